package com.example.namingexif.domain.model;

/**
 * Embedded metadata slots populated from a structured filename, keyed by their ExifTool tag name.
 * Declaration order is the order tags are handed to the writer.
 */
public enum MetadataField {
    IDENTIFIER("XMP-dc:Identifier"),
    DOCUMENT_ID("XMP-xmpMM:DocumentID"),
    DATE_CREATED("XMP-dc:Date"),
    PHOTOSHOP_DATE_CREATED("XMP-photoshop:DateCreated"),
    DATE_TIME_ORIGINAL("EXIF:DateTimeOriginal");

    private final String tag;

    MetadataField(String tag) {
        this.tag = tag;
    }

	/**
	 * @return fully qualified ExifTool tag name, e.g. {@code XMP-dc:Identifier}
	 */
    public String tag() {
        return tag;
    }
}
