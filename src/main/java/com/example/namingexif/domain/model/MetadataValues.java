package com.example.namingexif.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Formatter output for one filename: a fresh identifier plus the date strings each metadata consumer accepts.
 * Date values are {@code null} when the record does not carry enough precision for that consumer.
 *
 * @param identifier      random identifier shared by every identifier slot
 * @param partialDate     date-only value ({@code YYYY}, {@code YYYY-MM} or {@code YYYY-MM-DD})
 * @param fullDateTime    ISO date-time ({@code YYYY-MM-DDThh:mm:ss}), exact dates only
 * @param numericDateTime EXIF style date-time ({@code YYYY:MM:DD hh:mm:ss}), exact dates only
 */
public record MetadataValues(
        String identifier,
        String partialDate,
        String fullDateTime,
        String numericDateTime
) {

    public MetadataValues {
        Objects.requireNonNull(identifier, "identifier");
    }

	/**
	 * Resolves the value destined for a single metadata slot.
	 *
	 * @param field target slot
	 * @return value or {@code null} when the slot stays untouched
	 */
    public String valueFor(MetadataField field) {
        return switch (field) {
            case IDENTIFIER, DOCUMENT_ID -> identifier;
            case DATE_CREATED -> partialDate;
            case PHOTOSHOP_DATE_CREATED -> fullDateTime;
            case DATE_TIME_ORIGINAL -> numericDateTime;
        };
    }

	/**
	 * Builds the tag map handed to the metadata writer, skipping slots without a value.
	 *
	 * @return unmodifiable map from ExifTool tag name to value, in {@link MetadataField} order
	 */
    public Map<String, String> toTags() {
        Map<String, String> tags = new LinkedHashMap<>();
        for (MetadataField field : MetadataField.values()) {
            String value = valueFor(field);
            if (value != null) {
                tags.put(field.tag(), value);
            }
        }
        return Collections.unmodifiableMap(tags);
    }
}
