package com.example.namingexif.domain.naming;

import com.example.namingexif.domain.model.MetadataValues;
import com.example.namingexif.domain.model.ParsedFilename;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Derives the date strings embedded into image metadata from a validated filename.
 * <p>
 * Each metadata consumer tolerates a different precision: the date-only field degrades to
 * year-month or year, while both timestamp fields are written only for exact dates and then always
 * carry the literal time, {@code 00:00:00} included.
 */
@Component
public class MetadataFormatter {

    /**
     * Formats the date-only value.
     *
     * @param parsed validated filename
     * @return {@code YYYY-MM-DD}, {@code YYYY-MM} or {@code YYYY}; empty when the year is unknown
     */
    public Optional<String> formatPartialDate(ParsedFilename parsed) {
        if (parsed.year() == 0) {
            return Optional.empty();
        }
        if (parsed.month() == 0) {
            return Optional.of(String.format("%04d", parsed.year()));
        }
        if (parsed.day() == 0) {
            return Optional.of(String.format("%04d-%02d", parsed.year(), parsed.month()));
        }
        return Optional.of(String.format("%04d-%02d-%02d", parsed.year(), parsed.month(), parsed.day()));
    }

    /**
     * Formats the ISO 8601 date-time value.
     *
     * @param parsed validated filename
     * @return {@code YYYY-MM-DDThh:mm:ss} for exact dates, otherwise empty
     */
    public Optional<String> formatFullDateTime(ParsedFilename parsed) {
        if (!parsed.isExactDate()) {
            return Optional.empty();
        }
        return Optional.of(String.format("%04d-%02d-%02dT%02d:%02d:%02d",
                parsed.year(), parsed.month(), parsed.day(),
                parsed.hour(), parsed.minute(), parsed.second()));
    }

    /**
     * Formats the EXIF date-time value.
     *
     * @param parsed validated filename
     * @return {@code YYYY:MM:DD hh:mm:ss} for exact dates, otherwise empty
     */
    public Optional<String> formatNumericDateTime(ParsedFilename parsed) {
        if (!parsed.isExactDate()) {
            return Optional.empty();
        }
        return Optional.of(String.format("%04d:%02d:%02d %02d:%02d:%02d",
                parsed.year(), parsed.month(), parsed.day(),
                parsed.hour(), parsed.minute(), parsed.second()));
    }

    /**
     * @return a new random identifier, unrelated to any filename
     */
    public String newIdentifier() {
        return UUID.randomUUID().toString();
    }

    /**
     * Produces every value for one file. A single identifier is generated per call.
     *
     * @param parsed validated filename
     * @return values ready to be turned into tags
     */
    public MetadataValues format(ParsedFilename parsed) {
        return new MetadataValues(
                newIdentifier(),
                formatPartialDate(parsed).orElse(null),
                formatFullDateTime(parsed).orElse(null),
                formatNumericDateTime(parsed).orElse(null)
        );
    }
}
