package com.example.namingexif.domain.model;

/**
 * Immutable view of a structured photo filename after the grammar has been applied.
 * Numeric components are captured as-is and are only range-checked by the validator.
 *
 * @param year      four digit year, {@code 0} when unknown
 * @param month     month of year, {@code 0} when unknown
 * @param day       day of month, {@code 0} when unknown
 * @param hour      hour of day, {@code 0} when unknown
 * @param minute    minute of hour, {@code 0} when unknown
 * @param second    second of minute, {@code 0} when unknown
 * @param modifier  single uppercase letter describing how certain the date is
 * @param group     first categorical label, case preserved
 * @param subgroup  second categorical label, case preserved
 * @param sequence  sequence number digits including leading zeros
 * @param extension lowercase file extension
 */
public record ParsedFilename(
        int year,
        int month,
        int day,
        int hour,
        int minute,
        int second,
        String modifier,
        String group,
        String subgroup,
        String sequence,
        String extension
) {

    /**
     * Modifier letter marking a date that is known to the second.
     */
    public static final String EXACT_MODIFIER = "E";

    /**
     * @return {@code true} when the modifier marks the encoded date as exact
     */
    public boolean isExactDate() {
        return EXACT_MODIFIER.equals(modifier);
    }
}
