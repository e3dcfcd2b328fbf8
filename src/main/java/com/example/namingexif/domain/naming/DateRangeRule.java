package com.example.namingexif.domain.naming;

import com.example.namingexif.domain.model.ParsedFilename;
import com.example.namingexif.domain.model.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks month and day bounds. The day limit comes from a fixed per-month table when the month is
 * 1-12; February always allows 29 because no leap-year arithmetic is performed. Any other month
 * falls back to a limit of 31.
 */
final class DateRangeRule implements ValidationRule {

    private static final int[] DAYS_IN_MONTH = {31, 29, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};
    private static final int MAX_DAY = 31;

    @Override
    public List<Violation> validate(ParsedFilename parsed) {
        List<Violation> violations = new ArrayList<>();
        int month = parsed.month();
        int day = parsed.day();

        if (month > 12) {
            violations.add(new Violation("month",
                    String.format("Invalid month value: %d (must be 00-12)", month)));
        }

        if (month >= 1 && month <= 12 && day > 0) {
            int maxDays = DAYS_IN_MONTH[month - 1];
            if (day > maxDays) {
                violations.add(new Violation("day",
                        String.format("Invalid day value: %d for month %d (must be 00-%d)", day, month, maxDays)));
            }
        } else if (day > MAX_DAY) {
            violations.add(new Violation("day",
                    String.format("Invalid day value: %d (must be 00-%d)", day, MAX_DAY)));
        }
        return violations;
    }
}
