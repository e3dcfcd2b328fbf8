package com.example.namingexif.domain.naming;

import com.example.namingexif.domain.model.ParsedFilename;
import com.example.namingexif.domain.model.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Once a component is {@code 00} (unknown), every more precise component must be {@code 00} too:
 * <ul>
 *     <li>month=00 implies day=00 and time=00:00:00</li>
 *     <li>day=00 implies time=00:00:00</li>
 *     <li>hour=00 implies minute=00 and second=00</li>
 *     <li>minute=00 implies second=00</li>
 * </ul>
 * Each implication is checked on its own, so one bad field may surface more than once.
 */
final class PrecisionCascadeRule implements ValidationRule {

    @Override
    public List<Violation> validate(ParsedFilename parsed) {
        List<Violation> violations = new ArrayList<>();
        boolean timeKnown = parsed.hour() != 0 || parsed.minute() != 0 || parsed.second() != 0;

        if (parsed.month() == 0) {
            if (parsed.day() != 0) {
                violations.add(new Violation("day", String.format(
                        "Invalid date: month is 00 but day is %02d (when month=00, day must also be 00)",
                        parsed.day())));
            }
            if (timeKnown) {
                violations.add(new Violation("time", String.format(
                        "Invalid date: month is 00 but time is %s (when month=00, time must be 00:00:00)",
                        time(parsed))));
            }
        }

        if (parsed.day() == 0 && timeKnown) {
            violations.add(new Violation("time", String.format(
                    "Invalid date: day is 00 but time is %s (when day=00, time must be 00:00:00)",
                    time(parsed))));
        }

        if (parsed.hour() == 0 && (parsed.minute() != 0 || parsed.second() != 0)) {
            violations.add(new Violation("time", String.format(
                    "Invalid time: hour is 00 but minutes/seconds are %02d:%02d "
                            + "(when hour=00, minutes and seconds must also be 00)",
                    parsed.minute(), parsed.second())));
        }

        if (parsed.minute() == 0 && parsed.second() != 0) {
            violations.add(new Violation("second", String.format(
                    "Invalid time: minute is 00 but second is %02d (when minute=00, second must also be 00)",
                    parsed.second())));
        }
        return violations;
    }

    private static String time(ParsedFilename parsed) {
        return String.format("%02d:%02d:%02d", parsed.hour(), parsed.minute(), parsed.second());
    }
}
