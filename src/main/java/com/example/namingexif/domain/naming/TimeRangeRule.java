package com.example.namingexif.domain.naming;

import com.example.namingexif.domain.model.ParsedFilename;
import com.example.namingexif.domain.model.Violation;

import java.util.ArrayList;
import java.util.List;

final class TimeRangeRule implements ValidationRule {

    @Override
    public List<Violation> validate(ParsedFilename parsed) {
        List<Violation> violations = new ArrayList<>();
        if (parsed.hour() > 23) {
            violations.add(new Violation("hour",
                    String.format("Invalid hour value: %d (must be 00-23)", parsed.hour())));
        }
        if (parsed.minute() > 59) {
            violations.add(new Violation("minute",
                    String.format("Invalid minute value: %d (must be 00-59)", parsed.minute())));
        }
        if (parsed.second() > 59) {
            violations.add(new Violation("second",
                    String.format("Invalid second value: %d (must be 00-59)", parsed.second())));
        }
        return violations;
    }
}
