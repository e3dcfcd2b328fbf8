package com.example.namingexif.domain.naming;

import com.example.namingexif.domain.model.ParsedFilename;
import com.example.namingexif.domain.model.Violation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every validation rule against a parsed filename and concatenates their diagnostics.
 * Rules never short-circuit each other, so one call yields the complete list of problems.
 * The default order is modifier, date range, time range, precision cascade.
 */
@Component
public class FilenameValidator {

    private final List<ValidationRule> rules;

    /**
     * Creates the validator with the default rule set.
     */
    public FilenameValidator() {
        this(List.of(new ModifierRule(), new DateRangeRule(), new TimeRangeRule(), new PrecisionCascadeRule()));
    }

    FilenameValidator(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /**
     * Validates the parsed filename.
     *
     * @param parsed parsed filename
     * @return all violations in rule order, empty when the record is valid
     */
    public List<Violation> validate(ParsedFilename parsed) {
        Objects.requireNonNull(parsed, "parsed");
        List<Violation> violations = new ArrayList<>();
        for (ValidationRule rule : rules) {
            violations.addAll(rule.validate(parsed));
        }
        return violations;
    }

    /**
     * @param parsed parsed filename
     * @return {@code true} when no rule reports a violation
     */
    public boolean isValid(ParsedFilename parsed) {
        return validate(parsed).isEmpty();
    }
}
