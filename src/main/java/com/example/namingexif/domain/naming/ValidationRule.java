package com.example.namingexif.domain.naming;

import com.example.namingexif.domain.model.ParsedFilename;
import com.example.namingexif.domain.model.Violation;

import java.util.List;

/**
 * A single validation rule that inspects a parsed filename and emits diagnostics. Rules are
 * independent of each other and report every problem they find, in a stable order.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule against the given record.
     *
     * @param parsed parsed filename
     * @return violations found by this rule, possibly empty, never {@code null}
     */
    List<Violation> validate(ParsedFilename parsed);
}
