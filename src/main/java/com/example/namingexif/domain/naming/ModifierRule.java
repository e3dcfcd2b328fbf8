package com.example.namingexif.domain.naming;

import com.example.namingexif.domain.model.ParsedFilename;
import com.example.namingexif.domain.model.Violation;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Accepts only the known date certainty letters.
 */
final class ModifierRule implements ValidationRule {

    static final Set<String> VALID_MODIFIERS = Set.of("A", "B", "C", "E", "F");

    private static final String ALLOWED = String.join(", ", new TreeSet<>(VALID_MODIFIERS));

    @Override
    public List<Violation> validate(ParsedFilename parsed) {
        if (VALID_MODIFIERS.contains(parsed.modifier())) {
            return List.of();
        }
        return List.of(new Violation("modifier",
                "Invalid modifier: '" + parsed.modifier() + "' (must be one of: " + ALLOWED + ")"));
    }
}
