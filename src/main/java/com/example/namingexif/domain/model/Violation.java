package com.example.namingexif.domain.model;

/**
 * Single rule violation reported by the filename validator.
 *
 * @param field   filename component the rule inspected ({@code modifier}, {@code month}, {@code day},
 *                {@code hour}, {@code minute}, {@code second} or {@code time})
 * @param message human readable description including the offending value and the allowed range
 */
public record Violation(String field, String message) {

    @Override
    public String toString() {
        return message;
    }
}
