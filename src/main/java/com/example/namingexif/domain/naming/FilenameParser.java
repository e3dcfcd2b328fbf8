package com.example.namingexif.domain.naming;

import com.example.namingexif.domain.model.ParsedFilename;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Parser for structured photo filenames.
 * <p>
 * Expected format: {@code YYYY.MM.DD.HH.NN.SS.X.GGG.SSS.NNNNNN.ext}. The first ten dot separated
 * fields are positional and mandatory, the last field is the extension, and any fields in between
 * ({@code .A}, {@code .RAW}, {@code .WEB}, ...) are accepted and ignored.
 * Matching is case-insensitive; the modifier is normalized to uppercase and the extension to lowercase.
 */
@Component
public class FilenameParser {

    private static final Logger log = LoggerFactory.getLogger(FilenameParser.class);

    private static final int MANDATORY_FIELDS = 10;
    private static final int YEAR = 0;
    private static final int MONTH = 1;
    private static final int DAY = 2;
    private static final int HOUR = 3;
    private static final int MINUTE = 4;
    private static final int SECOND = 5;
    private static final int MODIFIER = 6;
    private static final int GROUP = 7;
    private static final int SUBGROUP = 8;
    private static final int SEQUENCE = 9;

    /**
     * Parses a bare filename (no directory part) into its components.
     *
     * @param filename filename to parse
     * @return parsed record, or empty when the name does not follow the grammar
     */
    public Optional<ParsedFilename> parse(String filename) {
        if (filename == null || filename.isEmpty()) {
            return Optional.empty();
        }
        String[] fields = filename.split("\\.", -1);
        if (!matchesGrammar(fields)) {
            return Optional.empty();
        }

        try {
            return Optional.of(new ParsedFilename(
                    Integer.parseInt(fields[YEAR]),
                    Integer.parseInt(fields[MONTH]),
                    Integer.parseInt(fields[DAY]),
                    Integer.parseInt(fields[HOUR]),
                    Integer.parseInt(fields[MINUTE]),
                    Integer.parseInt(fields[SECOND]),
                    fields[MODIFIER].toUpperCase(Locale.ROOT),
                    fields[GROUP],
                    fields[SUBGROUP],
                    fields[SEQUENCE],
                    fields[fields.length - 1].toLowerCase(Locale.ROOT)
            ));
        } catch (NumberFormatException ex) {
            log.debug("Numeric field out of range in filename {}", filename);
            return Optional.empty();
        }
    }

    /**
     * Checks the shape of every field without converting anything.
     *
     * @param fields filename split on every dot, empty fields retained
     * @return {@code true} when all mandatory fields, suffixes and the extension are well formed
     */
    private boolean matchesGrammar(String[] fields) {
        if (fields.length < MANDATORY_FIELDS + 1) {
            return false;
        }
        for (String field : fields) {
            if (field.isEmpty()) {
                return false;
            }
        }
        for (int i = YEAR; i <= SECOND; i++) {
            if (!isDigits(fields[i])) {
                return false;
            }
        }
        return fields[MODIFIER].length() == 1
                && isLetters(fields[MODIFIER])
                && isDigits(fields[SEQUENCE])
                && isLetters(fields[fields.length - 1]);
    }

    private static boolean isDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static boolean isLetters(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))) {
                return false;
            }
        }
        return true;
    }
}
