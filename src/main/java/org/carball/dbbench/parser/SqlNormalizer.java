package org.carball.dbbench.parser;

import java.util.regex.Pattern;

/**
 * Reduces SQL text to a shape that is stable across bound literal values, so that
 * {@code WHERE id = 5} and {@code WHERE id = 42} land in the same group.
 * This is a textual transform, not a parser: malformed SQL is normalized on a best-effort basis.
 */
public final class SqlNormalizer {

    public static final String PLACEHOLDER = "?";

    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\b\\d+\\b");

    private static final Pattern QUOTED_PATTERN = Pattern.compile("('[^']*'|\"[^\"]*\")");

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private SqlNormalizer() {
        // Utility class - prevent instantiation
    }

    public static String normalize(String sql) {
        if (sql == null || sql.isEmpty()) {
            return "";
        }

        String normalized = NUMBER_PATTERN.matcher(sql).replaceAll(PLACEHOLDER);
        normalized = QUOTED_PATTERN.matcher(normalized).replaceAll(PLACEHOLDER);
        normalized = WHITESPACE_PATTERN.matcher(normalized).replaceAll(" ");

        return normalized.trim();
    }
}
