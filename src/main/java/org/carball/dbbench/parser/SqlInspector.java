package org.carball.dbbench.parser;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Light textual checks over SQL used to phrase advisor suggestions.
 * Every check is heuristic; a miss only means a less specific suggestion.
 */
public final class SqlInspector {

    // Bound value on the right-hand side of an equality: ?, :name, $1, a number or a quoted literal
    private static final String VALUE = "(?:\\?|:\\w+|\\$\\d+|\\d+(?:\\.\\d+)?|'[^']*')";

    private static final String IDENTIFIER_QUOTE = "[`\"'\\[]?";

    private static final String IDENTIFIER_UNQUOTE = "[`\"'\\]]?";

    private static final Pattern KEY_LOOKUP_PATTERN = Pattern.compile(
            "SELECT\\s+.+?\\s+FROM\\s+" + IDENTIFIER_QUOTE + "(?:\\w+" + IDENTIFIER_UNQUOTE + "\\.)?" + IDENTIFIER_QUOTE
                    + "(\\w+)" + IDENTIFIER_UNQUOTE + "(?:\\s+(?:AS\\s+)?\\w+)??"
                    + "\\s+WHERE\\s+(?:\\w+\\.)?" + IDENTIFIER_QUOTE + "(\\w+)" + IDENTIFIER_UNQUOTE + "\\s*=\\s*" + VALUE,
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private static final Pattern EQUALITY_FILTER_PATTERN = Pattern.compile(
            "WHERE\\s+(?:\\w+\\.)?" + IDENTIFIER_QUOTE + "(\\w+)" + IDENTIFIER_UNQUOTE + "\\s*=\\s*" + VALUE,
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LEADING_WILDCARD_PATTERN = Pattern.compile(
            "LIKE\\s+['\"]%",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LIKE_PARAMETER_PATTERN = Pattern.compile(
            "LIKE\\s+\\?",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SELECT_ALL_PATTERN = Pattern.compile(
            "SELECT\\s+(?:DISTINCT\\s+)?(?:\\w+\\.)?\\*",
            Pattern.CASE_INSENSITIVE
    );

    private SqlInspector() {
        // Utility class - prevent instantiation
    }

    /**
     * Relation guessed from a {@code SELECT ... FROM table WHERE column = ?} key lookup.
     */
    public record RelationHint(String table, String column, String relation) {
    }

    public static Optional<RelationHint> inferRelation(String sql) {
        if (sql == null) {
            return Optional.empty();
        }

        Matcher matcher = KEY_LOOKUP_PATTERN.matcher(sql);
        if (!matcher.find()) {
            return Optional.empty();
        }

        String table = matcher.group(1);
        String column = matcher.group(2);
        return Optional.of(new RelationHint(table, column, inferRelationName(table, column)));
    }

    /**
     * Maps a table and its filter column to the relation that most likely loaded it:
     * a foreign key ({@code user_id}) points at the camel-cased singular table, a primary key
     * lookup ({@code id}) at the singular table, anything else at the table without its prefix.
     */
    public static String inferRelationName(String table, String column) {
        if (column != null && column.toLowerCase(Locale.ROOT).endsWith("_id")) {
            return Inflector.camel(Inflector.singular(table));
        }
        if (column != null && column.equalsIgnoreCase("id")) {
            return Inflector.singular(table);
        }

        String[] parts = table.split("_");
        if (parts.length > 1) {
            return Inflector.camel(table.substring(table.indexOf('_') + 1));
        }
        return Inflector.camel(Inflector.singular(table));
    }

    public static Optional<String> equalityFilterColumn(String sql) {
        if (sql == null) {
            return Optional.empty();
        }
        Matcher matcher = EQUALITY_FILTER_PATTERN.matcher(sql);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static boolean isSelect(String sql) {
        return upper(sql).contains("SELECT");
    }

    public static boolean hasWhere(String sql) {
        return upper(sql).contains("WHERE");
    }

    public static boolean hasLimit(String sql) {
        String upper = upper(sql);
        return upper.contains("LIMIT") || upper.contains("FETCH FIRST") || upper.contains(" TOP ");
    }

    public static boolean hasOrderBy(String sql) {
        return upper(sql).contains("ORDER BY");
    }

    public static boolean selectsAllColumns(String sql) {
        return sql != null && SELECT_ALL_PATTERN.matcher(sql).find();
    }

    /**
     * True when a LIKE pattern starts with a wildcard, either inline or through a bound value.
     */
    public static boolean hasLeadingWildcard(String sql, List<Object> bindings) {
        if (sql == null) {
            return false;
        }
        if (LEADING_WILDCARD_PATTERN.matcher(sql).find()) {
            return true;
        }
        if (bindings == null || !LIKE_PARAMETER_PATTERN.matcher(sql).find()) {
            return false;
        }
        return bindings.stream()
                .anyMatch(binding -> binding instanceof String && ((String) binding).startsWith("%"));
    }

    private static String upper(String sql) {
        return sql == null ? "" : sql.toUpperCase(Locale.ROOT);
    }
}
