package org.carball.dbbench.model.advisor;

/**
 * Type tags of the built-in rules. Custom rules may use any other tag.
 */
public final class SuggestionType {

    public static final String N_PLUS_ONE = "n_plus_one";
    public static final String SLOW_QUERY = "slow_query";
    public static final String HOTSPOT = "hotspot";
    public static final String DUPLICATE_QUERY = "duplicate_query";

    private SuggestionType() {
    }

    public static String label(String type) {
        return switch (type) {
            case N_PLUS_ONE -> "N+1 query issues";
            case SLOW_QUERY -> "Slow queries";
            case HOTSPOT -> "Database hotspots";
            case DUPLICATE_QUERY -> "Duplicate queries";
            default -> {
                String words = type.replace('_', ' ');
                yield words.isEmpty() ? words : Character.toUpperCase(words.charAt(0)) + words.substring(1);
            }
        };
    }
}
