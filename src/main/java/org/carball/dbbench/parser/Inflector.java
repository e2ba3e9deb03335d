package org.carball.dbbench.parser;

import java.util.Locale;
import java.util.Map;

/**
 * Minimal English inflection for turning table names into relation names.
 * Covers the regular plural forms plus a handful of common irregular ones.
 */
public final class Inflector {

    private static final Map<String, String> IRREGULAR = Map.of(
            "people", "person",
            "children", "child",
            "men", "man",
            "women", "woman",
            "mice", "mouse",
            "geese", "goose",
            "indices", "index",
            "statuses", "status",
            "addresses", "address",
            "analyses", "analysis"
    );

    private Inflector() {
        // Utility class - prevent instantiation
    }

    public static String singular(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }

        // Only the last segment of snake_case names is plural
        int underscore = word.lastIndexOf('_');
        if (underscore >= 0 && underscore < word.length() - 1) {
            return word.substring(0, underscore + 1) + singular(word.substring(underscore + 1));
        }

        String lower = word.toLowerCase(Locale.ROOT);
        String irregular = IRREGULAR.get(lower);
        if (irregular != null) {
            return irregular;
        }

        if (lower.endsWith("ies") && word.length() > 3) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (lower.endsWith("ches") || lower.endsWith("shes") || lower.endsWith("xes")
                || lower.endsWith("zes") || lower.endsWith("sses")) {
            return word.substring(0, word.length() - 2);
        }
        if (lower.endsWith("s") && !lower.endsWith("ss") && !lower.endsWith("us") && !lower.endsWith("is")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    /**
     * {@code user_settings} to {@code userSettings}.
     */
    public static String camel(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }

        String[] parts = word.split("[_\\-\\s]+");
        StringBuilder result = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            if (result.length() == 0) {
                result.append(Character.toLowerCase(part.charAt(0))).append(part.substring(1));
            } else {
                result.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return result.toString();
    }
}
