package org.carball.dbbench.model.query;

/**
 * Application code location a query is attributed to.
 */
public record CallSite(
        String file,
        Integer line,
        String className,
        String method
) {

    public static final String UNKNOWN_LOCATION = "Unknown location";

    private static final CallSite UNKNOWN = new CallSite(null, null, null, null);

    public static CallSite unknown() {
        return UNKNOWN;
    }

    public static CallSite of(StackFrame frame) {
        return new CallSite(frame.file(), frame.line(), frame.className(), frame.method());
    }

    public boolean isKnown() {
        return file != null || className != null;
    }

    /**
     * Short location for grouping and display: {@code com.acme.Type::method()}, {@code File.java:42}
     * or {@value #UNKNOWN_LOCATION}.
     */
    public String locationString() {
        if (className != null && method != null) {
            return className + "::" + method + "()";
        }
        if (file != null && line != null) {
            return baseName(file) + ":" + line;
        }
        return UNKNOWN_LOCATION;
    }

    public String fullLocation() {
        if (file != null && line != null) {
            return file + ":" + line;
        }
        return "Unknown";
    }

    private static String baseName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
