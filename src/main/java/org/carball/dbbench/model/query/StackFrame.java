package org.carball.dbbench.model.query;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One frame of the call stack captured when a query was issued. Every field is optional.
 */
public record StackFrame(
        @JsonProperty("file") String file,
        @JsonProperty("line") Integer line,
        @JsonProperty("class") String className,
        @JsonProperty("method") String method
) {

    public static StackFrame of(StackTraceElement element) {
        return new StackFrame(
                element.getFileName(),
                element.getLineNumber() > 0 ? element.getLineNumber() : null,
                element.getClassName(),
                element.getMethodName()
        );
    }
}
