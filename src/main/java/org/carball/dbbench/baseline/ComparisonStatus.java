package org.carball.dbbench.baseline;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum ComparisonStatus {
    CRITICAL("critical", "REGRESSION DETECTED", "🔴"),
    WARNING("warning", "Performance Warning", "⚠️"),
    IMPROVED("improved", "Performance Improved", "🚀"),
    STABLE("stable", "Stable", "✅");

    private final String code;
    private final String label;
    private final String emoji;

    ComparisonStatus(String code, String label, String emoji) {
        this.code = code;
        this.label = label;
        this.emoji = emoji;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
