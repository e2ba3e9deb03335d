package org.carball.dbbench.model.advisor;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Severity of an advisor suggestion or a regression, ordered from most to least severe.
 */
@Getter
public enum Severity {
    CRITICAL("critical", "red", "🔴"),
    WARNING("warning", "yellow", "⚠️"),
    INFO("info", "blue", "ℹ️");

    private final String code;
    private final String color;
    private final String icon;

    Severity(String code, String color, String icon) {
        this.code = code;
        this.color = color;
        this.icon = icon;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
