package org.carball.dbbench.config;

import lombok.Builder;
import lombok.Data;

/**
 * Limits applied when rendering suggestions as text.
 */
@Data
@Builder(toBuilder = true)
public class DisplaySettings {

    @Builder.Default
    private int maxPerType = 3;

    @Builder.Default
    private int maxTotal = 10;

    public static DisplaySettings defaults() {
        return DisplaySettings.builder().build();
    }
}
