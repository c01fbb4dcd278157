package com.pitchscope.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Delivery-metric tuning.
 */
@ConfigurationProperties(prefix = "intelligence")
@Validated
public class IntelligenceProperties {

    /** Target pace; appropriate is within ±20%. */
    @Positive(message = "Target WPM must be positive")
    private int targetWpm = 150;

    public int getTargetWpm() {
        return targetWpm;
    }

    public void setTargetWpm(int targetWpm) {
        this.targetWpm = targetWpm;
    }
}
