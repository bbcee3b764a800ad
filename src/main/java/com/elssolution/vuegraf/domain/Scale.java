package com.elssolution.vuegraf.domain;

import java.time.Duration;

/**
 * Upstream sample resolutions and the factor turning one sample's kWh into average watts.
 */
public enum Scale {
    SECOND("1S", Duration.ofSeconds(1), 3600 * 1000),
    MINUTE("1MIN", Duration.ofMinutes(1), 60 * 1000);

    private final String apiValue;
    private final Duration step;
    private final double wattsPerKwh;

    Scale(String apiValue, Duration step, double wattsPerKwh) {
        this.apiValue = apiValue;
        this.step = step;
        this.wattsPerKwh = wattsPerKwh;
    }

    public String apiValue() { return apiValue; }

    public Duration step() { return step; }

    public double toWatts(double kwh) {
        return kwh * wattsPerKwh;
    }
}
