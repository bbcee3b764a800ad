package com.elssolution.vuegraf.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Chart samples for one channel, one per step from the requested start. Samples are kWh per step
 * and may be null where upstream has a gap.
 */
public record UsageSeries(List<Double> samples) {

    public UsageSeries {
        // List.copyOf rejects nulls, and gaps are meaningful here
        samples = samples == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(samples));
    }
}
