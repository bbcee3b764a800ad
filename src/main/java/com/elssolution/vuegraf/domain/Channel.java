package com.elssolution.vuegraf.domain;

import java.util.List;
import java.util.Set;

/**
 * One metered circuit of a device.
 *
 * @param usage kWh for the interval just completed, null when upstream has no value
 */
public record Channel(long deviceGid, String channelNum, String name, Double usage, List<Device> nestedDevices) {

    /** The combined-phases channel every device has; it carries the device's own name. */
    public static final String MAINS = "1,2,3";

    /** Aggregates that only ever get the coarse realtime point. */
    public static final Set<String> COARSE_ONLY = Set.of("Balance", "TotalUsage");

    public Channel {
        nestedDevices = nestedDevices == null ? List.of() : List.copyOf(nestedDevices);
    }

    public boolean isCoarseOnly() {
        return COARSE_ONLY.contains(channelNum);
    }
}
