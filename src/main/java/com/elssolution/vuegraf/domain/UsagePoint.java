package com.elssolution.vuegraf.domain;

import java.time.Instant;

/**
 * One output record for the time-series sink.
 *
 * @param transition null unless the channel group crossed the power-on threshold at this instant
 */
public record UsagePoint(String measurement,
                         String accountName,
                         String channelName,
                         boolean detailed,
                         double watts,
                         Transition transition,
                         Instant time) {

    public static final String MEASUREMENT = "energy_usage";

    public static UsagePoint of(String accountName, String channelName, double watts, Instant time,
                                boolean detailed, Transition transition) {
        return new UsagePoint(MEASUREMENT, accountName, channelName, detailed, watts, transition, time);
    }
}
