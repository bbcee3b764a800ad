package com.elssolution.vuegraf.usage;

import java.time.Instant;

/**
 * Which resolutions one extraction pass pulls.
 *
 * @param realtime      emit the per-cycle point from the channel's current usage
 * @param detailedStart start of the per-second range ending at {@code stopTime}; null skips it
 * @param history       per-minute backfill window; null skips it
 */
public record ExtractionPlan(Instant stopTime, boolean realtime, Instant detailedStart, HistoryWindow history) {

    public static ExtractionPlan live(Instant stopTime, Instant detailedStart) {
        return new ExtractionPlan(stopTime, true, detailedStart, null);
    }

    public static ExtractionPlan backfill(Instant stopTime, HistoryWindow window) {
        return new ExtractionPlan(stopTime, false, null, window);
    }
}
