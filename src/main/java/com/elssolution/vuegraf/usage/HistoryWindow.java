package com.elssolution.vuegraf.usage;

import java.time.Instant;

/** Half a day of per-minute history, {@code [start, end)}. */
public record HistoryWindow(int daysAgo, Instant start, Instant end) {
}
