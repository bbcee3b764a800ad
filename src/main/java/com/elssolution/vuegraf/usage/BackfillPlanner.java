package com.elssolution.vuegraf.usage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the days before {@code stopTime} into half-day windows, newest day first and, within a day,
 * the later half first. The windows tile {@code [stopTime - days, stopTime)} without gap or overlap.
 */
public final class BackfillPlanner {

    static final Duration DAY = Duration.ofHours(24);
    static final Duration HALF_DAY = Duration.ofHours(12);

    private BackfillPlanner() {
    }

    public static List<HistoryWindow> windows(Instant stopTime, int days) {
        List<HistoryWindow> out = new ArrayList<>(Math.max(0, days) * 2);
        for (int day = 0; day < days; day++) {
            Instant dayEnd = stopTime.minus(DAY.multipliedBy(day));
            Instant dayStart = stopTime.minus(DAY.multipliedBy(day + 1L));
            Instant middle = dayStart.plus(HALF_DAY);
            out.add(new HistoryWindow(day + 1, middle, dayEnd));
            out.add(new HistoryWindow(day + 1, dayStart, middle));
        }
        return out;
    }
}
