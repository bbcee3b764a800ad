package com.elssolution.vuegraf.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Alerts keyed by condition, e.g. {@code CYCLE_TIMEOUT:Home} or {@code INFLUX_DOWN}.
 * A key is raised repeatedly while the condition holds and resolved once it clears; each
 * raised-to-resolved stretch is one episode. The last {@value #HISTORY_SIZE} transitions are kept.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    static final int HISTORY_SIZE = 50;

    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        Instant since;
        Instant lastSeen;
        int occurrences;
    }

    @Value @Builder
    public static class EventView {
        String key;
        String type;      // RAISE or RESOLVE
        Severity severity;
        String message;
        Instant at;
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent; // newest first
    }

    private final Clock clock;
    private final Map<String, Episode> active = new HashMap<>();
    private final Deque<EventView> history = new ArrayDeque<>();

    public AlertService(Clock clock) {
        this.clock = clock;
    }

    /** Raises {@code key}, or refreshes it when already active. Only the first raise of an episode is logged. */
    public void raise(String key, String message, Severity severity) {
        Instant now = clock.instant();
        boolean opened;
        synchronized (this) {
            Episode e = active.get(key);
            opened = e == null;
            if (opened) {
                active.put(key, new Episode(severity, message, now));
                record(key, "RAISE", severity, message, now);
            } else {
                e.refresh(severity, message, now);
            }
        }
        if (opened) {
            log.warn("ALERT RAISE key={} sev={} msg={}", key, severity, message);
        } else {
            log.debug("ALERT again key={} msg={}", key, message);
        }
    }

    /** Ends the episode of {@code key}; no-op when it is not active. */
    public void resolve(String key) {
        Instant now = clock.instant();
        Episode closed;
        synchronized (this) {
            closed = active.remove(key);
            if (closed != null) {
                record(key, "RESOLVE", closed.severity, "recovered", now);
            }
        }
        if (closed != null) {
            log.info("ALERT RESOLVE key={} after {} occurrence(s)", key, closed.occurrences);
        }
    }

    public synchronized boolean isActive(String key) {
        return active.containsKey(key);
    }

    public synchronized AlertsSnapshot snapshot() {
        List<AlertView> views = new ArrayList<>(active.size());
        active.forEach((key, e) -> views.add(e.view(key)));
        views.sort(Comparator.comparing(AlertView::getLastSeen).reversed());

        List<EventView> recent = new ArrayList<>(history.size());
        history.descendingIterator().forEachRemaining(recent::add);
        return AlertsSnapshot.builder().active(views).recent(recent).build();
    }

    private void record(String key, String type, Severity severity, String message, Instant at) {
        history.addLast(EventView.builder()
                .key(key).type(type).severity(severity).message(message).at(at)
                .build());
        while (history.size() > HISTORY_SIZE) history.removeFirst();
    }

    private static final class Episode {
        final Instant since;
        Severity severity;
        String message;
        Instant lastSeen;
        int occurrences = 1;

        Episode(Severity severity, String message, Instant now) {
            this.since = now;
            this.severity = severity;
            this.message = message;
            this.lastSeen = now;
        }

        void refresh(Severity severity, String message, Instant now) {
            this.severity = severity;
            this.message = message;
            this.lastSeen = now;
            occurrences++;
        }

        AlertView view(String key) {
            return AlertView.builder()
                    .key(key).message(message).severity(severity)
                    .since(since).lastSeen(lastSeen).occurrences(occurrences)
                    .build();
        }
    }
}
