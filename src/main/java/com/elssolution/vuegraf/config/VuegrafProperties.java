package com.elssolution.vuegraf.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Polling, extraction and account settings.
 */
@Slf4j
@Getter @Setter
@ConfigurationProperties(prefix = "vuegraf")
public class VuegrafProperties {

    /** Upper bound for the startup backfill, regardless of what is configured. */
    public static final int MAX_HISTORY_DAYS = 7;

    /** Seconds between two polling cycles. */
    private int updateIntervalSecs = 60;

    /** Pull per-second usage every {@link #detailedIntervalSecs}. */
    private boolean detailedDataEnabled = false;

    private int detailedIntervalSecs = 3600;

    /** Query this many seconds behind "now" so upstream data has settled. */
    private int lagSecs = 5;

    /** Days of per-minute history to backfill on startup (0 = none, at most 7). */
    private int historyDays = 0;

    /** Wattage above which a channel group counts as powered on. */
    private double powerOnThreshold = 1.0;

    /** Pause after every half-day backfill window, to stay under upstream rate limits. */
    private int backfillPauseSecs = 5;

    /** How long shutdown waits for the account in flight to be written. */
    private int shutdownWaitSecs = 30;

    private Emporia emporia = new Emporia();

    private List<Account> accounts = new ArrayList<>();

    /** Clamps knobs into their valid range and rejects an unusable account list. */
    public void sanitize() {
        if (accounts == null || accounts.isEmpty()) {
            throw new IllegalStateException("No accounts configured under vuegraf.accounts");
        }
        for (int i = 0; i < accounts.size(); i++) {
            Account a = accounts.get(i);
            if (a == null || a.getName() == null || a.getName().isBlank()) {
                throw new IllegalStateException("vuegraf.accounts[" + i + "] has no name");
            }
        }
        if (updateIntervalSecs < 1) {
            log.warn("updateIntervalSecs < 1 ({}). Using 60.", updateIntervalSecs);
            updateIntervalSecs = 60;
        }
        if (lagSecs < 0) {
            log.warn("lagSecs < 0 ({}). Clamping to 0.", lagSecs);
            lagSecs = 0;
        }
        if (historyDays < 0) {
            log.warn("historyDays < 0 ({}). Clamping to 0.", historyDays);
            historyDays = 0;
        }
        if (historyDays > MAX_HISTORY_DAYS) {
            log.warn("historyDays > {} ({}). Clamping to {}.", MAX_HISTORY_DAYS, historyDays, MAX_HISTORY_DAYS);
            historyDays = MAX_HISTORY_DAYS;
        }
        if (shutdownWaitSecs < 0) {
            log.warn("shutdownWaitSecs < 0 ({}). Clamping to 0.", shutdownWaitSecs);
            shutdownWaitSecs = 0;
        }
        if (backfillPauseSecs < 0) {
            log.warn("backfillPauseSecs < 0 ({}). Clamping to 0.", backfillPauseSecs);
            backfillPauseSecs = 0;
        }
    }

    @Getter @Setter
    public static class Emporia {
        private String baseUri = "https://api.emporiaenergy.com";
        private int requestTimeoutMs = 10_000;
    }

    @Getter @Setter
    @ToString(exclude = "token")
    public static class Account {
        private String name;
        private String email;
        /** Id token for the Emporia API. Obtained and refreshed outside this service. */
        private String token;
        /** Optional channel display names per device. */
        private List<DeviceNames> devices = new ArrayList<>();
    }

    @Getter @Setter
    @ToString
    public static class DeviceNames {
        private String name;
        private List<String> channels = new ArrayList<>();
    }
}
