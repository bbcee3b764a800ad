package com.elssolution.vuegraf.service;

import com.elssolution.vuegraf.usage.FailureKind;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outcome of the most recent cycle per account, for the status endpoint and health check.
 * Written by the poll loop, read by web threads.
 */
@Component
public class StatusService {

    private final Map<String, AccountStatus> accounts = new ConcurrentHashMap<>();
    private volatile long cycles = 0;
    private volatile Instant lastCycleAt;
    private volatile boolean stopping = false;
    private volatile String loopFailure;

    public void recordCycle(Instant at) {
        cycles++;
        lastCycleAt = at;
    }

    public void recordStopping() {
        stopping = true;
    }

    public void recordLoopDied(String cause) {
        loopFailure = cause;
    }

    public boolean isLoopDead() {
        return loopFailure != null;
    }

    public void recordSuccess(String account, int points, boolean backfillPending, Instant at) {
        accounts.compute(account, (k, prev) -> base(k, prev)
                .lastSuccessAt(at)
                .lastPoints(points)
                .lastFailureKind(null)
                .lastFailureMessage(null)
                .consecutiveFailures(0)
                .backfillPending(backfillPending)
                .build());
    }

    public void recordFailure(String account, FailureKind kind, String message, boolean backfillPending, Instant at) {
        accounts.compute(account, (k, prev) -> base(k, prev)
                .lastFailureAt(at)
                .lastFailureKind(kind)
                .lastFailureMessage(message)
                .consecutiveFailures(prev == null ? 1 : prev.getConsecutiveFailures() + 1)
                .backfillPending(backfillPending)
                .build());
    }

    /** True once at least one account reported and every reported account's last cycle failed. */
    public boolean allAccountsFailing() {
        return !accounts.isEmpty() && accounts.values().stream().allMatch(a -> a.getConsecutiveFailures() > 0);
    }

    public StatusView buildStatusView() {
        List<AccountStatus> list = new ArrayList<>(accounts.values());
        list.sort(Comparator.comparing(AccountStatus::getAccount));
        Instant last = lastCycleAt;
        return StatusView.builder()
                .cycles(cycles)
                .lastCycleAt(last)
                .lastCycleAgeHuman(last == null ? "-" : humanAge(Duration.between(last, Instant.now()).toMillis()))
                .stopping(stopping)
                .loopFailure(loopFailure)
                .accounts(list)
                .build();
    }

    private static AccountStatus.AccountStatusBuilder base(String account, AccountStatus prev) {
        return prev == null ? AccountStatus.builder().account(account) : prev.toBuilder();
    }

    private static String humanAge(long ageMs) {
        if (ageMs < 0) return "-";
        if (ageMs < 1000) return ageMs + " ms";
        long s = ageMs / 1000;
        if (s < 60) return s + " s";
        long m = s / 60;
        long remS = s % 60;
        return m + " min " + remS + " s";
    }

    @Value @Builder(toBuilder = true)
    public static class AccountStatus {
        String account;
        Instant lastSuccessAt;
        int lastPoints;
        Instant lastFailureAt;
        FailureKind lastFailureKind;
        String lastFailureMessage;
        int consecutiveFailures;
        boolean backfillPending;
    }

    @Value @Builder
    public static class StatusView {
        long cycles;
        Instant lastCycleAt;
        String lastCycleAgeHuman;
        boolean stopping;
        String loopFailure;
        List<AccountStatus> accounts;
    }
}
