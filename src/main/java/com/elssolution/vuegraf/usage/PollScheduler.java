package com.elssolution.vuegraf.usage;

import com.elssolution.vuegraf.account.AccountContext;
import com.elssolution.vuegraf.account.AccountRegistry;
import com.elssolution.vuegraf.alerts.AlertService;
import com.elssolution.vuegraf.config.InfluxProperties;
import com.elssolution.vuegraf.config.VuegrafProperties;
import com.elssolution.vuegraf.domain.Device;
import com.elssolution.vuegraf.domain.Scale;
import com.elssolution.vuegraf.domain.UsagePoint;
import com.elssolution.vuegraf.integration.emporia.VueSession;
import com.elssolution.vuegraf.integration.emporia.VueSessionFactory;
import com.elssolution.vuegraf.integration.http.UpstreamException;
import com.elssolution.vuegraf.integration.http.UpstreamTimeoutException;
import com.elssolution.vuegraf.integration.influx.UsageSink;
import com.elssolution.vuegraf.service.StatusService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The poll loop: every interval, pull realtime usage for each account, on an account's first good
 * cycle backfill its history, and hand the account's points to the sink in one batch.
 *
 * Accounts are processed one after another on the single scheduler thread. A failing account is
 * logged and skipped for the cycle; nothing of it is written. {@link #stop()} cuts any backfill
 * short at the next window boundary, wakes the pause and waits, bounded by
 * {@code shutdownWaitSecs}, for the account in flight to be written. Anything escaping the loop
 * itself is reported as {@code POLL_LOOP_DIED}.
 */
@Slf4j
@Component
public class PollScheduler {

    private final VuegrafProperties props;
    private final InfluxProperties influxProps;
    private final AccountRegistry accounts;
    private final VueSessionFactory sessions;
    private final UsageExtractor extractor;
    private final UsageSink sink;
    private final AlertService alerts;
    private final StatusService status;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final CancellablePause pause = new CancellablePause();
    private final CountDownLatch loopExited = new CountDownLatch(1);
    private final Instant startupTime;
    private volatile boolean stopRequested = false;
    private volatile Thread loopThread;

    /** Start of the next per-second range. */
    private Instant detailedStart;

    public PollScheduler(VuegrafProperties props,
                         InfluxProperties influxProps,
                         AccountRegistry accounts,
                         VueSessionFactory sessions,
                         UsageExtractor extractor,
                         UsageSink sink,
                         AlertService alerts,
                         StatusService status,
                         ScheduledExecutorService scheduler,
                         Clock clock) {
        this.props = props;
        this.influxProps = influxProps;
        this.accounts = accounts;
        this.sessions = sessions;
        this.extractor = extractor;
        this.sink = sink;
        this.alerts = alerts;
        this.status = status;
        this.scheduler = scheduler;
        this.clock = clock;
        this.startupTime = clock.instant();
        this.detailedStart = startupTime;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("Settings -> updateIntervalSecs: {}, detailedEnabled: {}, detailedIntervalSecs: {}, lagSecs: {}, historyDays: {}, powerOnThreshold: {}W",
                props.getUpdateIntervalSecs(), props.isDetailedDataEnabled(), props.getDetailedIntervalSecs(),
                props.getLagSecs(), props.getHistoryDays(), props.getPowerOnThreshold());
        scheduler.execute(this::runLoop);
    }

    @PreDestroy
    public void stop() {
        log.info("Stop requested; finishing the account in flight");
        stopRequested = true;
        status.recordStopping();
        pause.cancel();

        Thread running = loopThread;
        if (running == null || running == Thread.currentThread()) return;
        try {
            if (!loopExited.await(props.getShutdownWaitSecs(), TimeUnit.SECONDS)) {
                log.warn("Poll loop still busy after {}s; shutting down anyway", props.getShutdownWaitSecs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    void runLoop() {
        loopThread = Thread.currentThread();
        try {
            if (influxProps.isReset()) {
                resetSink();
            }
            while (!stopRequested) {
                runCycle();
                if (pause.pause(Duration.ofSeconds(props.getUpdateIntervalSecs()))) break;
            }
            log.info("Finished");
        } catch (Throwable t) {
            // ScheduledThreadPoolExecutor keeps task failures in the task's future
            log.error("Poll loop died in {}; no more usage will be collected", loopThread.getName(), t);
            status.recordLoopDied(t.toString());
            alerts.raise("POLL_LOOP_DIED", t.toString(), AlertService.Severity.CRITICAL);
        } finally {
            loopThread = null;
            loopExited.countDown();
        }
    }

    /** One pass over all accounts. */
    public void runCycle() {
        Instant now = clock.instant();
        Instant stopTime = now.minusSeconds(props.getLagSecs());
        boolean collectDetails = props.isDetailedDataEnabled()
                && props.getDetailedIntervalSecs() > 0
                && Duration.between(detailedStart, stopTime).getSeconds() >= props.getDetailedIntervalSecs();

        for (AccountContext account : accounts.all()) {
            if (stopRequested) break;
            processAccountSafe(account, stopTime, collectDetails);
        }

        if (collectDetails) {
            detailedStart = stopTime.plusSeconds(1);
        }
        status.recordCycle(now);
    }

    Instant getDetailedStart() {
        return detailedStart;
    }

    private void processAccountSafe(AccountContext account, Instant stopTime, boolean collectDetails) {
        String name = account.name();
        try {
            int points = processAccount(account, stopTime, collectDetails);
            status.recordSuccess(name, points, account.isBackfillPending(), clock.instant());
            alerts.resolve(timeoutKey(name));
            alerts.resolve(failureKey(name));

        } catch (UpstreamTimeoutException e) {
            log.warn("Failed to record new usage data: account={} timeout: {}", name, e.getMessage());
            status.recordFailure(name, FailureKind.TIMEOUT, e.getMessage(), account.isBackfillPending(), clock.instant());
            alerts.raise(timeoutKey(name), e.getMessage(), AlertService.Severity.WARN);

        } catch (IOException | RuntimeException e) {
            if (e instanceof UpstreamException ue && (ue.getStatus() == 401 || ue.getStatus() == 403)) {
                log.warn("Session rejected for account={}; reopening next cycle, refresh vuegraf.accounts[].token if this persists", name);
                account.dropSession();
            }
            log.error("Failed to record new usage data: account={}", name, e);
            status.recordFailure(name, FailureKind.OTHER, e.toString(), account.isBackfillPending(), clock.instant());
            alerts.raise(failureKey(name), e.toString(), AlertService.Severity.ERROR);
        }
    }

    /** @return number of points written */
    int processAccount(AccountContext account, Instant stopTime, boolean collectDetails) throws IOException {
        VueSession session = account.ensureSession(sessions);

        Map<Long, Device> usages = session.getDeviceListUsage(account.getIndex().deviceGids(), stopTime, Scale.MINUTE);
        List<UsagePoint> points = new ArrayList<>();

        ExtractionPlan live = ExtractionPlan.live(stopTime, collectDetails ? detailedStart : null);
        for (Device device : usages.values()) {
            extractInto(account, session, device, live, points);
        }

        if (account.isBackfillPending()) {
            backfill(account, session, usages.values(), stopTime, points);
        }

        log.info("Submitting datapoints to database; account=\"{}\"; points={};", account.name(), points.size());
        sink.write(points);
        return points.size();
    }

    /**
     * Loads {@code historyDays} of per-minute history in half-day windows, pausing after each.
     * A stop request ends it at the next window boundary; windows already loaded are still written.
     */
    private void backfill(AccountContext account, VueSession session, Collection<Device> devices,
                          Instant stopTime, List<UsagePoint> points) throws IOException {
        Duration windowPause = Duration.ofSeconds(props.getBackfillPauseSecs());
        int currentDay = 0;
        for (HistoryWindow window : BackfillPlanner.windows(stopTime, props.getHistoryDays())) {
            if (stopRequested) {
                log.info("Historical backfill cancelled: account={}", account.name());
                break;
            }
            if (window.daysAgo() != currentDay) {
                currentDay = window.daysAgo();
                log.info("Loading historical data: {} day(s) ago", currentDay);
            }
            ExtractionPlan plan = ExtractionPlan.backfill(stopTime, window);
            for (Device device : devices) {
                extractInto(account, session, device, plan, points);
            }
            pause.pause(windowPause);
        }
        account.setBackfillPending(false);
    }

    private void extractInto(AccountContext account, VueSession session, Device device, ExtractionPlan plan,
                             List<UsagePoint> points) throws IOException {
        long gid = device.gid();
        account.getPowerStates().put(gid,
                extractor.extract(account, session, device, account.getPowerStates().get(gid), plan, points));
    }

    private void resetSink() {
        try {
            sink.deleteUsageBefore(startupTime);
        } catch (IOException e) {
            log.error("Resetting database failed: {}", e.getMessage(), e);
            alerts.raise("INFLUX_RESET", e.getMessage(), AlertService.Severity.ERROR);
        }
    }

    private static String timeoutKey(String account) {
        return "CYCLE_TIMEOUT:" + account;
    }

    private static String failureKey(String account) {
        return "CYCLE_FAILED:" + account;
    }
}
