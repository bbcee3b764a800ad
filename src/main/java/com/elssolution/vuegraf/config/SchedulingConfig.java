package com.elssolution.vuegraf.config;

import com.elssolution.vuegraf.alerts.GlobalUncaughtHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

@Configuration
public class SchedulingConfig {
    private final GlobalUncaughtHandler handler;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    /**
     * One thread only: the poll loop processes accounts sequentially and owns all per-account state.
     */
    @Bean(destroyMethod = "shutdown") // runs after PollScheduler.stop(), which waits for the loop to exit
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r);
            t.setName(GlobalUncaughtHandler.POLL_THREAD_PREFIX + t.getId());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(handler);
            return t;
        });
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }
}
