package com.elssolution.vuegraf.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Last line for exceptions nobody caught on threads outside the poll loop, which reports its own
 * death. Muted once the context is closing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    public static final String POLL_THREAD_PREFIX = "vuegraf-poll-";

    private final AlertService alerts;

    private volatile boolean closing = false;

    @PostConstruct
    void install() {
        Thread.setDefaultUncaughtExceptionHandler(this);
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        closing = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (closing) {
            log.debug("Ignoring {} in {} during shutdown", e, t.getName());
            return;
        }
        log.error("Uncaught exception in {}", t.getName(), e);
        alerts.raise("UNCAUGHT:" + t.getName(), e.toString(), AlertService.Severity.ERROR);
    }
}
