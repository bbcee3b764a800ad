package com.elssolution.vuegraf.health;

import com.elssolution.vuegraf.service.StatusService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class VuegrafHealth implements HealthIndicator {
    private final StatusService status;

    public VuegrafHealth(StatusService status) { this.status = status; }

    @Override public Health health() {
        var v = status.buildStatusView();
        boolean ok = !status.allAccountsFailing() && !v.isStopping() && !status.isLoopDead();

        return (ok ? Health.up() : Health.down())
                .withDetail("cycles", v.getCycles())
                .withDetail("lastCycleAge", v.getLastCycleAgeHuman())
                .withDetail("accounts", v.getAccounts().size())
                .withDetail("loopFailure", v.getLoopFailure() == null ? "-" : v.getLoopFailure())
                .build();
    }
}
