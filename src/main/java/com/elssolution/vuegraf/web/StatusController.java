package com.elssolution.vuegraf.web;

import com.elssolution.vuegraf.alerts.AlertService;
import com.elssolution.vuegraf.service.StatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

    private final AlertService alerts;

    private final StatusService status;

    public StatusController(AlertService alerts, StatusService status) {
        this.alerts = alerts;
        this.status = status;
    }

    @GetMapping("/status")
    public StatusService.StatusView getStatus() {
        return status.buildStatusView();
    }

    @GetMapping("/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }
}
