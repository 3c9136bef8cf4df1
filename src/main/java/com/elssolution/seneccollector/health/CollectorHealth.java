package com.elssolution.seneccollector.health;

import com.elssolution.seneccollector.service.StatusService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

@Component
public class CollectorHealth implements HealthIndicator {
    private final StatusService status;

    public CollectorHealth(StatusService status) { this.status = status; }

    @Override public Health health() {
        var v = status.buildStatusView();
        boolean ok = "RUNNING".equals(v.getState()) && v.isFresh();

        return (ok ? Health.up() : Health.down())
                .withDetail("state", v.getState())
                .withDetail("queued", v.getQueued())
                .withDetail("lastSuccessAgeMs", v.getLastSuccessAgeMs())
                .withDetail("freshWindowMs", v.getFreshWindowMs())
                .withDetail("failures", v.getFailures())
                .build();
    }
}
