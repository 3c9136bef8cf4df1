package com.elssolution.seneccollector.service;

import com.elssolution.seneccollector.alerts.AlertService;
import com.elssolution.seneccollector.collector.SenecDataCollector;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Status aggregation for the UI, the health indicator and the periodic summary log.
 */
@Slf4j
@Component
public class StatusService {

    private final SenecDataCollector collector;
    private final AlertService alerts;

    /** Floor of the freshness window (ms); long poll intervals widen it. */
    private final long maxDataAgeMs;
    /** HTTP request timeout (ms); one fetch may take this long before it lands. */
    private final long requestTimeoutMs;

    public StatusService(SenecDataCollector collector,
                         AlertService alerts,
                         @Value("${senec.status.max-age-ms:300000}") long maxDataAgeMs,
                         @Value("${senec.http.request-timeout-ms:6000}") long requestTimeoutMs) {
        this.collector = collector;
        this.alerts = alerts;
        this.maxDataAgeMs = maxDataAgeMs;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    // ---------------------- Public API ----------------------

    public StatusView buildStatusView() {
        long now = System.currentTimeMillis();
        SenecDataCollector.Stats s = collector.stats();

        long ageMs = (s.getLastSuccessMs() == 0L) ? -1 : Math.max(0, now - s.getLastSuccessMs());
        long windowMs = freshWindowMs(s.getIntervalMs());
        boolean fresh = ageMs >= 0 && ageMs <= windowMs;

        return StatusView.builder()
                .host(s.getHost())
                .intervalMs(s.getIntervalMs())
                .state(String.valueOf(s.getState()))
                .queued(s.getQueued())
                .cycles(s.getCycles())
                .failures(s.getFailures())
                .lastSuccessAgeMs(ageMs)
                .lastSuccessAgeHuman(humanAge(ageMs))
                .lastError(s.getLastError())
                .fresh(fresh)
                .freshWindowMs(windowMs)
                .activeAlerts(alerts.snapshot().getActive().size())
                .build();
    }

    /** A reading counts as fresh for two poll periods plus one request timeout, never less than max-age-ms. */
    long freshWindowMs(long intervalMs) {
        return Math.max(maxDataAgeMs, 2 * intervalMs + requestTimeoutMs);
    }

    // ---------------------- Log summary ----------------------

    @Scheduled(initialDelayString = "${senec.status.summary-initial-delay-ms:60000}",
            fixedDelayString = "${senec.status.summary-period-ms:300000}")
    public void logSummarySafe() {
        try {
            StatusView v = buildStatusView();
            log.info("Status: host={} state={} queued={} cycles={} failures={} lastSuccess={} ago",
                    v.host, v.state, v.queued, v.cycles, v.failures, v.lastSuccessAgeHuman);
        } catch (Exception e) {
            log.warn("status_summary_failed: {}", e.getMessage());
        }
    }

    // ---------------------- formatting helpers ----------------------

    static String humanAge(long ageMs) {
        if (ageMs < 0) return "-";
        if (ageMs < 1000) return ageMs + " ms";
        long s = ageMs / 1000;
        if (s < 60) return s + " s";
        long m = s / 60;
        long remS = s % 60;
        return m + " min " + remS + " s";
    }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class StatusView {
        String host;
        long   intervalMs;
        String state;
        int    queued;
        long   cycles;
        long   failures;
        long   lastSuccessAgeMs;   // -1 = never
        String lastSuccessAgeHuman;
        String lastError;
        boolean fresh;
        long   freshWindowMs;
        int    activeAlerts;
    }
}
