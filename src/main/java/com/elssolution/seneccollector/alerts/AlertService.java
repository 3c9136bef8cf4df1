package com.elssolution.seneccollector.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keyed alert episodes for the collector (device down, contract violations,
 * risky interval, uncaught errors). Raising an active key just refreshes it.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        long firstSeen;   // epoch ms, start of the current episode
        long lastSeen;    // epoch ms
        int count;        // raise() calls in this episode
        boolean active;
    }

    @Value @Builder
    public static class EventView {
        String key;
        String message;
        Severity severity;
        long ts;          // epoch ms
        String type;      // "RAISE" or "RESOLVE"
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent; // newest first
    }

    private final Map<String, MutableAlert> alerts = new ConcurrentHashMap<>();
    private final Deque<EventView> recent = new ArrayDeque<>();
    private final int recentCapacity = 50;

    /** Raise or refresh an alert. Starts a new episode if it was inactive. */
    public void raise(String key, String message, Severity sev) {
        long now = System.currentTimeMillis();
        MutableAlert a = alerts.computeIfAbsent(key, k -> new MutableAlert(k, sev, message, now));

        boolean newEpisode;
        synchronized (a) {
            newEpisode = !a.active || a.count.get() == 0;
            if (newEpisode) {
                a.firstSeen = now;
                a.count.set(0);
            }
            a.active   = true;
            a.severity = sev;
            a.message  = message;
            a.count.incrementAndGet();
            a.lastSeen = now;
        }

        // repeated raises of a running episode stay at debug, the log already has the first one
        if (newEpisode) log.warn("ALERT RAISE key={} sev={} msg={}", key, sev, message);
        else if (log.isDebugEnabled()) log.debug("ALERT REFRESH key={} msg={}", key, message);
        emitEvent(key, message, sev, "RAISE");
    }

    /** Closes the episode; no-op when the key is unknown or already resolved. */
    public void resolve(String key) {
        MutableAlert a = alerts.get(key);
        if (a == null) return;

        boolean wasActive;
        Severity sev;
        synchronized (a) {
            wasActive = a.active;
            sev = a.severity;
            a.active = false;
            a.lastSeen = System.currentTimeMillis();
        }
        if (wasActive) {
            log.info("ALERT RESOLVE key={}", key);
            emitEvent(key, "recovered", sev, "RESOLVE");
        }
    }

    public boolean isActive(String key) {
        MutableAlert a = alerts.get(key);
        return a != null && a.active;
    }

    /** All active alerts (most recently seen first) + recent raise/resolve events. */
    public AlertsSnapshot snapshot() {
        List<AlertView> active = alerts.values().stream()
                .filter(ma -> ma.active)
                .sorted(Comparator.comparingLong((MutableAlert ma) -> ma.lastSeen).reversed())
                .map(MutableAlert::view)
                .toList();

        List<EventView> recentCopy;
        synchronized (recent) {
            recentCopy = new ArrayList<>(recent);
        }
        Collections.reverse(recentCopy);
        return AlertsSnapshot.builder().active(active).recent(recentCopy).build();
    }

    private void emitEvent(String key, String msg, Severity sev, String type) {
        EventView ev = EventView.builder()
                .key(key).message(msg).severity(sev).type(type)
                .ts(System.currentTimeMillis())
                .build();
        synchronized (recent) {
            recent.addLast(ev);
            while (recent.size() > recentCapacity) recent.removeFirst();
        }
    }

    private static class MutableAlert {
        final String key;
        volatile String message;
        volatile Severity severity;
        volatile boolean active;
        volatile long firstSeen;
        volatile long lastSeen;
        final AtomicInteger count = new AtomicInteger(0);

        MutableAlert(String key, Severity severity, String message, long now) {
            this.key = key;
            this.severity = severity;
            this.message = message;
            this.active = true;
            this.firstSeen = now;
            this.lastSeen = now;
        }

        AlertView view() {
            return AlertView.builder()
                    .key(key).message(message).severity(severity).active(active)
                    .firstSeen(firstSeen).lastSeen(lastSeen).count(count.get())
                    .build();
        }
    }
}
