package com.elssolution.seneccollector.collector;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Validated collector settings.
 *
 * Rules:
 * - host must be set
 * - interval below 10 s is rejected
 * - interval below 60 s is accepted; the collector warns about it
 * - interval above one day is rejected
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CollectorConfig {

    public static final Duration MIN_INTERVAL = Duration.ofSeconds(10);
    public static final Duration RECOMMENDED_MIN_INTERVAL = Duration.ofSeconds(60);
    public static final Duration MAX_INTERVAL = Duration.ofDays(1);

    private final String host;
    private final Duration interval;
    /** Stop after the first cycle (old one-shot behaviour). */
    private final boolean singleShot;

    private CollectorConfig(String host, Duration interval, boolean singleShot) {
        this.host = host;
        this.interval = interval;
        this.singleShot = singleShot;
    }

    public static CollectorConfig of(String host, Duration interval) {
        return of(host, interval, false);
    }

    public static CollectorConfig of(String host, Duration interval, boolean singleShot) {
        if (host == null || host.isBlank()) {
            throw new ConfigException("Device host is required");
        }
        if (interval == null) {
            throw new ConfigException("Poll interval is required");
        }
        if (interval.compareTo(MIN_INTERVAL) < 0) {
            throw new IntervalTooShortException(interval, MIN_INTERVAL);
        }
        if (interval.compareTo(MAX_INTERVAL) > 0) {
            throw new ConfigException("No interval above " + MAX_INTERVAL.toHours() + " h allowed (got "
                    + interval.toSeconds() + " s)");
        }
        return new CollectorConfig(host.trim(), interval, singleShot);
    }

    /** Skips the interval floor; lets tests run the loop at millisecond pace. */
    static CollectorConfig unvalidated(String host, Duration interval, boolean singleShot) {
        return new CollectorConfig(host, interval, singleShot);
    }

    public boolean isBelowRecommendedInterval() {
        return interval.compareTo(RECOMMENDED_MIN_INTERVAL) < 0;
    }
}
