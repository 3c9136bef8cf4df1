package com.elssolution.seneccollector.collector;

import java.time.Duration;

public class IntervalTooShortException extends ConfigException {

    private final Duration interval;

    public IntervalTooShortException(Duration interval, Duration minimum) {
        super("No interval below " + minimum.toSeconds() + " s allowed (got " + interval.toMillis() + " ms)");
        this.interval = interval;
    }

    public Duration getInterval() {
        return interval;
    }
}
