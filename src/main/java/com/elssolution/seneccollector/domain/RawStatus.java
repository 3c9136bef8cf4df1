package com.elssolution.seneccollector.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;

/**
 * Immutable device reading: the JSON tree exactly as the device returned it
 * plus the time the fetch completed. Nobody in the collector looks inside.
 */
@ToString
@EqualsAndHashCode
public final class RawStatus {
    private final JsonNode data;       // private copy, never handed out
    private final long fetchedAtMs;    // System.currentTimeMillis() when the response was complete

    public RawStatus(JsonNode data, long fetchedAtMs) {
        this.data = Objects.requireNonNull(data, "data is required").deepCopy();
        this.fetchedAtMs = fetchedAtMs;
    }

    public static RawStatus of(JsonNode data) {
        return new RawStatus(data, System.currentTimeMillis());
    }

    /** Returns a copy; callers may modify it freely. */
    public JsonNode getData() {
        return data.deepCopy();
    }

    public long getFetchedAtMs() {
        return fetchedAtMs;
    }
}
