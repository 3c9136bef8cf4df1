package com.elssolution.seneccollector.collector;

/** Collector settings that cannot be used. Raised at construction, never from a running collector. */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }
}
