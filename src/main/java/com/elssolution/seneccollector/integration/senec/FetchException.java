package com.elssolution.seneccollector.integration.senec;

/** One fetch cycle failed: connectivity, timeout, HTTP status or an unreadable payload. */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
