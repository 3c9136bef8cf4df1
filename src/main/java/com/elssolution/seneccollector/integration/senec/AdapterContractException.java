package com.elssolution.seneccollector.integration.senec;

/**
 * The asynchronous status request completed with a result count other than one.
 * Handled by the collector like any other failed cycle.
 */
public class AdapterContractException extends FetchException {

    private final int resultCount;

    public AdapterContractException(int resultCount) {
        super("Expected exactly one status from the device request, got " + resultCount);
        this.resultCount = resultCount;
    }

    public int getResultCount() {
        return resultCount;
    }
}
