package com.elssolution.seneccollector.integration.senec;

import com.elssolution.seneccollector.domain.RawStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Bridges the asynchronous {@link StatusSource} into the blocking step of the
 * collector loop: waits for the future on the caller's thread and insists on
 * exactly one result.
 */
@Slf4j
public class AsyncFetcherAdapter implements StatusFetcher {

    private final StatusSource source;

    public AsyncFetcherAdapter(StatusSource source) {
        this.source = source;
    }

    @Override
    public RawStatus fetch(String host) throws FetchException {
        CompletableFuture<List<RawStatus>> future;
        try {
            future = source.request(host);
        } catch (RuntimeException e) {
            throw new FetchException("Could not issue request to " + host + ": " + e.getMessage(), e);
        }
        if (future == null) {
            throw new AdapterContractException(0);
        }

        List<RawStatus> results;
        try {
            results = future.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new FetchException("Interrupted while waiting for " + host, ie);
        } catch (CancellationException ce) {
            throw new FetchException("Request to " + host + " was cancelled", ce);
        } catch (ExecutionException ee) {
            Throwable cause = unwrap(ee.getCause());
            if (cause instanceof FetchException fe) throw fe;
            throw new FetchException("Request to " + host + " failed: " + cause, cause);
        }

        int count = (results == null) ? 0 : results.size();
        if (count != 1) {
            throw new AdapterContractException(count);
        }
        if (log.isDebugEnabled()) {
            log.debug("status_fetched host={}", host);
        }
        return results.get(0);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable c = t;
        while (c instanceof CompletionException && c.getCause() != null) {
            c = c.getCause();
        }
        return c;
    }
}
