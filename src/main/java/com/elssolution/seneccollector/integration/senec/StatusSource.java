package com.elssolution.seneccollector.integration.senec;

import com.elssolution.seneccollector.domain.RawStatus;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous device request. A well-behaved source completes with a single
 * element; anything else is rejected by {@link AsyncFetcherAdapter}.
 */
public interface StatusSource {

    CompletableFuture<List<RawStatus>> request(String host);
}
