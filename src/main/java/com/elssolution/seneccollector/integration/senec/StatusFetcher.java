package com.elssolution.seneccollector.integration.senec;

import com.elssolution.seneccollector.domain.RawStatus;

/**
 * Blocking "fetch current status for host" capability used by the collector loop.
 */
public interface StatusFetcher {

    /**
     * Blocks until the device answered or the request failed.
     *
     * @param host address of the device (ip or hostname, optionally with port)
     * @return exactly one reading
     * @throws FetchException if no reading could be produced for this cycle
     */
    RawStatus fetch(String host) throws FetchException;
}
