package com.conveyal.sweep.provider;

import com.conveyal.sweep.api.Location;
import com.conveyal.sweep.api.ProbeOutcome;
import com.conveyal.sweep.api.ProviderName;
import com.conveyal.sweep.api.SearchMode;

import java.io.IOException;
import java.time.Instant;

/**
 * Adapter around one upstream routing API. It is the only place that knows the shape of that API's responses: it makes
 * one call and turns the answer into a NormalizedRoute, or classifies why there is no usable route.
 * Implementations must be threadsafe, many probes call them at once.
 */
public interface RouteProvider {

    ProviderName name ();

    /**
     * Ask the upstream for the best route leaving at (DEPART) or arriving by (ARRIVE) the given instant.
     * @return an OK outcome, or UPSTREAM_HTTP_ERROR / ZERO_RESULTS when the upstream answered without a usable route.
     * @throws IOException when no answer could be obtained at all. Such failures are not final and are never cached.
     */
    ProbeOutcome query (Location origin, Location destination, Instant instant, SearchMode mode) throws IOException;

    /** False when the provider is switched off or lacks credentials, in which case it must not be queried. */
    boolean isEnabled ();

}
