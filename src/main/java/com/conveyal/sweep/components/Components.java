package com.conveyal.sweep.components;

import com.conveyal.sweep.SweepConfig;
import com.conveyal.sweep.sweep.SweepEngine;
import com.conveyal.sweep.sweep.TransitSweepService;
import com.conveyal.sweep.upstream.HttpUpstreamClient;
import com.conveyal.sweep.util.BoundedExecutor;

/**
 * We wire up our components by hand instead of relying on a dependency injection framework. This class keeps
 * references to all components of the system in one place, like an "application context". The components are
 * singleton instances, so they can be replaced with other implementations (e.g. fake upstream clients in tests).
 *
 * Outside code should not reference these fields after startup. Each component holds final references to the other
 * components it needs, passed into its constructor by the wiring-up code in a subclass.
 */
public abstract class Components {

    public SweepConfig config;
    /** Pooled HTTP connections to the routing and geocoding upstreams. */
    public HttpUpstreamClient upstreamClient;
    /** Shared by all sweeps for probing candidates and geocoding endpoints in parallel. */
    public BoundedExecutor probeExecutor;
    public SweepEngine sweepEngine;
    public TransitSweepService sweepService;
    public HttpApi httpApi;

    /** Stop serving requests and release the thread pools and connections. */
    public void shutDown () {
        if (httpApi != null) httpApi.shutDown();
        if (probeExecutor != null) probeExecutor.shutdown();
        if (upstreamClient != null) upstreamClient.close();
    }

}
