package com.conveyal.sweep.sweep;

import com.conveyal.sweep.api.NormalizedRoute;
import com.conveyal.sweep.api.ProbeOutcome;
import com.conveyal.sweep.api.ProbeTrace;
import com.conveyal.sweep.api.ProviderName;
import com.conveyal.sweep.api.RouteQueryKey;
import com.conveyal.sweep.api.SearchMode;
import com.conveyal.sweep.api.SearchQuery;
import com.conveyal.sweep.api.SweepResult;
import com.conveyal.sweep.api.TransitLeg;
import com.conveyal.sweep.cache.KeyedCache;
import com.conveyal.sweep.components.Component;
import com.conveyal.sweep.provider.RouteProvider;
import com.conveyal.sweep.util.BoundedExecutor;
import com.conveyal.sweep.util.ExceptionUtils;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a sweep: asks a route provider for a route at each candidate instant of the search window and keeps the best
 * route that the filter policy accepts.
 *
 * Every probe goes through the shared route cache, so identical probes from concurrent or recent sweeps reach the
 * upstream only once. Probes run in parallel on the bounded executor. Selection only starts after all probes of a
 * pass have finished and looks at them in candidate order, so the result does not depend on completion order.
 *
 * If no candidate yields an acceptable route, the whole window is probed once more with the opposite search mode
 * (arrive-by becomes depart-at and vice versa). This retry happens at most once per sweep. Its probes have their own
 * cache keys since the mode is part of the key.
 *
 * sweep() never throws for upstream problems. Per-candidate failures only show up in the probe trace, and a sweep that
 * finds nothing returns a SWEEP_EMPTY result. A query naming a provider that is not registered also yields SWEEP_EMPTY,
 * with an empty trace.
 */
public class SweepEngine implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(SweepEngine.class);

    public interface Config {
        int maxParallelProbes ();
        boolean fallbackEnabled ();
    }

    private final Map<ProviderName, RouteProvider> providers;
    private final KeyedCache<RouteQueryKey, ProbeOutcome> routeCache;
    private final BoundedExecutor executor;
    private final CandidateTimeGenerator candidateTimeGenerator;
    private final FilterPolicy filterPolicy;
    private final SelectionPolicy selectionPolicy;
    private final Config config;

    public SweepEngine (
            List<RouteProvider> providers,
            KeyedCache<RouteQueryKey, ProbeOutcome> routeCache,
            BoundedExecutor executor,
            CandidateTimeGenerator candidateTimeGenerator,
            FilterPolicy filterPolicy,
            SelectionPolicy selectionPolicy,
            Config config
    ) {
        ImmutableMap.Builder<ProviderName, RouteProvider> byName = ImmutableMap.builder();
        for (RouteProvider provider : providers) {
            byName.put(provider.name(), provider);
        }
        this.providers = byName.build();
        this.routeCache = routeCache;
        this.executor = executor;
        this.candidateTimeGenerator = candidateTimeGenerator;
        this.filterPolicy = filterPolicy;
        this.selectionPolicy = selectionPolicy;
        this.config = config;
    }

    /** The registered provider with the given name, or null. */
    public RouteProvider provider (ProviderName name) {
        return providers.get(name);
    }

    public SweepResult sweep (SearchQuery query) {
        RouteProvider provider = providers.get(query.provider);
        if (provider == null) {
            LOG.warn("No route provider registered for {}, nothing to sweep.", query.provider);
            return SweepResult.empty(query, new ArrayList<>(), "No route provider registered for " + query.provider);
        }
        List<Instant> candidates = candidateTimeGenerator.candidates(
                query.anchorInstant, query.windowMinutes, query.stepMinutes, query.mode);
        LOG.info("Sweeping {} at {} candidate instants.", query, candidates.size());
        List<ProbeTrace> trace = new ArrayList<>();
        Probe best;
        try {
            best = probeWindow(provider, query, candidates, query.mode, false, trace);
            if (best == null && config.fallbackEnabled()) {
                LOG.info("No acceptable route in {} mode, retrying window in {} mode.", query.mode,
                        query.mode.opposite());
                best = probeWindow(provider, query, candidates, query.mode.opposite(), true, trace);
            }
        } catch (RuntimeException e) {
            // Only reachable if the executor itself fails, e.g. while shutting down.
            LOG.error("Sweep aborted for {}.\n{}", query, ExceptionUtils.stackTraceString(e));
            return SweepResult.empty(query, trace);
        }
        if (best == null) {
            LOG.info("Sweep found no acceptable route for {}.", query);
            return SweepResult.empty(query, trace);
        }
        LOG.info("Best route for {}: {}", query, best.route());
        return SweepResult.ok(best.route(), best.trace, best.trace.fallback, query, trace);
    }

    /**
     * Probe every candidate in one mode, append a trace entry per candidate, and return the best acceptable probe
     * or null if there is none.
     */
    private Probe probeWindow (RouteProvider provider, SearchQuery query, List<Instant> candidates, SearchMode mode,
                               boolean fallback, List<ProbeTrace> trace) {
        List<BoundedExecutor.Outcome<Probe>> outcomes = executor.runAll(
                candidates,
                instant -> probe(provider, query, instant, mode, fallback),
                config.maxParallelProbes()
        );
        List<Probe> accepted = new ArrayList<>();
        List<NormalizedRoute> acceptedRoutes = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            BoundedExecutor.Outcome<Probe> outcome = outcomes.get(i);
            Probe probe;
            if (outcome.succeeded()) {
                probe = outcome.value;
            } else {
                // The upstream could not be reached at all for this candidate.
                ProbeOutcome failed = ProbeOutcome.httpError(null, ExceptionUtils.shortCauseString(outcome.failure));
                probe = new Probe(failed, new ProbeTrace(candidates.get(i), mode, failed.error(), null, false,
                        fallback, null));
            }
            trace.add(probe.trace);
            if (probe.outcome.isOk()) {
                accepted.add(probe);
                acceptedRoutes.add(probe.route());
            }
        }
        int bestIndex = selectionPolicy.indexOfBest(acceptedRoutes);
        return bestIndex < 0 ? null : accepted.get(bestIndex);
    }

    /** Runs on an executor thread. Resolves one candidate through the route cache and applies the filter policy. */
    private Probe probe (RouteProvider provider, SearchQuery query, Instant instant, SearchMode mode,
                         boolean fallback) {
        RouteQueryKey key = query.keyFor(instant, mode);
        KeyedCache.Lookup<ProbeOutcome> lookup = routeCache.lookup(key, () -> {
            try {
                return provider.query(query.origin, query.destination, instant, mode);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        ProbeOutcome outcome = lookup.value;
        if (outcome.isOk()) {
            TransitLeg excluded = filterPolicy.firstExcludedLeg(outcome.route(), query.policyFlags);
            if (excluded != null) {
                LOG.debug("Route at {} rejected by policy {}: uses {}.", instant, query.policyFlags, excluded);
                outcome = ProbeOutcome.policyRejected("Uses excluded " + excluded.productCategory + " " + excluded.line);
            }
        }
        Integer duration = outcome.isOk() ? outcome.route().durationSeconds : null;
        ProbeTrace trace = new ProbeTrace(instant, mode, outcome.error(), outcome.httpCode, lookup.shared(),
                fallback, duration);
        return new Probe(outcome, trace);
    }

    /** One candidate's outcome after filtering, with its trace entry. */
    private static class Probe {
        final ProbeOutcome outcome;
        final ProbeTrace trace;

        Probe (ProbeOutcome outcome, ProbeTrace trace) {
            this.outcome = outcome;
            this.trace = trace;
        }

        NormalizedRoute route () {
            return outcome.route();
        }
    }

}
