package com.conveyal.sweep.api;

import com.google.common.collect.Sets;

import java.time.Instant;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A fully resolved request for a sweep: both endpoints are already geocoded. Created once per incoming request and
 * never modified.
 */
public class SearchQuery {

    public final ProviderName provider;

    public final Location origin;

    public final Location destination;

    public final SearchMode mode;

    /** The requested arrival time (ARRIVE) or departure time (DEPART). */
    public final Instant anchorInstant;

    public final int windowMinutes;

    public final int stepMinutes;

    public final Set<PolicyFlag> policyFlags;

    public SearchQuery (ProviderName provider, Location origin, Location destination, SearchMode mode,
                        Instant anchorInstant, int windowMinutes, int stepMinutes, Set<PolicyFlag> policyFlags) {
        checkArgument(provider != ProviderName.AUTO, "Provider must be resolved before building a query.");
        checkArgument(windowMinutes >= 0, "Window must not be negative: %s", windowMinutes);
        checkArgument(stepMinutes >= 1, "Step must be at least one minute: %s", stepMinutes);
        this.provider = checkNotNull(provider);
        this.origin = checkNotNull(origin);
        this.destination = checkNotNull(destination);
        this.mode = checkNotNull(mode);
        this.anchorInstant = checkNotNull(anchorInstant);
        this.windowMinutes = windowMinutes;
        this.stepMinutes = stepMinutes;
        this.policyFlags = Sets.immutableEnumSet(policyFlags);
    }

    public RouteQueryKey keyFor (Instant candidate, SearchMode probeMode) {
        return new RouteQueryKey(provider, origin, destination, probeMode, candidate, policyFlags);
    }

    @Override
    public String toString () {
        return String.format("%s %s -> %s, %s %s window %d step %d %s", provider, origin.label, destination.label,
                mode, anchorInstant, windowMinutes, stepMinutes, policyFlags);
    }
}
