package com.conveyal.sweep.api;

import com.google.common.base.Joiner;
import com.google.common.collect.Sets;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Identity of one upstream routing call. Two queries with equal keys would result in exactly the same provider call,
 * so the route cache uses this as the sole key for both memoization and collapsing concurrent duplicate requests.
 * Instants are truncated to whole seconds since no provider accepts finer resolution.
 */
public class RouteQueryKey {

    public final ProviderName provider;

    public final String origin;

    public final String destination;

    public final SearchMode mode;

    public final long epochSecond;

    public final Set<PolicyFlag> policyFlags;

    public RouteQueryKey (ProviderName provider, Location origin, Location destination, SearchMode mode,
                          Instant instant, Set<PolicyFlag> policyFlags) {
        this.provider = provider;
        this.origin = origin.keyString();
        this.destination = destination.keyString();
        this.mode = mode;
        this.epochSecond = instant.getEpochSecond();
        this.policyFlags = Sets.immutableEnumSet(policyFlags);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RouteQueryKey other = (RouteQueryKey) o;
        return epochSecond == other.epochSecond && provider == other.provider && mode == other.mode &&
                origin.equals(other.origin) && destination.equals(other.destination) &&
                policyFlags.equals(other.policyFlags);
    }

    @Override
    public int hashCode () {
        return Objects.hash(provider, origin, destination, mode, epochSecond, policyFlags);
    }

    @Override
    public String toString () {
        return Joiner.on('|').join(provider, origin, destination, mode, epochSecond, policyFlags);
    }
}
