package com.conveyal.sweep.api;

import com.google.common.collect.Sets;

import java.time.Instant;
import java.util.Set;

/**
 * A sweep request as it arrives from a client: endpoints are still free text and the provider may be AUTO.
 */
public class PlanRequest {

    public final String originText;

    public final String destinationText;

    public final ProviderName provider;

    public final SearchMode mode;

    public final Instant anchorInstant;

    public final int windowMinutes;

    public final int stepMinutes;

    /** Lowercase ISO country code restricting geocoding, empty for none. */
    public final String country;

    public final Set<PolicyFlag> policyFlags;

    public PlanRequest (String originText, String destinationText, ProviderName provider, SearchMode mode,
                        Instant anchorInstant, int windowMinutes, int stepMinutes, String country,
                        Set<PolicyFlag> policyFlags) {
        this.originText = originText;
        this.destinationText = destinationText;
        this.provider = provider;
        this.mode = mode;
        this.anchorInstant = anchorInstant;
        this.windowMinutes = windowMinutes;
        this.stepMinutes = stepMinutes;
        this.country = country == null ? "" : country;
        this.policyFlags = Sets.immutableEnumSet(policyFlags);
    }

    @Override
    public String toString () {
        return String.format("'%s' -> '%s' %s %s %s", originText, destinationText, provider, mode, anchorInstant);
    }
}
