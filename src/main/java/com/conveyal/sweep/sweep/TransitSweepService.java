package com.conveyal.sweep.sweep;

import com.conveyal.sweep.SweepServerException;
import com.conveyal.sweep.api.PlanRequest;
import com.conveyal.sweep.api.ProviderName;
import com.conveyal.sweep.api.SearchQuery;
import com.conveyal.sweep.api.SweepResult;
import com.conveyal.sweep.components.Component;
import com.conveyal.sweep.geocode.GeocodeResult;
import com.conveyal.sweep.geocode.Geocoder;
import com.conveyal.sweep.provider.RouteProvider;
import com.conveyal.sweep.util.BoundedExecutor;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the HTTP layer: picks the provider, geocodes both endpoints with that provider's geocoder, and
 * hands the resolved query to the SweepEngine. A geocoding failure ends the request before any route is probed.
 */
public class TransitSweepService implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(TransitSweepService.class);

    private final SweepEngine sweepEngine;

    private final Map<ProviderName, Geocoder> geocoders;

    private final BoundedExecutor executor;

    public TransitSweepService (SweepEngine sweepEngine, Map<ProviderName, Geocoder> geocoders,
                                BoundedExecutor executor) {
        this.sweepEngine = sweepEngine;
        this.geocoders = ImmutableMap.copyOf(geocoders);
        this.executor = executor;
    }

    /**
     * Replace AUTO with a concrete provider (DB if it is enabled, Google otherwise), and refuse disabled providers.
     */
    public ProviderName resolveProvider (ProviderName requested) {
        ProviderName resolved = requested;
        if (requested == ProviderName.AUTO) {
            resolved = isEnabled(ProviderName.DB) ? ProviderName.DB : ProviderName.GOOGLE;
        }
        if (!isEnabled(resolved)) {
            throw SweepServerException.providerDisabled(String.format(
                    "Provider %s is disabled or not configured.", resolved.paramValue()));
        }
        return resolved;
    }

    private boolean isEnabled (ProviderName name) {
        RouteProvider provider = sweepEngine.provider(name);
        return provider != null && provider.isEnabled() && geocoders.containsKey(name);
    }

    public SweepResult plan (PlanRequest request) {
        ProviderName provider = resolveProvider(request.provider);
        Geocoder geocoder = geocoders.get(provider);
        // Geocode both endpoints at once, they are independent upstream calls.
        List<BoundedExecutor.Outcome<GeocodeResult>> geocoded = executor.runAll(
                ImmutableList.of(request.originText, request.destinationText),
                text -> {
                    try {
                        return geocoder.geocode(text, request.country);
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                },
                2
        );
        GeocodeResult origin = resultOrFailure(geocoded.get(0));
        GeocodeResult destination = resultOrFailure(geocoded.get(1));
        if (!origin.ok || !destination.ok) {
            LOG.info("Geocoding failed for {}: origin {}, destination {}", request, origin, destination);
            return SweepResult.geocodeFailed(String.format("Geocoding failed (origin: %s, destination: %s)",
                    origin, destination));
        }
        SearchQuery query = new SearchQuery(provider, origin.location, destination.location, request.mode,
                request.anchorInstant, request.windowMinutes, request.stepMinutes, request.policyFlags);
        return sweepEngine.sweep(query);
    }

    private static GeocodeResult resultOrFailure (BoundedExecutor.Outcome<GeocodeResult> outcome) {
        if (outcome.succeeded()) {
            return outcome.value;
        }
        return GeocodeResult.failed("NETWORK_ERROR", outcome.failure.toString());
    }

}
