package com.conveyal.sweep.components;

import com.conveyal.sweep.SweepConfig;
import com.conveyal.sweep.api.ProbeOutcome;
import com.conveyal.sweep.api.ProviderName;
import com.conveyal.sweep.api.RouteQueryKey;
import com.conveyal.sweep.cache.KeyedCache;
import com.conveyal.sweep.controllers.HealthController;
import com.conveyal.sweep.controllers.HttpController;
import com.conveyal.sweep.controllers.TransitController;
import com.conveyal.sweep.geocode.CachingGeocoder;
import com.conveyal.sweep.geocode.GeocodeResult;
import com.conveyal.sweep.geocode.Geocoder;
import com.conveyal.sweep.geocode.GoogleGeocoder;
import com.conveyal.sweep.geocode.TransportRestLocator;
import com.conveyal.sweep.provider.GoogleDirectionsProvider;
import com.conveyal.sweep.provider.RouteProvider;
import com.conveyal.sweep.provider.TransportRestProvider;
import com.conveyal.sweep.sweep.CandidateTimeGenerator;
import com.conveyal.sweep.sweep.FilterPolicy;
import com.conveyal.sweep.sweep.SelectionPolicy;
import com.conveyal.sweep.sweep.SweepEngine;
import com.conveyal.sweep.sweep.TransitSweepService;
import com.conveyal.sweep.upstream.HttpUpstreamClient;
import com.conveyal.sweep.util.BoundedExecutor;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Wires up the components for a single sweep server process, talking to the real upstreams over HTTP.
 */
public class LocalComponents extends Components {

    public LocalComponents () {
        this(SweepConfig.fromDefaultFile());
    }

    public LocalComponents (SweepConfig config) {
        this.config = config;
        upstreamClient = new HttpUpstreamClient(config);
        probeExecutor = BoundedExecutor.withThreads(config.probeThreads(), "probe");

        KeyedCache<RouteQueryKey, ProbeOutcome> routeCache = new KeyedCache<>(
                "route cache", config.routeCacheSize(), config.cacheTtlSeconds(), Ticker.systemTicker());
        // One geocode cache for both geocoders, the geocoder name is part of each key.
        KeyedCache<String, GeocodeResult> geocodeCache = new KeyedCache<>(
                "geocode cache", config.geocodeCacheSize(), config.cacheTtlSeconds(), Ticker.systemTicker());

        List<RouteProvider> providers = ImmutableList.of(
                new GoogleDirectionsProvider(upstreamClient, config.googleApiKey()),
                new TransportRestProvider(upstreamClient, config.dbBaseUrl(), config.enableDb())
        );
        Map<ProviderName, Geocoder> geocoders = ImmutableMap.of(
                ProviderName.GOOGLE,
                new CachingGeocoder(new GoogleGeocoder(upstreamClient, config.googleApiKey()), geocodeCache),
                ProviderName.DB,
                new CachingGeocoder(new TransportRestLocator(upstreamClient, config.dbBaseUrl()), geocodeCache)
        );

        sweepEngine = new SweepEngine(
                providers,
                routeCache,
                probeExecutor,
                new CandidateTimeGenerator(config.maxCandidates()),
                new FilterPolicy(config.policyExclusions()),
                new SelectionPolicy(),
                config
        );
        sweepService = new TransitSweepService(sweepEngine, geocoders, probeExecutor);
        // Instantiate the HttpApi last, when all the components its controllers need are already created.
        httpApi = new HttpApi(config, standardHttpControllers(this));
    }

    /**
     * Create the standard list of HttpControllers. The Components parameter should already be initialized with all
     * components except the HttpApi.
     */
    public static List<HttpController> standardHttpControllers (Components components) {
        return ImmutableList.of(
                new HealthController(),
                new TransitController(components.sweepService, components.config)
        );
    }

}
