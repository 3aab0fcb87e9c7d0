package com.conveyal.sweep;

import com.conveyal.sweep.api.PolicyFlag;
import com.conveyal.sweep.api.ProductCategory;
import com.conveyal.sweep.components.HttpApi;
import com.conveyal.sweep.controllers.TransitController;
import com.conveyal.sweep.sweep.FilterPolicy;
import com.conveyal.sweep.sweep.SweepEngine;
import com.conveyal.sweep.upstream.HttpUpstreamClient;
import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/** Loads config information for the sweep server and exposes it to the Components and HttpControllers. */
public class SweepConfig extends ConfigBase implements
        HttpApi.Config,
        HttpUpstreamClient.Config,
        SweepEngine.Config,
        TransitController.Config
{

    // CONSTANTS AND STATIC FIELDS

    private static final Logger LOG = LoggerFactory.getLogger(SweepConfig.class);
    public static final String SWEEP_CONFIG_FILE = "sweep.properties";

    // INSTANCE FIELDS

    private final int serverPort;
    private final String allowOrigin;
    private final String googleApiKey;
    private final String userLocation;
    private final boolean enableDb;
    private final String dbBaseUrl;
    private final String userAgent;
    private final int httpTimeoutSeconds;
    private final int probeThreads;
    private final int maxParallelProbes;
    private final int maxCandidates;
    private final int routeCacheSize;
    private final int geocodeCacheSize;
    private final int cacheTtlSeconds;
    private final boolean fallbackEnabled;
    private final int defaultWindowMinutes;
    private final int defaultStepMinutes;
    private final Map<PolicyFlag, Set<ProductCategory>> policyExclusions;

    // CONSTRUCTORS

    private SweepConfig (String filename) {
        this(propsFromFile(filename), System.getenv(), System.getProperties());
    }

    protected SweepConfig (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        super(properties, environment, systemProperties);
        // We intentionally don't supply any defaults here.
        // Any 'defaults' should be shipped in an example config file.
        serverPort = intProp("server-port");
        allowOrigin = strProp("allow-origin");
        googleApiKey = strProp("google-api-key");
        userLocation = strProp("user-location");
        enableDb = boolProp("enable-db");
        dbBaseUrl = strProp("db-base-url");
        userAgent = strProp("user-agent");
        httpTimeoutSeconds = intProp("http-timeout-seconds");
        probeThreads = intProp("probe-threads");
        maxParallelProbes = intProp("max-parallel-probes");
        maxCandidates = intProp("max-candidates");
        routeCacheSize = intProp("route-cache-size");
        geocodeCacheSize = intProp("geocode-cache-size");
        cacheTtlSeconds = intProp("cache-ttl-seconds");
        fallbackEnabled = boolProp("fallback-enabled");
        defaultWindowMinutes = intProp("default-window-minutes");
        defaultStepMinutes = intProp("default-step-minutes");
        policyExclusions = new EnumMap<>(FilterPolicy.DEFAULT_EXCLUSIONS);
        String localTicketExclusions = strProp("excluded-products-local-ticket");
        if (localTicketExclusions != null) {
            policyExclusions.put(PolicyFlag.LOCAL_TICKET_ONLY,
                    parseCategories("excluded-products-local-ticket", localTicketExclusions));
        }
        validate();
    }

    private Set<ProductCategory> parseCategories (String key, String value) {
        Set<ProductCategory> categories = EnumSet.noneOf(ProductCategory.class);
        for (String name : Splitter.on(',').trimResults().omitEmptyStrings().split(value)) {
            try {
                categories.add(ProductCategory.valueOf(name.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                LOG.error("Configuration option '{}' contains unknown product category: {}", key, name);
                keysWithErrors.add(key);
            }
        }
        return categories;
    }

    private void validate () {
        requirePositive("probe-threads", probeThreads);
        requirePositive("max-parallel-probes", maxParallelProbes);
        requirePositive("max-candidates", maxCandidates);
        requirePositive("route-cache-size", routeCacheSize);
        requirePositive("geocode-cache-size", geocodeCacheSize);
        requirePositive("http-timeout-seconds", httpTimeoutSeconds);
        requirePositive("default-step-minutes", defaultStepMinutes);
        if (cacheTtlSeconds < 0) {
            LOG.error("Configuration option 'cache-ttl-seconds' must not be negative.");
            keysWithErrors.add("cache-ttl-seconds");
        }
    }

    private void requirePositive (String key, int value) {
        if (value < 1 && !keysWithErrors.contains(key)) {
            LOG.error("Configuration option '{}' must be at least 1, was {}.", key, value);
            keysWithErrors.add(key);
        }
    }

    // INTERFACE IMPLEMENTATIONS
    // Methods implementing Component and HttpController Config interfaces.

    @Override public int     serverPort()           { return serverPort; }
    @Override public String  allowOrigin()          { return allowOrigin; }
    @Override public String  userAgent()            { return userAgent; }
    @Override public int     httpTimeoutSeconds()   { return httpTimeoutSeconds; }
    @Override public int     probeThreads()         { return probeThreads; }
    @Override public int     maxParallelProbes()    { return maxParallelProbes; }
    @Override public boolean fallbackEnabled()      { return fallbackEnabled; }
    @Override public String  userLocation()         { return userLocation; }
    @Override public int     defaultWindowMinutes() { return defaultWindowMinutes; }
    @Override public int     defaultStepMinutes()   { return defaultStepMinutes; }

    public String  googleApiKey()     { return googleApiKey; }
    public boolean enableDb()         { return enableDb; }
    public String  dbBaseUrl()        { return dbBaseUrl; }
    public int     maxCandidates()    { return maxCandidates; }
    public int     routeCacheSize()   { return routeCacheSize; }
    public int     geocodeCacheSize() { return geocodeCacheSize; }
    public int     cacheTtlSeconds()  { return cacheTtlSeconds; }
    public Map<PolicyFlag, Set<ProductCategory>> policyExclusions() { return policyExclusions; }

    // STATIC FACTORY METHODS
    // Always use these to construct SweepConfig objects for readability.

    public static SweepConfig fromDefaultFile () {
        SweepConfig config = new SweepConfig(SWEEP_CONFIG_FILE);
        config.exitIfErrors();
        return config;
    }

    /** Build a config from in-memory properties only, ignoring the environment. Check keysWithErrors() after. */
    public static SweepConfig fromProperties (Properties properties) {
        return new SweepConfig(properties, Map.of(), Map.of());
    }

}
