package com.conveyal.sweep.api;

/**
 * Provider-agnostic classification of the vehicle used on a transit leg. Adapters map upstream vehicle or product
 * types onto these values so ticket policies never need to know which provider answered.
 */
public enum ProductCategory {
    // ICE, IC, EC, long distance coaches on rail networks
    LONG_DISTANCE_RAIL,
    // RE, RB and other regional trains
    REGIONAL_RAIL,
    // S-Bahn, commuter rail
    SUBURBAN_RAIL,
    SUBWAY,
    TRAM,
    BUS,
    FERRY,
    // Gondolas, funiculars, cable cars
    CABLE,
    // On-demand services and shared taxis
    TAXI,
    OTHER
}
