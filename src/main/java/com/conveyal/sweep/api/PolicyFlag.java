package com.conveyal.sweep.api;

/**
 * Ticket validity rules a caller can ask to enforce. Each flag excludes a configurable set of product categories,
 * see FilterPolicy.
 */
public enum PolicyFlag {
    // Regional flat-rate tickets (e.g. Deutschlandticket) that are not valid on long distance trains
    LOCAL_TICKET_ONLY,
    NO_BUS,
    NO_FERRY
}
