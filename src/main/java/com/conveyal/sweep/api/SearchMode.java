package com.conveyal.sweep.api;

/**
 * Whether the anchor instant of a search is the desired arrival time or the desired departure time.
 */
public enum SearchMode {
    ARRIVE,
    DEPART;

    public SearchMode opposite () {
        return this == ARRIVE ? DEPART : ARRIVE;
    }
}
