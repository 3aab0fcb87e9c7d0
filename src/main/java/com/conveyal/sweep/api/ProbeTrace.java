package com.conveyal.sweep.api;

import java.time.Instant;

/**
 * Diagnostic record of a single probe made during a sweep, returned to callers who ask for debugging output.
 */
public class ProbeTrace {

    public final Instant instant;

    public final SearchMode mode;

    /** Null if the probe produced an accepted route. */
    public final ErrorKind error;

    public final Integer httpCode;

    /** True if the outcome came from the route cache or from a request already in flight. */
    public final boolean cacheHit;

    /** True if this probe belongs to the opposite-mode retry. */
    public final boolean fallback;

    /** Duration of the route found, null for failed probes. */
    public final Integer durationSeconds;

    public ProbeTrace (Instant instant, SearchMode mode, ErrorKind error, Integer httpCode, boolean cacheHit,
                       boolean fallback, Integer durationSeconds) {
        this.instant = instant;
        this.mode = mode;
        this.error = error;
        this.httpCode = httpCode;
        this.cacheHit = cacheHit;
        this.fallback = fallback;
        this.durationSeconds = durationSeconds;
    }

    /** "OK" or the name of the error kind. */
    public String status () {
        return error == null ? "OK" : error.name();
    }

    @Override
    public String toString () {
        return String.format("%s %s %s%s", instant, mode, status(), cacheHit ? " (cached)" : "");
    }
}
