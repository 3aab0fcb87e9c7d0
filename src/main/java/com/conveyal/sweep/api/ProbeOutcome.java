package com.conveyal.sweep.api;

import com.google.common.base.Preconditions;

/**
 * The result of asking a route provider for one candidate instant: either a NormalizedRoute or an error kind, never
 * both. Callers must check isOk() before calling route(), which throws on failed outcomes so a value can't be read
 * out of an error by accident. Outcomes are immutable, and are stored in the route cache as-is.
 */
public class ProbeOutcome {

    private final NormalizedRoute route;

    private final ErrorKind error;

    /** HTTP status returned by the upstream for UPSTREAM_HTTP_ERROR outcomes, null if there was no response at all. */
    public final Integer httpCode;

    /** Short diagnostic text for failed outcomes. */
    public final String message;

    private ProbeOutcome (NormalizedRoute route, ErrorKind error, Integer httpCode, String message) {
        this.route = route;
        this.error = error;
        this.httpCode = httpCode;
        this.message = message;
    }

    public static ProbeOutcome ok (NormalizedRoute route) {
        Preconditions.checkNotNull(route);
        return new ProbeOutcome(route, null, null, null);
    }

    public static ProbeOutcome httpError (Integer httpCode, String message) {
        return new ProbeOutcome(null, ErrorKind.UPSTREAM_HTTP_ERROR, httpCode, message);
    }

    public static ProbeOutcome zeroResults (String message) {
        return new ProbeOutcome(null, ErrorKind.ZERO_RESULTS, null, message);
    }

    /** Wrap a computed route that a filter policy refused. The route itself is dropped. */
    public static ProbeOutcome policyRejected (String message) {
        return new ProbeOutcome(null, ErrorKind.POLICY_REJECTED, null, message);
    }

    public boolean isOk () {
        return route != null;
    }

    public NormalizedRoute route () {
        if (route == null) {
            throw new IllegalStateException("No route in failed outcome " + error);
        }
        return route;
    }

    /** The reason this outcome failed, or null if it holds a route. */
    public ErrorKind error () {
        return error;
    }

    @Override
    public String toString () {
        if (isOk()) {
            return "OK " + route;
        }
        return httpCode == null ? error.toString() : error + " " + httpCode;
    }
}
