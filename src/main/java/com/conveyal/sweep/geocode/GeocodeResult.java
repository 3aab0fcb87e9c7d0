package com.conveyal.sweep.geocode;

import com.conveyal.sweep.api.Location;

/**
 * Either a resolved Location or the reason why the text could not be resolved.
 */
public class GeocodeResult {

    public final boolean ok;

    /** Null unless ok. */
    public final Location location;

    /** Upstream status or local reason for failures, e.g. ZERO_RESULTS or REQUEST_DENIED. Null when ok. */
    public final String reason;

    public final String message;

    private GeocodeResult (boolean ok, Location location, String reason, String message) {
        this.ok = ok;
        this.location = location;
        this.reason = reason;
        this.message = message;
    }

    public static GeocodeResult ok (Location location) {
        return new GeocodeResult(true, location, null, null);
    }

    public static GeocodeResult failed (String reason, String message) {
        return new GeocodeResult(false, null, reason, message);
    }

    @Override
    public String toString () {
        return ok ? "OK " + location : reason + (message == null ? "" : ": " + message);
    }
}
