package com.conveyal.sweep.api;

import java.time.Duration;
import java.time.Instant;

/**
 * A ride on a single transit vehicle between two stops.
 */
public class TransitLeg extends Leg {

    /** Short line name as shown to riders, e.g. "U1" or "RE 10". */
    public final String line;

    public final String agency;

    public final String fromName;

    public final String toName;

    /** Departure from the boarding stop, may be null if the upstream omitted it. */
    public final Instant depAt;

    /** Arrival at the alighting stop, may be null if the upstream omitted it. */
    public final Instant arrAt;

    public final ProductCategory productCategory;

    /** Platform or track at the boarding stop, only reported by some providers. */
    public final String platform;

    public TransitLeg (String line, String agency, String fromName, String toName, Instant depAt, Instant arrAt,
                       ProductCategory productCategory, String platform) {
        this.line = line;
        this.agency = agency;
        this.fromName = fromName;
        this.toName = toName;
        this.depAt = depAt;
        this.arrAt = arrAt;
        this.productCategory = productCategory == null ? ProductCategory.OTHER : productCategory;
        this.platform = platform;
    }

    @Override
    public Type type () {
        return Type.TRANSIT;
    }

    @Override
    public int durationSeconds () {
        if (depAt == null || arrAt == null) {
            return 0;
        }
        return (int) Math.max(0, Duration.between(depAt, arrAt).getSeconds());
    }

    @Override
    public String toString () {
        return String.format("%s %s %s -> %s", productCategory, line, fromName, toName);
    }
}
