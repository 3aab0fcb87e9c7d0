package com.conveyal.sweep.api;

/**
 * One piece of a NormalizedRoute: either a ride on a transit vehicle or a walk.
 */
public abstract class Leg {

    public enum Type {
        TRANSIT,
        WALK
    }

    public abstract Type type ();

    /** Seconds spent on this leg, or zero when the upstream did not report enough to compute it. */
    public abstract int durationSeconds ();

}
