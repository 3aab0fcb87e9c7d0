package com.conveyal.sweep.api;

/**
 * A walk between stops, or from the origin / to the destination.
 */
public class WalkLeg extends Leg {

    public final int durationSeconds;

    /** Walked distance in meters, or -1 when unknown. */
    public final int distanceMeters;

    public WalkLeg (int durationSeconds, int distanceMeters) {
        this.durationSeconds = Math.max(0, durationSeconds);
        this.distanceMeters = distanceMeters;
    }

    @Override
    public Type type () {
        return Type.WALK;
    }

    @Override
    public int durationSeconds () {
        return durationSeconds;
    }

    @Override
    public String toString () {
        return String.format("WALK %ds %dm", durationSeconds, distanceMeters);
    }
}
