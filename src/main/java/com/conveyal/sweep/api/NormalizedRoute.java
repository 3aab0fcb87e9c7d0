package com.conveyal.sweep.api;

import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * The canonical, provider-independent result of one routing query. Sweep and selection logic only ever look at this
 * type, never at raw upstream responses. Instances are immutable.
 */
public class NormalizedRoute {

    public final ProviderName provider;

    /**
     * Total door-to-door travel time in seconds. Zero when nothing in the upstream reply allowed deriving it, see
     * {@link #hasUsableDuration()}.
     */
    public final int durationSeconds;

    /** Number of changes between transit vehicles, zero for a direct ride or a walk-only route. */
    public final int transferCount;

    /** Total seconds spent walking. */
    public final int walkSeconds;

    public final Instant departAt;

    public final Instant arriveAt;

    public final List<Leg> legs;

    public NormalizedRoute (ProviderName provider, int durationSeconds, int transferCount, int walkSeconds,
                            Instant departAt, Instant arriveAt, List<Leg> legs) {
        this.provider = provider;
        this.durationSeconds = durationSeconds;
        this.transferCount = transferCount;
        this.walkSeconds = walkSeconds;
        this.departAt = departAt;
        this.arriveAt = arriveAt;
        this.legs = ImmutableList.copyOf(legs);
    }

    /**
     * Build a route from its legs, deriving the summary figures. The upstream-reported total duration is used when it
     * is positive. Otherwise the duration is the span from the earliest known departure to the latest known arrival,
     * and failing that the sum of the leg durations.
     *
     * @param reportedDurationSeconds the total reported by the upstream, null if absent
     * @param departAt overall departure reported by the upstream, null to derive it from the legs
     * @param arriveAt overall arrival reported by the upstream, null to derive it from the legs
     */
    public static NormalizedRoute fromLegs (ProviderName provider, Integer reportedDurationSeconds, Instant departAt,
                                            Instant arriveAt, List<Leg> legs) {
        int transitLegs = 0;
        int walkSeconds = 0;
        int legSeconds = 0;
        Instant earliest = departAt;
        Instant latest = arriveAt;
        for (Leg leg : legs) {
            legSeconds += leg.durationSeconds();
            if (leg instanceof TransitLeg) {
                TransitLeg transitLeg = (TransitLeg) leg;
                transitLegs += 1;
                if (transitLeg.depAt != null && (earliest == null || transitLeg.depAt.isBefore(earliest))) {
                    earliest = transitLeg.depAt;
                }
                if (transitLeg.arrAt != null && (latest == null || transitLeg.arrAt.isAfter(latest))) {
                    latest = transitLeg.arrAt;
                }
            } else {
                walkSeconds += leg.durationSeconds();
            }
        }
        int duration;
        if (reportedDurationSeconds != null && reportedDurationSeconds > 0) {
            duration = reportedDurationSeconds;
        } else if (earliest != null && latest != null && latest.isAfter(earliest)) {
            duration = (int) Duration.between(earliest, latest).getSeconds();
        } else {
            duration = legSeconds;
        }
        int transfers = Math.max(0, transitLegs - 1);
        return new NormalizedRoute(provider, duration, transfers, walkSeconds, earliest, latest, legs);
    }

    /** False when the duration could not be derived. Adapters report such replies as zero results. */
    public boolean hasUsableDuration () {
        return durationSeconds > 0;
    }

    @Override
    public String toString () {
        return String.format("%s route %ds, %d transfers, %ds walking", provider, durationSeconds, transferCount,
                walkSeconds);
    }
}
