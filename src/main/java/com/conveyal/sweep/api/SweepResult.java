package com.conveyal.sweep.api;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The result of one sweep. Always produced, never thrown: failures are expressed through the status field. The probe
 * trace covers every candidate of the primary sweep and of the fallback sweep if one was run.
 */
public class SweepResult {

    public final SweepStatus status;

    /** The selected route, null unless status is OK. */
    public final NormalizedRoute best;

    /** Candidate instant at which the best route was requested, null unless status is OK. */
    public final ProbeTrace chosen;

    /** True when the best route was only found by retrying with the opposite search mode. */
    public final boolean fallback;

    public final Location origin;

    public final Location destination;

    public final List<ProbeTrace> probeTrace;

    /** Explanation for non-OK results, e.g. which endpoint failed to geocode. */
    public final String message;

    private SweepResult (SweepStatus status, NormalizedRoute best, ProbeTrace chosen, boolean fallback,
                         Location origin, Location destination, List<ProbeTrace> probeTrace, String message) {
        this.status = status;
        this.best = best;
        this.chosen = chosen;
        this.fallback = fallback;
        this.origin = origin;
        this.destination = destination;
        this.probeTrace = ImmutableList.copyOf(probeTrace);
        this.message = message;
    }

    public static SweepResult ok (NormalizedRoute best, ProbeTrace chosen, boolean fallback, SearchQuery query,
                                  List<ProbeTrace> trace) {
        return new SweepResult(SweepStatus.OK, best, chosen, fallback, query.origin, query.destination, trace, null);
    }

    public static SweepResult empty (SearchQuery query, List<ProbeTrace> trace) {
        return empty(query, trace, "No routes in window");
    }

    public static SweepResult empty (SearchQuery query, List<ProbeTrace> trace, String message) {
        return new SweepResult(SweepStatus.SWEEP_EMPTY, null, null, false, query.origin, query.destination, trace,
                message);
    }

    public static SweepResult geocodeFailed (String message) {
        return new SweepResult(SweepStatus.GEOCODE_FAILED, null, null, false, null, null, ImmutableList.of(), message);
    }

    public boolean isOk () {
        return status == SweepStatus.OK;
    }

    @Override
    public String toString () {
        return isOk() ? String.format("%s %s%s", status, best, fallback ? " (fallback)" : "") : status.toString();
    }
}
