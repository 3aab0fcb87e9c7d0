package com.conveyal.sweep.sweep;

import com.conveyal.sweep.api.SearchMode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Turns a search window into the list of instants at which the upstream will be asked for a route.
 * For ARRIVE the window extends backward from the anchor, for DEPART it extends forward. Instants are spaced by the
 * step and ordered by ascending offset from the start of the window. The number of instants never exceeds a hard
 * cap, which bounds upstream load and sweep latency whatever window and step a client asks for: if the requested
 * step would produce too many instants it is widened to the smallest step that fits under the cap.
 */
public class CandidateTimeGenerator {

    public static final int DEFAULT_MAX_CANDIDATES = 8;

    private final int maxCandidates;

    public CandidateTimeGenerator (int maxCandidates) {
        checkArgument(maxCandidates >= 1, "At least one candidate must be allowed.");
        this.maxCandidates = maxCandidates;
    }

    public CandidateTimeGenerator () {
        this(DEFAULT_MAX_CANDIDATES);
    }

    public int maxCandidates () {
        return maxCandidates;
    }

    /**
     * The step actually used for the given window. With step s the window yields floor(window / s) + 1 instants,
     * which fits under the cap exactly when s > window / cap.
     */
    public int effectiveStepMinutes (int windowMinutes, int stepMinutes) {
        long naiveCount = (long) windowMinutes / stepMinutes + 1;
        if (naiveCount <= maxCandidates) {
            return stepMinutes;
        }
        return Math.max(stepMinutes, windowMinutes / maxCandidates + 1);
    }

    public List<Instant> candidates (Instant anchor, int windowMinutes, int stepMinutes, SearchMode mode) {
        checkArgument(windowMinutes >= 0, "Window must not be negative: %s", windowMinutes);
        checkArgument(stepMinutes >= 1, "Step must be at least one minute: %s", stepMinutes);
        int step = effectiveStepMinutes(windowMinutes, stepMinutes);
        int startOffset = mode == SearchMode.ARRIVE ? -windowMinutes : 0;
        int endOffset = mode == SearchMode.ARRIVE ? 0 : windowMinutes;
        List<Instant> candidates = new ArrayList<>();
        for (int offset = startOffset; offset <= endOffset && candidates.size() < maxCandidates; offset += step) {
            candidates.add(anchor.plusSeconds(offset * 60L));
        }
        if (candidates.isEmpty()) {
            candidates.add(anchor);
        }
        return candidates;
    }

}
