package com.conveyal.sweep.sweep;

import com.conveyal.sweep.api.NormalizedRoute;
import com.google.common.collect.ComparisonChain;

import java.util.Comparator;
import java.util.List;

/**
 * Orders routes from best to worst: shortest duration first, then fewest transfers, then least walking.
 * Among routes that compare equal the earliest one in the input wins, so the outcome does not depend on the order in
 * which probes completed as long as the input is in candidate order.
 */
public class SelectionPolicy {

    public static final Comparator<NormalizedRoute> ORDER = (a, b) -> ComparisonChain.start()
            .compare(a.durationSeconds, b.durationSeconds)
            .compare(a.transferCount, b.transferCount)
            .compare(a.walkSeconds, b.walkSeconds)
            .result();

    /** @return the best route, or null if there are none. */
    public NormalizedRoute selectBest (List<NormalizedRoute> routes) {
        int index = indexOfBest(routes);
        return index < 0 ? null : routes.get(index);
    }

    /** @return the position of the best route in the list, or -1 if the list is empty. */
    public int indexOfBest (List<NormalizedRoute> routes) {
        int best = -1;
        for (int i = 0; i < routes.size(); i++) {
            if (best < 0 || ORDER.compare(routes.get(i), routes.get(best)) < 0) {
                best = i;
            }
        }
        return best;
    }

}
