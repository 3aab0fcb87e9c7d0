package com.conveyal.sweep.sweep;

import com.conveyal.sweep.api.Leg;
import com.conveyal.sweep.api.NormalizedRoute;
import com.conveyal.sweep.api.PolicyFlag;
import com.conveyal.sweep.api.ProductCategory;
import com.conveyal.sweep.api.TransitLeg;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a route is usable under the ticket rules a caller asked for. Each PolicyFlag excludes a set of
 * product categories, and a route is rejected if any of its transit legs uses an excluded category. Works on
 * normalized routes only, so the same rules apply whichever provider produced the route.
 */
public class FilterPolicy {

    /** Exclusions used when configuration does not override them. */
    public static final Map<PolicyFlag, Set<ProductCategory>> DEFAULT_EXCLUSIONS = ImmutableMap.of(
            PolicyFlag.LOCAL_TICKET_ONLY, Sets.immutableEnumSet(ProductCategory.LONG_DISTANCE_RAIL),
            PolicyFlag.NO_BUS, Sets.immutableEnumSet(ProductCategory.BUS),
            PolicyFlag.NO_FERRY, Sets.immutableEnumSet(ProductCategory.FERRY)
    );

    private final Map<PolicyFlag, Set<ProductCategory>> exclusions;

    public FilterPolicy (Map<PolicyFlag, Set<ProductCategory>> exclusions) {
        this.exclusions = ImmutableMap.copyOf(exclusions);
    }

    public FilterPolicy () {
        this(DEFAULT_EXCLUSIONS);
    }

    /** The union of the categories excluded by all the given flags. */
    public Set<ProductCategory> excludedCategories (Set<PolicyFlag> flags) {
        Set<ProductCategory> excluded = EnumSet.noneOf(ProductCategory.class);
        for (PolicyFlag flag : flags) {
            Set<ProductCategory> categories = exclusions.get(flag);
            if (categories != null) {
                excluded.addAll(categories);
            }
        }
        return excluded;
    }

    public boolean accepts (NormalizedRoute route, Set<PolicyFlag> flags) {
        return firstExcludedLeg(route, flags) == null;
    }

    /** The first transit leg that makes the route unacceptable, or null if the route is acceptable. */
    public TransitLeg firstExcludedLeg (NormalizedRoute route, Set<PolicyFlag> flags) {
        if (flags.isEmpty()) {
            return null;
        }
        Set<ProductCategory> excluded = excludedCategories(flags);
        for (Leg leg : route.legs) {
            if (leg instanceof TransitLeg && excluded.contains(((TransitLeg) leg).productCategory)) {
                return (TransitLeg) leg;
            }
        }
        return null;
    }

}
