package com.conveyal.sweep.sweep;

import com.conveyal.sweep.api.NormalizedRoute;
import com.conveyal.sweep.api.PolicyFlag;
import com.conveyal.sweep.api.ProductCategory;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static com.conveyal.sweep.api.RouteFixtures.route;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilterPolicyTest {

    private final FilterPolicy filterPolicy = new FilterPolicy();

    @Test
    void noFlagsAcceptsEverything () {
        NormalizedRoute ice = route(3600, 0, 0, ProductCategory.LONG_DISTANCE_RAIL);
        assertTrue(filterPolicy.accepts(ice, Set.of()));
    }

    @Test
    void localTicketRejectsLongDistanceLegs () {
        Set<PolicyFlag> localTicket = Set.of(PolicyFlag.LOCAL_TICKET_ONLY);
        NormalizedRoute mixed = route(3600, 1, 0, ProductCategory.REGIONAL_RAIL, ProductCategory.LONG_DISTANCE_RAIL);
        NormalizedRoute regional = route(4200, 1, 0, ProductCategory.SUBURBAN_RAIL, ProductCategory.REGIONAL_RAIL);
        assertFalse(filterPolicy.accepts(mixed, localTicket));
        assertEquals(ProductCategory.LONG_DISTANCE_RAIL,
                filterPolicy.firstExcludedLeg(mixed, localTicket).productCategory);
        assertTrue(filterPolicy.accepts(regional, localTicket));
        assertNull(filterPolicy.firstExcludedLeg(regional, localTicket));
    }

    @Test
    void flagsCombine () {
        assertEquals(EnumSet.of(ProductCategory.BUS, ProductCategory.FERRY),
                filterPolicy.excludedCategories(EnumSet.of(PolicyFlag.NO_BUS, PolicyFlag.NO_FERRY)));
        NormalizedRoute bus = route(900, 0, 0, ProductCategory.BUS);
        assertFalse(filterPolicy.accepts(bus, EnumSet.of(PolicyFlag.NO_BUS, PolicyFlag.NO_FERRY)));
        assertTrue(filterPolicy.accepts(bus, EnumSet.of(PolicyFlag.LOCAL_TICKET_ONLY)));
    }

    @Test
    void walkOnlyRouteIsAlwaysAccepted () {
        NormalizedRoute walk = route(1200, 0, 1200);
        assertTrue(filterPolicy.accepts(walk, EnumSet.allOf(PolicyFlag.class)));
    }

    @Test
    void configuredExclusionsReplaceDefaults () {
        FilterPolicy strict = new FilterPolicy(ImmutableMap.of(
                PolicyFlag.LOCAL_TICKET_ONLY, EnumSet.of(ProductCategory.LONG_DISTANCE_RAIL, ProductCategory.TAXI)
        ));
        NormalizedRoute taxi = route(900, 0, 0, ProductCategory.TAXI);
        assertFalse(strict.accepts(taxi, Set.of(PolicyFlag.LOCAL_TICKET_ONLY)));
        // Flags without a configured exclusion exclude nothing.
        assertTrue(strict.accepts(route(900, 0, 0, ProductCategory.BUS), Set.of(PolicyFlag.NO_BUS)));
    }

}
