package com.conveyal.sweep.controllers;

import com.conveyal.sweep.SweepServerException;
import com.conveyal.sweep.api.ErrorKind;
import com.conveyal.sweep.api.Leg;
import com.conveyal.sweep.api.Location;
import com.conveyal.sweep.api.NormalizedRoute;
import com.conveyal.sweep.api.PlanRequest;
import com.conveyal.sweep.api.PolicyFlag;
import com.conveyal.sweep.api.ProbeTrace;
import com.conveyal.sweep.api.ProductCategory;
import com.conveyal.sweep.api.ProviderName;
import com.conveyal.sweep.api.SearchMode;
import com.conveyal.sweep.api.SearchQuery;
import com.conveyal.sweep.api.SweepResult;
import com.conveyal.sweep.api.TransitLeg;
import com.conveyal.sweep.api.WalkLeg;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransitControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-06T08:00:00Z");

    private static final TransitController.Config CONFIG = new TransitController.Config() {
        @Override public String userLocation () { return "Pilotystraße 29, 90408 Nürnberg"; }
        @Override public int defaultWindowMinutes () { return 60; }
        @Override public int defaultStepMinutes () { return 10; }
    };

    private static PlanRequest parse (String... keysAndValues) {
        Map<String, String> params = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            params.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return TransitController.parseRequest(params::get, CONFIG, NOW);
    }

    @Test
    void legacyZielUsesConfiguredOrigin () {
        PlanRequest request = parse("ziel", "Erlangen", "arrival_time", "1714982400");
        assertEquals("Pilotystraße 29, 90408 Nürnberg", request.originText);
        assertEquals("Erlangen", request.destinationText);
        assertEquals(SearchMode.ARRIVE, request.mode);
        assertEquals(Instant.ofEpochSecond(1714982400), request.anchorInstant);
        assertEquals(ProviderName.GOOGLE, request.provider);
        assertEquals(60, request.windowMinutes);
        assertEquals(10, request.stepMinutes);
    }

    @Test
    void explicitParameters () {
        PlanRequest request = parse("origin", " Fürth Hbf ", "destination", "Erlangen", "departure_time", "now",
                "window", "-5", "step", "0", "country", "DE", "provider", "auto", "exclude", "local_ticket_only, NO_BUS");
        assertEquals("Fürth Hbf", request.originText);
        assertEquals(SearchMode.DEPART, request.mode);
        assertEquals(NOW, request.anchorInstant);
        assertEquals(0, request.windowMinutes);
        assertEquals(1, request.stepMinutes);
        assertEquals("de", request.country);
        assertEquals(ProviderName.AUTO, request.provider);
        assertEquals(Set.of(PolicyFlag.LOCAL_TICKET_ONLY, PolicyFlag.NO_BUS), request.policyFlags);
    }

    @Test
    void lenientTimesAndNumbers () {
        assertEquals(NOW, TransitController.parseTime("soon", NOW));
        assertEquals(NOW, TransitController.parseTime(null, NOW));
        assertEquals(NOW, TransitController.parseTime("NaN", NOW));
        assertEquals(Instant.ofEpochSecond(1714982400), TransitController.parseTime("1714982400.9", NOW));
        assertEquals(60, parse("destination", "Erlangen", "window", "lots").windowMinutes);
    }

    @Test
    void missingDestinationIsBadRequest () {
        SweepServerException e = assertThrows(SweepServerException.class, () -> parse("origin", "Fürth"));
        assertEquals(400, e.httpCode);
        assertEquals("destination/ziel missing", e.message);
    }

    @Test
    void unknownNamesAreBadRequests () {
        assertEquals(400, assertThrows(SweepServerException.class,
                () -> parse("destination", "Erlangen", "provider", "bahn")).httpCode);
        assertEquals(400, assertThrows(SweepServerException.class,
                () -> parse("destination", "Erlangen", "exclude", "NO_TRAINS")).httpCode);
    }

    @Test
    void rendersBestRoute () {
        PlanRequest request = parse("destination", "Erlangen", "departure_time", "1714982400", "window", "30");
        Location origin = new Location(49.4672, 11.0905, "Pilotystraße 29");
        Location destination = new Location(49.5958, 11.0019, "Erlangen");
        SearchQuery query = new SearchQuery(ProviderName.DB, origin, destination, SearchMode.DEPART,
                request.anchorInstant, 30, 10, Set.of());
        Instant dep = Instant.ofEpochSecond(1714983000);
        List<Leg> legs = List.of(
                new WalkLeg(240, -1),
                new TransitLeg("RE 10", "DB Regio", "Nürnberg Hbf", "Erlangen", dep, dep.plusSeconds(1020),
                        ProductCategory.REGIONAL_RAIL, "5")
        );
        NormalizedRoute best = NormalizedRoute.fromLegs(ProviderName.DB, null, dep.minusSeconds(240), null, legs);
        ProbeTrace chosen = new ProbeTrace(Instant.ofEpochSecond(1714982400 + 600), SearchMode.DEPART, null, null,
                true, true, best.durationSeconds);
        ProbeTrace failed = new ProbeTrace(Instant.ofEpochSecond(1714982400), SearchMode.ARRIVE,
                ErrorKind.UPSTREAM_HTTP_ERROR, 502, false, false, null);
        SweepResult result = SweepResult.ok(best, chosen, true, query, List.of(failed, chosen));

        ObjectNode body = TransitController.renderResult(request, result, true);
        assertEquals("OK", body.get("status").asText());
        assertEquals("db", body.get("provider").asText());
        assertEquals("Erlangen", body.get("destination").asText());
        assertEquals("depart", body.get("mode").asText());
        assertEquals(1714982400, body.get("requested_time").asLong());
        assertEquals(1714983000, body.get("chosen_time").asLong());
        assertEquals(1260, body.get("duration").asInt());
        assertEquals(21, body.get("duration_minutes").asInt());
        assertEquals(0, body.get("transfers").asInt());
        assertEquals(4, body.get("walk_minutes").asInt());
        assertEquals("fallback_to_opposite_mode", body.get("note").asText());

        JsonNode details = body.get("details");
        assertEquals(2, details.size());
        assertEquals("WALK", details.get(0).get("type").asText());
        assertTrue(details.get(0).get("distance_m").isNull());
        assertEquals("RE 10", details.get(1).get("line").asText());
        assertEquals("REGIONAL_RAIL", details.get(1).get("product").asText());
        assertEquals("5", details.get(1).get("platform").asText());

        JsonNode probed = body.get("probed");
        assertEquals(2, probed.size());
        assertEquals("UPSTREAM_HTTP_ERROR", probed.get(0).get("status").asText());
        assertEquals(502, probed.get(0).get("code").asInt());
        assertEquals("arrive", probed.get(0).get("mode").asText());
        assertTrue(probed.get(1).get("cached").asBoolean());
        assertTrue(probed.get(1).get("code").isNull());
    }

    @Test
    void rendersFailures () {
        PlanRequest request = parse("destination", "Atlantis");
        SweepResult geocodeFailed = SweepResult.geocodeFailed("Geocoding failed (origin: OK, destination: ZERO_RESULTS)");
        ObjectNode body = TransitController.renderResult(request, geocodeFailed, false);
        assertEquals("GEOCODE_FAILED", body.get("status").asText());
        assertEquals("Geocoding failed", body.get("message").asText());
        assertTrue(body.get("detail").asText().contains("ZERO_RESULTS"));
        assertFalse(body.has("probed"));

        SearchQuery query = new SearchQuery(ProviderName.GOOGLE, new Location(1, 2, "a"), new Location(3, 4, "b"),
                SearchMode.DEPART, NOW, 0, 1, Set.of());
        ObjectNode empty = TransitController.renderResult(request, SweepResult.empty(query, List.of()), true);
        assertEquals("SWEEP_EMPTY", empty.get("status").asText());
        assertEquals("No routes in window", empty.get("message").asText());
        assertEquals(0, empty.get("probed").size());
    }

}
