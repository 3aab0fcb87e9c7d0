package com.conveyal.sweep.controllers;

import com.conveyal.sweep.SweepServerException;
import com.conveyal.sweep.api.Leg;
import com.conveyal.sweep.api.NormalizedRoute;
import com.conveyal.sweep.api.PlanRequest;
import com.conveyal.sweep.api.PolicyFlag;
import com.conveyal.sweep.api.ProbeTrace;
import com.conveyal.sweep.api.ProviderName;
import com.conveyal.sweep.api.SearchMode;
import com.conveyal.sweep.api.SweepResult;
import com.conveyal.sweep.api.SweepStatus;
import com.conveyal.sweep.api.TransitLeg;
import com.conveyal.sweep.api.WalkLeg;
import com.conveyal.sweep.sweep.TransitSweepService;
import com.conveyal.sweep.util.JsonUtil;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Splitter;
import spark.Request;
import spark.Response;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * The /transit endpoint: sweeps a time window for the best public transport route between two addresses.
 *
 * /transit?origin=...&destination=...&arrival_time=UNIX | departure_time=UNIX
 *          &window=90&step=10&country=de&provider=google|db|auto&exclude=LOCAL_TICKET_ONLY&debug=1
 *
 * The legacy form ?ziel=... is still accepted, in which case the origin is the configured user location.
 */
public class TransitController implements HttpController {

    public interface Config {
        String userLocation ();
        int defaultWindowMinutes ();
        int defaultStepMinutes ();
    }

    private final TransitSweepService sweepService;

    private final Config config;

    public TransitController (TransitSweepService sweepService, Config config) {
        this.sweepService = sweepService;
        this.config = config;
    }

    @Override
    public void registerEndpoints (spark.Service sparkService) {
        sparkService.get("/transit", this::getTransit, JsonUtil.toJson);
    }

    private ObjectNode getTransit (Request req, Response res) {
        PlanRequest planRequest = parseRequest(req::queryParams, config, Instant.now());
        boolean debug = "1".equals(req.queryParams("debug"));
        SweepResult result = sweepService.plan(planRequest);
        if (!result.isOk()) {
            res.status(502);
        }
        return renderResult(planRequest, result, debug);
    }

    /** Build a PlanRequest from query parameters. Lenient about times and numbers, strict about names. */
    static PlanRequest parseRequest (Function<String, String> params, Config config, Instant now) {
        String legacyDestination = trimToEmpty(params.apply("ziel"));
        String origin = trimToEmpty(params.apply("origin"));
        if (origin.isEmpty()) {
            origin = config.userLocation();
        }
        String destination = trimToEmpty(params.apply("destination"));
        if (destination.isEmpty()) {
            destination = legacyDestination;
        }
        if (destination.isEmpty()) {
            throw SweepServerException.badRequest("destination/ziel missing");
        }
        ProviderName provider;
        try {
            provider = ProviderName.fromParam(params.apply("provider"));
        } catch (IllegalArgumentException e) {
            throw SweepServerException.badRequest("Unknown provider: " + params.apply("provider"));
        }
        SearchMode mode;
        Instant anchor;
        if (params.apply("arrival_time") != null) {
            mode = SearchMode.ARRIVE;
            anchor = parseTime(params.apply("arrival_time"), now);
        } else {
            mode = SearchMode.DEPART;
            anchor = parseTime(params.apply("departure_time"), now);
        }
        int window = Math.max(0, parseIntOr(params.apply("window"), config.defaultWindowMinutes()));
        int step = Math.max(1, parseIntOr(params.apply("step"), config.defaultStepMinutes()));
        String country = trimToEmpty(params.apply("country")).toLowerCase(Locale.ROOT);
        Set<PolicyFlag> flags = parseFlags(params.apply("exclude"));
        return new PlanRequest(origin, destination, provider, mode, anchor, window, step, country, flags);
    }

    /** Epoch seconds, or "now". Anything unparseable also means now. */
    static Instant parseTime (String value, Instant now) {
        if (value == null) {
            return now;
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        try {
            double seconds = Double.parseDouble(trimmed);
            return Double.isFinite(seconds) ? Instant.ofEpochSecond((long) Math.floor(seconds)) : now;
        } catch (NumberFormatException e) {
            return now;
        }
    }

    private static int parseIntOr (String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Set<PolicyFlag> parseFlags (String value) {
        Set<PolicyFlag> flags = EnumSet.noneOf(PolicyFlag.class);
        if (value == null) {
            return flags;
        }
        for (String name : Splitter.on(',').trimResults().omitEmptyStrings().split(value)) {
            try {
                flags.add(PolicyFlag.valueOf(name.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw SweepServerException.badRequest("Unknown policy flag: " + name);
            }
        }
        return flags;
    }

    private static String trimToEmpty (String s) {
        return s == null ? "" : s.trim();
    }

    /** Shape a SweepResult into the JSON body clients of this endpoint expect. */
    static ObjectNode renderResult (PlanRequest request, SweepResult result, boolean debug) {
        ObjectNode body = JsonUtil.objectNode();
        if (!result.isOk()) {
            body.put("status", result.status.toString());
            body.put("message", result.status == SweepStatus.GEOCODE_FAILED ? "Geocoding failed" : result.message);
            if (result.status == SweepStatus.GEOCODE_FAILED) {
                body.put("detail", result.message);
            }
            if (debug) {
                body.set("probed", renderTrace(result));
            }
            return body;
        }
        NormalizedRoute best = result.best;
        body.put("status", "OK");
        body.put("provider", best.provider.paramValue());
        body.put("origin", result.origin.label);
        body.put("destination", result.destination.label);
        body.put("mode", request.mode.toString().toLowerCase(Locale.ROOT));
        body.put("requested_time", request.anchorInstant.getEpochSecond());
        body.put("chosen_time", result.chosen.instant.getEpochSecond());
        body.put("duration", best.durationSeconds);
        body.put("duration_minutes", Math.round(best.durationSeconds / 60.0));
        body.put("transfers", best.transferCount);
        body.put("walk_minutes", Math.round(best.walkSeconds / 60.0));
        putEpoch(body, "depart", best.departAt);
        putEpoch(body, "arrive", best.arriveAt);
        ArrayNode details = body.putArray("details");
        for (Leg leg : best.legs) {
            details.add(renderLeg(leg));
        }
        if (result.fallback) {
            body.put("note", "fallback_to_opposite_mode");
        }
        if (debug) {
            body.set("probed", renderTrace(result));
        }
        return body;
    }

    private static ObjectNode renderLeg (Leg leg) {
        ObjectNode node = JsonUtil.objectNode();
        node.put("type", leg.type().toString());
        if (leg instanceof TransitLeg) {
            TransitLeg transit = (TransitLeg) leg;
            node.put("line", transit.line);
            node.put("agency", transit.agency);
            node.put("from", transit.fromName);
            node.put("to", transit.toName);
            putEpoch(node, "dep", transit.depAt);
            putEpoch(node, "arr", transit.arrAt);
            node.put("product", transit.productCategory.toString());
            node.put("platform", transit.platform);
        } else {
            WalkLeg walk = (WalkLeg) leg;
            node.put("duration_sec", walk.durationSeconds);
            if (walk.distanceMeters >= 0) {
                node.put("distance_m", walk.distanceMeters);
            } else {
                node.putNull("distance_m");
            }
        }
        return node;
    }

    private static ArrayNode renderTrace (SweepResult result) {
        ArrayNode probed = JsonUtil.objectMapper.createArrayNode();
        for (ProbeTrace probe : result.probeTrace) {
            ObjectNode node = probed.addObject();
            node.put("ts", probe.instant.getEpochSecond());
            node.put("mode", probe.mode.toString().toLowerCase(Locale.ROOT));
            node.put("status", probe.status());
            if (probe.httpCode != null) {
                node.put("code", probe.httpCode);
            } else {
                node.putNull("code");
            }
            node.put("cached", probe.cacheHit);
            node.put("fallback", probe.fallback);
        }
        return probed;
    }

    private static void putEpoch (ObjectNode node, String field, Instant instant) {
        if (instant == null) {
            node.putNull(field);
        } else {
            node.put(field, instant.getEpochSecond());
        }
    }

}
