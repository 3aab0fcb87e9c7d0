package com.conveyal.sweep.provider;

import com.conveyal.sweep.api.Leg;
import com.conveyal.sweep.api.Location;
import com.conveyal.sweep.api.NormalizedRoute;
import com.conveyal.sweep.api.ProbeOutcome;
import com.conveyal.sweep.api.ProductCategory;
import com.conveyal.sweep.api.ProviderName;
import com.conveyal.sweep.api.SearchMode;
import com.conveyal.sweep.api.TransitLeg;
import com.conveyal.sweep.api.WalkLeg;
import com.conveyal.sweep.upstream.UpstreamClient;
import com.conveyal.sweep.upstream.UpstreamResponse;
import com.conveyal.sweep.util.DurationParser;
import com.conveyal.sweep.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Route provider backed by the Google Directions API in transit mode. Only the first leg of the first route is used:
 * without waypoints Google returns a single leg covering the whole trip, broken down into WALKING and TRANSIT steps.
 */
public class GoogleDirectionsProvider implements RouteProvider {

    private static final Logger LOG = LoggerFactory.getLogger(GoogleDirectionsProvider.class);

    public static final String DIRECTIONS_URL = "https://maps.googleapis.com/maps/api/directions/json";

    private final UpstreamClient client;

    private final String apiKey;

    public GoogleDirectionsProvider (UpstreamClient client, String apiKey) {
        this.client = client;
        this.apiKey = apiKey;
    }

    @Override
    public ProviderName name () {
        return ProviderName.GOOGLE;
    }

    @Override
    public boolean isEnabled () {
        return apiKey != null && !apiKey.isBlank();
    }

    /** Google accepts a place id prefixed with "place_id:" wherever it accepts an address or coordinates. */
    static String placeParam (Location location) {
        if (location.id != null) {
            return "place_id:" + location.id;
        }
        return String.format(Locale.ROOT, "%.6f,%.6f", location.lat, location.lng);
    }

    @Override
    public ProbeOutcome query (Location origin, Location destination, Instant instant, SearchMode mode)
            throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("origin", placeParam(origin));
        params.put("destination", placeParam(destination));
        params.put("mode", "transit");
        params.put("key", apiKey);
        String timeParam = mode == SearchMode.ARRIVE ? "arrival_time" : "departure_time";
        params.put(timeParam, Long.toString(instant.getEpochSecond()));
        UpstreamResponse response = client.get(DIRECTIONS_URL, params);
        if (!response.isSuccess()) {
            LOG.warn("Google directions returned {} for {} {}.", response.status, mode, instant);
            return ProbeOutcome.httpError(response.status, null);
        }
        return normalize(JsonUtil.readTree(response.body));
    }

    /** Turn a Directions API response body into an outcome. Package-private for tests. */
    static ProbeOutcome normalize (JsonNode root) {
        JsonNode leg = root.path("routes").path(0).path("legs").path(0);
        if (leg.isMissingNode()) {
            return ProbeOutcome.zeroResults(JsonUtil.text(root, "/status"));
        }
        List<Leg> legs = new ArrayList<>();
        for (JsonNode step : leg.path("steps")) {
            String travelMode = JsonUtil.text(step, "/travel_mode");
            if ("TRANSIT".equals(travelMode)) {
                legs.add(transitLeg(step.path("transit_details")));
            } else if ("WALKING".equals(travelMode)) {
                JsonNode distance = step.at("/distance/value");
                legs.add(new WalkLeg(orZero(DurationParser.seconds(step.at("/duration/value"))),
                        distance.isNumber() ? distance.asInt() : -1));
            }
        }
        NormalizedRoute route = NormalizedRoute.fromLegs(
                ProviderName.GOOGLE,
                DurationParser.seconds(leg.at("/duration/value")),
                epochSeconds(leg.at("/departure_time/value")),
                epochSeconds(leg.at("/arrival_time/value")),
                legs
        );
        if (!route.hasUsableDuration()) {
            return ProbeOutcome.zeroResults("Route without usable duration");
        }
        return ProbeOutcome.ok(route);
    }

    private static TransitLeg transitLeg (JsonNode details) {
        String line = JsonUtil.firstText(details, "/line/short_name", "/line/name");
        return new TransitLeg(
                line == null ? "" : line,
                JsonUtil.text(details, "/line/agencies/0/name"),
                JsonUtil.text(details, "/departure_stop/name"),
                JsonUtil.text(details, "/arrival_stop/name"),
                epochSeconds(details.at("/departure_time/value")),
                epochSeconds(details.at("/arrival_time/value")),
                productCategory(JsonUtil.text(details, "/line/vehicle/type")),
                null
        );
    }

    /** Map a Google vehicle type, see https://developers.google.com/maps/documentation/directions/get-directions */
    static ProductCategory productCategory (String vehicleType) {
        if (vehicleType == null) {
            return ProductCategory.OTHER;
        }
        switch (vehicleType) {
            case "HIGH_SPEED_TRAIN":
            case "LONG_DISTANCE_TRAIN":
                return ProductCategory.LONG_DISTANCE_RAIL;
            case "RAIL":
            case "HEAVY_RAIL":
                return ProductCategory.REGIONAL_RAIL;
            case "COMMUTER_TRAIN":
                return ProductCategory.SUBURBAN_RAIL;
            case "METRO_RAIL":
            case "SUBWAY":
                return ProductCategory.SUBWAY;
            case "TRAM":
            case "MONORAIL":
                return ProductCategory.TRAM;
            case "BUS":
            case "INTERCITY_BUS":
            case "TROLLEYBUS":
                return ProductCategory.BUS;
            case "FERRY":
                return ProductCategory.FERRY;
            case "CABLE_CAR":
            case "GONDOLA_LIFT":
            case "FUNICULAR":
                return ProductCategory.CABLE;
            case "SHARE_TAXI":
                return ProductCategory.TAXI;
            default:
                return ProductCategory.OTHER;
        }
    }

    private static Instant epochSeconds (JsonNode node) {
        return node.isNumber() ? Instant.ofEpochSecond(node.asLong()) : null;
    }

    private static int orZero (Integer value) {
        return value == null ? 0 : value;
    }

}
