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
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Route provider for Deutsche Bahn journeys through a transport.rest (HAFAS) instance such as v6.db.transport.rest.
 * Requests a single journey. Switched off by configuration, as public instances are often unavailable.
 */
public class TransportRestProvider implements RouteProvider {

    private static final Logger LOG = LoggerFactory.getLogger(TransportRestProvider.class);

    private final UpstreamClient client;

    private final String baseUrl;

    private final boolean enabled;

    public TransportRestProvider (UpstreamClient client, String baseUrl, boolean enabled) {
        this.client = client;
        this.baseUrl = baseUrl;
        this.enabled = enabled;
    }

    @Override
    public ProviderName name () {
        return ProviderName.DB;
    }

    @Override
    public boolean isEnabled () {
        return enabled;
    }

    @Override
    public ProbeOutcome query (Location origin, Location destination, Instant instant, SearchMode mode)
            throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        addPlaceParams(params, "from", origin);
        addPlaceParams(params, "to", destination);
        // HAFAS expects the journey time as ISO 8601, without sub-second precision.
        params.put("when", Instant.ofEpochSecond(instant.getEpochSecond()).toString());
        params.put("results", "1");
        params.put("stopovers", "true");
        params.put("remarks", "false");
        params.put("polylines", "false");
        if (mode == SearchMode.ARRIVE) {
            params.put("arrival", "true");
        }
        UpstreamResponse response = client.get(baseUrl + "/journeys", params);
        if (!response.isSuccess()) {
            LOG.warn("transport.rest journeys returned {} for {} {}.", response.status, mode, instant);
            return ProbeOutcome.httpError(response.status, response.body);
        }
        return normalize(JsonUtil.readTree(response.body));
    }

    /** Stops and stations are referred to by id, anything else by its coordinates. */
    private static void addPlaceParams (Map<String, String> params, String prefix, Location location) {
        if (location.id != null) {
            params.put(prefix, location.id);
        } else {
            params.put(prefix + ".latitude", String.format(Locale.ROOT, "%.6f", location.lat));
            params.put(prefix + ".longitude", String.format(Locale.ROOT, "%.6f", location.lng));
            if (location.label != null) {
                params.put(prefix + ".address", location.label);
            }
        }
    }

    /** Turn a journeys response body into an outcome. Package-private for tests. */
    static ProbeOutcome normalize (JsonNode root) {
        JsonNode journey = root.path("journeys").path(0);
        if (journey.isMissingNode()) {
            return ProbeOutcome.zeroResults(null);
        }
        List<Leg> legs = new ArrayList<>();
        for (JsonNode leg : journey.path("legs")) {
            legs.add(isWalking(leg) ? walkLeg(leg) : transitLeg(leg));
        }
        // Journeys usually carry no overall times, the first and last legs (possibly walks) bound the trip.
        JsonNode journeyLegs = journey.path("legs");
        String departure = JsonUtil.firstText(journey, "/departure", "/legs/0/departure");
        String arrival = JsonUtil.firstText(journey, "/arrival", "/legs/" + (journeyLegs.size() - 1) + "/arrival");
        NormalizedRoute route = NormalizedRoute.fromLegs(
                ProviderName.DB,
                DurationParser.seconds(journey.path("duration")),
                parseTime(departure),
                parseTime(arrival),
                legs
        );
        if (!route.hasUsableDuration()) {
            return ProbeOutcome.zeroResults("Route without usable duration");
        }
        return ProbeOutcome.ok(route);
    }

    // Older instances flag walks with mode=walking, newer ones with walking=true and no mode at all.
    private static boolean isWalking (JsonNode leg) {
        return leg.path("walking").asBoolean(false) || "walking".equals(JsonUtil.text(leg, "/mode"));
    }

    private static WalkLeg walkLeg (JsonNode leg) {
        Integer seconds = legSeconds(leg);
        JsonNode distance = leg.path("distance");
        return new WalkLeg(seconds == null ? 0 : seconds, distance.isNumber() ? distance.asInt() : -1);
    }

    private static TransitLeg transitLeg (JsonNode leg) {
        String line = JsonUtil.firstText(leg, "/line/name", "/line/id");
        return new TransitLeg(
                line == null ? "" : line,
                JsonUtil.firstText(leg, "/operator/name", "/line/operator/name"),
                JsonUtil.text(leg, "/origin/name"),
                JsonUtil.text(leg, "/destination/name"),
                parseTime(JsonUtil.text(leg, "/departure")),
                parseTime(JsonUtil.text(leg, "/arrival")),
                productCategory(JsonUtil.text(leg, "/line/product")),
                JsonUtil.firstText(leg, "/departurePlatform", "/arrivalPlatform")
        );
    }

    private static Integer legSeconds (JsonNode leg) {
        Integer seconds = DurationParser.seconds(leg.path("plannedDuration"));
        if (seconds == null || seconds <= 0) {
            seconds = DurationParser.seconds(leg.path("duration"));
        }
        if (seconds == null || seconds <= 0) {
            Instant dep = parseTime(JsonUtil.text(leg, "/departure"));
            Instant arr = parseTime(JsonUtil.text(leg, "/arrival"));
            if (dep != null && arr != null) {
                seconds = (int) Duration.between(dep, arr).getSeconds();
            }
        }
        return seconds;
    }

    /** Map a HAFAS product name as used by the DB profile of hafas-client. */
    static ProductCategory productCategory (String product) {
        if (product == null) {
            return ProductCategory.OTHER;
        }
        switch (product) {
            case "nationalExpress":
            case "national":
                return ProductCategory.LONG_DISTANCE_RAIL;
            case "regionalExpress":
            case "regionalExp":
            case "regional":
                return ProductCategory.REGIONAL_RAIL;
            case "suburban":
                return ProductCategory.SUBURBAN_RAIL;
            case "subway":
                return ProductCategory.SUBWAY;
            case "tram":
                return ProductCategory.TRAM;
            case "bus":
                return ProductCategory.BUS;
            case "ferry":
                return ProductCategory.FERRY;
            case "taxi":
                return ProductCategory.TAXI;
            default:
                return ProductCategory.OTHER;
        }
    }

    private static Instant parseTime (String isoTime) {
        if (isoTime == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(isoTime).toInstant();
        } catch (DateTimeParseException e) {
            LOG.debug("Ignoring unparseable time '{}'.", isoTime);
            return null;
        }
    }

}
