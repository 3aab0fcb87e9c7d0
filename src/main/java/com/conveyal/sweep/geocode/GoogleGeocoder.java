package com.conveyal.sweep.geocode;

import com.conveyal.sweep.api.Location;
import com.conveyal.sweep.upstream.UpstreamClient;
import com.conveyal.sweep.upstream.UpstreamResponse;
import com.conveyal.sweep.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Geocoder backed by the Google Geocoding API. The place_id of the first result becomes the Location id, so the
 * Google directions provider can refer to exactly the same place.
 */
public class GoogleGeocoder implements Geocoder {

    private static final Logger LOG = LoggerFactory.getLogger(GoogleGeocoder.class);

    public static final String GEOCODE_URL = "https://maps.googleapis.com/maps/api/geocode/json";

    private final UpstreamClient client;

    private final String apiKey;

    public GoogleGeocoder (UpstreamClient client, String apiKey) {
        this.client = client;
        this.apiKey = apiKey;
    }

    @Override
    public GeocodeResult geocode (String text, String countryHint) throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("address", text);
        params.put("key", apiKey);
        params.put("language", "de");
        if (countryHint != null && !countryHint.isEmpty()) {
            params.put("components", "country:" + countryHint);
        }
        UpstreamResponse response = client.get(GEOCODE_URL, params);
        if (!response.isSuccess()) {
            LOG.warn("Google geocoding returned {} for '{}'.", response.status, text);
            return GeocodeResult.failed("HTTP_" + response.status, null);
        }
        JsonNode root = JsonUtil.readTree(response.body);
        String status = JsonUtil.text(root, "/status");
        JsonNode first = root.path("results").path(0);
        if (!"OK".equals(status) || first.isMissingNode()) {
            return GeocodeResult.failed(status == null ? "ZERO_RESULTS" : status, JsonUtil.text(root, "/error_message"));
        }
        JsonNode latLng = first.at("/geometry/location");
        Location location = new Location(
                latLng.path("lat").asDouble(),
                latLng.path("lng").asDouble(),
                JsonUtil.firstText(first, "/formatted_address"),
                JsonUtil.text(first, "/place_id")
        );
        return GeocodeResult.ok(location);
    }

    @Override
    public String name () {
        return "google";
    }

}
