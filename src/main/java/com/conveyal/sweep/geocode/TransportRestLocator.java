package com.conveyal.sweep.geocode;

import com.conveyal.sweep.api.Location;
import com.conveyal.sweep.upstream.UpstreamClient;
import com.conveyal.sweep.upstream.UpstreamResponse;
import com.conveyal.sweep.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Geocoder backed by the /locations endpoint of a transport.rest (HAFAS) instance. Returns the best matching stop,
 * address or point of interest. Its id is what the transport.rest journeys endpoint expects. The country hint is
 * ignored since the HAFAS instance is already specific to one network.
 */
public class TransportRestLocator implements Geocoder {

    private final UpstreamClient client;

    private final String baseUrl;

    public TransportRestLocator (UpstreamClient client, String baseUrl) {
        this.client = client;
        this.baseUrl = baseUrl;
    }

    @Override
    public GeocodeResult geocode (String text, String countryHint) throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", text);
        params.put("results", "1");
        UpstreamResponse response = client.get(baseUrl + "/locations", params);
        if (!response.isSuccess()) {
            return GeocodeResult.failed("HTTP_" + response.status, response.body);
        }
        JsonNode first = JsonUtil.readTree(response.body).path(0);
        if (first.isMissingNode()) {
            return GeocodeResult.failed("no_results", null);
        }
        // Stations nest their coordinates in a location object, addresses and POIs carry them at the top level.
        JsonNode coordinates = first.has("location") ? first.path("location") : first;
        Location location = new Location(
                coordinates.path("latitude").asDouble(),
                coordinates.path("longitude").asDouble(),
                JsonUtil.firstText(first, "/name", "/address"),
                JsonUtil.text(first, "/id")
        );
        return GeocodeResult.ok(location);
    }

    @Override
    public String name () {
        return "db";
    }

}
