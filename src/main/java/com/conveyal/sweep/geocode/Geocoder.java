package com.conveyal.sweep.geocode;

import java.io.IOException;

/**
 * Resolves free text such as a street address or a station name to a single Location.
 */
public interface Geocoder {

    /**
     * @param countryHint lowercase ISO country code restricting the search, or an empty string for no restriction.
     * @return a failed result when the upstream answered but found nothing usable.
     * @throws IOException when the upstream could not be reached at all.
     */
    GeocodeResult geocode (String text, String countryHint) throws IOException;

    /** Short name distinguishing geocoders in cache keys and logs. */
    String name ();

}
