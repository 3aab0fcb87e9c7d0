package com.conveyal.sweep.api;

import java.util.Locale;
import java.util.Objects;

/**
 * A geographic point resolved by a geocoder. The optional id is whatever the geocoding upstream uses to identify the
 * place (a Google place_id or a HAFAS station id). Route providers prefer it over raw coordinates when present.
 */
public class Location {

    public final double lat;

    public final double lng;

    /** Human readable name as formatted by the geocoder, e.g. "Hauptbahnhof, 90443 Nürnberg". */
    public final String label;

    /** Upstream identifier for this place, may be null. */
    public final String id;

    public Location (double lat, double lng, String label, String id) {
        this.lat = lat;
        this.lng = lng;
        this.label = label;
        this.id = id;
    }

    public Location (double lat, double lng, String label) {
        this(lat, lng, label, null);
    }

    /** Stable textual identity used inside cache keys. */
    public String keyString () {
        if (id != null) {
            return "id:" + id;
        }
        return String.format(Locale.ROOT, "%.6f,%.6f", lat, lng);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Location other = (Location) o;
        return Double.compare(other.lat, lat) == 0 && Double.compare(other.lng, lng) == 0 &&
                Objects.equals(label, other.label) && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode () {
        return Objects.hash(lat, lng, label, id);
    }

    @Override
    public String toString () {
        return String.format(Locale.ROOT, "%s (%.5f, %.5f)", label, lat, lng);
    }
}
