package com.conveyal.sweep.geocode;

import com.conveyal.sweep.api.Location;
import com.conveyal.sweep.cache.KeyedCache;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CachingGeocoderTest {

    /** Geocoder that resolves everything to the same place, or fails while told to. */
    private static class CountingGeocoder implements Geocoder {
        final AtomicInteger calls = new AtomicInteger();
        volatile boolean unreachable = false;
        volatile GeocodeResult answer = GeocodeResult.ok(new Location(49.45, 11.08, "Nürnberg"));

        @Override
        public GeocodeResult geocode (String text, String countryHint) throws IOException {
            calls.incrementAndGet();
            if (unreachable) {
                throw new IOException("no route to host");
            }
            return answer;
        }

        @Override
        public String name () {
            return "counting";
        }
    }

    private final CountingGeocoder delegate = new CountingGeocoder();

    private final CachingGeocoder geocoder = new CachingGeocoder(delegate, new KeyedCache<>("geocode cache", 10));

    @Test
    void spellingVariantsShareOneLookup () {
        assertTrue(geocoder.geocode("Nürnberg  Hbf", "de").ok);
        assertTrue(geocoder.geocode("  nürnberg hbf ", "DE").ok);
        assertTrue(geocoder.geocode("NÜRNBERG HBF", "de").ok);
        assertEquals(1, delegate.calls.get());
        // A different country restriction is a different question.
        geocoder.geocode("Nürnberg Hbf", "at");
        assertEquals(2, delegate.calls.get());
    }

    @Test
    void keysIncludeGeocoderName () {
        assertEquals("counting|nürnberg hbf|de", geocoder.cacheKey(" Nürnberg\tHbf", "DE"));
        assertEquals("counting|erlangen|", geocoder.cacheKey("Erlangen", null));
    }

    @Test
    void emptyTextNeverReachesUpstream () {
        GeocodeResult result = geocoder.geocode("   ", "de");
        assertFalse(result.ok);
        assertEquals("EMPTY_QUERY", result.reason);
        assertEquals(0, delegate.calls.get());
    }

    @Test
    void upstreamFailuresAreCachedButTransportFailuresAreNot () {
        delegate.answer = GeocodeResult.failed("ZERO_RESULTS", null);
        assertEquals("ZERO_RESULTS", geocoder.geocode("Atlantis", "").reason);
        assertEquals("ZERO_RESULTS", geocoder.geocode("Atlantis", "").reason);
        assertEquals(1, delegate.calls.get());

        delegate.unreachable = true;
        GeocodeResult result = geocoder.geocode("Erlangen", "");
        assertFalse(result.ok);
        assertEquals("NETWORK_ERROR", result.reason);
        delegate.unreachable = false;
        delegate.answer = GeocodeResult.ok(new Location(49.59, 11.00, "Erlangen"));
        assertTrue(geocoder.geocode("Erlangen", "").ok);
        assertEquals(3, delegate.calls.get());
    }

}
