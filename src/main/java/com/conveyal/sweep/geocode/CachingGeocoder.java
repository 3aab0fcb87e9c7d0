package com.conveyal.sweep.geocode;

import com.conveyal.sweep.cache.KeyedCache;
import com.conveyal.sweep.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Wraps another Geocoder so that each distinct query text is sent upstream at most once, even when many requests ask
 * for it at the same time. Failed lookups where the upstream did answer are cached as well. Transport failures are
 * not: they are turned into a failed result for this call only, and the next call tries again.
 */
public class CachingGeocoder implements Geocoder {

    private static final Logger LOG = LoggerFactory.getLogger(CachingGeocoder.class);

    private final Geocoder delegate;

    private final KeyedCache<String, GeocodeResult> cache;

    public CachingGeocoder (Geocoder delegate, KeyedCache<String, GeocodeResult> cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    /** Case and whitespace differences do not change what a geocoder finds, so they should not defeat the cache. */
    public static String normalizeText (String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public String cacheKey (String text, String countryHint) {
        String country = countryHint == null ? "" : countryHint.trim().toLowerCase(Locale.ROOT);
        return String.join("|", delegate.name(), normalizeText(text), country);
    }

    @Override
    public GeocodeResult geocode (String text, String countryHint) {
        String normalized = normalizeText(text);
        if (normalized.isEmpty()) {
            return GeocodeResult.failed("EMPTY_QUERY", "Nothing to geocode.");
        }
        String country = countryHint == null ? "" : countryHint;
        try {
            return cache.resolve(cacheKey(text, countryHint), () -> {
                try {
                    return delegate.geocode(text.trim(), country);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (RuntimeException e) {
            LOG.warn("Geocoding '{}' with {} failed: {}", text, delegate.name(), ExceptionUtils.shortCauseString(e));
            return GeocodeResult.failed("NETWORK_ERROR", ExceptionUtils.shortCauseString(e));
        }
    }

    @Override
    public String name () {
        return delegate.name();
    }

}
