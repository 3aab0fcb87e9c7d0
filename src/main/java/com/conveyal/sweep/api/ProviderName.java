package com.conveyal.sweep.api;

import java.util.Locale;

/**
 * The upstream routing services a sweep can be run against. AUTO is resolved to a concrete provider before any
 * sweep starts, it never reaches a RouteProvider.
 */
public enum ProviderName {
    GOOGLE,
    DB,
    AUTO;

    /** Parse a query parameter value, falling back to GOOGLE for blank input. Throws on unknown names. */
    public static ProviderName fromParam (String value) {
        if (value == null || value.isBlank()) {
            return GOOGLE;
        }
        return ProviderName.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String paramValue () {
        return name().toLowerCase(Locale.ROOT);
    }
}
