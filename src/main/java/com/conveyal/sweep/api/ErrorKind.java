package com.conveyal.sweep.api;

/** Reasons a single probe produced no usable route. */
public enum ErrorKind {
    UPSTREAM_HTTP_ERROR,
    ZERO_RESULTS,
    POLICY_REJECTED
}
