package com.conveyal.sweep.upstream;

/**
 * Status code and body of an HTTP response from an upstream API.
 */
public class UpstreamResponse {

    public final int status;

    public final String body;

    public UpstreamResponse (int status, String body) {
        this.status = status;
        this.body = body;
    }

    public boolean isSuccess () {
        return status >= 200 && status < 300;
    }

    @Override
    public String toString () {
        return "HTTP " + status;
    }
}
