package com.conveyal.sweep.upstream;

import java.io.IOException;
import java.util.Map;

/**
 * The narrow seam through which geocoders and route providers reach the network. Tests substitute canned responses.
 * Implementations must be threadsafe.
 */
public interface UpstreamClient {

    /**
     * Perform a GET request with the given query parameters (unencoded, encoding is up to the implementation).
     * A non-2xx status is a normal return, only transport failures throw.
     */
    UpstreamResponse get (String url, Map<String, String> queryParams) throws IOException;

}
