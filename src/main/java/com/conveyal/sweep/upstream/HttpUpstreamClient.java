package com.conveyal.sweep.upstream;

import com.conveyal.sweep.components.Component;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * UpstreamClient backed by a pooled Apache HttpClient, shared by all geocoders and route providers.
 */
public class HttpUpstreamClient implements UpstreamClient, Component {

    private static final Logger LOG = LoggerFactory.getLogger(HttpUpstreamClient.class);

    public interface Config {
        String userAgent ();
        int httpTimeoutSeconds ();
        int probeThreads ();
    }

    private final CloseableHttpClient httpClient;

    private final String userAgent;

    public HttpUpstreamClient (Config config) {
        this.userAgent = config.userAgent();
        int timeoutMillis = config.httpTimeoutSeconds() * 1000;
        PoolingHttpClientConnectionManager mgr = new PoolingHttpClientConnectionManager();
        // Every probe thread may hold one connection, and geocoding runs on request threads on top of that.
        mgr.setMaxTotal(config.probeThreads() * 2);
        mgr.setDefaultMaxPerRoute(config.probeThreads() * 2);
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();
        this.httpClient = HttpClients.custom()
                .disableAutomaticRetries()
                .setConnectionManager(mgr)
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Override
    public UpstreamResponse get (String url, Map<String, String> queryParams) throws IOException {
        URI uri;
        try {
            URIBuilder builder = new URIBuilder(url);
            queryParams.forEach(builder::addParameter);
            uri = builder.build();
        } catch (URISyntaxException e) {
            throw new IOException("Malformed upstream URL " + url, e);
        }
        HttpGet httpGet = new HttpGet(uri);
        httpGet.setHeader("User-Agent", userAgent);
        httpGet.setHeader("Accept", "application/json");
        // Only log the path, query strings contain API keys.
        LOG.debug("GET {}{}", uri.getHost(), uri.getPath());
        try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
            HttpEntity entity = response.getEntity();
            String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
            return new UpstreamResponse(response.getStatusLine().getStatusCode(), body);
        }
    }

    public void close () {
        try {
            httpClient.close();
        } catch (IOException e) {
            LOG.warn("Failed to close upstream HTTP client.", e);
        }
    }

}
