package com.conveyal.sweep.components;

import com.conveyal.sweep.SweepServerException;
import com.conveyal.sweep.controllers.HttpController;
import com.conveyal.sweep.util.JsonUtil;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;
import spark.Response;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * This Component is a web server that serves up our HTTP API endpoints.
 * It must be supplied with a list of HttpController instances implementing the endpoints.
 */
public class HttpApi implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(HttpApi.class);

    // These "attributes" are attached to an incoming HTTP request with String keys, making them available in handlers
    private static final String REQUEST_START_TIME_ATTRIBUTE = "requestStartTime";

    public interface Config {
        int serverPort ();
        String allowOrigin ();
    }

    private final Config config;

    private final spark.Service sparkService;

    public HttpApi (Config config, List<HttpController> httpControllers) {
        this.config = config;
        sparkService = configureSparkService();
        for (HttpController httpController : httpControllers) {
            httpController.registerEndpoints(sparkService);
        }
    }

    private spark.Service configureSparkService () {
        LOG.info("Sweep server will listen for HTTP connections on port {}.", config.serverPort());
        spark.Service sparkService = spark.Service.ignite();
        sparkService.port(config.serverPort());

        sparkService.before((req, res) -> {
            // Record when the request started, so we can measure elapsed response time.
            req.attribute(REQUEST_START_TIME_ATTRIBUTE, Instant.now());
            // The proxy is called from browser extensions and pages on other origins.
            res.header("Access-Control-Allow-Origin", config.allowOrigin());
            res.header("Vary", "Origin");
            res.type("application/json");
        });

        sparkService.after((req, res) -> {
            Instant requestStartTime = req.attribute(REQUEST_START_TIME_ATTRIBUTE);
            Duration elapsed = Duration.between(requestStartTime, Instant.now());
            LOG.info("{} {} {} in {} ms", req.requestMethod(), req.pathInfo(), res.status(), elapsed.toMillis());
        });

        // Handle CORS preflight requests (which are OPTIONS requests).
        sparkService.options("/*", (req, res) -> {
            res.header("Access-Control-Max-Age", "86400");
            res.header("Access-Control-Allow-Methods", "GET,OPTIONS");
            String requestHeaders = req.headers("Access-Control-Request-Headers");
            if (requestHeaders != null) {
                res.header("Access-Control-Allow-Headers", requestHeaders);
            }
            return "OK";
        });

        sparkService.exception(SweepServerException.class, (e, request, response) -> {
            respondToException(request, response, e.type, e.message, e.httpCode);
        });

        sparkService.exception(IllegalArgumentException.class, (e, request, response) -> {
            respondToException(request, response, SweepServerException.Type.BAD_REQUEST, e.getMessage(), 400);
        });

        sparkService.exception(RuntimeException.class, (e, request, response) -> {
            SweepServerException unknown = SweepServerException.unknown(e);
            respondToException(request, response, unknown.type, unknown.message, unknown.httpCode);
        });

        return sparkService;
    }

    private void respondToException (Request request, Response response, SweepServerException.Type type,
                                     String message, int code) {
        LOG.warn("{} {} failed with {}: {}", request.requestMethod(), request.pathInfo(), code, message);
        ObjectNode body = JsonUtil.objectNode()
                .put("status", type.toString())
                .put("message", message);
        response.status(code);
        response.type("application/json");
        response.body(JsonUtil.toJsonString(body));
    }

    public void awaitInitialization () {
        sparkService.awaitInitialization();
    }

    public void shutDown () {
        sparkService.stop();
    }

}
