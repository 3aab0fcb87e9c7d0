package com.conveyal.sweep.controllers;

import com.conveyal.sweep.util.JsonUtil;

/**
 * Liveness probe for load balancers and uptime checks.
 */
public class HealthController implements HttpController {

    @Override
    public void registerEndpoints (spark.Service sparkService) {
        sparkService.get("/health", (req, res) -> JsonUtil.objectNode().put("ok", true), JsonUtil.toJson);
    }

}
