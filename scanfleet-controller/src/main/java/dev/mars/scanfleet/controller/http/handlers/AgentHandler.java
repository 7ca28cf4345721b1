/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.scanfleet.controller.http.handlers;

import dev.mars.scanfleet.agent.AgentInfo;
import dev.mars.scanfleet.agent.AgentState;
import dev.mars.scanfleet.controller.http.ApiJson;
import dev.mars.scanfleet.controller.http.ErrorCode;
import dev.mars.scanfleet.controller.http.ScanFleetApiException;
import dev.mars.scanfleet.controller.observability.ControllerMetrics;
import dev.mars.scanfleet.controller.service.AgentRegistryService;
import dev.mars.scanfleet.controller.service.HeartbeatOutcome;
import dev.mars.scanfleet.core.exceptions.ScanFleetException;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * HTTP handler for agent registration, heartbeats and approval.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/agents/:agentId/heartbeat} - register or heartbeat</li>
 *   <li>{@code GET /api/v1/agents} - list agents in registration order</li>
 *   <li>{@code GET /api/v1/agents/:agentId} - get one agent</li>
 *   <li>{@code DELETE /api/v1/agents/:agentId} - forget an agent</li>
 *   <li>{@code POST /api/v1/agents/:agentId/approve} - approve an agent</li>
 *   <li>{@code POST /api/v1/agents/:agentId/revoke} - withdraw approval</li>
 * </ul>
 *
 * <p>An unapproved agent gets {@code 403} with {@code retry_after_seconds}. That is the
 * normal pending signal, so it is logged at DEBUG.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class AgentHandler {

    private static final Logger logger = LoggerFactory.getLogger(AgentHandler.class);

    private final AgentRegistryService registry;
    private final ControllerMetrics metrics;
    private final int pendingRetryAfterSeconds;

    public AgentHandler(AgentRegistryService registry, ControllerMetrics metrics, int pendingRetryAfterSeconds) {
        this.registry = registry;
        this.metrics = metrics;
        this.pendingRetryAfterSeconds = pendingRetryAfterSeconds;
    }

    /**
     * Handles {@code POST /api/v1/agents/:agentId/heartbeat}. Accepts {@code ip_address}
     * for {@code address} and {@code scan_range} for {@code owned_range}.
     */
    public Handler<RoutingContext> handleHeartbeat() {
        return ctx -> {
            String agentId = ctx.pathParam("agentId");
            JsonObject body = ApiJson.requireJsonObject(ctx);

            String hostname = requireString(body, "hostname");
            String address = firstPresent(body, "address", "ip_address");
            String ownedRange = firstPresent(body, "owned_range", "scan_range");
            int port = requirePort(body);

            HeartbeatOutcome outcome;
            try {
                outcome = registry.recordHeartbeat(agentId, hostname, address, port, ownedRange);
            } catch (ScanFleetException e) {
                throw ScanFleetApiException.from(e);
            }
            metrics.recordHeartbeat(outcome.approved());
            if (outcome.newAgent()) {
                logger.info("Agent registered: agentId={}, hostname={}, ownedRange={}", agentId, hostname, ownedRange);
            }

            if (outcome.isPending()) {
                ctx.response().setStatusCode(403);
                ctx.json(new JsonObject()
                        .put("approved", false)
                        .put("status", AgentState.PENDING_APPROVAL.getValue())
                        .put("agent_id", agentId)
                        .put("retry_after_seconds", pendingRetryAfterSeconds));
                return;
            }
            ctx.json(new JsonObject()
                    .put("approved", true)
                    .put("status", outcome.state().getValue())
                    .put("agent_id", agentId));
        };
    }

    /**
     * Handles {@code GET /api/v1/agents}.
     */
    public Handler<RoutingContext> handleList() {
        return ctx -> {
            List<AgentInfo> agents = registry.list();
            ApiJson.respond(ctx, 200, Map.of("agents", agents, "total", agents.size()));
        };
    }

    /**
     * Handles {@code GET /api/v1/agents/:agentId}.
     */
    public Handler<RoutingContext> handleGet() {
        return ctx -> {
            String agentId = ctx.pathParam("agentId");
            AgentInfo agent = registry.find(agentId)
                    .orElseThrow(() -> ScanFleetApiException.notFound(ErrorCode.AGENT_NOT_FOUND, agentId));
            ApiJson.respond(ctx, 200, agent);
        };
    }

    /**
     * Handles {@code DELETE /api/v1/agents/:agentId}.
     */
    public Handler<RoutingContext> handleDelete() {
        return ctx -> {
            String agentId = ctx.pathParam("agentId");
            try {
                registry.delete(agentId);
            } catch (ScanFleetException e) {
                throw ScanFleetApiException.from(e);
            }
            ctx.json(new JsonObject()
                    .put("message", "Agent deleted")
                    .put("agent_id", agentId));
        };
    }

    /**
     * Handles {@code POST /api/v1/agents/:agentId/approve}.
     */
    public Handler<RoutingContext> handleApprove() {
        return ctx -> {
            String agentId = ctx.pathParam("agentId");
            AgentInfo agent;
            try {
                agent = registry.approve(agentId);
            } catch (ScanFleetException e) {
                throw ScanFleetApiException.from(e);
            }
            ApiJson.respond(ctx, 200, agent);
        };
    }

    /**
     * Handles {@code POST /api/v1/agents/:agentId/revoke}.
     */
    public Handler<RoutingContext> handleRevoke() {
        return ctx -> {
            String agentId = ctx.pathParam("agentId");
            AgentInfo agent;
            try {
                agent = registry.revoke(agentId);
            } catch (ScanFleetException e) {
                throw ScanFleetApiException.from(e);
            }
            ApiJson.respond(ctx, 200, agent);
        };
    }

    private static String requireString(JsonObject body, String field) {
        Object value = body.getValue(field);
        if (!(value instanceof String text) || text.isBlank()) {
            throw ScanFleetApiException.badRequest(ErrorCode.MISSING_REQUIRED_FIELD, field);
        }
        return text;
    }

    private static String firstPresent(JsonObject body, String field, String alias) {
        if (body.getValue(field) instanceof String text && !text.isBlank()) {
            return text;
        }
        if (body.getValue(alias) instanceof String text && !text.isBlank()) {
            return text;
        }
        throw ScanFleetApiException.badRequest(ErrorCode.MISSING_REQUIRED_FIELD, field);
    }

    private static int requirePort(JsonObject body) {
        Object value = body.getValue("port");
        if (value == null) {
            throw ScanFleetApiException.badRequest(ErrorCode.MISSING_REQUIRED_FIELD, "port");
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw ScanFleetApiException.badRequest(ErrorCode.VALIDATION_ERROR, "port must be an integer");
        }
    }
}
