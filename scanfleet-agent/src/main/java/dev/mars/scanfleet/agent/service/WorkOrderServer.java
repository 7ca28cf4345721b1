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

package dev.mars.scanfleet.agent.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.scanfleet.agent.config.AgentSettings;
import dev.mars.scanfleet.agent.observability.AgentMetrics;
import dev.mars.scanfleet.core.ScanFleetJson;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * HTTP endpoint the controller dispatches work orders to.
 *
 * <ul>
 *   <li>{@code POST /scan} answers {@code 202 {accepted:true}} and runs the scan in the
 *       background. A malformed order gets {@code 400}; a full or stopping agent gets
 *       {@code 503}, which the controller treats as unreachable.</li>
 *   <li>{@code GET /health} reports the agent id, approval and running scans.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 */
public class WorkOrderServer {

    private static final Logger logger = LoggerFactory.getLogger(WorkOrderServer.class);
    private static final long MAX_BODY_BYTES = 4L * 1024 * 1024;

    private final Vertx vertx;
    private final AgentSettings settings;
    private final ScanExecutionService scans;
    private final HeartbeatService heartbeats;
    private final AgentMetrics metrics;
    private final Instant startTime = Instant.now();
    private HttpServer server;

    public WorkOrderServer(Vertx vertx, AgentSettings settings, ScanExecutionService scans,
                           HeartbeatService heartbeats, AgentMetrics metrics) {
        this.vertx = vertx;
        this.settings = settings;
        this.scans = scans;
        this.heartbeats = heartbeats;
        this.metrics = metrics;
    }

    /**
     * Binds the server.
     *
     * @return future with the bound port, useful when the configured port is 0
     */
    public Future<Integer> start() {
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES));
        router.post("/scan").handler(this::handleWorkOrder);
        router.get("/health").handler(this::handleHealth);

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(settings.port(), settings.bindHost())
                .map(httpServer -> {
                    server = httpServer;
                    logger.info("Work order server listening on {}:{}", settings.bindHost(), httpServer.actualPort());
                    return httpServer.actualPort();
                });
    }

    private void handleWorkOrder(RoutingContext ctx) {
        if (ctx.body().isEmpty()) {
            reject(ctx, 400, "Work order body is required");
            return;
        }
        WorkOrder order;
        List<Integer> ports;
        try {
            order = ScanFleetJson.mapper().readValue(ctx.body().buffer().getBytes(), WorkOrder.class);
            if (order == null) {
                reject(ctx, 400, "Work order body is required");
                return;
            }
            ports = order.validate();
        } catch (JsonProcessingException e) {
            reject(ctx, 400, "Malformed work order: " + e.getOriginalMessage());
            return;
        } catch (IOException e) {
            reject(ctx, 400, "Unreadable work order: " + e.getMessage());
            return;
        } catch (ValidationException e) {
            reject(ctx, 400, e.getMessage());
            return;
        }

        ScanExecutionService.Admission admission = scans.accept(order, ports);
        metrics.recordWorkOrder(admission.name().toLowerCase());
        switch (admission) {
            case ACCEPTED, DUPLICATE -> {
                logger.info("Work order {}: taskId={}, scanId={}, targets={}",
                        admission == ScanExecutionService.Admission.ACCEPTED ? "accepted" : "already running",
                        order.taskId(), order.scanId(), order.targets().size());
                ctx.response().setStatusCode(202);
                ctx.json(new JsonObject()
                        .put("accepted", true)
                        .put("task_id", order.taskId())
                        .put("duplicate", admission == ScanExecutionService.Admission.DUPLICATE));
            }
            case BUSY -> reject(ctx, 503, "Agent is running " + scans.getActiveScanCount() + " scans");
            case STOPPED -> reject(ctx, 503, "Agent is shutting down");
        }
    }

    private void handleHealth(RoutingContext ctx) {
        HeartbeatReply reply = heartbeats.getLastReply();
        ctx.json(new JsonObject()
                .put("status", "UP")
                .put("agent_id", settings.agentId())
                .put("approved", reply.isApproved())
                .put("controller_status", reply.status())
                .put("owned_range", settings.ownedRange())
                .put("active_scans", scans.getActiveScanCount())
                .put("uptime_ms", Instant.now().toEpochMilli() - startTime.toEpochMilli())
                .put("version", settings.version()));
    }

    private static void reject(RoutingContext ctx, int status, String message) {
        logger.warn("Work order rejected ({}): {}", status, message);
        ctx.response().setStatusCode(status);
        ctx.json(new JsonObject().put("accepted", false).put("error", message));
    }

    public Future<Void> shutdown() {
        if (server == null) {
            return Future.succeededFuture();
        }
        logger.info("Work order server stopping");
        return server.close();
    }
}
