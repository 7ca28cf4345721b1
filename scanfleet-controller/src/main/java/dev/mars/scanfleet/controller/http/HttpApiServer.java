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

package dev.mars.scanfleet.controller.http;

import dev.mars.scanfleet.controller.ScanFleetContext;
import dev.mars.scanfleet.controller.config.ControllerSettings;
import dev.mars.scanfleet.controller.http.handlers.AgentHandler;
import dev.mars.scanfleet.controller.http.handlers.DeltaHandler;
import dev.mars.scanfleet.controller.http.handlers.ResultHandler;
import dev.mars.scanfleet.controller.http.handlers.ScanHandler;
import dev.mars.scanfleet.controller.http.handlers.SystemHandler;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * The controller's REST API. Every route except {@code /health} lives under
 * {@code /api/v1}; failures of any route are rendered by {@link GlobalErrorHandler}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-19
 */
public class HttpApiServer {

    private static final Logger logger = LoggerFactory.getLogger(HttpApiServer.class);

    static final String API_PREFIX = "/api/v1";

    private static final long IDLE_POLL_MS = 50;

    private final Vertx vertx;
    private final ScanFleetContext context;
    private final ControllerSettings settings;
    private final DrainModeHandler drainModeHandler = new DrainModeHandler();
    private final AtomicInteger inFlight = new AtomicInteger();
    private HttpServer httpServer;

    public HttpApiServer(Vertx vertx, ScanFleetContext context) {
        this.vertx = vertx;
        this.context = context;
        this.settings = context.settings();
    }

    /**
     * Starts listening.
     *
     * @return the bound port, which differs from the configured one when that is {@code 0}
     */
    public Future<Integer> start() {
        Router router = buildRouter();

        httpServer = vertx.createHttpServer()
                .requestHandler(router);

        return httpServer.listen(settings.httpPort(), settings.httpHost())
                .onSuccess(server -> logger.info("HTTP API Server listening on {}:{}",
                        settings.httpHost(), server.actualPort()))
                .onFailure(err -> logger.error("Failed to start HTTP API Server", err))
                .map(HttpServer::actualPort);
    }

    Router buildRouter() {
        Router router = Router.router(vertx);
        GlobalErrorHandler errorHandler = new GlobalErrorHandler();

        router.route().handler(new CorrelationIdHandler());
        router.route().handler(ctx -> {
            inFlight.incrementAndGet();
            ctx.addEndHandler(v -> inFlight.decrementAndGet());
            ctx.next();
        });
        router.route().handler(drainModeHandler);
        router.route().handler(BodyHandler.create().setBodyLimit(settings.maxBodyBytes()));
        router.route().failureHandler(errorHandler);
        router.errorHandler(404, errorHandler);
        router.errorHandler(405, errorHandler);

        AgentHandler agents = new AgentHandler(context.registry(), context.metrics(),
                settings.pendingRetryAfterSeconds());
        ResultHandler results = new ResultHandler(context.aggregator(), settings);
        ScanHandler scans = new ScanHandler(context.scanConfigs(), context.scheduler());
        DeltaHandler deltas = new DeltaHandler(context.deltaReports());
        SystemHandler system = new SystemHandler(context.store(), context.scheduler(), drainModeHandler,
                context.clock(), settings.version());

        router.get("/health").handler(system.handleHealth());
        router.get(API_PREFIX + "/health").handler(system.handleHealth());
        router.get(API_PREFIX + "/stats").handler(system.handleStats());
        router.get(API_PREFIX + "/schedule").handler(system.handleSchedule());

        router.post(API_PREFIX + "/agents/:agentId/heartbeat").handler(agents.handleHeartbeat());
        router.post(API_PREFIX + "/agents/:agentId/results").handler(results.handleSubmit());
        router.post(API_PREFIX + "/agents/:agentId/approve").handler(agents.handleApprove());
        router.post(API_PREFIX + "/agents/:agentId/revoke").handler(agents.handleRevoke());
        router.get(API_PREFIX + "/agents").handler(agents.handleList());
        router.get(API_PREFIX + "/agents/:agentId").handler(agents.handleGet());
        router.delete(API_PREFIX + "/agents/:agentId").handler(agents.handleDelete());

        router.post(API_PREFIX + "/scans").handler(scans.handleCreate());
        router.get(API_PREFIX + "/scans").handler(scans.handleList());
        router.get(API_PREFIX + "/scans/:scanId").handler(scans.handleGet());
        router.put(API_PREFIX + "/scans/:scanId").handler(scans.handleUpdate());
        router.delete(API_PREFIX + "/scans/:scanId").handler(scans.handleDelete());
        router.post(API_PREFIX + "/scans/:scanId/execute").handler(scans.handleExecute());
        router.post(API_PREFIX + "/scans/:scanId/toggle").handler(scans.handleToggle());
        router.put(API_PREFIX + "/scans/:scanId/schedule").handler(scans.handleSchedule());
        router.get(API_PREFIX + "/scans/:scanId/results").handler(scans.handleResults());
        router.get(API_PREFIX + "/scans/:scanId/deltas").handler(deltas.handleList());
        router.get(API_PREFIX + "/scans/:scanId/deltas/summary").handler(deltas.handleSummary());

        router.get(API_PREFIX + "/results/:resultId").handler(results.handleGet());

        router.post(API_PREFIX + "/deltas/compare").handler(deltas.handleCompare());
        router.get(API_PREFIX + "/deltas/:deltaId").handler(deltas.handleGet());
        router.delete(API_PREFIX + "/deltas/:deltaId").handler(deltas.handleDelete());

        return router;
    }

    public Future<Void> stop() {
        if (httpServer != null) {
            return httpServer.close()
                    .onSuccess(v -> logger.info("HTTP API Server stopped"));
        }
        return Future.succeededFuture();
    }

    /**
     * Stops accepting API requests; health checks keep answering.
     */
    public void enterDrainMode() {
        drainModeHandler.enterDrainMode();
    }

    public boolean isDraining() {
        return drainModeHandler.isDraining();
    }

    public int inFlightRequests() {
        return inFlight.get();
    }

    /**
     * Completes once no request is in flight. The caller bounds the wait.
     */
    public Future<Void> awaitIdle() {
        Promise<Void> promise = Promise.promise();
        pollIdle(promise);
        return promise.future();
    }

    private void pollIdle(Promise<Void> promise) {
        if (inFlight.get() <= 0) {
            promise.tryComplete();
            return;
        }
        vertx.setTimer(IDLE_POLL_MS, id -> pollIdle(promise));
    }
}
