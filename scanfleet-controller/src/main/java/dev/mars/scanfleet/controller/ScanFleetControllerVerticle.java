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

package dev.mars.scanfleet.controller;

import dev.mars.scanfleet.controller.config.AppConfig;
import dev.mars.scanfleet.controller.config.ControllerSettings;
import dev.mars.scanfleet.controller.http.HttpApiServer;
import dev.mars.scanfleet.controller.lifecycle.ShutdownCoordinator;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle of the ScanFleet controller. Builds the service context, then
 * starts the HTTP API, the heartbeat monitor and the scan scheduler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-06
 */
public class ScanFleetControllerVerticle extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(ScanFleetControllerVerticle.class);

    private final ControllerSettings providedSettings;
    private final long drainTimeoutMs;
    private final long shutdownTimeoutMs;

    private ScanFleetContext context;
    private HttpApiServer apiServer;
    private ShutdownCoordinator shutdownCoordinator;
    private volatile int httpPort = -1;

    /**
     * Reads settings from {@link AppConfig}.
     */
    public ScanFleetControllerVerticle() {
        this(null, AppConfig.get().getShutdownDrainTimeoutMs(), AppConfig.get().getShutdownTimeoutMs());
    }

    public ScanFleetControllerVerticle(ControllerSettings settings, long drainTimeoutMs, long shutdownTimeoutMs) {
        this.providedSettings = settings;
        this.drainTimeoutMs = drainTimeoutMs;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    @Override
    public void start(Promise<Void> startPromise) throws Exception {
        logger.info("Starting ScanFleetControllerVerticle...");

        try {
            ControllerSettings settings = providedSettings != null
                    ? providedSettings
                    : ControllerSettings.from(AppConfig.get());

            this.context = ScanFleetContext.create(vertx, settings);
            this.apiServer = new HttpApiServer(vertx, context);

            apiServer.start()
                    .onSuccess(port -> {
                        this.httpPort = port;
                        context.heartbeatMonitor().start();
                        context.scheduler().start();
                        setupShutdownCoordinator();
                        logger.info("ScanFleetControllerVerticle started successfully (port={}, version={})",
                                port, settings.version());
                        startPromise.complete();
                    })
                    .onFailure(startPromise::fail);
        } catch (Exception e) {
            startPromise.fail(e);
        }
    }

    /**
     * Shutdown sequence:
     * <ol>
     *   <li>DRAIN: reject new API requests with 503, health stays up</li>
     *   <li>AWAIT: let in-flight requests finish</li>
     *   <li>STOP_SERVICES: scheduler, heartbeat monitor, HTTP server</li>
     *   <li>CLOSE_RESOURCES: the outbound web client</li>
     * </ol>
     * Work orders already accepted by agents are not cancelled.
     */
    private void setupShutdownCoordinator() {
        this.shutdownCoordinator = new ShutdownCoordinator(vertx, drainTimeoutMs, shutdownTimeoutMs);

        shutdownCoordinator.onDrain("http-api-drain", () -> {
            apiServer.enterDrainMode();
            return Future.succeededFuture();
        });

        shutdownCoordinator.onAwaitCompletion("http-in-flight", () -> apiServer.awaitIdle());

        shutdownCoordinator.onServiceStop("scheduler-stop", () -> {
            context.scheduler().stop();
            return Future.succeededFuture();
        });
        shutdownCoordinator.onServiceStop("heartbeat-monitor-stop", () -> {
            context.heartbeatMonitor().stop();
            return Future.succeededFuture();
        });
        shutdownCoordinator.onServiceStop("http-api-stop", () -> apiServer.stop());

        shutdownCoordinator.onResourceClose("web-client-close", () -> {
            context.webClient().close();
            return Future.succeededFuture();
        });

        logger.info("Shutdown coordinator configured (drain={}ms, timeout={}ms)", drainTimeoutMs, shutdownTimeoutMs);
    }

    @Override
    public void stop(Promise<Void> stopPromise) throws Exception {
        logger.info("Stopping ScanFleetControllerVerticle...");

        if (shutdownCoordinator != null) {
            shutdownCoordinator.shutdown()
                    .onSuccess(v -> {
                        logger.info("ScanFleetControllerVerticle stopped successfully (graceful)");
                        stopPromise.complete();
                    })
                    .onFailure(err -> {
                        logger.warn("Error during graceful shutdown", err);
                        stopPromise.complete();
                    });
            return;
        }

        // Start failed before the coordinator existed
        if (context != null) {
            context.scheduler().stop();
            context.heartbeatMonitor().stop();
        }
        Future<Void> httpStop = apiServer != null ? apiServer.stop() : Future.succeededFuture();
        httpStop.onComplete(ar -> {
            if (ar.failed()) {
                logger.warn("Error stopping HTTP API during shutdown", ar.cause());
            }
            if (context != null) {
                context.webClient().close();
            }
            logger.info("ScanFleetControllerVerticle stopped successfully (immediate)");
            stopPromise.complete();
        });
    }

    public ScanFleetContext getContext() {
        return context;
    }

    /**
     * @return the bound HTTP port, or {@code -1} before start completes
     */
    public int getHttpPort() {
        return httpPort;
    }

    public ShutdownCoordinator getShutdownCoordinator() {
        return shutdownCoordinator;
    }
}
