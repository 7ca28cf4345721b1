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
import dev.mars.scanfleet.controller.observability.TelemetryConfig;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for the ScanFleet controller. Creates Vert.x with telemetry wired
 * in, deploys {@link ScanFleetControllerVerticle} and undeploys it on JVM exit.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class ScanFleetControllerApplication {

    private static final Logger logger = LoggerFactory.getLogger(ScanFleetControllerApplication.class);

    public static void main(String[] args) {
        AppConfig config = AppConfig.get();

        VertxOptions options = TelemetryConfig.configure(new VertxOptions(), config);
        Vertx vertx = Vertx.vertx(options);

        vertx.deployVerticle(new ScanFleetControllerVerticle())
                .onSuccess(id -> logger.info("ScanFleet controller deployed: deploymentId={}", id))
                .onFailure(err -> {
                    logger.error("Failed to start ScanFleet controller", err);
                    vertx.close();
                    System.exit(1);
                });

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping ScanFleet controller...");
            CountDownLatch closed = new CountDownLatch(1);
            vertx.close().onComplete(ar -> {
                if (ar.failed()) {
                    logger.warn("Error while closing Vert.x", ar.cause());
                }
                closed.countDown();
            });
            try {
                if (!closed.await(config.getShutdownTimeoutMs() + 5000, TimeUnit.MILLISECONDS)) {
                    logger.warn("Vert.x did not close within the shutdown timeout");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for shutdown");
            }
        }, "scanfleet-shutdown"));
    }
}
