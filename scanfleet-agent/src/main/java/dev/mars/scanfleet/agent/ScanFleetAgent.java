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

package dev.mars.scanfleet.agent;

import dev.mars.scanfleet.agent.config.AgentConfig;
import dev.mars.scanfleet.agent.config.AgentSettings;
import dev.mars.scanfleet.agent.observability.AgentMetrics;
import dev.mars.scanfleet.agent.scanner.PortScanner;
import dev.mars.scanfleet.agent.scanner.TcpConnectScanner;
import dev.mars.scanfleet.agent.service.HeartbeatReply;
import dev.mars.scanfleet.agent.service.HeartbeatService;
import dev.mars.scanfleet.agent.service.ResultSubmissionService;
import dev.mars.scanfleet.agent.service.ScanExecutionService;
import dev.mars.scanfleet.agent.service.WorkOrderServer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main class for the ScanFleet agent.
 *
 * <p>The agent serves work orders on its own HTTP port and keeps a heartbeat loop
 * running against the controller. The first heartbeat registers it; while it
 * waits for approval it keeps polling at the interval the controller suggests.
 * Heartbeats use one-shot Vert.x timers so each delay can follow the last answer.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 */
public class ScanFleetAgent {

    private static final Logger logger = LoggerFactory.getLogger(ScanFleetAgent.class);

    private final Vertx vertx;
    private final AgentSettings settings;
    private final PortScanner scanner;
    private final AgentMetrics metrics;
    private final HeartbeatService heartbeatService;
    private final ResultSubmissionService submissionService;
    private final ScanExecutionService scanService;
    private final WorkOrderServer workOrderServer;

    private long heartbeatTimerId = -1;
    private volatile int boundPort = -1;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /**
     * Creates an agent that scans with {@link TcpConnectScanner}.
     */
    public ScanFleetAgent(Vertx vertx, AgentSettings settings) {
        this(vertx, settings, new TcpConnectScanner(settings.portConnectTimeoutMs(), settings.scanParallelism()));
    }

    /**
     * Creates an agent with the given scanner.
     *
     * @throws NullPointerException if any argument is null
     */
    public ScanFleetAgent(Vertx vertx, AgentSettings settings, PortScanner scanner) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.settings = Objects.requireNonNull(settings, "AgentSettings cannot be null");
        this.scanner = Objects.requireNonNull(scanner, "PortScanner cannot be null");

        this.metrics = new AgentMetrics(settings.agentId());
        this.heartbeatService = new HeartbeatService(vertx, settings, metrics);
        this.submissionService = new ResultSubmissionService(vertx, settings, metrics);
        this.scanService = new ScanExecutionService(vertx, settings, scanner, submissionService, metrics);
        this.workOrderServer = new WorkOrderServer(vertx, settings, scanService, heartbeatService, metrics);

        logger.info("ScanFleet agent initialized: {} (owned range {})", settings.agentId(), settings.ownedRange());
    }

    public static void main(String[] args) {
        logger.info("Starting ScanFleet agent...");

        Vertx vertx = Vertx.vertx();
        try {
            AgentConfig config = AgentConfig.get();
            config.validate();

            ScanFleetAgent agent = new ScanFleetAgent(vertx, AgentSettings.from(config));

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                agent.shutdown()
                        .eventually(() -> vertx.close())
                        .onComplete(ar -> {
                            if (ar.succeeded()) {
                                logger.info("Vert.x instance closed successfully");
                            } else {
                                logger.error("Error closing Vert.x instance", ar.cause());
                            }
                        });
            }));

            agent.start().onFailure(err -> {
                logger.error("Failed to start ScanFleet agent", err);
                agent.shutdown().eventually(() -> vertx.close()).onComplete(ar -> System.exit(1));
            });

            agent.awaitShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for shutdown");
        } catch (RuntimeException e) {
            logger.error("Failed to start ScanFleet agent", e);
            vertx.close();
            System.exit(1);
        }

        logger.info("ScanFleet agent stopped");
    }

    /**
     * Binds the work order server and sends the first heartbeat. Completes once the
     * server is listening; approval may still be pending.
     *
     * @throws IllegalStateException if the agent was already started or closed
     */
    public Future<Void> start() {
        if (closed.get()) {
            throw new IllegalStateException("Agent is closed, cannot start");
        }
        if (started.getAndSet(true)) {
            throw new IllegalStateException("Agent already started");
        }

        return workOrderServer.start()
                .map(port -> {
                    boundPort = port;
                    heartbeatService.setAdvertisedPort(port);
                    running = true;
                    heartbeatLoop();
                    logger.info("ScanFleet agent {} started on port {}", settings.agentId(), port);
                    return null;
                });
    }

    private void heartbeatLoop() {
        if (!running) {
            return;
        }
        heartbeatService.sendHeartbeat().onComplete(ar -> {
            HeartbeatReply reply = ar.succeeded() ? ar.result() : HeartbeatReply.failed();
            if (running) {
                long delay = heartbeatService.nextDelayMs(reply);
                heartbeatTimerId = vertx.setTimer(delay, id -> heartbeatLoop());
            }
        });
    }

    /**
     * Stops the heartbeat loop, refuses new work orders and closes every client.
     * Scans already running are abandoned. Safe to call more than once.
     */
    public Future<Void> shutdown() {
        if (closed.getAndSet(true)) {
            logger.info("Agent already closed, skipping shutdown");
            return Future.succeededFuture();
        }

        logger.info("Shutting down ScanFleet agent {}...", settings.agentId());
        running = false;
        if (heartbeatTimerId >= 0) {
            boolean cancelled = vertx.cancelTimer(heartbeatTimerId);
            logger.debug("Heartbeat timer cancelled: {} [ID: {}]", cancelled, heartbeatTimerId);
            heartbeatTimerId = -1;
        }

        return Future.join(scanService.shutdown(), workOrderServer.shutdown())
                .eventually(() -> Future.join(heartbeatService.shutdown(), submissionService.shutdown()))
                .<Void>mapEmpty()
                .onComplete(ar -> {
                    if (scanner instanceof AutoCloseable closeable) {
                        closeQuietly(closeable);
                    }
                    metrics.setStatusStopped();
                    if (ar.failed()) {
                        logger.error("Error during agent shutdown", ar.cause());
                    } else {
                        logger.info("ScanFleet agent shutdown complete");
                    }
                    shutdownLatch.countDown();
                });
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            logger.warn("Error closing scanner: {}", e.getMessage());
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isApproved() {
        return heartbeatService.isApproved();
    }

    /**
     * Port the work order server is bound to, or -1 before {@link #start()} completed.
     */
    public int getPort() {
        return boundPort;
    }

    public AgentSettings getSettings() {
        return settings;
    }

    ScanExecutionService scans() {
        return scanService;
    }
}
