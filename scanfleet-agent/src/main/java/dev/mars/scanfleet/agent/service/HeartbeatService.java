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

import dev.mars.scanfleet.agent.config.AgentSettings;
import dev.mars.scanfleet.agent.observability.AgentMetrics;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends heartbeats to the ScanFleet controller. The first heartbeat registers the
 * agent; until an operator approves it every heartbeat is answered with
 * {@code 403 pending_approval}, which is an expected state rather than an error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 */
public class HeartbeatService {

    private static final Logger logger = LoggerFactory.getLogger(HeartbeatService.class);

    private final AgentSettings settings;
    private final AgentMetrics metrics;
    private final WebClient webClient;
    private final AtomicLong sequenceNumber = new AtomicLong(0);
    private volatile HeartbeatReply lastReply = HeartbeatReply.failed();
    private volatile int advertisedPort;

    public HeartbeatService(Vertx vertx, AgentSettings settings, AgentMetrics metrics) {
        this.settings = settings;
        this.metrics = metrics;
        this.advertisedPort = settings.port();
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout(settings.httpConnectTimeoutMs())
                .setUserAgent("ScanFleet-Agent/" + settings.version()));
        logger.debug("HeartbeatService initialized (connectTimeout={}ms)", settings.httpConnectTimeoutMs());
    }

    /**
     * Sends one heartbeat. Never fails; transport errors and unexpected statuses
     * complete with {@link HeartbeatReply.Outcome#FAILED}.
     */
    public Future<HeartbeatReply> sendHeartbeat() {
        String url = settings.controllerUrl() + "/agents/" + settings.agentId() + "/heartbeat";

        return webClient.postAbs(url)
                .putHeader("Content-Type", "application/json")
                .sendJsonObject(createHeartbeatRequest())
                .map(response -> {
                    int statusCode = response.statusCode();
                    JsonObject body = parseBody(response.bodyAsString());
                    if (statusCode == 200) {
                        return HeartbeatReply.approved(body.getString("status", "online"));
                    }
                    if (statusCode == 403 && "pending_approval".equals(body.getString("status"))) {
                        return HeartbeatReply.pending(body.getInteger("retry_after_seconds", 0));
                    }
                    logger.warn("Heartbeat rejected for agent {}: HTTP {} {}",
                            settings.agentId(), statusCode, response.bodyAsString());
                    return HeartbeatReply.failed();
                })
                .recover(err -> {
                    logger.warn("Error sending heartbeat for agent {}: {}", settings.agentId(), err.getMessage());
                    return Future.succeededFuture(HeartbeatReply.failed());
                })
                .onSuccess(this::record);
    }

    /**
     * Delay before the next heartbeat given the last answer. An approved agent uses
     * the regular interval; a pending one polls at the controller's hint, or at the
     * approval-check interval when the controller gave none.
     */
    public long nextDelayMs(HeartbeatReply reply) {
        return switch (reply.outcome()) {
            case APPROVED -> settings.heartbeatIntervalMs();
            case PENDING_APPROVAL -> reply.retryAfterSeconds() > 0
                    ? reply.retryAfterSeconds() * 1000L
                    : settings.approvalCheckIntervalMs();
            case FAILED -> Math.min(settings.heartbeatIntervalMs(), settings.approvalCheckIntervalMs());
        };
    }

    /**
     * Sets the port announced to the controller. Called once the work order server
     * is bound, which differs from the configured port when that port is 0.
     */
    public void setAdvertisedPort(int port) {
        this.advertisedPort = port;
    }

    public int getAdvertisedPort() {
        return advertisedPort;
    }

    public HeartbeatReply getLastReply() {
        return lastReply;
    }

    public boolean isApproved() {
        return lastReply.isApproved();
    }

    private void record(HeartbeatReply reply) {
        HeartbeatReply previous = lastReply;
        lastReply = reply;
        metrics.recordHeartbeat(reply.outcome().name().toLowerCase());
        switch (reply.outcome()) {
            case APPROVED -> {
                metrics.setStatusApproved();
                if (!previous.isApproved()) {
                    logger.info("Agent {} approved by controller (status={})", settings.agentId(), reply.status());
                }
            }
            case PENDING_APPROVAL -> {
                metrics.setStatusPending();
                if (previous.outcome() != HeartbeatReply.Outcome.PENDING_APPROVAL) {
                    logger.info("Agent {} awaiting approval, polling again in {}ms",
                            settings.agentId(), nextDelayMs(reply));
                }
            }
            case FAILED -> logger.debug("Heartbeat {} failed", sequenceNumber.get());
        }
    }

    private JsonObject createHeartbeatRequest() {
        return new JsonObject()
                .put("hostname", settings.hostname())
                .put("address", settings.advertisedAddress())
                .put("port", advertisedPort)
                .put("owned_range", settings.ownedRange())
                .put("version", settings.version())
                .put("sequence_number", sequenceNumber.incrementAndGet());
    }

    private static JsonObject parseBody(String body) {
        if (body == null || body.isBlank()) {
            return new JsonObject();
        }
        try {
            return new JsonObject(body);
        } catch (RuntimeException e) {
            logger.debug("Heartbeat response is not JSON: {}", e.getMessage());
            return new JsonObject();
        }
    }

    public Future<Void> shutdown() {
        logger.debug("Shutting down HeartbeatService WebClient");
        webClient.close();
        return Future.succeededFuture();
    }
}
