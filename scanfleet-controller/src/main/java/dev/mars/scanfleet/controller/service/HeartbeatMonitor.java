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

package dev.mars.scanfleet.controller.service;

import dev.mars.scanfleet.agent.AgentInfo;
import dev.mars.scanfleet.controller.observability.ControllerMetrics;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically demotes agents whose heartbeats stopped arriving.
 *
 * <p>A sweep only ever moves live agents to offline. It never promotes, so running
 * it twice in a row is the same as running it once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-20
 */
public class HeartbeatMonitor {

    private static final Logger logger = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final Vertx vertx;
    private final AgentRegistryService registry;
    private final ControllerMetrics metrics;
    private final Clock clock;
    private final long checkIntervalMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile long timerId = -1;

    public HeartbeatMonitor(Vertx vertx, AgentRegistryService registry, ControllerMetrics metrics,
                            Clock clock, long checkIntervalMs) {
        this.vertx = vertx;
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
        this.checkIntervalMs = checkIntervalMs;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        timerId = vertx.setPeriodic(checkIntervalMs, id -> {
            if (running.get()) {
                sweep(clock.instant());
            }
        });
        logger.info("Heartbeat monitor started: interval={}ms, timeout={}ms",
                checkIntervalMs, registry.getHeartbeatTimeout().toMillis());
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            vertx.cancelTimer(timerId);
            logger.info("Heartbeat monitor stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Runs one sweep as of the given instant.
     */
    public SweepResult sweep(Instant now) {
        List<String> demoted = registry.demoteExpired(now);
        metrics.recordAgentsDemoted(demoted.size());

        List<AgentInfo> agents = registry.list();
        int online = (int) agents.stream().filter(a -> a.getState().isLive()).count();
        SweepResult result = new SweepResult(demoted, agents.size(), online, agents.size() - online);

        if (demoted.isEmpty()) {
            logger.debug("Heartbeat sweep: total={}, online={}, offline={}",
                    result.totalAgents(), result.onlineAgents(), result.offlineAgents());
        } else {
            logger.info("Heartbeat sweep demoted {} agent(s): total={}, online={}, offline={}",
                    demoted.size(), result.totalAgents(), result.onlineAgents(), result.offlineAgents());
        }
        return result;
    }
}
