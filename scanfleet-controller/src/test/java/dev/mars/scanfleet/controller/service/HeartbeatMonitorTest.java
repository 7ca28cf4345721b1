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

import dev.mars.scanfleet.agent.AgentState;
import dev.mars.scanfleet.controller.MutableClock;
import dev.mars.scanfleet.controller.observability.ControllerMetrics;
import dev.mars.scanfleet.controller.state.ScanFleetStateStore;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link HeartbeatMonitor}.
 */
@ExtendWith(VertxExtension.class)
@DisplayName("HeartbeatMonitor Tests")
class HeartbeatMonitorTest {

    private MutableClock clock;
    private AgentRegistryService registry;
    private ControllerMetrics metrics;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        registry = new AgentRegistryService(new ScanFleetStateStore(), Duration.ofSeconds(180), clock);
        metrics = new ControllerMetrics();

        for (String id : List.of("a1", "a2")) {
            registry.recordHeartbeat(id, id, "10.0.0.1", 8080, "10.0.0.0/24");
            registry.approve(id);
            registry.recordHeartbeat(id, id, "10.0.0.1", 8080, "10.0.0.0/24");
        }
        registry.recordHeartbeat("pending", "pending", "10.0.0.1", 8080, "10.0.0.0/24");
    }

    @Test
    @DisplayName("sweep demotes agents silent for longer than the timeout")
    void sweepDemotesSilentAgents(Vertx vertx) throws Exception {
        HeartbeatMonitor monitor = new HeartbeatMonitor(vertx, registry, metrics, clock, 60_000);

        clock.advance(Duration.ofSeconds(120));
        registry.recordHeartbeat("a2", "a2", "10.0.0.1", 8080, "10.0.0.0/24");
        clock.advance(Duration.ofSeconds(90));

        SweepResult result = monitor.sweep(clock.instant());

        assertEquals(List.of("a1"), result.demotedAgentIds());
        assertEquals(3, result.totalAgents());
        assertEquals(1, result.onlineAgents());
        assertEquals(2, result.offlineAgents());
        assertEquals(AgentState.OFFLINE, registry.find("a1").orElseThrow().getState());
        assertEquals(1, metrics.getAgentsDemoted());
    }

    @Test
    @DisplayName("a heartbeat exactly at the timeout boundary is not expired")
    void boundaryIsNotExpired(Vertx vertx) {
        HeartbeatMonitor monitor = new HeartbeatMonitor(vertx, registry, metrics, clock, 60_000);
        clock.advance(Duration.ofSeconds(180));

        assertTrue(monitor.sweep(clock.instant()).demotedAgentIds().isEmpty());
    }

    @Test
    @DisplayName("periodic sweeps run while started and stop afterwards")
    void periodicSweeps(Vertx vertx) {
        HeartbeatMonitor monitor = new HeartbeatMonitor(vertx, registry, metrics, clock, 20);
        clock.advance(Duration.ofMinutes(10));

        monitor.start();
        assertTrue(monitor.isRunning());

        await().atMost(Duration.ofSeconds(5))
                .until(() -> registry.find("a1").orElseThrow().getState() == AgentState.OFFLINE
                        && registry.find("a2").orElseThrow().getState() == AgentState.OFFLINE);

        monitor.stop();
        assertFalse(monitor.isRunning());
    }
}
