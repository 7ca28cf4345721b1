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
import dev.mars.scanfleet.agent.AgentState;
import dev.mars.scanfleet.controller.MutableClock;
import dev.mars.scanfleet.controller.state.ScanFleetStateStore;
import dev.mars.scanfleet.core.exceptions.AgentNotFoundException;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import dev.mars.scanfleet.network.TargetSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link AgentRegistryService}: registration, approval, revocation,
 * eligibility and heartbeat expiry.
 */
@DisplayName("AgentRegistryService Tests")
class AgentRegistryServiceTest {

    private MutableClock clock;
    private AgentRegistryService registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        registry = new AgentRegistryService(new ScanFleetStateStore(), Duration.ofMinutes(3), clock);
    }

    private HeartbeatOutcome heartbeat(String agentId, String range) throws ValidationException {
        return registry.recordHeartbeat(agentId, agentId + ".local", "10.0.0.1", 8080, range);
    }

    private void approveAndHeartbeat(String agentId, String range) throws Exception {
        heartbeat(agentId, range);
        registry.approve(agentId);
        heartbeat(agentId, range);
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("first heartbeat registers the agent as pending approval")
        void firstHeartbeatRegistersPending() throws Exception {
            HeartbeatOutcome outcome = heartbeat("a1", "10.0.0.0/24");

            assertTrue(outcome.newAgent());
            assertTrue(outcome.isPending());
            assertFalse(outcome.approved());
            AgentInfo agent = registry.find("a1").orElseThrow();
            assertEquals(AgentState.PENDING_APPROVAL, agent.getState());
            assertEquals(clock.instant(), agent.getLastHeartbeat());
        }

        @Test
        @DisplayName("registering twice with the same values changes nothing")
        void registrationIsIdempotent() throws Exception {
            AgentInfo first = registry.registerOrUpdate("a1", "host", "10.0.0.1", 8080, "10.0.0.0/24");
            AgentInfo second = registry.registerOrUpdate("a1", "host", "10.0.0.1", 8080, "10.0.0.0/24");

            assertEquals(first.getRegisteredAt(), second.getRegisteredAt());
            assertEquals(first.getState(), second.getState());
            assertEquals(1, registry.list().size());
        }

        @Test
        @DisplayName("a heartbeat refreshes the network identity")
        void heartbeatUpdatesIdentity() throws Exception {
            heartbeat("a1", "10.0.0.0/24");
            registry.recordHeartbeat("a1", "renamed", "10.0.0.9", 9090, "10.0.1.0/24");

            AgentInfo agent = registry.find("a1").orElseThrow();
            assertEquals("renamed", agent.getHostname());
            assertEquals("10.0.0.9", agent.getAddress());
            assertEquals(9090, agent.getPort());
            assertEquals("10.0.1.0/24", agent.getOwnedRange());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "not-a-range", "10.0.0.0/33", "10.0.0.300"})
        @DisplayName("rejects an unparseable owned range")
        void rejectsBadRange(String range) {
            assertThrows(ValidationException.class, () -> heartbeat("a1", range));
            assertTrue(registry.list().isEmpty());
        }

        @Test
        @DisplayName("rejects an out-of-range port")
        void rejectsBadPort() {
            assertThrows(ValidationException.class,
                    () -> registry.recordHeartbeat("a1", "host", "10.0.0.1", 70000, "10.0.0.0/24"));
        }

        @Test
        @DisplayName("lists agents in registration order")
        void listsInRegistrationOrder() throws Exception {
            heartbeat("zeta", "10.0.0.0/24");
            heartbeat("alpha", "10.0.1.0/24");
            heartbeat("mid", "10.0.2.0/24");

            assertEquals(List.of("zeta", "alpha", "mid"),
                    registry.list().stream().map(AgentInfo::getAgentId).toList());
        }
    }

    @Nested
    @DisplayName("Approval")
    class Approval {

        @Test
        @DisplayName("approval leaves the agent offline until its next heartbeat")
        void approvalThenHeartbeatComesOnline() throws Exception {
            heartbeat("a1", "10.0.0.0/24");

            AgentInfo approved = registry.approve("a1");
            assertTrue(approved.isApproved());
            assertEquals(AgentState.OFFLINE, approved.getState());

            HeartbeatOutcome outcome = heartbeat("a1", "10.0.0.0/24");
            assertTrue(outcome.approved());
            assertEquals(AgentState.ONLINE, outcome.state());
        }

        @Test
        @DisplayName("approving twice is a no-op")
        void approveIsIdempotent() throws Exception {
            approveAndHeartbeat("a1", "10.0.0.0/24");

            AgentInfo again = registry.approve("a1");
            assertEquals(AgentState.ONLINE, again.getState());
        }

        @Test
        @DisplayName("revoking makes the agent pending and ineligible")
        void revokeRemovesEligibility() throws Exception {
            approveAndHeartbeat("a1", "10.0.0.0/24");

            AgentInfo revoked = registry.revoke("a1");

            assertFalse(revoked.isApproved());
            assertEquals(AgentState.PENDING_APPROVAL, revoked.getState());
            assertTrue(registry.eligibleAgents(TargetSpec.parse("10.0.0.5")).isEmpty());
            assertTrue(heartbeat("a1", "10.0.0.0/24").isPending());
        }

        @Test
        @DisplayName("unknown agents raise AgentNotFoundException")
        void unknownAgent() {
            assertThrows(AgentNotFoundException.class, () -> registry.approve("ghost"));
            assertThrows(AgentNotFoundException.class, () -> registry.revoke("ghost"));
            assertThrows(AgentNotFoundException.class, () -> registry.delete("ghost"));
        }
    }

    @Nested
    @DisplayName("Eligibility")
    class Eligibility {

        @Test
        @DisplayName("only approved live agents whose range intersects the target are eligible")
        void eligibilityFilters() throws Exception {
            approveAndHeartbeat("owner", "10.0.0.0/24");
            approveAndHeartbeat("elsewhere", "192.168.0.0/24");
            heartbeat("unapproved", "10.0.0.0/24");

            List<AgentRegistryService.EligibleAgent> eligible =
                    registry.eligibleAgents(TargetSpec.parse("10.0.0.1-10.0.0.5"));

            assertEquals(List.of("owner"), eligible.stream().map(AgentRegistryService.EligibleAgent::agentId).toList());
        }

        @Test
        @DisplayName("an agent with an expired heartbeat is not eligible even before the sweep")
        void expiredHeartbeatNotEligible() throws Exception {
            approveAndHeartbeat("a1", "10.0.0.0/24");
            clock.advance(Duration.ofMinutes(4));

            assertTrue(registry.eligibleAgents(TargetSpec.parse("10.0.0.1")).isEmpty());
        }

        @Test
        @DisplayName("a scanning agent stays eligible")
        void scanningAgentEligible() throws Exception {
            approveAndHeartbeat("a1", "10.0.0.0/24");
            registry.markScanning("a1");

            assertEquals(AgentState.SCANNING, registry.find("a1").orElseThrow().getState());
            assertEquals(1, registry.eligibleAgents(TargetSpec.parse("10.0.0.1")).size());

            registry.markIdle(List.of("a1"));
            assertEquals(AgentState.ONLINE, registry.find("a1").orElseThrow().getState());
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("demotes live agents whose heartbeat is older than the timeout")
        void demotesExpired() throws Exception {
            approveAndHeartbeat("stale", "10.0.0.0/24");
            clock.advance(Duration.ofMinutes(2));
            approveAndHeartbeat("fresh", "10.0.1.0/24");
            clock.advance(Duration.ofMinutes(2));

            List<String> demoted = registry.demoteExpired(clock.instant());

            assertEquals(List.of("stale"), demoted);
            assertEquals(AgentState.OFFLINE, registry.find("stale").orElseThrow().getState());
            assertEquals(AgentState.ONLINE, registry.find("fresh").orElseThrow().getState());
        }

        @Test
        @DisplayName("a heartbeat after demotion brings the agent back online")
        void heartbeatAfterDemotion() throws Exception {
            approveAndHeartbeat("a1", "10.0.0.0/24");
            clock.advance(Duration.ofMinutes(5));
            registry.demoteExpired(clock.instant());

            assertEquals(AgentState.ONLINE, heartbeat("a1", "10.0.0.0/24").state());
        }

        @Test
        @DisplayName("pending agents are never demoted")
        void pendingNotDemoted() throws Exception {
            heartbeat("a1", "10.0.0.0/24");
            clock.advance(Duration.ofHours(1));

            assertTrue(registry.demoteExpired(clock.instant()).isEmpty());
            assertEquals(AgentState.PENDING_APPROVAL, registry.find("a1").orElseThrow().getState());
        }
    }
}
