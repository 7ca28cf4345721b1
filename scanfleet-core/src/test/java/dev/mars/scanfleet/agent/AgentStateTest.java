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

import dev.mars.scanfleet.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the {@link AgentState} transition table and the approval invariant
 * enforced by {@link AgentInfo}.
 */
@DisplayName("AgentState Tests")
class AgentStateTest {

    @Nested
    @DisplayName("Transition table")
    class TransitionTable {

        @Test
        @DisplayName("Pending agents can only be approved into OFFLINE")
        void pendingOnlyToOffline() {
            assertThat(AgentState.PENDING_APPROVAL.getValidTransitions())
                    .containsExactly(AgentState.OFFLINE);
        }

        @Test
        @DisplayName("Offline agents cannot jump straight to SCANNING")
        void offlineCannotScan() {
            assertThat(AgentState.OFFLINE.canTransitionTo(AgentState.SCANNING)).isFalse();
            assertThat(AgentState.OFFLINE.canTransitionTo(AgentState.ONLINE)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(value = AgentState.class, names = {"OFFLINE", "ONLINE", "SCANNING"})
        @DisplayName("Every approved state can be revoked back to PENDING_APPROVAL")
        void revocableFromApprovedStates(AgentState state) {
            assertThat(state.canTransitionTo(AgentState.PENDING_APPROVAL)).isTrue();
        }

        @Test
        @DisplayName("Only ONLINE and SCANNING are live")
        void liveStates() {
            assertThat(AgentState.ONLINE.isLive()).isTrue();
            assertThat(AgentState.SCANNING.isLive()).isTrue();
            assertThat(AgentState.OFFLINE.isLive()).isFalse();
            assertThat(AgentState.PENDING_APPROVAL.isLive()).isFalse();
        }

        @Test
        @DisplayName("fromValue accepts wire value and enum name")
        void parsesValues() {
            assertThat(AgentState.fromValue("pending_approval")).isEqualTo(AgentState.PENDING_APPROVAL);
            assertThat(AgentState.fromValue("SCANNING")).isEqualTo(AgentState.SCANNING);
            assertThatThrownBy(() -> AgentState.fromValue("busy"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("AgentInfo invariants")
    class AgentInfoInvariants {

        @Test
        @DisplayName("An unapproved agent can never become ONLINE")
        void unapprovedCannotGoOnline() throws Exception {
            AgentInfo agent = new AgentInfo("agent-1", "scanner-1", "10.0.0.5", 9090, "10.0.0.0/24");
            agent.setApproved(true);
            agent.transitionTo(AgentState.OFFLINE);
            agent.setApproved(false);

            assertThatThrownBy(() -> agent.transitionTo(AgentState.ONLINE))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("agent-1");
            assertThat(agent.getState()).isEqualTo(AgentState.OFFLINE);
        }

        @Test
        @DisplayName("Approved agent walks OFFLINE -> ONLINE -> SCANNING -> ONLINE")
        void approvedLifecycle() throws Exception {
            AgentInfo agent = new AgentInfo("agent-2", "scanner-2", "10.0.0.6", 9090, "10.0.1.0/24");
            agent.setApproved(true);
            agent.transitionTo(AgentState.OFFLINE);
            agent.transitionTo(AgentState.ONLINE);
            agent.transitionTo(AgentState.SCANNING);
            agent.transitionTo(AgentState.ONLINE);

            assertThat(agent.isEligible()).isTrue();
            assertThat(agent.getBaseUrl()).isEqualTo("http://10.0.0.6:9090");
        }

        @Test
        @DisplayName("Heartbeat expiry honours the timeout boundary")
        void heartbeatExpiry() {
            AgentInfo agent = new AgentInfo("agent-3", "h", "10.0.0.7", 9090, "10.0.2.0/24");
            Instant now = Instant.parse("2026-03-02T10:00:00Z");
            Duration timeout = Duration.ofMinutes(3);

            assertThat(agent.isHeartbeatExpired(now, timeout)).isTrue();

            agent.setLastHeartbeat(now.minus(Duration.ofMinutes(3)));
            assertThat(agent.isHeartbeatExpired(now, timeout)).isFalse();

            agent.setLastHeartbeat(now.minus(Duration.ofMinutes(3)).minusMillis(1));
            assertThat(agent.isHeartbeatExpired(now, timeout)).isTrue();
        }
    }
}
