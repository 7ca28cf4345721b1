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

/**
 * What the registry tells an agent in reply to a heartbeat.
 *
 * @param agentId  the agent that sent the heartbeat
 * @param approved false while an operator has not approved the agent
 * @param state    the agent's state after the heartbeat was recorded
 * @param newAgent true if this heartbeat registered the agent
 */
public record HeartbeatOutcome(String agentId, boolean approved, AgentState state, boolean newAgent) {

    public boolean isPending() {
        return !approved;
    }
}
