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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.scanfleet.core.exceptions.InvalidTransitionException;

import java.time.Duration;
import java.time.Instant;

/**
 * Registry record for one scanning agent.
 *
 * <p>Holds the agent's durable identity, where it listens for work orders, the
 * address range it owns, its approval flag and liveness state. All state changes
 * go through {@link #transitionTo(AgentState)}, which enforces both the state
 * table and the approval invariant: an unapproved agent can never be online or
 * scanning.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentInfo {

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("hostname")
    private String hostname;

    @JsonProperty("address")
    private String address;

    @JsonProperty("port")
    private int port;

    @JsonProperty("owned_range")
    private String ownedRange;

    @JsonProperty("state")
    private AgentState state = AgentState.PENDING_APPROVAL;

    @JsonProperty("approved")
    private boolean approved;

    @JsonProperty("registered_at")
    private Instant registeredAt;

    @JsonProperty("last_heartbeat")
    private Instant lastHeartbeat;

    @JsonIgnore
    private long registrationSequence;

    public AgentInfo() {
    }

    public AgentInfo(String agentId, String hostname, String address, int port, String ownedRange) {
        this.agentId = agentId;
        this.hostname = hostname;
        this.address = address;
        this.port = port;
        this.ownedRange = ownedRange;
    }

    /**
     * Copy constructor used to hand out snapshots that are safe to read while
     * the registry keeps mutating the original.
     */
    public AgentInfo(AgentInfo other) {
        this.agentId = other.agentId;
        this.hostname = other.hostname;
        this.address = other.address;
        this.port = other.port;
        this.ownedRange = other.ownedRange;
        this.state = other.state;
        this.approved = other.approved;
        this.registeredAt = other.registeredAt;
        this.lastHeartbeat = other.lastHeartbeat;
        this.registrationSequence = other.registrationSequence;
    }

    /**
     * Moves the agent to a new lifecycle state.
     *
     * @param target the new state
     * @throws InvalidTransitionException if the state table forbids the move, or
     *                                    the target is live and the agent is not approved
     */
    public void transitionTo(AgentState target) throws InvalidTransitionException {
        if (!state.canTransitionTo(target) || (target.isLive() && !approved)) {
            throw new InvalidTransitionException(agentId, state, target, state.getValidTransitions());
        }
        state = target;
    }

    /**
     * Checks whether the last heartbeat is older than the given timeout.
     * An agent that never sent a heartbeat is always expired.
     */
    public boolean isHeartbeatExpired(Instant now, Duration timeout) {
        return lastHeartbeat == null || lastHeartbeat.plus(timeout).isBefore(now);
    }

    @JsonIgnore
    public boolean isEligible() {
        return approved && state.isLive();
    }

    /**
     * Base URL for work-order calls to this agent.
     */
    @JsonIgnore
    public String getBaseUrl() {
        return "http://" + address + ":" + port;
    }

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public String getHostname() {
        return hostname;
    }

    public void setHostname(String hostname) {
        this.hostname = hostname;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getOwnedRange() {
        return ownedRange;
    }

    public void setOwnedRange(String ownedRange) {
        this.ownedRange = ownedRange;
    }

    public AgentState getState() {
        return state;
    }

    public boolean isApproved() {
        return approved;
    }

    public void setApproved(boolean approved) {
        this.approved = approved;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(Instant registeredAt) {
        this.registeredAt = registeredAt;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public void setLastHeartbeat(Instant lastHeartbeat) {
        this.lastHeartbeat = lastHeartbeat;
    }

    public long getRegistrationSequence() {
        return registrationSequence;
    }

    public void setRegistrationSequence(long registrationSequence) {
        this.registrationSequence = registrationSequence;
    }

    @Override
    public String toString() {
        return "AgentInfo{agentId='" + agentId + "', address='" + address + ":" + port
                + "', range='" + ownedRange + "', state=" + state + ", approved=" + approved + '}';
    }
}
