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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle states of a scanning agent as seen by the controller.
 *
 * <p>
 * Approval is tracked separately on {@link AgentInfo}; the transition table
 * below encodes which states an approved agent may move between. An agent that
 * has never been approved sits in {@code PENDING_APPROVAL} and the only way out
 * is an explicit approval, which lands it in {@code OFFLINE} until its next
 * heartbeat.
 * </p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 * @version 1.1
 */
public enum AgentState {

    /**
     * Agent has announced itself but an operator has not approved it yet.
     * Heartbeats are recorded for bookkeeping and answered with a pending signal.
     */
    PENDING_APPROVAL("pending_approval", "Agent is awaiting operator approval"),

    /**
     * Approved agent that is not currently sending heartbeats.
     */
    OFFLINE("offline", "Agent is approved but not reachable"),

    /**
     * Approved agent with a recent heartbeat, eligible for dispatch.
     */
    ONLINE("online", "Agent is online and available for scans"),

    /**
     * Approved agent that has accepted a work order which is still in progress.
     * Still eligible for dispatch.
     */
    SCANNING("scanning", "Agent is executing a scan");

    // ── Transition table (single source of truth) ──────────────────────

    private static final Map<AgentState, Set<AgentState>> TRANSITIONS;

    static {
        var map = new EnumMap<AgentState, Set<AgentState>>(AgentState.class);
        map.put(PENDING_APPROVAL, EnumSet.of(OFFLINE));
        map.put(OFFLINE, EnumSet.of(ONLINE, PENDING_APPROVAL));
        map.put(ONLINE, EnumSet.of(SCANNING, OFFLINE, PENDING_APPROVAL));
        map.put(SCANNING, EnumSet.of(ONLINE, OFFLINE, PENDING_APPROVAL));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;
    private final String description;

    AgentState(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Check whether the agent is considered alive, i.e. it has sent a heartbeat
     * within the liveness timeout.
     *
     * @return true for {@code ONLINE} and {@code SCANNING}
     */
    public boolean isLive() {
        return this == ONLINE || this == SCANNING;
    }

    /**
     * Parse a state from its string value.
     *
     * @param value the state value
     * @return the corresponding state
     * @throws IllegalArgumentException if the value is null or not recognized
     */
    @JsonCreator
    public static AgentState fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Agent state value must not be null");
        }
        for (AgentState state : values()) {
            if (state.value.equalsIgnoreCase(value) || state.name().equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown agent state: " + value);
    }

    /**
     * Checks whether a transition from this state to the given target is valid.
     *
     * <pre>
     *   PENDING_APPROVAL → OFFLINE
     *   OFFLINE          → ONLINE, PENDING_APPROVAL
     *   ONLINE           → SCANNING, OFFLINE, PENDING_APPROVAL
     *   SCANNING         → ONLINE, OFFLINE, PENDING_APPROVAL
     * </pre>
     *
     * @param target the target state
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(AgentState target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(AgentState.class)).contains(target);
    }

    /**
     * Returns all valid target states from this state.
     *
     * @return unmodifiable set of valid targets
     */
    public Set<AgentState> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    @Override
    public String toString() {
        return value;
    }
}
