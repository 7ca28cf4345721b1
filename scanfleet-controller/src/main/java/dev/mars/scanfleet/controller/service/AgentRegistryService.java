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
import dev.mars.scanfleet.controller.state.ScanFleetStateStore;
import dev.mars.scanfleet.core.exceptions.AgentNotFoundException;
import dev.mars.scanfleet.core.exceptions.InvalidTransitionException;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import dev.mars.scanfleet.network.TargetSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Owns agent lifecycle: self-registration through heartbeats, operator approval and
 * revocation, and the eligibility query the dispatcher uses.
 *
 * <p>Stored {@link AgentInfo} instances are only mutated while holding their monitor.
 * Every read hands out a copy, so callers never observe a half-applied update.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-20
 */
public class AgentRegistryService {

    private static final Logger logger = LoggerFactory.getLogger(AgentRegistryService.class);

    private final ScanFleetStateStore store;
    private final Duration heartbeatTimeout;
    private final Clock clock;

    public AgentRegistryService(ScanFleetStateStore store, Duration heartbeatTimeout, Clock clock) {
        this.store = store;
        this.heartbeatTimeout = heartbeatTimeout;
        this.clock = clock;
    }

    /**
     * Inserts a new agent in {@code PENDING_APPROVAL}, or refreshes the network
     * identity of a known one. Calling it twice with the same values changes nothing.
     *
     * @return a snapshot of the stored agent
     * @throws ValidationException if a field is missing or the owned range does not parse
     */
    public AgentInfo registerOrUpdate(String agentId, String hostname, String address, int port, String ownedRange)
            throws ValidationException {
        return upsert(agentId, hostname, address, port, ownedRange, null).agent();
    }

    /**
     * Records a heartbeat, registering the agent if it is unknown. Approved agents
     * come online; an agent in {@code SCANNING} stays there. Unapproved agents keep
     * their state and receive the pending signal.
     */
    public HeartbeatOutcome recordHeartbeat(String agentId, String hostname, String address, int port,
                                            String ownedRange) throws ValidationException {
        Upsert upsert = upsert(agentId, hostname, address, port, ownedRange, clock.instant());
        AgentInfo agent = upsert.stored();

        synchronized (agent) {
            if (agent.isApproved() && agent.getState() == AgentState.OFFLINE) {
                transition(agent, AgentState.ONLINE);
                logger.info("Agent came online: agentId={}, address={}:{}", agentId, address, port);
            }
            HeartbeatOutcome outcome = new HeartbeatOutcome(agentId, agent.isApproved(), agent.getState(), upsert.created());
            if (outcome.isPending()) {
                logger.debug("Heartbeat from unapproved agent: agentId={}", agentId);
            }
            return outcome;
        }
    }

    /**
     * Approves an agent, leaving it {@code OFFLINE} until its next heartbeat.
     * Approving an approved agent is a no-op.
     */
    public AgentInfo approve(String agentId) throws AgentNotFoundException {
        AgentInfo agent = require(agentId);
        synchronized (agent) {
            if (agent.isApproved()) {
                logger.debug("Agent already approved: agentId={}", agentId);
                return new AgentInfo(agent);
            }
            agent.setApproved(true);
            transition(agent, AgentState.OFFLINE);
            logger.info("Agent approved: agentId={}, ownedRange={}", agentId, agent.getOwnedRange());
            return new AgentInfo(agent);
        }
    }

    /**
     * Withdraws approval. The agent drops back to {@code PENDING_APPROVAL}, which is
     * offline and unapproved, and stops being eligible for dispatch immediately.
     * Tasks it already holds are left to finish.
     */
    public AgentInfo revoke(String agentId) throws AgentNotFoundException {
        AgentInfo agent = require(agentId);
        synchronized (agent) {
            agent.setApproved(false);
            if (agent.getState() != AgentState.PENDING_APPROVAL) {
                transition(agent, AgentState.PENDING_APPROVAL);
            }
            logger.info("Agent approval revoked: agentId={}", agentId);
            return new AgentInfo(agent);
        }
    }

    public void delete(String agentId) throws AgentNotFoundException {
        if (!store.removeAgent(agentId)) {
            throw new AgentNotFoundException(agentId);
        }
        logger.info("Agent deleted: agentId={}", agentId);
    }

    public Optional<AgentInfo> find(String agentId) {
        return store.findAgent(agentId).map(this::snapshot);
    }

    /**
     * @return snapshots of all agents in registration order
     */
    public List<AgentInfo> list() {
        return store.agentsInRegistrationOrder().stream().map(this::snapshot).toList();
    }

    /**
     * Approved agents that are {@code ONLINE} or {@code SCANNING}, have a heartbeat
     * within the timeout, and own part of the target. Ordered by registration.
     */
    public List<EligibleAgent> eligibleAgents(TargetSpec target) {
        Instant now = clock.instant();
        List<EligibleAgent> eligible = new ArrayList<>();
        for (AgentInfo stored : store.agentsInRegistrationOrder()) {
            AgentInfo agent = snapshot(stored);
            if (!agent.isEligible() || agent.isHeartbeatExpired(now, heartbeatTimeout)) {
                continue;
            }
            TargetSpec owned;
            try {
                owned = TargetSpec.parseOwnership(agent.getOwnedRange());
            } catch (ValidationException e) {
                logger.warn("Skipping agent with unparseable owned range: agentId={}, range={}",
                        agent.getAgentId(), agent.getOwnedRange());
                continue;
            }
            if (owned.intersects(target)) {
                eligible.add(new EligibleAgent(agent, owned));
            }
        }
        return eligible;
    }

    /**
     * Marks an agent as working on a work order it just accepted.
     */
    public void markScanning(String agentId) {
        store.findAgent(agentId).ifPresent(agent -> {
            synchronized (agent) {
                if (agent.getState() == AgentState.ONLINE) {
                    transition(agent, AgentState.SCANNING);
                }
            }
        });
    }

    /**
     * Returns agents from {@code SCANNING} to {@code ONLINE} once their task group is
     * finished. Agents in any other state are left alone.
     */
    public void markIdle(Collection<String> agentIds) {
        for (String agentId : agentIds) {
            store.findAgent(agentId).ifPresent(agent -> {
                synchronized (agent) {
                    if (agent.getState() == AgentState.SCANNING) {
                        transition(agent, AgentState.ONLINE);
                        logger.debug("Agent finished scanning: agentId={}", agentId);
                    }
                }
            });
        }
    }

    /**
     * Moves live agents with an expired heartbeat to {@code OFFLINE}.
     *
     * @return ids of the agents that were demoted
     */
    public List<String> demoteExpired(Instant now) {
        List<String> demoted = new ArrayList<>();
        for (AgentInfo agent : store.agentsInRegistrationOrder()) {
            synchronized (agent) {
                if (agent.getState().isLive() && agent.isHeartbeatExpired(now, heartbeatTimeout)) {
                    transition(agent, AgentState.OFFLINE);
                    demoted.add(agent.getAgentId());
                    logger.warn("Agent missed heartbeats, marked offline: agentId={}, lastHeartbeat={}",
                            agent.getAgentId(), agent.getLastHeartbeat());
                }
            }
        }
        return demoted;
    }

    public Duration getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    // ── Internal helpers ───────────────────────────────────────────────

    private Upsert upsert(String agentId, String hostname, String address, int port, String ownedRange,
                          Instant heartbeatAt) throws ValidationException {
        validate(agentId, hostname, address, port, ownedRange);

        AgentInfo candidate = new AgentInfo(agentId, hostname, address, port, ownedRange.trim());
        candidate.setRegisteredAt(clock.instant());
        candidate.setLastHeartbeat(heartbeatAt);
        AgentInfo stored = store.putAgentIfAbsent(candidate);
        boolean created = stored == candidate;

        if (created) {
            logger.info("New agent registered, awaiting approval: agentId={}, hostname={}, ownedRange={}",
                    agentId, hostname, ownedRange);
        } else {
            synchronized (stored) {
                stored.setHostname(hostname);
                stored.setAddress(address);
                stored.setPort(port);
                stored.setOwnedRange(ownedRange.trim());
                if (heartbeatAt != null) {
                    stored.setLastHeartbeat(heartbeatAt);
                }
            }
        }
        return new Upsert(stored, created);
    }

    private static void validate(String agentId, String hostname, String address, int port, String ownedRange)
            throws ValidationException {
        if (agentId == null || agentId.isBlank()) {
            throw new ValidationException("agent id is required");
        }
        if (hostname == null || hostname.isBlank()) {
            throw new ValidationException("hostname is required");
        }
        if (address == null || address.isBlank()) {
            throw new ValidationException("address is required");
        }
        if (port < 1 || port > 65535) {
            throw new ValidationException("port must be between 1 and 65535, got " + port);
        }
        if (ownedRange == null || ownedRange.isBlank()) {
            throw new ValidationException("owned_range is required");
        }
        TargetSpec.parseOwnership(ownedRange);
    }

    private AgentInfo require(String agentId) throws AgentNotFoundException {
        return store.findAgent(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    private AgentInfo snapshot(AgentInfo agent) {
        synchronized (agent) {
            return new AgentInfo(agent);
        }
    }

    /**
     * Applies a transition the caller has already checked against the table.
     */
    private static void transition(AgentInfo agent, AgentState target) {
        try {
            agent.transitionTo(target);
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private record Upsert(AgentInfo stored, boolean created) {
        AgentInfo agent() {
            synchronized (stored) {
                return new AgentInfo(stored);
            }
        }
    }

    /**
     * An eligible agent together with its parsed owned range.
     */
    public record EligibleAgent(AgentInfo agent, TargetSpec ownedRange) {

        public String agentId() {
            return agent.getAgentId();
        }
    }
}
