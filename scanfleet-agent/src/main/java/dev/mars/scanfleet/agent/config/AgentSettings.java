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

package dev.mars.scanfleet.agent.config;

/**
 * Plain values the agent's services are built from. Tests create these directly;
 * {@link dev.mars.scanfleet.agent.ScanFleetAgent} builds them from {@link AgentConfig}.
 */
public record AgentSettings(
        String agentId,
        String hostname,
        String advertisedAddress,
        String bindHost,
        int port,
        String ownedRange,
        String controllerUrl,
        int httpConnectTimeoutMs,
        long heartbeatIntervalMs,
        long approvalCheckIntervalMs,
        int retryAttempts,
        long retryDelayMs,
        int progressBatchSize,
        int maxConcurrentScans,
        int portConnectTimeoutMs,
        int scanParallelism,
        String version) {

    public static AgentSettings from(AgentConfig config) {
        return new AgentSettings(
                config.getAgentId(),
                config.getHostname(),
                config.getAdvertisedAddress(),
                config.getBindHost(),
                config.getAgentPort(),
                config.getOwnedRange(),
                config.getControllerUrl(),
                config.getHttpConnectTimeoutMs(),
                config.getHeartbeatIntervalMs(),
                config.getApprovalCheckIntervalMs(),
                config.getRetryAttempts(),
                config.getRetryDelayMs(),
                config.getProgressBatchSize(),
                config.getMaxConcurrentScans(),
                config.getPortConnectTimeoutMs(),
                config.getScanParallelism(),
                config.getVersion());
    }

    /**
     * Settings for an agent talking to the given controller, with the configured defaults
     * for everything else.
     */
    public static AgentSettings forController(String agentId, String controllerUrl, String ownedRange) {
        return new AgentSettings(agentId, "localhost", "127.0.0.1", "127.0.0.1", 8080, ownedRange,
                controllerUrl, 10000, 60000, 30000, 3, 5000, 16, 2, 1000, 64, "1.0.0");
    }

    public AgentSettings withPort(int port) {
        return new AgentSettings(agentId, hostname, advertisedAddress, bindHost, port, ownedRange, controllerUrl,
                httpConnectTimeoutMs, heartbeatIntervalMs, approvalCheckIntervalMs, retryAttempts, retryDelayMs,
                progressBatchSize, maxConcurrentScans, portConnectTimeoutMs, scanParallelism, version);
    }

    public AgentSettings withRetry(int attempts, long delayMs) {
        return new AgentSettings(agentId, hostname, advertisedAddress, bindHost, port, ownedRange, controllerUrl,
                httpConnectTimeoutMs, heartbeatIntervalMs, approvalCheckIntervalMs, attempts, delayMs,
                progressBatchSize, maxConcurrentScans, portConnectTimeoutMs, scanParallelism, version);
    }

    public AgentSettings withProgressBatchSize(int batchSize) {
        return new AgentSettings(agentId, hostname, advertisedAddress, bindHost, port, ownedRange, controllerUrl,
                httpConnectTimeoutMs, heartbeatIntervalMs, approvalCheckIntervalMs, retryAttempts, retryDelayMs,
                batchSize, maxConcurrentScans, portConnectTimeoutMs, scanParallelism, version);
    }

    public AgentSettings withMaxConcurrentScans(int maxScans) {
        return new AgentSettings(agentId, hostname, advertisedAddress, bindHost, port, ownedRange, controllerUrl,
                httpConnectTimeoutMs, heartbeatIntervalMs, approvalCheckIntervalMs, retryAttempts, retryDelayMs,
                progressBatchSize, maxScans, portConnectTimeoutMs, scanParallelism, version);
    }
}
