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

package dev.mars.scanfleet.controller.config;

/**
 * Plain values the controller's services are built from. Tests create these
 * directly; the verticle builds them from {@link AppConfig}.
 */
public record ControllerSettings(
        String httpHost,
        int httpPort,
        long maxBodyBytes,
        long heartbeatCheckIntervalMs,
        long heartbeatTimeoutMs,
        int pendingRetryAfterSeconds,
        long dispatchTimeoutMs,
        int maxTargetAddresses,
        long resultProcessingBaseMs,
        long resultProcessingPerTargetMs,
        long resultProcessingMaxMs,
        String version) {

    public static ControllerSettings defaults() {
        return new ControllerSettings("0.0.0.0", 5000, 10L * 1024 * 1024, 60000, 180000, 60,
                5000, 65536, 2000, 10, 30000, "1.0.0");
    }

    public static ControllerSettings from(AppConfig config) {
        return new ControllerSettings(
                config.getHttpHost(),
                config.getHttpPort(),
                config.getMaxBodyBytes(),
                config.getHeartbeatCheckIntervalMs(),
                config.getHeartbeatTimeoutMs(),
                config.getPendingRetryAfterSeconds(),
                config.getDispatchTimeoutMs(),
                config.getMaxTargetAddresses(),
                config.getResultProcessingBaseMs(),
                config.getResultProcessingPerTargetMs(),
                config.getResultProcessingMaxMs(),
                config.getVersion());
    }

    public ControllerSettings withHttpPort(int port) {
        return new ControllerSettings(httpHost, port, maxBodyBytes, heartbeatCheckIntervalMs, heartbeatTimeoutMs,
                pendingRetryAfterSeconds, dispatchTimeoutMs, maxTargetAddresses, resultProcessingBaseMs,
                resultProcessingPerTargetMs, resultProcessingMaxMs, version);
    }

    public ControllerSettings withDispatchTimeoutMs(long timeoutMs) {
        return new ControllerSettings(httpHost, httpPort, maxBodyBytes, heartbeatCheckIntervalMs, heartbeatTimeoutMs,
                pendingRetryAfterSeconds, timeoutMs, maxTargetAddresses, resultProcessingBaseMs,
                resultProcessingPerTargetMs, resultProcessingMaxMs, version);
    }

    public ControllerSettings withMaxBodyBytes(long bytes) {
        return new ControllerSettings(httpHost, httpPort, bytes, heartbeatCheckIntervalMs, heartbeatTimeoutMs,
                pendingRetryAfterSeconds, dispatchTimeoutMs, maxTargetAddresses, resultProcessingBaseMs,
                resultProcessingPerTargetMs, resultProcessingMaxMs, version);
    }

    /**
     * Time allowed to merge a submission covering the given number of hosts.
     */
    public long resultProcessingTimeoutMs(int targets) {
        return Math.min(resultProcessingMaxMs, resultProcessingBaseMs + resultProcessingPerTargetMs * targets);
    }
}
