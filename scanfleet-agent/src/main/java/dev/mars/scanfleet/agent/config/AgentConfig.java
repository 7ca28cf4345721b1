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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Properties;

/**
 * Centralized configuration loader for the ScanFleet agent.
 *
 * <p>Loads {@code scanfleet-agent.properties} from the classpath. Environment variables
 * take precedence using uppercase with underscores (e.g., scanfleet.agent.port ->
 * SCANFLEET_AGENT_PORT), then system properties, then the file, then the defaults.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-28
 */
public final class AgentConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);
    private static final String CONFIG_FILE = "scanfleet-agent.properties";
    private static final AgentConfig INSTANCE = new AgentConfig();

    private final Properties properties;

    private AgentConfig() {
        this.properties = new Properties();
        loadProperties();
        logConfiguration();
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static AgentConfig get() {
        return INSTANCE;
    }

    // ==================== Agent Identity ====================

    /**
     * Gets the agent ID. Falls back to the MAC address of the first non-loopback
     * interface, then to the hostname, so the id survives restarts.
     */
    public String getAgentId() {
        String agentId = getString("scanfleet.agent.id", "");
        if (agentId.isEmpty()) {
            agentId = deriveAgentIdFromMac();
        }
        return agentId;
    }

    public String getHostname() {
        String hostname = getString("scanfleet.agent.hostname", "");
        if (!hostname.isEmpty()) {
            return hostname;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("Could not determine hostname: {}", e.getMessage());
            return "unknown";
        }
    }

    public String getVersion() {
        return getString("scanfleet.agent.version", "1.0.0");
    }

    // ==================== Controller Connection ====================

    public String getControllerUrl() {
        return getString("scanfleet.agent.controller.url", "http://localhost:5000/api/v1");
    }

    public int getHttpConnectTimeoutMs() {
        return getInt("scanfleet.agent.http.connect-timeout-ms", 10000);
    }

    // ==================== Network Configuration ====================

    public String getBindHost() {
        return getString("scanfleet.agent.host", "0.0.0.0");
    }

    public int getAgentPort() {
        return getInt("scanfleet.agent.port", 8080);
    }

    /**
     * Address the controller uses to reach this agent. Defaults to the first
     * IPv4 address of a non-loopback interface.
     */
    public String getAdvertisedAddress() {
        String address = getString("scanfleet.agent.address", "");
        return address.isEmpty() ? detectIpv4Address() : address;
    }

    /**
     * Range this agent is responsible for, as CIDR, dash range or a single address.
     */
    public String getOwnedRange() {
        return getString("scanfleet.agent.owned-range", "192.168.0.0/24");
    }

    // ==================== Heartbeat Configuration ====================

    public long getHeartbeatIntervalMs() {
        return getLong("scanfleet.agent.heartbeat.interval-ms", 60000);
    }

    /**
     * Poll interval while waiting for approval when the controller sends no hint.
     */
    public long getApprovalCheckIntervalMs() {
        return getLong("scanfleet.agent.heartbeat.approval-check-interval-ms", 30000);
    }

    // ==================== Result Submission ====================

    public int getRetryAttempts() {
        return getInt("scanfleet.agent.results.retry-attempts", 3);
    }

    public long getRetryDelayMs() {
        return getLong("scanfleet.agent.results.retry-delay-ms", 5000);
    }

    /**
     * Number of scanned targets between two progress submissions.
     */
    public int getProgressBatchSize() {
        return getInt("scanfleet.agent.results.progress-batch-size", 16);
    }

    // ==================== Scanning ====================

    public int getMaxConcurrentScans() {
        return getInt("scanfleet.agent.scan.max-concurrent", 2);
    }

    public int getPortConnectTimeoutMs() {
        return getInt("scanfleet.agent.scan.connect-timeout-ms", 1000);
    }

    public int getScanParallelism() {
        return getInt("scanfleet.agent.scan.parallelism", 64);
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., SCANFLEET_AGENT_CONTROLLER_URL)</li>
     *   <li>System property (e.g., -Dscanfleet.agent.controller.url=...)</li>
     *   <li>Properties file (scanfleet-agent.properties)</li>
     *   <li>Default value</li>
     * </ol>
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        return properties.getProperty(key, defaultValue);
    }

    /**
     * Validates that required configuration is present and values are sensible.
     * Called during startup to fail fast on misconfiguration.
     *
     * @throws IllegalStateException if required configuration is invalid
     */
    public void validate() {
        String controllerUrl = getControllerUrl();
        if (!controllerUrl.startsWith("http://") && !controllerUrl.startsWith("https://")) {
            throw new IllegalStateException(
                    "Controller URL must start with http:// or https://, got: " + controllerUrl);
        }

        int port = getAgentPort();
        if (port < 1 || port > 65535) {
            throw new IllegalStateException(
                    "Agent port must be between 1 and 65535, got: " + port);
        }

        if (getHeartbeatIntervalMs() <= 0) {
            throw new IllegalStateException(
                    "Heartbeat interval must be positive, got: " + getHeartbeatIntervalMs());
        }
        if (getRetryAttempts() <= 0) {
            throw new IllegalStateException(
                    "Retry attempts must be positive, got: " + getRetryAttempts());
        }
        if (getMaxConcurrentScans() <= 0) {
            throw new IllegalStateException(
                    "Max concurrent scans must be positive, got: " + getMaxConcurrentScans());
        }
        if (getOwnedRange().isBlank()) {
            throw new IllegalStateException("Owned range must be configured");
        }

        logger.info("Agent configuration validated successfully");
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // ==================== Private Helpers ====================

    private void loadProperties() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
    }

    private String deriveAgentIdFromMac() {
        try {
            for (NetworkInterface nic : candidateInterfaces()) {
                byte[] mac = nic.getHardwareAddress();
                if (mac != null && mac.length > 0) {
                    return formatMac(mac);
                }
            }
        } catch (SocketException e) {
            logger.warn("Could not read MAC address: {}", e.getMessage());
        }
        String fallback = getHostname();
        logger.info("No MAC address available, agent ID derived from hostname: {}", fallback);
        return fallback;
    }

    private String detectIpv4Address() {
        try {
            for (NetworkInterface nic : candidateInterfaces()) {
                for (InetAddress address : Collections.list(nic.getInetAddresses())) {
                    if (address instanceof Inet4Address && !address.isLoopbackAddress()) {
                        return address.getHostAddress();
                    }
                }
            }
        } catch (SocketException e) {
            logger.warn("Could not enumerate network interfaces: {}", e.getMessage());
        }
        return "127.0.0.1";
    }

    private static List<NetworkInterface> candidateInterfaces() throws SocketException {
        Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
        if (interfaces == null) {
            return List.of();
        }
        return Collections.list(interfaces).stream()
                .filter(nic -> {
                    try {
                        return nic.isUp() && !nic.isLoopback() && !nic.isVirtual();
                    } catch (SocketException e) {
                        logger.debug("Skipping interface {}: {}", nic.getName(), e.getMessage());
                        return false;
                    }
                })
                .toList();
    }

    /**
     * Formats a hardware address as uppercase hex without separators.
     */
    static String formatMac(byte[] mac) {
        StringBuilder sb = new StringBuilder(mac.length * 2);
        for (byte b : mac) {
            sb.append(String.format("%02X", b));
        }
        return sb.toString();
    }

    private void logConfiguration() {
        logger.info("=== ScanFleet Agent Configuration ===");
        logger.info("  Agent ID:             {}", getAgentId());
        logger.info("  Hostname:             {}", getHostname());
        logger.info("  Bind:                 {}:{}", getBindHost(), getAgentPort());
        logger.info("  Advertised Address:   {}", getAdvertisedAddress());
        logger.info("  Owned Range:          {}", getOwnedRange());
        logger.info("  Controller URL:       {}", getControllerUrl());
        logger.info("  Version:              {}", getVersion());
        logger.info("  --- Heartbeat ---");
        logger.info("  Interval:             {}ms", getHeartbeatIntervalMs());
        logger.info("  Approval Check:       {}ms", getApprovalCheckIntervalMs());
        logger.info("  --- Results ---");
        logger.info("  Retry Attempts:       {}", getRetryAttempts());
        logger.info("  Retry Delay:          {}ms", getRetryDelayMs());
        logger.info("  Progress Batch:       {}", getProgressBatchSize());
        logger.info("  --- Scanning ---");
        logger.info("  Max Concurrent:       {}", getMaxConcurrentScans());
        logger.info("  Connect Timeout:      {}ms", getPortConnectTimeoutMs());
        logger.info("  Parallelism:          {}", getScanParallelism());
        logger.info("=====================================");
    }
}
