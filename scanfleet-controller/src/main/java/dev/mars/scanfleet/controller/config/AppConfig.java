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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Centralized configuration for the ScanFleet controller.
 *
 * <p>Loads {@code scanfleet-controller.properties} from the classpath with environment
 * variable override support. Environment variables take precedence and use uppercase
 * with underscores (e.g., scanfleet.http.port -> SCANFLEET_HTTP_PORT).
 *
 * <p>Only the verticle and the application entry point read this singleton. Services
 * receive the values they need through their constructors.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-28
 */
public final class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private static final String CONFIG_FILE = "scanfleet-controller.properties";
    private static final AppConfig INSTANCE = new AppConfig();

    private final Properties properties;

    private AppConfig() {
        this.properties = new Properties();
        loadProperties();
        logConfiguration();
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static AppConfig get() {
        return INSTANCE;
    }

    // ==================== HTTP Configuration ====================

    public int getHttpPort() {
        return getInt("scanfleet.http.port", 5000);
    }

    public String getHttpHost() {
        return getString("scanfleet.http.host", "0.0.0.0");
    }

    /**
     * Upper bound for request bodies, applied by the Vert.x {@code BodyHandler}.
     */
    public long getMaxBodyBytes() {
        return getLong("scanfleet.http.max-body-bytes", 10L * 1024 * 1024);
    }

    // ==================== Heartbeat Monitor ====================

    public long getHeartbeatCheckIntervalMs() {
        return getLong("scanfleet.heartbeat.check-interval-ms", 60000);
    }

    public long getHeartbeatTimeoutMs() {
        return getLong("scanfleet.heartbeat.timeout-ms", 180000);
    }

    /**
     * Seconds a pending agent is told to wait before its next heartbeat.
     */
    public int getPendingRetryAfterSeconds() {
        return getInt("scanfleet.heartbeat.pending-retry-after-seconds", 60);
    }

    // ==================== Dispatch ====================

    public long getDispatchTimeoutMs() {
        return getLong("scanfleet.dispatch.timeout-ms", 5000);
    }

    public int getMaxTargetAddresses() {
        return getInt("scanfleet.dispatch.max-target-addresses", 65536);
    }

    // ==================== Result Processing ====================

    public long getResultProcessingBaseMs() {
        return getLong("scanfleet.results.processing.base-ms", 2000);
    }

    public long getResultProcessingPerTargetMs() {
        return getLong("scanfleet.results.processing.per-target-ms", 10);
    }

    public long getResultProcessingMaxMs() {
        return getLong("scanfleet.results.processing.max-ms", 30000);
    }

    // ==================== Shutdown ====================

    public long getShutdownDrainTimeoutMs() {
        return getLong("scanfleet.shutdown.drain.timeout.ms", 5000L);
    }

    public long getShutdownTimeoutMs() {
        return getLong("scanfleet.shutdown.timeout.ms", 30000L);
    }

    // ==================== Telemetry Configuration ====================

    public boolean isTelemetryEnabled() {
        return getBoolean("scanfleet.telemetry.enabled", true);
    }

    public String getOtlpEndpoint() {
        return getString("scanfleet.telemetry.otlp.endpoint", "http://localhost:4317");
    }

    public int getPrometheusPort() {
        return getInt("scanfleet.telemetry.prometheus.port", 9464);
    }

    public String getServiceName() {
        return getString("scanfleet.telemetry.service.name", "scanfleet-controller");
    }

    // ==================== Application Info ====================

    public String getVersion() {
        return getString("scanfleet.version", "1.0.0");
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with environment variable and system property override.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., SCANFLEET_HTTP_PORT)</li>
     *   <li>System property (e.g., -Dscanfleet.http.port=5000)</li>
     *   <li>Properties file (scanfleet-controller.properties)</li>
     *   <li>Default value</li>
     * </ol>
     *
     * @param key the property key (e.g., "scanfleet.http.port")
     * @param defaultValue the default value if not found
     * @return the resolved property value
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isEmpty()) {
            return sysValue;
        }

        return properties.getProperty(key, defaultValue);
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

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ==================== Private Helpers ====================

    private void loadProperties() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
    }

    private void logConfiguration() {
        logger.info("=== ScanFleet Controller Configuration ===");
        logger.info("  HTTP Host:            {}", getHttpHost());
        logger.info("  HTTP Port:            {}", getHttpPort());
        logger.info("  Max Body:             {} bytes", getMaxBodyBytes());
        logger.info("  Version:              {}", getVersion());
        logger.info("  --- Heartbeat ---");
        logger.info("  Check Interval:       {}ms", getHeartbeatCheckIntervalMs());
        logger.info("  Timeout:              {}ms", getHeartbeatTimeoutMs());
        logger.info("  --- Dispatch ---");
        logger.info("  Work Order Timeout:   {}ms", getDispatchTimeoutMs());
        logger.info("  Max Target Addresses: {}", getMaxTargetAddresses());
        logger.info("  --- Result Processing ---");
        logger.info("  Base / Per Target:    {}ms / {}ms", getResultProcessingBaseMs(), getResultProcessingPerTargetMs());
        logger.info("  Max:                  {}ms", getResultProcessingMaxMs());
        logger.info("  --- Telemetry ---");
        logger.info("  Enabled:              {}", isTelemetryEnabled());
        logger.info("  OTLP Endpoint:        {}", getOtlpEndpoint());
        logger.info("  Prometheus Port:      {}", getPrometheusPort());
        logger.info("==========================================");
    }
}
