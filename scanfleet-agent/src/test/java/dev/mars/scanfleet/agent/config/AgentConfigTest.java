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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AgentConfig configuration loading. The test classpath carries its own
 * {@code scanfleet-agent.properties}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-28
 */
class AgentConfigTest {

    private static final String RETRY_KEY = "scanfleet.agent.results.retry-attempts";
    private static final String URL_KEY = "scanfleet.agent.controller.url";
    private static final String PORT_KEY = "scanfleet.agent.port";

    @AfterEach
    void clearOverrides() {
        System.clearProperty(RETRY_KEY);
        System.clearProperty(URL_KEY);
        System.clearProperty(PORT_KEY);
    }

    @Test
    @DisplayName("Should return singleton instance")
    void shouldReturnSingletonInstance() {
        assertSame(AgentConfig.get(), AgentConfig.get(), "Should return the same singleton instance");
    }

    @Test
    @DisplayName("Should read values from the properties file")
    void shouldReadPropertiesFile() {
        AgentConfig config = AgentConfig.get();

        assertEquals("agent-under-test", config.getAgentId());
        assertEquals("test-host", config.getHostname());
        assertEquals(8081, config.getAgentPort());
        assertEquals("127.0.0.1", config.getAdvertisedAddress());
        assertEquals("10.0.0.0/24", config.getOwnedRange());
        assertEquals("1.0.0-test", config.getVersion());
    }

    @Test
    @DisplayName("Should fall back to defaults for absent keys")
    void shouldUseDefaults() {
        AgentConfig config = AgentConfig.get();

        assertEquals(30000, config.getApprovalCheckIntervalMs());
        assertEquals(16, config.getProgressBatchSize());
        assertEquals(1000, config.getPortConnectTimeoutMs());
        assertEquals(10000, config.getHttpConnectTimeoutMs());
    }

    @Test
    @DisplayName("Should use the default when a value does not parse")
    void shouldIgnoreUnparseableValue() {
        assertEquals(64, AgentConfig.get().getScanParallelism());
    }

    @Test
    @DisplayName("System property should override the properties file")
    void systemPropertyOverridesFile() {
        assertEquals(3, AgentConfig.get().getRetryAttempts());

        System.setProperty(RETRY_KEY, "7");

        assertEquals(7, AgentConfig.get().getRetryAttempts());
    }

    @Test
    @DisplayName("Should validate the test configuration")
    void shouldValidate() {
        assertDoesNotThrow(() -> AgentConfig.get().validate());
    }

    @Test
    @DisplayName("Should reject a controller URL without http scheme")
    void shouldRejectControllerUrl() {
        System.setProperty(URL_KEY, "ftp://controller:21");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AgentConfig.get().validate());
        assertTrue(e.getMessage().contains("ftp://controller:21"));
    }

    @Test
    @DisplayName("Should reject an out of range port")
    void shouldRejectPort() {
        System.setProperty(PORT_KEY, "70000");

        assertThrows(IllegalStateException.class, () -> AgentConfig.get().validate());
    }

    @Test
    @DisplayName("Should format MAC addresses as uppercase hex")
    void shouldFormatMac() {
        byte[] mac = {0x00, 0x1a, (byte) 0x2b, (byte) 0xfc, 0x0d, (byte) 0xee};

        assertEquals("001A2BFC0DEE", AgentConfig.formatMac(mac));
    }

    @Test
    @DisplayName("Settings should carry the configured values")
    void settingsFromConfig() {
        AgentSettings settings = AgentSettings.from(AgentConfig.get());

        assertEquals("agent-under-test", settings.agentId());
        assertEquals("http://localhost:5000/api/v1", settings.controllerUrl());
        assertEquals(60000, settings.heartbeatIntervalMs());
        assertEquals(5000, settings.retryDelayMs());
        assertEquals(2, settings.maxConcurrentScans());
    }
}
