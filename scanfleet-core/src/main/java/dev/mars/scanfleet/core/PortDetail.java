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

package dev.mars.scanfleet.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Service fingerprint reported for one open port.
 *
 * @param protocol  transport protocol, usually {@code tcp}
 * @param name      service name, e.g. {@code http}
 * @param product   product banner, e.g. {@code nginx}
 * @param version   product version
 * @param extraInfo any additional detail the scanner reported
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record PortDetail(
        @JsonProperty("protocol") String protocol,
        @JsonProperty("name") String name,
        @JsonProperty("product") String product,
        @JsonProperty("version") String version,
        @JsonProperty("extrainfo") String extraInfo) {

    public static final String DEFAULT_PROTOCOL = "tcp";

    public PortDetail {
        protocol = protocol == null || protocol.isBlank() ? DEFAULT_PROTOCOL : protocol;
        name = nullToEmpty(name);
        product = nullToEmpty(product);
        version = nullToEmpty(version);
        extraInfo = nullToEmpty(extraInfo);
    }

    public static PortDetail unknown() {
        return new PortDetail(DEFAULT_PROTOCOL, "", "", "", "");
    }

    /**
     * Compares only the service fingerprint (name, product, version, extra info).
     * Protocol is part of the port identity, not the service.
     */
    public boolean sameServiceAs(PortDetail other) {
        return Objects.equals(name, other.name)
                && Objects.equals(product, other.product)
                && Objects.equals(version, other.version)
                && Objects.equals(extraInfo, other.extraInfo);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
