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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Scan outcome for one target address.
 *
 * <p>Open ports are always held sorted and free of duplicates, and the detail
 * map is keyed by port number in ascending order, so two results with the same
 * content compare equal regardless of the order they were assembled in.</p>
 *
 * @param hostname    reverse-resolved hostname, may be empty
 * @param state       reachability
 * @param openPorts   sorted open ports
 * @param portDetails service detail per port
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HostResult(
        @JsonProperty("hostname") String hostname,
        @JsonProperty("state") HostState state,
        @JsonProperty("open_ports") List<Integer> openPorts,
        @JsonProperty("port_details") Map<Integer, PortDetail> portDetails) {

    public HostResult {
        hostname = hostname == null ? "" : hostname;
        state = state == null ? HostState.UP : state;
        openPorts = openPorts == null
                ? List.of()
                : List.copyOf(new TreeSet<>(openPorts));
        portDetails = portDetails == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(portDetails));
    }

    /**
     * Detail for the given port, or {@link PortDetail#unknown()} when the scanner
     * reported the port open without fingerprinting it.
     */
    public PortDetail detailFor(int port) {
        PortDetail detail = portDetails.get(port);
        return detail != null ? detail : PortDetail.unknown();
    }
}
