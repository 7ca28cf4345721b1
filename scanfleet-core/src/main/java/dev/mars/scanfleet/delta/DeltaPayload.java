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

package dev.mars.scanfleet.delta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Structured difference between a baseline and a current scan.
 *
 * <p>Ports of hosts that appeared or vanished are folded into
 * {@code newPorts} and {@code closedPorts}; the host lists only name them.</p>
 */
public record DeltaPayload(
        @JsonProperty("new_hosts") List<String> newHosts,
        @JsonProperty("removed_hosts") List<String> removedHosts,
        @JsonProperty("new_ports") List<PortChange> newPorts,
        @JsonProperty("closed_ports") List<PortChange> closedPorts,
        @JsonProperty("changed_services") List<ServiceChange> changedServices) {

    public DeltaPayload {
        newHosts = List.copyOf(newHosts);
        removedHosts = List.copyOf(removedHosts);
        newPorts = List.copyOf(newPorts);
        closedPorts = List.copyOf(closedPorts);
        changedServices = List.copyOf(changedServices);
    }

    @JsonIgnore
    public boolean hasChanges() {
        return !newHosts.isEmpty() || !removedHosts.isEmpty() || !newPorts.isEmpty()
                || !closedPorts.isEmpty() || !changedServices.isEmpty();
    }

    /**
     * Newly opened ports whose number is in the given watch list.
     */
    public List<PortChange> portsOpenedIn(Set<Integer> watched) {
        return newPorts.stream()
                .filter(change -> watched.contains(change.port()))
                .toList();
    }
}
