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

package dev.mars.scanfleet.result;

import dev.mars.scanfleet.core.HostResult;
import dev.mars.scanfleet.core.PortDetail;
import dev.mars.scanfleet.core.ResultCounters;
import dev.mars.scanfleet.network.Ipv4;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges partial per-host scan data into an aggregated view.
 *
 * <p>Merge rules per host:</p>
 * <ul>
 *   <li>hostname and state are overwritten by the incoming value (an empty
 *       incoming hostname keeps the existing one)</li>
 *   <li>open ports become the set union of both sides</li>
 *   <li>port details are updated key by key, incoming values winning</li>
 * </ul>
 *
 * <p>Port merging is commutative and idempotent, so resubmitting identical data
 * changes nothing. Counters are always recomputed from the merged map rather
 * than incremented.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ResultMerger {

    private static final Logger logger = LoggerFactory.getLogger(ResultMerger.class);

    private ResultMerger() {
    }

    /**
     * Merges an incoming submission into an existing per-host map.
     *
     * @param existing current merged state (not modified)
     * @param incoming hosts reported by one submission
     * @return a new map holding the merged state
     */
    public static Map<String, HostResult> merge(Map<String, HostResult> existing,
                                                Map<String, HostResult> incoming) {
        Map<String, HostResult> merged = new TreeMap<>(Ipv4.ADDRESS_ORDER);
        merged.putAll(existing);
        for (Map.Entry<String, HostResult> entry : incoming.entrySet()) {
            merged.merge(entry.getKey(), entry.getValue(), ResultMerger::mergeHost);
        }
        return merged;
    }

    /**
     * Merges one host's incoming data into its existing entry.
     */
    public static HostResult mergeHost(HostResult existing, HostResult incoming) {
        String hostname = incoming.hostname().isEmpty() ? existing.hostname() : incoming.hostname();
        if (existing.state() != incoming.state()) {
            logger.debug("Host state overwritten by later submission: {} -> {} (hostname={})",
                    existing.state(), incoming.state(), hostname);
        }

        TreeSet<Integer> ports = new TreeSet<>(existing.openPorts());
        ports.addAll(incoming.openPorts());

        Map<Integer, PortDetail> details = new TreeMap<>(existing.portDetails());
        details.putAll(incoming.portDetails());

        return new HostResult(hostname, incoming.state(), ports.stream().toList(), details);
    }

    /**
     * Derives the running counters from a merged per-host map.
     *
     * @param hosts                merged hosts
     * @param reportedErrorTargets error targets the agents reported in their summaries
     * @return counters; failed targets is the larger of hosts in error state and
     *         the reported figure, so errors counted both ways are not doubled
     */
    public static ResultCounters computeCounters(Map<String, HostResult> hosts, int reportedErrorTargets) {
        int completed = 0;
        int errored = 0;
        int openPorts = 0;
        for (HostResult host : hosts.values()) {
            if (host.state().isCompleted()) {
                completed++;
            } else {
                errored++;
            }
            openPorts += host.openPorts().size();
        }
        return new ResultCounters(hosts.size(), completed, Math.max(errored, reportedErrorTargets), openPorts);
    }
}
