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

import dev.mars.scanfleet.core.HostResult;
import dev.mars.scanfleet.core.PortDetail;
import dev.mars.scanfleet.network.Ipv4;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the difference between two scan snapshots.
 *
 * <p>The comparison is a pure function of its inputs. Output lists are ordered
 * by host address and then port number, so recomputing on identical inputs
 * yields an identical payload. It is deliberately not symmetric: swapping the
 * arguments swaps new and removed hosts, and opened and closed ports.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class DeltaComparator {

    private static final Logger logger = LoggerFactory.getLogger(DeltaComparator.class);

    /**
     * Ports whose appearance is worth flagging to an operator:
     * FTP, SSH, Telnet, SMB, MySQL, RDP and VNC.
     */
    public static final Set<Integer> CRITICAL_PORTS = Set.of(21, 22, 23, 445, 3306, 3389, 5900);

    private DeltaComparator() {
    }

    /**
     * Compares a baseline snapshot against the current one.
     *
     * @param baseline per-host results of the earlier scan
     * @param current  per-host results of the later scan
     * @return the structured delta
     */
    public static DeltaPayload compare(Map<String, HostResult> baseline, Map<String, HostResult> current) {
        TreeSet<String> baselineHosts = sortedKeys(baseline);
        TreeSet<String> currentHosts = sortedKeys(current);

        List<String> newHosts = new ArrayList<>();
        List<String> removedHosts = new ArrayList<>();
        List<PortChange> newPorts = new ArrayList<>();
        List<PortChange> closedPorts = new ArrayList<>();
        List<ServiceChange> changedServices = new ArrayList<>();

        TreeSet<String> allHosts = new TreeSet<>(Ipv4.ADDRESS_ORDER);
        allHosts.addAll(baselineHosts);
        allHosts.addAll(currentHosts);

        for (String host : allHosts) {
            HostResult before = baseline.get(host);
            HostResult after = current.get(host);
            if (before == null) {
                newHosts.add(host);
                for (int port : after.openPorts()) {
                    newPorts.add(PortChange.of(host, port, after.detailFor(port)));
                }
            } else if (after == null) {
                removedHosts.add(host);
                for (int port : before.openPorts()) {
                    closedPorts.add(PortChange.of(host, port, before.detailFor(port)));
                }
            } else {
                compareHost(host, before, after, newPorts, closedPorts, changedServices);
            }
        }

        logger.debug("Compared {} baseline hosts with {} current: +{} hosts, -{} hosts, +{} ports, -{} ports, {} service changes",
                baselineHosts.size(), currentHosts.size(), newHosts.size(), removedHosts.size(),
                newPorts.size(), closedPorts.size(), changedServices.size());
        return new DeltaPayload(newHosts, removedHosts, newPorts, closedPorts, changedServices);
    }

    private static void compareHost(String host, HostResult before, HostResult after,
                                    List<PortChange> newPorts, List<PortChange> closedPorts,
                                    List<ServiceChange> changedServices) {
        TreeSet<Integer> ports = new TreeSet<>(before.openPorts());
        ports.addAll(after.openPorts());
        Set<Integer> beforePorts = Set.copyOf(before.openPorts());
        Set<Integer> afterPorts = Set.copyOf(after.openPorts());

        for (int port : ports) {
            boolean wasOpen = beforePorts.contains(port);
            boolean isOpen = afterPorts.contains(port);
            if (isOpen && !wasOpen) {
                newPorts.add(PortChange.of(host, port, after.detailFor(port)));
            } else if (wasOpen && !isOpen) {
                closedPorts.add(PortChange.of(host, port, before.detailFor(port)));
            } else {
                PortDetail oldDetail = before.detailFor(port);
                PortDetail newDetail = after.detailFor(port);
                if (!oldDetail.sameServiceAs(newDetail)) {
                    changedServices.add(new ServiceChange(host, port, oldDetail, newDetail));
                }
            }
        }
    }

    private static TreeSet<String> sortedKeys(Map<String, HostResult> hosts) {
        TreeSet<String> keys = new TreeSet<>(Ipv4.ADDRESS_ORDER);
        keys.addAll(hosts.keySet());
        return keys;
    }
}
