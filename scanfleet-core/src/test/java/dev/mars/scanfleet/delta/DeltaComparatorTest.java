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
import dev.mars.scanfleet.core.HostState;
import dev.mars.scanfleet.core.PortDetail;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DeltaComparator}.
 */
@DisplayName("DeltaComparator Tests")
class DeltaComparatorTest {

    private static final PortDetail SSH = new PortDetail("tcp", "ssh", "OpenSSH", "9.6", "");
    private static final PortDetail HTTP = new PortDetail("tcp", "http", "nginx", "1.24", "");

    private static HostResult up(List<Integer> ports, Map<Integer, PortDetail> details) {
        return new HostResult("", HostState.UP, ports, details);
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("New port on a known host and a newly present host")
        void newPortAndNewHost() {
            Map<String, HostResult> baseline = Map.of("10.0.0.10", up(List.of(22), Map.of(22, SSH)));
            Map<String, HostResult> current = Map.of(
                    "10.0.0.10", up(List.of(22, 80), Map.of(22, SSH, 80, HTTP)),
                    "10.0.0.20", up(List.of(), Map.of()));

            DeltaPayload delta = DeltaComparator.compare(baseline, current);

            assertThat(delta.newPorts()).containsExactly(
                    new PortChange("10.0.0.10", 80, "tcp", "http", "nginx", "1.24"));
            assertThat(delta.newHosts()).containsExactly("10.0.0.20");
            assertThat(delta.closedPorts()).isEmpty();
            assertThat(delta.removedHosts()).isEmpty();
            assertThat(delta.changedServices()).isEmpty();

            DeltaReport report = new DeltaReport("d1", "s1", "r0", "r1", Instant.EPOCH, delta);
            assertThat(report.getNewPortsCount()).isEqualTo(1);
            assertThat(report.getNewHostsCount()).isEqualTo(1);
            assertThat(report.hasChanges()).isTrue();
        }

        @Test
        @DisplayName("Identical snapshots yield an empty delta")
        void noChanges() {
            Map<String, HostResult> snapshot = Map.of("10.0.0.10", up(List.of(22), Map.of(22, SSH)));

            DeltaPayload delta = DeltaComparator.compare(snapshot, snapshot);

            assertThat(delta.hasChanges()).isFalse();
        }
    }

    @Nested
    @DisplayName("Host and port changes")
    class HostAndPortChanges {

        @Test
        @DisplayName("Closed ports carry the baseline detail")
        void closedPortAnnotatedFromBaseline() {
            Map<String, HostResult> baseline = Map.of("10.0.0.10", up(List.of(22, 80), Map.of(22, SSH, 80, HTTP)));
            Map<String, HostResult> current = Map.of("10.0.0.10", up(List.of(22), Map.of(22, SSH)));

            DeltaPayload delta = DeltaComparator.compare(baseline, current);

            assertThat(delta.closedPorts()).containsExactly(
                    new PortChange("10.0.0.10", 80, "tcp", "http", "nginx", "1.24"));
        }

        @Test
        @DisplayName("Ports of vanished hosts fold into the closed list")
        void removedHostPortsFolded() {
            Map<String, HostResult> baseline = Map.of(
                    "10.0.0.10", up(List.of(22), Map.of(22, SSH)),
                    "10.0.0.11", up(List.of(80, 22), Map.of(80, HTTP)));
            Map<String, HostResult> current = Map.of("10.0.0.10", up(List.of(22), Map.of(22, SSH)));

            DeltaPayload delta = DeltaComparator.compare(baseline, current);

            assertThat(delta.removedHosts()).containsExactly("10.0.0.11");
            assertThat(delta.closedPorts())
                    .extracting(PortChange::host, PortChange::port)
                    .containsExactly(
                            org.assertj.core.groups.Tuple.tuple("10.0.0.11", 22),
                            org.assertj.core.groups.Tuple.tuple("10.0.0.11", 80));
            assertThat(delta.closedPorts().get(0).service()).isEmpty();
        }

        @Test
        @DisplayName("A version bump on a still-open port is a changed service")
        void changedService() {
            PortDetail newerSsh = new PortDetail("tcp", "ssh", "OpenSSH", "9.7", "");
            Map<String, HostResult> baseline = Map.of("10.0.0.10", up(List.of(22), Map.of(22, SSH)));
            Map<String, HostResult> current = Map.of("10.0.0.10", up(List.of(22), Map.of(22, newerSsh)));

            DeltaPayload delta = DeltaComparator.compare(baseline, current);

            assertThat(delta.changedServices()).containsExactly(new ServiceChange("10.0.0.10", 22, SSH, newerSsh));
            assertThat(delta.newPorts()).isEmpty();
            assertThat(delta.closedPorts()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Algebraic properties")
    class Properties {

        private final Map<String, HostResult> a = Map.of(
                "10.0.0.2", up(List.of(22), Map.of(22, SSH)),
                "10.0.0.10", up(List.of(80), Map.of(80, HTTP)));
        private final Map<String, HostResult> b = Map.of(
                "10.0.0.10", up(List.of(80, 443), Map.of(80, HTTP)),
                "10.0.0.30", up(List.of(3389), Map.of()));

        @Test
        @DisplayName("Swapping arguments swaps new and removed hosts")
        void notSymmetric() {
            DeltaPayload forward = DeltaComparator.compare(a, b);
            DeltaPayload backward = DeltaComparator.compare(b, a);

            assertThat(forward.newHosts()).isEqualTo(backward.removedHosts());
            assertThat(forward.removedHosts()).isEqualTo(backward.newHosts());
            assertThat(forward.newPorts()).isEqualTo(backward.closedPorts());
            assertThat(forward).isNotEqualTo(backward);
        }

        @Test
        @DisplayName("Recomputation on identical inputs is identical")
        void deterministic() {
            assertThat(DeltaComparator.compare(a, b)).isEqualTo(DeltaComparator.compare(Map.copyOf(a), Map.copyOf(b)));
        }

        @Test
        @DisplayName("Output is ordered numerically by host, then by port")
        void ordered() {
            Map<String, HostResult> current = Map.of(
                    "10.0.0.10", up(List.of(443, 80), Map.of()),
                    "10.0.0.9", up(List.of(8080), Map.of()));

            DeltaPayload delta = DeltaComparator.compare(Map.of(), current);

            assertThat(delta.newHosts()).containsExactly("10.0.0.9", "10.0.0.10");
            assertThat(delta.newPorts()).extracting(PortChange::port).containsExactly(8080, 80, 443);
        }

        @Test
        @DisplayName("Newly opened critical ports are flagged")
        void criticalPorts() {
            DeltaReport report = new DeltaReport("d1", "s1", "r0", "r1", Instant.EPOCH, DeltaComparator.compare(a, b));

            assertThat(report.criticalPortsOpened())
                    .extracting(PortChange::port)
                    .containsExactly(3389);
        }
    }
}
