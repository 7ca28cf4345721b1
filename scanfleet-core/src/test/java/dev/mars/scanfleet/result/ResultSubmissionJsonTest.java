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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.scanfleet.core.HostResult;
import dev.mars.scanfleet.core.HostState;
import dev.mars.scanfleet.core.ScanFleetJson;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Decodes the submission payload agents put on the wire.
 */
@DisplayName("ResultSubmission wire format")
class ResultSubmissionJsonTest {

    private final ObjectMapper mapper = ScanFleetJson.mapper();

    @Test
    @DisplayName("Decodes parsed results, port details and summary stats")
    void decodesAgentPayload() throws Exception {
        String json = """
                {
                  "result_id": "res-1",
                  "task_id": "task-1",
                  "agent_id": "aa-bb-cc",
                  "status": "completed",
                  "parsed_results": {
                    "10.0.0.5": {
                      "hostname": "web.local",
                      "state": "up",
                      "open_ports": [443, 80, 80],
                      "port_details": {
                        "80": {"protocol": "tcp", "name": "http", "product": "nginx", "version": "1.24", "extrainfo": ""},
                        "443": {"name": "https"}
                      },
                      "os": "ignored"
                    }
                  },
                  "summary_stats": {"total_targets": 1, "up_targets": 1, "error_targets": 0, "scan_duration": 12.5}
                }
                """;

        ResultSubmission submission = mapper.readValue(json, ResultSubmission.class);

        assertThat(submission.resultId()).isEqualTo("res-1");
        assertThat(submission.status()).isEqualTo(SubmissionStatus.COMPLETED);
        HostResult host = submission.parsedResults().get("10.0.0.5");
        assertThat(host.state()).isEqualTo(HostState.UP);
        assertThat(host.openPorts()).containsExactly(80, 443);
        assertThat(host.portDetails().get(80).product()).isEqualTo("nginx");
        assertThat(host.portDetails().get(443).protocol()).isEqualTo("tcp");
        assertThat(submission.summaryStats().totalTargets()).isEqualTo(1);
    }

    @Test
    @DisplayName("Missing optional sections default to empty")
    void defaults() throws Exception {
        ResultSubmission submission = mapper.readValue(
                "{\"result_id\":\"r\",\"task_id\":\"t\",\"status\":\"running\"}", ResultSubmission.class);

        assertThat(submission.parsedResults()).isEmpty();
        assertThat(submission.summaryStats()).isEqualTo(SummaryStats.EMPTY);
        assertThat(submission.status().taskStatus()).isEmpty();
    }
}
