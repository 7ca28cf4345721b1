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

import dev.mars.scanfleet.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Task and result status tests")
class StatusTransitionTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Nested
    @DisplayName("TaskStatus")
    class TaskStatusTests {

        @Test
        @DisplayName("Pending task cannot complete without being assigned")
        void pendingCannotComplete() {
            assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED)).isFalse();
            assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED)).isTrue();
        }

        @Test
        @DisplayName("A completed task cannot later fail")
        void completedCannotFail() {
            assertThat(TaskStatus.COMPLETED.canTransitionTo(TaskStatus.FAILED)).isFalse();
            assertThat(TaskStatus.COMPLETED.canTransitionTo(TaskStatus.COMPLETED)).isTrue();
        }

        @Test
        @DisplayName("ScanTask stamps assigned and completed timestamps")
        void stampsTimestamps() throws Exception {
            ScanTask task = new ScanTask("t1", "g1", "s1", "r1", "a1", List.of("10.0.0.1"), NOW);
            task.transitionTo(TaskStatus.ASSIGNED, NOW.plusSeconds(1));
            task.transitionTo(TaskStatus.COMPLETED, NOW.plusSeconds(30));

            assertThat(task.getAssignedAt()).isEqualTo(NOW.plusSeconds(1));
            assertThat(task.getCompletedAt()).isEqualTo(NOW.plusSeconds(30));

            assertThatThrownBy(() -> task.transitionTo(TaskStatus.ASSIGNED, NOW))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("ResultStatus derivation")
    class ResultStatusDerivation {

        @Test
        @DisplayName("All completed -> COMPLETED")
        void allCompleted() {
            assertThat(ResultStatus.derive(List.of(TaskStatus.COMPLETED, TaskStatus.COMPLETED)))
                    .isEqualTo(ResultStatus.COMPLETED);
        }

        @Test
        @DisplayName("Mixed terminal outcomes -> PARTIAL")
        void mixed() {
            assertThat(ResultStatus.derive(List.of(TaskStatus.COMPLETED, TaskStatus.FAILED)))
                    .isEqualTo(ResultStatus.PARTIAL);
        }

        @Test
        @DisplayName("All failed -> FAILED")
        void allFailed() {
            assertThat(ResultStatus.derive(List.of(TaskStatus.FAILED, TaskStatus.FAILED)))
                    .isEqualTo(ResultStatus.FAILED);
        }

        @Test
        @DisplayName("Any outstanding task keeps the result PENDING, even after a failure")
        void outstanding() {
            assertThat(ResultStatus.derive(List.of(TaskStatus.FAILED, TaskStatus.ASSIGNED)))
                    .isEqualTo(ResultStatus.PENDING);
            assertThat(ResultStatus.derive(List.of(TaskStatus.COMPLETED, TaskStatus.PENDING)))
                    .isEqualTo(ResultStatus.PENDING);
            assertThat(ResultStatus.derive(List.of())).isEqualTo(ResultStatus.PENDING);
        }

        @Test
        @DisplayName("Terminal results are immutable")
        void terminalIsImmutable() throws Exception {
            AggregatedResult result = new AggregatedResult("r1", "s1", "g1", NOW);
            result.transitionTo(ResultStatus.COMPLETED, NOW.plusSeconds(5));

            assertThat(result.getCompletedAt()).isEqualTo(NOW.plusSeconds(5));
            assertThatThrownBy(() -> result.transitionTo(ResultStatus.FAILED, NOW))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("COMPLETED");
        }
    }
}
