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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.mars.scanfleet.core.TaskStatus;

import java.util.Optional;

/**
 * Outcome an agent reports for its task in a result submission.
 * {@code RUNNING} carries progress only and leaves the task status unchanged.
 */
public enum SubmissionStatus {

    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    SubmissionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * The task status this outcome moves the task to, if any.
     */
    public Optional<TaskStatus> taskStatus() {
        return switch (this) {
            case RUNNING -> Optional.empty();
            case COMPLETED -> Optional.of(TaskStatus.COMPLETED);
            case FAILED -> Optional.of(TaskStatus.FAILED);
        };
    }

    @JsonCreator
    public static SubmissionStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Submission status must not be null");
        }
        for (SubmissionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown submission status: " + value
                + " (expected running, completed or failed)");
    }
}
