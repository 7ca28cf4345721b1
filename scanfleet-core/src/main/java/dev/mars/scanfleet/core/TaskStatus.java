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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Status of a single scan task within a task group.
 *
 * <p>Valid transitions:</p>
 * <pre>
 *   PENDING   → ASSIGNED, FAILED
 *   ASSIGNED  → COMPLETED, FAILED
 *   COMPLETED → COMPLETED   (agent resubmits final data)
 *   FAILED    → FAILED
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-20
 * @version 1.0
 */
public enum TaskStatus {

    PENDING("pending"),
    ASSIGNED("assigned"),
    COMPLETED("completed"),
    FAILED("failed");

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<TaskStatus, Set<TaskStatus>>(TaskStatus.class);
        map.put(PENDING, EnumSet.of(ASSIGNED, FAILED));
        map.put(ASSIGNED, EnumSet.of(COMPLETED, FAILED));
        map.put(COMPLETED, EnumSet.of(COMPLETED));
        map.put(FAILED, EnumSet.of(FAILED));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(TaskStatus.class)).contains(target);
    }

    public Set<TaskStatus> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task status value must not be null");
        }
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
