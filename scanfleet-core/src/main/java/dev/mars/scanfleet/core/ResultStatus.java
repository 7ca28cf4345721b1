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

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Overall status of an aggregated result, derived from the statuses of the
 * tasks in its group.
 *
 * <p>{@code PENDING} is the only non-terminal status. Once a result leaves it,
 * the result is immutable, which is why the terminal states have no outgoing
 * transitions.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-20
 * @version 1.0
 */
public enum ResultStatus {

    /** Some tasks are still outstanding. */
    PENDING("pending"),

    /** Every task finished; at least one completed and at least one failed. */
    PARTIAL("partial"),

    /** Every task completed. */
    COMPLETED("completed"),

    /** Every task failed. */
    FAILED("failed");

    private static final Map<ResultStatus, Set<ResultStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<ResultStatus, Set<ResultStatus>>(ResultStatus.class);
        map.put(PENDING, EnumSet.of(PENDING, PARTIAL, COMPLETED, FAILED));
        map.put(PARTIAL, EnumSet.noneOf(ResultStatus.class));
        map.put(COMPLETED, EnumSet.noneOf(ResultStatus.class));
        map.put(FAILED, EnumSet.noneOf(ResultStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    ResultStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(ResultStatus target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(ResultStatus.class)).contains(target);
    }

    public Set<ResultStatus> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    /**
     * Derives the result status from the statuses of every task in the group.
     *
     * <ul>
     *   <li>any task not yet terminal → {@code PENDING}</li>
     *   <li>all completed → {@code COMPLETED}</li>
     *   <li>all failed → {@code FAILED}</li>
     *   <li>otherwise → {@code PARTIAL}</li>
     * </ul>
     *
     * @param taskStatuses statuses of all sibling tasks
     * @return the derived status; {@code PENDING} for an empty group
     */
    public static ResultStatus derive(Collection<TaskStatus> taskStatuses) {
        if (taskStatuses.isEmpty()) {
            return PENDING;
        }
        int completed = 0;
        int failed = 0;
        for (TaskStatus status : taskStatuses) {
            if (!status.isTerminal()) {
                return PENDING;
            }
            if (status == TaskStatus.COMPLETED) {
                completed++;
            } else {
                failed++;
            }
        }
        if (failed == 0) {
            return COMPLETED;
        }
        return completed == 0 ? FAILED : PARTIAL;
    }

    @JsonCreator
    public static ResultStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Result status value must not be null");
        }
        for (ResultStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown result status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
