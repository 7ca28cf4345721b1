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

/**
 * Reachability of a single scanned host.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-20
 */
public enum HostState {

    UP("up"),
    DOWN("down"),
    ERROR("error");

    private final String value;

    HostState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * A host counts as completed when the scanner could determine its
     * reachability either way.
     */
    public boolean isCompleted() {
        return this == UP || this == DOWN;
    }

    /**
     * Lenient parse; anything the scanner reports that is neither up nor down
     * is treated as an error.
     */
    @JsonCreator
    public static HostState fromValue(String value) {
        if (value != null) {
            for (HostState state : values()) {
                if (state.value.equalsIgnoreCase(value)) {
                    return state;
                }
            }
        }
        return ERROR;
    }

    @Override
    public String toString() {
        return value;
    }
}
