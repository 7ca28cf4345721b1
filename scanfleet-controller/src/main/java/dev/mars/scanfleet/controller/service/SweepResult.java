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

package dev.mars.scanfleet.controller.service;

import java.util.List;

/**
 * Outcome of one heartbeat sweep.
 *
 * @param demotedAgentIds agents moved to offline by this sweep
 * @param totalAgents     agents known to the registry
 * @param onlineAgents    agents in a live state after the sweep
 * @param offlineAgents   agents not live after the sweep, pending ones included
 */
public record SweepResult(List<String> demotedAgentIds, int totalAgents, int onlineAgents, int offlineAgents) {

    public SweepResult {
        demotedAgentIds = List.copyOf(demotedAgentIds);
    }
}
