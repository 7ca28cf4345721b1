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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fields supplied when creating or updating a scan configuration. A null field means
 * "not supplied": defaults apply on create, the current value is kept on update.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScanConfigChanges(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("target") String target,
        @JsonProperty("ports") String ports,
        @JsonProperty("scan_arguments") String scanArguments,
        @JsonProperty("interval_minutes") Integer intervalMinutes,
        @JsonProperty("is_active") Boolean active,
        @JsonProperty("is_scheduled") Boolean recurring) {

    public static ScanConfigChanges of(String name, String target) {
        return new ScanConfigChanges(name, null, target, null, null, null, null, null);
    }
}
