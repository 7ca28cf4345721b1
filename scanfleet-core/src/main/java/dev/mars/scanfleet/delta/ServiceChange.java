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

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.scanfleet.core.PortDetail;

/**
 * A port open in both scans whose service fingerprint differs.
 *
 * @param host   address
 * @param port   port number
 * @param before fingerprint in the baseline scan
 * @param after  fingerprint in the current scan
 */
public record ServiceChange(
        @JsonProperty("host") String host,
        @JsonProperty("port") int port,
        @JsonProperty("before") PortDetail before,
        @JsonProperty("after") PortDetail after) {
}
