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

package dev.mars.scanfleet.network;

import dev.mars.scanfleet.core.exceptions.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PortSpecTest {

    @Test
    void acceptsSinglesRangesAndLists() throws Exception {
        assertEquals("1-1000", PortSpec.normalise("1-1000"));
        assertEquals("22,80,443,8000-8100", PortSpec.normalise(" 22, 80,443 ,8000-8100 "));
        assertEquals("65535", PortSpec.normalise("65535"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0", "65536", "80,", "http", "100-10", "1-2-3"})
    void rejectsInvalid(String spec) {
        assertThrows(ValidationException.class, () -> PortSpec.normalise(spec));
    }

    @Test
    void expandsToSortedDistinctPorts() throws Exception {
        assertEquals(List.of(22, 80, 443, 444, 445), PortSpec.expand("443-445,80,22,444"));
        assertEquals(1000, PortSpec.expand("1-1000").size());
    }
}
