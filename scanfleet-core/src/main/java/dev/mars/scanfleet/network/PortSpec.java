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

import java.util.List;
import java.util.TreeSet;

/**
 * Validates port specifications of the form {@code 22}, {@code 1-1000} or a
 * comma-separated mix such as {@code 22,80,443,8000-8100}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class PortSpec {

    private PortSpec() {
    }

    /**
     * Validates a port specification and returns it with whitespace removed.
     *
     * @throws ValidationException if any element is malformed or outside 1-65535
     */
    public static String normalise(String spec) throws ValidationException {
        if (spec == null || spec.isBlank()) {
            throw new ValidationException("Port specification must not be empty");
        }
        String compact = spec.replaceAll("\\s+", "");
        for (String element : compact.split(",", -1)) {
            if (element.isEmpty()) {
                throw new ValidationException("Empty element in port specification '" + spec + "'");
            }
            int dash = element.indexOf('-');
            if (dash >= 0) {
                int start = parsePort(element.substring(0, dash), spec);
                int end = parsePort(element.substring(dash + 1), spec);
                if (end < start) {
                    throw new ValidationException("Port range '" + element + "' ends before it starts");
                }
            } else {
                parsePort(element, spec);
            }
        }
        return compact;
    }

    /**
     * Expands a port specification into the sorted, distinct ports it names.
     *
     * @throws ValidationException if the specification is invalid
     */
    public static List<Integer> expand(String spec) throws ValidationException {
        TreeSet<Integer> ports = new TreeSet<>();
        for (String element : normalise(spec).split(",")) {
            int dash = element.indexOf('-');
            if (dash >= 0) {
                int start = Integer.parseInt(element.substring(0, dash));
                int end = Integer.parseInt(element.substring(dash + 1));
                for (int port = start; port <= end; port++) {
                    ports.add(port);
                }
            } else {
                ports.add(Integer.parseInt(element));
            }
        }
        return List.copyOf(ports);
    }

    private static int parsePort(String text, String spec) throws ValidationException {
        int port;
        try {
            port = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid port '" + text + "' in '" + spec + "'", e);
        }
        if (port < 1 || port > 65535) {
            throw new ValidationException("Port " + port + " out of range 1-65535 in '" + spec + "'");
        }
        return port;
    }
}
