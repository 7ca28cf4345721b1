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

package dev.mars.scanfleet.agent.scanner;

import dev.mars.scanfleet.core.HostResult;

import java.io.IOException;
import java.util.List;

/**
 * Scans one target address. Implementations block the calling thread and are
 * invoked from a worker thread, never the event loop.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public interface PortScanner {

    /**
     * Scans the given ports on one address.
     *
     * @param address       IPv4 address
     * @param ports         sorted ports to probe
     * @param scanArguments free-form scanner arguments from the scan config, may be null
     * @return the host outcome; a host that could not be probed at all is reported as an error
     * @throws IOException if the scanner itself failed rather than the target
     */
    HostResult scan(String address, List<Integer> ports, String scanArguments) throws IOException;
}
