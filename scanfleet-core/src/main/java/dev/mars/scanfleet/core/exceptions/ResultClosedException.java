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

package dev.mars.scanfleet.core.exceptions;

import dev.mars.scanfleet.core.ResultStatus;

/**
 * Thrown when a submission arrives for an aggregated result that has already
 * reached a terminal status. Terminal results are immutable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ResultClosedException extends ScanFleetException {

    private final String resultId;
    private final ResultStatus status;

    public ResultClosedException(String resultId, ResultStatus status) {
        super("Result '" + resultId + "' is already " + status.getValue());
        this.resultId = resultId;
        this.status = status;
    }

    public String getResultId() {
        return resultId;
    }

    public ResultStatus getStatus() {
        return status;
    }
}
