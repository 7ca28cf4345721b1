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

package dev.mars.scanfleet.controller.http;

import dev.mars.scanfleet.core.exceptions.AgentNotFoundException;
import dev.mars.scanfleet.core.exceptions.InvalidTransitionException;
import dev.mars.scanfleet.core.exceptions.ResultClosedException;
import dev.mars.scanfleet.core.exceptions.ScanFleetException;
import dev.mars.scanfleet.core.exceptions.UnknownResultException;
import dev.mars.scanfleet.core.exceptions.ValidationException;

/**
 * Exception thrown by API handlers to indicate a known error condition.
 *
 * <p>This exception carries an {@link ErrorCode} which determines the HTTP
 * status code and error format returned to the client. The
 * {@link GlobalErrorHandler} will catch this and convert it to a standardized
 * {@link ErrorResponse}.</p>
 *
 * <p>Usage in handlers:</p>
 * <pre>{@code
 * ScanConfig config = scans.get(id)
 *         .orElseThrow(() -> ScanFleetApiException.notFound(ErrorCode.SCAN_NOT_FOUND, id));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-04
 */
public class ScanFleetApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public ScanFleetApiException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ScanFleetApiException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return errorCode.httpStatus();
    }

    // ==================== Factory Methods ====================

    public static ScanFleetApiException notFound(ErrorCode code, Object... args) {
        return new ScanFleetApiException(code, code.formatMessage(args));
    }

    public static ScanFleetApiException badRequest(ErrorCode code, Object... args) {
        return new ScanFleetApiException(code, code.formatMessage(args));
    }

    public static ScanFleetApiException conflict(ErrorCode code, Object... args) {
        return new ScanFleetApiException(code, code.formatMessage(args));
    }

    public static ScanFleetApiException unavailable(ErrorCode code, Object... args) {
        return new ScanFleetApiException(code, code.formatMessage(args));
    }

    /**
     * Maps a domain exception to the API error it surfaces as.
     */
    public static ScanFleetApiException from(ScanFleetException e) {
        if (e instanceof AgentNotFoundException notFound) {
            return new ScanFleetApiException(ErrorCode.AGENT_NOT_FOUND,
                    ErrorCode.AGENT_NOT_FOUND.formatMessage(notFound.getAgentId()), e);
        }
        if (e instanceof UnknownResultException unknown) {
            return new ScanFleetApiException(ErrorCode.RESULT_NOT_FOUND,
                    ErrorCode.RESULT_NOT_FOUND.formatMessage(unknown.getResultId()), e);
        }
        if (e instanceof ResultClosedException closed) {
            return new ScanFleetApiException(ErrorCode.RESULT_CLOSED,
                    "Result '" + closed.getResultId() + "' is closed with status " + closed.getStatus(), e);
        }
        if (e instanceof ValidationException) {
            return new ScanFleetApiException(ErrorCode.VALIDATION_ERROR, e.getMessage(), e);
        }
        if (e instanceof InvalidTransitionException) {
            return new ScanFleetApiException(ErrorCode.CONFLICT, e.getMessage(), e);
        }
        return new ScanFleetApiException(ErrorCode.INTERNAL_ERROR, e.getMessage(), e);
    }
}
