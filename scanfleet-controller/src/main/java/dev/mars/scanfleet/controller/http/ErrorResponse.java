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

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.UUID;

/**
 * Standardized error response for all API endpoints.
 *
 * <p>Example JSON output:</p>
 * <pre>{@code
 * {
 *   "error": {
 *     "code": "SCAN_NOT_FOUND",
 *     "message": "Scan 'xyz' not found",
 *     "timestamp": "2026-02-04T10:00:00Z",
 *     "path": "/api/v1/scans/xyz",
 *     "requestId": "req-1a2b3c4d"
 *   }
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-04
 */
public record ErrorResponse(
    ErrorCode errorCode,
    String message,
    Instant timestamp,
    String path,
    String requestId
) {
    /**
     * Creates an ErrorResponse with an explicit message and, when known, the
     * request ID assigned by the {@link CorrelationIdHandler}.
     */
    public static ErrorResponse withMessage(ErrorCode code, String path, String message, String requestId) {
        return new ErrorResponse(
            code,
            message,
            Instant.now(),
            path,
            requestId != null ? requestId : generateRequestId()
        );
    }

    /**
     * Creates an ErrorResponse with a formatted message from ErrorCode's template.
     */
    public static ErrorResponse of(ErrorCode code, String path, String requestId, Object... messageArgs) {
        return withMessage(code, path, code.formatMessage(messageArgs), requestId);
    }

    /**
     * Creates an ErrorResponse from an exception.
     */
    public static ErrorResponse fromException(ErrorCode code, Throwable cause, String path, String requestId) {
        String message = cause.getMessage() != null
            ? cause.getMessage()
            : code.messageTemplate();
        return withMessage(code, path, message, requestId);
    }

    public String code() {
        return errorCode.code();
    }

    /**
     * Converts this error response to a JSON object suitable for HTTP response body.
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("error", new JsonObject()
                .put("code", errorCode.code())
                .put("message", message)
                .put("timestamp", timestamp.toString())
                .put("path", path)
                .put("requestId", requestId));
    }

    public int httpStatus() {
        return errorCode.httpStatus();
    }

    private static String generateRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
