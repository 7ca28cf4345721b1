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

import java.util.Arrays;
import java.util.Optional;

/**
 * Standardized error codes for the ScanFleet HTTP API.
 *
 * <p>Each error code includes:</p>
 * <ul>
 *   <li>A unique string code (e.g., "SCAN_NOT_FOUND")</li>
 *   <li>An HTTP status code</li>
 *   <li>A message template for consistent error messages</li>
 * </ul>
 *
 * <p>Error code naming conventions:</p>
 * <ul>
 *   <li>{@code *_NOT_FOUND} - Resource does not exist (404)</li>
 *   <li>{@code *_INVALID} - Invalid input/request (400)</li>
 *   <li>{@code *_CLOSED} - Resource no longer accepts changes (409)</li>
 *   <li>{@code *_UNAVAILABLE} - Service temporarily unavailable (503)</li>
 *   <li>{@code INTERNAL_*} - Server-side errors (500)</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-04
 */
public enum ErrorCode {

    // ==================== General Errors (400-499) ====================

    /** Request body is missing or malformed */
    BAD_REQUEST("BAD_REQUEST", 400, "Invalid request: %s"),

    /** Request validation failed */
    VALIDATION_ERROR("VALIDATION_ERROR", 400, "Validation failed: %s"),

    /** Required field is missing */
    MISSING_REQUIRED_FIELD("MISSING_REQUIRED_FIELD", 400, "Required field '%s' is missing"),

    /** Generic resource not found */
    NOT_FOUND("NOT_FOUND", 404, "Resource not found: %s"),

    /** HTTP method not supported for this endpoint */
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", 405, "Method %s not allowed"),

    /** Resource state conflict */
    CONFLICT("CONFLICT", 409, "Conflict: %s"),

    /** Request body exceeds the configured limit */
    PAYLOAD_TOO_LARGE("PAYLOAD_TOO_LARGE", 413, "Request body too large: %s"),

    // ==================== Agent Errors ====================

    /** Agent not found */
    AGENT_NOT_FOUND("AGENT_NOT_FOUND", 404, "Agent '%s' not found"),

    /** Agent has not been approved by an operator */
    AGENT_PENDING_APPROVAL("AGENT_PENDING_APPROVAL", 403, "Agent '%s' is awaiting approval"),

    // ==================== Scan Errors ====================

    /** Scan configuration not found */
    SCAN_NOT_FOUND("SCAN_NOT_FOUND", 404, "Scan '%s' not found"),

    /** Scan configuration is invalid */
    SCAN_INVALID("SCAN_INVALID", 400, "Invalid scan configuration: %s"),

    /** Scan configuration is switched off */
    SCAN_INACTIVE("SCAN_INACTIVE", 400, "Scan '%s' is inactive"),

    /** No agent covers the scan target */
    NO_ELIGIBLE_AGENTS("NO_ELIGIBLE_AGENTS", 503, "No eligible agents for scan '%s'"),

    /** No agent accepted its work order */
    DISPATCH_FAILED("DISPATCH_FAILED", 503, "Dispatch failed for scan '%s'"),

    // ==================== Result Errors ====================

    /** Aggregated result not found */
    RESULT_NOT_FOUND("RESULT_NOT_FOUND", 404, "Result '%s' not found"),

    /** Aggregated result already finished */
    RESULT_CLOSED("RESULT_CLOSED", 409, "Result '%s' is closed"),

    // ==================== Delta Errors ====================

    /** Delta report not found */
    DELTA_NOT_FOUND("DELTA_NOT_FOUND", 404, "Delta report '%s' not found"),

    /** Comparison request is invalid */
    DELTA_INVALID("DELTA_INVALID", 400, "Invalid comparison: %s"),

    // ==================== Server Errors (500+) ====================

    /** Unexpected internal error */
    INTERNAL_ERROR("INTERNAL_ERROR", 500, "Internal server error: %s"),

    /** Service temporarily unavailable */
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", 503, "Service temporarily unavailable: %s"),

    /** Request timeout */
    TIMEOUT("TIMEOUT", 504, "Request timed out: %s");

    private final String code;
    private final int httpStatus;
    private final String messageTemplate;

    ErrorCode(String code, int httpStatus, String messageTemplate) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.messageTemplate = messageTemplate;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String messageTemplate() {
        return messageTemplate;
    }

    /**
     * Formats the message template with the provided arguments.
     */
    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }

    /**
     * Looks up an ErrorCode by its string code.
     */
    public static Optional<ErrorCode> fromCode(String code) {
        return Arrays.stream(values())
            .filter(e -> e.code.equals(code))
            .findFirst();
    }
}
