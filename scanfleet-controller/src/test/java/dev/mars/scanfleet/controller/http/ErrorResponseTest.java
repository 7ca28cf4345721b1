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

import dev.mars.scanfleet.core.ResultStatus;
import dev.mars.scanfleet.core.exceptions.AgentNotFoundException;
import dev.mars.scanfleet.core.exceptions.ResultClosedException;
import dev.mars.scanfleet.core.exceptions.UnknownResultException;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the error envelope and the mapping of domain exceptions onto it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-04
 */
@DisplayName("Error Response Tests")
class ErrorResponseTest {

    @Nested
    @DisplayName("ErrorCode")
    class ErrorCodeTests {

        @Test
        @DisplayName("error codes carry the documented HTTP statuses")
        void httpStatuses() {
            assertEquals(400, ErrorCode.BAD_REQUEST.httpStatus());
            assertEquals(400, ErrorCode.SCAN_INACTIVE.httpStatus());
            assertEquals(403, ErrorCode.AGENT_PENDING_APPROVAL.httpStatus());
            assertEquals(404, ErrorCode.SCAN_NOT_FOUND.httpStatus());
            assertEquals(404, ErrorCode.DELTA_NOT_FOUND.httpStatus());
            assertEquals(405, ErrorCode.METHOD_NOT_ALLOWED.httpStatus());
            assertEquals(409, ErrorCode.RESULT_CLOSED.httpStatus());
            assertEquals(413, ErrorCode.PAYLOAD_TOO_LARGE.httpStatus());
            assertEquals(503, ErrorCode.NO_ELIGIBLE_AGENTS.httpStatus());
            assertEquals(503, ErrorCode.DISPATCH_FAILED.httpStatus());
            assertEquals(504, ErrorCode.TIMEOUT.httpStatus());
        }

        @Test
        @DisplayName("string codes are unique and match the constant name")
        void uniqueCodes() {
            List<String> codes = Arrays.stream(ErrorCode.values()).map(ErrorCode::code).toList();

            assertEquals(codes.size(), new HashSet<>(codes).size());
            for (ErrorCode code : ErrorCode.values()) {
                assertEquals(code.name(), code.code());
            }
        }

        @Test
        @DisplayName("fromCode finds known codes only")
        void fromCode() {
            assertEquals(ErrorCode.RESULT_NOT_FOUND, ErrorCode.fromCode("RESULT_NOT_FOUND").orElseThrow());
            assertTrue(ErrorCode.fromCode("JOB_NOT_FOUND").isEmpty());
        }
    }

    @Nested
    @DisplayName("ErrorResponse")
    class EnvelopeTests {

        @Test
        @DisplayName("the envelope nests code, message, timestamp, path and request id")
        void envelope() {
            ErrorResponse response = ErrorResponse.of(ErrorCode.SCAN_NOT_FOUND, "/api/v1/scans/s1", "req-42", "s1");

            JsonObject error = response.toJson().getJsonObject("error");

            assertEquals("SCAN_NOT_FOUND", error.getString("code"));
            assertEquals("Scan 's1' not found", error.getString("message"));
            assertEquals("/api/v1/scans/s1", error.getString("path"));
            assertEquals("req-42", error.getString("requestId"));
            assertNotNull(error.getString("timestamp"));
            assertEquals(404, response.httpStatus());
        }

        @Test
        @DisplayName("a request id is generated when none was assigned")
        void generatedRequestId() {
            ErrorResponse response = ErrorResponse.withMessage(ErrorCode.BAD_REQUEST, "/x", "bad", null);

            assertTrue(response.requestId().startsWith("req-"));
            assertEquals("bad", response.message());
        }

        @Test
        @DisplayName("exceptions without a message fall back to the template")
        void fromExceptionWithoutMessage() {
            ErrorResponse response = ErrorResponse.fromException(ErrorCode.INTERNAL_ERROR,
                    new IllegalStateException(), "/x", "req-1");

            assertEquals(ErrorCode.INTERNAL_ERROR.messageTemplate(), response.message());
        }
    }

    @Nested
    @DisplayName("Domain exception mapping")
    class MappingTests {

        @Test
        @DisplayName("domain exceptions map to their API codes")
        void mapping() {
            assertEquals(ErrorCode.AGENT_NOT_FOUND,
                    ScanFleetApiException.from(new AgentNotFoundException("a1")).getErrorCode());
            assertEquals(ErrorCode.RESULT_NOT_FOUND,
                    ScanFleetApiException.from(new UnknownResultException("r1")).getErrorCode());
            assertEquals(ErrorCode.VALIDATION_ERROR,
                    ScanFleetApiException.from(new ValidationException("bad target")).getErrorCode());

            ScanFleetApiException closed = ScanFleetApiException.from(
                    new ResultClosedException("r1", ResultStatus.COMPLETED));
            assertEquals(409, closed.getHttpStatus());
            assertTrue(closed.getMessage().contains("r1"));
        }

        @Test
        @DisplayName("the domain exception is kept as the cause")
        void causeKept() {
            ValidationException cause = new ValidationException("bad ports");

            ScanFleetApiException mapped = ScanFleetApiException.from(cause);

            assertSame(cause, mapped.getCause());
            assertEquals("bad ports", mapped.getMessage());
        }
    }
}
