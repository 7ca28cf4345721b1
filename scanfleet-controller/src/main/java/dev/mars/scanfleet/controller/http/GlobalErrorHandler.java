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

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.scanfleet.core.exceptions.ScanFleetException;
import io.vertx.core.Handler;
import io.vertx.core.json.DecodeException;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeoutException;

/**
 * Global error handler for the HTTP API.
 *
 * <p>Catches all unhandled failures and converts them to standardized
 * {@link ErrorResponse} JSON responses.</p>
 *
 * <p>Exception mapping:</p>
 * <ul>
 *   <li>{@link ScanFleetApiException} → the exception's error code</li>
 *   <li>{@link ScanFleetException} → the code from {@link ScanFleetApiException#from}</li>
 *   <li>{@link IllegalArgumentException} → 400 VALIDATION_ERROR</li>
 *   <li>{@link DecodeException}, {@link JsonProcessingException} → 400 BAD_REQUEST</li>
 *   <li>{@link TimeoutException} → 504 TIMEOUT</li>
 *   <li>All others → 500 INTERNAL_ERROR</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-04
 */
public class GlobalErrorHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @Override
    public void handle(RoutingContext ctx) {
        Throwable failure = ctx.failure();
        String path = ctx.request().path();
        String requestId = CorrelationIdHandler.getRequestId(ctx);

        ErrorResponse errorResponse;

        if (failure == null) {
            errorResponse = mapStatusCodeToError(ctx.statusCode(), ctx.request().method().name(), path, requestId);
        } else if (failure instanceof ScanFleetApiException apiEx) {
            errorResponse = ErrorResponse.withMessage(apiEx.getErrorCode(), path, apiEx.getMessage(), requestId);
            logError(apiEx.getErrorCode(), failure, path);
        } else if (failure instanceof ScanFleetException domainEx) {
            ScanFleetApiException apiEx = ScanFleetApiException.from(domainEx);
            errorResponse = ErrorResponse.withMessage(apiEx.getErrorCode(), path, apiEx.getMessage(), requestId);
            logError(apiEx.getErrorCode(), failure, path);
        } else if (failure instanceof IllegalArgumentException) {
            errorResponse = ErrorResponse.fromException(ErrorCode.VALIDATION_ERROR, failure, path, requestId);
            logError(ErrorCode.VALIDATION_ERROR, failure, path);
        } else if (failure instanceof DecodeException || failure instanceof JsonProcessingException) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.BAD_REQUEST, path,
                    "Invalid JSON: " + failure.getMessage(), requestId);
            logError(ErrorCode.BAD_REQUEST, failure, path);
        } else if (failure instanceof TimeoutException) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.TIMEOUT, path,
                    "Request processing timed out", requestId);
            logError(ErrorCode.TIMEOUT, failure, path);
        } else {
            // Don't expose internal details
            errorResponse = ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, path,
                    "An unexpected error occurred", requestId);
            logger.error("Unhandled exception at path {}: {}", path, failure.getMessage(), failure);
        }

        sendErrorResponse(ctx, errorResponse);
    }

    /**
     * Maps HTTP status codes (from router) to appropriate ErrorResponse.
     */
    private ErrorResponse mapStatusCodeToError(int statusCode, String method, String path, String requestId) {
        return switch (statusCode) {
            case 400 -> ErrorResponse.withMessage(ErrorCode.BAD_REQUEST, path, "Bad request", requestId);
            case 404 -> ErrorResponse.of(ErrorCode.NOT_FOUND, path, requestId, path);
            case 405 -> ErrorResponse.of(ErrorCode.METHOD_NOT_ALLOWED, path, requestId, method);
            case 409 -> ErrorResponse.withMessage(ErrorCode.CONFLICT, path, "Resource conflict", requestId);
            case 413 -> ErrorResponse.of(ErrorCode.PAYLOAD_TOO_LARGE, path, requestId, "limit exceeded");
            case 503 -> ErrorResponse.withMessage(ErrorCode.SERVICE_UNAVAILABLE, path, "Service unavailable", requestId);
            case 504 -> ErrorResponse.withMessage(ErrorCode.TIMEOUT, path, "Request timeout", requestId);
            default -> ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, path, "Error " + statusCode, requestId);
        };
    }

    private void sendErrorResponse(RoutingContext ctx, ErrorResponse errorResponse) {
        if (ctx.response().ended()) {
            logger.debug("Response already sent for {}, dropping error {}", ctx.request().path(), errorResponse.code());
            return;
        }
        ctx.response()
            .setStatusCode(errorResponse.httpStatus())
            .putHeader("Content-Type", "application/json")
            .end(errorResponse.toJson().encode());
    }

    /**
     * Server errors are logged with the stack trace, client errors at WARN.
     * The correlation ID comes from the MDC set by {@link CorrelationIdHandler}.
     */
    private void logError(ErrorCode code, Throwable failure, String path) {
        if (code.httpStatus() >= 500) {
            logger.error("Server error [{}] at {}: {}", code.code(), path, failure.getMessage(), failure);
        } else {
            logger.warn("Client error [{}] at {}: {}", code.code(), path, failure.getMessage());
        }
    }
}
