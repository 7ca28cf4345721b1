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
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.scanfleet.core.ScanFleetJson;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.io.IOException;

/**
 * Request and response body helpers shared by the API handlers. Domain types are
 * written with the shared Jackson mapper so timestamps and snake_case names match
 * what agents send.
 */
public final class ApiJson {

    private static final ObjectMapper MAPPER = ScanFleetJson.mapper();

    private ApiJson() {
    }

    /**
     * Serializes the body and ends the response.
     */
    public static void respond(RoutingContext ctx, int status, Object body) {
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            ctx.fail(e);
            return;
        }
        ctx.response()
                .setStatusCode(status)
                .putHeader("Content-Type", "application/json")
                .end(json);
    }

    /**
     * Converts a domain object to a Vert.x JSON object, for handlers that add or drop fields.
     */
    public static JsonObject toJsonObject(Object value) {
        try {
            return new JsonObject(MAPPER.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decodes the request body.
     *
     * @throws ScanFleetApiException BAD_REQUEST when the body is missing or not valid for the type
     */
    public static <T> T readBody(RoutingContext ctx, Class<T> type) {
        Buffer buffer = ctx.body().buffer();
        if (buffer == null || buffer.length() == 0) {
            throw ScanFleetApiException.badRequest(ErrorCode.BAD_REQUEST, "Request body is required");
        }
        try {
            return MAPPER.readValue(buffer.getBytes(), type);
        } catch (JsonProcessingException e) {
            throw new ScanFleetApiException(ErrorCode.BAD_REQUEST,
                    ErrorCode.BAD_REQUEST.formatMessage(e.getOriginalMessage()), e);
        } catch (IOException e) {
            throw new ScanFleetApiException(ErrorCode.BAD_REQUEST,
                    ErrorCode.BAD_REQUEST.formatMessage(e.getMessage()), e);
        }
    }

    /**
     * @throws ScanFleetApiException BAD_REQUEST when the body is missing or not a JSON object
     */
    public static JsonObject requireJsonObject(RoutingContext ctx) {
        JsonObject body;
        try {
            body = ctx.body().asJsonObject();
        } catch (RuntimeException e) {
            throw new ScanFleetApiException(ErrorCode.BAD_REQUEST,
                    ErrorCode.BAD_REQUEST.formatMessage("body is not a JSON object"), e);
        }
        if (body == null) {
            throw ScanFleetApiException.badRequest(ErrorCode.BAD_REQUEST, "Request body is required");
        }
        return body;
    }

    public static int intParam(RoutingContext ctx, String name, int defaultValue) {
        String value = ctx.queryParams().get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw ScanFleetApiException.badRequest(ErrorCode.VALIDATION_ERROR,
                    "query parameter '" + name + "' must be an integer");
        }
    }

    public static boolean boolParam(RoutingContext ctx, String name) {
        return Boolean.parseBoolean(ctx.queryParams().get(name));
    }
}
