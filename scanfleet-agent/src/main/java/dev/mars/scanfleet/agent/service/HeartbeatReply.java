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

package dev.mars.scanfleet.agent.service;

/**
 * How the controller answered one heartbeat.
 *
 * @param outcome           approved, pending approval, or no usable answer
 * @param status            agent status reported by the controller, empty on failure
 * @param retryAfterSeconds poll hint sent with a pending answer, 0 when absent
 */
public record HeartbeatReply(Outcome outcome, String status, int retryAfterSeconds) {

    public enum Outcome {
        APPROVED,
        PENDING_APPROVAL,
        FAILED
    }

    public static HeartbeatReply approved(String status) {
        return new HeartbeatReply(Outcome.APPROVED, status, 0);
    }

    public static HeartbeatReply pending(int retryAfterSeconds) {
        return new HeartbeatReply(Outcome.PENDING_APPROVAL, "pending_approval", retryAfterSeconds);
    }

    public static HeartbeatReply failed() {
        return new HeartbeatReply(Outcome.FAILED, "", 0);
    }

    public boolean isApproved() {
        return outcome == Outcome.APPROVED;
    }
}
