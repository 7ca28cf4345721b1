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

package dev.mars.scanfleet.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Operator-defined scan configuration.
 *
 * <p>Created and edited through the API. The scheduler owns {@code lastRun} and
 * {@code nextRun}; everything else is operator input.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanConfig {

    public static final String DEFAULT_PORTS = "1-1000";
    public static final String DEFAULT_SCAN_ARGUMENTS = "-sV";
    public static final int DEFAULT_INTERVAL_MINUTES = 60;

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("target")
    private String target;

    @JsonProperty("ports")
    private String ports = DEFAULT_PORTS;

    @JsonProperty("scan_arguments")
    private String scanArguments = DEFAULT_SCAN_ARGUMENTS;

    @JsonProperty("interval_minutes")
    private int intervalMinutes = DEFAULT_INTERVAL_MINUTES;

    @JsonProperty("is_active")
    private boolean active = true;

    @JsonProperty("is_scheduled")
    private boolean recurring;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("last_run")
    private Instant lastRun;

    @JsonProperty("next_run")
    private Instant nextRun;

    public ScanConfig() {
    }

    public ScanConfig(String id, String name, String target) {
        this.id = id;
        this.name = name;
        this.target = target;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getPorts() {
        return ports;
    }

    public void setPorts(String ports) {
        this.ports = ports;
    }

    public String getScanArguments() {
        return scanArguments;
    }

    public void setScanArguments(String scanArguments) {
        this.scanArguments = scanArguments;
    }

    public int getIntervalMinutes() {
        return intervalMinutes;
    }

    public void setIntervalMinutes(int intervalMinutes) {
        this.intervalMinutes = intervalMinutes;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isRecurring() {
        return recurring;
    }

    public void setRecurring(boolean recurring) {
        this.recurring = recurring;
    }

    /**
     * A configuration is schedulable when it is both active and recurring.
     */
    @JsonIgnore
    public boolean isSchedulable() {
        return active && recurring;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }

    public Instant getNextRun() {
        return nextRun;
    }

    public void setNextRun(Instant nextRun) {
        this.nextRun = nextRun;
    }

    @Override
    public String toString() {
        return "ScanConfig{id='" + id + "', name='" + name + "', target='" + target
                + "', active=" + active + ", recurring=" + recurring + '}';
    }
}
