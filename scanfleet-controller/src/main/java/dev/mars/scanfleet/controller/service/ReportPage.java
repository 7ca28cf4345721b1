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

package dev.mars.scanfleet.controller.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of a paginated listing.
 *
 * @param <T> the item type
 */
public record ReportPage<T>(
        @JsonProperty("items") List<T> items,
        @JsonProperty("page") int page,
        @JsonProperty("per_page") int perPage,
        @JsonProperty("total") int total) {

    public ReportPage {
        items = List.copyOf(items);
    }

    @JsonProperty("pages")
    public int pages() {
        return total == 0 ? 0 : (total + perPage - 1) / perPage;
    }

    @JsonProperty("has_next")
    public boolean hasNext() {
        return page < pages();
    }

    @JsonProperty("has_prev")
    public boolean hasPrev() {
        return page > 1;
    }
}
