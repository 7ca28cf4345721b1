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

package dev.mars.scanfleet.network;

/**
 * A contiguous, inclusive run of IPv4 addresses.
 *
 * @param first lowest address in the block
 * @param last  highest address in the block
 */
public record AddressBlock(long first, long last) {

    public AddressBlock {
        if (first < 0 || last > Ipv4.MAX_VALUE || first > last) {
            throw new IllegalArgumentException("Invalid address block " + first + ".." + last);
        }
    }

    public boolean contains(long address) {
        return address >= first && address <= last;
    }

    public boolean overlaps(AddressBlock other) {
        return first <= other.last && other.first <= last;
    }

    /** Adjacent or overlapping blocks can be coalesced. */
    boolean touches(AddressBlock other) {
        return first <= other.last + 1 && other.first <= last + 1;
    }

    public long size() {
        return last - first + 1;
    }

    @Override
    public String toString() {
        return first == last ? Ipv4.toString(first) : Ipv4.toString(first) + "-" + Ipv4.toString(last);
    }
}
