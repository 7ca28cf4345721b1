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

import java.util.Comparator;

/**
 * IPv4 address helpers operating on the unsigned 32-bit value held in a {@code long}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class Ipv4 {

    public static final long MAX_VALUE = 0xFFFFFFFFL;

    /**
     * Orders dotted-quad addresses numerically. Anything that is not an IPv4
     * literal sorts after all addresses, lexically.
     */
    public static final Comparator<String> ADDRESS_ORDER = (a, b) -> {
        boolean aValid = isValid(a);
        boolean bValid = isValid(b);
        if (aValid && bValid) {
            return Long.compare(toLong(a), toLong(b));
        }
        if (aValid) {
            return -1;
        }
        if (bValid) {
            return 1;
        }
        return a.compareTo(b);
    };

    private Ipv4() {
    }

    /**
     * Parses a dotted-quad address.
     *
     * @throws IllegalArgumentException if the text is not a valid IPv4 literal
     */
    public static long toLong(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Address must not be null");
        }
        String[] octets = address.trim().split("\\.", -1);
        if (octets.length != 4) {
            throw new IllegalArgumentException("Not an IPv4 address: " + address);
        }
        long value = 0;
        for (String octet : octets) {
            value = (value << 8) | parseOctet(octet, address);
        }
        return value;
    }

    public static String toString(long value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("Out of IPv4 range: " + value);
        }
        return ((value >>> 24) & 0xFF) + "." + ((value >>> 16) & 0xFF) + "."
                + ((value >>> 8) & 0xFF) + "." + (value & 0xFF);
    }

    public static boolean isValid(String address) {
        try {
            toLong(address);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static int parseOctet(String octet, String source) {
        if (octet.isEmpty() || octet.length() > 3) {
            throw new IllegalArgumentException("Not an IPv4 address: " + source);
        }
        for (int i = 0; i < octet.length(); i++) {
            if (!Character.isDigit(octet.charAt(i))) {
                throw new IllegalArgumentException("Not an IPv4 address: " + source);
            }
        }
        int value = Integer.parseInt(octet);
        if (value > 255) {
            throw new IllegalArgumentException("Octet out of range in " + source);
        }
        return value;
    }
}
