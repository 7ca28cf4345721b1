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

import dev.mars.scanfleet.core.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Parsed form of an address expression, used both for scan targets and for the
 * ranges agents declare they own.
 *
 * <p>Accepted tokens, separated by commas or whitespace:</p>
 * <ul>
 *   <li>{@code 10.0.0.5} - a single address</li>
 *   <li>{@code 10.0.0.0/24} - a CIDR block; in scan targets the network and
 *       broadcast addresses of prefixes up to /30 are excluded, matching normal
 *       host enumeration, while ownership ranges keep the whole block</li>
 *   <li>{@code 10.0.0.10-20} - a last-octet range</li>
 *   <li>{@code 10.0.0.10-10.0.1.5} - an explicit range</li>
 * </ul>
 *
 * <p>Blocks are normalised (sorted and coalesced) so containment and
 * intersection checks never enumerate addresses.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class TargetSpec {

    /** Upper bound on the number of addresses a target expression may expand to. */
    public static final int DEFAULT_MAX_ADDRESSES = 65_536;

    private final String expression;
    private final List<AddressBlock> blocks;

    private TargetSpec(String expression, List<AddressBlock> blocks) {
        this.expression = expression;
        this.blocks = List.copyOf(blocks);
    }

    /**
     * Parses an address expression.
     *
     * @param expression CIDR, single address, range or list thereof
     * @return the parsed spec
     * @throws ValidationException if the expression is empty or any token is malformed
     */
    public static TargetSpec parse(String expression) throws ValidationException {
        return parse(expression, true);
    }

    /**
     * Parses the range an agent declares it owns. CIDR blocks cover every address
     * in the block, so adjacent owners such as two /25 halves of a /24 leave no gap.
     *
     * @throws ValidationException if the expression is empty or any token is malformed
     */
    public static TargetSpec parseOwnership(String expression) throws ValidationException {
        return parse(expression, false);
    }

    private static TargetSpec parse(String expression, boolean hostsOnly) throws ValidationException {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Address expression must not be empty");
        }
        List<AddressBlock> parsed = new ArrayList<>();
        for (String token : expression.trim().split("[,\\s]+")) {
            if (!token.isEmpty()) {
                parsed.add(parseToken(token, hostsOnly));
            }
        }
        return new TargetSpec(expression.trim(), normalise(parsed));
    }

    /**
     * Builds a spec from a literal list of addresses.
     *
     * @throws ValidationException if any entry is not an IPv4 address
     */
    public static TargetSpec ofAddresses(List<String> addresses) throws ValidationException {
        if (addresses == null || addresses.isEmpty()) {
            throw new ValidationException("Address list must not be empty");
        }
        return parse(String.join(",", addresses));
    }

    private static AddressBlock parseToken(String token, boolean hostsOnly) throws ValidationException {
        try {
            int slash = token.indexOf('/');
            if (slash >= 0) {
                return parseCidr(token, slash, hostsOnly);
            }
            int dash = token.indexOf('-');
            if (dash >= 0) {
                return parseRange(token, dash);
            }
            long address = Ipv4.toLong(token);
            return new AddressBlock(address, address);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid address token '" + token + "': " + e.getMessage(), e);
        }
    }

    private static AddressBlock parseCidr(String token, int slash, boolean hostsOnly) {
        long base = Ipv4.toLong(token.substring(0, slash));
        String prefixText = token.substring(slash + 1);
        int prefix;
        try {
            prefix = Integer.parseInt(prefixText);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad prefix length '" + prefixText + "'");
        }
        if (prefix < 0 || prefix > 32) {
            throw new IllegalArgumentException("prefix length must be between 0 and 32");
        }
        long mask = prefix == 0 ? 0 : (Ipv4.MAX_VALUE << (32 - prefix)) & Ipv4.MAX_VALUE;
        long network = base & mask;
        long broadcast = network | (~mask & Ipv4.MAX_VALUE);
        if (hostsOnly && prefix <= 30) {
            return new AddressBlock(network + 1, broadcast - 1);
        }
        return new AddressBlock(network, broadcast);
    }

    private static AddressBlock parseRange(String token, int dash) {
        String startText = token.substring(0, dash);
        String endText = token.substring(dash + 1);
        long start = Ipv4.toLong(startText);
        long end;
        if (endText.contains(".")) {
            end = Ipv4.toLong(endText);
        } else {
            end = (start & 0xFFFFFF00L) | Ipv4.parseOctet(endText, token);
        }
        if (end < start) {
            throw new IllegalArgumentException("range end precedes start");
        }
        return new AddressBlock(start, end);
    }

    private static List<AddressBlock> normalise(List<AddressBlock> input) {
        List<AddressBlock> sorted = new ArrayList<>(input);
        sorted.sort(Comparator.comparingLong(AddressBlock::first));
        List<AddressBlock> merged = new ArrayList<>();
        for (AddressBlock block : sorted) {
            if (!merged.isEmpty() && merged.get(merged.size() - 1).touches(block)) {
                AddressBlock last = merged.remove(merged.size() - 1);
                merged.add(new AddressBlock(last.first(), Math.max(last.last(), block.last())));
            } else {
                merged.add(block);
            }
        }
        return merged;
    }

    public String getExpression() {
        return expression;
    }

    public List<AddressBlock> getBlocks() {
        return blocks;
    }

    /**
     * @return number of addresses covered
     */
    public long size() {
        long total = 0;
        for (AddressBlock block : blocks) {
            total += block.size();
        }
        return total;
    }

    /**
     * Checks whether the given address falls inside this spec. Non-IPv4 input
     * is never contained.
     */
    public boolean contains(String address) {
        if (!Ipv4.isValid(address)) {
            return false;
        }
        long value = Ipv4.toLong(address);
        for (AddressBlock block : blocks) {
            if (block.contains(value)) {
                return true;
            }
        }
        return false;
    }

    public boolean intersects(TargetSpec other) {
        for (AddressBlock mine : blocks) {
            for (AddressBlock theirs : other.blocks) {
                if (mine.overlaps(theirs)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Expands this spec into individual addresses in ascending order.
     *
     * @param limit maximum number of addresses allowed
     * @throws ValidationException if the expression covers more than {@code limit} addresses
     */
    public List<String> enumerate(int limit) throws ValidationException {
        long size = size();
        if (size > limit) {
            throw new ValidationException("Target '" + expression + "' expands to " + size
                    + " addresses, more than the limit of " + limit);
        }
        List<String> addresses = new ArrayList<>((int) size);
        for (AddressBlock block : blocks) {
            for (long value = block.first(); value <= block.last(); value++) {
                addresses.add(Ipv4.toString(value));
            }
        }
        return addresses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TargetSpec)) {
            return false;
        }
        return blocks.equals(((TargetSpec) o).blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blocks);
    }

    @Override
    public String toString() {
        return expression;
    }
}
