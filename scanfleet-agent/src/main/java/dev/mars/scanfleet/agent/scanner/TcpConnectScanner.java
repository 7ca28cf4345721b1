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

package dev.mars.scanfleet.agent.scanner;

import dev.mars.scanfleet.core.HostResult;
import dev.mars.scanfleet.core.HostState;
import dev.mars.scanfleet.core.PortDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link PortScanner} that probes ports with plain TCP connects.
 *
 * <p>A port is open when the connect succeeds. A refused connection proves the host
 * is up even when nothing listens. A host that only times out is reported down.
 * Service names come from a table of well-known ports; no banner grabbing is done,
 * so product and version stay empty. {@code scanArguments} are not interpreted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class TcpConnectScanner implements PortScanner, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TcpConnectScanner.class);

    private static final Map<Integer, String> WELL_KNOWN = Map.ofEntries(
            Map.entry(21, "ftp"), Map.entry(22, "ssh"), Map.entry(23, "telnet"), Map.entry(25, "smtp"),
            Map.entry(53, "domain"), Map.entry(80, "http"), Map.entry(110, "pop3"), Map.entry(111, "rpcbind"),
            Map.entry(135, "msrpc"), Map.entry(139, "netbios-ssn"), Map.entry(143, "imap"),
            Map.entry(443, "https"), Map.entry(445, "microsoft-ds"), Map.entry(993, "imaps"),
            Map.entry(995, "pop3s"), Map.entry(1433, "ms-sql-s"), Map.entry(1521, "oracle"),
            Map.entry(3306, "mysql"), Map.entry(3389, "ms-wbt-server"), Map.entry(5432, "postgresql"),
            Map.entry(5900, "vnc"), Map.entry(6379, "redis"), Map.entry(8080, "http-proxy"),
            Map.entry(8443, "https-alt"), Map.entry(9200, "elasticsearch"), Map.entry(27017, "mongodb"));

    private enum Probe { OPEN, REFUSED, SILENT }

    private final int connectTimeoutMs;
    private final ExecutorService executor;

    public TcpConnectScanner(int connectTimeoutMs, int parallelism) {
        if (connectTimeoutMs <= 0 || parallelism <= 0) {
            throw new IllegalArgumentException("Timeout and parallelism must be positive");
        }
        this.connectTimeoutMs = connectTimeoutMs;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "scanfleet-probe-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public HostResult scan(String address, List<Integer> ports, String scanArguments) throws IOException {
        if (scanArguments != null && !scanArguments.isBlank()) {
            logger.debug("Ignoring scan arguments '{}' for {}", scanArguments, address);
        }

        List<Callable<Probe>> probes = new ArrayList<>(ports.size());
        for (int port : ports) {
            probes.add(() -> probe(address, port));
        }

        List<Future<Probe>> outcomes;
        try {
            outcomes = executor.invokeAll(probes);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Scan of " + address + " interrupted");
        }

        List<Integer> open = new ArrayList<>();
        Map<Integer, PortDetail> details = new LinkedHashMap<>();
        boolean answered = false;
        for (int i = 0; i < ports.size(); i++) {
            Probe probe = await(outcomes.get(i), address);
            if (probe == Probe.OPEN) {
                int port = ports.get(i);
                open.add(port);
                details.put(port, new PortDetail(PortDetail.DEFAULT_PROTOCOL, serviceName(port), "", "", ""));
                answered = true;
            } else if (probe == Probe.REFUSED) {
                answered = true;
            }
        }

        HostState state = answered ? HostState.UP : HostState.DOWN;
        String hostname = answered ? reverseLookup(address) : "";
        logger.debug("Scanned {}: state={}, open={}", address, state, open);
        return new HostResult(hostname, state, open, details);
    }

    /**
     * Service name for a well-known port, or {@code unknown}.
     */
    public static String serviceName(int port) {
        return WELL_KNOWN.getOrDefault(port, "unknown");
    }

    private Probe probe(String address, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(address, port), connectTimeoutMs);
            return Probe.OPEN;
        } catch (ConnectException e) {
            return Probe.REFUSED;
        } catch (IOException e) {
            logger.trace("Port {} silent on {}: {}", port, address, e.getMessage());
            return Probe.SILENT;
        }
    }

    private static Probe await(Future<Probe> outcome, String address) throws IOException {
        try {
            return outcome.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Scan of " + address + " interrupted");
        } catch (ExecutionException e) {
            throw new IOException("Probe of " + address + " failed", e.getCause());
        }
    }

    private static String reverseLookup(String address) {
        try {
            String name = InetAddress.getByName(address).getCanonicalHostName();
            return name.equals(address) ? "" : name;
        } catch (IOException e) {
            logger.debug("Reverse lookup failed for {}: {}", address, e.getMessage());
            return "";
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
