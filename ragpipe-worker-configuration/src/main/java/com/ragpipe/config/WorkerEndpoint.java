package com.ragpipe.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A worker's self-description HTTP endpoint (host and port of its /metadata server).
 * Parsed from {@code name=host:port}; name is optional and only used when the worker's
 * metadata does not declare a service name.
 */
public final class WorkerEndpoint {

    private final String name;
    private final String host;
    private final int port;

    public WorkerEndpoint(String name, String host, int port) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.name = name != null && !name.isBlank() ? name : host + ":" + port;
    }

    /**
     * Parses one endpoint spec: {@code name=host:port} or {@code host:port}.
     *
     * @throws IllegalArgumentException if host or port is missing or the port is not a number
     */
    public static WorkerEndpoint parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Empty worker endpoint");
        }
        String s = spec.trim();
        String name = null;
        int eq = s.indexOf('=');
        if (eq >= 0) {
            name = s.substring(0, eq).trim();
            s = s.substring(eq + 1).trim();
        }
        int colon = s.lastIndexOf(':');
        if (colon <= 0 || colon == s.length() - 1) {
            throw new IllegalArgumentException("Worker endpoint must be host:port, got: " + spec);
        }
        try {
            int port = Integer.parseInt(s.substring(colon + 1).trim());
            return new WorkerEndpoint(name, s.substring(0, colon).trim(), port);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in worker endpoint: " + spec, e);
        }
    }

    /** Parses a comma-separated list; blank input yields an empty list. */
    public static List<WorkerEndpoint> parseList(String value) {
        List<WorkerEndpoint> out = new ArrayList<>();
        for (String part : RagPipeConfig.parseCommaSeparated(value)) {
            out.add(parse(part));
        }
        return out;
    }

    public String getName() {
        return name;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String baseUrl() {
        return "http://" + host + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerEndpoint that = (WorkerEndpoint) o;
        return port == that.port && name.equals(that.name) && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, host, port);
    }

    @Override
    public String toString() {
        return name + "=" + host + ":" + port;
    }
}
