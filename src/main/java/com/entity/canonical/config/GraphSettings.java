package com.entity.canonical.config;

import java.util.Objects;

/**
 * FalkorDB connection settings.
 */
public record GraphSettings(String host, int port, String graphName) {

    public GraphSettings {
        Objects.requireNonNull(host, "host is required");
        Objects.requireNonNull(graphName, "graphName is required");
        if (port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
    }

    public static GraphSettings defaults() {
        return new GraphSettings("localhost", 6379, "entity-canonical");
    }
}
