package com.hydrology.dtss.server;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Server settings, loadable from JSON.
 *
 * <pre>{@code
 * { "port": 20000, "maxConnections": 10, "placeholderResolution": false }
 * }</pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** 0 picks an ephemeral port. */
    private int port = 20000;
    private int maxConnections = 10;
    private long stopTimeoutMillis = 2000;
    private int maxMessageBytes = 64 * 1024 * 1024;
    private int journalBufferSize = 1024;
    /** Answer unbound references with synthetic data when no resolver is set. Test only. */
    private boolean placeholderResolution;

    public static ServerConfig fromJson(String json) throws IOException {
        return MAPPER.readValue(json, ServerConfig.class).validate();
    }

    public static ServerConfig fromFile(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), ServerConfig.class).validate();
    }

    public static ServerConfig fromResource(String resource) throws IOException {
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return MAPPER.readValue(in, ServerConfig.class).validate();
        }
    }

    public ServerConfig validate() {
        if (port < 0 || port > 65535)
            throw new IllegalArgumentException("port out of range: " + port);
        if (maxConnections <= 0)
            throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        if (maxMessageBytes <= 0)
            throw new IllegalArgumentException("maxMessageBytes must be positive: " + maxMessageBytes);
        if (Integer.bitCount(journalBufferSize) != 1)
            throw new IllegalArgumentException("journalBufferSize must be a power of two: " + journalBufferSize);
        return this;
    }
}
