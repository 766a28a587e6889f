package com.analysis.nodeflow.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Engine settings. Defaults come from {@code nodeflow-defaults.json} on the
 * classpath; {@link #load(Path)} overlays a user file on top of them.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    public static final String DEFAULTS_RESOURCE = "/nodeflow-defaults.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private int executionTimeoutSeconds = 30;
    private int loadTimeoutSeconds = 30;
    private int maxSessions = 10;
    private int sessionIdleSeconds = 300;
    private EdgeMode edgeMode = EdgeMode.INFERRED;
    private boolean preflightCycleCheck = true;
    private List<String> extraReservedNames = new ArrayList<>();

    public static EngineConfig defaults() {
        try (InputStream in = EngineConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null)
                return new EngineConfig();
            return MAPPER.readValue(in, EngineConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    /** Defaults overlaid with the settings present in {@code file}. */
    public static EngineConfig load(Path file) {
        EngineConfig config = defaults();
        try {
            return MAPPER.readerForUpdating(config).readValue(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config " + file, e);
        }
    }

    @JsonIgnore
    public Duration executionTimeout() {
        return Duration.ofSeconds(executionTimeoutSeconds);
    }

    @JsonIgnore
    public Duration loadTimeout() {
        return Duration.ofSeconds(loadTimeoutSeconds);
    }

    @JsonIgnore
    public Duration sessionIdleTimeout() {
        return Duration.ofSeconds(sessionIdleSeconds);
    }
}
