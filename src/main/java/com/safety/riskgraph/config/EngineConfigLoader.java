package com.safety.riskgraph.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Reads {@link EngineConfig} from JSON.
 */
@Log4j2
public final class EngineConfigLoader {
    public static final String DEFAULT_RESOURCE = "risk-engine.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private EngineConfigLoader() {
        // Utility class
    }

    public static EngineConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            EngineConfig config = MAPPER.readValue(in, EngineConfig.class);
            log.info("Loaded engine config from {}", path);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read engine config " + path, e);
        }
    }

    /**
     * Loads a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist.
     */
    public static EngineConfig loadResource(String resource) {
        try (InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("No such resource: " + resource);
            return MAPPER.readValue(in, EngineConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read engine config resource " + resource, e);
        }
    }

    /** The bundled {@value #DEFAULT_RESOURCE}, or built-in defaults when it is absent. */
    public static EngineConfig defaults() {
        if (EngineConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            log.warn("{} not on classpath, using built-in defaults", DEFAULT_RESOURCE);
            return new EngineConfig();
        }
        return loadResource(DEFAULT_RESOURCE);
    }

    public static String toJson(EngineConfig config) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize engine config", e);
        }
    }
}
