package com.netctl.fib.io;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link FibConfig} from JSON. Absent keys keep their defaults.
 */
public final class FibConfigLoader {
    private static final Logger log = LogManager.getLogger(FibConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FibConfigLoader() {
    }

    public static FibConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            FibConfig cfg = load(in);
            log.info("Loaded FIB config from {}", path);
            return cfg;
        } catch (IOException e) {
            throw new FibConfigException("Failed to read config " + path, e);
        }
    }

    /** Loads a config bundled on the classpath, e.g. {@code "/fib.json"}. */
    public static FibConfig loadResource(String resource) {
        try (InputStream in = FibConfigLoader.class.getResourceAsStream(resource)) {
            if (in == null)
                throw new FibConfigException("Config resource not found: " + resource);
            return load(in);
        } catch (IOException e) {
            throw new FibConfigException("Failed to read config resource " + resource, e);
        }
    }

    public static FibConfig parse(String json) {
        try {
            return MAPPER.readValue(json, FibConfig.class).validate();
        } catch (IOException e) {
            throw new FibConfigException("Malformed config: " + e.getMessage(), e);
        }
    }

    private static FibConfig load(InputStream in) throws IOException {
        return MAPPER.readValue(in, FibConfig.class).validate();
    }
}
