package com.sanctionsentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sanctionsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    /** Reads {@code service.json}; a missing file yields the defaults. */
    public static ServiceConfig loadService(Path configDir) {
        Path path = configDir.resolve("service.json");
        if (!Files.exists(path)) {
            return ServiceConfig.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    public static List<SourceSettings> loadSources(Path configDir) {
        return read(configDir.resolve("sources.json"), new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
