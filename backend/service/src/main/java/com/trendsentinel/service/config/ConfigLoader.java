package com.trendsentinel.service.config;

import com.trendsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

public final class ConfigLoader {
    public static final String MONITOR_FILE = "monitor.json";

    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    /**
     * Reads {@code monitor.json} from {@code configDir}, or returns defaults when the file is absent.
     *
     * @throws IllegalStateException if the file exists but is not a valid configuration
     */
    public static MonitorConfig loadMonitor(Path configDir) {
        Path path = configDir.resolve(MONITOR_FILE);
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + " found; using default monitor settings");
            return MonitorConfig.defaults();
        }
        try (InputStream in = Files.newInputStream(path)) {
            MonitorConfig config = JsonUtils.objectMapper().readValue(in, MonitorConfig.class);
            // validate derived settings now rather than on the first cycle
            config.cycleSettings();
            config.redditSourceConfig();
            config.trendThresholds();
            return config;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
