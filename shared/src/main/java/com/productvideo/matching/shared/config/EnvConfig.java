package com.productvideo.matching.shared.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves settings from the process environment first, then from a {@code .env}
 * file in the working directory, then from a caller-supplied default.
 */
public class EnvConfig {
    private static final Logger logger = LogManager.getLogger(EnvConfig.class);

    private final Dotenv dotenv;

    public EnvConfig(Dotenv dotenv) {
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv is null");
    }

    public static EnvConfig load() {
        return new EnvConfig(Dotenv.configure().directory("./").ignoreIfMissing().load());
    }

    public String get(String key, String defaultValue) {
        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal;
        }
        String dotenvVal = dotenv.get(key);
        return (dotenvVal == null || dotenvVal.isBlank()) ? defaultValue : dotenvVal;
    }

    public int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for {}='{}', falling back to {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public String require(String key) {
        String value = get(key, null);
        if (value == null) {
            throw new IllegalStateException(key + " is not set");
        }
        return value;
    }
}
