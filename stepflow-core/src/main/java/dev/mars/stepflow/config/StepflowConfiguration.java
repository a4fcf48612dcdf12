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

package dev.mars.stepflow.config;

import dev.mars.stepflow.queue.QueueFullMode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Configuration management for the Stepflow engine.
 * Values come from built-in defaults, then an optional {@code stepflow.properties}
 * file, then {@code stepflow.*} system properties, each overriding the previous.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class StepflowConfiguration {
    private static final Logger logger = Logger.getLogger(StepflowConfiguration.class.getName());

    public static final String QUEUE_CAPACITY = "stepflow.queue.capacity";
    public static final String QUEUE_FULL_MODE = "stepflow.queue.full-mode";
    public static final String ENGINE_MAX_CONCURRENT_STEPS = "stepflow.engine.max-concurrent-steps";
    public static final String ENGINE_DEFAULT_STEP_TIMEOUT = "stepflow.engine.default-step-timeout";
    public static final String BATCH_THREAD_POOL_SIZE = "stepflow.batch.thread-pool-size";
    public static final String BATCH_MAX_RETAINED = "stepflow.batch.max-retained";
    public static final String STORAGE_TYPE = "stepflow.storage.type";
    public static final String STORAGE_DIRECTORY = "stepflow.storage.directory";
    public static final String TOOLS_ALLOWED = "stepflow.tools.allowed";

    private static final int DEFAULT_QUEUE_CAPACITY = 100;
    private static final int DEFAULT_MAX_CONCURRENT_STEPS = 4;
    private static final Duration DEFAULT_STEP_TIMEOUT = Duration.ofMinutes(5);
    private static final int DEFAULT_BATCH_THREAD_POOL_SIZE = 8;
    private static final int DEFAULT_BATCH_MAX_RETAINED = 500;
    private static final String DEFAULT_STORAGE_DIRECTORY = "./stepflow-data";
    private static final String DEFAULT_TOOLS = "company-search,form-filter,content-search";

    private final Properties properties;

    public StepflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public StepflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Task queue
    public int getQueueCapacity() {
        return getIntProperty(QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY);
    }

    public QueueFullMode getQueueFullMode() {
        String value = properties.getProperty(QUEUE_FULL_MODE, QueueFullMode.WAIT.name());
        try {
            return QueueFullMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warning("Invalid queue full mode " + value + ". Using default: WAIT");
            return QueueFullMode.WAIT;
        }
    }

    // Execution engine
    public int getMaxConcurrentSteps() {
        return getIntProperty(ENGINE_MAX_CONCURRENT_STEPS, DEFAULT_MAX_CONCURRENT_STEPS);
    }

    public Duration getDefaultStepTimeout() {
        return getDurationProperty(ENGINE_DEFAULT_STEP_TIMEOUT, DEFAULT_STEP_TIMEOUT);
    }

    // Batch processing
    public int getBatchThreadPoolSize() {
        return getIntProperty(BATCH_THREAD_POOL_SIZE, DEFAULT_BATCH_THREAD_POOL_SIZE);
    }

    /**
     * Number of batch records kept in memory. Once exceeded, the oldest finished batches are evicted.
     */
    public int getBatchMaxRetained() {
        return getIntProperty(BATCH_MAX_RETAINED, DEFAULT_BATCH_MAX_RETAINED);
    }

    // Storage
    public String getStorageType() {
        return properties.getProperty(STORAGE_TYPE, "memory").trim().toLowerCase(Locale.ROOT);
    }

    public Path getStorageDirectory() {
        return Paths.get(properties.getProperty(STORAGE_DIRECTORY, DEFAULT_STORAGE_DIRECTORY));
    }

    // Tools
    public Set<String> getAllowedTools() {
        String value = properties.getProperty(TOOLS_ALLOWED, DEFAULT_TOOLS);
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private Duration getDurationProperty(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Duration.parse(value.trim());
            } catch (DateTimeParseException e) {
                logger.warning("Invalid ISO-8601 duration for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(QUEUE_CAPACITY, String.valueOf(DEFAULT_QUEUE_CAPACITY));
        properties.setProperty(QUEUE_FULL_MODE, QueueFullMode.WAIT.name());
        properties.setProperty(ENGINE_MAX_CONCURRENT_STEPS, String.valueOf(DEFAULT_MAX_CONCURRENT_STEPS));
        properties.setProperty(ENGINE_DEFAULT_STEP_TIMEOUT, DEFAULT_STEP_TIMEOUT.toString());
        properties.setProperty(BATCH_THREAD_POOL_SIZE, String.valueOf(DEFAULT_BATCH_THREAD_POOL_SIZE));
        properties.setProperty(BATCH_MAX_RETAINED, String.valueOf(DEFAULT_BATCH_MAX_RETAINED));
        properties.setProperty(STORAGE_TYPE, "memory");
        properties.setProperty(STORAGE_DIRECTORY, DEFAULT_STORAGE_DIRECTORY);
        properties.setProperty(TOOLS_ALLOWED, DEFAULT_TOOLS);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "stepflow.properties",
                "config/stepflow.properties",
                System.getProperty("user.home") + "/.stepflow/stepflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("stepflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().stringPropertyNames().stream()
                .filter(key -> key.startsWith("stepflow."))
                .forEach(key -> {
                    properties.setProperty(key, System.getProperty(key));
                    logger.fine("Override from system property: " + key);
                });
    }

    @Override
    public String toString() {
        return "StepflowConfiguration{" +
                "queueCapacity=" + getQueueCapacity() +
                ", queueFullMode=" + getQueueFullMode() +
                ", maxConcurrentSteps=" + getMaxConcurrentSteps() +
                ", defaultStepTimeout=" + getDefaultStepTimeout() +
                ", storageType='" + getStorageType() + '\'' +
                ", allowedTools=" + getAllowedTools() +
                '}';
    }
}
