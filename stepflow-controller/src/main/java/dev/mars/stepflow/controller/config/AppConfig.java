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

package dev.mars.stepflow.controller.config;

import dev.mars.stepflow.config.StepflowConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Centralized configuration for the Stepflow controller.
 *
 * <p>Values are resolved in this order, first match wins:
 * <ol>
 *   <li>Environment variable, e.g. {@code STEPFLOW_HTTP_PORT}</li>
 *   <li>System property, e.g. {@code -Dstepflow.http.port=8080}</li>
 *   <li>{@code stepflow-controller.properties} on the classpath</li>
 *   <li>The default passed by the caller</li>
 * </ol>
 *
 * <p>Engine settings ({@code stepflow.queue.*}, {@code stepflow.engine.*}, {@code stepflow.batch.*},
 * {@code stepflow.storage.*}, {@code stepflow.tools.allowed}) are read through the same lookup and
 * handed to the core as a {@link StepflowConfiguration}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 * @version 1.0
 */
public final class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private static final String CONFIG_FILE = "stepflow-controller.properties";
    private static final String REMOTE_TOOL_PREFIX = "stepflow.tools.remote.";
    private static final String REMOTE_TOOL_SUFFIX = ".url";

    private static final String[] CORE_KEYS = {
            StepflowConfiguration.QUEUE_CAPACITY,
            StepflowConfiguration.QUEUE_FULL_MODE,
            StepflowConfiguration.ENGINE_MAX_CONCURRENT_STEPS,
            StepflowConfiguration.ENGINE_DEFAULT_STEP_TIMEOUT,
            StepflowConfiguration.BATCH_THREAD_POOL_SIZE,
            StepflowConfiguration.BATCH_MAX_RETAINED,
            StepflowConfiguration.STORAGE_TYPE,
            StepflowConfiguration.STORAGE_DIRECTORY,
            StepflowConfiguration.TOOLS_ALLOWED
    };

    private static final AppConfig INSTANCE = new AppConfig(loadProperties());

    private final Properties properties;

    private AppConfig(Properties properties) {
        this.properties = properties;
    }

    public static AppConfig get() {
        return INSTANCE;
    }

    /**
     * Builds a configuration over the given file properties. Environment variables and
     * system properties still take precedence.
     */
    public static AppConfig fromProperties(Properties properties) {
        Properties copy = new Properties();
        if (properties != null) {
            copy.putAll(properties);
        }
        return new AppConfig(copy);
    }

    // ==================== HTTP Configuration ====================

    public int getHttpPort() {
        return getInt("stepflow.http.port", 8080);
    }

    public String getHttpHost() {
        return getString("stepflow.http.host", "0.0.0.0");
    }

    // ==================== Shutdown Configuration ====================

    public long getDrainTimeoutMs() {
        return getLong("stepflow.shutdown.drain-timeout-ms", 30000);
    }

    // ==================== Telemetry Configuration ====================

    public boolean isTelemetryEnabled() {
        return getBoolean("stepflow.telemetry.enabled", false);
    }

    public int getPrometheusPort() {
        return getInt("stepflow.telemetry.prometheus-port", 9464);
    }

    public String getServiceName() {
        return getString("stepflow.telemetry.service-name", "stepflow-controller");
    }

    // ==================== Remote Tools ====================

    /**
     * Tool endpoints declared as {@code stepflow.tools.remote.<toolName>.url}. Only the
     * properties file and system properties are scanned for names; each value is then
     * resolved with the usual precedence.
     *
     * @return tool name to endpoint URL, in name order
     */
    public Map<String, String> getRemoteToolUrls() {
        Map<String, String> urls = new TreeMap<>();
        collectRemoteToolNames(properties, urls);
        collectRemoteToolNames(System.getProperties(), urls);
        Map<String, String> resolved = new LinkedHashMap<>();
        for (String toolName : urls.keySet()) {
            String url = getString(REMOTE_TOOL_PREFIX + toolName + REMOTE_TOOL_SUFFIX, "");
            if (!url.isBlank()) {
                resolved.put(toolName, url.trim());
            }
        }
        return resolved;
    }

    public long getRemoteToolTimeoutMs() {
        return getLong("stepflow.tools.remote.timeout-ms", 30000);
    }

    // ==================== Application Info ====================

    public String getVersion() {
        return getString("stepflow.version", "1.0-SNAPSHOT");
    }

    // ==================== Engine Configuration ====================

    /**
     * Builds the core engine configuration from the {@code stepflow.*} engine keys.
     * Keys that are not set anywhere keep the core defaults.
     */
    public StepflowConfiguration toStepflowConfiguration() {
        Properties core = new Properties();
        for (String key : CORE_KEYS) {
            String value = getString(key, null);
            if (value != null) {
                core.setProperty(key, value);
            }
        }
        return new StepflowConfiguration(core);
    }

    // ==================== Core Property Accessors ====================

    public String getString(String key, String defaultValue) {
        // STEPFLOW_HTTP_PORT format
        String envKey = key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isEmpty()) {
            return sysValue;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Logs the effective configuration at startup.
     */
    public void logConfiguration() {
        logger.info("Stepflow controller configuration:");
        logger.info("  HTTP: {}:{}", getHttpHost(), getHttpPort());
        logger.info("  Drain timeout: {}ms", getDrainTimeoutMs());
        logger.info("  Telemetry: enabled={}, prometheusPort={}", isTelemetryEnabled(), getPrometheusPort());
        logger.info("  Remote tools: {}", getRemoteToolUrls().keySet());
        logger.info("  Engine: {}", toStepflowConfiguration());
    }

    // ==================== Private Helpers ====================

    private static void collectRemoteToolNames(Properties source, Map<String, String> names) {
        for (String key : source.stringPropertyNames()) {
            if (key.startsWith(REMOTE_TOOL_PREFIX) && key.endsWith(REMOTE_TOOL_SUFFIX)) {
                String toolName = key.substring(REMOTE_TOOL_PREFIX.length(), key.length() - REMOTE_TOOL_SUFFIX.length());
                if (!toolName.isEmpty()) {
                    names.put(toolName, key);
                }
            }
        }
    }

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream input = AppConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
        return properties;
    }
}
