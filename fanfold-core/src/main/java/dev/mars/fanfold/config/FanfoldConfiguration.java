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

package dev.mars.fanfold.config;

import dev.mars.fanfold.core.EventBusAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuration for a Fanfold manager and its worker pool.
 *
 * <p>Loads {@code fanfold.properties} from the classpath. Values resolve in this order
 * (highest to lowest priority):
 * <ol>
 *   <li>Explicit overrides passed to the constructor (e.g., command-line arguments)</li>
 *   <li>Environment variable (e.g., FANFOLD_POOL_SIZE)</li>
 *   <li>System property (e.g., -Dfanfold.pool.size=8)</li>
 *   <li>Properties file (fanfold.properties)</li>
 *   <li>Default value</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public class FanfoldConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(FanfoldConfiguration.class);
    private static final String CONFIG_FILE = "fanfold.properties";

    public static final String POOL_SIZE = "fanfold.pool.size";
    public static final String DISPATCH_POLICY = "fanfold.pool.dispatch-policy";
    public static final String JOB_TIMEOUT_MS = "fanfold.jobs.timeout-ms";
    public static final String RECENTLY_FAILED_CAPACITY = "fanfold.jobs.recently-failed-capacity";
    public static final String ADDRESS_PREFIX = "fanfold.eventbus.prefix";
    public static final String DRAIN_TIMEOUT_MS = "fanfold.shutdown.drain.timeout-ms";
    public static final String SHUTDOWN_TIMEOUT_MS = "fanfold.shutdown.timeout-ms";
    public static final String TELEMETRY_ENABLED = "fanfold.telemetry.enabled";
    public static final String CLIENT_REPLY_TIMEOUT_MS = "fanfold.client.reply-timeout-ms";

    private static final int DEFAULT_POOL_SIZE = 4;
    private static final String DEFAULT_DISPATCH_POLICY = "ROUND_ROBIN";
    private static final long DEFAULT_JOB_TIMEOUT_MS = 30000L;
    private static final int DEFAULT_RECENTLY_FAILED_CAPACITY = 1024;
    private static final long DEFAULT_DRAIN_TIMEOUT_MS = 5000L;
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 30000L;
    private static final long DEFAULT_CLIENT_REPLY_TIMEOUT_MS = 60000L;

    private final Properties properties;
    private final Properties overrides;

    public FanfoldConfiguration() {
        this(null);
    }

    /**
     * @param overrides values taking precedence over every other source; may be null
     */
    public FanfoldConfiguration(Properties overrides) {
        this.properties = new Properties();
        this.overrides = new Properties();
        loadProperties();
        if (overrides != null) {
            this.overrides.putAll(overrides);
        }
    }

    // ==================== Worker Pool ====================

    public int getPoolSize() {
        int size = getInt(POOL_SIZE, DEFAULT_POOL_SIZE);
        if (size < 0) {
            logger.warn("Negative pool size {} for {}, using 0", size, POOL_SIZE);
            return 0;
        }
        return size;
    }

    /**
     * Name of the dispatch policy; resolved to an enum by the manager.
     */
    public String getDispatchPolicy() {
        return getString(DISPATCH_POLICY, DEFAULT_DISPATCH_POLICY).trim().toUpperCase(Locale.ROOT);
    }

    // ==================== Jobs ====================

    /**
     * Default job deadline. Zero disables deadlines.
     */
    public long getJobTimeoutMs() {
        long timeout = getLong(JOB_TIMEOUT_MS, DEFAULT_JOB_TIMEOUT_MS);
        return Math.max(0L, timeout);
    }

    /**
     * How many timed-out job ids the manager remembers to tell late partials apart from unknown ones.
     */
    public int getRecentlyFailedCapacity() {
        return Math.max(0, getInt(RECENTLY_FAILED_CAPACITY, DEFAULT_RECENTLY_FAILED_CAPACITY));
    }

    // ==================== Event Bus ====================

    public String getAddressPrefix() {
        return getString(ADDRESS_PREFIX, EventBusAddresses.DEFAULT_PREFIX);
    }

    public EventBusAddresses getAddresses() {
        return new EventBusAddresses(getAddressPrefix());
    }

    // ==================== Client ====================

    /**
     * How long the in-process client waits for a reply to a request without its own deadline.
     */
    public long getClientReplyTimeoutMs() {
        long timeout = getLong(CLIENT_REPLY_TIMEOUT_MS, DEFAULT_CLIENT_REPLY_TIMEOUT_MS);
        if (timeout <= 0) {
            logger.warn("Non-positive client reply timeout {} for {}, using {}",
                    timeout, CLIENT_REPLY_TIMEOUT_MS, DEFAULT_CLIENT_REPLY_TIMEOUT_MS);
            return DEFAULT_CLIENT_REPLY_TIMEOUT_MS;
        }
        return timeout;
    }

    // ==================== Shutdown ====================

    public long getDrainTimeoutMs() {
        return getLong(DRAIN_TIMEOUT_MS, DEFAULT_DRAIN_TIMEOUT_MS);
    }

    public long getShutdownTimeoutMs() {
        return getLong(SHUTDOWN_TIMEOUT_MS, DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    // ==================== Telemetry ====================

    public boolean isTelemetryEnabled() {
        return getBoolean(TELEMETRY_ENABLED, true);
    }

    // ==================== Core Property Accessors ====================

    public String getString(String key, String defaultValue) {
        String overrideValue = overrides.getProperty(key);
        if (overrideValue != null && !overrideValue.isEmpty()) {
            return overrideValue;
        }

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
     * Log the resolved configuration at INFO.
     */
    public void logConfiguration() {
        logger.info("=== Fanfold Configuration ===");
        logger.info("  Pool Size:            {}", getPoolSize());
        logger.info("  Dispatch Policy:      {}", getDispatchPolicy());
        logger.info("  Job Timeout:          {}ms", getJobTimeoutMs());
        logger.info("  Address Prefix:       {}", getAddressPrefix());
        logger.info("  Client Reply Timeout: {}ms", getClientReplyTimeoutMs());
        logger.info("  Drain Timeout:        {}ms", getDrainTimeoutMs());
        logger.info("  Shutdown Timeout:     {}ms", getShutdownTimeoutMs());
        logger.info("  Telemetry Enabled:    {}", isTelemetryEnabled());
        logger.info("=============================");
    }

    private void loadProperties() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.debug("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.debug("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
    }
}
