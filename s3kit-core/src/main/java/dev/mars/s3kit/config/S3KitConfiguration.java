package dev.mars.s3kit.config;

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


import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the S3Kit client.
 *
 * <p>Values are resolved in this order, later sources winning: built-in defaults,
 * the first readable {@code s3kit.properties} (working directory, {@code config/},
 * {@code ~/.s3kit/}, then the classpath), and finally any {@code s3kit.*} system
 * property. Numeric values that cannot be parsed fall back to the default with a warning.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class S3KitConfiguration {
    private static final Logger logger = Logger.getLogger(S3KitConfiguration.class.getName());

    public static final String ENDPOINT = "s3kit.endpoint";
    public static final String SECURE = "s3kit.secure";
    public static final String REGION = "s3kit.region";
    public static final String CONNECT_TIMEOUT_MS = "s3kit.network.connect.timeout.ms";
    public static final String READ_TIMEOUT_MS = "s3kit.network.read.timeout.ms";
    public static final String BUFFER_SIZE = "s3kit.network.buffer.size";
    public static final String UPLOAD_CHUNK_SIZE = "s3kit.upload.chunk.size";
    public static final String UPLOAD_MIN_PART_SIZE = "s3kit.upload.min.part.size";
    public static final String UPLOAD_MAX_PARALLEL = "s3kit.upload.max.parallel";
    public static final String DOWNLOAD_CHUNK_SIZE = "s3kit.download.chunk.size";
    public static final String DOWNLOAD_MIN_CHUNK_SIZE = "s3kit.download.min.chunk.size";
    public static final String DOWNLOAD_MAX_PARALLEL = "s3kit.download.max.parallel";
    public static final String MAX_RETRIES = "s3kit.transfer.max.retries";
    public static final String RETRY_DELAY_MS = "s3kit.transfer.retry.delay.ms";
    public static final String RESUME_DIR = "s3kit.resume.dir";
    public static final String RESUME_MAX_AGE_HOURS = "s3kit.resume.max.age.hours";

    private static final long MIB = 1024L * 1024L;

    private static final String DEFAULT_ENDPOINT = "localhost:9000";
    private static final String DEFAULT_REGION = "us-east-1";
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 30000;
    private static final int DEFAULT_READ_TIMEOUT_MS = 60000;
    private static final int DEFAULT_BUFFER_SIZE = 64 * 1024;
    private static final long DEFAULT_UPLOAD_CHUNK_SIZE = 64 * MIB;
    private static final long DEFAULT_UPLOAD_MIN_PART_SIZE = 5 * MIB;
    private static final int DEFAULT_UPLOAD_MAX_PARALLEL = 4;
    private static final long DEFAULT_DOWNLOAD_CHUNK_SIZE = 8 * MIB;
    private static final long DEFAULT_DOWNLOAD_MIN_CHUNK_SIZE = MIB;
    private static final int DEFAULT_DOWNLOAD_MAX_PARALLEL = 4;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 1000;
    private static final long DEFAULT_RESUME_MAX_AGE_HOURS = 7 * 24;

    private final Properties properties;

    public S3KitConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public S3KitConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Connection
    public String getEndpoint() {
        return getStringProperty(ENDPOINT, DEFAULT_ENDPOINT);
    }

    public boolean isSecure() {
        return getBooleanProperty(SECURE, false);
    }

    public String getRegion() {
        return getStringProperty(REGION, DEFAULT_REGION);
    }

    public int getConnectTimeoutMs() {
        return getIntProperty(CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS);
    }

    public int getReadTimeoutMs() {
        return getIntProperty(READ_TIMEOUT_MS, DEFAULT_READ_TIMEOUT_MS);
    }

    public int getBufferSize() {
        return getIntProperty(BUFFER_SIZE, DEFAULT_BUFFER_SIZE);
    }

    // Uploads
    public long getUploadChunkSize() {
        return getLongProperty(UPLOAD_CHUNK_SIZE, DEFAULT_UPLOAD_CHUNK_SIZE);
    }

    public long getMinimumPartSize() {
        return getLongProperty(UPLOAD_MIN_PART_SIZE, DEFAULT_UPLOAD_MIN_PART_SIZE);
    }

    public int getMaxParallelUploads() {
        return getIntProperty(UPLOAD_MAX_PARALLEL, DEFAULT_UPLOAD_MAX_PARALLEL);
    }

    // Downloads
    public long getDownloadChunkSize() {
        return getLongProperty(DOWNLOAD_CHUNK_SIZE, DEFAULT_DOWNLOAD_CHUNK_SIZE);
    }

    public long getMinimumDownloadChunkSize() {
        return getLongProperty(DOWNLOAD_MIN_CHUNK_SIZE, DEFAULT_DOWNLOAD_MIN_CHUNK_SIZE);
    }

    public int getMaxParallelDownloads() {
        return getIntProperty(DOWNLOAD_MAX_PARALLEL, DEFAULT_DOWNLOAD_MAX_PARALLEL);
    }

    // Retries
    public int getMaxRetries() {
        return getIntProperty(MAX_RETRIES, DEFAULT_MAX_RETRIES);
    }

    public long getRetryDelayMs() {
        return getLongProperty(RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS);
    }

    // Resume store
    public Path getResumeDirectory() {
        String configured = properties.getProperty(RESUME_DIR);
        if (configured == null || configured.isBlank()) {
            return Paths.get(System.getProperty("user.home"), ".s3kit", "resume");
        }
        return Paths.get(configured.trim());
    }

    public Duration getResumeMaxAge() {
        return Duration.ofHours(getLongProperty(RESUME_MAX_AGE_HOURS, DEFAULT_RESUME_MAX_AGE_HOURS));
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

    private String getStringProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
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

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(ENDPOINT, DEFAULT_ENDPOINT);
        properties.setProperty(SECURE, "false");
        properties.setProperty(REGION, DEFAULT_REGION);
        properties.setProperty(CONNECT_TIMEOUT_MS, String.valueOf(DEFAULT_CONNECT_TIMEOUT_MS));
        properties.setProperty(READ_TIMEOUT_MS, String.valueOf(DEFAULT_READ_TIMEOUT_MS));
        properties.setProperty(BUFFER_SIZE, String.valueOf(DEFAULT_BUFFER_SIZE));
        properties.setProperty(UPLOAD_CHUNK_SIZE, String.valueOf(DEFAULT_UPLOAD_CHUNK_SIZE));
        properties.setProperty(UPLOAD_MIN_PART_SIZE, String.valueOf(DEFAULT_UPLOAD_MIN_PART_SIZE));
        properties.setProperty(UPLOAD_MAX_PARALLEL, String.valueOf(DEFAULT_UPLOAD_MAX_PARALLEL));
        properties.setProperty(DOWNLOAD_CHUNK_SIZE, String.valueOf(DEFAULT_DOWNLOAD_CHUNK_SIZE));
        properties.setProperty(DOWNLOAD_MIN_CHUNK_SIZE, String.valueOf(DEFAULT_DOWNLOAD_MIN_CHUNK_SIZE));
        properties.setProperty(DOWNLOAD_MAX_PARALLEL, String.valueOf(DEFAULT_DOWNLOAD_MAX_PARALLEL));
        properties.setProperty(MAX_RETRIES, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(RETRY_DELAY_MS, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(RESUME_MAX_AGE_HOURS, String.valueOf(DEFAULT_RESUME_MAX_AGE_HOURS));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "s3kit.properties",
                "config/s3kit.properties",
                System.getProperty("user.home") + "/.s3kit/s3kit.properties"
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("s3kit.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("s3kit."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "S3KitConfiguration{" +
                "endpoint='" + getEndpoint() + '\'' +
                ", secure=" + isSecure() +
                ", region='" + getRegion() + '\'' +
                ", uploadChunkSize=" + getUploadChunkSize() +
                ", downloadChunkSize=" + getDownloadChunkSize() +
                ", maxRetries=" + getMaxRetries() +
                '}';
    }
}
