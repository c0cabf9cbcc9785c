/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.tokenstore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for the token store.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dtokenstore.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code TOKENSTORE_DATA_DIR})</li>
 *   <li>Properties file ({@code tokenstore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>tokenstore.dataDir</td><td>TOKENSTORE_DATA_DIR</td><td>~/.tokenstore/data</td></tr>
 *   <tr><td>fileName</td><td>tokenstore.fileName</td><td>TOKENSTORE_FILE_NAME</td><td>accounts.json</td></tr>
 *   <tr><td>cacheTtlMs</td><td>tokenstore.cacheTtlMs</td><td>TOKENSTORE_CACHE_TTL_MS</td><td>5000</td></tr>
 *   <tr><td>syncEnabled</td><td>tokenstore.syncEnabled</td><td>TOKENSTORE_SYNC_ENABLED</td><td>true</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # tokenstore.properties
 * tokenstore.dataDir=/var/lib/tokenstore
 * tokenstore.fileName=accounts.json
 * tokenstore.cacheTtlMs=5000
 * tokenstore.syncEnabled=true
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * TokenStoreConfig config = TokenStoreConfig.builder()
 *     .dataDir(Path.of("/var/lib/tokenstore"))
 *     .cacheTtlMs(0)
 *     .build();
 *
 * TokenStore store = new FileTokenStore(config);
 * </pre>
 */
public final class TokenStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(TokenStoreConfig.class);

    private static final String PROPERTIES_FILE = "tokenstore.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "tokenstore.dataDir";
    private static final String PROP_FILE_NAME = "tokenstore.fileName";
    private static final String PROP_CACHE_TTL_MS = "tokenstore.cacheTtlMs";
    private static final String PROP_SYNC_ENABLED = "tokenstore.syncEnabled";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "TOKENSTORE_DATA_DIR";
    private static final String ENV_FILE_NAME = "TOKENSTORE_FILE_NAME";
    private static final String ENV_CACHE_TTL_MS = "TOKENSTORE_CACHE_TTL_MS";
    private static final String ENV_SYNC_ENABLED = "TOKENSTORE_SYNC_ENABLED";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".tokenstore", "data");
    private static final String DEFAULT_FILE_NAME = "accounts.json";
    private static final long DEFAULT_CACHE_TTL_MS = 5000L;
    private static final boolean DEFAULT_SYNC_ENABLED = true;

    private final Path dataDir;
    private final String fileName;
    private final long cacheTtlMs;
    private final boolean syncEnabled;

    private TokenStoreConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.fileName = builder.fileName;
        this.cacheTtlMs = builder.cacheTtlMs;
        this.syncEnabled = builder.syncEnabled;
    }

    /** Directory holding the store file. */
    public Path dataDir() {
        return dataDir;
    }

    /** Name of the store file inside {@link #dataDir()}. */
    public String fileName() {
        return fileName;
    }

    /** Full path of the store file. */
    public Path storeFile() {
        return dataDir.resolve(fileName);
    }

    /** How long a cached read stays fresh, in milliseconds. Zero disables the cache. */
    public long cacheTtlMs() {
        return cacheTtlMs;
    }

    public Duration cacheTtl() {
        return Duration.ofMillis(cacheTtlMs);
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    @Override
    public String toString() {
        return "TokenStoreConfig{" +
                "dataDir=" + dataDir +
                ", fileName=" + fileName +
                ", cacheTtlMs=" + cacheTtlMs +
                ", syncEnabled=" + syncEnabled +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code TokenStoreConfig.builder().build()}.
     */
    public static TokenStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link TokenStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private String fileName;
        private Long cacheTtlMs;
        private Boolean syncEnabled;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Sets the store file name (default: accounts.json). */
        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        /** Sets the cache freshness window in milliseconds (default: 5000). */
        public Builder cacheTtlMs(long cacheTtlMs) {
            if (cacheTtlMs < 0) {
                throw new IllegalArgumentException("cacheTtlMs must be >= 0, got " + cacheTtlMs);
            }
            this.cacheTtlMs = cacheTtlMs;
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public TokenStoreConfig build() {
            if (dataDir == null) {
                String value = resolve(PROP_DATA_DIR, ENV_DATA_DIR);
                dataDir = value != null ? Path.of(value) : DEFAULT_DATA_DIR;
            }
            if (fileName == null) {
                String value = resolve(PROP_FILE_NAME, ENV_FILE_NAME);
                fileName = value != null ? value : DEFAULT_FILE_NAME;
            }
            if (cacheTtlMs == null) {
                cacheTtlMs = resolveLong(PROP_CACHE_TTL_MS, ENV_CACHE_TTL_MS, DEFAULT_CACHE_TTL_MS);
            }
            if (syncEnabled == null) {
                String value = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED);
                syncEnabled = value != null ? Boolean.parseBoolean(value) : DEFAULT_SYNC_ENABLED;
            }

            return new TokenStoreConfig(this);
        }

        /**
         * Returns the first non-blank value from system property, environment
         * variable, then properties file; null if none is set.
         */
        private String resolve(String sysProp, String envVar) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            return null;
        }

        private long resolveLong(String sysProp, String envVar, long defaultValue) {
            String value = resolve(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                long parsed = Long.parseLong(value);
                if (parsed >= 0) {
                    return parsed;
                }
                LOG.warn("Negative value for {}: {}, using default {}", sysProp, parsed, defaultValue);
            } catch (NumberFormatException e) {
                LOG.warn("Invalid number for {}: '{}', using default {}", sysProp, value, defaultValue);
            }
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = TokenStoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
