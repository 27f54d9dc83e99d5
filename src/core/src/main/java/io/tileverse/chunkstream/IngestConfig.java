/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.chunkstream;

import static java.util.Objects.requireNonNull;

import io.tileverse.io.ChunkBufferPool;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.Executor;

/**
 * Immutable settings of a {@link ChunkIngestor}.
 * <p>
 * Instances are created with {@link #builder()} or {@link #fromProperties(Properties)}.
 * Building never fails for missing values: the processor and the buffer size are required,
 * but they are only checked when an ingestion starts, so that it can fail with a precise
 * {@link ConfigurationError}.
 *
 * <pre>{@code
 * IngestConfig config = IngestConfig.builder()
 *         .processor((context, chunk) -> index(chunk.toByteArray()))
 *         .workers(16)
 *         .bufferSeed(5)
 *         .bufferSize(ByteSize.MB)
 *         .build();
 * }</pre>
 */
public final class IngestConfig {

    /** Number of workers used when none is configured. */
    public static final int DEFAULT_WORKERS = 1;

    /** Delimiter used when none is configured. */
    public static final byte DEFAULT_DELIMITER = '\n';

    /** Maximum number of chunks processed concurrently. */
    public static final IngestParameter<Integer> WORKERS = IngestParameter.of(
            "workers",
            "Workers",
            "Maximum number of chunks processed concurrently",
            Integer.class,
            DEFAULT_WORKERS);

    /** Number of buffers allocated before reading starts. */
    public static final IngestParameter<Integer> BUFFER_SEED = IngestParameter.of(
            "bufferSeed", "Buffer seed", "Number of buffers allocated before reading starts", Integer.class, 0);

    /** Initial length of each chunk buffer. */
    public static final IngestParameter<Integer> BUFFER_SIZE = IngestParameter.of(
            "bufferSize",
            "Buffer size",
            "Initial length of each chunk buffer, in bytes. Accepts KB, MB and GB suffixes",
            Integer.class,
            null);

    /** End of record byte. */
    public static final IngestParameter<String> DELIMITER = IngestParameter.of(
            "delimiter",
            "Delimiter",
            "End of record byte: a single character, an escape such as \\n, \\t or \\0, or a number such as 0x1E",
            String.class,
            "\\n");

    /** Whether chunks are fixed-size, ignoring the delimiter. */
    public static final IngestParameter<Boolean> NO_DELIMITER = IngestParameter.of(
            "noDelimiter",
            "Fixed size chunks",
            "Cut chunks at exactly the buffer size, ignoring the delimiter",
            Boolean.class,
            false);

    /** All the parameters understood by {@link #fromProperties(Properties)}. */
    public static final List<IngestParameter<?>> PARAMETERS =
            List.of(WORKERS, BUFFER_SEED, BUFFER_SIZE, DELIMITER, NO_DELIMITER);

    private final ChunkProcessor processor;
    private final int workers;
    private final int bufferSeed;
    private final int bufferSize;
    private final Byte delimiter;
    private final boolean noDelimiter;
    private final Executor executor;

    private IngestConfig(Builder builder) {
        this.processor = builder.processor;
        this.workers = builder.workers;
        this.bufferSeed = builder.bufferSeed;
        this.bufferSize = builder.bufferSize;
        this.delimiter = builder.delimiter;
        this.noDelimiter = builder.noDelimiter;
        this.executor = builder.executor;
    }

    /**
     * @return the chunk processor, if set
     */
    public Optional<ChunkProcessor> processor() {
        return Optional.ofNullable(processor);
    }

    /**
     * @return the maximum number of concurrent processor invocations, {@code 0} if unset
     */
    public int workers() {
        return workers;
    }

    /**
     * @return number of buffers to allocate before reading starts
     */
    public int bufferSeed() {
        return bufferSeed;
    }

    /**
     * @return initial length of each buffer in bytes, {@code 0} if unset
     */
    public int bufferSize() {
        return bufferSize;
    }

    /**
     * @return the end of record byte, if set
     */
    public Optional<Byte> delimiter() {
        return Optional.ofNullable(delimiter);
    }

    /**
     * @return whether chunks are cut at exactly {@link #bufferSize()} bytes, ignoring the delimiter
     */
    public boolean noDelimiter() {
        return noDelimiter;
    }

    /**
     * @return the executor processors run on, if set. When empty, each ingestion runs
     *     processors on its own pool of {@link #workers()} threads.
     */
    public Optional<Executor> executor() {
        return Optional.ofNullable(executor);
    }

    /**
     * Returns a copy of this configuration with {@link #DEFAULT_WORKERS} workers if unset and
     * the {@link #DEFAULT_DELIMITER} if unset. Nothing else is changed.
     *
     * @return the configuration ingestions actually run with
     */
    public IngestConfig withDefaults() {
        Builder builder = toBuilder();
        if (workers == 0) {
            builder.workers(DEFAULT_WORKERS);
        }
        if (delimiter == null) {
            builder.delimiter(DEFAULT_DELIMITER);
        }
        return builder.build();
    }

    /**
     * @return a builder initialized with this configuration's values
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.processor = processor;
        builder.workers = workers;
        builder.bufferSeed = bufferSeed;
        builder.bufferSize = bufferSize;
        builder.delimiter = delimiter;
        builder.noDelimiter = noDelimiter;
        builder.executor = executor;
        return builder;
    }

    /**
     * Converts the settings that can be expressed as text into {@link Properties}, keyed by
     * the {@link #PARAMETERS parameter keys}. Unset values are omitted; the processor and the
     * executor are never included.
     *
     * @return the properties representation of this configuration
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        if (workers > 0) {
            properties.setProperty(WORKERS.key(), String.valueOf(workers));
        }
        if (bufferSeed > 0) {
            properties.setProperty(BUFFER_SEED.key(), String.valueOf(bufferSeed));
        }
        if (bufferSize > 0) {
            properties.setProperty(BUFFER_SIZE.key(), String.valueOf(bufferSize));
        }
        if (delimiter != null) {
            properties.setProperty(DELIMITER.key(), formatDelimiter(delimiter));
        }
        if (noDelimiter) {
            properties.setProperty(NO_DELIMITER.key(), "true");
        }
        return properties;
    }

    /**
     * Creates a builder from {@link Properties}, reading the keys of {@link #PARAMETERS}.
     * Keys outside the {@link IngestParameter#KEY_PREFIX} namespace are ignored.
     * <p>
     * The processor (and optionally the executor) still has to be set on the returned builder.
     *
     * @param properties the properties to read
     * @return a builder with the values found in {@code properties}
     * @throws IllegalArgumentException if a value can't be parsed, or a key in the ingestion namespace is unknown
     */
    public static Builder fromProperties(Properties properties) {
        requireNonNull(properties, "properties cannot be null");
        Builder builder = builder();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(IngestParameter.KEY_PREFIX)) {
                continue;
            }
            String value = properties.getProperty(key).trim();
            try {
                if (WORKERS.key().equals(key)) {
                    builder.workers(Integer.parseInt(value));
                } else if (BUFFER_SEED.key().equals(key)) {
                    builder.bufferSeed(Integer.parseInt(value));
                } else if (BUFFER_SIZE.key().equals(key)) {
                    builder.bufferSize(ByteSize.parse(value));
                } else if (DELIMITER.key().equals(key)) {
                    builder.delimiter(parseDelimiter(properties.getProperty(key)));
                } else if (NO_DELIMITER.key().equals(key)) {
                    builder.noDelimiter(Boolean.parseBoolean(value));
                } else {
                    throw new IllegalArgumentException("Unknown ingestion parameter: " + key);
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for %s: '%s'".formatted(key, value), e);
            }
        }
        return builder;
    }

    /**
     * Parses a delimiter given as a single character, an escape sequence ({@code \n},
     * {@code \r}, {@code \t}, {@code \0}) or a decimal or {@code 0x} hexadecimal number.
     *
     * @param value the text to parse
     * @return the delimiter byte
     * @throws IllegalArgumentException if the value does not denote a single byte
     */
    static byte parseDelimiter(String value) {
        requireNonNull(value, "delimiter cannot be null");
        if (value.length() == 1) {
            char c = value.charAt(0);
            if (c > 0xFF) {
                throw new IllegalArgumentException("Delimiter must be a single byte: " + value);
            }
            return (byte) c;
        }
        switch (value) {
            case "\\n":
                return '\n';
            case "\\r":
                return '\r';
            case "\\t":
                return '\t';
            case "\\0":
                return 0;
            default:
                break;
        }
        String text = value.trim().toLowerCase(Locale.ROOT);
        int parsed = text.startsWith("0x") ? Integer.parseInt(text.substring(2), 16) : Integer.parseInt(text);
        if (parsed < 0 || parsed > 0xFF) {
            throw new IllegalArgumentException("Delimiter must be a single byte: " + value);
        }
        return (byte) parsed;
    }

    private static String formatDelimiter(byte delimiter) {
        return switch (delimiter) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            case 0 -> "\\0";
            default -> delimiter >= 0x21 && delimiter <= 0x7E
                    ? String.valueOf((char) delimiter)
                    : "0x%02x".formatted(delimiter & 0xFF);
        };
    }

    /**
     * Creates a new builder with nothing set.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "IngestConfig[workers=%d, bufferSeed=%d, bufferSize=%d, delimiter=%s, noDelimiter=%s]"
                .formatted(
                        workers,
                        bufferSeed,
                        bufferSize,
                        delimiter == null ? "unset" : formatDelimiter(delimiter),
                        noDelimiter);
    }

    /**
     * Builder for {@link IngestConfig}.
     */
    public static class Builder {
        private ChunkProcessor processor;
        private int workers;
        private int bufferSeed;
        private int bufferSize;
        private Byte delimiter;
        private boolean noDelimiter;
        private Executor executor;

        private Builder() {}

        /**
         * Sets the function invoked for every chunk.
         *
         * @param processor the chunk processor
         * @return this builder
         */
        public Builder processor(ChunkProcessor processor) {
            this.processor = processor;
            return this;
        }

        /**
         * Sets the maximum number of chunks processed concurrently. {@code 0} means
         * {@link IngestConfig#DEFAULT_WORKERS}.
         *
         * @param workers number of workers
         * @return this builder
         * @throws IllegalArgumentException if {@code workers} is negative
         */
        public Builder workers(int workers) {
            if (workers < 0) {
                throw new IllegalArgumentException("workers cannot be negative: " + workers);
            }
            this.workers = workers;
            return this;
        }

        /**
         * Sets the number of buffers allocated before reading starts.
         *
         * @param bufferSeed number of buffers
         * @return this builder
         * @throws IllegalArgumentException if {@code bufferSeed} is negative
         */
        public Builder bufferSeed(int bufferSeed) {
            if (bufferSeed < 0) {
                throw new IllegalArgumentException("bufferSeed cannot be negative: " + bufferSeed);
            }
            this.bufferSeed = bufferSeed;
            return this;
        }

        /**
         * Sets the initial length of each buffer, which is also the size of fixed-size chunks.
         *
         * @param bufferSize buffer size in bytes, see {@link ByteSize}
         * @return this builder
         * @throws IllegalArgumentException if {@code bufferSize} is negative or too large
         */
        public Builder bufferSize(int bufferSize) {
            if (bufferSize < 0) {
                throw new IllegalArgumentException("bufferSize cannot be negative: " + bufferSize);
            }
            if (bufferSize > ChunkBufferPool.MAX_BUFFER_SIZE) {
                throw new IllegalArgumentException("bufferSize too large: " + bufferSize);
            }
            this.bufferSize = bufferSize;
            return this;
        }

        /**
         * Sets the end of record byte. Any value, including {@code 0}, is accepted.
         *
         * @param delimiter the delimiter
         * @return this builder
         */
        public Builder delimiter(byte delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        /**
         * Sets whether chunks are cut at exactly the buffer size, possibly in the middle of
         * a record.
         *
         * @param noDelimiter {@code true} for fixed-size chunks
         * @return this builder
         */
        public Builder noDelimiter(boolean noDelimiter) {
            this.noDelimiter = noDelimiter;
            return this;
        }

        /**
         * Sets the executor processors run on. The ingestion never shuts it down.
         *
         * @param executor the executor, or {@code null} to use a per-ingestion thread pool
         * @return this builder
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new immutable configuration
         */
        public IngestConfig build() {
            return new IngestConfig(this);
        }
    }
}
