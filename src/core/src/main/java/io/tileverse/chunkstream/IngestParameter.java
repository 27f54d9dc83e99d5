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

import java.util.Optional;

/**
 * Describes an {@link IngestConfig} setting that can be expressed as a {@link java.util.Properties} entry.
 *
 * @param <T> The type of the parameter's value.
 * @param key The unique key identifying the parameter.
 * @param title A human-readable title of the parameter.
 * @param description A human-readable description of the parameter.
 * @param type The {@link Class} representing the type of the parameter's value.
 * @param defaultValue An {@link Optional} containing the default value of the parameter, if any.
 */
public record IngestParameter<T>(String key, String title, String description, Class<T> type, Optional<T> defaultValue) {

    /** Common prefix of all ingestion parameter keys. */
    public static final String KEY_PREFIX = "io.tileverse.chunkstream.";

    /**
     * Compact constructor for {@link IngestParameter} that performs validation.
     *
     * @param key unique identifier for this parameter
     * @param title human-readable display name for this parameter
     * @param description detailed description of what this parameter does
     * @param type the Java type of values this parameter accepts
     * @param defaultValue optional default value for this parameter
     */
    public IngestParameter {
        requireNonNull(key, "Parameter key cannot be null");
        requireNonNull(title, "Parameter title cannot be null");
        requireNonNull(description, "Parameter description cannot be null");
        requireNonNull(type, "Parameter type cannot be null");
        requireNonNull(defaultValue, "Parameter default value optional cannot be null");
    }

    static <T> IngestParameter<T> of(String name, String title, String description, Class<T> type, T defaultValue) {
        return new IngestParameter<>(KEY_PREFIX + name, title, description, type, Optional.ofNullable(defaultValue));
    }
}
