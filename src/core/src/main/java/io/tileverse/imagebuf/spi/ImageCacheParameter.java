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
package io.tileverse.imagebuf.spi;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Optional;

/**
 * Describes one tile cache configuration parameter: its key, human readable metadata, value type and default.
 *
 * @param <T> the value type
 * @param key unique property key, e.g. {@code io.tileverse.imagecache.max-memory-mb}
 * @param title short human readable name
 * @param description what the parameter controls
 * @param group logical group, see {@link #GROUP_MEMORY} and {@link #GROUP_PIXELS}
 * @param type the value type
 * @param defaultValue the value used when none is configured
 * @param sampleValues suggested values
 */
public record ImageCacheParameter<T>(
        String key,
        String title,
        String description,
        String group,
        Class<T> type,
        Optional<T> defaultValue,
        List<T> sampleValues) {

    /** Parameters bounding cache memory and lifetime. */
    public static final String GROUP_MEMORY = "memory";
    /** Parameters affecting the pixels the cache hands out. */
    public static final String GROUP_PIXELS = "pixels";

    public ImageCacheParameter {
        requireNonNull(key, "Parameter key cannot be null");
        requireNonNull(title, "Parameter title cannot be null");
        requireNonNull(description, "Parameter description cannot be null");
        requireNonNull(group, "Parameter group cannot be null");
        requireNonNull(type, "Parameter type cannot be null");
        requireNonNull(defaultValue, "Parameter default value optional cannot be null");
        sampleValues = List.copyOf(requireNonNull(sampleValues, "Parameter sample values list cannot be null"));
        defaultValue.ifPresent(v -> {
            if (!type.isInstance(v)) {
                throw new IllegalArgumentException("Default value %s of %s is not a %s"
                        .formatted(v, key, type.getSimpleName()));
            }
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ImageCacheParameter}.
     */
    public static class Builder {
        private String key;
        private String title;
        private String description = "";
        private String group = GROUP_MEMORY;

        @SuppressWarnings("rawtypes")
        private Class type;

        private Optional<Object> defaultValue = Optional.empty();
        private List<Object> sampleValues = List.of();

        Builder() {
            // use ImageCacheParameter.builder()
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder group(String group) {
            this.group = group;
            return this;
        }

        public Builder type(Class<?> type) {
            this.type = type;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = Optional.ofNullable(defaultValue);
            return this;
        }

        public Builder options(Object... values) {
            this.sampleValues = values == null || values.length == 0 ? List.of() : List.of(values);
            return this;
        }

        @SuppressWarnings("unchecked")
        public <T> ImageCacheParameter<T> build() {
            return new ImageCacheParameter<>(
                    key, title, description, group, type, (Optional<T>) defaultValue, (List<T>) sampleValues);
        }
    }
}
