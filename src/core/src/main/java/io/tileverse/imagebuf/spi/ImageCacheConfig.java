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

import io.tileverse.imagebuf.spec.PixelType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration values for a tile cache, keyed by {@link ImageCacheParameter}.
 * <p>
 * A config can be populated programmatically, from {@link Properties} (e.g. a configuration file) or from system
 * properties. Values are stored as given and converted to the parameter type on access, so string valued
 * properties work for every parameter.
 *
 * <pre>{@code
 * Properties props = new Properties();
 * props.setProperty("io.tileverse.imagecache.max-memory-mb", "512");
 * props.setProperty("io.tileverse.imagecache.autotile", "64");
 * ImageCache cache = CaffeineImageCache.builder().config(ImageCacheConfig.fromProperties(props)).build();
 * }</pre>
 */
public class ImageCacheConfig {

    /** Common prefix of all tile cache keys. */
    public static final String PREFIX = "io.tileverse.imagecache.";

    public static final ImageCacheParameter<Integer> MAX_MEMORY_MB = ImageCacheParameter.builder()
            .key(PREFIX + "max-memory-mb")
            .title("Maximum tile memory (MB)")
            .description("""
                    Upper bound, in megabytes, of the pixel memory held by cached tiles. \
                    Least recently used tiles are evicted beyond it.
                    """)
            .type(Integer.class)
            .group(ImageCacheParameter.GROUP_MEMORY)
            .defaultValue(256)
            .options(64, 256, 1024)
            .build();

    public static final ImageCacheParameter<Integer> MAX_TILES = ImageCacheParameter.builder()
            .key(PREFIX + "max-tiles")
            .title("Maximum number of tiles")
            .description("""
                    Upper bound on the number of cached tiles. When set it replaces the memory bound.
                    """)
            .type(Integer.class)
            .group(ImageCacheParameter.GROUP_MEMORY)
            .build();

    public static final ImageCacheParameter<Integer> MAX_OPEN_FILES = ImageCacheParameter.builder()
            .key(PREFIX + "max-open-files")
            .title("Maximum open files")
            .description("""
                    Upper bound on the number of image files kept open. The least recently used file is \
                    closed beyond it and reopened when referenced again.
                    """)
            .type(Integer.class)
            .group(ImageCacheParameter.GROUP_MEMORY)
            .defaultValue(100)
            .build();

    public static final ImageCacheParameter<Integer> EXPIRE_AFTER_ACCESS_SECONDS = ImageCacheParameter.builder()
            .key(PREFIX + "expire-after-access-seconds")
            .title("Tile expiration (seconds)")
            .description("""
                    Evicts tiles not accessed for this many seconds.
                    """)
            .type(Integer.class)
            .group(ImageCacheParameter.GROUP_MEMORY)
            .build();

    public static final ImageCacheParameter<Integer> AUTOTILE = ImageCacheParameter.builder()
            .key(PREFIX + "autotile")
            .title("Tile size for untiled files")
            .description("""
                    Untiled files are cut into square tiles of this size. \
                    0 caches an untiled file as a single tile.
                    """)
            .type(Integer.class)
            .group(ImageCacheParameter.GROUP_PIXELS)
            .defaultValue(0)
            .options(0, 64, 256)
            .build();

    public static final ImageCacheParameter<Boolean> FORCE_FLOAT = ImageCacheParameter.builder()
            .key(PREFIX + "forcefloat")
            .title("Store all tiles as float")
            .description("""
                    When true every tile is stored as 32 bit float regardless of the file's format.
                    """)
            .type(Boolean.class)
            .group(ImageCacheParameter.GROUP_PIXELS)
            .defaultValue(false)
            .build();

    public static final ImageCacheParameter<String> STORAGE_TYPE = ImageCacheParameter.builder()
            .key(PREFIX + "storage-type")
            .title("Tile storage type")
            .description("""
                    Pixel type name (e.g. uint8, half, float) every tile is stored as. \
                    Overrides forcefloat when set.
                    """)
            .type(String.class)
            .group(ImageCacheParameter.GROUP_PIXELS)
            .options("uint8", "uint16", "half", "float")
            .build();

    public static final ImageCacheParameter<Boolean> UNASSOCIATED_ALPHA = ImageCacheParameter.builder()
            .key(PREFIX + "unassociatedalpha")
            .title("Keep alpha unassociated")
            .description("""
                    When true, readers are asked to leave alpha unassociated.
                    """)
            .type(Boolean.class)
            .group(ImageCacheParameter.GROUP_PIXELS)
            .defaultValue(false)
            .build();

    private final Map<String, Object> parameterValues = new HashMap<>();

    public ImageCacheConfig() {
        // empty config, parameter defaults apply on access through the typed getters
    }

    /** @return every parameter understood by the tile cache */
    public static List<ImageCacheParameter<?>> parameters() {
        return List.of(
                MAX_MEMORY_MB, MAX_TILES, MAX_OPEN_FILES, EXPIRE_AFTER_ACCESS_SECONDS, AUTOTILE, FORCE_FLOAT, STORAGE_TYPE,
                UNASSOCIATED_ALPHA);
    }

    public ImageCacheConfig setParameter(String key, Object value) {
        requireNonNull(key, "key");
        if (value == null) {
            parameterValues.remove(key);
        } else {
            parameterValues.put(key, value);
        }
        return this;
    }

    public <T> ImageCacheConfig setParameter(ImageCacheParameter<T> param, T value) {
        return setParameter(param.key(), value);
    }

    /** @return the configured value, or the parameter default */
    public <T> Optional<T> getParameter(ImageCacheParameter<T> param) {
        Optional<T> value = getParameter(param.key(), param.type());
        return value.isPresent() ? value : param.defaultValue();
    }

    public <T> Optional<T> getParameter(String key, Class<T> type) {
        Object value = parameterValues.get(requireNonNull(key, "key"));
        requireNonNull(type, "type");
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(convert(value, type));
    }

    public long maxMemoryBytes() {
        return getParameter(MAX_MEMORY_MB).orElse(256) * 1024L * 1024L;
    }

    public Optional<PixelType> storageType() {
        return getParameter(STORAGE_TYPE).filter(s -> !s.isBlank()).map(PixelType::fromName);
    }

    static <T> T convert(Object value, Class<T> type) {
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        String s = String.valueOf(value).trim();
        Object converted;
        if (type.equals(String.class)) {
            converted = s;
        } else if (type.equals(Boolean.class)) {
            converted = Boolean.valueOf(s);
        } else if (type.equals(Integer.class)) {
            converted = Integer.parseInt(s);
        } else if (type.equals(Long.class)) {
            converted = Long.parseLong(s);
        } else {
            throw new IllegalArgumentException("Unsupported conversion %s to %s"
                    .formatted(value.getClass().getCanonicalName(), type.getCanonicalName()));
        }
        return type.cast(converted);
    }

    public Properties toProperties() {
        Properties properties = new Properties();
        parameterValues.forEach((k, v) -> properties.setProperty(k, String.valueOf(v)));
        return properties;
    }

    /**
     * Creates a config from the entries of {@code properties} whose keys start with {@link #PREFIX}.
     */
    public static ImageCacheConfig fromProperties(Properties properties) {
        requireNonNull(properties);
        ImageCacheConfig config = new ImageCacheConfig();
        properties.forEach((k, v) -> {
            String key = String.valueOf(k);
            if (key.startsWith(PREFIX)) {
                config.setParameter(key, v);
            }
        });
        return config;
    }

    public static ImageCacheConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }
}
