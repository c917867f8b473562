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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tileverse.imagebuf.spec.PixelType;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ImageCacheConfigTest {

    @Test
    void testDefaults() {
        ImageCacheConfig config = new ImageCacheConfig();
        assertThat(config.getParameter(ImageCacheConfig.MAX_MEMORY_MB)).contains(256);
        assertThat(config.getParameter(ImageCacheConfig.AUTOTILE)).contains(0);
        assertThat(config.getParameter(ImageCacheConfig.FORCE_FLOAT)).contains(false);
        assertThat(config.getParameter(ImageCacheConfig.MAX_TILES)).isEmpty();
        assertThat(config.maxMemoryBytes()).isEqualTo(256L * 1024 * 1024);
        assertThat(config.storageType()).isEmpty();
        // defaults are not reported as explicit values
        assertThat(config.getParameter(ImageCacheConfig.AUTOTILE.key(), Integer.class)).isEmpty();
    }

    @Test
    void testParametersAreListed() {
        assertThat(ImageCacheConfig.parameters())
                .extracting(ImageCacheParameter::key)
                .allMatch(k -> k.startsWith(ImageCacheConfig.PREFIX))
                .contains("io.tileverse.imagecache.max-memory-mb", "io.tileverse.imagecache.autotile");
    }

    @Test
    void testConversions() {
        ImageCacheConfig config = new ImageCacheConfig()
                .setParameter(ImageCacheConfig.MAX_MEMORY_MB.key(), "64")
                .setParameter(ImageCacheConfig.FORCE_FLOAT.key(), "true")
                .setParameter(ImageCacheConfig.STORAGE_TYPE, "half");
        assertThat(config.getParameter(ImageCacheConfig.MAX_MEMORY_MB)).contains(64);
        assertThat(config.getParameter(ImageCacheConfig.FORCE_FLOAT)).contains(true);
        assertThat(config.storageType()).contains(PixelType.HALF);
        assertThat(config.maxMemoryBytes()).isEqualTo(64L * 1024 * 1024);

        config.setParameter(ImageCacheConfig.MAX_MEMORY_MB.key(), "lots");
        assertThatThrownBy(() -> config.getParameter(ImageCacheConfig.MAX_MEMORY_MB))
                .isInstanceOf(NumberFormatException.class);
    }

    @Test
    void testNullRemoves() {
        ImageCacheConfig config = new ImageCacheConfig().setParameter(ImageCacheConfig.AUTOTILE, 64);
        config.setParameter(ImageCacheConfig.AUTOTILE, null);
        assertThat(config.getParameter(ImageCacheConfig.AUTOTILE)).contains(0);
    }

    @Test
    void testPropertiesRoundTrip() {
        Properties props = new Properties();
        props.setProperty("io.tileverse.imagecache.autotile", "128");
        props.setProperty("io.tileverse.imagecache.unassociatedalpha", "true");
        props.setProperty("unrelated.key", "x");

        ImageCacheConfig config = ImageCacheConfig.fromProperties(props);
        assertThat(config.getParameter(ImageCacheConfig.AUTOTILE)).contains(128);
        assertThat(config.getParameter(ImageCacheConfig.UNASSOCIATED_ALPHA)).contains(true);

        Properties out = config.toProperties();
        assertThat(out).hasSize(2).doesNotContainKey("unrelated.key");
        assertThat(out.getProperty("io.tileverse.imagecache.autotile")).isEqualTo("128");
    }

    @Test
    void testFromSystemProperties() {
        String key = ImageCacheConfig.MAX_TILES.key();
        System.setProperty(key, "42");
        try {
            assertThat(ImageCacheConfig.fromSystemProperties().getParameter(ImageCacheConfig.MAX_TILES))
                    .contains(42);
        } finally {
            System.clearProperty(key);
        }
    }
}
