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

import io.tileverse.imagebuf.spec.ImageSpec;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.stream.Stream;

/**
 * Service Provider Interface (SPI) for image file formats.
 * <p>
 * Implementations are discovered with {@link ServiceLoader}: register the fully qualified class name in
 * {@code META-INF/services/io.tileverse.imagebuf.spi.ImageFormatProvider}. Each provider creates
 * {@link ImageInput readers} and {@link ImageOutput writers} for one format, identified by its {@link #getId() id}
 * and recognized by its {@link #getExtensions() file extensions}.
 * <p>
 * A provider may be switched off with a system property or environment variable named after
 * {@link #enabledKey()}, set to {@code false}.
 */
public interface ImageFormatProvider {

    /** @return the unique format id, e.g. {@code "ibuf"} */
    String getId();

    String getDescription();

    /** @return lower case file extensions without the dot */
    List<String> getExtensions();

    default boolean isAvailable() {
        return isEnabled(enabledKey());
    }

    /** @return the property/environment variable name that can disable this provider */
    default String enabledKey() {
        return "IO_TILEVERSE_IMAGEBUF_FORMAT_" + getId().toUpperCase(Locale.ROOT);
    }

    /** Providers with a higher order win when several can read the same source. */
    default int getOrder() {
        return 0;
    }

    /**
     * @return whether this provider recognizes the source, by default from its file extension
     */
    default boolean canRead(Path path) {
        return getExtensions().contains(extension(path.getFileName() == null ? "" : path.getFileName().toString()));
    }

    /**
     * Opens a reader positioned on subimage 0, miplevel 0.
     *
     * @param config optional read-only overrides, may be {@code null}
     */
    ImageInput openInput(Path path, ImageSpec config) throws IOException;

    ImageOutput createOutput();

    static boolean isEnabled(String key) {
        String enabled = System.getProperty(key);
        if (enabled == null) {
            enabled = System.getenv(key);
        }
        return enabled == null ? true : Boolean.parseBoolean(enabled);
    }

    static Stream<ImageFormatProvider> findProviders() {
        ServiceLoader<ImageFormatProvider> loader = ServiceLoader.load(ImageFormatProvider.class);
        return loader.stream().map(Provider::get);
    }

    static List<ImageFormatProvider> getAvailableProviders() {
        return findProviders()
                .filter(ImageFormatProvider::isAvailable)
                .sorted(Comparator.comparingInt(ImageFormatProvider::getOrder).reversed())
                .toList();
    }

    /**
     * Finds an available provider by format id or by file extension.
     */
    static Optional<ImageFormatProvider> findProvider(String idOrExtension) {
        if (idOrExtension == null || idOrExtension.isBlank()) {
            return Optional.empty();
        }
        String key = idOrExtension.toLowerCase(Locale.ROOT);
        return getAvailableProviders().stream()
                .filter(p -> p.getId().equalsIgnoreCase(key) || p.getExtensions().contains(key))
                .findFirst();
    }

    /**
     * Opens {@code name} with the first available provider that can read it.
     *
     * @throws IOException if no provider recognizes the source or opening fails
     */
    static ImageInput open(String name, ImageSpec config) throws IOException {
        if (name == null || name.isEmpty()) {
            throw new IOException("No image name given");
        }
        Path path = Path.of(name);
        ImageFormatProvider provider = getAvailableProviders().stream()
                .filter(p -> p.canRead(path))
                .findFirst()
                .orElseThrow(() -> new IOException("Could not find a format reader for \"" + name + "\""));
        return provider.openInput(path, config);
    }

    /**
     * Creates a writer for {@code filename}, using {@code formatName} when given and the file extension otherwise.
     *
     * @throws IOException if no provider matches
     */
    static ImageOutput createOutput(String filename, String formatName) throws IOException {
        String key = formatName == null || formatName.isEmpty() ? extension(filename) : formatName;
        return findProvider(key)
                .map(ImageFormatProvider::createOutput)
                .orElseThrow(() -> new IOException("Could not find a format writer for \"" + filename + "\""));
    }

    static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        int sep = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        return dot > sep && dot >= 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
