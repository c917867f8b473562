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

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Base class for {@link ImageFormatProvider}s with a fixed id, description and extension list.
 */
public abstract class AbstractImageFormatProvider implements ImageFormatProvider {

    private final String id;
    private final String description;
    private final List<String> extensions;

    protected AbstractImageFormatProvider(String id, String description, String... extensions) {
        this.id = id;
        this.description = description;
        this.extensions = Stream.of(extensions).map(e -> e.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    public final String getId() {
        return id;
    }

    @Override
    public final String getDescription() {
        return description;
    }

    @Override
    public final List<String> getExtensions() {
        return extensions;
    }

    @Override
    public String toString() {
        return "%s[id=%s, extensions=%s]".formatted(getClass().getSimpleName(), id, extensions);
    }
}
