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
package io.tileverse.imagebuf;

/**
 * Where the pixels of an {@link ImageBuf} live.
 */
public enum Storage {
    /** No pixels. */
    UNINITIALIZED,
    /** Memory allocated and owned by the buffer. Deep images also use this mode. */
    LOCAL_BUFFER,
    /** Memory supplied by the caller; the buffer addresses it but never frees it. */
    APP_BUFFER,
    /** Pixels are served by an {@link io.tileverse.imagebuf.cache.ImageCache} and are not locally addressable. */
    IMAGE_CACHE
}
