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

import io.tileverse.imagebuf.cache.CaffeineImageCache;
import io.tileverse.imagebuf.cache.ImageCache;
import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spi.ImageCacheConfig;
import io.tileverse.imagebuf.spi.ImageFormatProvider;
import io.tileverse.imagebuf.spi.ImageInput;
import io.tileverse.imagebuf.spi.ImageOutput;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Process or application level state shared by {@link ImageBuf} instances: the shared {@link ImageCache}
 * buffers use when none is given, the running total of locally allocated pixel memory, and the factories that
 * open readers and writers.
 * <p>
 * {@link #getDefault()} returns a context whose shared cache is built lazily from {@link
 * ImageCacheConfig#fromSystemProperties() system properties}. Applications that want isolation, tests in
 * particular, create their own:
 *
 * <pre>{@code
 * try (ImageBufContext context = new ImageBufContext(CaffeineImageCache.builder().autoTile(64).build())) {
 *     ImageBuf buf = context.open("image.ibuf");
 *     float red = buf.getChannel(10, 10, 0, 0);
 * }
 * }</pre>
 */
@Slf4j
public class ImageBufContext implements Closeable {

    private static final ImageBufContext DEFAULT = new ImageBufContext();

    private final AtomicLong localMemory = new AtomicLong();
    private final ReentrantLock lock = new ReentrantLock();
    private final boolean ownsCache;
    private volatile ImageCache sharedCache;

    /** Creates a context whose shared cache is created from system properties on first use, and closed with it. */
    public ImageBufContext() {
        this.ownsCache = true;
    }

    /** Creates a context sharing {@code cache}. The cache is not closed by {@link #close()}. */
    public ImageBufContext(@NonNull ImageCache cache) {
        this.sharedCache = cache;
        this.ownsCache = false;
    }

    public static ImageBufContext getDefault() {
        return DEFAULT;
    }

    /** @return the cache used by buffers that were not given one */
    public ImageCache sharedCache() {
        ImageCache cache = sharedCache;
        if (cache == null) {
            lock.lock();
            try {
                cache = sharedCache;
                if (cache == null) {
                    ImageCacheConfig config = ImageCacheConfig.fromSystemProperties();
                    cache = CaffeineImageCache.builder().config(config).build();
                    log.debug("Created shared image cache with {}", config.toProperties());
                    sharedCache = cache;
                }
            } finally {
                lock.unlock();
            }
        }
        return cache;
    }

    /** @return bytes of pixel memory currently allocated by buffers of this context */
    public long localMemory() {
        return localMemory.get();
    }

    long allocated(long bytes) {
        return localMemory.addAndGet(bytes);
    }

    long released(long bytes) {
        return localMemory.addAndGet(-bytes);
    }

    /** Drops {@code name} from the shared cache, if one has been created. */
    void invalidate(String name) {
        ImageCache cache = sharedCache;
        if (cache != null) {
            cache.invalidate(name, false);
        }
    }

    ImageInput openInput(String name, ImageSpec config) throws IOException {
        return ImageFormatProvider.open(name, config);
    }

    ImageOutput createOutput(String filename, String formatName) throws IOException {
        return ImageFormatProvider.createOutput(filename, formatName);
    }

    /** @return a new buffer with no pixels */
    public ImageBuf newImageBuf() {
        return new DefaultImageBuf(this);
    }

    /** @return a buffer backed by {@code name}, read lazily through the shared cache */
    public ImageBuf open(String name) {
        return open(name, 0, 0, null, null);
    }

    public ImageBuf open(String name, int subimage, int miplevel) {
        return open(name, subimage, miplevel, null, null);
    }

    /**
     * @param cache cache to read through, {@code null} for the {@link #sharedCache() shared cache}
     * @param config hints passed to the reader, may be {@code null}
     */
    public ImageBuf open(String name, int subimage, int miplevel, ImageCache cache, ImageSpec config) {
        DefaultImageBuf buf = new DefaultImageBuf(this);
        buf.reset(name, subimage, miplevel, cache, config);
        return buf;
    }

    /** @return a buffer owning zero-filled pixels for {@code spec} */
    public ImageBuf create(ImageSpec spec) {
        DefaultImageBuf buf = new DefaultImageBuf(this);
        buf.reset(spec);
        return buf;
    }

    /** @return a buffer addressing {@code pixels}, from its current position, in native byte order */
    public ImageBuf wrap(ImageSpec spec, ByteBuffer pixels) {
        DefaultImageBuf buf = new DefaultImageBuf(this);
        buf.wrap(spec, pixels);
        return buf;
    }

    @Override
    public void close() throws IOException {
        if (ownsCache) {
            lock.lock();
            try {
                ImageCache cache = sharedCache;
                sharedCache = null;
                if (cache != null) {
                    cache.close();
                }
            } finally {
                lock.unlock();
            }
        }
    }
}
