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

import static org.assertj.core.api.Assertions.assertThat;

import io.tileverse.imagebuf.cache.CaffeineImageCache;
import io.tileverse.imagebuf.cache.ImageCache;
import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.junit.jupiter.api.Test;

class ImageBufContextTest {

    @Test
    void testLocalMemoryAccounting() throws IOException {
        try (ImageBufContext context = new ImageBufContext(CaffeineImageCache.builder().build())) {
            ImageBuf a = context.create(new ImageSpec(10, 10, 3, PixelType.FLOAT));
            assertThat(context.localMemory()).isEqualTo(1200);
            ImageBuf b = context.create(new ImageSpec(10, 10, 1, PixelType.UINT8));
            assertThat(context.localMemory()).isEqualTo(1300);

            a.reset(new ImageSpec(5, 5, 1, PixelType.UINT16));
            assertThat(context.localMemory()).isEqualTo(150);

            a.clear();
            b.close();
            assertThat(context.localMemory()).isZero();
        }
    }

    @Test
    void testCreateClampsEmptyDimensions() throws IOException {
        try (ImageBufContext context = new ImageBufContext(CaffeineImageCache.builder().build())) {
            ImageBuf buf = context.create(new ImageSpec(0, 0, 0, PixelType.UINT8));
            assertThat(buf.initialized()).isTrue();
            assertThat(buf.spec().width()).isEqualTo(1);
            assertThat(buf.spec().height()).isEqualTo(1);
            assertThat(buf.nchannels()).isEqualTo(1);
            assertThat(buf.getChannel(0, 0, 0, 0)).isZero();
        }
    }

    @Test
    void testAllocationFailureIsReported() throws IOException {
        try (ImageBufContext context = new ImageBufContext(CaffeineImageCache.builder().build())) {
            ImageBuf buf = context.create(new ImageSpec(50_000, 50_000, 4, PixelType.FLOAT));
            assertThat(buf.initialized()).isFalse();
            assertThat(buf.pixelsValid()).isFalse();
            assertThat(buf.getError()).contains("Unable to allocate");
            assertThat(context.localMemory()).isZero();

            assertThat(buf.reset(new ImageSpec(2, 2, 1, PixelType.FLOAT))).isTrue();
            assertThat(buf.initialized()).isTrue();
        }
    }

    @Test
    void testWrapAddressesCallerMemory() throws IOException {
        try (ImageBufContext context = new ImageBufContext(CaffeineImageCache.builder().build())) {
            ByteBuffer memory = ByteBuffer.allocate(8 + 2 * 2 * 4).order(ByteOrder.nativeOrder());
            memory.position(8);
            memory.putFloat(8 + 4, 0.75f);

            ImageBuf buf = context.wrap(new ImageSpec(2, 2, 1, PixelType.FLOAT), memory);
            assertThat(buf.storage()).isEqualTo(Storage.APP_BUFFER);
            assertThat(buf.getChannel(1, 0, 0, 0)).isEqualTo(0.75f);

            buf.setPixel(0, 1, new float[] {0.25f});
            assertThat(memory.getFloat(8 + 8)).isEqualTo(0.25f);
            assertThat(context.localMemory()).isZero();

            buf.close();
            assertThat(memory.getFloat(8 + 8)).isEqualTo(0.25f);
        }
    }

    @Test
    void testWrapRejectsTooSmallBuffer() throws IOException {
        try (ImageBufContext context = new ImageBufContext(CaffeineImageCache.builder().build())) {
            ImageBuf buf = context.wrap(new ImageSpec(4, 4, 3, PixelType.UINT8), ByteBuffer.allocate(40));
            assertThat(buf.initialized()).isFalse();
            assertThat(buf.getError()).contains("too small");
        }
    }

    @Test
    void testOwnedSharedCacheIsCreatedLazilyAndClosed() throws IOException {
        ImageBufContext context = new ImageBufContext();
        ImageCache first = context.sharedCache();
        assertThat(first).isInstanceOf(CaffeineImageCache.class).isSameAs(context.sharedCache());

        context.close();
        ImageCache second = context.sharedCache();
        assertThat(second).isNotSameAs(first);
        context.close();
    }

    @Test
    void testGivenCacheIsNotClosedWithTheContext() throws IOException {
        CountingImageCache cache = new CountingImageCache(CaffeineImageCache.builder().build());
        ImageBufContext context = new ImageBufContext(cache);
        assertThat(context.sharedCache()).isSameAs(cache);
        context.close();
        assertThat(context.sharedCache()).isSameAs(cache);

        ImageBuf buf = context.open("image.ibuf");
        buf.validateSpec();
        assertThat(buf.imageCache()).isSameAs(cache);
        assertThat(cache.imageInfoCalls).hasValue(1);
        cache.close();
    }

    @Test
    void testStaticFactoriesUseTheDefaultContext() {
        ImageBuf buf = ImageBuf.create(new ImageSpec(2, 2, 1, PixelType.UINT8));
        try {
            assertThat(buf.context()).isSameAs(ImageBufContext.getDefault());
            assertThat(ImageBuf.empty().context()).isSameAs(ImageBufContext.getDefault());
            assertThat(ImageBuf.open("image.ibuf").context()).isSameAs(ImageBufContext.getDefault());
        } finally {
            buf.close();
        }
    }
}
