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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.tileverse.imagebuf.cache.CaffeineImageCache;
import io.tileverse.imagebuf.cache.ImageCache;
import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import io.tileverse.imagebuf.spi.ImageInput;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageBufReadTest {

    /** Distinct 16 bit values, exact in a 16 bit file but not in 8 bits. */
    private static final TestImages.Pattern FINE = (x, y, z, c) -> ((x * 251 + y * 31 + c * 7) % 65536) / 65535f;

    @TempDir
    Path tempDir;

    private String rgb8;
    private CountingImageCache cache;
    private ImageBufContext context;

    @BeforeEach
    void setUp() throws IOException {
        rgb8 = TestImages.write(tempDir.resolve("rgb8.ibuf"), TestImages.rgb(100, 70, PixelType.UINT8), TestImages.GRADIENT)
                .toString();
        cache = new CountingImageCache(CaffeineImageCache.builder().autoTile(32).build());
        context = new ImageBufContext(cache);
    }

    @AfterEach
    void tearDown() throws IOException {
        context.close();
        cache.close();
    }

    @Test
    void testDefaultReadIsServedByTheCache() {
        ImageBuf buf = context.open(rgb8);
        assertThat(buf.read()).isTrue();
        assertThat(buf.storage()).isEqualTo(Storage.IMAGE_CACHE);
        assertThat(buf.pixelType()).isEqualTo(PixelType.UINT8);
        assertThat(buf.localPixels()).isNull();
        assertThat(buf.pixelAddr(0, 0, 0, 0)).isEqualTo(-1);
        assertThat(context.localMemory()).isZero();
        assertThat(cache.getPixelsCalls).hasValue(0);

        assertThat(buf.getChannel(99, 69, 0, 2)).isEqualTo(TestImages.GRADIENT.value(99, 69, 0, 2));
    }

    @Test
    void testForcedReadKeepsTheNativeType() {
        ImageBuf buf = context.open(rgb8);
        assertThat(buf.read(0, 0, true, PixelType.UNKNOWN)).isTrue();
        assertThat(buf.storage()).isEqualTo(Storage.LOCAL_BUFFER);
        assertThat(buf.pixelType()).isEqualTo(PixelType.UINT8);
        assertThat(buf.localPixels().capacity()).isEqualTo(100 * 70 * 3);
        assertThat(context.localMemory()).isEqualTo(100 * 70 * 3);
        assertThat(buf.getChannel(12, 34, 0, 1)).isEqualTo(TestImages.GRADIENT.value(12, 34, 0, 1));
        assertThat(buf.scanlineStride()).isEqualTo(300);
        assertThat(buf.pixelAddr(2, 1, 0, 1)).isEqualTo(300 + 2 * 3 + 1);

        buf.close();
        assertThat(context.localMemory()).isZero();
    }

    @Test
    void testConversionReadMaterializesLocally() {
        ImageBuf buf = context.open(rgb8);
        assertThat(buf.read(0, 0, false, PixelType.FLOAT)).isTrue();
        assertThat(buf.storage()).isEqualTo(Storage.LOCAL_BUFFER);
        assertThat(buf.pixelType()).isEqualTo(PixelType.FLOAT);
        assertThat(buf.pixelStride()).isEqualTo(12);
        assertThat(context.localMemory()).isEqualTo(100 * 70 * 3 * 4);
        assertThat(buf.getChannel(50, 60, 0, 0)).isEqualTo(TestImages.GRADIENT.value(50, 60, 0, 0));
    }

    @Test
    void testRepeatedReadIsANoOp() {
        ImageBuf buf = context.open(rgb8);
        assertThat(buf.read(0, 0, false, PixelType.FLOAT)).isTrue();
        long memory = context.localMemory();
        int pixelCalls = cache.pixelCalls();

        assertThat(buf.read(0, 0, false, PixelType.FLOAT)).isTrue();
        assertThat(buf.read()).isTrue();
        assertThat(context.localMemory()).isEqualTo(memory);
        assertThat(cache.pixelCalls()).isEqualTo(pixelCalls);
    }

    @Test
    void testWiderRequestedTypeBypassesLowerPrecisionCache() throws IOException {
        String file = TestImages.write(tempDir.resolve("fine.ibuf"), TestImages.rgb(40, 30, PixelType.UINT16), FINE)
                .toString();
        try (CaffeineImageCache eightBit = CaffeineImageCache.builder()
                .autoTile(16)
                .storageType(PixelType.UINT8)
                .build()) {
            CountingImageCache counting = new CountingImageCache(eightBit);
            ImageBuf cached = context.open(file, 0, 0, counting, null);
            assertThat(cached.pixelType()).isEqualTo(PixelType.UINT8);
            assertThat(cached.nativeSpec().format()).isEqualTo(PixelType.UINT16);

            ImageBuf buf = context.open(file, 0, 0, counting, null);
            assertThat(buf.read(0, 0, false, PixelType.FLOAT)).isTrue();
            assertThat(counting.getPixelsCalls).hasValue(0);
            assertThat(buf.getChannel(17, 23, 0, 2)).isEqualTo(FINE.value(17, 23, 0, 2));

            assertThat(cached.getChannel(17, 23, 0, 2)).isNotEqualTo(FINE.value(17, 23, 0, 2));
        }
    }

    @Test
    void testNarrowerRequestedTypeReadsThroughTheCache() throws IOException {
        String file = TestImages.write(tempDir.resolve("float.ibuf"), TestImages.rgb(20, 20, PixelType.FLOAT), FINE)
                .toString();
        try (CaffeineImageCache eightBit =
                CaffeineImageCache.builder().storageType(PixelType.UINT8).build()) {
            CountingImageCache counting = new CountingImageCache(eightBit);
            ImageBuf buf = context.open(file, 0, 0, counting, null);
            assertThat(buf.read(0, 0, false, PixelType.HALF)).isTrue();
            assertThat(counting.getPixelsCalls).hasValue(1);
            assertThat(buf.pixelType()).isEqualTo(PixelType.HALF);
        }
    }

    @Test
    void testChannelSubset() throws IOException {
        ImageSpec rgba = new ImageSpec(16, 8, 4, PixelType.UINT8);
        String file = TestImages.write(tempDir.resolve("rgba.ibuf"), rgba, TestImages.GRADIENT).toString();

        ImageBuf buf = context.open(file);
        assertThat(buf.read(0, 0, 2, 4, false, PixelType.UNKNOWN, null)).isTrue();
        assertThat(buf.storage()).isEqualTo(Storage.LOCAL_BUFFER);
        assertThat(buf.nchannels()).isEqualTo(2);
        assertThat(buf.spec().channelNames()).containsExactly("B", "A");
        assertThat(buf.spec().alphaChannel()).isEqualTo(1);
        assertThat(buf.getChannel(5, 6, 0, 0)).isEqualTo(TestImages.GRADIENT.value(5, 6, 0, 2));
        assertThat(buf.getChannel(5, 6, 0, 1)).isEqualTo(TestImages.GRADIENT.value(5, 6, 0, 3));
        assertThat(context.localMemory()).isEqualTo(16 * 8 * 2);

        ImageBuf rg = context.open(file);
        assertThat(rg.read(0, 0, 0, 2, false, PixelType.UNKNOWN, null)).isTrue();
        assertThat(rg.spec().alphaChannel()).isEqualTo(-1);
    }

    @Test
    void testChannelSubsetReadsAtNativePrecision() throws IOException {
        String file = TestImages.write(tempDir.resolve("fine16.ibuf"), TestImages.rgb(40, 30, PixelType.UINT16), FINE)
                .toString();
        try (CaffeineImageCache eightBit = CaffeineImageCache.builder()
                .autoTile(16)
                .storageType(PixelType.UINT8)
                .build()) {
            CountingImageCache counting = new CountingImageCache(eightBit);
            ImageBuf buf = context.open(file, 0, 0, counting, null);
            assertThat(buf.read(0, 0, 1, 3, false, PixelType.UNKNOWN, null)).isTrue();
            assertThat(counting.getPixelsCalls).hasValue(0);
            assertThat(buf.pixelType()).isEqualTo(PixelType.UINT16);
            assertThat(buf.nchannels()).isEqualTo(2);
            assertThat(buf.getChannel(17, 23, 0, 0)).isEqualTo(FINE.value(17, 23, 0, 1));
            assertThat(buf.getChannel(17, 23, 0, 1)).isEqualTo(FINE.value(17, 23, 0, 2));
        }
    }

    @Test
    void testChangingTheChannelRangeRereads() {
        ImageBuf buf = context.open(rgb8);
        assertThat(buf.read(0, 0, 0, 1, false, PixelType.UNKNOWN, null)).isTrue();
        assertThat(buf.nchannels()).isEqualTo(1);

        assertThat(buf.read(0, 0, 0, -1, false, PixelType.UNKNOWN, null)).isTrue();
        assertThat(buf.nchannels()).isEqualTo(3);
        assertThat(buf.getChannel(7, 9, 0, 2)).isEqualTo(TestImages.GRADIENT.value(7, 9, 0, 2));

        assertThat(buf.read(0, 0, 1, 2, false, PixelType.UNKNOWN, null)).isTrue();
        assertThat(buf.nchannels()).isEqualTo(1);
        assertThat(buf.spec().channelNames()).containsExactly("G");
        assertThat(buf.getChannel(7, 9, 0, 0)).isEqualTo(TestImages.GRADIENT.value(7, 9, 0, 1));
        assertThat(context.localMemory()).isEqualTo(100 * 70);

        // the same subset again is a no-op
        int pixelCalls = cache.pixelCalls();
        assertThat(buf.read(0, 0, 1, 2, false, PixelType.UNKNOWN, null)).isTrue();
        assertThat(cache.pixelCalls()).isEqualTo(pixelCalls);
    }

    @Test
    void testEmptyChannelRangeFails() {
        ImageBuf buf = context.open(rgb8);
        assertThat(buf.read(0, 0, 2, 1, false, PixelType.UNKNOWN, null)).isFalse();
        assertThat(buf.getError()).contains("Invalid channel range");
    }

    @Test
    void testSubimageOutOfRange() {
        ImageBuf buf = context.open(rgb8, 3, 0);
        assertThat(buf.validateSpec()).isFalse();
        assertThat(buf.subimage()).isEqualTo(-1);
        assertThat(buf.getError()).contains("subimage 3");
    }

    @Test
    void testAbortedReadRestoresTheBuffer() {
        ImageBuf buf = context.open(rgb8);
        assertThat(buf.read(0, 0, 0, -1, true, PixelType.FLOAT, progress -> true)).isFalse();
        assertThat(buf.hasError()).isTrue();
        assertThat(buf.pixelsValid()).isFalse();
        assertThat(buf.spec().format()).isEqualTo(PixelType.UINT8);
        assertThat(context.localMemory()).isZero();

        assertThat(buf.read(0, 0, true, PixelType.FLOAT)).isTrue();
        assertThat(buf.getChannel(1, 1, 0, 0)).isEqualTo(TestImages.GRADIENT.value(1, 1, 0, 0));
    }

    @Test
    void testCacheFailureIsReportedOnce() throws IOException {
        ImageCache failing = mock(ImageCache.class);
        when(failing.subimages(anyString())).thenThrow(new IOException("corrupt header"));

        ImageBuf buf = context.open("broken.ibuf", 0, 0, failing, null);
        assertThat(buf.validateSpec()).isFalse();
        assertThat(buf.validatePixels()).isFalse();
        assertThat(buf.getChannel(0, 0, 0, 0)).isZero();
        assertThat(buf.getError()).isEqualTo("corrupt header");
        verify(failing, times(1)).subimages("broken.ibuf");

        // an explicit read asks again
        assertThat(buf.read()).isFalse();
        verify(failing, times(2)).subimages("broken.ibuf");
        verify(failing, never()).getPixels(anyString(), anyInt(), anyInt(), any(), any(), any());
        verify(failing, never()).getTile(anyString(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt());
    }

    @Test
    void testFileWithoutSubimagesCannotBeOpened() throws IOException {
        ImageCache empty = mock(ImageCache.class);
        when(empty.subimages(anyString())).thenReturn(0);

        ImageBuf buf = context.open("empty.ibuf", 0, 0, empty, null);
        assertThat(buf.validateSpec()).isFalse();
        assertThat(buf.getError()).contains("Could not open").contains("empty.ibuf");
    }

    @Test
    void testConfigHintsReachTheReader() throws IOException {
        List<ImageSpec> received = new CopyOnWriteArrayList<>();
        try (ImageBufContext recording = new ImageBufContext(cache) {
            @Override
            ImageInput openInput(String name, ImageSpec config) throws IOException {
                received.add(config);
                return super.openInput(name, config);
            }
        }) {
            ImageSpec config = new ImageSpec();
            config.attribute(ImageSpec.UNASSOCIATED_ALPHA, 1);
            ImageBuf buf = recording.open(rgb8, 0, 0, null, config);
            assertThat(buf.read(0, 0, true, PixelType.FLOAT)).isTrue();
            assertThat(buf.getChannel(3, 4, 0, 1)).isEqualTo(TestImages.GRADIENT.value(3, 4, 0, 1));

            assertThat(cache.addedConfigs.get(rgb8).getAttribute(ImageSpec.UNASSOCIATED_ALPHA))
                    .contains(1);
            assertThat(received).singleElement().satisfies(c -> assertThat(c.getAttribute(ImageSpec.UNASSOCIATED_ALPHA))
                    .contains(1));
        }
    }
}
