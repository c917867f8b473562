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

import io.tileverse.imagebuf.cache.ImageCache;
import io.tileverse.imagebuf.deep.DeepData;
import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import io.tileverse.imagebuf.spec.Roi;
import io.tileverse.imagebuf.spi.ImageOutput;
import io.tileverse.imagebuf.spi.ProgressCallback;
import java.io.Closeable;
import java.nio.ByteBuffer;

/**
 * An image held in memory, or backed by a file read on demand through an {@link ImageCache}.
 * <p>
 * A buffer is in one of the {@link Storage} modes. Buffers opened by name start out with neither descriptor nor
 * pixels: the {@link #spec() descriptor} is fetched on first use of any metadata accessor, and pixels on first
 * pixel access. By default pixels stay in the cache and are served tile by tile; {@link #read(int, int, int, int,
 * boolean, PixelType, ProgressCallback) read} with a conversion or a channel subset, or {@link
 * #makeWriteable(boolean)}, copies them into locally owned memory.
 * <p>
 * Failures are not thrown. Operations return {@code false} (or black/zero values) and append a message that
 * {@link #getError()} retrieves.
 * <p>
 * Reads of valid pixels are safe from several threads. Anything that changes the buffer (reads, writes into
 * pixels, metadata changes, {@link #clear()}) requires exclusive access.
 */
public interface ImageBuf extends Closeable {

    /** Value for the stride arguments meaning "contiguous". */
    long AUTO_STRIDE = Long.MIN_VALUE;

    /** @return an empty buffer of the {@link ImageBufContext#getDefault() default context} */
    static ImageBuf empty() {
        return ImageBufContext.getDefault().newImageBuf();
    }

    static ImageBuf open(String name) {
        return ImageBufContext.getDefault().open(name);
    }

    static ImageBuf open(String name, int subimage, int miplevel) {
        return ImageBufContext.getDefault().open(name, subimage, miplevel);
    }

    static ImageBuf open(String name, int subimage, int miplevel, ImageCache cache, ImageSpec config) {
        return ImageBufContext.getDefault().open(name, subimage, miplevel, cache, config);
    }

    static ImageBuf create(ImageSpec spec) {
        return ImageBufContext.getDefault().create(spec);
    }

    static ImageBuf wrap(ImageSpec spec, ByteBuffer pixels) {
        return ImageBufContext.getDefault().wrap(spec, pixels);
    }

    ImageBufContext context();

    /** @return an independent copy; locally owned pixels are copied, caller buffers are shared */
    ImageBuf duplicate();

    /** Moves all state, pixel ownership included, to a new buffer and leaves this one empty. */
    ImageBuf transfer();

    /** Releases pixels and forgets the file; the buffer becomes uninitialized. */
    void clear();

    /** Re-targets the buffer at a file, subimage 0, miplevel 0. */
    default void reset(String name) {
        reset(name, 0, 0, null, null);
    }

    void reset(String name, int subimage, int miplevel, ImageCache cache, ImageSpec config);

    /**
     * Re-targets the buffer at zero-filled local pixels for {@code spec}.
     *
     * @return {@code false} if the pixels could not be allocated
     */
    boolean reset(ImageSpec spec);

    /** Same as {@link #clear()}. */
    @Override
    void close();

    /**
     * Makes sure the descriptor is known, fetching it from the cache if needed. Safe to call from several
     * threads; the fetch happens once.
     *
     * @return whether the descriptor is valid
     */
    boolean validateSpec();

    /**
     * Makes sure pixels are available, reading them if needed.
     *
     * @return {@code false} if a backing file could not be read
     */
    boolean validatePixels();

    /**
     * Fetches the descriptor of a subimage/miplevel of {@code name} from the cache without touching pixels.
     */
    boolean initSpec(String name, int subimage, int miplevel);

    default boolean read() {
        return read(Math.max(0, subimage()), Math.max(0, miplevel()), 0, -1, false, PixelType.UNKNOWN, null);
    }

    default boolean read(int subimage, int miplevel, boolean force, PixelType convert) {
        return read(subimage, miplevel, 0, -1, force, convert, null);
    }

    /**
     * Reads pixels of the backing file.
     *
     * @param chbegin first channel to read
     * @param chend end of the channel range, {@code -1} for all channels
     * @param force read into local memory even if the cache could serve the pixels
     * @param convert local pixel type, {@link PixelType#UNKNOWN} to keep the cached or native one
     * @param progress may be {@code null}; returning {@code true} aborts the read
     */
    boolean read(
            int subimage,
            int miplevel,
            int chbegin,
            int chend,
            boolean force,
            PixelType convert,
            ProgressCallback progress);

    /**
     * Turns cache-backed pixels into locally owned ones. No-op for other storage modes.
     *
     * @param keepCacheType keep the cached pixel type rather than the native one
     */
    boolean makeWriteable(boolean keepCacheType);

    default boolean write(String filename) {
        return write(filename, PixelType.UNKNOWN, null, null);
    }

    /**
     * Writes the image to a file.
     *
     * @param filename destination, empty or {@code null} for the buffer's own name
     * @param dtype file pixel type, {@link PixelType#UNKNOWN} to use {@link #setWriteFormat} or the native type
     * @param fileFormat format id or extension, {@code null} to pick it from the file name
     */
    boolean write(String filename, PixelType dtype, String fileFormat, ProgressCallback progress);

    /** Writes the pixels to an output that was already opened. */
    boolean write(ImageOutput out, ProgressCallback progress);

    /** Pixel type(s) for subsequent writes: one type for all channels, or one per channel. */
    void setWriteFormat(PixelType... formats);

    /** Tile size for subsequent writes to formats that support tiles; width {@code 0} writes scanlines. */
    void setWriteTiles(int width, int height, int depth);

    default boolean copyPixels(ImageBuf src) {
        return copyPixels(src, Roi.ALL);
    }

    /**
     * Copies pixels of {@code src} that fall within this buffer's data window and {@code roi}, converting types.
     * Pixels of this buffer that {@code src} does not cover are set to zero.
     */
    boolean copyPixels(ImageBuf src, Roi roi);

    /** Makes this buffer a copy of {@code src}, converted to {@code format} unless it is {@code UNKNOWN}. */
    boolean copy(ImageBuf src, PixelType format);

    /** @return a new buffer holding a copy of this one */
    ImageBuf copy(PixelType format);

    /** Copies full window, tile sizes and attributes of {@code src}, leaving pixels and data window alone. */
    void copyMetadata(ImageBuf src);

    /**
     * Reads one channel of one pixel as a normalized float.
     *
     * <p>Each call opens its own {@link TileCursor}, so on a cache-backed buffer it acquires and releases a tile.
     * Loops over many pixels should hold a {@link #tileCursor()} instead.
     */
    float getChannel(int x, int y, int z, int channel, WrapMode wrap);

    default float getChannel(int x, int y, int z, int channel) {
        return getChannel(x, y, z, channel, WrapMode.BLACK);
    }

    /**
     * Fills {@code pixel} with up to {@code pixel.length} channels of one pixel. Like
     * {@link #getChannel(int, int, int, int, WrapMode)} it uses a short-lived cursor per call.
     */
    void getPixel(int x, int y, int z, float[] pixel, WrapMode wrap);

    default void getPixel(int x, int y, float[] pixel) {
        getPixel(x, y, 0, pixel, WrapMode.BLACK);
    }

    default void getPixel(int x, int y, int z, float[] pixel) {
        getPixel(x, y, z, pixel, WrapMode.BLACK);
    }

    /** Stores up to {@code pixel.length} channels; pixels outside the data window are ignored. */
    void setPixel(int x, int y, int z, float[] pixel);

    default void setPixel(int x, int y, float[] pixel) {
        setPixel(x, y, 0, pixel);
    }

    /** Stores the pixel at linear index {@code i} of the data window. */
    void setPixel(int i, float[] pixel);

    /** Bilinear sample at continuous coordinates; pixel centers are at half-integers. */
    void interpolate(float x, float y, float[] pixel, WrapMode wrap);

    /** Bilinear sample at normalized coordinates of the full window. */
    void interpolateNdc(float s, float t, float[] pixel, WrapMode wrap);

    /** Cubic B-spline sample at continuous coordinates. */
    void interpolateBicubic(float x, float y, float[] pixel, WrapMode wrap);

    void interpolateBicubicNdc(float s, float t, float[] pixel, WrapMode wrap);

    default boolean getPixels(Roi roi, PixelType format, ByteBuffer result) {
        return getPixels(roi, format, result, AUTO_STRIDE, AUTO_STRIDE, AUTO_STRIDE);
    }

    /**
     * Copies a region into {@code result}, starting at its position and in its byte order, converting to {@code
     * format}. Pixels outside the data window read as zero.
     */
    boolean getPixels(Roi roi, PixelType format, ByteBuffer result, long xstride, long ystride, long zstride);

    default boolean setPixels(Roi roi, PixelType format, ByteBuffer data) {
        return setPixels(roi, format, data, AUTO_STRIDE, AUTO_STRIDE, AUTO_STRIDE);
    }

    /** Stores a region read from {@code data} at its position, converting from {@code format}. */
    boolean setPixels(Roi roi, PixelType format, ByteBuffer data, long xstride, long ystride, long zstride);

    /** @return a cursor over this buffer's pixels; close it to release any tile it holds */
    TileCursor tileCursor();

    boolean deep();

    /** @return the deep samples, empty for flat images */
    DeepData deepData();

    int deepSamples(int x, int y, int z);

    void setDeepSamples(int x, int y, int z, int nsamples);

    void deepInsertSamples(int x, int y, int z, int samplepos, int nsamples);

    void deepEraseSamples(int x, int y, int z, int samplepos, int nsamples);

    float deepValue(int x, int y, int z, int channel, int sample);

    long deepValueUint(int x, int y, int z, int channel, int sample);

    void setDeepValue(int x, int y, int z, int channel, int sample, float value);

    void setDeepValueUint(int x, int y, int z, int channel, int sample, long value);

    /** Copies all samples of a pixel of {@code src}; a pixel outside {@code src} leaves the target empty. */
    boolean copyDeepPixel(int x, int y, int z, ImageBuf src, int srcx, int srcy, int srcz);

    String name();

    /** @return id of the format the file was read with, empty for in-memory buffers */
    String fileFormatName();

    int subimage();

    int miplevel();

    int nsubimages();

    int nmiplevels();

    /** @return the descriptor; changes to it are visible to this buffer */
    ImageSpec spec();

    /** @return the descriptor of the file as stored, before cache or read conversions */
    ImageSpec nativeSpec();

    int nchannels();

    int xbegin();

    int xend();

    int ybegin();

    int yend();

    int zbegin();

    int zend();

    default int xmin() {
        return xbegin();
    }

    default int xmax() {
        return xend() - 1;
    }

    default int ymin() {
        return ybegin();
    }

    default int ymax() {
        return yend() - 1;
    }

    default int zmin() {
        return zbegin();
    }

    default int zmax() {
        return zend() - 1;
    }

    /** @return the {@code Orientation} attribute, {@code 1} when absent */
    int orientation();

    void setOrientation(int orientation);

    int orientedWidth();

    int orientedHeight();

    int orientedX();

    int orientedY();

    int orientedFullWidth();

    int orientedFullHeight();

    int orientedFullX();

    int orientedFullY();

    void setOrigin(int x, int y, int z);

    void setFull(int xbegin, int xend, int ybegin, int yend, int zbegin, int zend);

    Roi roi();

    Roi roiFull();

    void setRoiFull(Roi roi);

    /** @return whether the data window and channels contain {@code roi} */
    boolean containsRoi(Roi roi);

    /** @return the type pixels are held in, locally or in the cache */
    PixelType pixelType();

    Storage storage();

    /** @return whether the descriptor is valid and pixels are available in some storage mode */
    boolean initialized();

    boolean pixelsValid();

    /** @return whether pixels are served by the cache */
    boolean cachedPixels();

    /** @return a native order view of the local pixels, {@code null} if none */
    ByteBuffer localPixels();

    long pixelStride();

    long scanlineStride();

    long zStride();

    /** @return byte offset of a channel value in {@link #localPixels()}, {@code -1} if not addressable */
    long pixelAddr(int x, int y, int z, int channel);

    /** @return linear index of a pixel in the data window, {@code -1} if outside and {@code checkRange} */
    long pixelIndex(int x, int y, int z, boolean checkRange);

    /** @return a read-only zero pixel in {@link #pixelType()} */
    ByteBuffer blackPixel();

    /** @return the aspect ratio of pixels, {@code 1} unless the file says otherwise */
    float pixelAspectRatio();

    int threads();

    void threads(int threads);

    ImageCache imageCache();

    boolean hasError();

    /** @return accumulated errors, clearing them */
    default String getError() {
        return getError(true);
    }

    String getError(boolean clear);

    void error(String message);
}
