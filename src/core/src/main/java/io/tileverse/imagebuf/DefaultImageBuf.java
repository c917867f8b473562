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
import io.tileverse.imagebuf.spi.ImageInput;
import io.tileverse.imagebuf.spi.ImageOutput;
import io.tileverse.imagebuf.spi.ProgressCallback;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * The {@link ImageBuf} implementation.
 * <p>
 * Descriptor and pixels of file backed buffers are validated lazily with double checked locking on {@code
 * specValid}/{@code pixelsValid}; everything that reads or allocates holds {@code validLock}, which is reentrant
 * so {@link #read} can be called from {@link #validatePixels()}.
 * <p>
 * Local pixels are a heap {@link ByteBuffer} in native byte order, addressed with absolute indices only.
 */
@Slf4j
final class DefaultImageBuf implements ImageBuf {

    /** Largest pixel buffer a single heap buffer can hold. */
    static final long MAX_BUFFER_BYTES = Integer.MAX_VALUE - 8;

    private final ImageBufContext context;
    private final ErrorLog errors = new ErrorLog();
    private final ReentrantLock validLock = new ReentrantLock();

    private String name = "";
    private String fileFormat = "";
    private int nsubimages;
    private int nmiplevels;
    private int currentSubimage = -1;
    private int currentMiplevel = -1;
    // native channel range held by the pixels, channelEnd < 0 means all of them
    private int channelBegin;
    private int channelEnd = -1;
    private int threads;

    private Storage storage = Storage.UNINITIALIZED;
    private ImageSpec spec = new ImageSpec();
    private ImageSpec nativeSpec = new ImageSpec();
    private ImageSpec configSpec;
    private volatile boolean specValid;
    private volatile boolean pixelsValid;
    private boolean badFile;
    private float pixelAspect = 1f;

    private ByteBuffer localPixels;
    private long allocatedSize;
    private int channelBytes;
    private int pixelBytes;
    private long scanlineBytes;
    private long planeBytes;
    private ByteBuffer blackPixel = ByteBuffer.allocate(0);

    private ImageCache imageCache;
    private PixelType cachedPixelType = PixelType.UNKNOWN;
    private DeepData deepData = new DeepData();

    private List<PixelType> writeFormat = List.of();
    private int writeTileWidth;
    private int writeTileHeight;
    private int writeTileDepth = 1;

    DefaultImageBuf(ImageBufContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public ImageBufContext context() {
        return context;
    }

    @Override
    public void clear() {
        validLock.lock();
        try {
            freePixels();
            name = "";
            fileFormat = "";
            nsubimages = 0;
            nmiplevels = 0;
            currentSubimage = -1;
            currentMiplevel = -1;
            channelBegin = 0;
            channelEnd = -1;
            spec = new ImageSpec();
            nativeSpec = new ImageSpec();
            configSpec = null;
            specValid = false;
            pixelsValid = false;
            badFile = false;
            pixelAspect = 1f;
            imageCache = null;
            cachedPixelType = PixelType.UNKNOWN;
            deepData = new DeepData();
            writeFormat = List.of();
            writeTileWidth = 0;
            writeTileHeight = 0;
            writeTileDepth = 1;
            computeStrides();
        } finally {
            validLock.unlock();
        }
    }

    @Override
    public void reset(String name, int subimage, int miplevel, ImageCache cache, ImageSpec config) {
        validLock.lock();
        try {
            clear();
            this.name = name == null ? "" : name;
            this.currentSubimage = subimage;
            this.currentMiplevel = miplevel;
            this.imageCache = cache;
            this.configSpec = config == null ? null : config.copy();
        } finally {
            validLock.unlock();
        }
    }

    @Override
    public boolean reset(ImageSpec newSpec) {
        validLock.lock();
        try {
            clear();
            return alloc(newSpec, null);
        } finally {
            validLock.unlock();
        }
    }

    /** Addresses caller memory; see {@link ImageBufContext#wrap(ImageSpec, ByteBuffer)}. */
    void wrap(ImageSpec newSpec, ByteBuffer pixels) {
        validLock.lock();
        try {
            clear();
            spec = Objects.requireNonNull(newSpec, "spec").copy();
            nativeSpec = spec.copy();
            specValid = true;
            computeStrides();
            if (pixels.remaining() < spec.imageBytes()) {
                error("Buffer of %d bytes is too small for a %dx%dx%d image of %d byte pixels"
                        .formatted(pixels.remaining(), spec.width(), spec.height(), spec.depth(), pixelBytes));
                return;
            }
            localPixels = pixels.slice().order(ByteOrder.nativeOrder());
            storage = Storage.APP_BUFFER;
            pixelsValid = true;
        } finally {
            validLock.unlock();
        }
    }

    @Override
    public void close() {
        clear();
    }

    @Override
    public ImageBuf duplicate() {
        DefaultImageBuf copy = new DefaultImageBuf(context);
        validLock.lock();
        try {
            copy.copyState(this);
            copy.deepData = new DeepData(deepData);
            if (storage == Storage.LOCAL_BUFFER && localPixels != null) {
                if (copy.newPixels(allocatedSize)) {
                    copy.localPixels.put(0, localPixels, 0, (int) allocatedSize);
                } else {
                    copy.pixelsValid = false;
                }
            } else if (storage == Storage.APP_BUFFER) {
                copy.localPixels = view(localPixels);
            }
            copy.computeStrides();
        } finally {
            validLock.unlock();
        }
        return copy;
    }

    @Override
    public ImageBuf transfer() {
        DefaultImageBuf moved = new DefaultImageBuf(context);
        validLock.lock();
        try {
            moved.copyState(this);
            moved.deepData = deepData;
            moved.localPixels = localPixels;
            moved.allocatedSize = allocatedSize;
            moved.computeStrides();
            // ownership moved, nothing to release here
            localPixels = null;
            allocatedSize = 0;
            clear();
        } finally {
            validLock.unlock();
        }
        return moved;
    }

    private void copyState(DefaultImageBuf src) {
        name = src.name;
        fileFormat = src.fileFormat;
        nsubimages = src.nsubimages;
        nmiplevels = src.nmiplevels;
        currentSubimage = src.currentSubimage;
        currentMiplevel = src.currentMiplevel;
        channelBegin = src.channelBegin;
        channelEnd = src.channelEnd;
        threads = src.threads;
        storage = src.storage;
        spec = src.spec.copy();
        nativeSpec = src.nativeSpec.copy();
        configSpec = src.configSpec == null ? null : src.configSpec.copy();
        specValid = src.specValid;
        pixelsValid = src.pixelsValid;
        badFile = src.badFile;
        pixelAspect = src.pixelAspect;
        imageCache = src.imageCache;
        cachedPixelType = src.cachedPixelType;
        writeFormat = src.writeFormat;
        writeTileWidth = src.writeTileWidth;
        writeTileHeight = src.writeTileHeight;
        writeTileDepth = src.writeTileDepth;
    }

    @Override
    public boolean validateSpec() {
        if (specValid) {
            return true;
        }
        validLock.lock();
        try {
            if (specValid) {
                return true;
            }
            if (name.isEmpty() || badFile) {
                return false;
            }
            return initSpec(name, Math.max(0, currentSubimage), Math.max(0, currentMiplevel));
        } finally {
            validLock.unlock();
        }
    }

    @Override
    public boolean validatePixels() {
        if (pixelsValid) {
            return true;
        }
        validLock.lock();
        try {
            if (pixelsValid || name.isEmpty()) {
                return true;
            }
            if (badFile) {
                return false;
            }
            return read(
                    Math.max(0, currentSubimage),
                    Math.max(0, currentMiplevel),
                    0,
                    -1,
                    false,
                    PixelType.UNKNOWN,
                    null);
        } finally {
            validLock.unlock();
        }
    }

    @Override
    public boolean initSpec(String filename, int subimage, int miplevel) {
        validLock.lock();
        try {
            if (!badFile
                    && specValid
                    && filename.equals(name)
                    && subimage == currentSubimage
                    && miplevel == currentMiplevel) {
                return true;
            }
            if (imageCache == null) {
                imageCache = context.sharedCache();
            }
            name = filename;
            pixelsValid = false;
            badFile = false;
            nsubimages = 0;
            nmiplevels = 0;
            try {
                if (configSpec != null) {
                    imageCache.invalidate(name, false);
                    imageCache.addFile(name, configSpec, true);
                }
                nsubimages = imageCache.subimages(name);
                if (nsubimages <= 0) {
                    throw new IOException("Could not open \"" + name + "\"");
                }
                nmiplevels = imageCache.miplevels(name, subimage);
                fileFormat = imageCache.fileFormat(name);
                ImageSpec cacheSpec = imageCache.imageSpec(name, subimage, miplevel, false);
                ImageSpec fileSpec = imageCache.imageSpec(name, subimage, miplevel, true);
                PixelType cached = imageCache.cachedPixelType(name, subimage, miplevel);
                spec = cacheSpec;
                nativeSpec = fileSpec;
                cachedPixelType = cached;
                if (cached != PixelType.UNKNOWN) {
                    spec.format(cached);
                }
                pixelAspect = spec.getFloatAttribute(ImageSpec.PIXEL_ASPECT_RATIO, 1f);
                currentSubimage = subimage;
                currentMiplevel = miplevel;
                computeStrides();
                specValid = true;
                log.debug("Initialized {} subimage {} miplevel {}: {}", name, subimage, miplevel, spec);
                return true;
            } catch (IOException e) {
                badFile = true;
                specValid = false;
                currentSubimage = -1;
                currentMiplevel = -1;
                error(e.getMessage() == null ? "Could not open \"" + name + "\"" : e.getMessage());
                return false;
            }
        } finally {
            validLock.unlock();
        }
    }

    @Override
    public boolean read(
            int subimage,
            int miplevel,
            int chbegin,
            int chend,
            boolean force,
            PixelType convert,
            ProgressCallback progress) {
        if (name.isEmpty()) {
            return true;
        }
        final PixelType requested = convert == null ? PixelType.UNKNOWN : convert;
        validLock.lock();
        try {
            if (pixelsValid
                    && !force
                    && subimage == currentSubimage
                    && miplevel == currentMiplevel
                    && (requested == PixelType.UNKNOWN || requested == spec.format())
                    && holdsChannels(chbegin, chend)) {
                return true;
            }
            if (!initSpec(name, subimage, miplevel)) {
                return false;
            }
            final int nch = nativeSpec.nchannels();
            final int chEnd = chend < 0 || chend > nch ? nch : chend;
            final int chBegin = Math.max(0, Math.min(chbegin, chEnd));
            final boolean channelSubset = chBegin != 0 || chEnd != nch;
            if (channelSubset && chEnd <= chBegin) {
                error("Invalid channel range [%d,%d)".formatted(chbegin, chend));
                return false;
            }

            if (nativeSpec.deep()) {
                return readDeep(subimage, miplevel);
            }

            if (localPixels == null
                    && !force
                    && !channelSubset
                    && (requested == PixelType.UNKNOWN || requested == cachedPixelType)) {
                spec.format(cachedPixelType);
                computeStrides();
                storage = Storage.IMAGE_CACHE;
                channelBegin = 0;
                channelEnd = -1;
                pixelsValid = true;
                log.trace("{} served by the image cache as {}", name, cachedPixelType);
                return true;
            }

            final ImageSpec savedSpec = spec;
            final ImageSpec target = localSpec(chBegin, chEnd, requested);
            spec = target;
            if (!realloc()) {
                restoreAfterFailedRead(savedSpec);
                return false;
            }
            final boolean bypassCache = force
                    || channelSubset
                    || (requested != PixelType.UNKNOWN
                            && requested != cachedPixelType
                            && requested.size() >= cachedPixelType.size()
                            && requested.size() >= nativeSpec.format().size());
            try {
                if (bypassCache) {
                    readDirect(subimage, miplevel, chBegin, chEnd, progress);
                } else {
                    Roi region = target.roi().withChannels(chBegin, chEnd);
                    imageCache.getPixels(name, subimage, miplevel, region, target.format(), view(localPixels));
                }
            } catch (IOException | RuntimeException e) {
                error(e.getMessage() == null ? "Could not read \"" + name + "\"" : e.getMessage());
                restoreAfterFailedRead(savedSpec);
                return false;
            }
            channelBegin = chBegin;
            channelEnd = channelSubset ? chEnd : -1;
            pixelsValid = true;
            log.debug("Read {} into local {} pixels, bypassing the cache: {}", name, target.format(), bypassCache);
            return true;
        } finally {
            validLock.unlock();
        }
    }

    private boolean holdsChannels(int chbegin, int chend) {
        int nch = nativeSpec.nchannels();
        int end = chend < 0 || chend > nch ? nch : chend;
        int begin = Math.max(0, Math.min(chbegin, end));
        return begin == channelBegin && end == (channelEnd < 0 ? nch : channelEnd);
    }

    private ImageSpec localSpec(int chbegin, int chend, PixelType requested) {
        ImageSpec target = nativeSpec.copy();
        if (chbegin != 0 || chend != nativeSpec.nchannels()) {
            int alpha = nativeSpec.alphaChannel();
            int zch = nativeSpec.zChannel();
            target.channelNames(nativeSpec.channelNames().subList(chbegin, chend));
            if (!nativeSpec.channelFormats().isEmpty()) {
                target.channelFormats(nativeSpec.channelFormats().subList(chbegin, chend));
            }
            target.nchannels(chend - chbegin);
            target.alphaChannel(alpha >= chbegin && alpha < chend ? alpha - chbegin : -1);
            target.zChannel(zch >= chbegin && zch < chend ? zch - chbegin : -1);
        }
        target.format(requested != PixelType.UNKNOWN ? requested : nativeSpec.format());
        return target;
    }

    private void readDirect(int subimage, int miplevel, int chbegin, int chend, ProgressCallback progress)
            throws IOException {
        ImageSpec config = configSpec;
        boolean unassociated = imageCache
                .getAttribute(ImageCache.ATTR_UNASSOCIATED_ALPHA)
                .map(v -> ((Number) v).intValue() != 0)
                .orElse(false);
        if (unassociated && (config == null || config.getAttribute(ImageSpec.UNASSOCIATED_ALPHA).isEmpty())) {
            config = config == null ? new ImageSpec() : config.copy();
            config.attribute(ImageSpec.UNASSOCIATED_ALPHA, 1);
        }
        try (ImageInput in = context.openInput(name, config)) {
            in.threads(threads);
            in.seekSubimage(subimage, miplevel);
            in.readImage(chbegin, chend, spec.format(), view(localPixels), progress);
        }
    }

    private boolean readDeep(int subimage, int miplevel) {
        try (ImageInput in = context.openInput(name, configSpec)) {
            in.threads(threads);
            DeepData data = in.readNativeDeepImage(subimage, miplevel);
            freePixels();
            spec = nativeSpec.copy();
            deepData = data;
            storage = Storage.LOCAL_BUFFER;
            computeStrides();
            channelBegin = 0;
            channelEnd = -1;
            pixelsValid = true;
            return true;
        } catch (IOException e) {
            error(e.getMessage());
            pixelsValid = false;
            return false;
        }
    }

    private void restoreAfterFailedRead(ImageSpec savedSpec) {
        freePixels();
        spec = savedSpec;
        computeStrides();
        pixelsValid = false;
    }

    @Override
    public boolean makeWriteable(boolean keepCacheType) {
        if (storage != Storage.IMAGE_CACHE) {
            return true;
        }
        return read(
                currentSubimage,
                currentMiplevel,
                0,
                -1,
                true,
                keepCacheType ? cachedPixelType : PixelType.UNKNOWN,
                null);
    }

    private boolean alloc(ImageSpec newSpec, ImageSpec newNativeSpec) {
        ImageSpec s = Objects.requireNonNull(newSpec, "spec").copy();
        s.width(Math.max(1, s.width()));
        s.height(Math.max(1, s.height()));
        s.depth(Math.max(1, s.depth()));
        if (s.nchannels() < 1) {
            s.nchannels(1);
        }
        spec = s;
        nativeSpec = newNativeSpec == null ? s.copy() : newNativeSpec.copy();
        specValid = true;
        boolean ok = realloc();
        pixelsValid = ok;
        return ok;
    }

    private boolean realloc() {
        if (spec.deep()) {
            freePixels();
            deepData = new DeepData();
            deepData.init(spec);
            storage = Storage.LOCAL_BUFFER;
            computeStrides();
            return true;
        }
        boolean ok = newPixels(spec.imageBytes());
        computeStrides();
        return ok;
    }

    private boolean newPixels(long size) {
        freePixels();
        if (size <= 0) {
            return true;
        }
        if (size > MAX_BUFFER_BYTES) {
            error("Unable to allocate %d bytes, larger than a single buffer can hold".formatted(size));
            return false;
        }
        try {
            localPixels = ByteBuffer.allocate((int) size).order(ByteOrder.nativeOrder());
        } catch (OutOfMemoryError e) {
            error("Unable to allocate %d bytes (%s)".formatted(size, e.getMessage()));
            return false;
        }
        allocatedSize = size;
        storage = Storage.LOCAL_BUFFER;
        long total = context.allocated(size);
        log.debug("Allocated {} bytes, {} bytes of local pixels in use", size, total);
        return true;
    }

    private void freePixels() {
        if (allocatedSize > 0) {
            long total = context.released(allocatedSize);
            log.debug("Released {} bytes, {} bytes of local pixels in use", allocatedSize, total);
        }
        allocatedSize = 0;
        localPixels = null;
        storage = Storage.UNINITIALIZED;
    }

    private void computeStrides() {
        channelBytes = spec.format().size();
        pixelBytes = spec.pixelBytes();
        scanlineBytes = spec.scanlineBytes();
        planeBytes = scanlineBytes * Math.max(0, spec.height());
        blackPixel = ByteBuffer.allocate(Math.max(0, pixelBytes))
                .asReadOnlyBuffer()
                .order(ByteOrder.nativeOrder());
    }

    void zeroFill() {
        ByteBuffer px = localPixels;
        if (px == null) {
            return;
        }
        int length = (int) Math.min(px.capacity(), spec.imageBytes());
        if (px.hasArray()) {
            Arrays.fill(px.array(), px.arrayOffset(), px.arrayOffset() + length, (byte) 0);
        } else {
            for (int i = 0; i < length; i++) {
                px.put(i, (byte) 0);
            }
        }
    }

    private static ByteBuffer view(ByteBuffer buffer) {
        return buffer == null ? null : buffer.duplicate().order(buffer.order());
    }

    @Override
    public boolean write(String filename, PixelType dtype, String fileFormatName, ProgressCallback progress) {
        return ImageBufWriter.write(this, filename, dtype, fileFormatName, progress);
    }

    @Override
    public boolean write(ImageOutput out, ProgressCallback progress) {
        return ImageBufWriter.write(this, out, progress);
    }

    @Override
    public void setWriteFormat(PixelType... formats) {
        writeFormat = formats == null ? List.of() : List.of(formats);
    }

    @Override
    public void setWriteTiles(int width, int height, int depth) {
        writeTileWidth = width;
        writeTileHeight = height;
        writeTileDepth = Math.max(1, depth);
    }

    List<PixelType> writeFormat() {
        return writeFormat;
    }

    int writeTileWidth() {
        return writeTileWidth;
    }

    int writeTileHeight() {
        return writeTileHeight;
    }

    int writeTileDepth() {
        return writeTileDepth;
    }

    @Override
    public boolean copyPixels(ImageBuf src, Roi roi) {
        return PixelCopier.copyPixels(this, impl(src), roi);
    }

    @Override
    public boolean copy(ImageBuf source, PixelType format) {
        DefaultImageBuf src = impl(source);
        final PixelType fmt = format == null ? PixelType.UNKNOWN : format;
        src.validatePixels();
        if (src == this) {
            if (fmt == PixelType.UNKNOWN || fmt == spec.format()) {
                return true;
            }
            DefaultImageBuf tmp = (DefaultImageBuf) duplicate();
            try {
                return copy(tmp, fmt);
            } finally {
                tmp.close();
            }
        }
        if (src.storage == Storage.UNINITIALIZED) {
            clear();
            return true;
        }
        validLock.lock();
        try {
            clear();
            name = src.name;
            fileFormat = src.fileFormat;
            nsubimages = src.nsubimages;
            nmiplevels = src.nmiplevels;
            currentSubimage = src.currentSubimage;
            currentMiplevel = src.currentMiplevel;
            channelBegin = src.channelBegin;
            channelEnd = src.channelEnd;
            if (src.deep()) {
                boolean ok = alloc(src.spec, src.nativeSpec);
                deepData = new DeepData(src.deepData);
                return ok;
            }
            ImageSpec newSpec = src.spec.copy();
            if (fmt != PixelType.UNKNOWN) {
                newSpec.format(fmt);
            }
            if (!alloc(newSpec, src.nativeSpec)) {
                return false;
            }
            return copyPixels(src, Roi.ALL);
        } finally {
            validLock.unlock();
        }
    }

    @Override
    public ImageBuf copy(PixelType format) {
        DefaultImageBuf result = new DefaultImageBuf(context);
        result.copy(this, format);
        return result;
    }

    @Override
    public void copyMetadata(ImageBuf source) {
        DefaultImageBuf src = impl(source);
        if (src == this) {
            return;
        }
        src.validateSpec();
        validateSpec();
        ImageSpec from = src.spec;
        ImageSpec tiles = src.storage == Storage.IMAGE_CACHE ? src.nativeSpec : from;
        spec.fullX(from.fullX())
                .fullY(from.fullY())
                .fullZ(from.fullZ())
                .fullWidth(from.fullWidth())
                .fullHeight(from.fullHeight())
                .fullDepth(from.fullDepth())
                .tileSize(tiles.tileWidth(), tiles.tileHeight(), tiles.tileDepth());
        for (String key : List.copyOf(spec.attributes().keySet())) {
            spec.removeAttribute(key);
        }
        from.attributes().forEach(spec::attribute);
        pixelAspect = spec.getFloatAttribute(ImageSpec.PIXEL_ASPECT_RATIO, 1f);
    }

    private static DefaultImageBuf impl(ImageBuf buf) {
        if (buf instanceof DefaultImageBuf impl) {
            return impl;
        }
        throw new IllegalArgumentException("Unsupported ImageBuf implementation: " + buf);
    }

    @Override
    public float getChannel(int x, int y, int z, int channel, WrapMode wrap) {
        if (!validatePixels() || spec.deep() || channel < 0 || channel >= spec.nchannels()) {
            return 0f;
        }
        try (TileCursor cursor = new TileCursor(this)) {
            cursor.seek(x, y, z, wrap);
            return cursor.channel(channel);
        }
    }

    @Override
    public void getPixel(int x, int y, int z, float[] pixel, WrapMode wrap) {
        Arrays.fill(pixel, 0f);
        if (!validatePixels() || spec.deep()) {
            return;
        }
        int n = Math.min(spec.nchannels(), pixel.length);
        try (TileCursor cursor = new TileCursor(this)) {
            cursor.seek(x, y, z, wrap);
            for (int c = 0; c < n; c++) {
                pixel[c] = cursor.channel(c);
            }
        }
    }

    @Override
    public void setPixel(int x, int y, int z, float[] pixel) {
        if (!validatePixels() || spec.deep() || !spec.roi().contains(x, y, z)) {
            return;
        }
        if (storage == Storage.IMAGE_CACHE && !makeWriteable(true)) {
            return;
        }
        if (localPixels == null) {
            return;
        }
        final PixelType format = spec.format();
        final int offset = pixelOffset(x, y, z);
        final int n = Math.min(spec.nchannels(), pixel.length);
        for (int c = 0; c < n; c++) {
            format.put(localPixels, offset + c * channelBytes, pixel[c]);
        }
    }

    @Override
    public void setPixel(int i, float[] pixel) {
        if (!validateSpec()) {
            return;
        }
        int w = Math.max(1, spec.width());
        int h = Math.max(1, spec.height());
        setPixel(spec.x() + i % w, spec.y() + (i / w) % h, spec.z() + i / (w * h), pixel);
    }

    @Override
    public void interpolate(float x, float y, float[] pixel, WrapMode wrap) {
        Interpolator.bilinear(this, x, y, pixel, wrap);
    }

    @Override
    public void interpolateNdc(float s, float t, float[] pixel, WrapMode wrap) {
        validateSpec();
        interpolate(spec.fullX() + s * spec.fullWidth(), spec.fullY() + t * spec.fullHeight(), pixel, wrap);
    }

    @Override
    public void interpolateBicubic(float x, float y, float[] pixel, WrapMode wrap) {
        Interpolator.bicubic(this, x, y, pixel, wrap);
    }

    @Override
    public void interpolateBicubicNdc(float s, float t, float[] pixel, WrapMode wrap) {
        validateSpec();
        interpolateBicubic(spec.fullX() + s * spec.fullWidth(), spec.fullY() + t * spec.fullHeight(), pixel, wrap);
    }

    @Override
    public boolean getPixels(Roi roi, PixelType format, ByteBuffer result, long xstride, long ystride, long zstride) {
        return PixelCopier.getPixels(this, roi, format, result, xstride, ystride, zstride);
    }

    @Override
    public boolean setPixels(Roi roi, PixelType format, ByteBuffer data, long xstride, long ystride, long zstride) {
        return PixelCopier.setPixels(this, roi, format, data, xstride, ystride, zstride);
    }

    @Override
    public TileCursor tileCursor() {
        validatePixels();
        return new TileCursor(this);
    }

    /**
     * Applies {@code wrap} to coordinates outside the data window.
     *
     * @return whether the wrapped coordinates are inside the data window
     */
    boolean wrap(int[] xyz, WrapMode wrap) {
        if (wrap == null || wrap.isBlack()) {
            return false;
        }
        xyz[0] = wrap.wrap(xyz[0], spec.fullX(), Math.max(1, spec.fullWidth()));
        xyz[1] = wrap.wrap(xyz[1], spec.fullY(), Math.max(1, spec.fullHeight()));
        xyz[2] = wrap.wrap(xyz[2], spec.fullZ(), Math.max(1, spec.fullDepth()));
        return spec.roi().contains(xyz[0], xyz[1], xyz[2]);
    }

    /** Byte offset of a pixel in the local pixels; the pixel must be inside the data window. */
    int pixelOffset(int x, int y, int z) {
        return (int) ((long) (x - spec.x()) * pixelBytes
                + (long) (y - spec.y()) * scanlineBytes
                + (long) (z - spec.z()) * planeBytes);
    }

    ByteBuffer pixels() {
        return localPixels;
    }

    int channelBytes() {
        return channelBytes;
    }

    int pixelBytes() {
        return pixelBytes;
    }

    @Override
    public boolean deep() {
        return validateSpec() && spec.deep();
    }

    @Override
    public DeepData deepData() {
        validatePixels();
        return deepData;
    }

    private long deepPixel(int x, int y, int z) {
        if (!validatePixels() || !spec.deep()) {
            return -1;
        }
        return pixelIndex(x, y, z, true);
    }

    @Override
    public int deepSamples(int x, int y, int z) {
        long p = deepPixel(x, y, z);
        return p < 0 ? 0 : deepData.samples(p);
    }

    @Override
    public void setDeepSamples(int x, int y, int z, int nsamples) {
        long p = deepPixel(x, y, z);
        if (p >= 0) {
            deepData.setSamples(p, nsamples);
        }
    }

    @Override
    public void deepInsertSamples(int x, int y, int z, int samplepos, int nsamples) {
        long p = deepPixel(x, y, z);
        if (p >= 0) {
            deepData.insertSamples(p, samplepos, nsamples);
        }
    }

    @Override
    public void deepEraseSamples(int x, int y, int z, int samplepos, int nsamples) {
        long p = deepPixel(x, y, z);
        if (p >= 0) {
            deepData.eraseSamples(p, samplepos, nsamples);
        }
    }

    @Override
    public float deepValue(int x, int y, int z, int channel, int sample) {
        long p = deepPixel(x, y, z);
        return p < 0 ? 0f : deepData.deepValue(p, channel, sample);
    }

    @Override
    public long deepValueUint(int x, int y, int z, int channel, int sample) {
        long p = deepPixel(x, y, z);
        return p < 0 ? 0L : deepData.deepValueUint(p, channel, sample);
    }

    @Override
    public void setDeepValue(int x, int y, int z, int channel, int sample, float value) {
        long p = deepPixel(x, y, z);
        if (p >= 0) {
            deepData.setDeepValue(p, channel, sample, value);
        }
    }

    @Override
    public void setDeepValueUint(int x, int y, int z, int channel, int sample, long value) {
        long p = deepPixel(x, y, z);
        if (p >= 0) {
            deepData.setDeepValueUint(p, channel, sample, value);
        }
    }

    @Override
    public boolean copyDeepPixel(int x, int y, int z, ImageBuf source, int srcx, int srcy, int srcz) {
        DefaultImageBuf src = impl(source);
        if (!deep() || !src.deep()) {
            return false;
        }
        long p = deepPixel(x, y, z);
        if (p < 0) {
            return false;
        }
        long srcPixel = src.deepPixel(srcx, srcy, srcz);
        return deepData.copyDeepPixel(p, src.deepData, srcPixel);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String fileFormatName() {
        validateSpec();
        return fileFormat;
    }

    @Override
    public int subimage() {
        return currentSubimage;
    }

    @Override
    public int miplevel() {
        return currentMiplevel;
    }

    @Override
    public int nsubimages() {
        validateSpec();
        return nsubimages;
    }

    @Override
    public int nmiplevels() {
        validateSpec();
        return nmiplevels;
    }

    @Override
    public ImageSpec spec() {
        validateSpec();
        return spec;
    }

    @Override
    public ImageSpec nativeSpec() {
        validateSpec();
        return nativeSpec;
    }

    @Override
    public int nchannels() {
        return spec().nchannels();
    }

    @Override
    public int xbegin() {
        return spec().x();
    }

    @Override
    public int xend() {
        return spec().x() + spec.width();
    }

    @Override
    public int ybegin() {
        return spec().y();
    }

    @Override
    public int yend() {
        return spec().y() + spec.height();
    }

    @Override
    public int zbegin() {
        return spec().z();
    }

    @Override
    public int zend() {
        return spec().z() + Math.max(1, spec.depth());
    }

    @Override
    public int orientation() {
        return spec().getIntAttribute(ImageSpec.ORIENTATION, 1);
    }

    @Override
    public void setOrientation(int orientation) {
        spec().attribute(ImageSpec.ORIENTATION, orientation);
    }

    private boolean transposed() {
        return orientation() > 4;
    }

    @Override
    public int orientedWidth() {
        return transposed() ? spec.height() : spec.width();
    }

    @Override
    public int orientedHeight() {
        return transposed() ? spec.width() : spec.height();
    }

    @Override
    public int orientedX() {
        return transposed() ? spec.y() : spec.x();
    }

    @Override
    public int orientedY() {
        return transposed() ? spec.x() : spec.y();
    }

    @Override
    public int orientedFullWidth() {
        return transposed() ? spec.fullHeight() : spec.fullWidth();
    }

    @Override
    public int orientedFullHeight() {
        return transposed() ? spec.fullWidth() : spec.fullHeight();
    }

    @Override
    public int orientedFullX() {
        return transposed() ? spec.fullY() : spec.fullX();
    }

    @Override
    public int orientedFullY() {
        return transposed() ? spec.fullX() : spec.fullY();
    }

    @Override
    public void setOrigin(int x, int y, int z) {
        spec().x(x).y(y).z(z);
    }

    @Override
    public void setFull(int xbegin, int xend, int ybegin, int yend, int zbegin, int zend) {
        spec().roiFull(Roi.of(xbegin, xend, ybegin, yend, zbegin, zend, 0, spec.nchannels()));
    }

    @Override
    public Roi roi() {
        return spec().roi();
    }

    @Override
    public Roi roiFull() {
        return spec().roiFull();
    }

    @Override
    public void setRoiFull(Roi roi) {
        spec().roiFull(roi);
    }

    @Override
    public boolean containsRoi(Roi roi) {
        return roi().contains(roi);
    }

    @Override
    public PixelType pixelType() {
        validateSpec();
        return storage == Storage.IMAGE_CACHE ? cachedPixelType : spec.format();
    }

    @Override
    public Storage storage() {
        validateSpec();
        return storage;
    }

    @Override
    public boolean initialized() {
        return specValid && storage != Storage.UNINITIALIZED;
    }

    @Override
    public boolean pixelsValid() {
        return pixelsValid;
    }

    @Override
    public boolean cachedPixels() {
        validateSpec();
        return storage == Storage.IMAGE_CACHE;
    }

    @Override
    public ByteBuffer localPixels() {
        validatePixels();
        return view(localPixels);
    }

    @Override
    public long pixelStride() {
        validateSpec();
        return pixelBytes;
    }

    @Override
    public long scanlineStride() {
        validateSpec();
        return scanlineBytes;
    }

    @Override
    public long zStride() {
        validateSpec();
        return planeBytes;
    }

    @Override
    public long pixelAddr(int x, int y, int z, int channel) {
        if (!validatePixels() || localPixels == null || spec.deep()) {
            return -1;
        }
        return pixelOffset(x, y, z) + (long) channel * channelBytes;
    }

    @Override
    public long pixelIndex(int x, int y, int z, boolean checkRange) {
        validateSpec();
        if (checkRange && !spec.roi().contains(x, y, z)) {
            return -1;
        }
        return ((long) (z - spec.z()) * spec.height() + (y - spec.y())) * spec.width() + (x - spec.x());
    }

    @Override
    public ByteBuffer blackPixel() {
        validateSpec();
        return blackPixel.duplicate().order(ByteOrder.nativeOrder());
    }

    @Override
    public float pixelAspectRatio() {
        validateSpec();
        return pixelAspect;
    }

    @Override
    public int threads() {
        return threads;
    }

    @Override
    public void threads(int threads) {
        this.threads = Math.max(0, threads);
    }

    @Override
    public ImageCache imageCache() {
        return imageCache;
    }

    String cacheName() {
        return name;
    }

    @Override
    public boolean hasError() {
        return errors.hasError();
    }

    @Override
    public String getError(boolean clear) {
        return errors.get(clear);
    }

    @Override
    public void error(String message) {
        errors.append(message);
    }

    @Override
    public String toString() {
        return "ImageBuf[name=%s, storage=%s, spec=%s]".formatted(name, storage, specValid ? spec : "<invalid>");
    }
}
