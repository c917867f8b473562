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
package io.tileverse.imagebuf.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import io.tileverse.imagebuf.spec.Roi;
import io.tileverse.imagebuf.spi.ImageCacheConfig;
import io.tileverse.imagebuf.spi.ImageFormatProvider;
import io.tileverse.imagebuf.spi.ImageInput;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ImageCache} keeping tiles in memory with Caffeine.
 * <p>
 * Images are opened through {@link ImageFormatProvider} the first time they are referenced and stay open until
 * {@link #invalidate(String, boolean) invalidated}, or until more than {@link Builder#maxOpenFiles(int)} files are
 * open, in which case the least recently used one is closed and reopened on its next read. Tiles are loaded on demand and evicted by Caffeine when the
 * configured memory (or tile count) bound is exceeded. A tile handed out by {@link #getTile} stays usable after
 * eviction until it is released, only the cache forgets about it.
 * <p>
 * <strong>Stored pixel type:</strong> tiles are kept in the native format of the image when it is
 * {@code uint8}, {@code uint16}, {@code half} or {@code float} and shared by all channels, and as {@code float}
 * otherwise. {@link Builder#forceFloat(boolean)} stores everything as float,
 * {@link Builder#storageType(PixelType)} stores everything as the given type.
 * <p>
 * <strong>Tiling:</strong> tiled images keep their tile layout. Untiled images are cut into square tiles of
 * {@link Builder#autoTile(int)} pixels, or cached as a single tile when it is {@code 0}.
 *
 * <pre>{@code
 * CaffeineImageCache cache = CaffeineImageCache.builder()
 *     .maximumWeight(512 * 1024 * 1024)
 *     .autoTile(64)
 *     .build();
 * }</pre>
 */
@Slf4j
public class CaffeineImageCache implements ImageCache {

    static final long DEFAULT_MAX_MEMORY = 256L * 1024 * 1024;

    static final int DEFAULT_MAX_OPEN_FILES = 100;

    record TileKey(String name, int subimage, int miplevel, int x, int y, int z) {}

    private final Cache<String, ImageFile> files;
    private final Cache<TileKey, CachedTile> tiles;
    private final Map<String, ImageSpec> configs = new ConcurrentHashMap<>();
    private final AtomicLong outstanding = new AtomicLong();

    private final int autoTile;
    private final boolean forceFloat;
    private final PixelType storageType;
    private final boolean unassociatedAlpha;

    CaffeineImageCache(
            Cache<TileKey, CachedTile> tiles,
            int maxOpenFiles,
            int autoTile,
            boolean forceFloat,
            PixelType storageType,
            boolean unassociatedAlpha) {
        this.tiles = Objects.requireNonNull(tiles, "Cache cannot be null");
        this.files = Caffeine.newBuilder()
                .maximumSize(maxOpenFiles)
                .removalListener((String name, ImageFile file, RemovalCause cause) -> {
                    if (file != null && cause.wasEvicted()) {
                        log.debug("Closing {}, evicted from the open files ({})", name, cause);
                        file.close();
                    }
                })
                .build();
        if (autoTile < 0) {
            throw new IllegalArgumentException("Auto tile size cannot be negative: " + autoTile);
        }
        this.autoTile = autoTile;
        this.forceFloat = forceFloat;
        this.storageType = storageType == null ? PixelType.UNKNOWN : storageType;
        this.unassociatedAlpha = unassociatedAlpha;
    }

    @Override
    public ImageSpec imageSpec(@NonNull String name, int subimage, int miplevel, boolean nativeSpec)
            throws IOException {
        return file(name).spec(subimage, miplevel, nativeSpec).copy();
    }

    @Override
    public Optional<Object> imageInfo(@NonNull String name, int subimage, int miplevel, @NonNull String key)
            throws IOException {
        ImageFile f = file(name);
        return switch (key) {
            case SUBIMAGES -> Optional.of(f.subimages());
            case MIPLEVELS -> Optional.of(f.miplevels(subimage));
            case FILE_FORMAT -> Optional.of(f.formatName);
            case CACHED_PIXEL_TYPE -> Optional.of(f.spec(subimage, miplevel, false).format());
            default -> Optional.empty();
        };
    }

    @Override
    public void getPixels(
            @NonNull String name, int subimage, int miplevel, @NonNull Roi roi, PixelType format, ByteBuffer result)
            throws IOException {
        final ImageFile f = file(name);
        final ImageSpec cs = f.spec(subimage, miplevel, false);
        if (cs.deep()) {
            throw new IOException("Cannot read raster pixels from deep image " + name);
        }
        final Roi dataWindow = cs.roi();
        final Roi region = roi.defined() ? roi : dataWindow;
        final int chbegin = Math.max(0, region.chbegin());
        final int chend = Math.min(cs.nchannels(), region.chend());
        if (chend <= chbegin || region.isEmpty()) {
            return;
        }
        final PixelType stored = cs.format();
        final PixelType fmt = format == null || format == PixelType.UNKNOWN ? stored : format;
        final int valueBytes = stored.size();
        final int outPixel = fmt.size() * (chend - chbegin);

        int out = result.position();
        for (int z = region.zbegin(); z < region.zend(); z++) {
            for (int y = region.ybegin(); y < region.yend(); y++) {
                int x = region.xbegin();
                while (x < region.xend()) {
                    if (!dataWindow.contains(x, y, z)) {
                        for (int b = 0; b < outPixel; b++) {
                            result.put(out + b, (byte) 0);
                        }
                        out += outPixel;
                        x++;
                        continue;
                    }
                    CachedTile tile = tile(f, cs, subimage, miplevel, x, y, z);
                    ByteBuffer src = tile.pixels();
                    int xend = Math.min(region.xend(), Math.min(tile.xbegin() + tile.width(), dataWindow.xend()));
                    for (; x < xend; x++) {
                        int offset = tile.offset(x, y, z);
                        for (int c = chbegin; c < chend; c++) {
                            PixelType.convert(
                                    src, offset + c * valueBytes, stored, result, out + (c - chbegin) * fmt.size(), fmt);
                        }
                        out += outPixel;
                    }
                }
            }
        }
    }

    @Override
    public Tile getTile(@NonNull String name, int subimage, int miplevel, int x, int y, int z) throws IOException {
        final ImageFile f = file(name);
        final ImageSpec cs = f.spec(subimage, miplevel, false);
        if (cs.deep()) {
            throw new IOException("Deep image " + name + " has no tiles");
        }
        if (!cs.roi().contains(x, y, z)) {
            throw new IOException(
                    "Pixel (%d,%d,%d) is outside the data window of %s".formatted(x, y, z, name));
        }
        CachedTile tile = tile(f, cs, subimage, miplevel, x, y, z);
        tile.refs.incrementAndGet();
        outstanding.incrementAndGet();
        return tile;
    }

    @Override
    public void releaseTile(Tile tile) {
        if (tile instanceof CachedTile t) {
            if (t.refs.getAndUpdate(r -> r > 0 ? r - 1 : 0) > 0) {
                outstanding.decrementAndGet();
            } else {
                log.warn("Tile released more often than it was acquired: {}", t.key);
            }
        }
    }

    /** @return tile references handed out by {@link #getTile} and not yet released */
    public long outstandingTiles() {
        return outstanding.get();
    }

    @Override
    public void invalidate(@NonNull String name, boolean force) {
        ImageFile f = files.asMap().remove(name);
        if (f != null) {
            f.close();
        }
        tiles.asMap().keySet().removeIf(k -> k.name().equals(name));
        log.debug("Invalidated {} (force={})", name, force);
    }

    public void invalidateAll() {
        files.asMap().values().forEach(ImageFile::close);
        files.invalidateAll();
        tiles.invalidateAll();
    }

    @Override
    public void addFile(@NonNull String name, ImageSpec config, boolean replace) {
        if (config == null) {
            if (replace) {
                configs.remove(name);
            }
            return;
        }
        if (replace) {
            configs.put(name, config.copy());
        } else {
            configs.putIfAbsent(name, config.copy());
        }
    }

    @Override
    public Optional<Object> getAttribute(@NonNull String name) {
        return switch (name) {
            case ATTR_UNASSOCIATED_ALPHA -> Optional.of(unassociatedAlpha ? 1 : 0);
            case ATTR_FORCE_FLOAT -> Optional.of(forceFloat ? 1 : 0);
            case ATTR_AUTOTILE -> Optional.of(autoTile);
            default -> Optional.empty();
        };
    }

    public ImageCacheStats stats() {
        long sizeBytes = tiles.asMap().values().stream()
                .mapToLong(t -> t.pixels().capacity())
                .sum();
        return ImageCacheStats.fromCaffeine(
                tiles.stats(), tiles.estimatedSize(), files.estimatedSize(), sizeBytes, outstanding.get());
    }

    @Override
    public void close() {
        invalidateAll();
        configs.clear();
    }

    private ImageFile file(String name) throws IOException {
        try {
            return files.get(name, this::openFile);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private ImageFile openFile(String name) {
        ImageSpec config = configs.get(name);
        if (unassociatedAlpha && (config == null || config.getAttribute(ImageSpec.UNASSOCIATED_ALPHA).isEmpty())) {
            config = config == null ? new ImageSpec() : config.copy();
            config.attribute(ImageSpec.UNASSOCIATED_ALPHA, 1);
        }
        try {
            ImageInput input = ImageFormatProvider.open(name, config);
            try {
                List<List<ImageSpec>> nativeSpecs = new ArrayList<>();
                List<List<ImageSpec>> cacheSpecs = new ArrayList<>();
                for (int s = 0; s < input.subimages(); s++) {
                    List<ImageSpec> natives = new ArrayList<>();
                    List<ImageSpec> cached = new ArrayList<>();
                    for (int m = 0; m < input.miplevels(s); m++) {
                        ImageSpec nativeSpec = input.seekSubimage(s, m);
                        natives.add(nativeSpec);
                        cached.add(cacheLayout(nativeSpec));
                    }
                    nativeSpecs.add(natives);
                    cacheSpecs.add(cached);
                }
                input.seekSubimage(0, 0);
                log.debug("Opened {} ({}, {} subimage(s))", name, input.formatName(), nativeSpecs.size());
                return new ImageFile(name, config, input, nativeSpecs, cacheSpecs);
            } catch (IOException | RuntimeException e) {
                input.close();
                throw e;
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private ImageSpec cacheLayout(ImageSpec nativeSpec) {
        ImageSpec cs = nativeSpec.copy();
        cs.format(storedType(nativeSpec));
        if (!nativeSpec.isTiled()) {
            if (autoTile > 0) {
                cs.tileSize(autoTile, autoTile, 1);
            } else {
                cs.tileSize(
                        Math.max(1, nativeSpec.width()), Math.max(1, nativeSpec.height()), Math.max(1, nativeSpec.depth()));
            }
        }
        if (cs.tileDepth() <= 0) {
            cs.tileDepth(1);
        }
        return cs;
    }

    private PixelType storedType(ImageSpec nativeSpec) {
        if (storageType != PixelType.UNKNOWN) {
            return storageType;
        }
        if (forceFloat) {
            return PixelType.FLOAT;
        }
        PixelType t = nativeSpec.format();
        for (int c = 0; c < nativeSpec.nchannels(); c++) {
            if (nativeSpec.channelFormat(c) != t) {
                return PixelType.FLOAT;
            }
        }
        return switch (t) {
            case UINT8, UINT16, HALF, FLOAT -> t;
            default -> PixelType.FLOAT;
        };
    }

    private CachedTile tile(ImageFile f, ImageSpec cs, int subimage, int miplevel, int x, int y, int z)
            throws IOException {
        final int tw = cs.tileWidth();
        final int th = cs.tileHeight();
        final int td = Math.max(1, cs.tileDepth());
        TileKey key = new TileKey(
                f.name,
                subimage,
                miplevel,
                cs.x() + Math.floorDiv(x - cs.x(), tw) * tw,
                cs.y() + Math.floorDiv(y - cs.y(), th) * th,
                cs.z() + Math.floorDiv(z - cs.z(), td) * td);
        try {
            return tiles.get(key, k -> loadTile(f, cs, k));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private CachedTile loadTile(ImageFile f, ImageSpec cs, TileKey key) {
        final int tw = cs.tileWidth();
        final int th = cs.tileHeight();
        final int td = Math.max(1, cs.tileDepth());
        final int pixelBytes = cs.pixelBytes();
        try {
            long size = (long) tw * th * td * pixelBytes;
            if (size > Integer.MAX_VALUE) {
                throw new IOException("Tile of %dx%dx%d pixels is too large".formatted(tw, th, td));
            }
            ByteBuffer data = ByteBuffer.allocate((int) size).order(ByteOrder.nativeOrder());
            Roi tileRoi = Roi.of(key.x(), key.x() + tw, key.y(), key.y() + th, key.z(), key.z() + td, 0, cs.nchannels());
            Roi region = Roi.intersection(tileRoi, cs.roi());
            if (region.equals(tileRoi)) {
                f.read(key.subimage(), key.miplevel(), region, cs.format(), data);
            } else {
                // edge tile, read the valid part and place its rows, the rest stays zero
                ByteBuffer part =
                        ByteBuffer.allocate((int) (region.npixels() * pixelBytes)).order(ByteOrder.nativeOrder());
                f.read(key.subimage(), key.miplevel(), region, cs.format(), part);
                int rowBytes = region.width() * pixelBytes;
                for (int z = region.zbegin(); z < region.zend(); z++) {
                    for (int y = region.ybegin(); y < region.yend(); y++) {
                        int src = ((z - region.zbegin()) * region.height() + (y - region.ybegin())) * rowBytes;
                        int dst = (((z - key.z()) * th + (y - key.y())) * tw + (region.xbegin() - key.x())) * pixelBytes;
                        data.put(dst, part, src, rowBytes);
                    }
                }
            }
            log.trace("Loaded tile {}", key);
            return new CachedTile(
                    key, tw, th, td, cs.nchannels(), cs.format(), data.asReadOnlyBuffer().order(ByteOrder.nativeOrder()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * An open image and its specs. Reads are serialized since the input is positioned on one subimage at a time.
     * <p>
     * Once closed the specs stay usable. A read through a closed file, from a caller that obtained it before it was
     * evicted, reopens the input for that read only.
     */
    private static final class ImageFile {
        final String name;
        final String formatName;
        private final ImageSpec config;
        private ImageInput input;
        private boolean closed;
        private final List<List<ImageSpec>> nativeSpecs;
        private final List<List<ImageSpec>> cacheSpecs;

        ImageFile(
                String name,
                ImageSpec config,
                ImageInput input,
                List<List<ImageSpec>> nativeSpecs,
                List<List<ImageSpec>> cacheSpecs) {
            this.name = name;
            this.config = config;
            this.input = input;
            this.formatName = input.formatName();
            this.nativeSpecs = nativeSpecs;
            this.cacheSpecs = cacheSpecs;
        }

        int subimages() {
            return nativeSpecs.size();
        }

        int miplevels(int subimage) {
            return subimage >= 0 && subimage < nativeSpecs.size()
                    ? nativeSpecs.get(subimage).size()
                    : 0;
        }

        ImageSpec spec(int subimage, int miplevel, boolean nativeSpec) throws IOException {
            if (miplevel < 0 || miplevel >= miplevels(subimage)) {
                throw new IOException(
                        "%s does not have subimage %d, miplevel %d".formatted(name, subimage, miplevel));
            }
            return (nativeSpec ? nativeSpecs : cacheSpecs).get(subimage).get(miplevel);
        }

        synchronized void read(int subimage, int miplevel, Roi region, PixelType format, ByteBuffer target)
                throws IOException {
            if (input == null) {
                input = ImageFormatProvider.open(name, config);
            }
            try {
                if (input.currentSubimage() != subimage || input.currentMiplevel() != miplevel) {
                    input.seekSubimage(subimage, miplevel);
                }
                input.readRegion(region, format, target);
            } finally {
                if (closed) {
                    closeInput();
                }
            }
        }

        synchronized void close() {
            closed = true;
            closeInput();
        }

        private void closeInput() {
            if (input == null) {
                return;
            }
            try {
                input.close();
            } catch (IOException e) {
                log.warn("Error closing {}: {}", name, e.getMessage());
            }
            input = null;
        }
    }

    /**
     * A cached tile with its reference count.
     */
    static final class CachedTile implements Tile {
        final TileKey key;
        final AtomicInteger refs = new AtomicInteger();
        private final int width;
        private final int height;
        private final int depth;
        private final int nchannels;
        private final PixelType format;
        private final ByteBuffer pixels;

        CachedTile(TileKey key, int width, int height, int depth, int nchannels, PixelType format, ByteBuffer pixels) {
            this.key = key;
            this.width = width;
            this.height = height;
            this.depth = depth;
            this.nchannels = nchannels;
            this.format = format;
            this.pixels = pixels;
        }

        @Override
        public int xbegin() {
            return key.x();
        }

        @Override
        public int ybegin() {
            return key.y();
        }

        @Override
        public int zbegin() {
            return key.z();
        }

        @Override
        public int width() {
            return width;
        }

        @Override
        public int height() {
            return height;
        }

        @Override
        public int depth() {
            return depth;
        }

        @Override
        public int nchannels() {
            return nchannels;
        }

        @Override
        public PixelType format() {
            return format;
        }

        @Override
        public ByteBuffer pixels() {
            return pixels;
        }

        @Override
        public String toString() {
            return "Tile" + key;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link CaffeineImageCache}.
     */
    public static class Builder {
        private Long maximumSize;
        private Long maximumWeight;
        private int maxOpenFiles = DEFAULT_MAX_OPEN_FILES;
        private Long expireAfterAccessDuration;
        private TimeUnit expireAfterAccessUnit;
        private boolean softValues;
        private int autoTile;
        private boolean forceFloat;
        private PixelType storageType = PixelType.UNKNOWN;
        private boolean unassociatedAlpha;

        private Builder() {
            // use CaffeineImageCache.builder()
        }

        /**
         * Applies every parameter set in {@code config}; parameters it does not set keep the builder values.
         */
        public Builder config(@NonNull ImageCacheConfig config) {
            config.getParameter(ImageCacheConfig.MAX_TILES.key(), Integer.class).ifPresentOrElse(
                    n -> {
                        this.maximumWeight = null;
                        maximumSize(n);
                    },
                    () -> config.getParameter(ImageCacheConfig.MAX_MEMORY_MB.key(), Integer.class)
                            .ifPresent(mb -> {
                                this.maximumSize = null;
                                maximumWeight(mb * 1024L * 1024L);
                            }));
            config.getParameter(ImageCacheConfig.MAX_OPEN_FILES.key(), Integer.class).ifPresent(this::maxOpenFiles);
            config.getParameter(ImageCacheConfig.EXPIRE_AFTER_ACCESS_SECONDS.key(), Integer.class)
                    .ifPresent(s -> expireAfterAccess(s, TimeUnit.SECONDS));
            config.getParameter(ImageCacheConfig.AUTOTILE.key(), Integer.class).ifPresent(this::autoTile);
            config.getParameter(ImageCacheConfig.FORCE_FLOAT.key(), Boolean.class).ifPresent(this::forceFloat);
            config.storageType().ifPresent(this::storageType);
            config.getParameter(ImageCacheConfig.UNASSOCIATED_ALPHA.key(), Boolean.class)
                    .ifPresent(this::unassociatedAlpha);
            return this;
        }

        public Builder maximumSize(long maximumSize) {
            if (maximumSize <= 0) {
                throw new IllegalArgumentException("Maximum size must be positive: " + maximumSize);
            }
            if (this.maximumWeight != null) {
                throw new IllegalStateException("Cannot set both maximumSize and maximumWeight");
            }
            this.maximumSize = maximumSize;
            return this;
        }

        /** Bounds the total bytes of cached tile pixels. */
        public Builder maximumWeight(long maximumWeight) {
            if (maximumWeight <= 0) {
                throw new IllegalArgumentException("Maximum weight must be positive: " + maximumWeight);
            }
            if (this.maximumSize != null) {
                throw new IllegalStateException("Cannot set both maximumSize and maximumWeight");
            }
            this.maximumWeight = maximumWeight;
            return this;
        }

        /** Bounds the number of image files kept open at once. */
        public Builder maxOpenFiles(int maxOpenFiles) {
            if (maxOpenFiles <= 0) {
                throw new IllegalArgumentException("Maximum open files must be positive: " + maxOpenFiles);
            }
            this.maxOpenFiles = maxOpenFiles;
            return this;
        }

        public Builder expireAfterAccess(long duration, TimeUnit unit) {
            if (duration <= 0) {
                throw new IllegalArgumentException("Duration must be positive: " + duration);
            }
            this.expireAfterAccessDuration = duration;
            this.expireAfterAccessUnit = Objects.requireNonNull(unit, "Time unit cannot be null");
            return this;
        }

        public Builder softValues(boolean softValues) {
            this.softValues = softValues;
            return this;
        }

        public Builder autoTile(int autoTile) {
            if (autoTile < 0) {
                throw new IllegalArgumentException("Auto tile size cannot be negative: " + autoTile);
            }
            this.autoTile = autoTile;
            return this;
        }

        public Builder forceFloat(boolean forceFloat) {
            this.forceFloat = forceFloat;
            return this;
        }

        /** Stores every tile as {@code type}, {@link PixelType#UNKNOWN} restores the default rule. */
        public Builder storageType(PixelType type) {
            this.storageType = type == null ? PixelType.UNKNOWN : type;
            return this;
        }

        public Builder unassociatedAlpha(boolean unassociatedAlpha) {
            this.unassociatedAlpha = unassociatedAlpha;
            return this;
        }

        public CaffeineImageCache build() {
            Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder().recordStats();
            if (maximumSize != null) {
                cacheBuilder.maximumSize(maximumSize);
            } else {
                long weight = maximumWeight != null ? maximumWeight : DEFAULT_MAX_MEMORY;
                cacheBuilder.maximumWeight(weight).weigher((TileKey key, CachedTile tile) -> tile.pixels()
                        .capacity());
            }
            if (expireAfterAccessDuration != null && expireAfterAccessUnit != null) {
                cacheBuilder.expireAfterAccess(expireAfterAccessDuration, expireAfterAccessUnit);
            }
            if (softValues) {
                cacheBuilder.softValues();
            }
            Cache<TileKey, CachedTile> tiles = cacheBuilder.build();
            return new CaffeineImageCache(tiles, maxOpenFiles, autoTile, forceFloat, storageType, unassociatedAlpha);
        }
    }
}
