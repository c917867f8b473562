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
import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import io.tileverse.imagebuf.spec.Roi;
import io.tileverse.imagebuf.spi.ImageFormatProvider;
import io.tileverse.imagebuf.spi.ImageOutput;
import io.tileverse.imagebuf.spi.ProgressCallback;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes {@link ImageBuf} pixels to files.
 * <p>
 * Cache backed images that do not fit in {@link #WRITE_BUDGET} bytes are streamed through the cache in strips
 * of scanlines, or rows of tiles when the output is tiled, so they are never fully materialized.
 */
@Slf4j
final class ImageBufWriter {

    /** Largest cache backed image written in one piece. */
    static final long WRITE_BUDGET = 64L * 1024 * 1024;

    private ImageBufWriter() {
        // utility class
    }

    static boolean write(
            DefaultImageBuf buf, String filename, PixelType dtype, String fileFormat, ProgressCallback progress) {
        final String target = filename == null || filename.isEmpty() ? buf.name() : filename;
        if (target.isEmpty()) {
            buf.error("ImageBuf.write() called with no filename");
            return false;
        }
        if (!buf.validatePixels()) {
            return false;
        }
        if (!buf.initialized()) {
            buf.error("ImageBuf.write() called on an uninitialized ImageBuf");
            return false;
        }
        if (target.equals(buf.name()) && buf.storage() == Storage.IMAGE_CACHE) {
            // the file is about to be replaced, pixels must not be served from it anymore
            buf.read(
                    Math.max(0, buf.subimage()),
                    Math.max(0, buf.miplevel()),
                    0,
                    -1,
                    true,
                    buf.spec().format(),
                    null);
            if (buf.storage() != Storage.LOCAL_BUFFER) {
                buf.error("ImageBuf overwriting " + target + " but could not force read");
                return false;
            }
        }
        ImageCache cache = buf.imageCache();
        if (cache != null) {
            cache.invalidate(target, false);
        }
        buf.context().invalidate(target);

        try (ImageOutput out = buf.context().createOutput(target, fileFormat)) {
            ImageSpec fileSpec = buf.spec().copy();
            if (buf.writeTileWidth() > 0 && out.supports(ImageOutput.FEATURE_TILES)) {
                fileSpec.tileSize(buf.writeTileWidth(), buf.writeTileHeight(), buf.writeTileDepth());
            } else {
                fileSpec.tileSize(0, 0, 1);
            }
            applyWriteFormat(buf, fileSpec, dtype);
            out.open(Path.of(target), fileSpec);
            if (!write(buf, out, progress)) {
                return false;
            }
        } catch (IOException | RuntimeException e) {
            buf.error(e.getMessage() == null ? "Could not write " + target : e.getMessage());
            return false;
        }
        log.debug("Wrote {} as {}", target, fileFormat == null ? ImageFormatProvider.extension(target) : fileFormat);
        return true;
    }

    static boolean write(DefaultImageBuf buf, ImageOutput out, ProgressCallback progress) {
        if (!buf.validatePixels()) {
            return false;
        }
        final ImageSpec spec = buf.spec();
        try {
            if (spec.deep()) {
                out.writeDeepImage(buf.deepData());
            } else if (buf.pixels() != null) {
                out.writeImage(spec.format(), buf.localPixels(), progress);
            } else if (buf.storage() == Storage.IMAGE_CACHE) {
                writeFromCache(buf, out, progress);
            } else {
                buf.error("ImageBuf.write() called on an uninitialized ImageBuf");
                return false;
            }
            return true;
        } catch (IOException | RuntimeException e) {
            buf.error(e.getMessage() == null ? "Could not write " + buf.name() : e.getMessage());
            return false;
        }
    }

    private static void writeFromCache(DefaultImageBuf buf, ImageOutput out, ProgressCallback progress)
            throws IOException {
        final ImageSpec spec = buf.spec();
        final PixelType format = spec.format();
        final ImageCache cache = buf.imageCache();
        final String name = buf.name();
        final int sub = buf.subimage();
        final int mip = buf.miplevel();
        if (spec.imageBytes() <= WRITE_BUDGET) {
            ByteBuffer all = allocate(spec.imageBytes());
            cache.getPixels(name, sub, mip, spec.roi(), format, all);
            out.writeImage(format, all, progress);
            return;
        }
        final ImageSpec outSpec = out.spec();
        final long totalRows = (long) spec.height() * spec.depth();
        long rowsDone = 0;
        if (outSpec.isTiled()) {
            final int th = outSpec.tileHeight();
            final int td = Math.max(1, outSpec.tileDepth());
            for (int z = spec.z(); z < spec.z() + spec.depth(); z += td) {
                int zend = Math.min(z + td, spec.z() + spec.depth());
                for (int y = spec.y(); y < spec.y() + spec.height(); y += th) {
                    int yend = Math.min(y + th, spec.y() + spec.height());
                    Roi strip = Roi.of(spec.x(), spec.x() + spec.width(), y, yend, z, zend, 0, spec.nchannels());
                    ByteBuffer pixels = allocate(strip.npixels() * spec.pixelBytes());
                    cache.getPixels(name, sub, mip, strip, format, pixels);
                    out.writeTiles(strip, format, pixels);
                    rowsDone += (long) (yend - y) * (zend - z);
                    checkProgress(progress, rowsDone, totalRows);
                }
            }
            return;
        }
        final int chunk = scanlineChunk(spec.scanlineBytes());
        for (int z = spec.z(); z < spec.z() + spec.depth(); z++) {
            for (int y = spec.y(); y < spec.y() + spec.height(); y += chunk) {
                int yend = Math.min(y + chunk, spec.y() + spec.height());
                Roi strip = Roi.of(spec.x(), spec.x() + spec.width(), y, yend, z, z + 1, 0, spec.nchannels());
                ByteBuffer pixels = allocate(spec.scanlineBytes() * (yend - y));
                cache.getPixels(name, sub, mip, strip, format, pixels);
                out.writeScanlines(y, yend, z, format, pixels);
                rowsDone += yend - y;
                checkProgress(progress, rowsDone, totalRows);
            }
        }
    }

    /** Scanlines per strip: the budget rounded up to a multiple of 64, between 1 and 1024. */
    static int scanlineChunk(long scanlineBytes) {
        long rows = scanlineBytes <= 0 ? 1024 : WRITE_BUDGET / scanlineBytes;
        rows = (rows + 63) / 64 * 64;
        return (int) Math.max(1, Math.min(1024, rows));
    }

    private static void checkProgress(ProgressCallback progress, long done, long total) throws IOException {
        if (ProgressCallback.report(progress, (float) done / total)) {
            throw new IOException("Write aborted");
        }
    }

    private static ByteBuffer allocate(long bytes) throws IOException {
        if (bytes > DefaultImageBuf.MAX_BUFFER_BYTES) {
            throw new IOException("Strip of %d bytes is too large".formatted(bytes));
        }
        return ByteBuffer.allocate((int) bytes).order(ByteOrder.nativeOrder());
    }

    /**
     * Picks the file pixel types: an explicit type wins, then the write format set on the buffer, then the
     * native formats of the file the buffer was read from.
     */
    static void applyWriteFormat(DefaultImageBuf buf, ImageSpec fileSpec, PixelType dtype) {
        final ImageSpec nativeSpec = buf.nativeSpec();
        final List<PixelType> writeFormat = buf.writeFormat();
        if (dtype != null && dtype != PixelType.UNKNOWN) {
            fileSpec.format(dtype);
        } else if (!writeFormat.isEmpty()) {
            PixelType main = writeFormat.get(0);
            if (main == PixelType.UNKNOWN) {
                main = nativeSpec.format() != PixelType.UNKNOWN ? nativeSpec.format() : fileSpec.format();
            }
            fileSpec.format(main);
            if (writeFormat.size() > 1) {
                List<PixelType> perChannel = new ArrayList<>(fileSpec.nchannels());
                boolean mixed = false;
                for (int c = 0; c < fileSpec.nchannels(); c++) {
                    PixelType t = c < writeFormat.size() && writeFormat.get(c) != PixelType.UNKNOWN
                            ? writeFormat.get(c)
                            : main;
                    mixed |= t != main;
                    perChannel.add(t);
                }
                if (mixed) {
                    fileSpec.channelFormats(perChannel);
                }
            }
        } else if (nativeSpec.format() != PixelType.UNKNOWN) {
            fileSpec.format(nativeSpec.format());
            if (nativeSpec.channelFormats().size() == fileSpec.nchannels()) {
                fileSpec.channelFormats(nativeSpec.channelFormats());
            }
        }
    }
}
