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

import io.tileverse.imagebuf.deep.DeepData;
import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import io.tileverse.imagebuf.spec.Roi;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;

/**
 * Writes images to a destination.
 * <p>
 * Source pixels are contiguous (all channels interleaved, then x, then y, then z), start at the current position
 * of the source buffer and are read in that buffer's byte order; the writer converts them to the formats of the
 * spec it was opened with.
 */
public interface ImageOutput extends Closeable {

    /** How {@link #open(Path, ImageSpec, OpenMode)} treats the destination. */
    enum OpenMode {
        /** Create or truncate the destination and write its first subimage. */
        CREATE,
        /** Start the next subimage of an already open destination. */
        APPEND_SUBIMAGE,
        /** Start the next miplevel of the current subimage. */
        APPEND_MIPLEVEL
    }

    /** Feature name for tiled output. */
    String FEATURE_TILES = "tiles";
    /** Feature name for multiple subimages. */
    String FEATURE_MULTIIMAGE = "multiimage";
    /** Feature name for miplevels. */
    String FEATURE_MIPMAP = "mipmap";
    /** Feature name for deep images. */
    String FEATURE_DEEPDATA = "deepdata";
    /** Feature name for writing regions in any order. */
    String FEATURE_RANDOM_ACCESS = "random_access";

    String formatName();

    boolean supports(String feature);

    void open(Path path, ImageSpec spec, OpenMode mode) throws IOException;

    default void open(Path path, ImageSpec spec) throws IOException {
        open(path, spec, OpenMode.CREATE);
    }

    /** @return the spec of the image being written */
    ImageSpec spec();

    /**
     * Writes a region of the current image, all channels. The region must lie within the data window.
     */
    void writeRegion(Roi roi, PixelType format, ByteBuffer data) throws IOException;

    default void writeScanlines(int ybegin, int yend, int z, PixelType format, ByteBuffer data) throws IOException {
        ImageSpec spec = spec();
        writeRegion(
                Roi.of(spec.x(), spec.x() + spec.width(), ybegin, yend, z, z + 1, 0, spec.nchannels()), format, data);
    }

    default void writeTiles(Roi roi, PixelType format, ByteBuffer data) throws IOException {
        writeRegion(roi.withChannels(0, spec().nchannels()), format, data);
    }

    /**
     * Writes the whole data window in strips of scanlines, reporting progress after each strip.
     *
     * @throws IOException if writing fails or the callback aborts
     */
    default void writeImage(PixelType format, ByteBuffer data, ProgressCallback progress) throws IOException {
        final ImageSpec spec = spec();
        final PixelType fmt = format == PixelType.UNKNOWN ? spec.format() : format;
        final long rowBytes = (long) fmt.size() * spec.nchannels() * spec.width();
        final int strip = 64;
        final long totalRows = (long) spec.height() * spec.depth();
        long rowsDone = 0;
        for (int z = spec.z(); z < spec.z() + spec.depth(); z++) {
            for (int y = spec.y(); y < spec.y() + spec.height(); y += strip) {
                int yend = Math.min(y + strip, spec.y() + spec.height());
                ByteBuffer source = data.duplicate().order(data.order());
                source.position(Math.toIntExact(data.position() + rowsDone * rowBytes));
                writeScanlines(y, yend, z, fmt, source);
                rowsDone += yend - y;
                if (ProgressCallback.report(progress, (float) rowsDone / totalRows)) {
                    throw new IOException("Write aborted");
                }
            }
        }
    }

    void writeDeepImage(DeepData deep) throws IOException;
}
