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

/**
 * Reads pixels and metadata from an image source.
 * <p>
 * An input is positioned on one subimage/miplevel at a time, see {@link #seekSubimage(int, int)}. All bulk reads
 * deliver contiguous pixels (channels interleaved, then x, then y, then z) starting at the <em>current
 * position</em> of the destination buffer, written in that buffer's byte order, and leave the buffer position
 * unchanged. A destination format of {@link PixelType#UNKNOWN} means the current spec's {@link ImageSpec#format()}.
 * <p>
 * Failures are reported as {@link IOException} whose message is suitable to show to users.
 * <p>
 * Instances are not required to be thread-safe; callers sharing an input serialize access to it.
 */
public interface ImageInput extends Closeable {

    /** @return the id of the format that produced this input, e.g. {@code "ibuf"} */
    String formatName();

    /** @return the name the input was opened with */
    String name();

    /** @return number of subimages in the source */
    int subimages();

    /** @return number of miplevels of {@code subimage}, {@code 0} if it does not exist */
    int miplevels(int subimage);

    int currentSubimage();

    int currentMiplevel();

    /** @return the spec of the current subimage/miplevel */
    ImageSpec spec();

    /**
     * Positions the input on the given subimage and miplevel.
     *
     * @return a copy of the spec at the new position
     * @throws IOException if the subimage or miplevel does not exist
     */
    ImageSpec seekSubimage(int subimage, int miplevel) throws IOException;

    /** Hint for the number of threads a decoder may use, {@code 0} meaning the default. */
    default void threads(int threads) {
        // single threaded by default
    }

    /**
     * Reads a region of the current subimage. The region must lie within the data window.
     *
     * @param roi pixels and channels to read
     * @param format destination format
     * @param data destination buffer
     */
    void readRegion(Roi roi, PixelType format, ByteBuffer data) throws IOException;

    default void readScanlines(
            int ybegin, int yend, int z, int chbegin, int chend, PixelType format, ByteBuffer data)
            throws IOException {
        ImageSpec spec = spec();
        readRegion(Roi.of(spec.x(), spec.x() + spec.width(), ybegin, yend, z, z + 1, chbegin, chend), format, data);
    }

    default void readTiles(Roi roi, PixelType format, ByteBuffer data) throws IOException {
        readRegion(roi, format, data);
    }

    /**
     * Reads the whole data window of the current subimage, channels {@code [chbegin, chend)}, in strips of
     * scanlines, reporting progress after each strip.
     *
     * @throws IOException if reading fails or the callback aborts
     */
    default void readImage(int chbegin, int chend, PixelType format, ByteBuffer data, ProgressCallback progress)
            throws IOException {
        final ImageSpec spec = spec();
        final PixelType fmt = format == PixelType.UNKNOWN ? spec.format() : format;
        final long rowBytes = (long) fmt.size() * (chend - chbegin) * spec.width();
        final int strip = 64;
        final long totalRows = (long) spec.height() * spec.depth();
        long rowsDone = 0;
        for (int z = spec.z(); z < spec.z() + spec.depth(); z++) {
            for (int y = spec.y(); y < spec.y() + spec.height(); y += strip) {
                int yend = Math.min(y + strip, spec.y() + spec.height());
                ByteBuffer target = data.duplicate().order(data.order());
                target.position(Math.toIntExact(data.position() + rowsDone * rowBytes));
                readRegion(Roi.of(spec.x(), spec.x() + spec.width(), y, yend, z, z + 1, chbegin, chend), fmt, target);
                rowsDone += yend - y;
                if (ProgressCallback.report(progress, (float) rowsDone / totalRows)) {
                    throw new IOException("Read of " + name() + " aborted");
                }
            }
        }
    }

    /**
     * Reads all samples of a deep subimage.
     *
     * @throws IOException if the subimage is not deep or cannot be read
     */
    DeepData readNativeDeepImage(int subimage, int miplevel) throws IOException;
}
