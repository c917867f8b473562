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

import io.tileverse.imagebuf.spec.PixelType;
import java.nio.ByteBuffer;

/**
 * A block of pixels handed out by an {@link ImageCache}.
 * <p>
 * The tile covers {@code [xbegin, xbegin+width) x [ybegin, ybegin+height) x [zbegin, zbegin+depth)} of the image
 * grid. Its {@link #pixels() pixel buffer} always holds a full tile in {@link #format()}, all channels
 * interleaved, in native byte order; parts of edge tiles beyond the data window are zero.
 * <p>
 * A tile obtained from {@link ImageCache#getTile} must be handed back with {@link ImageCache#releaseTile(Tile)}.
 */
public interface Tile {

    int xbegin();

    int ybegin();

    int zbegin();

    int width();

    int height();

    int depth();

    int nchannels();

    PixelType format();

    /** @return read-only, native order view of the tile pixels; use absolute access only */
    ByteBuffer pixels();

    default int pixelBytes() {
        return nchannels() * format().size();
    }

    default boolean contains(int x, int y, int z) {
        return x >= xbegin()
                && x < xbegin() + width()
                && y >= ybegin()
                && y < ybegin() + height()
                && z >= zbegin()
                && z < zbegin() + depth();
    }

    /** @return byte offset of pixel {@code (x,y,z)} within {@link #pixels()} */
    default int offset(int x, int y, int z) {
        return (((z - zbegin()) * height() + (y - ybegin())) * width() + (x - xbegin())) * pixelBytes();
    }
}
