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
import io.tileverse.imagebuf.cache.Tile;
import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Positions on single pixels of an {@link ImageBuf} and exposes the bytes of the pixel it points at.
 * <p>
 * For local pixels the cursor addresses the buffer's memory directly. For cache backed buffers it holds at most
 * one {@link Tile} reference, kept while consecutive lookups fall in the same tile and released when the cursor
 * moves to another tile or is {@link #close() closed}. Lookups that end up outside the data window, or fail,
 * point at the buffer's black pixel.
 * <p>
 * A cursor is meant for a single thread.
 */
public final class TileCursor implements AutoCloseable {

    private final DefaultImageBuf buf;
    private final ImageSpec spec;
    private final PixelType format;
    private final int channelBytes;
    private final ByteBuffer black;
    private final int[] xyz = new int[3];

    private Tile tile;
    private ByteBuffer data;
    private int offset;

    TileCursor(DefaultImageBuf buf) {
        this.buf = buf;
        this.spec = buf.spec();
        this.format = spec.format();
        this.channelBytes = buf.channelBytes();
        this.black = buf.blackPixel();
        this.data = black;
    }

    /**
     * Points the cursor at a pixel.
     *
     * @return {@code true} if the cursor points at a pixel of the image, {@code false} if it points at black
     */
    public boolean seek(int x, int y, int z, WrapMode wrap) {
        if (!spec.roi().contains(x, y, z)) {
            xyz[0] = x;
            xyz[1] = y;
            xyz[2] = z;
            if (!buf.wrap(xyz, wrap)) {
                return pointAtBlack();
            }
            x = xyz[0];
            y = xyz[1];
            z = xyz[2];
        }
        ByteBuffer local = buf.pixels();
        if (local != null) {
            data = local;
            offset = buf.pixelOffset(x, y, z);
            return true;
        }
        ImageCache cache = buf.imageCache();
        if (cache == null || buf.storage() != Storage.IMAGE_CACHE) {
            return pointAtBlack();
        }
        if (tile == null || !tile.contains(x, y, z)) {
            release();
            try {
                tile = cache.getTile(buf.cacheName(), buf.subimage(), buf.miplevel(), x, y, z);
            } catch (IOException e) {
                String message = e.getMessage();
                buf.error(message == null || message.isEmpty() ? "unspecified ImageCache error" : message);
                return pointAtBlack();
            }
        }
        data = tile.pixels();
        offset = tile.offset(x, y, z);
        return true;
    }

    private boolean pointAtBlack() {
        data = black;
        offset = 0;
        return false;
    }

    /** @return bytes holding the current pixel, native byte order; do not modify */
    public ByteBuffer data() {
        return data;
    }

    /** @return index of the current pixel's first byte in {@link #data()} */
    public int offset() {
        return offset;
    }

    /** @return whether a cache tile is currently held */
    public boolean holdsTile() {
        return tile != null;
    }

    /** @return channel {@code c} of the current pixel as a float, {@code 0} for black */
    public float channel(int c) {
        if (data == black) {
            return 0f;
        }
        return format.get(data, offset + c * channelBytes);
    }

    private void release() {
        if (tile != null) {
            buf.imageCache().releaseTile(tile);
            tile = null;
        }
    }

    @Override
    public void close() {
        release();
        data = black;
        offset = 0;
    }
}
