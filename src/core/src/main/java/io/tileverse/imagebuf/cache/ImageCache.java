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

import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import io.tileverse.imagebuf.spec.Roi;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * A shared cache of image tiles, addressed by image name.
 * <p>
 * The cache opens images on demand, describes them both as found in the file ({@code nativeSpec == true}) and as
 * stored in the cache (tile layout and {@link #CACHED_PIXEL_TYPE stored pixel type}), and serves pixels either a
 * tile at a time or as bulk regions converted to a requested format.
 * <p>
 * Every failure is an {@link IOException} whose message describes the problem; callers that keep an error log
 * record that message verbatim.
 * <p>
 * Implementations must be thread-safe.
 */
public interface ImageCache extends Closeable {

    /** {@link #imageInfo} key: number of subimages, an {@code Integer}. */
    String SUBIMAGES = "subimages";
    /** {@link #imageInfo} key: number of miplevels of the subimage, an {@code Integer}. */
    String MIPLEVELS = "miplevels";
    /** {@link #imageInfo} key: id of the file format, a {@code String}. */
    String FILE_FORMAT = "fileformat";
    /** {@link #imageInfo} key: the {@link PixelType} tiles of the subimage are stored as. */
    String CACHED_PIXEL_TYPE = "cachedpixeltype";

    /** Cache attribute: {@code 1} if readers are asked to keep alpha unassociated. */
    String ATTR_UNASSOCIATED_ALPHA = "unassociatedalpha";
    /** Cache attribute: {@code 1} if every tile is stored as float. */
    String ATTR_FORCE_FLOAT = "forcefloat";
    /** Cache attribute: tile size used for untiled files, {@code 0} for one tile per image. */
    String ATTR_AUTOTILE = "autotile";

    /**
     * @param nativeSpec {@code true} for the spec as found in the file, {@code false} for the spec of the cached
     *     representation
     * @return a copy of the spec
     */
    ImageSpec imageSpec(String name, int subimage, int miplevel, boolean nativeSpec) throws IOException;

    /**
     * Named scalar metadata about an image, see {@link #SUBIMAGES}, {@link #MIPLEVELS}, {@link #FILE_FORMAT} and
     * {@link #CACHED_PIXEL_TYPE}.
     *
     * @return the value, empty for unknown keys
     */
    Optional<Object> imageInfo(String name, int subimage, int miplevel, String key) throws IOException;

    default int subimages(String name) throws IOException {
        return imageInfo(name, 0, 0, SUBIMAGES).map(v -> ((Number) v).intValue()).orElse(0);
    }

    default int miplevels(String name, int subimage) throws IOException {
        return imageInfo(name, subimage, 0, MIPLEVELS)
                .map(v -> ((Number) v).intValue())
                .orElse(0);
    }

    default String fileFormat(String name) throws IOException {
        return imageInfo(name, 0, 0, FILE_FORMAT).map(String::valueOf).orElse("");
    }

    default PixelType cachedPixelType(String name, int subimage, int miplevel) throws IOException {
        return imageInfo(name, subimage, miplevel, CACHED_PIXEL_TYPE)
                .map(PixelType.class::cast)
                .orElse(PixelType.UNKNOWN);
    }

    /**
     * Copies a region into {@code result}, converted to {@code format}, contiguous, starting at the buffer's
     * current position, in the buffer's byte order. Pixels of the region outside the data window are zero.
     */
    void getPixels(String name, int subimage, int miplevel, Roi roi, PixelType format, ByteBuffer result)
            throws IOException;

    /**
     * Returns the tile containing pixel {@code (x,y,z)}, which must lie within the data window. The caller owns a
     * reference to the tile until it calls {@link #releaseTile(Tile)}.
     */
    Tile getTile(String name, int subimage, int miplevel, int x, int y, int z) throws IOException;

    void releaseTile(Tile tile);

    /**
     * Drops everything cached about {@code name}, so the next access reopens it.
     *
     * @param force drop the entry even if the file appears unchanged
     */
    void invalidate(String name, boolean force);

    /**
     * Registers read overrides for {@code name}, used the next time the image is opened.
     *
     * @param config the overrides, {@code null} to clear them
     * @param replace whether to replace overrides already registered
     */
    void addFile(String name, ImageSpec config, boolean replace);

    /** @return a cache wide attribute, see the {@code ATTR_*} constants */
    Optional<Object> getAttribute(String name);

    @Override
    default void close() throws IOException {
        // nothing to release by default
    }
}
