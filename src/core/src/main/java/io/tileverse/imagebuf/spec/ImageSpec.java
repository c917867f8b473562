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
package io.tileverse.imagebuf.spec;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Describes an image: data window, full (display) window, tiling, channels, pixel format and arbitrary named
 * metadata.
 * <p>
 * {@code ImageSpec} is a mutable value. Accessors follow a fluent style, {@code width()} reads and
 * {@code width(int)} writes and returns {@code this}. Use {@link #copy()} to obtain an independent instance;
 * every component that stores a spec handed to it by a caller stores a copy.
 * <p>
 * The data window is {@code [x, x+width) x [y, y+height) x [z, z+depth)}. The full window describes the display
 * extent and is what wrap modes refer to. A tile width of {@code 0} means the image is not tiled.
 * <p>
 * {@link #format()} is the in-memory format of every channel. {@link #channelFormats()} optionally records
 * per-channel formats as found in a file; it is empty when all channels share {@link #format()}.
 */
public class ImageSpec {

    /** Attribute holding the pixel aspect ratio as a {@code Float}. */
    public static final String PIXEL_ASPECT_RATIO = "PixelAspectRatio";

    /** Attribute holding the orientation (1..8, EXIF convention) as an {@code Integer}. */
    public static final String ORIENTATION = "Orientation";

    /** Config attribute: when {@code 1}, readers leave alpha unassociated. */
    public static final String UNASSOCIATED_ALPHA = "UnassociatedAlpha";

    private int x, y, z;
    private int width, height, depth = 1;
    private int fullX, fullY, fullZ;
    private int fullWidth, fullHeight, fullDepth = 1;
    private int tileWidth, tileHeight, tileDepth = 1;
    private int nchannels;
    private PixelType format = PixelType.UNKNOWN;
    private List<PixelType> channelFormats = List.of();
    private List<String> channelNames = List.of();
    private int alphaChannel = -1;
    private int zChannel = -1;
    private boolean deep;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    /** Creates an empty spec with an unknown format. */
    public ImageSpec() {
        // empty
    }

    /**
     * Creates a 2D spec with origin {@code (0,0)}, a full window equal to the data window and default channel
     * names.
     */
    public ImageSpec(int width, int height, int nchannels, PixelType format) {
        this.width = width;
        this.height = height;
        this.fullWidth = width;
        this.fullHeight = height;
        this.nchannels = nchannels;
        this.format = requireNonNull(format, "format");
        defaultChannelNames();
    }

    /** Copy constructor. */
    public ImageSpec(ImageSpec other) {
        requireNonNull(other, "other");
        this.x = other.x;
        this.y = other.y;
        this.z = other.z;
        this.width = other.width;
        this.height = other.height;
        this.depth = other.depth;
        this.fullX = other.fullX;
        this.fullY = other.fullY;
        this.fullZ = other.fullZ;
        this.fullWidth = other.fullWidth;
        this.fullHeight = other.fullHeight;
        this.fullDepth = other.fullDepth;
        this.tileWidth = other.tileWidth;
        this.tileHeight = other.tileHeight;
        this.tileDepth = other.tileDepth;
        this.nchannels = other.nchannels;
        this.format = other.format;
        this.channelFormats = other.channelFormats;
        this.channelNames = other.channelNames;
        this.alphaChannel = other.alphaChannel;
        this.zChannel = other.zChannel;
        this.deep = other.deep;
        this.attributes.putAll(other.attributes);
    }

    public ImageSpec copy() {
        return new ImageSpec(this);
    }

    public int x() {
        return x;
    }

    public ImageSpec x(int x) {
        this.x = x;
        return this;
    }

    public int y() {
        return y;
    }

    public ImageSpec y(int y) {
        this.y = y;
        return this;
    }

    public int z() {
        return z;
    }

    public ImageSpec z(int z) {
        this.z = z;
        return this;
    }

    public int width() {
        return width;
    }

    public ImageSpec width(int width) {
        this.width = width;
        return this;
    }

    public int height() {
        return height;
    }

    public ImageSpec height(int height) {
        this.height = height;
        return this;
    }

    public int depth() {
        return depth;
    }

    public ImageSpec depth(int depth) {
        this.depth = depth;
        return this;
    }

    public int fullX() {
        return fullX;
    }

    public ImageSpec fullX(int fullX) {
        this.fullX = fullX;
        return this;
    }

    public int fullY() {
        return fullY;
    }

    public ImageSpec fullY(int fullY) {
        this.fullY = fullY;
        return this;
    }

    public int fullZ() {
        return fullZ;
    }

    public ImageSpec fullZ(int fullZ) {
        this.fullZ = fullZ;
        return this;
    }

    public int fullWidth() {
        return fullWidth;
    }

    public ImageSpec fullWidth(int fullWidth) {
        this.fullWidth = fullWidth;
        return this;
    }

    public int fullHeight() {
        return fullHeight;
    }

    public ImageSpec fullHeight(int fullHeight) {
        this.fullHeight = fullHeight;
        return this;
    }

    public int fullDepth() {
        return fullDepth;
    }

    public ImageSpec fullDepth(int fullDepth) {
        this.fullDepth = fullDepth;
        return this;
    }

    public int tileWidth() {
        return tileWidth;
    }

    public ImageSpec tileWidth(int tileWidth) {
        this.tileWidth = tileWidth;
        return this;
    }

    public int tileHeight() {
        return tileHeight;
    }

    public ImageSpec tileHeight(int tileHeight) {
        this.tileHeight = tileHeight;
        return this;
    }

    public int tileDepth() {
        return tileDepth;
    }

    public ImageSpec tileDepth(int tileDepth) {
        this.tileDepth = tileDepth;
        return this;
    }

    /** Sets all three tile dimensions, a width of {@code 0} meaning untiled. */
    public ImageSpec tileSize(int tileWidth, int tileHeight, int tileDepth) {
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.tileDepth = tileDepth;
        return this;
    }

    public boolean isTiled() {
        return tileWidth > 0 && tileHeight > 0;
    }

    public int nchannels() {
        return nchannels;
    }

    /**
     * Sets the channel count. Channel names and per-channel formats are truncated or extended with defaults to
     * match.
     */
    public ImageSpec nchannels(int nchannels) {
        this.nchannels = nchannels;
        if (channelNames.size() != nchannels) {
            List<String> names = new ArrayList<>(channelNames.subList(0, Math.min(nchannels, channelNames.size())));
            for (int c = names.size(); c < nchannels; c++) {
                names.add("channel" + c);
            }
            this.channelNames = List.copyOf(names);
        }
        if (!channelFormats.isEmpty() && channelFormats.size() != nchannels) {
            List<PixelType> formats =
                    new ArrayList<>(channelFormats.subList(0, Math.min(nchannels, channelFormats.size())));
            while (formats.size() < nchannels) {
                formats.add(format);
            }
            this.channelFormats = List.copyOf(formats);
        }
        if (alphaChannel >= nchannels) {
            alphaChannel = -1;
        }
        if (zChannel >= nchannels) {
            zChannel = -1;
        }
        return this;
    }

    public PixelType format() {
        return format;
    }

    /** Sets the format shared by all channels, discarding any per-channel formats. */
    public ImageSpec format(PixelType format) {
        this.format = requireNonNull(format, "format");
        this.channelFormats = List.of();
        return this;
    }

    /** @return per-channel formats, empty if all channels use {@link #format()} */
    public List<PixelType> channelFormats() {
        return channelFormats;
    }

    public ImageSpec channelFormats(List<PixelType> channelFormats) {
        this.channelFormats = channelFormats == null ? List.of() : List.copyOf(channelFormats);
        return this;
    }

    public PixelType channelFormat(int channel) {
        if (channel >= 0 && channel < channelFormats.size()) {
            return channelFormats.get(channel);
        }
        return format;
    }

    public List<String> channelNames() {
        return channelNames;
    }

    public ImageSpec channelNames(List<String> channelNames) {
        this.channelNames = channelNames == null ? List.of() : List.copyOf(channelNames);
        return this;
    }

    public String channelName(int channel) {
        return channel >= 0 && channel < channelNames.size() ? channelNames.get(channel) : "";
    }

    public int channelIndex(String name) {
        return channelNames.indexOf(name);
    }

    /**
     * Names channels {@code R, G, B, A, channel4, ...}, or {@code Y} for a single channel image, and marks
     * channel 3 as alpha when present.
     */
    public ImageSpec defaultChannelNames() {
        alphaChannel = -1;
        zChannel = -1;
        if (nchannels == 1) {
            channelNames = List.of("Y");
            return this;
        }
        List<String> names = new ArrayList<>(nchannels);
        String[] rgba = {"R", "G", "B", "A"};
        for (int c = 0; c < nchannels; c++) {
            names.add(c < rgba.length ? rgba[c] : "channel" + c);
        }
        if (nchannels >= 4) {
            alphaChannel = 3;
        }
        channelNames = List.copyOf(names);
        return this;
    }

    public int alphaChannel() {
        return alphaChannel;
    }

    public ImageSpec alphaChannel(int alphaChannel) {
        this.alphaChannel = alphaChannel;
        return this;
    }

    public int zChannel() {
        return zChannel;
    }

    public ImageSpec zChannel(int zChannel) {
        this.zChannel = zChannel;
        return this;
    }

    public boolean deep() {
        return deep;
    }

    public ImageSpec deep(boolean deep) {
        this.deep = deep;
        return this;
    }

    /** @return bytes per channel value in {@link #format()} */
    public int channelBytes() {
        return format.size();
    }

    /** @return bytes per pixel in {@link #format()} */
    public int pixelBytes() {
        return nchannels * format.size();
    }

    /**
     * @param nativeFormats whether to size channels by {@link #channelFormats()} rather than {@link #format()}
     * @return bytes per pixel
     */
    public int pixelBytes(boolean nativeFormats) {
        if (!nativeFormats || channelFormats.isEmpty()) {
            return pixelBytes();
        }
        int bytes = 0;
        for (int c = 0; c < nchannels; c++) {
            bytes += channelFormat(c).size();
        }
        return bytes;
    }

    public long scanlineBytes() {
        return (long) pixelBytes() * Math.max(0, width);
    }

    public long tileBytes() {
        return (long) pixelBytes() * Math.max(0, tileWidth) * Math.max(0, tileHeight) * Math.max(1, tileDepth);
    }

    public long imagePixels() {
        return (long) Math.max(0, width) * Math.max(0, height) * Math.max(0, depth);
    }

    public long imageBytes() {
        return imagePixels() * pixelBytes();
    }

    /** @return the data window with all channels */
    public Roi roi() {
        return Roi.of(x, x + width, y, y + height, z, z + depth, 0, nchannels);
    }

    /** Sets the data window from the spatial extent of {@code roi}. */
    public ImageSpec roi(Roi roi) {
        this.x = roi.xbegin();
        this.y = roi.ybegin();
        this.z = roi.zbegin();
        this.width = roi.width();
        this.height = roi.height();
        this.depth = roi.depth();
        return this;
    }

    /** @return the full (display) window with all channels */
    public Roi roiFull() {
        return Roi.of(fullX, fullX + fullWidth, fullY, fullY + fullHeight, fullZ, fullZ + fullDepth, 0, nchannels);
    }

    /** Sets the full window from the spatial extent of {@code roi}. */
    public ImageSpec roiFull(Roi roi) {
        this.fullX = roi.xbegin();
        this.fullY = roi.ybegin();
        this.fullZ = roi.zbegin();
        this.fullWidth = roi.width();
        this.fullHeight = roi.height();
        this.fullDepth = roi.depth();
        return this;
    }

    /**
     * Sets or replaces a named attribute. A {@code null} value removes it.
     */
    public ImageSpec attribute(String name, Object value) {
        requireNonNull(name, "name");
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
        return this;
    }

    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public int getIntAttribute(String name, int defaultValue) {
        Object v = attributes.get(name);
        if (v instanceof Number n) {
            return n.intValue();
        }
        if (v instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public float getFloatAttribute(String name, float defaultValue) {
        Object v = attributes.get(name);
        if (v instanceof Number n) {
            return n.floatValue();
        }
        if (v instanceof String s) {
            try {
                return Float.parseFloat(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public String getStringAttribute(String name, String defaultValue) {
        Object v = attributes.get(name);
        return v == null ? defaultValue : String.valueOf(v);
    }

    public ImageSpec removeAttribute(String name) {
        attributes.remove(name);
        return this;
    }

    /** @return an unmodifiable view of the attributes in insertion order */
    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String toString() {
        return "ImageSpec[%dx%dx%d @ (%d,%d,%d), full %dx%dx%d @ (%d,%d,%d), tile %dx%dx%d, %d ch %s%s]"
                .formatted(
                        width,
                        height,
                        depth,
                        x,
                        y,
                        z,
                        fullWidth,
                        fullHeight,
                        fullDepth,
                        fullX,
                        fullY,
                        fullZ,
                        tileWidth,
                        tileHeight,
                        tileDepth,
                        nchannels,
                        format.typeName(),
                        deep ? ", deep" : "");
    }
}
