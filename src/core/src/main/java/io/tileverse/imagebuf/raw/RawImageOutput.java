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
package io.tileverse.imagebuf.raw;

import io.tileverse.imagebuf.deep.DeepData;
import io.tileverse.imagebuf.spec.HalfFloat;
import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import io.tileverse.imagebuf.spec.Roi;
import io.tileverse.imagebuf.spi.ImageOutput;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@code ibuf} files.
 * <p>
 * Opening an image writes its record header and reserves its raster data, so regions can be written in any order.
 * Deep images are written in one call with {@link #writeDeepImage(DeepData)}.
 */
public class RawImageOutput implements ImageOutput {

    private static final Logger logger = LoggerFactory.getLogger(RawImageOutput.class);

    private static final Set<String> FEATURES =
            Set.of(FEATURE_TILES, FEATURE_MULTIIMAGE, FEATURE_MIPMAP, FEATURE_DEEPDATA, FEATURE_RANDOM_ACCESS);

    private Path path;
    private FileChannel channel;
    private ImageSpec spec;
    private int subimage = -1;
    private int miplevel = -1;
    private long lengthOffset;
    private long dataOffset;
    private long recordEnd;

    @Override
    public String formatName() {
        return RawImageFormatProvider.ID;
    }

    @Override
    public boolean supports(String feature) {
        return FEATURES.contains(feature);
    }

    @Override
    public void open(Path path, ImageSpec spec, OpenMode mode) throws IOException {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(spec, "spec");
        if (spec.nchannels() <= 0 || spec.format() == PixelType.UNKNOWN) {
            throw new IOException("Cannot write " + path + ": spec has no channels or no format");
        }
        switch (mode) {
            case CREATE -> {
                close();
                this.path = path;
                this.channel = FileChannel.open(
                        path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                ByteBuffer magic = ByteBuffer.allocate(8).putInt(RawFormat.MAGIC).putInt(RawFormat.VERSION);
                writeFully(magic.flip(), 0);
                recordEnd = 8;
                subimage = 0;
                miplevel = 0;
            }
            case APPEND_SUBIMAGE -> {
                requireOpen(path);
                subimage++;
                miplevel = 0;
            }
            case APPEND_MIPLEVEL -> {
                requireOpen(path);
                miplevel++;
            }
        }
        this.spec = spec.copy();
        writeHeader();
        logger.debug("Opened {} subimage {} miplevel {}: {}", path, subimage, miplevel, spec);
    }

    private void requireOpen(Path path) throws IOException {
        if (channel == null || !channel.isOpen() || !path.equals(this.path)) {
            throw new IOException("Cannot append to " + path + ", it is not open for writing");
        }
    }

    private void writeHeader() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(subimage);
            out.writeInt(miplevel);
            RawFormat.writeSpec(out, spec);
            out.writeLong(0L);
        }
        byte[] header = bytes.toByteArray();
        writeFully(ByteBuffer.wrap(header), recordEnd);
        lengthOffset = recordEnd + header.length - Long.BYTES;
        dataOffset = recordEnd + header.length;
        recordEnd = dataOffset;
        if (!spec.deep()) {
            long length = spec.imagePixels() * RawFormat.channelOffsets(spec)[spec.nchannels()];
            setDataLength(length);
            if (length > 0) {
                // reserve the raster, unwritten regions read back as zeros
                writeFully(ByteBuffer.allocate(1), dataOffset + length - 1);
            }
        }
    }

    private void setDataLength(long length) throws IOException {
        writeFully(ByteBuffer.allocate(Long.BYTES).putLong(length).flip(), lengthOffset);
        recordEnd = dataOffset + length;
    }

    @Override
    public ImageSpec spec() {
        return spec;
    }

    @Override
    public void writeRegion(Roi roi, PixelType format, ByteBuffer data) throws IOException {
        checkOpen();
        if (spec.deep()) {
            throw new IOException("Cannot write raster pixels to deep image " + path);
        }
        Roi region = roi.withChannels(0, spec.nchannels());
        if (!spec.roi().contains(region) || region.isEmpty()) {
            throw new IOException("Region " + roi + " is outside of the data window " + spec.roi());
        }
        final PixelType fmt = format == PixelType.UNKNOWN ? spec.format() : format;
        final int[] offsets = RawFormat.channelOffsets(spec);
        final int filePixel = offsets[spec.nchannels()];
        final int inPixel = fmt.size() * spec.nchannels();
        final ByteBuffer row = ByteBuffer.allocate(filePixel * region.width()).order(RawFormat.DATA_ORDER);
        int in = data.position();
        for (int z = region.zbegin(); z < region.zend(); z++) {
            for (int y = region.ybegin(); y < region.yend(); y++) {
                row.clear();
                for (int x = 0; x < region.width(); x++) {
                    for (int c = 0; c < spec.nchannels(); c++) {
                        PixelType.convert(
                                data, in + c * fmt.size(), fmt, row, x * filePixel + offsets[c], spec.channelFormat(c));
                    }
                    in += inPixel;
                }
                long pixel = ((long) (z - spec.z()) * spec.height() + (y - spec.y())) * spec.width()
                        + (region.xbegin() - spec.x());
                writeFully(row, dataOffset + pixel * filePixel);
            }
        }
    }

    @Override
    public void writeDeepImage(DeepData deep) throws IOException {
        checkOpen();
        if (!spec.deep()) {
            throw new IOException("Cannot write deep data to non-deep image " + path);
        }
        if (deep.pixels() != spec.imagePixels() || deep.channels() != spec.nchannels()) {
            throw new IOException("Deep data layout does not match the spec of " + path);
        }
        final int[] offsets = RawFormat.channelOffsets(spec);
        long size = 0;
        for (long p = 0; p < deep.pixels(); p++) {
            size += Integer.BYTES + (long) deep.samples(p) * offsets[spec.nchannels()];
        }
        if (size > Integer.MAX_VALUE) {
            throw new IOException("Deep image too large: " + size + " bytes");
        }
        ByteBuffer buf = ByteBuffer.allocate((int) size).order(RawFormat.DATA_ORDER);
        for (long p = 0; p < deep.pixels(); p++) {
            int nsamples = deep.samples(p);
            buf.putInt(nsamples);
            for (int s = 0; s < nsamples; s++) {
                for (int c = 0; c < spec.nchannels(); c++) {
                    writeSample(buf, spec.channelFormat(c), deep.deepValueDouble(p, c, s));
                }
            }
        }
        writeFully(buf.flip(), dataOffset);
        setDataLength(size);
    }

    private static void writeSample(ByteBuffer buf, PixelType type, double v) {
        switch (type) {
            case UINT8, INT8 -> buf.put((byte) (long) v);
            case UINT16, INT16 -> buf.putShort((short) (long) v);
            case UINT32, INT32 -> buf.putInt((int) (long) v);
            case UINT64, INT64 -> buf.putLong((long) v);
            case HALF -> buf.putShort(HalfFloat.fromFloat((float) v));
            case FLOAT -> buf.putFloat((float) v);
            case DOUBLE -> buf.putDouble(v);
            case UNKNOWN -> {
                // no bytes
            }
        }
    }

    private void checkOpen() throws IOException {
        if (channel == null || !channel.isOpen()) {
            throw new IOException("ImageOutput is not open");
        }
    }

    private void writeFully(ByteBuffer source, long offset) throws IOException {
        long position = offset;
        while (source.hasRemaining()) {
            position += channel.write(source, position);
        }
    }

    @Override
    public void close() throws IOException {
        if (channel != null) {
            channel.close();
            channel = null;
            logger.trace("Closed {}", path);
        }
    }
}
