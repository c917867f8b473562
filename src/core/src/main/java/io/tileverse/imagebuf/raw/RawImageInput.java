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
import io.tileverse.imagebuf.spi.ImageInput;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code ibuf} files.
 * <p>
 * The record index is built once when the file is opened; pixel reads use position-based channel reads and
 * therefore do not disturb each other, but the current subimage is shared state.
 */
public class RawImageInput implements ImageInput {

    private static final Logger logger = LoggerFactory.getLogger(RawImageInput.class);

    private record Entry(ImageSpec spec, long dataOffset, long dataLength) {}

    private final Path path;
    private final FileChannel channel;
    private final List<List<Entry>> subimages;

    private int subimage;
    private int miplevel;

    public RawImageInput(Path path) throws IOException {
        this.path = Objects.requireNonNull(path, "Path cannot be null");
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            this.subimages = index();
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
        if (subimages.isEmpty() || subimages.get(0).isEmpty()) {
            channel.close();
            throw new IOException("ibuf file " + path + " contains no images");
        }
    }

    private List<List<Entry>> index() throws IOException {
        final long size = channel.size();
        DataInputStream in = new DataInputStream(Channels.newInputStream(channel));
        channel.position(0);
        try {
            if (in.readInt() != RawFormat.MAGIC) {
                throw new IOException("\"" + path + "\" is not an ibuf file");
            }
            int version = in.readInt();
            if (version > RawFormat.VERSION) {
                throw new IOException("Unsupported ibuf version " + version + " in " + path);
            }
            List<List<Entry>> records = new ArrayList<>();
            while (channel.position() < size) {
                int sub = in.readInt();
                int mip = in.readInt();
                ImageSpec spec = RawFormat.readSpec(in);
                long length = in.readLong();
                long offset = channel.position();
                if (sub != records.size() - 1 && sub != records.size()) {
                    throw new IOException("Corrupt ibuf file " + path + ": subimage " + sub + " out of order");
                }
                if (sub == records.size()) {
                    records.add(new ArrayList<>());
                }
                if (mip != records.get(sub).size()) {
                    throw new IOException("Corrupt ibuf file " + path + ": miplevel " + mip + " out of order");
                }
                if (length < 0 || offset + length > size) {
                    throw new IOException("Truncated ibuf file " + path);
                }
                records.get(sub).add(new Entry(spec, offset, length));
                channel.position(offset + length);
            }
            logger.trace("Indexed {}: {} subimage(s)", path, records.size());
            return records;
        } catch (EOFException e) {
            throw new IOException("Truncated ibuf file " + path, e);
        }
    }

    @Override
    public String formatName() {
        return RawImageFormatProvider.ID;
    }

    @Override
    public String name() {
        return path.toString();
    }

    @Override
    public int subimages() {
        return subimages.size();
    }

    @Override
    public int miplevels(int subimage) {
        return subimage >= 0 && subimage < subimages.size() ? subimages.get(subimage).size() : 0;
    }

    @Override
    public int currentSubimage() {
        return subimage;
    }

    @Override
    public int currentMiplevel() {
        return miplevel;
    }

    @Override
    public ImageSpec spec() {
        return current().spec();
    }

    @Override
    public ImageSpec seekSubimage(int subimage, int miplevel) throws IOException {
        if (miplevels(subimage) <= miplevel || miplevel < 0) {
            throw new IOException(
                    "%s does not have subimage %d, miplevel %d".formatted(path, subimage, miplevel));
        }
        this.subimage = subimage;
        this.miplevel = miplevel;
        return current().spec().copy();
    }

    private Entry current() {
        return subimages.get(subimage).get(miplevel);
    }

    @Override
    public void readRegion(Roi roi, PixelType format, ByteBuffer data) throws IOException {
        final Entry entry = current();
        final ImageSpec spec = entry.spec();
        if (spec.deep()) {
            throw new IOException("Cannot read raster pixels from deep image " + path);
        }
        if (!spec.roi().contains(roi) || roi.nchannels() <= 0) {
            throw new IOException("Region " + roi + " is outside of " + path + " data window " + spec.roi());
        }
        final PixelType fmt = format == PixelType.UNKNOWN ? spec.format() : format;
        final int[] offsets = RawFormat.channelOffsets(spec);
        final int filePixel = offsets[spec.nchannels()];
        final int outPixel = fmt.size() * roi.nchannels();
        final ByteBuffer row = ByteBuffer.allocate(filePixel * roi.width()).order(RawFormat.DATA_ORDER);
        int out = data.position();
        for (int z = roi.zbegin(); z < roi.zend(); z++) {
            for (int y = roi.ybegin(); y < roi.yend(); y++) {
                long pixel = ((long) (z - spec.z()) * spec.height() + (y - spec.y())) * spec.width()
                        + (roi.xbegin() - spec.x());
                readFully(row.clear(), entry.dataOffset() + pixel * filePixel);
                for (int x = 0; x < roi.width(); x++) {
                    for (int c = roi.chbegin(); c < roi.chend(); c++) {
                        PixelType.convert(
                                row,
                                x * filePixel + offsets[c],
                                spec.channelFormat(c),
                                data,
                                out + (c - roi.chbegin()) * fmt.size(),
                                fmt);
                    }
                    out += outPixel;
                }
            }
        }
    }

    @Override
    public DeepData readNativeDeepImage(int subimage, int miplevel) throws IOException {
        seekSubimage(subimage, miplevel);
        final Entry entry = current();
        final ImageSpec spec = entry.spec();
        if (!spec.deep()) {
            throw new IOException(path + " subimage " + subimage + " is not a deep image");
        }
        if (entry.dataLength() > Integer.MAX_VALUE) {
            throw new IOException("Deep image too large: " + entry.dataLength() + " bytes");
        }
        ByteBuffer buf = ByteBuffer.allocate((int) entry.dataLength()).order(RawFormat.DATA_ORDER);
        readFully(buf, entry.dataOffset());
        buf.flip();

        DeepData deep = new DeepData();
        deep.init(spec);
        final int nchannels = spec.nchannels();
        try {
            for (long p = 0; p < deep.pixels(); p++) {
                int nsamples = buf.getInt();
                deep.setSamples(p, nsamples);
                for (int s = 0; s < nsamples; s++) {
                    for (int c = 0; c < nchannels; c++) {
                        deep.setDeepValueDouble(p, c, s, readSample(buf, spec.channelFormat(c)));
                    }
                }
            }
        } catch (BufferUnderflowException e) {
            throw new IOException("Truncated deep data in " + path, e);
        }
        return deep;
    }

    private static double readSample(ByteBuffer buf, PixelType type) {
        return switch (type) {
            case UINT8 -> buf.get() & 0xff;
            case INT8 -> buf.get();
            case UINT16 -> buf.getShort() & 0xffff;
            case INT16 -> buf.getShort();
            case UINT32 -> buf.getInt() & 0xffffffffL;
            case INT32 -> buf.getInt();
            case UINT64, INT64 -> buf.getLong();
            case HALF -> HalfFloat.toFloat(buf.getShort());
            case FLOAT -> buf.getFloat();
            case DOUBLE -> buf.getDouble();
            case UNKNOWN -> 0;
        };
    }

    private void readFully(ByteBuffer target, long offset) throws IOException {
        long position = offset;
        while (target.hasRemaining()) {
            int read = channel.read(target, position);
            if (read == -1) {
                throw new EOFException("Unexpected end of file reading " + path);
            }
            position += read;
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    @Override
    public String toString() {
        return "RawImageInput[" + path + "]";
    }
}
