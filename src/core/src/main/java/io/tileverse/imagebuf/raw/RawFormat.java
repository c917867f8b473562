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

import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Layout of the {@code ibuf} container.
 *
 * <pre>
 * file    := MAGIC:int VERSION:int record*
 * record  := subimage:int miplevel:int spec dataLength:long data[dataLength]
 * spec    := geometry:int[15] nchannels:int format:byte
 *            nchannelformats:int format:byte* channelnames:utf* alpha:int z:int deep:bool
 *            nattributes:int (name:utf tag:byte value)*
 * raster  := pixels in scanline order, channels interleaved, each channel in its own format
 * deep    := per pixel: nsamples:int then nsamples x nchannels values
 * </pre>
 *
 * Headers are big endian, pixel and sample data little endian.
 */
final class RawFormat {

    static final int MAGIC = 0x49425546; // "IBUF"
    static final int VERSION = 1;
    static final ByteOrder DATA_ORDER = ByteOrder.LITTLE_ENDIAN;

    private static final PixelType[] TYPES = PixelType.values();

    private RawFormat() {
        // constants and codec
    }

    static void writeSpec(DataOutput out, ImageSpec spec) throws IOException {
        int[] geometry = {
            spec.x(), spec.y(), spec.z(), spec.width(), spec.height(), spec.depth(),
            spec.fullX(), spec.fullY(), spec.fullZ(), spec.fullWidth(), spec.fullHeight(), spec.fullDepth(),
            spec.tileWidth(), spec.tileHeight(), spec.tileDepth()
        };
        for (int v : geometry) {
            out.writeInt(v);
        }
        out.writeInt(spec.nchannels());
        out.writeByte(spec.format().ordinal());
        out.writeInt(spec.channelFormats().size());
        for (PixelType t : spec.channelFormats()) {
            out.writeByte(t.ordinal());
        }
        for (int c = 0; c < spec.nchannels(); c++) {
            out.writeUTF(spec.channelName(c));
        }
        out.writeInt(spec.alphaChannel());
        out.writeInt(spec.zChannel());
        out.writeBoolean(spec.deep());

        Map<String, Object> attributes = spec.attributes();
        out.writeInt(attributes.size());
        for (Map.Entry<String, Object> e : attributes.entrySet()) {
            out.writeUTF(e.getKey());
            Object v = e.getValue();
            if (v instanceof Integer i) {
                out.writeByte('I');
                out.writeInt(i);
            } else if (v instanceof Long l) {
                out.writeByte('L');
                out.writeLong(l);
            } else if (v instanceof Float f) {
                out.writeByte('F');
                out.writeFloat(f);
            } else if (v instanceof Double d) {
                out.writeByte('D');
                out.writeDouble(d);
            } else {
                out.writeByte('S');
                out.writeUTF(String.valueOf(v));
            }
        }
    }

    static ImageSpec readSpec(DataInput in) throws IOException {
        ImageSpec spec = new ImageSpec();
        spec.x(in.readInt()).y(in.readInt()).z(in.readInt());
        spec.width(in.readInt()).height(in.readInt()).depth(in.readInt());
        spec.fullX(in.readInt()).fullY(in.readInt()).fullZ(in.readInt());
        spec.fullWidth(in.readInt()).fullHeight(in.readInt()).fullDepth(in.readInt());
        spec.tileSize(in.readInt(), in.readInt(), in.readInt());
        int nchannels = in.readInt();
        if (nchannels < 0) {
            throw new IOException("Corrupt ibuf header: negative channel count");
        }
        spec.format(type(in.readByte()));
        int nformats = in.readInt();
        List<PixelType> formats = new ArrayList<>(nformats);
        for (int i = 0; i < nformats; i++) {
            formats.add(type(in.readByte()));
        }
        List<String> names = new ArrayList<>(nchannels);
        for (int c = 0; c < nchannels; c++) {
            names.add(in.readUTF());
        }
        spec.channelNames(names);
        spec.nchannels(nchannels);
        spec.channelFormats(formats);
        spec.alphaChannel(in.readInt());
        spec.zChannel(in.readInt());
        spec.deep(in.readBoolean());

        int nattributes = in.readInt();
        for (int i = 0; i < nattributes; i++) {
            String name = in.readUTF();
            byte tag = in.readByte();
            Object value =
                    switch (tag) {
                        case 'I' -> in.readInt();
                        case 'L' -> in.readLong();
                        case 'F' -> in.readFloat();
                        case 'D' -> in.readDouble();
                        case 'S' -> in.readUTF();
                        default -> throw new IOException("Corrupt ibuf header: unknown attribute tag " + tag);
                    };
            spec.attribute(name, value);
        }
        return spec;
    }

    /** @return byte offsets of each channel within one stored pixel, plus the pixel size as last element */
    static int[] channelOffsets(ImageSpec spec) {
        int[] offsets = new int[spec.nchannels() + 1];
        for (int c = 0; c < spec.nchannels(); c++) {
            offsets[c + 1] = offsets[c] + spec.channelFormat(c).size();
        }
        return offsets;
    }

    private static PixelType type(byte code) throws IOException {
        if (code < 0 || code >= TYPES.length) {
            throw new IOException("Corrupt ibuf header: unknown pixel type code " + code);
        }
        return TYPES[code];
    }
}
