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

import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import io.tileverse.imagebuf.spec.Roi;
import java.nio.ByteBuffer;

/**
 * Bulk pixel transfers between buffers and between a buffer and caller memory.
 * <p>
 * Caller memory is addressed from the buffer's current position with byte strides, in its byte order; the
 * position is left unchanged. Local pixels with matching layout are copied a scanline at a time, anything else
 * goes value by value through {@link PixelType#convert}.
 */
final class PixelCopier {

    private PixelCopier() {
        // utility class
    }

    static boolean getPixels(
            DefaultImageBuf buf, Roi roi, PixelType format, ByteBuffer result, long xstride, long ystride, long zstride) {
        if (!buf.validatePixels()) {
            return false;
        }
        final ImageSpec spec = buf.spec();
        if (spec.deep()) {
            buf.error("getPixels is not supported for deep images");
            return false;
        }
        if (!buf.initialized()) {
            buf.error("getPixels called on an uninitialized ImageBuf");
            return false;
        }
        final Roi r = clampChannels(roi.defined() ? roi : spec.roi(), spec.nchannels());
        if (r.nchannels() <= 0 || r.isEmpty()) {
            return true;
        }
        final PixelType src = spec.format();
        final PixelType dst = format == null || format == PixelType.UNKNOWN ? src : format;
        final int nch = r.nchannels();
        final long xs = xstride == ImageBuf.AUTO_STRIDE ? (long) dst.size() * nch : xstride;
        final long ys = ystride == ImageBuf.AUTO_STRIDE ? xs * r.width() : ystride;
        final long zs = zstride == ImageBuf.AUTO_STRIDE ? ys * r.height() : zstride;
        final int base = result.position();
        final ByteBuffer local = buf.pixels();
        final int cb = buf.channelBytes();
        try {
            if (local != null && spec.roi().contains(r.withChannels(0, spec.nchannels()))) {
                final boolean rowCopy = src == dst
                        && nch == spec.nchannels()
                        && xs == buf.pixelBytes()
                        && result.order() == local.order();
                for (int z = r.zbegin(); z < r.zend(); z++) {
                    for (int y = r.ybegin(); y < r.yend(); y++) {
                        long row = base + (z - r.zbegin()) * zs + (y - r.ybegin()) * ys;
                        int srcRow = buf.pixelOffset(r.xbegin(), y, z);
                        if (rowCopy) {
                            result.put((int) row, local, srcRow, r.width() * buf.pixelBytes());
                            continue;
                        }
                        for (int x = 0; x < r.width(); x++) {
                            int s = srcRow + x * buf.pixelBytes();
                            long d = row + x * xs;
                            for (int c = r.chbegin(); c < r.chend(); c++) {
                                PixelType.convert(
                                        local, s + c * cb, src, result, (int) d + (c - r.chbegin()) * dst.size(), dst);
                            }
                        }
                    }
                }
                return true;
            }
            try (TileCursor cursor = new TileCursor(buf)) {
                for (int z = r.zbegin(); z < r.zend(); z++) {
                    for (int y = r.ybegin(); y < r.yend(); y++) {
                        long row = base + (z - r.zbegin()) * zs + (y - r.ybegin()) * ys;
                        for (int x = r.xbegin(); x < r.xend(); x++) {
                            long d = row + (x - r.xbegin()) * xs;
                            boolean inside = cursor.seek(x, y, z, WrapMode.BLACK);
                            for (int c = r.chbegin(); c < r.chend(); c++) {
                                int di = (int) d + (c - r.chbegin()) * dst.size();
                                if (inside) {
                                    PixelType.convert(
                                            cursor.data(), cursor.offset() + c * cb, src, result, di, dst);
                                } else {
                                    dst.put(result, di, 0f);
                                }
                            }
                        }
                    }
                }
            }
            return true;
        } catch (IndexOutOfBoundsException e) {
            buf.error("getPixels: destination buffer too small for " + r);
            return false;
        }
    }

    static boolean setPixels(
            DefaultImageBuf buf, Roi roi, PixelType format, ByteBuffer data, long xstride, long ystride, long zstride) {
        if (!buf.validatePixels() || !buf.initialized()) {
            buf.error("setPixels called on an uninitialized ImageBuf");
            return false;
        }
        final ImageSpec spec = buf.spec();
        if (spec.deep()) {
            buf.error("setPixels is not supported for deep images");
            return false;
        }
        if (buf.storage() == Storage.IMAGE_CACHE && !buf.makeWriteable(true)) {
            return false;
        }
        final ByteBuffer local = buf.pixels();
        if (local == null) {
            buf.error("setPixels: no local pixels");
            return false;
        }
        final Roi r = clampChannels(roi.defined() ? roi : spec.roi(), spec.nchannels());
        if (r.nchannels() <= 0 || r.isEmpty()) {
            return true;
        }
        final PixelType dst = spec.format();
        final PixelType src = format == null || format == PixelType.UNKNOWN ? dst : format;
        final long xs = xstride == ImageBuf.AUTO_STRIDE ? (long) src.size() * r.nchannels() : xstride;
        final long ys = ystride == ImageBuf.AUTO_STRIDE ? xs * r.width() : ystride;
        final long zs = zstride == ImageBuf.AUTO_STRIDE ? ys * r.height() : zstride;
        final int base = data.position();
        final Roi window = spec.roi();
        final int cb = buf.channelBytes();
        try {
            for (int z = r.zbegin(); z < r.zend(); z++) {
                for (int y = r.ybegin(); y < r.yend(); y++) {
                    long row = base + (z - r.zbegin()) * zs + (y - r.ybegin()) * ys;
                    for (int x = r.xbegin(); x < r.xend(); x++) {
                        if (!window.contains(x, y, z)) {
                            continue;
                        }
                        long s = row + (x - r.xbegin()) * xs;
                        int d = buf.pixelOffset(x, y, z);
                        for (int c = r.chbegin(); c < r.chend(); c++) {
                            PixelType.convert(data, (int) s + (c - r.chbegin()) * src.size(), src, local, d + c * cb, dst);
                        }
                    }
                }
            }
            return true;
        } catch (IndexOutOfBoundsException e) {
            buf.error("setPixels: source buffer too small for " + r);
            return false;
        }
    }

    /**
     * Copies pixels of {@code src} into {@code dst} over the intersection of both data windows and {@code roi}.
     * Destination pixels outside that region are zeroed first.
     */
    static boolean copyPixels(DefaultImageBuf dst, DefaultImageBuf src, Roi roi) {
        if (src == dst) {
            return true;
        }
        if (!dst.validatePixels() || !src.validatePixels()) {
            return false;
        }
        if (dst.deep() || src.deep()) {
            dst.error("copyPixels is not supported for deep images");
            return false;
        }
        if (!dst.initialized()) {
            dst.error("copyPixels called on an uninitialized ImageBuf");
            return false;
        }
        if (dst.storage() == Storage.IMAGE_CACHE && !dst.makeWriteable(true)) {
            return false;
        }
        final ImageSpec ds = dst.spec();
        final ImageSpec ss = src.spec();
        final Roi window = ds.roi();
        Roi r = Roi.intersection(window, ss.roi());
        if (roi.defined()) {
            r = Roi.intersection(r, roi);
        }
        if (!r.equals(window)) {
            dst.zeroFill();
        }
        if (r.isEmpty() || r.nchannels() <= 0 || !src.initialized()) {
            return true;
        }
        final PixelType df = ds.format();
        final PixelType sf = ss.format();
        final ByteBuffer out = dst.pixels();
        final ByteBuffer in = src.pixels();
        final int dcb = dst.channelBytes();
        final int scb = src.channelBytes();
        if (df == sf
                && in != null
                && r.chbegin() == 0
                && r.chend() == ds.nchannels()
                && r.chend() == ss.nchannels()) {
            final int rowBytes = r.width() * dst.pixelBytes();
            for (int z = r.zbegin(); z < r.zend(); z++) {
                for (int y = r.ybegin(); y < r.yend(); y++) {
                    out.put(dst.pixelOffset(r.xbegin(), y, z), in, src.pixelOffset(r.xbegin(), y, z), rowBytes);
                }
            }
            return true;
        }
        try (TileCursor cursor = new TileCursor(src)) {
            for (int z = r.zbegin(); z < r.zend(); z++) {
                for (int y = r.ybegin(); y < r.yend(); y++) {
                    for (int x = r.xbegin(); x < r.xend(); x++) {
                        cursor.seek(x, y, z, WrapMode.BLACK);
                        int d = dst.pixelOffset(x, y, z);
                        for (int c = r.chbegin(); c < r.chend(); c++) {
                            PixelType.convert(cursor.data(), cursor.offset() + c * scb, sf, out, d + c * dcb, df);
                        }
                    }
                }
            }
        }
        return true;
    }

    private static Roi clampChannels(Roi roi, int nchannels) {
        int chbegin = Math.max(0, roi.chbegin());
        int chend = Math.min(nchannels, roi.chend());
        return roi.withChannels(chbegin, Math.max(chbegin, chend));
    }
}
