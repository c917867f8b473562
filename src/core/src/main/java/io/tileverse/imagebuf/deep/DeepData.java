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
package io.tileverse.imagebuf.deep;

import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spec.PixelType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Variable-length sample storage for deep images.
 * <p>
 * Every pixel, addressed by its flat index, holds zero or more samples; every sample holds one value per channel.
 * Channels have their own {@link PixelType}: floating point channels keep float values, integer channels keep
 * integer values (typically {@link PixelType#UINT32} object ids). Values are not normalized, an integer channel
 * holding {@code 7} reads back as {@code 7.0f} from {@link #deepValue(long, int, int)}.
 * <p>
 * Out of range pixel, channel or sample indices read as {@code 0} and are ignored on write.
 */
public class DeepData {

    private static final double[] EMPTY = new double[0];

    private int nchannels;
    private List<PixelType> channelTypes = List.of();
    private List<String> channelNames = List.of();
    private int[] samples = new int[0];
    private double[][] values = new double[0][];

    public DeepData() {
        // empty
    }

    /** Deep copy. */
    public DeepData(DeepData other) {
        this.nchannels = other.nchannels;
        this.channelTypes = other.channelTypes;
        this.channelNames = other.channelNames;
        this.samples = other.samples.clone();
        this.values = new double[other.values.length][];
        for (int p = 0; p < values.length; p++) {
            this.values[p] = other.values[p].clone();
        }
    }

    /**
     * Sizes the store for the pixels and channels of {@code spec}, every pixel starting with no samples.
     */
    public void init(ImageSpec spec) {
        List<PixelType> types = new ArrayList<>(spec.nchannels());
        for (int c = 0; c < spec.nchannels(); c++) {
            types.add(spec.channelFormat(c));
        }
        init(spec.imagePixels(), spec.nchannels(), types, spec.channelNames());
    }

    public void init(long npixels, int nchannels, List<PixelType> channelTypes, List<String> channelNames) {
        if (npixels < 0 || npixels > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Unsupported deep pixel count: " + npixels);
        }
        if (channelTypes.size() != nchannels) {
            throw new IllegalArgumentException(
                    "Expected %d channel types, got %d".formatted(nchannels, channelTypes.size()));
        }
        this.nchannels = nchannels;
        this.channelTypes = List.copyOf(channelTypes);
        this.channelNames = channelNames == null ? List.of() : List.copyOf(channelNames);
        this.samples = new int[(int) npixels];
        this.values = new double[(int) npixels][];
        Arrays.fill(values, EMPTY);
    }

    /** Releases all storage. */
    public void clear() {
        nchannels = 0;
        channelTypes = List.of();
        channelNames = List.of();
        samples = new int[0];
        values = new double[0][];
    }

    public boolean initialized() {
        return nchannels > 0;
    }

    public long pixels() {
        return samples.length;
    }

    public int channels() {
        return nchannels;
    }

    public PixelType channelType(int channel) {
        return channel >= 0 && channel < nchannels ? channelTypes.get(channel) : PixelType.UNKNOWN;
    }

    public List<PixelType> channelTypes() {
        return channelTypes;
    }

    public List<String> channelNames() {
        return channelNames;
    }

    /** @return the total number of samples over all pixels */
    public long allSamples() {
        long total = 0;
        for (int n : samples) {
            total += n;
        }
        return total;
    }

    public int samples(long pixel) {
        return validPixel(pixel) ? samples[(int) pixel] : 0;
    }

    /**
     * Resizes the sample list of a pixel, keeping existing leading samples and zero-filling new ones.
     */
    public void setSamples(long pixel, int nsamples) {
        if (!validPixel(pixel) || nsamples < 0) {
            return;
        }
        int p = (int) pixel;
        if (samples[p] == nsamples) {
            return;
        }
        values[p] = nsamples == 0 ? EMPTY : Arrays.copyOf(values[p], nsamples * nchannels);
        samples[p] = nsamples;
    }

    /**
     * Inserts {@code n} zero samples before sample {@code samplepos}.
     */
    public void insertSamples(long pixel, int samplepos, int n) {
        if (!validPixel(pixel) || n <= 0) {
            return;
        }
        int p = (int) pixel;
        int pos = Math.max(0, Math.min(samplepos, samples[p]));
        double[] old = values[p];
        double[] grown = new double[(samples[p] + n) * nchannels];
        System.arraycopy(old, 0, grown, 0, pos * nchannels);
        System.arraycopy(old, pos * nchannels, grown, (pos + n) * nchannels, (samples[p] - pos) * nchannels);
        values[p] = grown;
        samples[p] += n;
    }

    /**
     * Removes up to {@code n} samples starting at {@code samplepos}.
     */
    public void eraseSamples(long pixel, int samplepos, int n) {
        if (!validPixel(pixel) || n <= 0 || samplepos < 0 || samplepos >= samples[(int) pixel]) {
            return;
        }
        int p = (int) pixel;
        int count = Math.min(n, samples[p] - samplepos);
        double[] old = values[p];
        double[] shrunk = new double[(samples[p] - count) * nchannels];
        System.arraycopy(old, 0, shrunk, 0, samplepos * nchannels);
        System.arraycopy(
                old,
                (samplepos + count) * nchannels,
                shrunk,
                samplepos * nchannels,
                (samples[p] - samplepos - count) * nchannels);
        values[p] = shrunk.length == 0 ? EMPTY : shrunk;
        samples[p] -= count;
    }

    public float deepValue(long pixel, int channel, int sample) {
        return validSample(pixel, channel, sample) ? (float) values[(int) pixel][sample * nchannels + channel] : 0f;
    }

    /**
     * @return the value as an unsigned 32 bit integer, negative and fractional float values are rounded and
     *     clamped into range
     */
    public long deepValueUint(long pixel, int channel, int sample) {
        if (!validSample(pixel, channel, sample)) {
            return 0L;
        }
        double v = values[(int) pixel][sample * nchannels + channel];
        return clampUint(v);
    }

    /** @return the stored value without narrowing, as kept for the channel type */
    public double deepValueDouble(long pixel, int channel, int sample) {
        return validSample(pixel, channel, sample) ? values[(int) pixel][sample * nchannels + channel] : 0.0;
    }

    public void setDeepValueDouble(long pixel, int channel, int sample, double value) {
        if (validSample(pixel, channel, sample)) {
            values[(int) pixel][sample * nchannels + channel] = coerce(channelTypes.get(channel), value);
        }
    }

    public void setDeepValue(long pixel, int channel, int sample, float value) {
        if (validSample(pixel, channel, sample)) {
            values[(int) pixel][sample * nchannels + channel] = coerce(channelTypes.get(channel), value);
        }
    }

    public void setDeepValueUint(long pixel, int channel, int sample, long value) {
        if (validSample(pixel, channel, sample)) {
            values[(int) pixel][sample * nchannels + channel] = coerce(channelTypes.get(channel), value);
        }
    }

    /**
     * Replaces the samples of {@code pixel} with those of {@code srcPixel} in {@code src}. A negative
     * {@code srcPixel} empties the destination pixel.
     *
     * @return {@code false} if the channel layouts differ or the pixels are out of range
     */
    public boolean copyDeepPixel(long pixel, DeepData src, long srcPixel) {
        if (!validPixel(pixel)) {
            return false;
        }
        if (srcPixel < 0) {
            setSamples(pixel, 0);
            return true;
        }
        if (src.nchannels != nchannels || !src.validPixel(srcPixel)) {
            return false;
        }
        int n = src.samples[(int) srcPixel];
        double[] copy = src.values[(int) srcPixel].clone();
        for (int c = 0; c < nchannels; c++) {
            if (src.channelTypes.get(c) != channelTypes.get(c)) {
                for (int s = 0; s < n; s++) {
                    copy[s * nchannels + c] = coerce(channelTypes.get(c), copy[s * nchannels + c]);
                }
            }
        }
        values[(int) pixel] = n == 0 ? EMPTY : copy;
        samples[(int) pixel] = n;
        return true;
    }

    private boolean validPixel(long pixel) {
        return pixel >= 0 && pixel < samples.length;
    }

    private boolean validSample(long pixel, int channel, int sample) {
        return validPixel(pixel)
                && channel >= 0
                && channel < nchannels
                && sample >= 0
                && sample < samples[(int) pixel];
    }

    private static double coerce(PixelType type, double value) {
        if (type.isFloatingPoint()) {
            return type == PixelType.DOUBLE ? value : (float) value;
        }
        if (Double.isNaN(value)) {
            return 0;
        }
        double r = value < 0 ? -Math.floor(-value + 0.5) : Math.floor(value + 0.5);
        return switch (type) {
            case UINT8 -> clamp(r, 0, 255);
            case INT8 -> clamp(r, Byte.MIN_VALUE, Byte.MAX_VALUE);
            case UINT16 -> clamp(r, 0, 65535);
            case INT16 -> clamp(r, Short.MIN_VALUE, Short.MAX_VALUE);
            case UINT32 -> clamp(r, 0, 0xffffffffL);
            case INT32 -> clamp(r, Integer.MIN_VALUE, Integer.MAX_VALUE);
            default -> r;
        };
    }

    private static double clamp(double v, double min, double max) {
        return v < min ? min : Math.min(v, max);
    }

    private static long clampUint(double v) {
        if (!(v > 0)) {
            return 0L;
        }
        return (long) Math.min(Math.floor(v + 0.5), 0xffffffffL);
    }
}
