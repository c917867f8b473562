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
import java.util.Arrays;

/**
 * Continuous coordinate sampling. Pixel {@code (i,j)} covers {@code [i,i+1) x [j,j+1)}, so its center is at
 * {@code (i+0.5, j+0.5)}. Samples are taken from the first z plane of the data window.
 */
final class Interpolator {

    private Interpolator() {
        // utility class
    }

    static void bilinear(DefaultImageBuf buf, float x, float y, float[] pixel, WrapMode wrap) {
        Arrays.fill(pixel, 0f);
        if (!readable(buf)) {
            return;
        }
        final ImageSpec spec = buf.spec();
        final int n = Math.min(spec.nchannels(), pixel.length);
        final float fx = x - 0.5f;
        final float fy = y - 0.5f;
        final int xtexel = (int) Math.floor(fx);
        final int ytexel = (int) Math.floor(fy);
        final float xfrac = fx - xtexel;
        final float yfrac = fy - ytexel;
        final float[][] corners = new float[4][n];
        try (TileCursor cursor = new TileCursor(buf)) {
            for (int j = 0; j < 2; j++) {
                for (int i = 0; i < 2; i++) {
                    cursor.seek(xtexel + i, ytexel + j, spec.z(), wrap);
                    for (int c = 0; c < n; c++) {
                        corners[j * 2 + i][c] = cursor.channel(c);
                    }
                }
            }
        }
        for (int c = 0; c < n; c++) {
            float top = corners[0][c] * (1 - xfrac) + corners[1][c] * xfrac;
            float bottom = corners[2][c] * (1 - xfrac) + corners[3][c] * xfrac;
            pixel[c] = top * (1 - yfrac) + bottom * yfrac;
        }
    }

    static void bicubic(DefaultImageBuf buf, float x, float y, float[] pixel, WrapMode wrap) {
        Arrays.fill(pixel, 0f);
        if (!readable(buf)) {
            return;
        }
        final ImageSpec spec = buf.spec();
        final int n = Math.min(spec.nchannels(), pixel.length);
        final float fx = x - 0.5f;
        final float fy = y - 0.5f;
        final int xtexel = (int) Math.floor(fx);
        final int ytexel = (int) Math.floor(fy);
        final float[] wx = bsplineWeights(fx - xtexel);
        final float[] wy = bsplineWeights(fy - ytexel);
        try (TileCursor cursor = new TileCursor(buf)) {
            for (int j = 0; j < 4; j++) {
                for (int i = 0; i < 4; i++) {
                    cursor.seek(xtexel - 1 + i, ytexel - 1 + j, spec.z(), wrap);
                    float w = wx[i] * wy[j];
                    for (int c = 0; c < n; c++) {
                        pixel[c] += w * cursor.channel(c);
                    }
                }
            }
        }
    }

    /** Uniform cubic B-spline weights for the four texels around fraction {@code f}. */
    static float[] bsplineWeights(float f) {
        float g = 1 - f;
        return new float[] {
            g * g * g / 6f,
            2f / 3f - 0.5f * f * f * (2 - f),
            2f / 3f - 0.5f * g * g * (2 - g),
            f * f * f / 6f
        };
    }

    private static boolean readable(DefaultImageBuf buf) {
        return buf.validatePixels() && buf.initialized() && !buf.spec().deep();
    }
}
