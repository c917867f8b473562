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

import java.util.Locale;

/**
 * How pixel lookups resolve coordinates outside the data window.
 * <p>
 * Wrapping works against the <em>full</em> (display) window; if the wrapped coordinate still falls outside the
 * data window the lookup yields black.
 */
public enum WrapMode {
    /** Same as {@link #BLACK}. */
    DEFAULT,
    /** Outside pixels are black. */
    BLACK,
    /** Coordinates are clamped to the full window. */
    CLAMP {
        @Override
        int wrap(int coord, int origin, int width) {
            return Math.max(origin, Math.min(coord, origin + width - 1));
        }
    },
    /** Coordinates repeat with the size of the full window. */
    PERIODIC {
        @Override
        int wrap(int coord, int origin, int width) {
            return origin + Math.floorMod(coord - origin, width);
        }
    },
    /** Coordinates reflect at the full window edges, edge pixels repeated once. */
    MIRROR {
        @Override
        int wrap(int coord, int origin, int width) {
            int c = coord - origin;
            if (c < 0) {
                c = -c - 1;
            }
            int iteration = c / width;
            c -= iteration * width;
            if ((iteration & 1) != 0) {
                c = width - 1 - c;
            }
            return c + origin;
        }
    };

    /** Maps one axis coordinate. Modes that do not move coordinates return it unchanged. */
    int wrap(int coord, int origin, int width) {
        return coord;
    }

    /** @return whether this mode never moves a coordinate */
    public boolean isBlack() {
        return this == DEFAULT || this == BLACK;
    }

    /**
     * Parses {@code "default"}, {@code "black"}, {@code "clamp"}, {@code "periodic"} or {@code "mirror"}, case
     * insensitive. Anything else yields {@link #DEFAULT}.
     */
    public static WrapMode fromString(String name) {
        if (name != null) {
            String n = name.trim().toUpperCase(Locale.ROOT);
            for (WrapMode mode : values()) {
                if (mode.name().equals(n)) {
                    return mode;
                }
            }
        }
        return DEFAULT;
    }
}
