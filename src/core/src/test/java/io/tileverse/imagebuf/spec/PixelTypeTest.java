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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Tests for {@link PixelType}.
 */
class PixelTypeTest {

    @Test
    void testSizes() {
        assertThat(PixelType.UNKNOWN.size()).isZero();
        assertThat(PixelType.UINT8.size()).isEqualTo(1);
        assertThat(PixelType.INT16.size()).isEqualTo(2);
        assertThat(PixelType.HALF.size()).isEqualTo(2);
        assertThat(PixelType.FLOAT.size()).isEqualTo(4);
        assertThat(PixelType.UINT32.size()).isEqualTo(4);
        assertThat(PixelType.DOUBLE.size()).isEqualTo(8);
        assertThat(PixelType.INT64.size()).isEqualTo(8);
    }

    @Test
    void testUint8Normalization() {
        ByteBuffer buf = ByteBuffer.allocate(1);
        PixelType.UINT8.put(buf, 0, 1f);
        assertThat(buf.get(0) & 0xff).isEqualTo(255);
        assertThat(PixelType.UINT8.get(buf, 0)).isEqualTo(1f);

        PixelType.UINT8.put(buf, 0, 0.5f);
        // 127.5 rounds half away from zero
        assertThat(buf.get(0) & 0xff).isEqualTo(128);
    }

    @Test
    void testIntegerConversionClamps() {
        ByteBuffer buf = ByteBuffer.allocate(2);
        PixelType.UINT8.put(buf, 0, 2f);
        assertThat(buf.get(0) & 0xff).isEqualTo(255);
        PixelType.UINT8.put(buf, 0, -1f);
        assertThat(buf.get(0)).isZero();
        PixelType.INT16.put(buf, 0, -3f);
        assertThat(buf.getShort(0)).isEqualTo(Short.MIN_VALUE);
        PixelType.UINT16.put(buf, 0, Float.NaN);
        assertThat(buf.getShort(0)).isZero();
    }

    @Test
    void testSignedRoundsHalfAwayFromZero() {
        ByteBuffer buf = ByteBuffer.allocate(1);
        PixelType.INT8.put(buf, 0, -0.5f / 127f);
        assertThat(buf.get(0)).isEqualTo((byte) -1);
        PixelType.INT8.put(buf, 0, 0.5f / 127f);
        assertThat(buf.get(0)).isEqualTo((byte) 1);
    }

    @Test
    void testHonorsByteOrder() {
        ByteBuffer big = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN);
        ByteBuffer little = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        PixelType.UINT16.put(big, 0, 1f / 65535f);
        PixelType.UINT16.put(little, 0, 1f / 65535f);
        assertThat(big.get(1)).isEqualTo((byte) 1);
        assertThat(little.get(0)).isEqualTo((byte) 1);
    }

    @Test
    void testConvertSameTypeCopiesExactBits() {
        ByteBuffer src = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN);
        ByteBuffer dst = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        src.putFloat(0, Float.intBitsToFloat(0x7fc00123));
        PixelType.convert(src, 0, PixelType.FLOAT, dst, 0, PixelType.FLOAT);
        assertThat(dst.getInt(0)).isEqualTo(0x7fc00123);
    }

    @Test
    void testConvertBetweenTypes() {
        ByteBuffer src = ByteBuffer.allocate(2);
        ByteBuffer dst = ByteBuffer.allocate(4);
        PixelType.UINT16.put(src, 0, 1f);
        PixelType.convert(src, 0, PixelType.UINT16, dst, 0, PixelType.FLOAT);
        assertThat(dst.getFloat(0)).isEqualTo(1f);
        PixelType.convert(dst, 0, PixelType.FLOAT, src, 0, PixelType.UINT8);
        assertThat(src.get(0) & 0xff).isEqualTo(255);
    }

    @ParameterizedTest
    @EnumSource(
            value = PixelType.class,
            names = {"UNKNOWN"},
            mode = EnumSource.Mode.EXCLUDE)
    void testRepresentableValuesSurviveRoundTrip(PixelType type) {
        ByteBuffer buf = ByteBuffer.allocate(8).order(ByteOrder.nativeOrder());
        type.put(buf, 0, 0f);
        assertThat(type.get(buf, 0)).isZero();
        type.put(buf, 0, 1f);
        assertThat(type.get(buf, 0)).isCloseTo(1f, within(1e-6f));
    }

    @Test
    void testUnknownReadsZeroAndIgnoresWrites() {
        ByteBuffer buf = ByteBuffer.allocate(1);
        PixelType.UNKNOWN.put(buf, 0, 1f);
        assertThat(buf.get(0)).isZero();
        assertThat(PixelType.UNKNOWN.get(buf, 0)).isZero();
    }

    @Test
    void testFromName() {
        assertThat(PixelType.fromName("uint8")).isEqualTo(PixelType.UINT8);
        assertThat(PixelType.fromName("HALF")).isEqualTo(PixelType.HALF);
        assertThat(PixelType.fromName("ushort")).isEqualTo(PixelType.UINT16);
        assertThat(PixelType.fromName("int")).isEqualTo(PixelType.INT32);
        assertThat(PixelType.fromName("")).isEqualTo(PixelType.UNKNOWN);
        assertThat(PixelType.fromName(null)).isEqualTo(PixelType.UNKNOWN);
        assertThatThrownBy(() -> PixelType.fromName("rgb"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rgb");
    }

    @Test
    void testTypeNameRoundTrips() {
        for (PixelType t : PixelType.values()) {
            assertThat(PixelType.fromName(t.typeName())).isEqualTo(t);
        }
    }
}
