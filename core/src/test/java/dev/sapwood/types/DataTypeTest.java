/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DataTypeTest {

    @Test
    void testForName() {
        assertThat(DataType.forName("int")).isSameAs(DataType.INT);
        assertThat(DataType.forName("long")).isSameAs(DataType.LONG);
        assertThat(DataType.forName("float")).isSameAs(DataType.FLOAT);
        assertThat(DataType.forName("double")).isSameAs(DataType.DOUBLE);
        assertThat(DataType.forName("string")).isSameAs(DataType.STRING);

        assertThatThrownBy(() -> DataType.forName("varchar"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("varchar");
    }

    @Test
    void testCastMatchingType() {
        assertThat(DataType.INT.cast(Scalar.of(42))).isEqualTo(42);
        assertThat(DataType.LONG.cast(Scalar.of(42L))).isEqualTo(42L);
        assertThat(DataType.DOUBLE.cast(Scalar.of(1.5d))).isEqualTo(1.5d);
        assertThat(DataType.STRING.cast(Scalar.of("Hello"))).isEqualTo("Hello");
    }

    @Test
    void testCastRejectsOtherType() {
        assertThatThrownBy(() -> DataType.STRING.cast(Scalar.of(42)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected string but got int");

        // No implicit widening between numeric types
        assertThatThrownBy(() -> DataType.LONG.cast(Scalar.of(42)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testScalarOfObject() {
        assertThat(Scalar.of((Object) 1)).isEqualTo(Scalar.of(1));
        assertThat(Scalar.of((Object) 1.0f).type()).isSameAs(DataType.FLOAT);
        assertThat(DataType.INT.toScalar(7)).isEqualTo(new Scalar.IntScalar(7));

        assertThatThrownBy(() -> Scalar.of(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Scalar.of((Object) null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testTypedIdsRejectNegativeValues() {
        assertThatThrownBy(() -> new ColumnID(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChunkID(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChunkOffset(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testInvalidValueId() {
        assertThat(ValueID.INVALID_VALUE_ID.isValid()).isFalse();
        assertThat(ValueID.INVALID_VALUE_ID.unsignedValue()).isEqualTo(0xFFFFFFFFL);
        assertThat(ValueID.of(0xFFFFFFFFL)).isEqualTo(ValueID.INVALID_VALUE_ID);
        assertThat(new ValueID(0).isValid()).isTrue();
    }
}
