/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import org.junit.jupiter.api.Test;

import dev.sapwood.types.ChunkOffset;
import dev.sapwood.types.DataType;
import dev.sapwood.types.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ValueSegmentTest {

    @Test
    void testAppendAndRead() {
        ValueSegment<Integer> segment = new ValueSegment<>(DataType.INT);
        segment.append(Scalar.of(4));
        segment.append(Scalar.of(6));
        segment.appendValue(3);

        assertThat(segment.size()).isEqualTo(3);
        assertThat(segment.values()).containsExactly(4, 6, 3);
        assertThat(segment.valueAt(1)).isEqualTo(6);
        assertThat(segment.get(new ChunkOffset(2))).isEqualTo(Scalar.of(3));
    }

    @Test
    void testAppendRejectsTypeMismatch() {
        ValueSegment<String> segment = new ValueSegment<>(DataType.STRING);

        assertThatThrownBy(() -> segment.append(Scalar.of(3)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(segment.size()).isZero();
    }

    @Test
    void testValuesViewIsReadOnly() {
        ValueSegment<Integer> segment = new ValueSegment<>(DataType.INT);
        segment.appendValue(1);

        assertThatThrownBy(() -> segment.values().add(2))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testOutOfRangeRead() {
        ValueSegment<Integer> segment = new ValueSegment<>(DataType.INT);
        segment.appendValue(1);

        assertThatThrownBy(() -> segment.get(new ChunkOffset(1)))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testNarrowing() {
        ValueSegment<?> segment = ValueSegment.create(DataType.forName("long"));

        assertThat(segment.as(DataType.LONG)).isSameAs(segment);
        assertThatThrownBy(() -> segment.as(DataType.INT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Type mismatch");
    }
}
