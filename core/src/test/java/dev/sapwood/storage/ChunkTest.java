/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.sapwood.types.ChunkOffset;
import dev.sapwood.types.ColumnID;
import dev.sapwood.types.DataType;
import dev.sapwood.types.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ChunkTest {

    private Chunk chunk;
    private ValueSegment<Integer> intSegment;
    private ValueSegment<String> stringSegment;

    @BeforeEach
    void setUp() {
        chunk = new Chunk();
        intSegment = new ValueSegment<>(DataType.INT);
        stringSegment = new ValueSegment<>(DataType.STRING);
        intSegment.appendValue(4);
        intSegment.appendValue(6);
        intSegment.appendValue(3);
        stringSegment.appendValue("Hello,");
        stringSegment.appendValue("world");
        stringSegment.appendValue("!");
    }

    @Test
    void testAddSegmentToChunk() {
        assertThat(chunk.size()).isZero();

        chunk.addSegment(intSegment);
        chunk.addSegment(stringSegment);

        assertThat(chunk.size()).isEqualTo(3);
        assertThat(chunk.columnCount()).isEqualTo(2);
    }

    @Test
    void testAddValuesToChunk() {
        chunk.addSegment(intSegment);
        chunk.addSegment(stringSegment);
        chunk.append(List.of(Scalar.of(2), Scalar.of("two")));

        assertThat(chunk.size()).isEqualTo(4);
        assertThat(chunk.getSegment(new ColumnID(1)).get(new ChunkOffset(3))).isEqualTo(Scalar.of("two"));
    }

    @Test
    void testRejectedRowLeavesChunkUnchanged() {
        chunk.addSegment(intSegment);
        chunk.addSegment(stringSegment);

        assertThatThrownBy(() -> chunk.append(List.of(Scalar.of(2))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunk.append(List.of(Scalar.of(2), Scalar.of(3))))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(intSegment.size()).isEqualTo(3);
        assertThat(stringSegment.size()).isEqualTo(3);
    }

    @Test
    void testSegmentSizeMismatch() {
        chunk.addSegment(intSegment);

        assertThatThrownBy(() -> chunk.addSegment(new ValueSegment<>(DataType.LONG)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCompressedChunkIsImmutable() {
        chunk.addSegment(DictionarySegment.compress(intSegment));
        chunk.addSegment(stringSegment);

        assertThat(chunk.isMutable()).isFalse();
        assertThatThrownBy(() -> chunk.append(List.of(Scalar.of(1), Scalar.of("x"))))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(stringSegment.size()).isEqualTo(3);
    }

    @Test
    void testUnknownColumn() {
        chunk.addSegment(intSegment);

        assertThatThrownBy(() -> chunk.getSegment(new ColumnID(1)))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
