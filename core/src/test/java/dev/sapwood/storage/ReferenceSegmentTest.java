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

import dev.sapwood.types.ChunkID;
import dev.sapwood.types.ChunkOffset;
import dev.sapwood.types.ColumnID;
import dev.sapwood.types.DataType;
import dev.sapwood.types.RowID;
import dev.sapwood.types.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReferenceSegmentTest {

    private Table table;

    @BeforeEach
    void setUp() {
        table = new Table(2);
        table.addColumn("a", DataType.INT);
        table.addColumn("b", DataType.STRING);
        table.append(Scalar.of(1), Scalar.of("one"));
        table.append(Scalar.of(2), Scalar.of("two"));
        table.append(Scalar.of(3), Scalar.of("three"));
    }

    @Test
    void testResolvesRowsOfReferencedTable() {
        PosList posList = new PosList(List.of(RowID.of(1, 0), RowID.of(0, 0), RowID.of(1, 0)));
        ReferenceSegment segment = new ReferenceSegment(table, new ColumnID(1), posList);

        assertThat(segment.size()).isEqualTo(3);
        assertThat(segment.dataType()).isEqualTo(DataType.STRING);
        assertThat(segment.get(new ChunkOffset(0))).isEqualTo(Scalar.of("three"));
        assertThat(segment.get(new ChunkOffset(1))).isEqualTo(Scalar.of("one"));
        assertThat(segment.get(new ChunkOffset(2))).isEqualTo(Scalar.of("three"));
    }

    @Test
    void testResolvesThroughCompressedChunk() {
        table.compressChunk(new ChunkID(0));
        ReferenceSegment segment = new ReferenceSegment(table, new ColumnID(0),
                new PosList(List.of(RowID.of(0, 1))));

        assertThat(segment.get(new ChunkOffset(0))).isEqualTo(Scalar.of(2));
    }

    @Test
    void testRejectsUnknownColumn() {
        assertThatThrownBy(() -> new ReferenceSegment(table, new ColumnID(2), PosList.empty()))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testAppendFails() {
        ReferenceSegment segment = new ReferenceSegment(table, new ColumnID(0), PosList.empty());

        assertThatThrownBy(() -> segment.append(Scalar.of(1)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(segment.size()).isZero();
    }

    @Test
    void testPosListIsImmutable() {
        PosList posList = new PosList(List.of(RowID.of(0, 0)));

        assertThatThrownBy(() -> posList.rowIds().add(RowID.of(0, 1)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(posList).containsExactly(RowID.of(0, 0));
        assertThat(posList).isEqualTo(new PosList(List.of(RowID.of(0, 0))));
    }
}
