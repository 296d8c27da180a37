/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import java.util.Objects;

import dev.sapwood.types.ChunkOffset;
import dev.sapwood.types.ColumnID;
import dev.sapwood.types.DataType;
import dev.sapwood.types.RowID;
import dev.sapwood.types.Scalar;

/**
 * Segment that holds no data itself but points to rows of a column in another table.
 * <p>
 * Row {@code i} of this segment is the row {@code posList().get(i)} of the referenced column.
 * Referenced tables only ever hold value or dictionary segments in that column; chained scans
 * resolve references so that there is at most one level of indirection.
 * </p>
 */
public final class ReferenceSegment implements Segment {

    private final Table referencedTable;
    private final ColumnID referencedColumnId;
    private final PosList posList;

    public ReferenceSegment(Table referencedTable, ColumnID referencedColumnId, PosList posList) {
        this.referencedTable = Objects.requireNonNull(referencedTable, "referencedTable");
        this.referencedColumnId = Objects.requireNonNull(referencedColumnId, "referencedColumnId");
        this.posList = Objects.requireNonNull(posList, "posList");
        Objects.checkIndex(referencedColumnId.value(), referencedTable.columnCount());
    }

    @Override
    public Scalar get(ChunkOffset offset) {
        RowID rowId = posList.get(Objects.checkIndex(offset.value(), posList.size()));
        return referencedTable.getChunk(rowId.chunkId())
                .getSegment(referencedColumnId)
                .get(rowId.chunkOffset());
    }

    @Override
    public int size() {
        return posList.size();
    }

    @Override
    public DataType<?> dataType() {
        return referencedTable.columnType(referencedColumnId);
    }

    @Override
    public void append(Scalar value) {
        throw new UnsupportedOperationException("Cannot append to reference segment");
    }

    public Table referencedTable() {
        return referencedTable;
    }

    public ColumnID referencedColumnId() {
        return referencedColumnId;
    }

    public PosList posList() {
        return posList;
    }

    @Override
    public <R> R accept(SegmentVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "ReferenceSegment[column=" + referencedColumnId.value() + ", size=" + posList.size() + "]";
    }
}
