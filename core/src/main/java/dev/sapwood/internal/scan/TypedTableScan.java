/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

import dev.sapwood.storage.AttributeVector;
import dev.sapwood.storage.Chunk;
import dev.sapwood.storage.DictionarySegment;
import dev.sapwood.storage.PosList;
import dev.sapwood.storage.ReferenceSegment;
import dev.sapwood.storage.Segment;
import dev.sapwood.storage.SegmentVisitor;
import dev.sapwood.storage.Table;
import dev.sapwood.storage.ValueSegment;
import dev.sapwood.types.ChunkID;
import dev.sapwood.types.ChunkOffset;
import dev.sapwood.types.ColumnID;
import dev.sapwood.types.DataType;
import dev.sapwood.types.RowID;
import dev.sapwood.types.ScanType;
import dev.sapwood.types.ValueID;

/**
 * Table scan specialized for one column value type.
 * <p>
 * Value segments are compared row by row. Dictionary segments are scanned on their attribute
 * vector codes, after translating the search value into a value id via binary search. Reference
 * segments evaluate the predicate on the rows they point to, either by reading each row through
 * the generic {@link Segment#get(ChunkOffset)} path or, for long position lists, by classifying
 * the referenced segments once and reading typed values.
 * </p>
 *
 * @param <T> the Java type of the scanned column's values
 */
public final class TypedTableScan<T extends Comparable<T>> {

    private static final System.Logger LOG = System.getLogger(TypedTableScan.class.getName());

    private final DataType<T> type;
    private final ColumnID columnId;
    private final ScanType scanType;
    private final T searchValue;
    private final int referenceFallbackFactor;

    public TypedTableScan(DataType<T> type, ColumnID columnId, ScanType scanType, T searchValue,
                          int referenceFallbackFactor) {
        this.type = type;
        this.columnId = columnId;
        this.scanType = scanType;
        this.searchValue = searchValue;
        this.referenceFallbackFactor = referenceFallbackFactor;
    }

    public Table execute(Table input) {
        List<RowID> matches = new ArrayList<>();
        Table referencedTable = input;

        for (int chunkIndex = 0; chunkIndex < input.chunkCount(); chunkIndex++) {
            ChunkID chunkId = new ChunkID(chunkIndex);
            Segment segment = input.getChunk(chunkId).getSegment(columnId);
            referencedTable = segment.accept(new ChunkScan(input, chunkId, matches));
        }

        PosList posList = new PosList(matches);
        Table result = new Table();
        Chunk chunk = new Chunk();
        for (int column = 0; column < input.columnCount(); column++) {
            ColumnID outputColumn = new ColumnID(column);
            result.addColumnDefinition(input.columnName(outputColumn), input.columnType(outputColumn));
            chunk.addSegment(new ReferenceSegment(referencedTable, referencedColumn(input, outputColumn), posList));
        }
        result.emplaceChunk(chunk);

        LOG.log(System.Logger.Level.DEBUG, "Scanned {0} chunks for {1} {2} ''{3}'': {4} matching rows",
                input.chunkCount(), input.columnName(columnId), scanType.symbol(), searchValue, posList.size());
        return result;
    }

    /**
     * Column of the referenced table that an output column points to. Columns of reference
     * inputs keep pointing at the column their segments reference.
     */
    private static ColumnID referencedColumn(Table input, ColumnID column) {
        Segment first = input.getChunk(new ChunkID(0)).getSegment(column);
        return first instanceof ReferenceSegment reference ? reference.referencedColumnId() : column;
    }

    /**
     * Scans one segment and returns the table whose rows the collected row ids address.
     */
    private final class ChunkScan implements SegmentVisitor<Table> {

        private final Table input;
        private final ChunkID chunkId;
        private final List<RowID> matches;

        ChunkScan(Table input, ChunkID chunkId, List<RowID> matches) {
            this.input = input;
            this.chunkId = chunkId;
            this.matches = matches;
        }

        @Override
        public Table visit(ValueSegment<?> segment) {
            scanValueSegment(segment.as(type), chunkId, matches);
            return input;
        }

        @Override
        public Table visit(DictionarySegment<?> segment) {
            scanDictionarySegment(segment.as(type), chunkId, matches);
            return input;
        }

        @Override
        public Table visit(ReferenceSegment segment) {
            scanReferenceSegment(segment, matches);
            return segment.referencedTable();
        }
    }

    private void scanValueSegment(ValueSegment<T> segment, ChunkID chunkId, List<RowID> matches) {
        List<T> values = segment.values();
        for (int offset = 0; offset < values.size(); offset++) {
            if (scanType.matches(values.get(offset), searchValue)) {
                matches.add(new RowID(chunkId, new ChunkOffset(offset)));
            }
        }
    }

    private void scanDictionarySegment(DictionarySegment<T> segment, ChunkID chunkId, List<RowID> matches) {
        AttributeVector attributeVector = segment.attributeVector();
        IntConsumer collector = offset -> matches.add(new RowID(chunkId, new ChunkOffset(offset)));
        ValueID searchId = segment.lowerBound(searchValue);

        // All dictionary entries are smaller than the search value
        if (!searchId.isValid()) {
            switch (scanType) {
                case LESS_THAN, LESS_THAN_EQUALS, NOT_EQUALS -> fullScan(attributeVector, collector);
                default -> {
                }
            }
            return;
        }

        if (scanType == ScanType.GREATER_THAN_EQUALS || scanType == ScanType.LESS_THAN) {
            attributeVector.forEachMatch(scanType, searchId, collector);
            return;
        }

        if (segment.valueByValueId(searchId).compareTo(searchValue) == 0) {
            attributeVector.forEachMatch(scanType, searchId, collector);
            return;
        }

        // The search value is not in the dictionary, searchId points to the next larger entry
        switch (scanType) {
            case NOT_EQUALS -> fullScan(attributeVector, collector);
            case GREATER_THAN -> attributeVector.forEachMatch(ScanType.GREATER_THAN_EQUALS, searchId, collector);
            case LESS_THAN_EQUALS -> attributeVector.forEachMatch(ScanType.LESS_THAN, searchId, collector);
            default -> {
            }
        }
    }

    /**
     * Reports every row of the attribute vector. Stored codes never equal the invalid id.
     */
    private static void fullScan(AttributeVector attributeVector, IntConsumer collector) {
        attributeVector.forEachMatch(ScanType.NOT_EQUALS, ValueID.INVALID_VALUE_ID, collector);
    }

    private void scanReferenceSegment(ReferenceSegment segment, List<RowID> matches) {
        Table table = segment.referencedTable();
        PosList positions = segment.posList();

        if (positions.size() < (long) referenceFallbackFactor * table.chunkCount()) {
            LOG.log(System.Logger.Level.DEBUG, "Scanning {0} referenced rows individually", positions.size());
            scanReferencedRows(segment, matches);
        }
        else {
            LOG.log(System.Logger.Level.DEBUG, "Scanning {0} referenced rows across {1} segments",
                    positions.size(), table.chunkCount());
            scanReferencedSegments(segment, matches);
        }
    }

    /**
     * Reads every referenced row through the generic segment access path.
     */
    private void scanReferencedRows(ReferenceSegment segment, List<RowID> matches) {
        Table table = segment.referencedTable();
        ColumnID referencedColumn = segment.referencedColumnId();

        for (RowID rowId : segment.posList()) {
            Segment referenced = table.getChunk(rowId.chunkId()).getSegment(referencedColumn);
            if (scanType.matches(type.cast(referenced.get(rowId.chunkOffset())), searchValue)) {
                matches.add(rowId);
            }
        }
    }

    /**
     * Classifies the referenced column's segments once, then reads typed values for every row id.
     */
    private void scanReferencedSegments(ReferenceSegment segment, List<RowID> matches) {
        Table table = segment.referencedTable();
        ColumnID referencedColumn = segment.referencedColumnId();

        List<ValueSegment<T>> valueSegments = new ArrayList<>();
        List<DictionarySegment<T>> dictionarySegments = new ArrayList<>();
        // Per referenced chunk: index into valueSegments if >= 0, else -(index into dictionarySegments) - 1
        int[] segmentMapping = new int[table.chunkCount()];

        for (int chunkIndex = 0; chunkIndex < table.chunkCount(); chunkIndex++) {
            int referencedChunk = chunkIndex;
            Segment referenced = table.getChunk(new ChunkID(chunkIndex)).getSegment(referencedColumn);
            segmentMapping[chunkIndex] = referenced.accept(new SegmentVisitor<Integer>() {
                @Override
                public Integer visit(ValueSegment<?> valueSegment) {
                    valueSegments.add(valueSegment.as(type));
                    return valueSegments.size() - 1;
                }

                @Override
                public Integer visit(DictionarySegment<?> dictionarySegment) {
                    dictionarySegments.add(dictionarySegment.as(type));
                    return -dictionarySegments.size();
                }

                @Override
                public Integer visit(ReferenceSegment referenceSegment) {
                    throw new IllegalStateException("Reference segments may only reference value or dictionary "
                            + "segments, but chunk " + referencedChunk + " holds " + referenceSegment);
                }
            });
        }

        for (RowID rowId : segment.posList()) {
            int mapping = segmentMapping[rowId.chunkId().value()];
            int offset = rowId.chunkOffset().value();
            T value = mapping >= 0
                    ? valueSegments.get(mapping).valueAt(offset)
                    : dictionarySegments.get(-mapping - 1).valueAt(offset);
            if (scanType.matches(value, searchValue)) {
                matches.add(rowId);
            }
        }
    }
}
