/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

import dev.sapwood.types.ChunkID;
import dev.sapwood.types.ColumnID;
import dev.sapwood.types.DataType;
import dev.sapwood.types.Scalar;

/**
 * An ordered sequence of chunks sharing one schema.
 * <p>
 * Rows are appended to the last chunk; as soon as it holds {@link #chunkSize()} rows, a new
 * last chunk is allocated. A chunk size of 0 means chunks are unbounded. The schema can only
 * be changed while the table has no rows.
 * </p>
 * <p>
 * A table supports a single writer. Allocating chunks and deciding whether a chunk still
 * needs to be compressed are serialized by a per-table lock, so {@link #compressChunk(ChunkID)}
 * compresses a chunk exactly once even when called concurrently; the compression work itself
 * runs outside the lock. Scanning a table while it is being modified is not supported.
 * </p>
 */
public final class Table {

    private static final System.Logger LOG = System.getLogger(Table.class.getName());

    private final int chunkSize;
    private final List<String> columnNames = new ArrayList<>();
    private final List<DataType<?>> columnTypes = new ArrayList<>();
    private final Map<String, ColumnID> columnIdsByName = new HashMap<>();

    private final List<Chunk> chunks = new CopyOnWriteArrayList<>();
    private final BitSet compressedChunks = new BitSet();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Create a table with unbounded chunks.
     */
    public Table() {
        this(0);
    }

    /**
     * Create a table whose chunks hold at most {@code chunkSize} rows (0 for unbounded).
     */
    public Table(int chunkSize) {
        if (chunkSize < 0) {
            throw new IllegalArgumentException("Chunk size must not be negative: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        createNewChunk();
    }

    /**
     * Adds a column to the schema without adding segments to the existing chunks. Used for
     * tables whose chunks are built externally and added via {@link #emplaceChunk(Chunk)}.
     */
    public void addColumnDefinition(String name, DataType<?> type) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (rowCount() > 0) {
            throw new IllegalStateException("Columns can only be added to empty tables, column: " + name);
        }
        if (columnIdsByName.containsKey(name)) {
            throw new IllegalArgumentException("Column with name '" + name + "' already exists");
        }
        columnIdsByName.put(name, new ColumnID(columnNames.size()));
        columnNames.add(name);
        columnTypes.add(type);
    }

    /**
     * Adds a column to the schema and an empty value segment for it to every chunk.
     */
    public void addColumn(String name, DataType<?> type) {
        addColumnDefinition(name, type);
        for (Chunk chunk : chunks) {
            chunk.addSegment(ValueSegment.create(type));
        }
    }

    public void addColumn(String name, String typeName) {
        addColumn(name, DataType.forName(typeName));
    }

    public void append(Scalar... values) {
        append(Arrays.asList(values));
    }

    /**
     * Appends a row to the last chunk.
     *
     * @throws IllegalArgumentException if the number or the types of the values do not match the schema
     */
    public void append(List<Scalar> values) {
        if (values.size() != columnCount()) {
            throw new IllegalArgumentException("Number of values (" + values.size()
                    + ") does not match number of columns (" + columnCount() + ")");
        }
        for (int i = 0; i < values.size(); i++) {
            columnTypes.get(i).cast(values.get(i));
        }

        Chunk chunk = lastChunk();
        if (!chunk.isMutable()) {
            createNewChunk();
            chunk = lastChunk();
        }

        chunk.append(values);
        if (chunkSize != 0 && chunk.size() >= chunkSize) {
            createNewChunk();
        }
    }

    private Chunk lastChunk() {
        return chunks.get(chunks.size() - 1);
    }

    private void createNewChunk() {
        Chunk chunk = new Chunk();
        for (DataType<?> type : columnTypes) {
            chunk.addSegment(ValueSegment.create(type));
        }

        lock.lock();
        try {
            chunks.add(chunk);
            compressedChunks.clear(chunks.size() - 1);
        }
        finally {
            lock.unlock();
        }
        LOG.log(System.Logger.Level.TRACE, "Allocated chunk {0}", chunks.size() - 1);
    }

    public int columnCount() {
        return columnNames.size();
    }

    public long rowCount() {
        long rows = 0;
        for (Chunk chunk : chunks) {
            rows += chunk.size();
        }
        return rows;
    }

    public int chunkCount() {
        return chunks.size();
    }

    public ColumnID columnIdByName(String columnName) {
        ColumnID columnId = columnIdsByName.get(columnName);
        if (columnId == null) {
            throw new IllegalArgumentException("Column not found: " + columnName);
        }
        return columnId;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public List<String> columnNames() {
        return Collections.unmodifiableList(columnNames);
    }

    public String columnName(ColumnID columnId) {
        return columnNames.get(Objects.checkIndex(columnId.value(), columnNames.size()));
    }

    public DataType<?> columnType(ColumnID columnId) {
        return columnTypes.get(Objects.checkIndex(columnId.value(), columnTypes.size()));
    }

    public Chunk getChunk(ChunkID chunkId) {
        return chunks.get(Objects.checkIndex(chunkId.value(), chunks.size()));
    }

    /**
     * Adds a chunk that was built outside of this table. It replaces the last chunk if that
     * one is empty, and is added after it otherwise.
     */
    public void emplaceChunk(Chunk chunk) {
        if (chunk.columnCount() != columnCount()) {
            throw new IllegalArgumentException("Chunk has " + chunk.columnCount() + " columns but table has "
                    + columnCount());
        }

        lock.lock();
        try {
            int last = chunks.size() - 1;
            if (chunks.get(last).size() == 0) {
                chunks.set(last, chunk);
                compressedChunks.clear(last);
            }
            else {
                chunks.add(chunk);
                compressedChunks.clear(chunks.size() - 1);
            }
        }
        finally {
            lock.unlock();
        }
    }

    public boolean isChunkCompressed(ChunkID chunkId) {
        int index = Objects.checkIndex(chunkId.value(), chunks.size());
        lock.lock();
        try {
            return compressedChunks.get(index);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the value segments of a chunk with dictionary segments holding the same values.
     * Calling this for a chunk that has already been compressed does nothing.
     *
     * @throws IllegalStateException if the chunk holds reference segments
     */
    public void compressChunk(ChunkID chunkId) {
        int index = Objects.checkIndex(chunkId.value(), chunks.size());
        Chunk chunk = chunks.get(index);
        for (Segment segment : chunk.segments()) {
            if (segment instanceof ReferenceSegment) {
                throw new IllegalStateException("Cannot compress chunk " + index + " holding reference segments");
            }
        }

        lock.lock();
        try {
            if (compressedChunks.get(index)) {
                return;
            }
            compressedChunks.set(index);
        }
        finally {
            lock.unlock();
        }

        Chunk compressedChunk = new Chunk();
        List<Integer> widths = new ArrayList<>();
        for (Segment segment : chunk.segments()) {
            if (segment instanceof ValueSegment<?> valueSegment) {
                DictionarySegment<?> dictionarySegment = DictionarySegment.compress(valueSegment);
                widths.add(dictionarySegment.attributeVector().width().bytes());
                compressedChunk.addSegment(dictionarySegment);
            }
            else {
                compressedChunk.addSegment(segment);
            }
        }

        lock.lock();
        try {
            chunks.set(index, compressedChunk);
        }
        finally {
            lock.unlock();
        }

        LOG.log(System.Logger.Level.DEBUG, "Compressed chunk {0} with {1} rows, attribute vector widths {2}",
                index, compressedChunk.size(), widths);
    }
}
