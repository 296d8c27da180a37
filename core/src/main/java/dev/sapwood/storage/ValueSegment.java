/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import dev.sapwood.types.ChunkOffset;
import dev.sapwood.types.DataType;
import dev.sapwood.types.Scalar;

/**
 * Uncompressed segment holding its values in insertion order. Append is the only mutation.
 *
 * @param <T> the Java type of the segment's values
 */
public final class ValueSegment<T extends Comparable<T>> implements Segment {

    private final DataType<T> dataType;
    private final List<T> values;

    public ValueSegment(DataType<T> dataType) {
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.values = new ArrayList<>();
    }

    /**
     * Creates an empty segment for a data type only known at runtime.
     */
    public static <T extends Comparable<T>> ValueSegment<T> create(DataType<T> dataType) {
        return new ValueSegment<>(dataType);
    }

    @Override
    public Scalar get(ChunkOffset offset) {
        return dataType.toScalar(valueAt(offset.value()));
    }

    public T valueAt(int offset) {
        return values.get(Objects.checkIndex(offset, values.size()));
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public DataType<T> dataType() {
        return dataType;
    }

    @Override
    public void append(Scalar value) {
        values.add(dataType.cast(value));
    }

    public void appendValue(T value) {
        values.add(Objects.requireNonNull(value, "value"));
    }

    /**
     * Read-only view of the values, for bulk scanning.
     */
    public List<T> values() {
        return Collections.unmodifiableList(values);
    }

    /**
     * Narrows this segment to the given data type.
     *
     * @throws IllegalArgumentException if the segment holds values of another type
     */
    @SuppressWarnings("unchecked")
    public <U extends Comparable<U>> ValueSegment<U> as(DataType<U> type) {
        if (type != dataType) {
            throw new IllegalArgumentException("Type mismatch: segment holds " + dataType + " values, not " + type);
        }
        return (ValueSegment<U>) this;
    }

    @Override
    public <R> R accept(SegmentVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "ValueSegment[type=" + dataType + ", size=" + values.size() + "]";
    }
}
