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
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import dev.sapwood.types.ChunkOffset;
import dev.sapwood.types.DataType;
import dev.sapwood.types.Scalar;
import dev.sapwood.types.ValueID;

/**
 * Immutable dictionary-encoded segment.
 * <p>
 * Holds the column's distinct values in ascending order plus an {@link AttributeVector}
 * mapping every row to the index of its value in the dictionary. Since dictionary order
 * mirrors value order, predicates can be evaluated on the codes without decoding them.
 * </p>
 *
 * @param <T> the Java type of the segment's values
 */
public final class DictionarySegment<T extends Comparable<T>> implements Segment {

    private final DataType<T> dataType;
    private final List<T> dictionary;
    private final AttributeVector attributeVector;

    private DictionarySegment(DataType<T> dataType, List<T> dictionary, AttributeVector attributeVector) {
        this.dataType = dataType;
        this.dictionary = dictionary;
        this.attributeVector = attributeVector;
    }

    /**
     * Builds a dictionary segment holding the same values, in the same row order, as the given
     * value segment. The attribute vector width is derived from the number of distinct values.
     */
    public static <T extends Comparable<T>> DictionarySegment<T> compress(ValueSegment<T> source) {
        List<T> values = source.values();

        TreeMap<T, Integer> codes = new TreeMap<>();
        for (T value : values) {
            codes.putIfAbsent(value, 0);
        }

        List<T> dictionary = new ArrayList<>(codes.size());
        int code = 0;
        for (Map.Entry<T, Integer> entry : codes.entrySet()) {
            entry.setValue(code++);
            dictionary.add(entry.getKey());
        }

        AttributeVectorWidth width = AttributeVectorWidth.forDistinctCount(dictionary.size());
        AttributeVector attributeVector = AttributeVector.allocate(width, values.size());
        for (int i = 0; i < values.size(); i++) {
            attributeVector.set(i, new ValueID(codes.get(values.get(i))));
        }

        return new DictionarySegment<>(source.dataType(), Collections.unmodifiableList(dictionary), attributeVector);
    }

    /**
     * Get the value at a row offset. Scans should work on the attribute vector instead.
     */
    @Override
    public Scalar get(ChunkOffset offset) {
        return dataType.toScalar(valueAt(offset.value()));
    }

    public T valueAt(int offset) {
        return dictionary.get(attributeVector.get(Objects.checkIndex(offset, size())).value());
    }

    @Override
    public int size() {
        return attributeVector.size();
    }

    @Override
    public DataType<T> dataType() {
        return dataType;
    }

    @Override
    public void append(Scalar value) {
        throw new UnsupportedOperationException("Cannot append to immutable dictionary segment");
    }

    /** The distinct values of this segment, in ascending order. */
    public List<T> dictionary() {
        return dictionary;
    }

    public AttributeVector attributeVector() {
        return attributeVector;
    }

    public T valueByValueId(ValueID valueId) {
        if (!valueId.isValid() || valueId.unsignedValue() >= dictionary.size()) {
            throw new IndexOutOfBoundsException("Value id " + valueId + " out of range for dictionary of size "
                    + dictionary.size());
        }
        return dictionary.get(valueId.value());
    }

    /**
     * Returns the id of the first dictionary entry that is {@code >= value}, or
     * {@link ValueID#INVALID_VALUE_ID} if all entries are smaller.
     */
    public ValueID lowerBound(T value) {
        int index = Collections.binarySearch(dictionary, value);
        int position = index >= 0 ? index : -index - 1;
        return toValueId(position);
    }

    public ValueID lowerBound(Scalar value) {
        return lowerBound(dataType.cast(value));
    }

    /**
     * Returns the id of the first dictionary entry that is {@code > value}, or
     * {@link ValueID#INVALID_VALUE_ID} if all entries are smaller or equal.
     */
    public ValueID upperBound(T value) {
        int index = Collections.binarySearch(dictionary, value);
        int position = index >= 0 ? index + 1 : -index - 1;
        return toValueId(position);
    }

    public ValueID upperBound(Scalar value) {
        return upperBound(dataType.cast(value));
    }

    private ValueID toValueId(int position) {
        return position == dictionary.size() ? ValueID.INVALID_VALUE_ID : new ValueID(position);
    }

    public int uniqueValuesCount() {
        return dictionary.size();
    }

    /**
     * Narrows this segment to the given data type.
     *
     * @throws IllegalArgumentException if the segment holds values of another type
     */
    @SuppressWarnings("unchecked")
    public <U extends Comparable<U>> DictionarySegment<U> as(DataType<U> type) {
        if (type != dataType) {
            throw new IllegalArgumentException("Type mismatch: segment holds " + dataType + " values, not " + type);
        }
        return (DictionarySegment<U>) this;
    }

    @Override
    public <R> R accept(SegmentVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "DictionarySegment[type=" + dataType + ", size=" + size() + ", uniqueValues=" + dictionary.size()
                + ", width=" + attributeVector.width().bytes() + "]";
    }
}
