/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import dev.sapwood.types.ChunkOffset;
import dev.sapwood.types.DataType;
import dev.sapwood.types.Scalar;

/**
 * One column's worth of data within one chunk.
 * <p>
 * There are exactly three physical representations:
 * <ul>
 *   <li>{@link ValueSegment} - uncompressed, appendable values</li>
 *   <li>{@link DictionarySegment} - immutable, dictionary-encoded values</li>
 *   <li>{@link ReferenceSegment} - positions into another table, used for intermediate results</li>
 * </ul>
 * {@link #get(ChunkOffset)} works uniformly across all of them; performance-critical code
 * dispatches on the concrete representation via {@link #accept(SegmentVisitor)} instead.
 * </p>
 */
public sealed interface Segment permits ValueSegment, DictionarySegment, ReferenceSegment {

    /** Get the value at the given row offset, boxed into a scalar. */
    Scalar get(ChunkOffset offset);

    int size();

    DataType<?> dataType();

    /**
     * Appends a value. Only supported by value segments.
     *
     * @throws UnsupportedOperationException for immutable segments
     * @throws IllegalArgumentException if the value's type does not match {@link #dataType()}
     */
    void append(Scalar value);

    <R> R accept(SegmentVisitor<R> visitor);
}
