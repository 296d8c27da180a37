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

import dev.sapwood.types.ColumnID;
import dev.sapwood.types.Scalar;

/**
 * A horizontal partition of a table, holding one segment per column. All segments of a
 * chunk have the same number of rows.
 */
public final class Chunk {

    private final List<Segment> segments = new ArrayList<>();

    public void addSegment(Segment segment) {
        Objects.requireNonNull(segment, "segment");
        if (!segments.isEmpty() && segment.size() != size()) {
            throw new IllegalArgumentException("Segment has " + segment.size() + " rows but chunk has " + size());
        }
        segments.add(segment);
    }

    /**
     * Appends a row. Either all values are appended or, if any value is rejected, none.
     *
     * @throws IllegalArgumentException if the number or the types of the values do not match the segments
     * @throws UnsupportedOperationException if the chunk holds immutable segments
     */
    public void append(List<Scalar> values) {
        if (values.size() != segments.size()) {
            throw new IllegalArgumentException("Number of values (" + values.size()
                    + ") does not match number of columns (" + segments.size() + ")");
        }

        for (int i = 0; i < values.size(); i++) {
            Segment segment = segments.get(i);
            if (!(segment instanceof ValueSegment<?> valueSegment)) {
                throw new UnsupportedOperationException("Cannot append to immutable segment of column " + i + ": "
                        + segment);
            }
            valueSegment.dataType().cast(values.get(i));
        }

        for (int i = 0; i < values.size(); i++) {
            segments.get(i).append(values.get(i));
        }
    }

    public Segment getSegment(ColumnID columnId) {
        return segments.get(Objects.checkIndex(columnId.value(), segments.size()));
    }

    public List<Segment> segments() {
        return Collections.unmodifiableList(segments);
    }

    public int columnCount() {
        return segments.size();
    }

    public int size() {
        if (segments.isEmpty()) {
            return 0;
        }
        return segments.get(0).size();
    }

    /**
     * Returns true if rows can be appended, i.e. all segments are value segments.
     */
    public boolean isMutable() {
        for (Segment segment : segments) {
            if (!(segment instanceof ValueSegment)) {
                return false;
            }
        }
        return true;
    }
}
