/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import java.util.Iterator;
import java.util.List;

import dev.sapwood.types.RowID;

/**
 * Immutable, ordered list of row ids selecting a subset of a table's rows.
 * <p>
 * All {@link ReferenceSegment}s of one result chunk share the same instance, which keeps
 * the columns of a filtered row set aligned.
 * </p>
 */
public final class PosList implements Iterable<RowID> {

    private static final PosList EMPTY = new PosList(List.of());

    private final List<RowID> rowIds;

    public PosList(List<RowID> rowIds) {
        this.rowIds = List.copyOf(rowIds);
    }

    public static PosList empty() {
        return EMPTY;
    }

    public RowID get(int index) {
        return rowIds.get(index);
    }

    public int size() {
        return rowIds.size();
    }

    public boolean isEmpty() {
        return rowIds.isEmpty();
    }

    public List<RowID> rowIds() {
        return rowIds;
    }

    @Override
    public Iterator<RowID> iterator() {
        return rowIds.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PosList other && rowIds.equals(other.rowIds);
    }

    @Override
    public int hashCode() {
        return rowIds.hashCode();
    }

    @Override
    public String toString() {
        return "PosList" + rowIds;
    }
}
