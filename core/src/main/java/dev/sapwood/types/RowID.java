/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.types;

import java.util.Objects;

/**
 * Global address of a row within one table.
 */
public record RowID(ChunkID chunkId, ChunkOffset chunkOffset) {

    public RowID {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(chunkOffset, "chunkOffset");
    }

    public static RowID of(int chunkId, int chunkOffset) {
        return new RowID(new ChunkID(chunkId), new ChunkOffset(chunkOffset));
    }

    @Override
    public String toString() {
        return "RowID[" + chunkId.value() + ", " + chunkOffset.value() + "]";
    }
}
