/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.types;

/**
 * Position of a row within a chunk.
 */
public record ChunkOffset(int value) {

    public ChunkOffset {
        if (value < 0) {
            throw new IllegalArgumentException("Chunk offset must not be negative: " + value);
        }
    }

    @Override
    public String toString() {
        return "ChunkOffset[" + value + "]";
    }
}
