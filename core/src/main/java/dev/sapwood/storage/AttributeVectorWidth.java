/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import dev.sapwood.types.ValueID;

/**
 * Byte width of the codes stored in an {@link AttributeVector}.
 */
public enum AttributeVectorWidth {
    BYTE(1, 0xFFL),
    SHORT(2, 0xFFFFL),
    INT(4, 0xFFFFFFFFL);

    private final int bytes;
    private final long maxValue;

    AttributeVectorWidth(int bytes, long maxValue) {
        this.bytes = bytes;
        this.maxValue = maxValue;
    }

    public int bytes() {
        return bytes;
    }

    /** Largest code representable with this width. */
    public long maxValue() {
        return maxValue;
    }

    /**
     * Truncates a value id to this width. {@link ValueID#INVALID_VALUE_ID} becomes the
     * maximum code of the width, which a correctly sized vector never stores.
     */
    public int narrow(ValueID valueId) {
        return (int) (valueId.unsignedValue() & maxValue);
    }

    /**
     * Chooses the narrowest width able to hold codes for {@code distinctCount} dictionary
     * entries while keeping the maximum code free for the invalid id.
     */
    public static AttributeVectorWidth forDistinctCount(long distinctCount) {
        if (distinctCount < BYTE.maxValue) {
            return BYTE;
        }
        if (distinctCount < SHORT.maxValue) {
            return SHORT;
        }
        if (distinctCount < INT.maxValue) {
            return INT;
        }
        throw new IllegalStateException("Segments cannot hold more than 2^32 - 1 distinct values: " + distinctCount);
    }
}
