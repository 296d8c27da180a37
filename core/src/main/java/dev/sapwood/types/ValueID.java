/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.types;

/**
 * Index of an entry within a dictionary or an attribute vector.
 * <p>
 * The wrapped {@code int} is interpreted as an unsigned 32 bit number. The maximum
 * value, {@link #INVALID_VALUE_ID}, is reserved as the "no such entry" result of
 * dictionary searches and is never stored in an attribute vector.
 * </p>
 */
public record ValueID(int value) {

    public static final ValueID INVALID_VALUE_ID = new ValueID(-1);

    public static ValueID of(long value) {
        if (value < 0 || value > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("Value id out of unsigned 32 bit range: " + value);
        }
        return new ValueID((int) value);
    }

    public boolean isValid() {
        return value != INVALID_VALUE_ID.value;
    }

    /**
     * Returns the id as a non-negative number.
     */
    public long unsignedValue() {
        return Integer.toUnsignedLong(value);
    }

    @Override
    public String toString() {
        return isValid() ? "ValueID[" + Integer.toUnsignedString(value) + "]" : "ValueID[INVALID]";
    }
}
