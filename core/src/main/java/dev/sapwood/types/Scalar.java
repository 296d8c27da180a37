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
 * Container for a single value of any supported {@link DataType}.
 * <p>
 * Used wherever the concrete type is not known statically: row appends, predicate
 * literals and the generic read path of segments. Typed code unwraps a scalar with
 * {@link DataType#cast(Scalar)}.
 * </p>
 */
public sealed interface Scalar {

    DataType<?> type();

    /** The value, boxed to the Java type of {@link #type()}. */
    Object boxed();

    static Scalar of(int value) {
        return new IntScalar(value);
    }

    static Scalar of(long value) {
        return new LongScalar(value);
    }

    static Scalar of(float value) {
        return new FloatScalar(value);
    }

    static Scalar of(double value) {
        return new DoubleScalar(value);
    }

    static Scalar of(String value) {
        return new StringScalar(value);
    }

    /**
     * Wraps a boxed value of one of the supported Java types.
     */
    static Scalar of(Object value) {
        if (value instanceof Integer i) {
            return new IntScalar(i);
        }
        if (value instanceof Long l) {
            return new LongScalar(l);
        }
        if (value instanceof Float f) {
            return new FloatScalar(f);
        }
        if (value instanceof Double d) {
            return new DoubleScalar(d);
        }
        if (value instanceof String s) {
            return new StringScalar(s);
        }
        throw new IllegalArgumentException("Unsupported value type: "
                + (value == null ? "null" : value.getClass().getName()));
    }

    record IntScalar(int value) implements Scalar {
        @Override
        public DataType<?> type() {
            return DataType.INT;
        }

        @Override
        public Object boxed() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record LongScalar(long value) implements Scalar {
        @Override
        public DataType<?> type() {
            return DataType.LONG;
        }

        @Override
        public Object boxed() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record FloatScalar(float value) implements Scalar {
        @Override
        public DataType<?> type() {
            return DataType.FLOAT;
        }

        @Override
        public Object boxed() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record DoubleScalar(double value) implements Scalar {
        @Override
        public DataType<?> type() {
            return DataType.DOUBLE;
        }

        @Override
        public Object boxed() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record StringScalar(String value) implements Scalar {
        public StringScalar {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public DataType<?> type() {
            return DataType.STRING;
        }

        @Override
        public Object boxed() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
