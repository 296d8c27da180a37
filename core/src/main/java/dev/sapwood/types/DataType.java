/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.types;

import java.util.List;

/**
 * The closed set of scalar value types a column can hold.
 * <p>
 * Each data type is bound to the Java type used to represent its values in typed
 * segments. Values of all types are totally ordered by {@link Comparable#compareTo(Object)}.
 * </p>
 *
 * @param <T> the Java type of values of this data type
 */
public final class DataType<T extends Comparable<T>> {

    public static final DataType<Integer> INT = new DataType<>("int", Integer.class);
    public static final DataType<Long> LONG = new DataType<>("long", Long.class);
    public static final DataType<Float> FLOAT = new DataType<>("float", Float.class);
    public static final DataType<Double> DOUBLE = new DataType<>("double", Double.class);
    public static final DataType<String> STRING = new DataType<>("string", String.class);

    private static final List<DataType<?>> VALUES = List.of(INT, LONG, FLOAT, DOUBLE, STRING);

    private final String name;
    private final Class<T> javaType;

    private DataType(String name, Class<T> javaType) {
        this.name = name;
        this.javaType = javaType;
    }

    /**
     * Looks up a data type by its name, e.g. {@code "int"} or {@code "string"}.
     */
    public static DataType<?> forName(String name) {
        for (DataType<?> type : VALUES) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + name);
    }

    public String name() {
        return name;
    }

    /**
     * Unwraps a scalar of this type.
     *
     * @throws IllegalArgumentException if the scalar holds a value of another type
     */
    public T cast(Scalar scalar) {
        if (scalar.type() != this) {
            throw new IllegalArgumentException("Type mismatch: expected " + name + " but got " + scalar.type().name
                    + " value '" + scalar + "'");
        }
        return javaType.cast(scalar.boxed());
    }

    public Scalar toScalar(T value) {
        return Scalar.of(value);
    }

    @Override
    public String toString() {
        return name;
    }
}
