/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import java.util.function.IntConsumer;

import dev.sapwood.types.ScanType;
import dev.sapwood.types.ValueID;

/**
 * Fixed-size array of dictionary codes backing a {@link DictionarySegment}.
 * <p>
 * Codes are unsigned and stored with one of three widths, chosen once when the vector is
 * allocated (see {@link AttributeVectorWidth#forDistinctCount(long)}):
 * <ul>
 *   <li>{@link ByteAttributeVector} - 1 byte per row</li>
 *   <li>{@link ShortAttributeVector} - 2 bytes per row</li>
 *   <li>{@link IntAttributeVector} - 4 bytes per row</li>
 * </ul>
 * Callers stay width-agnostic; each variant branches on its own array type only. Codes are
 * written only while the owning dictionary segment is built and are read-only afterwards.
 * </p>
 */
public abstract sealed class AttributeVector
        permits AttributeVector.ByteAttributeVector, AttributeVector.ShortAttributeVector,
        AttributeVector.IntAttributeVector {

    private AttributeVector() {
    }

    public abstract ValueID get(int offset);

    /**
     * Stores a code.
     *
     * @throws IllegalStateException if the id does not fit into this vector's width
     */
    abstract void set(int offset, ValueID valueId);

    public abstract int size();

    public abstract AttributeVectorWidth width();

    /**
     * Compares every stored code with {@code searchId} and reports the offsets whose
     * comparison satisfies {@code scanType}, in ascending order. Codes are compared as
     * unsigned numbers, without decoding them.
     */
    public abstract void forEachMatch(ScanType scanType, ValueID searchId, IntConsumer matchingOffsets);

    static AttributeVector allocate(AttributeVectorWidth width, int size) {
        return switch (width) {
            case BYTE -> new ByteAttributeVector(size);
            case SHORT -> new ShortAttributeVector(size);
            case INT -> new IntAttributeVector(size);
        };
    }

    private static void checkFits(AttributeVectorWidth width, ValueID valueId) {
        if (valueId.unsignedValue() > width.maxValue()) {
            throw new IllegalStateException("Value id " + valueId + " out of range for attribute vector of width "
                    + width.bytes());
        }
    }

    public static final class ByteAttributeVector extends AttributeVector {

        private final byte[] codes;

        private ByteAttributeVector(int size) {
            this.codes = new byte[size];
        }

        @Override
        public ValueID get(int offset) {
            return new ValueID(Byte.toUnsignedInt(codes[offset]));
        }

        @Override
        void set(int offset, ValueID valueId) {
            checkFits(AttributeVectorWidth.BYTE, valueId);
            codes[offset] = (byte) valueId.value();
        }

        @Override
        public int size() {
            return codes.length;
        }

        @Override
        public AttributeVectorWidth width() {
            return AttributeVectorWidth.BYTE;
        }

        @Override
        public void forEachMatch(ScanType scanType, ValueID searchId, IntConsumer matchingOffsets) {
            int search = AttributeVectorWidth.BYTE.narrow(searchId);
            for (int i = 0; i < codes.length; i++) {
                if (scanType.test(Integer.compare(Byte.toUnsignedInt(codes[i]), search))) {
                    matchingOffsets.accept(i);
                }
            }
        }
    }

    public static final class ShortAttributeVector extends AttributeVector {

        private final short[] codes;

        private ShortAttributeVector(int size) {
            this.codes = new short[size];
        }

        @Override
        public ValueID get(int offset) {
            return new ValueID(Short.toUnsignedInt(codes[offset]));
        }

        @Override
        void set(int offset, ValueID valueId) {
            checkFits(AttributeVectorWidth.SHORT, valueId);
            codes[offset] = (short) valueId.value();
        }

        @Override
        public int size() {
            return codes.length;
        }

        @Override
        public AttributeVectorWidth width() {
            return AttributeVectorWidth.SHORT;
        }

        @Override
        public void forEachMatch(ScanType scanType, ValueID searchId, IntConsumer matchingOffsets) {
            int search = AttributeVectorWidth.SHORT.narrow(searchId);
            for (int i = 0; i < codes.length; i++) {
                if (scanType.test(Integer.compare(Short.toUnsignedInt(codes[i]), search))) {
                    matchingOffsets.accept(i);
                }
            }
        }
    }

    public static final class IntAttributeVector extends AttributeVector {

        private final int[] codes;

        private IntAttributeVector(int size) {
            this.codes = new int[size];
        }

        @Override
        public ValueID get(int offset) {
            return new ValueID(codes[offset]);
        }

        @Override
        void set(int offset, ValueID valueId) {
            codes[offset] = valueId.value();
        }

        @Override
        public int size() {
            return codes.length;
        }

        @Override
        public AttributeVectorWidth width() {
            return AttributeVectorWidth.INT;
        }

        @Override
        public void forEachMatch(ScanType scanType, ValueID searchId, IntConsumer matchingOffsets) {
            int search = searchId.value();
            for (int i = 0; i < codes.length; i++) {
                if (scanType.test(Integer.compareUnsigned(codes[i], search))) {
                    matchingOffsets.accept(i);
                }
            }
        }
    }
}
