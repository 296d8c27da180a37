/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.operators;

import java.util.Objects;

import dev.sapwood.internal.scan.TypedTableScan;
import dev.sapwood.storage.Table;
import dev.sapwood.types.ColumnID;
import dev.sapwood.types.DataType;
import dev.sapwood.types.Scalar;
import dev.sapwood.types.ScanType;

/**
 * Selects the rows of the input table for which {@code column <scanType> searchValue} holds.
 * <p>
 * The output has the input's schema and a single chunk in which every column is a
 * {@link dev.sapwood.storage.ReferenceSegment}; all of them share one position list holding
 * the matching rows in ascending row id order. When the input itself consists of reference
 * segments, the output points at the table those segments reference, never at the input.
 * </p>
 * <p>
 * The type of {@code searchValue} must match the column type. This is checked as soon as the
 * input table is known, before any row is examined.
 * </p>
 */
public final class TableScan extends AbstractOperator {

    private static final String REFERENCE_FALLBACK_FACTOR_PROPERTY = "sapwood.scan.referenceFallbackFactor";

    /**
     * Reference segments whose position list has fewer than this many entries per chunk of the
     * referenced table are scanned row by row instead of classifying the referenced segments first.
     */
    public static final int DEFAULT_REFERENCE_FALLBACK_FACTOR = Integer.getInteger(REFERENCE_FALLBACK_FACTOR_PROPERTY, 5);

    private final ColumnID columnId;
    private final ScanType scanType;
    private final Scalar searchValue;
    private final int referenceFallbackFactor;

    public TableScan(AbstractOperator input, ColumnID columnId, ScanType scanType, Scalar searchValue) {
        this(input, columnId, scanType, searchValue, DEFAULT_REFERENCE_FALLBACK_FACTOR);
    }

    public TableScan(AbstractOperator input, ColumnID columnId, ScanType scanType, Scalar searchValue,
                     int referenceFallbackFactor) {
        super(Objects.requireNonNull(input, "input"));
        this.columnId = Objects.requireNonNull(columnId, "columnId");
        this.scanType = Objects.requireNonNull(scanType, "scanType");
        this.searchValue = Objects.requireNonNull(searchValue, "searchValue");
        if (referenceFallbackFactor < 0) {
            throw new IllegalArgumentException("Reference fallback factor must not be negative: "
                    + referenceFallbackFactor);
        }
        this.referenceFallbackFactor = referenceFallbackFactor;

        if (input.hasOutput()) {
            input.getOutput().columnType(columnId).cast(searchValue);
        }
    }

    public ColumnID columnId() {
        return columnId;
    }

    public ScanType scanType() {
        return scanType;
    }

    public Scalar searchValue() {
        return searchValue;
    }

    @Override
    protected Table onExecute() {
        Table input = leftInputTable();
        return scan(input.columnType(columnId), input);
    }

    private <T extends Comparable<T>> Table scan(DataType<T> type, Table input) {
        T value = type.cast(searchValue);
        return new TypedTableScan<>(type, columnId, scanType, value, referenceFallbackFactor).execute(input);
    }
}
