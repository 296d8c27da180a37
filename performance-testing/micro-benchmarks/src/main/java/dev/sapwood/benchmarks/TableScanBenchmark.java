/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.benchmarks;

import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.sapwood.operators.TableScan;
import dev.sapwood.operators.TableWrapper;
import dev.sapwood.storage.Table;
import dev.sapwood.types.ChunkID;
import dev.sapwood.types.ColumnID;
import dev.sapwood.types.DataType;
import dev.sapwood.types.Scalar;
import dev.sapwood.types.ScanType;

/**
 * Compares scans over value and dictionary segments, and the two strategies for scanning
 * reference segments.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms1g", "-Xmx1g" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class TableScanBenchmark {

    private static final ColumnID VALUE_COLUMN = new ColumnID(0);

    @Param({ "1000000" })
    private int rowCount;

    @Param({ "65535" })
    private int chunkSize;

    @Param({ "1000" })
    private int distinctValues;

    private Table uncompressed;
    private Table compressed;
    private TableWrapper filteredUncompressed;
    private TableWrapper filteredCompressed;

    @Setup
    public void setup() {
        uncompressed = createTable();
        compressed = createTable();
        for (int i = 0; i < compressed.chunkCount(); i++) {
            compressed.compressChunk(new ChunkID(i));
        }

        filteredUncompressed = prefilter(uncompressed);
        filteredCompressed = prefilter(compressed);
    }

    private Table createTable() {
        Random random = new Random(42);
        Table table = new Table(chunkSize);
        table.addColumn("value", DataType.INT);
        table.addColumn("label", DataType.STRING);
        for (int i = 0; i < rowCount; i++) {
            int value = random.nextInt(distinctValues);
            table.append(Scalar.of(value), Scalar.of("label-" + (value % 16)));
        }
        return table;
    }

    private TableWrapper prefilter(Table table) {
        TableWrapper wrapper = new TableWrapper(table);
        wrapper.execute();
        TableScan scan = new TableScan(wrapper, VALUE_COLUMN, ScanType.LESS_THAN, Scalar.of(distinctValues / 2));
        scan.execute();
        TableWrapper filtered = new TableWrapper(scan.getOutput());
        filtered.execute();
        return filtered;
    }

    private static Table scan(Table table, ScanType scanType, int searchValue) {
        TableWrapper wrapper = new TableWrapper(table);
        wrapper.execute();
        TableScan scan = new TableScan(wrapper, VALUE_COLUMN, scanType, Scalar.of(searchValue));
        scan.execute();
        return scan.getOutput();
    }

    private static Table scanReferences(TableWrapper input, int searchValue, int fallbackFactor) {
        TableScan scan = new TableScan(input, VALUE_COLUMN, ScanType.GREATER_THAN_EQUALS, Scalar.of(searchValue),
                fallbackFactor);
        scan.execute();
        return scan.getOutput();
    }

    @Benchmark
    public void a_scanValueSegments(Blackhole blackhole) {
        blackhole.consume(scan(uncompressed, ScanType.GREATER_THAN, distinctValues / 2));
    }

    @Benchmark
    public void b_scanDictionarySegments(Blackhole blackhole) {
        blackhole.consume(scan(compressed, ScanType.GREATER_THAN, distinctValues / 2));
    }

    @Benchmark
    public void c_scanReferencesRowByRow(Blackhole blackhole) {
        blackhole.consume(scanReferences(filteredUncompressed, distinctValues / 4, Integer.MAX_VALUE));
        blackhole.consume(scanReferences(filteredCompressed, distinctValues / 4, Integer.MAX_VALUE));
    }

    @Benchmark
    public void d_scanReferencesBatched(Blackhole blackhole) {
        blackhole.consume(scanReferences(filteredUncompressed, distinctValues / 4, 0));
        blackhole.consume(scanReferences(filteredCompressed, distinctValues / 4, 0));
    }
}
