/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.operators;

import java.io.PrintStream;
import java.util.Objects;

import dev.sapwood.storage.Chunk;
import dev.sapwood.storage.Table;
import dev.sapwood.types.ChunkID;
import dev.sapwood.types.ChunkOffset;
import dev.sapwood.types.ColumnID;

/**
 * Writes the input table's schema and rows to a stream, chunk by chunk, and outputs the
 * input table unchanged.
 */
public final class Print extends AbstractOperator {

    private final PrintStream out;

    public Print(AbstractOperator input, PrintStream out) {
        super(Objects.requireNonNull(input, "input"));
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    protected Table onExecute() {
        Table table = leftInputTable();
        int columnCount = table.columnCount();

        out.println("=== Columns");
        StringBuilder names = new StringBuilder("|");
        StringBuilder types = new StringBuilder("|");
        for (int column = 0; column < columnCount; column++) {
            ColumnID columnId = new ColumnID(column);
            names.append(table.columnName(columnId)).append('|');
            types.append(table.columnType(columnId)).append('|');
        }
        out.println(names);
        out.println(types);

        for (int chunkIndex = 0; chunkIndex < table.chunkCount(); chunkIndex++) {
            Chunk chunk = table.getChunk(new ChunkID(chunkIndex));
            out.println("=== Chunk " + chunkIndex + " ===");
            for (int offset = 0; offset < chunk.size(); offset++) {
                StringBuilder row = new StringBuilder("|");
                for (int column = 0; column < columnCount; column++) {
                    row.append(chunk.getSegment(new ColumnID(column)).get(new ChunkOffset(offset))).append('|');
                }
                out.println(row);
            }
        }
        return table;
    }
}
