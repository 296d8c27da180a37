/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.sapwood.types.DataType;
import dev.sapwood.types.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StorageManagerTest {

    private StorageManager storageManager;

    @BeforeEach
    void setUp() {
        storageManager = new StorageManager();
        storageManager.addTable("first_table", new Table());
        storageManager.addTable("second_table", new Table(4));
    }

    @Test
    void testGetTable() {
        Table table = storageManager.getTable("first_table");

        assertThat(table).isSameAs(storageManager.getTable("first_table"));
        assertThat(storageManager.getTable("second_table").chunkSize()).isEqualTo(4);
        assertThatThrownBy(() -> storageManager.getTable("third_table"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Table not found: third_table");
    }

    @Test
    void testDropTable() {
        storageManager.dropTable("first_table");

        assertThat(storageManager.hasTable("first_table")).isFalse();
        assertThatThrownBy(() -> storageManager.getTable("first_table"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storageManager.dropTable("first_table"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDuplicateName() {
        assertThatThrownBy(() -> storageManager.addTable("first_table", new Table()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void testTableNamesAndReset() {
        storageManager.addTable("a_table", new Table());

        assertThat(storageManager.tableNames()).containsExactly("a_table", "first_table", "second_table");

        storageManager.reset();
        assertThat(storageManager.tableNames()).isEmpty();
        assertThat(storageManager.hasTable("first_table")).isFalse();
    }

    @Test
    void testPrint() {
        Table table = storageManager.getTable("second_table");
        table.addColumn("a", DataType.INT);
        table.append(Scalar.of(1));
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        storageManager.print(new PrintStream(bytes, true, StandardCharsets.UTF_8));

        assertThat(bytes.toString(StandardCharsets.UTF_8).lines()).containsExactly(
                "NAME, COLUMNS, ROWS, CHUNKS",
                "first_table\t0\t0\t1",
                "second_table\t1\t1\t1");
    }
}
