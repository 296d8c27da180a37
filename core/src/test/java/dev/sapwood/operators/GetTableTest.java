/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.operators;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.sapwood.storage.StorageManager;
import dev.sapwood.storage.Table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class GetTableTest {

    private StorageManager storageManager;
    private Table table;

    @BeforeEach
    void setUp() {
        storageManager = new StorageManager();
        table = new Table(2);
        storageManager.addTable("table_a", table);
    }

    @Test
    void testGetOutput() {
        GetTable getTable = new GetTable(storageManager, "table_a");
        getTable.execute();

        assertThat(getTable.tableName()).isEqualTo("table_a");
        assertThat(getTable.getOutput()).isSameAs(table);
    }

    @Test
    void testThrowsUnknownTableName() {
        GetTable getTable = new GetTable(storageManager, "table_b");

        assertThatThrownBy(getTable::execute)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Table not found: table_b");
    }

    @Test
    void testTableDroppedBeforeExecution() {
        GetTable getTable = new GetTable(storageManager, "table_a");
        storageManager.dropTable("table_a");

        assertThatThrownBy(getTable::execute)
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(getTable.hasOutput()).isFalse();
    }
}
