/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of tables by name.
 * <p>
 * Instances are owned by a {@link SapwoodContext} (or created directly) and passed to the
 * components that resolve table names. Storage and scan code never look tables up here.
 * </p>
 */
public final class StorageManager {

    private static final System.Logger LOG = System.getLogger(StorageManager.class.getName());

    private final Map<String, Table> tablesByName = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if a table with that name is already registered
     */
    public void addTable(String name, Table table) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(table, "table");
        if (tablesByName.putIfAbsent(name, table) != null) {
            throw new IllegalArgumentException("Table with name '" + name + "' already exists");
        }
        LOG.log(System.Logger.Level.DEBUG, "Added table ''{0}'' with {1} columns", name, table.columnCount());
    }

    /**
     * @throws IllegalArgumentException if no table with that name is registered
     */
    public void dropTable(String name) {
        if (tablesByName.remove(name) == null) {
            throw new IllegalArgumentException("Table not found: " + name);
        }
        LOG.log(System.Logger.Level.DEBUG, "Dropped table ''{0}''", name);
    }

    /**
     * @throws IllegalArgumentException if no table with that name is registered
     */
    public Table getTable(String name) {
        Table table = tablesByName.get(name);
        if (table == null) {
            throw new IllegalArgumentException("Table not found: " + name);
        }
        return table;
    }

    public boolean hasTable(String name) {
        return tablesByName.containsKey(name);
    }

    /**
     * Returns the names of all registered tables in ascending order.
     */
    public List<String> tableNames() {
        List<String> names = new ArrayList<>(tablesByName.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Writes one line per table with its name, column count, row count and chunk count.
     */
    public void print(PrintStream out) {
        out.println("NAME, COLUMNS, ROWS, CHUNKS");
        for (String name : tableNames()) {
            Table table = tablesByName.get(name);
            if (table != null) {
                out.println(name + "\t" + table.columnCount() + "\t" + table.rowCount() + "\t" + table.chunkCount());
            }
        }
    }

    /**
     * Removes all tables.
     */
    public void reset() {
        tablesByName.clear();
    }
}
