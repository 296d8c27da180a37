/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.operators;

import java.util.Objects;

import dev.sapwood.storage.StorageManager;
import dev.sapwood.storage.Table;

/**
 * Outputs the table registered under a name.
 */
public final class GetTable extends AbstractOperator {

    private final StorageManager storageManager;
    private final String tableName;

    public GetTable(StorageManager storageManager, String tableName) {
        this.storageManager = Objects.requireNonNull(storageManager, "storageManager");
        this.tableName = Objects.requireNonNull(tableName, "tableName");
    }

    public String tableName() {
        return tableName;
    }

    @Override
    protected Table onExecute() {
        return storageManager.getTable(tableName);
    }
}
