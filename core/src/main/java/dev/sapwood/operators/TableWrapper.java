/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.operators;

import java.util.Objects;

import dev.sapwood.storage.Table;

/**
 * Makes an existing table available as the output of an operator.
 */
public final class TableWrapper extends AbstractOperator {

    private final Table table;

    public TableWrapper(Table table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    @Override
    protected Table onExecute() {
        return table;
    }
}
