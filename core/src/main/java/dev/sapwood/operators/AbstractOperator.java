/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.operators;

import dev.sapwood.storage.Table;

/**
 * Base class of all operators.
 * <p>
 * An operator takes at most one input operator, is executed exactly once and then exposes
 * its result table via {@link #getOutput()}. Operators never modify their input tables.
 * </p>
 */
public abstract class AbstractOperator {

    protected final AbstractOperator leftInput;

    private Table output;

    protected AbstractOperator() {
        this(null);
    }

    protected AbstractOperator(AbstractOperator leftInput) {
        this.leftInput = leftInput;
    }

    /**
     * Runs the operator. Inputs must have been executed before.
     *
     * @throws IllegalStateException if the operator has already been executed
     */
    public final void execute() {
        if (output != null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has already been executed");
        }
        output = onExecute();
    }

    public final boolean hasOutput() {
        return output != null;
    }

    /**
     * @throws IllegalStateException if the operator has not been executed yet
     */
    public final Table getOutput() {
        if (output == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has not been executed yet");
        }
        return output;
    }

    protected final Table leftInputTable() {
        if (leftInput == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has no left input");
        }
        return leftInput.getOutput();
    }

    protected abstract Table onExecute();
}
