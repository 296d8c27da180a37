/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.types;

/**
 * Comparison operators of scan predicates.
 * <p>
 * Each operator decides on the result of a three-way comparison between a column value
 * and the search value, so the same operator applies to typed values and to dictionary
 * codes alike.
 * </p>
 */
public enum ScanType {
    EQUALS("=") {
        @Override
        public boolean test(int comparison) {
            return comparison == 0;
        }
    },
    NOT_EQUALS("!=") {
        @Override
        public boolean test(int comparison) {
            return comparison != 0;
        }
    },
    GREATER_THAN(">") {
        @Override
        public boolean test(int comparison) {
            return comparison > 0;
        }
    },
    GREATER_THAN_EQUALS(">=") {
        @Override
        public boolean test(int comparison) {
            return comparison >= 0;
        }
    },
    LESS_THAN("<") {
        @Override
        public boolean test(int comparison) {
            return comparison < 0;
        }
    },
    LESS_THAN_EQUALS("<=") {
        @Override
        public boolean test(int comparison) {
            return comparison <= 0;
        }
    };

    private final String symbol;

    ScanType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Whether a value whose comparison with the search value yielded {@code comparison}
     * satisfies this operator.
     */
    public abstract boolean test(int comparison);

    public <T extends Comparable<T>> boolean matches(T value, T searchValue) {
        return test(value.compareTo(searchValue));
    }

    public String symbol() {
        return symbol;
    }

    public static ScanType fromSymbol(String symbol) {
        for (ScanType type : values()) {
            if (type.symbol.equals(symbol)) {
                return type;
            }
        }
        if ("<>".equals(symbol)) {
            return NOT_EQUALS;
        }
        throw new IllegalArgumentException("Unknown scan type: " + symbol);
    }
}
