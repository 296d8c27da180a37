/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ScanTypeTest {

    @Test
    void testMatches() {
        assertThat(ScanType.EQUALS.matches(2, 2)).isTrue();
        assertThat(ScanType.EQUALS.matches(2, 3)).isFalse();
        assertThat(ScanType.NOT_EQUALS.matches(2, 3)).isTrue();
        assertThat(ScanType.GREATER_THAN.matches(3, 2)).isTrue();
        assertThat(ScanType.GREATER_THAN.matches(2, 2)).isFalse();
        assertThat(ScanType.GREATER_THAN_EQUALS.matches(2, 2)).isTrue();
        assertThat(ScanType.LESS_THAN.matches("a", "b")).isTrue();
        assertThat(ScanType.LESS_THAN_EQUALS.matches("b", "b")).isTrue();
        assertThat(ScanType.LESS_THAN_EQUALS.matches("c", "b")).isFalse();
    }

    @Test
    void testFromSymbol() {
        for (ScanType type : ScanType.values()) {
            assertThat(ScanType.fromSymbol(type.symbol())).isSameAs(type);
        }
        assertThat(ScanType.fromSymbol("<>")).isSameAs(ScanType.NOT_EQUALS);
        assertThatThrownBy(() -> ScanType.fromSymbol("~")).isInstanceOf(IllegalArgumentException.class);
    }
}
