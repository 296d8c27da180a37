/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

/**
 * Visitor over the three segment representations.
 *
 * @param <R> result type of the visit
 */
public interface SegmentVisitor<R> {

    R visit(ValueSegment<?> segment);

    R visit(DictionarySegment<?> segment);

    R visit(ReferenceSegment segment);
}
