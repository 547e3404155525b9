/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cqptree.ast;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // operands
  LITERAL(true),
  ATTRIBUTE(true),

  // predicates
  EXISTS(true),
  EQ(" = ", 4),
  NE(" != ", 4),
  CONTAINS(" contains ", 4),
  NOT_CONTAINS(" not contains ", 4),
  NOT("!", 5),
  AND(" & ", 2),
  OR(" | ", 1);

  /** Padded name, e.g. " = ". */
  public final String padded;

  /** Name without padding, e.g. "=". */
  public final String opName;

  public final int left;
  public final int right;

  /** Comparison operators, keyed by every spelling the front ends use. */
  private static final ImmutableMap<String, Op> COMPARISONS =
      ImmutableMap.<String, Op>builder()
          .put("=", EQ)
          .put("==", EQ)
          .put("!=", NE)
          .put("#", NE)
          .put("<>", NE)
          .put("contains", CONTAINS)
          .put("not contains", NOT_CONTAINS)
          .build();

  Op(boolean atom) {
    this("", atom ? 9999 : 0);
  }

  Op(String padded, int precedence) {
    this.padded = padded;
    this.opName = padded.trim();
    this.left = precedence;
    this.right = precedence;
  }

  /** Returns whether this is a comparison operator. */
  public boolean isComparison() {
    return this == EQ || this == NE || this == CONTAINS || this == NOT_CONTAINS;
  }

  /**
   * Returns the comparison operator with a given spelling, or null if there is
   * none.
   */
  public static @Nullable Op comparisonOpt(String s) {
    return COMPARISONS.get(s);
  }

  /** Returns the comparison operator with a given spelling, or throws. */
  public static Op comparison(String s) {
    final Op op = comparisonOpt(s);
    if (op == null) {
      throw new IllegalArgumentException("unknown comparison operator: " + s);
    }
    return op;
  }
}

// End Op.java
