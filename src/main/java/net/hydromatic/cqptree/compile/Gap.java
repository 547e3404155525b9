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
package net.hydromatic.cqptree.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import java.util.Collections;
import java.util.Objects;
import net.hydromatic.cqptree.query.Constraint;

/**
 * Range of the number of tokens between two consecutive tokens of a linear
 * query.
 *
 * <p>A gap of zero means that the tokens are adjacent.
 */
public class Gap {
  /** Largest value of {@link #max}, meaning no upper bound. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  /** Any number of tokens. */
  public static final Gap ANY = new Gap(0, UNBOUNDED);

  /** No tokens. */
  public static final Gap ADJACENT = new Gap(0, 0);

  public final int min;
  public final int max;

  private Gap(int min, int max) {
    checkArgument(min >= 0);
    this.min = min;
    this.max = max;
  }

  public static Gap of(int min, int max) {
    return new Gap(Math.max(min, 0), max);
  }

  public static Gap exactly(int n) {
    return of(n, n);
  }

  /**
   * Converts a distance constraint to a gap.
   *
   * @throws NotSupportedException if the constraint cannot be expressed
   */
  public static Gap of(Constraint.Distance distance) {
    final int k = distance.distance;
    switch (distance.compare) {
    case EQ:
      return of(k, k);
    case LT:
      return of(0, k - 1);
    case GT:
      return k == UNBOUNDED ? of(k, k - 1) : of(k + 1, UNBOUNDED);
    case NE:
      throw new NotSupportedException(
          "Distance constraints with '#' are not supported.");
    default:
      throw new AssertionError(distance.compare);
    }
  }

  /** Returns whether no number of tokens is in this gap. */
  public boolean isEmpty() {
    return max < min;
  }

  /** Returns whether a given number of tokens is in this gap. */
  public boolean allows(int n) {
    return min <= n && n <= max;
  }

  /** Returns whether this gap could hold at least a given number of
   * tokens. */
  public boolean allowsAtLeast(int n) {
    return max >= n;
  }

  /** Returns the numbers of tokens that are in both this gap and another. */
  public Gap intersect(Gap gap) {
    return new Gap(Math.max(min, gap.min), Math.min(max, gap.max));
  }

  /**
   * Returns this gap in the target query language, for example "[]*",
   * "[] []", "[]{2,}"; the empty string if the gap is zero.
   */
  public String unparse() {
    checkArgument(!isEmpty(), "empty gap");
    if (min == max) {
      return Joiner.on(' ').join(Collections.nCopies(min, "[]"));
    }
    if (max == UNBOUNDED) {
      return min == 0 ? "[]*" : "[]{" + min + ",}";
    }
    return "[]{" + min + "," + max + "}";
  }

  @Override
  public int hashCode() {
    return Objects.hash(min, max);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Gap && min == ((Gap) o).min && max == ((Gap) o).max;
  }

  @Override
  public String toString() {
    return "Gap{" + min + ", " + (max == UNBOUNDED ? "*" : max) + "}";
  }
}

// End Gap.java
