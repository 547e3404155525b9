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
package net.hydromatic.cqptree.query;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import net.hydromatic.cqptree.ast.Identifier;

/**
 * Constraint on the positions of tokens.
 *
 * <p>There are three kinds: {@link Order} (one token precedes another), {@link
 * Distance} (the number of tokens between two tokens), and {@link Anchor} (a
 * token is the first or last of the matched span).
 */
public abstract class Constraint {
  private Constraint() {}

  /** Returns the tokens that this constraint refers to. */
  public abstract ImmutableSet<Identifier> referencedIdentifiers();

  /** Creates a constraint that token {@code a} precedes token {@code b}. */
  public static Order order(Identifier a, Identifier b) {
    return new Order(a, b);
  }

  /**
   * Returns a factory for distance constraints between two tokens.
   *
   * <p>For example, {@code distance(a, b).lessThan(3)} requires fewer than
   * three tokens between {@code a} and {@code b}.
   */
  public static DistanceFactory distance(Identifier a, Identifier b) {
    return new DistanceFactory(a, b);
  }

  /** Creates a distance constraint. */
  public static Distance distance(
      Identifier a, Identifier b, Compare compare, int distance) {
    return new Distance(a, b, compare, distance);
  }

  /** Creates a constraint that a token is first or last in the span. */
  public static Anchor anchor(Identifier id, Position position) {
    return new Anchor(id, position);
  }

  /** Creates a constraint that a token is the first in the span. */
  public static Anchor first(Identifier id) {
    return new Anchor(id, Position.FIRST);
  }

  /** Creates a constraint that a token is the last in the span. */
  public static Anchor last(Identifier id) {
    return new Anchor(id, Position.LAST);
  }

  /** Comparison between the distance of two tokens and a number. */
  public enum Compare {
    EQ("="),
    NE("#"),
    LT("<"),
    GT(">");

    public final String symbol;

    Compare(String symbol) {
      this.symbol = symbol;
    }
  }

  /** End of the span that a token is anchored to. */
  public enum Position {
    FIRST,
    LAST
  }

  /** Constraint that token {@link #fst} precedes token {@link #snd}. */
  public static class Order extends Constraint {
    public final Identifier fst;
    public final Identifier snd;

    Order(Identifier fst, Identifier snd) {
      this.fst = requireNonNull(fst);
      this.snd = requireNonNull(snd);
      if (fst == snd) {
        throw new InvalidQueryException("token cannot precede itself");
      }
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      return ImmutableSet.of(fst, snd);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fst, snd);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Order
              && fst == ((Order) o).fst
              && snd == ((Order) o).snd;
    }

    @Override
    public String toString() {
      return fst + " << " + snd;
    }
  }

  /**
   * Constraint on the number of tokens between {@link #a} and {@link #b},
   * whichever comes first.
   */
  public static class Distance extends Constraint {
    public final Identifier a;
    public final Identifier b;
    public final Compare compare;
    public final int distance;

    Distance(Identifier a, Identifier b, Compare compare, int distance) {
      this.a = requireNonNull(a);
      this.b = requireNonNull(b);
      this.compare = requireNonNull(compare);
      this.distance = distance;
      if (a == b) {
        throw new InvalidQueryException("distance of a token to itself");
      }
      // "greater than -1" is "at least 0"
      if (distance < (compare == Compare.GT ? -1 : 0)) {
        throw new InvalidQueryException("negative distance bound: "
            + compare.symbol + " " + distance);
      }
    }

    /** Returns whether this constraint is between the two given tokens. */
    public boolean isBetween(Identifier x, Identifier y) {
      return a == x && b == y || a == y && b == x;
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      return ImmutableSet.of(a, b);
    }

    @Override
    public int hashCode() {
      return Objects.hash(a, b, compare, distance);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Distance
              && a == ((Distance) o).a
              && b == ((Distance) o).b
              && compare == ((Distance) o).compare
              && distance == ((Distance) o).distance;
    }

    @Override
    public String toString() {
      return "distance(" + a + ", " + b + ") " + compare.symbol + " "
          + distance;
    }
  }

  /** Constraint that a token is at one end of the span. */
  public static class Anchor extends Constraint {
    public final Identifier id;
    public final Position position;

    Anchor(Identifier id, Position position) {
      this.id = requireNonNull(id);
      this.position = requireNonNull(position);
    }

    public boolean isFirst() {
      return position == Position.FIRST;
    }

    public boolean isLast() {
      return position == Position.LAST;
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      return ImmutableSet.of(id);
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, position);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Anchor
              && id == ((Anchor) o).id
              && position == ((Anchor) o).position;
    }

    @Override
    public String toString() {
      return "anchor(" + id + ", " + position + ")";
    }
  }

  /**
   * Creates distance constraints between two tokens.
   *
   * <p>The non-strict comparisons are defined in terms of the strict ones:
   * "at most k" is "less than k + 1", and "at least k" is "greater than
   * k - 1".
   */
  public static class DistanceFactory {
    private final Identifier a;
    private final Identifier b;

    DistanceFactory(Identifier a, Identifier b) {
      this.a = a;
      this.b = b;
    }

    public Distance equalTo(int k) {
      return new Distance(a, b, Compare.EQ, k);
    }

    public Distance notEqualTo(int k) {
      return new Distance(a, b, Compare.NE, k);
    }

    public Distance lessThan(int k) {
      return new Distance(a, b, Compare.LT, k);
    }

    public Distance greaterThan(int k) {
      return new Distance(a, b, Compare.GT, k);
    }

    public Distance atMost(int k) {
      return lessThan(k + 1);
    }

    public Distance atLeast(int k) {
      return greaterThan(k - 1);
    }
  }
}

// End Constraint.java
