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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.cqptree.ast.Ast;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.query.Constraint;
import net.hydromatic.cqptree.query.Dependency;
import net.hydromatic.cqptree.query.Query;
import net.hydromatic.cqptree.query.Token;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts an arrangement of the tokens of a query into a linear query.
 *
 * <p>Each dependency and predicate is attached to the first token in the
 * arrangement at which all of the tokens it references have been seen (that
 * token included).
 */
public class Linearizer {
  private final ImmutableList<Identifier> identifiers;
  private final ImmutableList<Dependency> dependencies;
  private final ImmutableList<Ast.Predicate> predicates;
  private final ImmutableList<Constraint.Order> orders;
  private final ImmutableList<Constraint.Distance> distances;
  private final @Nullable Identifier first;
  private final @Nullable Identifier last;

  private Linearizer(ImmutableList<Identifier> identifiers,
      ImmutableList<Dependency> dependencies,
      ImmutableList<Ast.Predicate> predicates,
      ImmutableList<Constraint.Order> orders,
      ImmutableList<Constraint.Distance> distances,
      @Nullable Identifier first, @Nullable Identifier last) {
    this.identifiers = identifiers;
    this.dependencies = dependencies;
    this.predicates = predicates;
    this.orders = orders;
    this.distances = distances;
    this.first = first;
    this.last = last;
  }

  /**
   * Creates a linearizer for a query, ignoring its parts.
   *
   * <p>The local predicates of tokens are raised and added to the global
   * predicates; then all predicates are normalized and duplicates removed.
   *
   * @throws NotSupportedException if a distance constraint cannot be
   *   expressed
   */
  public static Linearizer of(Query query) {
    final ImmutableList<Identifier> identifiers =
        query.tokenIdentifiers().asList();

    final Set<Ast.Predicate> predicates = new LinkedHashSet<>();
    for (Token token : query.tokens) {
      final Ast.Predicate raised = token.raisedAttributes();
      if (raised != null) {
        predicates.add(raised.normalize());
      }
    }
    query.predicates.forEach(p -> predicates.add(p.normalize()));

    final List<Constraint.Order> orders = new ArrayList<>();
    final List<Constraint.Distance> distances = new ArrayList<>();
    @Nullable Identifier first = null;
    @Nullable Identifier last = null;
    for (Constraint constraint : query.constraints) {
      if (constraint instanceof Constraint.Order) {
        orders.add((Constraint.Order) constraint);
      } else if (constraint instanceof Constraint.Distance) {
        distances.add((Constraint.Distance) constraint);
      } else {
        final Constraint.Anchor anchor = (Constraint.Anchor) constraint;
        if (anchor.isFirst()) {
          first = anchor.id;
        } else {
          last = anchor.id;
        }
      }
    }

    // An anchored token precedes (or follows) every other token.
    for (Identifier id : identifiers) {
      if (first != null && id != first) {
        orders.add(Constraint.order(first, id));
      }
      if (last != null && id != last) {
        orders.add(Constraint.order(id, last));
      }
    }

    final Linearizer linearizer =
        new Linearizer(identifiers,
            ImmutableList.copyOf(query.dependencies),
            ImmutableList.copyOf(predicates),
            ImmutableList.copyOf(orders),
            ImmutableList.copyOf(distances), first, last);
    for (Constraint.Distance distance : distances) {
      if (linearizer.distanceBetween(distance.a, distance.b).isEmpty()) {
        throw new NotSupportedException("Distance constraints between two "
            + "tokens cannot be satisfied.");
      }
    }
    return linearizer;
  }

  /** Returns the arrangements of the tokens that satisfy the order
   * constraints, including those implied by anchors. */
  public Arrangements arrangements() {
    return Arrangements.of(identifiers, orders);
  }

  /** Returns the dependencies, in order of declaration. */
  public ImmutableList<Dependency> dependencies() {
    return dependencies;
  }

  /** Returns the global predicates, normalized and without duplicates. */
  public ImmutableList<Ast.Predicate> predicates() {
    return predicates;
  }

  /**
   * Returns the allowed gap between two tokens.
   *
   * <p>If there are several distance constraints between the tokens (in
   * either order), the gap satisfies all of them; if there are none, any gap
   * is allowed.
   */
  public Gap distanceBetween(Identifier a, Identifier b) {
    Gap gap = Gap.ANY;
    for (Constraint.Distance distance : distances) {
      if (distance.isBetween(a, b)) {
        gap = gap.intersect(Gap.of(distance));
      }
    }
    return gap;
  }

  /**
   * Returns whether an arrangement can satisfy the distance constraints.
   *
   * <p>A constraint between two tokens that are not adjacent in the
   * arrangement is violated if it allows fewer tokens between them than the
   * arrangement places there.
   */
  public boolean isFeasible(List<Identifier> arrangement) {
    for (Constraint.Distance distance : distances) {
      final int i = arrangement.indexOf(distance.a);
      final int j = arrangement.indexOf(distance.b);
      final int between = Math.abs(i - j) - 1;
      if (between > 0
          && !distanceBetween(distance.a, distance.b)
              .allowsAtLeast(between)) {
        return false;
      }
    }
    return true;
  }

  /** Converts an arrangement into a sequence of token patterns. */
  public Linear.Node fromArrangement(List<Identifier> arrangement) {
    final Set<Identifier> visited = new LinkedHashSet<>();
    final List<Dependency> remainingDependencies =
        new ArrayList<>(dependencies);
    final List<Ast.Predicate> remainingPredicates =
        new ArrayList<>(predicates);

    final List<Linear.Token> tokens = new ArrayList<>();
    for (Identifier id : arrangement) {
      visited.add(id);
      final List<Dependency> tokenDependencies = new ArrayList<>();
      remainingDependencies.removeIf(d -> {
        if (visited.containsAll(d.referencedIdentifiers())) {
          tokenDependencies.add(d);
          return true;
        }
        return false;
      });
      final List<Ast.Predicate> tokenPredicates = new ArrayList<>();
      remainingPredicates.removeIf(p -> {
        if (visited.containsAll(p.referencedIdentifiers())) {
          tokenPredicates.add(p.lowerOnto(id));
          return true;
        }
        return false;
      });
      tokens.add(
          Linear.token(id, tokenPredicates, tokenDependencies, id == first,
              id == last));
    }

    // Right-leaning: the first token, then the rest of the query.
    final int last = tokens.size() - 1;
    Linear.Node node = tokens.get(last);
    for (int i = last - 1; i >= 0; i--) {
      final Gap gap =
          distanceBetween(arrangement.get(i), arrangement.get(i + 1));
      node = Linear.sequence(tokens.get(i), gap, node);
    }
    return node;
  }
}

// End Linearizer.java
