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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Queries, and set operations that combine their results.
 *
 * <p>The {@link #goal} is the step whose result the recipe computes. A
 * recipe that consists of a single query can be created using {@link
 * #ofQuery(Query)}; otherwise use a {@link Builder}.
 */
public class Recipe {
  public final ImmutableList<Query> queries;
  public final ImmutableList<Operation> operations;
  public final Identifier goal;

  private Recipe(
      ImmutableList<Query> queries,
      ImmutableList<Operation> operations,
      Identifier goal) {
    this.queries = queries;
    this.operations = operations;
    this.goal = requireNonNull(goal);

    final Set<Identifier> identifiers = new HashSet<>();
    for (Step step : Iterables.<Step>concat(queries, operations)) {
      if (!identifiers.add(step.identifier())) {
        throw new InvalidQueryException(
            "Multiple steps in recipe share the same identifier.");
      }
    }
    for (Operation operation : operations) {
      if (!identifiers.contains(operation.lhs)
          || !identifiers.contains(operation.rhs)) {
        throw new InvalidQueryException(
            "Step in recipe uses undefined query identifier.");
      }
    }
    if (!identifiers.contains(goal)) {
      throw new InvalidQueryException("Goal of recipe is not a step.");
    }
  }

  /** Creates a recipe that computes a single query. */
  public static Recipe ofQuery(Query query) {
    return new Recipe(ImmutableList.of(query), ImmutableList.of(),
        query.identifier);
  }

  /** Returns the query if this recipe consists of a single query and no
   * operations, otherwise null. */
  public @Nullable Query simpleRepresentation() {
    if (queries.size() == 1 && operations.isEmpty()) {
      return queries.get(0);
    }
    return null;
  }

  public boolean hasSimpleRepresentation() {
    return simpleRepresentation() != null;
  }

  /** Returns the identifiers of all steps: operations first, then
   * queries. */
  public ImmutableList<Identifier> identifiers() {
    final ImmutableList.Builder<Identifier> b = ImmutableList.builder();
    operations.forEach(o -> b.add(o.identifier));
    queries.forEach(q -> b.add(q.identifier));
    return b.build();
  }

  /** Returns the steps indexed by identifier. */
  public ImmutableMap<Identifier, Step> asMap() {
    final ImmutableMap.Builder<Identifier, Step> b = ImmutableMap.builder();
    queries.forEach(q -> b.put(q.identifier, q));
    operations.forEach(o -> b.put(o.identifier, o));
    return b.build();
  }

  @Override
  public String toString() {
    return "Recipe{queries=" + queries + ", operations=" + operations
        + ", goal=" + goal + "}";
  }

  /** Step of a recipe; either a {@link Query} or an {@link Operation}. */
  public interface Step {
    Identifier identifier();
  }

  /** Builds a recipe step by step. */
  public static class Builder {
    private final IdentifierGenerator generator;
    private final List<Query> queries = new ArrayList<>();
    private final List<Operation> operations = new ArrayList<>();
    private @Nullable Identifier goal;

    public Builder(IdentifierGenerator generator) {
      this.generator = requireNonNull(generator);
    }

    /** Adds a query, and returns its identifier. */
    public Identifier addQuery(Query query) {
      queries.add(query);
      return query.identifier;
    }

    /** Adds an operation on two earlier steps, and returns its
     * identifier. */
    public Identifier addOperation(
        Identifier lhs, SetOperator operator, Identifier rhs) {
      final Operation operation =
          new Operation(generator.get(), lhs, operator, rhs);
      operations.add(operation);
      return operation.identifier;
    }

    /** Sets the goal. If not set, the goal is the sole query or the last
     * operation. */
    public Builder goal(Identifier goal) {
      this.goal = goal;
      return this;
    }

    public Recipe build() {
      Identifier goal = this.goal;
      if (goal == null) {
        if (queries.size() == 1 && operations.isEmpty()) {
          goal = queries.get(0).identifier;
        } else if (!operations.isEmpty()) {
          goal = Iterables.getLast(operations).identifier;
        } else {
          throw new InvalidQueryException("Recipe has no goal.");
        }
      }
      return new Recipe(ImmutableList.copyOf(queries),
          ImmutableList.copyOf(operations), goal);
    }
  }
}

// End Recipe.java
