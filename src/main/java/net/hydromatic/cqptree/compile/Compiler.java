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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.query.InvalidQueryException;
import net.hydromatic.cqptree.query.Operation;
import net.hydromatic.cqptree.query.Query;
import net.hydromatic.cqptree.query.Recipe;
import net.hydromatic.cqptree.query.SetOperator;

/** Compiles queries and recipes into linear queries. */
public class Compiler {
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;

  public Compiler(Map<Prop, Object> props, Tracer tracer) {
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a compiler with default properties and no tracing. */
  public static Compiler create() {
    return new Compiler(ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Converts a query, ignoring its parts, to the disjunction of the linear
   * queries of all of its feasible arrangements.
   *
   * @throws NotSupportedException if the constraints cannot be expressed, or
   *   if no order of the tokens satisfies them
   * @throws CancellationException if the current thread is interrupted
   *   while arrangements are being enumerated
   */
  public Linear.Node fromQuery(Query query) {
    final Linearizer linearizer = Linearizer.of(query);
    final List<Linear.Node> nodes = new ArrayList<>();
    for (ImmutableList<Identifier> arrangement : linearizer.arrangements()) {
      if (Thread.interrupted()) {
        throw new CancellationException("Compilation was interrupted");
      }
      if (!linearizer.isFeasible(arrangement)) {
        continue;
      }
      tracer.onArrangement(query, arrangement);
      nodes.add(linearizer.fromArrangement(arrangement));
    }
    if (nodes.isEmpty()) {
      throw new NotSupportedException("Constraints of query cannot be "
          + "satisfied by any order of tokens.");
    }
    final Linear.Node node = Linear.or(nodes);
    tracer.onLinear(query, node);
    return node;
  }

  /** Converts a query, ignoring its parts, to text. */
  public String format(Query query) {
    return fromQuery(query).format(Prop.SPAN.stringValue(props));
  }

  /**
   * Compiles a recipe into a plan.
   *
   * <p>Each query becomes a step; each part of a query becomes a step that
   * runs the query together with the part, followed by a step that
   * intersects the running result with it (or subtracts it). Each
   * operation becomes a step over the results of its operands.
   */
  public CompiledPlan compile(Recipe recipe) {
    final NameGenerator nameGenerator = NameGenerator.upper();
    final List<CompiledPlan.Step> steps = new ArrayList<>();
    final Map<Identifier, String> results = new HashMap<>();
    for (Query query : recipe.queries) {
      String result =
          add(steps, new CompiledPlan.QueryStep(nameGenerator.get(),
              format(query)));
      for (Query.Part part : query.parts) {
        final String partResult =
            add(steps, new CompiledPlan.QueryStep(nameGenerator.get(),
                format(query.merge(part))));
        final SetOperator operator =
            part.kind == Query.PartKind.ADDITIONAL
                ? SetOperator.CONJUNCTION
                : SetOperator.SUBTRACTION;
        result =
            add(steps, new CompiledPlan.OperationStep(nameGenerator.get(),
                operator.command, result, partResult));
      }
      results.put(query.identifier, result);
    }
    for (Operation operation : recipe.operations) {
      results.put(operation.identifier,
          add(steps, new CompiledPlan.OperationStep(nameGenerator.get(),
              operation.operator.command,
              result(results, operation.lhs),
              result(results, operation.rhs))));
    }
    return new CompiledPlan(steps, result(results, recipe.goal));
  }

  private static String result(Map<Identifier, String> results,
      Identifier id) {
    final String result = results.get(id);
    if (result == null) {
      throw new InvalidQueryException(
          "Step in recipe uses a step that is defined after it.");
    }
    return result;
  }

  private String add(List<CompiledPlan.Step> steps, CompiledPlan.Step step) {
    tracer.onStep(step);
    steps.add(step);
    return step.name;
  }
}

// End Compiler.java
