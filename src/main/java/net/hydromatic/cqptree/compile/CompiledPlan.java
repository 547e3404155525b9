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
import java.util.List;
import java.util.stream.Collectors;

/**
 * Compiled form of a recipe: a list of named steps, each of which either runs
 * a linear query or combines the results of two earlier steps.
 *
 * <p>If the plan has more than one step, the steps must be run in order; the
 * result is the result of the {@link #goal} step.
 */
public class CompiledPlan {
  public final ImmutableList<Step> steps;
  public final String goal;

  CompiledPlan(List<Step> steps, String goal) {
    this.steps = ImmutableList.copyOf(steps);
    this.goal = requireNonNull(goal);
  }

  /** Returns whether this plan consists of a single query. */
  public boolean isSimple() {
    return steps.size() == 1;
  }

  /** Returns the text of the first query. */
  public String query() {
    return ((QueryStep) steps.get(0)).query;
  }

  /** Returns the commands for the steps after the first. */
  public ImmutableList<String> additionalSteps() {
    return steps.subList(1, steps.size()).stream()
        .map(Step::command)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the query if this plan is simple, otherwise a command per
   * step, one per line. */
  public String script() {
    if (isSimple()) {
      return query();
    }
    return steps.stream().map(Step::command)
        .collect(Collectors.joining("\n"));
  }

  @Override
  public String toString() {
    return script();
  }

  /** Step of a plan. */
  public abstract static class Step {
    public final String name;

    Step(String name) {
      this.name = requireNonNull(name);
    }

    /** Returns this step as a command that assigns its result to its
     * name. */
    public abstract String command();

    @Override
    public String toString() {
      return command();
    }
  }

  /** Step that runs a linear query. */
  public static class QueryStep extends Step {
    public final String query;

    QueryStep(String name, String query) {
      super(name);
      this.query = requireNonNull(query);
    }

    @Override
    public String command() {
      return name + " = " + query + ";";
    }
  }

  /** Step that combines the results of two earlier steps, e.g.
   * "C = intersect A B;". */
  public static class OperationStep extends Step {
    public final String operator;
    public final String lhs;
    public final String rhs;

    OperationStep(String name, String operator, String lhs, String rhs) {
      super(name);
      this.operator = requireNonNull(operator);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public String command() {
      return name + " = " + operator + " " + lhs + " " + rhs + ";";
    }
  }
}

// End CompiledPlan.java
