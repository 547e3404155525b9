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

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.query.Query;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each arrangement,
   * then calls the underlying tracer. */
  public static Tracer withOnArrangement(Tracer tracer,
      BiConsumer<Query, List<Identifier>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onArrangement(Query query,
          List<Identifier> arrangement) {
        consumer.accept(query, arrangement);
        super.onArrangement(query, arrangement);
      }
    };
  }

  /** Returns a tracer that performs the given action on each linear query,
   * then calls the underlying tracer. */
  public static Tracer withOnLinear(Tracer tracer,
      BiConsumer<Query, Linear.Node> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onLinear(Query query, Linear.Node node) {
        consumer.accept(query, node);
        super.onLinear(query, node);
      }
    };
  }

  public static Tracer withOnStep(Tracer tracer,
      Consumer<CompiledPlan.Step> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onStep(CompiledPlan.Step step) {
        consumer.accept(step);
        super.onStep(step);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onArrangement(Query query,
        List<Identifier> arrangement) {
    }

    @Override public void onLinear(Query query, Linear.Node node) {
    }

    @Override public void onStep(CompiledPlan.Step step) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onArrangement(Query query,
        List<Identifier> arrangement) {
      tracer.onArrangement(query, arrangement);
    }

    @Override public void onLinear(Query query, Linear.Node node) {
      tracer.onLinear(query, node);
    }

    @Override public void onStep(CompiledPlan.Step step) {
      tracer.onStep(step);
    }
  }
}

// End Tracers.java
