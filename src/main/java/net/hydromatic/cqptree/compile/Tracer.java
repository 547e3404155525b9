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
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.query.Query;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called for each arrangement of the tokens of a query that satisfies
   * the query's distance constraints. */
  void onArrangement(Query query, List<Identifier> arrangement);

  /** Called when a query has been converted to a linear query. */
  void onLinear(Query query, Linear.Node node);

  /** Called when a step of a plan has been generated. */
  void onStep(CompiledPlan.Step step);
}

// End Tracer.java
