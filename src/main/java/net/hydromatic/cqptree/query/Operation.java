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

import net.hydromatic.cqptree.ast.Identifier;

/** Set operation on the results of two earlier steps of a {@link Recipe}. */
public class Operation implements Recipe.Step {
  public final Identifier identifier;
  public final Identifier lhs;
  public final SetOperator operator;
  public final Identifier rhs;

  Operation(
      Identifier identifier,
      Identifier lhs,
      SetOperator operator,
      Identifier rhs) {
    this.identifier = requireNonNull(identifier);
    this.lhs = requireNonNull(lhs);
    this.operator = requireNonNull(operator);
    this.rhs = requireNonNull(rhs);
  }

  @Override
  public Identifier identifier() {
    return identifier;
  }

  @Override
  public String toString() {
    return identifier + " = " + lhs + " " + operator.symbol + " " + rhs;
  }
}

// End Operation.java
