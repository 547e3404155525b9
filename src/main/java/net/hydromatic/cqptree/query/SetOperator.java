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

/** Operator that combines the results of two steps of a {@link Recipe}. */
public enum SetOperator {
  CONJUNCTION("&", "intersect"),
  DISJUNCTION("|", "join"),
  SUBTRACTION("-", "diff");

  /** Symbol in the query languages of front ends. */
  public final String symbol;

  /** Name of the command that computes the operation on two named query
   * results. */
  public final String command;

  SetOperator(String symbol, String command) {
    this.symbol = symbol;
    this.command = command;
  }
}

// End SetOperator.java
