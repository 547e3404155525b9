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
package net.hydromatic.cqptree.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;

/** Abstract syntax tree node of an operand or predicate. */
public abstract class AstNode {
  public final Op op;

  AstNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string in the target query language.
   *
   * <p>Attributes qualified by an identifier are written using the
   * identifier's ordinal, because outside of a compiled query there are no
   * names. The purpose of this string is debugging.
   */
  @Override
  public final String toString() {
    return unparse(new CqpWriter(), 0, 0).toString();
  }

  abstract CqpWriter unparse(CqpWriter w, int left, int right);

  /**
   * Returns every identifier that occurs in this node, recursively, in order
   * of first occurrence.
   */
  public abstract ImmutableSet<Identifier> referencedIdentifiers();

  /**
   * Raises this node into a global context.
   *
   * <p>Each reference to the current token (an attribute without identifier)
   * becomes an explicit reference to {@code id}. Other references are
   * unchanged.
   */
  public abstract AstNode raiseFrom(Identifier id);

  /**
   * Lowers this node into the local context of the token {@code id}.
   *
   * <p>Each explicit reference to {@code id} becomes a reference to the
   * current token. Other references are unchanged.
   */
  public abstract AstNode lowerOnto(Identifier id);
}

// End AstNode.java
