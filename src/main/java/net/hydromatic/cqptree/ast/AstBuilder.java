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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds operand and predicate nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a literal from plain text, escaping regex metacharacters. */
  public Ast.Literal literal(String value) {
    return literal(value, false);
  }

  /**
   * Creates a literal.
   *
   * @param value Text of the literal
   * @param representsRegex Whether {@code value} is already a regular
   *     expression; if false, its metacharacters are escaped
   */
  public Ast.Literal literal(String value, boolean representsRegex) {
    return new Ast.Literal(representsRegex ? value : Ast.Literal.escape(value));
  }

  /**
   * Creates a string literal from plain text: escapes regex metacharacters and
   * wraps the result in double quotes.
   */
  public Ast.Literal quoted(String value) {
    return new Ast.Literal('"' + Ast.Literal.escape(value) + '"');
  }

  /** Creates an attribute of the current token. */
  public Ast.Attribute attribute(String name) {
    return new Ast.Attribute(null, name);
  }

  /** Creates an attribute of a given token, or of the current token if null. */
  public Ast.Attribute attribute(@Nullable Identifier reference, String name) {
    return new Ast.Attribute(reference, name);
  }

  /** Creates a comparison. */
  public Ast.Comparison comparison(Ast.Operand lhs, Op op, Ast.Operand rhs) {
    return new Ast.Comparison(lhs, op, rhs);
  }

  /** Creates a comparison whose operator is given by its spelling. */
  public Ast.Comparison comparison(
      Ast.Operand lhs, String op, Ast.Operand rhs) {
    return new Ast.Comparison(lhs, Op.comparison(op), rhs);
  }

  /** Creates an equality comparison. */
  public Ast.Comparison equal(Ast.Operand lhs, Ast.Operand rhs) {
    return new Ast.Comparison(lhs, Op.EQ, rhs);
  }

  /** Creates a predicate that holds if an attribute has a value. */
  public Ast.Exists exists(Ast.Attribute attribute) {
    return new Ast.Exists(attribute);
  }

  /** Creates a negation. */
  public Ast.Negation not(Ast.Predicate predicate) {
    return new Ast.Negation(predicate);
  }

  /**
   * Creates a conjunction, even if there is only one member.
   *
   * @throws IllegalArgumentException if there are no members
   */
  public Ast.Conjunction conjunction(Iterable<? extends Ast.Predicate> list) {
    return new Ast.Conjunction(ImmutableList.copyOf(list));
  }

  /**
   * Creates a disjunction, even if there is only one member.
   *
   * @throws IllegalArgumentException if there are no members
   */
  public Ast.Disjunction disjunction(Iterable<? extends Ast.Predicate> list) {
    return new Ast.Disjunction(ImmutableList.copyOf(list));
  }

  /** Creates a conjunction, or returns the sole member. */
  public Ast.Predicate and(Iterable<? extends Ast.Predicate> list) {
    return Ast.Conjunction.of(list);
  }

  /** Creates a conjunction, or returns the sole member. */
  public Ast.Predicate and(Ast.Predicate... predicates) {
    return Ast.Conjunction.of(ImmutableList.copyOf(predicates));
  }

  /** Creates a disjunction, or returns the sole member. */
  public Ast.Predicate or(Iterable<? extends Ast.Predicate> list) {
    return Ast.Disjunction.of(list);
  }

  /** Creates a disjunction, or returns the sole member. */
  public Ast.Predicate or(Ast.Predicate... predicates) {
    return Ast.Disjunction.of(ImmutableList.copyOf(predicates));
  }
}

// End AstBuilder.java
