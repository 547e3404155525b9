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
package net.hydromatic.cqptree.frontend.deptreepy;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.cqptree.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cqptree.ast.Ast;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import net.hydromatic.cqptree.ast.Op;
import net.hydromatic.cqptree.compile.NotSupportedException;
import net.hydromatic.cqptree.parse.ParseFailedException;
import net.hydromatic.cqptree.query.Dependency;
import net.hydromatic.cqptree.query.Query;
import net.hydromatic.cqptree.query.Recipe;
import net.hydromatic.cqptree.query.SetOperator;
import net.hydromatic.cqptree.query.Token;
import net.hydromatic.cqptree.translate.Translator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates a deptreepy pattern into a recipe.
 *
 * <p>A pattern is an s-expression. {@code (TREE_ root dependent...)} matches
 * a subtree; any other expression matches a single token:
 *
 * <ul>
 * <li>{@code (field value)} matches a token whose field has a value;
 * <li>{@code (field IN value...)} matches any of several values;
 * <li>{@code (AND p...)}, {@code (OR p...)}, {@code (NOT p)} combine
 *   patterns.
 * </ul>
 *
 * <p>If the name of a field ends in "_", the field must contain the value
 * rather than equal it. At the top level, {@code AND} and {@code OR} may
 * combine trees; each tree becomes a query, and the queries are combined by
 * set operations.
 */
public class DeptreepyTranslator implements Translator {
  private final IdentifierGenerator generator;

  public DeptreepyTranslator(IdentifierGenerator generator) {
    this.generator = requireNonNull(generator);
  }

  @Override
  public String name() {
    return "deptreepy";
  }

  @Override
  public Recipe translate(String text) {
    final SExpression e = SExpression.parse(text);
    if (e instanceof SExpression.SList
        && ((SExpression.SList) e).list.isEmpty()) {
      throw ParseFailedException.of(e.pos, "Empty pattern");
    }
    final Recipe.Builder builder = new Recipe.Builder(generator);
    builder.goal(plan(builder, e));
    return builder.build();
  }

  /** Adds the queries and operations for an expression to a recipe, and
   * returns the identifier of the step that computes it. */
  private Identifier plan(Recipe.Builder builder, SExpression e) {
    final @Nullable SetOperator operator = setOperator(e);
    if (operator != null) {
      final List<SExpression> args = ((SExpression.SList) e).list;
      Identifier result = plan(builder, args.get(1));
      for (SExpression arg : args.subList(2, args.size())) {
        result = builder.addOperation(result, operator, plan(builder, arg));
      }
      return result;
    }
    final QueryBuilder queryBuilder = new QueryBuilder();
    queryBuilder.convert(e);
    return builder.addQuery(queryBuilder.build());
  }

  /** If an expression is {@code AND} or {@code OR} of at least two
   * arguments, at least one of which is a tree, returns the set operator. */
  private static @Nullable SetOperator setOperator(SExpression e) {
    if (!(e instanceof SExpression.SList)) {
      return null;
    }
    final SExpression.SList list = (SExpression.SList) e;
    if (list.list.size() < 3) {
      return null;
    }
    final @Nullable SetOperator operator =
        list.startsWith("AND") ? SetOperator.CONJUNCTION
            : list.startsWith("OR") ? SetOperator.DISJUNCTION
            : null;
    if (operator == null) {
      return null;
    }
    for (SExpression arg : list.list.subList(1, list.list.size())) {
      if (containsTree(arg)) {
        return operator;
      }
    }
    return null;
  }

  private static boolean containsTree(SExpression e) {
    if (e instanceof SExpression.SList) {
      final SExpression.SList list = (SExpression.SList) e;
      if (list.startsWith("TREE_") || list.startsWith("TREE")) {
        return true;
      }
      for (SExpression arg : list.list) {
        if (containsTree(arg)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Collects the tokens and dependencies of one query. */
  private class QueryBuilder {
    final List<Token> tokens = new ArrayList<>();
    final List<Dependency> dependencies = new ArrayList<>();

    Query build() {
      return Query.create(generator, tokens, dependencies,
          ImmutableList.of(), ImmutableList.of());
    }

    /** Converts a tree or a token pattern, and returns the identifier of its
     * root token. */
    Identifier convert(SExpression e) {
      if (e instanceof SExpression.SList) {
        final SExpression.SList list = (SExpression.SList) e;
        if (list.startsWith("TREE")) {
          throw new NotSupportedException(
              "Only TREE_ is supported for matching subtrees.");
        }
        if (list.list.size() == 1) {
          return convert(list.list.get(0));
        }
        if (list.startsWith("TREE_")) {
          final Identifier root = convert(list.list.get(1));
          for (SExpression dependent
              : list.list.subList(2, list.list.size())) {
            dependencies.add(Dependency.of(root, convert(dependent)));
          }
          return root;
        }
      }
      final Identifier id = generator.get();
      tokens.add(Token.of(id, predicate(e)));
      return id;
    }

    /** Converts a token pattern to a predicate. */
    Ast.Predicate predicate(SExpression e) {
      if (!(e instanceof SExpression.SList)) {
        throw new NotSupportedException("Not a pattern: " + e);
      }
      final List<SExpression> list = ((SExpression.SList) e).list;
      if (list.size() == 1) {
        return predicate(list.get(0));
      }
      final List<SExpression> args = list.subList(1, list.size());
      final SExpression head = list.get(0);
      if (head.isAtom("TREE_") || head.isAtom("TREE")) {
        throw new NotSupportedException(
            "Trees can only be combined using AND and OR at the top level.");
      }
      if (head.isAtom("AND")) {
        return ast.and(predicates(args));
      }
      if (head.isAtom("OR")) {
        return ast.or(predicates(args));
      }
      if (head.isAtom("NOT")) {
        if (args.size() != 1) {
          throw new NotSupportedException("NOT requires one argument.");
        }
        return ast.not(predicate(args.get(0)));
      }
      if (list.size() >= 3 && list.get(1).isAtom("IN")) {
        final List<Ast.Predicate> comparisons = new ArrayList<>();
        for (SExpression value : list.subList(2, list.size())) {
          comparisons.add(comparison(head, value));
        }
        return ast.or(comparisons);
      }
      if (list.size() == 2) {
        return comparison(head, list.get(1));
      }
      throw new NotSupportedException("Not a pattern: " + e);
    }

    private List<Ast.Predicate> predicates(List<SExpression> list) {
      final List<Ast.Predicate> predicates = new ArrayList<>();
      for (SExpression e : list) {
        predicates.add(predicate(e));
      }
      return predicates;
    }

    /** Converts {@code (field value)} to a comparison. */
    private Ast.Predicate comparison(SExpression field, SExpression value) {
      if (!(field instanceof SExpression.Atom)) {
        throw new NotSupportedException(
            "When matching a field, the field must be a string.");
      }
      if (!(value instanceof SExpression.Atom)) {
        throw new NotSupportedException(
            "When matching a field, the field value must be a string.");
      }
      String name = ((SExpression.Atom) field).value;
      Op op = Op.EQ;
      if (name.endsWith("_")) {
        name = name.substring(0, name.length() - 1);
        op = Op.CONTAINS;
      }
      return ast.comparison(ast.attribute(name), op,
          ast.quoted(((SExpression.Atom) value).value));
    }
  }
}

// End DeptreepyTranslator.java
