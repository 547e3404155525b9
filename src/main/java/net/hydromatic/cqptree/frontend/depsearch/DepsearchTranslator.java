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
package net.hydromatic.cqptree.frontend.depsearch;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.cqptree.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.cqptree.ast.Ast;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import net.hydromatic.cqptree.ast.Op;
import net.hydromatic.cqptree.compile.NotSupportedException;
import net.hydromatic.cqptree.parse.ParseFailedException;
import net.hydromatic.cqptree.query.Constraint;
import net.hydromatic.cqptree.query.Dependency;
import net.hydromatic.cqptree.query.Query;
import net.hydromatic.cqptree.query.Recipe;
import net.hydromatic.cqptree.translate.Translator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates a dep_search query into a recipe.
 *
 * <p>A word matches the word form, or the part of speech if it is a
 * universal POS tag such as {@code NOUN}; "_" matches any token;
 * {@code L=x} matches the lemma, and any other {@code Name=Value} a
 * morphological feature.
 *
 * <p>{@code a > b} means that "a" governs "b", and {@code a < b} that "a"
 * depends on "b"; a label after the arrow constrains the relation of the
 * dependent. "@L" and "@R" require the target to be on the left or on the
 * right. {@code a <lin_m:n b} requires between m and n tokens between "a"
 * and "b", and {@code a . b} that "b" immediately follows "a".
 */
public class DepsearchTranslator implements Translator {
  /** Universal part-of-speech tags. */
  private static final ImmutableSet<String> PARTS_OF_SPEECH =
      ImmutableSet.of("ADJ", "ADP", "ADV", "AUX", "CCONJ", "DET", "INTJ",
          "NOUN", "NUM", "PART", "PRON", "PROPN", "PUNCT", "SCONJ", "SYM",
          "VERB", "X");

  private static final Pattern LINEAR_DISTANCE =
      Pattern.compile("lin_(-?[0-9]{1,9}):(-?[0-9]{1,9})");

  private final IdentifierGenerator generator;

  public DepsearchTranslator(IdentifierGenerator generator) {
    this.generator = requireNonNull(generator);
  }

  @Override
  public String name() {
    return "depsearch";
  }

  @Override
  public Recipe translate(String text) {
    final DepsearchAst.Query query = DepsearchParser.parse(text);
    if (query.combinator != null) {
      switch (query.combinator) {
      case IMPLIES:
        throw new NotSupportedException(
            "Universally quantified queries (\"->\") are not supported.");
      case PLUS:
        throw new NotSupportedException(
            "Disjunctions of queries (\"+\") are not supported.");
      default:
        throw new AssertionError(query.combinator);
      }
    }
    final Query.Builder builder = Query.builder(generator);
    tree(builder, query.tree);
    return Recipe.ofQuery(builder.build());
  }

  /** Adds the tokens of a tree, and returns the identifier of its head. */
  private Identifier tree(Query.Builder builder, DepsearchAst.Tree tree) {
    final Identifier head = token(builder, tree.head);
    for (DepsearchAst.Relation relation : tree.relations) {
      final Identifier target = token(builder, relation.target);
      relation(builder, relation, head, target);
    }
    return head;
  }

  /** Adds a token, or the tokens of a tree in parentheses, and returns the
   * identifier of the token. */
  private Identifier token(Query.Builder builder, DepsearchAst.Expr e) {
    if (e instanceof DepsearchAst.Group) {
      return tree(builder, ((DepsearchAst.Group) e).tree);
    }
    return builder.token(predicate(e));
  }

  private void relation(Query.Builder builder,
      DepsearchAst.Relation relation, Identifier head, Identifier target) {
    if (relation.grouped) {
      throw new NotSupportedException(
          "Complex dependency expressions are not supported.");
    }
    if (relation.negated) {
      throw new NotSupportedException(
          "The absence of a dependency relation cannot be expressed.");
    }
    if (relation.arrows.isEmpty()) {
      // "a . b"
      builder.add(Constraint.order(head, target));
      builder.add(Constraint.distance(head, target).equalTo(0));
      return;
    }
    if (relation.arrows.size() > 1) {
      throw new NotSupportedException(
          "Disjunctions of dependency relations are not supported.");
    }
    final DepsearchAst.Arrow arrow = relation.arrows.get(0);
    if (arrow.isLinear()) {
      distance(builder, arrow, head, target);
    } else {
      final Identifier governor = arrow.governs ? head : target;
      final Identifier dependent = arrow.governs ? target : head;
      builder.add(Dependency.of(governor, dependent));
      if (arrow.label != null) {
        builder.add(
            ast.comparison(ast.attribute(dependent, "deprel"),
                arrow.negatedLabel ? Op.NE : Op.EQ,
                ast.quoted(arrow.label)));
      }
    }
    if (arrow.side == DepsearchAst.Side.RIGHT) {
      builder.add(Constraint.order(head, target));
    } else if (arrow.side == DepsearchAst.Side.LEFT) {
      builder.add(Constraint.order(target, head));
    }
  }

  /** Adds the constraints of a linear distance such as "lin_2:3". */
  private static void distance(Query.Builder builder,
      DepsearchAst.Arrow arrow, Identifier head, Identifier target) {
    final Matcher matcher =
        LINEAR_DISTANCE.matcher(requireNonNull(arrow.label));
    if (!matcher.matches()) {
      throw ParseFailedException.of(arrow.pos,
          "Invalid linear distance '" + arrow.label
              + "'; expected 'lin_min:max'");
    }
    final int min = Integer.parseInt(matcher.group(1));
    final int max = Integer.parseInt(matcher.group(2));
    if (min < 0 || max < min) {
      throw ParseFailedException.of(arrow.pos,
          "Invalid distance range " + min + ":" + max);
    }
    if (arrow.negatedLabel) {
      throw new NotSupportedException(
          "Negated linear distances are not supported.");
    }
    builder.add(Constraint.distance(head, target).atLeast(min));
    builder.add(Constraint.distance(head, target).atMost(max));
  }

  /** Converts an expression to a predicate on a token; returns null if the
   * expression matches any token. */
  private static Ast.@Nullable Predicate predicate(DepsearchAst.Expr e) {
    if (e instanceof DepsearchAst.Word) {
      final DepsearchAst.Word word = (DepsearchAst.Word) e;
      if (word.isAny()) {
        return null;
      }
      final String attribute =
          !word.quoted && PARTS_OF_SPEECH.contains(word.text) ? "pos"
              : "word";
      return ast.equal(ast.attribute(attribute), ast.quoted(word.text));
    } else if (e instanceof DepsearchAst.Feature) {
      final DepsearchAst.Feature feature = (DepsearchAst.Feature) e;
      if (feature.name.equals("L")) {
        return ast.equal(ast.attribute("lemma"), ast.quoted(feature.value));
      }
      return ast.comparison(ast.attribute("ufeats"), Op.CONTAINS,
          ast.quoted(feature.name + "=" + feature.value));
    } else if (e instanceof DepsearchAst.Not) {
      final Ast.@Nullable Predicate operand =
          predicate(((DepsearchAst.Not) e).operand);
      if (operand == null) {
        throw new NotSupportedException("'!_' matches no token.");
      }
      return ast.not(operand);
    } else if (e instanceof DepsearchAst.Junction) {
      final DepsearchAst.Junction junction = (DepsearchAst.Junction) e;
      final List<Ast.Predicate> list = new ArrayList<>();
      for (DepsearchAst.Expr operand : junction.operands) {
        final Ast.@Nullable Predicate predicate = predicate(operand);
        if (predicate != null) {
          list.add(predicate);
        } else if (!junction.conjunction) {
          // "x | _" matches any token
          return null;
        }
      }
      if (list.isEmpty()) {
        return null;
      }
      return junction.conjunction ? ast.and(list) : ast.or(list);
    } else if (e instanceof DepsearchAst.Group) {
      final DepsearchAst.Tree tree = ((DepsearchAst.Group) e).tree;
      if (!tree.relations.isEmpty()) {
        throw new NotSupportedException("Relations inside a token "
            + "expression are not supported.");
      }
      return predicate(tree.head);
    } else {
      throw new AssertionError("unknown expression " + e);
    }
  }
}

// End DepsearchTranslator.java
