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
package net.hydromatic.cqptree.frontend.grew;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.cqptree.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cqptree.ast.Ast;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import net.hydromatic.cqptree.ast.Op;
import net.hydromatic.cqptree.compile.NotSupportedException;
import net.hydromatic.cqptree.query.Constraint;
import net.hydromatic.cqptree.query.Dependency;
import net.hydromatic.cqptree.query.Query;
import net.hydromatic.cqptree.query.Recipe;
import net.hydromatic.cqptree.query.Token;
import net.hydromatic.cqptree.translate.Translator;

/**
 * Translates a Grew request into a recipe.
 *
 * <p>The pattern becomes a query. Each "with" item becomes an additional
 * part of that query, and each "without" item a negative part. Nodes are
 * declared by being mentioned; an item may mention nodes of the pattern.
 */
public class GrewTranslator implements Translator {
  private final IdentifierGenerator generator;

  public GrewTranslator(IdentifierGenerator generator) {
    this.generator = requireNonNull(generator);
  }

  @Override
  public String name() {
    return "grew";
  }

  @Override
  public Recipe translate(String text) {
    return Recipe.ofQuery(translate(GrewParser.parse(text)));
  }

  /** Translates a parsed request into a query. */
  Query translate(GrewAst.Request request) {
    final ClauseTranslator pattern = new ClauseTranslator(ImmutableMap.of());
    request.pattern.forEach(pattern::translate);

    Query query;
    if (pattern.tokens().isEmpty()) {
      // An empty pattern matches an arbitrary token.
      query = Query.of(generator, Token.fresh(generator));
    } else {
      query = Query.create(generator, pattern.tokens(),
          pattern.dependencies, pattern.constraints, pattern.predicates);
    }

    for (GrewAst.Item item : request.items) {
      final ClauseTranslator part =
          new ClauseTranslator(pattern.environment);
      item.clauses.forEach(part::translate);
      query = query.plusPart(
          item.negative ? Query.PartKind.NEGATIVE : Query.PartKind.ADDITIONAL,
          part.tokens(), part.dependencies, part.constraints,
          part.predicates);
    }
    return query;
  }

  /** Translates the clauses of a pattern or an item. */
  private class ClauseTranslator {
    /** Nodes, in order of first mention. */
    final Map<String, Identifier> environment = new LinkedHashMap<>();
    final ImmutableSet<String> inherited;
    final List<Dependency> dependencies = new ArrayList<>();
    final List<Constraint> constraints = new ArrayList<>();
    final List<Ast.Predicate> predicates = new ArrayList<>();

    ClauseTranslator(Map<String, Identifier> inheritedEnvironment) {
      environment.putAll(inheritedEnvironment);
      inherited = ImmutableSet.copyOf(inheritedEnvironment.keySet());
    }

    /** Returns the identifier of a node, declaring it if it is new. */
    Identifier node(String name) {
      return environment.computeIfAbsent(name, n -> generator.get());
    }

    /** Returns the tokens of the nodes that are not inherited. */
    List<Token> tokens() {
      final List<Token> tokens = new ArrayList<>();
      environment.forEach((name, id) -> {
        if (!inherited.contains(name)) {
          tokens.add(Token.of(id));
        }
      });
      return tokens;
    }

    void translate(GrewAst.Clause clause) {
      if (clause instanceof GrewAst.NodeClause) {
        final GrewAst.NodeClause node = (GrewAst.NodeClause) clause;
        final Identifier id = node(node.name);
        final List<Ast.Predicate> alternatives = new ArrayList<>();
        for (List<GrewAst.Feature> features : node.alternatives) {
          if (features.isEmpty()) {
            // "N []" matches any token, so the alternatives are redundant.
            return;
          }
          final List<Ast.Predicate> list = new ArrayList<>();
          features.forEach(f -> list.add(predicate(f)));
          alternatives.add(ast.and(list));
        }
        predicates.add(ast.or(alternatives).raiseFrom(id));
      } else if (clause instanceof GrewAst.EdgeClause) {
        final GrewAst.EdgeClause edge = (GrewAst.EdgeClause) clause;
        if (edge.label != null) {
          throw new NotSupportedException(
              "Named edges are not supported.");
        }
        if (edge.src.equals(edge.dst)) {
          throw new NotSupportedException("Node " + edge.src
              + " cannot be a dependent of itself.");
        }
        final Identifier src = node(edge.src);
        final Identifier dst = node(edge.dst);
        dependencies.add(Dependency.of(src, dst));

        final Ast.Attribute deprel = ast.attribute(dst, "deprel");
        final List<Ast.Predicate> list = new ArrayList<>();
        switch (edge.kind) {
        case POSITIVE:
          edge.types.forEach(t ->
              list.add(ast.comparison(deprel, Op.EQ, operand(t))));
          predicates.add(ast.or(list));
          break;
        case NEGATIVE:
          edge.types.forEach(t ->
              list.add(ast.comparison(deprel, Op.NE, operand(t))));
          predicates.add(ast.and(list));
          break;
        default:
          break;
        }
      } else if (clause instanceof GrewAst.ConstraintClause) {
        final GrewAst.ConstraintClause c = (GrewAst.ConstraintClause) clause;
        predicates.add(
            ast.comparison(operand(c.lhs), c.equal ? Op.EQ : Op.NE,
                operand(c.rhs)));
      } else if (clause instanceof GrewAst.OrderClause) {
        final GrewAst.OrderClause order = (GrewAst.OrderClause) clause;
        if (order.lhs.equals(order.rhs)) {
          throw new NotSupportedException("Node " + order.lhs
              + " cannot precede itself.");
        }
        final Identifier lhs = node(order.lhs);
        final Identifier rhs = node(order.rhs);
        constraints.add(Constraint.order(lhs, rhs));
        if (order.immediate) {
          constraints.add(Constraint.distance(lhs, rhs).equalTo(0));
        }
      } else {
        throw new AssertionError("unknown clause " + clause);
      }
    }

    /** Converts a feature to a predicate on the current token. */
    Ast.Predicate predicate(GrewAst.Feature feature) {
      final Ast.Attribute attribute = ast.attribute(feature.name);
      if (feature instanceof GrewAst.Presence) {
        return ast.exists(attribute);
      } else if (feature instanceof GrewAst.Absence) {
        return ast.not(ast.exists(attribute));
      } else {
        final GrewAst.Requires requires = (GrewAst.Requires) feature;
        final List<Ast.Predicate> list = new ArrayList<>();
        for (GrewAst.Value value : requires.values) {
          list.add(
              ast.comparison(attribute, requires.equal ? Op.EQ : Op.NE,
                  operand(value)));
        }
        return requires.equal ? ast.or(list) : ast.and(list);
      }
    }

    Ast.Operand operand(GrewAst.Value value) {
      switch (value.kind) {
      case SIMPLE:
        return ast.quoted(value.text);
      case STRING:
        return ast.quoted(unescape(value.text));
      case REGEX:
        return ast.literal('"' + value.text + '"', true);
      case PCRE:
        throw new NotSupportedException(
            "PCRE expressions are not yet supported.");
      case ATTRIBUTE:
        return ast.attribute(node(requireNonNull(value.node)), value.text);
      default:
        throw new AssertionError(value.kind);
      }
    }
  }

  /** Removes the backslash from escaped characters. */
  private static String unescape(String s) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '\\' && i + 1 < s.length()) {
        b.append(s.charAt(++i));
      } else {
        b.append(c);
      }
    }
    return b.toString();
  }
}

// End GrewTranslator.java
