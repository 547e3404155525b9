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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.cqptree.ast.Ast;
import net.hydromatic.cqptree.ast.AstNode;
import net.hydromatic.cqptree.ast.CqpWriter;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.ast.Op;
import net.hydromatic.cqptree.query.Dependency;

/**
 * Linear query: a tree of token patterns, sequences of patterns with gaps
 * between them, and alternatives.
 *
 * <p>Unlike a {@link net.hydromatic.cqptree.query.Query}, a linear query can
 * be written directly in the target query language.
 */
public abstract class Linear {
  private Linear() {}

  /** Creates a token pattern. */
  public static Token token(Identifier identifier,
      Iterable<? extends Ast.Predicate> predicates,
      Iterable<Dependency> dependencies, boolean opensSpan,
      boolean closesSpan) {
    return new Token(identifier, ImmutableList.copyOf(predicates),
        ImmutableList.copyOf(dependencies), opensSpan, closesSpan);
  }

  /** Creates a sequence of two queries. */
  public static Sequence sequence(Node lhs, Gap gap, Node rhs) {
    return new Sequence(lhs, gap, rhs);
  }

  /** Creates the disjunction of some queries. */
  public static Operator or(Iterable<? extends Node> nodes) {
    return new Operator(Op.OR, ImmutableList.copyOf(nodes));
  }

  /** Node of a linear query. */
  public abstract static class Node {
    Node() {}

    /**
     * Returns the tokens that are referenced from a token other than
     * themselves. In the target language, such tokens need a name.
     */
    public abstract ImmutableSet<Identifier> referencedIdentifiers();

    abstract void unparse(CqpWriter w, String span);

    /** Returns the names of the tokens that need names; "a", "b", etc. */
    public ImmutableMap<Identifier, String> names() {
      final NameGenerator nameGenerator = NameGenerator.lower();
      final ImmutableMap.Builder<Identifier, String> b =
          ImmutableMap.builder();
      referencedIdentifiers().forEach(id -> b.put(id, nameGenerator.get()));
      return b.build();
    }

    /** Writes this query in the target query language, using a given
     * structural attribute for anchors. */
    public String format(String span) {
      final CqpWriter w = new CqpWriter(names());
      unparse(w, span);
      return w.toString();
    }

    @Override
    public String toString() {
      return format("s");
    }
  }

  /**
   * Pattern that matches one token.
   *
   * <p>Its predicates use unqualified attributes for the token itself.
   */
  public static class Token extends Node {
    public final Identifier identifier;
    public final ImmutableList<Ast.Predicate> predicates;
    public final ImmutableList<Dependency> dependencies;
    public final boolean opensSpan;
    public final boolean closesSpan;

    Token(Identifier identifier, ImmutableList<Ast.Predicate> predicates,
        ImmutableList<Dependency> dependencies, boolean opensSpan,
        boolean closesSpan) {
      this.identifier = requireNonNull(identifier);
      this.predicates = predicates;
      this.dependencies = dependencies;
      this.opensSpan = opensSpan;
      this.closesSpan = closesSpan;
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      final Set<Identifier> set = new LinkedHashSet<>();
      dependencies.forEach(d -> set.addAll(d.referencedIdentifiers()));
      predicates.forEach(p -> set.addAll(p.referencedIdentifiers()));
      set.remove(identifier);
      return ImmutableSet.copyOf(set);
    }

    @Override
    void unparse(CqpWriter w, String span) {
      if (opensSpan) {
        w.append("<").append(span).append("> ");
      }
      if (w.isNamed(identifier)) {
        w.append(w.name(identifier)).append(":");
      }

      // A conjunction's members are separate terms; all terms of a token are
      // conjoined anyway.
      final List<AstNode> terms = new ArrayList<>();
      for (Ast.Predicate predicate : predicates) {
        if (predicate.op == Op.AND) {
          terms.addAll(((Ast.Junction) predicate).predicates);
        } else {
          terms.add(predicate);
        }
      }
      final int termCount = terms.size() + dependencies.size();
      final int left = termCount == 1 ? 0 : Op.AND.left;
      final int right = termCount == 1 ? 0 : Op.AND.right;
      w.append("[");
      int i = 0;
      for (AstNode term : terms) {
        if (i++ > 0) {
          w.append(Op.AND.padded);
        }
        w.append(term, left, right);
      }
      for (Dependency dependency : dependencies) {
        if (i++ > 0) {
          w.append(Op.AND.padded);
        }
        if (dependency.src == identifier) {
          w.append(w.name(dependency.dst)).append(".dephead = ref");
        } else {
          w.append("dephead = ").append(w.name(dependency.src))
              .append(".ref");
        }
      }
      w.append("]");
      if (closesSpan) {
        w.append(" </").append(span).append(">");
      }
    }
  }

  /** Two queries, one after the other, with a gap between them. */
  public static class Sequence extends Node {
    public final Node lhs;
    public final Gap gap;
    public final Node rhs;

    Sequence(Node lhs, Gap gap, Node rhs) {
      this.lhs = requireNonNull(lhs);
      this.gap = requireNonNull(gap);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      return ImmutableSet.<Identifier>builder()
          .addAll(lhs.referencedIdentifiers())
          .addAll(rhs.referencedIdentifiers())
          .build();
    }

    @Override
    void unparse(CqpWriter w, String span) {
      unparseChild(w, lhs, span);
      final String gapString = gap.unparse();
      if (!gapString.isEmpty()) {
        w.append(" ").append(gapString);
      }
      w.append(" ");
      unparseChild(w, rhs, span);
    }

    private static void unparseChild(CqpWriter w, Node node, String span) {
      if (node instanceof Operator) {
        w.append("(");
        node.unparse(w, span);
        w.append(")");
      } else {
        node.unparse(w, span);
      }
    }
  }

  /** Queries combined by an operator, such as "|". */
  public static class Operator extends Node {
    public final Op op;
    public final ImmutableList<Node> nodes;

    Operator(Op op, ImmutableList<Node> nodes) {
      this.op = requireNonNull(op);
      this.nodes = nodes;
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      final ImmutableSet.Builder<Identifier> b = ImmutableSet.builder();
      nodes.forEach(n -> b.addAll(n.referencedIdentifiers()));
      return b.build();
    }

    @Override
    void unparse(CqpWriter w, String span) {
      int i = 0;
      for (Node node : nodes) {
        if (i++ > 0) {
          w.append(op.padded);
        }
        if (node instanceof Token || node instanceof Sequence) {
          node.unparse(w, span);
        } else {
          w.append("(");
          node.unparse(w, span);
          w.append(")");
        }
      }
    }
  }
}

// End Linear.java
