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

import com.google.common.collect.ImmutableList;
import net.hydromatic.cqptree.parse.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Parse tree of a dep_search query. */
public class DepsearchAst {
  private DepsearchAst() {}

  /** Base class of parse tree nodes. */
  public abstract static class Node {
    public final Pos pos;

    Node(Pos pos) {
      this.pos = requireNonNull(pos);
    }
  }

  /** Operator that combines two trees into a query. */
  public enum Combinator {
    /** "a -> b": every match of "a" must also match "b". */
    IMPLIES,
    /** "a + b": matches of either tree. */
    PLUS
  }

  /** Query: a tree, optionally combined with a second tree. */
  public static class Query extends Node {
    public final Tree tree;
    public final @Nullable Combinator combinator;
    public final @Nullable Tree other;

    Query(Pos pos, Tree tree, @Nullable Combinator combinator,
        @Nullable Tree other) {
      super(pos);
      this.tree = requireNonNull(tree);
      this.combinator = combinator;
      this.other = other;
    }
  }

  /** Token expression followed by relations to other tokens, e.g.
   * {@code cat >amod _ >amod _}. Each relation starts from the head. */
  public static class Tree extends Node {
    public final Expr head;
    public final ImmutableList<Relation> relations;

    Tree(Pos pos, Expr head, ImmutableList<Relation> relations) {
      super(pos);
      this.head = requireNonNull(head);
      this.relations = relations;
    }
  }

  /** Relation between the head of a tree and a target token.
   *
   * <p>If {@link #arrows} is empty, the relation is ".", "immediately
   * followed by". */
  public static class Relation extends Node {
    /** Whether the relation is negated, as in {@code !>amod}. */
    public final boolean negated;
    /** Whether the arrows are in parentheses, as in {@code !(>a|>b)}. */
    public final boolean grouped;
    /** Alternative arrows, as in {@code >amod|>acl}. */
    public final ImmutableList<Arrow> arrows;
    public final Expr target;

    Relation(Pos pos, boolean negated, boolean grouped,
        ImmutableList<Arrow> arrows, Expr target) {
      super(pos);
      this.negated = negated;
      this.grouped = grouped;
      this.arrows = arrows;
      this.target = requireNonNull(target);
    }
  }

  /** Side on which the target of a relation lies. */
  public enum Side {
    LEFT,
    RIGHT
  }

  /** Arrow such as {@code >nsubj}, {@code <!amod@L} or
   * {@code <lin_2:3}. */
  public static class Arrow extends Node {
    /** Whether the head of the tree governs the target (">"), rather than
     * depending on it ("<"). */
    public final boolean governs;
    /** Whether the label is negated, as in {@code >!amod}. */
    public final boolean negatedLabel;
    public final @Nullable String label;
    public final @Nullable Side side;

    Arrow(Pos pos, boolean governs, boolean negatedLabel,
        @Nullable String label, @Nullable Side side) {
      super(pos);
      this.governs = governs;
      this.negatedLabel = negatedLabel;
      this.label = label;
      this.side = side;
    }

    /** Whether this is a linear distance, such as {@code <lin_2:3}, rather
     * than a dependency. */
    public boolean isLinear() {
      return label != null && label.startsWith("lin_");
    }
  }

  /** Expression that describes a single token. */
  public abstract static class Expr extends Node {
    Expr(Pos pos) {
      super(pos);
    }
  }

  /** Word, e.g. {@code walk}, {@code NOUN}, {@code _} or
   * {@code "Person"}. */
  public static class Word extends Expr {
    public final String text;
    /** Whether the word was in double quotes. */
    public final boolean quoted;

    Word(Pos pos, String text, boolean quoted) {
      super(pos);
      this.text = requireNonNull(text);
      this.quoted = quoted;
    }

    /** Whether this is "_", which matches any token. */
    public boolean isAny() {
      return !quoted && text.equals("_");
    }
  }

  /** Feature, e.g. {@code L=cat} or {@code Case=Gen}. */
  public static class Feature extends Expr {
    public final String name;
    public final String value;

    Feature(Pos pos, String name, String value) {
      super(pos);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }
  }

  /** Negation, e.g. {@code !AUX}. */
  public static class Not extends Expr {
    public final Expr operand;

    Not(Pos pos, Expr operand) {
      super(pos);
      this.operand = requireNonNull(operand);
    }
  }

  /** Conjunction ("&") or disjunction ("|") of expressions. */
  public static class Junction extends Expr {
    public final boolean conjunction;
    public final ImmutableList<Expr> operands;

    Junction(Pos pos, boolean conjunction, ImmutableList<Expr> operands) {
      super(pos);
      this.conjunction = conjunction;
      this.operands = operands;
    }

    /** Creates a junction, or returns the operand if there is only one. */
    static Expr of(boolean conjunction, ImmutableList<Expr> operands) {
      return operands.size() == 1
          ? operands.get(0)
          : new Junction(operands.get(0).pos, conjunction, operands);
    }
  }

  /** Tree in parentheses, e.g. {@code (_ >amod _)} or
   * {@code (L=cat | L=dog)}. */
  public static class Group extends Expr {
    public final Tree tree;

    Group(Pos pos, Tree tree) {
      super(pos);
      this.tree = requireNonNull(tree);
    }
  }
}

// End DepsearchAst.java
