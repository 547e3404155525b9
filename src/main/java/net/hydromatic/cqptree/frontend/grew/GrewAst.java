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

import com.google.common.collect.ImmutableList;
import net.hydromatic.cqptree.parse.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Parse tree of a Grew request. */
public class GrewAst {
  private GrewAst() {}

  /** Base class of parse tree nodes. */
  public abstract static class Node {
    public final Pos pos;

    Node(Pos pos) {
      this.pos = requireNonNull(pos);
    }
  }

  /** Request: a pattern, followed by any number of "with" and "without"
   * items. */
  public static class Request extends Node {
    public final ImmutableList<Clause> pattern;
    public final ImmutableList<Item> items;

    Request(Pos pos, ImmutableList<Clause> pattern,
        ImmutableList<Item> items) {
      super(pos);
      this.pattern = pattern;
      this.items = items;
    }
  }

  /** "with { ... }" or "without { ... }". */
  public static class Item extends Node {
    public final boolean negative;
    public final ImmutableList<Clause> clauses;

    Item(Pos pos, boolean negative, ImmutableList<Clause> clauses) {
      super(pos);
      this.negative = negative;
      this.clauses = clauses;
    }
  }

  /** Clause of a pattern. */
  public abstract static class Clause extends Node {
    Clause(Pos pos) {
      super(pos);
    }
  }

  /** Node clause, e.g. {@code N [upos = NOUN, !Tense]}. Several feature
   * structures, separated by "|", are alternatives. */
  public static class NodeClause extends Clause {
    public final String name;
    public final ImmutableList<ImmutableList<Feature>> alternatives;

    NodeClause(Pos pos, String name,
        ImmutableList<ImmutableList<Feature>> alternatives) {
      super(pos);
      this.name = requireNonNull(name);
      this.alternatives = alternatives;
    }
  }

  /** Kind of arrow in an edge clause. */
  public enum ArrowKind {
    /** {@code N -> M}. */
    ANY,
    /** {@code N -[a|b]-> M}. */
    POSITIVE,
    /** {@code N -[^a|b]-> M}. */
    NEGATIVE
  }

  /** Edge clause, e.g. {@code N -[nsubj]-> M}. */
  public static class EdgeClause extends Clause {
    public final @Nullable String label;
    public final String src;
    public final ArrowKind kind;
    public final ImmutableList<Value> types;
    public final String dst;

    EdgeClause(Pos pos, @Nullable String label, String src, ArrowKind kind,
        ImmutableList<Value> types, String dst) {
      super(pos);
      this.label = label;
      this.src = requireNonNull(src);
      this.kind = requireNonNull(kind);
      this.types = types;
      this.dst = requireNonNull(dst);
    }
  }

  /** Constraint clause, e.g. {@code N.lemma = M.lemma}. */
  public static class ConstraintClause extends Clause {
    public final Value lhs;
    public final boolean equal;
    public final Value rhs;

    ConstraintClause(Pos pos, Value lhs, boolean equal, Value rhs) {
      super(pos);
      this.lhs = requireNonNull(lhs);
      this.equal = equal;
      this.rhs = requireNonNull(rhs);
    }
  }

  /** Order clause: {@code N < M} (immediately precedes) or {@code N << M}
   * (precedes). */
  public static class OrderClause extends Clause {
    public final String lhs;
    public final boolean immediate;
    public final String rhs;

    OrderClause(Pos pos, String lhs, boolean immediate, String rhs) {
      super(pos);
      this.lhs = requireNonNull(lhs);
      this.immediate = immediate;
      this.rhs = requireNonNull(rhs);
    }
  }

  /** Feature in a feature structure. */
  public abstract static class Feature extends Node {
    public final String name;

    Feature(Pos pos, String name) {
      super(pos);
      this.name = requireNonNull(name);
    }
  }

  /** Feature that must be present, e.g. {@code Tense}. */
  public static class Presence extends Feature {
    Presence(Pos pos, String name) {
      super(pos, name);
    }
  }

  /** Feature that must be absent, e.g. {@code !Tense}. */
  public static class Absence extends Feature {
    Absence(Pos pos, String name) {
      super(pos, name);
    }
  }

  /** Feature that must have (or must not have) one of several values, e.g.
   * {@code lemma = dog|cat}. */
  public static class Requires extends Feature {
    public final boolean equal;
    public final ImmutableList<Value> values;

    Requires(Pos pos, String name, boolean equal,
        ImmutableList<Value> values) {
      super(pos, name);
      this.equal = equal;
      this.values = values;
    }
  }

  /** Kind of value. */
  public enum ValueKind {
    /** Bare word, e.g. {@code NOUN}. */
    SIMPLE,
    /** String in double quotes. */
    STRING,
    /** Regular expression, e.g. {@code re"a.*"}. */
    REGEX,
    /** Perl-style regular expression, e.g. {@code /a.+/i}. */
    PCRE,
    /** Feature of a node, e.g. {@code N.lemma}. */
    ATTRIBUTE
  }

  /** Value of a feature, an edge type, or an operand of a constraint. */
  public static class Value extends Node {
    public final ValueKind kind;
    /** Text of the value; for an attribute, the feature name. */
    public final String text;
    /** For an attribute, the name of the node; otherwise null. */
    public final @Nullable String node;

    Value(Pos pos, ValueKind kind, String text, @Nullable String node) {
      super(pos);
      this.kind = requireNonNull(kind);
      this.text = requireNonNull(text);
      this.node = node;
    }
  }
}

// End GrewAst.java
