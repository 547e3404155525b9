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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>An {@link Operand} is either a {@link Literal} or an {@link Attribute}. A
 * {@link Predicate} is a {@link Comparison}, {@link Exists}, {@link Negation},
 * {@link Conjunction} or {@link Disjunction}. Constructors are package-private,
 * so the hierarchy is closed; use {@link AstBuilder} to create nodes.
 */
public class Ast {
  private Ast() {}

  /** Characters that have a special meaning in a regular expression. */
  private static final String REGEX_META_CHARACTERS = "\\.^$|?*+()[]{}";

  /** Base class for a value within a {@link Predicate}. */
  public abstract static class Operand extends AstNode {
    Operand(Op op) {
      super(op);
    }

    @Override
    public abstract Operand raiseFrom(Identifier id);

    @Override
    public abstract Operand lowerOnto(Identifier id);
  }

  /**
   * Literal value.
   *
   * <p>The value is written to the target query exactly as it is stored, so it
   * includes quotes if it is a string. If the literal was created from plain
   * text, regular expression metacharacters have already been escaped.
   */
  public static class Literal extends Operand {
    public final String value;

    Literal(String value) {
      super(Op.LITERAL);
      this.value = requireNonNull(value);
    }

    /** Escapes every regular expression metacharacter in a string. */
    public static String escape(String s) {
      final StringBuilder b = new StringBuilder(s.length());
      for (int i = 0; i < s.length(); i++) {
        final char c = s.charAt(i);
        if (REGEX_META_CHARACTERS.indexOf(c) >= 0) {
          b.append('\\');
        }
        b.append(c);
      }
      return b.toString();
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal && value.equals(((Literal) o).value);
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      return ImmutableSet.of();
    }

    @Override
    public Literal raiseFrom(Identifier id) {
      return this;
    }

    @Override
    public Literal lowerOnto(Identifier id) {
      return this;
    }

    @Override
    CqpWriter unparse(CqpWriter w, int left, int right) {
      return w.append(value);
    }
  }

  /**
   * Field of a token.
   *
   * <p>If {@link #reference} is null, the field belongs to the token that the
   * enclosing predicate is attached to; otherwise it belongs to the referenced
   * token.
   */
  public static class Attribute extends Operand {
    public final @Nullable Identifier reference;
    public final String name;

    Attribute(@Nullable Identifier reference, String name) {
      super(Op.ATTRIBUTE);
      this.reference = reference;
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "attribute name must not be empty");
    }

    @Override
    public int hashCode() {
      return Objects.hash(reference, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Attribute
              && reference == ((Attribute) o).reference
              && name.equals(((Attribute) o).name);
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      return reference == null ? ImmutableSet.of() : ImmutableSet.of(reference);
    }

    @Override
    public Attribute raiseFrom(Identifier id) {
      return reference == null ? new Attribute(id, name) : this;
    }

    @Override
    public Attribute lowerOnto(Identifier id) {
      return reference == id ? new Attribute(null, name) : this;
    }

    @Override
    CqpWriter unparse(CqpWriter w, int left, int right) {
      return w.attribute(reference, name);
    }
  }

  /** Base class for a boolean expression over operands. */
  public abstract static class Predicate extends AstNode {
    Predicate(Op op) {
      super(op);
    }

    @Override
    public abstract Predicate raiseFrom(Identifier id);

    @Override
    public abstract Predicate lowerOnto(Identifier id);

    /**
     * Returns a simplified copy of this predicate.
     *
     * <p>Nested junctions of the same kind are flattened, junctions with a
     * single member are replaced by that member, and double negations cancel.
     * The result is deterministic, and normalizing it again returns an equal
     * predicate.
     */
    public abstract Predicate normalize();
  }

  /** Predicate that compares two operands, e.g. {@code lemma = "dog"}. */
  public static class Comparison extends Predicate {
    public final Operand lhs;
    public final Operand rhs;

    Comparison(Operand lhs, Op op, Operand rhs) {
      super(op);
      checkArgument(op.isComparison(), "not a comparison: %s", op);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(lhs, op, rhs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Comparison
              && op == ((Comparison) o).op
              && lhs.equals(((Comparison) o).lhs)
              && rhs.equals(((Comparison) o).rhs);
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      return ImmutableSet.<Identifier>builder()
          .addAll(lhs.referencedIdentifiers())
          .addAll(rhs.referencedIdentifiers())
          .build();
    }

    @Override
    public Comparison raiseFrom(Identifier id) {
      return copy(lhs.raiseFrom(id), rhs.raiseFrom(id));
    }

    @Override
    public Comparison lowerOnto(Identifier id) {
      return copy(lhs.lowerOnto(id), rhs.lowerOnto(id));
    }

    @Override
    public Comparison normalize() {
      return this;
    }

    @Override
    CqpWriter unparse(CqpWriter w, int left, int right) {
      return w.infix(left, lhs, op, rhs, right);
    }

    /**
     * Creates a copy of this {@code Comparison} with given operands and the
     * same operator, or {@code this} if the operands are the same.
     */
    public Comparison copy(Operand lhs, Operand rhs) {
      return this.lhs.equals(lhs) && this.rhs.equals(rhs)
          ? this
          : new Comparison(lhs, op, rhs);
    }
  }

  /** Predicate that holds if a token has a value for an attribute. */
  public static class Exists extends Predicate {
    public final Attribute attribute;

    Exists(Attribute attribute) {
      super(Op.EXISTS);
      this.attribute = requireNonNull(attribute);
    }

    @Override
    public int hashCode() {
      return attribute.hashCode() * 31 + 7;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Exists && attribute.equals(((Exists) o).attribute);
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      return attribute.referencedIdentifiers();
    }

    @Override
    public Exists raiseFrom(Identifier id) {
      return copy(attribute.raiseFrom(id));
    }

    @Override
    public Exists lowerOnto(Identifier id) {
      return copy(attribute.lowerOnto(id));
    }

    @Override
    public Exists normalize() {
      return this;
    }

    @Override
    CqpWriter unparse(CqpWriter w, int left, int right) {
      return attribute.unparse(w, left, right);
    }

    /**
     * Creates a copy of this {@code Exists} with a given attribute, or {@code
     * this} if the attribute is the same.
     */
    public Exists copy(Attribute attribute) {
      return this.attribute.equals(attribute) ? this : new Exists(attribute);
    }
  }

  /** Negated predicate. */
  public static class Negation extends Predicate {
    public final Predicate predicate;

    Negation(Predicate predicate) {
      super(Op.NOT);
      this.predicate = requireNonNull(predicate);
    }

    @Override
    public int hashCode() {
      return ~predicate.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Negation
              && predicate.equals(((Negation) o).predicate);
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      return predicate.referencedIdentifiers();
    }

    @Override
    public Negation raiseFrom(Identifier id) {
      return copy(predicate.raiseFrom(id));
    }

    @Override
    public Negation lowerOnto(Identifier id) {
      return copy(predicate.lowerOnto(id));
    }

    @Override
    public Predicate normalize() {
      final Predicate p = predicate.normalize();
      if (p instanceof Negation) {
        // !!p is p
        return ((Negation) p).predicate;
      }
      return copy(p);
    }

    @Override
    CqpWriter unparse(CqpWriter w, int left, int right) {
      return w.prefix(left, op, predicate, right);
    }

    /**
     * Creates a copy of this {@code Negation} with a given predicate, or
     * {@code this} if the predicate is the same.
     */
    public Negation copy(Predicate predicate) {
      return this.predicate.equals(predicate) ? this : new Negation(predicate);
    }
  }

  /** Base class for {@link Conjunction} and {@link Disjunction}. */
  public abstract static class Junction extends Predicate {
    public final ImmutableList<Predicate> predicates;

    Junction(Op op, List<? extends Predicate> predicates) {
      super(op);
      this.predicates = ImmutableList.copyOf(predicates);
      checkArgument(
          !this.predicates.isEmpty(),
          "Cannot create empty %s",
          getClass().getSimpleName());
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, predicates);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Junction
              && op == ((Junction) o).op
              && predicates.equals(((Junction) o).predicates);
    }

    @Override
    public ImmutableSet<Identifier> referencedIdentifiers() {
      final ImmutableSet.Builder<Identifier> b = ImmutableSet.builder();
      predicates.forEach(p -> b.addAll(p.referencedIdentifiers()));
      return b.build();
    }

    @Override
    public Junction raiseFrom(Identifier id) {
      final ImmutableList.Builder<Predicate> b = ImmutableList.builder();
      predicates.forEach(p -> b.add(p.raiseFrom(id)));
      return copy(b.build());
    }

    @Override
    public Junction lowerOnto(Identifier id) {
      final ImmutableList.Builder<Predicate> b = ImmutableList.builder();
      predicates.forEach(p -> b.add(p.lowerOnto(id)));
      return copy(b.build());
    }

    @Override
    public Predicate normalize() {
      final ImmutableList.Builder<Predicate> b = ImmutableList.builder();
      for (Predicate predicate : predicates) {
        final Predicate p = predicate.normalize();
        if (p.op == op) {
          b.addAll(((Junction) p).predicates);
        } else {
          b.add(p);
        }
      }
      final List<Predicate> list = b.build();
      return list.size() == 1 ? list.get(0) : copy(list);
    }

    @Override
    CqpWriter unparse(CqpWriter w, int left, int right) {
      return w.junction(left, op, predicates, right);
    }

    /**
     * Creates a junction of the same kind with given members, or {@code this}
     * if the members are the same.
     */
    public abstract Junction copy(List<? extends Predicate> predicates);
  }

  /** Predicate that holds if all of its members hold. */
  public static class Conjunction extends Junction {
    Conjunction(List<? extends Predicate> predicates) {
      super(Op.AND, predicates);
    }

    /**
     * Creates a conjunction, or returns the sole predicate if there is only
     * one.
     *
     * @throws IllegalArgumentException if there are no predicates
     */
    public static Predicate of(Iterable<? extends Predicate> predicates) {
      final ImmutableList<Predicate> list = ImmutableList.copyOf(predicates);
      return list.size() == 1 ? list.get(0) : new Conjunction(list);
    }

    @Override
    public Conjunction copy(List<? extends Predicate> predicates) {
      return this.predicates.equals(predicates)
          ? this
          : new Conjunction(predicates);
    }
  }

  /** Predicate that holds if at least one of its members holds. */
  public static class Disjunction extends Junction {
    Disjunction(List<? extends Predicate> predicates) {
      super(Op.OR, predicates);
    }

    /**
     * Creates a disjunction, or returns the sole predicate if there is only
     * one.
     *
     * @throws IllegalArgumentException if there are no predicates
     */
    public static Predicate of(Iterable<? extends Predicate> predicates) {
      final ImmutableList<Predicate> list = ImmutableList.copyOf(predicates);
      return list.size() == 1 ? list.get(0) : new Disjunction(list);
    }

    @Override
    public Disjunction copy(List<? extends Predicate> predicates) {
      return this.predicates.equals(predicates)
          ? this
          : new Disjunction(predicates);
    }
  }
}

// End Ast.java
