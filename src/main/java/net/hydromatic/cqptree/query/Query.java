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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.cqptree.ast.Ast;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Query graph: tokens, the dependencies between them, constraints on their
 * positions, and global predicates.
 *
 * <p>A query is validated on construction. Every token has its own
 * identifier, and every identifier that a dependency, constraint or predicate
 * references is defined by a token. A query may also have parts, each of
 * which narrows ({@link PartKind#ADDITIONAL}) or excludes ({@link
 * PartKind#NEGATIVE}) the matches of the query.
 */
public class Query implements Recipe.Step {
  public final Identifier identifier;
  public final ImmutableList<Token> tokens;
  public final ImmutableSet<Dependency> dependencies;
  public final ImmutableSet<Constraint> constraints;
  public final ImmutableSet<Ast.Predicate> predicates;
  public final ImmutableList<Part> parts;

  private Query(
      Identifier identifier,
      ImmutableList<Token> tokens,
      ImmutableSet<Dependency> dependencies,
      ImmutableSet<Constraint> constraints,
      ImmutableSet<Ast.Predicate> predicates,
      ImmutableList<Part> parts) {
    this.identifier = requireNonNull(identifier);
    this.tokens = tokens;
    this.dependencies = dependencies;
    this.constraints = constraints;
    this.predicates = predicates;
    this.parts = parts;
    validate(ImmutableSet.of(), tokens, dependencies, constraints, predicates);
  }

  /**
   * Creates a query.
   *
   * @throws InvalidQueryException if the query is not well-formed
   */
  public static Query create(
      IdentifierGenerator generator,
      Iterable<Token> tokens,
      Iterable<Dependency> dependencies,
      Iterable<? extends Constraint> constraints,
      Iterable<? extends Ast.Predicate> predicates) {
    return new Query(
        generator.get(),
        ImmutableList.copyOf(tokens),
        ImmutableSet.copyOf(dependencies),
        ImmutableSet.copyOf(constraints),
        ImmutableSet.copyOf(predicates),
        ImmutableList.of());
  }

  /** Creates a query that consists only of tokens. */
  public static Query of(IdentifierGenerator generator, Token... tokens) {
    return create(
        generator,
        ImmutableList.copyOf(tokens),
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableList.of());
  }

  /** Returns a builder of queries. */
  public static Builder builder(IdentifierGenerator generator) {
    return new Builder(generator);
  }

  /**
   * Returns a copy of this query with an additional part.
   *
   * <p>The part may reference the tokens of this query, and tokens that it
   * defines itself.
   *
   * @throws InvalidQueryException if the part is not well-formed
   */
  public Query plusPart(
      PartKind kind,
      Iterable<Token> tokens,
      Iterable<Dependency> dependencies,
      Iterable<? extends Constraint> constraints,
      Iterable<? extends Ast.Predicate> predicates) {
    final Part part =
        new Part(
            kind,
            ImmutableList.copyOf(tokens),
            ImmutableSet.copyOf(dependencies),
            ImmutableSet.copyOf(constraints),
            ImmutableSet.copyOf(predicates));
    validate(
        tokenIdentifiers(),
        part.tokens,
        part.dependencies,
        part.constraints,
        part.predicates);
    return new Query(
        identifier,
        this.tokens,
        this.dependencies,
        this.constraints,
        this.predicates,
        ImmutableList.<Part>builder().addAll(parts).add(part).build());
  }

  /**
   * Returns a query, without parts, that combines this query and a part.
   *
   * <p>The matches of the result are the matches of this query that the part
   * also matches.
   */
  public Query merge(Part part) {
    return new Query(
        identifier,
        ImmutableList.<Token>builder()
            .addAll(tokens)
            .addAll(part.tokens)
            .build(),
        ImmutableSet.<Dependency>builder()
            .addAll(dependencies)
            .addAll(part.dependencies)
            .build(),
        ImmutableSet.<Constraint>builder()
            .addAll(constraints)
            .addAll(part.constraints)
            .build(),
        ImmutableSet.<Ast.Predicate>builder()
            .addAll(predicates)
            .addAll(part.predicates)
            .build(),
        ImmutableList.of());
  }

  /** Returns this query without its parts. */
  public Query withoutParts() {
    if (parts.isEmpty()) {
      return this;
    }
    return new Query(identifier, tokens, dependencies, constraints,
        predicates, ImmutableList.of());
  }

  @Override
  public Identifier identifier() {
    return identifier;
  }

  /** Returns the identifiers of the tokens, in order of definition. */
  public ImmutableSet<Identifier> tokenIdentifiers() {
    final ImmutableSet.Builder<Identifier> b = ImmutableSet.builder();
    tokens.forEach(t -> b.add(t.identifier));
    return b.build();
  }

  /** Checks that tokens, together with inherited identifiers, define every
   * identifier that is referenced. */
  private static void validate(
      Set<Identifier> inherited,
      List<Token> tokens,
      Set<Dependency> dependencies,
      Set<Constraint> constraints,
      Set<Ast.Predicate> predicates) {
    final Set<Identifier> defined = new LinkedHashSet<>(inherited);
    for (Token token : tokens) {
      if (!defined.add(token.identifier)) {
        throw new InvalidQueryException(
            "Multiple tokens share the same identifier.");
      }
    }

    final Set<Identifier> referenced = new LinkedHashSet<>();
    constraints.forEach(c -> referenced.addAll(c.referencedIdentifiers()));
    dependencies.forEach(d -> referenced.addAll(d.referencedIdentifiers()));
    predicates.forEach(p -> referenced.addAll(p.referencedIdentifiers()));
    for (Token token : tokens) {
      if (token.attributes != null) {
        referenced.addAll(token.attributes.referencedIdentifiers());
      }
    }
    if (!defined.containsAll(referenced)) {
      throw new InvalidQueryException(
          "Query uses identifiers not defined by tokens.");
    }

    @Nullable Identifier first = null;
    @Nullable Identifier last = null;
    for (Constraint constraint : constraints) {
      if (!(constraint instanceof Constraint.Anchor)) {
        continue;
      }
      final Constraint.Anchor anchor = (Constraint.Anchor) constraint;
      if (anchor.isFirst()) {
        if (first != null) {
          throw new InvalidQueryException(
              "Multiple anchors to beginning of span defined.");
        }
        first = anchor.id;
      } else {
        if (last != null) {
          throw new InvalidQueryException(
              "Multiple anchors to end of span defined.");
        }
        last = anchor.id;
      }
    }
    if (first != null && first == last) {
      throw new InvalidQueryException(
          "Token is anchor for both begin and end of span.");
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, tokens, dependencies, constraints,
        predicates, parts);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Query
            && identifier == ((Query) o).identifier
            && tokens.equals(((Query) o).tokens)
            && dependencies.equals(((Query) o).dependencies)
            && constraints.equals(((Query) o).constraints)
            && predicates.equals(((Query) o).predicates)
            && parts.equals(((Query) o).parts);
  }

  @Override
  public String toString() {
    return "Query{" + identifier
        + ", tokens=" + tokens
        + ", dependencies=" + dependencies
        + ", constraints=" + constraints
        + ", predicates=" + predicates
        + (parts.isEmpty() ? "" : ", parts=" + parts)
        + "}";
  }

  /** Kind of query part. */
  public enum PartKind {
    /** Matches of the query must also match the part. */
    ADDITIONAL,
    /** Matches of the query must not match the part. */
    NEGATIVE
  }

  /** Part of a query. Its tokens are in addition to those of the query. */
  public static class Part {
    public final PartKind kind;
    public final ImmutableList<Token> tokens;
    public final ImmutableSet<Dependency> dependencies;
    public final ImmutableSet<Constraint> constraints;
    public final ImmutableSet<Ast.Predicate> predicates;

    Part(
        PartKind kind,
        ImmutableList<Token> tokens,
        ImmutableSet<Dependency> dependencies,
        ImmutableSet<Constraint> constraints,
        ImmutableSet<Ast.Predicate> predicates) {
      this.kind = requireNonNull(kind);
      this.tokens = tokens;
      this.dependencies = dependencies;
      this.constraints = constraints;
      this.predicates = predicates;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, tokens, dependencies, constraints,
          predicates);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Part
              && kind == ((Part) o).kind
              && tokens.equals(((Part) o).tokens)
              && dependencies.equals(((Part) o).dependencies)
              && constraints.equals(((Part) o).constraints)
              && predicates.equals(((Part) o).predicates);
    }

    @Override
    public String toString() {
      return "Part{" + kind + ", tokens=" + tokens
          + ", dependencies=" + dependencies
          + ", constraints=" + constraints
          + ", predicates=" + predicates + "}";
    }
  }

  /** Accumulates the elements of a query or a query part. */
  public static class Builder {
    private final IdentifierGenerator generator;
    private final List<Token> tokens = new ArrayList<>();
    private final Set<Dependency> dependencies = new LinkedHashSet<>();
    private final Set<Constraint> constraints = new LinkedHashSet<>();
    private final Set<Ast.Predicate> predicates = new LinkedHashSet<>();

    Builder(IdentifierGenerator generator) {
      this.generator = requireNonNull(generator);
    }

    /** Adds a token with a fresh identifier, and returns the identifier. */
    public Identifier token(Ast.@Nullable Predicate attributes) {
      final Identifier id = generator.get();
      tokens.add(Token.of(id, attributes));
      return id;
    }

    public Builder add(Token token) {
      tokens.add(token);
      return this;
    }

    public Builder add(Dependency dependency) {
      dependencies.add(dependency);
      return this;
    }

    public Builder add(Constraint constraint) {
      constraints.add(constraint);
      return this;
    }

    public Builder add(Ast.Predicate predicate) {
      predicates.add(predicate);
      return this;
    }

    public boolean isEmpty() {
      return tokens.isEmpty();
    }

    public Query build() {
      return create(generator, tokens, dependencies, constraints, predicates);
    }

    /** Adds the accumulated elements to a query as a part. */
    public Query buildPart(Query query, PartKind kind) {
      return query.plusPart(kind, tokens, dependencies, constraints,
          predicates);
    }
  }
}

// End Query.java
