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

import static net.hydromatic.cqptree.Cqp.assertError;
import static net.hydromatic.cqptree.Matchers.throwsA;
import static net.hydromatic.cqptree.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.cqptree.ast.Ast;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import org.junit.jupiter.api.Test;

/** Tests for {@link Query} and {@link Constraint}. */
public class QueryTest {
  private final IdentifierGenerator generator = new IdentifierGenerator();

  private static Ast.Predicate lemma(String value) {
    return ast.equal(ast.attribute("lemma"), ast.quoted(value));
  }

  private static Ast.Predicate lemma(Identifier id, String value) {
    return ast.equal(ast.attribute(id, "lemma"), ast.quoted(value));
  }

  @Test void testCreate() {
    final Identifier x = generator.get();
    final Identifier y = generator.get();
    final Query query =
        Query.create(generator,
            ImmutableList.of(Token.of(x, lemma("dog")), Token.of(y)),
            ImmutableList.of(Dependency.of(x, y)),
            ImmutableList.of(Constraint.order(x, y)),
            ImmutableList.of(lemma(y, "bark")));
    assertThat(query.tokenIdentifiers(), is(ImmutableSet.of(x, y)));
    assertThat(query.tokens.get(0).raisedAttributes(), is(lemma(x, "dog")));
    assertThat(query.tokens.get(1).raisedAttributes() == null, is(true));
    assertThat(query.parts.isEmpty(), is(true));
    assertThat(query.withoutParts(), is(query));
  }

  @Test void testDuplicateToken() {
    final Identifier x = generator.get();
    assertError(() -> Query.of(generator, Token.of(x), Token.of(x)),
        throwsA(InvalidQueryException.class,
            is("Multiple tokens share the same identifier.")));
  }

  @Test void testUndefinedIdentifier() {
    final Identifier x = generator.get();
    final Identifier undefined = generator.get();
    final String message = "Query uses identifiers not defined by tokens.";
    assertError(() ->
            Query.create(generator, ImmutableList.of(Token.of(x)),
                ImmutableList.of(Dependency.of(x, undefined)),
                ImmutableList.of(), ImmutableList.of()),
        throwsA(InvalidQueryException.class, is(message)));
    assertError(() ->
            Query.create(generator, ImmutableList.of(Token.of(x)),
                ImmutableList.of(),
                ImmutableList.of(Constraint.distance(x, undefined)
                    .lessThan(2)),
                ImmutableList.of()),
        throwsA(InvalidQueryException.class, is(message)));
    assertError(() ->
            Query.create(generator, ImmutableList.of(Token.of(x)),
                ImmutableList.of(), ImmutableList.of(),
                ImmutableList.of(lemma(undefined, "dog"))),
        throwsA(InvalidQueryException.class, is(message)));

    // A token's local predicate may only refer to defined tokens, too
    final Ast.Predicate sameLemma =
        ast.equal(ast.attribute("lemma"), ast.attribute(undefined, "lemma"));
    assertError(() -> Query.of(generator, Token.of(x, sameLemma)),
        throwsA(InvalidQueryException.class, is(message)));
  }

  @Test void testAnchors() {
    final Identifier x = generator.get();
    final Identifier y = generator.get();
    final Identifier z = generator.get();
    final ImmutableList<Token> tokens =
        ImmutableList.of(Token.of(x), Token.of(y), Token.of(z));

    // One anchor at each end is fine
    final Query query =
        Query.create(generator, tokens, ImmutableList.of(),
            ImmutableList.of(Constraint.first(x), Constraint.last(z)),
            ImmutableList.of());
    assertThat(query.constraints.size(), is(2));

    assertError(() ->
            Query.create(generator, tokens, ImmutableList.of(),
                ImmutableList.of(Constraint.first(x), Constraint.first(y)),
                ImmutableList.of()),
        throwsA(InvalidQueryException.class,
            is("Multiple anchors to beginning of span defined.")));
    assertError(() ->
            Query.create(generator, tokens, ImmutableList.of(),
                ImmutableList.of(Constraint.last(x),
                    Constraint.anchor(y, Constraint.Position.LAST)),
                ImmutableList.of()),
        throwsA(InvalidQueryException.class,
            is("Multiple anchors to end of span defined.")));
  }

  /** A single token cannot be anchored to both the first and the last
   * position. */
  @Test void testAnchorBothEnds() {
    final Identifier x = generator.get();
    assertError(() ->
            Query.create(generator, ImmutableList.of(Token.of(x)),
                ImmutableList.of(),
                ImmutableList.of(Constraint.first(x), Constraint.last(x)),
                ImmutableList.of()),
        throwsA(InvalidQueryException.class,
            is("Token is anchor for both begin and end of span.")));
  }

  @Test void testConstraints() {
    final Identifier x = generator.get();
    final Identifier y = generator.get();
    final Constraint.Distance atMost = Constraint.distance(x, y).atMost(2);
    assertThat(atMost.compare, is(Constraint.Compare.LT));
    assertThat(atMost.distance, is(3));
    assertThat(atMost, is(Constraint.distance(x, y).lessThan(3)));

    final Constraint.Distance atLeast = Constraint.distance(x, y).atLeast(2);
    assertThat(atLeast.compare, is(Constraint.Compare.GT));
    assertThat(atLeast.distance, is(1));

    assertThat(atMost.isBetween(x, y), is(true));
    assertThat(atMost.isBetween(y, x), is(true));
    assertThat(Constraint.distance(x, y).notEqualTo(1).compare.symbol,
        is("#"));
    assertThat(Constraint.first(x).isFirst(), is(true));
    assertThat(Constraint.last(x).isLast(), is(true));

  }

  /** Constraints and dependencies that relate a token to itself, or that
   * have a negative bound, are invalid. */
  @Test void testInvalidConstraints() {
    final Identifier x = generator.get();
    final Identifier y = generator.get();
    assertError(() -> Constraint.order(x, x),
        throwsA(InvalidQueryException.class,
            is("token cannot precede itself")));
    assertError(() -> Dependency.of(y, y),
        throwsA(InvalidQueryException.class,
            is("token cannot depend on itself")));
    assertError(() -> Constraint.distance(x, x).equalTo(0),
        throwsA(InvalidQueryException.class,
            is("distance of a token to itself")));
    assertError(() -> Constraint.distance(x, y).equalTo(-1),
        throwsA(InvalidQueryException.class,
            is("negative distance bound: = -1")));
    assertError(() -> Constraint.distance(x, y).atMost(-2),
        throwsA(InvalidQueryException.class,
            is("negative distance bound: < -1")));
    assertError(() -> Constraint.distance(x, y).atLeast(-1),
        throwsA(InvalidQueryException.class,
            is("negative distance bound: > -2")));

    // The smallest bounds that are valid
    assertThat(Constraint.distance(x, y).atLeast(0).distance, is(-1));
    assertThat(Constraint.distance(x, y).lessThan(0).distance, is(0));
  }

  @Test void testPart() {
    final Identifier x = generator.get();
    final Query query = Query.of(generator, Token.of(x, lemma("dog")));

    final Identifier y = generator.get();
    final Query withPart =
        query.plusPart(Query.PartKind.NEGATIVE,
            ImmutableList.of(Token.of(y)),
            ImmutableList.of(Dependency.of(x, y)),
            ImmutableList.of(), ImmutableList.of(lemma(y, "big")));
    assertThat(withPart.identifier, is(query.identifier));
    assertThat(withPart.parts.size(), is(1));
    assertThat(withPart.parts.get(0).kind, is(Query.PartKind.NEGATIVE));

    // The tokens of the part are not tokens of the query
    assertThat(withPart.tokenIdentifiers(), is(ImmutableSet.of(x)));
    assertThat(withPart.withoutParts(), is(query));

    final Query merged = withPart.merge(withPart.parts.get(0));
    assertThat(merged.tokenIdentifiers(), is(ImmutableSet.of(x, y)));
    assertThat(merged.dependencies.size(), is(1));
    assertThat(merged.predicates, is(ImmutableSet.of(lemma(y, "big"))));
    assertThat(merged.parts.isEmpty(), is(true));

    // A part may not refer to tokens defined by neither it nor the query
    final Identifier z = generator.get();
    assertError(() ->
            query.plusPart(Query.PartKind.ADDITIONAL,
                ImmutableList.of(Token.of(y)),
                ImmutableList.of(Dependency.of(z, y)),
                ImmutableList.of(), ImmutableList.of()),
        throwsA(InvalidQueryException.class,
            is("Query uses identifiers not defined by tokens.")));

    // A part may not redefine a token of the query
    assertError(() ->
            query.plusPart(Query.PartKind.ADDITIONAL,
                ImmutableList.of(Token.of(x)),
                ImmutableList.of(), ImmutableList.of(), ImmutableList.of()),
        throwsA(InvalidQueryException.class,
            is("Multiple tokens share the same identifier.")));
  }

  @Test void testBuilder() {
    final Query.Builder builder = Query.builder(generator);
    assertThat(builder.isEmpty(), is(true));
    final Identifier x = builder.token(lemma("dog"));
    final Identifier y = builder.token(null);
    builder.add(Dependency.of(x, y))
        .add(Constraint.order(x, y))
        .add(lemma(y, "bark"));
    final Query query = builder.build();
    assertThat(query.tokenIdentifiers(), is(ImmutableSet.of(x, y)));
    assertThat(query.dependencies.size(), is(1));
    assertThat(query.constraints.size(), is(1));
    assertThat(query.predicates.size(), is(1));

    final Query.Builder partBuilder = Query.builder(generator);
    final Identifier z = partBuilder.token(null);
    partBuilder.add(Dependency.of(y, z));
    final Query withPart =
        partBuilder.buildPart(query, Query.PartKind.ADDITIONAL);
    assertThat(withPart.parts.get(0).tokens.get(0).identifier, is(z));
  }
}

// End QueryTest.java
