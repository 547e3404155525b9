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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import org.junit.jupiter.api.Test;

/** Tests for {@link Recipe}. */
public class RecipeTest {
  private final IdentifierGenerator generator = new IdentifierGenerator();

  private Query query() {
    return Query.of(generator, Token.fresh(generator));
  }

  @Test void testOfQuery() {
    final Query query = query();
    final Recipe recipe = Recipe.ofQuery(query);
    assertThat(recipe.goal, is(query.identifier));
    assertThat(recipe.simpleRepresentation(), sameInstance(query));
    assertThat(recipe.hasSimpleRepresentation(), is(true));
    assertThat(recipe.identifiers(), is(ImmutableList.of(query.identifier)));
    assertThat(recipe.asMap().get(query.identifier),
        sameInstance((Recipe.Step) query));
  }

  @Test void testBuilder() {
    final Recipe.Builder builder = new Recipe.Builder(generator);
    final Identifier q1 = builder.addQuery(query());
    final Identifier q2 = builder.addQuery(query());
    final Identifier q3 = builder.addQuery(query());
    final Identifier op1 =
        builder.addOperation(q1, SetOperator.CONJUNCTION, q2);
    final Identifier op2 =
        builder.addOperation(op1, SetOperator.SUBTRACTION, q3);
    final Recipe recipe = builder.build();

    // The goal defaults to the last operation
    assertThat(recipe.goal, is(op2));
    assertThat(recipe.simpleRepresentation(), nullValue());
    assertThat(recipe.identifiers(),
        is(ImmutableList.of(op1, op2, q1, q2, q3)));
    assertThat(recipe.operations.get(1).lhs, is(op1));
    assertThat(recipe.operations.get(1).operator.command, is("diff"));
    assertThat(recipe.asMap().size(), is(5));
  }

  @Test void testBuilderGoal() {
    final Recipe.Builder builder = new Recipe.Builder(generator);
    final Identifier q1 = builder.addQuery(query());
    assertThat(builder.build().goal, is(q1));

    final Identifier q2 = builder.addQuery(query());
    assertError(builder::build,
        throwsA(InvalidQueryException.class, is("Recipe has no goal.")));
    assertThat(builder.goal(q2).build().goal, is(q2));
  }

  @Test void testInvalid() {
    final Recipe.Builder builder = new Recipe.Builder(generator);
    final Identifier q1 = builder.addQuery(query());
    builder.addOperation(q1, SetOperator.DISJUNCTION, generator.get());
    assertError(builder::build,
        throwsA(InvalidQueryException.class,
            is("Step in recipe uses undefined query identifier.")));

    final Recipe.Builder builder2 = new Recipe.Builder(generator);
    final Query query = query();
    builder2.addQuery(query);
    builder2.addQuery(query);
    builder2.goal(query.identifier);
    assertError(builder2::build,
        throwsA(InvalidQueryException.class,
            is("Multiple steps in recipe share the same identifier.")));

    final Recipe.Builder builder3 = new Recipe.Builder(generator);
    builder3.addQuery(query());
    builder3.goal(generator.get());
    assertError(builder3::build,
        throwsA(InvalidQueryException.class,
            is("Goal of recipe is not a step.")));
  }
}

// End RecipeTest.java
