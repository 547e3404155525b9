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
package net.hydromatic.cqptree.frontend.conllu;

import static net.hydromatic.cqptree.Cqp.assertError;
import static net.hydromatic.cqptree.Cqp.cqp;
import static net.hydromatic.cqptree.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import net.hydromatic.cqptree.compile.NotSupportedException;
import net.hydromatic.cqptree.parse.ParseFailedException;
import net.hydromatic.cqptree.query.Constraint;
import net.hydromatic.cqptree.query.Dependency;
import net.hydromatic.cqptree.query.Query;
import net.hydromatic.cqptree.query.Recipe;
import org.junit.jupiter.api.Test;

/** Tests for {@link ConlluTranslator}. */
public class ConlluTranslatorTest {
  private final ConlluTranslator translator =
      new ConlluTranslator(new IdentifierGenerator());

  /** Reads a file from the "conllu" test resource directory. */
  static String resource(String name) {
    try {
      return Resources.toString(Resources.getResource("conllu/" + name),
          StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private Query query(String text) {
    final Recipe recipe = translator.translate(text);
    assertThat(recipe.hasSimpleRepresentation(), is(true));
    return recipe.queries.get(0);
  }

  @Test void testFull() {
    final Query query = query(resource("full.conllu"));
    assertThat(query.tokens.size(), is(3));
    assertThat(query.constraints.isEmpty(), is(true));
    assertThat(query.predicates.isEmpty(), is(true));
    assertThat(String.valueOf(query.tokens.get(0).attributes),
        is("word = \"The\" & lemma = \"the\" & pos = \"DET\" & msd = \"DT\""
            + " & deprel = \"det\" & ufeats contains \"Definite=Def\""
            + " & ufeats contains \"PronType=Art\""));

    final Dependency dogThe =
        Dependency.of(query.tokens.get(1).identifier,
            query.tokens.get(0).identifier);
    final Dependency barksDog =
        Dependency.of(query.tokens.get(2).identifier,
            query.tokens.get(1).identifier);
    assertThat(query.dependencies.asList(),
        is(ImmutableList.of(dogThe, barksDog)));
  }

  /** Fields that are "_" or "*" do not constrain the token; MISC entries
   * such as "ordered" become constraints. */
  @Test void testPartial() {
    cqp("conllu", resource("partial.conllu"))
        .assertCqp("a:[lemma = \"big\" & pos = \"ADJ\"] []*"
            + " [lemma = \"dog\" & a.dephead = ref]");
  }

  @Test void testAnchoredSubsequent() {
    final String text = "1\tthe\t_\t_\t_\t_\t2\t_\t_\tanchored=Yes\n"
        + "2\tdog\t_\t_\t_\t_\t0\t_\t_\tsubsequent=Yes\n";
    cqp("conllu", text)
        .assertCqp("<s> a:[word = \"the\"] [word = \"dog\" & a.dephead = ref]");
  }

  @Test void testAnchoredLast() {
    final String text = "1\tthe\t_\t_\t_\t_\t2\t_\t_\t_\n"
        + "2\tdog\t_\t_\t_\t_\t0\t_\t_\tanchored=Yes|subsequent=Yes\n";
    cqp("conllu", text)
        .assertCqp("a:[word = \"the\"] [word = \"dog\" & a.dephead = ref]"
            + " </s>");
  }

  /** Only the first and the last token of a sentence can be anchored;
   * "anchored" on any other token is ignored. */
  @Test void testAnchoredMiddle() {
    final Query query =
        query("1\ta\t_\t_\t_\t_\t0\t_\t_\tanchored=Yes\n"
            + "2\tb\t_\t_\t_\t_\t1\t_\t_\tanchored=Yes\n"
            + "3\tc\t_\t_\t_\t_\t1\t_\t_\t_\n");
    assertThat(query.tokens.size(), is(3));
    assertThat(query.constraints,
        is(ImmutableSet.<Constraint>of(
            Constraint.first(query.tokens.get(0).identifier))));
  }

  /** MISC entries that are not annotations constrain the attribute of the
   * same name. */
  @Test void testMisc() {
    final String text = "1\tdog\t_\t_\t_\t_\t0\t_\t_\tSpaceAfter=No\n";
    cqp("conllu", text)
        .assertCqp("[word = \"dog\" & SpaceAfter = \"No\"]");
  }

  @Test void testUnderspecified() {
    assertError(() -> translator.translate(resource("underspecified.conllu")),
        throwsA(NotSupportedException.class,
            is("IDs and HEADs cannot be omitted.")));
  }

  @Test void testMultiWordTokens() {
    final Query query = query(resource("mwes.conllu"));
    assertThat(query.tokens.size(), is(3));
    assertThat(query.dependencies.size(), is(2));
    assertThat(String.valueOf(query.tokens.get(1).attributes),
        is("word = \"n't\" & lemma = \"not\" & pos = \"PART\""
            + " & deprel = \"advmod\""));
  }

  /** Only the first sentence of a document is translated. */
  @Test void testFirstSentence() {
    final String text = "\n# first\n1\tdog\t_\t_\t_\t_\t0\t_\t_\t_\n\n"
        + "1\tcat\t_\t_\t_\t_\t0\t_\t_\t_\n";
    cqp("conllu", text).assertCqp("[word = \"dog\"]");
  }

  @Test void testInvalid() {
    assertThat(parseErrors(resource("invalid.conllu")),
        is(ImmutableList.of("2:1: Expected 10 tab-separated fields, found 3")));
    assertThat(parseErrors("1\tdog\t_\t_\t_\t_\tx\t_\t_\t_\n"),
        is(ImmutableList.of("1:15: Invalid HEAD: x")));
    assertThat(
        parseErrors("1\tdog\t_\t_\t_\t_\t0\t_\t_\t_\n"
            + "1\tcat\t_\t_\t_\t_\t0\t_\t_\t_\n"
            + "x\tcow\t_\t_\t_\t_\t0\t_\t_\t_\n"),
        is(ImmutableList.of("2:1: Duplicate ID: 1", "3:1: Invalid ID: x")));
    assertThat(parseErrors("# only a comment\n"),
        is(ImmutableList.of("?: No tokens found.")));
  }

  @Test void testNotSupported() {
    assertError(() ->
            translator.translate("1\tdog\t_\t_\t_\t_\t5\t_\t_\t_\n"),
        throwsA(NotSupportedException.class,
            is("HEAD 5 of token 1 is not a token of the sentence.")));
    assertError(() ->
            translator.translate("1\tdog\t_\t_\t_\t_\t0\t_\t_\tanchored=Yes\n"),
        throwsA(NotSupportedException.class,
            is("A single token cannot be anchored to both the beginning and "
                + "the end of the span.")));
    assertError(() ->
            translator.translate("1\tdog\t_\t_\t_\t_\t1\t_\t_\t_\n"),
        throwsA(NotSupportedException.class,
            is("Token 1 cannot be its own HEAD.")));
    assertError(() ->
            translator.translate(
                "1\ta\t_\t_\t_\t_\t0\t_\t_\tsubsequent=Yes\n"),
        throwsA(NotSupportedException.class,
            is("The first token cannot be subsequent to another token.")));
  }

  private List<String> parseErrors(String text) {
    try {
      translator.translate(text);
      throw new AssertionError("expected parse failure");
    } catch (ParseFailedException e) {
      return e.errors.stream().map(Object::toString)
          .collect(ImmutableList.toImmutableList());
    }
  }
}

// End ConlluTranslatorTest.java
