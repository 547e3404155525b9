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

import static net.hydromatic.cqptree.Cqp.cqp;
import static net.hydromatic.cqptree.Matchers.isDisjunctionOf;
import static net.hydromatic.cqptree.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.cqptree.compile.NotSupportedException;
import net.hydromatic.cqptree.query.Query;
import org.junit.jupiter.api.Test;

/** Tests for {@link GrewTranslator}. */
public class GrewTranslatorTest {
  @Test void testNode() {
    cqp("grew", "pattern { N [upos=NOUN] }").assertCqp("[upos = \"NOUN\"]");
    cqp("grew", "pattern { N [lemma=\"dog\"|\"cat\"] }")
        .assertCqp("[lemma = \"dog\" | lemma = \"cat\"]");
    cqp("grew", "pattern { N [!Tense] }").assertCqp("[!Tense]");
    cqp("grew", "pattern { N [Tense, upos=VERB] }")
        .assertCqp("[Tense & upos = \"VERB\"]");
    cqp("grew", "pattern { N [upos<>NOUN|PROPN] }")
        .assertCqp("[upos != \"NOUN\" & upos != \"PROPN\"]");
    cqp("grew", "pattern { N [lemma=re\"dog.*\"] }")
        .assertCqp("[lemma = \"dog.*\"]");
    cqp("grew", "pattern { N [lemma=\"a.b\"] }")
        .assertCqp("[lemma = \"a\\.b\"]");
    cqp("grew", "pattern { N [upos=NOUN] | [upos=PROPN, Number=Sing] }")
        .assertCqp("[upos = \"NOUN\" | upos = \"PROPN\" & Number = \"Sing\"]");
  }

  /** A node without features matches any token. */
  @Test void testEmpty() {
    cqp("grew", "pattern { N [] }").assertCqp("[]");
    cqp("grew", "pattern { N [upos=NOUN] | [] }").assertCqp("[]");
    cqp("grew", "pattern { }").assertCqp("[]");
  }

  @Test void testEdge() {
    cqp("grew", "pattern { V [upos=VERB]; N [upos=NOUN]; V -[nsubj]-> N }")
        .assertCqp("a:[upos = \"VERB\"] []*"
            + " b:[upos = \"NOUN\" & deprel = \"nsubj\" & dephead = a.ref]"
            + " | b:[upos = \"NOUN\" & deprel = \"nsubj\"] []*"
            + " a:[upos = \"VERB\" & b.dephead = ref]");
    cqp("grew", "pattern { V -> N; V < N }")
        .assertCqp("a:[] [dephead = a.ref]");
    cqp("grew", "pattern { V -[nsubj|obj]-> N; V < N }")
        .assertCqp("a:[] [(deprel = \"nsubj\" | deprel = \"obj\")"
            + " & dephead = a.ref]");
    cqp("grew", "pattern { V -[^nsubj|obj]-> N; V < N }")
        .assertCqp("a:[] [deprel != \"nsubj\" & deprel != \"obj\""
            + " & dephead = a.ref]");
    cqp("grew", "pattern { V -[nsubj:pass]-> N; V < N }")
        .assertCqp("a:[] [deprel = \"nsubj:pass\" & dephead = a.ref]");
  }

  @Test void testOrder() {
    cqp("grew", "pattern { X < Y }").assertCqp("[] []");
    cqp("grew", "pattern { X << Y }").assertCqp("[] []* []");
    cqp("grew", "pattern { X [word=a]; Y [word=b]; Z [word=c]; X < Y; "
            + "Y < Z }")
        .assertCqp("[word = \"a\"] [word = \"b\"] [word = \"c\"]");
  }

  @Test void testConstraint() {
    cqp("grew", "pattern { N.lemma = M.lemma }")
        .assertCqp("a:[] []* b:[a.lemma = lemma]"
            + " | b:[] []* a:[lemma = b.lemma]");
    cqp("grew", "pattern { N [upos=NOUN]; M [upos=VERB]; N.lemma <> M.lemma;"
            + " N << M }")
        .assertCqp("a:[upos = \"NOUN\"] []*"
            + " [upos = \"VERB\" & a.lemma != lemma]");
    cqp("grew", "pattern { N.lemma = \"dog\" }")
        .assertCqp("[lemma = \"dog\"]");
  }

  @Test void testWithout() {
    cqp("grew", "pattern { N [upos=NOUN] } without { N -[amod]-> A }")
        .assertRecipe(recipe -> {
          final Query query = recipe.queries.get(0);
          assertThat(query.tokens.size(), is(1));
          assertThat(query.parts.size(), is(1));
          assertThat(query.parts.get(0).kind, is(Query.PartKind.NEGATIVE));
          assertThat(query.parts.get(0).tokens.size(), is(1));
        })
        .assertCqp("A = [upos = \"NOUN\"];\n"
            + "B = a:[upos = \"NOUN\"] []*"
            + " b:[deprel = \"amod\" & dephead = a.ref]"
            + " | b:[deprel = \"amod\"] []*"
            + " a:[upos = \"NOUN\" & b.dephead = ref];\n"
            + "C = diff A B;");
  }

  @Test void testWith() {
    cqp("grew", "pattern { N [upos=NOUN] } with { A [upos=ADJ]; A < N }"
            + " without { N [Number=Plur] }")
        .assertPlan(plan -> {
          assertThat(plan.steps.size(), is(5));
          assertThat(plan.steps.get(1).command(),
              is("B = [upos = \"ADJ\"] [upos = \"NOUN\"];"));
          assertThat(plan.steps.get(2).command(), is("C = intersect A B;"));
          assertThat(plan.steps.get(3).command(),
              is("D = [upos = \"NOUN\" & Number = \"Plur\"];"));
          assertThat(plan.steps.get(4).command(), is("E = diff C D;"));
          assertThat(plan.goal, is("E"));
        });
  }

  /** Arrangements of unordered nodes may come in any order. */
  @Test void testUnordered() {
    cqp("grew", "pattern { X [word=a]; Y [word=b]; Z [word=c]; X < Y }")
        .assertCqp(
            isDisjunctionOf(
                "[word = \"a\"] [word = \"b\"] []* [word = \"c\"]",
                "[word = \"c\"] []* [word = \"a\"] [word = \"b\"]"));
  }

  @Test void testNotSupported() {
    cqp("grew", "pattern { N [lemma=/dog/] }")
        .assertError(
            throwsA(NotSupportedException.class,
                is("PCRE expressions are not yet supported.")));
    cqp("grew", "pattern { e: N -> M }")
        .assertError(
            throwsA(NotSupportedException.class,
                is("Named edges are not supported.")));
    cqp("grew", "pattern { N -> N }")
        .assertError(
            throwsA(NotSupportedException.class,
                is("Node N cannot be a dependent of itself.")));
    cqp("grew", "pattern { N [upos=NOUN]; N < N }")
        .assertError(
            throwsA(NotSupportedException.class,
                is("Node N cannot precede itself.")));
    cqp("grew", "pattern { N -[nsubj]-> N }")
        .assertError(
            throwsA(NotSupportedException.class,
                is("Node N cannot be a dependent of itself.")));
  }
}

// End GrewTranslatorTest.java
