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

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.cqptree.parse.ParseFailedException;
import org.junit.jupiter.api.Test;

/** Tests for {@link GrewParser}. */
public class GrewParserTest {
  /** Parses a request and returns the error messages, with positions. */
  private static List<String> errors(String text) {
    try {
      GrewParser.parse(text);
      throw new AssertionError("expected parse failure");
    } catch (ParseFailedException e) {
      return e.errors.stream().map(Object::toString)
          .collect(ImmutableList.toImmutableList());
    }
  }

  @Test void testRequest() {
    final GrewAst.Request request =
        GrewParser.parse("pattern { V [upos=VERB]; N [upos=NOUN];\n"
            + "  V -[nsubj]-> N }\n"
            + "with { N < V }\n"
            + "without { V -[obj]-> O }");
    assertThat(request.pattern.size(), is(3));
    assertThat(request.items.size(), is(2));
    assertThat(request.items.get(0).negative, is(false));
    assertThat(request.items.get(1).negative, is(true));

    final GrewAst.NodeClause v = (GrewAst.NodeClause) request.pattern.get(0);
    assertThat(v.name, is("V"));
    assertThat(v.alternatives.size(), is(1));
    final GrewAst.Requires upos =
        (GrewAst.Requires) v.alternatives.get(0).get(0);
    assertThat(upos.name, is("upos"));
    assertThat(upos.equal, is(true));
    assertThat(upos.values.get(0).kind, is(GrewAst.ValueKind.SIMPLE));
    assertThat(upos.values.get(0).text, is("VERB"));

    final GrewAst.EdgeClause edge =
        (GrewAst.EdgeClause) request.pattern.get(2);
    assertThat(edge.label, nullValue());
    assertThat(edge.src, is("V"));
    assertThat(edge.dst, is("N"));
    assertThat(edge.kind, is(GrewAst.ArrowKind.POSITIVE));
    assertThat(edge.types.get(0).text, is("nsubj"));
    assertThat(edge.pos.startLine, is(2));
    assertThat(edge.pos.startColumn, is(3));

    final GrewAst.OrderClause order =
        (GrewAst.OrderClause) request.items.get(0).clauses.get(0);
    assertThat(order.immediate, is(true));
  }

  @Test void testClauses() {
    final GrewAst.Request request =
        GrewParser.parse("% a comment\n"
            + "pattern {\n"
            + "  N [lemma=\"dog\"|re\"ca.*\", !Tense, Number] | [];\n"
            + "  e: N -> M\n"
            + "  N -[^nsubj:pass|obj]-> M;\n"
            + "  N.lemma <> M.lemma;\n"
            + "  N << M  % another comment\n"
            + "}");
    assertThat(request.pattern.size(), is(5));

    final GrewAst.NodeClause n = (GrewAst.NodeClause) request.pattern.get(0);
    assertThat(n.alternatives.size(), is(2));
    assertThat(n.alternatives.get(1).isEmpty(), is(true));
    final List<GrewAst.Feature> features = n.alternatives.get(0);
    assertThat(features.get(1), instanceOf(GrewAst.Absence.class));
    assertThat(features.get(1).name, is("Tense"));
    assertThat(features.get(2), instanceOf(GrewAst.Presence.class));
    final GrewAst.Requires lemma = (GrewAst.Requires) features.get(0);
    assertThat(lemma.values.get(0).kind, is(GrewAst.ValueKind.STRING));
    assertThat(lemma.values.get(0).text, is("dog"));
    assertThat(lemma.values.get(1).kind, is(GrewAst.ValueKind.REGEX));
    assertThat(lemma.values.get(1).text, is("ca.*"));

    final GrewAst.EdgeClause named =
        (GrewAst.EdgeClause) request.pattern.get(1);
    assertThat(named.label, is("e"));
    assertThat(named.kind, is(GrewAst.ArrowKind.ANY));

    final GrewAst.EdgeClause negative =
        (GrewAst.EdgeClause) request.pattern.get(2);
    assertThat(negative.kind, is(GrewAst.ArrowKind.NEGATIVE));
    assertThat(negative.types.get(0).text, is("nsubj:pass"));
    assertThat(negative.types.get(1).text, is("obj"));

    final GrewAst.ConstraintClause constraint =
        (GrewAst.ConstraintClause) request.pattern.get(3);
    assertThat(constraint.equal, is(false));
    assertThat(constraint.lhs.kind, is(GrewAst.ValueKind.ATTRIBUTE));
    assertThat(constraint.lhs.node, is("N"));
    assertThat(constraint.lhs.text, is("lemma"));

    final GrewAst.OrderClause order =
        (GrewAst.OrderClause) request.pattern.get(4);
    assertThat(order.immediate, is(false));
  }

  @Test void testPcre() {
    final GrewAst.Request request =
        GrewParser.parse("pattern { N [lemma=/d.g/i] }");
    final GrewAst.NodeClause n = (GrewAst.NodeClause) request.pattern.get(0);
    final GrewAst.Requires lemma =
        (GrewAst.Requires) n.alternatives.get(0).get(0);
    assertThat(lemma.values.get(0).kind, is(GrewAst.ValueKind.PCRE));
    assertThat(lemma.values.get(0).text, is("/d.g/i"));
  }

  /** Keywords are reserved only where a keyword is expected. */
  @Test void testKeywordsAsWords() {
    final GrewAst.Request request =
        GrewParser.parse("pattern { with [lemma=pattern] }");
    final GrewAst.NodeClause n = (GrewAst.NodeClause) request.pattern.get(0);
    assertThat(n.name, is("with"));
    final GrewAst.Requires lemma =
        (GrewAst.Requires) n.alternatives.get(0).get(0);
    assertThat(lemma.values.get(0).text, is("pattern"));
  }

  @Test void testErrors() {
    assertThat(errors("pattern { N [upos=NOUN }"),
        is(ImmutableList.of("1:24: Expected ',', '.', ']' or '|', "
            + "found '}'")));
    assertThat(errors("pattern { N [upos=NOUN]"),
        is(ImmutableList.of("1:24: Expected ';', '|', '}' or a value, "
            + "found end of input")));
    assertThat(errors("match { }"),
        is(ImmutableList.of("1:1: Expected 'pattern', found 'match'")));
    assertThat(errors("pattern { } foo { }"),
        is(
            ImmutableList.of("1:13: Expected 'with', 'without' or "
                + "end of input, found 'foo'")));
    assertThat(errors("pattern { N # M }"),
        is(ImmutableList.of("1:13: Unexpected character '#'")));
    assertThat(errors("pattern { N [lemma=\"dog] }"),
        is(ImmutableList.of("1:20: Unterminated string")));
    assertThat(errors("pattern { N [lemma=/d.g] }"),
        is(ImmutableList.of("1:20: Unterminated PCRE expression")));
    assertThat(errors("pattern { N [upos==NOUN] }"),
        is(ImmutableList.of("1:19: Expected a value, found '='")));
    assertThat(errors("pattern { N -[nsubj] M }"),
        is(ImmutableList.of("1:20: Expected ':', ']->' or '|', found ']'")));
    assertThat(errors(""),
        is(ImmutableList.of("1:1: Expected 'pattern', found end of input")));
  }
}

// End GrewParserTest.java
