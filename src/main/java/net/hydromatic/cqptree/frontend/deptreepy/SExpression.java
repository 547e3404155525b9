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
package net.hydromatic.cqptree.frontend.deptreepy;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.StringReader;
import net.hydromatic.cqptree.parse.ParseFailedException;
import net.hydromatic.cqptree.parse.Pos;

/**
 * S-expression: either an atom or a parenthesized list of s-expressions.
 *
 * <p>Atoms are sequences of characters other than white space and
 * parentheses, or strings in double quotes.
 */
public abstract class SExpression {
  public final Pos pos;

  private SExpression(Pos pos) {
    this.pos = requireNonNull(pos);
  }

  /** Returns whether this is an atom with a given value. */
  public boolean isAtom(String value) {
    return false;
  }

  /**
   * Parses a string. If the string does not start with "(", it is treated as
   * if it were enclosed in parentheses.
   *
   * @throws ParseFailedException if parentheses are not balanced, or if
   *   there is text after the expression
   */
  public static SExpression parse(String text) {
    final SExpressionParserImpl parser =
        new SExpressionParserImpl(new StringReader(text));
    try {
      return parser.Query();
    } catch (ParseException e) {
      throw toParseFailed(text, e);
    }
  }

  private static ParseFailedException toParseFailed(String text,
      ParseException e) {
    if (e.currentToken == null || e.currentToken.next == null) {
      return ParseFailedException.of(Pos.UNKNOWN, e.getMessage());
    }
    final Token token = e.currentToken.next;
    boolean endExpected = false;
    for (int[] sequence : e.expectedTokenSequences) {
      endExpected |= sequence[0] == SExpressionParserImplConstants.EOF;
    }
    if (token.kind == SExpressionParserImplConstants.UNEXPECTED) {
      return ParseFailedException.of(SExpressionParserImpl.pos(token),
          "Unterminated string");
    } else if (endExpected) {
      return ParseFailedException.of(SExpressionParserImpl.pos(token),
          "Unexpected input after expression");
    } else if (token.kind == SExpressionParserImplConstants.EOF) {
      return ParseFailedException.of(Pos.of(text, text.length()),
          "Expected ')' to match '('");
    } else {
      return ParseFailedException.of(SExpressionParserImpl.pos(token),
          "Unexpected '" + token.image + "'");
    }
  }

  /** Atom. */
  public static class Atom extends SExpression {
    public final String value;

    Atom(Pos pos, String value) {
      super(pos);
      this.value = requireNonNull(value);
    }

    @Override
    public boolean isAtom(String value) {
      return this.value.equals(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Atom && value.equals(((Atom) o).value);
    }

    @Override
    public String toString() {
      return value;
    }
  }

  /** List of expressions. */
  public static class SList extends SExpression {
    public final ImmutableList<SExpression> list;

    SList(Pos pos, ImmutableList<SExpression> list) {
      super(pos);
      this.list = list;
    }

    /** Returns whether the first element is an atom with a given value. */
    public boolean startsWith(String value) {
      return !list.isEmpty() && list.get(0).isAtom(value);
    }

    @Override
    public int hashCode() {
      return list.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SList && list.equals(((SList) o).list);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder("(");
      for (int i = 0; i < list.size(); i++) {
        if (i > 0) {
          b.append(' ');
        }
        b.append(list.get(i));
      }
      return b.append(')').toString();
    }
  }
}

// End SExpression.java
