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

import com.google.common.collect.ImmutableSet;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.cqptree.parse.ParseFailedException;
import net.hydromatic.cqptree.parse.Pos;

/**
 * Parser for Grew requests.
 *
 * <p>The grammar, in {@code GrewParser.jj}, is as follows:
 *
 * <pre>{@code
 * request  ::= 'pattern' body (('with' | 'without') body)*
 * body     ::= '{' (clause (';')?)* '}'
 * clause   ::= id fs ('|' fs)*
 *            | (id ':')? id arrow id
 *            | id ('<' | '<<') id
 *            | value ('=' | '<>') value
 * arrow    ::= '->' | '-[' ('^')? value ('|' value)* ']->'
 * fs       ::= '[' (feature (',' feature)*)? ']'
 * feature  ::= id | '!' id | id ('=' | '<>') value ('|' value)*
 * value    ::= id | id '.' id | string | 're' string | pcre
 * }</pre>
 *
 * <p>A "%" starts a comment that runs to the end of the line.
 */
public class GrewParser {
  /** Tokens that can start a value; in error messages they are described
   * together, as "a value". */
  private static final ImmutableSet<Integer> VALUE_TOKENS =
      ImmutableSet.of(GrewParserImplConstants.IDENTIFIER,
          GrewParserImplConstants.PATTERN,
          GrewParserImplConstants.WITH,
          GrewParserImplConstants.WITHOUT,
          GrewParserImplConstants.STRING,
          GrewParserImplConstants.REGEX,
          GrewParserImplConstants.PCRE);

  private GrewParser() {}

  /**
   * Parses a request.
   *
   * @throws ParseFailedException if the text is not a valid request
   */
  public static GrewAst.Request parse(String text) {
    final GrewParserImpl parser = new GrewParserImpl(new StringReader(text));
    try {
      return parser.Request();
    } catch (ParseException e) {
      throw toParseFailed(text, e);
    }
  }

  /** Converts an exception thrown by the generated parser. */
  static ParseFailedException toParseFailed(String text, ParseException e) {
    if (e.currentToken == null || e.currentToken.next == null) {
      return ParseFailedException.of(Pos.UNKNOWN, e.getMessage());
    }
    final Token token = e.currentToken.next;
    switch (token.kind) {
    case GrewParserImplConstants.EOF:
      return ParseFailedException.of(Pos.of(text, text.length()),
          expected(e) + "found end of input");
    case GrewParserImplConstants.UNEXPECTED:
      final String message;
      switch (token.image) {
      case "\"":
        message = "Unterminated string";
        break;
      case "/":
        message = "Unterminated PCRE expression";
        break;
      default:
        message = "Unexpected character '" + token.image + "'";
      }
      return ParseFailedException.of(GrewParserImpl.pos(token), message);
    default:
      return ParseFailedException.of(GrewParserImpl.pos(token),
          expected(e) + "found '" + token.image + "'");
    }
  }

  /** Describes the tokens that the parser would have accepted, for example
   * "Expected ']' or a value, ". */
  private static String expected(ParseException e) {
    final Set<Integer> kinds = new TreeSet<>();
    for (int[] sequence : e.expectedTokenSequences) {
      kinds.add(sequence[0]);
    }
    final Set<String> descriptions = new TreeSet<>();
    if (kinds.containsAll(VALUE_TOKENS)) {
      kinds.removeAll(VALUE_TOKENS);
      descriptions.add("a value");
    }
    for (int kind : kinds) {
      descriptions.add(describe(e.tokenImage[kind]));
    }
    if (descriptions.isEmpty()) {
      return "Unexpected input, ";
    }
    final List<String> list = new ArrayList<>(descriptions);
    final StringBuilder b = new StringBuilder("Expected ");
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        b.append(i == list.size() - 1 ? " or " : ", ");
      }
      b.append(list.get(i));
    }
    return b.append(", ").toString();
  }

  /** Converts a token image such as {@code "\"{\""} or {@code "<STRING>"}
   * to a description such as "'{'" or "a string". */
  private static String describe(String image) {
    if (image.startsWith("\"")) {
      return "'" + image.substring(1, image.length() - 1) + "'";
    }
    switch (image) {
    case "<EOF>":
      return "end of input";
    case "<IDENTIFIER>":
      return "an identifier";
    case "<STRING>":
      return "a string";
    case "<REGEX>":
      return "a regular expression";
    case "<PCRE>":
      return "a PCRE expression";
    default:
      return image;
    }
  }
}

// End GrewParser.java
