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
package net.hydromatic.cqptree.frontend.depsearch;

import java.io.StringReader;
import net.hydromatic.cqptree.parse.ParseFailedException;
import net.hydromatic.cqptree.parse.Pos;

/**
 * Parser for dep_search queries.
 *
 * <p>The grammar, in {@code DepsearchParser.jj}, is as follows:
 *
 * <pre>{@code
 * query    ::= tree (('->' | '+') tree)?
 * tree     ::= expr relation*
 * relation ::= ('.' | arrows | '!' arrows | '!' '(' arrows ')') expr
 * arrows   ::= arrow ('|' arrow)*
 * arrow    ::= ('<' | '>') ('!'? label)? ('@L' | '@R')?
 * expr     ::= conj ('|' conj)*
 * conj     ::= unary ('&' unary)*
 * unary    ::= '!' unary | '(' tree ')' | string | word ('=' value)?
 * }</pre>
 *
 * <p>An arrow has no white space inside it: {@code >nsubj:cop@R} is one
 * arrow, and so is {@code <lin_2:3}.
 */
public class DepsearchParser {
  private DepsearchParser() {}

  /**
   * Parses a query.
   *
   * @throws ParseFailedException if the text is not a valid query
   */
  public static DepsearchAst.Query parse(String text) {
    final DepsearchParserImpl parser =
        new DepsearchParserImpl(new StringReader(text));
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
    switch (token.kind) {
    case DepsearchParserImplConstants.EOF:
      return ParseFailedException.of(Pos.of(text, text.length()),
          "Unexpected end of input");
    case DepsearchParserImplConstants.UNEXPECTED:
      return ParseFailedException.of(DepsearchParserImpl.pos(token),
          token.image.equals("\"")
              ? "Unterminated string"
              : "Unexpected character '" + token.image + "'");
    default:
      return ParseFailedException.of(DepsearchParserImpl.pos(token),
          "Unexpected '" + token.image + "'");
    }
  }
}

// End DepsearchParser.java
