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

import java.util.Objects;
import net.hydromatic.cqptree.ast.Ast;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Token variable of a query, with an optional predicate that the token must
 * satisfy.
 *
 * <p>The predicate is local: its unqualified attributes refer to this token.
 */
public class Token {
  public final Identifier identifier;
  public final Ast.@Nullable Predicate attributes;

  private Token(Identifier identifier, Ast.@Nullable Predicate attributes) {
    this.identifier = requireNonNull(identifier);
    this.attributes = attributes;
  }

  /** Creates a token without predicate. */
  public static Token of(Identifier identifier) {
    return new Token(identifier, null);
  }

  /** Creates a token with a local predicate. */
  public static Token of(
      Identifier identifier, Ast.@Nullable Predicate attributes) {
    return new Token(identifier, attributes);
  }

  /** Creates a token with a fresh identifier and no predicate. */
  public static Token fresh(IdentifierGenerator generator) {
    return new Token(generator.get(), null);
  }

  /**
   * Returns the predicate of this token in global form, with every reference
   * to the current token replaced by a reference to this token; or null if
   * the token has no predicate.
   */
  public Ast.@Nullable Predicate raisedAttributes() {
    return attributes == null ? null : attributes.raiseFrom(identifier);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, attributes);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Token
            && identifier == ((Token) o).identifier
            && Objects.equals(attributes, ((Token) o).attributes);
  }

  @Override
  public String toString() {
    return attributes == null
        ? identifier.toString()
        : identifier + "[" + attributes + "]";
  }
}

// End Token.java
