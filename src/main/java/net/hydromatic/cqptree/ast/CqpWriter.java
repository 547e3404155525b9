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
package net.hydromatic.cqptree.ast;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Context for writing AST nodes out as a string in the target query language.
 *
 * <p>The writer knows the names of the tokens that are referenced from other
 * tokens. An attribute of a named token is written {@code a.lemma}; an
 * attribute of an unnamed token (which only happens when debugging) is written
 * using its ordinal, {@code _3.lemma}.
 */
public class CqpWriter {
  private final StringBuilder b = new StringBuilder();
  private final Map<Identifier, String> names;

  /** Creates a writer that knows no names. */
  public CqpWriter() {
    this(ImmutableMap.of());
  }

  /** Creates a writer with a given assignment of names to tokens. */
  public CqpWriter(Map<Identifier, String> names) {
    this.names = ImmutableMap.copyOf(names);
  }

  /** Returns the name of a token. */
  public String name(Identifier id) {
    final String name = names.get(id);
    return name != null ? name : "_" + id.ordinal;
  }

  /** Returns whether a token has a name. */
  public boolean isNamed(Identifier id) {
    return names.containsKey(id);
  }

  /** Appends a string to the output. */
  public CqpWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public CqpWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends an attribute, qualified by the name of its token if it has one. */
  public CqpWriter attribute(@Nullable Identifier reference, String name) {
    if (reference != null) {
      b.append(name(reference)).append('.');
    }
    b.append(name);
    return this;
  }

  /** Appends a call to an infix operator. */
  public CqpWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator, e.g. "!". */
  public CqpWriter prefix(int left, Op op, AstNode a, int right) {
    if (left > op.left) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /** Appends a list of nodes joined by an associative operator. */
  public CqpWriter junction(
      int left, Op op, List<? extends AstNode> args, int right) {
    if (left > op.left || op.right < right) {
      return append("(").junction(0, op, args, 0).append(")");
    }
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        append(op.padded);
      }
      final int l = i == 0 ? left : op.right;
      final int r = i == args.size() - 1 ? right : op.left;
      args.get(i).unparse(this, l, r);
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End CqpWriter.java
