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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.cqptree.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cqptree.ast.Ast;
import net.hydromatic.cqptree.ast.Identifier;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import net.hydromatic.cqptree.ast.Op;
import net.hydromatic.cqptree.compile.NotSupportedException;
import net.hydromatic.cqptree.parse.InputError;
import net.hydromatic.cqptree.parse.ParseFailedException;
import net.hydromatic.cqptree.parse.Pos;
import net.hydromatic.cqptree.query.Constraint;
import net.hydromatic.cqptree.query.Dependency;
import net.hydromatic.cqptree.query.Query;
import net.hydromatic.cqptree.query.Recipe;
import net.hydromatic.cqptree.query.Token;
import net.hydromatic.cqptree.translate.Translator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates a sentence in CoNLL-U format into a query.
 *
 * <p>Every word of the sentence becomes a token, and every head a
 * dependency. Fields whose value is "_" or "*" do not constrain the token.
 * The MISC column may annotate tokens as "anchored", "ordered" or
 * "subsequent"; other MISC entries constrain attributes of the same name.
 */
public class ConlluTranslator implements Translator {
  /** Columns that become attributes, and the attribute for each. */
  private static final ImmutableMap<Column, String> ATTRIBUTES =
      ImmutableMap.of(Column.FORM, "word",
          Column.LEMMA, "lemma",
          Column.UPOS, "pos",
          Column.XPOS, "msd",
          Column.DEPREL, "deprel");

  /** Attribute that holds the morphological features of a token. */
  private static final String FEATS_ATTRIBUTE = "ufeats";

  /** MISC entries that annotate the query rather than constrain a token. */
  private static final ImmutableSet<String> ANNOTATIONS =
      ImmutableSet.of("anchored", "ordered", "subsequent", "highlight");

  private final IdentifierGenerator generator;

  public ConlluTranslator(IdentifierGenerator generator) {
    this.generator = requireNonNull(generator);
  }

  @Override
  public String name() {
    return "conllu";
  }

  @Override
  public Recipe translate(String text) {
    final List<Row> rows = parse(text);

    final Map<Integer, Identifier> identifiers = new HashMap<>();
    rows.forEach(row -> identifiers.put(row.id, generator.get()));

    final List<Token> tokens = new ArrayList<>();
    final List<Dependency> dependencies = new ArrayList<>();
    final List<Constraint> constraints = new ArrayList<>();
    @Nullable Identifier previousOrdered = null;
    for (int i = 0; i < rows.size(); i++) {
      final Row row = rows.get(i);
      final Identifier id = requireNonNull(identifiers.get(row.id));
      final List<Ast.Predicate> predicates = predicates(row);
      tokens.add(predicates.isEmpty()
          ? Token.of(id)
          : Token.of(id, ast.and(predicates)));

      final String head = row.get(Column.HEAD);
      if (isUnspecified(head)) {
        throw new NotSupportedException("IDs and HEADs cannot be omitted.");
      }
      final int headId = Integer.parseInt(head);
      if (headId != 0) {
        final Identifier headIdentifier = identifiers.get(headId);
        if (headIdentifier == null) {
          throw new NotSupportedException("HEAD " + headId
              + " of token " + row.id + " is not a token of the sentence.");
        }
        if (headIdentifier == id) {
          throw new NotSupportedException("Token " + row.id
              + " cannot be its own HEAD.");
        }
        dependencies.add(Dependency.of(headIdentifier, id));
      }

      final Map<String, String> misc = row.misc();
      if (isYes(misc.get("anchored"))) {
        if (rows.size() == 1) {
          throw new NotSupportedException("A single token cannot be "
              + "anchored to both the beginning and the end of the span.");
        } else if (i == 0) {
          constraints.add(Constraint.first(id));
        } else if (i == rows.size() - 1) {
          constraints.add(Constraint.last(id));
        }
        // "anchored" on a token in the middle has no effect
      }
      if (isYes(misc.get("ordered"))) {
        if (previousOrdered != null) {
          constraints.add(Constraint.order(previousOrdered, id));
        }
        previousOrdered = id;
      }
      if (isYes(misc.get("subsequent"))) {
        if (i == 0) {
          throw new NotSupportedException(
              "The first token cannot be subsequent to another token.");
        }
        final Identifier previous =
            requireNonNull(identifiers.get(rows.get(i - 1).id));
        constraints.add(Constraint.order(previous, id));
        constraints.add(Constraint.distance(previous, id).equalTo(0));
      }
    }
    return Recipe.ofQuery(
        Query.create(generator, tokens, dependencies, constraints,
            ImmutableList.of()));
  }

  /** Returns the predicates that constrain the token of a row. */
  private static List<Ast.Predicate> predicates(Row row) {
    final List<Ast.Predicate> predicates = new ArrayList<>();
    ATTRIBUTES.forEach((column, attribute) -> {
      final String value = row.get(column);
      if (!isUnspecified(value)) {
        predicates.add(
            ast.equal(ast.attribute(attribute), ast.quoted(value)));
      }
    });
    final String feats = row.get(Column.FEATS);
    if (!isUnspecified(feats)) {
      for (String feat : feats.split("\\|")) {
        predicates.add(
            ast.comparison(ast.attribute(FEATS_ATTRIBUTE), Op.CONTAINS,
                ast.quoted(feat)));
      }
    }
    row.misc().forEach((key, value) -> {
      if (!ANNOTATIONS.contains(key) && !isUnspecified(value)) {
        predicates.add(ast.equal(ast.attribute(key), ast.quoted(value)));
      }
    });
    return predicates;
  }

  /** Parses the first sentence of a document. */
  static List<Row> parse(String text) {
    final List<Row> rows = new ArrayList<>();
    final List<InputError> errors = new ArrayList<>();
    final Map<Integer, Integer> lineOfId = new HashMap<>();
    final String[] lines = text.split("\r?\n", -1);
    for (int i = 0; i < lines.length; i++) {
      final int lineNumber = i + 1;
      final String line = lines[i];
      if (line.trim().isEmpty()) {
        if (rows.isEmpty() && errors.isEmpty()) {
          continue;
        }
        break;
      }
      if (line.startsWith("#")) {
        continue;
      }
      final String[] fields = line.split("\t", -1);
      if (fields.length != Column.values().length) {
        errors.add(
            new InputError(Pos.at(lineNumber, 1),
                "Expected " + Column.values().length
                    + " tab-separated fields, found " + fields.length));
        continue;
      }
      final String id = fields[Column.ID.ordinal()];
      if (id.contains("-") || id.contains(".")) {
        // Multi-word token or empty node.
        continue;
      }
      final Integer intId = parseInt(id);
      if (intId == null || intId < 1) {
        errors.add(
            new InputError(Pos.at(lineNumber, 1), "Invalid ID: " + id));
        continue;
      }
      if (lineOfId.put(intId, lineNumber) != null) {
        errors.add(
            new InputError(Pos.at(lineNumber, 1), "Duplicate ID: " + id));
        continue;
      }
      final String head = fields[Column.HEAD.ordinal()];
      if (!isUnspecified(head) && parseInt(head) == null) {
        errors.add(
            new InputError(Pos.at(lineNumber, column(fields, Column.HEAD)),
                "Invalid HEAD: " + head));
        continue;
      }
      rows.add(new Row(intId, ImmutableList.copyOf(fields)));
    }
    if (!errors.isEmpty()) {
      throw new ParseFailedException(errors);
    }
    if (rows.isEmpty()) {
      throw ParseFailedException.of(Pos.UNKNOWN, "No tokens found.");
    }
    return rows;
  }

  /** Returns the 1-based column at which a field starts. */
  private static int column(String[] fields, Column column) {
    int c = 1;
    for (int i = 0; i < column.ordinal(); i++) {
      c += fields[i].length() + 1;
    }
    return c;
  }

  private static @Nullable Integer parseInt(String s) {
    try {
      return Integer.valueOf(s);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static boolean isUnspecified(String value) {
    return value.equals("_") || value.equals("*") || value.isEmpty();
  }

  private static boolean isYes(@Nullable String value) {
    return "Yes".equalsIgnoreCase(value);
  }

  /** Column of a CoNLL-U file. */
  enum Column {
    ID, FORM, LEMMA, UPOS, XPOS, FEATS, HEAD, DEPREL, DEPS, MISC
  }

  /** Line of a CoNLL-U file that describes a word. */
  static class Row {
    final int id;
    final ImmutableList<String> fields;

    Row(int id, ImmutableList<String> fields) {
      this.id = id;
      this.fields = fields;
    }

    String get(Column column) {
      return fields.get(column.ordinal());
    }

    /** Returns the entries of the MISC column, in order. */
    Map<String, String> misc() {
      final String misc = get(Column.MISC);
      final Map<String, String> map = new LinkedHashMap<>();
      if (!isUnspecified(misc)) {
        for (String entry : misc.split("\\|")) {
          final int i = entry.indexOf('=');
          if (i > 0) {
            map.put(entry.substring(0, i), entry.substring(i + 1));
          }
        }
      }
      return map;
    }
  }
}

// End ConlluTranslator.java
