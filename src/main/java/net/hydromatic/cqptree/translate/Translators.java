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
package net.hydromatic.cqptree.translate;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import net.hydromatic.cqptree.compile.NotSupportedException;
import net.hydromatic.cqptree.frontend.conllu.ConlluTranslator;
import net.hydromatic.cqptree.frontend.depsearch.DepsearchTranslator;
import net.hydromatic.cqptree.frontend.deptreepy.DeptreepyTranslator;
import net.hydromatic.cqptree.frontend.grew.GrewTranslator;
import net.hydromatic.cqptree.parse.ParseFailedException;
import net.hydromatic.cqptree.query.Recipe;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Registry of translators, keyed by name. */
public class Translators {
  private final Map<String, Translator> map = new LinkedHashMap<>();

  /** Creates an empty registry. */
  public Translators() {
  }

  /** Creates a registry of the built-in translators. */
  public static Translators builtIn(IdentifierGenerator generator) {
    return new Translators()
        .register(new ConlluTranslator(generator))
        .register(new DepsearchTranslator(generator))
        .register(new DeptreepyTranslator(generator))
        .register(new GrewTranslator(generator));
  }

  /**
   * Adds a translator.
   *
   * @throws IllegalArgumentException if there is already a translator with
   *   the same name
   */
  public Translators register(Translator translator) {
    final String name = translator.name();
    if (map.containsKey(name)) {
      throw new IllegalArgumentException("Another translator for " + name
          + " has already been registered");
    }
    map.put(name, translator);
    return this;
  }

  /** Returns the names of the translators, in order of registration. */
  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(map.keySet());
  }

  /**
   * Returns the translator with a given name.
   *
   * @throws IllegalArgumentException if there is no such translator
   */
  public Translator get(String name) {
    final Translator translator = map.get(name);
    if (translator == null) {
      throw new IllegalArgumentException("Unknown translator: " + name);
    }
    return translator;
  }

  /**
   * Translates a query using a given translator, or, if the name is null,
   * the only translator that accepts it.
   *
   * @throws AmbiguousTranslatorException if no name is given, and the number
   *   of translators that accept the query is not one
   */
  public Recipe translate(String text, @Nullable String name) {
    if (name != null) {
      return get(name).translate(text);
    }
    final List<String> matching = new ArrayList<>();
    final List<String> nonMatching = new ArrayList<>();
    @Nullable Recipe recipe = null;
    for (Translator translator : map.values()) {
      try {
        recipe = translator.translate(text);
        matching.add(translator.name());
      } catch (ParseFailedException | NotSupportedException e) {
        nonMatching.add(translator.name());
      }
    }
    if (matching.size() != 1) {
      throw new AmbiguousTranslatorException(matching, nonMatching);
    }
    return requireNonNull(recipe);
  }
}

// End Translators.java
