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
package net.hydromatic.cqptree.compile;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Generates unique names from an alphabet.
 *
 * <p>With the alphabet "abc", generates "a", "b", "c", "aa", "ab", and so on.
 */
public class NameGenerator {
  private final String alphabet;
  private int id = 0;

  public NameGenerator(String alphabet) {
    checkArgument(!alphabet.isEmpty(), "empty alphabet");
    this.alphabet = alphabet;
  }

  /** Returns a generator of token names: "a", "b", ... "z", "aa", .... */
  public static NameGenerator lower() {
    return new NameGenerator("abcdefghijklmnopqrstuvwxyz");
  }

  /** Returns a generator of step names: "A", "B", ... "Z", "AA", .... */
  public static NameGenerator upper() {
    return new NameGenerator("ABCDEFGHIJKLMNOPQRSTUVWXYZ");
  }

  /** Generates a name that is unique in this generator. */
  public String get() {
    return name(id++);
  }

  /** Returns the name with a given ordinal. */
  public String name(int ordinal) {
    checkArgument(ordinal >= 0);
    final int radix = alphabet.length();
    final StringBuilder b = new StringBuilder();
    for (int n = ordinal + 1; n > 0; n = (n - 1) / radix) {
      b.append(alphabet.charAt((n - 1) % radix));
    }
    return b.reverse().toString();
  }
}

// End NameGenerator.java
