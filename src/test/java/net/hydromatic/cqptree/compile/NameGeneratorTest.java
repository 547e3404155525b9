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

import static net.hydromatic.cqptree.Cqp.assertError;
import static net.hydromatic.cqptree.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for {@link NameGenerator}. */
public class NameGeneratorTest {
  @Test void testLower() {
    final NameGenerator generator = NameGenerator.lower();
    assertThat(generator.name(0), is("a"));
    assertThat(generator.name(25), is("z"));
    assertThat(generator.name(26), is("aa"));
    assertThat(generator.name(51), is("az"));
    assertThat(generator.name(52), is("ba"));
    assertThat(generator.name(26 + 26 * 26), is("aaa"));
  }

  @Test void testGet() {
    final NameGenerator generator = NameGenerator.upper();
    assertThat(generator.get(), is("A"));
    assertThat(generator.get(), is("B"));
    assertThat(generator.get(), is("C"));

    // Generators are independent
    assertThat(NameGenerator.upper().get(), is("A"));
  }

  @Test void testCustomAlphabet() {
    final NameGenerator generator = new NameGenerator("xy");
    assertThat(generator.name(0), is("x"));
    assertThat(generator.name(1), is("y"));
    assertThat(generator.name(2), is("xx"));
    assertThat(generator.name(5), is("yy"));
    assertThat(generator.name(6), is("xxx"));
    assertError(() -> new NameGenerator(""),
        throwsA(IllegalArgumentException.class, is("empty alphabet")));
  }
}

// End NameGeneratorTest.java
