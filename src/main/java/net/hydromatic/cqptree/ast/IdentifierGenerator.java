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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Allocates fresh {@link Identifier}s.
 *
 * <p>Front ends and the compiler receive a generator explicitly; there is no
 * global counter. A generator may be shared between threads.
 */
public class IdentifierGenerator {
  private final AtomicInteger next = new AtomicInteger();

  /** Returns an identifier that this generator has never returned before. */
  public Identifier get() {
    return new Identifier(next.getAndIncrement());
  }

  /** Returns the number of identifiers allocated so far. */
  public int count() {
    return next.get();
  }
}

// End IdentifierGenerator.java
