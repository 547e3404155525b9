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

/**
 * Handle for a token variable.
 *
 * <p>Two identifiers are equal only if they are the same object. The ordinal
 * is for debugging; it never takes part in comparisons.
 *
 * @see IdentifierGenerator
 */
public final class Identifier {
  public final int ordinal;

  Identifier(int ordinal) {
    this.ordinal = ordinal;
  }

  @Override
  public String toString() {
    return "Identifier(" + ordinal + ")";
  }
}

// End Identifier.java
