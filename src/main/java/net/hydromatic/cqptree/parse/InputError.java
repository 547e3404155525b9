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
package net.hydromatic.cqptree.parse;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Error found while parsing a query. */
public class InputError {
  public final Pos pos;
  public final String message;

  public InputError(Pos pos, String message) {
    this.pos = requireNonNull(pos);
    this.message = requireNonNull(message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pos, message);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof InputError
            && pos.equals(((InputError) o).pos)
            && message.equals(((InputError) o).message);
  }

  @Override
  public String toString() {
    return pos + ": " + message;
  }
}

// End InputError.java
