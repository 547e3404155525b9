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

import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import net.hydromatic.cqptree.ast.Identifier;

/** Directed edge meaning that {@link #dst} is a syntactic dependent of {@link
 * #src}. */
public class Dependency {
  public final Identifier src;
  public final Identifier dst;

  private Dependency(Identifier src, Identifier dst) {
    this.src = requireNonNull(src);
    this.dst = requireNonNull(dst);
    if (src == dst) {
      throw new InvalidQueryException("token cannot depend on itself");
    }
  }

  /** Creates a dependency from a head to its dependent. */
  public static Dependency of(Identifier head, Identifier dependent) {
    return new Dependency(head, dependent);
  }

  public ImmutableSet<Identifier> referencedIdentifiers() {
    return ImmutableSet.of(src, dst);
  }

  @Override
  public int hashCode() {
    return Objects.hash(src, dst);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Dependency
            && src == ((Dependency) o).src
            && dst == ((Dependency) o).dst;
  }

  @Override
  public String toString() {
    return src + " -> " + dst;
  }
}

// End Dependency.java
