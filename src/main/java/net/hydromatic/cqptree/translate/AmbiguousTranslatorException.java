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

import com.google.common.collect.ImmutableList;
import net.hydromatic.cqptree.util.CqpTreeException;

/**
 * No translator was specified, and either no translator or more than one
 * translator accepts the text of a query.
 */
public class AmbiguousTranslatorException extends RuntimeException
    implements CqpTreeException {
  /** Names of the translators that accept the query. */
  public final ImmutableList<String> matching;

  /** Names of the translators that reject the query. */
  public final ImmutableList<String> nonMatching;

  public AmbiguousTranslatorException(Iterable<String> matching,
      Iterable<String> nonMatching) {
    super(message(ImmutableList.copyOf(matching)));
    this.matching = ImmutableList.copyOf(matching);
    this.nonMatching = ImmutableList.copyOf(nonMatching);
  }

  private static String message(ImmutableList<String> matching) {
    return "Cannot guess translator for query: "
        + (matching.isEmpty()
            ? "no translator matches"
            : "multiple translators match (" + String.join(", ", matching)
                + ")");
  }

  public boolean noTranslatorMatches() {
    return matching.isEmpty();
  }

  public boolean tooManyTranslatorsMatch() {
    return matching.size() > 1;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(getMessage());
  }
}

// End AmbiguousTranslatorException.java
