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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import net.hydromatic.cqptree.util.CqpTreeException;

/** Exception caused by one or more errors in the text of a query. */
public class ParseFailedException extends RuntimeException
    implements CqpTreeException {
  public final ImmutableList<InputError> errors;

  public ParseFailedException(Iterable<InputError> errors) {
    this(ImmutableList.copyOf(errors));
  }

  private ParseFailedException(ImmutableList<InputError> errors) {
    super("Parsing failed. Detected " + errors.size() + " error(s).");
    checkArgument(!errors.isEmpty(), "expected at least one error");
    this.errors = errors;
  }

  /** Creates an exception with a single error. */
  public static ParseFailedException of(Pos pos, String message) {
    return new ParseFailedException(
        ImmutableList.of(new InputError(pos, message)));
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Query could not be parsed:");
    errors.forEach(e -> buf.append('\n').append(e));
    return buf;
  }
}

// End ParseFailedException.java
