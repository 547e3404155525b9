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

import net.hydromatic.cqptree.util.CqpTreeException;

/**
 * A query is valid in its source language but cannot be translated.
 *
 * <p>The message is a reason that can be shown to the user, and may be
 * empty.
 */
public class NotSupportedException extends RuntimeException
    implements CqpTreeException {
  public NotSupportedException(String reason) {
    super(reason);
  }

  /** Returns the reason; never null, possibly empty. */
  public String reason() {
    final String message = getMessage();
    return message == null ? "" : message;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Query cannot be translated");
    return reason().isEmpty()
        ? buf.append('.')
        : buf.append(": ").append(reason());
  }
}

// End NotSupportedException.java
