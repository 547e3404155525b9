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

import net.hydromatic.cqptree.util.CqpTreeException;

/**
 * A query graph violates one of its invariants.
 *
 * <p>For example, two tokens share an identifier, or a predicate references a
 * token that the query does not define. Such a graph is produced only by a
 * faulty front end, never by a faulty user input.
 */
public class InvalidQueryException extends RuntimeException
    implements CqpTreeException {
  public InvalidQueryException(String message) {
    super(message);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Invalid query: ").append(getMessage());
  }
}

// End InvalidQueryException.java
