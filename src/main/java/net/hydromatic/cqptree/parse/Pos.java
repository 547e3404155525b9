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

import java.util.Objects;

/** Position in the text of a query. Lines and columns are 1-based. */
public class Pos {
  /** Position that is not known. */
  public static final Pos UNKNOWN = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(String file, int startLine, int startColumn,
      int endLine, int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos that covers a single character. */
  public static Pos at(int line, int column) {
    return new Pos("", line, column, line, column + 1);
  }

  /** Creates a Pos from two offsets into a text. */
  public static Pos of(String text, String file, int startOffset,
      int endOffset) {
    final int[] start = lineCol(text, startOffset);
    final int[] end = lineCol(text, endOffset);
    return new Pos(file, start[0], start[1], end[0], end[1]);
  }

  /** Creates a Pos that covers the character at an offset into a text. */
  public static Pos of(String text, int offset) {
    return of(text, "", offset, offset + 1);
  }

  @Override public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && this.startLine == ((Pos) o).startLine
        && this.startColumn == ((Pos) o).startColumn
        && this.endLine == ((Pos) o).endLine
        && this.endColumn == ((Pos) o).endColumn;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes this position as "line:column", or "?" if not known. */
  public StringBuilder describeTo(StringBuilder buf) {
    if (this.equals(UNKNOWN)) {
      return buf.append("?");
    }
    return buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append(':')
        .append(startColumn);
  }

  /** Returns the 1-based line and column of an offset. Offsets beyond the
   * end of the text are treated as the end. */
  private static int[] lineCol(String s, int offset) {
    int line = 1;
    int lineStart = 0;
    final int n = Math.min(s.length(), offset);
    for (int i = 0; i < n; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    return new int[] {line, n - lineStart + 1};
  }
}

// End Pos.java
