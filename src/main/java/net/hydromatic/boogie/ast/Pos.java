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
package net.hydromatic.boogie.ast;

import java.util.Objects;

/** Position of a parse-tree node. */
public class Pos implements Comparable<Pos> {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos from two offsets into a program text. */
  public static Pos of(
      String text, String file, int startOffset, int endOffset) {
    final int[] start = lineCol(text, startOffset);
    final int[] end = lineCol(text, endOffset);
    return new Pos(file, start[0], start[1], end[0], end[1]);
  }

  @Override
  public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.startLine == ((Pos) o).startLine
            && this.startColumn == ((Pos) o).startColumn
            && this.endLine == ((Pos) o).endLine
            && this.endColumn == ((Pos) o).endColumn;
  }

  @Override
  public int compareTo(Pos o) {
    int c = Integer.compare(startLine, o.startLine);
    if (c == 0) {
      c = Integer.compare(startColumn, o.startColumn);
    }
    return c;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }

  /** Returns a position that spans this and another position. */
  public Pos plus(Pos pos) {
    if (this.equals(ZERO)) {
      return pos;
    }
    if (pos.equals(ZERO)) {
      return this;
    }
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    if (pos.startLine < startLine
        || pos.startLine == startLine && pos.startColumn < startColumn) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
    }
    int endLine = pos.endLine;
    int endColumn = pos.endColumn;
    if (this.endLine > endLine
        || this.endLine == endLine && this.endColumn > endColumn) {
      endLine = this.endLine;
      endColumn = this.endColumn;
    }
    return new Pos(file, startLine, startColumn, endLine, endColumn);
  }

  /** Returns the 1-based line and column of an offset. */
  private static int[] lineCol(String s, int offset) {
    int line = 1;
    int lineStart = 0;
    int i;
    final int n = Math.min(s.length(), offset);
    for (i = 0; i < n; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    if (i == offset) {
      return new int[] {line, offset - lineStart + 1};
    } else {
      throw new IllegalArgumentException("not found");
    }
  }
}

// End Pos.java
