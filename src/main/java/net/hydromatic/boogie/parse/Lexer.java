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
package net.hydromatic.boogie.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.boogie.ast.Pos;

/**
 * Converts the text of a program into a list of tokens, discarding
 * whitespace and comments.
 */
public class Lexer {
  /** Words that cannot be used as identifiers. */
  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of("assert", "assume", "axiom", "call", "complete",
          "const", "div", "else", "ensures", "exists", "extends", "false",
          "forall", "free", "function", "goto", "havoc", "if",
          "implementation", "mod", "modifies", "old", "procedure",
          "requires", "return", "returns", "then", "true", "type", "unique",
          "var", "where");

  /** Symbols, longest first, so that the longest match wins. */
  private static final ImmutableList<String> SYMBOLS =
      ImmutableList.of("<==>", "==>", "::", ":=", "==", "!=", "<=", ">=",
          "<:", "++", "||", "&&", "(", ")", "[", "]", "{", "}", "<", ">",
          ",", ";", ":", "!", "-", "+", "*", "=");

  private final String file;
  private final String text;
  private int pos;

  public Lexer(String file, String text) {
    this.file = requireNonNull(file);
    this.text = requireNonNull(text);
  }

  /** Scans the whole input. The last token has kind
   * {@link TokenKind#EOF}. */
  public List<Token> scan() {
    final List<Token> tokens = new ArrayList<>();
    pos = 0;
    while (pos < text.length()) {
      final char c = text.charAt(pos);
      if (Character.isWhitespace(c)) {
        ++pos;
      } else if (text.startsWith("//", pos)) {
        skipLineComment();
      } else if (text.startsWith("/*", pos)) {
        skipBlockComment();
      } else if (Character.isDigit(c)) {
        tokens.add(scanNumber());
      } else if (c == '"') {
        tokens.add(scanString());
      } else if (isIdentifierStart(c)) {
        tokens.add(scanIdentifier());
      } else {
        tokens.add(scanSymbol());
      }
    }
    tokens.add(new Token(TokenKind.EOF, "", pos, pos));
    return tokens;
  }

  /** Returns the position of a range of the input. */
  Pos pos(int start, int end) {
    final int n = text.length();
    return Pos.of(text, file, Math.min(start, n), Math.min(end, n));
  }

  static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || "_.$#'?^~\\".indexOf(c) >= 0;
  }

  static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || Character.isDigit(c);
  }

  private void skipLineComment() {
    while (pos < text.length() && text.charAt(pos) != '\n') {
      ++pos;
    }
  }

  private void skipBlockComment() {
    final int start = pos;
    final int end = text.indexOf("*/", pos + 2);
    if (end < 0) {
      throw new ParseException("unterminated comment", pos(start, start + 2));
    }
    pos = end + 2;
  }

  /** Scans an integer, such as {@code 12}, or a bit-vector literal, such
   * as {@code 12bv8}. */
  private Token scanNumber() {
    final int start = pos;
    while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
      ++pos;
    }
    if (text.startsWith("bv", pos)
        && pos + 2 < text.length()
        && Character.isDigit(text.charAt(pos + 2))) {
      pos += 2;
      while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
        ++pos;
      }
      return token(TokenKind.BV, start);
    }
    return token(TokenKind.INT, start);
  }

  private Token scanString() {
    final int start = pos;
    final int end = text.indexOf('"', pos + 1);
    if (end < 0) {
      throw new ParseException("unterminated string", pos(start, start + 1));
    }
    pos = end + 1;
    return new Token(TokenKind.STRING, text.substring(start + 1, end),
        start, pos);
  }

  private Token scanIdentifier() {
    final int start = pos;
    while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
      ++pos;
    }
    final String word = text.substring(start, pos);
    return token(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.ID,
        start);
  }

  private Token scanSymbol() {
    for (String symbol : SYMBOLS) {
      if (text.startsWith(symbol, pos)) {
        final int start = pos;
        pos += symbol.length();
        return token(TokenKind.SYMBOL, start);
      }
    }
    throw new ParseException("unexpected character '" + text.charAt(pos)
        + "'", pos(pos, pos + 1));
  }

  private Token token(TokenKind kind, int start) {
    return new Token(kind, text.substring(start, pos), start, pos);
  }

  /** Kind of token. */
  public enum TokenKind {
    ID,
    KEYWORD,
    INT,
    BV,
    STRING,
    SYMBOL,
    EOF
  }

  /** Token: a kind, its text, and its offsets in the input. */
  public static class Token {
    public final TokenKind kind;
    /** Text of the token; for a string, the text between the quotes. */
    public final String text;
    public final int start;
    public final int end;

    Token(TokenKind kind, String text, int start, int end) {
      this.kind = requireNonNull(kind);
      this.text = requireNonNull(text);
      this.start = start;
      this.end = end;
    }

    /** Returns whether this token is a given keyword or symbol. */
    public boolean is(String s) {
      return (kind == TokenKind.KEYWORD || kind == TokenKind.SYMBOL)
          && text.equals(s);
    }

    @Override
    public String toString() {
      return kind == TokenKind.EOF ? "end of input" : "'" + text + "'";
    }
  }
}

// End Lexer.java
