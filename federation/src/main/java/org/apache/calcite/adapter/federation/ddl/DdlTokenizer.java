/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.federation.ddl;

import org.apache.calcite.adapter.federation.ErrorKind;
import org.apache.calcite.adapter.federation.FederationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits DDL text into tokens. Identifiers may be double-quoted, strings are
 * single-quoted; a doubled quote inside either stands for one quote.
 */
class DdlTokenizer {
  /** Token kind. */
  enum Kind { WORD, QUOTED_WORD, STRING, NUMBER, SYMBOL, EOF }

  /** A token and its offset in the input. */
  static final class Token {
    final Kind kind;
    final String text;
    final int offset;

    Token(Kind kind, String text, int offset) {
      this.kind = kind;
      this.text = text;
      this.offset = offset;
    }

    /** Whether this is the unquoted keyword {@code word}, ignoring case. */
    boolean isKeyword(String word) {
      return kind == Kind.WORD && text.equalsIgnoreCase(word);
    }

    boolean isSymbol(String symbol) {
      return kind == Kind.SYMBOL && text.equals(symbol);
    }

    @Override public String toString() {
      return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
  }

  private DdlTokenizer() {
  }

  static List<Token> tokenize(String sql) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    int n = sql.length();
    while (i < n) {
      char c = sql.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        while (i < n && sql.charAt(i) != '\n') {
          i++;
        }
      } else if (c == '\'' || c == '"') {
        int start = i;
        StringBuilder text = new StringBuilder();
        i++;
        while (true) {
          if (i >= n) {
            throw error(start, "unterminated " + (c == '\'' ? "string" : "quoted identifier"));
          }
          char d = sql.charAt(i);
          if (d == c) {
            if (i + 1 < n && sql.charAt(i + 1) == c) {
              text.append(c);
              i += 2;
              continue;
            }
            i++;
            break;
          }
          text.append(d);
          i++;
        }
        tokens.add(new Token(c == '\'' ? Kind.STRING : Kind.QUOTED_WORD, text.toString(), start));
      } else if (Character.isDigit(c) || (c == '-' || c == '+' || c == '.')
          && i + 1 < n && (Character.isDigit(sql.charAt(i + 1)) || sql.charAt(i + 1) == '.')) {
        int start = i;
        i++;
        while (i < n && (Character.isDigit(sql.charAt(i)) || sql.charAt(i) == '.'
            || sql.charAt(i) == 'e' || sql.charAt(i) == 'E'
            || (sql.charAt(i) == '-' || sql.charAt(i) == '+')
                && (sql.charAt(i - 1) == 'e' || sql.charAt(i - 1) == 'E'))) {
          i++;
        }
        tokens.add(new Token(Kind.NUMBER, sql.substring(start, i), start));
      } else if (Character.isLetter(c) || c == '_') {
        int start = i;
        while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_'
            || sql.charAt(i) == '$')) {
          i++;
        }
        tokens.add(new Token(Kind.WORD, sql.substring(start, i), start));
      } else if (c == '=' && i + 1 < n && sql.charAt(i + 1) == '>') {
        tokens.add(new Token(Kind.SYMBOL, "=>", i));
        i += 2;
      } else if ("(),=[];.".indexOf(c) >= 0) {
        tokens.add(new Token(Kind.SYMBOL, String.valueOf(c), i));
        i++;
      } else {
        throw error(i, String.format(Locale.ROOT, "unexpected character '%c'", c));
      }
    }
    tokens.add(new Token(Kind.EOF, "", n));
    return tokens;
  }

  static FederationException error(int offset, String message) {
    return new FederationException(ErrorKind.PARSE_ERROR,
        message + " at position " + (offset + 1));
  }
}
