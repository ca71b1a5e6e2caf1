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

import org.apache.calcite.adapter.federation.ddl.DdlTokenizer.Kind;
import org.apache.calcite.adapter.federation.ddl.DdlTokenizer.Token;
import org.apache.calcite.adapter.federation.options.ExternalOptions;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses option lists such as {@code location = 's3://b/k', infer_rows => 10,
 * has_header = true, paths = ['a', 'b']}.
 *
 * <p>{@code =} and {@code =>} are interchangeable. Values are string,
 * number, boolean or list literals; integral numbers become {@code Long},
 * others {@code BigDecimal}.
 */
public final class OptionsParser {
  private final List<Token> tokens;
  private int pos;

  OptionsParser(List<Token> tokens, int pos) {
    this.tokens = tokens;
    this.pos = pos;
  }

  /** Parses a complete option list, without surrounding parentheses. */
  public static ExternalOptions parse(String text) {
    OptionsParser parser = new OptionsParser(DdlTokenizer.tokenize(text), 0);
    ExternalOptions options = parser.parseList();
    parser.expectEnd();
    return options;
  }

  int position() {
    return pos;
  }

  /** Parses {@code key = value [, ...]} up to the end of input or a {@code )}. */
  ExternalOptions parseList() {
    ExternalOptions.Builder builder = ExternalOptions.builder();
    if (atListEnd()) {
      return builder.build();
    }
    while (true) {
      Token key = next();
      if (key.kind != Kind.WORD && key.kind != Kind.QUOTED_WORD && key.kind != Kind.STRING) {
        throw DdlTokenizer.error(key.offset, "expected option name, got " + key);
      }
      Token assign = next();
      if (!assign.isSymbol("=") && !assign.isSymbol("=>")) {
        throw DdlTokenizer.error(assign.offset, "expected '=' or '=>' after " + key);
      }
      builder.put(key.text, parseValue());
      if (peek().isSymbol(",")) {
        next();
        continue;
      }
      if (atListEnd()) {
        return builder.build();
      }
      throw DdlTokenizer.error(peek().offset, "expected ',' but got " + peek());
    }
  }

  private boolean atListEnd() {
    Token token = peek();
    return token.kind == Kind.EOF || token.isSymbol(")");
  }

  Object parseValue() {
    Token token = next();
    switch (token.kind) {
    case STRING:
      return token.text;
    case NUMBER:
      return number(token);
    case WORD:
      if (token.text.equalsIgnoreCase("true")) {
        return Boolean.TRUE;
      }
      if (token.text.equalsIgnoreCase("false")) {
        return Boolean.FALSE;
      }
      if (token.text.equalsIgnoreCase("array") && peek().isSymbol("[")) {
        return parseArray(next());
      }
      throw DdlTokenizer.error(token.offset, "expected a literal, got " + token);
    case SYMBOL:
      if (token.isSymbol("[")) {
        return parseArray(token);
      }
      throw DdlTokenizer.error(token.offset, "expected a literal, got " + token);
    default:
      throw DdlTokenizer.error(token.offset, "expected a literal, got " + token);
    }
  }

  private List<Object> parseArray(Token open) {
    List<Object> values = new ArrayList<>();
    if (peek().isSymbol("]")) {
      next();
      return values;
    }
    while (true) {
      values.add(parseValue());
      Token token = next();
      if (token.isSymbol("]")) {
        return values;
      }
      if (!token.isSymbol(",")) {
        throw DdlTokenizer.error(token.offset,
            "expected ',' or ']' in list starting at position " + (open.offset + 1));
      }
    }
  }

  private static Object number(Token token) {
    String text = token.text.startsWith("+") ? token.text.substring(1) : token.text;
    try {
      BigDecimal decimal = new BigDecimal(text);
      if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
        try {
          return decimal.longValueExact();
        } catch (ArithmeticException e) {
          return decimal;
        }
      }
      return decimal;
    } catch (NumberFormatException e) {
      throw DdlTokenizer.error(token.offset, "malformed number " + token);
    }
  }

  Token peek() {
    return tokens.get(pos);
  }

  Token next() {
    Token token = tokens.get(pos);
    if (token.kind != Kind.EOF) {
      pos++;
    }
    return token;
  }

  private void expectEnd() {
    if (peek().kind != Kind.EOF) {
      throw DdlTokenizer.error(peek().offset, "unexpected " + peek());
    }
  }
}
