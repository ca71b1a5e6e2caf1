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

import org.apache.calcite.adapter.federation.FederationException;
import org.apache.calcite.adapter.federation.ddl.DdlTokenizer.Kind;
import org.apache.calcite.adapter.federation.ddl.DdlTokenizer.Token;
import org.apache.calcite.adapter.federation.options.ExternalOptions;

import java.util.List;

/**
 * Parses the federation DDL statements:
 *
 * <pre>
 * CREATE [OR REPLACE] CREDENTIAL[S] name PROVIDER provider
 *     OPTIONS (key = value, key =&gt; value, ...) [COMMENT 'text']
 * CREATE [OR REPLACE] EXTERNAL TABLE name FROM provider OPTIONS (...)
 * DROP CREDENTIAL[S] [IF EXISTS] name
 * DROP EXTERNAL TABLE [IF EXISTS] name
 * </pre>
 *
 * <p>Keywords are case-insensitive. Names are taken as written; double
 * quotes allow any characters.
 */
public final class DdlParser {
  private final List<Token> tokens;
  private int pos;

  private DdlParser(String sql) {
    this.tokens = DdlTokenizer.tokenize(sql);
  }

  /**
   * Parses one statement; a trailing semicolon is allowed.
   *
   * @throws FederationException with
   *     {@code PARSE_ERROR} on malformed input
   */
  public static DdlStatement parse(String sql) {
    DdlParser parser = new DdlParser(sql);
    DdlStatement statement = parser.statement();
    if (parser.peek().isSymbol(";")) {
      parser.next();
    }
    if (parser.peek().kind != Kind.EOF) {
      throw DdlTokenizer.error(parser.peek().offset, "unexpected " + parser.peek());
    }
    return statement;
  }

  /** Whether {@code sql} starts like a statement this parser handles. */
  public static boolean accepts(String sql) {
    List<Token> tokens;
    try {
      tokens = DdlTokenizer.tokenize(sql);
    } catch (FederationException e) {
      return false;
    }
    int i = 0;
    if (tokens.get(i).isKeyword("CREATE")) {
      i++;
      if (tokens.get(i).isKeyword("OR") && tokens.get(i + 1).isKeyword("REPLACE")) {
        i += 2;
      }
      return tokens.get(i).isKeyword("CREDENTIAL") || tokens.get(i).isKeyword("CREDENTIALS")
          || tokens.get(i).isKeyword("EXTERNAL");
    }
    if (tokens.get(i).isKeyword("DROP")) {
      Token what = tokens.get(i + 1);
      return what.isKeyword("CREDENTIAL") || what.isKeyword("CREDENTIALS")
          || what.isKeyword("EXTERNAL");
    }
    return false;
  }

  private DdlStatement statement() {
    if (acceptKeyword("CREATE")) {
      boolean replace = false;
      if (acceptKeyword("OR")) {
        expectKeyword("REPLACE");
        replace = true;
      }
      if (acceptKeyword("CREDENTIAL") || acceptKeyword("CREDENTIALS")) {
        return createCredential(replace);
      }
      if (acceptKeyword("EXTERNAL")) {
        expectKeyword("TABLE");
        return createExternalTable(replace);
      }
      throw DdlTokenizer.error(peek().offset,
          "expected CREDENTIAL or EXTERNAL TABLE, got " + peek());
    }
    if (acceptKeyword("DROP")) {
      if (acceptKeyword("CREDENTIAL") || acceptKeyword("CREDENTIALS")) {
        boolean ifExists = ifExists();
        return new DdlStatement.DropCredential(name(), ifExists);
      }
      if (acceptKeyword("EXTERNAL")) {
        expectKeyword("TABLE");
        boolean ifExists = ifExists();
        return new DdlStatement.DropExternalTable(name(), ifExists);
      }
      throw DdlTokenizer.error(peek().offset,
          "expected CREDENTIAL or EXTERNAL TABLE, got " + peek());
    }
    throw DdlTokenizer.error(peek().offset, "expected CREATE or DROP, got " + peek());
  }

  private DdlStatement createCredential(boolean replace) {
    String name = name();
    expectKeyword("PROVIDER");
    String provider = name();
    ExternalOptions options = options();
    String comment = null;
    if (acceptKeyword("COMMENT")) {
      Token token = next();
      if (token.kind != Kind.STRING) {
        throw DdlTokenizer.error(token.offset, "expected comment string, got " + token);
      }
      comment = token.text;
    }
    return new DdlStatement.CreateCredential(name, replace, provider, options, comment);
  }

  private DdlStatement createExternalTable(boolean replace) {
    String name = name();
    expectKeyword("FROM");
    String provider = name();
    ExternalOptions options = options();
    return new DdlStatement.CreateExternalTable(name, replace, provider, options);
  }

  /** Parses {@code OPTIONS (...)}; absent means no options. */
  private ExternalOptions options() {
    if (!acceptKeyword("OPTIONS")) {
      return ExternalOptions.EMPTY;
    }
    expectSymbol("(");
    OptionsParser parser = new OptionsParser(tokens, pos);
    ExternalOptions options = parser.parseList();
    pos = parser.position();
    expectSymbol(")");
    return options;
  }

  private boolean ifExists() {
    if (acceptKeyword("IF")) {
      expectKeyword("EXISTS");
      return true;
    }
    return false;
  }

  private String name() {
    Token token = next();
    if (token.kind == Kind.WORD || token.kind == Kind.QUOTED_WORD) {
      return token.text;
    }
    throw DdlTokenizer.error(token.offset, "expected a name, got " + token);
  }

  private boolean acceptKeyword(String keyword) {
    if (peek().isKeyword(keyword)) {
      next();
      return true;
    }
    return false;
  }

  private void expectKeyword(String keyword) {
    if (!acceptKeyword(keyword)) {
      throw DdlTokenizer.error(peek().offset, "expected " + keyword + ", got " + peek());
    }
  }

  private void expectSymbol(String symbol) {
    Token token = next();
    if (!token.isSymbol(symbol)) {
      throw DdlTokenizer.error(token.offset, "expected '" + symbol + "', got " + token);
    }
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token next() {
    Token token = tokens.get(pos);
    if (token.kind != Kind.EOF) {
      pos++;
    }
    return token;
  }
}
