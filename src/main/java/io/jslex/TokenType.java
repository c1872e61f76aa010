/*
 * Copyright © 2022,2023 James Crawford
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package io.jslex;

/**
 * Enum for the different token types produced by the Scanner
 */
public enum TokenType {
  //= Punctuators
  LPAREN("("),
  RPAREN(")"),
  LBRACK("["),
  RBRACK("]"),
  LBRACE("{"),
  RBRACE("}"),
  COLON(":"),
  SEMICOLON(";"),
  PERIOD("."),
  ELLIPSIS("..."),
  CONDITIONAL("?"),
  INC("++"),
  DEC("--"),
  ARROW("=>"),

  //= Assignment operators
  ASSIGN("="),
  ASSIGN_BIT_OR("|="),
  ASSIGN_BIT_XOR("^="),
  ASSIGN_BIT_AND("&="),
  ASSIGN_SHL("<<="),
  ASSIGN_SAR(">>="),
  ASSIGN_SHR(">>>="),
  ASSIGN_ADD("+="),
  ASSIGN_SUB("-="),
  ASSIGN_MUL("*="),
  ASSIGN_DIV("/="),
  ASSIGN_MOD("%="),
  ASSIGN_EXP("**="),

  //= Binary operators
  COMMA(","),
  OR("||"),
  AND("&&"),
  BIT_OR("|"),
  BIT_XOR("^"),
  BIT_AND("&"),
  SHL("<<"),
  SAR(">>"),
  SHR(">>>"),
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  MOD("%"),
  EXP("**"),

  //= Compare operators
  EQ("=="),
  NE("!="),
  EQ_STRICT("==="),
  NE_STRICT("!=="),
  LT("<"),
  GT(">"),
  LTE("<="),
  GTE(">="),
  INSTANCEOF("instanceof"),
  IN("in"),

  //= Unary operators
  NOT("!"),
  BIT_NOT("~"),
  DELETE("delete"),
  TYPEOF("typeof"),
  VOID("void"),

  //= Keywords
  BREAK("break"),
  CASE("case"),
  CATCH("catch"),
  CONTINUE("continue"),
  DEBUGGER("debugger"),
  DEFAULT("default"),
  DO("do"),
  ELSE("else"),
  FINALLY("finally"),
  FOR("for"),
  FUNCTION("function"),
  IF("if"),
  NEW("new"),
  RETURN("return"),
  SWITCH("switch"),
  THIS("this"),
  THROW("throw"),
  TRY("try"),
  VAR("var"),
  WHILE("while"),
  WITH("with"),
  CLASS("class"),
  CONST("const"),
  ENUM("enum"),
  EXPORT("export"),
  EXTENDS("extends"),
  IMPORT("import"),
  SUPER("super"),
  LET("let"),
  STATIC("static"),
  YIELD("yield"),

  //= Literals
  NULL_LITERAL("null"),
  TRUE_LITERAL("true"),
  FALSE_LITERAL("false"),
  NUMBER(),
  SMI(),
  STRING(),
  REGEXP_LITERAL(),

  //= Identifiers (not keywords or future reserved words)
  IDENTIFIER(),
  FUTURE_STRICT_RESERVED_WORD(),
  ESCAPED_KEYWORD(),
  ESCAPED_STRICT_RESERVED_WORD(),

  //= Template literals
  TEMPLATE_SPAN(),
  TEMPLATE_TAIL(),

  //= Special
  ILLEGAL(),        // Illegal token (error already latched by Scanner)
  EOS(),            // End of source

  // Internal use only
  WHITESPACE(),
  UNINITIALIZED();

  public final String asString;

  TokenType(String str) {
    this.asString = str;
  }
  TokenType()           { this.asString = null; }

  public boolean is(TokenType... types) {
    for (TokenType type: types) {
      if (this == type) {
        return true;
      }
    }
    return false;
  }

  /**
   * Keywords are the tokens whose fixed text is a valid identifier
   * @return true if token is a keyword
   */
  public boolean isKeyword() {
    if (asString == null) {
      return false;
    }
    for (int i = 0; i < asString.length(); i++) {
      if (!Character.isLetter(asString.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  public boolean isAssignmentOp() {
    return ordinal() >= ASSIGN.ordinal() && ordinal() <= ASSIGN_EXP.ordinal();
  }

  public boolean isBinaryOp() {
    return ordinal() >= COMMA.ordinal() && ordinal() <= EXP.ordinal();
  }

  public boolean isCompareOp() {
    return ordinal() >= EQ.ordinal() && ordinal() <= IN.ordinal();
  }

  public boolean isUnaryOp() {
    return this.is(NOT, BIT_NOT, DELETE, TYPEOF, VOID, ADD, SUB);
  }

  public boolean isCountOp() {
    return this.is(INC, DEC);
  }

  /**
   * Words that are identifiers in sloppy mode but reserved in strict mode
   * @return true if strict reserved word
   */
  public boolean isStrictReservedWord() {
    return this.is(FUTURE_STRICT_RESERVED_WORD, LET, STATIC, YIELD, ESCAPED_STRICT_RESERVED_WORD);
  }

  public boolean isNumber()   { return this.is(NUMBER, SMI); }
  public boolean isTemplate() { return this.is(TEMPLATE_SPAN, TEMPLATE_TAIL); }

  @Override
  public String toString() {
    return asString != null ? asString : super.toString();
  }
}
