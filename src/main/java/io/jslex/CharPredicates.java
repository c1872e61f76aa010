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
 * ECMAScript character classes used when scanning. All predicates take a full
 * code point (or CharacterStream.END_OF_INPUT, which never matches).
 */
final class CharPredicates {

  private static final int ZWNJ = 0x200C;    // Zero width non-joiner
  private static final int ZWJ  = 0x200D;    // Zero width joiner
  private static final int BOM  = 0xFEFF;
  private static final int LINE_SEPARATOR      = 0x2028;
  private static final int PARAGRAPH_SEPARATOR = 0x2029;

  private CharPredicates() {}

  static boolean isIdentifierStart(int c) {
    if (c < 0) {
      return false;
    }
    if (c < 0x80) {
      return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '$' || c == '_';
    }
    return Character.isUnicodeIdentifierStart(c);
  }

  static boolean isIdentifierPart(int c) {
    if (c < 0) {
      return false;
    }
    if (c < 0x80) {
      return isIdentifierStart(c) || isDecimalDigit(c);
    }
    if (c == ZWNJ || c == ZWJ) {
      return true;
    }
    // Java treats format and control characters as ignorable identifier parts but ECMAScript does not
    return Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c);
  }

  static boolean isLineTerminator(int c) {
    return c == '\n' || c == '\r' || c == LINE_SEPARATOR || c == PARAGRAPH_SEPARATOR;
  }

  static boolean isWhiteSpace(int c) {
    switch (c) {
      case '\t':
      case 0x0B:
      case '\f':
      case ' ':
      case 0xA0:
      case BOM:
        return true;
      default:
        return c > 0xFF && c <= 0xFFFF && Character.getType(c) == Character.SPACE_SEPARATOR;
    }
  }

  static boolean isWhiteSpaceOrLineTerminator(int c) {
    return isWhiteSpace(c) || isLineTerminator(c);
  }

  static boolean isDecimalDigit(int c) {
    return c >= '0' && c <= '9';
  }

  static boolean isOctalDigit(int c) {
    return c >= '0' && c <= '7';
  }

  static boolean isBinaryDigit(int c) {
    return c == '0' || c == '1';
  }

  static boolean isHexDigit(int c) {
    return hexValue(c) >= 0;
  }

  /**
   * Value of a hex digit
   * @param c  the character
   * @return the value 0-15 or -1 if not a hex digit
   */
  static int hexValue(int c) {
    if (c >= '0' && c <= '9') { return c - '0'; }
    if (c >= 'a' && c <= 'f') { return c - 'a' + 10; }
    if (c >= 'A' && c <= 'F') { return c - 'A' + 10; }
    return -1;
  }
}
