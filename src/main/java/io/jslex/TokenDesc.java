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
 * Description of a scanned token. The literal buffers are borrowed from the
 * Scanner's pool and are only valid while this descriptor is one of the live
 * ones (current, next or next-next).
 */
class TokenDesc {
  TokenType     type            = TokenType.UNINITIALIZED;
  int           begPos          = 0;
  int           endPos          = 0;
  LiteralBuffer literalChars    = null;   // Cooked literal or null
  LiteralBuffer rawLiteralChars = null;   // Raw template text or null
  int           smiValue        = 0;      // Only valid for SMI tokens

  boolean afterLineTerminator   = false;  // Line terminator between previous token and this one
  boolean afterMultilineComment = false;  // Multi-line comment containing a line terminator before this token

  Location location() {
    return new Location(begPos, endPos);
  }

  void copyFrom(TokenDesc other) {
    type            = other.type;
    begPos          = other.begPos;
    endPos          = other.endPos;
    literalChars    = other.literalChars;
    rawLiteralChars = other.rawLiteralChars;
    smiValue        = other.smiValue;
    afterLineTerminator   = other.afterLineTerminator;
    afterMultilineComment = other.afterMultilineComment;
  }

  void clear() {
    type            = TokenType.UNINITIALIZED;
    begPos          = 0;
    endPos          = 0;
    literalChars    = null;
    rawLiteralChars = null;
    smiValue        = 0;
    afterLineTerminator   = false;
    afterMultilineComment = false;
  }

  boolean isValid() {
    return type != TokenType.UNINITIALIZED;
  }

  boolean references(LiteralBuffer buffer) {
    return literalChars == buffer || rawLiteralChars == buffer;
  }

  @Override
  public String toString() {
    return type.name() + "[" + begPos + ", " + endPos + ")" + (literalChars == null ? "" : " '" + literalChars + "'");
  }
}
