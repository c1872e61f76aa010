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
 * Kinds of lexical error latched by the Scanner. Rendering these into
 * user visible text is left to whoever consumes the tokens.
 */
public enum MessageTemplate {
  INVALID_OR_UNEXPECTED_TOKEN,
  UNTERMINATED_STRING,
  UNTERMINATED_TEMPLATE,
  UNTERMINATED_COMMENT,
  INVALID_HEX_ESCAPE_SEQUENCE,
  INVALID_UNICODE_ESCAPE_SEQUENCE,
  UNDEFINED_UNICODE_CODE_POINT,
  MALFORMED_NUMERIC_LITERAL,
  TEMPLATE_OCTAL_LITERAL,
  UNTERMINATED_REG_EXP,
  MALFORMED_REG_EXP_FLAGS
}
