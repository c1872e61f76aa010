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
 * Flags that can follow the closing '/' of a regular expression literal
 */
public enum RegExpFlag {
  GLOBAL('g'),
  IGNORE_CASE('i'),
  MULTILINE('m'),
  UNICODE('u'),
  STICKY('y');

  public final char flagChar;

  RegExpFlag(char flagChar) {
    this.flagChar = flagChar;
  }

  /**
   * @param c  the flag character
   * @return the flag or null if c is not a valid flag
   */
  public static RegExpFlag fromChar(int c) {
    for (RegExpFlag flag: values()) {
      if (flag.flagChar == c) {
        return flag;
      }
    }
    return null;
  }
}
