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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Detects repeated property keys (for example in an object literal). Each distinct
 * key is stored once in an append-only byte store, encoded as a base-128 length
 * prefix (which also carries whether the key is one byte or two byte) followed by
 * the bytes of the key. A hash index over the encoded keys gives the value that was
 * stored when the key was first added.
 *
 * <p>Numeric keys are canonicalised first so that {@code 1}, {@code 1.0} and
 * {@code 0x1} are all the same key.</p>
 */
public class DuplicateFinder {
  private static final int INITIAL_CAPACITY = 64;

  private byte[] backingStore = new byte[INITIAL_CAPACITY];
  private int    storeLength  = 0;

  private final Map<EncodedKey,Integer> index = new HashMap<>();

  /**
   * Add a one byte (Latin-1) symbol.
   * @param key    the bytes of the symbol
   * @param value  the value to associate with the symbol if not already present
   * @return value if the symbol is new or the value stored when it was first added
   */
  public int addOneByteSymbol(byte[] key, int value) {
    return addSymbol(key, 0, key.length, true, value);
  }

  /**
   * Add a two byte (UTF-16) symbol.
   * @param key    the code units of the symbol
   * @param value  the value to associate with the symbol if not already present
   * @return value if the symbol is new or the value stored when it was first added
   */
  public int addTwoByteSymbol(char[] key, int value) {
    byte[] bytes = new byte[key.length * 2];
    for (int i = 0; i < key.length; i++) {
      bytes[2 * i]     = (byte) key[i];
      bytes[2 * i + 1] = (byte) (key[i] >> 8);
    }
    return addSymbol(bytes, 0, bytes.length, false, value);
  }

  /**
   * Add a numeric literal. The literal is first converted to the canonical string
   * for its value so that different spellings of the same number are the same key.
   * @param literal  the text of the numeric literal
   * @param value    the value to associate with the number if not already present
   * @return value if the number is new or the value stored when it was first added
   */
  public int addNumber(CharSequence literal, int value) {
    String canonical;
    if (isNumberCanonical(literal)) {
      canonical = literal.toString();
    }
    else {
      double number = NumberConversions.stringToDouble(literal);
      canonical = Double.isInfinite(number) ? "Infinity" : NumberConversions.doubleToString(number);
    }
    return addOneByteSymbol(canonical.getBytes(StandardCharsets.ISO_8859_1), value);
  }

  /**
   * @return number of distinct keys added so far
   */
  public int size() {
    return index.size();
  }

  int addSymbol(byte[] key, int offset, int length, boolean isOneByte, int value) {
    int        hash    = hash(key, offset, length, isOneByte);
    EncodedKey encoded = backupKey(key, offset, length, isOneByte, hash);
    Integer    existing = index.putIfAbsent(encoded, value);
    if (existing != null) {
      // Already have this key so undo the tentative encoding
      storeLength = encoded.offset;
      return existing;
    }
    return value;
  }

  /**
   * Quick check for literals that are already in canonical form: at most 15 digits,
   * a non-empty integer part with no leading zeros other than a single zero, and no
   * trailing zeros after the decimal point.
   */
  static boolean isNumberCanonical(CharSequence number) {
    int length = number.length();
    if (length == 0 || length > 15) {
      return false;
    }
    int pos = 0;
    if (number.charAt(pos) == '0') {
      pos++;
    }
    else {
      while (pos < length && CharPredicates.isDecimalDigit(number.charAt(pos))) { pos++; }
      if (pos == 0) {
        return false;     // No integer part (e.g. ".5")
      }
    }
    if (pos == length) {
      return true;
    }
    if (number.charAt(pos) != '.') {
      return false;
    }
    pos++;
    boolean invalidLastDigit = true;
    while (pos < length) {
      char c = number.charAt(pos);
      if (!CharPredicates.isDecimalDigit(c)) {
        return false;
      }
      invalidLastDigit = c == '0';
      pos++;
    }
    return !invalidLastDigit;
  }

  static int hash(byte[] key, int offset, int length, boolean isOneByte) {
    int hash = (length << 1) | (isOneByte ? 1 : 0);
    for (int i = offset; i < offset + length; i++) {
      int c = key[i] & 0xFF;
      hash = (hash + c) * 1025;
      hash ^= hash >>> 6;
    }
    return hash;
  }

  /**
   * Append the encoded form of the key to the store. The length is written most
   * significant group first, seven bits per byte, with the top bit set on all but
   * the last byte.
   */
  private EncodedKey backupKey(byte[] key, int offset, int length, boolean isOneByte, int hash) {
    int start         = storeLength;
    int oneByteLength = (length << 1) | (isOneByte ? 1 : 0);
    int groups        = 1;
    for (int remaining = oneByteLength >>> 7; remaining != 0; remaining >>>= 7) {
      groups++;
    }
    ensureCapacity(groups + length);
    for (int shift = (groups - 1) * 7; shift > 0; shift -= 7) {
      backingStore[storeLength++] = (byte) (0x80 | ((oneByteLength >>> shift) & 0x7F));
    }
    backingStore[storeLength++] = (byte) (oneByteLength & 0x7F);
    System.arraycopy(key, offset, backingStore, storeLength, length);
    storeLength += length;
    return new EncodedKey(start, storeLength - start, hash);
  }

  private void ensureCapacity(int extra) {
    if (storeLength + extra > backingStore.length) {
      backingStore = Arrays.copyOf(backingStore, Math.max(backingStore.length * 2, storeLength + extra));
    }
  }

  /**
   * Key into the backing store. Equal keys have identical encodings so equality
   * is a straight byte comparison.
   */
  private class EncodedKey {
    final int offset;
    final int length;
    final int hash;

    EncodedKey(int offset, int length, int hash) {
      this.offset = offset;
      this.length = length;
      this.hash   = hash;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof EncodedKey)) {
        return false;
      }
      EncodedKey other = (EncodedKey) obj;
      return hash == other.hash &&
             Arrays.equals(backingStore, offset, offset + length,
                           backingStore, other.offset, other.offset + other.length);
    }

    @Override
    public int hashCode() {
      return hash;
    }
  }
}
