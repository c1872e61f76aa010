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

/**
 * Collector of the characters of one literal (identifier, string, number,
 * template span or regular expression).
 *
 * The buffer starts out narrow, storing one byte per Latin-1 character. The
 * first character that does not fit widens the buffer in place to two bytes
 * (little endian UTF-16) per code unit; after that it stays wide until the
 * next {@link #reset()}. Characters outside the BMP are stored as a surrogate
 * pair, both halves being appended by the same call.
 *
 * Growth is geometric but each growth step is capped so that a single append
 * never copies more than a bounded amount of extra space.
 */
public final class LiteralBuffer implements CharSequence {
  private static final int    INITIAL_CAPACITY  = 16;
  private static final int    GROWTH_FACTOR     = 4;
  private static final int    MAX_GROWTH        = 1024 * 1024;
  private static final int    MAX_ONE_BYTE_CHAR = 0xFF;
  private static final byte[] EMPTY             = new byte[0];

  private boolean isOneByte    = true;
  private int     position     = 0;       // Number of bytes used in backingStore
  private byte[]  backingStore = EMPTY;

  public LiteralBuffer() {}

  /**
   * Append a character. Code points above 0xFFFF are appended as two code units.
   * @param codePoint  the code unit or code point to append
   */
  public void addChar(int codePoint) {
    if (isOneByte) {
      if (codePoint <= MAX_ONE_BYTE_CHAR) {
        ensureCapacity(1);
        backingStore[position++] = (byte) codePoint;
        return;
      }
      convertToTwoByte();
    }
    if (codePoint <= Character.MAX_VALUE) {
      ensureCapacity(2);
      putCodeUnit(codePoint);
    }
    else {
      // Make room for both halves before writing either of them
      ensureCapacity(4);
      putCodeUnit(Character.highSurrogate(codePoint));
      putCodeUnit(Character.lowSurrogate(codePoint));
    }
  }

  public boolean isOneByte() {
    return isOneByte;
  }

  /**
   * @return the number of characters (code units when wide)
   */
  @Override
  public int length() {
    return isOneByte ? position : (position >> 1);
  }

  @Override
  public char charAt(int index) {
    if (index < 0 || index >= length()) {
      throw new IndexOutOfBoundsException("Index " + index + " out of range for literal of length " + length());
    }
    if (isOneByte) {
      return (char) (backingStore[index] & 0xFF);
    }
    int offset = index << 1;
    return (char) ((backingStore[offset] & 0xFF) | ((backingStore[offset + 1] & 0xFF) << 8));
  }

  @Override
  public CharSequence subSequence(int start, int end) {
    return toString().subSequence(start, end);
  }

  /**
   * Remove the last characters of the literal
   * @param delta  number of characters to remove
   */
  public void reduceLength(int delta) {
    if (delta < 0 || delta > length()) {
      throw new IllegalArgumentException("Cannot reduce literal of length " + length() + " by " + delta);
    }
    position -= delta * (isOneByte ? 1 : 2);
  }

  public void reset() {
    position  = 0;
    isOneByte = true;
  }

  /**
   * Make this buffer a copy of another one.
   * @param other  the buffer to copy or null to just reset this one
   */
  public void copyFrom(LiteralBuffer other) {
    if (other == null) {
      reset();
      return;
    }
    isOneByte = other.isOneByte;
    position  = 0;
    ensureCapacity(other.position);
    System.arraycopy(other.backingStore, 0, backingStore, 0, other.position);
    position  = other.position;
  }

  /**
   * Check for an exact match against a keyword. Only narrow buffers can match
   * since keywords are ASCII.
   * @param keyword  the keyword
   * @return true if buffer is narrow and holds exactly the keyword
   */
  public boolean isContextualKeyword(String keyword) {
    if (!isOneByte || keyword.length() != position) {
      return false;
    }
    for (int i = 0; i < position; i++) {
      if (backingStore[i] != (byte) keyword.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  public byte[] oneByteLiteral() {
    if (!isOneByte) {
      throw new IllegalStateException("Internal error: literal is not one byte");
    }
    return Arrays.copyOf(backingStore, position);
  }

  public char[] twoByteLiteral() {
    if (isOneByte) {
      throw new IllegalStateException("Internal error: literal is not two byte");
    }
    char[] chars = new char[position >> 1];
    for (int i = 0; i < chars.length; i++) {
      chars[i] = charAt(i);
    }
    return chars;
  }

  @Override
  public String toString() {
    return new String(backingStore, 0, position, isOneByte ? StandardCharsets.ISO_8859_1 : StandardCharsets.UTF_16LE);
  }

  //////////////////////////////////////////////

  // Raw access for DuplicateFinder which hashes the encoded bytes directly
  byte[] backingStore() { return backingStore; }
  int    byteLength()   { return position; }

  int capacity()        { return backingStore.length; }

  private void putCodeUnit(int codeUnit) {
    backingStore[position++] = (byte) codeUnit;
    backingStore[position++] = (byte) (codeUnit >>> 8);
  }

  private void ensureCapacity(int extraBytes) {
    int required = position + extraBytes;
    if (required > backingStore.length) {
      expandBuffer(required);
    }
  }

  private int newCapacity(int minCapacity) {
    int capacity = backingStore.length;
    if (capacity == 0) {
      return Math.max(INITIAL_CAPACITY, minCapacity);
    }
    long grown = Math.min((long) capacity * GROWTH_FACTOR, (long) capacity + MAX_GROWTH);
    return (int) Math.max(grown, minCapacity);
  }

  private void expandBuffer(int minCapacity) {
    backingStore = Arrays.copyOf(backingStore, newCapacity(minCapacity));
  }

  private void convertToTwoByte() {
    int newContentSize = position * 2;
    if (newContentSize > backingStore.length) {
      expandBuffer(newContentSize);
    }
    // Copy backwards so that we can widen in place
    for (int i = position - 1; i >= 0; i--) {
      byte b = backingStore[i];
      backingStore[2 * i]     = b;
      backingStore[2 * i + 1] = 0;
    }
    position  = newContentSize;
    isOneByte = false;
  }
}
