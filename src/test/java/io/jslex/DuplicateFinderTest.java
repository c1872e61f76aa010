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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DuplicateFinderTest {

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.ISO_8859_1);
  }

  @Test public void firstValueWins() {
    DuplicateFinder finder = new DuplicateFinder();
    assertEquals(1, finder.addOneByteSymbol(bytes("foo"), 1));
    assertEquals(2, finder.addOneByteSymbol(bytes("bar"), 2));
    assertEquals(1, finder.addOneByteSymbol(bytes("foo"), 3));
    assertEquals(2, finder.addOneByteSymbol(bytes("bar"), 4));
    assertEquals(2, finder.size());
  }

  @Test public void widthIsPartOfKey() {
    DuplicateFinder finder = new DuplicateFinder();
    // Same bytes but one is the narrow form of "a\0" and the other the wide form of "a"
    assertEquals(1, finder.addOneByteSymbol(new byte[]{ 0x61, 0 }, 1));
    assertEquals(2, finder.addTwoByteSymbol(new char[]{ 'a' }, 2));
    assertEquals(1, finder.addOneByteSymbol(new byte[]{ 0x61, 0 }, 3));
    assertEquals(2, finder.addTwoByteSymbol(new char[]{ 'a' }, 4));
    assertEquals(2, finder.size());
  }

  @Test public void twoByteSymbols() {
    DuplicateFinder finder = new DuplicateFinder();
    assertEquals(7, finder.addTwoByteSymbol("αβγ".toCharArray(), 7));
    assertEquals(8, finder.addTwoByteSymbol("αβδ".toCharArray(), 8));
    assertEquals(7, finder.addTwoByteSymbol("αβγ".toCharArray(), 9));
  }

  @Test public void emptyKey() {
    DuplicateFinder finder = new DuplicateFinder();
    assertEquals(1, finder.addOneByteSymbol(new byte[0], 1));
    assertEquals(1, finder.addOneByteSymbol(new byte[0], 2));
    assertEquals(2, finder.addTwoByteSymbol(new char[0], 2));
  }

  @Test public void numbersAreCanonicalised() {
    DuplicateFinder finder = new DuplicateFinder();
    assertEquals(1, finder.addNumber("1", 1));
    assertEquals(1, finder.addNumber("1.0", 2));
    assertEquals(1, finder.addNumber("0x1", 3));
    assertEquals(1, finder.addNumber("1e0", 4));
    assertEquals(1, finder.addNumber("0b1", 5));
    assertEquals(6, finder.addNumber("1.5", 6));
    assertEquals(6, finder.addNumber("15e-1", 7));
    assertEquals(8, finder.addNumber("1e400", 8));
    assertEquals(8, finder.addNumber("2e400", 9));
    assertEquals(3, finder.size());
  }

  @Test public void fractionWithoutIntegerPart() {
    DuplicateFinder finder = new DuplicateFinder();
    assertEquals(1, finder.addNumber("0.5", 1));
    assertEquals(1, finder.addNumber(".5", 2));
    assertEquals(1, finder.addNumber("5e-1", 3));

    finder = new DuplicateFinder();
    assertEquals(1, finder.addNumber(".5", 1));
    assertEquals(1, finder.addNumber("0.5", 2));
    assertEquals(1, finder.addOneByteSymbol(bytes("0.5"), 3));
    assertEquals(1, finder.size());
  }

  @Test public void scannedNumbers() {
    DuplicateFinder finder  = new DuplicateFinder();
    Scanner         scanner = new Scanner();
    scanner.initialize(new StringCharacterStream(".25 0.25 1.50 1.5 0x0A 10"));
    int[] expected = { 0, 0, 2, 2, 4, 4 };
    for (int i = 0; i < expected.length; i++) {
      assertTrue(scanner.next().isNumber());
      assertEquals(expected[i], finder.addNumber(scanner.currentLiteral(), i), scanner.currentLiteral().toString());
    }
    assertEquals(3, finder.size());
  }

  @Test public void numberMatchesStringKey() {
    DuplicateFinder finder = new DuplicateFinder();
    assertEquals(1, finder.addOneByteSymbol(bytes("10"), 1));
    assertEquals(1, finder.addNumber("0xa", 2));
  }

  @Test public void longKeys() {
    DuplicateFinder finder = new DuplicateFinder();
    byte[] key = bytes("k".repeat(100));
    assertEquals(1, finder.addOneByteSymbol(key, 1));
    for (int i = 0; i < 50; i++) {
      assertEquals(1, finder.addOneByteSymbol(key, i + 2));
    }
    byte[] other = bytes("k".repeat(99) + "j");
    assertEquals(3, finder.addOneByteSymbol(other, 3));
    assertEquals(2, finder.size());
  }

  @Test public void manyKeys() {
    DuplicateFinder finder = new DuplicateFinder();
    for (int i = 0; i < 1000; i++) {
      assertEquals(i, finder.addOneByteSymbol(bytes("key" + i), i));
    }
    for (int i = 0; i < 1000; i++) {
      assertEquals(i, finder.addOneByteSymbol(bytes("key" + i), -1));
    }
    assertEquals(1000, finder.size());
  }

  @Test public void canonicalNumberCheck() {
    assertTrue(DuplicateFinder.isNumberCanonical("0"));
    assertTrue(DuplicateFinder.isNumberCanonical("123"));
    assertTrue(DuplicateFinder.isNumberCanonical("0.5"));
    assertTrue(DuplicateFinder.isNumberCanonical("12.25"));
    assertFalse(DuplicateFinder.isNumberCanonical(""));
    assertFalse(DuplicateFinder.isNumberCanonical("01"));
    assertFalse(DuplicateFinder.isNumberCanonical("1.0"));
    assertFalse(DuplicateFinder.isNumberCanonical("1."));
    assertFalse(DuplicateFinder.isNumberCanonical(".5"));
    assertFalse(DuplicateFinder.isNumberCanonical("."));
    assertFalse(DuplicateFinder.isNumberCanonical("1e5"));
    assertFalse(DuplicateFinder.isNumberCanonical("0x10"));
    assertFalse(DuplicateFinder.isNumberCanonical("1234567890123456"));
  }

  @Test public void hashValues() {
    assertEquals(1, DuplicateFinder.hash(new byte[0], 0, 0, true));
    assertEquals(103973, DuplicateFinder.hash(bytes("a"), 0, 1, true));
    assertEquals(107130720, DuplicateFinder.hash(bytes("ab"), 0, 2, true));
    assertEquals(106122172, DuplicateFinder.hash(new byte[]{ 0x61, 0 }, 0, 2, false));
  }
}
