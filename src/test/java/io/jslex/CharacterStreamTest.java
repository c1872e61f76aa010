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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;

import static io.jslex.CharacterStream.END_OF_INPUT;
import static org.junit.jupiter.api.Assertions.*;

class CharacterStreamTest {

  private static String source(int length) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < length; i++) {
      sb.append((char) ('a' + (i % 26)));
    }
    return sb.toString();
  }

  @Test public void advanceAndPos() {
    CharacterStream stream = new StringCharacterStream("ab");
    assertEquals(0, stream.pos());
    assertEquals('a', stream.advance());
    assertEquals(1, stream.pos());
    assertEquals('b', stream.advance());
    assertEquals(2, stream.pos());
    // Position keeps moving at end of input
    assertEquals(END_OF_INPUT, stream.advance());
    assertEquals(3, stream.pos());
    assertEquals(END_OF_INPUT, stream.advance());
    assertEquals(4, stream.pos());
  }

  @Test public void emptySource() {
    CharacterStream stream = new StringCharacterStream("");
    assertEquals(END_OF_INPUT, stream.advance());
    assertEquals(1, stream.pos());
    stream.pushBack(END_OF_INPUT);
    assertEquals(0, stream.pos());
    assertEquals(END_OF_INPUT, stream.advance());
  }

  @Test public void pushBack() {
    CharacterStream stream = new StringCharacterStream("abc");
    assertThrows(IllegalStateException.class, () -> stream.pushBack('x'));
    stream.advance();
    int c = stream.advance();
    assertEquals('b', c);
    stream.pushBack(c);
    assertEquals(1, stream.pos());
    assertEquals('b', stream.advance());
    assertEquals('c', stream.advance());

    int eof = stream.advance();
    assertEquals(END_OF_INPUT, eof);
    stream.pushBack(eof);
    assertEquals(3, stream.pos());
    stream.pushBack('c');
    stream.pushBack('b');
    assertEquals(1, stream.pos());
    assertEquals('b', stream.advance());
    assertEquals('c', stream.advance());
    assertEquals(END_OF_INPUT, stream.advance());
  }

  @Test public void seekForward() {
    CharacterStream stream = new StringCharacterStream("abcdef");
    stream.advance();
    assertEquals(3, stream.seekForward(3));
    assertEquals(4, stream.pos());
    assertEquals('e', stream.advance());
    assertThrows(IllegalArgumentException.class, () -> stream.seekForward(-1));

    // Seek is limited by end of input
    assertEquals(1, stream.seekForward(10));
    assertEquals(6, stream.pos());
    assertEquals(END_OF_INPUT, stream.advance());
  }

  @Test public void pushBackAfterSeek() {
    CharacterStream stream = new StringCharacterStream("abcdef");
    stream.advance();
    stream.seekForward(2);
    assertThrows(IllegalStateException.class, () -> stream.pushBack('c'));
    assertEquals('d', stream.advance());
    stream.pushBack('d');
    assertEquals('d', stream.advance());
  }

  @Test public void bookmarks() {
    CharacterStream stream = new StringCharacterStream("abcdef");
    assertThrows(IllegalStateException.class, stream::resetToBookmark);
    stream.advance();
    stream.advance();
    assertTrue(stream.setBookmark());
    assertEquals('c', stream.advance());
    assertEquals('d', stream.advance());
    stream.resetToBookmark();
    assertEquals(2, stream.pos());
    assertEquals('c', stream.advance());

    // Reset can be repeated
    stream.seekForward(3);
    stream.resetToBookmark();
    assertEquals(2, stream.pos());
    assertEquals('c', stream.advance());
  }

  @Test public void subRange() {
    CharacterStream stream = new StringCharacterStream("xxabcxx", 2, 5);
    assertEquals('a', stream.advance());
    assertEquals(1, stream.pos());
    assertEquals('b', stream.advance());
    assertEquals('c', stream.advance());
    assertEquals(END_OF_INPUT, stream.advance());
    assertThrows(IllegalArgumentException.class, () -> new StringCharacterStream("abc", 2, 1));
    assertThrows(IllegalArgumentException.class, () -> new StringCharacterStream("abc", 0, 4));
    assertThrows(IllegalArgumentException.class, () -> new StringCharacterStream("abc", -1, 2));
  }

  @Test public void longStringSource() {
    String          src    = source(1200);
    CharacterStream stream = new StringCharacterStream(src);
    for (int i = 0; i < 600; i++) {
      assertEquals(src.charAt(i), stream.advance());
    }
    assertEquals(600, stream.seekForward(600));
    assertEquals(END_OF_INPUT, stream.advance());
  }

  @Test public void readerSeekAcrossBlocks() {
    String          src    = source(1200);
    CharacterStream stream = new ReaderCharacterStream(new StringReader(src));
    assertEquals(1000, stream.seekForward(1000));
    assertEquals(1000, stream.pos());
    assertEquals(src.charAt(1000), stream.advance());
    assertEquals(199, stream.seekForward(500));
    assertEquals(1200, stream.pos());
    assertEquals(END_OF_INPUT, stream.advance());
  }

  @Test public void readerPushBackAcrossBlocks() {
    String          src    = source(1200);
    CharacterStream stream = new ReaderCharacterStream(new StringReader(src));
    for (int i = 0; i < 513; i++) {
      assertEquals(src.charAt(i), stream.advance());
    }
    // Second unit pushed back no longer fits in front of the current block
    stream.pushBack(src.charAt(512));
    stream.pushBack(src.charAt(511));
    assertEquals(511, stream.pos());
    for (int i = 511; i < src.length(); i++) {
      assertEquals(src.charAt(i), stream.advance());
    }
    assertEquals(END_OF_INPUT, stream.advance());
  }

  @Test public void readerHasNoBookmarks() {
    CharacterStream stream = new ReaderCharacterStream(new StringReader("abc"));
    assertFalse(stream.setBookmark());
    assertThrows(UnsupportedOperationException.class, stream::resetToBookmark);
  }

  @Test public void readerError() {
    Reader failing = new Reader() {
      @Override public int read(char[] cbuf, int off, int len) throws IOException {
        throw new IOException("disk on fire");
      }
      @Override public void close() {}
    };
    CharacterStream stream = new ReaderCharacterStream(failing);
    UncheckedIOException e = assertThrows(UncheckedIOException.class, stream::advance);
    assertTrue(e.getMessage().contains("position 0"));
    assertEquals("disk on fire", e.getCause().getMessage());
  }
}
