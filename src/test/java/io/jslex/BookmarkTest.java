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

import java.io.StringReader;

import static io.jslex.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

class BookmarkTest {

  private static Scanner scanner(String source) {
    Scanner scanner = new Scanner();
    scanner.initialize(new StringCharacterStream(source));
    return scanner;
  }

  @Test public void resetRestoresTokens() {
    Scanner scanner = scanner("foo bar baz qux");
    scanner.next();
    assertTrue(scanner.setBookmark());
    assertTrue(scanner.bookmarkHasBeenSet());
    assertFalse(scanner.bookmarkHasBeenReset());

    scanner.next();
    scanner.next();
    assertEquals("baz", scanner.currentLiteral().toString());
    assertEquals("qux", scanner.nextLiteral().toString());

    scanner.resetToBookmark();
    assertFalse(scanner.bookmarkHasBeenSet());
    assertTrue(scanner.bookmarkHasBeenReset());
    assertEquals(IDENTIFIER, scanner.currentToken());
    assertEquals("foo", scanner.currentLiteral().toString());
    assertEquals(new Location(0, 3), scanner.location());
    assertEquals("bar", scanner.nextLiteral().toString());
    assertEquals(new Location(4, 7), scanner.peekLocation());

    assertEquals(IDENTIFIER, scanner.next());
    assertEquals("bar", scanner.currentLiteral().toString());
    assertEquals(IDENTIFIER, scanner.next());
    assertEquals("baz", scanner.currentLiteral().toString());
    assertEquals(IDENTIFIER, scanner.next());
    assertEquals("qux", scanner.currentLiteral().toString());
    assertEquals(new Location(12, 15), scanner.location());
    assertEquals(EOS, scanner.next());
  }

  @Test public void resetRestoresLineTerminatorFlags() {
    Scanner scanner = scanner("a\nb /*\n*/ c");
    scanner.next();
    assertTrue(scanner.hasLineTerminatorBeforeNext());
    scanner.setBookmark();
    scanner.next();
    assertTrue(scanner.hasMultilineCommentBeforeNext());
    scanner.resetToBookmark();
    assertTrue(scanner.hasLineTerminatorBeforeNext());
    assertFalse(scanner.hasMultilineCommentBeforeNext());
    scanner.next();
    assertFalse(scanner.hasLineTerminatorBeforeNext());
    assertTrue(scanner.hasMultilineCommentBeforeNext());
  }

  @Test public void resetRestoresTemplateLiterals() {
    Scanner scanner = scanner("x `t\\n${y}u` z");
    scanner.next();
    assertEquals(TEMPLATE_SPAN, scanner.next());
    assertTrue(scanner.setBookmark());
    assertEquals(IDENTIFIER, scanner.next());
    assertEquals(TEMPLATE_TAIL, scanner.scanTemplateContinuation());
    assertEquals(TEMPLATE_TAIL, scanner.next());
    assertEquals("u", scanner.currentRawLiteral().toString());

    scanner.resetToBookmark();
    assertEquals(TEMPLATE_SPAN, scanner.currentToken());
    assertEquals("t\n", scanner.currentLiteral().toString());
    assertEquals("t\\n", scanner.currentRawLiteral().toString());
    assertEquals(IDENTIFIER, scanner.peek());
    assertEquals("y", scanner.nextLiteral().toString());

    scanner.next();
    assertEquals(TEMPLATE_TAIL, scanner.scanTemplateContinuation());
    assertEquals(TEMPLATE_TAIL, scanner.next());
    assertEquals("u", scanner.currentLiteral().toString());
    assertEquals(IDENTIFIER, scanner.next());
    assertEquals("z", scanner.currentLiteral().toString());
  }

  @Test public void resetRestoresErrorState() {
    Scanner scanner = scanner("a b 'oops");
    scanner.next();
    scanner.setBookmark();
    scanner.next();
    scanner.next();
    assertTrue(scanner.hasError());
    scanner.resetToBookmark();
    assertFalse(scanner.hasError());
    assertEquals(Location.INVALID, scanner.getErrorLocation());

    assertEquals(IDENTIFIER, scanner.next());
    assertEquals(ILLEGAL, scanner.next());
    assertEquals(MessageTemplate.UNTERMINATED_STRING, scanner.getError());
    assertEquals(new Location(4, 9), scanner.getErrorLocation());
  }

  @Test public void resetKeepsEarlierError() {
    Scanner scanner = scanner("# a b");
    scanner.next();
    scanner.setBookmark();
    scanner.next();
    scanner.resetToBookmark();
    assertTrue(scanner.hasError());
    assertEquals(new Location(0, 1), scanner.getErrorLocation());
  }

  @Test public void resetRestoresOctalPositions() {
    Scanner scanner = scanner("x a 017 09");
    scanner.next();
    scanner.setBookmark();
    scanner.next();
    scanner.next();
    scanner.next();
    assertTrue(scanner.octalPosition().isValid());
    assertTrue(scanner.decimalWithLeadingZeroPosition().isValid());
    scanner.resetToBookmark();
    assertFalse(scanner.octalPosition().isValid());
    assertFalse(scanner.decimalWithLeadingZeroPosition().isValid());
  }

  @Test public void resetWithSupplementaryLookahead() {
    Scanner scanner = scanner("+𝑦");
    assertTrue(scanner.setBookmark());
    assertEquals(ADD, scanner.next());
    assertEquals(IDENTIFIER, scanner.next());
    scanner.resetToBookmark();
    assertEquals(ADD, scanner.next());
    assertEquals(IDENTIFIER, scanner.next());
    assertEquals(new Location(1, 3), scanner.location());
    assertEquals("𝑦", scanner.currentLiteral().toString());
    assertEquals(EOS, scanner.next());
  }

  @Test public void bookmarkAtEndOfSource() {
    Scanner scanner = scanner("a");
    scanner.next();
    assertEquals(EOS, scanner.peek());
    assertTrue(scanner.setBookmark());
    assertEquals(EOS, scanner.next());
    scanner.resetToBookmark();
    assertEquals(IDENTIFIER, scanner.currentToken());
    assertEquals(EOS, scanner.peek());
    assertEquals(new Location(1, 2), scanner.peekLocation());
  }

  @Test public void cannotSetAfterPeekAhead() {
    Scanner scanner = scanner("a b c");
    scanner.peekAhead();
    assertFalse(scanner.setBookmark());
    assertFalse(scanner.bookmarkHasBeenSet());
    scanner.next();
    assertTrue(scanner.setBookmark());
  }

  @Test public void onlyOneBookmark() {
    Scanner scanner = scanner("a b c");
    assertTrue(scanner.setBookmark());
    assertFalse(scanner.setBookmark());
    scanner.dropBookmark();
    assertFalse(scanner.bookmarkHasBeenSet());
    assertTrue(scanner.setBookmark());
  }

  @Test public void invalidResets() {
    Scanner scanner = scanner("a b c");
    assertThrows(IllegalStateException.class, scanner::resetToBookmark);
    scanner.setBookmark();
    scanner.next();
    scanner.resetToBookmark();
    assertThrows(IllegalStateException.class, scanner::resetToBookmark);
    scanner.dropBookmark();
    assertThrows(IllegalStateException.class, scanner::resetToBookmark);
  }

  @Test public void readerSourceCannotBookmark() {
    Scanner scanner = new Scanner();
    scanner.initialize(new ReaderCharacterStream(new StringReader("a b")));
    assertFalse(scanner.setBookmark());
    assertFalse(scanner.bookmarkHasBeenSet());
    assertEquals(IDENTIFIER, scanner.next());
  }

  @Test public void bookmarkScope() {
    Scanner scanner = scanner("( a , b ) => a");
    scanner.next();
    try (Scanner.BookmarkScope bookmark = new Scanner.BookmarkScope(scanner)) {
      assertTrue(bookmark.set());
      assertTrue(bookmark.hasBeenSet());
      while (scanner.next() != ARROW) {}
      bookmark.reset();
      assertTrue(bookmark.hasBeenReset());
    }
    assertFalse(scanner.bookmarkHasBeenSet());
    assertFalse(scanner.bookmarkHasBeenReset());
    assertEquals(LPAREN, scanner.currentToken());
    assertEquals("a", scanner.nextLiteral().toString());
    assertTrue(scanner.setBookmark());
  }

  @Test public void scopeDropsUnusedBookmark() {
    Scanner scanner = scanner("a b");
    try (Scanner.BookmarkScope bookmark = new Scanner.BookmarkScope(scanner)) {
      assertTrue(bookmark.set());
      scanner.next();
    }
    assertFalse(scanner.bookmarkHasBeenSet());
    assertEquals("a", scanner.currentLiteral().toString());
  }
}
