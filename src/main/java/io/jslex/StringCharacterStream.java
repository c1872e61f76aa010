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
 * CharacterStream over an in-memory CharSequence. Since the whole source is
 * available this stream supports bookmarks.
 */
public class StringCharacterStream extends BufferedCharacterStream {
  private final CharSequence source;
  private final int          start;
  private final int          length;
  private       int          bookmark = -1;

  public StringCharacterStream(CharSequence source) {
    this(source, 0, source.length());
  }

  /**
   * Stream over a subsequence of the source. Positions reported by the stream
   * are relative to startPosition.
   * @param source         the source
   * @param startPosition  offset of first unit to stream
   * @param endPosition    offset after the last unit to stream
   */
  public StringCharacterStream(CharSequence source, int startPosition, int endPosition) {
    if (startPosition < 0 || endPosition > source.length() || startPosition > endPosition) {
      throw new IllegalArgumentException("Invalid range [" + startPosition + ", " + endPosition + ") for source of length " + source.length());
    }
    this.source = source;
    this.start  = startPosition;
    this.length = endPosition - startPosition;
  }

  @Override
  protected int fillBuffer(int fromPos) {
    int count = Math.min(buffer.length, length - fromPos);
    if (count <= 0) {
      return 0;
    }
    int offset = start + fromPos;
    for (int i = 0; i < count; i++) {
      buffer[i] = source.charAt(offset + i);
    }
    return count;
  }

  @Override
  protected int slowSeekForward(int codeUnitCount) {
    int skipped = Math.max(0, Math.min(codeUnitCount, length - pos));
    pos += skipped;
    // Buffer no longer lines up with pos so force a refill
    bufferCursor = bufferEnd = 0;
    return skipped;
  }

  @Override
  public boolean setBookmark() {
    bookmark = pos;
    return true;
  }

  @Override
  public void resetToBookmark() {
    if (bookmark < 0) {
      throw new IllegalStateException("Internal error: resetToBookmark() invoked without bookmark");
    }
    pos = bookmark;
    bufferCursor = bufferEnd = 0;
  }
}
