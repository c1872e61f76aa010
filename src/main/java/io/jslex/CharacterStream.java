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
 * Buffered stream of UTF-16 code units. A code unit is a 16 bit value that is
 * either a BMP code point or one half of a surrogate pair.
 *
 * Subclasses keep the units that have been read from the underlying source but
 * not yet consumed in {@link #buffer} between {@link #bufferCursor} and
 * {@link #bufferEnd}. The common case of reading the next unit never leaves
 * this class.
 *
 * Note that {@link #pos()} is incremented on every call to {@link #advance()},
 * including calls at end of input. The Scanner relies on this to give the end
 * of input token a span of one code unit.
 */
public abstract class CharacterStream {
  public static final int END_OF_INPUT = -1;

  protected char[] buffer       = new char[0];
  protected int    bufferCursor = 0;
  protected int    bufferEnd    = 0;
  protected int    pos          = 0;

  private boolean lastOperationWasSeek = false;

  /**
   * Return and advance past the next code unit.
   * @return the code unit or END_OF_INPUT if there are no more
   */
  public final int advance() {
    lastOperationWasSeek = false;
    if (bufferCursor < bufferEnd || readBlock()) {
      pos++;
      return buffer[bufferCursor++];
    }
    pos++;
    return END_OF_INPUT;
  }

  /**
   * @return the number of code units consumed so far
   */
  public final int pos() {
    return pos;
  }

  /**
   * Skip forward past the given number of code units, or up to end of input if
   * that comes sooner. Units that are already buffered are used before any more
   * are read from the source.
   * @param codeUnitCount  the number of units to skip
   * @return the number of units actually skipped
   */
  public final int seekForward(int codeUnitCount) {
    if (codeUnitCount < 0) {
      throw new IllegalArgumentException("Cannot seek backwards: " + codeUnitCount);
    }
    lastOperationWasSeek = true;
    int bufferedChars = bufferEnd - bufferCursor;
    if (codeUnitCount <= bufferedChars) {
      bufferCursor += codeUnitCount;
      pos += codeUnitCount;
      return codeUnitCount;
    }
    return slowSeekForward(codeUnitCount);
  }

  /**
   * Push back the code unit returned by the most recent call to {@link #advance()}
   * (which may be END_OF_INPUT). Must not be called straight after {@link #seekForward(int)}.
   * @param codeUnit  the code unit to push back
   */
  public final void pushBack(int codeUnit) {
    if (lastOperationWasSeek) {
      throw new IllegalStateException("Internal error: pushBack() invoked straight after seekForward()");
    }
    if (pos == 0) {
      throw new IllegalStateException("Internal error: pushBack() invoked at start of stream");
    }
    pos--;
    if (codeUnit == END_OF_INPUT) {
      // Nothing was taken from the buffer when we hit the end of the input
      return;
    }
    if (bufferCursor > 0) {
      buffer[--bufferCursor] = (char) codeUnit;
      return;
    }
    slowPushBack((char) codeUnit);
  }

  /**
   * Remember the current position so that we can later return to it.
   * @return false if this stream does not support bookmarks
   */
  public boolean setBookmark() {
    return false;
  }

  /**
   * Return to the position saved by the last successful {@link #setBookmark()}.
   */
  public void resetToBookmark() {
    throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support bookmarks");
  }

  /**
   * Ensure that bufferCursor points to the code unit at {@link #pos} of the input.
   * @return false if at or after end of input
   */
  protected abstract boolean readBlock();

  /**
   * Called by {@link #seekForward(int)} when there are not enough buffered units.
   * @param codeUnitCount  the number of units to skip
   * @return the number of units actually skipped
   */
  protected abstract int slowSeekForward(int codeUnitCount);

  /**
   * Called by {@link #pushBack(int)} when the cursor is at the start of the buffer.
   * @param codeUnit  the unit to push back
   */
  protected abstract void slowPushBack(char codeUnit);
}
