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

import java.util.Arrays;

/**
 * CharacterStream that reads its source in blocks into a fixed size buffer.
 * Subclasses only need to know how to fill the buffer starting at a given
 * position.
 */
public abstract class BufferedCharacterStream extends CharacterStream {
  protected static final int BUFFER_SIZE = 512;

  protected BufferedCharacterStream() {
    buffer = new char[BUFFER_SIZE];
  }

  /**
   * Fill {@link #buffer} starting at index 0 with the code units that start at
   * the given position of the source.
   * @param fromPos  position in the source of the first unit wanted
   * @return the number of units placed in the buffer (0 at end of input)
   */
  protected abstract int fillBuffer(int fromPos);

  @Override
  protected boolean readBlock() {
    bufferCursor = 0;
    bufferEnd    = fillBuffer(pos);
    return bufferEnd > 0;
  }

  @Override
  protected int slowSeekForward(int codeUnitCount) {
    int skipped = 0;
    while (skipped < codeUnitCount) {
      int buffered = bufferEnd - bufferCursor;
      if (buffered == 0) {
        if (!readBlock()) {
          break;
        }
        continue;
      }
      int step = Math.min(buffered, codeUnitCount - skipped);
      bufferCursor += step;
      pos          += step;
      skipped      += step;
    }
    return skipped;
  }

  @Override
  protected void slowPushBack(char codeUnit) {
    // Cursor is at start of the buffer so shift buffered units up to make room
    if (bufferEnd == buffer.length) {
      buffer = Arrays.copyOf(buffer, buffer.length * 2);
    }
    System.arraycopy(buffer, 0, buffer, 1, bufferEnd);
    buffer[0] = codeUnit;
    bufferEnd++;
  }
}
