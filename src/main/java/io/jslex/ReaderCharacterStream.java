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

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

/**
 * CharacterStream that streams code units from a Reader. Units are only read
 * once so this stream cannot be rewound and does not support bookmarks.
 */
public class ReaderCharacterStream extends BufferedCharacterStream implements Closeable {
  private final Reader  reader;
  private       boolean endOfInput = false;

  public ReaderCharacterStream(Reader reader) {
    this.reader = reader;
  }

  @Override
  protected int fillBuffer(int fromPos) {
    if (endOfInput) {
      return 0;
    }
    try {
      int count;
      do {
        count = reader.read(buffer, 0, buffer.length);
      } while (count == 0);
      if (count < 0) {
        endOfInput = true;
        return 0;
      }
      return count;
    }
    catch (IOException e) {
      throw new UncheckedIOException("Error reading source at position " + fromPos, e);
    }
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
