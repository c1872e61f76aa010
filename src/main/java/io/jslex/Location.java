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
 * An interval of source positions, measured in UTF-16 code units from the
 * start of the character stream. The end position is exclusive.
 */
public final class Location {
  public static final Location INVALID = new Location(-1, -1);

  private final int begPos;
  private final int endPos;

  public Location(int begPos, int endPos) {
    this.begPos = begPos;
    this.endPos = endPos;
  }

  public int getBegPos() { return begPos; }
  public int getEndPos() { return endPos; }

  public boolean isValid() {
    return begPos >= 0 && endPos >= begPos;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Location)) {
      return false;
    }
    Location other = (Location) obj;
    return begPos == other.begPos && endPos == other.endPos;
  }

  @Override
  public int hashCode() {
    return 31 * begPos + endPos;
  }

  @Override
  public String toString() {
    return "[" + begPos + ", " + endPos + ")";
  }
}
