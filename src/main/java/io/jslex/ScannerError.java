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
 * Exception form of a lexical error latched by the Scanner. The Scanner itself
 * never throws this while scanning: it is created by {@link Scanner#throwIfError()}
 * for callers that want to stop at the first error.
 */
public class ScannerError extends RuntimeException {

  private final MessageTemplate error;
  private final Location        location;

  /**
   * Constructor
   * @param error     the kind of error
   * @param location  the source span where the error occurred
   */
  public ScannerError(MessageTemplate error, Location location) {
    super(null, null, false, false);
    this.error    = error;
    this.location = location;
  }

  public MessageTemplate getError() {
    return error;
  }

  public Location getLocation() {
    return location;
  }

  @Override
  public String getMessage() {
    if (location == null || !location.isValid()) {
      return String.format("%s @ unknown location", error);
    }
    return String.format("%s @ %s", error, location);
  }
}
