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
 * Options that control which language features a Scanner recognises.
 * Create using the builder:
 * <pre>
 *   ScannerOptions options = ScannerOptions.create()
 *                                          .htmlComments(false)
 *                                          .build();
 * </pre>
 */
public class ScannerOptions {

  boolean harmonyExponentiationOperator = true;   // Whether to scan '**' and '**='
  boolean htmlComments                  = true;   // Whether '<!--' and '-->' start comments (not in module code)

  public static ScannerOptionsBuilder create() {
    return new ScannerOptions().getScannerOptionsBuilder();
  }

  private ScannerOptions() {}

  public boolean allowHarmonyExponentiationOperator() { return harmonyExponentiationOperator; }
  public boolean allowHtmlComments()                  { return htmlComments; }

  @Override
  public String toString() {
    return "ScannerOptions[harmonyExponentiationOperator=" + harmonyExponentiationOperator + ", htmlComments=" + htmlComments + "]";
  }

  ///////////////////////////////////

  private ScannerOptionsBuilder getScannerOptionsBuilder() {
    return new ScannerOptionsBuilder();
  }

  public class ScannerOptionsBuilder {
    private ScannerOptionsBuilder() {}

    public ScannerOptionsBuilder harmonyExponentiationOperator(boolean value) { harmonyExponentiationOperator = value; return this; }
    public ScannerOptionsBuilder htmlComments(boolean value)                  { htmlComments                  = value; return this; }

    public ScannerOptions build() {
      return ScannerOptions.this;
    }
  }
}
