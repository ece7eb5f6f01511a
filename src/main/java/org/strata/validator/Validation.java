/*
 * Copyright 2026 The Strata Authors
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
 */

package org.strata.validator;

/** The outcome of a validation stage: whether the code passed, and why not if it did not. */
public record Validation(boolean passed, String reason) {

  public static final String PASSED = "Passed";

  public static Validation pass() {
    return new Validation(true, PASSED);
  }

  public static Validation fail(String reason) {
    return new Validation(false, reason);
  }
}
