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

package org.strata.cfg;

/** A branch or goto names a label that no instruction defines, or a label is defined twice. */
public class LabelResolutionError extends RuntimeException {
  public final String label;

  /** The index of the instruction that referenced or redefined the label. */
  public final int instrIndex;

  public LabelResolutionError(String msg, String label, int instrIndex) {
    super(msg);
    this.label = label;
    this.instrIndex = instrIndex;
  }

  @Override
  public String getMessage() {
    return String.format("%s: '%s' (instruction %s)", super.getMessage(), label, instrIndex);
  }
}
