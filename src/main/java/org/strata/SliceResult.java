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

package org.strata;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;
import org.strata.parser.SyntaxError;

/** The outcome of {@link Toolkit#slice}: either the sliced source text or a SyntaxError. */
public final class SliceResult {
  private final @Nullable String text;
  private final @Nullable SyntaxError error;

  private SliceResult(@Nullable String text, @Nullable SyntaxError error) {
    this.text = text;
    this.error = error;
  }

  static SliceResult success(String text) {
    return new SliceResult(Preconditions.checkNotNull(text), null);
  }

  static SliceResult failure(SyntaxError error) {
    return new SliceResult(null, Preconditions.checkNotNull(error));
  }

  public boolean succeeded() {
    return text != null;
  }

  /** Returns the sliced code; only valid if {@link #succeeded}. */
  public String text() {
    Preconditions.checkState(text != null, "Slice failed: %s", error);
    return text;
  }

  /** Returns the SyntaxError; only valid if the slice did not succeed. */
  public SyntaxError error() {
    Preconditions.checkState(error != null, "Slice succeeded");
    return error;
  }

  @Override
  public String toString() {
    return succeeded() ? "SliceResult(success)" : "SliceResult(" + error.describe() + ")";
  }
}
