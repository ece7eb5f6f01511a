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

package org.strata.rewriter;

import com.google.errorprone.annotations.FormatMethod;

/**
 * A mutation's precondition did not hold. The rewriter catches this, leaves the affected code as
 * it was, and continues with the next mutation.
 */
public class RewriteGuardViolation extends RuntimeException {

  public RewriteGuardViolation(String msg) {
    super(msg);
  }

  /** Throws a RewriteGuardViolation with the formatted message unless {@code condition} holds. */
  @FormatMethod
  static void check(boolean condition, String fmt, Object... fmtArgs) {
    if (!condition) {
      throw new RewriteGuardViolation(String.format(fmt, fmtArgs));
    }
  }
}
