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

package org.strata.analysis;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableSet;

/**
 * Structured Text identifiers are case-insensitive. Names are stored as written; comparisons go
 * through {@link #canonical}.
 */
public final class Names {

  // Static methods only
  private Names() {}

  public static String canonical(String name) {
    return Ascii.toUpperCase(name);
  }

  public static ImmutableSet<String> canonical(Iterable<String> names) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (String name : names) {
      builder.add(canonical(name));
    }
    return builder.build();
  }

  /** True if the two sets share a name, ignoring case. */
  public static boolean intersect(Iterable<String> a, Iterable<String> b) {
    ImmutableSet<String> canonicalA = canonical(a);
    for (String name : b) {
      if (canonicalA.contains(canonical(name))) {
        return true;
      }
    }
    return false;
  }
}
