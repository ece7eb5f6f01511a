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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.antlr.v4.runtime.Vocabulary;
import org.strata.analysis.Names;
import org.strata.parser.StructuredTextLexer;

/**
 * The renamings chosen for one program unit. Keys are canonical (upper-case) names, so every
 * spelling of a variable maps to the same new name; values keep the case of the first spelling
 * seen.
 */
public final class RenameMap {
  /** Keywords of the grammar; a new name that spells one would lex as that keyword. */
  static final ImmutableSet<String> KEYWORDS = keywords(StructuredTextLexer.VOCABULARY);

  private final Map<String, String> renames = new LinkedHashMap<>();

  /** Canonical names that a new name must not collide with. */
  private final Set<String> taken = new HashSet<>();

  /**
   * @param reserved every name already in use (declared variables, unit names, ...); new names are
   *     chosen to avoid them
   */
  public RenameMap(Iterable<String> reserved) {
    taken.addAll(KEYWORDS);
    reserved.forEach(name -> taken.add(Names.canonical(name)));
  }

  private static ImmutableSet<String> keywords(Vocabulary vocabulary) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (int type = 1; type <= vocabulary.getMaxTokenType(); type++) {
      String literal = vocabulary.getLiteralName(type);
      if (literal != null && literal.matches("'[A-Z_][A-Z_0-9]*'")) {
        builder.add(Names.canonical(literal.substring(1, literal.length() - 1)));
      }
    }
    return builder.build();
  }

  /**
   * Chooses and records a new name for {@code original}: {@code prefix + original}, or with a
   * numeric suffix if that is already taken or is a keyword. A name that starts with an
   * underscore is joined to the prefix without doubling it ({@code _x} becomes {@code var_x}, not
   * {@code var__x}).
   *
   * @throws RewriteGuardViolation if {@code original} has already been renamed
   */
  @CanIgnoreReturnValue
  public String assign(String original, String prefix) {
    String key = Names.canonical(original);
    RewriteGuardViolation.check(!renames.containsKey(key), "%s is already renamed", original);
    String base;
    if (original.startsWith("_") && prefix.endsWith("_")) {
      base = prefix + original.substring(1);
    } else {
      base = prefix + original;
    }
    String candidate = base;
    for (int suffix = 2; taken.contains(Names.canonical(candidate)); suffix++) {
      candidate = base + suffix;
    }
    taken.add(Names.canonical(candidate));
    renames.put(key, candidate);
    return candidate;
  }

  public boolean isRenamed(String name) {
    return renames.containsKey(Names.canonical(name));
  }

  /** Returns the new name for {@code name}, or {@code name} itself if it is not renamed. */
  public String apply(String name) {
    return renames.getOrDefault(Names.canonical(name), name);
  }

  public boolean isEmpty() {
    return renames.isEmpty();
  }

  /** The renamings, keyed by canonical original name. */
  public ImmutableMap<String, String> asMap() {
    return ImmutableMap.copyOf(renames);
  }

  @Override
  public String toString() {
    return renames.toString();
  }
}
