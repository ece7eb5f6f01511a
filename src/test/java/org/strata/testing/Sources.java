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

package org.strata.testing;

import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import org.strata.ast.Ast;
import org.strata.ast.Statement;
import org.strata.parser.ParseResult;
import org.strata.parser.SourceParser;

/** Parses test snippets, failing the test if they do not parse. */
public final class Sources {

  public static Ast parse(String source) {
    ParseResult result = SourceParser.parse(source);
    assertWithMessage("Parse failed: %s", result).that(result.succeeded()).isTrue();
    return result.ast();
  }

  /** Parses {@code statements} as the body of a PROGRAM. */
  public static ImmutableList<Statement> body(String statements) {
    return parse("PROGRAM P\n" + statements + "\nEND_PROGRAM").units().get(0).body();
  }

  public static Statement statement(String text) {
    return body(text).get(0);
  }

  private Sources() {}
}
