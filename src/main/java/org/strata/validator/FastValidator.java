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

import com.google.common.collect.ImmutableList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cheap textual checks that reject obviously broken code before it is parsed or compiled. All
 * checks run on the code with comments, pragmas and string literals removed.
 */
public final class FastValidator implements Validator {

  private static final Pattern COMMENTS_AND_STRINGS =
      Pattern.compile(
          "\\(\\*.*?\\*\\)|/\\*.*?\\*/|//[^\\n]*|\\{[^}]*\\}"
              + "|'(?:\\$.|[^'$])*'|\"(?:\\$.|[^\"$])*\"",
          Pattern.DOTALL);

  private static final Pattern UNIT_KEYWORD =
      Pattern.compile("\\b(?:PROGRAM|FUNCTION_BLOCK|FUNCTION)\\b", Pattern.CASE_INSENSITIVE);

  /**
   * A statement of the form {@code place = expr;}, i.e. a comparison where an assignment belongs.
   * Statements start at the beginning of the text, after a {@code ;}, after a unit header, or
   * after a keyword that opens a statement list.
   */
  private static final Pattern ILLEGAL_ASSIGNMENT =
      Pattern.compile(
          "(?:\\A|;|\\bTHEN\\b|\\bELSE\\b|\\bDO\\b|\\bREPEAT\\b|\\bEND_VAR\\b"
              + "|\\b(?:PROGRAM|FUNCTION_BLOCK)\\s+\\w+|\\bFUNCTION\\s+\\w+\\s*:\\s*\\w+)"
              + "\\s*([A-Za-z_][\\w.\\[\\]]*\\s*=(?![=>])[^;]*;)",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern DYNAMIC_ARRAY =
      Pattern.compile("\\bARRAY\\s*\\[\\s*\\*", Pattern.CASE_INSENSITIVE);

  /** Block keywords that must be matched by an {@code END_} keyword. */
  private static final ImmutableList<String> PAIRED =
      ImmutableList.of(
          "IF",
          "CASE",
          "FOR",
          "WHILE",
          "REPEAT",
          "STRUCT",
          "PROGRAM",
          "FUNCTION_BLOCK",
          "FUNCTION");

  private static final Pattern VAR_OPENER =
      Pattern.compile(
          "\\bVAR(?:_INPUT|_OUTPUT|_IN_OUT|_TEMP|_GLOBAL|_EXTERNAL)?\\b", Pattern.CASE_INSENSITIVE);

  @Override
  public Validation validate(String code) {
    String text = stripCommentsAndStrings(code);
    if (text.isBlank()) {
      return Validation.fail("Empty code");
    }
    Matcher assignment = ILLEGAL_ASSIGNMENT.matcher(text);
    if (assignment.find()) {
      return Validation.fail(
          "Illegal assignment '=' (use ':='): " + assignment.group(1).trim());
    }
    if (!UNIT_KEYWORD.matcher(text).find()) {
      return Validation.fail("No PROGRAM, FUNCTION_BLOCK or FUNCTION found");
    }
    for (String keyword : PAIRED) {
      String end = "END_" + keyword;
      int opens = count(Pattern.compile("\\b" + keyword + "\\b", Pattern.CASE_INSENSITIVE), text);
      int closes = count(Pattern.compile("\\b" + end + "\\b", Pattern.CASE_INSENSITIVE), text);
      if (opens != closes) {
        return imbalance(keyword, opens, end, closes);
      }
    }
    int varOpens = count(VAR_OPENER, text);
    int varCloses = count(Pattern.compile("\\bEND_VAR\\b", Pattern.CASE_INSENSITIVE), text);
    if (varOpens != varCloses) {
      return imbalance("VAR", varOpens, "END_VAR", varCloses);
    }
    if (DYNAMIC_ARRAY.matcher(text).find()) {
      return Validation.fail("Dynamic arrays not supported");
    }
    return Validation.pass();
  }

  private static Validation imbalance(String open, int opens, String close, int closes) {
    return Validation.fail(
        String.format("Structural imbalance: %s(%d) vs %s(%d)", open, opens, close, closes));
  }

  private static int count(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int n = 0;
    while (matcher.find()) {
      n++;
    }
    return n;
  }

  /** Replaces comments and pragmas with a space and string literals with {@code ''}. */
  static String stripCommentsAndStrings(String code) {
    Matcher matcher = COMMENTS_AND_STRINGS.matcher(code);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String match = matcher.group();
      boolean isString = match.startsWith("'") || match.startsWith("\"");
      matcher.appendReplacement(sb, isString ? "''" : " ");
    }
    matcher.appendTail(sb);
    return sb.toString();
  }
}
