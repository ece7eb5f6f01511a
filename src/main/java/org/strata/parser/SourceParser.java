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

package org.strata.parser;

import com.google.common.collect.ImmutableList;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.ast.Ast;
import org.strata.parser.StructuredTextParser.FileContext;

/** Parses Structured Text source into an {@link Ast}. */
public final class SourceParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(SourceParser.class);

  // Static methods only
  private SourceParser() {}

  /**
   * Parses {@code text}, after {@link #preprocess preprocessing} it. Never throws for bad input;
   * the first lexical or syntactic error is returned in the ParseResult.
   *
   * @throws BuildError if the parse tree could not be converted (a defect in this package)
   */
  public static ParseResult parse(String text) {
    FileContext tree;
    try {
      tree = parseTree(preprocess(text));
    } catch (SyntaxError e) {
      LOGGER.debug("Parse failed: {}", e.describe());
      return ParseResult.failure(e);
    }
    return ParseResult.success(AstBuilder.build(tree));
  }

  /** Parses {@code text} as given, throwing a {@link SyntaxError} at the first error. */
  static FileContext parseTree(String text) {
    // Throw SyntaxErrors in response to lexing and parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            if (offendingSymbol instanceof Token token) {
              throw new SyntaxError(
                  msg,
                  token.getType() == Token.EOF ? "<EOF>" : token.getText(),
                  lineNum,
                  charPositionInLine,
                  expectedTokens(recognizer, e));
            }
            throw new LexError(msg, offendingText(e), lineNum, charPositionInLine);
          }
        };
    StructuredTextLexer lexer = new StructuredTextLexer(CharStreams.fromString(text));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    StructuredTextParser parser = new StructuredTextParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser.file();
  }

  private static ImmutableList<String> expectedTokens(
      Recognizer<?, ?> recognizer, RecognitionException e) {
    IntervalSet expected = null;
    if (e != null) {
      expected = e.getExpectedTokens();
    }
    if (expected == null && recognizer instanceof Parser parser) {
      expected = parser.getExpectedTokens();
    }
    if (expected == null) {
      return ImmutableList.of();
    }
    Vocabulary vocabulary = recognizer.getVocabulary();
    return expected.toList().stream()
        .map(vocabulary::getDisplayName)
        .collect(ImmutableList.toImmutableList());
  }

  private static String offendingText(RecognitionException e) {
    if (e instanceof LexerNoViableAltException lexError) {
      int start = lexError.getStartIndex();
      return lexError.getInputStream().getText(Interval.of(start, start));
    }
    return "";
  }

  /**
   * Normalizes text as it typically arrives from editors and web forms: drops a leading byte order
   * mark, converts CRLF and CR line endings to LF, and unescapes {@code &lt;}, {@code &gt;} and
   * {@code &amp;}.
   */
  public static String preprocess(String text) {
    String result = text;
    if (result.startsWith("\uFEFF")) {
      result = result.substring(1);
    }
    result = result.replace("\r\n", "\n").replace('\r', '\n');
    return result.replace("&lt;", "<").replace("&gt;", ">").replace("&amp;", "&");
  }
}
