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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SplittableRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.ast.Ast;
import org.strata.ast.AstJson;
import org.strata.ast.ProgramUnit;
import org.strata.parser.BuildError;
import org.strata.parser.ParseResult;
import org.strata.parser.SourceParser;
import org.strata.rewriter.Rewriter;
import org.strata.slicer.Slicer;
import org.strata.unparser.Unparser;
import org.strata.validator.Validation;
import org.strata.validator.ValidatorFunnel;

/**
 * The entry points used by dataset tooling: validating candidate code, generating
 * semantics-preserving variants of it, slicing it, and exporting its AST as JSON.
 *
 * <p>A Toolkit holds only its options and may be shared between threads.
 */
public final class Toolkit {
  private static final Logger LOGGER = LoggerFactory.getLogger(Toolkit.class);

  /** Used to derive a distinct, well-spread seed for each augment attempt. */
  private static final long SEED_INCREMENT = 0x9E3779B97F4A7C15L;

  private final ToolkitOptions options;
  private final ValidatorFunnel funnel;
  private final Unparser unparser;

  public Toolkit(ToolkitOptions options) {
    this.options = options;
    this.funnel = ValidatorFunnel.fromOptions(options);
    this.unparser = new Unparser(options);
  }

  public Toolkit() {
    this(ToolkitOptions.DEFAULT);
  }

  public ToolkitOptions options() {
    return options;
  }

  public ParseResult parse(String code) {
    return SourceParser.parse(code);
  }

  /** Runs the validator funnel, stopping at the first stage that rejects the code. */
  public Validation validate(String code) {
    try {
      return funnel.validate(code);
    } catch (BuildError e) {
      LOGGER.warn("Validation aborted", e);
      return Validation.fail("Internal error: " + e.getMessage());
    }
  }

  /** Validates each of {@code codes} independently; results are in the same order. */
  public ImmutableList<Validation> validateAll(List<String> codes) {
    return codes.parallelStream().map(this::validate).collect(ImmutableList.toImmutableList());
  }

  /**
   * Returns up to {@code variantCount} rewritten versions of {@code code}. Each attempt rewrites
   * the original Ast with its own seed derived from {@code seed}; a variant is kept only if its
   * text differs from the input and from every variant already kept, and it parses again. Code
   * that does not parse produces no variants.
   */
  public ImmutableList<String> augment(String code, int variantCount, long seed) {
    ParseResult parsed = parse(code);
    if (!parsed.succeeded()) {
      LOGGER.warn("Cannot augment unparseable code: {}", parsed.error().describe());
      return ImmutableList.of();
    }
    Ast original = parsed.ast();
    String canonical = unparser.unparse(original);
    String input = code.strip();
    Set<String> variants = new LinkedHashSet<>();
    for (int attempt = 0; attempt < variantCount; attempt++) {
      long attemptSeed = seed ^ (attempt * SEED_INCREMENT);
      Ast rewritten = new Rewriter(new SplittableRandom(attemptSeed), options).rewrite(original);
      String text = unparser.unparse(rewritten);
      if (text.strip().equals(input) || text.equals(canonical)) {
        LOGGER.debug("Attempt {} made no change", attempt);
      } else if (!SourceParser.parse(text).succeeded()) {
        LOGGER.debug("Attempt {} produced code that does not parse", attempt);
      } else if (!variants.add(text)) {
        LOGGER.debug("Attempt {} repeated an earlier variant", attempt);
      }
    }
    return ImmutableList.copyOf(variants);
  }

  /**
   * Removes from each unit's body the statements that cannot affect any of {@code seeds}.
   * Declarations are kept.
   */
  public SliceResult slice(String code, Set<String> seeds) {
    ParseResult parsed = parse(code);
    if (!parsed.succeeded()) {
      return SliceResult.failure(parsed.error());
    }
    return SliceResult.success(unparser.unparse(Slicer.slice(parsed.ast(), seeds)));
  }

  /**
   * Returns {@code {"status": "success", "ast": ...}}, or {@code {"status": "error", "message":
   * ...}} if the code cannot be parsed.
   */
  public JsonNode getAst(String code) {
    ParseResult parsed;
    try {
      parsed = parse(code);
    } catch (BuildError e) {
      LOGGER.warn("Cannot build AST", e);
      return AstJson.error("Internal error: " + e.getMessage());
    }
    if (!parsed.succeeded()) {
      return AstJson.error(parsed.error().describe());
    }
    return AstJson.success(parsed.ast());
  }

  public ControlFlow controlFlow(ProgramUnit unit) {
    return ControlFlow.of(unit);
  }
}
