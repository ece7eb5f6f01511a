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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.ToolkitOptions;
import org.strata.parser.BuildError;

/**
 * Runs a sequence of validators, cheapest first, and reports the first failure. Code that passes
 * every stage is reported as {@link Validation#pass}.
 */
public final class ValidatorFunnel implements Validator {
  private static final Logger LOGGER = LoggerFactory.getLogger(ValidatorFunnel.class);

  private final ImmutableList<Validator> stages;

  public ValidatorFunnel(ImmutableList<Validator> stages) {
    this.stages = stages;
  }

  /**
   * Returns the standard funnel: the textual checks, then the compiler if one is configured, then
   * the semantic checks.
   */
  public static ValidatorFunnel fromOptions(ToolkitOptions options) {
    ImmutableList.Builder<Validator> stages = ImmutableList.builder();
    stages.add(new FastValidator());
    if (options.compilerPath() != null) {
      stages.add(CompilerValidator.fromOptions(options));
    }
    stages.add(new SemanticValidator());
    return new ValidatorFunnel(stages.build());
  }

  public ImmutableList<Validator> stages() {
    return stages;
  }

  @Override
  public Validation validate(String code) {
    for (Validator stage : stages) {
      Validation result;
      try {
        result = stage.validate(code);
      } catch (BuildError e) {
        LOGGER.warn("{} could not build an AST", stage.getClass().getSimpleName(), e);
        result = Validation.fail("Internal error: " + e.getMessage());
      }
      if (!result.passed()) {
        LOGGER.debug("{} rejected code: {}", stage.getClass().getSimpleName(), result.reason());
        return result;
      }
    }
    return Validation.pass();
  }
}
