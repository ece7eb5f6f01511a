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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.nio.file.Path;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Settings for the toolkit.
 *
 * @param indentWidth the number of spaces per indentation level in unparsed code
 * @param commuteProbability the chance that the rewriter swaps the operands of a {@code + * AND OR}
 * @param invertProbability the chance that the rewriter inverts an IF/ELSE
 * @param swapProbability the chance that one attempted swap of adjacent statements is made
 * @param renameProbability the chance that the rewriter renames an eligible local variable
 * @param renamePrefix prepended to a variable's name to form its new name
 * @param compilerPath the {@code iec2c} executable; if null the compiler stage is skipped
 * @param compilerLibPath passed to the compiler as {@code -I}, if non-null
 * @param compilerTimeout how long the compiler may run before it is killed
 */
public record ToolkitOptions(
    int indentWidth,
    double commuteProbability,
    double invertProbability,
    double swapProbability,
    double renameProbability,
    String renamePrefix,
    @Nullable Path compilerPath,
    @Nullable Path compilerLibPath,
    Duration compilerTimeout) {

  public static final ToolkitOptions DEFAULT = builder().build();

  public ToolkitOptions {
    checkArgument(indentWidth >= 0, "Negative indent");
    checkProbability(commuteProbability);
    checkProbability(invertProbability);
    checkProbability(swapProbability);
    checkProbability(renameProbability);
    checkArgument(!compilerTimeout.isNegative() && !compilerTimeout.isZero(), "Bad timeout");
  }

  private static void checkProbability(double p) {
    checkArgument(p >= 0 && p <= 1, "Probability out of range: %s", p);
  }

  /** One level of indentation. */
  public String indent() {
    return Strings.repeat(" ", indentWidth);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .indentWidth(indentWidth)
        .commuteProbability(commuteProbability)
        .invertProbability(invertProbability)
        .swapProbability(swapProbability)
        .renameProbability(renameProbability)
        .renamePrefix(renamePrefix)
        .compilerPath(compilerPath)
        .compilerLibPath(compilerLibPath)
        .compilerTimeout(compilerTimeout);
  }

  /**
   * Returns the defaults overridden by any of these system properties: {@code strata.indent},
   * {@code strata.commute}, {@code strata.invert}, {@code strata.swap}, {@code strata.rename},
   * {@code strata.renamePrefix}, {@code strata.iec2c}, {@code strata.iec2cLib} and {@code
   * strata.iec2cTimeoutSeconds}.
   */
  public static ToolkitOptions fromSystemProperties() {
    Builder builder = builder();
    String indent = System.getProperty("strata.indent");
    if (indent != null) {
      builder.indentWidth(Integer.parseInt(indent));
    }
    builder.commuteProbability(doubleProperty("strata.commute", builder.commuteProbability));
    builder.invertProbability(doubleProperty("strata.invert", builder.invertProbability));
    builder.swapProbability(doubleProperty("strata.swap", builder.swapProbability));
    builder.renameProbability(doubleProperty("strata.rename", builder.renameProbability));
    builder.renamePrefix(System.getProperty("strata.renamePrefix", builder.renamePrefix));
    String compiler = System.getProperty("strata.iec2c");
    if (!Strings.isNullOrEmpty(compiler)) {
      builder.compilerPath(Path.of(compiler));
    }
    String lib = System.getProperty("strata.iec2cLib");
    if (!Strings.isNullOrEmpty(lib)) {
      builder.compilerLibPath(Path.of(lib));
    }
    String timeout = System.getProperty("strata.iec2cTimeoutSeconds");
    if (timeout != null) {
      builder.compilerTimeout(Duration.ofSeconds(Long.parseLong(timeout)));
    }
    return builder.build();
  }

  private static double doubleProperty(String name, double defaultValue) {
    String value = System.getProperty(name);
    return (value == null) ? defaultValue : Double.parseDouble(value);
  }

  /** A mutable builder, initialized with the default settings. */
  public static final class Builder {
    private int indentWidth = 4;
    private double commuteProbability = 0.5;
    private double invertProbability = 0.5;
    private double swapProbability = 0.5;
    private double renameProbability = 0.3;
    private String renamePrefix = "var_";
    private @Nullable Path compilerPath;
    private @Nullable Path compilerLibPath;
    private Duration compilerTimeout = Duration.ofSeconds(10);

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder indentWidth(int indentWidth) {
      this.indentWidth = indentWidth;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder commuteProbability(double p) {
      this.commuteProbability = p;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder invertProbability(double p) {
      this.invertProbability = p;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder swapProbability(double p) {
      this.swapProbability = p;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder renameProbability(double p) {
      this.renameProbability = p;
      return this;
    }

    /** Sets all four mutation probabilities at once. */
    @CanIgnoreReturnValue
    public Builder allProbabilities(double p) {
      return commuteProbability(p).invertProbability(p).swapProbability(p).renameProbability(p);
    }

    @CanIgnoreReturnValue
    public Builder renamePrefix(String renamePrefix) {
      this.renamePrefix = renamePrefix;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder compilerPath(@Nullable Path compilerPath) {
      this.compilerPath = compilerPath;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder compilerLibPath(@Nullable Path compilerLibPath) {
      this.compilerLibPath = compilerLibPath;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder compilerTimeout(Duration compilerTimeout) {
      this.compilerTimeout = compilerTimeout;
      return this;
    }

    public ToolkitOptions build() {
      return new ToolkitOptions(
          indentWidth,
          commuteProbability,
          invertProbability,
          swapProbability,
          renameProbability,
          renamePrefix,
          compilerPath,
          compilerLibPath,
          compilerTimeout);
    }
  }
}
