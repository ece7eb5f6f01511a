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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.ToolkitOptions;

/**
 * Compiles code with the MatIEC {@code iec2c} compiler and reports whether it was accepted.
 *
 * <p>Each call writes the code to a fresh temporary directory, runs {@code iec2c -T <out> [-I
 * <lib>] source.st} with its output captured to a file, and deletes the directory afterwards
 * whatever the outcome. A compiler that runs past the timeout is killed.
 */
public final class CompilerValidator implements Validator {
  private static final Logger LOGGER = LoggerFactory.getLogger(CompilerValidator.class);

  static final String SOURCE_NAME = "source.st";

  private final Path compiler;
  private final @Nullable Path libPath;
  private final Duration timeout;

  /** Where temporary directories are created; null for the system default. */
  private final @Nullable Path tempRoot;

  public CompilerValidator(Path compiler, @Nullable Path libPath, Duration timeout) {
    this(compiler, libPath, timeout, null);
  }

  @VisibleForTesting
  CompilerValidator(
      Path compiler, @Nullable Path libPath, Duration timeout, @Nullable Path tempRoot) {
    this.compiler = compiler;
    this.libPath = libPath;
    this.timeout = timeout;
    this.tempRoot = tempRoot;
  }

  /** Returns a CompilerValidator for the configured compiler, which must be set. */
  public static CompilerValidator fromOptions(ToolkitOptions options) {
    Path compiler = options.compilerPath();
    if (compiler == null) {
      throw new IllegalArgumentException("No compiler configured");
    }
    return new CompilerValidator(compiler, options.compilerLibPath(), options.compilerTimeout());
  }

  @Override
  public Validation validate(String code) {
    try {
      compile(code);
      return Validation.pass();
    } catch (CompilerToolError e) {
      return Validation.fail(e.getMessage());
    }
  }

  /**
   * Compiles {@code code}, returning normally if the compiler accepts it.
   *
   * @throws CompilerToolError if the compiler is missing, times out, or rejects the code
   */
  public void compile(String code) throws CompilerToolError {
    Path dir;
    try {
      dir =
          (tempRoot == null)
              ? Files.createTempDirectory("strata-iec2c")
              : Files.createTempDirectory(tempRoot, "strata-iec2c");
    } catch (IOException e) {
      throw new CompilerToolError(CompilerToolError.Kind.FAILED, "Cannot create temp dir", e);
    }
    try {
      run(dir, code);
    } finally {
      try {
        MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
      } catch (IOException e) {
        LOGGER.warn("Could not delete {}", dir, e);
      }
    }
  }

  private void run(Path dir, String code) throws CompilerToolError {
    Path source = dir.resolve(SOURCE_NAME);
    Path outDir = dir.resolve("out");
    Path log = dir.resolve("iec2c.log");
    try {
      Files.writeString(source, code, UTF_8);
      Files.createDirectory(outDir);
    } catch (IOException e) {
      throw new CompilerToolError(CompilerToolError.Kind.FAILED, "Cannot write source", e);
    }
    List<String> command = new ArrayList<>();
    command.add(compiler.toString());
    command.add("-T");
    command.add(outDir.toString());
    if (libPath != null) {
      command.add("-I");
      command.add(libPath.toString());
    }
    command.add(source.toString());

    Process process;
    try {
      process =
          new ProcessBuilder(command)
              .directory(dir.toFile())
              .redirectErrorStream(true)
              .redirectOutput(log.toFile())
              .start();
    } catch (IOException e) {
      throw new CompilerToolError(
          CompilerToolError.Kind.NOT_FOUND, "Cannot run " + compiler, e);
    }
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new CompilerToolError(
            CompilerToolError.Kind.TIMEOUT, "No result after " + timeout.toMillis() + "ms", "");
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new CompilerToolError(CompilerToolError.Kind.TIMEOUT, "Interrupted", e);
    }
    int exitCode = process.exitValue();
    LOGGER.debug("{} exited with {}", compiler, exitCode);
    if (exitCode != 0) {
      String output;
      try {
        output = Files.readString(log, UTF_8);
      } catch (IOException e) {
        output = "(output unavailable: " + e.getMessage() + ")";
      }
      output = output.replace(source.toString(), SOURCE_NAME).trim();
      throw new CompilerToolError(
          CompilerToolError.Kind.FAILED, "Compiler exited with status " + exitCode, output);
    }
  }
}
