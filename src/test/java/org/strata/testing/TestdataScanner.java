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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Supplies test parameters by splitting each {@code .st} file in a directory into chunks of code,
 * each followed by a directive comment. Subclasses pass the directory and a pattern matching the
 * directive; group 1 of the pattern is the directive's contents.
 */
public abstract class TestdataScanner implements TestParameter.TestParameterValuesProvider {

  /**
   * One chunk of a testdata file. {@code comment} is null if the chunk was not followed by a
   * directive.
   */
  public record TestProgram(String name, String code, @Nullable String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path dir;
  private final Pattern commentPattern;

  protected TestdataScanner(Path dir, Pattern commentPattern) {
    this.dir = dir;
    this.commentPattern = commentPattern;
  }

  @Override
  public List<?> provideValues() {
    try (Stream<Path> files = Files.list(dir)) {
      ImmutableList.Builder<TestProgram> programs = ImmutableList.builder();
      for (Path file : files.filter(f -> f.toString().endsWith(".st")).sorted().toList()) {
        scan(file, programs);
      }
      return programs.build();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void scan(Path file, ImmutableList.Builder<TestProgram> programs) throws IOException {
    String text = Files.readString(file, UTF_8);
    String baseName = file.getFileName().toString();
    baseName = baseName.substring(0, baseName.length() - ".st".length());
    Matcher matcher = commentPattern.matcher(text);
    int start = 0;
    int count = 0;
    while (matcher.find()) {
      String code = text.substring(start, matcher.start());
      programs.add(new TestProgram(baseName + "_" + (++count), code, matcher.group(1)));
      start = matcher.end();
    }
    if (!text.substring(start).isBlank()) {
      programs.add(new TestProgram(baseName + "_" + (++count), text.substring(start), null));
    }
  }
}
