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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ToolkitOptionsTest {

  private static final String[] PROPERTIES = {
    "strata.indent",
    "strata.commute",
    "strata.invert",
    "strata.swap",
    "strata.rename",
    "strata.renamePrefix",
    "strata.iec2c",
    "strata.iec2cLib",
    "strata.iec2cTimeoutSeconds"
  };

  @After
  public void clearProperties() {
    for (String property : PROPERTIES) {
      System.clearProperty(property);
    }
  }

  @Test
  public void defaults() {
    ToolkitOptions options = ToolkitOptions.DEFAULT;
    assertThat(options.indentWidth()).isEqualTo(4);
    assertThat(options.indent()).isEqualTo("    ");
    assertThat(options.commuteProbability()).isEqualTo(0.5);
    assertThat(options.renameProbability()).isEqualTo(0.3);
    assertThat(options.renamePrefix()).isEqualTo("var_");
    assertThat(options.compilerPath()).isNull();
    assertThat(options.compilerTimeout()).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  public void builder() {
    ToolkitOptions options =
        ToolkitOptions.builder()
            .indentWidth(2)
            .allProbabilities(0.25)
            .swapProbability(1)
            .renamePrefix("v_")
            .compilerPath(Path.of("/usr/bin/iec2c"))
            .build();
    assertThat(options.indent()).isEqualTo("  ");
    assertThat(options.commuteProbability()).isEqualTo(0.25);
    assertThat(options.invertProbability()).isEqualTo(0.25);
    assertThat(options.swapProbability()).isEqualTo(1.0);
    assertThat(options.renamePrefix()).isEqualTo("v_");
    assertThat(options.toBuilder().build()).isEqualTo(options);
  }

  @Test
  public void rejectsBadValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ToolkitOptions.builder().invertProbability(1.5).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> ToolkitOptions.builder().renameProbability(-0.1).build());
    assertThrows(
        IllegalArgumentException.class, () -> ToolkitOptions.builder().indentWidth(-1).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> ToolkitOptions.builder().compilerTimeout(Duration.ZERO).build());
  }

  @Test
  public void systemProperties() {
    System.setProperty("strata.indent", "3");
    System.setProperty("strata.swap", "0");
    System.setProperty("strata.renamePrefix", "tmp_");
    System.setProperty("strata.iec2c", "/opt/matiec/iec2c");
    System.setProperty("strata.iec2cLib", "/opt/matiec/lib");
    System.setProperty("strata.iec2cTimeoutSeconds", "30");

    ToolkitOptions options = ToolkitOptions.fromSystemProperties();
    assertThat(options.indentWidth()).isEqualTo(3);
    assertThat(options.swapProbability()).isEqualTo(0.0);
    assertThat(options.commuteProbability()).isEqualTo(0.5);
    assertThat(options.renamePrefix()).isEqualTo("tmp_");
    assertThat(options.compilerPath()).isEqualTo(Path.of("/opt/matiec/iec2c"));
    assertThat(options.compilerLibPath()).isEqualTo(Path.of("/opt/matiec/lib"));
    assertThat(options.compilerTimeout()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  public void noSystemProperties() {
    assertThat(ToolkitOptions.fromSystemProperties()).isEqualTo(ToolkitOptions.DEFAULT);
  }
}
