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

/** The external compiler could not be run, did not finish, or rejected the code. */
public class CompilerToolError extends Exception {

  public enum Kind {
    /** The compiler ran longer than the configured timeout and was killed. */
    TIMEOUT,
    /** The compiler executable could not be started. */
    NOT_FOUND,
    /** The compiler exited with a nonzero status, or its files could not be prepared. */
    FAILED
  }

  public final Kind kind;

  /** What the compiler printed, with temporary paths replaced; empty unless kind is FAILED. */
  public final String output;

  public CompilerToolError(Kind kind, String msg, String output) {
    super(msg);
    this.kind = kind;
    this.output = output;
  }

  public CompilerToolError(Kind kind, String msg, Throwable cause) {
    super(msg, cause);
    this.kind = kind;
    this.output = "";
  }

  @Override
  public String getMessage() {
    String msg = kind + ": " + super.getMessage();
    return output.isEmpty() ? msg : msg + "\n" + output;
  }
}
