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

package org.strata.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** The declared type of a variable or of a FUNCTION's result. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(TypeRef.Scalar.class),
  @JsonSubTypes.Type(TypeRef.Array.class),
  @JsonSubTypes.Type(TypeRef.Struct.class),
  @JsonSubTypes.Type(TypeRef.Named.class)
})
public sealed interface TypeRef {

  <T> T accept(Visitor<T> visitor);

  interface Visitor<T> {
    T visitScalar(Scalar scalar);

    T visitArray(Array array);

    T visitStruct(Struct struct);

    T visitNamed(Named named);
  }

  /** The elementary type names; anything else is a {@link Named} type. */
  ImmutableSet<String> ELEMENTARY =
      ImmutableSet.of(
          "BOOL", "BYTE", "WORD", "DWORD", "LWORD", "SINT", "INT", "DINT", "LINT", "USINT", "UINT",
          "UDINT", "ULINT", "REAL", "LREAL", "TIME", "LTIME", "DATE", "TIME_OF_DAY", "TOD",
          "DATE_AND_TIME", "DT", "STRING", "WSTRING", "CHAR", "WCHAR");

  /**
   * An elementary type. {@code name} includes a length suffix when one was given, e.g. {@code
   * "STRING[80]"}.
   */
  @JsonTypeName("scalar")
  record Scalar(String name) implements TypeRef {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitScalar(this);
    }
  }

  /**
   * {@code ARRAY[lower..upper] OF elem}. The bounds are kept as written since they may be named
   * constants.
   */
  @JsonTypeName("array")
  record Array(String lower, String upper, TypeRef elem) implements TypeRef {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitArray(this);
    }
  }

  @JsonTypeName("struct")
  record Struct(ImmutableList<VarDecl> fields) implements TypeRef {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitStruct(this);
    }
  }

  /** A function block, enumeration or other user-defined type. */
  @JsonTypeName("named")
  record Named(String name) implements TypeRef {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNamed(this);
    }
  }

  /** Returns a Scalar for an elementary type name and a Named type otherwise. */
  static TypeRef ofName(String name) {
    String base = name;
    int bracket = name.indexOf('[');
    if (bracket >= 0) {
      base = name.substring(0, bracket);
    }
    return ELEMENTARY.contains(Ascii.toUpperCase(base)) ? new Scalar(name) : new Named(name);
  }
}
