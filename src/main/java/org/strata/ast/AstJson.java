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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts ASTs to JSON trees. Every Statement, Expr and TypeRef node carries a {@code "kind"}
 * property naming its variant; absent optional fields (a FOR without BY, a declaration without
 * an initial value) are omitted.
 */
public final class AstJson {

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  // Static methods only
  private AstJson() {}

  /** The mapper used for all AST serialization; it is thread-safe once configured. */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static JsonNode toJson(Ast ast) {
    return MAPPER.valueToTree(ast);
  }

  /** Returns {@code {"status":"success","ast":...}}. */
  public static ObjectNode success(Ast ast) {
    ObjectNode result = MAPPER.createObjectNode();
    result.put("status", "success");
    result.set("ast", toJson(ast));
    return result;
  }

  /** Returns {@code {"status":"error","message":...}}. */
  public static ObjectNode error(String message) {
    ObjectNode result = MAPPER.createObjectNode();
    result.put("status", "error");
    result.put("message", message);
    return result;
  }
}
