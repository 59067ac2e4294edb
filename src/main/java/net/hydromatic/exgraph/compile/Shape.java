/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.exgraph.compile;

/**
 * Kind of expression, as determined by {@link Classifier}.
 *
 * <p>Each kind belongs to a {@link Category}, which determines which
 * compiler handles it.
 */
public enum Shape {
  ATOM(Category.LITERAL),
  BOOLEAN(Category.LITERAL),
  NIL(Category.LITERAL),
  INTEGER(Category.LITERAL),
  FLOAT(Category.LITERAL),
  STRING(Category.LITERAL),
  CHARLIST(Category.LITERAL),
  BINARY(Category.LITERAL),
  LIST(Category.LITERAL),
  TUPLE(Category.LITERAL),
  MAP(Category.LITERAL),
  STRUCT(Category.LITERAL),
  KEYWORD_LIST(Category.LITERAL),
  SIGIL(Category.LITERAL),
  RANGE(Category.LITERAL),
  STEP_RANGE(Category.LITERAL),

  COMPARISON(Category.OPERATOR),
  LOGICAL(Category.OPERATOR),
  ARITHMETIC(Category.OPERATOR),
  PIPE(Category.OPERATOR),
  MATCH(Category.OPERATOR),
  STRING_CONCAT(Category.OPERATOR),
  LIST_OPERATOR(Category.OPERATOR),
  IN(Category.OPERATOR),

  VARIABLE(Category.REFERENCE),
  WILDCARD(Category.REFERENCE),
  PIN(Category.REFERENCE),
  MODULE_REFERENCE(Category.REFERENCE),
  ATTRIBUTE_REFERENCE(Category.REFERENCE),

  FN(Category.FUNCTION),
  PLACEHOLDER(Category.FUNCTION),
  FUNCTION_CAPTURE(Category.FUNCTION),
  PARTIAL_APPLICATION(Category.FUNCTION),

  IF(Category.CONTROL_FLOW),
  UNLESS(Category.CONTROL_FLOW),
  COND(Category.CONTROL_FLOW),
  CASE(Category.CONTROL_FLOW),
  WITH(Category.CONTROL_FLOW),
  FOR(Category.CONTROL_FLOW),
  TRY(Category.CONTROL_FLOW),
  RAISE(Category.CONTROL_FLOW),
  RERAISE(Category.CONTROL_FLOW),
  THROW(Category.CONTROL_FLOW),
  EXIT(Category.CONTROL_FLOW),
  RECEIVE(Category.CONTROL_FLOW),

  BLOCK(Category.CALL),
  REMOTE_CALL(Category.CALL),
  LOCAL_CALL(Category.CALL),

  /** A term that matches no other shape. */
  UNKNOWN(Category.FALLBACK);

  public final Category category;

  Shape(Category category) {
    this.category = category;
  }

  /** Group of shapes that are compiled by the same compiler. */
  public enum Category {
    LITERAL,
    OPERATOR,
    REFERENCE,
    FUNCTION,
    CONTROL_FLOW,
    CALL,
    FALLBACK
  }
}

// End Shape.java
