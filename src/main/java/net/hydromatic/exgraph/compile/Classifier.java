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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.exgraph.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Assigns each term exactly one {@link Shape}.
 *
 * <p>Several shapes overlap, so the order of the tests matters. The
 * wildcard is tested before variables, and variables (forms with no
 * argument list) before calls; a struct before a map; a keyword list before
 * a charlist, and a charlist before a generic list; ranges before calls.
 * A list is a charlist if every element is an integer code point, so the
 * empty list is a charlist.
 */
public abstract class Classifier {
  private Classifier() {}

  /** Binary operators, by name. */
  static final ImmutableMap<String, Shape> BINARY_OPERATORS =
      ImmutableMap.<String, Shape>builder()
          .put("==", Shape.COMPARISON)
          .put("!=", Shape.COMPARISON)
          .put("===", Shape.COMPARISON)
          .put("!==", Shape.COMPARISON)
          .put("<", Shape.COMPARISON)
          .put(">", Shape.COMPARISON)
          .put("<=", Shape.COMPARISON)
          .put(">=", Shape.COMPARISON)
          .put("and", Shape.LOGICAL)
          .put("or", Shape.LOGICAL)
          .put("&&", Shape.LOGICAL)
          .put("||", Shape.LOGICAL)
          .put("+", Shape.ARITHMETIC)
          .put("-", Shape.ARITHMETIC)
          .put("*", Shape.ARITHMETIC)
          .put("/", Shape.ARITHMETIC)
          .put("div", Shape.ARITHMETIC)
          .put("rem", Shape.ARITHMETIC)
          .put("|>", Shape.PIPE)
          .put("=", Shape.MATCH)
          .put("<>", Shape.STRING_CONCAT)
          .put("++", Shape.LIST_OPERATOR)
          .put("--", Shape.LIST_OPERATOR)
          .put("in", Shape.IN)
          .build();

  /** Unary operators, by name. */
  static final ImmutableMap<String, Shape> UNARY_OPERATORS =
      ImmutableMap.of(
          "not", Shape.LOGICAL,
          "!", Shape.LOGICAL,
          "+", Shape.ARITHMETIC,
          "-", Shape.ARITHMETIC);

  /** Forms that only occur inside other constructs. */
  static final ImmutableSet<String> SPECIAL_FORMS =
      ImmutableSet.of("->", "<-", "when", "::", "|", ".", "\\\\");

  /** Returns the shape of a term. */
  public static Shape classify(Ast.Term term) {
    if (term.op.atomic) {
      return classifyAtomic(term);
    }
    switch (term.op) {
      case PAIR:
        return Shape.TUPLE;
      case LIST:
        final Ast.ListTerm list = (Ast.ListTerm) term;
        if (list.isKeywordList()) {
          return Shape.KEYWORD_LIST;
        }
        return Terms.isCharlist(list) ? Shape.CHARLIST : Shape.LIST;
      case FORM:
        return classifyForm((Ast.Form) term);
      default:
        throw new AssertionError("unknown op " + term.op);
    }
  }

  private static Shape classifyAtomic(Ast.Term term) {
    switch (term.op) {
      case ATOM:
        final Ast.Atom atom = (Ast.Atom) term;
        return atom.isBoolean()
            ? Shape.BOOLEAN
            : atom.isNil() ? Shape.NIL : Shape.ATOM;
      case INT_LITERAL:
        return Shape.INTEGER;
      case FLOAT_LITERAL:
        return Shape.FLOAT;
      case STRING_LITERAL:
        return Shape.STRING;
      default:
        throw new AssertionError("unknown op " + term.op);
    }
  }

  private static Shape classifyForm(Ast.Form form) {
    final String name = form.name();
    if (name == null) {
      return Terms.isRemoteHead(form.head) && form.args != null
          ? Shape.REMOTE_CALL
          : Shape.UNKNOWN;
    }
    if (form.isVariable()) {
      if (name.equals("_")) {
        return Shape.WILDCARD;
      }
      return Terms.SPECIAL_VARIABLES.contains(name)
          ? Shape.UNKNOWN
          : Shape.VARIABLE;
    }
    final int arity = form.arity();
    switch (name) {
      case "%":
        return arity == 2
                && Terms.moduleName(form.arg(0)) != null
                && isMapLiteral(form.arg(1))
            ? Shape.STRUCT
            : Shape.UNKNOWN;
      case "%{}":
        return isMapLiteral(form) ? Shape.MAP : Shape.UNKNOWN;
      case "{}":
        return Shape.TUPLE;
      case "..":
        return arity == 2 ? Shape.RANGE : Shape.UNKNOWN;
      case "..//":
        return arity == 3 ? Shape.STEP_RANGE : Shape.UNKNOWN;
      case "<<>>":
        return Terms.isByteLiteral(form) ? Shape.BINARY : Shape.UNKNOWN;
      case "&":
        return arity == 1 ? classifyCapture(form.arg(0)) : Shape.UNKNOWN;
      case "^":
        return arity == 1 && Terms.variableName(form.arg(0)) != null
            ? Shape.PIN
            : Shape.UNKNOWN;
      case "__aliases__":
        return Terms.aliasName(form) != null
            ? Shape.MODULE_REFERENCE
            : Shape.UNKNOWN;
      case "@":
        return arity == 1 && Terms.variableName(form.arg(0)) != null
            ? Shape.ATTRIBUTE_REFERENCE
            : Shape.UNKNOWN;
      case "fn":
        return Terms.arrows(form.args()) != null ? Shape.FN : Shape.UNKNOWN;
      case "__block__":
        return Shape.BLOCK;
      case "if":
        return doBlock(form, 2) ? Shape.IF : Shape.UNKNOWN;
      case "unless":
        return doBlock(form, 2) ? Shape.UNLESS : Shape.UNKNOWN;
      case "cond":
        return doBlock(form, 1) && Terms.arrows(doKeyword(form)) != null
            ? Shape.COND
            : Shape.UNKNOWN;
      case "case":
        return doBlock(form, 2) ? Shape.CASE : Shape.UNKNOWN;
      case "with":
        return arity >= 2 && Terms.trailingKeywords(form, "do") != null
            ? Shape.WITH
            : Shape.UNKNOWN;
      case "for":
        return arity >= 2 && Terms.trailingKeywords(form, "do") != null
            ? Shape.FOR
            : Shape.UNKNOWN;
      case "try":
        return doBlock(form, 1) ? Shape.TRY : Shape.UNKNOWN;
      case "receive":
        return arity == 1
                && (Terms.trailingKeywords(form, "do") != null
                    || Terms.trailingKeywords(form, "after") != null)
            ? Shape.RECEIVE
            : Shape.UNKNOWN;
      case "raise":
        return arity == 1 || arity == 2 ? Shape.RAISE : Shape.UNKNOWN;
      case "reraise":
        return arity == 2 || arity == 3 ? Shape.RERAISE : Shape.UNKNOWN;
      case "throw":
        return arity == 1 ? Shape.THROW : Shape.UNKNOWN;
      case "exit":
        return arity == 1 ? Shape.EXIT : Shape.UNKNOWN;
      default:
        break;
    }
    if (name.startsWith("sigil_") && name.length() > "sigil_".length()) {
      return isSigil(form) ? Shape.SIGIL : Shape.UNKNOWN;
    }
    if (arity == 2 && BINARY_OPERATORS.containsKey(name)) {
      return BINARY_OPERATORS.get(name);
    }
    if (arity == 1 && UNARY_OPERATORS.containsKey(name)) {
      return UNARY_OPERATORS.get(name);
    }
    if (SPECIAL_FORMS.contains(name)) {
      return Shape.UNKNOWN;
    }
    return Shape.LOCAL_CALL;
  }

  private static Shape classifyCapture(Ast.Term arg) {
    if (arg instanceof Ast.IntLiteral) {
      return PlaceholderAnalyzer.isPosition((Ast.IntLiteral) arg)
          ? Shape.PLACEHOLDER
          : Shape.UNKNOWN;
    }
    if (FunctionReference.of(arg) != null) {
      return Shape.FUNCTION_CAPTURE;
    }
    return PlaceholderAnalyzer.hasInvalidPlaceholder(arg)
        ? Shape.UNKNOWN
        : Shape.PARTIAL_APPLICATION;
  }

  /**
   * Returns whether a form has a given arity and its last argument is a
   * keyword list with a {@code do} key.
   */
  private static boolean doBlock(Ast.Form form, int arity) {
    return form.arity() == arity
        && Terms.trailingKeywords(form, "do") != null;
  }

  private static Ast.@Nullable Term doKeyword(Ast.Form form) {
    final Ast.ListTerm keywords = Terms.trailingKeywords(form, "do");
    return keywords == null ? null : keywords.keyword("do");
  }

  /** Returns whether a term is a map literal, not a map update. */
  static boolean isMapLiteral(Ast.Term term) {
    if (!(term instanceof Ast.Form) || !((Ast.Form) term).is("%{}")) {
      return false;
    }
    for (Ast.Term arg : ((Ast.Form) term).args()) {
      if (!(arg instanceof Ast.Pair)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns whether a sigil form is a literal: its content is a binary of
   * string segments, without interpolation, and its modifiers a charlist.
   */
  private static boolean isSigil(Ast.Form form) {
    if (form.arity() != 2
        || !(form.arg(0) instanceof Ast.Form)
        || !((Ast.Form) form.arg(0)).is("<<>>")
        || !(form.arg(1) instanceof Ast.ListTerm)
        || !Terms.isCharlist((Ast.ListTerm) form.arg(1))) {
      return false;
    }
    for (Ast.Term segment : ((Ast.Form) form.arg(0)).args()) {
      if (!(segment instanceof Ast.StringLiteral)) {
        return false;
      }
    }
    return true;
  }
}

// End Classifier.java
