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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.exgraph.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for inspecting the shape of terms. */
abstract class Terms {
  /** Variable-shaped forms that are not variables. */
  static final ImmutableSet<String> SPECIAL_VARIABLES =
      ImmutableSet.of(
          "__MODULE__", "__ENV__", "__DIR__", "__CALLER__", "__STACKTRACE__");

  private Terms() {}

  /** Returns the name of a variable, or null if the term is not one. */
  static @Nullable String variableName(Ast.Term term) {
    if (term instanceof Ast.Form && ((Ast.Form) term).isVariable()) {
      return ((Ast.Form) term).name();
    }
    return null;
  }

  /** Returns whether a term is a form with a given head and arity. */
  static boolean isForm(Ast.Term term, String name, int arity) {
    return term instanceof Ast.Form && ((Ast.Form) term).is(name, arity);
  }

  /** Returns whether a term is a clause, {@code heads -> body}. */
  static boolean isArrow(Ast.Term term) {
    return isForm(term, "->", 2)
        && ((Ast.Form) term).arg(0) instanceof Ast.ListTerm;
  }

  /**
   * Returns the clauses in a term, if it is a non-empty list of arrows,
   * otherwise null.
   */
  static @Nullable List<Ast.Form> arrows(Ast.@Nullable Term term) {
    if (!(term instanceof Ast.ListTerm)) {
      return null;
    }
    return arrows(((Ast.ListTerm) term).elements);
  }

  /**
   * Returns a list of terms as clauses, if it is non-empty and every element
   * is an arrow, otherwise null.
   */
  static @Nullable List<Ast.Form> arrows(List<Ast.Term> elements) {
    final List<Ast.Form> clauses = new ArrayList<>();
    for (Ast.Term element : elements) {
      if (!isArrow(element)) {
        return null;
      }
      clauses.add((Ast.Form) element);
    }
    return clauses.isEmpty() ? null : clauses;
  }

  /** Returns the heads of a clause. */
  static ImmutableList<Ast.Term> heads(Ast.Form arrow) {
    return ((Ast.ListTerm) arrow.arg(0)).elements;
  }

  /** Returns the body of a clause. */
  static Ast.Term body(Ast.Form arrow) {
    return arrow.arg(1);
  }

  /** Returns a term as a keyword list, or null if it is not one. */
  static Ast.@Nullable ListTerm keywords(Ast.@Nullable Term term) {
    return term instanceof Ast.ListTerm
            && ((Ast.ListTerm) term).isKeywordList()
        ? (Ast.ListTerm) term
        : null;
  }

  /**
   * Returns the trailing keyword list of a form's arguments (such as the
   * {@code do} block of {@code if}), if it has the given key, otherwise null.
   */
  static Ast.@Nullable ListTerm trailingKeywords(Ast.Form form, String key) {
    if (form.arity() == 0) {
      return null;
    }
    final Ast.ListTerm keywords = keywords(form.arg(form.arity() - 1));
    return keywords != null && keywords.keyword(key) != null ? keywords : null;
  }

  /** Returns the dotted name of a module alias, or null. */
  static @Nullable String aliasName(Ast.Term term) {
    if (!(term instanceof Ast.Form) || !((Ast.Form) term).is("__aliases__")) {
      return null;
    }
    final List<String> parts = new ArrayList<>();
    for (Ast.Term part : ((Ast.Form) term).args()) {
      if (!(part instanceof Ast.Atom)) {
        return null;
      }
      parts.add(((Ast.Atom) part).name);
    }
    return parts.isEmpty() ? null : Joiner.on('.').join(parts);
  }

  /**
   * Returns the name of a module term: the dotted name of an alias, {@code
   * :name} for an atom (an Erlang module), or null.
   */
  static @Nullable String moduleName(Ast.Term term) {
    if (term instanceof Ast.Atom) {
      return ":" + ((Ast.Atom) term).name;
    }
    final String variable = variableName(term);
    if ("__MODULE__".equals(variable)) {
      return variable;
    }
    return aliasName(term);
  }

  /**
   * Returns whether a term is the head of a remote call, {@code
   * {:., _, [receiver, :fun]}}.
   */
  static boolean isRemoteHead(Ast.Term head) {
    return isForm(head, ".", 2) && ((Ast.Form) head).arg(1) instanceof Ast.Atom;
  }

  /** Returns the statements of a body; a block has several. */
  static ImmutableList<Ast.Term> statements(Ast.Term body) {
    if (body instanceof Ast.Form && ((Ast.Form) body).is("__block__")) {
      return ((Ast.Form) body).args();
    }
    return ImmutableList.of(body);
  }

  /**
   * Returns whether a list is a charlist: Unicode scalar values only, which
   * excludes surrogates.
   */
  static boolean isCharlist(Ast.ListTerm list) {
    for (Ast.Term element : list.elements) {
      if (!(element instanceof Ast.IntLiteral)) {
        return false;
      }
      final Ast.IntLiteral literal = (Ast.IntLiteral) element;
      if (!literal.between(0, Character.MAX_CODE_POINT)
          || literal.between(
              Character.MIN_SURROGATE, Character.MAX_SURROGATE)) {
        return false;
      }
    }
    return true;
  }

  /** Decodes a list of code points. */
  static String decodeCharlist(Ast.ListTerm list) {
    final StringBuilder b = new StringBuilder();
    for (Ast.Term element : list.elements) {
      b.appendCodePoint(((Ast.IntLiteral) element).value.intValueExact());
    }
    return b.toString();
  }

  /** Returns whether every segment of a binary is a byte literal. */
  static boolean isByteLiteral(Ast.Form binary) {
    for (Ast.Term segment : binary.args()) {
      if (!(segment instanceof Ast.IntLiteral)
          || !((Ast.IntLiteral) segment).between(0, 255)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns whether the last element of a list is a cons cell, {@code [h |
   * t]}.
   */
  static boolean hasTail(Ast.ListTerm list) {
    return !list.elements.isEmpty()
        && isForm(list.elements.get(list.elements.size() - 1), "|", 2);
  }
}

// End Terms.java
