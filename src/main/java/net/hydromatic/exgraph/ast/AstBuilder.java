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
package net.hydromatic.exgraph.ast;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds syntax tree nodes.
 *
 * <p>Methods without a {@link Pos} argument create nodes at {@link Pos#ZERO}.
 */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // atomic terms

  public Ast.Atom atom(Pos pos, String name) {
    return new Ast.Atom(pos, name);
  }

  public Ast.Atom atom(String name) {
    return atom(Pos.ZERO, name);
  }

  public Ast.Atom bool(boolean b) {
    return atom(Boolean.toString(b));
  }

  public Ast.Atom nil() {
    return atom("nil");
  }

  public Ast.IntLiteral intLiteral(Pos pos, BigInteger value) {
    return new Ast.IntLiteral(pos, value);
  }

  public Ast.IntLiteral intLiteral(long value) {
    return intLiteral(Pos.ZERO, BigInteger.valueOf(value));
  }

  public Ast.FloatLiteral floatLiteral(Pos pos, double value) {
    return new Ast.FloatLiteral(pos, value);
  }

  public Ast.FloatLiteral floatLiteral(double value) {
    return floatLiteral(Pos.ZERO, value);
  }

  public Ast.StringLiteral string(Pos pos, String value) {
    return new Ast.StringLiteral(pos, value);
  }

  public Ast.StringLiteral string(String value) {
    return string(Pos.ZERO, value);
  }

  // compound terms

  public Ast.ListTerm list(Pos pos, List<? extends Ast.Term> elements) {
    return new Ast.ListTerm(pos, ImmutableList.copyOf(elements));
  }

  public Ast.ListTerm list(Ast.Term... elements) {
    return list(Pos.ZERO, ImmutableList.copyOf(elements));
  }

  /** Creates a list of code points, the quoted form of a charlist. */
  public Ast.ListTerm charlist(String s) {
    final ImmutableList.Builder<Ast.Term> b = ImmutableList.builder();
    s.codePoints().forEach(c -> b.add(intLiteral(c)));
    return list(Pos.ZERO, b.build());
  }

  public Ast.Pair pair(Pos pos, Ast.Term first, Ast.Term second) {
    return new Ast.Pair(pos, first, second);
  }

  public Ast.Pair pair(Ast.Term first, Ast.Term second) {
    return pair(Pos.ZERO, first, second);
  }

  /** Creates a keyword list entry, {@code key: value}. */
  public Ast.Pair kw(String key, Ast.Term value) {
    return pair(atom(key), value);
  }

  /** Creates a variable. */
  public Ast.Form var(Pos pos, String name, @Nullable String context) {
    return new Ast.Form(pos, atom(pos, name), null, context);
  }

  public Ast.Form var(Pos pos, String name) {
    return var(pos, name, null);
  }

  public Ast.Form var(String name) {
    return var(Pos.ZERO, name, null);
  }

  /** Creates a form that applies a term to arguments. */
  public Ast.Form form(Pos pos, Ast.Term head, List<? extends Ast.Term> args) {
    return new Ast.Form(pos, head, ImmutableList.copyOf(args), null);
  }

  public Ast.Form form(Pos pos, String name, List<? extends Ast.Term> args) {
    return form(pos, atom(pos, name), args);
  }

  public Ast.Form form(Pos pos, String name, Ast.Term... args) {
    return form(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.Form form(String name, Ast.Term... args) {
    return form(Pos.ZERO, name, ImmutableList.copyOf(args));
  }

  /** Creates a module alias, such as {@code String.Chars}. */
  public Ast.Form aliases(String dottedName) {
    final ImmutableList.Builder<Ast.Term> parts = ImmutableList.builder();
    Splitter.on('.').split(dottedName).forEach(part -> parts.add(atom(part)));
    return form(Pos.ZERO, "__aliases__", parts.build());
  }

  /**
   * Creates a remote call, {@code Module.fun(args)}. The module is an alias
   * if its name starts with an upper-case letter, otherwise an atom.
   */
  public Ast.Form remoteCall(
      Pos pos, String module, String fun, List<? extends Ast.Term> args) {
    final Ast.Term moduleTerm =
        Character.isUpperCase(module.charAt(0))
            ? aliases(module)
            : atom(module);
    return form(pos, dot(moduleTerm, fun), args);
  }

  public Ast.Form remoteCall(String module, String fun, Ast.Term... args) {
    return remoteCall(Pos.ZERO, module, fun, ImmutableList.copyOf(args));
  }

  /** Creates a dot form, {@code {:., [], [receiver, :fun]}}. */
  public Ast.Form dot(Ast.Term receiver, String fun) {
    return form(".", receiver, atom(fun));
  }

  /** Creates a call to a local function or macro. */
  public Ast.Form call(Pos pos, String fun, List<? extends Ast.Term> args) {
    return form(pos, fun, args);
  }

  public Ast.Form call(String fun, Ast.Term... args) {
    return form(Pos.ZERO, fun, ImmutableList.copyOf(args));
  }

  /** Creates a binary operator application. */
  public Ast.Form infix(String op, Ast.Term left, Ast.Term right) {
    return form(op, left, right);
  }

  /** Creates a clause, {@code heads -> body}. */
  public Ast.Form arrow(List<? extends Ast.Term> heads, Ast.Term body) {
    return form(Pos.ZERO, "->", list(Pos.ZERO, heads), body);
  }

  /** Creates an anonymous function from clauses. */
  public Ast.Form fn(Pos pos, Ast.Term... clauses) {
    return form(pos, "fn", ImmutableList.copyOf(clauses));
  }

  public Ast.Form fn(Ast.Term... clauses) {
    return fn(Pos.ZERO, clauses);
  }

  public Ast.Form block(Ast.Term... statements) {
    return form("__block__", statements);
  }

  /** Creates a map literal, {@code %{k => v, ...}}. */
  public Ast.Form map(Ast.Pair... entries) {
    return form("%{}", entries);
  }

  /** Creates a struct literal, {@code %Module{k: v, ...}}. */
  public Ast.Form struct(String module, Ast.Pair... entries) {
    return form("%", aliases(module), map(entries));
  }

  /** Creates a tuple of arbitrary size. */
  public Ast.Term tuple(Ast.Term... elements) {
    if (elements.length == 2) {
      return pair(elements[0], elements[1]);
    }
    return form("{}", elements);
  }

  /** Creates a capture placeholder, {@code &n}. */
  public Ast.Form placeholder(int n) {
    return form("&", intLiteral(n));
  }

  public Ast.Form pin(String name) {
    return form("^", var(name));
  }

  /** Creates a module attribute reference, {@code @name}. */
  public Ast.Form attribute(String name) {
    return form("@", var(name));
  }
}

// End AstBuilder.java
