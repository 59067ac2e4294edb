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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>The tree mirrors the quoted form of the source language: atoms, numbers,
 * strings, lists and two-element tuples quote to themselves, and everything
 * else is a three-element {@link Form}.
 */
public class Ast {
  private Ast() {}

  /** Base class for a term, the unit of syntax. */
  public abstract static class Term extends AstNode {
    Term(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Atom, such as {@code :ok}, {@code true} or {@code nil}. */
  public static class Atom extends Term {
    public final String name;

    Atom(Pos pos, String name) {
      super(pos, Op.ATOM);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Atom && name.equals(((Atom) o).name);
    }

    /** Returns whether this atom is {@code true} or {@code false}. */
    public boolean isBoolean() {
      return name.equals("true") || name.equals("false");
    }

    /** Returns whether this atom is {@code nil}. */
    public boolean isNil() {
      return name.equals("nil");
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.atom(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Integer literal, of arbitrary precision. */
  public static class IntLiteral extends Term {
    public final BigInteger value;

    IntLiteral(Pos pos, BigInteger value) {
      super(pos, Op.INT_LITERAL);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IntLiteral && value.equals(((IntLiteral) o).value);
    }

    /** Returns whether the value lies in the range {@code [lower, upper]}. */
    public boolean between(long lower, long upper) {
      return value.compareTo(BigInteger.valueOf(lower)) >= 0
          && value.compareTo(BigInteger.valueOf(upper)) <= 0;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(value.toString());
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Floating-point literal. */
  public static class FloatLiteral extends Term {
    public final double value;

    FloatLiteral(Pos pos, double value) {
      super(pos, Op.FLOAT_LITERAL);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FloatLiteral
              && Double.compare(value, ((FloatLiteral) o).value) == 0;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(Double.toString(value));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** String literal; a binary in the source language. */
  public static class StringLiteral extends Term {
    public final String value;

    StringLiteral(Pos pos, String value) {
      super(pos, Op.STRING_LITERAL);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof StringLiteral
              && value.equals(((StringLiteral) o).value);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.string(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** List, such as {@code [1, 2]} or the keyword list {@code [do: x]}. */
  public static class ListTerm extends Term {
    public final ImmutableList<Term> elements;

    ListTerm(Pos pos, ImmutableList<Term> elements) {
      super(pos, Op.LIST);
      this.elements = requireNonNull(elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ListTerm && elements.equals(((ListTerm) o).elements);
    }

    /**
     * Returns whether this is a keyword list: non-empty, and every element a
     * pair whose first element is an atom.
     */
    public boolean isKeywordList() {
      if (elements.isEmpty()) {
        return false;
      }
      for (Term element : elements) {
        if (!(element instanceof Pair)
            || !(((Pair) element).first instanceof Atom)) {
          return false;
        }
      }
      return true;
    }

    /**
     * Returns the value of the first entry with a given key, if this is a
     * keyword list, or null.
     */
    public @Nullable Term keyword(String key) {
      for (Term element : elements) {
        if (element instanceof Pair) {
          final Pair pair = (Pair) element;
          if (pair.first instanceof Atom
              && ((Atom) pair.first).name.equals(key)) {
            return pair.second;
          }
        }
      }
      return null;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("[").appendAll(elements).append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Two-element tuple. */
  public static class Pair extends Term {
    public final Term first;
    public final Term second;

    Pair(Pos pos, Term first, Term second) {
      super(pos, Op.PAIR);
      this.first = requireNonNull(first);
      this.second = requireNonNull(second);
    }

    @Override
    public int hashCode() {
      return Objects.hash(first, second);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Pair
              && first.equals(((Pair) o).first)
              && second.equals(((Pair) o).second);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("{")
          .append(first)
          .append(", ")
          .append(second)
          .append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Three-element form {@code {head, meta, args}}.
   *
   * <p>If {@link #args} is null, the form is a variable, and {@link #context}
   * is the name of the module that introduced it (if any). Otherwise the form
   * is an application of {@link #head}, which is usually an atom (a local
   * call, operator or special form) and is sometimes another form (for
   * example, a remote call's dot form).
   *
   * <p>Source positions live in {@link #pos}, not in the metadata list.
   */
  public static class Form extends Term {
    public final Term head;
    public final @Nullable ImmutableList<Term> args;
    public final @Nullable String context;

    Form(
        Pos pos,
        Term head,
        @Nullable ImmutableList<Term> args,
        @Nullable String context) {
      super(pos, Op.FORM);
      this.head = requireNonNull(head);
      this.args = args;
      this.context = context;
    }

    @Override
    public int hashCode() {
      return Objects.hash(head, args, context);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Form
              && head.equals(((Form) o).head)
              && Objects.equals(args, ((Form) o).args)
              && Objects.equals(context, ((Form) o).context);
    }

    /** Returns the name of the head, if it is an atom, otherwise null. */
    public @Nullable String name() {
      return head instanceof Atom ? ((Atom) head).name : null;
    }

    /** Returns whether this form has variable shape. */
    public boolean isVariable() {
      return args == null && head instanceof Atom;
    }

    /** Returns whether this form applies an atom with a given name. */
    public boolean is(String name) {
      return args != null && name.equals(name());
    }

    /**
     * Returns whether this form applies an atom with a given name to a given
     * number of arguments.
     */
    public boolean is(String name, int arity) {
      return is(name) && args().size() == arity;
    }

    /** Returns the arguments, or an empty list for a variable. */
    public ImmutableList<Term> args() {
      return args == null ? ImmutableList.of() : args;
    }

    /** Returns the number of arguments; 0 for a variable. */
    public int arity() {
      return args().size();
    }

    /** Returns the {@code i}th argument. */
    public Term arg(int i) {
      return args().get(i);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("{").append(head).append(", ").meta(pos).append(", ");
      if (args != null) {
        w.append("[").appendAll(args).append("]");
      } else if (context != null) {
        w.append(context);
      } else {
        w.append("nil");
      }
      return w.append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Ast.java
