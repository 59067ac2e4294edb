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

import com.google.common.collect.ImmutableSet;
import java.util.function.Consumer;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.ast.Visitor;

/** Utilities for patterns. */
public abstract class Patterns {
  private Patterns() {}

  /**
   * Returns the names that a pattern binds, in order of first occurrence.
   *
   * <p>The wildcard, names that start with an underscore, and pinned
   * variables bind nothing. In a guarded pattern only the pattern binds; in a
   * binary segment only the value binds, not the size or type.
   */
  public static ImmutableSet<String> bindings(Ast.Term pattern) {
    final ImmutableSet.Builder<String> b = ImmutableSet.builder();
    pattern.accept(new BindingFinder(b::add));
    return b.build();
  }

  /** Returns the names that a list of patterns binds. */
  public static ImmutableSet<String> bindings(
      Iterable<? extends Ast.Term> patterns) {
    final ImmutableSet.Builder<String> b = ImmutableSet.builder();
    final BindingFinder finder = new BindingFinder(b::add);
    patterns.forEach(pattern -> pattern.accept(finder));
    return b.build();
  }

  /** Returns whether a variable name can be bound by a pattern. */
  static boolean isBindable(String name) {
    return !name.startsWith("_") && !Terms.SPECIAL_VARIABLES.contains(name);
  }

  /** Visitor that finds the variables bound by a pattern. */
  private static class BindingFinder extends Visitor {
    private final Consumer<String> consumer;

    BindingFinder(Consumer<String> consumer) {
      this.consumer = consumer;
    }

    @Override
    protected void visit(Ast.Form form) {
      if (form.isVariable()) {
        final String name = form.name();
        if (name != null && isBindable(name)) {
          consumer.accept(name);
        }
        return;
      }
      final String name = form.name();
      if (name == null) {
        return;
      }
      switch (name) {
        case "^":
        case "@":
          // pinned variables and module attributes are read, not bound
          return;
        case "when":
          // the last argument is the guard
          form.args().subList(0, Math.max(form.arity() - 1, 0))
              .forEach(this::accept);
          return;
        case "::":
          if (form.arity() == 2) {
            form.arg(0).accept(this);
          }
          return;
        default:
          form.args().forEach(this::accept);
      }
    }
  }
}

// End Patterns.java
