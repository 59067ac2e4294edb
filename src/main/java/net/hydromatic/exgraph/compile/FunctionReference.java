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

import static java.util.Objects.requireNonNull;

import net.hydromatic.exgraph.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reference to a named function in a capture: {@code &fun/2},
 * {@code &Mod.fun/2}, or {@code &Mod.fun}.
 */
class FunctionReference {
  /**
   * Name of the module, such as {@code Enum} or {@code :lists}; null for a
   * local function, or if the receiver is not a module name.
   */
  final @Nullable String module;

  /** Receiver of a remote function; null for a local function. */
  final Ast.@Nullable Term receiver;

  final String function;
  /** Arity, or null if not given. */
  final @Nullable Integer arity;

  private FunctionReference(
      @Nullable String module,
      Ast.@Nullable Term receiver,
      String function,
      @Nullable Integer arity) {
    this.module = module;
    this.receiver = receiver;
    this.function = requireNonNull(function);
    this.arity = arity;
  }

  /**
   * Parses the argument of a capture as a function reference, or returns
   * null.
   */
  static @Nullable FunctionReference of(Ast.Term arg) {
    if (Terms.isForm(arg, "/", 2)) {
      final Ast.Form slash = (Ast.Form) arg;
      if (!(slash.arg(1) instanceof Ast.IntLiteral)
          || !((Ast.IntLiteral) slash.arg(1)).between(0, 255)) {
        return null;
      }
      final int arity = ((Ast.IntLiteral) slash.arg(1)).value.intValueExact();
      final String local = Terms.variableName(slash.arg(0));
      if (local != null) {
        return new FunctionReference(null, null, local, arity);
      }
      return remote(slash.arg(0), arity);
    }
    return remote(arg, null);
  }

  /** Parses {@code Mod.fun}, a remote call with no arguments. */
  private static @Nullable FunctionReference remote(
      Ast.Term term, @Nullable Integer arity) {
    if (!(term instanceof Ast.Form)) {
      return null;
    }
    final Ast.Form call = (Ast.Form) term;
    if (!Terms.isRemoteHead(call.head) || call.arity() != 0) {
      return null;
    }
    final Ast.Form dot = (Ast.Form) call.head;
    final Ast.Term receiver = dot.arg(0);
    final String module = Terms.moduleName(receiver);
    if (arity == null && module == null) {
      // "&m.f" where "m" is a variable is a call, not a reference
      return null;
    }
    return new FunctionReference(
        module, receiver, ((Ast.Atom) dot.arg(1)).name, arity);
  }

  /** Returns whether this is a reference to a function in another module. */
  boolean isRemote() {
    return receiver != null;
  }

  @Override
  public String toString() {
    return "&"
        + (receiver == null ? "" : (module == null ? "?" : module) + ".")
        + function
        + (arity == null ? "" : "/" + arity);
  }
}

// End FunctionReference.java
