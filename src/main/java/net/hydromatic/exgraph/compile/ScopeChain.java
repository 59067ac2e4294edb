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

import static com.google.common.collect.Lists.reverse;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The scopes that enclose a function literal, outermost first.
 *
 * <p>Immutable; {@link #push} returns a new chain.
 */
public class ScopeChain {
  public static final ScopeChain EMPTY = new ScopeChain(ImmutableList.of());

  public final ImmutableList<Scope> scopes;

  private ScopeChain(ImmutableList<Scope> scopes) {
    this.scopes = scopes;
  }

  /** Returns a chain with one more, innermost, scope. */
  public ScopeChain push(
      Scope.Kind kind, Iterable<String> variables, @Nullable String name) {
    final Scope scope = new Scope(scopes.size(), kind, variables, name);
    return new ScopeChain(
        ImmutableList.<Scope>builder().addAll(scopes).add(scope).build());
  }

  public ScopeChain push(Scope.Kind kind, String... variables) {
    return push(kind, ImmutableSet.copyOf(variables), null);
  }

  /** Returns the level that a closure nested directly inside would have. */
  public int closureLevel() {
    return scopes.size();
  }

  /** Returns the innermost scope that binds a name, or null. */
  public @Nullable Scope find(String variable) {
    for (Scope scope : reverse(scopes)) {
      if (scope.binds(variable)) {
        return scope;
      }
    }
    return null;
  }

  /**
   * Returns whether there is a function scope strictly between a given scope
   * and a closure nested directly inside this chain.
   */
  public boolean functionBetween(Scope source) {
    for (Scope scope : scopes) {
      if (scope.level > source.level && scope.kind == Scope.Kind.FUNCTION) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return scopes.toString();
  }
}

// End ScopeChain.java
