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

import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Frame in a {@link ScopeChain}. */
public class Scope {
  /** Position in the chain; 0 is outermost. */
  public final int level;

  public final Kind kind;
  public final ImmutableSet<String> variables;
  public final @Nullable String name;

  Scope(
      int level,
      Kind kind,
      Iterable<String> variables,
      @Nullable String name) {
    this.level = level;
    this.kind = requireNonNull(kind);
    this.variables = ImmutableSet.copyOf(variables);
    this.name = name;
  }

  /** Returns whether this scope binds a given name. */
  public boolean binds(String variable) {
    return variables.contains(variable);
  }

  @Override
  public int hashCode() {
    return Objects.hash(level, kind, variables, name);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Scope
            && level == ((Scope) o).level
            && kind == ((Scope) o).kind
            && variables.equals(((Scope) o).variables)
            && Objects.equals(name, ((Scope) o).name);
  }

  @Override
  public String toString() {
    return kind + (name == null ? "" : " " + name) + "@" + level + variables;
  }

  /** Kind of scope. */
  public enum Kind {
    MODULE,
    FUNCTION,
    CLOSURE,
    BLOCK
  }
}

// End Scope.java
