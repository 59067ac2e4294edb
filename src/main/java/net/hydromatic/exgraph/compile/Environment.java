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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Set of variable names that are bound at a point in an expression.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. Neither
 * the new nor the old will ever change.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 */
public abstract class Environment {
  /**
   * Visits every name bound in this environment, innermost first. A name
   * that is bound more than once may be visited more than once.
   */
  abstract void visit(Consumer<String> consumer);

  /** Returns whether {@code name} is bound. */
  public abstract boolean has(String name);

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we did,
   * debuggers would invoke it automatically, burning lots of CPU and memory.
   */
  public String asString() {
    return names().toString();
  }

  /**
   * Creates an environment that is the same as a given environment, plus one
   * more variable.
   */
  public Environment bind(String name) {
    return new Environments.SubEnvironment(this, name);
  }

  /**
   * Creates an environment that is the same as this, plus the given names.
   */
  public final Environment bindAll(Iterable<String> names) {
    return Environments.bind(this, names);
  }

  /** Returns the bound names, sorted. */
  public final Set<String> names() {
    final Set<String> names = new TreeSet<>();
    visit(names::add);
    return ImmutableSortedSet.copyOf(names);
  }

  /**
   * If this environment only binds names in the given set, returns its parent.
   * Never returns null. The empty environment returns itself.
   */
  abstract Environment nearestAncestorNotObscuredBy(Set<String> names);
}

// End Environment.java
