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
import com.google.common.collect.Iterables;
import java.util.Set;
import java.util.function.Consumer;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Creates an empty environment. */
  public static Environment empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /** Creates an environment that is a given environment plus names. */
  static Environment bind(Environment env, Iterable<String> names) {
    if (Iterables.size(names) < 5) {
      for (String name : names) {
        env = env.bind(name);
      }
      return env;
    } else {
      final ImmutableSet<String> set = ImmutableSet.copyOf(names);
      env = env.nearestAncestorNotObscuredBy(set);
      return new MapEnvironment(env, set);
    }
  }

  /**
   * Environment that inherits from a parent environment and adds one name.
   */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final String name;

    SubEnvironment(Environment parent, String name) {
      this.parent = requireNonNull(parent);
      this.name = requireNonNull(name);
    }

    @Override
    public String toString() {
      return name + ", ...";
    }

    @Override
    public boolean has(String name) {
      return this.name.equals(name) || parent.has(name);
    }

    @Override
    public Environment bind(String name) {
      Environment env;
      if (this.name.equals(name)) {
        // Binding the same name again adds nothing. Bind the parent
        // environment instead, which prevents long chains from forming.
        env = parent;
        while (env instanceof SubEnvironment
            && ((SubEnvironment) env).name.equals(name)) {
          env = ((SubEnvironment) env).parent;
        }
      } else {
        env = this;
      }
      return new SubEnvironment(env, name);
    }

    @Override
    void visit(Consumer<String> consumer) {
      consumer.accept(name);
      parent.visit(consumer);
    }

    @Override
    Environment nearestAncestorNotObscuredBy(Set<String> names) {
      return names.contains(name)
          ? parent.nearestAncestorNotObscuredBy(names)
          : this;
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override
    void visit(Consumer<String> consumer) {}

    @Override
    public boolean has(String name) {
      return false;
    }

    @Override
    Environment nearestAncestorNotObscuredBy(Set<String> names) {
      return this;
    }
  }

  /** Environment that keeps names in a set. */
  static class MapEnvironment extends Environment {
    private final Environment parent;
    private final ImmutableSet<String> names;

    MapEnvironment(Environment parent, ImmutableSet<String> names) {
      this.parent = requireNonNull(parent);
      this.names = requireNonNull(names);
    }

    @Override
    void visit(Consumer<String> consumer) {
      names.forEach(consumer);
      parent.visit(consumer);
    }

    @Override
    public boolean has(String name) {
      return names.contains(name) || parent.has(name);
    }

    @Override
    Environment nearestAncestorNotObscuredBy(Set<String> names) {
      return names.containsAll(this.names)
          ? parent.nearestAncestorNotObscuredBy(names)
          : this;
    }
  }
}

// End Environments.java
