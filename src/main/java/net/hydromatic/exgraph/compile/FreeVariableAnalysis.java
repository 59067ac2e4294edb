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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of finding the free variables of a function literal. */
public class FreeVariableAnalysis {
  /** Free variables, sorted by name. */
  public final ImmutableList<FreeVariable> freeVariables;
  /** Names bound by the parameters of any clause. */
  public final ImmutableSortedSet<String> boundVariables;
  /** Names of every variable referenced, free or bound. */
  public final ImmutableSortedSet<String> allReferences;

  FreeVariableAnalysis(
      Iterable<FreeVariable> freeVariables,
      Iterable<String> boundVariables,
      Iterable<String> allReferences) {
    this.freeVariables =
        Ordering.<String>natural()
            .onResultOf((FreeVariable v) -> v.name)
            .immutableSortedCopy(freeVariables);
    this.boundVariables = ImmutableSortedSet.copyOf(boundVariables);
    this.allReferences = ImmutableSortedSet.copyOf(allReferences);
  }

  /** Returns whether the function captures any variable. */
  public boolean hasCaptures() {
    return !freeVariables.isEmpty();
  }

  /** Returns the number of references to free variables. */
  public int totalCaptureCount() {
    int n = 0;
    for (FreeVariable v : freeVariables) {
      n += v.referenceCount;
    }
    return n;
  }

  /** Returns the names of the free variables, sorted. */
  public ImmutableList<String> freeVariableNames() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    freeVariables.forEach(v -> b.add(v.name));
    return b.build();
  }

  /** Returns the free variable with a given name, or null. */
  public @Nullable FreeVariable get(String name) {
    for (FreeVariable v : freeVariables) {
      if (v.name.equals(name)) {
        return v;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "free " + freeVariables + ", bound " + boundVariables;
  }
}

// End FreeVariableAnalysis.java
