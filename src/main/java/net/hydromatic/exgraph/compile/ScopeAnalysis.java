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

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Where the free variables of a function literal come from, given the chain
 * of scopes that encloses it.
 */
public class ScopeAnalysis {
  /**
   * Innermost enclosing scope that binds each free variable. Free variables
   * that no scope binds are absent.
   */
  public final ImmutableMap<String, Scope> variableSources;

  /**
   * Maximum number of scopes between the function literal and the scope that
   * provides one of its variables; 0 if every variable comes from the
   * innermost enclosing scope, or if there are no sources.
   */
  public final int captureDepth;

  /** Whether some variable is provided from outside an enclosing function. */
  public final boolean crossesFunctionBoundary;

  /** Whether some variable is provided by a module scope. */
  public final boolean capturesModuleLevel;

  ScopeAnalysis(
      Map<String, Scope> variableSources,
      int captureDepth,
      boolean crossesFunctionBoundary,
      boolean capturesModuleLevel) {
    this.variableSources = ImmutableMap.copyOf(variableSources);
    this.captureDepth = captureDepth;
    this.crossesFunctionBoundary = crossesFunctionBoundary;
    this.capturesModuleLevel = capturesModuleLevel;
  }

  @Override
  public String toString() {
    return "sources " + variableSources + ", depth " + captureDepth;
  }
}

// End ScopeAnalysis.java
