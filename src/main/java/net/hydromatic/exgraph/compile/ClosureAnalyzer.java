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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds the variables that a function literal captures from the scopes that
 * enclose it.
 *
 * <p>Each clause is analyzed against the names bound by its own parameters;
 * the results of the clauses are then merged by name. Names bound inside a
 * clause (by a nested function, a case clause, a match in a block, and so
 * on) are visible only inside the construct that binds them.
 */
public class ClosureAnalyzer {
  private ClosureAnalyzer() {}

  /** Analyzes a function literal. */
  public static FreeVariableAnalysis analyze(AnonymousFunction fn) {
    final Map<String, FreeVariable> freeVariables = new LinkedHashMap<>();
    final Set<String> boundVariables = new LinkedHashSet<>();
    final Set<String> allReferences = new LinkedHashSet<>();
    for (FnClause clause : fn.clauses) {
      final FreeVariableAnalysis analysis = analyzeClause(clause, fn.pos);
      for (FreeVariable v : analysis.freeVariables) {
        freeVariables.merge(v.name, v, FreeVariable::plus);
      }
      boundVariables.addAll(analysis.boundVariables);
      allReferences.addAll(analysis.allReferences);
    }
    return new FreeVariableAnalysis(
        freeVariables.values(), boundVariables, allReferences);
  }

  /** Analyzes a single clause of a function literal. */
  public static FreeVariableAnalysis analyzeClause(FnClause clause) {
    return analyzeClause(clause, clause.pos);
  }

  private static FreeVariableAnalysis analyzeClause(
      FnClause clause, Pos capturedAt) {
    // Pinned variables in the parameters refer to enclosing bindings, even
    // if a parameter has the same name.
    final List<Ast.Form> pins = new ArrayList<>();
    new FreeFinder(Environments.empty(), pins::add)
        .visitPatternReads(clause.parameters);

    final List<Ast.Form> references = new ArrayList<>();
    final FreeFinder finder =
        new FreeFinder(Environments.empty(), references::add);
    if (clause.guard != null) {
      clause.guard.accept(finder);
    }
    clause.body.accept(finder);

    final Map<String, List<Pos>> free = new LinkedHashMap<>();
    final Set<String> allReferences = new LinkedHashSet<>();
    for (Ast.Form pin : pins) {
      final String name = name(pin);
      allReferences.add(name);
      free.computeIfAbsent(name, k -> new ArrayList<>()).add(pin.pos);
    }
    for (Ast.Form reference : references) {
      final String name = name(reference);
      allReferences.add(name);
      if (!clause.boundVariables.contains(name)) {
        free.computeIfAbsent(name, k -> new ArrayList<>()).add(reference.pos);
      }
    }

    final List<FreeVariable> freeVariables = new ArrayList<>();
    free.forEach((name, positions) -> {
      final List<Pos> known = new ArrayList<>();
      for (Pos pos : positions) {
        if (pos.isKnown()) {
          known.add(pos);
        }
      }
      freeVariables.add(
          new FreeVariable(name, positions.size(), known, capturedAt));
    });
    return new FreeVariableAnalysis(
        freeVariables, clause.boundVariables, allReferences);
  }

  private static String name(Ast.Form variable) {
    final @Nullable String name = variable.name();
    checkArgument(name != null, "not a variable: %s", variable);
    return name;
  }

  /**
   * Finds where the named variables come from, given the chain of scopes
   * that encloses a function literal.
   *
   * <p>Each name is looked up innermost scope first. A variable provided by
   * the scope directly enclosing the literal has depth 0; each scope in
   * between adds 1.
   */
  public static ScopeAnalysis analyzeScope(
      Iterable<String> names, ScopeChain scopeChain) {
    final Map<String, Scope> sources = new LinkedHashMap<>();
    int captureDepth = 0;
    boolean crossesFunctionBoundary = false;
    boolean capturesModuleLevel = false;
    for (String name : names) {
      final Scope scope = scopeChain.find(name);
      if (scope == null) {
        continue;
      }
      sources.put(name, scope);
      captureDepth =
          Math.max(captureDepth, scopeChain.closureLevel() - scope.level - 1);
      if (scopeChain.functionBetween(scope)) {
        crossesFunctionBoundary = true;
      }
      if (scope.kind == Scope.Kind.MODULE) {
        capturesModuleLevel = true;
      }
    }
    return new ScopeAnalysis(
        sources, captureDepth, crossesFunctionBoundary, capturesModuleLevel);
  }
}

// End ClosureAnalyzer.java
