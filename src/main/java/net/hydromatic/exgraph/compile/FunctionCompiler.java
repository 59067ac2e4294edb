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
import net.hydromatic.exgraph.graph.Core;
import net.hydromatic.exgraph.graph.ExpressionGraph;
import net.hydromatic.exgraph.graph.Structure;
import net.hydromatic.exgraph.graph.Triples;
import org.apache.jena.graph.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiles function literals and captures.
 *
 * <p>A function literal whose clauses reference variables they do not bind
 * is also a {@link Core#Closure}, and has a node for each captured
 * variable. If the context knows the scopes that enclose the literal, the
 * closure also records how far out its variables come from.
 */
class FunctionCompiler {
  private final ExpressionCompiler compiler;
  private final ExpressionGraph.Builder graph;

  FunctionCompiler(ExpressionCompiler compiler) {
    this.compiler = requireNonNull(compiler);
    this.graph = compiler.graph;
  }

  Node compile(Shape shape, Ast.Form form) {
    switch (shape) {
      case FN:
        return fn(form);
      case PLACEHOLDER:
        return placeholder(form);
      case FUNCTION_CAPTURE:
        return functionCapture(form);
      case PARTIAL_APPLICATION:
        return partialApplication(form);
      default:
        throw new AssertionError("not a function: " + shape);
    }
  }

  private Node fn(Ast.Form form) {
    final AnonymousFunction fn = AnonymousFunction.of(form);
    final @Nullable ScopeChain scopeChain = compiler.context.scopeChain;
    final Node node = compiler.node(form, Structure.AnonymousFunction);
    graph.add(node, Structure.arity, Triples.nonNegativeInteger(fn.arity()));
    for (FnClause clause : fn.clauses) {
      final Node clauseNode = IdGenerator.child(node, "clause", clause.order);
      graph.type(clauseNode, Structure.FunctionClause);
      graph.add(node, Structure.hasClause, clauseNode);
      graph.add(
          clauseNode,
          Structure.clauseOrder,
          Triples.positiveInteger(clause.order));
      compiler.location(clauseNode, clause.pos);
      for (Ast.Term parameter : clause.parameters) {
        graph.add(
            clauseNode,
            Structure.hasParameter,
            compiler.compilePattern(parameter));
      }

      // Functions nested in the body see this clause's parameters as an
      // enclosing scope.
      final ExpressionCompiler inner =
          scopeChain == null
              ? compiler
              : compiler.withContext(
                  compiler.context.withScopeChain(
                      scopeChain.push(
                          Scope.Kind.CLOSURE, clause.boundVariables, null)));
      if (clause.guard != null) {
        graph.add(clauseNode, Core.hasGuard, inner.compile(clause.guard));
      }
      graph.add(clauseNode, Structure.hasBody, inner.compile(clause.body));
    }

    final FreeVariableAnalysis analysis = ClosureAnalyzer.analyze(fn);
    compiler.context.tracer.onClosure(node, analysis);
    if (!analysis.hasCaptures()) {
      return node;
    }
    graph.type(node, Core.Closure);
    for (FreeVariable v : analysis.freeVariables) {
      final Node capture = IdGenerator.child(node, "capture", v.name);
      graph.add(node, Core.capturesVariable, capture);
      graph.type(capture, Core.Variable);
      graph.add(capture, Core.name, v.name);
      graph.add(
          capture,
          Core.referenceCount,
          Triples.positiveInteger(v.referenceCount));
    }
    if (scopeChain != null) {
      final ScopeAnalysis scopeAnalysis =
          ClosureAnalyzer.analyzeScope(
              analysis.freeVariableNames(), scopeChain);
      graph.add(
          node,
          Core.captureDepth,
          Triples.nonNegativeInteger(scopeAnalysis.captureDepth));
      graph.add(
          node,
          Core.crossesFunctionBoundary,
          scopeAnalysis.crossesFunctionBoundary);
    }
    return node;
  }

  /** Compiles a placeholder, {@code &1}. */
  private Node placeholder(Ast.Form form) {
    final Node node = capture(form);
    graph.add(
        node,
        Core.captureIndex,
        Triples.positiveInteger(
            requireNonNull(PlaceholderAnalyzer.position(form))));
    return node;
  }

  /** Compiles a reference to a named function, {@code &Enum.map/2}. */
  private Node functionCapture(Ast.Form form) {
    final FunctionReference ref =
        requireNonNull(FunctionReference.of(form.arg(0)));
    final Node node = capture(form);
    graph.add(node, Core.captureFunctionName, ref.function);
    if (ref.arity != null) {
      graph.add(
          node, Core.captureArity, Triples.nonNegativeInteger(ref.arity));
    }
    if (ref.module != null) {
      graph.add(node, Core.captureModuleName, ref.module);
      graph.add(
          node, Core.refersToModule, compiler.context.moduleIri(ref.module));
      if (ref.arity != null) {
        graph.add(
            node,
            Core.refersToFunction,
            compiler.context.functionIri(ref.module, ref.function, ref.arity));
      }
    } else if (ref.receiver != null) {
      graph.add(node, Core.hasReceiver, compiler.compile(ref.receiver));
    }
    return node;
  }

  /**
   * Compiles a partial application, such as {@code &(&1 + &3)}. Its arity is
   * the highest placeholder, even if lower placeholders are unused.
   */
  private Node partialApplication(Ast.Form form) {
    final Ast.Term body = form.arg(0);
    final PlaceholderAnalysis analysis = PlaceholderAnalyzer.analyze(body);
    final Node node = capture(form);
    graph.type(node, Core.PartialApplication);
    graph.add(node, Core.hasOperand, compiler.compile(body));
    graph.add(
        node, Core.captureArity, Triples.nonNegativeInteger(analysis.arity()));
    for (int gap : analysis.gaps) {
      graph.add(node, Core.captureGap, Triples.positiveInteger(gap));
    }
    graph.add(
        node,
        Core.placeholderUsageCount,
        Triples.nonNegativeInteger(analysis.totalUsages()));
    return node;
  }

  private Node capture(Ast.Form form) {
    final Node node = compiler.node(form, Core.CaptureOperator);
    graph.add(node, Core.operatorSymbol, "&");
    return node;
  }
}

// End FunctionCompiler.java
