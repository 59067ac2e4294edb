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
import net.hydromatic.exgraph.ast.Pos;
import net.hydromatic.exgraph.graph.Core;
import net.hydromatic.exgraph.graph.ExpressionGraph;
import net.hydromatic.exgraph.graph.Outcome;
import net.hydromatic.exgraph.graph.Triples;
import org.apache.jena.graph.Node;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles an expression to a graph.
 *
 * <p>Each term is classified by {@link Classifier} and compiled by the
 * compiler for its {@link Shape.Category}. Every compiled term gets one node
 * from the context's {@link IdGenerator}; its children are compiled
 * depth-first, left to right, into the same graph.
 */
public class ExpressionCompiler {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ExpressionCompiler.class);

  final Context context;
  final ExpressionGraph.Builder graph;

  private final LiteralCompiler literalCompiler;
  private final OperatorCompiler operatorCompiler;
  private final PatternCompiler patternCompiler;
  private final ControlFlowCompiler controlFlowCompiler;
  private final FunctionCompiler functionCompiler;

  ExpressionCompiler(Context context, ExpressionGraph.Builder graph) {
    this.context = requireNonNull(context);
    this.graph = requireNonNull(graph);
    this.literalCompiler = new LiteralCompiler(this);
    this.operatorCompiler = new OperatorCompiler(this);
    this.patternCompiler = new PatternCompiler(this);
    this.controlFlowCompiler = new ControlFlowCompiler(this);
    this.functionCompiler = new FunctionCompiler(this);
  }

  /**
   * Compiles an expression.
   *
   * <p>Returns {@link Outcome#SKIP} if there is no expression, or if
   * {@link Modes#shouldCompile} says that the file should not be compiled in
   * full.
   *
   * @param term Expression, or null
   * @param context Context of the file that contains the expression
   */
  public static Outcome compile(Ast.@Nullable Term term, Context context) {
    requireNonNull(context, "context");
    if (term == null) {
      return Outcome.SKIP;
    }
    if (!Modes.shouldCompile(context)) {
      LOGGER.debug("skipping expressions in {}", context.filePath);
      context.tracer.onSkip(context.filePath);
      return Outcome.SKIP;
    }
    final ExpressionGraph.Builder graph = ExpressionGraph.builder();
    final Node root = new ExpressionCompiler(context, graph).compile(term);
    return Outcome.of(root, graph.build());
  }

  /** Returns a compiler that shares this compiler's graph. */
  ExpressionCompiler withContext(Context context) {
    if (context == this.context) {
      return this;
    }
    return new ExpressionCompiler(context, graph);
  }

  /** Compiles a term and returns its node. */
  Node compile(Ast.Term term) {
    final Shape shape = Classifier.classify(term);
    switch (shape.category) {
      case LITERAL:
        return literalCompiler.compile(shape, term);
      case OPERATOR:
        return operatorCompiler.compile(shape, (Ast.Form) term);
      case REFERENCE:
        return compileReference(shape, term);
      case FUNCTION:
        return functionCompiler.compile(shape, (Ast.Form) term);
      case CONTROL_FLOW:
        return controlFlowCompiler.compile(shape, (Ast.Form) term);
      case CALL:
        return compileCall(shape, (Ast.Form) term);
      case FALLBACK:
        return fallback(term);
      default:
        throw new AssertionError("unknown category " + shape.category);
    }
  }

  /** Compiles a term that occurs as a pattern. */
  Node compilePattern(Ast.Term term) {
    return patternCompiler.compile(term);
  }

  /**
   * Allocates a node for a term, with a given type and the term's source
   * location.
   */
  Node node(Ast.Term term, Node type) {
    final Node node = context.ids.next();
    graph.type(node, type);
    location(node, term.pos);
    return node;
  }

  /** Records the source location of a node, if known and wanted. */
  void location(Node node, Pos pos) {
    if (!pos.isKnown() || !context.booleanValue(Prop.INCLUDE_LOCATIONS)) {
      return;
    }
    graph.add(node, Core.startLine, Triples.positiveInteger(pos.startLine));
    if (pos.hasColumn()) {
      graph.add(
          node, Core.startColumn, Triples.positiveInteger(pos.startColumn));
    }
    if (pos.endLine >= pos.startLine) {
      graph.add(node, Core.endLine, Triples.positiveInteger(pos.endLine));
    }
  }

  /**
   * Compiles a term that matches no known shape to a generic expression that
   * holds the term's quoted form.
   */
  Node fallback(Ast.Term term) {
    final Node node = node(term, Core.Expression);
    final String sourceForm = term.toString();
    graph.add(node, Core.sourceForm, sourceForm);
    LOGGER.debug("no shape for {}; compiled as {}", sourceForm, node);
    context.tracer.onFallback(term, node);
    return node;
  }

  private Node compileReference(Shape shape, Ast.Term term) {
    final Ast.Form form = (Ast.Form) term;
    final Node node;
    switch (shape) {
      case VARIABLE:
        node = node(form, Core.Variable);
        graph.add(node, Core.name, requireNonNull(form.name()));
        return node;
      case WILDCARD:
        return node(form, Core.WildcardPattern);
      case PIN:
        node = node(form, Core.PinPattern);
        graph.add(
            node, Core.name, requireNonNull(Terms.variableName(form.arg(0))));
        return node;
      case MODULE_REFERENCE:
        final String module = requireNonNull(Terms.aliasName(form));
        node = node(form, Core.ModuleReference);
        graph.add(node, Core.name, module);
        graph.add(node, Core.refersToModule, context.moduleIri(module));
        return node;
      case ATTRIBUTE_REFERENCE:
        node = node(form, Core.ModuleAttributeReference);
        graph.add(
            node, Core.name, requireNonNull(Terms.variableName(form.arg(0))));
        return node;
      default:
        throw new AssertionError("not a reference: " + shape);
    }
  }

  private Node compileCall(Shape shape, Ast.Form form) {
    final Node node;
    switch (shape) {
      case BLOCK:
        node = node(form, Core.Block);
        for (Ast.Term statement : form.args()) {
          graph.add(node, Core.hasExpression, compile(statement));
        }
        return node;
      case REMOTE_CALL:
        return compileRemoteCall(form);
      case LOCAL_CALL:
        node = node(form, Core.LocalCall);
        graph.add(node, Core.name, requireNonNull(form.name()));
        for (Ast.Term arg : form.args()) {
          graph.add(node, Core.hasArgument, compile(arg));
        }
        return node;
      default:
        throw new AssertionError("not a call: " + shape);
    }
  }

  /**
   * Compiles a call to a function in another module, {@code Mod.fun(args)}.
   * If the receiver is not a module name (say a variable that holds a module
   * or a map), it is compiled as an expression.
   */
  private Node compileRemoteCall(Ast.Form call) {
    final Ast.Form dot = (Ast.Form) call.head;
    final Ast.Term receiver = dot.arg(0);
    final String function = ((Ast.Atom) dot.arg(1)).name;
    final String module = Terms.moduleName(receiver);
    final Node node = node(call, Core.RemoteCall);
    graph.add(node, Core.name, receiverName(receiver, module) + "." + function);
    if (module != null) {
      graph.add(node, Core.refersToModule, context.moduleIri(module));
      graph.add(
          node,
          Core.refersToFunction,
          context.functionIri(module, function, call.arity()));
    } else {
      graph.add(node, Core.hasReceiver, compile(receiver));
    }
    for (Ast.Term arg : call.args()) {
      graph.add(node, Core.hasArgument, compile(arg));
    }
    return node;
  }

  private static String receiverName(
      Ast.Term receiver, @Nullable String module) {
    if (module != null) {
      return module;
    }
    final String variable = Terms.variableName(receiver);
    return variable != null ? variable : receiver.toString();
  }
}

// End ExpressionCompiler.java
