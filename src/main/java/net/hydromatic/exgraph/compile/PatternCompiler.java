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

import java.util.List;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.graph.Core;
import net.hydromatic.exgraph.graph.ExpressionGraph;
import org.apache.jena.graph.Node;

/**
 * Compiles patterns: function parameters, the heads of case, receive and
 * catch clauses, generators, and the left side of a match.
 *
 * <p>The root node of each pattern lists the variables that the pattern
 * binds, as given by {@link Patterns#bindings(Ast.Term)}. A term that is not
 * a recognized pattern is compiled as an expression.
 */
class PatternCompiler {
  private final ExpressionCompiler compiler;
  private final ExpressionGraph.Builder graph;

  PatternCompiler(ExpressionCompiler compiler) {
    this.compiler = requireNonNull(compiler);
    this.graph = compiler.graph;
  }

  /** Compiles a pattern, recording the names it binds. */
  Node compile(Ast.Term pattern) {
    final Node node = compileSub(pattern);
    for (String name : Patterns.bindings(pattern)) {
      graph.add(node, Core.bindsVariable, name);
    }
    return node;
  }

  private Node compileSub(Ast.Term pattern) {
    final Shape shape = Classifier.classify(pattern);
    final Node node;
    switch (shape) {
      case ATOM:
      case BOOLEAN:
      case NIL:
      case INTEGER:
      case FLOAT:
      case STRING:
      case CHARLIST:
      case BINARY:
        node = compiler.node(pattern, Core.LiteralPattern);
        LiteralCompiler.value(graph, node, shape, pattern);
        return node;

      case WILDCARD:
        return compiler.node(pattern, Core.WildcardPattern);

      case VARIABLE:
        node = compiler.node(pattern, Core.VariablePattern);
        graph.add(node, Core.name, requireNonNull(((Ast.Form) pattern).name()));
        return node;

      case PIN:
        node = compiler.node(pattern, Core.PinPattern);
        graph.add(
            node,
            Core.name,
            requireNonNull(Terms.variableName(((Ast.Form) pattern).arg(0))));
        return node;

      case TUPLE:
        node = compiler.node(pattern, Core.TuplePattern);
        if (pattern instanceof Ast.Pair) {
          final Ast.Pair pair = (Ast.Pair) pattern;
          graph.add(node, Core.hasElement, compileSub(pair.first));
          graph.add(node, Core.hasElement, compileSub(pair.second));
        } else {
          for (Ast.Term element : ((Ast.Form) pattern).args()) {
            graph.add(node, Core.hasElement, compileSub(element));
          }
        }
        return node;

      case LIST:
      case KEYWORD_LIST:
        node = compiler.node(pattern, Core.ListPattern);
        final List<Ast.Term> elements = ((Ast.ListTerm) pattern).elements;
        for (int i = 0; i < elements.size(); i++) {
          final Ast.Term element = elements.get(i);
          if (i == elements.size() - 1 && Terms.isForm(element, "|", 2)) {
            final Ast.Form cons = (Ast.Form) element;
            graph.add(node, Core.hasElement, compileSub(cons.arg(0)));
            graph.add(node, Core.hasTail, compileSub(cons.arg(1)));
          } else {
            graph.add(node, Core.hasElement, compileSub(element));
          }
        }
        return node;

      case MAP:
        node = compiler.node(pattern, Core.MapPattern);
        entries(node, ((Ast.Form) pattern).args());
        return node;

      case STRUCT:
        final Ast.Form struct = (Ast.Form) pattern;
        final String module = requireNonNull(Terms.moduleName(struct.arg(0)));
        node = compiler.node(pattern, Core.StructPattern);
        graph.add(node, Core.name, module);
        graph.add(
            node, Core.refersToModule, compiler.context.moduleIri(module));
        entries(node, ((Ast.Form) struct.arg(1)).args());
        return node;

      case MATCH:
        // "{:ok, x} = result" inside a pattern binds both sides
        final Ast.Form as = (Ast.Form) pattern;
        node = compiler.node(pattern, Core.AsPattern);
        graph.add(node, Core.hasLeftOperand, compileSub(as.arg(0)));
        graph.add(node, Core.hasRightOperand, compileSub(as.arg(1)));
        return node;

      default:
        break;
    }
    if (pattern instanceof Ast.Form) {
      final Ast.Form form = (Ast.Form) pattern;
      if (form.is("<<>>")) {
        return binary(form);
      }
      if (form.is("when") && form.arity() >= 2) {
        return guard(form);
      }
    }
    return compiler.compile(pattern);
  }

  /**
   * Compiles a binary pattern, such as {@code <<size::8, rest::binary>>}.
   * Only the value of each segment is a pattern; sizes and types are not.
   */
  private Node binary(Ast.Form binary) {
    final Node node = compiler.node(binary, Core.BinaryPattern);
    for (Ast.Term segment : binary.args()) {
      final Ast.Term value =
          Terms.isForm(segment, "::", 2)
              ? ((Ast.Form) segment).arg(0)
              : segment;
      graph.add(node, Core.hasElement, compileSub(value));
    }
    return node;
  }

  /** Compiles a guarded pattern, {@code pattern when guard}. */
  private Node guard(Ast.Form when) {
    final Node node = compiler.node(when, Core.GuardClause);
    final List<Ast.Term> args = when.args();
    for (Ast.Term pattern : args.subList(0, args.size() - 1)) {
      graph.add(node, Core.hasPattern, compileSub(pattern));
    }
    graph.add(
        node, Core.hasGuard, compiler.compile(args.get(args.size() - 1)));
    return node;
  }

  private void entries(Node node, List<Ast.Term> entries) {
    for (int i = 0; i < entries.size(); i++) {
      final Ast.Pair entry = (Ast.Pair) entries.get(i);
      final Node entryNode = IdGenerator.child(node, "entry", i + 1);
      graph.type(entryNode, Core.MapEntry);
      graph.add(node, Core.hasEntry, entryNode);
      graph.add(entryNode, Core.entryKey, LiteralCompiler.key(entry.first));
      graph.add(entryNode, Core.hasEntryValue, compileSub(entry.second));
    }
  }
}

// End PatternCompiler.java
