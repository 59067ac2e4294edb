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
import org.apache.jena.graph.Node;

/**
 * Compiles applications of unary and binary operators.
 *
 * <p>All operators have the same shape: a type, the operator symbol, and one
 * or two operands. The left operand of the match operator, {@code =}, is a
 * pattern.
 */
class OperatorCompiler {
  private final ExpressionCompiler compiler;

  OperatorCompiler(ExpressionCompiler compiler) {
    this.compiler = requireNonNull(compiler);
  }

  Node compile(Shape shape, Ast.Form form) {
    final Node node = compiler.node(form, type(shape));
    compiler.graph.add(node, Core.operatorSymbol, requireNonNull(form.name()));
    if (form.arity() == 1) {
      compiler.graph.add(node, Core.hasOperand, compiler.compile(form.arg(0)));
      return node;
    }
    final Node left =
        shape == Shape.MATCH
            ? compiler.compilePattern(form.arg(0))
            : compiler.compile(form.arg(0));
    compiler.graph.add(node, Core.hasLeftOperand, left);
    compiler.graph.add(
        node, Core.hasRightOperand, compiler.compile(form.arg(1)));
    return node;
  }

  private static Node type(Shape shape) {
    switch (shape) {
      case COMPARISON:
        return Core.ComparisonOperator;
      case LOGICAL:
        return Core.LogicalOperator;
      case ARITHMETIC:
        return Core.ArithmeticOperator;
      case PIPE:
        return Core.PipeOperator;
      case MATCH:
        return Core.MatchOperator;
      case STRING_CONCAT:
        return Core.StringConcatOperator;
      case LIST_OPERATOR:
        return Core.ListOperator;
      case IN:
        return Core.InOperator;
      default:
        throw new AssertionError("not an operator: " + shape);
    }
  }
}

// End OperatorCompiler.java
