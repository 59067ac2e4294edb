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
import net.hydromatic.exgraph.graph.Triples;
import org.apache.jena.graph.Node;

/** Compiles literals: atoms, numbers, strings, collections and ranges. */
class LiteralCompiler {
  private final ExpressionCompiler compiler;
  private final ExpressionGraph.Builder graph;

  LiteralCompiler(ExpressionCompiler compiler) {
    this.compiler = requireNonNull(compiler);
    this.graph = compiler.graph;
  }

  Node compile(Shape shape, Ast.Term term) {
    final Node node;
    switch (shape) {
      case ATOM:
        return scalar(term, Core.AtomLiteral, shape);
      case BOOLEAN:
        return scalar(term, Core.BooleanLiteral, shape);
      case NIL:
        return scalar(term, Core.NilLiteral, shape);
      case INTEGER:
        return scalar(term, Core.IntegerLiteral, shape);
      case FLOAT:
        return scalar(term, Core.FloatLiteral, shape);
      case STRING:
        return scalar(term, Core.StringLiteral, shape);
      case CHARLIST:
        return scalar(term, Core.CharlistLiteral, shape);
      case BINARY:
        return scalar(term, Core.BinaryLiteral, shape);

      case LIST:
        node = compiler.node(term, Core.ListLiteral);
        elements(node, ((Ast.ListTerm) term).elements);
        return node;

      case KEYWORD_LIST:
        node = compiler.node(term, Core.KeywordListLiteral);
        // each entry is a 2-tuple; duplicate keys are kept
        for (Ast.Term element : ((Ast.ListTerm) term).elements) {
          graph.add(node, Core.hasElement, compiler.compile(element));
        }
        return node;

      case TUPLE:
        node = compiler.node(term, Core.TupleLiteral);
        if (term instanceof Ast.Pair) {
          final Ast.Pair pair = (Ast.Pair) term;
          graph.add(node, Core.hasElement, compiler.compile(pair.first));
          graph.add(node, Core.hasElement, compiler.compile(pair.second));
        } else {
          for (Ast.Term element : ((Ast.Form) term).args()) {
            graph.add(node, Core.hasElement, compiler.compile(element));
          }
        }
        return node;

      case MAP:
        node = compiler.node(term, Core.MapLiteral);
        entries(node, ((Ast.Form) term).args());
        return node;

      case STRUCT:
        final Ast.Form struct = (Ast.Form) term;
        final String module = requireNonNull(Terms.moduleName(struct.arg(0)));
        node = compiler.node(term, Core.StructLiteral);
        graph.add(node, Core.name, module);
        graph.add(
            node, Core.refersToModule, compiler.context.moduleIri(module));
        entries(node, ((Ast.Form) struct.arg(1)).args());
        return node;

      case SIGIL:
        return sigil((Ast.Form) term);

      case RANGE:
      case STEP_RANGE:
        final Ast.Form range = (Ast.Form) term;
        node = compiler.node(term, Core.RangeLiteral);
        graph.add(node, Core.rangeStart, compiler.compile(range.arg(0)));
        graph.add(node, Core.rangeEnd, compiler.compile(range.arg(1)));
        if (shape == Shape.STEP_RANGE) {
          graph.add(node, Core.rangeStep, compiler.compile(range.arg(2)));
        }
        return node;

      default:
        throw new AssertionError("not a literal: " + shape);
    }
  }

  private Node scalar(Ast.Term term, Node type, Shape shape) {
    final Node node = compiler.node(term, type);
    value(graph, node, shape, term);
    return node;
  }

  /**
   * Adds the value of a scalar literal to a node. Returns false if the shape
   * is not a scalar literal.
   */
  static boolean value(
      ExpressionGraph.Builder graph, Node node, Shape shape, Ast.Term term) {
    switch (shape) {
      case ATOM:
      case BOOLEAN:
      case NIL:
        graph.add(node, Core.atomValue, atomValue((Ast.Atom) term));
        return true;
      case INTEGER:
        graph.add(node, Core.integerValue, ((Ast.IntLiteral) term).value);
        return true;
      case FLOAT:
        graph.add(
            node,
            Core.floatValue,
            Triples.doubleLiteral(((Ast.FloatLiteral) term).value));
        return true;
      case STRING:
        graph.add(node, Core.stringValue, ((Ast.StringLiteral) term).value);
        return true;
      case CHARLIST:
        graph.add(
            node,
            Core.charlistValue,
            Terms.decodeCharlist((Ast.ListTerm) term));
        return true;
      case BINARY:
        graph.add(
            node, Core.binaryValue, Triples.base64(bytes((Ast.Form) term)));
        return true;
      default:
        return false;
    }
  }

  /**
   * Returns the value of an atom as written in source: {@code :ok}, or
   * {@code true}, {@code false} or {@code nil}.
   */
  static String atomValue(Ast.Atom atom) {
    if (atom.isBoolean() || atom.isNil()) {
      return atom.name;
    }
    return ":" + atom.name;
  }

  private static byte[] bytes(Ast.Form binary) {
    final byte[] bytes = new byte[binary.arity()];
    for (int i = 0; i < bytes.length; i++) {
      bytes[i] =
          (byte) ((Ast.IntLiteral) binary.arg(i)).value.intValueExact();
    }
    return bytes;
  }

  /**
   * Adds the elements of a list; if the last element is a cons cell,
   * {@code h | t}, adds its head as an element and its tail as the tail.
   */
  private void elements(Node node, List<Ast.Term> elements) {
    for (Ast.Term element : elements) {
      if (Terms.isForm(element, "|", 2)
          && element == elements.get(elements.size() - 1)) {
        final Ast.Form cons = (Ast.Form) element;
        graph.add(node, Core.hasElement, compiler.compile(cons.arg(0)));
        graph.add(node, Core.hasTail, compiler.compile(cons.arg(1)));
      } else {
        graph.add(node, Core.hasElement, compiler.compile(element));
      }
    }
  }

  /**
   * Adds an entry node for each key of a map. Keys are recorded as literals;
   * values are compiled.
   */
  private void entries(Node node, List<Ast.Term> entries) {
    for (int i = 0; i < entries.size(); i++) {
      final Ast.Pair entry = (Ast.Pair) entries.get(i);
      final Node entryNode = IdGenerator.child(node, "entry", i + 1);
      graph.type(entryNode, Core.MapEntry);
      graph.add(node, Core.hasEntry, entryNode);
      graph.add(entryNode, Core.entryKey, key(entry.first));
      graph.add(entryNode, Core.hasEntryValue, compiler.compile(entry.second));
    }
  }

  /** Returns the literal that represents a map key. */
  static Node key(Ast.Term key) {
    if (key instanceof Ast.Atom) {
      return Triples.string(atomValue((Ast.Atom) key));
    }
    if (key instanceof Ast.StringLiteral) {
      return Triples.string(((Ast.StringLiteral) key).value);
    }
    if (key instanceof Ast.IntLiteral) {
      return Triples.integer(((Ast.IntLiteral) key).value);
    }
    return Triples.string(key.toString());
  }

  /** Compiles a sigil, such as {@code ~r/a+/i}. */
  private Node sigil(Ast.Form sigil) {
    final String name = requireNonNull(sigil.name());
    final StringBuilder content = new StringBuilder();
    for (Ast.Term segment : ((Ast.Form) sigil.arg(0)).args()) {
      content.append(((Ast.StringLiteral) segment).value);
    }
    final String modifiers = Terms.decodeCharlist((Ast.ListTerm) sigil.arg(1));
    final Node node = compiler.node(sigil, Core.SigilLiteral);
    graph.add(node, Core.sigilChar, name.substring("sigil_".length()));
    graph.add(node, Core.sigilContent, content.toString());
    if (!modifiers.isEmpty()) {
      graph.add(node, Core.sigilModifiers, modifiers);
    }
    return node;
  }
}

// End LiteralCompiler.java
