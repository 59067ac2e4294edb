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

import static net.hydromatic.exgraph.Matchers.equalsOrdered;
import static net.hydromatic.exgraph.Matchers.hasNo;
import static net.hydromatic.exgraph.Matchers.hasTriple;
import static net.hydromatic.exgraph.Matchers.hasType;
import static net.hydromatic.exgraph.ast.AstBuilder.ast;
import static net.hydromatic.exgraph.compile.Fixtures.child;
import static net.hydromatic.exgraph.compile.Fixtures.compile;
import static net.hydromatic.exgraph.compile.Fixtures.expr;
import static net.hydromatic.exgraph.compile.Fixtures.module;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.graph.Core;
import net.hydromatic.exgraph.graph.ExpressionGraph;
import net.hydromatic.exgraph.graph.Triples;
import org.apache.jena.graph.Node;
import org.junit.jupiter.api.Test;

/** Tests for {@link LiteralCompiler}. */
public class LiteralCompilerTest {
  private static ExpressionGraph graph(Ast.Term term) {
    return compile(term).graph;
  }

  @Test
  void testAtoms() {
    ExpressionGraph graph = graph(ast.atom("ok"));
    assertThat(graph, hasType(expr(0), Core.AtomLiteral));
    assertThat(
        graph, hasTriple(expr(0), Core.atomValue, Triples.string(":ok")));

    graph = graph(ast.bool(false));
    assertThat(graph, hasType(expr(0), Core.BooleanLiteral));
    assertThat(
        graph, hasTriple(expr(0), Core.atomValue, Triples.string("false")));

    graph = graph(ast.nil());
    assertThat(graph, hasType(expr(0), Core.NilLiteral));
    assertThat(
        graph, hasTriple(expr(0), Core.atomValue, Triples.string("nil")));
  }

  @Test
  void testNumbers() {
    ExpressionGraph graph = graph(ast.intLiteral(-42));
    assertThat(graph, hasType(expr(0), Core.IntegerLiteral));
    assertThat(
        graph, hasTriple(expr(0), Core.integerValue, Triples.integer(-42)));

    graph = graph(ast.floatLiteral(2.5));
    assertThat(graph, hasType(expr(0), Core.FloatLiteral));
    assertThat(
        graph,
        hasTriple(expr(0), Core.floatValue, Triples.doubleLiteral(2.5)));
  }

  @Test
  void testStrings() {
    ExpressionGraph graph = graph(ast.string("héllo"));
    assertThat(graph, hasType(expr(0), Core.StringLiteral));
    assertThat(
        graph, hasTriple(expr(0), Core.stringValue, Triples.string("héllo")));

    graph = graph(ast.charlist("abc"));
    assertThat(graph, hasType(expr(0), Core.CharlistLiteral));
    assertThat(
        graph, hasTriple(expr(0), Core.charlistValue, Triples.string("abc")));

    graph = graph(ast.form("<<>>", ast.intLiteral(1), ast.intLiteral(2)));
    assertThat(graph, hasType(expr(0), Core.BinaryLiteral));
    assertThat(
        graph,
        hasTriple(
            expr(0), Core.binaryValue, Triples.base64(new byte[] {1, 2})));
  }

  /** An empty list is an empty charlist. */
  @Test
  void testEmptyList() {
    final ExpressionGraph graph = graph(ast.list());
    assertThat(graph, hasType(expr(0), Core.CharlistLiteral));
    assertThat(
        graph, hasTriple(expr(0), Core.charlistValue, Triples.string("")));
  }

  @Test
  void testList() {
    final ExpressionGraph graph = graph(ast.list(ast.var("a"), ast.atom("b")));
    assertThat(graph, hasType(expr(0), Core.ListLiteral));
    assertThat(
        graph.objects(expr(0), Core.hasElement),
        equalsOrdered(expr(1), expr(2)));
    assertThat(graph, hasNo(expr(0), Core.hasTail));
  }

  /** {@code [a, b | rest]} has two elements and a tail. */
  @Test
  void testListWithTail() {
    final ExpressionGraph graph =
        graph(
            ast.list(
                ast.var("a"), ast.form("|", ast.var("b"), ast.var("rest"))));
    assertThat(graph, hasType(expr(0), Core.ListLiteral));
    assertThat(
        graph.objects(expr(0), Core.hasElement),
        equalsOrdered(expr(1), expr(2)));
    assertThat(graph, hasTriple(expr(0), Core.hasTail, expr(3)));
    assertThat(graph, hasTriple(expr(3), Core.name, Triples.string("rest")));
  }

  @Test
  void testKeywordList() {
    final ExpressionGraph graph =
        graph(
            ast.list(
                ast.kw("a", ast.intLiteral(1)),
                ast.kw("a", ast.intLiteral(2))));
    assertThat(graph, hasType(expr(0), Core.KeywordListLiteral));
    // duplicate keys are kept; each entry is a tuple
    assertThat(graph.objects(expr(0), Core.hasElement).size(), is(2));
    assertThat(graph, hasType(expr(1), Core.TupleLiteral));
  }

  @Test
  void testTuples() {
    ExpressionGraph graph = graph(ast.pair(ast.atom("ok"), ast.var("v")));
    assertThat(graph, hasType(expr(0), Core.TupleLiteral));
    assertThat(
        graph.objects(expr(0), Core.hasElement),
        equalsOrdered(expr(1), expr(2)));

    graph =
        graph(ast.tuple(ast.intLiteral(1), ast.intLiteral(2), ast.var("c")));
    assertThat(graph, hasType(expr(0), Core.TupleLiteral));
    assertThat(graph.objects(expr(0), Core.hasElement).size(), is(3));

    graph = graph(ast.form("{}"));
    assertThat(graph, hasType(expr(0), Core.TupleLiteral));
    assertThat(graph, hasNo(expr(0), Core.hasElement));
  }

  @Test
  void testEmptyMap() {
    final ExpressionGraph graph = graph(ast.map());
    assertThat(graph, hasType(expr(0), Core.MapLiteral));
    assertThat(graph, hasNo(expr(0), Core.hasEntry));
    assertThat(graph.size(), is(1));
  }

  @Test
  void testMap() {
    final ExpressionGraph graph =
        graph(
            ast.map(
                ast.pair(ast.atom("name"), ast.var("n")),
                ast.pair(ast.string("k"), ast.intLiteral(1))));
    final Node entry1 = child(expr(0), "entry", 1);
    final Node entry2 = child(expr(0), "entry", 2);
    assertThat(
        graph.objects(expr(0), Core.hasEntry), equalsOrdered(entry1, entry2));
    assertThat(graph, hasType(entry1, Core.MapEntry));
    assertThat(
        graph, hasTriple(entry1, Core.entryKey, Triples.string(":name")));
    assertThat(graph, hasTriple(entry1, Core.hasEntryValue, expr(1)));
    assertThat(graph, hasTriple(entry2, Core.entryKey, Triples.string("k")));
    assertThat(graph, hasTriple(entry2, Core.hasEntryValue, expr(2)));
  }

  @Test
  void testStruct() {
    final ExpressionGraph graph =
        graph(ast.struct("MyApp.User", ast.kw("age", ast.intLiteral(3))));
    assertThat(graph, hasType(expr(0), Core.StructLiteral));
    assertThat(
        graph, hasTriple(expr(0), Core.name, Triples.string("MyApp.User")));
    assertThat(
        graph, hasTriple(expr(0), Core.refersToModule, module("MyApp.User")));
    final Node entry = child(expr(0), "entry", 1);
    assertThat(graph, hasTriple(entry, Core.entryKey, Triples.string(":age")));
    assertThat(graph, hasType(expr(1), Core.IntegerLiteral));
  }

  /** {@code ~r/a+b/iu}. */
  @Test
  void testSigil() {
    final ExpressionGraph graph =
        graph(
            ast.call(
                "sigil_r",
                ast.form("<<>>", ast.string("a+b")),
                ast.charlist("iu")));
    assertThat(graph, hasType(expr(0), Core.SigilLiteral));
    assertThat(graph, hasTriple(expr(0), Core.sigilChar, Triples.string("r")));
    assertThat(
        graph, hasTriple(expr(0), Core.sigilContent, Triples.string("a+b")));
    assertThat(
        graph, hasTriple(expr(0), Core.sigilModifiers, Triples.string("iu")));

    final ExpressionGraph graph2 =
        graph(
            ast.call(
                "sigil_w", ast.form("<<>>", ast.string("a b")), ast.list()));
    assertThat(graph2, hasNo(expr(0), Core.sigilModifiers));
  }

  /** {@code 1..10//2} has a step; {@code 1..10} does not. */
  @Test
  void testRange() {
    final ExpressionGraph stepped =
        graph(
            ast.form(
                "..//",
                ast.intLiteral(1),
                ast.intLiteral(10),
                ast.intLiteral(2)));
    assertThat(stepped, hasType(expr(0), Core.RangeLiteral));
    assertThat(stepped, hasTriple(expr(0), Core.rangeStart, expr(1)));
    assertThat(stepped, hasTriple(expr(0), Core.rangeEnd, expr(2)));
    assertThat(stepped, hasTriple(expr(0), Core.rangeStep, expr(3)));

    final ExpressionGraph plain =
        graph(ast.form("..", ast.intLiteral(1), ast.var("n")));
    assertThat(plain, hasType(expr(0), Core.RangeLiteral));
    assertThat(plain, hasTriple(expr(0), Core.rangeStart, expr(1)));
    assertThat(plain, hasTriple(expr(0), Core.rangeEnd, expr(2)));
    assertThat(plain, hasNo(expr(0), Core.rangeStep));
  }
}

// End LiteralCompilerTest.java
