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

import static net.hydromatic.exgraph.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link Classifier}. */
public class ClassifierTest {
  private static Shape shape(Ast.Term term) {
    return Classifier.classify(term);
  }

  private static Ast.ListTerm doBlock(Ast.Term body) {
    return ast.list(ast.kw("do", body));
  }

  @Test
  void testLiterals() {
    assertThat(shape(ast.atom("ok")), is(Shape.ATOM));
    assertThat(shape(ast.bool(true)), is(Shape.BOOLEAN));
    assertThat(shape(ast.nil()), is(Shape.NIL));
    assertThat(shape(ast.intLiteral(1)), is(Shape.INTEGER));
    assertThat(shape(ast.floatLiteral(1.5)), is(Shape.FLOAT));
    assertThat(shape(ast.string("s")), is(Shape.STRING));
    assertThat(shape(ast.charlist("abc")), is(Shape.CHARLIST));
    assertThat(shape(ast.list()), is(Shape.CHARLIST));
    assertThat(
        shape(ast.list(ast.intLiteral(1), ast.atom("a"))), is(Shape.LIST));
    assertThat(shape(ast.list(ast.intLiteral(-1))), is(Shape.LIST));
    // Surrogates are not scalar values
    assertThat(shape(ast.list(ast.intLiteral(0xD800))), is(Shape.LIST));
    assertThat(shape(ast.list(ast.intLiteral(0xDFFF))), is(Shape.LIST));
    assertThat(shape(ast.list(ast.intLiteral(0xD7FF))), is(Shape.CHARLIST));
    assertThat(shape(ast.list(ast.intLiteral(0xE000))), is(Shape.CHARLIST));
    assertThat(
        shape(ast.list(ast.intLiteral(0x10FFFF))), is(Shape.CHARLIST));
    assertThat(shape(ast.list(ast.intLiteral(0x110000))), is(Shape.LIST));
    assertThat(
        shape(ast.list(ast.kw("a", ast.intLiteral(1)))),
        is(Shape.KEYWORD_LIST));
    assertThat(
        shape(ast.pair(ast.atom("ok"), ast.var("x"))), is(Shape.TUPLE));
    assertThat(shape(ast.form("{}")), is(Shape.TUPLE));
    assertThat(
        shape(ast.form("<<>>", ast.intLiteral(1), ast.intLiteral(255))),
        is(Shape.BINARY));
    assertThat(
        shape(ast.form("<<>>", ast.intLiteral(256))), is(Shape.UNKNOWN));
  }

  @Test
  void testMapsAndStructs() {
    assertThat(shape(ast.map()), is(Shape.MAP));
    assertThat(
        shape(ast.map(ast.pair(ast.atom("a"), ast.intLiteral(1)))),
        is(Shape.MAP));
    // A map update, %{m | a: 1}, is not a literal
    assertThat(
        shape(
            ast.form(
                "%{}",
                ast.form(
                    "|",
                    ast.var("m"),
                    ast.list(ast.kw("a", ast.intLiteral(1)))))),
        is(Shape.UNKNOWN));
    assertThat(shape(ast.struct("User")), is(Shape.STRUCT));
    assertThat(
        shape(ast.form("%", ast.var("m"), ast.map())), is(Shape.UNKNOWN));
  }

  @Test
  void testRangesAndSigils() {
    assertThat(
        shape(ast.form("..", ast.intLiteral(1), ast.intLiteral(10))),
        is(Shape.RANGE));
    assertThat(
        shape(
            ast.form(
                "..//",
                ast.intLiteral(1),
                ast.intLiteral(10),
                ast.intLiteral(2))),
        is(Shape.STEP_RANGE));
    assertThat(
        shape(
            ast.call(
                "sigil_r",
                ast.form("<<>>", ast.string("a+")),
                ast.charlist("i"))),
        is(Shape.SIGIL));
    // Interpolation makes a sigil a call, which we do not decompose
    assertThat(
        shape(
            ast.call(
                "sigil_s",
                ast.form("<<>>", ast.string("a"), ast.var("x")),
                ast.list())),
        is(Shape.UNKNOWN));
  }

  @Test
  void testOperators() {
    assertThat(
        shape(ast.infix("==", ast.var("a"), ast.var("b"))),
        is(Shape.COMPARISON));
    assertThat(
        shape(ast.infix("and", ast.var("a"), ast.var("b"))),
        is(Shape.LOGICAL));
    assertThat(shape(ast.call("not", ast.var("a"))), is(Shape.LOGICAL));
    assertThat(shape(ast.call("-", ast.var("a"))), is(Shape.ARITHMETIC));
    assertThat(
        shape(ast.infix("rem", ast.var("a"), ast.var("b"))),
        is(Shape.ARITHMETIC));
    assertThat(
        shape(ast.infix("|>", ast.var("a"), ast.call("f"))),
        is(Shape.PIPE));
    assertThat(
        shape(ast.infix("=", ast.var("a"), ast.intLiteral(1))),
        is(Shape.MATCH));
    assertThat(
        shape(ast.infix("<>", ast.string("a"), ast.var("b"))),
        is(Shape.STRING_CONCAT));
    assertThat(
        shape(ast.infix("++", ast.var("a"), ast.var("b"))),
        is(Shape.LIST_OPERATOR));
    assertThat(
        shape(ast.infix("in", ast.var("a"), ast.var("b"))), is(Shape.IN));
    // "==" with three arguments is a call to a function named "=="
    assertThat(
        shape(ast.call("==", ast.var("a"), ast.var("b"), ast.var("c"))),
        is(Shape.LOCAL_CALL));
  }

  @Test
  void testReferences() {
    assertThat(shape(ast.var("x")), is(Shape.VARIABLE));
    assertThat(shape(ast.var("_")), is(Shape.WILDCARD));
    assertThat(shape(ast.var("_ignored")), is(Shape.VARIABLE));
    assertThat(shape(ast.var("__MODULE__")), is(Shape.UNKNOWN));
    assertThat(shape(ast.pin("x")), is(Shape.PIN));
    assertThat(shape(ast.aliases("MyApp.Repo")), is(Shape.MODULE_REFERENCE));
    assertThat(shape(ast.attribute("timeout")), is(Shape.ATTRIBUTE_REFERENCE));
  }

  @Test
  void testFunctions() {
    final Ast.Form fn =
        ast.fn(ast.arrow(ImmutableList.of(ast.var("x")), ast.var("x")));
    assertThat(shape(fn), is(Shape.FN));
    assertThat(shape(ast.fn(ast.intLiteral(1))), is(Shape.UNKNOWN));
    assertThat(shape(ast.placeholder(1)), is(Shape.PLACEHOLDER));
    assertThat(shape(ast.placeholder(0)), is(Shape.UNKNOWN));
    final Ast.Form enumMap =
        ast.infix("/", ast.remoteCall("Enum", "map"), ast.intLiteral(2));
    assertThat(shape(ast.form("&", enumMap)), is(Shape.FUNCTION_CAPTURE));
    assertThat(
        shape(
            ast.form("&", ast.infix("/", ast.var("foo"), ast.intLiteral(1)))),
        is(Shape.FUNCTION_CAPTURE));
    assertThat(
        shape(
            ast.form(
                "&", ast.infix("+", ast.placeholder(1), ast.intLiteral(1)))),
        is(Shape.PARTIAL_APPLICATION));
    // Placeholders are limited to the maximum arity, 255
    assertThat(shape(ast.placeholder(255)), is(Shape.PLACEHOLDER));
    assertThat(shape(ast.placeholder(256)), is(Shape.UNKNOWN));
    assertThat(
        shape(
            ast.form(
                "&",
                ast.infix(
                    "+", ast.placeholder(1), ast.placeholder(2_000_000_000)))),
        is(Shape.UNKNOWN));
  }

  @Test
  void testControlFlow() {
    assertThat(
        shape(ast.call("if", ast.var("c"), doBlock(ast.intLiteral(1)))),
        is(Shape.IF));
    assertThat(
        shape(ast.call("unless", ast.var("c"), doBlock(ast.intLiteral(1)))),
        is(Shape.UNLESS));
    // "if" without a do block is malformed
    assertThat(shape(ast.call("if", ast.var("c"))), is(Shape.UNKNOWN));
    assertThat(
        shape(ast.call("case", ast.var("x"), doBlock(ast.intLiteral(1)))),
        is(Shape.CASE));
    assertThat(shape(ast.call("try", doBlock(ast.nil()))), is(Shape.TRY));
    assertThat(
        shape(ast.call("raise", ast.string("oops"))), is(Shape.RAISE));
    assertThat(
        shape(ast.call("reraise", ast.var("e"), ast.var("st"))),
        is(Shape.RERAISE));
    assertThat(shape(ast.call("throw", ast.var("x"))), is(Shape.THROW));
    assertThat(
        shape(ast.call("exit", ast.atom("normal"))), is(Shape.EXIT));
    assertThat(
        shape(
            ast.call(
                "receive",
                ast.list(
                    ast.kw(
                        "after",
                        ast.list(
                            ast.arrow(
                                ImmutableList.of(ast.intLiteral(0)),
                                ast.nil())))))),
        is(Shape.RECEIVE));
  }

  @Test
  void testCalls() {
    assertThat(shape(ast.block(ast.var("a"), ast.var("b"))), is(Shape.BLOCK));
    assertThat(shape(ast.call("foo")), is(Shape.LOCAL_CALL));
    assertThat(
        shape(ast.remoteCall("String", "upcase", ast.var("s"))),
        is(Shape.REMOTE_CALL));
    assertThat(shape(ast.form("->")), is(Shape.UNKNOWN));
    assertThat(
        shape(ast.form(Pos.ZERO, ast.var("f"), ImmutableList.of())),
        is(Shape.UNKNOWN));
  }
}

// End ClassifierTest.java
