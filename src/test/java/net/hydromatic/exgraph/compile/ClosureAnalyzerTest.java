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
import static net.hydromatic.exgraph.Matchers.equalsUnordered;
import static net.hydromatic.exgraph.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link ClosureAnalyzer}. */
public class ClosureAnalyzerTest {
  /** Creates a clause, {@code params -> body}. */
  private static Ast.Form clause(Ast.Term body, Ast.Term... params) {
    return ast.arrow(ImmutableList.copyOf(params), body);
  }

  private static FreeVariableAnalysis analyze(Ast.Term... clauses) {
    return ClosureAnalyzer.analyze(AnonymousFunction.of(ast.fn(clauses)));
  }

  /** Analyzing {@code fn x -> x + y end}. */
  @Test
  void testSimpleCapture() {
    final FreeVariableAnalysis analysis =
        analyze(
            clause(ast.infix("+", ast.var("x"), ast.var("y")), ast.var("x")));
    assertThat(analysis.hasCaptures(), is(true));
    assertThat(analysis.freeVariableNames(), equalsOrdered("y"));
    assertThat(analysis.boundVariables, equalsUnordered("x"));
    assertThat(analysis.allReferences, equalsUnordered("x", "y"));
    assertThat(analysis.totalCaptureCount(), is(1));
  }

  @Test
  void testNoCaptures() {
    final FreeVariableAnalysis analysis =
        analyze(
            clause(
                ast.pair(ast.var("a"), ast.var("b")),
                ast.var("a"),
                ast.var("b")));
    assertThat(analysis.hasCaptures(), is(false));
    assertThat(analysis.totalCaptureCount(), is(0));
    assertThat(analysis.get("a"), nullValue());
  }

  /**
   * Each clause has its own scope. In
   * {@code fn x -> y; y -> x end}, clause 1 captures {@code y} and clause 2
   * captures {@code x}.
   */
  @Test
  void testSiblingClausesDoNotShareScope() {
    final Ast.Form fn =
        ast.fn(
            clause(ast.var("y"), ast.var("x")),
            clause(ast.var("x"), ast.var("y")));
    final AnonymousFunction function = AnonymousFunction.of(fn);

    final FreeVariableAnalysis clause1 =
        ClosureAnalyzer.analyzeClause(function.clauses.get(0));
    assertThat(clause1.freeVariableNames(), equalsOrdered("y"));
    assertThat(clause1.boundVariables, equalsUnordered("x"));

    final FreeVariableAnalysis clause2 =
        ClosureAnalyzer.analyzeClause(function.clauses.get(1));
    assertThat(clause2.freeVariableNames(), equalsOrdered("x"));
    assertThat(clause2.boundVariables, equalsUnordered("y"));

    // The function as a whole captures both
    final FreeVariableAnalysis analysis = ClosureAnalyzer.analyze(function);
    assertThat(analysis.freeVariableNames(), equalsOrdered("x", "y"));
  }

  /** Captures in several clauses are merged, and their counts added. */
  @Test
  void testMergeClauses() {
    final FreeVariableAnalysis analysis =
        analyze(
            clause(
                ast.infix("+", ast.var("n"), ast.var("n")),
                ast.intLiteral(0)),
            clause(ast.var("n"), ast.var("_")));
    final FreeVariable n = analysis.get("n");
    assertThat(n, notNullValue());
    assertThat(n.referenceCount, is(3));
    assertThat(analysis.totalCaptureCount(), is(3));
  }

  /** A nested function's parameters do not leak into the outer function. */
  @Test
  void testNestedFunction() {
    // fn x -> fn z -> x + z + w end end
    final Ast.Form inner =
        ast.fn(
            clause(
                ast.infix(
                    "+",
                    ast.infix("+", ast.var("x"), ast.var("z")),
                    ast.var("w")),
                ast.var("z")));
    final FreeVariableAnalysis outer = analyze(clause(inner, ast.var("x")));
    assertThat(outer.freeVariableNames(), equalsOrdered("w"));
    assertThat(outer.allReferences, equalsUnordered("w", "x"));

    final FreeVariableAnalysis innerAnalysis =
        ClosureAnalyzer.analyze(AnonymousFunction.of(inner));
    assertThat(innerAnalysis.freeVariableNames(), equalsOrdered("w", "x"));
  }

  /**
   * A pinned variable in a parameter is read from the enclosing scope, even
   * if the same clause binds the name.
   */
  @Test
  void testPin() {
    // fn ^x, x -> x end
    final FreeVariableAnalysis analysis =
        analyze(clause(ast.var("x"), ast.pin("x"), ast.var("x")));
    assertThat(analysis.freeVariableNames(), equalsOrdered("x"));
    assertThat(analysis.boundVariables, equalsUnordered("x"));
    assertThat(analysis.totalCaptureCount(), is(1));
  }

  /** Names bound by a case clause are local to that clause. */
  @Test
  void testCaseBindings() {
    // fn m ->
    //   case m do
    //     {:ok, v} -> v
    //     _ -> v
    //   end
    // end
    final Ast.Form kase =
        ast.call(
            "case",
            ast.var("m"),
            ast.list(
                ast.kw(
                    "do",
                    ast.list(
                        clause(
                            ast.var("v"),
                            ast.pair(ast.atom("ok"), ast.var("v"))),
                        clause(ast.var("v"), ast.var("_"))))));
    final FreeVariableAnalysis analysis = analyze(clause(kase, ast.var("m")));
    final FreeVariable v = analysis.get("v");
    assertThat(v, notNullValue());
    assertThat(v.referenceCount, is(1));
    assertThat(analysis.freeVariableNames(), equalsOrdered("v"));
  }

  /** A match in a block binds names for the statements after it. */
  @Test
  void testBlockBindings() {
    // fn -> a = b; a end
    final Ast.Form body =
        ast.block(ast.infix("=", ast.var("a"), ast.var("b")), ast.var("a"));
    final FreeVariableAnalysis analysis = analyze(clause(body));
    assertThat(analysis.freeVariableNames(), equalsOrdered("b"));
  }

  /** Module attributes, placeholders and underscored names are not free. */
  @Test
  void testNotVariables() {
    final Ast.Form body =
        ast.call(
            "f",
            ast.attribute("timeout"),
            ast.var("_ignored"),
            ast.var("__MODULE__"),
            ast.form("&", ast.infix("/", ast.var("g"), ast.intLiteral(1))));
    final FreeVariableAnalysis analysis = analyze(clause(body));
    assertThat(analysis.hasCaptures(), is(false));
  }

  @Test
  void testGuard() {
    // fn x when x > limit -> x end
    final Ast.Form arrow =
        ast.arrow(
            ImmutableList.of(
                ast.form(
                    "when",
                    ast.var("x"),
                    ast.infix(">", ast.var("x"), ast.var("limit")))),
            ast.var("x"));
    final FreeVariableAnalysis analysis = analyze(arrow);
    assertThat(analysis.freeVariableNames(), equalsOrdered("limit"));
  }

  /** Reference locations are the known positions only. */
  @Test
  void testLocations() {
    final Pos pos = Pos.at("a.ex", 3, 7);
    final Ast.Form body = ast.infix("+", ast.var(pos, "y"), ast.var("y"));
    final FreeVariableAnalysis analysis = analyze(clause(body, ast.var("x")));
    final FreeVariable y = analysis.get("y");
    assertThat(y, notNullValue());
    assertThat(y.referenceCount, is(2));
    assertThat(y.referenceLocations, equalsOrdered(pos));
  }

  @Test
  void testScopeAnalysis() {
    final ScopeChain chain =
        ScopeChain.EMPTY
            .push(Scope.Kind.MODULE, "m")
            .push(Scope.Kind.FUNCTION, "a")
            .push(Scope.Kind.CLOSURE, "b");

    final ScopeAnalysis direct =
        ClosureAnalyzer.analyzeScope(ImmutableList.of("b"), chain);
    assertThat(direct.captureDepth, is(0));
    assertThat(direct.crossesFunctionBoundary, is(false));
    assertThat(direct.capturesModuleLevel, is(false));

    final ScopeAnalysis deep =
        ClosureAnalyzer.analyzeScope(ImmutableList.of("a", "b"), chain);
    assertThat(deep.captureDepth, is(1));
    assertThat(deep.crossesFunctionBoundary, is(false));
    assertThat(deep.variableSources.get("a").kind, is(Scope.Kind.FUNCTION));

    final ScopeAnalysis module =
        ClosureAnalyzer.analyzeScope(ImmutableList.of("m"), chain);
    assertThat(module.captureDepth, is(2));
    assertThat(module.crossesFunctionBoundary, is(true));
    assertThat(module.capturesModuleLevel, is(true));

    // Names that no scope binds are ignored
    final ScopeAnalysis unknown =
        ClosureAnalyzer.analyzeScope(ImmutableList.of("zzz"), chain);
    assertThat(unknown.variableSources.isEmpty(), is(true));
    assertThat(unknown.captureDepth, is(0));
  }

  /** The innermost scope that binds a name wins. */
  @Test
  void testShadowedScope() {
    final ScopeChain chain =
        ScopeChain.EMPTY
            .push(Scope.Kind.FUNCTION, "x")
            .push(Scope.Kind.CLOSURE, "x");
    final Scope scope = chain.find("x");
    assertThat(scope, notNullValue());
    assertThat(scope.level, is(1));
    assertThat(chain.find("y"), nullValue());
    assertThat(chain.closureLevel(), is(2));
  }
}

// End ClosureAnalyzerTest.java
