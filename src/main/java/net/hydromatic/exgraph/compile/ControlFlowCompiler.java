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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.graph.Core;
import net.hydromatic.exgraph.graph.ExpressionGraph;
import net.hydromatic.exgraph.graph.Triples;
import org.apache.jena.graph.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiles control flow: conditionals, case, cond, with, for, try, receive,
 * and raising, throwing and exiting.
 *
 * <p>Clauses are nodes whose identifiers derive from the node of the
 * construct, for example {@code {node}/clause/2} or {@code {node}/rescue/1},
 * and carry their 1-based order. Optional parts that are absent produce no
 * triples.
 */
class ControlFlowCompiler {
  private final ExpressionCompiler compiler;
  private final ExpressionGraph.Builder graph;

  ControlFlowCompiler(ExpressionCompiler compiler) {
    this.compiler = requireNonNull(compiler);
    this.graph = compiler.graph;
  }

  Node compile(Shape shape, Ast.Form form) {
    switch (shape) {
      case IF:
        return conditional(form, Core.IfExpression);
      case UNLESS:
        return conditional(form, Core.UnlessExpression);
      case COND:
        return cond(form);
      case CASE:
        return kase(form);
      case WITH:
        return with(form);
      case FOR:
        return comprehension(form);
      case TRY:
        return tryExpression(form);
      case RAISE:
      case RERAISE:
        return raise(form, shape == Shape.RERAISE);
      case THROW:
        return unary(form, Core.ThrowExpression, Core.hasThrownValue);
      case EXIT:
        return unary(form, Core.ExitExpression, Core.hasExitReason);
      case RECEIVE:
        return receive(form);
      default:
        throw new AssertionError("not control flow: " + shape);
    }
  }

  /** Compiles {@code if} or {@code unless}. */
  private Node conditional(Ast.Form form, Node type) {
    final Ast.ListTerm keywords = doBlock(form);
    final Node node = compiler.node(form, type);
    graph.add(node, Core.hasCondition, compiler.compile(form.arg(0)));
    graph.add(
        node,
        Core.hasThenBranch,
        compiler.compile(requireNonNull(keywords.keyword("do"))));
    final Ast.Term elseBranch = keywords.keyword("else");
    if (elseBranch != null) {
      graph.add(node, Core.hasElseBranch, compiler.compile(elseBranch));
    }
    return node;
  }

  private Node cond(Ast.Form form) {
    final List<Ast.Form> arrows =
        requireNonNull(Terms.arrows(doBlock(form).keyword("do")));
    final Node node = compiler.node(form, Core.CondExpression);
    for (int i = 0; i < arrows.size(); i++) {
      final Ast.Form arrow = arrows.get(i);
      final Node clause = clause(node, Core.hasClause, "clause", i + 1, arrow);
      graph.type(clause, Core.CondClause);
      for (Ast.Term condition : Terms.heads(arrow)) {
        graph.add(clause, Core.hasCondition, compiler.compile(condition));
      }
      graph.add(clause, Core.hasBody, compiler.compile(Terms.body(arrow)));
    }
    return node;
  }

  private Node kase(Ast.Form form) {
    final List<Ast.Form> arrows = Terms.arrows(doBlock(form).keyword("do"));
    if (arrows == null) {
      return compiler.fallback(form);
    }
    final Node node = compiler.node(form, Core.CaseExpression);
    graph.add(node, Core.hasSubject, compiler.compile(form.arg(0)));
    matchClauses(node, Core.hasClause, "clause", arrows);
    return node;
  }

  /**
   * Compiles {@code with}. Each clause is a pattern bound to an expression
   * ({@code <-}), a match ({@code =}), or a bare expression.
   */
  private Node with(Ast.Form form) {
    final Ast.ListTerm keywords = doBlock(form);
    final List<Ast.Form> elseArrows = Terms.arrows(keywords.keyword("else"));
    final Node node = compiler.node(form, Core.WithExpression);
    final List<Ast.Term> clauses = form.args().subList(0, form.arity() - 1);
    for (int i = 0; i < clauses.size(); i++) {
      final Ast.Term term = clauses.get(i);
      final Node clause = IdGenerator.child(node, "clause", i + 1);
      graph.type(clause, Core.WithClause);
      graph.add(node, Core.hasClause, clause);
      graph.add(clause, Core.clauseOrder, Triples.positiveInteger(i + 1));
      compiler.location(clause, term.pos);
      if (Terms.isForm(term, "<-", 2) || Terms.isForm(term, "=", 2)) {
        final Ast.Form bind = (Ast.Form) term;
        graph.add(clause, Core.operatorSymbol, requireNonNull(bind.name()));
        graph.add(
            clause, Core.hasPattern, compiler.compilePattern(bind.arg(0)));
        graph.add(clause, Core.hasExpression, compiler.compile(bind.arg(1)));
      } else {
        graph.add(clause, Core.hasExpression, compiler.compile(term));
      }
    }
    graph.add(
        node,
        Core.hasBody,
        compiler.compile(requireNonNull(keywords.keyword("do"))));
    if (elseArrows != null) {
      matchClauses(node, Core.hasElseClause, "else", elseArrows);
    }
    return node;
  }

  /**
   * Compiles a comprehension, {@code for}. Generators and filters are
   * clauses in one sequence; options are flags on the comprehension.
   */
  private Node comprehension(Ast.Form form) {
    final Ast.ListTerm keywords = doBlock(form);
    final Node node = compiler.node(form, Core.ForComprehension);
    final List<Ast.Term> clauses = form.args().subList(0, form.arity() - 1);
    for (int i = 0; i < clauses.size(); i++) {
      final Ast.Term term = clauses.get(i);
      final Ast.@Nullable Form generator = generator(term);
      final Node clause = IdGenerator.child(node, "clause", i + 1);
      graph.add(clause, Core.clauseOrder, Triples.positiveInteger(i + 1));
      compiler.location(clause, term.pos);
      if (generator != null) {
        graph.type(clause, Core.Generator);
        graph.add(node, Core.hasGenerator, clause);
        graph.add(
            clause, Core.hasPattern, compiler.compilePattern(generator.arg(0)));
        graph.add(
            clause, Core.generatorSource, compiler.compile(generator.arg(1)));
      } else {
        graph.type(clause, Core.Filter);
        graph.add(node, Core.hasFilter, clause);
        graph.add(clause, Core.hasCondition, compiler.compile(term));
      }
    }

    final Ast.Term into = keywords.keyword("into");
    graph.add(node, Core.hasIntoOption, into != null);
    if (into != null) {
      graph.add(node, Core.intoTarget, compiler.compile(into));
    }
    final Ast.Term uniq = keywords.keyword("uniq");
    final boolean hasUniq =
        uniq != null && !(uniq instanceof Ast.Atom && isFalsy((Ast.Atom) uniq));
    graph.add(node, Core.hasUniqOption, hasUniq);
    final Ast.Term reduce = keywords.keyword("reduce");
    graph.add(node, Core.hasReduceOption, reduce != null);
    final Ast.Term body = requireNonNull(keywords.keyword("do"));
    final @Nullable List<Ast.Form> reduceArrows =
        reduce == null ? null : Terms.arrows(body);
    if (reduce != null) {
      graph.add(node, Core.reduceInitial, compiler.compile(reduce));
    }
    if (reduceArrows != null) {
      matchClauses(node, Core.hasClause, "reduce", reduceArrows);
    } else {
      graph.add(node, Core.hasBody, compiler.compile(body));
    }
    return node;
  }

  /**
   * Returns a generator, {@code pattern <- source}, possibly within a
   * bitstring generator, {@code <<c <- binary>>}; or null.
   */
  private static Ast.@Nullable Form generator(Ast.Term term) {
    if (Terms.isForm(term, "<-", 2)) {
      return (Ast.Form) term;
    }
    if (Terms.isForm(term, "<<>>", 1)
        && Terms.isForm(((Ast.Form) term).arg(0), "<-", 2)) {
      return (Ast.Form) ((Ast.Form) term).arg(0);
    }
    return null;
  }

  private static boolean isFalsy(Ast.Atom atom) {
    return atom.name.equals("false") || atom.isNil();
  }

  private Node tryExpression(Ast.Form form) {
    final Ast.ListTerm keywords = doBlock(form);
    final Node node = compiler.node(form, Core.TryExpression);
    graph.add(
        node,
        Core.hasBody,
        compiler.compile(requireNonNull(keywords.keyword("do"))));
    final List<Ast.Form> rescues = Terms.arrows(keywords.keyword("rescue"));
    if (rescues != null) {
      for (int i = 0; i < rescues.size(); i++) {
        rescueClause(node, i + 1, rescues.get(i));
      }
    }
    final List<Ast.Form> catches = Terms.arrows(keywords.keyword("catch"));
    if (catches != null) {
      for (int i = 0; i < catches.size(); i++) {
        catchClause(node, i + 1, catches.get(i));
      }
    }
    final Ast.Term after = keywords.keyword("after");
    if (after != null) {
      final Node clause = IdGenerator.child(node, "after", 1);
      graph.type(clause, Core.AfterClause);
      graph.add(node, Core.hasAfterClause, clause);
      compiler.location(clause, after.pos);
      graph.add(clause, Core.hasBody, compiler.compile(after));
    }
    final List<Ast.Form> elses = Terms.arrows(keywords.keyword("else"));
    if (elses != null) {
      matchClauses(node, Core.hasElseClause, "else", elses);
    }
    return node;
  }

  /**
   * Compiles a rescue clause. The head is an exception module
   * ({@code ArgumentError ->}), a variable ({@code e ->}), or a variable
   * restricted to modules ({@code e in [ArgumentError, KeyError] ->}).
   */
  private void rescueClause(Node node, int order, Ast.Form arrow) {
    final Node clause =
        clause(node, Core.hasRescueClause, "rescue", order, arrow);
    graph.type(clause, Core.RescueClause);
    for (Ast.Term head : Terms.heads(arrow)) {
      Ast.Term exceptions = head;
      if (Terms.isForm(head, "in", 2)) {
        exceptions = ((Ast.Form) head).arg(1);
      }
      for (String name : EnvVisitor.rescueBindings(head)) {
        graph.add(clause, Core.bindsVariable, name);
      }
      final List<Ast.Term> modules =
          exceptions instanceof Ast.ListTerm
              ? ((Ast.ListTerm) exceptions).elements
              : ImmutableList.of(exceptions);
      for (Ast.Term module : modules) {
        final String moduleName = Terms.moduleName(module);
        if (moduleName != null) {
          graph.add(
              clause,
              Core.rescuesException,
              compiler.context.moduleIri(moduleName));
        }
      }
    }
    graph.add(clause, Core.hasBody, compiler.compile(Terms.body(arrow)));
  }

  /**
   * Compiles a catch clause, {@code value ->} or {@code kind, value ->},
   * optionally with a guard.
   */
  private void catchClause(Node node, int order, Ast.Form arrow) {
    final FnClause fnClause = FnClause.of(order, arrow);
    final Node clause =
        clause(node, Core.hasCatchClause, "catch", order, arrow);
    graph.type(clause, Core.CatchClause);
    final List<Ast.Term> parameters = fnClause.parameters;
    if (parameters.size() == 2) {
      final Ast.Term kind = parameters.get(0);
      if (kind instanceof Ast.Atom) {
        graph.add(clause, Core.catchKind, ((Ast.Atom) kind).name);
      }
    }
    for (Ast.Term parameter : parameters) {
      graph.add(clause, Core.hasPattern, compiler.compilePattern(parameter));
    }
    if (fnClause.guard != null) {
      graph.add(clause, Core.hasGuard, compiler.compile(fnClause.guard));
    }
    graph.add(clause, Core.hasBody, compiler.compile(fnClause.body));
  }

  /**
   * Compiles {@code raise} or {@code reraise}.
   *
   * <p>The first argument is an exception module, or a message or exception
   * value. A second argument (except the stack trace of {@code reraise}) is a
   * message if it is a string, otherwise the exception's attributes.
   */
  private Node raise(Ast.Form form, boolean reraise) {
    final Node node = compiler.node(form, Core.RaiseExpression);
    graph.add(node, Core.isReraise, reraise);
    final List<Ast.Term> args =
        reraise ? form.args().subList(0, form.arity() - 1) : form.args();
    final Ast.Term first = args.get(0);
    final String module = Terms.moduleName(first);
    if (module != null) {
      graph.add(
          node, Core.hasExceptionType, compiler.context.moduleIri(module));
    } else {
      graph.add(node, Core.hasMessage, compiler.compile(first));
    }
    if (args.size() == 2) {
      final Ast.Term second = args.get(1);
      final Node property =
          second instanceof Ast.StringLiteral
              ? Core.hasMessage
              : Core.hasAttributes;
      graph.add(node, property, compiler.compile(second));
    }
    if (reraise) {
      graph.add(
          node,
          Core.hasStacktrace,
          compiler.compile(form.arg(form.arity() - 1)));
    }
    return node;
  }

  private Node unary(Ast.Form form, Node type, Node property) {
    final Node node = compiler.node(form, type);
    graph.add(node, property, compiler.compile(form.arg(0)));
    return node;
  }

  /**
   * Compiles {@code receive}. A timeout of literal 0 makes the receive
   * non-blocking. The {@code after} block must be a single clause with a
   * single timeout.
   */
  private Node receive(Ast.Form form) {
    final Ast.ListTerm keywords = Terms.keywords(form.arg(0));
    final Ast.Term doClauses = requireNonNull(keywords).keyword("do");
    final List<Ast.Form> arrows = Terms.arrows(doClauses);
    final List<Ast.Form> afterArrows = Terms.arrows(keywords.keyword("after"));
    if (doClauses != null && arrows == null
        || keywords.keyword("after") != null
            && (afterArrows == null
                || afterArrows.size() != 1
                || Terms.heads(afterArrows.get(0)).size() != 1)) {
      return compiler.fallback(form);
    }
    final Node node = compiler.node(form, Core.ReceiveExpression);
    if (arrows != null) {
      matchClauses(node, Core.hasClause, "clause", arrows);
    }
    graph.add(node, Core.hasAfterTimeout, afterArrows != null);
    if (afterArrows != null) {
      final Ast.Form arrow = afterArrows.get(0);
      final Ast.Term timeout = Terms.heads(arrow).get(0);
      graph.add(node, Core.hasTimeout, compiler.compile(timeout));
      graph.add(
          node,
          Core.isNonBlocking,
          timeout instanceof Ast.IntLiteral
              && ((Ast.IntLiteral) timeout).value.signum() == 0);
      final Node clause =
          clause(node, Core.hasAfterClause, "after", 1, arrow);
      graph.type(clause, Core.AfterClause);
      graph.add(clause, Core.hasBody, compiler.compile(Terms.body(arrow)));
    }
    return node;
  }

  /**
   * Compiles clauses of the form {@code pattern when guard -> body}, as in
   * {@code case}, {@code receive} and the {@code else} of {@code with}.
   */
  private void matchClauses(
      Node node, Node property, String kind, List<Ast.Form> arrows) {
    for (int i = 0; i < arrows.size(); i++) {
      final Ast.Form arrow = arrows.get(i);
      final FnClause fnClause = FnClause.of(i + 1, arrow);
      final Node clause = clause(node, property, kind, i + 1, arrow);
      graph.type(clause, Core.MatchClause);
      for (Ast.Term parameter : fnClause.parameters) {
        graph.add(clause, Core.hasPattern, compiler.compilePattern(parameter));
      }
      if (fnClause.guard != null) {
        graph.add(clause, Core.hasGuard, compiler.compile(fnClause.guard));
      }
      graph.add(clause, Core.hasBody, compiler.compile(fnClause.body));
    }
  }

  /** Creates the node of a clause and links it to its construct. */
  private Node clause(
      Node node, Node property, String kind, int order, Ast.Form arrow) {
    final Node clause = IdGenerator.child(node, kind, order);
    graph.add(node, property, clause);
    graph.add(clause, Core.clauseOrder, Triples.positiveInteger(order));
    compiler.location(clause, arrow.pos);
    return clause;
  }

  /** Returns the trailing {@code do} keyword list of a form. */
  private static Ast.ListTerm doBlock(Ast.Form form) {
    return requireNonNull(Terms.trailingKeywords(form, "do"));
  }
}

// End ControlFlowCompiler.java
