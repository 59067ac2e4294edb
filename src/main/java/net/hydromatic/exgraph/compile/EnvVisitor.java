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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Visitor that keeps an environment of what variables are in scope.
 *
 * <p>Constructs that bind variables (function clauses, case and receive
 * clauses, {@code with} and {@code for} clauses, rescue clauses, and matches
 * in a block) visit their scope with a new visitor whose environment includes
 * the bound names.
 */
abstract class EnvVisitor extends Visitor {
  final Environment env;

  /** Creates an EnvVisitor. */
  protected EnvVisitor(Environment env) {
    this.env = env;
  }

  /** Creates a visitor the same as this but with a new environment. */
  protected abstract EnvVisitor push(Environment env);

  /** Creates a visitor the same as this but with overriding bindings. */
  protected EnvVisitor bind(Iterable<String> names) {
    if (!names.iterator().hasNext()) {
      return this;
    }
    return push(env.bindAll(names));
  }

  /** Called for each variable that is read. */
  protected abstract void visitVariable(Ast.Form variable);

  @Override
  protected void visit(Ast.Form form) {
    if (form.isVariable()) {
      visitVariable(form);
      return;
    }
    final String name = form.name();
    if (name == null) {
      if (Terms.isRemoteHead(form.head)) {
        // the receiver may be a variable; the function name is not
        ((Ast.Form) form.head).arg(0).accept(this);
      } else {
        form.head.accept(this);
      }
      form.args().forEach(this::accept);
      return;
    }
    switch (name) {
      case "fn":
        visitFn(form);
        return;
      case "case":
        visitCase(form);
        return;
      case "receive":
        visitReceive(form);
        return;
      case "with":
        visitWith(form);
        return;
      case "for":
        visitFor(form);
        return;
      case "try":
        visitTry(form);
        return;
      case "__block__":
        visitBlock(form.args());
        return;
      case "=":
        if (form.arity() == 2) {
          visitMatch(form.arg(0), form.arg(1));
          return;
        }
        break;
      case "&":
        visitCapture(form);
        return;
      case "@":
      case "__aliases__":
        return;
      default:
        break;
    }
    form.args().forEach(this::accept);
  }

  /** Visits a function literal; each clause binds its parameters. */
  protected void visitFn(Ast.Form fn) {
    final List<Ast.Form> arrows = Terms.arrows(fn.args());
    if (arrows == null) {
      fn.args().forEach(this::accept);
      return;
    }
    for (int i = 0; i < arrows.size(); i++) {
      final FnClause clause = FnClause.of(i + 1, arrows.get(i));
      visitPatternReads(clause.parameters);
      final EnvVisitor v = bind(clause.boundVariables);
      if (clause.guard != null) {
        clause.guard.accept(v);
      }
      clause.body.accept(v);
    }
  }

  protected void visitCase(Ast.Form kase) {
    if (kase.arity() != 2) {
      kase.args().forEach(this::accept);
      return;
    }
    kase.arg(0).accept(this);
    visitClauses(kase.arg(1), "do");
  }

  protected void visitReceive(Ast.Form receive) {
    final Ast.ListTerm keywords = Terms.keywords(lastArg(receive));
    if (keywords == null) {
      receive.args().forEach(this::accept);
      return;
    }
    visitClauses(keywords, "do");
    final List<Ast.Form> after = Terms.arrows(keywords.keyword("after"));
    if (after != null) {
      for (Ast.Form arrow : after) {
        Terms.heads(arrow).forEach(this::accept);
        Terms.body(arrow).accept(this);
      }
    }
  }

  /**
   * Visits a {@code with}. Each clause sees the names bound by the clauses
   * before it; the body sees them all; the else clauses see none of them.
   */
  protected void visitWith(Ast.Form with) {
    EnvVisitor v = this;
    Ast.@Nullable ListTerm keywords = null;
    for (Ast.Term arg : with.args()) {
      if (arg == lastArg(with) && Terms.keywords(arg) != null) {
        keywords = (Ast.ListTerm) arg;
        break;
      }
      v = v.visitSequential(arg);
    }
    if (keywords != null) {
      final Ast.Term body = keywords.keyword("do");
      if (body != null) {
        body.accept(v);
      }
      visitClauses(keywords, "else");
    }
  }

  /**
   * Visits a {@code for}. Generators and filters see the names bound by the
   * generators before them, and the body sees them all. Options such as
   * {@code into} and the initial value of {@code reduce} see none of them.
   */
  protected void visitFor(Ast.Form forForm) {
    EnvVisitor v = this;
    Ast.@Nullable ListTerm keywords = null;
    for (Ast.Term arg : forForm.args()) {
      if (arg == lastArg(forForm) && Terms.keywords(arg) != null) {
        keywords = (Ast.ListTerm) arg;
        break;
      }
      v = v.visitSequential(arg);
    }
    if (keywords == null) {
      return;
    }
    for (Ast.Term element : keywords.elements) {
      final Ast.Pair pair = (Ast.Pair) element;
      final String key = ((Ast.Atom) pair.first).name;
      if (key.equals("do")) {
        if (keywords.keyword("reduce") != null) {
          v.visitClauses(keywords, "do");
        } else {
          pair.second.accept(v);
        }
      } else {
        pair.second.accept(this);
      }
    }
  }

  /**
   * Visits a generator ({@code pattern <- source}), a match, or a filter, and
   * returns a visitor whose environment includes the names it binds.
   */
  private EnvVisitor visitSequential(Ast.Term clause) {
    if (Terms.isForm(clause, "<-", 2) || Terms.isForm(clause, "=", 2)) {
      final Ast.Form form = (Ast.Form) clause;
      Ast.Term pattern = form.arg(0);
      form.arg(1).accept(this);
      if (Terms.isForm(pattern, "when", 2)) {
        final Ast.Form when = (Ast.Form) pattern;
        pattern = when.arg(0);
        visitPatternReads(ImmutableList.of(pattern));
        final EnvVisitor v = bind(Patterns.bindings(pattern));
        when.arg(1).accept(v);
        return v;
      }
      visitPatternReads(ImmutableList.of(pattern));
      return bind(Patterns.bindings(pattern));
    }
    clause.accept(this);
    return this;
  }

  protected void visitTry(Ast.Form tryForm) {
    final Ast.ListTerm keywords = Terms.keywords(lastArg(tryForm));
    if (keywords == null) {
      tryForm.args().forEach(this::accept);
      return;
    }
    for (Ast.Term element : keywords.elements) {
      final Ast.Pair pair = (Ast.Pair) element;
      switch (((Ast.Atom) pair.first).name) {
        case "rescue":
          final List<Ast.Form> arrows = Terms.arrows(pair.second);
          if (arrows != null) {
            for (Ast.Form arrow : arrows) {
              final ImmutableList<Ast.Term> heads = Terms.heads(arrow);
              final ImmutableSet<String> bound =
                  heads.size() == 1
                      ? rescueBindings(heads.get(0))
                      : ImmutableSet.of();
              Terms.body(arrow).accept(bind(bound));
            }
          }
          break;
        case "catch":
        case "else":
          visitClauses(keywords, ((Ast.Atom) pair.first).name);
          break;
        default:
          pair.second.accept(this);
      }
    }
  }

  /**
   * Returns the names bound by the head of a rescue clause: {@code e} in
   * {@code e in [ArgumentError]}, or the head if it is a variable.
   */
  static ImmutableSet<String> rescueBindings(Ast.Term head) {
    if (Terms.isForm(head, "in", 2)) {
      return Patterns.bindings(((Ast.Form) head).arg(0));
    }
    if (Terms.variableName(head) != null) {
      return Patterns.bindings(head);
    }
    return ImmutableSet.of();
  }

  /**
   * Visits the statements of a block. A match binds names for the statements
   * that follow it.
   */
  protected void visitBlock(List<Ast.Term> statements) {
    EnvVisitor v = this;
    for (Ast.Term statement : statements) {
      statement.accept(v);
      v = v.bind(matchBindings(statement));
    }
  }

  /** Visits a match, {@code pattern = expression}. */
  protected void visitMatch(Ast.Term pattern, Ast.Term expression) {
    expression.accept(this);
    visitPatternReads(ImmutableList.of(pattern));
  }

  /**
   * Visits a capture. Placeholders and the names of captured functions are
   * not variables.
   */
  protected void visitCapture(Ast.Form capture) {
    if (capture.arity() != 1) {
      capture.args().forEach(this::accept);
      return;
    }
    final Ast.Term arg = capture.arg(0);
    if (arg instanceof Ast.IntLiteral) {
      return;
    }
    if (Terms.isForm(arg, "/", 2)
        && ((Ast.Form) arg).arg(1) instanceof Ast.IntLiteral) {
      final Ast.Term callee = ((Ast.Form) arg).arg(0);
      if (callee instanceof Ast.Form) {
        final Ast.Form calleeForm = (Ast.Form) callee;
        if (calleeForm.isVariable()) {
          return;
        }
        if (Terms.isRemoteHead(calleeForm.head)) {
          ((Ast.Form) calleeForm.head).arg(0).accept(this);
          return;
        }
      }
    }
    arg.accept(this);
  }

  /** Visits the clauses stored under a key of a keyword list. */
  protected void visitClauses(Ast.Term keywordList, String key) {
    final Ast.ListTerm keywords = Terms.keywords(keywordList);
    if (keywords == null) {
      keywordList.accept(this);
      return;
    }
    final Ast.Term clauses = keywords.keyword(key);
    if (clauses == null) {
      return;
    }
    final List<Ast.Form> arrows = Terms.arrows(clauses);
    if (arrows == null) {
      clauses.accept(this);
      return;
    }
    arrows.forEach(this::visitMatchClause);
  }

  /**
   * Visits a clause, {@code pattern when guard -> body}. The guard and body
   * see the names bound by the pattern.
   */
  protected void visitMatchClause(Ast.Form arrow) {
    final FnClause clause = FnClause.of(1, arrow);
    visitPatternReads(clause.parameters);
    final EnvVisitor v = bind(clause.boundVariables);
    if (clause.guard != null) {
      clause.guard.accept(v);
    }
    clause.body.accept(v);
  }

  /**
   * Visits the parts of patterns that are read rather than bound: pinned
   * variables.
   */
  protected void visitPatternReads(List<Ast.Term> patterns) {
    final Visitor pinVisitor =
        new Visitor() {
          @Override
          protected void visit(Ast.Form form) {
            if (form.is("^", 1)) {
              form.arg(0).accept(EnvVisitor.this);
            } else if (!form.is("@")) {
              super.visit(form);
            }
          }
        };
    patterns.forEach(pattern -> pattern.accept(pinVisitor));
  }

  /** Returns the names bound by a statement that is a match. */
  static ImmutableSet<String> matchBindings(Ast.Term statement) {
    if (!Terms.isForm(statement, "=", 2)) {
      return ImmutableSet.of();
    }
    final Ast.Form match = (Ast.Form) statement;
    return ImmutableSet.<String>builder()
        .addAll(Patterns.bindings(match.arg(0)))
        .addAll(matchBindings(match.arg(1)))
        .build();
  }

  private static Ast.@Nullable Term lastArg(Ast.Form form) {
    return form.arity() == 0 ? null : form.arg(form.arity() - 1);
  }
}

// End EnvVisitor.java
