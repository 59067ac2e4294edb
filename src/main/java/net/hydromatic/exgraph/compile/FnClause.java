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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Clause of an anonymous function, {@code params when guard -> body}. */
public class FnClause {
  /** 1-based position of this clause in its function. */
  public final int order;

  public final ImmutableList<Ast.Term> parameters;
  public final Ast.@Nullable Term guard;
  public final Ast.Term body;
  /** Names bound by the parameters. */
  public final ImmutableSet<String> boundVariables;

  public final Pos pos;

  FnClause(
      int order,
      List<Ast.Term> parameters,
      Ast.@Nullable Term guard,
      Ast.Term body,
      Pos pos) {
    this.order = order;
    this.parameters = ImmutableList.copyOf(parameters);
    this.guard = guard;
    this.body = requireNonNull(body);
    this.boundVariables = Patterns.bindings(this.parameters);
    this.pos = requireNonNull(pos);
  }

  /** Creates a clause from an arrow form. */
  static FnClause of(int order, Ast.Form arrow) {
    final ImmutableList<Ast.Term> heads = Terms.heads(arrow);
    if (heads.size() == 1 && heads.get(0) instanceof Ast.Form) {
      final Ast.Form head = (Ast.Form) heads.get(0);
      if (head.is("when") && head.arity() >= 2) {
        final ImmutableList<Ast.Term> args = head.args();
        return new FnClause(
            order,
            args.subList(0, args.size() - 1),
            args.get(args.size() - 1),
            Terms.body(arrow),
            arrow.pos);
      }
    }
    return new FnClause(order, heads, null, Terms.body(arrow), arrow.pos);
  }

  public int arity() {
    return parameters.size();
  }

  @Override
  public String toString() {
    return "clause " + order + " " + parameters + " -> " + body;
  }
}

// End FnClause.java
