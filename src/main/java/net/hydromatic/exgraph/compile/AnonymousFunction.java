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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.ast.Pos;

/**
 * Function literal, {@code fn ... end}, broken into clauses.
 *
 * @see FnClause
 */
public class AnonymousFunction {
  public final ImmutableList<FnClause> clauses;
  public final Pos pos;

  private AnonymousFunction(List<FnClause> clauses, Pos pos) {
    checkArgument(!clauses.isEmpty(), "function has no clauses");
    this.clauses = ImmutableList.copyOf(clauses);
    this.pos = requireNonNull(pos);
  }

  /**
   * Extracts the clauses of a {@code fn} form.
   *
   * @throws IllegalArgumentException if the form is not a function literal
   */
  public static AnonymousFunction of(Ast.Form fn) {
    checkArgument(fn.is("fn"), "not a function literal: %s", fn);
    final List<Ast.Form> arrows = Terms.arrows(fn.args());
    checkArgument(arrows != null, "function has malformed clauses: %s", fn);
    final ImmutableList.Builder<FnClause> clauses = ImmutableList.builder();
    for (int i = 0; i < arrows.size(); i++) {
      clauses.add(FnClause.of(i + 1, arrows.get(i)));
    }
    return new AnonymousFunction(clauses.build(), fn.pos);
  }

  /** Returns the arity, which is the number of parameters of each clause. */
  public int arity() {
    return clauses.get(0).arity();
  }

  @Override
  public String toString() {
    return "fn " + clauses;
  }
}

// End AnonymousFunction.java
