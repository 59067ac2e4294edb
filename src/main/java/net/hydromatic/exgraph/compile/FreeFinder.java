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
import java.util.function.Consumer;
import net.hydromatic.exgraph.ast.Ast;

/** Finds free variables in a term. */
class FreeFinder extends EnvVisitor {
  final Consumer<Ast.Form> consumer;

  protected FreeFinder(Environment env, Consumer<Ast.Form> consumer) {
    super(env);
    this.consumer = consumer;
  }

  /**
   * Finds the references to variables in a term that are not bound within
   * the term, in the order they occur.
   */
  public static ImmutableList<Ast.Form> references(Ast.Term term) {
    final ImmutableList.Builder<Ast.Form> list = ImmutableList.builder();
    term.accept(new FreeFinder(Environments.empty(), list::add));
    return list.build();
  }

  @Override
  protected EnvVisitor push(Environment env) {
    return new FreeFinder(env, consumer);
  }

  @Override
  protected void visitVariable(Ast.Form variable) {
    final String name = variable.name();
    if (name != null && Patterns.isBindable(name) && !env.has(name)) {
      consumer.accept(variable);
    }
  }
}

// End FreeFinder.java
