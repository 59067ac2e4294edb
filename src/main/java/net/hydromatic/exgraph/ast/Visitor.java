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
package net.hydromatic.exgraph.ast;

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // atomic terms

  protected void visit(Ast.Atom atom) {}

  protected void visit(Ast.IntLiteral intLiteral) {}

  protected void visit(Ast.FloatLiteral floatLiteral) {}

  protected void visit(Ast.StringLiteral stringLiteral) {}

  // compound terms

  protected void visit(Ast.ListTerm list) {
    list.elements.forEach(this::accept);
  }

  protected void visit(Ast.Pair pair) {
    pair.first.accept(this);
    pair.second.accept(this);
  }

  protected void visit(Ast.Form form) {
    form.head.accept(this);
    form.args().forEach(this::accept);
  }
}

// End Visitor.java
