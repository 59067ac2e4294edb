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

import net.hydromatic.exgraph.ast.Ast;
import org.apache.jena.graph.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during compilation. */
public interface Tracer {
  /**
   * Called when an expression is not compiled, because expression
   * compilation is disabled or the file is not a project file.
   */
  void onSkip(@Nullable String filePath);

  /**
   * Called when a term matches no known shape and is compiled to a generic
   * expression node.
   */
  void onFallback(Ast.Term term, Node node);

  /** Called when the free variables of a function literal are known. */
  void onClosure(Node node, FreeVariableAnalysis analysis);
}

// End Tracer.java
