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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.graph.Outcome;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/** Contexts and nodes shared by compiler tests. */
abstract class Fixtures {
  private Fixtures() {}

  static final String BASE_IRI = "https://example.org/code#";

  /** Path of a project source file. */
  static final String PROJECT_FILE = "lib/my_app/worker.ex";

  /** Returns a configuration in which expressions are compiled. */
  static Map<Prop, Object> config() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.INCLUDE_EXPRESSIONS.set(map, true);
    return map;
  }

  /** Creates a context for a project file that compiles expressions. */
  static Context context() {
    return Context.of(config(), PROJECT_FILE);
  }

  /** Creates a context that does not record locations. */
  static Context contextWithoutLocations() {
    final Map<Prop, Object> map = config();
    Prop.INCLUDE_LOCATIONS.set(map, false);
    return Context.of(ImmutableMap.copyOf(map), PROJECT_FILE);
  }

  /** Compiles a term in a fresh context, and expects a result. */
  static Outcome.Compiled compile(Ast.Term term) {
    return compile(term, context());
  }

  static Outcome.Compiled compile(Ast.Term term, Context context) {
    return ExpressionCompiler.compile(term, context).compiled();
  }

  /** Returns the node with a given number. */
  static Node expr(int n) {
    return NodeFactory.createURI(BASE_IRI + "expr/" + n);
  }

  /** Returns the node of a part of a node, such as a clause. */
  static Node child(Node parent, String kind, Object key) {
    return IdGenerator.child(parent, kind, key);
  }

  static Node module(String name) {
    return NodeFactory.createURI(BASE_IRI + name);
  }
}

// End Fixtures.java
