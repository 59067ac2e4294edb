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
package net.hydromatic.exgraph.graph;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/** Vocabulary of the structure ontology: functions and their clauses. */
@SuppressWarnings("checkstyle:ConstantName")
public class Structure {
  /** Namespace of the structure ontology. */
  public static final String NS = "https://w3id.org/elixir-code/structure#";

  private Structure() {}

  private static Node uri(String localName) {
    return NodeFactory.createURI(NS + localName);
  }

  public static final Node AnonymousFunction = uri("AnonymousFunction");
  public static final Node FunctionClause = uri("FunctionClause");

  public static final Node arity = uri("arity");
  public static final Node hasClause = uri("hasClause");
  public static final Node clauseOrder = uri("clauseOrder");
  public static final Node hasParameter = uri("hasParameter");
  public static final Node hasBody = uri("hasBody");
}

// End Structure.java
