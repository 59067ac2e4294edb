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

import static java.util.Objects.requireNonNull;

import org.apache.jena.graph.Node;

/**
 * Result of compiling an expression: either {@link #SKIP}, or a {@link
 * Compiled} root node and graph.
 */
public abstract class Outcome {
  /** Outcome when there was no expression, or compilation was disabled. */
  public static final Outcome SKIP = new Skip();

  private Outcome() {}

  /** Creates a compiled outcome. */
  public static Compiled of(Node root, ExpressionGraph graph) {
    return new Compiled(root, graph);
  }

  /** Returns whether this outcome is {@link #SKIP}. */
  public abstract boolean isSkip();

  /** Converts this outcome to {@link Compiled}, or throws. */
  public Compiled compiled() {
    throw new IllegalStateException("expression was skipped");
  }

  /** Outcome that produced no node. */
  private static class Skip extends Outcome {
    @Override
    public boolean isSkip() {
      return true;
    }

    @Override
    public String toString() {
      return "SKIP";
    }
  }

  /** Outcome that produced a root node and the graph reachable from it. */
  public static class Compiled extends Outcome {
    public final Node root;
    public final ExpressionGraph graph;

    Compiled(Node root, ExpressionGraph graph) {
      this.root = requireNonNull(root);
      this.graph = requireNonNull(graph);
    }

    @Override
    public boolean isSkip() {
      return false;
    }

    @Override
    public Compiled compiled() {
      return this;
    }

    @Override
    public String toString() {
      return "Compiled(" + root + ", " + graph.size() + " triples)";
    }
  }
}

// End Outcome.java
