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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.exgraph.ast.Ast;
import org.apache.jena.graph.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action when an expression is
   * skipped, then calls the underlying tracer.
   */
  public static Tracer withOnSkip(
      Tracer tracer, Consumer<@Nullable String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSkip(@Nullable String filePath) {
        consumer.accept(filePath);
        super.onSkip(filePath);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a term that fell back
   * to a generic node, then calls the underlying tracer.
   */
  public static Tracer withOnFallback(
      Tracer tracer, BiConsumer<Ast.Term, Node> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFallback(Ast.Term term, Node node) {
        consumer.accept(term, node);
        super.onFallback(term, node);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the free-variable
   * analysis of a function literal, then calls the underlying tracer.
   */
  public static Tracer withOnClosure(
      Tracer tracer, BiConsumer<Node, FreeVariableAnalysis> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onClosure(Node node, FreeVariableAnalysis analysis) {
        consumer.accept(node, analysis);
        super.onClosure(node, analysis);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onSkip(@Nullable String filePath) {}

    @Override
    public void onFallback(Ast.Term term, Node node) {}

    @Override
    public void onClosure(Node node, FreeVariableAnalysis analysis) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onSkip(@Nullable String filePath) {
      tracer.onSkip(filePath);
    }

    @Override
    public void onFallback(Ast.Term term, Node node) {
      tracer.onFallback(term, node);
    }

    @Override
    public void onClosure(Node node, FreeVariableAnalysis analysis) {
      tracer.onClosure(node, analysis);
    }
  }
}

// End Tracers.java
