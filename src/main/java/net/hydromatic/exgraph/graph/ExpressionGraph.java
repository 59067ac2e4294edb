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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.Set;
import org.apache.jena.graph.Factory;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.vocabulary.RDF;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Set of triples produced by compiling an expression.
 *
 * <p>Immutable. Triples are kept in the order they were first added, and
 * duplicates are removed.
 */
public class ExpressionGraph {
  public static final ExpressionGraph EMPTY =
      new ExpressionGraph(ImmutableSet.of());

  public final ImmutableSet<Triple> triples;

  private ExpressionGraph(ImmutableSet<Triple> triples) {
    this.triples = requireNonNull(triples);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  public int size() {
    return triples.size();
  }

  public boolean contains(Node subject, Node predicate, Node object) {
    return triples.contains(Triple.create(subject, predicate, object));
  }

  /** Returns whether a subject has a given type. */
  public boolean hasType(Node subject, Node clazz) {
    return contains(subject, RDF.Nodes.type, clazz);
  }

  /** Returns the objects of a subject and predicate, in insertion order. */
  public ImmutableList<Node> objects(Node subject, Node predicate) {
    final ImmutableList.Builder<Node> b = ImmutableList.builder();
    for (Triple triple : triples) {
      if (triple.getSubject().equals(subject)
          && triple.getPredicate().equals(predicate)) {
        b.add(triple.getObject());
      }
    }
    return b.build();
  }

  /** Returns the first object of a subject and predicate, or null. */
  public @Nullable Node object(Node subject, Node predicate) {
    final ImmutableList<Node> objects = objects(subject, predicate);
    return objects.isEmpty() ? null : objects.get(0);
  }

  /** Returns the types of a subject. */
  public ImmutableList<Node> types(Node subject) {
    return objects(subject, RDF.Nodes.type);
  }

  /** Returns every subject that has a given type. */
  public ImmutableList<Node> instancesOf(Node clazz) {
    final ImmutableList.Builder<Node> b = ImmutableList.builder();
    for (Triple triple : triples) {
      if (triple.getPredicate().equals(RDF.Nodes.type)
          && triple.getObject().equals(clazz)) {
        b.add(triple.getSubject());
      }
    }
    return b.build();
  }

  /** Copies the triples into a new in-memory Jena graph. */
  public Graph toGraph() {
    final Graph graph = Factory.createDefaultGraph();
    triples.forEach(graph::add);
    return graph;
  }

  @Override
  public int hashCode() {
    return triples.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ExpressionGraph
            && triples.equals(((ExpressionGraph) o).triples);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    triples.forEach(t -> b.append(t).append('\n'));
    return b.toString();
  }

  /**
   * Accumulates triples. Shared by all compilers while an expression tree is
   * compiled; append-only.
   */
  public static class Builder {
    private final Set<Triple> triples = new LinkedHashSet<>();

    private Builder() {}

    public Builder add(Triple triple) {
      triples.add(requireNonNull(triple));
      return this;
    }

    /** Adds a triple whose object is a node or a literal. */
    public Builder add(Node subject, Node predicate, Node object) {
      return add(Triples.link(subject, predicate, object));
    }

    public Builder type(Node subject, Node clazz) {
      return add(Triples.type(subject, clazz));
    }

    /** Adds a triple whose object is an {@code xsd:string} literal. */
    public Builder add(Node subject, Node predicate, String value) {
      return add(subject, predicate, Triples.string(value));
    }

    /** Adds a triple whose object is an {@code xsd:integer} literal. */
    public Builder add(Node subject, Node predicate, BigInteger value) {
      return add(subject, predicate, Triples.integer(value));
    }

    /** Adds a triple whose object is an {@code xsd:boolean} literal. */
    public Builder add(Node subject, Node predicate, boolean value) {
      return add(subject, predicate, Triples.bool(value));
    }

    public int size() {
      return triples.size();
    }

    public ExpressionGraph build() {
      return new ExpressionGraph(ImmutableSet.copyOf(triples));
    }
  }
}

// End ExpressionGraph.java
