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
package net.hydromatic.exgraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import net.hydromatic.exgraph.ast.AstNode;
import net.hydromatic.exgraph.graph.ExpressionGraph;
import org.apache.jena.graph.Node;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an AST node by its quoted form. */
  public static <T extends AstNode> Matcher<T> isAst(String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      @Override
      protected boolean matchesSafely(T t) {
        return t.toString().equals(expected);
      }
    };
  }

  /** Matches a graph that contains a given triple. */
  public static Matcher<ExpressionGraph> hasTriple(
      Node subject, Node predicate, Node object) {
    return new TypeSafeMatcher<ExpressionGraph>() {
      @Override
      protected boolean matchesSafely(ExpressionGraph graph) {
        return graph.contains(subject, predicate, object);
      }

      @Override
      public void describeTo(Description description) {
        description
            .appendText("graph containing ")
            .appendText(subject + " " + predicate + " " + object);
      }

      @Override
      protected void describeMismatchSafely(
          ExpressionGraph graph, Description description) {
        description.appendText("was\n").appendText(graph.toString());
      }
    };
  }

  /** Matches a graph in which a node has a given type. */
  public static Matcher<ExpressionGraph> hasType(Node subject, Node clazz) {
    return new CustomTypeSafeMatcher<ExpressionGraph>(
        subject + " of type " + clazz) {
      @Override
      protected boolean matchesSafely(ExpressionGraph graph) {
        return graph.hasType(subject, clazz);
      }
    };
  }

  /** Matches a graph in which a subject has no value for a predicate. */
  public static Matcher<ExpressionGraph> hasNo(Node subject, Node predicate) {
    return new CustomTypeSafeMatcher<ExpressionGraph>(
        subject + " without " + predicate) {
      @Override
      protected boolean matchesSafely(ExpressionGraph graph) {
        return graph.objects(subject, predicate).isEmpty();
      }
    };
  }

  /**
   * Matches an iterable whose elements are equal to the given values, in the
   * same order.
   */
  @SafeVarargs
  public static <E> Matcher<Iterable<E>> equalsOrdered(E... elements) {
    final List<E> expectedList = Arrays.asList(elements);
    return new TypeSafeMatcher<Iterable<E>>() {
      @Override
      public void describeTo(Description description) {
        description.appendText("equalsOrdered").appendValue(expectedList);
      }

      @Override
      protected boolean matchesSafely(Iterable<E> item) {
        return ImmutableList.copyOf(item).equals(expectedList);
      }
    };
  }

  /**
   * Matches a set whose elements are equal to the given values, in any
   * order.
   */
  @SafeVarargs
  public static <E> Matcher<Set<E>> equalsUnordered(E... elements) {
    final Set<E> expectedSet = ImmutableSet.copyOf(elements);
    return new TypeSafeMatcher<Set<E>>() {
      @Override
      public void describeTo(Description description) {
        description.appendText("equalsUnordered").appendValue(expectedSet);
      }

      @Override
      protected boolean matchesSafely(Set<E> item) {
        return item.equals(expectedSet);
      }
    };
  }
}

// End Matchers.java
