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

import static java.util.Objects.requireNonNull;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/**
 * Generates node identifiers.
 *
 * <p>Identifiers are {@code {base}expr/{n}}, where {@code n} counts from 0 in
 * the order in which nodes are allocated. The same expression tree compiled
 * with a fresh generator therefore gets the same identifiers every time.
 *
 * <p>A generator belongs to the thread that created it; calling {@link #next}
 * from any other thread throws.
 */
public class IdGenerator {
  private static final Escaper SEGMENT_ESCAPER =
      UrlEscapers.urlPathSegmentEscaper();

  private final String prefix;
  private final Thread owner;
  private int id = 0;

  /** Creates an IdGenerator. */
  public IdGenerator(String baseIri) {
    this.prefix = requireNonNull(baseIri) + "expr/";
    this.owner = Thread.currentThread();
  }

  /** Generates an identifier that is unique in this file. */
  public Node next() {
    if (Thread.currentThread() != owner) {
      throw new IllegalStateException(
          "id generator owned by thread '"
              + owner.getName()
              + "' used from thread '"
              + Thread.currentThread().getName()
              + "'");
    }
    return NodeFactory.createURI(prefix + id++);
  }

  /** Returns the number of identifiers generated so far. */
  public int count() {
    return id;
  }

  /**
   * Derives the identifier of a sub-structure of a node, for example {@code
   * {parent}/clause/2}.
   */
  public static Node child(Node parent, String kind, Object key) {
    return NodeFactory.createURI(
        parent.getURI()
            + "/"
            + kind
            + "/"
            + SEGMENT_ESCAPER.escape(key.toString()));
  }
}

// End IdGenerator.java
