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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.io.BaseEncoding;
import java.math.BigInteger;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.vocabulary.RDF;

/** Utilities for creating triples and typed literals. */
public abstract class Triples {
  private Triples() {}

  /** Creates a triple that states that a subject is an instance of a class. */
  public static Triple type(Node subject, Node clazz) {
    return Triple.create(subject, RDF.Nodes.type, clazz);
  }

  /** Creates a triple. */
  public static Triple link(Node subject, Node predicate, Node object) {
    return Triple.create(subject, predicate, object);
  }

  /** Creates an {@code xsd:string} literal. */
  public static Node string(String value) {
    return NodeFactory.createLiteral(value, XSDDatatype.XSDstring);
  }

  /** Creates an {@code xsd:integer} literal. */
  public static Node integer(BigInteger value) {
    return NodeFactory.createLiteral(value.toString(), XSDDatatype.XSDinteger);
  }

  /** Creates an {@code xsd:integer} literal. */
  public static Node integer(long value) {
    return integer(BigInteger.valueOf(value));
  }

  /** Creates an {@code xsd:nonNegativeInteger} literal. */
  public static Node nonNegativeInteger(long value) {
    checkArgument(value >= 0, "negative value %s", value);
    return NodeFactory.createLiteral(
        Long.toString(value), XSDDatatype.XSDnonNegativeInteger);
  }

  /** Creates an {@code xsd:positiveInteger} literal. */
  public static Node positiveInteger(long value) {
    checkArgument(value > 0, "non-positive value %s", value);
    return NodeFactory.createLiteral(
        Long.toString(value), XSDDatatype.XSDpositiveInteger);
  }

  /**
   * Creates an {@code xsd:double} literal. Infinities and NaN use the XML
   * Schema lexical forms.
   */
  public static Node doubleLiteral(double value) {
    final String lexical;
    if (Double.isNaN(value)) {
      lexical = "NaN";
    } else if (Double.isInfinite(value)) {
      lexical = value > 0 ? "INF" : "-INF";
    } else {
      lexical = Double.toString(value);
    }
    return NodeFactory.createLiteral(lexical, XSDDatatype.XSDdouble);
  }

  /** Creates an {@code xsd:boolean} literal. */
  public static Node bool(boolean value) {
    return NodeFactory.createLiteral(
        Boolean.toString(value), XSDDatatype.XSDboolean);
  }

  /** Creates an {@code xsd:base64Binary} literal. */
  public static Node base64(byte[] bytes) {
    return NodeFactory.createLiteral(
        BaseEncoding.base64().encode(bytes), XSDDatatype.XSDbase64Binary);
  }
}

// End Triples.java
