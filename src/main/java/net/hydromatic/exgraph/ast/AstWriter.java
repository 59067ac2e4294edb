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

import java.util.List;
import java.util.regex.Pattern;

/** Writes syntax trees in quoted form. */
public class AstWriter {
  private static final Pattern PLAIN_ATOM =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_@.]*[?!]?");
  private static final Pattern SYMBOL_ATOM =
      Pattern.compile("[-+*/=<>!&|^~%{}\\[\\].:\\\\@]+");

  private final StringBuilder b = new StringBuilder();

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a raw string. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node. */
  public AstWriter append(AstNode node) {
    return node.unparse(this);
  }

  /** Appends a list of nodes separated by commas. */
  public AstWriter appendAll(List<? extends AstNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      append(nodes.get(i));
    }
    return this;
  }

  /**
   * Appends an atom. Booleans and {@code nil} are written bare; atoms that are
   * neither identifiers nor operators are quoted.
   */
  public AstWriter atom(String name) {
    switch (name) {
      case "true":
      case "false":
      case "nil":
        b.append(name);
        return this;
      default:
        b.append(':');
        if (PLAIN_ATOM.matcher(name).matches()
            || SYMBOL_ATOM.matcher(name).matches()) {
          b.append(name);
          return this;
        }
        return string(name);
    }
  }

  /** Appends a double-quoted string, escaping as necessary. */
  public AstWriter string(String s) {
    b.append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"':
          b.append("\\\"");
          break;
        case '\\':
          b.append("\\\\");
          break;
        case '\n':
          b.append("\\n");
          break;
        case '\t':
          b.append("\\t");
          break;
        default:
          b.append(c);
      }
    }
    b.append('"');
    return this;
  }

  /** Appends the metadata list of a form. */
  public AstWriter meta(Pos pos) {
    if (!pos.isKnown()) {
      b.append("[]");
    } else if (!pos.hasColumn()) {
      b.append("[line: ").append(pos.startLine).append(']');
    } else {
      b.append("[line: ")
          .append(pos.startLine)
          .append(", column: ")
          .append(pos.startColumn)
          .append(']');
    }
    return this;
  }
}

// End AstWriter.java
