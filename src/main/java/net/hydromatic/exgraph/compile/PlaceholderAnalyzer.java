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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import net.hydromatic.exgraph.ast.Ast;
import net.hydromatic.exgraph.ast.Pos;
import net.hydromatic.exgraph.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds the positional placeholders, {@code &1}, {@code &2} and so on, in the
 * body of a capture such as {@code &(&1 + &3)}.
 */
public class PlaceholderAnalyzer {
  /** Highest placeholder; a function has at most 255 arguments. */
  static final int MAX_POSITION = 255;

  private PlaceholderAnalyzer() {}

  /** Analyzes the body of a capture. */
  public static PlaceholderAnalysis analyze(Ast.Term body) {
    final TreeMap<Integer, List<Pos>> uses = new TreeMap<>();
    body.accept(
        new Visitor() {
          @Override
          protected void visit(Ast.Form form) {
            final Integer position = position(form);
            if (position != null) {
              uses.computeIfAbsent(position, k -> new ArrayList<>())
                  .add(form.pos);
              return;
            }
            super.visit(form);
          }
        });

    final ImmutableList.Builder<Placeholder> placeholders =
        ImmutableList.builder();
    uses.forEach((position, positions) -> {
      final List<Pos> known = new ArrayList<>();
      for (Pos pos : positions) {
        if (pos.isKnown()) {
          known.add(pos);
        }
      }
      placeholders.add(new Placeholder(position, positions.size(), known));
    });
    if (uses.isEmpty()) {
      return new PlaceholderAnalysis(
          placeholders.build(), null, ImmutableList.of());
    }
    final int highest = uses.lastKey();
    final ImmutableList.Builder<Integer> gaps = ImmutableList.builder();
    for (int i = 1; i < highest; i++) {
      if (!uses.containsKey(i)) {
        gaps.add(i);
      }
    }
    return new PlaceholderAnalysis(placeholders.build(), highest, gaps.build());
  }

  /** Returns the position of a placeholder, or null if it is not one. */
  static @Nullable Integer position(Ast.Term term) {
    if (Terms.isForm(term, "&", 1)) {
      final Ast.Term arg = ((Ast.Form) term).arg(0);
      if (arg instanceof Ast.IntLiteral && isPosition((Ast.IntLiteral) arg)) {
        return ((Ast.IntLiteral) arg).value.intValueExact();
      }
    }
    return null;
  }

  /** Returns whether an integer is a valid placeholder position. */
  static boolean isPosition(Ast.IntLiteral literal) {
    return literal.between(1, MAX_POSITION);
  }

  /**
   * Returns whether the body of a capture contains a placeholder whose
   * position is out of range, such as {@code &0} or {@code &1000}.
   */
  static boolean hasInvalidPlaceholder(Ast.Term body) {
    final boolean[] invalid = {false};
    body.accept(
        new Visitor() {
          @Override
          protected void visit(Ast.Form form) {
            if (form.is("&", 1)
                && form.arg(0) instanceof Ast.IntLiteral
                && !isPosition((Ast.IntLiteral) form.arg(0))) {
              invalid[0] = true;
              return;
            }
            super.visit(form);
          }
        });
    return invalid[0];
  }
}

// End PlaceholderAnalyzer.java
