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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Summary of the placeholders in a capture body.
 *
 * <p>The arity of the capture is the highest placeholder position, even if
 * lower positions are unused; unused positions are listed in {@link #gaps}.
 */
public class PlaceholderAnalysis {
  /** Placeholders, sorted by position. */
  public final ImmutableList<Placeholder> placeholders;

  /** Highest position used, or null if there are no placeholders. */
  public final @Nullable Integer highest;

  /** Unused positions below {@link #highest}, ascending. */
  public final ImmutableList<Integer> gaps;

  PlaceholderAnalysis(
      Iterable<Placeholder> placeholders,
      @Nullable Integer highest,
      Iterable<Integer> gaps) {
    this.placeholders = ImmutableList.copyOf(placeholders);
    this.highest = highest;
    this.gaps = ImmutableList.copyOf(gaps);
  }

  /** Returns the arity of the capture; 0 if there are no placeholders. */
  public int arity() {
    return highest == null ? 0 : highest;
  }

  public boolean hasGaps() {
    return !gaps.isEmpty();
  }

  /** Returns the total number of placeholder uses. */
  public int totalUsages() {
    int n = 0;
    for (Placeholder placeholder : placeholders) {
      n += placeholder.usageCount;
    }
    return n;
  }

  @Override
  public String toString() {
    return "placeholders " + placeholders + ", gaps " + gaps;
  }
}

// End PlaceholderAnalysis.java
