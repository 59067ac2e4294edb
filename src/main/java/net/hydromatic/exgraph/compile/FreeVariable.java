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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import net.hydromatic.exgraph.ast.Pos;

/** Variable that a function literal references but does not bind. */
public class FreeVariable {
  public final String name;
  public final int referenceCount;
  /** Positions of the references, where known. */
  public final ImmutableList<Pos> referenceLocations;
  /** Position of the function literal that captures the variable. */
  public final Pos capturedAt;

  FreeVariable(
      String name,
      int referenceCount,
      Iterable<Pos> referenceLocations,
      Pos capturedAt) {
    checkArgument(referenceCount > 0, "no references to %s", name);
    this.name = requireNonNull(name);
    this.referenceCount = referenceCount;
    this.referenceLocations = ImmutableList.copyOf(referenceLocations);
    this.capturedAt = requireNonNull(capturedAt);
  }

  /** Combines the references of the same variable in two clauses. */
  FreeVariable plus(FreeVariable other) {
    checkArgument(name.equals(other.name));
    return new FreeVariable(
        name,
        referenceCount + other.referenceCount,
        ImmutableList.<Pos>builder()
            .addAll(referenceLocations)
            .addAll(other.referenceLocations)
            .build(),
        capturedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, referenceCount, referenceLocations, capturedAt);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FreeVariable
            && name.equals(((FreeVariable) o).name)
            && referenceCount == ((FreeVariable) o).referenceCount
            && referenceLocations.equals(((FreeVariable) o).referenceLocations)
            && capturedAt.equals(((FreeVariable) o).capturedAt);
  }

  @Override
  public String toString() {
    return name + "*" + referenceCount;
  }
}

// End FreeVariable.java
