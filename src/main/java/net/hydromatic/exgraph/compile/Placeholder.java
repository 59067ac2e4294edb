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
import net.hydromatic.exgraph.ast.Pos;

/** Uses of one positional placeholder, such as {@code &2}, in a capture. */
public class Placeholder {
  /** 1-based position. */
  public final int position;

  public final int usageCount;
  public final ImmutableList<Pos> locations;

  Placeholder(int position, int usageCount, Iterable<Pos> locations) {
    this.position = position;
    this.usageCount = usageCount;
    this.locations = ImmutableList.copyOf(locations);
  }

  @Override
  public String toString() {
    return "&" + position + "*" + usageCount;
  }
}

// End Placeholder.java
