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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Whether a source file belongs to the project or to a dependency. */
public enum FileKind {
  PROJECT,
  DEPENDENCY;

  /**
   * Classifies a file path.
   *
   * <p>A path is a dependency if it lies in a {@code deps} directory, with
   * either separator, at the start of the path or after a separator. A null
   * path is also a dependency.
   */
  public static FileKind of(@Nullable String path) {
    if (path == null
        || path.contains("/deps/")
        || path.contains("\\deps\\")
        || path.startsWith("deps/")
        || path.startsWith("deps\\")) {
      return DEPENDENCY;
    }
    return PROJECT;
  }
}

// End FileKind.java
