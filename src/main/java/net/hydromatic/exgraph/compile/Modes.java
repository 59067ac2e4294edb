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

/** Decides how much of a file to compile. */
public abstract class Modes {
  private Modes() {}

  /**
   * Returns whether expressions should be compiled in full: only if {@link
   * Prop#INCLUDE_EXPRESSIONS} is set and the file belongs to the project.
   */
  public static boolean shouldCompile(Context context) {
    return context.booleanValue(Prop.INCLUDE_EXPRESSIONS)
        && context.fileKind == FileKind.PROJECT;
  }
}

// End Modes.java
