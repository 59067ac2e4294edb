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

import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import java.util.Map;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Everything the compiler needs to know about the file it is compiling.
 *
 * <p>Create one context per file. The context owns the {@link IdGenerator},
 * so two compilations that share a context get distinct identifiers, and a
 * context must not be shared between threads.
 */
public class Context {
  private static final Escaper SEGMENT_ESCAPER =
      UrlEscapers.urlPathSegmentEscaper();

  public final String baseIri;
  public final @Nullable String filePath;
  public final FileKind fileKind;
  public final ImmutableMap<Prop, Object> config;
  public final IdGenerator ids;
  /** Scopes that enclose the expression being compiled, if known. */
  public final @Nullable ScopeChain scopeChain;
  public final Tracer tracer;

  private Context(
      String baseIri,
      @Nullable String filePath,
      FileKind fileKind,
      ImmutableMap<Prop, Object> config,
      IdGenerator ids,
      @Nullable ScopeChain scopeChain,
      Tracer tracer) {
    this.baseIri = requireNonNull(baseIri);
    this.filePath = filePath;
    this.fileKind = requireNonNull(fileKind);
    this.config = requireNonNull(config);
    this.ids = requireNonNull(ids);
    this.scopeChain = scopeChain;
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Creates a context for a file.
   *
   * @param config Configuration; properties not in the map have their default
   *     values
   * @param filePath Path of the file, or null if not known
   */
  public static Context of(
      Map<Prop, Object> config, @Nullable String filePath) {
    return of(config, filePath, FileKind.of(filePath));
  }

  /**
   * Creates a context for a file whose kind the caller has already
   * determined.
   *
   * @param config Configuration; properties not in the map have their default
   *     values
   * @param filePath Path of the file, or null if not known
   * @param fileKind Whether the file belongs to the project or a dependency
   */
  public static Context of(
      Map<Prop, Object> config,
      @Nullable String filePath,
      FileKind fileKind) {
    requireNonNull(fileKind, "fileKind");
    final String baseIri = Prop.BASE_IRI.stringValue(config);
    checkArgument(
        baseIri.endsWith("#") || baseIri.endsWith("/"),
        "base IRI must end with '#' or '/': %s",
        baseIri);
    checkArgument(
        baseIri.contains(":"), "base IRI must be absolute: %s", baseIri);
    return new Context(
        baseIri,
        filePath,
        fileKind,
        ImmutableMap.copyOf(config),
        new IdGenerator(baseIri),
        null,
        Tracers.empty());
  }

  /**
   * Returns a context that is the same as this but with a given scope chain.
   * The new context shares this context's id generator.
   */
  public Context withScopeChain(@Nullable ScopeChain scopeChain) {
    if (scopeChain == this.scopeChain) {
      return this;
    }
    return new Context(
        baseIri, filePath, fileKind, config, ids, scopeChain, tracer);
  }

  /** Returns a context that is the same as this but with a given tracer. */
  public Context withTracer(Tracer tracer) {
    return new Context(
        baseIri, filePath, fileKind, config, ids, scopeChain, tracer);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Prop prop) {
    return prop.booleanValue(config);
  }

  /** Returns the IRI of a module, for example {@code {base}String.Chars}. */
  public Node moduleIri(String module) {
    return NodeFactory.createURI(baseIri + SEGMENT_ESCAPER.escape(module));
  }

  /** Returns the IRI of a function, for example {@code {base}Enum/map/2}. */
  public Node functionIri(String module, String function, int arity) {
    return NodeFactory.createURI(
        baseIri
            + SEGMENT_ESCAPER.escape(module)
            + "/"
            + SEGMENT_ESCAPER.escape(function)
            + "/"
            + arity);
  }
}

// End Context.java
