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

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.jena.graph.Node;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Context}, {@link FileKind}, {@link IdGenerator} and
 * {@link Modes}.
 */
public class ContextTest {
  @Test
  void testFileKind() {
    assertThat(FileKind.of("lib/foo.ex"), is(FileKind.PROJECT));
    assertThat(FileKind.of("/home/me/app/lib/deps.ex"), is(FileKind.PROJECT));
    assertThat(FileKind.of("lib/mydeps/foo.ex"), is(FileKind.PROJECT));
    assertThat(FileKind.of("deps/jason/lib/jason.ex"), is(FileKind.DEPENDENCY));
    assertThat(
        FileKind.of("/home/me/app/deps/plug/lib/plug.ex"),
        is(FileKind.DEPENDENCY));
    assertThat(
        FileKind.of("C:\\app\\deps\\plug\\lib\\plug.ex"),
        is(FileKind.DEPENDENCY));
    assertThat(FileKind.of(null), is(FileKind.DEPENDENCY));
  }

  @Test
  void testModes() {
    assertThat(Modes.shouldCompile(Fixtures.context()), is(true));

    // Expressions in dependencies are never compiled
    final Context deps = Context.of(Fixtures.config(), "deps/x/lib/x.ex");
    assertThat(Modes.shouldCompile(deps), is(false));

    // Nor, by default, are expressions in the project
    final Context light = Context.of(new HashMap<>(), "lib/x.ex");
    assertThat(Modes.shouldCompile(light), is(false));

    // A caller may supply the file kind rather than derive it from the path
    final Context given =
        Context.of(Fixtures.config(), "deps/x/lib/x.ex", FileKind.PROJECT);
    assertThat(given.fileKind, is(FileKind.PROJECT));
    assertThat(Modes.shouldCompile(given), is(true));
    final Context vendored =
        Context.of(Fixtures.config(), "lib/x.ex", FileKind.DEPENDENCY);
    assertThat(Modes.shouldCompile(vendored), is(false));
    assertThat(
        Context.of(Fixtures.config(), null).fileKind, is(FileKind.DEPENDENCY));
  }

  @Test
  void testBaseIri() {
    final Map<Prop, Object> map = Fixtures.config();
    Prop.BASE_IRI.set(map, "https://example.com/code");
    assertThrows(
        IllegalArgumentException.class, () -> Context.of(map, "lib/a.ex"));
    Prop.BASE_IRI.set(map, "code#");
    assertThrows(
        IllegalArgumentException.class, () -> Context.of(map, "lib/a.ex"));
    Prop.BASE_IRI.set(map, "https://example.com/code/");
    final Context context = Context.of(map, "lib/a.ex");
    assertThat(context.baseIri, is("https://example.com/code/"));
    assertThat(
        context.ids.next().getURI(), is("https://example.com/code/expr/0"));
  }

  @Test
  void testIris() {
    final Context context = Fixtures.context();
    assertThat(
        context.moduleIri("MyApp.Worker").getURI(),
        is("https://example.org/code#MyApp.Worker"));
    assertThat(
        context.moduleIri(":lists").getURI(),
        is("https://example.org/code#:lists"));
    assertThat(
        context.functionIri("Enum", "map", 2).getURI(),
        is("https://example.org/code#Enum/map/2"));
    assertThat(
        context.functionIri("MyApp", "valid?", 1).getURI(),
        is("https://example.org/code#MyApp/valid%3F/1"));
  }

  @Test
  void testWith() {
    final Context context = Fixtures.context();
    assertThat(context.scopeChain, nullValue());
    assertThat(context.withScopeChain(null), sameInstance(context));

    final ScopeChain chain = ScopeChain.EMPTY.push(Scope.Kind.MODULE);
    final Context context2 = context.withScopeChain(chain);
    assertThat(context2.scopeChain, sameInstance(chain));
    assertThat(context2.ids, sameInstance(context.ids));

    final Context context3 = context2.withTracer(Tracers.empty());
    assertThat(context3.scopeChain, sameInstance(chain));
    assertThat(context3.fileKind, is(FileKind.PROJECT));
  }

  @Test
  void testIdGenerator() {
    final IdGenerator ids = new IdGenerator("urn:x#");
    assertThat(ids.count(), is(0));
    assertThat(ids.next().getURI(), is("urn:x#expr/0"));
    assertThat(ids.next().getURI(), is("urn:x#expr/1"));
    assertThat(ids.count(), is(2));

    final Node parent = ids.next();
    assertThat(
        IdGenerator.child(parent, "clause", 1).getURI(),
        is("urn:x#expr/2/clause/1"));
    assertThat(
        IdGenerator.child(parent, "capture", "x y").getURI(),
        is("urn:x#expr/2/capture/x%20y"));
  }

  /** A generator may only be used by the thread that created it. */
  @Test
  void testIdGeneratorIsConfinedToThread() throws InterruptedException {
    final IdGenerator ids = new IdGenerator("urn:x#");
    ids.next();
    final AtomicReference<Throwable> thrown = new AtomicReference<>();
    final Thread thread =
        new Thread(
            () -> {
              try {
                ids.next();
              } catch (Throwable e) {
                thrown.set(e);
              }
            },
            "other");
    thread.start();
    thread.join();
    assertThat(thrown.get(), instanceOf(IllegalStateException.class));
    assertThat(ids.count(), is(1));
  }
}

// End ContextTest.java
