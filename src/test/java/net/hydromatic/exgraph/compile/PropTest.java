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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.INCLUDE_EXPRESSIONS.booleanValue(map), is(false));
    assertThat(Prop.INCLUDE_LOCATIONS.booleanValue(map), is(true));
    assertThat(
        Prop.BASE_IRI.stringValue(map), is("https://example.org/code#"));
  }

  @Test
  void testLookup() {
    assertThat(Prop.lookup("includeExpressions"), is(Prop.INCLUDE_EXPRESSIONS));
    assertThat(Prop.lookup("BASE_IRI"), is(Prop.BASE_IRI));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("foo"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.BASE_IRI));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.INCLUDE_LOCATIONS.set(map, false);
    assertThat(Prop.INCLUDE_LOCATIONS.booleanValue(map), is(false));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.INCLUDE_LOCATIONS.set(map, "false"));
    assertThrows(
        IllegalArgumentException.class, () -> Prop.BASE_IRI.set(map, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.INCLUDE_LOCATIONS.stringValue(map));

    Prop.INCLUDE_LOCATIONS.setLenient(map, " TRUE ");
    assertThat(Prop.INCLUDE_LOCATIONS.booleanValue(map), is(true));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.INCLUDE_LOCATIONS.setLenient(map, "yes"));
  }

  /** Reads a configuration file; keys may be in either case. */
  @Test
  void testLoad() throws IOException {
    final Properties properties = new Properties();
    try (InputStream stream =
        PropTest.class.getResourceAsStream("/exgraph-test.properties")) {
      properties.load(stream);
    }
    final Map<Prop, Object> map = Prop.load(properties);
    assertThat(map.size(), is(3));
    assertThat(Prop.BASE_IRI.stringValue(map), is("https://example.com/src/"));
    assertThat(Prop.INCLUDE_EXPRESSIONS.booleanValue(map), is(true));
    assertThat(Prop.INCLUDE_LOCATIONS.booleanValue(map), is(false));

    final Context context = Context.of(map, "lib/a.ex");
    assertThat(context.baseIri, is("https://example.com/src/"));
    assertThat(Modes.shouldCompile(context), is(true));
  }
}

// End PropTest.java
