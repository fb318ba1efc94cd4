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
package net.hydromatic.flexsql.compile;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("maxDepth"), is(Prop.MAX_DEPTH));
    assertThat(Prop.lookup("MAX_DEPTH"), is(Prop.MAX_DEPTH));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.IDENTIFIER_QUOTING));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("depth"));
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThat(Prop.NORMALIZE.booleanValue(map), is(true));
    assertThat(Prop.MAX_DEPTH.intValue(map), is(1000));
    assertThat(Prop.PLACEHOLDER_STYLE.enumValue(map, PlaceholderStyle.class),
        nullValue());
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEPTH.booleanValue(map));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.MAX_DEPTH.setLenient(map, "20");
    assertThat(Prop.MAX_DEPTH.intValue(map), is(20));
    Prop.NORMALIZE.setLenient(map, "false");
    assertThat(Prop.NORMALIZE.booleanValue(map), is(false));
    Prop.IDENTIFIER_QUOTING.setLenient(map, "as_needed");
    assertThat(Prop.IDENTIFIER_QUOTING.enumValue(map, Quoting.class),
        is(Quoting.AS_NEEDED));

    final IllegalArgumentException x =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.PLACEHOLDER_STYLE.setLenient(map, "percent"));
    assertThat(x.getMessage(),
        is("value for property placeholderStyle must be one of: "
            + "'QUESTION', 'DOLLAR', 'COLON', 'AT'"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEPTH.set(map, "20"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEPTH.set(map, null));

    // an optional property can be unset
    Prop.IDENTIFIER_QUOTING.set(map, null);
    assertThat(Prop.IDENTIFIER_QUOTING.enumValue(map, Quoting.class),
        nullValue());
    assertThat(Prop.MAX_DEPTH.remove(map), is((Object) 20));
    assertThat(Prop.MAX_DEPTH.intValue(map), is(1000));
  }
}

// End PropTest.java
