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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * SQL statement that has been written for a dialect, with the positions of
 * its placeholders.
 *
 * <p>Given values for the placeholders, by name, it produces the arguments to
 * pass to a database driver.
 */
public class CompiledStatement {
  private final String sql;
  private final ImmutableMap<String, Integer> placeholders;
  private final ImmutableList<String> occurrences;

  CompiledStatement(String sql, Map<String, Integer> placeholders,
      List<String> occurrences) {
    this.sql = requireNonNull(sql);
    this.placeholders = ImmutableMap.copyOf(placeholders);
    this.occurrences = ImmutableList.copyOf(occurrences);
  }

  @Override public String toString() {
    return sql;
  }

  /** Returns the SQL text. */
  public String sql() {
    return sql;
  }

  /** Returns the 1-based position of each placeholder name, in order of
   * position. */
  public ImmutableMap<String, Integer> placeholders() {
    return placeholders;
  }

  /** Returns the names of placeholders in the order that they occur in the
   * text. A name that is written more than once occurs more than once. */
  public ImmutableList<String> occurrences() {
    return occurrences;
  }

  /**
   * Returns the values of placeholders, in order of position.
   *
   * <p>Element 0 is the value for position 1, and so forth. Use this for
   * dialects whose placeholders carry a position or name, such as "$1" or
   * ":name".
   *
   * @param values Value of each placeholder, keyed by name; a value may be
   *   null
   * @throws SqlException of kind
   *   {@link SqlException.Kind#UNBOUND_PLACEHOLDER} if a placeholder has no
   *   value, or {@link SqlException.Kind#UNKNOWN_INPUT_KEY} if a name in
   *   {@code values} is not a placeholder in this statement
   */
  public List<Object> arguments(Map<String, ?> values) {
    check(values);
    final Object[] arguments = new Object[placeholders.size()];
    placeholders.forEach((name, position) ->
        arguments[position - 1] = values.get(name));
    return Arrays.asList(arguments);
  }

  /**
   * Returns the values of placeholders, one for each occurrence in the text.
   *
   * <p>Use this for dialects whose placeholders are all "?", where a driver
   * binds values by the order of the "?" characters.
   *
   * @see #arguments(Map)
   */
  public List<Object> occurrenceArguments(Map<String, ?> values) {
    check(values);
    final List<Object> arguments = new ArrayList<>(occurrences.size());
    for (String name : occurrences) {
      arguments.add(values.get(name));
    }
    return arguments;
  }

  private void check(Map<String, ?> values) {
    for (String name : placeholders.keySet()) {
      if (!values.containsKey(name)) {
        throw new SqlException(SqlException.Kind.UNBOUND_PLACEHOLDER,
            "no value for placeholder " + name);
      }
    }
    if (values.size() > placeholders.size()) {
      final List<String> unknown =
          Ordering.<String>natural().nullsFirst()
              .sortedCopy(Sets.difference(values.keySet(),
                  placeholders.keySet()));
      throw new SqlException(SqlException.Kind.UNKNOWN_INPUT_KEY,
          "not a placeholder: " + Joiner.on(", ").useForNull("null")
              .join(unknown));
    }
  }
}

// End CompiledStatement.java
