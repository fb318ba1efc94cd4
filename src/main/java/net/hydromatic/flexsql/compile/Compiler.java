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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.flexsql.ast.SqlNode;
import net.hydromatic.flexsql.ast.SqlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles syntax trees into SQL statements for a dialect.
 *
 * <p>A compiler is immutable and may be shared between threads; each call to
 * {@link #compile} uses a fresh {@link SqlWriter}.
 */
public class Compiler {
  private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

  private final Dialect dialect;
  private final ImmutableMap<Prop, Object> propMap;

  /** Creates a Compiler with default properties. */
  public Compiler(Dialect dialect) {
    this(dialect, ImmutableMap.of());
  }

  /** Creates a Compiler.
   *
   * <p>Properties {@link Prop#PLACEHOLDER_STYLE} and
   * {@link Prop#IDENTIFIER_QUOTING}, if set, override those aspects of the
   * dialect. */
  public Compiler(Dialect dialect, Map<Prop, Object> propMap) {
    this.propMap = ImmutableMap.copyOf(propMap);
    checkArgument(Prop.MAX_DEPTH.intValue(this.propMap) > 0,
        "maxDepth must be positive");
    Dialect d = requireNonNull(dialect);
    final PlaceholderStyle placeholderStyle =
        Prop.PLACEHOLDER_STYLE.enumValue(this.propMap,
            PlaceholderStyle.class);
    if (placeholderStyle != null) {
      d = Dialects.withPlaceholderStyle(d, placeholderStyle);
    }
    final Quoting quoting =
        Prop.IDENTIFIER_QUOTING.enumValue(this.propMap, Quoting.class);
    if (quoting != null) {
      d = Dialects.withQuoting(d, quoting);
    }
    this.dialect = d;
  }

  /** Returns the dialect, after properties have been applied. */
  public Dialect dialect() {
    return dialect;
  }

  /** Returns the tree that would be written; the canonical form if
   * {@link Prop#NORMALIZE} is true, otherwise the tree unchanged.
   *
   * @throws SqlException of kind
   *   {@link SqlException.Kind#NESTING_TOO_DEEP} if the tree is deeper than
   *   {@link Prop#MAX_DEPTH} */
  public SqlNode rewrite(SqlNode node) {
    if (!Prop.NORMALIZE.booleanValue(propMap)) {
      return node;
    }
    return new Normalizer(Prop.MAX_DEPTH.intValue(propMap)).normalize(node);
  }

  /**
   * Compiles a tree into a statement.
   *
   * @throws SqlException if the tree cannot be written in this dialect, for
   *   example if an operator has no precedence
   */
  public CompiledStatement compile(SqlNode node) {
    final SqlNode node2 = rewrite(node);
    final SqlWriter w =
        new SqlWriter(dialect, Prop.MAX_DEPTH.intValue(propMap));
    final String sql = node2.unparse(w);
    final CompiledStatement statement =
        new CompiledStatement(sql, w.bindings(), w.occurrences());
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("compiled [{}] for dialect {} with {} placeholder(s)",
          sql, dialect.name(), statement.placeholders().size());
    }
    return statement;
  }
}

// End Compiler.java
