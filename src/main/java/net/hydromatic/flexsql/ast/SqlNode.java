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
package net.hydromatic.flexsql.ast;

import static java.util.Objects.requireNonNull;

import net.hydromatic.flexsql.compile.Dialects;
import net.hydromatic.flexsql.compile.Normalizer;

/** Node of a SQL syntax tree. */
public abstract class SqlNode {
  public final Op op;

  SqlNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a SQL string in the ANSI dialect.
   *
   * <p>The purpose of this string is debugging. If you want to generate a
   * statement for a particular database, use {@link #unparse} with a writer
   * for that database's dialect, or a
   * {@link net.hydromatic.flexsql.compile.Compiler}.
   */
  @Override public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new SqlWriter(Dialects.ANSI));
  }

  /** Converts this node into a SQL string, with a given writer. */
  public final String unparse(SqlWriter w) {
    return w.append(this).toString();
  }

  /** Writes this node's text. Children are written via
   * {@link SqlWriter#append(SqlNode)}, never by calling this method
   * directly. */
  abstract SqlWriter unparseTo(SqlWriter w);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate to
   * the type of this node, and returning the result.
   */
  public abstract SqlNode accept(Shuttle shuttle);

  /** Returns the canonical form of this tree, with negated operators
   * collapsed. Returns {@code this} if the tree is already canonical. */
  public SqlNode rewrite() {
    return new Normalizer().normalize(this);
  }
}

// End SqlNode.java
