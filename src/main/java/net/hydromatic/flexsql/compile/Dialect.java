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

import net.hydromatic.flexsql.ast.Associativity;
import net.hydromatic.flexsql.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rules for writing SQL for a particular database.
 *
 * <p>A dialect decides how tightly each operator binds, which way operators
 * of equal precedence group, how identifiers are quoted and how placeholders
 * are written. An operator call may override the dialect's precedence and
 * associativity.
 *
 * @see Dialects
 * @see SqlDialect
 */
public interface Dialect {
  /** Returns the name of this dialect, for error messages. */
  String name();

  /** Returns an identifier, quoted if this dialect's policy requires it. */
  String quoteIdentifier(String name);

  /** Returns the precedence of an operator; higher binds tighter; 0 if this
   * dialect does not define it. */
  int precedence(Op op);

  /** Returns the associativity of an operator, or null if this dialect does
   * not define it. */
  @Nullable Associativity associativity(Op op);

  /** Returns the text of a placeholder with a given name and 1-based
   * position. */
  String placeholder(String name, int position);
}

// End Dialect.java
