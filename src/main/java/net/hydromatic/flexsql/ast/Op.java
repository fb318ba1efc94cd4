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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link SqlNode}. */
public enum Op {
  // leaves
  LITERAL,
  VERBATIM,
  TYPE_NAME,
  PLACEHOLDER,
  COLUMN,
  TABLE,
  LABELED_TABLE,

  // arithmetic
  MUL("*"),
  DIV("/"),
  MOD("%"),
  ADD("+"),
  SUB("-"),
  CONCAT("||"),
  NEGATE("-"),

  // postfix tests
  IS_NULL("IS NULL"),
  IS_NOT_NULL("IS NOT NULL"),
  IS_TRUE("IS TRUE"),
  IS_NOT_TRUE("IS NOT TRUE"),
  IS_FALSE("IS FALSE"),
  IS_NOT_FALSE("IS NOT FALSE"),

  // membership, pattern and interval tests
  IN("IN"),
  NOT_IN("NOT IN"),
  BETWEEN("BETWEEN", "AND"),
  NOT_BETWEEN("NOT BETWEEN", "AND"),
  LIKE("LIKE"),
  NOT_LIKE("NOT LIKE"),
  ILIKE("ILIKE"),
  NOT_ILIKE("NOT ILIKE"),

  // comparison
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),
  EQ("="),
  NE("<>"),

  // logical
  NOT("NOT"),
  EXISTS("EXISTS"),
  AND("AND"),
  OR("OR"),

  // expressions
  CAST,
  FUNCTION,
  TUPLE,
  CASE,
  SCALAR_SUBQUERY,

  // clauses
  LABELED_COLUMN,
  SUBQUERY,
  JOIN,
  FROM_ITEM,
  FROM,
  WHERE,
  GROUP_BY,
  HAVING,
  ORDER_ITEM,
  ORDER_BY,
  LIMIT,
  OFFSET,
  SELECT;

  /** Default symbol of an operator, e.g. "IS NULL"; null if this is not an
   * operator. For a ternary operator, the symbol before the second operand. */
  public final @Nullable String symbol;
  /** Symbol before the third operand of a ternary operator, e.g. "AND" in
   * "x BETWEEN a AND b"; otherwise null. */
  public final @Nullable String symbol2;

  Op() {
    this(null, null);
  }

  Op(String symbol) {
    this(symbol, null);
  }

  Op(@Nullable String symbol, @Nullable String symbol2) {
    this.symbol = symbol;
    this.symbol2 = symbol2;
  }

  /** Returns whether this kind of node is an operator; that is, whether its
   * grouping is decided by precedence and associativity. */
  public boolean isOperator() {
    return symbol != null;
  }

  /** Returns whether this kind of node is an operator with three operands. */
  public boolean isTernary() {
    return symbol2 != null;
  }
}

// End Op.java
