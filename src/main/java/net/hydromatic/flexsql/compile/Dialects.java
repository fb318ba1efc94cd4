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

import net.hydromatic.flexsql.ast.Associativity;
import net.hydromatic.flexsql.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in dialects, and utilities for dialects.
 *
 * <p>The built-in dialects share a precedence table. From loosest to
 * tightest:
 *
 * <table>
 *   <caption>Default precedence</caption>
 *   <tr><th>Precedence</th><th>Operators</th><th>Associativity</th></tr>
 *   <tr><td>1</td><td>OR</td><td>left</td></tr>
 *   <tr><td>2</td><td>AND</td><td>left</td></tr>
 *   <tr><td>3</td><td>NOT, EXISTS</td><td>right (prefix)</td></tr>
 *   <tr><td>4</td><td>IS NULL, IS TRUE, ...</td><td>left (postfix)</td></tr>
 *   <tr><td>5</td><td>&lt;, &lt;=, &gt;, &gt;=, =, &lt;&gt;</td>
 *     <td>none</td></tr>
 *   <tr><td>6</td><td>IN, LIKE, ILIKE, BETWEEN and their negations</td>
 *     <td>none</td></tr>
 *   <tr><td>7</td><td>+, -, ||</td><td>left</td></tr>
 *   <tr><td>8</td><td>*, /, %</td><td>left</td></tr>
 *   <tr><td>9</td><td>- (negation)</td><td>right (prefix)</td></tr>
 * </table>
 */
public abstract class Dialects {
  private Dialects() {}

  /** Standard SQL, with "?" placeholders. */
  public static final SqlDialect ANSI =
      standard("ANSI").build();

  /** PostgreSQL, with "$1" placeholders. Unquoted identifiers are converted
   * to lower case, so a name with upper-case letters is quoted. */
  public static final SqlDialect POSTGRESQL =
      standard("POSTGRESQL")
          .unquotedCasing(Casing.TO_LOWER)
          .placeholderStyle(PlaceholderStyle.DOLLAR)
          .build();

  /** MySQL, with back-tick quoted identifiers and "?" placeholders. */
  public static final SqlDialect MYSQL =
      standard("MYSQL")
          .identifierQuote("`", "`")
          .build();

  /** SQLite, with "?" placeholders. */
  public static final SqlDialect SQLITE =
      standard("SQLITE").build();

  /** Oracle, with ":name" placeholders. Unquoted identifiers are converted
   * to upper case, so a name with lower-case letters is quoted. */
  public static final SqlDialect ORACLE =
      standard("ORACLE")
          .unquotedCasing(Casing.TO_UPPER)
          .placeholderStyle(PlaceholderStyle.COLON)
          .build();

  /** Microsoft SQL Server, with bracket-quoted identifiers and "@name"
   * placeholders. */
  public static final SqlDialect SQL_SERVER =
      standard("SQL_SERVER")
          .identifierQuote("[", "]")
          .placeholderStyle(PlaceholderStyle.AT)
          .build();

  /** Creates a builder with the default precedence table. */
  public static SqlDialect.Builder standard(String name) {
    final SqlDialect.Builder b = SqlDialect.builder().name(name);
    b.operator(Op.OR, 1, Associativity.LEFT);
    b.operator(Op.AND, 2, Associativity.LEFT);
    b.operator(Op.NOT, 3, Associativity.RIGHT);
    b.operator(Op.EXISTS, 3, Associativity.RIGHT);
    for (Op op : new Op[] {Op.IS_NULL, Op.IS_NOT_NULL, Op.IS_TRUE,
        Op.IS_NOT_TRUE, Op.IS_FALSE, Op.IS_NOT_FALSE}) {
      b.operator(op, 4, Associativity.LEFT);
    }
    for (Op op : new Op[] {Op.LT, Op.LE, Op.GT, Op.GE, Op.EQ, Op.NE}) {
      b.operator(op, 5, Associativity.NON_ASSOCIATIVE);
    }
    for (Op op : new Op[] {Op.IN, Op.NOT_IN, Op.LIKE, Op.NOT_LIKE, Op.ILIKE,
        Op.NOT_ILIKE, Op.BETWEEN, Op.NOT_BETWEEN}) {
      b.operator(op, 6, Associativity.NON_ASSOCIATIVE);
    }
    for (Op op : new Op[] {Op.ADD, Op.SUB, Op.CONCAT}) {
      b.operator(op, 7, Associativity.LEFT);
    }
    for (Op op : new Op[] {Op.MUL, Op.DIV, Op.MOD}) {
      b.operator(op, 8, Associativity.LEFT);
    }
    b.operator(Op.NEGATE, 9, Associativity.RIGHT);
    return b;
  }

  /** Looks up a built-in dialect by name, case-insensitively; returns null
   * if not found. */
  public static @Nullable SqlDialect lookup(String name) {
    for (SqlDialect dialect
        : new SqlDialect[] {ANSI, POSTGRESQL, MYSQL, SQLITE, ORACLE,
            SQL_SERVER}) {
      if (dialect.name().equalsIgnoreCase(name)) {
        return dialect;
      }
    }
    return null;
  }

  /** Returns a dialect that is the same as a given dialect but writes
   * placeholders in a given style. */
  public static Dialect withPlaceholderStyle(Dialect dialect,
      PlaceholderStyle placeholderStyle) {
    requireNonNull(placeholderStyle);
    if (dialect instanceof SqlDialect) {
      final SqlDialect sqlDialect = (SqlDialect) dialect;
      if (sqlDialect.placeholderStyle() == placeholderStyle) {
        return dialect;
      }
      return sqlDialect.toBuilder().placeholderStyle(placeholderStyle).build();
    }
    return new DelegatingDialect(dialect) {
      @Override public String placeholder(String name, int position) {
        return placeholderStyle.render(name, position);
      }
    };
  }

  /** Returns a dialect that is the same as a given dialect but quotes
   * identifiers according to a given policy.
   *
   * <p>Only {@link Quoting#NEVER} is possible if the dialect is not a
   * {@link SqlDialect}, because other policies need the dialect's quote
   * characters. */
  public static Dialect withQuoting(Dialect dialect, Quoting quoting) {
    requireNonNull(quoting);
    if (dialect instanceof SqlDialect) {
      final SqlDialect sqlDialect = (SqlDialect) dialect;
      if (sqlDialect.quoting() == quoting) {
        return dialect;
      }
      return sqlDialect.toBuilder().quoting(quoting).build();
    }
    checkArgument(quoting == Quoting.NEVER,
        "cannot change quoting of dialect %s to %s", dialect.name(), quoting);
    return new DelegatingDialect(dialect) {
      @Override public String quoteIdentifier(String name) {
        return name;
      }
    };
  }

  /** Dialect that forwards every call to another dialect. */
  private static class DelegatingDialect implements Dialect {
    private final Dialect dialect;

    DelegatingDialect(Dialect dialect) {
      this.dialect = requireNonNull(dialect);
    }

    @Override public String name() {
      return dialect.name();
    }

    @Override public String quoteIdentifier(String name) {
      return dialect.quoteIdentifier(name);
    }

    @Override public int precedence(Op op) {
      return dialect.precedence(op);
    }

    @Override public @Nullable Associativity associativity(Op op) {
      return dialect.associativity(op);
    }

    @Override public String placeholder(String name, int position) {
      return dialect.placeholder(name, position);
    }
  }
}

// End Dialects.java
