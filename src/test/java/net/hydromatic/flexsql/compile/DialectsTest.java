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

import static net.hydromatic.flexsql.ast.SqlBuilder.sql;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.flexsql.ast.Associativity;
import net.hydromatic.flexsql.ast.Op;
import net.hydromatic.flexsql.ast.SqlWriter;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link Dialects}, {@link SqlDialect} and
 * {@link PlaceholderStyle}. */
public class DialectsTest {
  @Test void testPlaceholderStyle() {
    assertThat(PlaceholderStyle.QUESTION.render("x", 3), is("?"));
    assertThat(PlaceholderStyle.DOLLAR.render("x", 3), is("$3"));
    assertThat(PlaceholderStyle.COLON.render("x", 3), is(":x"));
    assertThat(PlaceholderStyle.AT.render("x", 3), is("@x"));
    assertThat(PlaceholderStyle.QUESTION.isPositional(), is(true));
    assertThat(PlaceholderStyle.DOLLAR.isPositional(), is(false));
  }

  /** Tests that every built-in dialect has the same precedence table. */
  @Test void testDefaultPrecedence() {
    for (SqlDialect dialect
        : new SqlDialect[] {Dialects.ANSI, Dialects.POSTGRESQL, Dialects.MYSQL,
            Dialects.SQLITE, Dialects.ORACLE, Dialects.SQL_SERVER}) {
      for (Op op : Op.values()) {
        assertThat(dialect.precedence(op), is(Dialects.ANSI.precedence(op)));
        assertThat(op.isOperator(), is(dialect.precedence(op) > 0));
        assertThat(dialect.associativity(op),
            is(Dialects.ANSI.associativity(op)));
      }
    }
    assertThat(Dialects.ANSI.precedence(Op.OR), is(1));
    assertThat(Dialects.ANSI.precedence(Op.NOT), is(3));
    assertThat(Dialects.ANSI.precedence(Op.EXISTS), is(3));
    assertThat(Dialects.ANSI.precedence(Op.NEGATE), is(9));
    assertThat(Dialects.ANSI.precedence(Op.SELECT), is(0));
    assertThat(Dialects.ANSI.associativity(Op.IS_NULL),
        is(Associativity.LEFT));
    assertThat(Dialects.ANSI.associativity(Op.BETWEEN),
        is(Associativity.NON_ASSOCIATIVE));
    assertThat(Dialects.ANSI.associativity(Op.SELECT), nullValue());
  }

  @Test void testQuoting() {
    assertThat(Dialects.ANSI.quoteIdentifier("emp"), is("emp"));
    assertThat(Dialects.ANSI.quoteIdentifier("_emp2"), is("_emp2"));
    assertThat(Dialects.ANSI.quoteIdentifier("2emp"), is("\"2emp\""));
    assertThat(Dialects.ANSI.quoteIdentifier("Order"), is("\"Order\""));
    assertThat(Dialects.ANSI.quoteIdentifier("a\"b"), is("\"a\"\"b\""));
    assertThat(Dialects.MYSQL.quoteIdentifier("group"), is("`group`"));
    assertThat(Dialects.SQL_SERVER.quoteIdentifier("user"), is("[user]"));

    // words that are reserved in most databases
    for (String word : new String[] {"default", "with", "VALUES", "into",
        "to", "for", "check", "primary", "unique", "key"}) {
      assertThat(Dialects.ANSI.quoteIdentifier(word), is("\"" + word + "\""));
    }
    assertThat(Dialects.ANSI.quoteIdentifier("defaults"), is("defaults"));

    final SqlDialect always =
        Dialects.ANSI.toBuilder().quoting(Quoting.ALWAYS).build();
    assertThat(always.quoteIdentifier("emp"), is("\"emp\""));
    final SqlDialect never =
        Dialects.ANSI.toBuilder().quoting(Quoting.NEVER).build();
    assertThat(never.quoteIdentifier("a b"), is("a b"));
  }

  /** Tests that a name is quoted if the database would change its case
   * when it is not quoted. */
  @Test void testQuotingCasing() {
    assertThat(Dialects.POSTGRESQL.unquotedCasing(), is(Casing.TO_LOWER));
    assertThat(Dialects.POSTGRESQL.quoteIdentifier("user_id"), is("user_id"));
    assertThat(Dialects.POSTGRESQL.quoteIdentifier("userId"),
        is("\"userId\""));
    assertThat(Dialects.POSTGRESQL.quoteIdentifier("EMP"), is("\"EMP\""));
    assertThat(Dialects.POSTGRESQL.quoteIdentifier("emp_2"), is("emp_2"));

    assertThat(Dialects.ORACLE.unquotedCasing(), is(Casing.TO_UPPER));
    assertThat(Dialects.ORACLE.quoteIdentifier("USER_ID"), is("USER_ID"));
    assertThat(Dialects.ORACLE.quoteIdentifier("userId"), is("\"userId\""));
    assertThat(Dialects.ORACLE.quoteIdentifier("emp"), is("\"emp\""));
    assertThat(Dialects.ORACLE.quoteIdentifier("_2"), is("_2"));

    // other dialects compare unquoted names without regard to case
    assertThat(Dialects.ANSI.quoteIdentifier("userId"), is("userId"));
    assertThat(Dialects.MYSQL.quoteIdentifier("userId"), is("userId"));
    assertThat(Dialects.SQL_SERVER.quoteIdentifier("userId"), is("userId"));

    // a reserved word is quoted in any case
    assertThat(Dialects.POSTGRESQL.quoteIdentifier("default"),
        is("\"default\""));
    assertThat(Dialects.ORACLE.quoteIdentifier("DEFAULT"),
        is("\"DEFAULT\""));

    // casing survives toBuilder, and can be set on a custom dialect
    final SqlDialect pg2 =
        Dialects.POSTGRESQL.toBuilder().name("PG2").build();
    assertThat(pg2.quoteIdentifier("userId"), is("\"userId\""));
    final SqlDialect lower =
        Dialects.MYSQL.toBuilder().unquotedCasing(Casing.TO_LOWER).build();
    assertThat(lower.quoteIdentifier("userId"), is("`userId`"));
    assertThat(Casing.TO_UPPER.apply("userId"), is("USERID"));
    assertThat(Casing.UNCHANGED.apply("userId"), is("userId"));

    // casing does not matter if quoting is ALWAYS or NEVER
    final SqlDialect never =
        Dialects.ORACLE.toBuilder().quoting(Quoting.NEVER).build();
    assertThat(never.quoteIdentifier("userId"), is("userId"));
  }

  @Test void testBuilder() {
    final SqlDialect dialect =
        Dialects.POSTGRESQL.toBuilder()
            .name("CUSTOM_PG")
            .precedence(Op.CONCAT, 10)
            .placeholderStyle(PlaceholderStyle.COLON)
            .build();
    assertThat(dialect.name(), is("CUSTOM_PG"));
    assertThat(dialect.precedence(Op.CONCAT), is(10));
    assertThat(dialect.precedence(Op.ADD), is(7));
    assertThat(dialect.placeholder("x", 1), is(":x"));
    // the original is unchanged
    assertThat(Dialects.POSTGRESQL.precedence(Op.CONCAT), is(7));
    assertThat(Dialects.POSTGRESQL.placeholder("x", 1), is("$1"));

    // "||" now binds tighter than "*"
    assertThat(
        sql.mul(sql.concat(sql.column("a"), sql.column("b")), sql.column("c"))
            .unparse(new SqlWriter(dialect)),
        is("a || b * c"));

    assertThrows(IllegalArgumentException.class,
        () -> SqlDialect.builder().precedence(Op.ADD, 0));
    assertThrows(IllegalArgumentException.class,
        () -> SqlDialect.builder().precedence(Op.SELECT, 1));
    assertThrows(IllegalArgumentException.class,
        () -> SqlDialect.builder().identifierQuote("", "]"));
  }

  @Test void testLookup() {
    assertThat(Dialects.lookup("postgresql"),
        sameInstance(Dialects.POSTGRESQL));
    assertThat(Dialects.lookup("SQL_SERVER"),
        sameInstance(Dialects.SQL_SERVER));
    assertThat(Dialects.lookup("db2"), nullValue());
  }

  /** Tests overriding aspects of a dialect that is not a
   * {@link SqlDialect}. */
  @Test void testWrap() {
    final Dialect dialect = new Dialect() {
      @Override public String name() {
        return "TINY";
      }

      @Override public String quoteIdentifier(String name) {
        return "<" + name + ">";
      }

      @Override public int precedence(Op op) {
        return Dialects.ANSI.precedence(op);
      }

      @Override public @Nullable Associativity associativity(Op op) {
        return Dialects.ANSI.associativity(op);
      }

      @Override public String placeholder(String name, int position) {
        return "?";
      }
    };
    final Dialect d2 =
        Dialects.withPlaceholderStyle(dialect, PlaceholderStyle.DOLLAR);
    assertThat(d2.name(), is("TINY"));
    assertThat(d2.placeholder("x", 2), is("$2"));
    assertThat(d2.quoteIdentifier("a"), is("<a>"));

    final Dialect d3 = Dialects.withQuoting(d2, Quoting.NEVER);
    assertThat(d3.quoteIdentifier("a"), is("a"));
    assertThat(d3.placeholder("x", 2), is("$2"));
    assertThat(d3.precedence(Op.AND), is(2));
    assertThrows(IllegalArgumentException.class,
        () -> Dialects.withQuoting(dialect, Quoting.ALWAYS));

    assertThat(
        Dialects.withPlaceholderStyle(Dialects.ANSI,
            PlaceholderStyle.QUESTION),
        sameInstance((Dialect) Dialects.ANSI));
  }
}

// End DialectsTest.java
