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

import static net.hydromatic.flexsql.ast.SqlBuilder.sql;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import net.hydromatic.flexsql.compile.Dialects;
import net.hydromatic.flexsql.compile.SqlException;
import org.junit.jupiter.api.Test;

/** Tests for {@link SqlBuilder}. */
class SqlBuilderTest {
  @Test void testPlaceholders() {
    final List<Sql.Placeholder> list = sql.placeholders("p", 3);
    assertThat(list, hasSize(3));
    assertThat(list, hasToString("[?, ?, ?]"));
    assertThat(list.get(2).name, is("p3"));

    final SqlException x =
        assertThrows(SqlException.class, () -> sql.placeholders("p", 0));
    assertThat(x.kind(),
        is(SqlException.Kind.ZERO_LENGTH_PLACEHOLDER_REQUEST));
    final SqlException x2 =
        assertThrows(SqlException.class, () -> sql.placeholders("p", -1));
    assertThat(x2.kind(),
        is(SqlException.Kind.ZERO_LENGTH_PLACEHOLDER_REQUEST));
    final SqlException x3 =
        assertThrows(SqlException.class, () -> sql.placeholderTuple("p", 0));
    assertThat(x3.kind(),
        is(SqlException.Kind.ZERO_LENGTH_PLACEHOLDER_REQUEST));

    final Sql.Exp e = sql.in(sql.column("a"), sql.placeholderTuple("p", 3));
    assertThat(e.unparse(new SqlWriter(Dialects.POSTGRESQL)),
        is("a IN ($1,$2,$3)"));
    assertThat(e.unparse(new SqlWriter(Dialects.ORACLE)),
        is("\"a\" IN (:p1,:p2,:p3)"));
  }

  @Test void testFunction() {
    assertThat(sql.function("COALESCE", sql.column("a"), sql.literal(0)),
        hasToString("COALESCE(a,0)"));
    assertThat(sql.function("NOW"), hasToString("NOW()"));
    assertThat(sql.function0("CURRENT_TIMESTAMP"),
        hasToString("CURRENT_TIMESTAMP"));
    assertThat(sql.function("pg_catalog.lower", sql.column("a")),
        hasToString("pg_catalog.lower(a)"));
    assertThat(sql.function("COUNT", sql.verbatim("*")),
        hasToString("COUNT(*)"));
    assertThrows(IllegalArgumentException.class,
        () -> sql.function("1abc"));
    assertThrows(IllegalArgumentException.class,
        () -> sql.function("drop table t; --"));
    assertThrows(IllegalArgumentException.class, () -> sql.function0(""));
  }

  @Test void testCast() {
    assertThat(sql.cast(sql.column("a"), Sql.INTEGER),
        hasToString("CAST(a AS INTEGER)"));
    assertThat(sql.cast(sql.add(sql.column("a"), sql.literal(1)),
            sql.decimal(10, 2)),
        hasToString("CAST(a + 1 AS DECIMAL(10,2))"));
    assertThat(sql.cast(sql.column("t"), Sql.DOUBLE_PRECISION),
        hasToString("CAST(t AS DOUBLE PRECISION)"));
  }

  @Test void testCase() {
    final Sql.Column a = sql.column("a");
    final Sql.Case c =
        sql.caseWhen(sql.gt(a, sql.literal(0)), sql.stringLiteral("pos"))
            .when(sql.lt(a, sql.literal(0)), sql.stringLiteral("neg"))
            .otherwise(sql.stringLiteral("zero"));
    assertThat(c,
        hasToString("CASE WHEN a > 0 THEN 'pos' WHEN a < 0 THEN 'neg' "
            + "ELSE 'zero' END"));
    assertThat(sql.caseWhen(sql.isNull(a), sql.literal(1)),
        hasToString("CASE WHEN a IS NULL THEN 1 END"));
  }

  @Test void testTuple() {
    assertThat(sql.tuple(sql.literal(1)), hasToString("(1)"));
    assertThat(sql.tuple(sql.literal(1), sql.stringLiteral("x"),
            sql.nullLiteral()),
        hasToString("(1,'x',NULL)"));
  }

  /** Tests that clauses are written in a fixed order, whatever the order in
   * which they were added. */
  @Test void testSelect() {
    final Sql.Select select =
        sql.select(sql.labeled(sql.column("e", "name"), "n"),
                sql.unlabeled(sql.function("COUNT", sql.verbatim("*"))))
            .offset(sql.literal(20))
            .limit(sql.literal(10))
            .orderBy(sql.desc(sql.column("n")),
                sql.nullsFirst(sql.asc(sql.column("e", "name"))))
            .having(sql.gt(sql.function("COUNT", sql.verbatim("*")),
                sql.literal(1)))
            .groupBy(sql.column("e", "name"))
            .where(sql.gt(sql.column("e", "sal"), sql.placeholder("minSal")))
            .from(sql.labeledTable("hr", "emps", "e"));
    assertThat(select,
        hasToString("SELECT e.name n,COUNT(*) FROM hr.emps e"
            + " WHERE e.sal > ? GROUP BY e.name HAVING COUNT(*) > 1"
            + " ORDER BY n DESC,e.name NULLS FIRST LIMIT 10 OFFSET 20"));

    assertThat(sql.select(sql.literal(1)), hasToString("SELECT 1"));
    assertThat(
        sql.select(sql.column("a"), sql.column("b"))
            .from(sql.labeledTable("t", "t1"))
            .groupBy(sql.column("a"), sql.column("b")),
        hasToString("SELECT a,b FROM t t1 GROUP BY a,b"));
  }

  @Test void testOrderItem() {
    final Sql.Column x = sql.column("x");
    assertThat(sql.asc(x), hasToString("x"));
    assertThat(sql.desc(x), hasToString("x DESC"));
    // nulls sort last ascending and first descending, unless told otherwise
    assertThat(sql.nullsLast(sql.asc(x)), hasToString("x"));
    assertThat(sql.nullsFirst(sql.asc(x)), hasToString("x NULLS FIRST"));
    assertThat(sql.nullsFirst(sql.desc(x)), hasToString("x DESC"));
    assertThat(sql.nullsLast(sql.desc(x)), hasToString("x DESC NULLS LAST"));
  }

  @Test void testJoin() {
    final Sql.FromItem emps = sql.fromItem(sql.labeledTable("emps", "e"));
    final Sql.FromItem depts = sql.fromItem(sql.labeledTable("depts", "d"));
    final Sql.Exp on =
        sql.eq(sql.column("e", "deptno"), sql.column("d", "deptno"));
    assertThat(sql.select(sql.column("e", "name"))
            .from(sql.leftJoin(emps, depts, on)),
        hasToString("SELECT e.name FROM emps e LEFT JOIN depts d"
            + " ON e.deptno = d.deptno"));
    assertThat(sql.join(emps, depts, on),
        hasToString("emps e JOIN depts d ON e.deptno = d.deptno"));
    assertThat(sql.rightJoin(emps, depts, on),
        hasToString("emps e RIGHT JOIN depts d ON e.deptno = d.deptno"));

    final Sql.FromItem bonus = sql.fromItem(sql.labeledTable("bonus", "b"));
    final Sql.Join join =
        sql.fullJoin(sql.fromItem(sql.join(emps, depts, on)), bonus,
            sql.eq(sql.column("b", "ename"), sql.column("e", "name")));
    assertThat(join,
        hasToString("emps e JOIN depts d ON e.deptno = d.deptno"
            + " FULL JOIN bonus b ON b.ename = e.name"));
  }

  @Test void testSubquery() {
    final Sql.Select inner =
        sql.select(sql.column("a")).from(sql.labeledTable("t", "x"));
    assertThat(
        sql.select(sql.column("s", "a"))
            .from(sql.fromItem(sql.subquery(inner, "s"))),
        hasToString("SELECT s.a FROM (SELECT a FROM t x) s"));
    assertThat(sql.exists(inner),
        hasToString("EXISTS (SELECT a FROM t x)"));
    assertThat(sql.not(sql.exists(inner)),
        hasToString("NOT EXISTS (SELECT a FROM t x)"));
    assertThat(sql.in(sql.column("b"), sql.scalarSubquery(inner)),
        hasToString("b IN (SELECT a FROM t x)"));
  }

  /** Tests that a FROM item with no alternative cannot be written. */
  @Test void testEmptyFromItem() {
    final Sql.FromItem item = sql.fromItem(null, null, null);
    final SqlException x =
        assertThrows(SqlException.class, item::toString);
    assertThat(x.kind(), is(SqlException.Kind.UNKNOWN_STRUCTURAL_VARIANT));

    final Sql.Select select = sql.select(sql.column("a")).from(item);
    final SqlException x2 =
        assertThrows(SqlException.class, select::toString);
    assertThat(x2.kind(), is(SqlException.Kind.UNKNOWN_STRUCTURAL_VARIANT));
  }

  @Test void testNegate() {
    final Sql.Exp a = sql.column("a");
    final Sql.Exp b = sql.column("b");
    assertThat(sql.isNull(a).negate(), hasToString("a IS NOT NULL"));
    assertThat(sql.isNotFalse(a).negate(), hasToString("a IS FALSE"));
    assertThat(sql.lt(a, b).negate(), hasToString("a >= b"));
    assertThat(sql.ne(a, b).negate(), hasToString("a = b"));
    assertThat(sql.notLike(a, b).negate(), hasToString("a LIKE b"));
    assertThat(sql.ilike(a, b).negate(), hasToString("a NOT ILIKE b"));
    assertThat(sql.between(a, b, a).negate(),
        hasToString("a NOT BETWEEN b AND a"));
    assertThat(sql.not(a).negate(), sameInstance(a));
    assertThat(sql.add(a, b).negatable(), is(false));
    assertThrows(IllegalStateException.class, () -> sql.add(a, b).negate());
    assertThat(sql.exists(sql.select(a)).negatable(), is(false));
  }
}

// End SqlBuilderTest.java
