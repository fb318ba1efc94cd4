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
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.flexsql.ast.Sql;
import net.hydromatic.flexsql.ast.SqlNode;
import org.junit.jupiter.api.Test;

/** Tests for {@link Normalizer}. */
public class NormalizerTest {
  private static final Sql.Column A = sql.column("a");
  private static final Sql.Column B = sql.column("b");

  private static void checkRewrite(SqlNode node, String expected) {
    final SqlNode rewritten = node.rewrite();
    assertThat(rewritten, hasToString(expected));
    // rewriting a canonical tree does nothing
    assertThat(rewritten.rewrite(), sameInstance(rewritten));
  }

  @Test void testCollapseNot() {
    checkRewrite(sql.not(sql.isNull(A)), "a IS NOT NULL");
    checkRewrite(sql.not(sql.isNotNull(A)), "a IS NULL");
    checkRewrite(sql.not(sql.isTrue(A)), "a IS NOT TRUE");
    checkRewrite(sql.not(sql.eq(A, B)), "a <> b");
    checkRewrite(sql.not(sql.lt(A, B)), "a >= b");
    checkRewrite(sql.not(sql.ge(A, B)), "a < b");
    checkRewrite(sql.not(sql.in(A, sql.tuple(sql.literal(1), sql.literal(2)))),
        "a NOT IN (1,2)");
    checkRewrite(sql.not(sql.notLike(A, sql.stringLiteral("x%"))),
        "a LIKE 'x%'");
    checkRewrite(sql.not(sql.between(A, sql.literal(1), sql.literal(2))),
        "a NOT BETWEEN 1 AND 2");
  }

  /** Tests that chains of NOT collapse completely. */
  @Test void testDoubleNot() {
    checkRewrite(sql.not(sql.not(sql.isNull(A))), "a IS NULL");
    checkRewrite(sql.not(sql.not(A)), "a");
    checkRewrite(sql.not(sql.not(sql.not(A))), "NOT a");
    checkRewrite(sql.not(sql.not(sql.not(sql.eq(A, B)))), "a <> b");
    checkRewrite(sql.not(sql.not(sql.not(sql.not(sql.eq(A, B))))), "a = b");
  }

  /** Tests that NOT over an operator with no negated form is kept. */
  @Test void testKeepNot() {
    checkRewrite(sql.not(A), "NOT a");
    checkRewrite(sql.not(sql.and(A, B)), "NOT (a AND b)");
    checkRewrite(sql.not(sql.or(sql.not(sql.isNull(A)), B)),
        "NOT (a IS NOT NULL OR b)");
    checkRewrite(sql.not(sql.exists(sql.select(A))), "NOT EXISTS (SELECT a)");
  }

  /** Tests that the normalizer reaches into every part of a statement. */
  @Test void testNested() {
    final Sql.Select select =
        sql.select(sql.unlabeled(sql.not(sql.isNull(A))))
            .where(sql.and(sql.not(sql.eq(A, B)), sql.not(sql.not(B))))
            .having(sql.not(sql.gt(sql.function("COUNT", A), sql.literal(1))))
            .orderBy(sql.desc(
                sql.caseWhen(sql.not(sql.isTrue(B)), sql.literal(1))));
    checkRewrite(select,
        "SELECT a IS NOT NULL WHERE a <> b AND b"
            + " HAVING COUNT(a) <= 1"
            + " ORDER BY CASE WHEN b IS NOT TRUE THEN 1 END DESC");

    final Sql.Select inner =
        sql.select(A).where(sql.not(sql.isNotNull(B)));
    checkRewrite(
        sql.select(B).from(sql.fromItem(sql.subquery(inner, "s"))),
        "SELECT b FROM (SELECT a WHERE b IS NULL) s");
  }

  /** Tests that a tree with nothing to rewrite is returned unchanged. */
  @Test void testUnchanged() {
    final Sql.Select select =
        sql.select(A).from(sql.labeledTable("t", "t"))
            .where(sql.and(sql.eq(A, B), sql.not(A)));
    assertThat(select.rewrite(), sameInstance((SqlNode) select));
  }

  /** Tests that a normalizer with a maximum depth fails on a deeper tree,
   * counting the root as depth 1. */
  @Test void testMaxDepth() {
    Sql.Exp e = A;
    for (int i = 0; i < 18; i++) {
      e = sql.add(e, B);
    }
    // 18 calls to "+" and a column is 19 deep
    assertThat(new Normalizer(19).normalize(e), sameInstance((SqlNode) e));
    final Sql.Exp e2 = e;
    final SqlException x =
        assertThrows(SqlException.class, () ->
            new Normalizer(18).normalize(e2));
    assertThat(x.kind(), is(SqlException.Kind.NESTING_TOO_DEEP));
    assertThat(x.getMessage(), is("expression is nested more than 18 deep"));

    // A pair of NOTs collapses to its operand, which is counted one level
    // below the outer NOT. 18 NOTs over a column are 19 deep but need 10.
    Sql.Exp e3 = A;
    for (int i = 0; i < 9; i++) {
      e3 = sql.not(sql.not(e3));
    }
    assertThat(new Normalizer(10).normalize(e3), hasToString("a"));
    final Sql.Exp e4 = e3;
    assertThrows(SqlException.class, () -> new Normalizer(9).normalize(e4));

    // the normalizer can be used again after a failure
    final Normalizer normalizer = new Normalizer(3);
    assertThrows(SqlException.class, () ->
        normalizer.normalize(sql.add(sql.add(sql.add(A, B), B), B)));
    assertThat(normalizer.normalize(sql.not(sql.isNull(A))),
        hasToString("a IS NOT NULL"));
  }
}

// End NormalizerTest.java
