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

import net.hydromatic.flexsql.ast.Shuttle;
import net.hydromatic.flexsql.ast.Sql;
import net.hydromatic.flexsql.ast.SqlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shuttle that converts a tree to canonical form.
 *
 * <p>"NOT" applied to an operator that has a negated counterpart is replaced
 * by that counterpart; for example "NOT (a IS NULL)" becomes
 * "a IS NOT NULL", "NOT (a = b)" becomes "a &lt;&gt; b", and "NOT (NOT p)"
 * becomes "p". The replacement is normalized again, so chains of NOT
 * collapse completely. "NOT" over anything else is kept.
 *
 * <p>Normalizing a canonical tree returns the same tree.
 *
 * <p>If created with a maximum depth, a normalizer fails with
 * {@link SqlException.Kind#NESTING_TOO_DEEP} on reaching a node nested
 * deeper than that, counting the root as depth 1, the same way as
 * {@link net.hydromatic.flexsql.ast.SqlWriter}.
 */
public class Normalizer extends Shuttle {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Normalizer.class);

  private final int maxDepth;
  private int depth;

  /** Creates a Normalizer with no limit on nesting depth. */
  public Normalizer() {
    this(Integer.MAX_VALUE);
  }

  /** Creates a Normalizer that fails if nodes are nested more than
   * {@code maxDepth} deep. */
  public Normalizer(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  /** Returns the canonical form of a tree. */
  public SqlNode normalize(SqlNode node) {
    return go(node);
  }

  @Override protected <E extends SqlNode> E go(E node) {
    if (++depth > maxDepth) {
      throw new SqlException(SqlException.Kind.NESTING_TOO_DEEP,
          "expression is nested more than " + maxDepth + " deep");
    }
    try {
      return super.go(node);
    } finally {
      --depth;
    }
  }

  @Override protected Sql.Exp visit(Sql.UnaryCall unaryCall) {
    if (unaryCall.isNot() && unaryCall.a instanceof Sql.Operator) {
      final Sql.Operator operand = (Sql.Operator) unaryCall.a;
      if (operand.negatable()) {
        final Sql.Exp negated = operand.negate();
        LOGGER.trace("collapsed NOT over {} to {}", operand.op, negated.op);
        // counted one level down, where the operand was
        return go(negated);
      }
    }
    return super.visit(unaryCall);
  }
}

// End Normalizer.java
