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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.flexsql.compile.Dialect;
import net.hydromatic.flexsql.compile.SqlException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Context for writing a syntax tree out as SQL text.
 *
 * <p>A writer is used for one print pass. It holds the text written so far,
 * the dialect that supplies operator precedence, identifier quoting and
 * placeholder syntax, and the positions assigned to placeholders.
 *
 * <p>If writing fails with a {@link SqlException}, the partial text is
 * meaningless and the writer should be discarded.
 */
public class SqlWriter {
  private final StringBuilder b = new StringBuilder();
  private final Dialect dialect;
  private final int maxDepth;
  /** Position of each placeholder name, in order of first appearance. */
  private final Map<String, Integer> bindings = new LinkedHashMap<>();
  /** Placeholder names in the order they appear in the text. */
  private final List<String> occurrences = new ArrayList<>();
  private int depth;

  /** Creates a SqlWriter with no limit on nesting depth. */
  public SqlWriter(Dialect dialect) {
    this(dialect, Integer.MAX_VALUE);
  }

  /** Creates a SqlWriter that fails if nodes are nested more than
   * {@code maxDepth} deep. */
  public SqlWriter(Dialect dialect, int maxDepth) {
    this.dialect = requireNonNull(dialect);
    this.maxDepth = maxDepth;
  }

  public Dialect dialect() {
    return dialect;
  }

  /** Appends a string to the output, verbatim. */
  public SqlWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public SqlWriter append(SqlNode node) {
    if (++depth > maxDepth) {
      throw new SqlException(SqlException.Kind.NESTING_TOO_DEEP,
          "expression is nested more than " + maxDepth + " deep");
    }
    node.unparseTo(this);
    --depth;
    return this;
  }

  /** Appends a list of nodes, separated by {@code sep}, between
   * {@code start} and {@code end}. */
  public SqlWriter appendAll(List<? extends SqlNode> nodes, String start,
      String sep, String end) {
    append(start);
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      append(nodes.get(i));
    }
    return append(end);
  }

  /** Appends a node enclosed in parentheses. */
  public SqlWriter appendParenthesized(SqlNode node) {
    return append("(").append(node).append(")");
  }

  /** Appends an identifier, quoted as the dialect requires. */
  public SqlWriter identifier(String name) {
    return append(dialect.quoteIdentifier(name));
  }

  /** Appends a literal value. */
  public SqlWriter literal(@Nullable Object value) {
    if (value == null) {
      return append("NULL");
    } else if (value instanceof Boolean) {
      return append((Boolean) value ? "TRUE" : "FALSE");
    } else if (value instanceof BigDecimal) {
      return append(((BigDecimal) value).toPlainString());
    } else if (value instanceof String) {
      return append("'")
          .append(((String) value).replace("'", "''"))
          .append("'");
    } else {
      throw new AssertionError("unknown literal " + value);
    }
  }

  /** Returns the position of a placeholder, assigning the next position if
   * this is the first time the name has been seen. Positions start at 1. */
  public int bind(String name) {
    Integer position = bindings.get(name);
    if (position == null) {
      position = bindings.size() + 1;
      bindings.put(name, position);
    }
    return position;
  }

  /** Appends a placeholder in the syntax of the dialect. */
  public SqlWriter placeholder(String name) {
    final int position = bind(name);
    occurrences.add(name);
    return append(dialect.placeholder(name, position));
  }

  /** Returns the position of each placeholder bound so far, in order of
   * position. */
  public ImmutableMap<String, Integer> bindings() {
    return ImmutableMap.copyOf(bindings);
  }

  /** Returns the names of placeholders in the order that they occur in the
   * text; a name occurs more than once if it was written more than once. */
  public ImmutableList<String> occurrences() {
    return ImmutableList.copyOf(occurrences);
  }

  /** Returns the effective precedence of an operator call: its own
   * precedence if set, otherwise the dialect's. */
  public int precedence(Sql.Operator operator) {
    if (operator.precedence != 0) {
      return operator.precedence;
    }
    final int precedence = dialect.precedence(operator.op);
    if (precedence != 0) {
      return precedence;
    }
    throw new SqlException(SqlException.Kind.PRECEDENCE_UNDEFINED,
        "no precedence for operator " + operator.op + " in dialect "
            + dialect.name());
  }

  /** Returns the effective associativity of an operator call: its own
   * associativity if set, otherwise the dialect's. */
  public Associativity associativity(Sql.Operator operator) {
    if (operator.associativity != null) {
      return operator.associativity;
    }
    final Associativity associativity = dialect.associativity(operator.op);
    if (associativity != null) {
      return associativity;
    }
    throw new SqlException(SqlException.Kind.ASSOCIATIVITY_UNDEFINED,
        "no associativity for operator " + operator.op + " in dialect "
            + dialect.name());
  }

  /** Appends a call to a unary operator.
   *
   * <p>A right-associative operator is written before its operand, a
   * left-associative operator after. The operand is parenthesized only if it
   * binds more loosely than the operator. */
  SqlWriter unary(Sql.UnaryCall call) {
    final Associativity associativity = associativity(call);
    if (associativity == Associativity.NON_ASSOCIATIVE) {
      throw new SqlException(SqlException.Kind.NON_ASSOCIATIVE_UNARY,
          "unary operator " + call.op + " cannot be non-associative");
    }
    final int precedence = precedence(call);
    final boolean parenthesize =
        call.a instanceof Sql.Operator
            && precedence((Sql.Operator) call.a) < precedence;
    if (associativity == Associativity.RIGHT) {
      append(call.symbol).append(" ");
    }
    operand(call.a, parenthesize);
    if (associativity == Associativity.LEFT) {
      append(" ").append(call.symbol);
    }
    return this;
  }

  /** Appends a call to a binary operator. */
  SqlWriter binary(Sql.BinaryCall call) {
    final Associativity associativity = associativity(call);
    final int precedence = precedence(call);
    operand(call.a0,
        needsParentheses(call.a0, precedence, associativity,
            Associativity.RIGHT));
    if (call.suppressSpace) {
      append(call.symbol);
    } else {
      append(" ").append(call.symbol).append(" ");
    }
    return operand(call.a1,
        needsParentheses(call.a1, precedence, associativity,
            Associativity.LEFT));
  }

  /** Appends a call to a ternary operator.
   *
   * <p>A ternary operator has no associativity, so an operand is
   * parenthesized if it binds as loosely as the operator or more loosely. */
  SqlWriter ternary(Sql.TernaryCall call) {
    final int precedence = precedence(call);
    operand(call.a0, ternaryNeedsParentheses(call.a0, precedence));
    append(" ").append(call.symbol1).append(" ");
    operand(call.a1, ternaryNeedsParentheses(call.a1, precedence));
    append(" ").append(call.symbol2).append(" ");
    return operand(call.a2, ternaryNeedsParentheses(call.a2, precedence));
  }

  /**
   * Returns whether an operand of a binary operator needs parentheses.
   *
   * <p>A non-associative operator, such as "=", requires parentheses around
   * an operand of the same or lower precedence, on either side. Otherwise,
   * an operand needs parentheses if it has lower precedence, or if it has the
   * same precedence and sits on the side where grouping would change, which
   * is the left side of a right-associative operator and the right side of a
   * left-associative operator.
   *
   * @param operand Operand
   * @param precedence Precedence of the binary operator
   * @param associativity Associativity of the binary operator
   * @param tieBreak Associativity for which an operand of equal precedence
   *   needs parentheses: {@link Associativity#RIGHT} for the left operand,
   *   {@link Associativity#LEFT} for the right operand
   */
  private boolean needsParentheses(Sql.Exp operand, int precedence,
      Associativity associativity, Associativity tieBreak) {
    if (!(operand instanceof Sql.Operator)) {
      return false;
    }
    final int operandPrecedence = precedence((Sql.Operator) operand);
    if (associativity == Associativity.NON_ASSOCIATIVE) {
      return operandPrecedence <= precedence;
    }
    return operandPrecedence < precedence
        || operandPrecedence == precedence && associativity == tieBreak;
  }

  private boolean ternaryNeedsParentheses(Sql.Exp operand, int precedence) {
    return operand instanceof Sql.Operator
        && precedence((Sql.Operator) operand) <= precedence;
  }

  private SqlWriter operand(Sql.Exp operand, boolean parenthesize) {
    return parenthesize ? appendParenthesized(operand) : append(operand);
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End SqlWriter.java
