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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;
import net.hydromatic.flexsql.compile.SqlException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds SQL syntax tree nodes. */
public enum SqlBuilder {
  /**
   * The singleton instance of the SQL builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  sql;

  /** Valid name of a function. */
  private static final Pattern FUNCTION_NAME =
      Pattern.compile("^[A-Za-z][A-Za-z0-9_.]*$");

  private static final Sql.Literal NULL_LITERAL = new Sql.Literal(null);

  // general operators

  /** Creates a call to a unary operator. Pass null {@code negatedOp} and
   * {@code negatedSymbol} if the operator has no negated form. */
  public Sql.UnaryCall unary(Op op, String symbol, @Nullable Op negatedOp,
      @Nullable String negatedSymbol, Sql.Exp a) {
    return new Sql.UnaryCall(op, symbol, negatedOp, negatedSymbol, a, 0, null);
  }

  /** Creates a call to a binary operator. Pass null {@code negatedOp} and
   * {@code negatedSymbol} if the operator has no negated form. */
  public Sql.BinaryCall binary(Op op, String symbol, @Nullable Op negatedOp,
      @Nullable String negatedSymbol, Sql.Exp a0, Sql.Exp a1) {
    return new Sql.BinaryCall(op, symbol, negatedOp, negatedSymbol, a0, a1, 0,
        null, false);
  }

  /** Creates a call to a ternary operator. Pass null {@code negatedOp},
   * {@code negatedSymbol1} and {@code negatedSymbol2} if the operator has no
   * negated form. */
  public Sql.TernaryCall ternary(Op op, String symbol1, String symbol2,
      @Nullable Op negatedOp, @Nullable String negatedSymbol1,
      @Nullable String negatedSymbol2, Sql.Exp a0, Sql.Exp a1, Sql.Exp a2) {
    return new Sql.TernaryCall(op, symbol1, symbol2, negatedOp,
        negatedSymbol1, negatedSymbol2, a0, a1, a2, 0, null);
  }

  private Sql.UnaryCall unary(Op op, @Nullable Op negatedOp, Sql.Exp a) {
    return unary(op, requireNonNull(op.symbol), negatedOp,
        negatedOp == null ? null : negatedOp.symbol, a);
  }

  private Sql.BinaryCall binary(Op op, @Nullable Op negatedOp, Sql.Exp a0,
      Sql.Exp a1) {
    return binary(op, requireNonNull(op.symbol), negatedOp,
        negatedOp == null ? null : negatedOp.symbol, a0, a1);
  }

  private Sql.TernaryCall ternary(Op op, Op negatedOp, Sql.Exp a0, Sql.Exp a1,
      Sql.Exp a2) {
    return ternary(op, requireNonNull(op.symbol), requireNonNull(op.symbol2),
        negatedOp, negatedOp.symbol, negatedOp.symbol2, a0, a1, a2);
  }

  // logical

  /** Creates "NOT a". */
  public Sql.UnaryCall not(Sql.Exp a) {
    return unary(Op.NOT, null, a);
  }

  /** Creates "EXISTS (select)". */
  public Sql.UnaryCall exists(Sql.Select select) {
    return unary(Op.EXISTS, null, scalarSubquery(select));
  }

  /** Creates "a AND b", or "a AND b AND c ..." if there are more
   * operands.
   *
   * <p>The result is nested to the left, "((a AND b) AND c) ...", so it is
   * one level deeper for each operand; a compiler fails on chains longer than
   * its {@link net.hydromatic.flexsql.compile.Prop#MAX_DEPTH}. */
  public Sql.BinaryCall and(Sql.Exp a0, Sql.Exp a1, Sql.Exp... more) {
    Sql.BinaryCall call = binary(Op.AND, null, a0, a1);
    for (Sql.Exp a : more) {
      call = binary(Op.AND, null, call, a);
    }
    return call;
  }

  /** Creates "a OR b", or "a OR b OR c ..." if there are more operands.
   * Like {@link #and}, the result is nested to the left. */
  public Sql.BinaryCall or(Sql.Exp a0, Sql.Exp a1, Sql.Exp... more) {
    Sql.BinaryCall call = binary(Op.OR, null, a0, a1);
    for (Sql.Exp a : more) {
      call = binary(Op.OR, null, call, a);
    }
    return call;
  }

  // postfix tests

  public Sql.UnaryCall isNull(Sql.Exp a) {
    return unary(Op.IS_NULL, Op.IS_NOT_NULL, a);
  }

  public Sql.UnaryCall isNotNull(Sql.Exp a) {
    return unary(Op.IS_NOT_NULL, Op.IS_NULL, a);
  }

  public Sql.UnaryCall isTrue(Sql.Exp a) {
    return unary(Op.IS_TRUE, Op.IS_NOT_TRUE, a);
  }

  public Sql.UnaryCall isNotTrue(Sql.Exp a) {
    return unary(Op.IS_NOT_TRUE, Op.IS_TRUE, a);
  }

  public Sql.UnaryCall isFalse(Sql.Exp a) {
    return unary(Op.IS_FALSE, Op.IS_NOT_FALSE, a);
  }

  public Sql.UnaryCall isNotFalse(Sql.Exp a) {
    return unary(Op.IS_NOT_FALSE, Op.IS_FALSE, a);
  }

  // arithmetic

  /** Creates "- a". */
  public Sql.UnaryCall negate(Sql.Exp a) {
    return unary(Op.NEGATE, null, a);
  }

  public Sql.BinaryCall add(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.ADD, null, a0, a1);
  }

  public Sql.BinaryCall sub(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.SUB, null, a0, a1);
  }

  public Sql.BinaryCall mul(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.MUL, null, a0, a1);
  }

  public Sql.BinaryCall div(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.DIV, null, a0, a1);
  }

  public Sql.BinaryCall mod(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.MOD, null, a0, a1);
  }

  /** Creates "a || b", string concatenation. */
  public Sql.BinaryCall concat(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.CONCAT, null, a0, a1);
  }

  // comparison

  public Sql.BinaryCall lt(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.LT, Op.GE, a0, a1);
  }

  public Sql.BinaryCall le(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.LE, Op.GT, a0, a1);
  }

  public Sql.BinaryCall gt(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.GT, Op.LE, a0, a1);
  }

  public Sql.BinaryCall ge(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.GE, Op.LT, a0, a1);
  }

  public Sql.BinaryCall eq(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.EQ, Op.NE, a0, a1);
  }

  public Sql.BinaryCall ne(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.NE, Op.EQ, a0, a1);
  }

  // membership and pattern tests

  public Sql.BinaryCall in(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.IN, Op.NOT_IN, a0, a1);
  }

  public Sql.BinaryCall notIn(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.NOT_IN, Op.IN, a0, a1);
  }

  public Sql.BinaryCall like(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.LIKE, Op.NOT_LIKE, a0, a1);
  }

  public Sql.BinaryCall notLike(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.NOT_LIKE, Op.LIKE, a0, a1);
  }

  public Sql.BinaryCall ilike(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.ILIKE, Op.NOT_ILIKE, a0, a1);
  }

  public Sql.BinaryCall notIlike(Sql.Exp a0, Sql.Exp a1) {
    return binary(Op.NOT_ILIKE, Op.ILIKE, a0, a1);
  }

  /** Creates "a BETWEEN low AND high". */
  public Sql.TernaryCall between(Sql.Exp a, Sql.Exp low, Sql.Exp high) {
    return ternary(Op.BETWEEN, Op.NOT_BETWEEN, a, low, high);
  }

  /** Creates "a NOT BETWEEN low AND high". */
  public Sql.TernaryCall notBetween(Sql.Exp a, Sql.Exp low, Sql.Exp high) {
    return ternary(Op.NOT_BETWEEN, Op.BETWEEN, a, low, high);
  }

  // leaves

  /** Creates an integer literal. */
  public Sql.Literal literal(long value) {
    return new Sql.Literal(BigDecimal.valueOf(value));
  }

  /** Creates a numeric literal. */
  public Sql.Literal literal(BigDecimal value) {
    return new Sql.Literal(requireNonNull(value));
  }

  /** Creates a {@code TRUE} or {@code FALSE} literal. */
  public Sql.Literal literal(boolean value) {
    return new Sql.Literal(value);
  }

  /** Creates a character string literal, such as {@code 'it''s'}. */
  public Sql.Literal stringLiteral(String value) {
    return new Sql.Literal(requireNonNull(value));
  }

  /** Creates the {@code NULL} literal. */
  public Sql.Literal nullLiteral() {
    return NULL_LITERAL;
  }

  /** Creates a piece of SQL that is written without change. */
  public Sql.Verbatim verbatim(String text) {
    return new Sql.Verbatim(text);
  }

  /** Creates a type name, such as "INTERVAL". */
  public Sql.TypeName type(String name) {
    return new Sql.TypeName(name);
  }

  /** Creates "DECIMAL(precision,scale)". */
  public Sql.TypeName decimal(int precision, int scale) {
    return new Sql.TypeName("DECIMAL(" + precision + "," + scale + ")");
  }

  /** Creates a named placeholder. */
  public Sql.Placeholder placeholder(String name) {
    return new Sql.Placeholder(name);
  }

  /**
   * Creates {@code count} placeholders named {@code prefix1},
   * {@code prefix2}, ... {@code prefixN}.
   *
   * @throws SqlException of kind
   *   {@link SqlException.Kind#ZERO_LENGTH_PLACEHOLDER_REQUEST} if
   *   {@code count} is not positive
   */
  public ImmutableList<Sql.Placeholder> placeholders(String prefix,
      int count) {
    if (count <= 0) {
      throw new SqlException(
          SqlException.Kind.ZERO_LENGTH_PLACEHOLDER_REQUEST,
          "cannot generate " + count + " placeholders");
    }
    final ImmutableList.Builder<Sql.Placeholder> b = ImmutableList.builder();
    for (int i = 1; i <= count; i++) {
      b.add(placeholder(prefix + i));
    }
    return b.build();
  }

  /**
   * Creates a tuple of {@code count} placeholders, such as "(?,?,?)",
   * for use as the right operand of IN.
   *
   * @see #placeholders(String, int)
   */
  public Sql.Tuple placeholderTuple(String prefix, int count) {
    return new Sql.Tuple(placeholders(prefix, count));
  }

  /** Creates a reference to a column. */
  public Sql.Column column(String name) {
    return new Sql.Column(null, name);
  }

  /** Creates a reference to a column qualified by a table label. */
  public Sql.Column column(String table, String name) {
    return new Sql.Column(requireNonNull(table), name);
  }

  /** Creates a reference to a table. */
  public Sql.Table table(String name) {
    return new Sql.Table(null, name);
  }

  /** Creates a reference to a table qualified by a schema. */
  public Sql.Table table(String schema, String name) {
    return new Sql.Table(requireNonNull(schema), name);
  }

  /** Creates "table label". */
  public Sql.LabeledTable labeledTable(Sql.Table table, String label) {
    return new Sql.LabeledTable(table, label);
  }

  /** Creates "name label". */
  public Sql.LabeledTable labeledTable(String name, String label) {
    return labeledTable(table(name), label);
  }

  /** Creates "schema.name label". */
  public Sql.LabeledTable labeledTable(String schema, String name,
      String label) {
    return labeledTable(table(schema, name), label);
  }

  // expressions

  /** Creates "CAST(exp AS type)". */
  public Sql.Cast cast(Sql.Exp exp, Sql.TypeName type) {
    return new Sql.Cast(exp, type);
  }

  /**
   * Creates a call to a function, such as "COALESCE(a,b)" or "NOW()".
   *
   * @throws IllegalArgumentException if the name is not a letter followed by
   *   letters, digits, underscores and periods
   */
  public Sql.FunctionCall function(String name, Sql.Exp... args) {
    return new Sql.FunctionCall(checkFunctionName(name),
        ImmutableList.copyOf(args), false);
  }

  /** Creates a call to a function with a given list of arguments. */
  public Sql.FunctionCall function(String name, List<? extends Sql.Exp> args) {
    return new Sql.FunctionCall(checkFunctionName(name), args, false);
  }

  /** Creates a call to a function that takes no arguments and is written
   * without parentheses, such as "CURRENT_TIMESTAMP". */
  public Sql.FunctionCall function0(String name) {
    return new Sql.FunctionCall(checkFunctionName(name), ImmutableList.of(),
        true);
  }

  private static String checkFunctionName(String name) {
    checkArgument(FUNCTION_NAME.matcher(name).matches(),
        "illegal function name: %s", name);
    return name;
  }

  /** Creates a tuple, "(a,b,...)". */
  public Sql.Tuple tuple(Sql.Exp first, Sql.Exp... rest) {
    return new Sql.Tuple(
        ImmutableList.<Sql.Exp>builder().add(first).add(rest).build());
  }

  /** Creates "CASE WHEN condition THEN result END"; call
   * {@link Sql.Case#when} to add branches and {@link Sql.Case#otherwise} to
   * add "ELSE". */
  public Sql.Case caseWhen(Sql.Exp condition, Sql.Exp result) {
    return new Sql.Case(ImmutableList.of(condition), ImmutableList.of(result),
        null);
  }

  /** Creates a sub-query that is used as an expression, "(SELECT ...)". */
  public Sql.ScalarSubquery scalarSubquery(Sql.Select select) {
    return new Sql.ScalarSubquery(select);
  }

  // clauses

  /** Creates an item in a SELECT list with an alias, "exp label". */
  public Sql.LabeledColumn labeled(Sql.Exp exp, String label) {
    return new Sql.LabeledColumn(exp, requireNonNull(label));
  }

  /** Creates an item in a SELECT list without an alias. */
  public Sql.LabeledColumn unlabeled(Sql.Exp exp) {
    return new Sql.LabeledColumn(exp, null);
  }

  /** Creates "(select) label", a sub-query in a FROM clause. */
  public Sql.Subquery subquery(Sql.Select select, String label) {
    return new Sql.Subquery(select, label);
  }

  public Sql.Join join(Sql.FromItem left, Sql.FromItem right, Sql.Exp on) {
    return new Sql.Join(Sql.JoinType.INNER, left, right, on);
  }

  public Sql.Join leftJoin(Sql.FromItem left, Sql.FromItem right,
      Sql.Exp on) {
    return new Sql.Join(Sql.JoinType.LEFT, left, right, on);
  }

  public Sql.Join rightJoin(Sql.FromItem left, Sql.FromItem right,
      Sql.Exp on) {
    return new Sql.Join(Sql.JoinType.RIGHT, left, right, on);
  }

  public Sql.Join fullJoin(Sql.FromItem left, Sql.FromItem right,
      Sql.Exp on) {
    return new Sql.Join(Sql.JoinType.FULL, left, right, on);
  }

  /** Creates a FROM item that is a table. */
  public Sql.FromItem fromItem(Sql.LabeledTable table) {
    return new Sql.FromItem(requireNonNull(table), null, null);
  }

  /** Creates a FROM item that is a sub-query. */
  public Sql.FromItem fromItem(Sql.Subquery subquery) {
    return new Sql.FromItem(null, requireNonNull(subquery), null);
  }

  /** Creates a FROM item that is a join. */
  public Sql.FromItem fromItem(Sql.Join join) {
    return new Sql.FromItem(null, null, requireNonNull(join));
  }

  /** Creates a FROM item with given alternatives. At most one should be
   * present; if none is, the item cannot be written. */
  public Sql.FromItem fromItem(Sql.@Nullable LabeledTable table,
      Sql.@Nullable Subquery subquery, Sql.@Nullable Join join) {
    return new Sql.FromItem(table, subquery, join);
  }

  /** Creates an ascending ORDER BY item. */
  public Sql.OrderItem asc(Sql.Exp exp) {
    return new Sql.OrderItem(exp, false, null);
  }

  /** Creates a descending ORDER BY item. */
  public Sql.OrderItem desc(Sql.Exp exp) {
    return new Sql.OrderItem(exp, true, null);
  }

  /** Returns an ORDER BY item that sorts nulls first. */
  public Sql.OrderItem nullsFirst(Sql.OrderItem item) {
    return item.withNullDirection(Sql.NullDirection.FIRST);
  }

  /** Returns an ORDER BY item that sorts nulls last. */
  public Sql.OrderItem nullsLast(Sql.OrderItem item) {
    return item.withNullDirection(Sql.NullDirection.LAST);
  }

  /** Creates "SELECT exp, ..."; call methods such as
   * {@link Sql.Select#from} and {@link Sql.Select#where} to add clauses. */
  public Sql.Select select(Sql.Exp first, Sql.Exp... rest) {
    final ImmutableList.Builder<Sql.LabeledColumn> b = ImmutableList.builder();
    b.add(unlabeled(first));
    for (Sql.Exp exp : rest) {
      b.add(unlabeled(exp));
    }
    return select(b.build());
  }

  /** Creates "SELECT exp label, ...". */
  public Sql.Select select(Sql.LabeledColumn first,
      Sql.LabeledColumn... rest) {
    return select(
        ImmutableList.<Sql.LabeledColumn>builder().add(first).add(rest)
            .build());
  }

  /** Creates "SELECT ..." with a list of columns, which must not be
   * empty. */
  public Sql.Select select(List<Sql.LabeledColumn> columns) {
    return new Sql.Select(columns, null, null, null, null, null, null, null);
  }
}

// End SqlBuilder.java
