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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import net.hydromatic.flexsql.compile.SqlException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of SQL syntax tree nodes. */
public class Sql {
  private Sql() {}

  public static final TypeName SMALLINT = new TypeName("SMALLINT");
  public static final TypeName INTEGER = new TypeName("INTEGER");
  public static final TypeName BIGINT = new TypeName("BIGINT");
  public static final TypeName BOOLEAN = new TypeName("BOOLEAN");
  public static final TypeName REAL = new TypeName("REAL");
  public static final TypeName DOUBLE_PRECISION =
      new TypeName("DOUBLE PRECISION");
  public static final TypeName TEXT = new TypeName("TEXT");
  public static final TypeName TIMESTAMP = new TypeName("TIMESTAMP");

  /** Base class for an expression. */
  public abstract static class Exp extends SqlNode {
    Exp(Op op) {
      super(op);
    }

    @Override public abstract Exp accept(Shuttle shuttle);
  }

  /**
   * Base class for a call to an operator.
   *
   * <p>Precedence and associativity come from the dialect unless this call
   * overrides them. The only sub-classes are {@link UnaryCall},
   * {@link BinaryCall} and {@link TernaryCall}.
   */
  public abstract static class Operator extends Exp {
    /** Precedence that overrides the dialect's, or 0 to use the dialect's. */
    public final int precedence;
    /** Associativity that overrides the dialect's, or null to use the
     * dialect's. */
    public final @Nullable Associativity associativity;

    Operator(Op op, int precedence, @Nullable Associativity associativity) {
      super(op);
      checkArgument(op.isOperator(), "not an operator: %s", op);
      checkArgument(precedence >= 0, "negative precedence %s", precedence);
      this.precedence = precedence;
      this.associativity = associativity;
    }

    /** Returns whether this operator has a counterpart that means its logical
     * negation. */
    public abstract boolean negatable();

    /**
     * Returns an expression equivalent to "NOT this" that has no explicit
     * NOT; for example, "x IS NULL" becomes "x IS NOT NULL".
     *
     * @throws IllegalStateException if this operator is not
     * {@link #negatable()}
     */
    public abstract Exp negate();

    /** Returns a copy of this call with a given precedence, which must be
     * positive. */
    public abstract Operator withPrecedence(int precedence);

    /** Returns a copy of this call with a given associativity. */
    public abstract Operator withAssociativity(Associativity associativity);

    static int checkPrecedence(int precedence) {
      checkArgument(precedence > 0, "precedence must be positive: %s",
          precedence);
      return precedence;
    }

    static String checkSymbol(String symbol) {
      checkArgument(!symbol.isEmpty(), "empty symbol");
      return symbol;
    }
  }

  /** Call to an operator with one operand, such as "NOT a" or
   * "a IS NULL". */
  public static class UnaryCall extends Operator {
    public final String symbol;
    public final @Nullable Op negatedOp;
    public final @Nullable String negatedSymbol;
    public final Exp a;

    UnaryCall(Op op, String symbol, @Nullable Op negatedOp,
        @Nullable String negatedSymbol, Exp a, int precedence,
        @Nullable Associativity associativity) {
      super(op, precedence, associativity);
      this.symbol = checkSymbol(symbol);
      checkArgument((negatedOp == null) == (negatedSymbol == null),
          "negated op and symbol must both be present or both absent");
      checkArgument(negatedOp == null || negatedOp.isOperator());
      this.negatedOp = negatedOp;
      this.negatedSymbol =
          negatedSymbol == null ? null : checkSymbol(negatedSymbol);
      this.a = requireNonNull(a);
    }

    /** Returns whether this is a logical NOT. */
    public boolean isNot() {
      return op == Op.NOT;
    }

    /** {@inheritDoc}
     *
     * <p>A logical NOT is always negatable. */
    @Override public boolean negatable() {
      return isNot() || negatedOp != null;
    }

    /** {@inheritDoc}
     *
     * <p>Negating a logical NOT returns its operand. */
    @Override public Exp negate() {
      checkState(negatable(), "operator %s is not negatable", op);
      if (isNot()) {
        return a;
      }
      return new UnaryCall(requireNonNull(negatedOp),
          requireNonNull(negatedSymbol), op, symbol, a, precedence,
          associativity);
    }

    @Override public UnaryCall withPrecedence(int precedence) {
      return new UnaryCall(op, symbol, negatedOp, negatedSymbol, a,
          checkPrecedence(precedence), associativity);
    }

    @Override public UnaryCall withAssociativity(
        Associativity associativity) {
      return new UnaryCall(op, symbol, negatedOp, negatedSymbol, a,
          precedence, requireNonNull(associativity));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.unary(this);
    }

    /** Creates a copy of this {@code UnaryCall} with given operand,
     * or {@code this} if the operand is the same. */
    public UnaryCall copy(Exp a) {
      return this.a == a
          ? this
          : new UnaryCall(op, symbol, negatedOp, negatedSymbol, a, precedence,
              associativity);
    }
  }

  /** Call to an operator with two operands, such as "a + b". */
  public static class BinaryCall extends Operator {
    public final String symbol;
    public final @Nullable Op negatedOp;
    public final @Nullable String negatedSymbol;
    public final Exp a0;
    public final Exp a1;
    /** Whether to write the symbol without spaces around it, e.g. "a||b". */
    public final boolean suppressSpace;

    BinaryCall(Op op, String symbol, @Nullable Op negatedOp,
        @Nullable String negatedSymbol, Exp a0, Exp a1, int precedence,
        @Nullable Associativity associativity, boolean suppressSpace) {
      super(op, precedence, associativity);
      this.symbol = checkSymbol(symbol);
      checkArgument((negatedOp == null) == (negatedSymbol == null),
          "negated op and symbol must both be present or both absent");
      checkArgument(negatedOp == null || negatedOp.isOperator());
      this.negatedOp = negatedOp;
      this.negatedSymbol =
          negatedSymbol == null ? null : checkSymbol(negatedSymbol);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      this.suppressSpace = suppressSpace;
    }

    @Override public boolean negatable() {
      return negatedOp != null;
    }

    @Override public BinaryCall negate() {
      checkState(negatable(), "operator %s is not negatable", op);
      return new BinaryCall(requireNonNull(negatedOp),
          requireNonNull(negatedSymbol), op, symbol, a0, a1, precedence,
          associativity, suppressSpace);
    }

    @Override public BinaryCall withPrecedence(int precedence) {
      return new BinaryCall(op, symbol, negatedOp, negatedSymbol, a0, a1,
          checkPrecedence(precedence), associativity, suppressSpace);
    }

    @Override public BinaryCall withAssociativity(
        Associativity associativity) {
      return new BinaryCall(op, symbol, negatedOp, negatedSymbol, a0, a1,
          precedence, requireNonNull(associativity), suppressSpace);
    }

    /** Returns a copy of this call whose symbol is written with or without
     * surrounding spaces. */
    public BinaryCall withSuppressSpace(boolean suppressSpace) {
      return suppressSpace == this.suppressSpace
          ? this
          : new BinaryCall(op, symbol, negatedOp, negatedSymbol, a0, a1,
              precedence, associativity, suppressSpace);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.binary(this);
    }

    /** Creates a copy of this {@code BinaryCall} with given operands,
     * or {@code this} if the operands are the same. */
    public BinaryCall copy(Exp a0, Exp a1) {
      return this.a0 == a0 && this.a1 == a1
          ? this
          : new BinaryCall(op, symbol, negatedOp, negatedSymbol, a0, a1,
              precedence, associativity, suppressSpace);
    }
  }

  /** Call to an operator with three operands and two symbols, such as
   * "a BETWEEN b AND c". */
  public static class TernaryCall extends Operator {
    public final String symbol1;
    public final String symbol2;
    public final @Nullable Op negatedOp;
    public final @Nullable String negatedSymbol1;
    public final @Nullable String negatedSymbol2;
    public final Exp a0;
    public final Exp a1;
    public final Exp a2;

    TernaryCall(Op op, String symbol1, String symbol2,
        @Nullable Op negatedOp, @Nullable String negatedSymbol1,
        @Nullable String negatedSymbol2, Exp a0, Exp a1, Exp a2,
        int precedence, @Nullable Associativity associativity) {
      super(op, precedence, associativity);
      this.symbol1 = checkSymbol(symbol1);
      this.symbol2 = checkSymbol(symbol2);
      checkArgument((negatedOp == null) == (negatedSymbol1 == null)
              && (negatedOp == null) == (negatedSymbol2 == null),
          "negated op and symbols must all be present or all absent");
      checkArgument(negatedOp == null || negatedOp.isOperator());
      this.negatedOp = negatedOp;
      this.negatedSymbol1 =
          negatedSymbol1 == null ? null : checkSymbol(negatedSymbol1);
      this.negatedSymbol2 =
          negatedSymbol2 == null ? null : checkSymbol(negatedSymbol2);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      this.a2 = requireNonNull(a2);
    }

    @Override public boolean negatable() {
      return negatedOp != null;
    }

    @Override public TernaryCall negate() {
      checkState(negatable(), "operator %s is not negatable", op);
      return new TernaryCall(requireNonNull(negatedOp),
          requireNonNull(negatedSymbol1), requireNonNull(negatedSymbol2), op,
          symbol1, symbol2, a0, a1, a2, precedence, associativity);
    }

    @Override public TernaryCall withPrecedence(int precedence) {
      return new TernaryCall(op, symbol1, symbol2, negatedOp, negatedSymbol1,
          negatedSymbol2, a0, a1, a2, checkPrecedence(precedence),
          associativity);
    }

    /** {@inheritDoc}
     *
     * <p>The associativity of a ternary operator is never used to decide
     * parentheses. */
    @Override public TernaryCall withAssociativity(
        Associativity associativity) {
      return new TernaryCall(op, symbol1, symbol2, negatedOp, negatedSymbol1,
          negatedSymbol2, a0, a1, a2, precedence,
          requireNonNull(associativity));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.ternary(this);
    }

    /** Creates a copy of this {@code TernaryCall} with given operands,
     * or {@code this} if the operands are the same. */
    public TernaryCall copy(Exp a0, Exp a1, Exp a2) {
      return this.a0 == a0 && this.a1 == a1 && this.a2 == a2
          ? this
          : new TernaryCall(op, symbol1, symbol2, negatedOp, negatedSymbol1,
              negatedSymbol2, a0, a1, a2, precedence, associativity);
    }
  }

  /** Literal value: a number, boolean, string or NULL. */
  public static class Literal extends Exp {
    /** Value; a {@link BigDecimal}, {@link Boolean}, {@link String}, or null
     * for the NULL literal. */
    public final @Nullable Object value;

    Literal(@Nullable Object value) {
      super(Op.LITERAL);
      checkArgument(value == null
          || value instanceof BigDecimal
          || value instanceof Boolean
          || value instanceof String, "invalid literal %s", value);
      this.value = value;
    }

    @Override public int hashCode() {
      return Objects.hashCode(value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && Objects.equals(this.value, ((Literal) o).value);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.literal(value);
    }
  }

  /** Text that is written as is, such as "*" in "COUNT(*)". */
  public static class Verbatim extends Exp {
    public final String text;

    Verbatim(String text) {
      super(Op.VERBATIM);
      this.text = requireNonNull(text);
    }

    @Override public int hashCode() {
      return text.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Verbatim
          && this.text.equals(((Verbatim) o).text);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append(text);
    }
  }

  /** Name of a SQL type, such as "INTEGER" or "DECIMAL(10,2)". */
  public static class TypeName extends SqlNode {
    public final String name;

    TypeName(String name) {
      super(Op.TYPE_NAME);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty type name");
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TypeName
          && this.name.equals(((TypeName) o).name);
    }

    @Override public TypeName accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append(name);
    }
  }

  /** Named parameter.
   *
   * <p>All placeholders with the same name in a statement receive the same
   * position. */
  public static class Placeholder extends Exp {
    public final String name;

    Placeholder(String name) {
      super(Op.PLACEHOLDER);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty placeholder name");
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Placeholder
          && this.name.equals(((Placeholder) o).name);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.placeholder(name);
    }
  }

  /** Reference to a column, optionally qualified by a table label, such as
   * "e.deptno". */
  public static class Column extends Exp {
    public final @Nullable String table;
    public final String name;

    Column(@Nullable String table, String name) {
      super(Op.COLUMN);
      this.table = table;
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return Objects.hash(table, name);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Column
          && Objects.equals(this.table, ((Column) o).table)
          && this.name.equals(((Column) o).name);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      if (table != null) {
        w.identifier(table).append(".");
      }
      return w.identifier(name);
    }
  }

  /** Reference to a table, optionally qualified by a schema. */
  public static class Table extends SqlNode {
    public final @Nullable String schema;
    public final String name;

    Table(@Nullable String schema, String name) {
      super(Op.TABLE);
      this.schema = schema;
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return Objects.hash(schema, name);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Table
          && Objects.equals(this.schema, ((Table) o).schema)
          && this.name.equals(((Table) o).name);
    }

    @Override public Table accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      if (schema != null) {
        w.identifier(schema).append(".");
      }
      return w.identifier(name);
    }
  }

  /** Table with an alias, such as "hr.emps e". */
  public static class LabeledTable extends SqlNode {
    public final Table table;
    public final String label;

    LabeledTable(Table table, String label) {
      super(Op.LABELED_TABLE);
      this.table = requireNonNull(table);
      this.label = requireNonNull(label);
    }

    @Override public LabeledTable accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append(table).append(" ").identifier(label);
    }
  }

  /** "CAST(exp AS type)". */
  public static class Cast extends Exp {
    public final Exp exp;
    public final TypeName type;

    Cast(Exp exp, TypeName type) {
      super(Op.CAST);
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append("CAST(").append(exp).append(" AS ").append(type)
          .append(")");
    }

    public Cast copy(Exp exp, TypeName type) {
      return this.exp == exp && this.type == type ? this : new Cast(exp, type);
    }
  }

  /** Call to a function, such as "COALESCE(a,b)" or "CURRENT_DATE". */
  public static class FunctionCall extends Exp {
    public final String name;
    public final List<Exp> args;
    /** Whether to omit "()" when there are no arguments. */
    public final boolean omitParentheses;

    FunctionCall(String name, Iterable<? extends Exp> args,
        boolean omitParentheses) {
      super(Op.FUNCTION);
      this.name = requireNonNull(name);
      this.args = ImmutableList.copyOf(args);
      this.omitParentheses = omitParentheses;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      w.append(name);
      if (args.isEmpty()) {
        return omitParentheses ? w : w.append("()");
      }
      return w.appendAll(args, "(", ",", ")");
    }

    public FunctionCall copy(List<Exp> args) {
      return this.args.equals(args)
          ? this
          : new FunctionCall(name, args, omitParentheses);
    }
  }

  /** Parenthesized list of expressions, such as "(1,2,3)". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Iterable<? extends Exp> args) {
      super(Op.TUPLE);
      this.args = ImmutableList.copyOf(args);
      checkArgument(!this.args.isEmpty(), "empty tuple");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.appendAll(args, "(", ",", ")");
    }

    public Tuple copy(List<Exp> args) {
      return this.args.equals(args) ? this : new Tuple(args);
    }
  }

  /** "CASE WHEN c1 THEN r1 ... ELSE e END". */
  public static class Case extends Exp {
    public final List<Exp> conditions;
    public final List<Exp> results;
    public final @Nullable Exp otherwise;

    Case(Iterable<? extends Exp> conditions, Iterable<? extends Exp> results,
        @Nullable Exp otherwise) {
      super(Op.CASE);
      this.conditions = ImmutableList.copyOf(conditions);
      this.results = ImmutableList.copyOf(results);
      this.otherwise = otherwise;
      checkArgument(!this.conditions.isEmpty(), "CASE requires a WHEN");
      checkArgument(this.conditions.size() == this.results.size());
    }

    /** Returns a copy of this CASE with one more "WHEN ... THEN ..."
     * branch. */
    public Case when(Exp condition, Exp result) {
      return new Case(
          ImmutableList.<Exp>builder().addAll(conditions)
              .add(requireNonNull(condition)).build(),
          ImmutableList.<Exp>builder().addAll(results)
              .add(requireNonNull(result)).build(),
          otherwise);
    }

    /** Returns a copy of this CASE with a given ELSE branch. */
    public Case otherwise(Exp otherwise) {
      return new Case(conditions, results, requireNonNull(otherwise));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      w.append("CASE");
      for (int i = 0; i < conditions.size(); i++) {
        w.append(" WHEN ").append(conditions.get(i))
            .append(" THEN ").append(results.get(i));
      }
      if (otherwise != null) {
        w.append(" ELSE ").append(otherwise);
      }
      return w.append(" END");
    }

    public Case copy(List<Exp> conditions, List<Exp> results,
        @Nullable Exp otherwise) {
      return this.conditions.equals(conditions)
          && this.results.equals(results)
          && this.otherwise == otherwise
          ? this
          : new Case(conditions, results, otherwise);
    }
  }

  /** Sub-query used as an expression, such as the operand of EXISTS or
   * IN. */
  public static class ScalarSubquery extends Exp {
    public final Select select;

    ScalarSubquery(Select select) {
      super(Op.SCALAR_SUBQUERY);
      this.select = requireNonNull(select);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append("(").append(select).append(")");
    }

    public ScalarSubquery copy(Select select) {
      return this.select == select ? this : new ScalarSubquery(select);
    }
  }

  /** Item in a SELECT list, with an optional alias, such as "a + b total". */
  public static class LabeledColumn extends SqlNode {
    public final Exp exp;
    public final @Nullable String label;

    LabeledColumn(Exp exp, @Nullable String label) {
      super(Op.LABELED_COLUMN);
      this.exp = requireNonNull(exp);
      this.label = label;
    }

    @Override public LabeledColumn accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      w.append(exp);
      return label == null ? w : w.append(" ").identifier(label);
    }

    public LabeledColumn copy(Exp exp) {
      return this.exp == exp ? this : new LabeledColumn(exp, label);
    }
  }

  /** Sub-query in a FROM clause, with an alias. */
  public static class Subquery extends SqlNode {
    public final Select select;
    public final String label;

    Subquery(Select select, String label) {
      super(Op.SUBQUERY);
      this.select = requireNonNull(select);
      this.label = requireNonNull(label);
    }

    @Override public Subquery accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append("(").append(select).append(") ").identifier(label);
    }

    public Subquery copy(Select select) {
      return this.select == select ? this : new Subquery(select, label);
    }
  }

  /** Kind of join. */
  public enum JoinType {
    INNER("JOIN"),
    LEFT("LEFT JOIN"),
    RIGHT("RIGHT JOIN"),
    FULL("FULL JOIN");

    public final String keyword;

    JoinType(String keyword) {
      this.keyword = keyword;
    }
  }

  /** "left JOIN right ON condition". */
  public static class Join extends SqlNode {
    public final JoinType joinType;
    public final FromItem left;
    public final FromItem right;
    public final Exp on;

    Join(JoinType joinType, FromItem left, FromItem right, Exp on) {
      super(Op.JOIN);
      this.joinType = requireNonNull(joinType);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      this.on = requireNonNull(on);
    }

    @Override public Join accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append(left).append(" ").append(joinType.keyword).append(" ")
          .append(right).append(" ON ").append(on);
    }

    public Join copy(FromItem left, FromItem right, Exp on) {
      return this.left == left && this.right == right && this.on == on
          ? this
          : new Join(joinType, left, right, on);
    }
  }

  /**
   * Item in a FROM clause: a table, a sub-query or a join.
   *
   * <p>Exactly one alternative should be present. If none is, writing fails
   * with {@link SqlException.Kind#UNKNOWN_STRUCTURAL_VARIANT}.
   */
  public static class FromItem extends SqlNode {
    public final @Nullable LabeledTable table;
    public final @Nullable Subquery subquery;
    public final @Nullable Join join;

    FromItem(@Nullable LabeledTable table, @Nullable Subquery subquery,
        @Nullable Join join) {
      super(Op.FROM_ITEM);
      this.table = table;
      this.subquery = subquery;
      this.join = join;
    }

    @Override public FromItem accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      if (table != null) {
        return w.append(table);
      } else if (subquery != null) {
        return w.append(subquery);
      } else if (join != null) {
        return w.append(join);
      }
      throw new SqlException(SqlException.Kind.UNKNOWN_STRUCTURAL_VARIANT,
          "FROM item has no table, sub-query or join");
    }

    public FromItem copy(@Nullable LabeledTable table,
        @Nullable Subquery subquery, @Nullable Join join) {
      return this.table == table
          && this.subquery == subquery
          && this.join == join
          ? this
          : new FromItem(table, subquery, join);
    }
  }

  /** "FROM item". */
  public static class From extends SqlNode {
    public final FromItem item;

    From(FromItem item) {
      super(Op.FROM);
      this.item = requireNonNull(item);
    }

    @Override public From accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append("FROM ").append(item);
    }

    public From copy(FromItem item) {
      return this.item == item ? this : new From(item);
    }
  }

  /** "WHERE condition". */
  public static class Where extends SqlNode {
    public final Exp exp;

    Where(Exp exp) {
      super(Op.WHERE);
      this.exp = requireNonNull(exp);
    }

    @Override public Where accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append("WHERE ").append(exp);
    }

    public Where copy(Exp exp) {
      return this.exp == exp ? this : new Where(exp);
    }
  }

  /** "GROUP BY e1,e2". */
  public static class GroupBy extends SqlNode {
    public final List<Exp> exps;

    GroupBy(Iterable<? extends Exp> exps) {
      super(Op.GROUP_BY);
      this.exps = ImmutableList.copyOf(exps);
      checkArgument(!this.exps.isEmpty(), "empty GROUP BY");
    }

    @Override public GroupBy accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.appendAll(exps, "GROUP BY ", ",", "");
    }

    public GroupBy copy(List<Exp> exps) {
      return this.exps.equals(exps) ? this : new GroupBy(exps);
    }
  }

  /** "HAVING condition". */
  public static class Having extends SqlNode {
    public final Exp exp;

    Having(Exp exp) {
      super(Op.HAVING);
      this.exp = requireNonNull(exp);
    }

    @Override public Having accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append("HAVING ").append(exp);
    }

    public Having copy(Exp exp) {
      return this.exp == exp ? this : new Having(exp);
    }
  }

  /** Where NULL values sort relative to other values. */
  public enum NullDirection {
    FIRST,
    LAST
  }

  /** Item in an ORDER BY clause, such as "sal DESC NULLS LAST". */
  public static class OrderItem extends SqlNode {
    public final Exp exp;
    public final boolean descending;
    /** Explicit null ordering, or null to use the database default. */
    public final @Nullable NullDirection nullDirection;

    OrderItem(Exp exp, boolean descending,
        @Nullable NullDirection nullDirection) {
      super(Op.ORDER_ITEM);
      this.exp = requireNonNull(exp);
      this.descending = descending;
      this.nullDirection = nullDirection;
    }

    /** Returns a copy of this item with a given null ordering. */
    public OrderItem withNullDirection(NullDirection nullDirection) {
      return new OrderItem(exp, descending, requireNonNull(nullDirection));
    }

    @Override public OrderItem accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** {@inheritDoc}
     *
     * <p>Nulls sort last in ascending order and first in descending order,
     * so "NULLS ..." is only written when it differs from that. */
    @Override SqlWriter unparseTo(SqlWriter w) {
      w.append(exp);
      if (descending) {
        w.append(" DESC");
      }
      if (nullDirection != null) {
        if (descending && nullDirection == NullDirection.LAST) {
          w.append(" NULLS LAST");
        }
        if (!descending && nullDirection == NullDirection.FIRST) {
          w.append(" NULLS FIRST");
        }
      }
      return w;
    }

    public OrderItem copy(Exp exp) {
      return this.exp == exp
          ? this
          : new OrderItem(exp, descending, nullDirection);
    }
  }

  /** "ORDER BY item1,item2". */
  public static class OrderBy extends SqlNode {
    public final List<OrderItem> items;

    OrderBy(Iterable<OrderItem> items) {
      super(Op.ORDER_BY);
      this.items = ImmutableList.copyOf(items);
      checkArgument(!this.items.isEmpty(), "empty ORDER BY");
    }

    @Override public OrderBy accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.appendAll(items, "ORDER BY ", ",", "");
    }

    public OrderBy copy(List<OrderItem> items) {
      return this.items.equals(items) ? this : new OrderBy(items);
    }
  }

  /** "LIMIT count". */
  public static class Limit extends SqlNode {
    public final Exp exp;

    Limit(Exp exp) {
      super(Op.LIMIT);
      this.exp = requireNonNull(exp);
    }

    @Override public Limit accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append("LIMIT ").append(exp);
    }

    public Limit copy(Exp exp) {
      return this.exp == exp ? this : new Limit(exp);
    }
  }

  /** "OFFSET count". */
  public static class Offset extends SqlNode {
    public final Exp exp;

    Offset(Exp exp) {
      super(Op.OFFSET);
      this.exp = requireNonNull(exp);
    }

    @Override public Offset accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      return w.append("OFFSET ").append(exp);
    }

    public Offset copy(Exp exp) {
      return this.exp == exp ? this : new Offset(exp);
    }
  }

  /**
   * SELECT statement.
   *
   * <p>Clauses are written in the order SELECT, FROM, WHERE, GROUP BY, HAVING,
   * ORDER BY, LIMIT, OFFSET, regardless of the order in which they were
   * added. Each clause is optional except the SELECT list, which must have at
   * least one item.
   */
  public static class Select extends SqlNode {
    public final List<LabeledColumn> columns;
    public final @Nullable From from;
    public final @Nullable Where where;
    public final @Nullable GroupBy groupBy;
    public final @Nullable Having having;
    public final @Nullable OrderBy orderBy;
    public final @Nullable Limit limit;
    public final @Nullable Offset offset;

    Select(Iterable<LabeledColumn> columns, @Nullable From from,
        @Nullable Where where, @Nullable GroupBy groupBy,
        @Nullable Having having, @Nullable OrderBy orderBy,
        @Nullable Limit limit, @Nullable Offset offset) {
      super(Op.SELECT);
      this.columns = ImmutableList.copyOf(columns);
      checkArgument(!this.columns.isEmpty(), "SELECT requires a column");
      this.from = from;
      this.where = where;
      this.groupBy = groupBy;
      this.having = having;
      this.orderBy = orderBy;
      this.limit = limit;
      this.offset = offset;
    }

    /** Returns a copy of this SELECT with a given FROM item. */
    public Select from(FromItem item) {
      return new Select(columns, new From(item), where, groupBy, having,
          orderBy, limit, offset);
    }

    /** Returns a copy of this SELECT that reads from a given table. */
    public Select from(LabeledTable table) {
      return from(new FromItem(table, null, null));
    }

    /** Returns a copy of this SELECT that reads from a given join. */
    public Select from(Join join) {
      return from(new FromItem(null, null, join));
    }

    /** Returns a copy of this SELECT with a given WHERE condition. */
    public Select where(Exp condition) {
      return new Select(columns, from, new Where(condition), groupBy, having,
          orderBy, limit, offset);
    }

    /** Returns a copy of this SELECT with given GROUP BY expressions. */
    public Select groupBy(Exp exp, Exp... exps) {
      return new Select(columns, from, where,
          new GroupBy(ImmutableList.<Exp>builder().add(exp).add(exps).build()),
          having, orderBy, limit, offset);
    }

    /** Returns a copy of this SELECT with a given HAVING condition. */
    public Select having(Exp condition) {
      return new Select(columns, from, where, groupBy, new Having(condition),
          orderBy, limit, offset);
    }

    /** Returns a copy of this SELECT with given ORDER BY items. */
    public Select orderBy(OrderItem item, OrderItem... items) {
      return new Select(columns, from, where, groupBy, having,
          new OrderBy(
              ImmutableList.<OrderItem>builder().add(item).add(items).build()),
          limit, offset);
    }

    /** Returns a copy of this SELECT with a given LIMIT. */
    public Select limit(Exp count) {
      return new Select(columns, from, where, groupBy, having, orderBy,
          new Limit(count), offset);
    }

    /** Returns a copy of this SELECT with a given OFFSET. */
    public Select offset(Exp count) {
      return new Select(columns, from, where, groupBy, having, orderBy, limit,
          new Offset(count));
    }

    @Override public Select accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override SqlWriter unparseTo(SqlWriter w) {
      w.appendAll(columns, "SELECT ", ",", "");
      appendClause(w, from);
      appendClause(w, where);
      appendClause(w, groupBy);
      appendClause(w, having);
      appendClause(w, orderBy);
      appendClause(w, limit);
      appendClause(w, offset);
      return w;
    }

    private static void appendClause(SqlWriter w, @Nullable SqlNode clause) {
      if (clause != null) {
        w.append(" ").append(clause);
      }
    }

    public Select copy(List<LabeledColumn> columns, @Nullable From from,
        @Nullable Where where, @Nullable GroupBy groupBy,
        @Nullable Having having, @Nullable OrderBy orderBy,
        @Nullable Limit limit, @Nullable Offset offset) {
      return this.columns.equals(columns)
          && this.from == from
          && this.where == where
          && this.groupBy == groupBy
          && this.having == having
          && this.orderBy == orderBy
          && this.limit == limit
          && this.offset == offset
          ? this
          : new Select(columns, from, where, groupBy, having, orderBy, limit,
              offset);
    }
  }
}

// End Sql.java
