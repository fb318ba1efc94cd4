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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import net.hydromatic.flexsql.ast.Associativity;
import net.hydromatic.flexsql.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Implementation of {@link Dialect} whose rules are held in tables.
 *
 * <p>Instances are immutable. To create one, call {@link #builder()} or
 * modify an existing dialect via {@link #toBuilder()}.
 */
public class SqlDialect implements Dialect {
  /** Identifier that needs no quotes, unless it is a reserved word. */
  private static final Pattern PLAIN_IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /** Words that must be quoted if used as identifiers. */
  static final ImmutableSet<String> RESERVED_WORDS =
      ImmutableSet.of("ALL", "ALTER", "AND", "ANY", "AS", "ASC", "BETWEEN",
          "BY", "CASE", "CAST", "CHECK", "COLUMN", "CONSTRAINT", "CREATE",
          "CROSS", "CURRENT_DATE", "CURRENT_TIME", "CURRENT_TIMESTAMP",
          "CURRENT_USER", "DEFAULT", "DELETE", "DESC", "DISTINCT", "DROP",
          "ELSE", "END", "EXCEPT", "EXISTS", "FALSE", "FETCH", "FOR",
          "FOREIGN", "FROM", "FULL", "GRANT", "GROUP", "HAVING", "ILIKE",
          "IN", "INNER", "INSERT", "INTERSECT", "INTO", "IS", "JOIN", "KEY",
          "LEFT", "LIKE", "LIMIT", "NATURAL", "NOT", "NULL", "NULLS",
          "OFFSET", "ON", "OR", "ORDER", "OUTER", "PRIMARY", "REFERENCES",
          "RIGHT", "ROW", "ROWS", "SELECT", "SET", "SOME", "TABLE", "THEN",
          "TO", "TRUE", "UNION", "UNIQUE", "UPDATE", "USER", "USING",
          "VALUES", "WHEN", "WHERE", "WINDOW", "WITH");

  private final String name;
  private final String openQuote;
  private final String closeQuote;
  private final Quoting quoting;
  private final Casing unquotedCasing;
  private final PlaceholderStyle placeholderStyle;
  private final ImmutableMap<Op, Integer> precedences;
  private final ImmutableMap<Op, Associativity> associativities;

  private SqlDialect(String name, String openQuote, String closeQuote,
      Quoting quoting, Casing unquotedCasing,
      PlaceholderStyle placeholderStyle, Map<Op, Integer> precedences,
      Map<Op, Associativity> associativities) {
    this.name = requireNonNull(name);
    this.openQuote = requireNonNull(openQuote);
    this.closeQuote = requireNonNull(closeQuote);
    this.quoting = requireNonNull(quoting);
    this.unquotedCasing = requireNonNull(unquotedCasing);
    this.placeholderStyle = requireNonNull(placeholderStyle);
    this.precedences = ImmutableMap.copyOf(precedences);
    this.associativities = ImmutableMap.copyOf(associativities);
  }

  /** Creates a builder with ANSI quoting, unquoted identifiers that keep
   * their case, "?" placeholders and no operators. */
  public static Builder builder() {
    return new Builder("CUSTOM");
  }

  /** Creates a builder initialized with the rules of this dialect. */
  public Builder toBuilder() {
    final Builder b = new Builder(name);
    b.openQuote = openQuote;
    b.closeQuote = closeQuote;
    b.quoting = quoting;
    b.unquotedCasing = unquotedCasing;
    b.placeholderStyle = placeholderStyle;
    b.precedences.putAll(precedences);
    b.associativities.putAll(associativities);
    return b;
  }

  @Override public String toString() {
    return name;
  }

  @Override public String name() {
    return name;
  }

  public Quoting quoting() {
    return quoting;
  }

  /** Returns how the database folds the case of an identifier that is not
   * quoted. */
  public Casing unquotedCasing() {
    return unquotedCasing;
  }

  public PlaceholderStyle placeholderStyle() {
    return placeholderStyle;
  }

  /** {@inheritDoc}
   *
   * <p>If quoting is {@link Quoting#AS_NEEDED}, a name is quoted if it is
   * not a plain identifier, if it is a reserved word, or if the database
   * would change its case; in PostgreSQL, {@code userId} is quoted but
   * {@code user_id} is not. */
  @Override public String quoteIdentifier(String name) {
    switch (quoting) {
    case NEVER:
      return name;
    case AS_NEEDED:
      if (PLAIN_IDENTIFIER.matcher(name).matches()
          && !RESERVED_WORDS.contains(name.toUpperCase(Locale.ROOT))
          && unquotedCasing.apply(name).equals(name)) {
        return name;
      }
      // fall through
    default:
      return openQuote + name.replace(closeQuote, closeQuote + closeQuote)
          + closeQuote;
    }
  }

  @Override public int precedence(Op op) {
    final Integer precedence = precedences.get(op);
    return precedence == null ? 0 : precedence;
  }

  @Override public @Nullable Associativity associativity(Op op) {
    return associativities.get(op);
  }

  @Override public String placeholder(String name, int position) {
    return placeholderStyle.render(name, position);
  }

  /** Builder for a {@link SqlDialect}. */
  public static class Builder {
    private String name;
    private String openQuote = "\"";
    private String closeQuote = "\"";
    private Quoting quoting = Quoting.AS_NEEDED;
    private Casing unquotedCasing = Casing.UNCHANGED;
    private PlaceholderStyle placeholderStyle = PlaceholderStyle.QUESTION;
    private final Map<Op, Integer> precedences = new EnumMap<>(Op.class);
    private final Map<Op, Associativity> associativities =
        new EnumMap<>(Op.class);

    private Builder(String name) {
      this.name = name;
    }

    public Builder name(String name) {
      this.name = requireNonNull(name);
      return this;
    }

    /** Sets the characters that start and end a quoted identifier, such as
     * "[" and "]". */
    public Builder identifierQuote(String openQuote, String closeQuote) {
      checkArgument(!openQuote.isEmpty() && !closeQuote.isEmpty(),
          "empty quote");
      this.openQuote = openQuote;
      this.closeQuote = closeQuote;
      return this;
    }

    public Builder quoting(Quoting quoting) {
      this.quoting = requireNonNull(quoting);
      return this;
    }

    /** Sets how the database folds the case of an identifier that is not
     * quoted. With {@link Quoting#AS_NEEDED}, a name that folding would
     * change is quoted. */
    public Builder unquotedCasing(Casing unquotedCasing) {
      this.unquotedCasing = requireNonNull(unquotedCasing);
      return this;
    }

    public Builder placeholderStyle(PlaceholderStyle placeholderStyle) {
      this.placeholderStyle = requireNonNull(placeholderStyle);
      return this;
    }

    /** Sets the precedence of an operator; higher binds tighter. */
    public Builder precedence(Op op, int precedence) {
      checkArgument(op.isOperator(), "not an operator: %s", op);
      checkArgument(precedence > 0, "precedence must be positive: %s",
          precedence);
      precedences.put(op, precedence);
      return this;
    }

    public Builder associativity(Op op, Associativity associativity) {
      checkArgument(op.isOperator(), "not an operator: %s", op);
      associativities.put(op, requireNonNull(associativity));
      return this;
    }

    /** Sets both the precedence and associativity of an operator. */
    public Builder operator(Op op, int precedence,
        Associativity associativity) {
      return precedence(op, precedence).associativity(op, associativity);
    }

    /** Removes the precedence of an operator, so that writing a call to it
     * fails unless the call has its own precedence. */
    public Builder clearPrecedence(Op op) {
      precedences.remove(op);
      return this;
    }

    public Builder clearAssociativity(Op op) {
      associativities.remove(op);
      return this;
    }

    public SqlDialect build() {
      return new SqlDialect(name, openQuote, closeQuote, quoting,
          unquotedCasing, placeholderStyle, precedences, associativities);
    }
  }
}

// End SqlDialect.java
