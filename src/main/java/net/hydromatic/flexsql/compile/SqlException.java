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

import static java.util.Objects.requireNonNull;

/** An error occurred while building or writing SQL. */
public class SqlException extends RuntimeException {
  private final Kind kind;

  public SqlException(Kind kind, String message) {
    super(message);
    this.kind = requireNonNull(kind);
  }

  /** Returns the kind of error. */
  public Kind kind() {
    return kind;
  }

  @Override public String toString() {
    return getClass().getName() + ": " + kind + ": " + getMessage();
  }

  /** Kind of error. */
  public enum Kind {
    /** An operator has no precedence in the call or the dialect. */
    PRECEDENCE_UNDEFINED,
    /** An operator has no associativity in the call or the dialect. */
    ASSOCIATIVITY_UNDEFINED,
    /** A unary operator is non-associative, so it is neither prefix nor
     * postfix. */
    NON_ASSOCIATIVE_UNARY,
    /** A node that has several alternatives has none of them. */
    UNKNOWN_STRUCTURAL_VARIANT,
    /** Zero or a negative number of placeholders was requested. */
    ZERO_LENGTH_PLACEHOLDER_REQUEST,
    /** A placeholder in a statement has no value. */
    UNBOUND_PLACEHOLDER,
    /** A value was given for a name that is not a placeholder in the
     * statement. */
    UNKNOWN_INPUT_KEY,
    /** Nodes are nested too deeply to write. */
    NESTING_TOO_DEEP
  }
}

// End SqlException.java
