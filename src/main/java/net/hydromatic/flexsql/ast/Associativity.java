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

/**
 * Associativity of an operator.
 *
 * <p>Associativity breaks ties between operators of the same precedence. For a
 * unary operator it also decides where the symbol goes: a {@link #RIGHT}
 * operator is prefix ("NOT x"), a {@link #LEFT} operator is postfix ("x IS
 * NULL").
 */
public enum Associativity {
  /** Operator may not be chained; "a = b = c" is not valid. */
  NON_ASSOCIATIVE,
  /** "a - b - c" means "(a - b) - c". */
  LEFT,
  /** "a ^ b ^ c" means "a ^ (b ^ c)". */
  RIGHT
}

// End Associativity.java
