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

/** Policy for quoting identifiers. */
public enum Quoting {
  /** Quote every identifier. */
  ALWAYS,
  /** Quote an identifier only if it is not a plain identifier (letters,
   * digits and underscores, not starting with a digit), if it is a reserved
   * word, or if the dialect's {@link Casing} would change it. */
  AS_NEEDED,
  /** Never quote identifiers; write them verbatim. */
  NEVER
}

// End Quoting.java
