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

import java.util.Locale;

/** How a database folds the case of an identifier that is not quoted. */
public enum Casing {
  /** Unquoted identifiers keep their case, or the database compares them
   * without regard to case. */
  UNCHANGED {
    @Override public String apply(String name) {
      return name;
    }
  },
  /** Unquoted identifiers are converted to upper case, as in Oracle. */
  TO_UPPER {
    @Override public String apply(String name) {
      return name.toUpperCase(Locale.ROOT);
    }
  },
  /** Unquoted identifiers are converted to lower case, as in PostgreSQL. */
  TO_LOWER {
    @Override public String apply(String name) {
      return name.toLowerCase(Locale.ROOT);
    }
  };

  /** Returns the name that the database would see if {@code name} were
   * written without quotes. */
  public abstract String apply(String name);
}

// End Casing.java
