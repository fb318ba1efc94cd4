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

/** Syntax of a placeholder in SQL text. */
public enum PlaceholderStyle {
  /** "?", as used by JDBC, MySQL and SQLite. Placeholders are bound by the
   * order in which they occur in the text. */
  QUESTION {
    @Override public String render(String name, int position) {
      return "?";
    }
  },

  /** "$1", as used by PostgreSQL. */
  DOLLAR {
    @Override public String render(String name, int position) {
      return "$" + position;
    }
  },

  /** ":name", as used by Oracle. */
  COLON {
    @Override public String render(String name, int position) {
      return ":" + name;
    }
  },

  /** "@name", as used by SQL Server. */
  AT {
    @Override public String render(String name, int position) {
      return "@" + name;
    }
  };

  /** Returns the text of a placeholder with a given name and 1-based
   * position. */
  public abstract String render(String name, int position);

  /** Returns whether a placeholder that occurs several times in the text
   * needs a value for each occurrence. */
  public boolean isPositional() {
    return this == QUESTION;
  }
}

// End PlaceholderStyle.java
