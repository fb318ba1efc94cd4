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

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls how a {@link Compiler} generates SQL.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 */
public enum Prop {
  /**
   * Boolean property "normalize" controls whether to rewrite a tree into
   * canonical form, collapsing "NOT" over negatable operators, before writing
   * it. Default is true.
   */
  NORMALIZE("normalize", Boolean.class, true, true),

  /**
   * Integer property "maxDepth" is the deepest that nodes may be nested.
   * Normalizing or writing a deeper tree fails with
   * {@link SqlException.Kind#NESTING_TOO_DEEP}. Default is 1,000.
   *
   * <p>Every node counts, and a chain of operators such as "a AND b AND c"
   * nests to the left, so a chain of n conditions is about n + 1 deep. Set a
   * larger value for longer chains; a very large value risks running out of
   * stack.
   */
  MAX_DEPTH("maxDepth", Integer.class, true, 1_000),

  /**
   * Enum property "placeholderStyle", if set, overrides the dialect's syntax
   * for placeholders. Default is null, meaning use the dialect's.
   */
  PLACEHOLDER_STYLE("placeholderStyle", PlaceholderStyle.class, false, null),

  /**
   * Enum property "identifierQuoting", if set, overrides the dialect's policy
   * for quoting identifiers. Default is null, meaning use the dialect's.
   */
  IDENTIFIER_QUOTING("identifierQuoting", Quoting.class, false, null);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and
   * {@link #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(CaseFormat.LOWER_CAMEL
        .to(CaseFormat.UPPER_UNDERSCORE, camelName)
        .equals(name()));
    if (defaultValue == null) {
      checkArgument(!required,
          "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or its default value. */
  public @Nullable Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType, "invalid type %s for property %s",
        type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of an enum property, or null if the property has no
   * value and no default value. */
  public <E extends Enum<E>> @Nullable E enumValue(Map<Prop, Object> map,
      Class<E> enumClass) {
    checkType(enumClass);
    return enumClass.cast(get(map));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException("no value for property " + camelName
            + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /** Sets the value of a property, allowing strings for enum, boolean and
   * integer types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = (String) value;
      if (type.isEnum()) {
        final Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type,
                s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          final String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(Enum::name)
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException("value for property "
              + camelName + " must be one of: " + values);
        }
        set(map, optional.get());
        return;
      }
      if (type == Boolean.class) {
        set(map, Boolean.valueOf(s));
        return;
      }
      if (type == Integer.class) {
        set(map, Integer.valueOf(s));
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type);
      }
      map.put(this, value);
    }
  }

  /** Removes the value of this property from a map, returning the previous
   * value or null. */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
