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
package net.hydromatic.gql.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.gql.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Setting that controls how a graph pattern is analyzed.
 *
 * <p>Settings live in a {@code Map<Prop, Object>} owned by the caller. Every
 * setting has a default, which applies while the map has no entry for it.
 */
public enum Prop {
  /**
   * Enum setting "matchMode": the match mode of a graph pattern that does not
   * declare one. Default is {@link Ast.MatchMode#REPEATABLE_ELEMENTS}.
   *
   * <p>Under {@link Ast.MatchMode#DIFFERENT_EDGES} every match is finite, and
   * unbounded quantifiers need no selective context.
   */
  MATCH_MODE(Ast.MatchMode.class, Ast.MatchMode.REPEATABLE_ELEMENTS),

  /**
   * Boolean setting "checkDeclarationOrder": whether declarations must arrive
   * in increasing source position. Out-of-order declarations mean the caller
   * walked the tree wrongly. Default is true.
   */
  CHECK_DECLARATION_ORDER(Boolean.class, true),

  /**
   * Boolean setting "referenceCheckEnabled": whether to resolve the variables
   * referenced by search conditions once the pattern is analyzed. When false,
   * no accessibility errors arise and search conditions reference nothing.
   * Default is true.
   */
  REFERENCE_CHECK_ENABLED(Boolean.class, true);

  /** Name in lower camel case, for example "matchMode". */
  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /** Settings keyed by constant name and by camel name. */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** Settings ordered by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final ImmutableList<Prop> sorted =
        ImmutableList.sortedCopyOf(Comparator.comparing((Prop p) -> p.camelName),
            ImmutableList.copyOf(values()));
    final ImmutableMap.Builder<String, Prop> b = ImmutableMap.builder();
    sorted.forEach(p -> b.put(p.name(), p).put(p.camelName, p));
    BY_CAMEL_NAME = sorted;
    BY_NAME = b.build();
  }

  Prop(Class<?> type, Object defaultValue) {
    this.type = requireNonNull(type);
    this.defaultValue = requireNonNull(defaultValue);
    this.camelName =
        CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
    checkArgument(type.isInstance(defaultValue),
        "default for %s has wrong type", name());
  }

  /** Returns the setting with a given name, either its constant name or its
   * camel name. */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    checkArgument(prop != null, "property %s not found", propName);
    return prop;
  }

  /** Returns the current value, or the default if the map has none. */
  public Object get(Map<Prop, Object> map) {
    return map.getOrDefault(this, defaultValue);
  }

  public boolean booleanValue(Map<Prop, Object> map) {
    return as(Boolean.class, map);
  }

  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    return as(type, map);
  }

  private <T> T as(Class<T> requestedType, Map<Prop, Object> map) {
    checkArgument(type == requestedType,
        "property %s has type %s, not %s", camelName, type, requestedType);
    return requestedType.cast(get(map));
  }

  /** Sets the value, converting a string to this setting's type if it is an
   * enum or a boolean.
   *
   * <p>Enum names are matched ignoring case. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    set(map, value instanceof String ? parse((String) value) : value);
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private Object parse(String s) {
    if (type == Boolean.class) {
      return Boolean.valueOf(s);
    }
    if (!type.isEnum()) {
      return s;
    }
    final Class<Enum> enumClass = (Class<Enum>) type;
    final Optional<Enum> e =
        Enums.getIfPresent(enumClass, s.toUpperCase(Locale.ROOT));
    if (!e.isPresent()) {
      throw new IllegalArgumentException("value must be one of: '"
          + Joiner.on("', '").join(
              Arrays.stream(enumClass.getEnumConstants()).map(Enum::name)
                  .iterator()) + "'");
    }
    return e.get();
  }

  /** Sets the value. A null value is not allowed, because every setting has
   * a default; use {@link #remove} to restore the default. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    checkArgument(value != null, "property %s may not be null", camelName);
    checkArgument(type.isInstance(value),
        "value for property %s must have type %s", camelName, type);
    map.put(this, value);
  }

  /** Restores the default, returning the value that was set, or null. */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
