package com.gentoro.graphsync.model;

import java.util.Objects;

/**
 * Where the value of a graph property comes from during a load call.
 *
 * <ul>
 *   <li>{@link FromRow}: a field of the current input row.
 *   <li>{@link FromKwargs}: a constant supplied once for the whole batch.
 *   <li>{@link FromRowList}: a row field holding a list, used to fan out a one-to-many match.
 * </ul>
 */
public sealed interface Binding permits Binding.FromRow, Binding.FromKwargs, Binding.FromRowList {

  /** Row field name or kwarg name this binding reads. */
  String key();

  default MatchMode matchMode() {
    return MatchMode.EXACT;
  }

  static FromRow row(String field) {
    return new FromRow(field, false, MatchMode.EXACT);
  }

  static FromKwargs kwarg(String name) {
    return new FromKwargs(name, MatchMode.EXACT);
  }

  static FromRowList rowList(String field) {
    return new FromRowList(field);
  }

  record FromRow(String field, boolean extraIndex, MatchMode matchMode) implements Binding {
    public FromRow {
      requireName(field, "field");
      matchMode = matchMode == null ? MatchMode.EXACT : matchMode;
    }

    @Override
    public String key() {
      return field;
    }

    /** Also create a lookup index on the graph property this binding is assigned to. */
    public FromRow withExtraIndex() {
      return new FromRow(field, true, matchMode);
    }

    public FromRow ignoreCase() {
      return new FromRow(field, extraIndex, MatchMode.IGNORE_CASE);
    }

    public FromRow fuzzyIgnoreCase() {
      return new FromRow(field, extraIndex, MatchMode.FUZZY_IGNORE_CASE);
    }
  }

  record FromKwargs(String name, MatchMode matchMode) implements Binding {
    public FromKwargs {
      requireName(name, "name");
      matchMode = matchMode == null ? MatchMode.EXACT : matchMode;
    }

    @Override
    public String key() {
      return name;
    }

    public FromKwargs ignoreCase() {
      return new FromKwargs(name, MatchMode.IGNORE_CASE);
    }

    public FromKwargs fuzzyIgnoreCase() {
      return new FromKwargs(name, MatchMode.FUZZY_IGNORE_CASE);
    }
  }

  record FromRowList(String field) implements Binding {
    public FromRowList {
      requireName(field, "field");
    }

    @Override
    public String key() {
      return field;
    }
  }

  private static void requireName(String value, String what) {
    Objects.requireNonNull(value, what);
    if (value.isBlank()) {
      throw new IllegalArgumentException("Binding " + what + " must not be blank");
    }
  }
}
