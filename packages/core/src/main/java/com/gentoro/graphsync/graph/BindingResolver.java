package com.gentoro.graphsync.graph;

import com.gentoro.graphsync.exception.ConfigException;
import com.gentoro.graphsync.model.Binding;
import com.gentoro.graphsync.model.MatchLinkSchema;
import com.gentoro.graphsync.model.NodeSchema;
import com.gentoro.graphsync.model.PropertyMap;
import com.gentoro.graphsync.model.RelationshipSchema;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves bindings against a row and the per-call kwargs. Loads do not substitute values into the
 * query text; the resolver is used to check a batch before it reaches the store.
 */
public final class BindingResolver {

  private BindingResolver() {}

  /**
   * @return the row value (null when the row lacks the field), the kwarg value, or the list a row
   *     list binding fans out over (empty when the field is absent or null)
   * @throws ConfigException when a kwarg is missing or a row list field is not a list
   */
  public static Object resolve(Binding binding, Map<String, ?> row, Map<String, ?> kwargs) {
    if (binding instanceof Binding.FromKwargs kwarg) {
      if (kwargs == null || !kwargs.containsKey(kwarg.name())) {
        throw new ConfigException("Missing required kwarg '" + kwarg.name() + "'")
            .withContext("kwarg", kwarg.name());
      }
      return kwargs.get(kwarg.name());
    }
    Object value = row == null ? null : row.get(binding.key());
    if (binding instanceof Binding.FromRowList) {
      return asList(binding.key(), value);
    }
    return value;
  }

  private static List<?> asList(String field, Object value) {
    if (value == null) return List.of();
    if (value instanceof List<?> list) return list;
    if (value instanceof Collection<?> collection) return new ArrayList<>(collection);
    if (value instanceof Object[] array) return Arrays.asList(array);
    throw new ConfigException(
            "Field '"
                + field
                + "' is bound as a row list but holds "
                + value.getClass().getSimpleName())
        .withContext("field", field);
  }

  /** Every kwarg name a node schema reads, including those of its relationships. */
  public static Set<String> kwargNames(NodeSchema schema) {
    Set<String> names = new LinkedHashSet<>();
    collectKwargs(schema.properties(), names);
    for (RelationshipSchema rel : schema.relationships()) {
      collectKwargs(rel.targetMatcher(), names);
      collectKwargs(rel.properties(), names);
    }
    return names;
  }

  public static Set<String> kwargNames(MatchLinkSchema schema) {
    Set<String> names = new LinkedHashSet<>();
    collectKwargs(schema.sourceMatcher(), names);
    collectKwargs(schema.targetMatcher(), names);
    collectKwargs(schema.properties(), names);
    return names;
  }

  /**
   * Check a batch before it is sent: every kwarg must be present and every row list field must hold
   * a list.
   */
  static void check(
      String schemaName,
      Set<String> kwargNames,
      List<PropertyMap> matchers,
      List<? extends Map<String, ?>> rows,
      Map<String, ?> kwargs) {
    try {
      for (String name : kwargNames) {
        resolve(Binding.kwarg(name), null, kwargs);
      }
      for (PropertyMap matcher : matchers) {
        for (PropertyMap.PropertyMapping entry : matcher) {
          if (!(entry.binding() instanceof Binding.FromRowList)) continue;
          for (Map<String, ?> row : rows) {
            resolve(entry.binding(), row, kwargs);
          }
        }
      }
    } catch (ConfigException e) {
      ConfigException wrapped =
          new ConfigException("Cannot load '" + schemaName + "': " + e.getMessage(), e);
      e.getContext().forEach(wrapped::withContext);
      throw wrapped.withContext("schema", schemaName);
    }
  }

  private static void collectKwargs(PropertyMap map, Set<String> names) {
    for (PropertyMap.PropertyMapping entry : map) {
      if (entry.binding() instanceof Binding.FromKwargs kwarg) names.add(kwarg.name());
    }
  }
}
