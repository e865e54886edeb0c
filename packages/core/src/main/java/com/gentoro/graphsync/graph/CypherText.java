package com.gentoro.graphsync.graph;

import com.gentoro.graphsync.model.Binding;
import com.gentoro.graphsync.model.LinkDirection;
import com.gentoro.graphsync.model.MatchMode;
import com.gentoro.graphsync.model.PropertyMap;
import com.gentoro.graphsync.model.SchemaValidator;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Small rendering helpers shared by the query builders. */
final class CypherText {
  static final String ROW = "item";
  static final String INDENT = "    ";

  private static final Pattern PARAMETER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

  private CypherText() {}

  /** Row fields that are not plain identifiers are backtick quoted. */
  static String rowField(String field) {
    if (SchemaValidator.isIdentifier(field)) return ROW + "." + field;
    return ROW + ".`" + field.replace("`", "``") + "`";
  }

  static String value(Binding binding) {
    if (binding instanceof Binding.FromKwargs kwarg) {
      return "$" + kwarg.name();
    }
    return rowField(binding.key());
  }

  static String stringLiteral(String text) {
    return "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
  }

  /** {@code {a: item.a, b: $B}} */
  static String inlineMap(PropertyMap matcher) {
    List<String> parts = new ArrayList<>();
    for (PropertyMap.PropertyMapping entry : matcher) {
      parts.add(entry.property() + ": " + value(entry.binding()));
    }
    return "{" + String.join(", ", parts) + "}";
  }

  /** WHERE predicate for a matcher, honouring match modes and row list fan-out. */
  static String predicate(String variable, PropertyMap matcher) {
    List<String> parts = new ArrayList<>();
    for (PropertyMap.PropertyMapping entry : matcher) {
      String property = variable + "." + entry.property();
      Binding binding = entry.binding();
      String value = value(binding);
      if (binding instanceof Binding.FromRowList) {
        parts.add(property + " IN " + value);
      } else if (binding.matchMode() == MatchMode.IGNORE_CASE) {
        parts.add("toLower(" + property + ") = toLower(" + value + ")");
      } else if (binding.matchMode() == MatchMode.FUZZY_IGNORE_CASE) {
        parts.add("toLower(" + property + ") CONTAINS toLower(" + value + ")");
      } else {
        parts.add(property + " = " + value);
      }
    }
    return String.join(" AND ", parts);
  }

  /** {@code (a)-[r:L]->(b)} or {@code (a)<-[r:L]-(b)} */
  static String link(String from, String rel, String label, LinkDirection direction, String to) {
    String relationship = "[" + rel + ":" + label + "]";
    return direction == LinkDirection.INWARD
        ? "(" + from + ")<-" + relationship + "-(" + to + ")"
        : "(" + from + ")-" + relationship + "->(" + to + ")";
  }

  /** Names of all {@code $parameters} referenced by a query, in order of appearance. */
  static Set<String> parameterNames(String query) {
    Set<String> names = new LinkedHashSet<>();
    Matcher m = PARAMETER.matcher(query);
    while (m.find()) names.add(m.group(1));
    return names;
  }

  static String moduleName(String module) {
    return "graphsync:" + (module == null || module.isBlank() ? "unknown" : module);
  }

  static String moduleVersion() {
    String version = CypherText.class.getPackage().getImplementationVersion();
    return version == null ? "dev" : version;
  }
}
