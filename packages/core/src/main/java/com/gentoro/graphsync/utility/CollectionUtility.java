package com.gentoro.graphsync.utility;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class CollectionUtility {

  /**
   * Merge maps left to right; later maps win on key collisions. Null maps are skipped. Insertion
   * order is preserved so merged Cypher parameters stay readable in logs.
   */
  @SafeVarargs
  public static <K, V> Map<K, V> mergeMaps(Map<K, V>... maps) {
    Map<K, V> result = new LinkedHashMap<>();
    if (Objects.nonNull(maps)) {
      for (Map<K, V> map : maps) {
        if (Objects.nonNull(map)) {
          result.putAll(map);
        }
      }
    }
    return result;
  }

  /** Split {@code items} into consecutive chunks of at most {@code size} elements. */
  public static <T> List<List<T>> partition(List<T> items, int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("Partition size must be greater than 0, got " + size);
    }
    List<List<T>> chunks = new ArrayList<>();
    if (items == null || items.isEmpty()) {
      return chunks;
    }
    for (int i = 0; i < items.size(); i += size) {
      chunks.add(items.subList(i, Math.min(items.size(), i + size)));
    }
    return chunks;
  }
}
