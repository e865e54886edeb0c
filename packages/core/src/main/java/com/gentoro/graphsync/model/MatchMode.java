package com.gentoro.graphsync.model;

/** How a bound value is compared against a target node property when matching. */
public enum MatchMode {
  EXACT,
  /** {@code toLower(node.p) = toLower(value)} */
  IGNORE_CASE,
  /** {@code toLower(node.p) CONTAINS toLower(value)} */
  FUZZY_IGNORE_CASE
}
