package com.gentoro.graphsync.model;

/**
 * Direction of a relationship relative to the node that owns the schema (or the source node of a
 * match link). {@code OUTWARD} renders as {@code (i)-[r]->(j)}, {@code INWARD} as {@code
 * (i)<-[r]-(j)}.
 */
public enum LinkDirection {
  OUTWARD,
  INWARD
}
