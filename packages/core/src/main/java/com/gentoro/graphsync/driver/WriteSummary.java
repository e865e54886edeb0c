package com.gentoro.graphsync.driver;

/** Update counters of one or more write statements. */
public record WriteSummary(
    long nodesCreated,
    long nodesDeleted,
    long relationshipsCreated,
    long relationshipsDeleted,
    long propertiesSet,
    long labelsAdded,
    long indexesAdded) {

  public static final WriteSummary EMPTY = new WriteSummary(0, 0, 0, 0, 0, 0, 0);

  /** True when the statement changed anything; iterative statements stop once this is false. */
  public boolean containsUpdates() {
    return nodesCreated > 0
        || nodesDeleted > 0
        || relationshipsCreated > 0
        || relationshipsDeleted > 0
        || propertiesSet > 0
        || labelsAdded > 0
        || indexesAdded > 0;
  }

  public WriteSummary plus(WriteSummary other) {
    if (other == null) return this;
    return new WriteSummary(
        nodesCreated + other.nodesCreated,
        nodesDeleted + other.nodesDeleted,
        relationshipsCreated + other.relationshipsCreated,
        relationshipsDeleted + other.relationshipsDeleted,
        propertiesSet + other.propertiesSet,
        labelsAdded + other.labelsAdded,
        indexesAdded + other.indexesAdded);
  }
}
