package org.apache.arrow.ballista;

/** Lifecycle of a {@link QueryStage}. */
public enum StageState {
  /** Created by the planner; some inputs may still be unresolved. */
  PENDING,
  /** All inputs resolved, partitions are being written. */
  RUNNING,
  /** Every output partition has been written. The stage is immutable from here on. */
  COMPLETED
}
