package org.apache.arrow.ballista.plan;

/** Join types supported by {@link PhysicalPlan.HashJoinExec}. */
public enum JoinType {
  INNER,
  LEFT,
  RIGHT,
  FULL,
  SEMI,
  ANTI
}
