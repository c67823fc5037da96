package org.apache.arrow.ballista.plan;

/** Aggregate functions of {@link AggregateExpr}. */
public enum AggregateFunction {
  COUNT,
  SUM,
  MIN,
  MAX,
  AVG
}
