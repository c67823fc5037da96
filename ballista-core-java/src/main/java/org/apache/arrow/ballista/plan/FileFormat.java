package org.apache.arrow.ballista.plan;

/** File formats a {@link PhysicalPlan.ScanExec} can read. */
public enum FileFormat {
  CSV,
  PARQUET
}
