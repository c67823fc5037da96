package org.apache.arrow.ballista.plan;

/**
 * A sort key of a {@link PhysicalPlan.SortExec}.
 *
 * @param expr the expression to sort by
 * @param descending true for descending order, false for ascending
 * @param nullsFirst true to sort nulls before non-null values
 */
public record PhysicalSortExpr(PhysicalExpr expr, boolean descending, boolean nullsFirst) {}
