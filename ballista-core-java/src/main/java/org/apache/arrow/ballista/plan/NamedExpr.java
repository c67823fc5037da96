package org.apache.arrow.ballista.plan;

import java.util.Objects;

/**
 * An expression together with the name of the column it produces.
 *
 * @param expr the expression
 * @param name the output column name
 */
public record NamedExpr(PhysicalExpr expr, String name) {
  public NamedExpr {
    Objects.requireNonNull(expr, "expr");
    Objects.requireNonNull(name, "name");
  }
}
