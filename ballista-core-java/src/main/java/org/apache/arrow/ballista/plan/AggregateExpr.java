package org.apache.arrow.ballista.plan;

import java.util.List;
import java.util.Objects;
import org.apache.arrow.ballista.BallistaException;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * An aggregate expression of a {@link PhysicalPlan.HashAggregateExec}.
 *
 * @param function the aggregate function
 * @param expressions the function arguments
 * @param name the output column name, or null if it has not been resolved
 * @param dataType the output type, or null if it has not been resolved
 */
public record AggregateExpr(
    AggregateFunction function, List<PhysicalExpr> expressions, String name, ArrowType dataType) {

  public AggregateExpr {
    Objects.requireNonNull(function, "function");
    expressions = List.copyOf(expressions);
  }

  /**
   * Returns the output field of this aggregate.
   *
   * @return a nullable field with the output name and type
   * @throws BallistaException if the output name or type has not been resolved
   */
  public Field field() {
    if (name == null || name.isBlank()) {
      throw new BallistaException("Aggregate " + function + " has no output field name");
    }
    if (dataType == null) {
      throw new BallistaException("Aggregate " + name + " has no output type");
    }
    return new Field(name, FieldType.nullable(dataType), null);
  }
}
