package org.apache.arrow.ballista.plan;

import java.util.Objects;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * A physical expression evaluated by a plan node.
 *
 * <p>Each variant is a record. Only columns, literals and binary expressions have a dedicated text
 * rendering; other variants are described by their {@code toString()}.
 */
public sealed interface PhysicalExpr {

  /**
   * A reference to an input column.
   *
   * @param name the column name
   * @param index the column index in the input schema
   */
  record ColumnExpr(String name, int index) implements PhysicalExpr {
    public ColumnExpr {
      Objects.requireNonNull(name, "name");
    }
  }

  /**
   * A literal value.
   *
   * @param value the value, or null for a typed NULL
   * @param dataType the Arrow type of the value
   */
  record LiteralExpr(Object value, ArrowType dataType) implements PhysicalExpr {
    public LiteralExpr {
      Objects.requireNonNull(dataType, "dataType");
    }
  }

  /**
   * A binary expression.
   *
   * @param left the left operand
   * @param op the operator
   * @param right the right operand
   */
  record BinaryExpr(PhysicalExpr left, Operator op, PhysicalExpr right) implements PhysicalExpr {
    public BinaryExpr {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(right, "right");
    }
  }

  /**
   * A NOT expression.
   *
   * @param expr the negated expression
   */
  record NotExpr(PhysicalExpr expr) implements PhysicalExpr {}

  /**
   * An IS NULL expression.
   *
   * @param expr the expression to check
   */
  record IsNullExpr(PhysicalExpr expr) implements PhysicalExpr {}

  /**
   * A CAST expression.
   *
   * @param expr the expression to cast
   * @param dataType the target Arrow type
   */
  record CastExpr(PhysicalExpr expr, ArrowType dataType) implements PhysicalExpr {}
}
