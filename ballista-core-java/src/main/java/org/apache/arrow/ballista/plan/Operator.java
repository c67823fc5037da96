package org.apache.arrow.ballista.plan;

/** Binary operators of {@link PhysicalExpr.BinaryExpr}. */
public enum Operator {
  EQ("="),
  NOT_EQ("!="),
  LT("<"),
  LT_EQ("<="),
  GT(">"),
  GT_EQ(">="),
  PLUS("+"),
  MINUS("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  MODULO("%"),
  AND("AND"),
  OR("OR"),
  LIKE("LIKE"),
  NOT_LIKE("NOT LIKE");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  /** Returns the SQL spelling of the operator. */
  public String symbol() {
    return symbol;
  }
}
