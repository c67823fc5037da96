package org.apache.arrow.ballista.plan;

import java.util.Objects;

/**
 * One equi-join key pair.
 *
 * @param left the column name on the left input
 * @param right the column name on the right input
 */
public record JoinOn(String left, String right) {
  public JoinOn {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }
}
