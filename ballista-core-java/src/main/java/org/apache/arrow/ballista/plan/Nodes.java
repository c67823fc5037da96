package org.apache.arrow.ballista.plan;

import java.util.List;

/** Helpers shared by the plan node records. */
final class Nodes {

  private Nodes() {}

  static void requireArity(PhysicalPlan node, List<PhysicalPlan> children, int expected) {
    if (children.size() != expected) {
      throw new IllegalArgumentException(
          node.kindName() + " expects " + expected + " children but got " + children.size());
    }
  }
}
