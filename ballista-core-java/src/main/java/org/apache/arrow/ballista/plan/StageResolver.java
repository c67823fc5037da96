package org.apache.arrow.ballista.plan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.arrow.ballista.BallistaException;
import org.apache.arrow.ballista.PartitionLocation;
import org.apache.arrow.ballista.plan.PhysicalPlan.ShuffleReaderExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.UnresolvedShuffleExec;

/**
 * Finds and replaces {@link UnresolvedShuffleExec} placeholders.
 *
 * <p>The scheduler decides when upstream stages are complete; this class only performs the
 * substitution once it hands over the partition locations.
 */
public final class StageResolver {

  private StageResolver() {}

  /**
   * Returns the upstream stage ids referenced by placeholders in {@code plan}.
   *
   * @param plan the plan to inspect
   * @return stage ids in depth-first order of first appearance, without duplicates
   */
  public static List<Integer> unresolvedStageIds(PhysicalPlan plan) {
    Set<Integer> ids = new LinkedHashSet<>();
    collectStageIds(plan, ids);
    return List.copyOf(ids);
  }

  /**
   * Returns whether {@code plan} can be executed, i.e. contains no placeholders.
   *
   * @param plan the plan to inspect
   * @return true if no {@link UnresolvedShuffleExec} remains
   */
  public static boolean isExecutable(PhysicalPlan plan) {
    if (plan instanceof UnresolvedShuffleExec) {
      return false;
    }
    for (PhysicalPlan child : plan.children()) {
      if (!isExecutable(child)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Replaces every placeholder with a {@link ShuffleReaderExec} over its upstream partitions.
   *
   * <p>A placeholder depending on several stages reads the partitions of each stage in the order
   * the stage ids are listed.
   *
   * @param plan the plan to resolve
   * @param upstream finalized partitions by stage id
   * @return a new plan; {@code plan} is not modified
   * @throws BallistaException if a placeholder references a stage missing from {@code upstream}
   */
  public static PhysicalPlan resolve(
      PhysicalPlan plan, Map<Integer, List<PartitionLocation>> upstream) {
    if (plan instanceof UnresolvedShuffleExec shuffle) {
      List<PartitionLocation> locations = new ArrayList<>();
      for (Integer stageId : shuffle.queryStageIds()) {
        List<PartitionLocation> stagePartitions = upstream.get(stageId);
        if (stagePartitions == null) {
          throw new BallistaException(
              "No partition locations for stage " + stageId + " required by " + shuffle);
        }
        locations.addAll(stagePartitions);
      }
      return new ShuffleReaderExec(locations, shuffle.schema());
    }

    List<PhysicalPlan> children = plan.children();
    if (children.isEmpty()) {
      return plan;
    }
    List<PhysicalPlan> resolved = new ArrayList<>(children.size());
    boolean changed = false;
    for (PhysicalPlan child : children) {
      PhysicalPlan newChild = resolve(child, upstream);
      changed |= newChild != child;
      resolved.add(newChild);
    }
    return changed ? plan.withNewChildren(resolved) : plan;
  }

  private static void collectStageIds(PhysicalPlan plan, Set<Integer> ids) {
    if (plan instanceof UnresolvedShuffleExec shuffle) {
      ids.addAll(shuffle.queryStageIds());
      return;
    }
    for (PhysicalPlan child : plan.children()) {
      collectStageIds(child, ids);
    }
  }
}
