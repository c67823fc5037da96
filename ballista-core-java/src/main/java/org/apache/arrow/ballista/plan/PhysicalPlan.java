package org.apache.arrow.ballista.plan;

import java.util.List;
import java.util.Objects;
import org.apache.arrow.ballista.PartitionLocation;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * A node of a physical query plan.
 *
 * <p>This sealed interface is the closed set of operator kinds the stage layer understands. Each
 * variant is an immutable record that owns its children outright; trees are never shared or
 * cyclic. Operators defined elsewhere implement {@link ExtensionExec}, which the formatter and the
 * stage diagram describe generically.
 *
 * <p>Use {@code instanceof} pattern matching to inspect plan structure:
 *
 * <pre>{@code
 * if (plan instanceof PhysicalPlan.QueryStageExec stage) {
 *     System.out.println("Stage: " + stage.stageId());
 * }
 * }</pre>
 *
 * <p>A tree that contains an {@link UnresolvedShuffleExec} cannot be executed until the placeholder
 * has been replaced by concrete inputs, see {@link StageResolver}.
 */
public sealed interface PhysicalPlan {

  /**
   * Returns the direct children of this node, in order.
   *
   * @return an unmodifiable list, empty for leaves
   */
  List<PhysicalPlan> children();

  /**
   * Returns a copy of this node with its children replaced.
   *
   * @param children the new children; must have the same size as {@link #children()}
   * @return the new node
   */
  PhysicalPlan withNewChildren(List<PhysicalPlan> children);

  /**
   * Returns the operator name, e.g. {@code FilterExec}.
   *
   * @return a short human-readable kind label
   */
  default String kindName() {
    return getClass().getSimpleName();
  }

  /**
   * A file scan.
   *
   * @param format the file format read
   * @param path the table path
   * @param partitionCount number of output partitions
   * @param fileCount number of files across all partitions
   */
  record ScanExec(FileFormat format, String path, int partitionCount, int fileCount)
      implements PhysicalPlan {
    public ScanExec {
      Objects.requireNonNull(format, "format");
      Objects.requireNonNull(path, "path");
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of();
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 0);
      return this;
    }

    @Override
    public String kindName() {
      return format == FileFormat.CSV ? "CsvExec" : "ParquetExec";
    }
  }

  /**
   * Filters rows of its input by a predicate.
   *
   * @param predicate the boolean filter expression
   * @param input the input plan
   */
  record FilterExec(PhysicalExpr predicate, PhysicalPlan input) implements PhysicalPlan {
    public FilterExec {
      Objects.requireNonNull(predicate, "predicate");
      Objects.requireNonNull(input, "input");
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of(input);
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 1);
      return new FilterExec(predicate, children.get(0));
    }
  }

  /**
   * Evaluates a list of expressions against each input row.
   *
   * @param exprs the projected expressions with their output names
   * @param input the input plan
   */
  record ProjectionExec(List<NamedExpr> exprs, PhysicalPlan input) implements PhysicalPlan {
    public ProjectionExec {
      exprs = List.copyOf(exprs);
      Objects.requireNonNull(input, "input");
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of(input);
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 1);
      return new ProjectionExec(exprs, children.get(0));
    }
  }

  /**
   * A hash join of two inputs.
   *
   * @param joinType the join type
   * @param on the equi-join key pairs
   * @param left the build side
   * @param right the probe side
   */
  record HashJoinExec(JoinType joinType, List<JoinOn> on, PhysicalPlan left, PhysicalPlan right)
      implements PhysicalPlan {
    public HashJoinExec {
      Objects.requireNonNull(joinType, "joinType");
      on = List.copyOf(on);
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of(left, right);
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 2);
      return new HashJoinExec(joinType, on, children.get(0), children.get(1));
    }
  }

  /**
   * A hash aggregation.
   *
   * @param groupExprs the grouping expressions
   * @param aggrExprs the aggregate expressions
   * @param input the input plan
   */
  record HashAggregateExec(
      List<NamedExpr> groupExprs, List<AggregateExpr> aggrExprs, PhysicalPlan input)
      implements PhysicalPlan {
    public HashAggregateExec {
      groupExprs = List.copyOf(groupExprs);
      aggrExprs = List.copyOf(aggrExprs);
      Objects.requireNonNull(input, "input");
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of(input);
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 1);
      return new HashAggregateExec(groupExprs, aggrExprs, children.get(0));
    }
  }

  /**
   * Sorts its input.
   *
   * @param sortExprs the sort keys, most significant first
   * @param input the input plan
   */
  record SortExec(List<PhysicalSortExpr> sortExprs, PhysicalPlan input) implements PhysicalPlan {
    public SortExec {
      sortExprs = List.copyOf(sortExprs);
      Objects.requireNonNull(input, "input");
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of(input);
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 1);
      return new SortExec(sortExprs, children.get(0));
    }
  }

  /**
   * Combines small input batches into batches of roughly {@code targetBatchSize} rows.
   *
   * @param targetBatchSize the minimum number of rows per output batch
   * @param input the input plan
   */
  record CoalesceBatchesExec(int targetBatchSize, PhysicalPlan input) implements PhysicalPlan {
    public CoalesceBatchesExec {
      if (targetBatchSize <= 0) {
        throw new IllegalArgumentException("targetBatchSize must be positive: " + targetBatchSize);
      }
      Objects.requireNonNull(input, "input");
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of(input);
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 1);
      return new CoalesceBatchesExec(targetBatchSize, children.get(0));
    }
  }

  /**
   * Merges all input partitions into a single partition.
   *
   * @param input the input plan
   */
  record MergeExec(PhysicalPlan input) implements PhysicalPlan {
    public MergeExec {
      Objects.requireNonNull(input, "input");
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of(input);
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 1);
      return new MergeExec(children.get(0));
    }
  }

  /**
   * The root of one query stage. Its output is materialized to shuffle files.
   *
   * @param jobId the job this stage belongs to
   * @param stageId the stage id, unique within the job
   * @param child the plan executed by the stage
   */
  record QueryStageExec(String jobId, int stageId, PhysicalPlan child) implements PhysicalPlan {
    public QueryStageExec {
      Objects.requireNonNull(jobId, "jobId");
      Objects.requireNonNull(child, "child");
      if (stageId < 0) {
        throw new IllegalArgumentException("stageId must be non-negative: " + stageId);
      }
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of(child);
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 1);
      return new QueryStageExec(jobId, stageId, children.get(0));
    }
  }

  /**
   * Placeholder for the output of stages that have not completed yet.
   *
   * @param queryStageIds the upstream stages this node reads from, in order
   * @param schema the schema of the upstream output
   * @param partitionCount number of partitions this node will expose once resolved
   */
  record UnresolvedShuffleExec(List<Integer> queryStageIds, Schema schema, int partitionCount)
      implements PhysicalPlan {
    public UnresolvedShuffleExec {
      queryStageIds = List.copyOf(queryStageIds);
      if (queryStageIds.isEmpty()) {
        throw new IllegalArgumentException("UnresolvedShuffleExec needs at least one stage id");
      }
      Objects.requireNonNull(schema, "schema");
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of();
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 0);
      return this;
    }
  }

  /**
   * Reads finalized shuffle partitions. Substituted for an {@link UnresolvedShuffleExec} once its
   * upstream stages have completed.
   *
   * @param partitionLocations the partition files to read, in order
   * @param schema the schema of the partition files
   */
  record ShuffleReaderExec(List<PartitionLocation> partitionLocations, Schema schema)
      implements PhysicalPlan {
    public ShuffleReaderExec {
      partitionLocations = List.copyOf(partitionLocations);
      Objects.requireNonNull(schema, "schema");
    }

    @Override
    public List<PhysicalPlan> children() {
      return List.of();
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> children) {
      Nodes.requireArity(this, children, 0);
      return this;
    }
  }

  /**
   * An operator defined outside this library.
   *
   * <p>Formatting falls back to {@link Object#toString()} and stage diagrams label these nodes as
   * unknown.
   */
  non-sealed interface ExtensionExec extends PhysicalPlan {}
}
