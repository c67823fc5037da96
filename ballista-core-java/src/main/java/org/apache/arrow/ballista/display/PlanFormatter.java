package org.apache.arrow.ballista.display;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.arrow.ballista.BallistaException;
import org.apache.arrow.ballista.PlanFormatException;
import org.apache.arrow.ballista.config.DisplayOptions;
import org.apache.arrow.ballista.plan.AggregateExpr;
import org.apache.arrow.ballista.plan.FileFormat;
import org.apache.arrow.ballista.plan.PhysicalExpr;
import org.apache.arrow.ballista.plan.PhysicalPlan;
import org.apache.arrow.ballista.plan.PhysicalPlan.CoalesceBatchesExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.FilterExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.HashAggregateExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.HashJoinExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.MergeExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.QueryStageExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.ScanExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.ShuffleReaderExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.UnresolvedShuffleExec;

/**
 * Renders physical plans as indented text for logs and diagnostics.
 *
 * <p>Every node is rendered on its own line, children one indent level deeper than their parent.
 * Operators without a dedicated rendering are described by their {@code toString()}, cut to {@link
 * DisplayOptions#maxDescriptionLength()} code points.
 *
 * <p>Example output:
 *
 * <pre>
 * QueryStageExec: job=job-1, stage=2
 *   CoalesceBatchesExec: batchSize=4096
 *     FilterExec: c0 &gt; 10
 *       CsvExec: /data/t.csv; partitions=4
 * </pre>
 */
public final class PlanFormatter {

  private final DisplayOptions options;

  public PlanFormatter() {
    this(DisplayOptions.defaults());
  }

  public PlanFormatter(DisplayOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Renders the subtree rooted at {@code plan} starting at indent level zero.
   *
   * @param plan the plan to render
   * @return the rendering, without a trailing newline
   * @throws PlanFormatException if a node in the subtree cannot be rendered
   */
  public String formatPlan(PhysicalPlan plan) {
    return formatPlan(plan, 0);
  }

  /**
   * Renders the subtree rooted at {@code plan}.
   *
   * @param plan the plan to render
   * @param indent the indent level of the first line
   * @return the rendering, without a trailing newline
   * @throws PlanFormatException if a node in the subtree cannot be rendered; it names the stage
   *     containing the node when the node sits below a {@link QueryStageExec}
   */
  public String formatPlan(PhysicalPlan plan, int indent) {
    String operator = describe(plan);
    List<PhysicalPlan> children = plan.children();

    List<String> renderedChildren = new ArrayList<>(children.size());
    for (PhysicalPlan child : children) {
      try {
        renderedChildren.add(formatPlan(child, indent + 1));
      } catch (PlanFormatException e) {
        // The innermost enclosing stage is reported
        if (plan instanceof QueryStageExec stage && e.getStageId() < 0) {
          throw e.inStage(stage.jobId(), stage.stageId());
        }
        throw e;
      }
    }

    String line = options.indent().repeat(indent) + operator;
    if (renderedChildren.isEmpty()) {
      return line;
    }
    return line + "\n" + String.join("\n", renderedChildren);
  }

  /**
   * Renders an expression.
   *
   * @param expr the expression
   * @return column names, literal values and binary expressions as text; anything else as its
   *     {@code toString()}
   */
  public String formatExpr(PhysicalExpr expr) {
    if (expr instanceof PhysicalExpr.ColumnExpr column) {
      return column.name();
    } else if (expr instanceof PhysicalExpr.LiteralExpr literal) {
      return literal.value() == null ? "NULL" : String.valueOf(literal.value());
    } else if (expr instanceof PhysicalExpr.BinaryExpr binary) {
      return formatExpr(binary.left())
          + " "
          + binary.op().symbol()
          + " "
          + formatExpr(binary.right());
    }
    return String.valueOf(expr);
  }

  /**
   * Renders an aggregate expression as its output field name followed by its arguments.
   *
   * @param expr the aggregate
   * @return e.g. {@code "total [price]"}
   * @throws BallistaException if the output field of the aggregate is not resolved
   */
  public String formatAggregateExpr(AggregateExpr expr) {
    return expr.field().getName() + " " + formatList(expr.expressions(), this::formatExpr);
  }

  private String describe(PhysicalPlan plan) {
    if (plan instanceof HashAggregateExec aggregate) {
      return "HashAggregateExec: groupBy="
          + formatList(aggregate.groupExprs(), e -> formatExpr(e.expr()))
          + ", aggrExpr="
          + formatAggregates(aggregate);
    } else if (plan instanceof HashJoinExec join) {
      return "HashJoinExec: joinType="
          + join.joinType()
          + ", on="
          + formatList(join.on(), on -> "(" + on.left() + ", " + on.right() + ")");
    } else if (plan instanceof ScanExec scan) {
      if (scan.format() == FileFormat.PARQUET) {
        return "ParquetExec: partitions=" + scan.partitionCount() + ", files=" + scan.fileCount();
      }
      return "CsvExec: " + scan.path() + "; partitions=" + scan.partitionCount();
    } else if (plan instanceof FilterExec filter) {
      return "FilterExec: " + formatExpr(filter.predicate());
    } else if (plan instanceof QueryStageExec stage) {
      return "QueryStageExec: job=" + stage.jobId() + ", stage=" + stage.stageId();
    } else if (plan instanceof UnresolvedShuffleExec shuffle) {
      return "UnresolvedShuffleExec: stages=" + shuffle.queryStageIds();
    } else if (plan instanceof ShuffleReaderExec reader) {
      return "ShuffleReaderExec: partitions=" + reader.partitionLocations().size();
    } else if (plan instanceof CoalesceBatchesExec coalesce) {
      return "CoalesceBatchesExec: batchSize=" + coalesce.targetBatchSize();
    } else if (plan instanceof MergeExec) {
      return "MergeExec";
    }
    return truncate(plan.toString(), options.maxDescriptionLength());
  }

  private String formatAggregates(HashAggregateExec aggregate) {
    try {
      return formatList(aggregate.aggrExprs(), this::formatAggregateExpr);
    } catch (BallistaException e) {
      throw new PlanFormatException(aggregate.kindName(), e.getMessage(), e);
    }
  }

  private static <T> String formatList(List<T> items, Function<T, String> format) {
    return items.stream().map(format).collect(Collectors.joining(", ", "[", "]"));
  }

  /**
   * Cuts {@code text} to at most {@code maxCodePoints} code points.
   *
   * <p>Surrogate pairs are never split and shorter text is returned unchanged.
   */
  static String truncate(String text, int maxCodePoints) {
    if (text.codePointCount(0, text.length()) <= maxCodePoints) {
      return text;
    }
    return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
  }
}
