package org.apache.arrow.ballista.display;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.arrow.ballista.DiagramException;
import org.apache.arrow.ballista.plan.PhysicalPlan;
import org.apache.arrow.ballista.plan.PhysicalPlan.ExtensionExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.QueryStageExec;
import org.apache.arrow.ballista.plan.PhysicalPlan.UnresolvedShuffleExec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draws the stages of a job and the shuffle dependencies between them as a Graphviz digraph.
 *
 * <p>Each stage becomes a {@code cluster<stageId>} subgraph with one box per operator and an edge
 * from every operator to its parent. Operators are numbered depth-first from zero within each
 * stage, so the stage's output operator is always {@code stage_<stageId>_exec_0}. A shuffle
 * placeholder is not drawn; instead every upstream stage it reads gets an edge from its output
 * operator to the operator consuming the placeholder.
 *
 * <p>Nodes are written in a first pass and cross-stage edges in a second pass that numbers nodes
 * exactly like the first one.
 */
public final class StageDiagram {
  private static final Logger logger = LoggerFactory.getLogger(StageDiagram.class);

  /** Node id of the operator producing a stage's output. */
  static final int SINK_NODE_ID = 0;

  static final String UNKNOWN_LABEL = "Unknown";

  /**
   * Writes the diagram for {@code stages} to a file, replacing any existing content.
   *
   * @param path the output file
   * @param stages the stages to draw, in order
   * @throws DiagramException if the file cannot be written
   */
  public void writeTo(Path path, List<QueryStageExec> stages) {
    try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      render(stages, out);
    } catch (IOException e) {
      throw new DiagramException(-1, "Failed to write stage diagram " + path + ": " + e, e);
    }
    logger.debug("Wrote diagram of {} stages to {}", stages.size(), path);
  }

  /**
   * Returns the diagram for {@code stages} as a string.
   *
   * @param stages the stages to draw, in order
   * @return the Graphviz source
   */
  public String render(List<QueryStageExec> stages) {
    StringWriter out = new StringWriter();
    render(stages, out);
    return out.toString();
  }

  /**
   * Writes the diagram for {@code stages} to {@code out}.
   *
   * @param stages the stages to draw, in order
   * @param out the destination; not closed
   * @throws DiagramException if writing fails, naming the stage being written
   */
  public void render(List<QueryStageExec> stages, Writer out) {
    write(out, -1, "digraph G {\n");

    for (QueryStageExec stage : stages) {
      int stageId = stage.stageId();
      write(out, stageId, "\tsubgraph cluster" + stageId + " {\n");
      write(out, stageId, "\t\tlabel = \"Stage " + stageId + "\";\n");
      drawOperators(out, stage.child(), stageId, new NodeIds());
      write(out, stageId, "\t}\n");
    }

    for (QueryStageExec stage : stages) {
      drawShuffleEdges(out, stage.child(), stage.stageId(), new NodeIds());
    }

    write(out, -1, "}\n");
  }

  private int drawOperators(Writer out, PhysicalPlan plan, int stageId, NodeIds ids) {
    int nodeId = ids.next();
    write(
        out,
        stageId,
        "\t\t" + node(stageId, nodeId) + " [shape=box, label=\"" + label(plan, stageId) + "\"];\n");

    for (PhysicalPlan child : plan.children()) {
      if (child instanceof UnresolvedShuffleExec) {
        continue;
      }
      int childId = drawOperators(out, child, stageId, ids);
      String edge = node(stageId, childId) + " -> " + node(stageId, nodeId);
      write(out, stageId, "\t\t" + edge + ";\n");
    }
    return nodeId;
  }

  private void drawShuffleEdges(Writer out, PhysicalPlan plan, int stageId, NodeIds ids) {
    int nodeId = ids.next();
    if (plan instanceof UnresolvedShuffleExec shuffle) {
      drawDependency(out, shuffle, stageId, nodeId);
    }

    for (PhysicalPlan child : plan.children()) {
      if (child instanceof UnresolvedShuffleExec shuffle) {
        drawDependency(out, shuffle, stageId, nodeId);
      } else {
        drawShuffleEdges(out, child, stageId, ids);
      }
    }
  }

  private void drawDependency(Writer out, UnresolvedShuffleExec shuffle, int stageId, int nodeId) {
    for (int upstream : shuffle.queryStageIds()) {
      String edge = node(upstream, SINK_NODE_ID) + " -> " + node(stageId, nodeId);
      write(out, stageId, "\t" + edge + ";\n");
    }
  }

  private static String label(PhysicalPlan plan, int stageId) {
    if (plan instanceof ExtensionExec) {
      logger.warn("Unknown operator in stage {}: {}", stageId, plan);
      return UNKNOWN_LABEL;
    }
    return plan.kindName().replace("\"", "\\\"");
  }

  private static String node(int stageId, int nodeId) {
    return "stage_" + stageId + "_exec_" + nodeId;
  }

  private static void write(Writer out, int stageId, String text) {
    try {
      out.write(text);
    } catch (IOException e) {
      throw new DiagramException(stageId, "Failed to write stage diagram: " + e, e);
    }
  }

  /** Depth-first node numbering for one traversal of one stage. */
  private static final class NodeIds {
    private int next = 0;

    int next() {
      return next++;
    }
  }
}
