package org.apache.arrow.ballista;

/** Thrown when a plan node cannot be rendered because metadata it needs is unavailable. */
public class PlanFormatException extends BallistaException {
  private final String nodeKind;
  private final String jobId;
  private final int stageId;
  private final String reason;

  public PlanFormatException(String nodeKind, String message, Throwable cause) {
    this(nodeKind, null, -1, message, cause);
  }

  private PlanFormatException(
      String nodeKind, String jobId, int stageId, String message, Throwable cause) {
    super(formatMessage(nodeKind, jobId, stageId, message), cause);
    this.nodeKind = nodeKind;
    this.jobId = jobId;
    this.stageId = stageId;
    this.reason = message;
  }

  /**
   * Returns a copy of this exception that names the stage whose subtree failed.
   *
   * @param jobId the job of the enclosing stage
   * @param stageId the enclosing stage
   * @return a new exception with this exception as its cause
   */
  public PlanFormatException inStage(String jobId, int stageId) {
    return new PlanFormatException(nodeKind, jobId, stageId, reason, this);
  }

  /**
   * Gets the kind of the node whose rendering failed.
   *
   * @return the node kind, e.g. {@code HashAggregateExec}
   */
  public String getNodeKind() {
    return nodeKind;
  }

  /** Gets the job of the stage containing the failed node, or null outside any stage. */
  public String getJobId() {
    return jobId;
  }

  /** Gets the stage containing the failed node, or -1 outside any stage. */
  public int getStageId() {
    return stageId;
  }

  private static String formatMessage(
      String nodeKind, String jobId, int stageId, String message) {
    String where = stageId < 0 ? "" : " in stage " + jobId + "/" + stageId;
    return "Failed to format " + nodeKind + where + ": " + message;
  }
}
