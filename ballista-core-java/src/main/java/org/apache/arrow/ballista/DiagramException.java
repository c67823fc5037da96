package org.apache.arrow.ballista;

/** Thrown when a stage diagram cannot be written. */
public class DiagramException extends BallistaException {
  private final int stageId;

  public DiagramException(int stageId, String message, Throwable cause) {
    super(stageId >= 0 ? message + " (stage " + stageId + ")" : message, cause);
    this.stageId = stageId;
  }

  /**
   * Gets the stage being written when the failure happened.
   *
   * @return the stage id, or -1 if the failure was outside any stage cluster
   */
  public int getStageId() {
    return stageId;
  }
}
