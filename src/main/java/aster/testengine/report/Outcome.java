package aster.testengine.report;

import aster.testengine.runtime.NodeState;

/**
 * 终止结果
 */
public enum Outcome {
  PASSED,
  FAILED,
  SKIPPED,
  CANCELLED;

  public static Outcome of(NodeState state) {
    return switch (state) {
      case PASSED -> PASSED;
      case FAILED -> FAILED;
      case SKIPPED -> SKIPPED;
      case CANCELLED -> CANCELLED;
      default -> throw new IllegalArgumentException("Not a terminal state: " + state);
    };
  }
}
