package aster.testengine.runtime;

/**
 * 单次尝试的结果
 *
 * @param outcome 终止状态（PASSED / FAILED / SKIPPED / CANCELLED）
 * @param failure 捕获的错误，通过时为 null
 */
public record AttemptResult(NodeState outcome, Throwable failure) {

  private static final AttemptResult PASSED = new AttemptResult(NodeState.PASSED, null);

  public AttemptResult {
    if (!outcome.isTerminal()) {
      throw new IllegalArgumentException("Attempt outcome must be terminal: " + outcome);
    }
  }

  public static AttemptResult passed() {
    return PASSED;
  }

  public static AttemptResult failed(Throwable failure) {
    return new AttemptResult(NodeState.FAILED, failure);
  }

  public static AttemptResult skipped(Throwable reason) {
    return new AttemptResult(NodeState.SKIPPED, reason);
  }

  public static AttemptResult cancelled(Throwable reason) {
    return new AttemptResult(NodeState.CANCELLED, reason);
  }
}
