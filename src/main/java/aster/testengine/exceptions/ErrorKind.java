package aster.testengine.exceptions;

/**
 * 错误分类 - 对应引擎的错误分类表
 *
 * 每个终止结果都归入一个分类，报告器据此区分"根因失败"与"连带跳过"。
 */
public enum ErrorKind {
  CIRCULAR_DEPENDENCY(false),
  FIXTURE_CYCLE_DETECTED(false),
  FIXTURE_INITIALIZATION_FAILED(false),
  HOOK_FAILURE(false),
  TIMED_OUT(true),
  TEST_BODY_FAILURE(true),
  SKIPPED(false),
  CANCELLED(false);

  private final boolean retryable;

  ErrorKind(boolean retryable) {
    this.retryable = retryable;
  }

  /**
   * 是否允许由重试监督器重新调度
   */
  public boolean isRetryable() {
    return retryable;
  }

  /**
   * 为任意异常归类；非引擎异常一律视为测试体失败。
   *
   * @param error 捕获的异常，可为 null
   * @return 分类；error 为 null 时返回 null
   */
  public static ErrorKind of(Throwable error) {
    if (error == null) {
      return null;
    }
    if (error instanceof FixtureInitializationFailedException fixtureFailure
        && fixtureFailure.getCause() instanceof FixtureCycleDetectedException) {
      return FIXTURE_CYCLE_DETECTED;
    }
    if (error instanceof EngineException engineException) {
      return engineException.getKind();
    }
    return TEST_BODY_FAILURE;
  }
}
