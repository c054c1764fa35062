package aster.testengine.report;

/**
 * 报告协作方接口。回调可能来自任意工作线程，实现需自行保证线程安全。
 */
public interface ReportSink {

  ReportSink NONE = new ReportSink() {
  };

  default void onSessionStarted(int testCount) {
  }

  default void onTestFinished(TestResultEvent event) {
  }

  default void onHookScope(HookScopeEvent event) {
  }

  /**
   * 重试扩展点：节点重新进入准入前调用。
   */
  default void onTestRetry(RetryEvent event) {
  }

  default void onSessionFinished(RunSummary summary) {
  }
}
