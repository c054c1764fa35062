package aster.testengine.report;

import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 分发到多个报告器；单个报告器抛出的异常被记录后隔离，不影响其余报告器与运行本身。
 */
public final class CompositeReportSink implements ReportSink {
  private static final Logger logger = Logger.getLogger(CompositeReportSink.class.getName());

  private final List<ReportSink> sinks;

  public CompositeReportSink(List<ReportSink> sinks) {
    this.sinks = List.copyOf(sinks);
  }

  public static CompositeReportSink of(ReportSink... sinks) {
    return new CompositeReportSink(List.of(sinks));
  }

  @Override
  public void onSessionStarted(int testCount) {
    dispatch("onSessionStarted", sink -> sink.onSessionStarted(testCount));
  }

  @Override
  public void onTestFinished(TestResultEvent event) {
    dispatch("onTestFinished", sink -> sink.onTestFinished(event));
  }

  @Override
  public void onHookScope(HookScopeEvent event) {
    dispatch("onHookScope", sink -> sink.onHookScope(event));
  }

  @Override
  public void onTestRetry(RetryEvent event) {
    dispatch("onTestRetry", sink -> sink.onTestRetry(event));
  }

  @Override
  public void onSessionFinished(RunSummary summary) {
    dispatch("onSessionFinished", sink -> sink.onSessionFinished(summary));
  }

  private void dispatch(String callback, Consumer<ReportSink> action) {
    for (ReportSink sink : sinks) {
      try {
        action.accept(sink);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, String.format("Report sink %s failed in %s",
            sink.getClass().getSimpleName(), callback), e);
      }
    }
  }
}
