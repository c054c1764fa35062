package aster.testengine.report;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 收集全部事件，用于构建 {@link RunSummary} 与测试断言。
 */
public final class CollectingReportSink implements ReportSink {
  private final ConcurrentLinkedQueue<TestResultEvent> results = new ConcurrentLinkedQueue<>();
  private final ConcurrentLinkedQueue<HookScopeEvent> scopeEvents = new ConcurrentLinkedQueue<>();
  private final ConcurrentLinkedQueue<RetryEvent> retries = new ConcurrentLinkedQueue<>();

  @Override
  public void onTestFinished(TestResultEvent event) {
    results.add(event);
  }

  @Override
  public void onHookScope(HookScopeEvent event) {
    scopeEvents.add(event);
  }

  @Override
  public void onTestRetry(RetryEvent event) {
    retries.add(event);
  }

  public List<TestResultEvent> results() {
    return new ArrayList<>(results);
  }

  public List<HookScopeEvent> scopeEvents() {
    return new ArrayList<>(scopeEvents);
  }

  public List<RetryEvent> retries() {
    return new ArrayList<>(retries);
  }

  public RunSummary summary(Duration duration) {
    List<HookScopeEvent> failures = new ArrayList<>();
    for (HookScopeEvent event : scopeEvents) {
      if (event.failed()) {
        failures.add(event);
      }
    }
    return new RunSummary(results(), failures, duration);
  }
}
