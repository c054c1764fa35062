package aster.testengine.report;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一次运行的汇总：各结果计数、全部终止事件与作用域级失败。
 */
public final class RunSummary {
  private final List<TestResultEvent> results;
  private final List<HookScopeEvent> scopeFailures;
  private final Map<Outcome, Integer> counts;
  private final Duration duration;

  public RunSummary(List<TestResultEvent> results, List<HookScopeEvent> scopeFailures, Duration duration) {
    this.results = List.copyOf(results);
    this.scopeFailures = List.copyOf(scopeFailures);
    this.duration = duration;
    Map<Outcome, Integer> tally = new EnumMap<>(Outcome.class);
    for (Outcome outcome : Outcome.values()) {
      tally.put(outcome, 0);
    }
    for (TestResultEvent event : results) {
      tally.merge(event.outcome(), 1, Integer::sum);
    }
    this.counts = tally;
  }

  public List<TestResultEvent> results() {
    return results;
  }

  public List<HookScopeEvent> scopeFailures() {
    return scopeFailures;
  }

  public Duration duration() {
    return duration;
  }

  public int total() {
    return results.size();
  }

  public int count(Outcome outcome) {
    return counts.get(outcome);
  }

  public Optional<TestResultEvent> result(String testId) {
    return results.stream().filter(r -> r.testId().equals(testId)).findFirst();
  }

  /**
   * 无失败、无取消且无作用域级失败。
   */
  public boolean isSuccessful() {
    return count(Outcome.FAILED) == 0 && count(Outcome.CANCELLED) == 0 && scopeFailures.isEmpty();
  }

  @Override
  public String toString() {
    return String.format("RunSummary{total=%d, passed=%d, failed=%d, skipped=%d, cancelled=%d, scopeFailures=%d, %dms}",
        total(), count(Outcome.PASSED), count(Outcome.FAILED), count(Outcome.SKIPPED),
        count(Outcome.CANCELLED), scopeFailures.size(), duration.toMillis());
  }
}
