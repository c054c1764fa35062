package aster.testengine.runtime;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.RetryPolicy;
import aster.testengine.exceptions.ErrorKind;
import aster.testengine.exceptions.TimedOutException;
import aster.testengine.report.ReportSink;
import aster.testengine.report.RetryEvent;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * 重试/超时监督器 - 包装单次尝试的截止时间与重试策略
 *
 * 超时流程：
 * 1. 截止时间到达时取消测试体令牌（协作式取消）
 * 2. 测试体在宽限期内结束：本次尝试报告 TimedOut
 * 3. 宽限期后仍未结束：放弃该尝试并报告 TimedOut，工作线程池补充一个线程
 *
 * 重试对调度器不可见，仅表现为节点重新进入准入（不保留原有并发槽位与互斥键）。
 */
public final class RetrySupervisor {
  private static final Logger logger = Logger.getLogger(RetrySupervisor.class.getName());
  private static final int MAX_EXPONENT = 20;

  private final WorkerPool workers;
  private final ScheduledExecutorService timer;
  private final ReportSink sink;
  private final CancellationToken sessionToken;
  private final Duration abandonGrace;

  /**
   * 重试决策
   *
   * @param retry 是否重新入队
   * @param delay 重新准入前的退避时间
   */
  public record Decision(boolean retry, Duration delay) {
    static final Decision FINISH = new Decision(false, Duration.ZERO);
  }

  public RetrySupervisor(WorkerPool workers, ScheduledExecutorService timer, ReportSink sink,
                         CancellationToken sessionToken, Duration abandonGrace) {
    this.workers = workers;
    this.timer = timer;
    this.sink = sink;
    this.sessionToken = sessionToken;
    this.abandonGrace = abandonGrace;
  }

  /**
   * 在工作线程上执行测试体并施加截止时间。
   *
   * @param testId 测试 ID
   * @param timeout 超时；null 或非正数表示无限制
   * @param token 测试体令牌，超时时被取消
   * @param body 测试体调用
   * @return 测试体结果；超时时以 {@link TimedOutException} 异常完成
   */
  public CompletableFuture<Void> withTimeout(String testId, Duration timeout, CancellationToken token,
                                             Supplier<? extends CompletionStage<Void>> body) {
    CompletableFuture<Void> attempt = CompletableFuture
        .supplyAsync(() -> Futures.invoke(body), workers)
        .thenCompose(stage -> stage);
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return attempt;
    }

    CompletableFuture<Void> result = new CompletableFuture<>();
    AtomicBoolean expired = new AtomicBoolean();
    ScheduledFuture<?> deadline = timer.schedule(() -> {
      expired.set(true);
      token.cancel("timed out after " + timeout.toMillis() + "ms");
      if (attempt.isDone()) {
        return;
      }
      timer.schedule(() -> {
        if (attempt.isDone()) {
          return;
        }
        // 先补偿线程再上报超时，调用方看到结果时池已扩容
        workers.compensate(attempt);
        if (result.completeExceptionally(new TimedOutException(testId, timeout))) {
          logger.warning(String.format("Test %s ignored cancellation after timeout, attempt abandoned", testId));
        }
      }, abandonGrace.toMillis(), TimeUnit.MILLISECONDS);
    }, timeout.toMillis(), TimeUnit.MILLISECONDS);

    attempt.whenComplete((v, error) -> {
      deadline.cancel(false);
      if (expired.get()) {
        result.completeExceptionally(new TimedOutException(testId, timeout));
      } else if (error == null) {
        result.complete(null);
      } else {
        result.completeExceptionally(Futures.unwrap(error));
      }
    });
    return result;
  }

  /**
   * 根据尝试结果决定重试还是终止。
   *
   * 只有可重试的失败（测试体失败、超时）在会话未取消且尝试次数未超过上限时重试；
   * 重试前先通知报告器的 on-retry 扩展点。
   */
  public Decision decide(ExecutionNode node, AttemptResult result) {
    if (result.outcome() != NodeState.FAILED) {
      return Decision.FINISH;
    }
    ErrorKind kind = ErrorKind.of(result.failure());
    RetryPolicy policy = node.descriptor().retryPolicy();
    int attempt = node.attempts();
    if (kind == null || !kind.isRetryable() || sessionToken.isCancellationRequested()
        || attempt > policy.retryLimit()) {
      return Decision.FINISH;
    }

    long delayMs = calculateBackoff(attempt, policy.backoff(), policy.baseDelay().toMillis());
    int maxAttempts = policy.retryLimit() + 1;
    sink.onTestRetry(new RetryEvent(node.id(), attempt, maxAttempts, result.failure(), Duration.ofMillis(delayMs)));
    logger.info(String.format("Test %s failed (attempt %d/%d), retrying in %dms",
        node.id(), attempt, maxAttempts, delayMs));
    return new Decision(true, Duration.ofMillis(delayMs));
  }

  /**
   * 计算 backoff 延迟
   *
   * - NONE：立即重试
   * - LINEAR：baseDelay * attempt
   * - EXPONENTIAL：baseDelay * 2^(attempt-1)
   *
   * @param attempt 刚失败的尝试序号（从 1 开始）
   */
  static long calculateBackoff(int attempt, RetryPolicy.Backoff backoff, long baseDelayMs) {
    if (backoff == RetryPolicy.Backoff.NONE || baseDelayMs <= 0) {
      return 0L;
    }
    long normalizedAttempt = Math.max(1, attempt);
    if (backoff == RetryPolicy.Backoff.EXPONENTIAL) {
      long exponent = Math.min(normalizedAttempt - 1, MAX_EXPONENT);
      return baseDelayMs * (1L << exponent);
    }
    return baseDelayMs * normalizedAttempt;
  }
}
