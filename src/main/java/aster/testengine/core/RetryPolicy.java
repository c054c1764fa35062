package aster.testengine.core;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * 重试策略配置
 *
 * retryLimit 为允许的额外尝试次数：失败的测试最多执行 retryLimit + 1 次。
 */
public final class RetryPolicy {
  public static final RetryPolicy NONE = new RetryPolicy(0, Backoff.NONE, Duration.ZERO);

  public enum Backoff {
    NONE,
    LINEAR,
    EXPONENTIAL;

    public static Backoff parse(String value) {
      if (value == null || value.isBlank()) {
        return NONE;
      }
      return Backoff.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
  }

  private final int retryLimit;
  private final Backoff backoff;
  private final Duration baseDelay;

  public RetryPolicy(int retryLimit, Backoff backoff, Duration baseDelay) {
    if (retryLimit < 0) {
      throw new IllegalArgumentException("retryLimit must be >= 0: " + retryLimit);
    }
    this.retryLimit = retryLimit;
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
  }

  public static RetryPolicy retries(int retryLimit) {
    return retryLimit == 0 ? NONE : new RetryPolicy(retryLimit, Backoff.NONE, Duration.ZERO);
  }

  public int retryLimit() {
    return retryLimit;
  }

  public Backoff backoff() {
    return backoff;
  }

  public Duration baseDelay() {
    return baseDelay;
  }

  @Override
  public String toString() {
    return String.format("RetryPolicy{retryLimit=%d, backoff=%s, baseDelay=%dms}",
        retryLimit, backoff, baseDelay.toMillis());
  }
}
