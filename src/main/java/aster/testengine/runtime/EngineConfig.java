package aster.testengine.runtime;

import aster.testengine.exceptions.EngineConfigurationException;
import java.time.Duration;
import java.util.Map;

/**
 * 测试引擎运行配置
 *
 * 环境变量（{@link #fromEnvironment()}）：
 * - ASTER_TEST_PARALLELISM：最大并行度，默认 CPU 核心数
 * - ASTER_TEST_DEFAULT_TIMEOUT_MS：未声明超时的测试使用的默认超时，0 表示无限制
 * - ASTER_TEST_CANCEL_GRACE_MS：取消后在途测试的宽限期，默认 5000
 * - ASTER_TEST_SESSION_TIMEOUT_MS：整个会话的超时，0 表示无限制
 * - ASTER_TEST_FAIL_FAST：首个失败即取消会话，默认 false
 *
 * 环境变量解析失败时打印警告并使用默认值；Builder 显式设置的非法值直接抛出异常。
 */
public final class EngineConfig {
  public static final String ENV_PARALLELISM = "ASTER_TEST_PARALLELISM";
  public static final String ENV_DEFAULT_TIMEOUT_MS = "ASTER_TEST_DEFAULT_TIMEOUT_MS";
  public static final String ENV_CANCEL_GRACE_MS = "ASTER_TEST_CANCEL_GRACE_MS";
  public static final String ENV_SESSION_TIMEOUT_MS = "ASTER_TEST_SESSION_TIMEOUT_MS";
  public static final String ENV_FAIL_FAST = "ASTER_TEST_FAIL_FAST";

  static final Duration DEFAULT_CANCELLATION_GRACE = Duration.ofMillis(5_000);

  private final int parallelism;
  private final Duration defaultTimeout;
  private final Duration cancellationGrace;
  private final Duration sessionTimeout;
  private final boolean failFast;

  private EngineConfig(Builder builder) {
    this.parallelism = builder.parallelism;
    this.defaultTimeout = builder.defaultTimeout;
    this.cancellationGrace = builder.cancellationGrace;
    this.sessionTimeout = builder.sessionTimeout;
    this.failFast = builder.failFast;
  }

  public static EngineConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static EngineConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * 从给定的环境映射读取配置（便于测试注入）。
   */
  public static EngineConfig fromEnvironment(Map<String, String> env) {
    return builder()
        .parallelism((int) readLong(env, ENV_PARALLELISM, defaultParallelism(), 1))
        .defaultTimeout(Duration.ofMillis(readLong(env, ENV_DEFAULT_TIMEOUT_MS, 0L, 0)))
        .cancellationGrace(Duration.ofMillis(readLong(env, ENV_CANCEL_GRACE_MS,
            DEFAULT_CANCELLATION_GRACE.toMillis(), 0)))
        .sessionTimeout(Duration.ofMillis(readLong(env, ENV_SESSION_TIMEOUT_MS, 0L, 0)))
        .failFast(readBoolean(env, ENV_FAIL_FAST))
        .build();
  }

  public int parallelism() {
    return parallelism;
  }

  /**
   * @return 默认超时；Duration.ZERO 表示无限制
   */
  public Duration defaultTimeout() {
    return defaultTimeout;
  }

  public Duration cancellationGrace() {
    return cancellationGrace;
  }

  /**
   * @return 会话超时；Duration.ZERO 表示无限制
   */
  public Duration sessionTimeout() {
    return sessionTimeout;
  }

  public boolean failFast() {
    return failFast;
  }

  public Builder toBuilder() {
    return builder()
        .parallelism(parallelism)
        .defaultTimeout(defaultTimeout)
        .cancellationGrace(cancellationGrace)
        .sessionTimeout(sessionTimeout)
        .failFast(failFast);
  }

  @Override
  public String toString() {
    return String.format("EngineConfig{parallelism=%d, defaultTimeout=%dms, cancellationGrace=%dms, "
            + "sessionTimeout=%dms, failFast=%s}", parallelism, defaultTimeout.toMillis(),
        cancellationGrace.toMillis(), sessionTimeout.toMillis(), failFast);
  }

  private static int defaultParallelism() {
    return Math.max(1, Runtime.getRuntime().availableProcessors());
  }

  private static long readLong(Map<String, String> env, String key, long defaultValue, long min) {
    String value = env.get(key);
    if (value == null || value.isEmpty()) {
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(value.trim());
      if (parsed >= min && parsed <= Integer.MAX_VALUE) {
        return parsed;
      }
      System.err.println("警告：" + key + " 必须 >= " + min + "，使用默认值");
      return defaultValue;
    } catch (NumberFormatException e) {
      System.err.println("警告：" + key + " 解析失败，使用默认值: " + value);
      return defaultValue;
    }
  }

  private static boolean readBoolean(Map<String, String> env, String key) {
    String value = env.get(key);
    if (value == null || value.isEmpty()) {
      return false;
    }
    String normalized = value.trim();
    if ("true".equalsIgnoreCase(normalized) || "1".equals(normalized)) {
      return true;
    }
    if (!"false".equalsIgnoreCase(normalized) && !"0".equals(normalized)) {
      System.err.println("警告：" + key + " 解析失败，使用默认值: " + value);
    }
    return false;
  }

  public static final class Builder {
    private int parallelism = defaultParallelism();
    private Duration defaultTimeout = Duration.ZERO;
    private Duration cancellationGrace = DEFAULT_CANCELLATION_GRACE;
    private Duration sessionTimeout = Duration.ZERO;
    private boolean failFast;

    private Builder() {
    }

    public Builder parallelism(int parallelism) {
      if (parallelism < 1) {
        throw new EngineConfigurationException(
            ErrorMessages.invalidConfig("parallelism", parallelism, "must be >= 1"));
      }
      this.parallelism = parallelism;
      return this;
    }

    public Builder defaultTimeout(Duration timeout) {
      this.defaultTimeout = nonNegative("defaultTimeout", timeout);
      return this;
    }

    public Builder cancellationGrace(Duration grace) {
      this.cancellationGrace = nonNegative("cancellationGrace", grace);
      return this;
    }

    public Builder sessionTimeout(Duration timeout) {
      this.sessionTimeout = nonNegative("sessionTimeout", timeout);
      return this;
    }

    public Builder failFast(boolean failFast) {
      this.failFast = failFast;
      return this;
    }

    public EngineConfig build() {
      return new EngineConfig(this);
    }

    private static Duration nonNegative(String name, Duration value) {
      if (value == null || value.isNegative()) {
        throw new EngineConfigurationException(ErrorMessages.invalidConfig(name, value, "must be >= 0"));
      }
      return value;
    }
  }
}
