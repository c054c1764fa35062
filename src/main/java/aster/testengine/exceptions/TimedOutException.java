package aster.testengine.exceptions;

import aster.testengine.runtime.ErrorMessages;
import java.time.Duration;

/**
 * 单次尝试超时（可重试）。
 */
public final class TimedOutException extends EngineException {
  private final String testId;
  private final Duration timeout;

  public TimedOutException(String testId, Duration timeout) {
    super(ErrorKind.TIMED_OUT, ErrorMessages.timedOut(testId, timeout));
    this.testId = testId;
    this.timeout = timeout;
  }

  public String getTestId() {
    return testId;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
