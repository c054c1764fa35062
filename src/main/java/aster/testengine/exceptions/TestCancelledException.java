package aster.testengine.exceptions;

import aster.testengine.runtime.ErrorMessages;

/**
 * 会话级取消，永不重试。
 */
public final class TestCancelledException extends EngineException {
  private final String reason;

  public TestCancelledException(String reason) {
    super(ErrorKind.CANCELLED, ErrorMessages.cancelled(reason));
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }
}
