package aster.testengine.exceptions;

import java.util.Objects;

/**
 * 引擎异常基类：所有会出现在报告中的引擎级失败都携带 {@link ErrorKind}。
 */
public abstract class EngineException extends RuntimeException {
  private final ErrorKind kind;

  protected EngineException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected EngineException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind getKind() {
    return kind;
  }
}
