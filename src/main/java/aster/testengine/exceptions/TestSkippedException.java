package aster.testengine.exceptions;

/**
 * 跳过原因（静态跳过或前置依赖未满足）。
 */
public final class TestSkippedException extends EngineException {

  public TestSkippedException(String message) {
    super(ErrorKind.SKIPPED, message);
  }
}
