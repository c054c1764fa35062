package aster.testengine.exceptions;

import aster.testengine.runtime.ErrorMessages;
import java.util.List;

/**
 * 夹具直接或间接依赖自身。
 */
public final class FixtureCycleDetectedException extends EngineException {
  private final List<String> path;

  public FixtureCycleDetectedException(List<String> path) {
    super(ErrorKind.FIXTURE_CYCLE_DETECTED, ErrorMessages.fixtureCycle(path));
    this.path = List.copyOf(path);
  }

  /**
   * @return 成环路径，首尾为同一夹具类型
   */
  public List<String> getPath() {
    return path;
  }
}
