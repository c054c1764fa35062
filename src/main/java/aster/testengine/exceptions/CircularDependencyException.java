package aster.testengine.exceptions;

import aster.testengine.runtime.ErrorMessages;
import java.util.List;

/**
 * 测试依赖成环。仅使参与环的测试失败，不中止整个运行。
 */
public final class CircularDependencyException extends EngineException {
  private final List<String> cycle;

  public CircularDependencyException(List<String> cycle) {
    super(ErrorKind.CIRCULAR_DEPENDENCY, ErrorMessages.circularDependency(cycle));
    this.cycle = List.copyOf(cycle);
  }

  /**
   * @return 环上的测试 ID（按声明顺序）
   */
  public List<String> getCycle() {
    return cycle;
  }
}
