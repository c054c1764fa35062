package aster.testengine.core;

import java.util.Objects;

/**
 * DependsOn 声明。默认前置失败/跳过/取消时传递跳过；proceedOnFailure 允许前置终止后照常运行。
 */
public record DependencyEdge(String testId, boolean proceedOnFailure) {

  public DependencyEdge {
    Objects.requireNonNull(testId, "testId");
  }

  public static DependencyEdge on(String testId) {
    return new DependencyEdge(testId, false);
  }

  public static DependencyEdge proceedingOnFailure(String testId) {
    return new DependencyEdge(testId, true);
  }
}
