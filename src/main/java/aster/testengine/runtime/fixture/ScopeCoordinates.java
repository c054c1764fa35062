package aster.testengine.runtime.fixture;

import aster.testengine.core.TestDescriptor;

/**
 * 夹具请求所在的作用域坐标，嵌套请求沿用发起测试的坐标。
 *
 * @param classId 类 ID
 * @param assemblyId 程序集 ID
 * @param attemptScope 单次尝试的标识，NONE 夹具以此为区分符
 */
public record ScopeCoordinates(String classId, String assemblyId, String attemptScope) {

  public static ScopeCoordinates forAttempt(TestDescriptor descriptor, int attempt) {
    return new ScopeCoordinates(descriptor.classId(), descriptor.assemblyId(),
        attemptScope(descriptor.id(), attempt));
  }

  public static String attemptScope(String testId, int attempt) {
    return "test:" + testId + "#" + attempt;
  }
}
