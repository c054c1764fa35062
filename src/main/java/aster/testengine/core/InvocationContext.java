package aster.testengine.core;

import java.util.Map;
import java.util.Objects;

/**
 * 传递给测试体与钩子的调用上下文。
 *
 * <p>作用域钩子（SESSION/ASSEMBLY/CLASS）的上下文没有测试 ID 与实例；测试级上下文携带
 * 本次尝试的实例、已就绪的夹具以及尝试序号（从 1 开始）。</p>
 */
public final class InvocationContext {
  private final ScopeKind scopeKind;
  private final String scopeId;
  private final String testId;
  private final String classId;
  private final String assemblyId;
  private final Object instance;
  private final Map<String, Object> fixtures;
  private final int attempt;

  private InvocationContext(ScopeKind scopeKind, String scopeId, String testId, String classId,
                            String assemblyId, Object instance, Map<String, Object> fixtures, int attempt) {
    this.scopeKind = Objects.requireNonNull(scopeKind, "scopeKind");
    this.scopeId = scopeId;
    this.testId = testId;
    this.classId = classId;
    this.assemblyId = assemblyId;
    this.instance = instance;
    this.fixtures = fixtures == null ? Map.of() : Map.copyOf(fixtures);
    this.attempt = attempt;
  }

  /**
   * 构造作用域钩子的上下文。
   */
  public static InvocationContext forScope(ScopeKind kind, String scopeId, String classId, String assemblyId) {
    return new InvocationContext(kind, scopeId, null, classId, assemblyId, null, Map.of(), 0);
  }

  /**
   * 构造单次测试尝试的上下文。
   */
  public static InvocationContext forTest(TestDescriptor descriptor, Object instance,
                                          Map<String, Object> fixtures, int attempt) {
    return new InvocationContext(ScopeKind.TEST, descriptor.id(), descriptor.id(), descriptor.classId(),
        descriptor.assemblyId(), instance, fixtures, attempt);
  }

  public ScopeKind scopeKind() {
    return scopeKind;
  }

  public String scopeId() {
    return scopeId;
  }

  public String testId() {
    return testId;
  }

  public String classId() {
    return classId;
  }

  public String assemblyId() {
    return assemblyId;
  }

  public Object instance() {
    return instance;
  }

  public int attempt() {
    return attempt;
  }

  public Map<String, Object> fixtures() {
    return fixtures;
  }

  /**
   * 按声明名获取已就绪的夹具实例。
   *
   * @throws IllegalArgumentException 如果测试没有声明该夹具
   */
  public <T> T fixture(String name, Class<T> type) {
    Object value = fixtures.get(name);
    if (value == null) {
      throw new IllegalArgumentException("Fixture not declared: " + name);
    }
    return type.cast(value);
  }

  @Override
  public String toString() {
    return String.format("InvocationContext{%s %s, attempt=%d}", scopeKind, scopeId, attempt);
  }
}
