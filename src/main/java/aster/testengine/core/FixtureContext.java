package aster.testengine.core;

import java.util.Map;

/**
 * 夹具创建与初始化时可见的上下文：作用域键、已就绪的嵌套夹具与会话取消令牌。
 */
public record FixtureContext(String scopeKey, Map<String, Object> nested, CancellationToken token) {

  public FixtureContext {
    nested = nested == null ? Map.of() : Map.copyOf(nested);
  }

  public <T> T nested(String name, Class<T> type) {
    Object value = nested.get(name);
    if (value == null) {
      throw new IllegalArgumentException("Nested fixture not declared: " + name);
    }
    return type.cast(value);
  }
}
