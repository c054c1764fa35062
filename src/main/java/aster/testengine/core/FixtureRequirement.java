package aster.testengine.core;

import java.util.Objects;

/**
 * 声明的夹具需求：以 name 注入，按 shared 决定作用域。
 *
 * @param name 注入名，测试通过 {@link InvocationContext#fixture(String, Class)} 读取
 * @param type 夹具类型
 * @param shared 共享方式
 * @param key KEYED 共享时的显式键，其余情况为 null
 */
public record FixtureRequirement(String name, FixtureType<?> type, SharedType shared, String key) {

  public FixtureRequirement {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(shared, "shared");
    if (shared == SharedType.KEYED && (key == null || key.isBlank())) {
      throw new IllegalArgumentException("KEYED fixture requirement needs a key: " + name);
    }
    if (shared != SharedType.KEYED) {
      key = null;
    }
  }

  public static FixtureRequirement of(String name, FixtureType<?> type, SharedType shared) {
    return new FixtureRequirement(name, type, shared, null);
  }

  public static FixtureRequirement keyed(String name, FixtureType<?> type, String key) {
    return new FixtureRequirement(name, type, SharedType.KEYED, key);
  }
}
