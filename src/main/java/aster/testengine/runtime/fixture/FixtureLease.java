package aster.testengine.runtime.fixture;

import java.util.List;
import java.util.Map;

/**
 * 一次测试尝试持有的夹具集合，尝试结束时归还。
 */
public final class FixtureLease {
  static final FixtureLease EMPTY = new FixtureLease(null, null, Map.of(), List.of());

  private final FixtureRegistry registry;
  private final String consumerId;
  private final Map<String, Object> values;
  private final List<FixtureRecord> records;

  FixtureLease(FixtureRegistry registry, String consumerId, Map<String, Object> values, List<FixtureRecord> records) {
    this.registry = registry;
    this.consumerId = consumerId;
    this.values = Map.copyOf(values);
    this.records = List.copyOf(records);
  }

  /**
   * @return 注入名 -> 已就绪实例
   */
  public Map<String, Object> values() {
    return values;
  }

  /**
   * 归还所有持有的夹具；作用域已关闭且无人持有的夹具随即释放。
   */
  public void release() {
    for (FixtureRecord record : records) {
      registry.release(record, consumerId);
    }
  }
}
