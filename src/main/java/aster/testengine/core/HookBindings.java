package aster.testengine.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 测试继承的 before/after 钩子，按作用域分组，组内按 order 升序。
 */
public final class HookBindings {
  public static final HookBindings EMPTY = builder().build();

  private final Map<ScopeKind, List<Hook>> before;
  private final Map<ScopeKind, List<Hook>> after;

  private HookBindings(Map<ScopeKind, List<Hook>> before, Map<ScopeKind, List<Hook>> after) {
    this.before = before;
    this.after = after;
  }

  public List<Hook> before(ScopeKind kind) {
    return before.getOrDefault(kind, List.of());
  }

  public List<Hook> after(ScopeKind kind) {
    return after.getOrDefault(kind, List.of());
  }

  public boolean isEmpty(ScopeKind kind) {
    return before(kind).isEmpty() && after(kind).isEmpty();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * 以当前绑定为基础继续追加。
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    before.forEach((kind, hooks) -> hooks.forEach(h -> builder.before(kind, h)));
    after.forEach((kind, hooks) -> hooks.forEach(h -> builder.after(kind, h)));
    return builder;
  }

  public static final class Builder {
    private final Map<ScopeKind, List<Hook>> before = new EnumMap<>(ScopeKind.class);
    private final Map<ScopeKind, List<Hook>> after = new EnumMap<>(ScopeKind.class);

    private Builder() {
    }

    public Builder before(ScopeKind kind, Hook hook) {
      before.computeIfAbsent(kind, k -> new ArrayList<>()).add(hook);
      return this;
    }

    public Builder after(ScopeKind kind, Hook hook) {
      after.computeIfAbsent(kind, k -> new ArrayList<>()).add(hook);
      return this;
    }

    public HookBindings build() {
      return new HookBindings(freeze(before), freeze(after));
    }

    // 稳定排序：同 order 保持注册顺序
    private static Map<ScopeKind, List<Hook>> freeze(Map<ScopeKind, List<Hook>> source) {
      Map<ScopeKind, List<Hook>> frozen = new EnumMap<>(ScopeKind.class);
      source.forEach((kind, hooks) -> {
        List<Hook> sorted = new ArrayList<>(hooks);
        sorted.sort(Comparator.comparingInt(Hook::order));
        frozen.put(kind, List.copyOf(sorted));
      });
      return frozen;
    }
  }
}
