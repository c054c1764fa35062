package aster.testengine.runtime.fixture;

import aster.testengine.core.SharedType;
import java.util.Objects;

/**
 * 夹具作用域键：夹具类型名 + 共享方式 + 区分符。
 *
 * 区分符：NONE 为测试尝试标识（嵌套时为父夹具的键），PER_CLASS 为类 ID，
 * PER_ASSEMBLY 为程序集 ID，PER_SESSION 为空串，KEYED 为显式键。
 */
public record ScopeKey(String typeName, SharedType shared, String discriminator) {

  public ScopeKey {
    Objects.requireNonNull(typeName, "typeName");
    Objects.requireNonNull(shared, "shared");
    Objects.requireNonNull(discriminator, "discriminator");
  }

  @Override
  public String toString() {
    return discriminator.isEmpty()
        ? typeName + "[" + shared + "]"
        : typeName + "[" + shared + ":" + discriminator + "]";
  }
}
