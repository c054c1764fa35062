package aster.testengine.core;

import java.util.Objects;

/**
 * 单个 before/after 钩子。同一作用域内按 order 升序执行。
 */
public record Hook(String name, int order, Invokable invokable) {

  public Hook {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(invokable, "invokable");
  }

  public static Hook of(String name, Invokable invokable) {
    return new Hook(name, 0, invokable);
  }

  public static Hook blocking(String name, Invokable.Body body) {
    return new Hook(name, 0, Invokable.blocking(body));
  }
}
