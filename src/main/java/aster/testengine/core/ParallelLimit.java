package aster.testengine.core;

import java.util.Objects;

/**
 * 具名并发上限：同名限流器的测试同时最多运行 maxConcurrency 个。
 */
public record ParallelLimit(String name, int maxConcurrency) {

  public ParallelLimit {
    Objects.requireNonNull(name, "name");
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1: " + maxConcurrency);
    }
  }
}
