package aster.testengine.core;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 夹具类型：由外部提供的共享资源定义。
 *
 * <p>引擎保证同一作用域键只调用一次 {@link #create} 与 {@link #initialize}，并在作用域关闭时调用一次
 * {@link #dispose}。{@link #name()} 是夹具类型的身份，用于作用域键与循环检测。</p>
 *
 * <p>就绪后的实例由作者保证线程安全，引擎不串行化对它的并发使用。</p>
 *
 * @param <T> 实例类型
 */
public interface FixtureType<T> {

  String name();

  /**
   * 本夹具依赖的嵌套夹具，在本夹具创建前全部就绪。
   */
  default List<FixtureRequirement> requirements() {
    return List.of();
  }

  T create(FixtureContext context) throws Exception;

  /**
   * 可选的异步初始化。
   */
  default CompletionStage<Void> initialize(T instance, FixtureContext context) {
    return CompletableFuture.completedFuture(null);
  }

  /**
   * 可选的异步释放；默认关闭 AutoCloseable 实例。
   */
  default CompletionStage<Void> dispose(T instance) {
    if (instance instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        return CompletableFuture.failedFuture(e);
      }
    }
    return CompletableFuture.completedFuture(null);
  }

  /**
   * 以工厂函数构造无嵌套依赖的夹具类型。
   */
  static <T> FixtureType<T> of(String name, Factory<T> factory) {
    return of(name, List.of(), factory);
  }

  static <T> FixtureType<T> of(String name, List<FixtureRequirement> requirements, Factory<T> factory) {
    List<FixtureRequirement> nested = List.copyOf(requirements);
    return new FixtureType<>() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public List<FixtureRequirement> requirements() {
        return nested;
      }

      @Override
      public T create(FixtureContext context) throws Exception {
        return factory.create(context);
      }

      @Override
      public String toString() {
        return "FixtureType{" + name + "}";
      }
    };
  }

  @FunctionalInterface
  interface Factory<T> {
    T create(FixtureContext context) throws Exception;
  }
}
