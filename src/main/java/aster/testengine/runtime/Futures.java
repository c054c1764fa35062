package aster.testengine.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * CompletableFuture 辅助方法
 */
public final class Futures {

  private Futures() {
  }

  /**
   * 剥离 CompletionException / ExecutionException 包装，返回原始异常。
   */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * 调用返回 stage 的函数，同步抛出的异常转换为异常完成的 future。
   */
  public static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> call) {
    try {
      CompletionStage<T> stage = call.get();
      if (stage == null) {
        return CompletableFuture.failedFuture(new IllegalStateException("Invokable returned null stage"));
      }
      return stage.toCompletableFuture();
    } catch (Throwable t) {
      return CompletableFuture.failedFuture(t);
    }
  }
}
