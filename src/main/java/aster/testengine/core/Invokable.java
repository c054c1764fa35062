package aster.testengine.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 可调用单元：测试体与钩子的统一签名。
 *
 * 由代码生成或反射适配器实现；引擎只依赖此接口。正常完成表示成功，异常完成携带捕获的错误。
 */
@FunctionalInterface
public interface Invokable {

  Invokable NO_OP = (context, token) -> CompletableFuture.completedFuture(null);

  CompletionStage<Void> invoke(InvocationContext context, CancellationToken token);

  /**
   * 同步测试体适配：在调用线程执行，异常转换为异常完成的 stage。
   */
  static Invokable blocking(Body body) {
    return (context, token) -> {
      try {
        body.run(context, token);
        return CompletableFuture.completedFuture(null);
      } catch (Throwable t) {
        return CompletableFuture.failedFuture(t);
      }
    };
  }

  @FunctionalInterface
  interface Body {
    void run(InvocationContext context, CancellationToken token) throws Exception;
  }
}
