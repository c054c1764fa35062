package aster.testengine.plan;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.Invokable;
import aster.testengine.core.InvocationContext;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 反射适配器：把 public 方法适配为 {@link Invokable}。
 *
 * 参数可以是 InvocationContext 与 CancellationToken 的任意组合；返回 CompletionStage 时等待其完成，
 * 其余返回值忽略。实例方法在当前尝试的测试类实例上调用。
 */
final class ReflectiveInvokable implements Invokable {
  private final MethodReference method;

  ReflectiveInvokable(MethodReference method) {
    this.method = method;
  }

  @Override
  public CompletionStage<Void> invoke(InvocationContext context, CancellationToken token) {
    if (!method.isStatic() && context.instance() == null) {
      return CompletableFuture.failedFuture(new IllegalStateException(
          "Instance method " + method + " needs a test instance but " + context.scopeKind() + " scope has none"));
    }
    Class<?>[] types = method.parameterTypes();
    Object[] arguments = new Object[types.length];
    for (int i = 0; i < types.length; i++) {
      arguments[i] = types[i] == CancellationToken.class ? token : context;
    }
    Object result;
    try {
      result = method.invoke(context.instance(), arguments);
    } catch (Throwable t) {
      return CompletableFuture.failedFuture(t);
    }
    if (result instanceof CompletionStage<?> stage) {
      return stage.thenApply(value -> null);
    }
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public String toString() {
    return "ReflectiveInvokable{" + method + "}";
  }
}
