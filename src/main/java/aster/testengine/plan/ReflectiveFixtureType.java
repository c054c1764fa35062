package aster.testengine.plan;

import aster.testengine.core.FixtureContext;
import aster.testengine.core.FixtureRequirement;
import aster.testengine.core.FixtureType;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 由计划声明的夹具类型。
 *
 * 嵌套需求在全部夹具类型创建后才绑定，因此计划中可以前向引用，循环引用留给运行时的环检测处理。
 */
final class ReflectiveFixtureType implements FixtureType<Object> {
  private final String name;
  private final MethodReference factory;
  private final MethodReference dispose;
  private volatile List<FixtureRequirement> requirements = List.of();

  ReflectiveFixtureType(String name, MethodReference factory, MethodReference dispose) {
    this.name = name;
    this.factory = factory;
    this.dispose = dispose;
  }

  void bind(List<FixtureRequirement> nested) {
    this.requirements = List.copyOf(nested);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public List<FixtureRequirement> requirements() {
    return requirements;
  }

  @Override
  public Object create(FixtureContext context) throws Exception {
    Object[] arguments = factory.parameterTypes().length == 0 ? new Object[0] : new Object[] {context};
    return factory.invoke(null, arguments);
  }

  @Override
  public CompletionStage<Void> dispose(Object instance) {
    if (dispose == null) {
      return FixtureType.super.dispose(instance);
    }
    try {
      Object result = dispose.invoke(null, instance);
      if (result instanceof CompletionStage<?> stage) {
        return stage.thenApply(value -> null);
      }
      return CompletableFuture.completedFuture(null);
    } catch (Exception e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public String toString() {
    return "FixtureType{" + name + " <- " + factory + "}";
  }
}
