package aster.testengine.core;

/**
 * 测试类实例工厂；每次尝试调用一次。
 */
@FunctionalInterface
public interface InstanceFactory {

  InstanceFactory NONE = context -> null;

  Object create(InvocationContext context) throws Exception;
}
