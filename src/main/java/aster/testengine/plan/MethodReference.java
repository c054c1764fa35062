package aster.testengine.plan;

import aster.testengine.exceptions.EngineConfigurationException;
import aster.testengine.runtime.ErrorMessages;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Comparator;
import java.util.Set;
import java.util.function.Predicate;

/**
 * "类全名#方法名" 形式的方法引用。
 *
 * 同名重载中选取参数全部可注入且参数最多的 public 方法。
 */
final class MethodReference {
  private final String text;
  private final Method method;

  private MethodReference(String text, Method method) {
    this.text = text;
    this.method = method;
  }

  /**
   * 解析方法引用。
   *
   * @param location 计划中的位置，用于错误消息
   * @param text 方法引用文本
   * @param loader 加载测试类的类加载器
   * @param injectable 允许出现在参数列表中的类型
   * @throws EngineConfigurationException 如果引用格式错误、类不存在或没有可调用的方法
   */
  static MethodReference parse(String location, String text, ClassLoader loader, Set<Class<?>> injectable) {
    return resolve(location, text, loader, candidate -> acceptsOnly(candidate, injectable),
        "accepting " + describe(injectable));
  }

  /**
   * 解析恰好接收一个参数的静态方法引用，用于夹具释放。
   */
  static MethodReference parseUnaryStatic(String location, String text, ClassLoader loader) {
    return resolve(location, text, loader,
        candidate -> candidate.getParameterCount() == 1 && Modifier.isStatic(candidate.getModifiers()),
        "that is static and takes exactly one parameter");
  }

  private static MethodReference resolve(String location, String text, ClassLoader loader,
                                         Predicate<Method> accepts, String expectation) {
    if (text == null || text.isBlank()) {
      throw new EngineConfigurationException(ErrorMessages.invalidPlan(location, "method reference is missing"));
    }
    int hash = text.indexOf('#');
    if (hash <= 0 || hash == text.length() - 1) {
      throw new EngineConfigurationException(ErrorMessages.invalidPlan(location, "expected Class#method but got " + text));
    }
    String className = text.substring(0, hash).trim();
    String methodName = text.substring(hash + 1).trim();
    Class<?> owner;
    try {
      owner = Class.forName(className, true, loader);
    } catch (ClassNotFoundException e) {
      throw new EngineConfigurationException(ErrorMessages.invalidPlan(location, "class not found: " + className), e);
    }
    Method chosen = null;
    for (Method candidate : owner.getMethods()) {
      if (!candidate.getName().equals(methodName) || !accepts.test(candidate)) {
        continue;
      }
      if (chosen == null || candidate.getParameterCount() > chosen.getParameterCount()) {
        chosen = candidate;
      }
    }
    if (chosen == null) {
      throw new EngineConfigurationException(ErrorMessages.invalidPlan(location,
          "no public method " + methodName + " on " + className + " " + expectation));
    }
    return new MethodReference(text, chosen);
  }

  private static boolean acceptsOnly(Method method, Set<Class<?>> injectable) {
    for (Class<?> parameter : method.getParameterTypes()) {
      if (!injectable.contains(parameter)) {
        return false;
      }
    }
    return true;
  }

  private static String describe(Set<Class<?>> injectable) {
    if (injectable.isEmpty()) {
      return "no parameters";
    }
    return injectable.stream().map(Class::getSimpleName).sorted(Comparator.naturalOrder())
        .reduce((a, b) -> a + ", " + b).orElse("") + " parameters";
  }

  boolean isStatic() {
    return Modifier.isStatic(method.getModifiers());
  }

  Class<?> owner() {
    return method.getDeclaringClass();
  }

  Class<?>[] parameterTypes() {
    return method.getParameterTypes();
  }

  /**
   * 反射调用，目标方法抛出的异常原样抛出。
   */
  Object invoke(Object target, Object... arguments) throws Exception {
    try {
      return method.invoke(isStatic() ? null : target, arguments);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception exception) {
        throw exception;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }

  @Override
  public String toString() {
    return text;
  }
}
