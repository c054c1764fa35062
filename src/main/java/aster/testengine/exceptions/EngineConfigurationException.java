package aster.testengine.exceptions;

/**
 * 配置或测试描述不合法。唯一会在任何测试开始前中止运行的错误。
 */
public final class EngineConfigurationException extends IllegalArgumentException {

  public EngineConfigurationException(String message) {
    super(message);
  }

  public EngineConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
