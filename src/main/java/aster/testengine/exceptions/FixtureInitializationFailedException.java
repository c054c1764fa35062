package aster.testengine.exceptions;

import aster.testengine.runtime.ErrorMessages;

/**
 * 夹具初始化失败。同一作用域键的所有当前与后续使用者都会观察到同一个实例。
 *
 * <p>{@link #getInitiatorId()} 记录触发初始化的使用者：它报告根因失败，其余使用者报告跳过。</p>
 */
public final class FixtureInitializationFailedException extends EngineException {
  private final String scopeKey;
  private final String initiatorId;

  public FixtureInitializationFailedException(String scopeKey, String initiatorId, Throwable rootCause) {
    super(ErrorKind.FIXTURE_INITIALIZATION_FAILED,
        ErrorMessages.fixtureInitializationFailed(scopeKey, rootCause), rootCause);
    this.scopeKey = scopeKey;
    this.initiatorId = initiatorId;
  }

  public String getScopeKey() {
    return scopeKey;
  }

  public String getInitiatorId() {
    return initiatorId;
  }

  public boolean initiatedBy(String consumerId) {
    return initiatorId != null && initiatorId.equals(consumerId);
  }
}
