package aster.testengine.exceptions;

import aster.testengine.core.ScopeKind;
import aster.testengine.runtime.ErrorMessages;

/**
 * 钩子失败。before 钩子失败会扇出到作用域内所有尚未开始的测试。
 */
public final class HookFailureException extends EngineException {
  private final ScopeKind scopeKind;
  private final String scopeId;
  private final boolean before;

  public HookFailureException(ScopeKind scopeKind, String scopeId, boolean before, Throwable cause) {
    super(ErrorKind.HOOK_FAILURE, ErrorMessages.hookFailed(scopeKind, scopeId, before, cause), cause);
    this.scopeKind = scopeKind;
    this.scopeId = scopeId;
    this.before = before;
  }

  public ScopeKind getScopeKind() {
    return scopeKind;
  }

  public String getScopeId() {
    return scopeId;
  }

  public boolean isBefore() {
    return before;
  }
}
