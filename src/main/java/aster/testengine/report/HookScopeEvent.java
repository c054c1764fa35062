package aster.testengine.report;

import aster.testengine.core.ScopeKind;

/**
 * 钩子作用域迁移事件：某个作用域的 before 或 after 阶段执行完毕。
 */
public record HookScopeEvent(ScopeKind kind, String scopeId, Phase phase, Outcome outcome, Throwable error) {

  public enum Phase {
    BEFORE,
    AFTER
  }

  public boolean failed() {
    return outcome == Outcome.FAILED;
  }
}
