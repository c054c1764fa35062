package aster.testengine.runtime;

import java.util.EnumSet;
import java.util.Set;

/**
 * 执行节点状态机
 *
 * PENDING → BLOCKED → RUNNABLE → RUNNING → {PASSED, FAILED, SKIPPED, CANCELLED}，
 * 重试时 RUNNING → PENDING。
 *
 * RUNNABLE 表示依赖已满足、正在等待并发预算或互斥键；互斥键是否空闲在准入时判定。
 */
public enum NodeState {
  PENDING,
  BLOCKED,
  RUNNABLE,
  RUNNING,
  PASSED,
  FAILED,
  SKIPPED,
  CANCELLED;

  public boolean isTerminal() {
    return this == PASSED || this == FAILED || this == SKIPPED || this == CANCELLED;
  }

  /**
   * 校验状态迁移是否合法：只能前进，唯一的回退是重试。
   */
  public boolean canTransitionTo(NodeState next) {
    return allowedNext().contains(next);
  }

  private Set<NodeState> allowedNext() {
    return switch (this) {
      case PENDING -> EnumSet.of(BLOCKED, RUNNABLE, FAILED, SKIPPED, CANCELLED);
      case BLOCKED -> EnumSet.of(RUNNABLE, SKIPPED, CANCELLED);
      case RUNNABLE -> EnumSet.of(RUNNING, CANCELLED);
      case RUNNING -> EnumSet.of(PENDING, PASSED, FAILED, SKIPPED, CANCELLED);
      case PASSED, FAILED, SKIPPED, CANCELLED -> EnumSet.noneOf(NodeState.class);
    };
  }
}
