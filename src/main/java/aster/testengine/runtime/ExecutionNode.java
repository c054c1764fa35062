package aster.testengine.runtime;

import aster.testengine.core.TestDescriptor;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 执行节点 - 包装 TestDescriptor 的可变调度状态
 *
 * 状态通过 CAS 迁移，只有成功完成迁移的线程持有该节点的修改权。
 */
public final class ExecutionNode {
  private final TestDescriptor descriptor;
  private final int declarationIndex;
  private final AtomicReference<NodeState> state = new AtomicReference<>(NodeState.PENDING);
  private final AtomicInteger attempts = new AtomicInteger();
  private volatile long startedNanos;
  private volatile long finishedNanos;
  private volatile Throwable failure;
  // 重试退避：早于该时刻不参与准入
  private volatile long eligibleAtNanos;

  ExecutionNode(TestDescriptor descriptor, int declarationIndex) {
    this.descriptor = descriptor;
    this.declarationIndex = declarationIndex;
    this.eligibleAtNanos = System.nanoTime();
  }

  public TestDescriptor descriptor() {
    return descriptor;
  }

  public String id() {
    return descriptor.id();
  }

  public int declarationIndex() {
    return declarationIndex;
  }

  public NodeState state() {
    return state.get();
  }

  public int attempts() {
    return attempts.get();
  }

  public Throwable failure() {
    return failure;
  }

  /**
   * 从首次开始到终止的耗时；从未开始的节点为 0。
   */
  public Duration duration() {
    long start = startedNanos;
    long end = finishedNanos;
    if (start == 0L || end == 0L) {
      return Duration.ZERO;
    }
    return Duration.ofNanos(Math.max(0L, end - start));
  }

  /**
   * CAS 迁移状态。
   *
   * @throws IllegalStateException 如果迁移违反状态机
   */
  boolean transition(NodeState expected, NodeState next) {
    if (!expected.canTransitionTo(next)) {
      throw new IllegalStateException(String.format("Illegal transition for %s: %s -> %s", id(), expected, next));
    }
    return state.compareAndSet(expected, next);
  }

  /**
   * 进入 RUNNING 并开始新一次尝试。
   *
   * @return 本次尝试序号（从 1 开始）
   */
  int beginAttempt() {
    if (startedNanos == 0L) {
      startedNanos = System.nanoTime();
    }
    return attempts.incrementAndGet();
  }

  /**
   * 以终止状态结束节点。
   */
  boolean finish(NodeState terminal, Throwable error) {
    NodeState current = state.get();
    if (current.isTerminal() || !current.canTransitionTo(terminal)) {
      return false;
    }
    if (!state.compareAndSet(current, terminal)) {
      return false;
    }
    this.failure = error;
    this.finishedNanos = System.nanoTime();
    return true;
  }

  /**
   * 失败后回到 PENDING，等待 delay 后重新准入。
   */
  boolean requeue(Duration delay, Throwable lastFailure) {
    if (!state.compareAndSet(NodeState.RUNNING, NodeState.PENDING)) {
      return false;
    }
    this.failure = lastFailure;
    this.eligibleAtNanos = System.nanoTime() + delay.toNanos();
    return true;
  }

  boolean isEligible(long nowNanos) {
    return nowNanos - eligibleAtNanos >= 0;
  }

  @Override
  public String toString() {
    return String.format("ExecutionNode{%s, state=%s, attempts=%d}", id(), state(), attempts());
  }
}
