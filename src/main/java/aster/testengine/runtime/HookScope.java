package aster.testengine.runtime;

import aster.testengine.core.Hook;
import aster.testengine.core.ScopeKind;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 钩子作用域实例（每个会话、程序集、类各一个）
 *
 * before 使用单次赋值的完成信号：第一个进入者执行钩子，其余进入者等待同一个信号，不使用可重入锁。
 * 计数器在注册阶段确定（类：测试数；程序集：类数；会话：程序集数），归零时触发 after。
 */
public final class HookScope {
  private final ScopeKind kind;
  private final String id;
  private final String classId;
  private final String assemblyId;
  private final List<Hook> before;
  private final List<Hook> after;
  private final HookScope parent;
  private final int registered;
  private final AtomicInteger live;
  private final AtomicReference<CompletableFuture<Void>> beforeSignal = new AtomicReference<>();
  private final AtomicBoolean beforeRan = new AtomicBoolean();
  private final AtomicBoolean afterStarted = new AtomicBoolean();
  private final CompletableFuture<Void> closed = new CompletableFuture<>();

  HookScope(ScopeKind kind, String id, String classId, String assemblyId, List<Hook> before, List<Hook> after,
            HookScope parent, int registered) {
    this.kind = kind;
    this.id = id;
    this.classId = classId;
    this.assemblyId = assemblyId;
    this.before = List.copyOf(before);
    this.after = List.copyOf(after);
    this.parent = parent;
    this.registered = registered;
    this.live = new AtomicInteger(registered);
  }

  public ScopeKind kind() {
    return kind;
  }

  public String id() {
    return id;
  }

  public String classId() {
    return classId;
  }

  public String assemblyId() {
    return assemblyId;
  }

  List<Hook> beforeHooks() {
    return before;
  }

  List<Hook> afterHooks() {
    return after;
  }

  public HookScope parent() {
    return parent;
  }

  public int registered() {
    return registered;
  }

  /**
   * @return 尚未完成的成员数
   */
  public int live() {
    return live.get();
  }

  /**
   * before 阶段是否已经执行（无论成功与否）。会话取消导致未执行的不算。
   */
  public boolean beforeExecuted() {
    return beforeRan.get();
  }

  void markBeforeRan() {
    beforeRan.set(true);
  }

  public boolean afterStarted() {
    return afterStarted.get();
  }

  /**
   * @return after 阶段结束（或作用域无需 after）时完成
   */
  public CompletableFuture<Void> closed() {
    return closed;
  }

  /**
   * 确保 before 恰好执行一次；并发进入者得到同一个完成信号。
   *
   * @param runner 执行 before 钩子，仅由第一个进入者调用
   */
  CompletableFuture<Void> ensureBefore(Supplier<CompletableFuture<Void>> runner) {
    CompletableFuture<Void> existing = beforeSignal.get();
    if (existing != null) {
      return existing;
    }
    CompletableFuture<Void> signal = new CompletableFuture<>();
    if (!beforeSignal.compareAndSet(null, signal)) {
      return beforeSignal.get();
    }
    Futures.invoke(runner).whenComplete((v, error) -> {
      if (error == null) {
        signal.complete(null);
      } else {
        signal.completeExceptionally(Futures.unwrap(error));
      }
    });
    return signal;
  }

  /**
   * 一个成员完成。
   *
   * @return true 如果本次调用使计数归零并取得 after 的执行权
   */
  boolean completeMember() {
    int remaining = live.decrementAndGet();
    if (remaining < 0) {
      throw new IllegalStateException(String.format("%s scope %s completed more members than registered", kind, id));
    }
    return remaining == 0 && afterStarted.compareAndSet(false, true);
  }

  void markClosed() {
    closed.complete(null);
  }

  @Override
  public String toString() {
    return String.format("HookScope{%s %s, live=%d/%d}", kind, id, live(), registered);
  }
}
