package aster.testengine.core;

import aster.testengine.exceptions.TestCancelledException;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 协作式取消令牌
 *
 * 取消信号是一次性赋值的 future：被取消后不可恢复，子令牌随父令牌一起取消。
 * 所有可能挂起的调用都显式接收令牌，并在钩子执行前、重试前、夹具等待边界处检查。
 *
 * 子令牌登记在父令牌的集合里而不是挂在信号上，用完后 {@link #release()} 即从父令牌摘除，
 * 长会话中逐次尝试创建的子令牌不会在会话令牌上累积。
 */
public final class CancellationToken {
  private final CompletableFuture<String> signal = new CompletableFuture<>();
  private final Set<CancellationToken> children = ConcurrentHashMap.newKeySet();
  private final CancellationToken parent;

  public CancellationToken() {
    this(null);
  }

  private CancellationToken(CancellationToken parent) {
    this.parent = parent;
  }

  /**
   * 创建随本令牌一起取消的子令牌；子令牌可单独取消而不影响父令牌。
   * 子令牌不再使用时应调用 {@link #release()}。
   */
  public CancellationToken child() {
    CancellationToken child = new CancellationToken(this);
    children.add(child);
    // 与 cancel 并发时，登记之后再检查一次，保证子令牌不会漏掉取消
    if (signal.isDone()) {
      children.remove(child);
      child.cancel(reason());
    }
    return child;
  }

  /**
   * 从父令牌上摘除本令牌。之后父令牌取消不再传递到本令牌；已经发生的取消不受影响。
   */
  public void release() {
    if (parent != null) {
      parent.children.remove(this);
    }
  }

  /**
   * @return 当前登记在本令牌上、尚未释放的子令牌数量
   */
  public int childCount() {
    return children.size();
  }

  /**
   * 请求取消。
   *
   * @param reason 取消原因
   * @return true 如果本次调用完成了取消
   */
  public boolean cancel(String reason) {
    if (!signal.complete(reason == null ? "cancelled" : reason)) {
      return false;
    }
    for (CancellationToken child : children) {
      child.cancel(reason());
    }
    children.clear();
    return true;
  }

  public boolean isCancellationRequested() {
    return signal.isDone();
  }

  /**
   * @return 取消原因；未取消时为 null
   */
  public String reason() {
    return signal.getNow(null);
  }

  public void throwIfCancellationRequested() {
    if (signal.isDone()) {
      throw new TestCancelledException(reason());
    }
  }

  /**
   * 注册取消回调；若已取消则立即在调用线程执行。
   */
  public void onCancel(Runnable callback) {
    signal.thenRun(callback);
  }

  /**
   * @return 取消时完成的只读视图，值为取消原因
   */
  public CompletionStage<String> whenCancelled() {
    return signal.minimalCompletionStage();
  }
}
