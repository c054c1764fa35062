package aster.testengine.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * 工作线程池 - 大小等于配置的并行度
 *
 * 超时后仍未返回的同步测试体会一直占用线程；每个被放弃的尝试临时补充一个线程，
 * 该尝试最终结束时再收回，保证在途预算与实际可用线程一致。
 */
public final class WorkerPool implements Executor {
  private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

  private final ThreadPoolExecutor executor;
  private final int baseSize;
  private final AtomicInteger borrowed = new AtomicInteger();

  public WorkerPool(int size, String namePrefix) {
    this.baseSize = Math.max(1, size);
    this.executor = new ThreadPoolExecutor(baseSize, baseSize, 0L, TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(), daemonThreads(namePrefix));
  }

  @Override
  public void execute(Runnable command) {
    executor.execute(command);
  }

  /**
   * 为被放弃但仍在运行的尝试补充一个线程，直到该尝试结束。
   */
  public void compensate(CompletableFuture<?> abandoned) {
    resize(borrowed.incrementAndGet());
    logger.fine(String.format("Worker pool grown to %d threads for an abandoned attempt", baseSize + borrowed.get()));
    abandoned.whenComplete((v, e) -> resize(borrowed.decrementAndGet()));
  }

  /**
   * @return 当前线程上限
   */
  public int size() {
    return executor.getMaximumPoolSize();
  }

  private synchronized void resize(int extra) {
    int target = baseSize + Math.max(0, extra);
    if (target > executor.getMaximumPoolSize()) {
      executor.setMaximumPoolSize(target);
      executor.setCorePoolSize(target);
    } else {
      executor.setCorePoolSize(target);
      executor.setMaximumPoolSize(target);
    }
  }

  /**
   * 关闭线程池，等待在途任务结束，超时后强制中断。
   */
  public void awaitShutdown(long timeout, TimeUnit unit) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(timeout, unit)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * 不等待的关闭，可在池内线程上调用；已提交的任务继续执行。
   */
  public void shutdown() {
    executor.shutdown();
  }

  public boolean isShutdown() {
    return executor.isShutdown();
  }

  static ThreadFactory daemonThreads(String namePrefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
