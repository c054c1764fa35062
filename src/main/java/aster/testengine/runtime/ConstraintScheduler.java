package aster.testengine.runtime;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.ParallelLimit;
import aster.testengine.core.TestDescriptor;
import aster.testengine.exceptions.CircularDependencyException;
import aster.testengine.exceptions.TestCancelledException;
import aster.testengine.exceptions.TestSkippedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 并行约束调度器 - 依赖与约束感知的准入控制
 *
 * 准入条件：
 * - 依赖前置全部终止且满足继续策略（否则传递跳过）
 * - 在途数量小于并行度（按逻辑在途测试计数，而非线程）
 * - 声明的互斥键全部空闲
 * - 并行分组：同一时刻只有一个分组处于活动状态
 * - 限流器：同名限流器的在途数量小于其上限
 * - 全局互斥：没有其他测试在途；等待中的全局互斥测试会阻止后续准入，使在途测试排空
 *
 * 所有状态迁移与约束的获取/释放都在同一把锁内完成，每次终止或重试后在锁内重新扫描，避免丢失唤醒。
 * 扫描顺序为优先级降序、声明顺序升序，保证相同输入与并行度下的运行可复现。
 * 报告回调与尝试分发在锁外进行。
 */
public final class ConstraintScheduler {
  private static final Logger logger = Logger.getLogger(ConstraintScheduler.class.getName());

  /**
   * 执行单次尝试，返回的结果必须是终止状态。
   */
  @FunctionalInterface
  public interface AttemptRunner {
    CompletionStage<AttemptResult> run(ExecutionNode node, CancellationToken token);
  }

  private record Admission(ExecutionNode node, int attempt) {
  }

  private final DependencyGraph graph;
  private final Map<String, ExecutionNode> nodes = new LinkedHashMap<>();
  private final List<ExecutionNode> admissionOrder;
  private final EngineConfig config;
  private final RetrySupervisor supervisor;
  private final AttemptRunner runner;
  private final Executor workers;
  private final ScheduledExecutorService timer;
  private final CancellationToken sessionToken;
  private final Consumer<ExecutionNode> terminalListener;
  private final CompletableFuture<Void> completion = new CompletableFuture<>();

  // 以下字段由 lock 保护
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, String> heldKeys = new HashMap<>();
  private final Map<String, Integer> limiterUsage = new HashMap<>();
  private int inFlight;
  private int remaining;
  private String activeGroup;
  private int activeGroupCount;
  private boolean exclusiveRunning;
  private boolean started;
  // fail-fast 已触发：停止准入，等待会话取消
  private boolean failFastTriggered;

  public ConstraintScheduler(List<TestDescriptor> descriptors, DependencyGraph graph, EngineConfig config,
                             RetrySupervisor supervisor, AttemptRunner runner, Executor workers,
                             ScheduledExecutorService timer, CancellationToken sessionToken,
                             Consumer<ExecutionNode> terminalListener) {
    this.graph = graph;
    this.config = config;
    this.supervisor = supervisor;
    this.runner = runner;
    this.workers = workers;
    this.timer = timer;
    this.sessionToken = sessionToken;
    this.terminalListener = terminalListener;
    int index = 0;
    for (TestDescriptor descriptor : descriptors) {
      nodes.put(descriptor.id(), new ExecutionNode(descriptor, index++));
    }
    List<ExecutionNode> order = new ArrayList<>(nodes.values());
    order.sort(Comparator.comparingInt((ExecutionNode n) -> n.descriptor().priority()).reversed()
        .thenComparingInt(ExecutionNode::declarationIndex));
    this.admissionOrder = List.copyOf(order);
  }

  /**
   * 启动调度：环上的测试直接失败，静态跳过的测试直接跳过，其余进入准入。
   */
  public void start() {
    List<Admission> dispatch = new ArrayList<>();
    List<ExecutionNode> terminal = new ArrayList<>();
    boolean done;
    lock.lock();
    try {
      if (started) {
        throw new IllegalStateException("Scheduler already started");
      }
      started = true;
      remaining = nodes.size();
      for (ExecutionNode node : nodes.values()) {
        TestDescriptor descriptor = node.descriptor();
        if (graph.isInCycle(node.id())) {
          finishLocked(node, NodeState.FAILED, new CircularDependencyException(graph.cycleOf(node.id())), terminal);
        } else if (descriptor.skipReason().isPresent()) {
          finishLocked(node, NodeState.SKIPPED, new TestSkippedException(descriptor.skipReason().get()), terminal);
        }
      }
      admitLocked(dispatch, terminal);
      done = remaining == 0;
    } finally {
      lock.unlock();
    }
    logger.fine(String.format("Scheduler started: %d tests, parallelism=%d", nodes.size(), config.parallelism()));
    publish(dispatch, terminal, done);
    sessionToken.onCancel(this::onSessionCancelled);
  }

  /**
   * @return 全部节点终止后完成（在最后一批终止回调之后）
   */
  public CompletableFuture<Void> completion() {
    return completion;
  }

  public Optional<ExecutionNode> node(String testId) {
    return Optional.ofNullable(nodes.get(testId));
  }

  public List<ExecutionNode> nodes() {
    return List.copyOf(nodes.values());
  }

  /**
   * 重新扫描（用于重试退避到期）。
   */
  void signal() {
    List<Admission> dispatch = new ArrayList<>();
    List<ExecutionNode> terminal = new ArrayList<>();
    boolean done;
    lock.lock();
    try {
      admitLocked(dispatch, terminal);
      done = remaining == 0;
    } finally {
      lock.unlock();
    }
    publish(dispatch, terminal, done);
  }

  // ========= 准入 =========

  private void admitLocked(List<Admission> dispatch, List<ExecutionNode> terminal) {
    if (sessionToken.isCancellationRequested()) {
      cancelUnstartedLocked(terminal);
      return;
    }
    if (failFastTriggered) {
      return;
    }
    long now = System.nanoTime();
    boolean changed;
    do {
      changed = false;
      boolean drainForExclusive = false;
      for (ExecutionNode node : admissionOrder) {
        NodeState state = node.state();
        if (state.isTerminal() || state == NodeState.RUNNING) {
          continue;
        }
        if (state == NodeState.PENDING && !node.isEligible(now)) {
          continue;
        }
        if (state != NodeState.RUNNABLE) {
          DependencyGraph.Readiness readiness = graph.readiness(node.id(), this::stateOf);
          if (readiness.status() == DependencyGraph.Status.SKIP) {
            String message = ErrorMessages.dependencyNotSatisfied(node.id(), readiness.predecessorId(),
                readiness.predecessorState());
            finishLocked(node, NodeState.SKIPPED, new TestSkippedException(message), terminal);
            changed = true;
            continue;
          }
          if (readiness.status() == DependencyGraph.Status.BLOCKED) {
            if (state == NodeState.PENDING) {
              node.transition(NodeState.PENDING, NodeState.BLOCKED);
            }
            continue;
          }
          node.transition(state, NodeState.RUNNABLE);
        }
        if (drainForExclusive) {
          continue;
        }
        TestDescriptor descriptor = node.descriptor();
        if (canAdmitLocked(descriptor)) {
          acquireLocked(descriptor);
          node.transition(NodeState.RUNNABLE, NodeState.RUNNING);
          int attempt = node.beginAttempt();
          dispatch.add(new Admission(node, attempt));
          logger.fine(String.format("Admitted %s (attempt %d, inFlight=%d)", node.id(), attempt, inFlight));
        } else if (descriptor.globallyExclusive()) {
          drainForExclusive = true;
        }
      }
    } while (changed);
  }

  private boolean canAdmitLocked(TestDescriptor descriptor) {
    if (inFlight >= config.parallelism() || exclusiveRunning) {
      return false;
    }
    if (descriptor.globallyExclusive() && inFlight > 0) {
      return false;
    }
    for (String key : descriptor.exclusionKeys()) {
      if (heldKeys.containsKey(key)) {
        return false;
      }
    }
    Optional<String> group = descriptor.parallelGroup();
    if (group.isPresent() && activeGroup != null && !activeGroup.equals(group.get())) {
      return false;
    }
    Optional<ParallelLimit> limit = descriptor.parallelLimit();
    return limit.isEmpty() || limiterUsage.getOrDefault(limit.get().name(), 0) < limit.get().maxConcurrency();
  }

  private void acquireLocked(TestDescriptor descriptor) {
    inFlight++;
    for (String key : descriptor.exclusionKeys()) {
      heldKeys.put(key, descriptor.id());
    }
    if (descriptor.globallyExclusive()) {
      exclusiveRunning = true;
    }
    descriptor.parallelGroup().ifPresent(group -> {
      activeGroup = group;
      activeGroupCount++;
    });
    descriptor.parallelLimit().ifPresent(limit -> limiterUsage.merge(limit.name(), 1, Integer::sum));
  }

  private void releaseLocked(TestDescriptor descriptor) {
    inFlight--;
    for (String key : descriptor.exclusionKeys()) {
      heldKeys.remove(key, descriptor.id());
    }
    if (descriptor.globallyExclusive()) {
      exclusiveRunning = false;
    }
    if (descriptor.parallelGroup().isPresent() && --activeGroupCount == 0) {
      activeGroup = null;
    }
    descriptor.parallelLimit().ifPresent(limit -> limiterUsage.merge(limit.name(), -1, Integer::sum));
    logger.fine(String.format("Released %s (inFlight=%d)", descriptor.id(), inFlight));
  }

  private void finishLocked(ExecutionNode node, NodeState outcome, Throwable error, List<ExecutionNode> terminal) {
    if (node.finish(outcome, error)) {
      remaining--;
      if (outcome == NodeState.FAILED && config.failFast()) {
        failFastTriggered = true;
      }
      terminal.add(node);
      logger.fine(String.format("Test %s -> %s", node.id(), outcome));
    }
  }

  private void cancelUnstartedLocked(List<ExecutionNode> terminal) {
    for (ExecutionNode node : admissionOrder) {
      NodeState state = node.state();
      if (state == NodeState.PENDING || state == NodeState.BLOCKED || state == NodeState.RUNNABLE) {
        finishLocked(node, NodeState.CANCELLED, new TestCancelledException(sessionToken.reason()), terminal);
      }
    }
  }

  private NodeState stateOf(String testId) {
    return nodes.get(testId).state();
  }

  // ========= 执行与回收 =========

  private void launch(Admission admission) {
    ExecutionNode node = admission.node();
    CancellationToken token = sessionToken.child();
    try {
      workers.execute(() -> Futures.invoke(() -> runner.run(node, token))
          .whenComplete((result, error) -> {
            token.release();
            onAttemptFinished(node, admission.attempt(),
                result != null ? result : AttemptResult.failed(Futures.unwrap(error)));
          }));
    } catch (RejectedExecutionException e) {
      token.release();
      onAttemptFinished(node, admission.attempt(), AttemptResult.cancelled(e));
    }
  }

  private void onAttemptFinished(ExecutionNode node, int attempt, AttemptResult result) {
    if (node.state() != NodeState.RUNNING || node.attempts() != attempt) {
      logger.fine(String.format("Ignoring stale attempt %d of %s", attempt, node.id()));
      return;
    }
    RetrySupervisor.Decision decision = supervisor.decide(node, result);

    List<Admission> dispatch = new ArrayList<>();
    List<ExecutionNode> terminal = new ArrayList<>();
    boolean done;
    lock.lock();
    try {
      if (node.state() != NodeState.RUNNING || node.attempts() != attempt) {
        return;
      }
      releaseLocked(node.descriptor());
      if (decision.retry()) {
        node.requeue(decision.delay(), result.failure());
        scheduleWakeUp(decision.delay());
      } else {
        finishLocked(node, result.outcome(), result.failure(), terminal);
      }
      admitLocked(dispatch, terminal);
      done = remaining == 0;
    } finally {
      lock.unlock();
    }
    publish(dispatch, terminal, done);
  }

  private void scheduleWakeUp(Duration delay) {
    if (delay.isZero()) {
      return;
    }
    timer.schedule(this::signal, delay.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * 会话取消：未开始的节点直接取消；在途节点收到协作式取消，宽限期后仍未结束则强制报告取消。
   */
  private void onSessionCancelled() {
    List<ExecutionNode> terminal = new ArrayList<>();
    List<Admission> running = new ArrayList<>();
    boolean done;
    lock.lock();
    try {
      cancelUnstartedLocked(terminal);
      for (ExecutionNode node : nodes.values()) {
        if (node.state() == NodeState.RUNNING) {
          running.add(new Admission(node, node.attempts()));
        }
      }
      done = remaining == 0;
    } finally {
      lock.unlock();
    }
    logger.info(String.format("Session cancelled (%s): %d unstarted tests cancelled, %d in flight",
        sessionToken.reason(), terminal.size(), running.size()));
    publish(List.of(), terminal, done);
    if (!running.isEmpty()) {
      timer.schedule(() -> forceCancel(running), config.cancellationGrace().toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  private void forceCancel(List<Admission> candidates) {
    List<ExecutionNode> terminal = new ArrayList<>();
    boolean done;
    lock.lock();
    try {
      for (Admission admission : candidates) {
        ExecutionNode node = admission.node();
        if (node.state() == NodeState.RUNNING && node.attempts() == admission.attempt()) {
          releaseLocked(node.descriptor());
          logger.warning(String.format("Test %s did not stop within the grace period, reporting it cancelled", node.id()));
          finishLocked(node, NodeState.CANCELLED, new TestCancelledException(sessionToken.reason()), terminal);
        }
      }
      done = remaining == 0;
    } finally {
      lock.unlock();
    }
    publish(List.of(), terminal, done);
  }

  /**
   * 锁外：通知终止回调、分发新准入的尝试，最后在全部终止时完成 completion。
   */
  private void publish(List<Admission> dispatch, List<ExecutionNode> terminal, boolean done) {
    boolean failed = false;
    for (ExecutionNode node : terminal) {
      failed |= node.state() == NodeState.FAILED;
      try {
        terminalListener.accept(node);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, String.format("Terminal listener failed for %s", node.id()), e);
      }
    }
    for (Admission admission : dispatch) {
      launch(admission);
    }
    if (done) {
      completion.complete(null);
    }
    if (failed && config.failFast() && !sessionToken.isCancellationRequested()) {
      sessionToken.cancel("fail-fast: a test failed");
    }
  }
}
