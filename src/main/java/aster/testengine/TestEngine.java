package aster.testengine;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.TestDescriptor;
import aster.testengine.exceptions.ErrorKind;
import aster.testengine.report.CollectingReportSink;
import aster.testengine.report.CompositeReportSink;
import aster.testengine.report.Outcome;
import aster.testengine.report.ReportSink;
import aster.testengine.report.RunSummary;
import aster.testengine.report.TestResultEvent;
import aster.testengine.runtime.ConstraintScheduler;
import aster.testengine.runtime.DependencyGraph;
import aster.testengine.runtime.EngineConfig;
import aster.testengine.runtime.ExecutionNode;
import aster.testengine.runtime.Futures;
import aster.testengine.runtime.HookOrchestrator;
import aster.testengine.runtime.NodeState;
import aster.testengine.runtime.RetrySupervisor;
import aster.testengine.runtime.TestPipeline;
import aster.testengine.runtime.WorkerPool;
import aster.testengine.runtime.fixture.FixtureRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * 测试引擎 - 会话入口
 *
 * 每次 run 创建一个独立会话：依赖图、夹具注册表、钩子编排器、调度器、工作线程池与计时器都在会话开始时创建，
 * 会话结束后丢弃，多个会话之间互不影响。
 *
 * 只有配置错误（测试 ID 重复、依赖目标不存在、非法配置）会在任何测试开始前以
 * EngineConfigurationException 抛出；其余错误都作为终止结果上报。
 */
public final class TestEngine {
  private static final Logger logger = Logger.getLogger(TestEngine.class.getName());
  private static final AtomicInteger TIMER_COUNTER = new AtomicInteger();

  private final EngineConfig config;
  private final ReportSink sink;
  private final Set<CancellationToken> activeSessions = ConcurrentHashMap.newKeySet();

  public TestEngine() {
    this(EngineConfig.fromEnvironment(), ReportSink.NONE);
  }

  public TestEngine(EngineConfig config) {
    this(config, ReportSink.NONE);
  }

  public TestEngine(EngineConfig config, ReportSink sink) {
    if (config == null) {
      throw new IllegalArgumentException("config cannot be null");
    }
    this.config = config;
    this.sink = sink == null ? ReportSink.NONE : sink;
  }

  public EngineConfig config() {
    return config;
  }

  /**
   * 执行全部测试直至终止，阻塞调用线程。
   *
   * @param descriptors 发现阶段产出的测试描述
   * @return 运行汇总
   * @throws aster.testengine.exceptions.EngineConfigurationException 如果测试描述不合法
   */
  public RunSummary run(List<TestDescriptor> descriptors) {
    Session session = open(descriptors);
    try {
      return session.result.join();
    } catch (CompletionException e) {
      Throwable cause = Futures.unwrap(e);
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    } finally {
      session.shutdown();
    }
  }

  /**
   * 异步执行全部测试。配置错误仍在调用线程同步抛出。
   */
  public CompletableFuture<RunSummary> runAsync(List<TestDescriptor> descriptors) {
    Session session = open(descriptors);
    return session.result.whenComplete((summary, error) -> session.release());
  }

  /**
   * 取消所有进行中的会话：未开始的测试直接取消，在途测试收到协作式取消并在宽限期后强制结束。
   *
   * @return true 如果至少取消了一个会话
   */
  public boolean cancel(String reason) {
    boolean cancelled = false;
    for (CancellationToken token : activeSessions) {
      cancelled |= token.cancel(reason);
    }
    return cancelled;
  }

  private Session open(List<TestDescriptor> descriptors) {
    List<TestDescriptor> tests = List.copyOf(descriptors);
    DependencyGraph graph = DependencyGraph.build(tests);

    CancellationToken sessionToken = new CancellationToken();
    CollectingReportSink collector = new CollectingReportSink();
    ReportSink reporter = CompositeReportSink.of(collector, sink);
    WorkerPool workers = new WorkerPool(config.parallelism(), "aster-test-worker");
    ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "aster-test-timer-" + TIMER_COUNTER.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });

    FixtureRegistry fixtures = new FixtureRegistry(workers, sessionToken);
    HookOrchestrator orchestrator = new HookOrchestrator(workers, fixtures, reporter, sessionToken);
    orchestrator.registerTests(tests);
    RetrySupervisor supervisor = new RetrySupervisor(workers, timer, reporter, sessionToken,
        config.cancellationGrace());
    TestPipeline pipeline = new TestPipeline(orchestrator, fixtures, supervisor, workers, config.defaultTimeout());
    ConstraintScheduler scheduler = new ConstraintScheduler(tests, graph, config, supervisor, pipeline, workers,
        timer, sessionToken, node -> {
          reporter.onTestFinished(toEvent(node));
          orchestrator.exit(node.descriptor());
        });

    long startedNanos = System.nanoTime();
    activeSessions.add(sessionToken);
    reporter.onSessionStarted(tests.size());
    logger.info(String.format("Starting session: %d tests, %s", tests.size(), config));

    if (!config.sessionTimeout().isZero()) {
      long timeoutMs = config.sessionTimeout().toMillis();
      timer.schedule(() -> {
        if (sessionToken.cancel("session timed out after " + timeoutMs + "ms")) {
          logger.warning(String.format("Session timed out after %dms, cancelling remaining tests", timeoutMs));
        }
      }, timeoutMs, TimeUnit.MILLISECONDS);
    }

    scheduler.start();

    CompletableFuture<RunSummary> result = scheduler.completion()
        .thenCompose(v -> orchestrator.sessionCompletion())
        .thenApply(v -> {
          RunSummary summary = collector.summary(Duration.ofNanos(System.nanoTime() - startedNanos));
          reporter.onSessionFinished(summary);
          logger.info("Session finished: " + summary);
          return summary;
        })
        .whenComplete((summary, error) -> activeSessions.remove(sessionToken));
    return new Session(result, workers, timer, config.cancellationGrace());
  }

  static TestResultEvent toEvent(ExecutionNode node) {
    NodeState state = node.state();
    Throwable error = state == NodeState.PASSED ? null : node.failure();
    return new TestResultEvent(node.id(), node.descriptor().classId(), Outcome.of(state), node.duration(),
        node.attempts(), error, ErrorKind.of(error));
  }

  /**
   * 会话持有的执行资源
   */
  private static final class Session {
    final CompletableFuture<RunSummary> result;
    final WorkerPool workers;
    final ScheduledExecutorService timer;
    final Duration grace;

    Session(CompletableFuture<RunSummary> result, WorkerPool workers, ScheduledExecutorService timer,
            Duration grace) {
      this.result = result;
      this.workers = workers;
      this.timer = timer;
      this.grace = grace;
    }

    /**
     * 关闭线程池并等待在途任务结束，超时后强制中断。
     */
    void shutdown() {
      timer.shutdownNow();
      workers.awaitShutdown(Math.max(1L, grace.toMillis()), TimeUnit.MILLISECONDS);
    }

    /**
     * 不等待的关闭，可在会话自身的工作线程上调用。
     */
    void release() {
      timer.shutdownNow();
      workers.shutdown();
    }
  }
}
