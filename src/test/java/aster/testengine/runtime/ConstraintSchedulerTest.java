package aster.testengine.runtime;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.DependencyEdge;
import aster.testengine.core.InvocationContext;
import aster.testengine.core.ParallelLimit;
import aster.testengine.core.TestDescriptor;
import aster.testengine.exceptions.CircularDependencyException;
import aster.testengine.exceptions.TestCancelledException;
import aster.testengine.exceptions.TestSkippedException;
import aster.testengine.report.CollectingReportSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConstraintScheduler 单元测试
 *
 * 只执行测试体（不含钩子与夹具），验证准入控制：并行度上限、互斥键、全局互斥、并行分组、限流器、
 * 优先级、依赖跳过传递、重试次数、会话取消与 fail-fast。
 */
public class ConstraintSchedulerTest {

  private static final ConstraintScheduler.AttemptRunner BODY_ONLY = (node, token) -> Futures
      .invoke(() -> node.descriptor().body().invoke(
          InvocationContext.forTest(node.descriptor(), null, Map.of(), node.attempts()), token))
      .handle((v, error) -> error == null ? AttemptResult.passed()
          : TestPipeline.classify(node.id(), Futures.unwrap(error)));

  private WorkerPool workers;
  private ScheduledExecutorService timer;
  private CancellationToken session;
  private CollectingReportSink sink;
  private List<ExecutionNode> terminal;

  @BeforeEach
  public void setUp() {
    timer = Executors.newSingleThreadScheduledExecutor();
    session = new CancellationToken();
    sink = new CollectingReportSink();
    terminal = Collections.synchronizedList(new ArrayList<>());
  }

  @AfterEach
  public void tearDown() {
    timer.shutdownNow();
    if (workers != null) {
      workers.awaitShutdown(2, TimeUnit.SECONDS);
    }
  }

  private ConstraintScheduler start(List<TestDescriptor> tests, EngineConfig config) {
    workers = new WorkerPool(config.parallelism(), "scheduler-test");
    RetrySupervisor supervisor = new RetrySupervisor(workers, timer, sink, session, config.cancellationGrace());
    ConstraintScheduler scheduler = new ConstraintScheduler(tests, DependencyGraph.build(tests), config, supervisor,
        BODY_ONLY, workers, timer, session, terminal::add);
    scheduler.start();
    return scheduler;
  }

  private ConstraintScheduler run(List<TestDescriptor> tests, int parallelism) throws Exception {
    ConstraintScheduler scheduler = start(tests, EngineConfig.builder().parallelism(parallelism).build());
    scheduler.completion().get(10, TimeUnit.SECONDS);
    return scheduler;
  }

  private static NodeState stateOf(ConstraintScheduler scheduler, String id) {
    return scheduler.node(id).orElseThrow().state();
  }

  /**
   * 记录同时运行的测试体数量
   */
  private static final class ConcurrencyMeter {
    final AtomicInteger current = new AtomicInteger();
    final AtomicInteger max = new AtomicInteger();

    void enter() {
      max.accumulateAndGet(current.incrementAndGet(), Math::max);
    }

    void exit() {
      current.decrementAndGet();
    }

    void work(long millis) throws InterruptedException {
      enter();
      try {
        Thread.sleep(millis);
      } finally {
        exit();
      }
    }
  }

  /**
   * 测试：在途测试数量不超过并行度。
   */
  @Test
  public void testParallelismCap() throws Exception {
    ConcurrencyMeter meter = new ConcurrencyMeter();
    List<TestDescriptor> tests = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      tests.add(TestDescriptor.builder("t" + i, "Cap").blockingBody((ctx, token) -> meter.work(40)).build());
    }

    ConstraintScheduler scheduler = run(tests, 3);

    assertTrue(meter.max.get() <= 3, "并发数不应超过并行度，实际 " + meter.max.get());
    assertTrue(meter.max.get() > 1, "应存在并行执行");
    for (ExecutionNode node : scheduler.nodes()) {
      assertEquals(NodeState.PASSED, node.state());
      assertEquals(1, node.attempts());
    }
    assertEquals(8, terminal.size(), "每个节点恰好上报一次终止");
  }

  /**
   * 测试：共享互斥键的测试从不并发，无键测试不受影响。
   */
  @Test
  public void testExclusionKeys() throws Exception {
    ConcurrencyMeter keyed = new ConcurrencyMeter();
    ConcurrencyMeter all = new ConcurrencyMeter();
    List<TestDescriptor> tests = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      tests.add(TestDescriptor.builder("db" + i, "Keys").notInParallel("database")
          .blockingBody((ctx, token) -> {
            all.enter();
            try {
              keyed.work(20);
            } finally {
              all.exit();
            }
          }).build());
      tests.add(TestDescriptor.builder("free" + i, "Keys").blockingBody((ctx, token) -> all.work(20)).build());
    }

    run(tests, 4);

    assertEquals(1, keyed.max.get(), "相同互斥键的测试必须串行");
    assertTrue(all.max.get() > 1, "无互斥键的测试可以并行");
  }

  /**
   * 测试：类级互斥只串行同一类的测试。
   */
  @Test
  public void testClassExclusivity() throws Exception {
    ConcurrencyMeter serialClass = new ConcurrencyMeter();
    List<TestDescriptor> tests = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      tests.add(TestDescriptor.builder("s" + i, "SerialClass").notInParallelWithinClass()
          .blockingBody((ctx, token) -> serialClass.work(15)).build());
    }

    run(tests, 4);

    assertEquals(1, serialClass.max.get(), "同一类的测试应串行");
  }

  /**
   * 测试：全局互斥测试运行时没有任何其他测试在途。
   */
  @Test
  public void testGlobalExclusive() throws Exception {
    ConcurrencyMeter meter = new ConcurrencyMeter();
    AtomicBoolean exclusiveActive = new AtomicBoolean();
    AtomicBoolean violation = new AtomicBoolean();
    List<TestDescriptor> tests = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      tests.add(TestDescriptor.builder("before" + i, "Global").blockingBody((ctx, token) -> {
        if (exclusiveActive.get()) {
          violation.set(true);
        }
        meter.work(30);
      }).build());
    }
    tests.add(TestDescriptor.builder("exclusive", "Global").notInParallel().blockingBody((ctx, token) -> {
      exclusiveActive.set(true);
      if (meter.current.get() != 0) {
        violation.set(true);
      }
      Thread.sleep(30);
      exclusiveActive.set(false);
    }).build());
    for (int i = 0; i < 3; i++) {
      tests.add(TestDescriptor.builder("after" + i, "Global").blockingBody((ctx, token) -> {
        if (exclusiveActive.get()) {
          violation.set(true);
        }
        meter.work(30);
      }).build());
    }

    ConstraintScheduler scheduler = run(tests, 4);

    assertFalse(violation.get(), "全局互斥测试不得与其他测试重叠");
    assertEquals(NodeState.PASSED, stateOf(scheduler, "exclusive"));
  }

  /**
   * 测试：同一时刻只有一个并行分组处于活动状态，同组测试之间可以并行。
   */
  @Test
  public void testParallelGroups() throws Exception {
    Map<String, AtomicInteger> active = new ConcurrentHashMap<>(Map.of("red", new AtomicInteger(), "blue", new AtomicInteger()));
    AtomicBoolean violation = new AtomicBoolean();
    AtomicInteger maxRed = new AtomicInteger();
    List<TestDescriptor> tests = new ArrayList<>();
    for (String group : List.of("red", "blue")) {
      String other = group.equals("red") ? "blue" : "red";
      for (int i = 0; i < 3; i++) {
        tests.add(TestDescriptor.builder(group + i, "Groups").parallelGroup(group).blockingBody((ctx, token) -> {
          int now = active.get(group).incrementAndGet();
          if (group.equals("red")) {
            maxRed.accumulateAndGet(now, Math::max);
          }
          if (active.get(other).get() > 0) {
            violation.set(true);
          }
          Thread.sleep(30);
          active.get(group).decrementAndGet();
        }).build());
      }
    }

    run(tests, 6);

    assertFalse(violation.get(), "不同分组不得同时活动");
    assertTrue(maxRed.get() > 1, "同组测试应并行执行");
  }

  /**
   * 测试：限流器限制同名限流器下的并发数。
   */
  @Test
  public void testParallelLimiter() throws Exception {
    ConcurrencyMeter browser = new ConcurrencyMeter();
    List<TestDescriptor> tests = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      tests.add(TestDescriptor.builder("ui" + i, "Limiter").parallelLimit(new ParallelLimit("browser", 2))
          .blockingBody((ctx, token) -> browser.work(30)).build());
    }

    run(tests, 6);

    assertEquals(2, browser.max.get(), "限流器上限为 2");
  }

  /**
   * 测试：并行度为 1 时按优先级降序、声明顺序升序执行。
   */
  @Test
  public void testPriorityOrder() throws Exception {
    List<String> order = Collections.synchronizedList(new ArrayList<>());
    List<TestDescriptor> tests = List.of(
        TestDescriptor.builder("low", "Priority").blockingBody((ctx, token) -> order.add("low")).build(),
        TestDescriptor.builder("mid-a", "Priority").priority(5).blockingBody((ctx, token) -> order.add("mid-a")).build(),
        TestDescriptor.builder("high", "Priority").priority(10).blockingBody((ctx, token) -> order.add("high")).build(),
        TestDescriptor.builder("mid-b", "Priority").priority(5).blockingBody((ctx, token) -> order.add("mid-b")).build());

    run(tests, 1);

    assertEquals(List.of("high", "mid-a", "mid-b", "low"), order);
  }

  /**
   * 测试：依赖按顺序执行，失败沿依赖链传递跳过，proceedOnFailure 的后续仍会运行。
   */
  @Test
  public void testDependencyOrderAndSkipPropagation() throws Exception {
    List<String> order = Collections.synchronizedList(new ArrayList<>());
    AtomicBoolean skippedBodyRan = new AtomicBoolean();
    List<TestDescriptor> tests = List.of(
        TestDescriptor.builder("C", "Deps").dependsOn("B").blockingBody((ctx, token) -> skippedBodyRan.set(true)).build(),
        TestDescriptor.builder("B", "Deps").dependsOn("A").blockingBody((ctx, token) -> skippedBodyRan.set(true)).build(),
        TestDescriptor.builder("A", "Deps").blockingBody((ctx, token) -> {
          order.add("A");
          throw new AssertionError("A failed");
        }).build(),
        TestDescriptor.builder("cleanup", "Deps").dependsOn(DependencyEdge.proceedingOnFailure("A"))
            .blockingBody((ctx, token) -> order.add("cleanup")).build());

    ConstraintScheduler scheduler = run(tests, 4);

    assertEquals(NodeState.FAILED, stateOf(scheduler, "A"));
    assertEquals(NodeState.SKIPPED, stateOf(scheduler, "B"));
    assertEquals(NodeState.SKIPPED, stateOf(scheduler, "C"), "跳过应传递");
    assertEquals(NodeState.PASSED, stateOf(scheduler, "cleanup"));
    assertFalse(skippedBodyRan.get(), "被跳过的测试体不得执行");
    assertEquals(List.of("A", "cleanup"), order);

    ExecutionNode skipped = scheduler.node("B").orElseThrow();
    assertInstanceOf(TestSkippedException.class, skipped.failure());
    assertTrue(skipped.failure().getMessage().contains("dependency A ended FAILED"), "跳过原因应指出前置测试");
    assertEquals(0, skipped.attempts());
  }

  /**
   * 测试：循环依赖上的测试失败，环外测试正常运行，依赖环成员的测试被跳过。
   */
  @Test
  public void testCycleMembersFail() throws Exception {
    List<TestDescriptor> tests = List.of(
        TestDescriptor.builder("A", "Cycle").dependsOn("B").build(),
        TestDescriptor.builder("B", "Cycle").dependsOn("A").build(),
        TestDescriptor.builder("D", "Cycle").dependsOn("A").build(),
        TestDescriptor.builder("free", "Cycle").build());

    ConstraintScheduler scheduler = run(tests, 2);

    ExecutionNode a = scheduler.node("A").orElseThrow();
    assertEquals(NodeState.FAILED, a.state());
    assertInstanceOf(CircularDependencyException.class, a.failure());
    assertTrue(a.failure().getMessage().contains("A -> B -> A"), "错误消息应包含环路径");
    assertEquals(NodeState.FAILED, stateOf(scheduler, "B"));
    assertEquals(NodeState.SKIPPED, stateOf(scheduler, "D"));
    assertEquals(NodeState.PASSED, stateOf(scheduler, "free"));
  }

  /**
   * 测试：重试上限 R 的测试最多执行 R+1 次；间歇失败的测试在重试后通过。
   */
  @Test
  public void testRetryAttempts() throws Exception {
    AtomicInteger alwaysFails = new AtomicInteger();
    AtomicInteger flaky = new AtomicInteger();
    List<TestDescriptor> tests = List.of(
        TestDescriptor.builder("broken", "Retry").retries(2).blockingBody((ctx, token) -> {
          alwaysFails.incrementAndGet();
          throw new AssertionError("always");
        }).build(),
        TestDescriptor.builder("flaky", "Retry").retries(3).blockingBody((ctx, token) -> {
          if (flaky.incrementAndGet() < 2) {
            throw new AssertionError("first attempt fails");
          }
        }).build(),
        TestDescriptor.builder("dependent", "Retry").dependsOn("flaky").build());

    ConstraintScheduler scheduler = run(tests, 2);

    assertEquals(3, alwaysFails.get(), "重试上限 2 时共执行 3 次");
    assertEquals(3, scheduler.node("broken").orElseThrow().attempts());
    assertEquals(NodeState.FAILED, stateOf(scheduler, "broken"));
    assertEquals(NodeState.PASSED, stateOf(scheduler, "flaky"));
    assertEquals(2, scheduler.node("flaky").orElseThrow().attempts());
    assertEquals(NodeState.PASSED, stateOf(scheduler, "dependent"), "重试成功后后续测试照常运行");
    assertEquals(3, sink.retries().size(), "broken 重试 2 次，flaky 重试 1 次");
    assertEquals(0, session.childCount(), "每次尝试结束后其令牌应从会话令牌上释放");
  }

  /**
   * 测试：静态跳过的测试不执行测试体。
   */
  @Test
  public void testStaticSkip() throws Exception {
    AtomicBoolean ran = new AtomicBoolean();
    List<TestDescriptor> tests = List.of(
        TestDescriptor.builder("ignored", "Skip").skip("not on this platform").blockingBody((ctx, token) -> ran.set(true)).build(),
        TestDescriptor.builder("after", "Skip").dependsOn("ignored").build());

    ConstraintScheduler scheduler = run(tests, 1);

    assertEquals(NodeState.SKIPPED, stateOf(scheduler, "ignored"));
    assertEquals(NodeState.SKIPPED, stateOf(scheduler, "after"));
    assertFalse(ran.get());
  }

  /**
   * 测试：会话取消后未开始的测试直接取消，响应取消的在途测试以取消结束。
   */
  @Test
  public void testSessionCancellation() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    List<TestDescriptor> tests = new ArrayList<>();
    tests.add(TestDescriptor.builder("running", "Cancel").body((ctx, token) -> {
      started.countDown();
      return token.whenCancelled().thenAccept(reason -> {
        throw new TestCancelledException(reason);
      });
    }).build());
    for (int i = 0; i < 3; i++) {
      tests.add(TestDescriptor.builder("queued" + i, "Cancel").build());
    }

    ConstraintScheduler scheduler = start(tests, EngineConfig.builder().parallelism(1).build());
    assertTrue(started.await(5, TimeUnit.SECONDS));
    session.cancel("user requested");
    scheduler.completion().get(10, TimeUnit.SECONDS);

    for (ExecutionNode node : scheduler.nodes()) {
      assertEquals(NodeState.CANCELLED, node.state(), node.id() + " 应被取消");
    }
    assertEquals(0, scheduler.node("queued0").orElseThrow().attempts(), "未开始的测试不应执行");
  }

  /**
   * 测试：忽略取消的在途测试在宽限期后被强制报告为取消，之后到达的结果被忽略。
   */
  @Test
  public void testForceCancelAfterGrace() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    List<TestDescriptor> tests = List.of(TestDescriptor.builder("stubborn", "Cancel").blockingBody((ctx, token) -> {
      started.countDown();
      release.await(10, TimeUnit.SECONDS);
    }).build());
    EngineConfig config = EngineConfig.builder().parallelism(1).cancellationGrace(Duration.ofMillis(100)).build();

    ConstraintScheduler scheduler = start(tests, config);
    assertTrue(started.await(5, TimeUnit.SECONDS));
    session.cancel("shutdown");
    scheduler.completion().get(5, TimeUnit.SECONDS);

    assertEquals(NodeState.CANCELLED, stateOf(scheduler, "stubborn"), "宽限期后应强制取消");
    release.countDown();
    Thread.sleep(50);
    assertEquals(NodeState.CANCELLED, stateOf(scheduler, "stubborn"), "迟到的结果不得改变终止状态");
    assertEquals(1, terminal.size(), "终止只上报一次");
  }

  /**
   * 测试：fail-fast 在首个失败后取消会话。
   */
  @Test
  public void testFailFast() throws Exception {
    List<TestDescriptor> tests = List.of(
        TestDescriptor.builder("first", "FailFast").blockingBody((ctx, token) -> {
          throw new AssertionError("boom");
        }).build(),
        TestDescriptor.builder("second", "FailFast").build(),
        TestDescriptor.builder("third", "FailFast").build());

    ConstraintScheduler scheduler = start(tests, EngineConfig.builder().parallelism(1).failFast(true).build());
    scheduler.completion().get(10, TimeUnit.SECONDS);

    assertEquals(NodeState.FAILED, stateOf(scheduler, "first"));
    assertEquals(NodeState.CANCELLED, stateOf(scheduler, "second"));
    assertEquals(NodeState.CANCELLED, stateOf(scheduler, "third"));
    assertTrue(session.isCancellationRequested());
  }

  /**
   * 测试：completion 在全部终止回调之后完成；空计划立即完成。
   */
  @Test
  public void testCompletionAfterListeners() throws Exception {
    AtomicInteger seenAtCompletion = new AtomicInteger(-1);
    List<TestDescriptor> tests = List.of(
        TestDescriptor.builder("a", "Done").build(),
        TestDescriptor.builder("b", "Done").dependsOn("a").build());

    ConstraintScheduler scheduler = start(tests, EngineConfig.builder().parallelism(2).build());
    scheduler.completion().thenRun(() -> seenAtCompletion.set(terminal.size())).get(5, TimeUnit.SECONDS);

    assertEquals(2, seenAtCompletion.get());

    ConstraintScheduler empty = start(List.of(), EngineConfig.builder().parallelism(1).build());
    assertTrue(empty.completion().isDone(), "没有测试时立即完成");
  }
}
