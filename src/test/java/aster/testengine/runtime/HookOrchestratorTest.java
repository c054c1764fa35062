package aster.testengine.runtime;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.Hook;
import aster.testengine.core.HookBindings;
import aster.testengine.core.InvocationContext;
import aster.testengine.core.Invokable;
import aster.testengine.core.ScopeKind;
import aster.testengine.core.TestDescriptor;
import aster.testengine.exceptions.HookFailureException;
import aster.testengine.exceptions.TestCancelledException;
import aster.testengine.report.CollectingReportSink;
import aster.testengine.report.HookScopeEvent;
import aster.testengine.report.Outcome;
import aster.testengine.runtime.fixture.FixtureRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HookOrchestrator 单元测试
 *
 * 验证会话、程序集、类三级作用域：before 钩子在并发进入时只执行一次，after 钩子在最后一个成员终止后执行，
 * before 失败扇出到作用域内的测试，after 钩子全部执行并聚合失败，会话取消后不再执行 before。
 */
public class HookOrchestratorTest {

  private ExecutorService executor;
  private CancellationToken session;
  private CollectingReportSink sink;
  private HookOrchestrator orchestrator;
  private final List<String> calls = new CopyOnWriteArrayList<>();

  @BeforeEach
  public void setUp() {
    executor = Executors.newFixedThreadPool(4);
    session = new CancellationToken();
    sink = new CollectingReportSink();
    orchestrator = new HookOrchestrator(executor, new FixtureRegistry(executor, session), sink, session);
  }

  @AfterEach
  public void tearDown() {
    executor.shutdownNow();
  }

  private Hook recording(String name) {
    return Hook.blocking(name, (ctx, token) -> calls.add(name));
  }

  private static Hook failing(String name, String message) {
    return Hook.blocking(name, (ctx, token) -> {
      throw new IllegalStateException(message);
    });
  }

  private List<HookScopeEvent> events(ScopeKind kind, HookScopeEvent.Phase phase) {
    List<HookScopeEvent> matched = new ArrayList<>();
    for (HookScopeEvent event : sink.scopeEvents()) {
      if (event.kind() == kind && event.phase() == phase) {
        matched.add(event);
      }
    }
    return matched;
  }

  /**
   * 测试：20 个测试并发进入时，每个作用域的 before 钩子只执行一次。
   */
  @Test
  public void testBeforeHooksRunOnceUnderConcurrency() throws Exception {
    AtomicInteger sessionBefore = new AtomicInteger();
    AtomicInteger classBefore = new AtomicInteger();
    HookBindings hooks = HookBindings.builder()
        .before(ScopeKind.SESSION, Hook.blocking("session", (ctx, token) -> {
          sessionBefore.incrementAndGet();
          Thread.sleep(20);
        }))
        .before(ScopeKind.CLASS, Hook.blocking("class", (ctx, token) -> classBefore.incrementAndGet()))
        .build();
    List<TestDescriptor> tests = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      tests.add(TestDescriptor.builder("t" + i, "Class" + (i % 4)).hooks(hooks).build());
    }
    orchestrator.registerTests(tests);

    List<CompletableFuture<Void>> entries = new ArrayList<>();
    for (TestDescriptor test : tests) {
      entries.add(CompletableFuture.supplyAsync(() -> orchestrator.enter(test), executor).thenCompose(f -> f));
    }
    CompletableFuture.allOf(entries.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

    assertEquals(1, sessionBefore.get(), "会话 before 只执行一次");
    assertEquals(4, classBefore.get(), "每个类的 before 只执行一次");
  }

  /**
   * 测试：after 钩子在作用域最后一个成员终止后执行，并由内向外关闭。
   */
  @Test
  public void testScopesCloseAfterLastMember() throws Exception {
    HookBindings hooks = HookBindings.builder()
        .before(ScopeKind.SESSION, recording("session-before"))
        .before(ScopeKind.ASSEMBLY, recording("assembly-before"))
        .before(ScopeKind.CLASS, recording("class-before"))
        .after(ScopeKind.CLASS, recording("class-after"))
        .after(ScopeKind.ASSEMBLY, recording("assembly-after"))
        .after(ScopeKind.SESSION, recording("session-after"))
        .build();
    TestDescriptor first = TestDescriptor.builder("first", "Cls").hooks(hooks).build();
    TestDescriptor second = TestDescriptor.builder("second", "Cls").hooks(hooks).build();
    orchestrator.registerTests(List.of(first, second));

    orchestrator.enter(first).get(5, TimeUnit.SECONDS);
    orchestrator.enter(second).get(5, TimeUnit.SECONDS);
    orchestrator.exit(first);
    Thread.sleep(50);
    assertFalse(calls.contains("class-after"), "仍有成员未终止时不得执行 after");
    assertFalse(orchestrator.sessionCompletion().isDone());

    orchestrator.exit(second);
    orchestrator.sessionCompletion().get(5, TimeUnit.SECONDS);

    assertEquals(List.of("session-before", "assembly-before", "class-before",
        "class-after", "assembly-after", "session-after"), calls);
    assertTrue(orchestrator.scope(ScopeKind.CLASS, "Cls").orElseThrow().closed().isDone());
    assertEquals(1, events(ScopeKind.SESSION, HookScopeEvent.Phase.AFTER).size());
    assertEquals(Outcome.PASSED, events(ScopeKind.CLASS, HookScopeEvent.Phase.AFTER).get(0).outcome());
  }

  /**
   * 测试：before 钩子失败时作用域内所有测试观察到同一个 HookFailure，after 钩子仍然执行。
   */
  @Test
  public void testBeforeFailureFansOut() throws Exception {
    HookBindings hooks = HookBindings.builder()
        .before(ScopeKind.CLASS, failing("setup", "database unavailable"))
        .after(ScopeKind.CLASS, recording("teardown"))
        .build();
    TestDescriptor a = TestDescriptor.builder("a", "Broken").hooks(hooks).build();
    TestDescriptor b = TestDescriptor.builder("b", "Broken").hooks(hooks).build();
    orchestrator.registerTests(List.of(a, b));

    ExecutionException errorA = assertThrows(ExecutionException.class, () -> orchestrator.enter(a).get(5, TimeUnit.SECONDS));
    ExecutionException errorB = assertThrows(ExecutionException.class, () -> orchestrator.enter(b).get(5, TimeUnit.SECONDS));
    HookFailureException failure = assertInstanceOf(HookFailureException.class, errorA.getCause());
    assertSame(failure, errorB.getCause(), "before 只执行一次，失败被所有成员共享");
    assertTrue(failure.isBefore());
    assertEquals("Broken", failure.getScopeId());
    assertEquals("database unavailable", failure.getCause().getMessage());

    List<HookScopeEvent> before = events(ScopeKind.CLASS, HookScopeEvent.Phase.BEFORE);
    assertEquals(1, before.size());
    assertEquals(Outcome.FAILED, before.get(0).outcome());

    orchestrator.exit(a);
    orchestrator.exit(b);
    orchestrator.sessionCompletion().get(5, TimeUnit.SECONDS);
    assertEquals(List.of("teardown"), calls, "before 执行过（即使失败）就执行 after");
    assertFalse(session.isCancellationRequested(), "类级 before 失败只影响本类，不取消会话");
  }

  /**
   * 测试：程序集 before 钩子失败时本程序集的测试观察到 HookFailure，同时整个会话被取消，
   * 其他程序集随后进入时不再执行 before 钩子。
   */
  @Test
  public void testAssemblyBeforeFailureCancelsSession() throws Exception {
    HookBindings broken = HookBindings.builder()
        .before(ScopeKind.ASSEMBLY, failing("deploy", "container registry unreachable"))
        .build();
    HookBindings healthy = HookBindings.builder()
        .before(ScopeKind.ASSEMBLY, recording("healthy-before"))
        .build();
    TestDescriptor a = TestDescriptor.builder("a", "A").assembly("broken").hooks(broken).build();
    TestDescriptor h = TestDescriptor.builder("h", "H").assembly("healthy").hooks(healthy).build();
    orchestrator.registerTests(List.of(a, h));

    ExecutionException errorA = assertThrows(ExecutionException.class, () -> orchestrator.enter(a).get(5, TimeUnit.SECONDS));
    HookFailureException failure = assertInstanceOf(HookFailureException.class, errorA.getCause());
    assertEquals(ScopeKind.ASSEMBLY, failure.getScopeKind());
    assertTrue(session.isCancellationRequested(), "程序集 before 失败应取消会话");
    assertTrue(session.reason().contains("broken"), session.reason());

    ExecutionException errorH = assertThrows(ExecutionException.class, () -> orchestrator.enter(h).get(5, TimeUnit.SECONDS));
    assertInstanceOf(TestCancelledException.class, errorH.getCause());
    assertFalse(calls.contains("healthy-before"), "会话取消后其他程序集不再执行 before");
  }

  /**
   * 测试：after 钩子全部执行，失败聚合为一个 HookFailure，首个失败为 cause，其余为 suppressed。
   */
  @Test
  public void testAfterHooksAggregateFailures() throws Exception {
    HookBindings hooks = HookBindings.builder()
        .after(ScopeKind.CLASS, new Hook("first", 1, Invokable.blocking((ctx, token) -> {
          calls.add("first");
          throw new IllegalStateException("first failed");
        })))
        .after(ScopeKind.CLASS, new Hook("second", 2, Invokable.blocking((ctx, token) -> {
          calls.add("second");
          throw new IllegalStateException("second failed");
        })))
        .after(ScopeKind.CLASS, new Hook("third", 3, Invokable.blocking((ctx, token) -> calls.add("third"))))
        .build();
    TestDescriptor only = TestDescriptor.builder("only", "Cleanup").hooks(hooks).build();
    orchestrator.registerTests(List.of(only));

    orchestrator.enter(only).get(5, TimeUnit.SECONDS);
    orchestrator.exit(only);
    orchestrator.sessionCompletion().get(5, TimeUnit.SECONDS);

    assertEquals(List.of("first", "second", "third"), calls, "失败不得中断后续 after 钩子");
    HookScopeEvent after = events(ScopeKind.CLASS, HookScopeEvent.Phase.AFTER).get(0);
    assertEquals(Outcome.FAILED, after.outcome());
    HookFailureException failure = assertInstanceOf(HookFailureException.class, after.error());
    assertFalse(failure.isBefore());
    assertEquals("first failed", failure.getCause().getMessage());
    assertEquals(1, failure.getSuppressed().length);
    assertEquals("second failed", failure.getSuppressed()[0].getMessage());
  }

  /**
   * 测试：钩子按 order 升序执行。
   */
  @Test
  public void testHookOrdering() throws Exception {
    HookBindings hooks = HookBindings.builder()
        .before(ScopeKind.CLASS, new Hook("late", 10, Invokable.blocking((ctx, token) -> calls.add("late"))))
        .before(ScopeKind.CLASS, new Hook("early", -1, Invokable.blocking((ctx, token) -> calls.add("early"))))
        .before(ScopeKind.CLASS, new Hook("middle", 0, Invokable.blocking((ctx, token) -> calls.add("middle"))))
        .build();
    TestDescriptor test = TestDescriptor.builder("t", "Ordered").hooks(hooks).build();
    orchestrator.registerTests(List.of(test));

    orchestrator.enter(test).get(5, TimeUnit.SECONDS);

    assertEquals(List.of("early", "middle", "late"), calls);
  }

  /**
   * 测试：会话取消后不再执行 before 钩子，对应的 after 钩子也不执行。
   */
  @Test
  public void testCancelledSessionSkipsHooks() throws Exception {
    HookBindings hooks = HookBindings.builder()
        .before(ScopeKind.SESSION, recording("session-before"))
        .after(ScopeKind.SESSION, recording("session-after"))
        .build();
    TestDescriptor test = TestDescriptor.builder("t", "Cancelled").hooks(hooks).build();
    orchestrator.registerTests(List.of(test));
    session.cancel("user requested");

    ExecutionException error = assertThrows(ExecutionException.class, () -> orchestrator.enter(test).get(5, TimeUnit.SECONDS));
    assertInstanceOf(TestCancelledException.class, error.getCause());

    orchestrator.exit(test);
    orchestrator.sessionCompletion().get(5, TimeUnit.SECONDS);
    assertTrue(calls.isEmpty(), "取消后 before 与 after 都不执行");
    assertTrue(events(ScopeKind.SESSION, HookScopeEvent.Phase.AFTER).isEmpty());
  }

  /**
   * 测试：从未开始的测试同样推进作用域关闭；空计划立即完成。
   */
  @Test
  public void testNeverStartedTestsCloseScopes() throws Exception {
    HookBindings hooks = HookBindings.builder().after(ScopeKind.CLASS, recording("class-after")).build();
    List<TestDescriptor> tests = List.of(
        TestDescriptor.builder("x", "A").assembly("one").hooks(hooks).build(),
        TestDescriptor.builder("y", "B").assembly("two").hooks(hooks).build());
    orchestrator.registerTests(tests);

    tests.forEach(orchestrator::exit);
    orchestrator.sessionCompletion().get(5, TimeUnit.SECONDS);
    assertTrue(calls.isEmpty(), "before 从未执行的作用域不执行 after");
    assertTrue(orchestrator.scope(ScopeKind.ASSEMBLY, "two").orElseThrow().closed().isDone());

    HookOrchestrator empty = new HookOrchestrator(executor, new FixtureRegistry(executor, session), sink, session);
    empty.registerTests(List.of());
    assertTrue(empty.sessionCompletion().isDone(), "没有测试时会话立即完成");
  }

  /**
   * 测试：测试级 after 钩子与清理错误作为作用域级事件上报，返回的 future 总是正常完成。
   */
  @Test
  public void testTestLevelAfterReportsCleanupErrors() throws Exception {
    TestDescriptor plain = TestDescriptor.builder("plain", "Level").build();
    TestDescriptor hooked = TestDescriptor.builder("hooked", "Level")
        .hooks(HookBindings.builder().after(ScopeKind.TEST, failing("after-test", "after failed")).build())
        .build();
    orchestrator.registerTests(List.of(plain, hooked));
    InvocationContext context = InvocationContext.forTest(plain, null, Map.of(), 1);

    orchestrator.runTestAfter(plain, context, session, false,
        () -> CompletableFuture.completedFuture(List.of())).get(5, TimeUnit.SECONDS);
    assertTrue(events(ScopeKind.TEST, HookScopeEvent.Phase.AFTER).isEmpty(), "无钩子且无清理错误时不产生事件");

    orchestrator.runTestAfter(plain, context, session, false,
        () -> CompletableFuture.completedFuture(List.of(new IllegalStateException("close failed")))).get(5, TimeUnit.SECONDS);
    HookScopeEvent cleanup = events(ScopeKind.TEST, HookScopeEvent.Phase.AFTER).get(0);
    assertEquals("plain", cleanup.scopeId());
    assertEquals("close failed", cleanup.error().getMessage());

    orchestrator.runTestAfter(hooked, InvocationContext.forTest(hooked, null, Map.of(), 1), session, true,
        () -> CompletableFuture.completedFuture(List.of())).get(5, TimeUnit.SECONDS);
    HookScopeEvent hookEvent = events(ScopeKind.TEST, HookScopeEvent.Phase.AFTER).get(1);
    assertEquals("hooked", hookEvent.scopeId());
    assertInstanceOf(HookFailureException.class, hookEvent.error());
  }
}
