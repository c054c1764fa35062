package aster.testengine.runtime;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.InvocationContext;
import aster.testengine.core.SharedType;
import aster.testengine.core.TestDescriptor;
import aster.testengine.exceptions.FixtureInitializationFailedException;
import aster.testengine.exceptions.TestCancelledException;
import aster.testengine.runtime.fixture.FixtureLease;
import aster.testengine.runtime.fixture.FixtureRegistry;
import aster.testengine.runtime.fixture.ScopeCoordinates;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 单次测试尝试的执行流水线
 *
 * 1. 进入作用域（等待各层 before 钩子）
 * 2. 获取夹具
 * 3. 创建测试实例
 * 4. 测试级 before 钩子
 * 5. 测试体（带超时）
 * 6. 测试级 after 钩子，归还夹具，释放本次尝试的 NONE 夹具，关闭实例
 *
 * 各步骤之间只通过 future 串联，等待期间不占用工作线程。
 */
public final class TestPipeline implements ConstraintScheduler.AttemptRunner {
  private static final Logger logger = Logger.getLogger(TestPipeline.class.getName());

  private final HookOrchestrator orchestrator;
  private final FixtureRegistry fixtures;
  private final RetrySupervisor supervisor;
  private final Executor workers;
  private final Duration defaultTimeout;

  /**
   * 单次尝试在各步骤间传递的状态
   */
  private static final class AttemptState {
    volatile FixtureLease lease;
    volatile Object instance;
    volatile InvocationContext context;
    volatile boolean testBeforeRan;
  }

  public TestPipeline(HookOrchestrator orchestrator, FixtureRegistry fixtures, RetrySupervisor supervisor,
                      Executor workers, Duration defaultTimeout) {
    this.orchestrator = orchestrator;
    this.fixtures = fixtures;
    this.supervisor = supervisor;
    this.workers = workers;
    this.defaultTimeout = defaultTimeout;
  }

  @Override
  public CompletionStage<AttemptResult> run(ExecutionNode node, CancellationToken token) {
    TestDescriptor descriptor = node.descriptor();
    int attempt = node.attempts();
    ScopeCoordinates coordinates = ScopeCoordinates.forAttempt(descriptor, attempt);
    AttemptState state = new AttemptState();

    CompletableFuture<Void> flow = CompletableFuture.completedFuture((Void) null)
        .thenCompose(v -> {
          token.throwIfCancellationRequested();
          return orchestrator.enter(descriptor);
        })
        .thenCompose(v -> {
          token.throwIfCancellationRequested();
          return fixtures.acquireAll(descriptor, coordinates, token);
        })
        .thenApplyAsync(lease -> {
          state.lease = lease;
          return createContext(descriptor, lease, attempt, state);
        }, workers)
        .thenCompose(context -> {
          state.testBeforeRan = true;
          return orchestrator.runTestBefore(descriptor, context, token);
        })
        .thenCompose(v -> {
          CancellationToken bodyToken = token.child();
          return supervisor.withTimeout(descriptor.id(), timeoutOf(descriptor), bodyToken,
                  () -> descriptor.body().invoke(state.context, bodyToken))
              .whenComplete((ignored, error) -> bodyToken.release());
        });

    return flow
        .handle((v, error) -> error == null
            ? AttemptResult.passed()
            : classify(descriptor.id(), Futures.unwrap(error)))
        .thenComposeAsync(result -> orchestrator
            .runTestAfter(descriptor, state.context, token, state.testBeforeRan,
                () -> teardown(coordinates, state))
            .thenApply(v -> result), workers);
  }

  /**
   * 将尝试失败归类为终止状态
   *
   * - 会话取消 → CANCELLED
   * - 夹具失败：发起初始化的测试报告 FAILED（根因），其余使用者报告 SKIPPED
   * - 超时、钩子失败、测试体失败 → FAILED
   */
  static AttemptResult classify(String testId, Throwable error) {
    if (error instanceof TestCancelledException || error instanceof CancellationException) {
      return AttemptResult.cancelled(error);
    }
    if (error instanceof FixtureInitializationFailedException fixtureFailure) {
      if (fixtureFailure.getCause() instanceof TestCancelledException) {
        return AttemptResult.cancelled(fixtureFailure);
      }
      return fixtureFailure.initiatedBy(testId)
          ? AttemptResult.failed(fixtureFailure)
          : AttemptResult.skipped(fixtureFailure);
    }
    return AttemptResult.failed(error);
  }

  private InvocationContext createContext(TestDescriptor descriptor, FixtureLease lease, int attempt,
                                          AttemptState state) {
    InvocationContext factoryContext = InvocationContext.forTest(descriptor, null, lease.values(), attempt);
    Object instance;
    try {
      instance = descriptor.instanceFactory().create(factoryContext);
    } catch (Exception e) {
      throw new CompletionException(e);
    }
    state.instance = instance;
    InvocationContext context = InvocationContext.forTest(descriptor, instance, lease.values(), attempt);
    state.context = context;
    return context;
  }

  private CompletableFuture<List<Throwable>> teardown(ScopeCoordinates coordinates, AttemptState state) {
    List<Throwable> errors = new ArrayList<>();
    if (state.instance instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        errors.add(e);
        logger.log(Level.WARNING, String.format("Closing test instance for %s failed", coordinates.attemptScope()), e);
      }
    }
    FixtureLease lease = state.lease;
    if (lease != null) {
      lease.release();
    }
    return fixtures.closeScope(SharedType.NONE, coordinates.attemptScope())
        .thenApply(disposal -> {
          List<Throwable> all = new ArrayList<>(errors);
          all.addAll(disposal);
          return all;
        });
  }

  private Duration timeoutOf(TestDescriptor descriptor) {
    return descriptor.timeout().orElse(defaultTimeout);
  }
}
