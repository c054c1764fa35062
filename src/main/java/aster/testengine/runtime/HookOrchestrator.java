package aster.testengine.runtime;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.Hook;
import aster.testengine.core.HookBindings;
import aster.testengine.core.InvocationContext;
import aster.testengine.core.ScopeKind;
import aster.testengine.core.SharedType;
import aster.testengine.core.TestDescriptor;
import aster.testengine.exceptions.HookFailureException;
import aster.testengine.exceptions.TestCancelledException;
import aster.testengine.report.HookScopeEvent;
import aster.testengine.report.Outcome;
import aster.testengine.report.ReportSink;
import aster.testengine.runtime.fixture.FixtureRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 钩子编排器 - 在会话、程序集、类、测试四个层级上排列 before/after 钩子
 *
 * - enter：每个测试在测试体前调用一次；按 Session → Assembly → Class 顺序确保各层 before 恰好执行一次
 * - exit：每个测试终止时调用一次；类计数归零时释放 PER_CLASS 夹具并执行类 after，
 *   然后逐层向外（程序集、会话）传递
 * - before 失败：作用域内尚未开始的测试全部以 HookFailure 失败
 * - after 失败：记录为作用域级失败，不回溯修改已通过的测试
 *
 * 只要某作用域的 before 执行过（包括失败），其 after 就会执行，用于释放资源。
 */
public final class HookOrchestrator {
  private static final Logger logger = Logger.getLogger(HookOrchestrator.class.getName());
  static final String SESSION_ID = "session";

  private final Executor executor;
  private final FixtureRegistry fixtures;
  private final ReportSink sink;
  private final CancellationToken sessionToken;
  private final Map<String, HookScope> assemblies = new LinkedHashMap<>();
  private final Map<String, HookScope> classes = new LinkedHashMap<>();
  private final CompletableFuture<Void> sessionCompletion = new CompletableFuture<>();
  private volatile HookScope session;

  public HookOrchestrator(Executor executor, FixtureRegistry fixtures, ReportSink sink,
                          CancellationToken sessionToken) {
    this.executor = executor;
    this.fixtures = fixtures;
    this.sink = sink;
    this.sessionToken = sessionToken;
  }

  /**
   * 注册全部测试并确定各作用域的成员数。必须在调度开始前调用一次。
   *
   * 作用域的钩子取自该作用域内第一个声明了该层钩子的测试。
   */
  public void registerTests(List<TestDescriptor> descriptors) {
    if (session != null) {
      throw new IllegalStateException("Tests already registered");
    }
    Map<String, List<TestDescriptor>> byClass = new LinkedHashMap<>();
    Map<String, Set<String>> classesByAssembly = new LinkedHashMap<>();
    Map<String, List<TestDescriptor>> byAssembly = new LinkedHashMap<>();
    for (TestDescriptor descriptor : descriptors) {
      List<TestDescriptor> members = byClass.computeIfAbsent(descriptor.classId(), k -> new ArrayList<>());
      members.add(descriptor);
      // 类归属于其第一个测试声明的程序集
      String assemblyId = members.get(0).assemblyId();
      classesByAssembly.computeIfAbsent(assemblyId, k -> new LinkedHashSet<>()).add(descriptor.classId());
      byAssembly.computeIfAbsent(assemblyId, k -> new ArrayList<>()).add(descriptor);
    }

    HookScope sessionScope = newScope(ScopeKind.SESSION, SESSION_ID, null, null, descriptors, null,
        classesByAssembly.size());
    for (Map.Entry<String, Set<String>> entry : classesByAssembly.entrySet()) {
      String assemblyId = entry.getKey();
      HookScope assembly = newScope(ScopeKind.ASSEMBLY, assemblyId, null, assemblyId,
          byAssembly.get(assemblyId), sessionScope, entry.getValue().size());
      assemblies.put(assemblyId, assembly);
      for (String classId : entry.getValue()) {
        List<TestDescriptor> members = byClass.get(classId);
        classes.put(classId, newScope(ScopeKind.CLASS, classId, classId, assemblyId, members, assembly,
            members.size()));
      }
    }
    this.session = sessionScope;
    if (descriptors.isEmpty()) {
      sessionScope.markClosed();
      sessionCompletion.complete(null);
    }
  }

  /**
   * 测试进入：等待（或由本测试执行）各外层作用域的 before 钩子。
   *
   * @return 各层 before 成功时完成；失败时以 HookFailureException（或会话取消时的 TestCancelledException）异常完成
   */
  public CompletableFuture<Void> enter(TestDescriptor descriptor) {
    HookScope classScope = classScope(descriptor);
    HookScope assembly = classScope.parent();
    return ensureBefore(session)
        .thenCompose(v -> ensureBefore(assembly))
        .thenCompose(v -> ensureBefore(classScope));
  }

  /**
   * 执行测试级 before 钩子；没有钩子时不产生事件。
   */
  public CompletableFuture<Void> runTestBefore(TestDescriptor descriptor, InvocationContext context,
                                               CancellationToken token) {
    List<Hook> hooks = descriptor.hooks().before(ScopeKind.TEST);
    if (hooks.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    return runBeforeHooks(ScopeKind.TEST, descriptor.id(), hooks, context, token)
        .whenComplete((v, error) -> emit(ScopeKind.TEST, descriptor.id(), HookScopeEvent.Phase.BEFORE, error));
  }

  /**
   * 执行测试级 after 钩子（全部执行）与测试级清理。
   *
   * 失败只作为作用域级事件上报，不影响测试结果，返回的 future 总是正常完成。
   *
   * @param runHooks 测试级 before 是否执行过
   * @param teardown 钩子结束后的清理（归还夹具、关闭实例），返回清理错误
   */
  public CompletableFuture<Void> runTestAfter(TestDescriptor descriptor, InvocationContext context,
                                              CancellationToken token, boolean runHooks,
                                              Supplier<CompletableFuture<List<Throwable>>> teardown) {
    List<Hook> hooks = runHooks ? descriptor.hooks().after(ScopeKind.TEST) : List.of();
    CompletableFuture<Void> afterHooks = hooks.isEmpty() || context == null
        ? CompletableFuture.completedFuture(null)
        : runAfterHooks(ScopeKind.TEST, descriptor.id(), hooks, context, token);
    return afterHooks
        .handle((v, error) -> error)
        .thenCompose(hookError -> Futures.invoke(teardown)
            .handle((errors, teardownError) -> {
              List<Throwable> cleanup = new ArrayList<>();
              if (errors != null) {
                cleanup.addAll(errors);
              }
              if (teardownError != null) {
                cleanup.add(Futures.unwrap(teardownError));
              }
              if (!hooks.isEmpty() || !cleanup.isEmpty()) {
                reportAfter(ScopeKind.TEST, descriptor.id(), hookError, cleanup);
              }
              return (Void) null;
            }));
  }

  /**
   * 测试终止（每个测试恰好一次，包括从未开始的测试）。
   */
  public void exit(TestDescriptor descriptor) {
    HookScope classScope = classScope(descriptor);
    if (classScope.completeMember()) {
      close(classScope);
    }
  }

  /**
   * @return 会话 after 钩子执行完毕后完成
   */
  public CompletableFuture<Void> sessionCompletion() {
    return sessionCompletion;
  }

  public Optional<HookScope> scope(ScopeKind kind, String id) {
    return switch (kind) {
      case SESSION -> Optional.ofNullable(session);
      case ASSEMBLY -> Optional.ofNullable(assemblies.get(id));
      case CLASS -> Optional.ofNullable(classes.get(id));
      case TEST -> Optional.empty();
    };
  }

  // ========= 内部实现 =========

  private HookScope newScope(ScopeKind kind, String id, String classId, String assemblyId,
                             List<TestDescriptor> members, HookScope parent, int registered) {
    List<Hook> before = firstDeclared(members, bindings -> bindings.before(kind));
    List<Hook> after = firstDeclared(members, bindings -> bindings.after(kind));
    return new HookScope(kind, id, classId, assemblyId, before, after, parent, registered);
  }

  private static List<Hook> firstDeclared(List<TestDescriptor> members, Function<HookBindings, List<Hook>> select) {
    for (TestDescriptor member : members) {
      List<Hook> hooks = select.apply(member.hooks());
      if (!hooks.isEmpty()) {
        return hooks;
      }
    }
    return List.of();
  }

  private HookScope classScope(TestDescriptor descriptor) {
    HookScope scope = classes.get(descriptor.classId());
    if (scope == null) {
      throw new IllegalStateException("Test was not registered: " + descriptor.id());
    }
    return scope;
  }

  private CompletableFuture<Void> ensureBefore(HookScope scope) {
    return scope.ensureBefore(() -> {
      if (sessionToken.isCancellationRequested()) {
        return CompletableFuture.failedFuture(new TestCancelledException(sessionToken.reason()));
      }
      scope.markBeforeRan();
      logger.fine(String.format("Running %s before hooks for %s", scope.kind(), scope.id()));
      return runBeforeHooks(scope.kind(), scope.id(), scope.beforeHooks(), contextOf(scope), sessionToken)
          .whenComplete((v, error) -> {
            emit(scope.kind(), scope.id(), HookScopeEvent.Phase.BEFORE, error);
            if (error != null && scope.kind() == ScopeKind.ASSEMBLY) {
              abortSession(scope, Futures.unwrap(error));
            }
          });
    });
  }

  /**
   * 程序集 before 钩子失败对整个会话是致命的：发出会话取消，其他程序集未开始的测试直接取消。
   * 本程序集内等待 before 的测试仍以 HookFailure 报告失败。
   */
  private void abortSession(HookScope scope, Throwable error) {
    if (!(error instanceof HookFailureException)) {
      return;
    }
    String reason = String.format("%s before hooks failed for %s: %s", scope.kind(), scope.id(), error.getMessage());
    if (sessionToken.cancel(reason)) {
      logger.log(Level.WARNING, "Cancelling session: " + reason, error);
    }
  }

  /**
   * 按顺序执行 before 钩子，遇到第一个失败即停止。每个钩子执行前检查取消。
   */
  private CompletableFuture<Void> runBeforeHooks(ScopeKind kind, String scopeId, List<Hook> hooks,
                                                 InvocationContext context, CancellationToken token) {
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (Hook hook : hooks) {
      chain = chain.thenComposeAsync(v -> {
        token.throwIfCancellationRequested();
        return Futures.invoke(() -> hook.invokable().invoke(context, token));
      }, executor);
    }
    return chain.handle((v, error) -> {
      if (error == null) {
        return null;
      }
      Throwable cause = Futures.unwrap(error);
      if (cause instanceof TestCancelledException) {
        throw new CompletionException(cause);
      }
      throw new CompletionException(new HookFailureException(kind, scopeId, true, cause));
    });
  }

  /**
   * 按顺序执行全部 after 钩子；失败不会中断后续钩子，所有失败聚合为一个 HookFailureException。
   */
  private CompletableFuture<Void> runAfterHooks(ScopeKind kind, String scopeId, List<Hook> hooks,
                                                InvocationContext context, CancellationToken token) {
    List<Throwable> failures = new CopyOnWriteArrayList<>();
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (Hook hook : hooks) {
      chain = chain.thenComposeAsync(v -> Futures.invoke(() -> hook.invokable().invoke(context, token))
          .handle((result, error) -> {
            if (error != null) {
              failures.add(Futures.unwrap(error));
            }
            return (Void) null;
          }), executor);
    }
    return chain.thenCompose(v -> {
      if (failures.isEmpty()) {
        return CompletableFuture.completedFuture(null);
      }
      HookFailureException aggregated = new HookFailureException(kind, scopeId, false, failures.get(0));
      for (Throwable extra : failures.subList(1, failures.size())) {
        aggregated.addSuppressed(extra);
      }
      return CompletableFuture.failedFuture(aggregated);
    });
  }

  /**
   * 关闭作用域：释放该作用域的共享夹具，执行 after 钩子，再向外层传递完成。
   */
  private void close(HookScope scope) {
    logger.fine(String.format("Closing %s scope %s", scope.kind(), scope.id()));
    closeFixtures(scope)
        .thenCompose(disposalErrors -> {
          CompletableFuture<Void> hooks = scope.beforeExecuted() && !scope.afterHooks().isEmpty()
              ? runAfterHooks(scope.kind(), scope.id(), scope.afterHooks(), contextOf(scope), sessionToken)
              : CompletableFuture.completedFuture(null);
          return hooks.handle((v, hookError) -> {
            if (scope.beforeExecuted() || !disposalErrors.isEmpty()) {
              reportAfter(scope.kind(), scope.id(), hookError, disposalErrors);
            }
            return (Void) null;
          });
        })
        .whenComplete((v, error) -> {
          if (error != null) {
            logger.log(Level.WARNING, String.format("Closing %s scope %s failed", scope.kind(), scope.id()), error);
          }
          scope.markClosed();
          HookScope parent = scope.parent();
          if (parent == null) {
            sessionCompletion.complete(null);
          } else if (parent.completeMember()) {
            close(parent);
          }
        });
  }

  private CompletableFuture<List<Throwable>> closeFixtures(HookScope scope) {
    return switch (scope.kind()) {
      case CLASS -> fixtures.closeScope(SharedType.PER_CLASS, scope.id());
      case ASSEMBLY -> fixtures.closeScope(SharedType.PER_ASSEMBLY, scope.id());
      case SESSION -> fixtures.closeSession();
      case TEST -> CompletableFuture.completedFuture(List.of());
    };
  }

  private void reportAfter(ScopeKind kind, String scopeId, Throwable hookError, List<Throwable> disposalErrors) {
    Throwable error = hookError == null ? null : Futures.unwrap(hookError);
    for (Throwable disposal : disposalErrors) {
      if (error == null) {
        error = disposal;
      } else if (error != disposal) {
        error.addSuppressed(disposal);
      }
    }
    if (error != null) {
      logger.log(Level.WARNING, String.format("%s after phase failed for %s", kind, scopeId), error);
    }
    emit(kind, scopeId, HookScopeEvent.Phase.AFTER, error);
  }

  private void emit(ScopeKind kind, String scopeId, HookScopeEvent.Phase phase, Throwable error) {
    Throwable cause = error == null ? null : Futures.unwrap(error);
    Outcome outcome;
    if (cause == null) {
      outcome = Outcome.PASSED;
    } else if (cause instanceof TestCancelledException) {
      outcome = Outcome.CANCELLED;
    } else {
      outcome = Outcome.FAILED;
    }
    sink.onHookScope(new HookScopeEvent(kind, scopeId, phase, outcome, cause));
  }

  private static InvocationContext contextOf(HookScope scope) {
    return InvocationContext.forScope(scope.kind(), scope.id(), scope.classId(), scope.assemblyId());
  }
}
