package aster.testengine.runtime.fixture;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.FixtureContext;
import aster.testengine.core.FixtureRequirement;
import aster.testengine.core.FixtureType;
import aster.testengine.core.SharedType;
import aster.testengine.core.TestDescriptor;
import aster.testengine.exceptions.FixtureCycleDetectedException;
import aster.testengine.exceptions.FixtureInitializationFailedException;
import aster.testengine.runtime.Futures;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 夹具注册表 - 共享资源的解析、异步初始化与释放
 *
 * - 按作用域键去重：同一个键只初始化一次，并发请求等待同一个 promise
 * - 深度优先初始化：嵌套夹具全部就绪后才创建父夹具
 * - 循环检测：首次初始化顶层夹具前沿需求链做 DFS，成环时直接以 FixtureCycleDetected 使 promise 失败
 * - 失败毒化：失败的键在其作用域剩余生命周期内对所有请求者返回同一个失败
 * - 按就绪顺序的逆序释放，父夹具释放时连带释放其独占的嵌套夹具
 *
 * 每个会话创建一个注册表实例，会话结束即丢弃。
 */
public final class FixtureRegistry {
  private static final Logger logger = Logger.getLogger(FixtureRegistry.class.getName());

  private final ConcurrentHashMap<ScopeKey, FixtureRecord> records = new ConcurrentHashMap<>();
  private final AtomicLong readySequence = new AtomicLong();
  private final Executor executor;
  private final CancellationToken sessionToken;

  public FixtureRegistry(Executor executor, CancellationToken sessionToken) {
    this.executor = executor;
    this.sessionToken = sessionToken;
  }

  /**
   * 获取测试声明的全部夹具
   *
   * 任一夹具失败时归还已持有的夹具，并按声明顺序以第一个失败异常完成。
   *
   * @param descriptor 测试描述
   * @param coordinates 本次尝试的作用域坐标
   * @param token 尝试级取消令牌，等待结束后检查
   * @return 持有的夹具租约
   */
  public CompletableFuture<FixtureLease> acquireAll(TestDescriptor descriptor, ScopeCoordinates coordinates,
                                                    CancellationToken token) {
    List<FixtureRequirement> requirements = descriptor.fixtures();
    if (requirements.isEmpty()) {
      return CompletableFuture.completedFuture(FixtureLease.EMPTY);
    }
    String consumerId = descriptor.id();
    List<FixtureRecord> acquired = new ArrayList<>(requirements.size());
    for (FixtureRequirement requirement : requirements) {
      acquired.add(acquireRecord(requirement, consumerId, consumerId, coordinates, null));
    }
    CompletableFuture<?>[] waits = acquired.stream()
        .map(record -> record.promise().handle((value, error) -> null))
        .toArray(CompletableFuture[]::new);

    return CompletableFuture.allOf(waits).thenApply(ignored -> {
      FixtureLease lease = new FixtureLease(this, consumerId, Map.of(), acquired);
      Map<String, Object> values = new LinkedHashMap<>();
      for (int i = 0; i < requirements.size(); i++) {
        try {
          values.put(requirements.get(i).name(), acquired.get(i).promise().join());
        } catch (CompletionException e) {
          lease.release();
          throw e;
        }
      }
      if (token.isCancellationRequested()) {
        lease.release();
        token.throwIfCancellationRequested();
      }
      return new FixtureLease(this, consumerId, values, acquired);
    });
  }

  /**
   * 以指定使用者身份请求单个夹具。
   *
   * @return 就绪实例；失败时以 {@link FixtureInitializationFailedException} 异常完成
   */
  public CompletableFuture<Object> acquire(FixtureRequirement requirement, String consumerId,
                                           ScopeCoordinates coordinates) {
    return acquireRecord(requirement, consumerId, consumerId, coordinates, null).promise();
  }

  /**
   * 使用者归还夹具；作用域已关闭且无人持有时立即释放。
   */
  public void release(FixtureRecord record, String consumerId) {
    record.removeConsumer(consumerId);
    if (record.isScopeClosed() && !record.hasConsumers()) {
      disposeIfEligible(record, new CopyOnWriteArrayList<>());
    }
  }

  /**
   * 关闭作用域：标记匹配的记录，并按就绪顺序的逆序释放无人持有的记录。
   *
   * @param shared 共享方式
   * @param discriminator 区分符；为 null 时关闭该共享方式下的全部记录
   * @return 释放过程中收集到的错误（已记录日志）
   */
  public CompletableFuture<List<Throwable>> closeScope(SharedType shared, String discriminator) {
    return closeMatching(shared + ":" + discriminator, key -> key.shared() == shared
        && (discriminator == null || discriminator.equals(key.discriminator())));
  }

  /**
   * 会话结束：关闭剩余的全部记录（KEYED、PER_SESSION 以及被放弃的尝试遗留的记录）。
   */
  public CompletableFuture<List<Throwable>> closeSession() {
    return closeMatching("session", key -> true);
  }

  private CompletableFuture<List<Throwable>> closeMatching(String label, Predicate<ScopeKey> filter) {
    List<FixtureRecord> targets = new ArrayList<>();
    for (FixtureRecord record : records.values()) {
      if (filter.test(record.key()) && record.closeScope()) {
        targets.add(record);
      }
    }
    if (targets.isEmpty()) {
      return CompletableFuture.completedFuture(List.of());
    }
    targets.sort(Comparator.comparingLong(FixtureRecord::readySequence).reversed());
    logger.fine(String.format("Closing fixture scope %s (%d records)", label, targets.size()));

    List<Throwable> errors = new CopyOnWriteArrayList<>();
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (FixtureRecord record : targets) {
      chain = chain.thenCompose(v -> disposeIfEligible(record, errors));
    }
    return chain.thenApply(v -> List.copyOf(errors));
  }

  public Optional<FixtureRecord> find(ScopeKey key) {
    return Optional.ofNullable(records.get(key));
  }

  /**
   * @return 当前仍在注册表中的记录数
   */
  public int size() {
    return records.size();
  }

  // ========= 初始化 =========

  private FixtureRecord acquireRecord(FixtureRequirement requirement, String consumerId, String initiatorId,
                                      ScopeCoordinates coordinates, ScopeKey parent) {
    ScopeKey key = keyFor(requirement, coordinates, parent);
    FixtureRecord record = records.computeIfAbsent(key, k -> new FixtureRecord(k, requirement.type()));
    record.addConsumer(consumerId);

    if (record.claim()) {
      logger.fine(String.format("Initializing fixture %s for %s", key, initiatorId));
      if (parent == null) {
        List<String> cycle = findCycle(requirement.type(), new ArrayList<>(), new HashSet<>());
        if (cycle != null) {
          fault(record, new FixtureInitializationFailedException(key.toString(), initiatorId,
              new FixtureCycleDetectedException(cycle)));
          return record;
        }
      }
      initialize(record, coordinates, initiatorId);
    }
    return record;
  }

  private void initialize(FixtureRecord record, ScopeCoordinates coordinates, String initiatorId) {
    List<FixtureRequirement> nested = record.type().requirements();
    List<FixtureRecord> children = new ArrayList<>(nested.size());
    for (FixtureRequirement requirement : nested) {
      FixtureRecord child = acquireRecord(requirement, record.key().toString(), initiatorId, coordinates, record.key());
      record.holdChild(child);
      children.add(child);
    }
    CompletableFuture<?>[] waits = children.stream().map(FixtureRecord::promise).toArray(CompletableFuture[]::new);

    CompletableFuture.allOf(waits)
        .thenComposeAsync(ignored -> {
          sessionToken.throwIfCancellationRequested();
          Map<String, Object> values = new LinkedHashMap<>();
          for (int i = 0; i < nested.size(); i++) {
            values.put(nested.get(i).name(), children.get(i).promise().join());
          }
          FixtureContext context = new FixtureContext(record.key().toString(), values, sessionToken);
          return createAndInitialize(record, record.type(), context);
        }, executor)
        .whenComplete((value, error) -> {
          if (error == null) {
            long sequence = readySequence.incrementAndGet();
            record.markReady(sequence, value);
            logger.fine(String.format("Fixture %s ready (#%d)", record.key(), sequence));
            return;
          }
          Throwable cause = Futures.unwrap(error);
          if (cause instanceof FixtureInitializationFailedException child) {
            // 嵌套夹具失败：保留根因与最初的发起者
            fault(record, new FixtureInitializationFailedException(record.key().toString(),
                child.getInitiatorId(), child.getCause()));
          } else {
            fault(record, new FixtureInitializationFailedException(record.key().toString(), initiatorId, cause));
          }
        });
  }

  private static <T> CompletableFuture<Object> createAndInitialize(FixtureRecord record, FixtureType<T> type,
                                                                   FixtureContext context) {
    T instance;
    try {
      instance = type.create(context);
    } catch (Exception e) {
      return CompletableFuture.failedFuture(e);
    }
    if (instance == null) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("Fixture " + type.name() + " created a null instance"));
    }
    record.instance(instance);
    return type.initialize(instance, context).toCompletableFuture().thenApply(v -> (Object) instance);
  }

  private void fault(FixtureRecord record, FixtureInitializationFailedException error) {
    logger.log(Level.WARNING, String.format("Fixture %s failed to initialize", record.key()), error.getCause());
    record.markFaulted(error);
  }

  /**
   * 沿需求链 DFS，返回第一个发现的环（首尾为同一夹具类型），无环时返回 null。
   */
  static List<String> findCycle(FixtureType<?> type, List<String> path, Set<String> finished) {
    String name = type.name();
    int at = path.indexOf(name);
    if (at >= 0) {
      List<String> cycle = new ArrayList<>(path.subList(at, path.size()));
      cycle.add(name);
      return cycle;
    }
    if (finished.contains(name)) {
      return null;
    }
    path.add(name);
    for (FixtureRequirement requirement : type.requirements()) {
      List<String> cycle = findCycle(requirement.type(), path, finished);
      if (cycle != null) {
        return cycle;
      }
    }
    path.remove(path.size() - 1);
    finished.add(name);
    return null;
  }

  private static ScopeKey keyFor(FixtureRequirement requirement, ScopeCoordinates coordinates, ScopeKey parent) {
    String typeName = requirement.type().name();
    String discriminator = switch (requirement.shared()) {
      case NONE -> parent != null ? parent.toString() : coordinates.attemptScope();
      case PER_CLASS -> coordinates.classId();
      case PER_ASSEMBLY -> coordinates.assemblyId();
      case PER_SESSION -> "";
      case KEYED -> requirement.key();
    };
    return new ScopeKey(typeName, requirement.shared(), discriminator);
  }

  // ========= 释放 =========

  private CompletableFuture<Void> disposeIfEligible(FixtureRecord record, List<Throwable> errors) {
    if (!record.isScopeClosed() || record.hasConsumers() || !record.claimDisposal()) {
      return CompletableFuture.completedFuture(null);
    }
    records.remove(record.key(), record);

    FixtureState state = record.state();
    Object instance = record.instance();
    CompletableFuture<Void> disposal;
    if (state == FixtureState.UNINITIALIZED || state == FixtureState.INITIALIZING) {
      logger.warning(String.format("Fixture %s closed while %s, disposal skipped", record.key(), state));
      disposal = CompletableFuture.completedFuture(null);
    } else if (instance == null) {
      disposal = CompletableFuture.completedFuture(null);
    } else {
      disposal = disposeInstance(record.type(), instance);
    }

    return disposal
        .handle((v, error) -> {
          if (error != null) {
            Throwable cause = Futures.unwrap(error);
            errors.add(cause);
            logger.log(Level.WARNING, String.format("Fixture %s failed to dispose", record.key()), cause);
          } else {
            logger.fine(String.format("Fixture %s disposed", record.key()));
          }
          record.markDisposed();
          return (Void) null;
        })
        .thenCompose(v -> releaseChildren(record, errors));
  }

  private CompletableFuture<Void> releaseChildren(FixtureRecord parent, List<Throwable> errors) {
    List<FixtureRecord> children = new ArrayList<>(parent.children());
    if (children.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    children.sort(Comparator.comparingLong(FixtureRecord::readySequence).reversed());
    String parentId = parent.key().toString();
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (FixtureRecord child : children) {
      child.removeConsumer(parentId);
      if (child.key().shared() == SharedType.NONE) {
        // 父夹具独占的嵌套夹具随父夹具关闭
        child.closeScope();
      }
      chain = chain.thenCompose(v -> disposeIfEligible(child, errors));
    }
    return chain;
  }

  @SuppressWarnings("unchecked")
  private static <T> CompletableFuture<Void> disposeInstance(FixtureType<T> type, Object instance) {
    try {
      return type.dispose((T) instance).toCompletableFuture();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}
