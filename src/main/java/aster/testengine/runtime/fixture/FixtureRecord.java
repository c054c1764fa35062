package aster.testengine.runtime.fixture;

import aster.testengine.core.FixtureType;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 夹具记录 - 一个作用域键对应的共享资源实例
 *
 * 初始化由单次赋值的 promise 保护：第一个请求者通过 CAS 取得初始化权，其余请求者等待同一个 promise。
 * consumers 为当前持有者集合（测试 ID 或父夹具的键），用于决定释放时机。
 */
public final class FixtureRecord {
  private final ScopeKey key;
  private final FixtureType<?> type;
  private final AtomicReference<FixtureState> state = new AtomicReference<>(FixtureState.UNINITIALIZED);
  private final CompletableFuture<Object> promise = new CompletableFuture<>();
  private final Set<String> consumers = ConcurrentHashMap.newKeySet();
  // 本夹具作为使用者持有的嵌套夹具
  private final List<FixtureRecord> children = new CopyOnWriteArrayList<>();
  private final AtomicBoolean scopeClosed = new AtomicBoolean();
  private final AtomicBoolean disposalClaimed = new AtomicBoolean();
  private volatile Object instance;
  private volatile long readySequence;

  FixtureRecord(ScopeKey key, FixtureType<?> type) {
    this.key = key;
    this.type = type;
  }

  public ScopeKey key() {
    return key;
  }

  public FixtureType<?> type() {
    return type;
  }

  public FixtureState state() {
    return state.get();
  }

  /**
   * @return 就绪时完成为实例，失败时以 FixtureInitializationFailedException 异常完成
   */
  public CompletableFuture<Object> promise() {
    return promise;
  }

  public long readySequence() {
    return readySequence;
  }

  public Set<String> consumers() {
    return Set.copyOf(consumers);
  }

  Object instance() {
    return instance;
  }

  void instance(Object value) {
    this.instance = value;
  }

  List<FixtureRecord> children() {
    return children;
  }

  void holdChild(FixtureRecord child) {
    children.add(child);
  }

  boolean claim() {
    return state.compareAndSet(FixtureState.UNINITIALIZED, FixtureState.INITIALIZING);
  }

  void markReady(long sequence, Object value) {
    this.readySequence = sequence;
    state.set(FixtureState.READY);
    promise.complete(value);
  }

  void markFaulted(Throwable error) {
    state.set(FixtureState.FAULTED);
    promise.completeExceptionally(error);
  }

  void markDisposed() {
    state.set(FixtureState.DISPOSED);
  }

  void addConsumer(String consumerId) {
    consumers.add(consumerId);
  }

  void removeConsumer(String consumerId) {
    consumers.remove(consumerId);
  }

  boolean hasConsumers() {
    return !consumers.isEmpty();
  }

  boolean closeScope() {
    return scopeClosed.compareAndSet(false, true);
  }

  boolean isScopeClosed() {
    return scopeClosed.get();
  }

  boolean claimDisposal() {
    return disposalClaimed.compareAndSet(false, true);
  }

  @Override
  public String toString() {
    return String.format("FixtureRecord{%s, state=%s, consumers=%d}", key, state(), consumers.size());
  }
}
