package aster.testengine.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 测试描述 - 发现阶段产出的不可变记录
 *
 * 包含调度所需的全部约束（依赖、互斥键、并行分组、限流器、重试、超时、优先级）、
 * 夹具需求、继承的钩子以及三类可调用单元（实例工厂、测试体、钩子）。
 */
public final class TestDescriptor {
  public static final String DEFAULT_ASSEMBLY = "default";

  private final String id;
  private final String classId;
  private final String assemblyId;
  private final List<DependencyEdge> dependencies;
  private final Set<String> exclusionKeys;
  private final boolean globallyExclusive;
  private final String parallelGroup;
  private final ParallelLimit parallelLimit;
  private final RetryPolicy retryPolicy;
  private final Duration timeout;
  private final List<FixtureRequirement> fixtures;
  private final HookBindings hooks;
  private final InstanceFactory instanceFactory;
  private final Invokable body;
  private final int priority;
  private final String skipReason;

  private TestDescriptor(Builder b) {
    this.id = b.id;
    this.classId = b.classId;
    this.assemblyId = b.assemblyId;
    this.dependencies = List.copyOf(b.dependencies);
    this.exclusionKeys = Collections.unmodifiableSet(new LinkedHashSet<>(b.exclusionKeys));
    this.globallyExclusive = b.globallyExclusive;
    this.parallelGroup = b.parallelGroup;
    this.parallelLimit = b.parallelLimit;
    this.retryPolicy = b.retryPolicy;
    this.timeout = b.timeout;
    this.fixtures = List.copyOf(b.fixtures);
    this.hooks = b.hooks;
    this.instanceFactory = b.instanceFactory;
    this.body = b.body;
    this.priority = b.priority;
    this.skipReason = b.skipReason;
  }

  public static Builder builder(String id, String classId) {
    return new Builder(id, classId);
  }

  public String id() {
    return id;
  }

  public String classId() {
    return classId;
  }

  public String assemblyId() {
    return assemblyId;
  }

  public List<DependencyEdge> dependencies() {
    return dependencies;
  }

  public Set<String> exclusionKeys() {
    return exclusionKeys;
  }

  /**
   * 无键 NotInParallel：运行时不允许任何其他测试在途。
   */
  public boolean globallyExclusive() {
    return globallyExclusive;
  }

  public Optional<String> parallelGroup() {
    return Optional.ofNullable(parallelGroup);
  }

  public Optional<ParallelLimit> parallelLimit() {
    return Optional.ofNullable(parallelLimit);
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  public List<FixtureRequirement> fixtures() {
    return fixtures;
  }

  public HookBindings hooks() {
    return hooks;
  }

  public InstanceFactory instanceFactory() {
    return instanceFactory;
  }

  public Invokable body() {
    return body;
  }

  public int priority() {
    return priority;
  }

  public Optional<String> skipReason() {
    return Optional.ofNullable(skipReason);
  }

  @Override
  public String toString() {
    return "TestDescriptor{" + id + "}";
  }

  public static final class Builder {
    private final String id;
    private final String classId;
    private String assemblyId = DEFAULT_ASSEMBLY;
    private final List<DependencyEdge> dependencies = new ArrayList<>();
    private final Set<String> exclusionKeys = new LinkedHashSet<>();
    private boolean globallyExclusive;
    private String parallelGroup;
    private ParallelLimit parallelLimit;
    private RetryPolicy retryPolicy = RetryPolicy.NONE;
    private Duration timeout;
    private final List<FixtureRequirement> fixtures = new ArrayList<>();
    private HookBindings hooks = HookBindings.EMPTY;
    private InstanceFactory instanceFactory = InstanceFactory.NONE;
    private Invokable body = Invokable.NO_OP;
    private int priority;
    private String skipReason;

    private Builder(String id, String classId) {
      this.id = Objects.requireNonNull(id, "id");
      this.classId = Objects.requireNonNull(classId, "classId");
    }

    public Builder assembly(String assemblyId) {
      this.assemblyId = Objects.requireNonNull(assemblyId, "assemblyId");
      return this;
    }

    public Builder dependsOn(String... testIds) {
      for (String testId : testIds) {
        dependencies.add(DependencyEdge.on(testId));
      }
      return this;
    }

    public Builder dependsOn(DependencyEdge edge) {
      dependencies.add(Objects.requireNonNull(edge, "edge"));
      return this;
    }

    public Builder notInParallel(String... keys) {
      if (keys.length == 0) {
        globallyExclusive = true;
      }
      Collections.addAll(exclusionKeys, keys);
      return this;
    }

    /**
     * 类级互斥：同一类的测试互相串行。
     */
    public Builder notInParallelWithinClass() {
      exclusionKeys.add("class:" + classId);
      return this;
    }

    public Builder parallelGroup(String group) {
      this.parallelGroup = group;
      return this;
    }

    public Builder parallelLimit(ParallelLimit limit) {
      this.parallelLimit = limit;
      return this;
    }

    public Builder retry(RetryPolicy policy) {
      this.retryPolicy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    public Builder retries(int retryLimit) {
      return retry(RetryPolicy.retries(retryLimit));
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder fixture(FixtureRequirement requirement) {
      fixtures.add(Objects.requireNonNull(requirement, "requirement"));
      return this;
    }

    public Builder hooks(HookBindings hooks) {
      this.hooks = Objects.requireNonNull(hooks, "hooks");
      return this;
    }

    public Builder instanceFactory(InstanceFactory factory) {
      this.instanceFactory = Objects.requireNonNull(factory, "factory");
      return this;
    }

    public Builder body(Invokable body) {
      this.body = Objects.requireNonNull(body, "body");
      return this;
    }

    /**
     * 同步测试体，在工作线程上执行。
     */
    public Builder blockingBody(Invokable.Body body) {
      return body(Invokable.blocking(body));
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder skip(String reason) {
      this.skipReason = reason;
      return this;
    }

    public TestDescriptor build() {
      return new TestDescriptor(this);
    }
  }
}
