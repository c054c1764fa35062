package aster.testengine.plan;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.DependencyEdge;
import aster.testengine.core.FixtureContext;
import aster.testengine.core.FixtureRequirement;
import aster.testengine.core.Hook;
import aster.testengine.core.HookBindings;
import aster.testengine.core.InvocationContext;
import aster.testengine.core.ParallelLimit;
import aster.testengine.core.RetryPolicy;
import aster.testengine.core.ScopeKind;
import aster.testengine.core.SharedType;
import aster.testengine.core.TestDescriptor;
import aster.testengine.exceptions.EngineConfigurationException;
import aster.testengine.runtime.ErrorMessages;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.InvocationTargetException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 测试计划加载器：读取 JSON 计划并构建 {@link TestDescriptor} 列表。
 *
 * 方法引用、夹具引用与钩子声明在加载时全部解析，任何错误以 {@link EngineConfigurationException} 抛出，
 * 保证运行开始前发现计划问题。
 */
public final class PlanLoader {
  private static final Logger logger = Logger.getLogger(PlanLoader.class.getName());

  private static final Set<Class<?>> INVOKABLE_PARAMETERS = Set.of(InvocationContext.class, CancellationToken.class);
  private static final Set<Class<?>> FACTORY_PARAMETERS = Set.of(FixtureContext.class);

  private final ObjectMapper mapper = new ObjectMapper();
  private final ClassLoader classLoader;

  public PlanLoader() {
    this(PlanLoader.class.getClassLoader());
  }

  public PlanLoader(ClassLoader classLoader) {
    this.classLoader = classLoader;
  }

  public List<TestDescriptor> load(File file) throws IOException {
    return toDescriptors(mapper.readValue(file, PlanModel.Plan.class));
  }

  public List<TestDescriptor> load(InputStream in) throws IOException {
    return toDescriptors(mapper.readValue(in, PlanModel.Plan.class));
  }

  public List<TestDescriptor> parse(String json) throws IOException {
    return toDescriptors(mapper.readValue(json, PlanModel.Plan.class));
  }

  /**
   * 把计划模型转换为测试描述。
   *
   * @throws EngineConfigurationException 如果计划引用了不存在的类、方法或夹具，或取值非法
   */
  public List<TestDescriptor> toDescriptors(PlanModel.Plan plan) {
    Map<String, ReflectiveFixtureType> fixtureTypes = loadFixtures(plan.fixtures);
    List<BoundHook> hooks = loadHooks(plan.hooks);
    List<TestDescriptor> descriptors = new ArrayList<>();
    if (plan.tests != null) {
      for (int i = 0; i < plan.tests.size(); i++) {
        String location = "tests[" + i + "]";
        try {
          descriptors.add(toDescriptor(location, plan.tests.get(i), fixtureTypes, hooks));
        } catch (EngineConfigurationException e) {
          throw e;
        } catch (IllegalArgumentException | NullPointerException e) {
          throw new EngineConfigurationException(ErrorMessages.invalidPlan(location, e.getMessage()), e);
        }
      }
    }
    logger.fine(String.format("Loaded plan %s: %d tests, %d fixtures, %d hooks",
        plan.name, descriptors.size(), fixtureTypes.size(), hooks.size()));
    return descriptors;
  }

  private Map<String, ReflectiveFixtureType> loadFixtures(List<PlanModel.Fixture> declarations) {
    Map<String, ReflectiveFixtureType> types = new LinkedHashMap<>();
    if (declarations == null) {
      return types;
    }
    for (int i = 0; i < declarations.size(); i++) {
      PlanModel.Fixture fixture = declarations.get(i);
      String location = "fixtures[" + i + "]";
      if (fixture.name == null || fixture.name.isBlank()) {
        throw new EngineConfigurationException(ErrorMessages.invalidPlan(location, "fixture name is missing"));
      }
      MethodReference factory = MethodReference.parse(location + ".factory", fixture.factory, classLoader,
          FACTORY_PARAMETERS);
      if (!factory.isStatic()) {
        throw new EngineConfigurationException(ErrorMessages.invalidPlan(location + ".factory",
            "fixture factory must be static: " + fixture.factory));
      }
      MethodReference dispose = fixture.dispose == null ? null
          : MethodReference.parseUnaryStatic(location + ".dispose", fixture.dispose, classLoader);
      if (types.putIfAbsent(fixture.name, new ReflectiveFixtureType(fixture.name, factory, dispose)) != null) {
        throw new EngineConfigurationException(ErrorMessages.invalidPlan(location, "duplicate fixture " + fixture.name));
      }
    }
    // 全部类型创建后再绑定嵌套需求，允许前向引用
    for (int i = 0; i < declarations.size(); i++) {
      PlanModel.Fixture fixture = declarations.get(i);
      types.get(fixture.name).bind(toRequirements("fixtures[" + i + "].requires", fixture.requires, types));
    }
    return types;
  }

  private List<BoundHook> loadHooks(List<PlanModel.HookDecl> declarations) {
    List<BoundHook> hooks = new ArrayList<>();
    if (declarations == null) {
      return hooks;
    }
    for (int i = 0; i < declarations.size(); i++) {
      PlanModel.HookDecl decl = declarations.get(i);
      String location = "hooks[" + i + "]";
      ScopeKind kind = parseEnum(location + ".scope", decl.scope, ScopeKind.class);
      boolean before = switch (decl.phase == null ? "" : decl.phase.trim().toLowerCase(Locale.ROOT)) {
        case "before" -> true;
        case "after" -> false;
        default -> throw new EngineConfigurationException(
            ErrorMessages.invalidPlan(location + ".phase", "expected before or after but got " + decl.phase));
      };
      MethodReference method = MethodReference.parse(location + ".method", decl.method, classLoader,
          INVOKABLE_PARAMETERS);
      if (kind != ScopeKind.TEST && !method.isStatic()) {
        throw new EngineConfigurationException(ErrorMessages.invalidPlan(location + ".method",
            kind + " hooks run without a test instance and must be static: " + decl.method));
      }
      hooks.add(new BoundHook(kind, before, decl.target,
          new Hook(decl.method, decl.order, new ReflectiveInvokable(method))));
    }
    return hooks;
  }

  private TestDescriptor toDescriptor(String location, PlanModel.Test test, Map<String, ReflectiveFixtureType> types,
                                      List<BoundHook> hooks) {
    if (test.id == null || test.id.isBlank()) {
      throw new EngineConfigurationException(ErrorMessages.invalidPlan(location, "test id is missing"));
    }
    MethodReference method = test.method == null && test.skip != null ? null
        : MethodReference.parse(location + ".method", test.method, classLoader, INVOKABLE_PARAMETERS);
    String classId = test.classId != null ? test.classId
        : method != null ? method.owner().getName() : "default";
    TestDescriptor.Builder builder = TestDescriptor.builder(test.id, classId);
    if (test.assembly != null) {
      builder.assembly(test.assembly);
    }
    if (test.dependsOn != null) {
      test.dependsOn.forEach(builder::dependsOn);
    }
    if (test.runsAfter != null) {
      test.runsAfter.forEach(id -> builder.dependsOn(DependencyEdge.proceedingOnFailure(id)));
    }
    if (test.notInParallel != null && !test.notInParallel.isEmpty()) {
      builder.notInParallel(test.notInParallel.toArray(new String[0]));
    }
    if (test.exclusive) {
      builder.notInParallel();
    }
    if (test.classExclusive) {
      builder.notInParallelWithinClass();
    }
    builder.parallelGroup(test.parallelGroup);
    if (test.parallelLimit != null) {
      builder.parallelLimit(new ParallelLimit(test.parallelLimit.name, test.parallelLimit.max));
    }
    if (test.retries > 0) {
      builder.retry(new RetryPolicy(test.retries, RetryPolicy.Backoff.parse(test.backoff),
          Duration.ofMillis(test.backoffMs)));
    }
    if (test.timeoutMs != null) {
      builder.timeout(Duration.ofMillis(test.timeoutMs));
    }
    builder.priority(test.priority);
    if (test.skip != null) {
      builder.skip(test.skip);
    }
    toRequirements(location + ".fixtures", test.fixtures, types).forEach(builder::fixture);
    builder.hooks(bindHooks(test.id, classId, test.assembly != null ? test.assembly : TestDescriptor.DEFAULT_ASSEMBLY,
        hooks));
    if (method != null) {
      builder.body(new ReflectiveInvokable(method));
      if (!method.isStatic()) {
        Class<?> owner = method.owner();
        builder.instanceFactory(context -> instantiate(owner));
      }
    }
    return builder.build();
  }

  private static List<FixtureRequirement> toRequirements(String location, List<PlanModel.Requirement> declarations,
                                                         Map<String, ReflectiveFixtureType> types) {
    List<FixtureRequirement> requirements = new ArrayList<>();
    if (declarations == null) {
      return requirements;
    }
    for (int i = 0; i < declarations.size(); i++) {
      PlanModel.Requirement decl = declarations.get(i);
      String at = location + "[" + i + "]";
      if (decl.name == null || decl.name.isBlank()) {
        throw new EngineConfigurationException(ErrorMessages.invalidPlan(at, "requirement name is missing"));
      }
      String fixtureName = decl.fixture != null ? decl.fixture : decl.name;
      ReflectiveFixtureType type = types.get(fixtureName);
      if (type == null) {
        throw new EngineConfigurationException(ErrorMessages.invalidPlan(at, "unknown fixture " + fixtureName));
      }
      SharedType shared = decl.shared == null ? SharedType.NONE : parseEnum(at + ".shared", decl.shared, SharedType.class);
      try {
        requirements.add(new FixtureRequirement(decl.name, type, shared, decl.key));
      } catch (IllegalArgumentException e) {
        throw new EngineConfigurationException(ErrorMessages.invalidPlan(at, e.getMessage()), e);
      }
    }
    return requirements;
  }

  private static HookBindings bindHooks(String testId, String classId, String assemblyId, List<BoundHook> hooks) {
    HookBindings.Builder bindings = HookBindings.builder();
    for (BoundHook hook : hooks) {
      if (!hook.appliesTo(testId, classId, assemblyId)) {
        continue;
      }
      if (hook.before()) {
        bindings.before(hook.kind(), hook.hook());
      } else {
        bindings.after(hook.kind(), hook.hook());
      }
    }
    return bindings.build();
  }

  private static Object instantiate(Class<?> owner) throws Exception {
    try {
      return owner.getDeclaredConstructor().newInstance();
    } catch (InvocationTargetException e) {
      if (e.getCause() instanceof Exception cause) {
        throw cause;
      }
      throw e;
    }
  }

  private static <E extends Enum<E>> E parseEnum(String location, String value, Class<E> type) {
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new EngineConfigurationException(ErrorMessages.invalidPlan(location,
          "unknown " + type.getSimpleName() + " " + value), e);
    }
  }

  /**
   * 已解析的钩子声明
   */
  private record BoundHook(ScopeKind kind, boolean before, String target, Hook hook) {

    boolean appliesTo(String testId, String classId, String assemblyId) {
      if (target == null) {
        return true;
      }
      return switch (kind) {
        case SESSION -> true;
        case ASSEMBLY -> target.equals(assemblyId);
        case CLASS -> target.equals(classId);
        case TEST -> target.equals(classId) || target.equals(testId);
      };
    }
  }
}
