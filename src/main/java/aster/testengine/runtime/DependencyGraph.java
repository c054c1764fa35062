package aster.testengine.runtime;

import aster.testengine.core.DependencyEdge;
import aster.testengine.core.TestDescriptor;
import aster.testengine.exceptions.EngineConfigurationException;
import java.util.*;
import java.util.function.Function;

/**
 * 依赖图 - 由 DependsOn 声明构建的测试有向图
 *
 * - 正向边（依赖谁）与反向边（被谁依赖）
 * - 强连通分量检测：环上的测试单独失败，不中止整个运行
 * - 就绪判定：前置全部终止且满足继续策略
 *
 * 构建完成后只读，可在调度期间无锁读取。
 */
public final class DependencyGraph {
  // test_id -> 依赖声明（保持声明顺序）
  private final Map<String, List<DependencyEdge>> predecessors = new LinkedHashMap<>();
  // test_id -> 依赖此测试的后续测试
  private final Map<String, Set<String>> dependents = new HashMap<>();
  // test_id -> 所在环的成员（按声明顺序）
  private final Map<String, List<String>> cycles = new HashMap<>();

  /**
   * 就绪判定结果
   */
  public enum Status {
    BLOCKED,
    READY,
    SKIP
  }

  /**
   * @param status 判定结果
   * @param predecessorId SKIP 时导致跳过的前置测试
   * @param predecessorState SKIP 时前置测试的终止状态
   */
  public record Readiness(Status status, String predecessorId, NodeState predecessorState) {
    static final Readiness BLOCKED = new Readiness(Status.BLOCKED, null, null);
    static final Readiness READY = new Readiness(Status.READY, null, null);
  }

  private DependencyGraph() {
  }

  /**
   * 构建依赖图
   *
   * @param descriptors 全部测试描述（声明顺序）
   * @return 只读依赖图
   * @throws EngineConfigurationException 如果测试 ID 重复或依赖目标不存在
   */
  public static DependencyGraph build(List<TestDescriptor> descriptors) {
    DependencyGraph graph = new DependencyGraph();
    for (TestDescriptor descriptor : descriptors) {
      if (graph.predecessors.containsKey(descriptor.id())) {
        throw new EngineConfigurationException(ErrorMessages.duplicateTest(descriptor.id()));
      }
      graph.predecessors.put(descriptor.id(), descriptor.dependencies());
      graph.dependents.put(descriptor.id(), new LinkedHashSet<>());
    }
    for (TestDescriptor descriptor : descriptors) {
      for (DependencyEdge edge : descriptor.dependencies()) {
        Set<String> reverse = graph.dependents.get(edge.testId());
        if (reverse == null) {
          throw new EngineConfigurationException(ErrorMessages.unknownDependency(descriptor.id(), edge.testId()));
        }
        reverse.add(descriptor.id());
      }
    }
    graph.detectCycles();
    return graph;
  }

  /**
   * @return 全部测试 ID（声明顺序）
   */
  public List<String> ids() {
    return List.copyOf(predecessors.keySet());
  }

  public List<DependencyEdge> predecessorsOf(String testId) {
    return predecessors.getOrDefault(testId, List.of());
  }

  public Set<String> dependentsOf(String testId) {
    return Collections.unmodifiableSet(dependents.getOrDefault(testId, Set.of()));
  }

  public boolean isInCycle(String testId) {
    return cycles.containsKey(testId);
  }

  /**
   * @return 测试所在环的成员；不在环上时为空列表
   */
  public List<String> cycleOf(String testId) {
    return cycles.getOrDefault(testId, List.of());
  }

  /**
   * 判断测试当前能否运行
   *
   * 默认策略：任一前置以非 PASSED 终止则传递跳过；proceedOnFailure 的边只要求前置终止。
   *
   * @param testId 测试 ID
   * @param stateOf 查询节点当前状态
   * @return 就绪判定
   */
  public Readiness readiness(String testId, Function<String, NodeState> stateOf) {
    boolean blocked = false;
    for (DependencyEdge edge : predecessorsOf(testId)) {
      NodeState state = stateOf.apply(edge.testId());
      if (!state.isTerminal()) {
        blocked = true;
        continue;
      }
      if (state != NodeState.PASSED && !edge.proceedOnFailure()) {
        return new Readiness(Status.SKIP, edge.testId(), state);
      }
    }
    return blocked ? Readiness.BLOCKED : Readiness.READY;
  }

  /**
   * 循环依赖检测 - Tarjan 强连通分量（DFS）
   *
   * 大小超过 1 的分量或自环上的每个测试都记录其所在环。
   */
  private void detectCycles() {
    Map<String, Integer> index = new HashMap<>();
    Map<String, Integer> lowLink = new HashMap<>();
    Deque<String> stack = new ArrayDeque<>();
    Set<String> onStack = new HashSet<>();
    int[] counter = {0};
    List<String> order = new ArrayList<>(predecessors.keySet());

    for (String testId : order) {
      if (!index.containsKey(testId)) {
        strongConnect(testId, index, lowLink, stack, onStack, counter, order);
      }
    }
  }

  /**
   * DFS 栈帧：当前测试及下一条待访问的依赖边
   */
  private static final class Frame {
    final String testId;
    final List<DependencyEdge> edges;
    int next;
    boolean selfLoop;

    Frame(String testId, List<DependencyEdge> edges) {
      this.testId = testId;
      this.edges = edges;
    }
  }

  // 显式栈迭代，依赖链长度不受线程栈深度限制
  private void strongConnect(String root, Map<String, Integer> index, Map<String, Integer> lowLink,
                             Deque<String> stack, Set<String> onStack, int[] counter, List<String> order) {
    Deque<Frame> frames = new ArrayDeque<>();
    frames.push(enter(root, index, lowLink, stack, onStack, counter));

    while (!frames.isEmpty()) {
      Frame frame = frames.peek();
      if (frame.next < frame.edges.size()) {
        String dep = frame.edges.get(frame.next++).testId();
        if (dep.equals(frame.testId)) {
          frame.selfLoop = true;
        }
        if (!index.containsKey(dep)) {
          frames.push(enter(dep, index, lowLink, stack, onStack, counter));
        } else if (onStack.contains(dep)) {
          // 回边
          lowLink.put(frame.testId, Math.min(lowLink.get(frame.testId), index.get(dep)));
        }
        continue;
      }

      frames.pop();
      Frame parent = frames.peek();
      if (parent != null) {
        lowLink.put(parent.testId, Math.min(lowLink.get(parent.testId), lowLink.get(frame.testId)));
      }
      if (lowLink.get(frame.testId).equals(index.get(frame.testId))) {
        recordComponent(frame, stack, onStack, order);
      }
    }
  }

  private Frame enter(String testId, Map<String, Integer> index, Map<String, Integer> lowLink,
                      Deque<String> stack, Set<String> onStack, int[] counter) {
    index.put(testId, counter[0]);
    lowLink.put(testId, counter[0]);
    counter[0]++;
    stack.push(testId);
    onStack.add(testId);
    return new Frame(testId, predecessorsOf(testId));
  }

  private void recordComponent(Frame frame, Deque<String> stack, Set<String> onStack, List<String> order) {
    Set<String> component = new HashSet<>();
    String member;
    do {
      member = stack.pop();
      onStack.remove(member);
      component.add(member);
    } while (!member.equals(frame.testId));

    if (component.size() > 1 || frame.selfLoop) {
      List<String> members = new ArrayList<>();
      for (String id : order) {
        if (component.contains(id)) {
          members.add(id);
        }
      }
      List<String> cycle = List.copyOf(members);
      for (String id : cycle) {
        cycles.put(id, cycle);
      }
    }
  }
}
