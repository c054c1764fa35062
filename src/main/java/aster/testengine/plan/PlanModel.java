package aster.testengine.plan;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * JSON 测试计划模型
 *
 * 测试体、钩子与夹具工厂均以 "类全名#方法名" 引用 public 方法，由 {@link PlanLoader} 解析为引擎描述。
 * 未识别的字段一律忽略，便于计划生成器附带自己的元数据。
 */
public final class PlanModel {

  private PlanModel() {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static final class Plan {
    public String name;
    public List<Fixture> fixtures;
    public List<HookDecl> hooks;
    public List<Test> tests;
  }

  /**
   * 夹具类型声明。factory 可接收 FixtureContext；dispose 为可选的单参数静态方法，缺省时关闭 AutoCloseable 实例。
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static final class Fixture {
    public String name;
    public String factory;
    public String dispose;
    public List<Requirement> requires;
  }

  /**
   * 夹具需求。fixture 缺省时与注入名 name 相同；shared 缺省为 NONE。
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static final class Requirement {
    public String name;
    public String fixture;
    public String shared;
    public String key;
  }

  /**
   * 钩子声明
   *
   * scope 取 SESSION / ASSEMBLY / CLASS / TEST，phase 取 before / after。target 为程序集、类或测试的 ID，
   * SESSION 忽略 target，其余缺省时作用于全部。
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static final class HookDecl {
    public String scope;
    public String phase;
    public String target;
    public String method;
    public int order;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static final class Test {
    public String id;
    @JsonAlias("class")
    public String classId;
    public String assembly;
    public String method;
    public List<String> dependsOn;
    // 仅约束顺序：前置测试以任意终止状态结束后即可运行
    public List<String> runsAfter;
    public List<String> notInParallel;
    public boolean exclusive;
    public boolean classExclusive;
    public String parallelGroup;
    public Limit parallelLimit;
    public int retries;
    public String backoff;
    public long backoffMs;
    public Long timeoutMs;
    public int priority;
    public String skip;
    public List<Requirement> fixtures;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static final class Limit {
    public String name;
    @JsonAlias("maxConcurrency")
    public int max;
  }
}
