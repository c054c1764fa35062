package aster.testengine.runtime;

import aster.testengine.core.ScopeKind;
import java.time.Duration;
import java.util.List;

/**
 * 错误消息统一生成工具。
 *
 * <p>所有错误消息均提供中英文双语描述并附带恢复提示。英文部分保留稳定关键字
 * （如 "Circular dependency"、"timed out"），报告器与测试据此匹配。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息，保持英文关键字用于兼容既有测试。
   *
   * @param zh 中文描述
   * @param en 英文描述（保留原有关键词）
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   *
   * @param message 主体消息
   * @param hintZh 中文提示
   * @param hintEn 英文提示
   * @return 包含提示信息的完整消息文本
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  /**
   * 构造测试依赖成环的错误消息。
   *
   * @param cycle 环上的测试 ID
   * @return 带有恢复建议的循环依赖描述
   */
  public static String circularDependency(List<String> cycle) {
    String path = String.join(" -> ", cycle) + (cycle.isEmpty() ? "" : " -> " + cycle.get(0));
    String english = "Circular dependency detected: " + path;
    String message = bilingual("检测到循环依赖：" + path, english);
    return withHint(message, "移除环上任一 DependsOn 声明", "Remove one DependsOn declaration on the cycle");
  }

  /**
   * 构造夹具成环的错误消息。
   *
   * @param path 从首个夹具到重复夹具的路径
   * @return 带有恢复建议的夹具循环描述
   */
  public static String fixtureCycle(List<String> path) {
    String joined = String.join(" -> ", path);
    String english = "Fixture cycle detected: " + joined;
    String message = bilingual("检测到夹具循环依赖：" + joined, english);
    return withHint(message, "拆分夹具或改为按需查找，打破相互依赖", "Split the fixtures or break the mutual requirement");
  }

  /**
   * 构造夹具初始化失败的错误消息。
   *
   * @param scopeKey 失败夹具的作用域键
   * @param cause 根因
   * @return 带有恢复建议的夹具失败描述
   */
  public static String fixtureInitializationFailed(String scopeKey, Throwable cause) {
    String english = "Fixture initialization failed for " + scopeKey + ": " + describe(cause);
    String message = bilingual("夹具初始化失败：" + scopeKey, english);
    return withHint(message, "修复夹具初始化逻辑；依赖此夹具的测试已被跳过",
        "Fix the fixture initializer; dependent tests were skipped");
  }

  /**
   * 构造钩子失败的错误消息。
   *
   * @param kind 作用域类型
   * @param scopeId 作用域标识
   * @param before 是否 before 阶段
   * @param cause 根因
   * @return 带有恢复建议的钩子失败描述
   */
  public static String hookFailed(ScopeKind kind, String scopeId, boolean before, Throwable cause) {
    String phase = before ? "before" : "after";
    String english = kind + " " + phase + " hook failed for " + scopeId + ": " + describe(cause);
    String message = bilingual(kind + " 作用域 " + scopeId + " 的 " + phase + " 钩子失败", english);
    return withHint(message, "检查钩子实现；before 失败会使作用域内未开始的测试失败",
        "Inspect the hook; a failing before hook fails every test of the scope that has not started");
  }

  /**
   * 构造单次尝试超时的错误消息。
   *
   * @param testId 测试 ID
   * @param timeout 声明的超时时间
   * @return 带有恢复建议的超时描述
   */
  public static String timedOut(String testId, Duration timeout) {
    String english = "Test " + testId + " timed out after " + timeout.toMillis() + "ms";
    String message = bilingual("测试 " + testId + " 超时（" + timeout.toMillis() + "ms）", english);
    return withHint(message, "确保测试体响应取消信号，或放宽超时", "Observe the cancellation token or raise the timeout");
  }

  /**
   * 构造会话取消的错误消息。
   *
   * @param reason 取消原因
   * @return 取消描述
   */
  public static String cancelled(String reason) {
    String english = "Cancelled: " + reason;
    return bilingual("已取消：" + reason, english);
  }

  /**
   * 构造前置依赖未满足而跳过的消息。
   *
   * @param testId 被跳过的测试
   * @param predecessorId 未成功的前置测试
   * @param predecessorState 前置测试的终止状态
   * @return 跳过描述
   */
  public static String dependencyNotSatisfied(String testId, String predecessorId, NodeState predecessorState) {
    String english = "Skipped " + testId + " because dependency " + predecessorId + " ended " + predecessorState;
    return bilingual("测试 " + testId + " 的依赖 " + predecessorId + " 以 " + predecessorState + " 结束，已跳过", english);
  }

  /**
   * 构造依赖目标不存在的错误消息。
   */
  public static String unknownDependency(String testId, String target) {
    String english = "Test " + testId + " depends on unknown test " + target;
    String message = bilingual("测试 " + testId + " 依赖的测试不存在：" + target, english);
    return withHint(message, "确认依赖的测试 ID 已被发现", "Ensure the dependency target was discovered");
  }

  /**
   * 构造测试 ID 重复的错误消息。
   */
  public static String duplicateTest(String testId) {
    String english = "Test already exists: " + testId;
    String message = bilingual("测试 ID 重复：" + testId, english);
    return withHint(message, "为每个测试生成唯一 ID", "Give every test a unique identifier");
  }

  /**
   * 构造配置项非法的错误消息。
   */
  public static String invalidConfig(String name, Object value, String expectation) {
    String english = "Invalid configuration " + name + "=" + value + " (" + expectation + ")";
    String message = bilingual("配置项非法：" + name + "=" + value, english);
    return withHint(message, expectation, expectation);
  }

  /**
   * 构造测试计划非法的错误消息。
   *
   * @param location 出错的计划元素，例如 "tests[2].method"
   * @param detail 具体原因
   * @return 带有恢复建议的计划错误描述
   */
  public static String invalidPlan(String location, String detail) {
    String english = "Invalid test plan at " + location + ": " + detail;
    String message = bilingual("测试计划非法：" + location + "，" + detail, english);
    return withHint(message, "方法引用使用 类全名#方法名 格式，且方法必须为 public",
        "Reference methods as fully.qualified.Class#method and make them public");
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown";
    }
    String text = cause.getMessage();
    return text != null ? text : cause.getClass().getSimpleName();
  }
}
