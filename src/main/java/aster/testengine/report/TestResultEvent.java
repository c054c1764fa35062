package aster.testengine.report;

import aster.testengine.exceptions.ErrorKind;
import java.time.Duration;

/**
 * 执行节点终止事件
 *
 * @param testId 测试 ID
 * @param classId 所属类
 * @param outcome 终止结果
 * @param duration 首次开始到终止的耗时
 * @param attempts 尝试次数（从未开始为 0）
 * @param error 捕获的错误，通过时为 null
 * @param errorKind 错误分类，通过时为 null
 */
public record TestResultEvent(String testId, String classId, Outcome outcome, Duration duration,
                              int attempts, Throwable error, ErrorKind errorKind) {
}
