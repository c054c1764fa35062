package aster.testengine.report;

import java.time.Duration;

/**
 * 重试事件，在节点重新入队之前发出。
 *
 * @param testId 测试 ID
 * @param failedAttempt 刚失败的尝试序号
 * @param maxAttempts 最大尝试次数（重试上限 + 1）
 * @param failure 失败原因
 * @param delay 重新准入前的退避时间
 */
public record RetryEvent(String testId, int failedAttempt, int maxAttempts, Throwable failure, Duration delay) {
}
