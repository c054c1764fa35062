package aster.testengine.report;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 通过 java.util.logging 输出运行进度，供 CLI 使用。
 */
public final class LoggingReportSink implements ReportSink {
  private static final Logger logger = Logger.getLogger(LoggingReportSink.class.getName());

  @Override
  public void onSessionStarted(int testCount) {
    logger.info(String.format("Session started: %d tests", testCount));
  }

  @Override
  public void onTestFinished(TestResultEvent event) {
    String line = String.format("%-9s %s (%dms, attempts=%d)", event.outcome(), event.testId(),
        event.duration().toMillis(), event.attempts());
    switch (event.outcome()) {
      case PASSED -> logger.info(line);
      case SKIPPED, CANCELLED -> logger.info(line + ": " + firstLine(event.error()));
      case FAILED -> logger.log(Level.WARNING, line, event.error());
    }
  }

  @Override
  public void onHookScope(HookScopeEvent event) {
    if (event.failed()) {
      logger.log(Level.WARNING, String.format("%s %s hooks failed for %s",
          event.kind(), event.phase(), event.scopeId()), event.error());
    } else {
      logger.fine(String.format("%s %s hooks completed for %s", event.kind(), event.phase(), event.scopeId()));
    }
  }

  @Override
  public void onTestRetry(RetryEvent event) {
    logger.info(String.format("RETRY     %s (attempt %d/%d failed, retrying in %dms): %s", event.testId(),
        event.failedAttempt(), event.maxAttempts(), event.delay().toMillis(), firstLine(event.failure())));
  }

  @Override
  public void onSessionFinished(RunSummary summary) {
    logger.info("Session finished: " + summary);
  }

  private static String firstLine(Throwable error) {
    if (error == null || error.getMessage() == null) {
      return error == null ? "" : error.getClass().getSimpleName();
    }
    String message = error.getMessage();
    int newline = message.indexOf('\n');
    return newline < 0 ? message : message.substring(0, newline);
  }
}
