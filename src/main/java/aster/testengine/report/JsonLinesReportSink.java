package aster.testengine.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * JSON Lines 报告器：每个事件输出一行 JSON 对象，作为"重跑失败用例"等外部工具的输入。
 *
 * 字段：
 * - test：event=test, testId, classId, outcome, durationMs, attempts, errorKind, error
 * - scope：event=scope, kind, scopeId, phase, outcome, error
 * - retry：event=retry, testId, attempt, maxAttempts, delayMs, error
 * - summary：event=summary, total, passed, failed, skipped, cancelled, scopeFailures, durationMs
 */
public final class JsonLinesReportSink implements ReportSink, AutoCloseable {
  private final ObjectMapper mapper = new ObjectMapper();
  private final Writer writer;
  private final Object writeLock = new Object();

  public JsonLinesReportSink(Writer writer) {
    this.writer = writer;
  }

  public static JsonLinesReportSink open(Path file) throws IOException {
    return new JsonLinesReportSink(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
  }

  @Override
  public void onTestFinished(TestResultEvent event) {
    ObjectNode node = mapper.createObjectNode();
    node.put("event", "test");
    node.put("testId", event.testId());
    node.put("classId", event.classId());
    node.put("outcome", event.outcome().name());
    node.put("durationMs", event.duration().toMillis());
    node.put("attempts", event.attempts());
    if (event.errorKind() != null) {
      node.put("errorKind", event.errorKind().name());
    }
    putError(node, event.error());
    write(node);
  }

  @Override
  public void onHookScope(HookScopeEvent event) {
    ObjectNode node = mapper.createObjectNode();
    node.put("event", "scope");
    node.put("kind", event.kind().name());
    node.put("scopeId", event.scopeId());
    node.put("phase", event.phase().name());
    node.put("outcome", event.outcome().name());
    putError(node, event.error());
    write(node);
  }

  @Override
  public void onTestRetry(RetryEvent event) {
    ObjectNode node = mapper.createObjectNode();
    node.put("event", "retry");
    node.put("testId", event.testId());
    node.put("attempt", event.failedAttempt());
    node.put("maxAttempts", event.maxAttempts());
    node.put("delayMs", event.delay().toMillis());
    putError(node, event.failure());
    write(node);
  }

  @Override
  public void onSessionFinished(RunSummary summary) {
    ObjectNode node = mapper.createObjectNode();
    node.put("event", "summary");
    node.put("total", summary.total());
    for (Outcome outcome : Outcome.values()) {
      node.put(outcome.name().toLowerCase(Locale.ROOT), summary.count(outcome));
    }
    node.put("scopeFailures", summary.scopeFailures().size());
    node.put("durationMs", summary.duration().toMillis());
    write(node);
    flush();
  }

  @Override
  public void close() throws IOException {
    synchronized (writeLock) {
      writer.close();
    }
  }

  private void putError(ObjectNode node, Throwable error) {
    if (error == null) {
      return;
    }
    ObjectNode err = node.putObject("error");
    err.put("type", error.getClass().getName());
    err.put("message", error.getMessage());
  }

  private void write(ObjectNode node) {
    String line;
    try {
      line = mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
    synchronized (writeLock) {
      try {
        writer.write(line);
        writer.write('\n');
        if (!(writer instanceof BufferedWriter)) {
          writer.flush();
        }
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }

  private void flush() {
    synchronized (writeLock) {
      try {
        writer.flush();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }
}
