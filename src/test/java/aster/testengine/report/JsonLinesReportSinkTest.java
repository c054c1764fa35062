package aster.testengine.report;

import aster.testengine.core.ScopeKind;
import aster.testengine.exceptions.ErrorKind;
import aster.testengine.exceptions.HookFailureException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JsonLinesReportSink 与汇总统计测试
 */
public class JsonLinesReportSinkTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private List<JsonNode> lines(StringWriter out) throws Exception {
    String[] raw = out.toString().split("\n");
    JsonNode[] parsed = new JsonNode[raw.length];
    for (int i = 0; i < raw.length; i++) {
      parsed[i] = mapper.readTree(raw[i]);
    }
    return List.of(parsed);
  }

  /**
   * 测试：每个事件一行 JSON，字段与类型对应。
   */
  @Test
  public void testWritesOneObjectPerEvent() throws Exception {
    StringWriter out = new StringWriter();
    JsonLinesReportSink sink = new JsonLinesReportSink(out);
    IllegalStateException failure = new IllegalStateException("bad state");

    sink.onTestFinished(new TestResultEvent("a", "A", Outcome.PASSED, Duration.ofMillis(12), 1, null, null));
    sink.onTestFinished(new TestResultEvent("b", "A", Outcome.FAILED, Duration.ofMillis(3), 2, failure,
        ErrorKind.TEST_BODY_FAILURE));
    sink.onTestRetry(new RetryEvent("b", 1, 2, failure, Duration.ofMillis(100)));
    sink.onHookScope(new HookScopeEvent(ScopeKind.CLASS, "A", HookScopeEvent.Phase.AFTER, Outcome.FAILED,
        new HookFailureException(ScopeKind.CLASS, "A", false, failure)));

    List<JsonNode> lines = lines(out);
    assertEquals(4, lines.size());

    JsonNode passed = lines.get(0);
    assertEquals("test", passed.get("event").asText());
    assertEquals("PASSED", passed.get("outcome").asText());
    assertEquals(12, passed.get("durationMs").asLong());
    assertFalse(passed.has("error"), "通过的测试不输出 error 字段");

    JsonNode failed = lines.get(1);
    assertEquals("TEST_BODY_FAILURE", failed.get("errorKind").asText());
    assertEquals(IllegalStateException.class.getName(), failed.get("error").get("type").asText());
    assertEquals(2, failed.get("attempts").asInt());

    JsonNode retry = lines.get(2);
    assertEquals("retry", retry.get("event").asText());
    assertEquals(100, retry.get("delayMs").asLong());

    JsonNode scope = lines.get(3);
    assertEquals("scope", scope.get("event").asText());
    assertEquals("CLASS", scope.get("kind").asText());
    assertEquals("AFTER", scope.get("phase").asText());
  }

  /**
   * 测试：汇总行统计各结果，作用域失败使运行不成功。
   */
  @Test
  public void testSummaryLine() throws Exception {
    StringWriter out = new StringWriter();
    JsonLinesReportSink sink = new JsonLinesReportSink(out);
    HookScopeEvent scopeFailure = new HookScopeEvent(ScopeKind.SESSION, "session", HookScopeEvent.Phase.AFTER,
        Outcome.FAILED, new IllegalStateException("dispose failed"));
    RunSummary summary = new RunSummary(List.of(
        new TestResultEvent("a", "A", Outcome.PASSED, Duration.ZERO, 1, null, null),
        new TestResultEvent("b", "A", Outcome.SKIPPED, Duration.ZERO, 0, null, ErrorKind.SKIPPED)),
        List.of(scopeFailure), Duration.ofMillis(40));

    sink.onSessionFinished(summary);

    JsonNode line = lines(out).get(0);
    assertEquals("summary", line.get("event").asText());
    assertEquals(2, line.get("total").asInt());
    assertEquals(1, line.get("passed").asInt());
    assertEquals(1, line.get("skipped").asInt());
    assertEquals(0, line.get("failed").asInt());
    assertEquals(1, line.get("scopeFailures").asInt());
    assertFalse(summary.isSuccessful(), "作用域级失败使运行不成功");
  }
}
