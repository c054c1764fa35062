package aster.testengine;

import aster.testengine.core.TestDescriptor;
import aster.testengine.exceptions.EngineConfigurationException;
import aster.testengine.plan.PlanLoader;
import aster.testengine.report.CompositeReportSink;
import aster.testengine.report.JsonLinesReportSink;
import aster.testengine.report.LoggingReportSink;
import aster.testengine.report.ReportSink;
import aster.testengine.report.RunSummary;
import aster.testengine.runtime.EngineConfig;
import aster.testengine.runtime.ErrorMessages;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 命令行入口：Runner [--parallelism=N] [--timeout-ms=N] [--fail-fast] [--report=file.jsonl] plan.json
 *
 * 命令行参数覆盖环境变量配置。全部测试通过时退出码为 0，否则为 1；参数或计划非法时为 2。
 */
public final class Runner {

  private Runner() {
  }

  public static void main(String[] args) throws Exception {
    System.exit(run(args));
  }

  static int run(String[] args) throws IOException {
    EngineConfig.Builder config = EngineConfig.fromEnvironment().toBuilder();
    String report = null;
    List<String> positional = new ArrayList<>();
    try {
      for (String a : args) {
        if (a.startsWith("--parallelism=")) {
          config.parallelism(parseInt("--parallelism", a.substring("--parallelism=".length())));
        } else if (a.startsWith("--timeout-ms=")) {
          config.defaultTimeout(Duration.ofMillis(parseInt("--timeout-ms", a.substring("--timeout-ms=".length()))));
        } else if ("--fail-fast".equals(a)) {
          config.failFast(true);
        } else if (a.startsWith("--report=")) {
          report = a.substring("--report=".length());
        } else if (a.startsWith("--")) {
          System.err.println("Unknown option: " + a);
          printUsage();
          return 2;
        } else {
          positional.add(a);
        }
      }
    } catch (EngineConfigurationException e) {
      System.err.println(e.getMessage());
      return 2;
    }
    if (positional.size() != 1) {
      printUsage();
      return 2;
    }

    File plan = new File(positional.get(0));
    if (!plan.exists()) {
      System.err.println("Plan file not found: " + plan.getAbsolutePath());
      return 2;
    }

    JsonLinesReportSink jsonReport = report == null ? null : JsonLinesReportSink.open(Path.of(report));
    try {
      ReportSink sink = jsonReport == null ? new LoggingReportSink()
          : CompositeReportSink.of(new LoggingReportSink(), jsonReport);
      TestEngine engine = new TestEngine(config.build(), sink);
      List<TestDescriptor> descriptors = new PlanLoader().load(plan);
      RunSummary summary = engine.run(descriptors);
      System.out.println(summary);
      return summary.isSuccessful() ? 0 : 1;
    } catch (EngineConfigurationException e) {
      System.err.println(e.getMessage());
      return 2;
    } finally {
      if (jsonReport != null) {
        jsonReport.close();
      }
    }
  }

  private static int parseInt(String option, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new EngineConfigurationException(ErrorMessages.invalidConfig(option, value, "must be an integer"), e);
    }
  }

  private static void printUsage() {
    System.err.println("Usage: Runner [options] <plan.json>");
    System.err.println("  --parallelism=N   Maximum concurrently running tests (default: " + EngineConfig.ENV_PARALLELISM + " or CPU count)");
    System.err.println("  --timeout-ms=N    Default per-attempt timeout for tests that declare none");
    System.err.println("  --fail-fast       Cancel the session after the first failed test");
    System.err.println("  --report=FILE     Also write JSON lines events to FILE");
    System.err.println("");
    System.err.println("Examples:");
    System.err.println("  Runner plan.json");
    System.err.println("  Runner --parallelism=4 --fail-fast --report=results.jsonl plan.json");
  }
}
