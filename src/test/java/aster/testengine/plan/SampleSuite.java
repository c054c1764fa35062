package aster.testengine.plan;

import aster.testengine.core.CancellationToken;
import aster.testengine.core.FixtureContext;
import aster.testengine.core.InvocationContext;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * plans/sample-plan.json 引用的测试类、钩子与夹具工厂。
 */
public class SampleSuite {
  public static final List<String> EVENTS = new CopyOnWriteArrayList<>();

  public static void reset() {
    EVENTS.clear();
  }

  public static final class Connection {
  }

  public static final class Repository {
    final Connection connection;
    final List<String> rows = new CopyOnWriteArrayList<>();

    Repository(Connection connection) {
      this.connection = connection;
    }
  }

  // ========= 夹具 =========

  public static Connection openConnection() {
    EVENTS.add("connection-open");
    return new Connection();
  }

  public static void closeConnection(Connection connection) {
    EVENTS.add("connection-close");
  }

  public static Repository openRepository(FixtureContext context) {
    EVENTS.add("repository-open");
    return new Repository(context.nested("connection", Connection.class));
  }

  // ========= 钩子 =========

  public static void startSession() {
    EVENTS.add("session-before");
  }

  public static void stopSession() {
    EVENTS.add("session-after");
  }

  public static void prepareOrders(InvocationContext context) {
    EVENTS.add("class-before:" + context.scopeId());
  }

  private boolean prepared;

  public void prepareInstance() {
    prepared = true;
  }

  // ========= 测试 =========

  public void createOrder(InvocationContext context) {
    if (!prepared) {
      throw new IllegalStateException("test-level before hook did not run");
    }
    context.fixture("repo", Repository.class).rows.add("order-1");
    EVENTS.add("create");
  }

  public void readOrder(InvocationContext context) {
    Repository repository = context.fixture("repo", Repository.class);
    if (!repository.rows.contains("order-1")) {
      throw new AssertionError("order-1 not found");
    }
    EVENTS.add("read");
  }

  public static void flaky(InvocationContext context) {
    if (context.attempt() < 3) {
      throw new IllegalStateException("flaky attempt " + context.attempt());
    }
    EVENTS.add("flaky-passed");
  }

  public static CompletionStage<Void> asyncCleanup(CancellationToken token) {
    return CompletableFuture.runAsync(() -> {
      token.throwIfCancellationRequested();
      EVENTS.add("cleanup");
    });
  }
}
