package com.ubi.dbal.driver;

import com.ubi.dbal.client.ClientPrimitive;
import com.ubi.dbal.client.FakeBackendClient;
import com.ubi.dbal.core.ConnectivityException;
import com.ubi.dbal.core.DriverConfigurationException;
import com.ubi.dbal.core.ErrorRecord;
import com.ubi.dbal.transaction.TransactionStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.ubi.dbal.client.FakeBackendClient.row;
import static org.junit.jupiter.api.Assertions.*;

final class MSSQLDriverTest {
  private static final String USERS = "SELECT user_id, username FROM phpbb_users ORDER BY user_id";

  private static List<Map<String, Object>> numbered(int count) {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      rows.add(row("a", i));
    }
    return rows;
  }

  private static MSSQLDriver connected(FakeBackendClient client) throws ConnectivityException {
    MSSQLDriver driver = new MSSQLDriver(client);
    driver.setPortDelimiter(":");
    driver.connect("db.internal", "forum", "pw", "forum", 1433, false);
    return driver;
  }

  @Test
  void connectRecordsIdentityAndBuildsServerString() throws Exception {
    FakeBackendClient client = new FakeBackendClient();
    MSSQLDriver driver = new MSSQLDriver(client);
    driver.setPortDelimiter(",");
    driver.connect("db.internal", "forum", "pw", "forum", 1433, true);

    assertEquals(ConnectionState.CONNECTED, driver.getState());
    assertEquals("db.internal,1433", driver.getServer());
    assertEquals("forum", driver.getDbName());
    assertTrue(driver.isPersistent());
    assertEquals("db.internal,1433", client.getLastConnect().getServer());
    assertEquals(Integer.valueOf(1433), client.getLastConnect().getPort());
  }

  @Test
  void serverStringOmitsMissingPort() throws Exception {
    MSSQLDriver driver = new MSSQLDriver(new FakeBackendClient());
    driver.connect("db.internal", "forum", "pw", "forum", null, false);
    assertEquals("db.internal", driver.getServer());
  }

  @Test
  void portDelimiterFollowsTargetPlatform() {
    assertEquals(",", AbstractDatabaseDriver.defaultPortDelimiter("Windows Server 2022"));
    assertEquals(":", AbstractDatabaseDriver.defaultPortDelimiter("Linux"));
  }

  @Test
  void missingCapabilityFailsBeforeConnecting() {
    FakeBackendClient client = new FakeBackendClient().without(ClientPrimitive.CONNECT);
    MSSQLDriver driver = new MSSQLDriver(client);

    ConnectivityException ex = assertThrows(
        ConnectivityException.class,
        () -> driver.connect("db.internal", "forum", "pw", "forum", 1433, false)
    );
    assertTrue(ex.getMessage().contains("connect"));
    assertNull(client.getLastConnect());
    assertEquals(ConnectionState.DISCONNECTED, driver.getState());
    assertEquals(ex.getMessage(), driver.reportError().getMessage());
  }

  @Test
  void everyClientPrimitiveIsCheckedBeforeConnecting() {
    for (ClientPrimitive missing : List.of(ClientPrimitive.EXECUTE, ClientPrimitive.FETCH,
        ClientPrimitive.FREE, ClientPrimitive.CLOSE)) {
      FakeBackendClient client = new FakeBackendClient().without(missing);
      MSSQLDriver driver = new MSSQLDriver(client);

      ConnectivityException ex = assertThrows(
          ConnectivityException.class,
          () -> driver.connect("db.internal", "forum", "pw", "forum", 1433, false)
      );
      assertTrue(ex.getMessage().startsWith(missing.getPrimitiveName() + " "), ex.getMessage());
      assertNull(client.getLastConnect());
      assertFalse(driver.isConnected());
    }
  }

  @Test
  void missingPersistentCapabilityNamesPconnect() {
    FakeBackendClient client = new FakeBackendClient().without(ClientPrimitive.PERSISTENT_CONNECT);
    MSSQLDriver driver = new MSSQLDriver(client);

    ConnectivityException ex = assertThrows(
        ConnectivityException.class,
        () -> driver.connect("db.internal", "forum", "pw", "forum", 1433, true)
    );
    assertTrue(ex.getMessage().contains("pconnect"));
  }

  @Test
  void failedConnectKeepsConnectErrorAsFallback() {
    FakeBackendClient client = new FakeBackendClient().withConnectFailure("Login failed for user 'forum'", "28000");
    MSSQLDriver driver = new MSSQLDriver(client);

    ConnectivityException ex = assertThrows(
        ConnectivityException.class,
        () -> driver.connect("db.internal", "forum", "pw", "forum", 1433, false)
    );
    assertEquals("28000", ex.getError().getCode());
    assertEquals("Login failed for user 'forum'", driver.reportError().getMessage());
    assertFalse(driver.query("SELECT 1").isPresent());
  }

  @Test
  void secondConnectIsRejected() throws Exception {
    MSSQLDriver driver = connected(new FakeBackendClient());
    assertThrows(IllegalStateException.class,
        () -> driver.connect("other", "forum", "pw", "forum", 1433, false));
  }

  @Test
  void emptyQueryHasNoSideEffects() throws Exception {
    FakeBackendClient client = new FakeBackendClient();
    MSSQLDriver driver = connected(client);

    assertFalse(driver.query("", 0).isPresent());
    assertFalse(driver.query(null, 60).isPresent());
    assertTrue(client.getExecuted().isEmpty());
    assertEquals(0, driver.getNumQueries(false));
    assertEquals(0, driver.getOpenQueryCount());
    assertNull(driver.getLastQueryText());
  }

  @Test
  void selectIsRegisteredAndFetchedInColumnOrder() throws Exception {
    FakeBackendClient client = new FakeBackendClient()
        .withRows(USERS, row("user_id", 2, "username", "admin"), row("user_id", 3, "username", "bot"));
    MSSQLDriver driver = connected(client);

    QueryResult result = driver.query(USERS).orElseThrow();
    assertEquals(QueryResult.Source.LIVE, result.getSource());
    assertTrue(driver.isOpen(result));

    Map<String, Object> first = driver.fetchRow(result);
    assertEquals(List.of("user_id", "username"), new ArrayList<>(first.keySet()));
    assertEquals(2, first.get("user_id"));
    assertEquals("bot", driver.fetchRow().get("username"));
    assertNull(driver.fetchRow(result));
  }

  @Test
  void nonSelectStatementIsNotRegistered() throws Exception {
    String update = "UPDATE phpbb_users SET user_posts = 0";
    FakeBackendClient client = new FakeBackendClient().withUpdate(update, 12);
    MSSQLDriver driver = connected(client);

    QueryResult result = driver.query(update).orElseThrow();
    assertFalse(driver.isOpen(result));
    assertEquals(0, driver.getOpenQueryCount());
    assertEquals(12, driver.affectedRows().getAsLong());
  }

  @Test
  void failedQueryReportsErrorOnceAndReturnsEmpty() throws Exception {
    String bad = "SELECT * FROM missing_table";
    FakeBackendClient client = new FakeBackendClient().withFailure(bad, "Invalid object name 'missing_table'.", "S0002");
    MSSQLDriver driver = connected(client);

    Optional<QueryResult> result = driver.query(bad);

    assertFalse(result.isPresent());
    assertTrue(driver.isErrorTriggered());
    assertEquals(bad, driver.getErrorSql());
    assertEquals("S0002", driver.getLastError().getCode());
    assertEquals(ErrorRecord.of("Invalid object name 'missing_table'.", "S0002"), driver.reportError());
    assertEquals(0, driver.getOpenQueryCount());
    assertNull(driver.getLastResult());
  }

  @Test
  void affectedRowsIsZeroAfterFailedStatementWhileConnected() throws Exception {
    String update = "UPDATE phpbb_topics SET topic_views = topic_views + 1";
    String bad = "UPDATE phpbb_missing SET x = 1";
    FakeBackendClient client = new FakeBackendClient()
        .withUpdate(update, 3)
        .withFailure(bad, "Invalid object name 'phpbb_missing'.", "S0002");
    MSSQLDriver driver = connected(client);

    assertEquals(0, driver.affectedRows().getAsLong());
    driver.query(update);
    assertEquals(3, driver.affectedRows().getAsLong());
    assertFalse(driver.query(bad).isPresent());
    assertEquals(0, driver.affectedRows().getAsLong());

    driver.close();
    assertFalse(driver.affectedRows().isPresent());
  }

  @Test
  void limitAcceptsLowercaseSelectWithLeadingWhitespace() throws Exception {
    FakeBackendClient client = new FakeBackendClient().withRows("SELECT a from t", numbered(4));
    MSSQLDriver driver = connected(client);

    QueryResult result = driver.queryLimit("  select a from t", 1, 1, 0).orElseThrow();

    assertEquals(List.of("SELECT TOP 2 a from t"), client.getExecuted());
    assertEquals(2, driver.fetchRow(result).get("a"));
    assertNull(driver.fetchRow(result));
  }

  @Test
  void freeingTwiceIsANoOp() throws Exception {
    FakeBackendClient client = new FakeBackendClient().withRows(USERS, row("user_id", 2, "username", "admin"));
    MSSQLDriver driver = connected(client);
    QueryResult result = driver.query(USERS).orElseThrow();

    driver.freeResult(result);
    driver.freeResult(result);

    assertEquals(1, client.getReleased().size());
    assertEquals(0, client.getRepeatedFrees());
    assertFalse(driver.isOpen(result));
  }

  @Test
  void fetchAfterFreeReturnsNull() throws Exception {
    FakeBackendClient client = new FakeBackendClient().withRows(USERS, row("user_id", 2, "username", "admin"));
    MSSQLDriver driver = connected(client);
    QueryResult result = driver.query(USERS).orElseThrow();

    driver.freeResult();

    assertNull(driver.fetchRow(result));
    assertNull(driver.fetchField("username", result));
  }

  @Test
  void limitWithDistinctRewritesThenSeeks() throws Exception {
    FakeBackendClient client = new FakeBackendClient().withRows("SELECT DISTINCT a FROM t", numbered(10));
    MSSQLDriver driver = connected(client);

    QueryResult result = driver.queryLimit("SELECT DISTINCT a FROM t", 5, 2, 0).orElseThrow();

    assertEquals(List.of("SELECT DISTINCT TOP 7 a FROM t"), client.getExecuted());
    List<Map<String, Object>> rows = driver.fetchRowSet(result);
    assertEquals(5, rows.size());
    for (int i = 0; i < rows.size(); i++) {
      assertEquals(i + 3, rows.get(i).get("a"));
    }
  }

  @Test
  void limitFirstRowMatchesOffsetPlusOneOfUnboundedResult() throws Exception {
    for (int total = 0; total <= 4; total++) {
      for (int offset = 0; offset <= 4; offset++) {
        FakeBackendClient client = new FakeBackendClient().withRows("SELECT a FROM t", numbered(8));
        MSSQLDriver driver = connected(client);

        QueryResult result = driver.queryLimit("SELECT a FROM t", total, offset, 0).orElseThrow();
        String expectedSql = total == 0 ? "SELECT a FROM t" : "SELECT TOP " + (total + offset) + " a FROM t";
        assertEquals(expectedSql, client.getExecuted().get(0), "total=" + total + ", offset=" + offset);

        Map<String, Object> first = driver.fetchRow(result);
        assertNotNull(first, "total=" + total + ", offset=" + offset);
        assertEquals(offset + 1, first.get("a"));
        driver.close();
      }
    }
  }

  @Test
  void limitRejectsNegativeOffset() throws Exception {
    MSSQLDriver driver = connected(new FakeBackendClient());
    assertThrows(DriverConfigurationException.class, () -> driver.queryLimit("SELECT a FROM t", 5, -1, 0));
  }

  @Test
  void seekingBackwardsReExecutesTheQuery() throws Exception {
    FakeBackendClient client = new FakeBackendClient().withRows("SELECT a FROM t", numbered(5));
    MSSQLDriver driver = connected(client);
    QueryResult result = driver.query("SELECT a FROM t").orElseThrow();
    driver.fetchRow(result);
    driver.fetchRow(result);
    driver.fetchRow(result);
    String oldId = result.getId();

    assertTrue(driver.rowSeek(1, result));

    assertEquals(2, client.countExecuted("SELECT a FROM t"));
    assertNotEquals(oldId, result.getId());
    assertTrue(driver.isOpen(result));
    assertEquals(1, driver.getOpenQueryCount());
    assertEquals(2, driver.fetchRow(result).get("a"));
    assertFalse(driver.rowSeek(9, result));
  }

  @Test
  void fetchFieldSeeksToRow() throws Exception {
    FakeBackendClient client = new FakeBackendClient().withRows("SELECT a FROM t", numbered(5));
    MSSQLDriver driver = connected(client);
    QueryResult result = driver.query("SELECT a FROM t").orElseThrow();

    assertEquals(4, driver.fetchField("a", 3, result));
    assertNull(driver.fetchField("missing", result));
  }

  @Test
  void lastInsertedIdReleasesTemporaryHandle() throws Exception {
    FakeBackendClient client = new FakeBackendClient().withRows("SELECT @@IDENTITY", row("", new java.math.BigDecimal("42")));
    MSSQLDriver driver = connected(client);

    assertEquals(Optional.of(42L), driver.lastInsertedId());
    assertEquals(1, client.getReleased().size());
    assertEquals(0, driver.getOpenQueryCount());
  }

  @Test
  void lastInsertedIdWithoutIdentityReleasesHandle() throws Exception {
    FakeBackendClient client = new FakeBackendClient().withRows("SELECT @@IDENTITY", row("", null));
    MSSQLDriver driver = connected(client);

    assertEquals(Optional.empty(), driver.lastInsertedId());
    assertEquals(1, client.getReleased().size());
  }

  @Test
  void affectedRowsIsEmptyWhenDisconnected() throws Exception {
    MSSQLDriver driver = new MSSQLDriver(new FakeBackendClient());
    assertFalse(driver.affectedRows().isPresent());
    assertFalse(driver.lastInsertedId().isPresent());
  }

  @Test
  void transactionsIssueStatementsAndNest() throws Exception {
    FakeBackendClient client = new FakeBackendClient();
    MSSQLDriver driver = connected(client);

    assertTrue(driver.transaction(TransactionStatus.BEGIN));
    assertTrue(driver.transaction("begin"));
    assertEquals(1, driver.getTransactionDepth());
    assertTrue(driver.transaction(TransactionStatus.COMMIT));
    assertTrue(driver.transaction(TransactionStatus.COMMIT));
    assertFalse(driver.transaction(TransactionStatus.COMMIT));

    assertEquals(List.of("BEGIN TRANSACTION", "COMMIT TRANSACTION"), client.getExecuted());
    assertThrows(DriverConfigurationException.class, () -> driver.transaction("comit"));
  }

  @Test
  void failedTransactionStatementIsReported() throws Exception {
    FakeBackendClient client = new FakeBackendClient().withFailure("BEGIN TRANSACTION", "deadlock", "40001");
    MSSQLDriver driver = connected(client);

    assertFalse(driver.transaction(TransactionStatus.BEGIN));
    assertFalse(driver.isInTransaction());
    assertEquals("BEGIN TRANSACTION", driver.getErrorSql());
  }

  @Test
  void closeReleasesOpenHandlesAndRollsBack() throws Exception {
    FakeBackendClient client = new FakeBackendClient()
        .withRows("SELECT a FROM t", numbered(3))
        .withRows(USERS, row("user_id", 2, "username", "admin"));
    MSSQLDriver driver = connected(client);
    driver.transaction(TransactionStatus.BEGIN);
    driver.query("SELECT a FROM t");
    driver.query(USERS);

    assertTrue(driver.close());

    assertEquals(ConnectionState.CLOSED, driver.getState());
    assertEquals(0, driver.getOpenQueryCount());
    assertEquals(2, client.getReleased().size());
    assertEquals(0, client.getOpenLinks());
    assertTrue(client.getExecuted().contains("ROLLBACK TRANSACTION"));
    assertFalse(driver.isInTransaction());
    assertTrue(driver.close());
  }

  @Test
  void serverInfoJoinsTrimmedFields() throws Exception {
    FakeBackendClient client = new FakeBackendClient().withRows(
        "SELECT SERVERPROPERTY('productversion'), SERVERPROPERTY('productlevel'), SERVERPROPERTY('edition')",
        row("v", "16.0.1000.6 ", "l", "RTM", "e", " Developer Edition (64-bit)"));
    MSSQLDriver driver = connected(client);

    assertEquals("16.0.1000.6 RTM Developer Edition (64-bit)", driver.serverInfo(true, false));
    assertEquals("MSSQL (JDBC) 16.0.1000.6 RTM Developer Edition (64-bit)", driver.serverInfo(false, false));
    assertEquals(2, client.getReleased().size());
  }

  @Test
  void serverInfoUnknownWhenDisconnected() {
    MSSQLDriver driver = new MSSQLDriver(new FakeBackendClient());
    assertEquals("0", driver.serverInfo(true, true));
    assertEquals("MSSQL (JDBC)", driver.serverInfo(false, true));
  }

  @Test
  void escapeDoublesSingleQuotes() {
    MSSQLDriver driver = new MSSQLDriver(new FakeBackendClient());
    assertEquals("O''Brien", driver.escape("O'Brien"));
  }

  @Test
  void explainModeRequiresProfiler() {
    assertThrows(DriverConfigurationException.class,
        () -> new MSSQLDriver(new FakeBackendClient(), null, null, DebugMode.EXPLAIN));
    assertEquals(DebugMode.LOAD_TIME, DebugMode.of("load_time"));
    assertThrows(DriverConfigurationException.class, () -> DebugMode.of("verbose"));
  }
}
