package com.querycache.service;

import com.querycache.model.BulkWriteResult;
import com.querycache.model.ColumnType;
import com.querycache.model.TabularResult;
import com.querycache.session.QueryCursor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryCacheClientTest {

    private static final String QUERY = "select * from orders where region = 'EU'";

    @TempDir
    Path tmp;

    private Path sqlRoot;
    private Path cacheDir;
    private FakeWarehouseSession session;
    private QueryCacheClient client;

    @BeforeEach
    void setUp() throws Exception {
        sqlRoot = Files.createDirectories(tmp.resolve("sql"));
        cacheDir = sqlRoot.resolve("caches");
        session = new FakeWarehouseSession();
        session.queryResult = TabularResult.builder()
                .column("ORDER_ID", ColumnType.INTEGER)
                .column("REGION", ColumnType.STRING)
                .column("_LOAD_ID", ColumnType.STRING)
                .row(1L, "EU", "batch-1")
                .row(2L, "EU", "batch-1")
                .build();
        client = new QueryCacheClient(session, new QueryResolver(sqlRoot), new ParquetResultCache(cacheDir));
    }

    @Test
    void fetchStripsMetadataColumnsAndLowercasesNames() throws Exception {
        TabularResult result = client.fetchData(QUERY, Map.of(), false);

        assertThat(result.getColumnNames()).containsExactly("order_id", "region");
        assertThat(result.getRows()).containsExactly(List.of(1L, "EU"), List.of(2L, "EU"));
    }

    @Test
    void fetchWithoutCacheExecutesEveryTimeAndRewritesTheEntry() throws Exception {
        client.fetchData(QUERY, Map.of(), false);
        Path entry = cacheDir.resolve(QueryResolver.md5Hex(QUERY) + ".parquet");
        assertThat(entry).exists();
        FileTime stale = FileTime.fromMillis(0);
        Files.setLastModifiedTime(entry, stale);

        client.fetchData(QUERY, Map.of(), false);

        assertThat(session.queryCount()).isEqualTo(2);
        assertThat(Files.getLastModifiedTime(entry)).isGreaterThan(stale);
    }

    @Test
    void fetchWithCacheReturnsStoredResultWithoutTouchingTheSession() throws Exception {
        TabularResult first = client.fetchData(QUERY);
        int executedBefore = session.executed.size();
        session.failure = new SQLException("session must not be used");

        QueryCacheClient.FetchOutcome outcome = client.fetch(QUERY, Map.of(), true);

        assertThat(outcome.isFromCache()).isTrue();
        assertThat(outcome.getResult().getColumns()).isEqualTo(first.getColumns());
        assertThat(outcome.getResult().getRows()).isEqualTo(first.getRows());
        assertThat(session.executed).hasSize(executedBefore);
    }

    @Test
    void fetchSubstitutesVariablesBeforeExecution() throws Exception {
        client.fetchData("select * from t where id = $id", Map.of("id", "42"), false);

        assertThat(session.executed).containsExactly("select * from t where id = 42");
    }

    @Test
    void fetchWithMissingVariableFailsWithoutExecutingOrCaching() throws Exception {
        String query = "select * from t where id = $id";

        assertThatThrownBy(() -> client.fetchData(query, Map.of(), false))
                .isInstanceOf(MissingVariableException.class)
                .hasMessageContaining("id");
        assertThat(session.executed).isEmpty();
        assertThat(cacheDir.resolve(QueryResolver.md5Hex(query) + ".parquet")).doesNotExist();
    }

    @Test
    void sameSkeletonWithDifferentVariablesSharesOneCacheEntry() throws Exception {
        String query = "select * from orders where region = '$region'";
        TabularResult eu = client.fetchData(query, Map.of("region", "EU"));

        session.queryResult = TabularResult.builder()
                .column("ORDER_ID", ColumnType.INTEGER)
                .column("REGION", ColumnType.STRING)
                .row(9L, "US")
                .build();
        TabularResult us = client.fetchData(query, Map.of("region", "US"));

        assertThat(session.queryCount()).isEqualTo(1);
        assertThat(us.getRows()).isEqualTo(eu.getRows());
    }

    @Test
    void fileSourceIsResolvedUnderSqlRootAndCachedByFileName() throws Exception {
        Files.writeString(sqlRoot.resolve("daily_orders.sql"), "select * from orders", StandardCharsets.UTF_8);

        client.fetchData("daily_orders.sql");

        assertThat(session.executed).containsExactly("select * from orders");
        assertThat(cacheDir.resolve("daily_orders.parquet")).exists();
    }

    @Test
    void missingSqlFileFails() {
        assertThatThrownBy(() -> client.fetchData("missing.sql"))
                .isInstanceOf(SqlFileNotFoundException.class);
        assertThat(session.executed).isEmpty();
    }

    @Test
    void mutatingInlineTextIsRejected() {
        assertThatThrownBy(() -> client.fetchData("delete from orders"))
                .isInstanceOf(QueryValidationException.class)
                .hasMessageContaining("'select' or 'with'");
        assertThat(session.executed).isEmpty();
    }

    @Test
    void executionErrorsPropagateUnchanged() {
        SQLException failure = new SQLException("SQL compilation error", "42000", 2003);
        session.failure = failure;

        assertThatThrownBy(() -> client.fetchData(QUERY, Map.of(), false)).isSameAs(failure);
        assertThat(session.executed).hasSize(1);
    }

    @Test
    void evictCacheRemovesTheEntry() throws Exception {
        client.fetchData(QUERY);

        assertThat(client.evictCache(QUERY)).isTrue();
        assertThat(client.evictCache(QUERY)).isFalse();

        client.fetchData(QUERY);
        assertThat(session.queryCount()).isEqualTo(2);
    }

    @Test
    void entryOfDeletedSqlFileCanStillBeEvicted() throws Exception {
        Path file = sqlRoot.resolve("retired.sql");
        Files.writeString(file, "select * from orders", StandardCharsets.UTF_8);
        client.fetchData("retired.sql");
        Files.delete(file);

        assertThat(client.evictCache("retired.sql")).isTrue();
        assertThat(cacheDir.resolve("retired.parquet")).doesNotExist();
    }

    @Test
    void exportCreatesMissingTableWithInferredTypes() throws Exception {
        TabularResult rows = TabularResult.builder()
                .column("id", ColumnType.INTEGER)
                .column("score", ColumnType.FLOAT)
                .column("seen_at", ColumnType.TIMESTAMP)
                .column("active", ColumnType.BOOLEAN)
                .column("note", ColumnType.DATE)
                .row(1L, 0.5, LocalDateTime.of(2024, 3, 1, 12, 0), true, null)
                .build();

        BulkWriteResult result = client.exportData("people", "ANALYTICS", "PUBLIC", rows, true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isTableCreated()).isTrue();
        assertThat(result.getRowCount()).isEqualTo(1);
        assertThat(session.executed).containsSubsequence(
                "USE DATABASE ANALYTICS",
                "USE SCHEMA PUBLIC",
                "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = 'PUBLIC' AND table_name = 'PEOPLE'",
                "CREATE TABLE PUBLIC.people (ID NUMBER, SCORE FLOAT, SEEN_AT TIMESTAMP_NTZ, ACTIVE BOOLEAN, NOTE STRING)");
        assertThat(session.tables.get("PUBLIC.PEOPLE").getColumnNames())
                .containsExactly("ID", "SCORE", "SEEN_AT", "ACTIVE", "NOTE");
    }

    @Test
    void exportIntoExistingTableSkipsCreation() throws Exception {
        session.createTable("PUBLIC.PEOPLE", TabularResult.empty(List.of()));
        TabularResult rows = TabularResult.fromRecords(List.of(Map.of("id", 1)));

        BulkWriteResult result = client.exportData("people", "ANALYTICS", "PUBLIC", rows, true);

        assertThat(result.isTableCreated()).isFalse();
        assertThat(session.executed).noneMatch(sql -> sql.startsWith("CREATE TABLE"));
        assertThat(session.bulkWrites).containsExactly("PUBLIC.people");
    }

    @Test
    void exportWithoutAppendReplacesTheTable() throws Exception {
        session.createTable("PUBLIC.PEOPLE", TabularResult.fromRecords(List.of(Map.of("ID", 7))));
        TabularResult rows = TabularResult.fromRecords(List.of(Map.of("id", 1), Map.of("id", 2)));

        client.exportData("people", "ANALYTICS", "PUBLIC", rows, false);

        assertThat(session.executed).contains("DROP TABLE PUBLIC.people");
        assertThat(session.tables.get("PUBLIC.PEOPLE").getRowCount()).isEqualTo(2);
    }

    @Test
    void exportOfEmptyRowsDoesNothing() throws Exception {
        TabularResult empty = TabularResult.builder().column("id", ColumnType.INTEGER).build();

        BulkWriteResult result = client.exportData("people", "ANALYTICS", "PUBLIC", empty, true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRowCount()).isZero();
        assertThat(session.executedCatalogLookup()).isFalse();
        assertThat(session.bulkWrites).isEmpty();
    }

    @Test
    void bulkWriteFailureIsReportedNotThrown() throws Exception {
        session.failBulkWrite = true;
        TabularResult rows = TabularResult.fromRecords(List.of(Map.of("id", 1)));

        BulkWriteResult result = client.exportData("people", "ANALYTICS", "PUBLIC", rows, true);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDiagnostic()).isEqualTo("simulated load failure");
    }

    @Test
    void exportedTableReadsBackWithSameRowCountAndColumnNames() throws Exception {
        TabularResult rows = TabularResult.fromRecords(List.of(
                Map.of("customer_id", 1, "segment", "retail"),
                Map.of("customer_id", 2, "segment", "corporate"),
                Map.of("customer_id", 3, "segment", "retail")));

        client.exportData("customers", "ANALYTICS", "PUBLIC", rows, true);
        TabularResult fetched = client.fetchData("select * from PUBLIC.customers", Map.of(), false);

        assertThat(fetched.getRowCount()).isEqualTo(rows.getRowCount());
        assertThat(fetched.getColumnNames()).containsExactlyInAnyOrderElementsOf(rows.getColumnNames());
    }

    @Test
    void dropOfMissingTableIsANoOp() throws Exception {
        assertThat(client.dropTable("ANALYTICS", "PUBLIC", "ghost")).isFalse();
        assertThat(session.executed).noneMatch(sql -> sql.startsWith("DROP TABLE"));
    }

    @Test
    void dropOfExistingTableDropsIt() throws Exception {
        session.createTable("PUBLIC.PEOPLE", TabularResult.empty(List.of()));

        assertThat(client.dropTable("ANALYTICS", "PUBLIC", "people")).isTrue();
        assertThat(session.tables).doesNotContainKey("PUBLIC.PEOPLE");
    }

    @Test
    void executeSqlRunsEachStatementInOrder() throws Exception {
        Path script = tmp.resolve("setup.sql");
        Files.writeString(script, """
                create table $schema.a (id number);
                insert into $schema.a values (1);

                insert into $schema.a values (2);
                """, StandardCharsets.UTF_8);

        int executed = client.executeSql(script, Map.of("schema", "STAGING"));

        assertThat(executed).isEqualTo(3);
        assertThat(session.executed).containsExactly(
                "create table STAGING.a (id number)",
                "insert into STAGING.a values (1)",
                "insert into STAGING.a values (2)");
    }

    @Test
    void executeSqlStopsAtFirstFailureKeepingEarlierStatements() throws Exception {
        Path script = tmp.resolve("broken.sql");
        Files.writeString(script, "insert into a values (1); insert into missing values (2); insert into a values (3)",
                StandardCharsets.UTF_8);
        FakeWarehouseSession failing = new FakeWarehouseSession() {
            @Override
            public QueryCursor execute(String sql) throws SQLException {
                if (sql.contains("missing")) {
                    executed.add(sql);
                    throw new SQLException("Table 'MISSING' does not exist", "42S02");
                }
                return super.execute(sql);
            }
        };
        QueryCacheClient failingClient = new QueryCacheClient(
                failing, new QueryResolver(sqlRoot), new ParquetResultCache(cacheDir));

        assertThatThrownBy(() -> failingClient.executeSql(script, Map.of()))
                .isInstanceOf(SQLException.class);
        assertThat(failing.executed).containsExactly(
                "insert into a values (1)",
                "insert into missing values (2)");
    }

    @Test
    void closeClosesTheSession() throws Exception {
        client.close();

        assertThat(session.closed).isTrue();
    }
}
