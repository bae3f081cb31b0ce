package com.querycache.service;

import com.querycache.model.BulkWriteResult;
import com.querycache.model.ResolvedQuery;
import com.querycache.model.TabularResult;
import com.querycache.session.QueryCursor;
import com.querycache.session.WarehouseSession;
import com.querycache.util.SqlLiterals;
import com.querycache.util.SqlScriptSplitter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs queries against the warehouse through a local result cache and writes tables back.
 *
 * <p>One client owns one session. Calls are blocking and the client does no locking of its own: callers that
 * share a client across threads must serialize access. Cache entries never expire; pass
 * {@code useCache = false} or call {@link #evictCache(String)} to refresh one.
 *
 * <p>The cache key is computed on the query text <em>before</em> variable substitution. The same query
 * skeleton run with different variables therefore reads and overwrites a single cache entry.
 */
@Slf4j
public class QueryCacheClient implements AutoCloseable {

    /**
     * Columns whose names start with this marker are driver metadata and never reach callers.
     */
    public static final String METADATA_COLUMN_PREFIX = "_";

    private final WarehouseSession session;
    private final QueryResolver resolver;
    private final ParquetResultCache cache;

    /**
     * Create a client.
     *
     * @param session open warehouse session; closed together with the client
     * @param resolver query source resolver
     * @param cache result cache
     */
    public QueryCacheClient(WarehouseSession session, QueryResolver resolver, ParquetResultCache cache) {
        this.session = session;
        this.resolver = resolver;
        this.cache = cache;
    }

    public TabularResult fetchData(String querySource) throws SQLException, IOException {
        return fetchData(querySource, Map.of(), true);
    }

    public TabularResult fetchData(String querySource, Map<String, ?> variables) throws SQLException, IOException {
        return fetchData(querySource, variables, true);
    }

    /**
     * Fetch a query result, from the cache when allowed and present, otherwise from the warehouse.
     *
     * @param querySource {@code .sql} file reference or inline {@code select}/{@code with} query
     * @param variables values for {@code $name} variables; ignored when the cache answers
     * @param useCache whether an existing cache entry may be returned
     * @return result with metadata columns removed and lower-case column names
     * @throws SQLException when execution fails
     * @throws IOException when the SQL file or the cache cannot be read or written
     */
    public TabularResult fetchData(String querySource, Map<String, ?> variables, boolean useCache)
            throws SQLException, IOException {
        return fetch(querySource, variables, useCache).getResult();
    }

    /**
     * Same as {@link #fetchData(String, Map, boolean)}, also reporting whether the cache answered.
     *
     * @param querySource query source
     * @param variables variable values
     * @param useCache whether an existing cache entry may be returned
     * @return result and origin
     * @throws SQLException when execution fails
     * @throws IOException on file errors
     */
    public FetchOutcome fetch(String querySource, Map<String, ?> variables, boolean useCache)
            throws SQLException, IOException {
        log.info("Fetching data from the warehouse...");
        ResolvedQuery query = resolver.resolve(querySource);
        cache.ensureDirectory();

        if (useCache && cache.contains(query.getCacheKey())) {
            log.info("Using cached result {}", cache.pathFor(query.getCacheKey()));
            return new FetchOutcome(cache.read(query.getCacheKey()), true, query.getCacheKey());
        }

        String sql = VariableSubstitutor.substitute(query.getText(), variables);
        log.info("Executing query:\n{}", sql);
        TabularResult result;
        try (QueryCursor cursor = session.execute(sql)) {
            result = clean(cursor.fetchAllAsTable());
        }
        cache.write(query.getCacheKey(), result);
        return new FetchOutcome(result, false, query.getCacheKey());
    }

    /**
     * Delete the cache entry of a query source.
     *
     * The source is not read, so the entry of a deleted {@code .sql} file can still be evicted.
     *
     * @param querySource query source as passed to {@link #fetchData(String, Map, boolean)}
     * @return true when an entry existed
     * @throws IOException on file errors
     */
    public boolean evictCache(String querySource) throws IOException {
        return cache.evict(resolver.cacheKeyOf(querySource));
    }

    /**
     * Remove metadata columns and lower-case the remaining column names.
     *
     * @param response raw driver result
     * @return cleaned result
     */
    public static TabularResult clean(TabularResult response) {
        return response.withoutColumnsPrefixed(METADATA_COLUMN_PREFIX).withLowerCaseColumns();
    }

    /**
     * Write rows to a table, creating it when missing.
     *
     * @param table target table
     * @param database target database
     * @param schema target schema
     * @param rows rows to write
     * @param append false to drop the table first
     * @return outcome of the load; a failed load is reported, not thrown
     * @throws SQLException when context selection, the catalog lookup or table creation fails
     */
    public BulkWriteResult exportData(String table, String database, String schema, TabularResult rows, boolean append)
            throws SQLException {
        if (!append) {
            dropTable(database, schema, table);
        }

        if (rows.isEmpty()) {
            log.info("No rows to export to {}.{}.{}", database, schema, table);
            return BulkWriteResult.nothingToWrite();
        }

        TabularResult upper = rows.withUpperCaseColumns();
        useContext(database, schema);

        boolean created = false;
        if (!tableExists(schema, table)) {
            String createTableSql = "CREATE TABLE " + schema + "." + table + " ("
                    + WarehouseTypeMapper.columnDefinitions(upper.getColumns()) + ")";
            log.info("Generated SQL for table creation:\n{}", createTableSql);
            executeAndClose(createTableSql);
            log.info("Table '{}' created successfully.", table);
            created = true;
        } else {
            log.info("Table '{}' already exists.", table);
        }

        log.info("Writing {} rows to {}.{}...", upper.getRowCount(), schema, table);
        BulkWriteResult result = session.bulkWrite(schema + "." + table, upper);
        result.setTableCreated(created);
        if (result.isSuccess()) {
            log.info("Successfully written {} rows to {}.{}.", result.getRowCount(), schema, table);
        } else {
            log.warn("Failed to write rows to {}.{}: {}", schema, table, result.getDiagnostic());
        }
        return result;
    }

    /**
     * Drop a table if it exists.
     *
     * @param database database
     * @param schema schema
     * @param table table
     * @return true when a table was dropped
     * @throws SQLException on execution errors
     */
    public boolean dropTable(String database, String schema, String table) throws SQLException {
        useContext(database, schema);
        if (tableExists(schema, table)) {
            executeAndClose("DROP TABLE " + schema + "." + table);
            log.info("Table '{}' dropped.", table);
            return true;
        }
        log.info("Table '{}' does not exist.", table);
        return false;
    }

    /**
     * Run every statement of a SQL file in order.
     *
     * Statements already executed stay applied when a later one fails.
     *
     * @param filePath SQL file, used as given
     * @param variables values for {@code $name} variables
     * @return number of statements executed
     * @throws SQLException when a statement fails
     * @throws IOException when the file cannot be read
     */
    public int executeSql(Path filePath, Map<String, ?> variables) throws SQLException, IOException {
        if (!Files.isRegularFile(filePath)) {
            throw new SqlFileNotFoundException(filePath);
        }
        String script = VariableSubstitutor.substitute(Files.readString(filePath, StandardCharsets.UTF_8), variables);
        List<String> statements = SqlScriptSplitter.split(script);
        for (String statement : statements) {
            log.info("Executing SQL command:\n{}", statement);
            executeAndClose(statement);
        }
        return statements.size();
    }

    @Override
    public void close() throws SQLException {
        session.close();
    }

    private void useContext(String database, String schema) throws SQLException {
        executeAndClose("USE DATABASE " + database);
        executeAndClose("USE SCHEMA " + schema);
    }

    private boolean tableExists(String schema, String table) throws SQLException {
        String sql = "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = "
                + SqlLiterals.quote(schema.toUpperCase(Locale.ROOT))
                + " AND table_name = " + SqlLiterals.quote(table.toUpperCase(Locale.ROOT));
        try (QueryCursor cursor = session.execute(sql)) {
            Object count = cursor.fetchScalar();
            return count instanceof Number n && n.longValue() > 0;
        }
    }

    private void executeAndClose(String sql) throws SQLException {
        try (QueryCursor ignored = session.execute(sql)) {
            log.debug("Executed: {}", sql);
        }
    }

    /**
     * A fetched result and where it came from.
     */
    public static final class FetchOutcome {
        private final TabularResult result;
        private final boolean fromCache;
        private final String cacheKey;

        public FetchOutcome(TabularResult result, boolean fromCache, String cacheKey) {
            this.result = result;
            this.fromCache = fromCache;
            this.cacheKey = cacheKey;
        }

        public TabularResult getResult() {
            return result;
        }

        public boolean isFromCache() {
            return fromCache;
        }

        public String getCacheKey() {
            return cacheKey;
        }
    }
}
