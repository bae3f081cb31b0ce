package com.querycache.controller;

import com.querycache.api.DropTableRequest;
import com.querycache.api.ExecuteSqlRequest;
import com.querycache.api.ExecuteSqlResponse;
import com.querycache.api.ExportRequest;
import com.querycache.api.FetchRequest;
import com.querycache.api.FetchResponse;
import com.querycache.api.TableResponse;
import com.querycache.model.BulkWriteResult;
import com.querycache.model.TabularColumn;
import com.querycache.model.TabularResult;
import com.querycache.service.QueryCacheClient;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

@RestController
@RequestMapping("/v1")
public class QueryCacheController {

    private static final Logger log = LoggerFactory.getLogger(QueryCacheController.class);

    private final QueryCacheClient client;

    // The client owns a single warehouse session; requests take turns on it.
    private final ReentrantLock sessionLock = new ReentrantLock();

    public QueryCacheController(QueryCacheClient client) {
        this.client = client;
    }

    /**
     * Fetch a query result through the cache.
     *
     * POST /v1/fetch
     *
     * @param request query source, variables and cache flag
     * @return tabular response
     */
    @PostMapping("/fetch")
    public ResponseEntity<FetchResponse> fetch(@Valid @RequestBody FetchRequest request)
            throws SQLException, IOException {
        long startTime = System.currentTimeMillis();
        QueryCacheClient.FetchOutcome outcome;
        sessionLock.lock();
        try {
            outcome = client.fetch(request.getQuery(), request.getVariables(), request.isUseCache());
        } finally {
            sessionLock.unlock();
        }
        return ResponseEntity.ok(toResponse(outcome, System.currentTimeMillis() - startTime));
    }

    /**
     * Write records into a table, creating it when missing.
     *
     * POST /v1/export
     *
     * @param request target table and records
     * @return load outcome
     */
    @PostMapping("/export")
    public ResponseEntity<BulkWriteResult> export(@Valid @RequestBody ExportRequest request) throws SQLException {
        TabularResult rows = TabularResult.fromRecords(request.getRows());
        log.info("Export requested: table={}.{}.{}, rows={}, append={}, trace_id={}",
                request.getDatabase(), request.getSchema(), request.getTable(), rows.getRowCount(),
                request.isAppend(), MDC.get("trace_id"));
        sessionLock.lock();
        try {
            return ResponseEntity.ok(client.exportData(
                    request.getTable(), request.getDatabase(), request.getSchema(), rows, request.isAppend()));
        } finally {
            sessionLock.unlock();
        }
    }

    /**
     * Drop a table if it exists.
     *
     * POST /v1/drop
     */
    @PostMapping("/drop")
    public ResponseEntity<TableResponse> drop(@Valid @RequestBody DropTableRequest request) throws SQLException {
        boolean dropped;
        sessionLock.lock();
        try {
            dropped = client.dropTable(request.getDatabase(), request.getSchema(), request.getTable());
        } finally {
            sessionLock.unlock();
        }
        return ResponseEntity.ok(TableResponse.builder()
                .target(request.getDatabase() + "." + request.getSchema() + "." + request.getTable())
                .changed(dropped)
                .traceId(MDC.get("trace_id"))
                .build());
    }

    /**
     * Run a multi-statement SQL file.
     *
     * POST /v1/execute
     */
    @PostMapping("/execute")
    public ResponseEntity<ExecuteSqlResponse> execute(@Valid @RequestBody ExecuteSqlRequest request)
            throws SQLException, IOException {
        long startTime = System.currentTimeMillis();
        int executed;
        sessionLock.lock();
        try {
            executed = client.executeSql(Paths.get(request.getFilePath()), request.getVariables());
        } finally {
            sessionLock.unlock();
        }
        return ResponseEntity.ok(ExecuteSqlResponse.builder()
                .statementsExecuted(executed)
                .durationMs(System.currentTimeMillis() - startTime)
                .build());
    }

    /**
     * Delete the cache entry of a query source.
     *
     * DELETE /v1/cache?query=...
     */
    @DeleteMapping("/cache")
    public ResponseEntity<TableResponse> evict(@RequestParam("query") String query) throws IOException {
        boolean evicted;
        sessionLock.lock();
        try {
            evicted = client.evictCache(query);
        } finally {
            sessionLock.unlock();
        }
        return ResponseEntity.ok(TableResponse.builder()
                .target(query)
                .changed(evicted)
                .traceId(MDC.get("trace_id"))
                .build());
    }

    private FetchResponse toResponse(QueryCacheClient.FetchOutcome outcome, long durationMs) {
        TabularResult result = outcome.getResult();

        List<FetchResponse.ColumnDefinition> columns = new ArrayList<>();
        for (TabularColumn column : result.getColumns()) {
            FetchResponse.ColumnDefinition col = new FetchResponse.ColumnDefinition();
            col.setName(column.getName());
            col.setType(column.getType().name());
            columns.add(col);
        }

        FetchResponse.DataContent data = new FetchResponse.DataContent();
        data.setColumns(columns);
        data.setRows(result.toRecords());

        FetchResponse.Metadata metadata = new FetchResponse.Metadata();
        metadata.setRowCount(result.getRowCount());
        metadata.setFromCache(outcome.isFromCache());
        metadata.setCacheKey(outcome.getCacheKey());
        metadata.setDurationMs(durationMs);

        FetchResponse response = new FetchResponse();
        response.setType("tabular");
        response.setData(data);
        response.setMetadata(metadata);
        return response;
    }
}
