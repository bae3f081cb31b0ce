package com.querycache.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of loading rows into a warehouse table.
 *
 * A failed load is reported here rather than thrown so the caller can decide what to do with it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BulkWriteResult {
    private boolean success;
    private long rowCount;
    private boolean tableCreated;
    private String diagnostic;

    public static BulkWriteResult written(long rowCount) {
        return BulkWriteResult.builder().success(true).rowCount(rowCount).build();
    }

    public static BulkWriteResult failed(String diagnostic) {
        return BulkWriteResult.builder().success(false).diagnostic(diagnostic).build();
    }

    /**
     * Result for an export that had nothing to write.
     *
     * @return successful zero-row result
     */
    public static BulkWriteResult nothingToWrite() {
        return BulkWriteResult.builder().success(true).rowCount(0).diagnostic("No rows to export").build();
    }
}
