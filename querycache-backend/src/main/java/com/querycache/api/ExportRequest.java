package com.querycache.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request payload for writing JSON records into a warehouse table.
 *
 * Column types are inferred from the JSON values; dates and timestamps arrive as strings and are
 * therefore loaded as string columns.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExportRequest {
    @NotBlank(message = "Table is required")
    private String table;

    @NotBlank(message = "Database is required")
    private String database;

    @NotBlank(message = "Schema is required")
    private String schema;

    @NotNull(message = "Rows are required")
    private List<Map<String, Object>> rows = new ArrayList<>();

    private boolean append = true;
}
