package com.querycache.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DropTableRequest {
    @NotBlank(message = "Database is required")
    private String database;

    @NotBlank(message = "Schema is required")
    private String schema;

    @NotBlank(message = "Table is required")
    private String table;
}
