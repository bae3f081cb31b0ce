package com.querycache.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FetchResponse {
    private String type; // tabular
    private DataContent data;
    private Metadata metadata;

    @Data
    public static class DataContent {
        private List<ColumnDefinition> columns;
        private List<Map<String, Object>> rows;
    }

    @Data
    public static class ColumnDefinition {
        private String name;
        private String type;
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Metadata {
        private long rowCount;
        private boolean fromCache;
        private String cacheKey;
        private long durationMs;
    }
}
