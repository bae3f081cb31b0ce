package com.querycache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * File locations and tuning for the query cache client.
 */
@Data
@ConfigurationProperties(prefix = "querycache")
public class QueryCacheProperties {
    /**
     * Directory that relative {@code .sql} references are resolved under.
     */
    private String sqlRoot = "sql";

    /**
     * Directory holding one Parquet file per cached query.
     */
    private String cacheDir = "sql/caches";

    /**
     * Rows per JDBC batch when exporting.
     */
    private int bulkWriteBatchSize = 10_000;
}
