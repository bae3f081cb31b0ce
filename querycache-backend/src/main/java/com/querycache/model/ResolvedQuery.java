package com.querycache.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * A query source resolved to its canonical text and cache key.
 */
@Value
@Builder
public class ResolvedQuery {
    /**
     * Query text before variable substitution.
     */
    String text;

    /**
     * File name of the cache entry, e.g. {@code daily_sales.parquet} or {@code <md5>.parquet}.
     */
    String cacheKey;

    /**
     * The SQL file the text was read from; null for inline queries.
     */
    Path sourceFile;

    public boolean isFromFile() {
        return sourceFile != null;
    }
}
