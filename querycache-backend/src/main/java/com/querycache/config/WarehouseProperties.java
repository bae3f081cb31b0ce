package com.querycache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the warehouse, bound once at startup.
 *
 * Each value falls back to the matching {@code SNOWFLAKE_*} environment variable through
 * {@code application.yml}; nothing else reads the process environment.
 */
@Data
@ConfigurationProperties(prefix = "warehouse")
public class WarehouseProperties {
    private String account;
    private String user;
    private String role;
    private String warehouse;
    private String database;
    private String schema;
    private String privateKeyPath;
    private String privateKeyPassphrase;

    /**
     * Explicit JDBC URL; derived from the account when blank.
     */
    private String url;

    private int loginTimeoutSeconds = 120;

    /**
     * Resolve the JDBC URL for this account.
     *
     * @return jdbc url
     */
    public String resolveUrl() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("warehouse.account (SNOWFLAKE_ACCOUNT) is required");
        }
        return "jdbc:snowflake://" + account + ".snowflakecomputing.com";
    }
}
