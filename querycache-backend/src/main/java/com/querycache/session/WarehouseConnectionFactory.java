package com.querycache.session;

import com.querycache.config.WarehouseProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import net.snowflake.client.jdbc.SnowflakeBasicDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.function.Consumer;

/**
 * Opens authenticated warehouse sessions.
 *
 * Key-pair authentication is used when a private key path is configured and the file exists;
 * otherwise the driver's external browser login is used.
 */
@Slf4j
public class WarehouseConnectionFactory {

    static final String AUTHENTICATOR_EXTERNAL_BROWSER = "externalbrowser";

    private final int batchSize;

    /**
     * Create a factory.
     *
     * @param batchSize rows per JDBC batch for sessions opened by this factory
     */
    public WarehouseConnectionFactory(int batchSize) {
        this.batchSize = batchSize;
    }

    /**
     * Open a session.
     *
     * @param props connection settings
     * @return live session
     * @throws SQLException when the driver rejects the login
     * @throws IOException when the private key file cannot be read
     */
    public WarehouseSession connect(WarehouseProperties props) throws SQLException, IOException {
        SnowflakeBasicDataSource snowflake = buildDataSource(props);
        log.info("Connecting to {} as {} (role: {}, warehouse: {}, database: {}, schema: {})",
                props.resolveUrl(), props.getUser(), props.getRole(), props.getWarehouse(),
                props.getDatabase(), props.getSchema());

        HikariDataSource ds = new HikariDataSource(buildHikariConfig(snowflake, props));
        try {
            return new JdbcWarehouseSession(ds, batchSize);
        } catch (SQLException e) {
            log.error("Connection failed: {} (SQLState: {}, Error Code: {})", e.getMessage(), e.getSQLState(), e.getErrorCode());
            ds.close();
            throw e;
        }
    }

    SnowflakeBasicDataSource buildDataSource(WarehouseProperties props) throws IOException {
        SnowflakeBasicDataSource ds = new SnowflakeBasicDataSource();
        ds.setUrl(props.resolveUrl());
        ds.setAccount(props.getAccount());
        ds.setUser(props.getUser());
        setIfPresent(props.getRole(), ds::setRole);
        setIfPresent(props.getWarehouse(), ds::setWarehouse);
        setIfPresent(props.getDatabase(), ds::setDatabaseName);
        setIfPresent(props.getSchema(), ds::setSchema);

        Path keyPath = resolvePrivateKey(props.getPrivateKeyPath());
        if (keyPath != null) {
            log.info("Using private key to log in to the warehouse.");
            byte[] der = PrivateKeyLoader.loadDer(keyPath, props.getPrivateKeyPassphrase());
            ds.setPrivateKey(PrivateKeyLoader.fromDer(der));
        } else {
            log.info("Using browser authentication, no private key found. Please log in to the warehouse.");
            ds.setAuthenticator(AUTHENTICATOR_EXTERNAL_BROWSER);
        }
        return ds;
    }

    private HikariConfig buildHikariConfig(SnowflakeBasicDataSource snowflake, WarehouseProperties props) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("QueryCache-Session");
        config.setDataSource(snowflake);
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(0);
        config.setAutoCommit(true);
        config.setMaxLifetime(0);
        config.setIdleTimeout(0);
        config.setConnectionTimeout(props.getLoginTimeoutSeconds() * 1000L);
        config.setInitializationFailTimeout(-1);
        config.setExceptionOverrideClassName(WarehouseSqlExceptionOverride.class.getName());
        return config;
    }

    /**
     * Resolve the configured key path to an existing file.
     *
     * @param privateKeyPath configured path, may be blank
     * @return existing file or null when key-pair authentication does not apply
     */
    static Path resolvePrivateKey(String privateKeyPath) {
        if (privateKeyPath == null || privateKeyPath.isBlank()) {
            return null;
        }
        Path path = Paths.get(privateKeyPath);
        if (!Files.isRegularFile(path)) {
            log.warn("Private key file not found at {}", privateKeyPath);
            return null;
        }
        return path;
    }

    private static void setIfPresent(String value, Consumer<String> setter) {
        if (value != null && !value.isBlank()) {
            setter.accept(value);
        }
    }
}
