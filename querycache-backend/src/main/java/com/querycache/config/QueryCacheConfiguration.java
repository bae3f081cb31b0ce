package com.querycache.config;

import com.querycache.service.ParquetResultCache;
import com.querycache.service.QueryCacheClient;
import com.querycache.service.QueryResolver;
import com.querycache.session.WarehouseConnectionFactory;
import com.querycache.session.WarehouseSession;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Paths;
import java.sql.SQLException;

/**
 * Wires the query cache client.
 *
 * The session is opened eagerly: a failed login fails application startup.
 */
@Configuration
public class QueryCacheConfiguration {

    @Bean
    public WarehouseConnectionFactory warehouseConnectionFactory(QueryCacheProperties props) {
        return new WarehouseConnectionFactory(props.getBulkWriteBatchSize());
    }

    @Bean
    public QueryResolver queryResolver(QueryCacheProperties props) {
        return new QueryResolver(Paths.get(props.getSqlRoot()));
    }

    @Bean
    public ParquetResultCache parquetResultCache(QueryCacheProperties props) {
        return new ParquetResultCache(Paths.get(props.getCacheDir()));
    }

    @Bean(destroyMethod = "")
    public WarehouseSession warehouseSession(WarehouseConnectionFactory factory, WarehouseProperties props)
            throws SQLException, IOException {
        return factory.connect(props);
    }

    @Bean(destroyMethod = "close")
    public QueryCacheClient queryCacheClient(WarehouseSession session, QueryResolver resolver, ParquetResultCache cache) {
        return new QueryCacheClient(session, resolver, cache);
    }
}
