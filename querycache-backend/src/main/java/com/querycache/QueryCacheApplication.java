package com.querycache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class QueryCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryCacheApplication.class, args);
    }
}
