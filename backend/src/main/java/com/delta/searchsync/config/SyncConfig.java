package com.delta.searchsync.config;

import com.delta.searchsync.sync.exec.BoundedWorkExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SyncConfig {

    @Bean(name = "syncWorkExecutor", destroyMethod = "shutdown")
    public BoundedWorkExecutor syncWorkExecutor(SearchSyncProperties properties) {
        return new BoundedWorkExecutor(properties.getConcurrency(), properties.getQueueCapacity());
    }

    @Bean(name = "indexHttpExecutor", destroyMethod = "shutdown")
    public ExecutorService indexHttpExecutor(SearchSyncProperties properties) {
        int size = Math.max(2, properties.getConcurrency());
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
