package com.tradingstore.store.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.tradingstore.shared.config.StoreProperties;
import com.tradingstore.store.RecordStore;
import com.tradingstore.store.schema.SchemaManager;
import com.tradingstore.store.seed.DefaultDataSeeder;
import com.tradingstore.store.sequence.SequenceAllocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.concurrent.TimeUnit;

/**
 * 文件式後端（trading-store.backend=document）
 *
 * 不使用 Spring Boot 的 Mongo 自動配置，連線逾時統一取 operation-timeout。
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "trading-store", name = "backend", havingValue = "document")
public class DocumentStoreConfig {

    @Bean
    public MongoClient mongoClient(StoreProperties properties) {
        ConnectionString connectionString = new ConnectionString(properties.getMongo().getUri());
        long timeoutMs = properties.getOperationTimeout().toMillis();
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .applyToClusterSettings(b -> b.serverSelectionTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(b -> b
                        .connectTimeout((int) timeoutMs, TimeUnit.MILLISECONDS)
                        .readTimeout((int) timeoutMs, TimeUnit.MILLISECONDS))
                .build();
        log.info("使用 MongoDB 存儲後端: {}", connectionString.getHosts());
        return MongoClients.create(settings);
    }

    @Bean
    public MongoTemplate mongoTemplate(MongoClient mongoClient, StoreProperties properties) {
        String database = new ConnectionString(properties.getMongo().getUri()).getDatabase();
        if (database == null || database.isBlank()) {
            database = properties.getMongo().getDatabase();
        }
        return new MongoTemplate(mongoClient, database);
    }

    @Bean
    public SequenceAllocator sequenceAllocator(MongoTemplate mongoTemplate) {
        return new MongoSequenceAllocator(mongoTemplate);
    }

    @Bean
    public SchemaManager schemaManager(MongoTemplate mongoTemplate, SequenceAllocator sequenceAllocator,
                                       StoreProperties properties) {
        return new MongoSchemaManager(mongoTemplate, sequenceAllocator, properties.getBackupDir());
    }

    @Bean
    public DefaultDataSeeder defaultDataSeeder(MongoTemplate mongoTemplate, SequenceAllocator sequenceAllocator) {
        return new MongoDefaultDataSeeder(mongoTemplate, sequenceAllocator);
    }

    @Bean
    public RecordStore recordStore(MongoTemplate mongoTemplate, MongoClient mongoClient,
                                   SequenceAllocator sequenceAllocator, ObjectMapper objectMapper,
                                   StoreProperties properties) {
        return new MongoRecordStore(mongoTemplate, mongoClient, sequenceAllocator, objectMapper,
                properties.getOperationTimeout());
    }
}
