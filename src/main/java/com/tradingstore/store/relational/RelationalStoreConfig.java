package com.tradingstore.store.relational;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingstore.shared.config.StoreProperties;
import com.tradingstore.store.RecordStore;
import com.tradingstore.store.schema.SchemaManager;
import com.tradingstore.store.seed.DefaultDataSeeder;
import com.tradingstore.store.sequence.SequenceAllocator;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * 關聯式後端（預設）
 *
 * DataSource 由 spring.datasource 設定（H2 檔案模式），只在此後端啟用時建立。
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "trading-store", name = "backend", havingValue = "relational", matchIfMissing = true)
public class RelationalStoreConfig {

    @Bean
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties dataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource dataSource(DataSourceProperties dataSourceProperties) {
        return dataSourceProperties.initializeDataSourceBuilder().type(HikariDataSource.class).build();
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource, StoreProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout((int) Math.max(1, properties.getOperationTimeout().toSeconds()));
        log.info("使用關聯式存儲後端，操作逾時 {}", properties.getOperationTimeout());
        return jdbcTemplate;
    }

    @Bean
    public SequenceAllocator sequenceAllocator(JdbcTemplate jdbcTemplate, DataSource dataSource) {
        return new JdbcSequenceAllocator(jdbcTemplate,
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    @Bean
    public SchemaManager schemaManager(JdbcTemplate jdbcTemplate, SequenceAllocator sequenceAllocator,
                                       StoreProperties properties) {
        return new JdbcSchemaManager(jdbcTemplate, sequenceAllocator, properties.getBackupDir());
    }

    @Bean
    public DefaultDataSeeder defaultDataSeeder(JdbcTemplate jdbcTemplate, SequenceAllocator sequenceAllocator) {
        return new JdbcDefaultDataSeeder(jdbcTemplate, sequenceAllocator);
    }

    @Bean
    public RecordStore recordStore(JdbcTemplate jdbcTemplate, SequenceAllocator sequenceAllocator,
                                   ObjectMapper objectMapper) {
        return new JdbcRecordStore(jdbcTemplate, sequenceAllocator, objectMapper);
    }
}
