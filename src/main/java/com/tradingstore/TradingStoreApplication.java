package com.tradingstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * DataSource 與 Mongo 連線都由各自的後端配置建立，未選用的後端不會開啟任何連線
 */
@SpringBootApplication(exclude = {
        DataSourceAutoConfiguration.class, MongoAutoConfiguration.class, MongoDataAutoConfiguration.class})
@ConfigurationPropertiesScan("com.tradingstore.shared.config")
public class TradingStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradingStoreApplication.class, args);
    }
}
