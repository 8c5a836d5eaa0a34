package com.tradingstore.store.document;

import com.mongodb.client.result.UpdateResult;
import com.tradingstore.shared.config.AppConstants;
import com.tradingstore.shared.exception.StoreErrors;
import com.tradingstore.store.CatalogDefaults;
import com.tradingstore.store.entity.AIModelConfig;
import com.tradingstore.store.entity.ExchangeConfig;
import com.tradingstore.store.seed.DefaultDataSeeder;
import com.tradingstore.store.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
public class MongoDefaultDataSeeder implements DefaultDataSeeder {

    private final MongoTemplate mongoTemplate;
    private final SequenceAllocator sequenceAllocator;

    @Override
    public void seedDefaults() {
        try {
            int models = seedAiModels();
            int exchanges = seedExchanges();
            int settings = seedSystemSettings();
            log.info("預設資料初始化完成: 新增 AI 模型 {} 筆、交易所 {} 筆、系統設定 {} 筆",
                    models, exchanges, settings);
        } catch (DataAccessException e) {
            throw StoreErrors.translate("初始化預設資料", e);
        }
    }

    private int seedAiModels() {
        int inserted = 0;
        for (CatalogDefaults.ModelEntry entry : CatalogDefaults.AI_MODELS) {
            Query query = Query.query(Criteria.where("model_id").is(entry.modelId())
                    .and("user_id").is(CatalogDefaults.DEFAULT_OWNER));
            if (mongoTemplate.exists(query, StoreDocuments.AI_MODELS)) {
                continue;
            }
            AIModelConfig model = AIModelConfig.builder()
                    .id(sequenceAllocator.next(SequenceAllocator.AI_MODELS))
                    .modelId(entry.modelId())
                    .userId(CatalogDefaults.DEFAULT_OWNER)
                    .name(entry.name())
                    .provider(entry.provider())
                    .build();
            try {
                mongoTemplate.insert(StoreDocuments.toDocument(model, "", AppConstants.now()), StoreDocuments.AI_MODELS);
                inserted++;
            } catch (DuplicateKeyException e) {
                log.debug("預設 AI 模型 {} 已由其他程序建立", entry.modelId());
            }
        }
        return inserted;
    }

    private int seedExchanges() {
        int inserted = 0;
        for (CatalogDefaults.ExchangeEntry entry : CatalogDefaults.EXCHANGES) {
            Query query = Query.query(Criteria.where("exchange_id").is(entry.exchangeId())
                    .and("user_id").is(CatalogDefaults.DEFAULT_OWNER));
            if (mongoTemplate.exists(query, StoreDocuments.EXCHANGES)) {
                continue;
            }
            ExchangeConfig exchange = ExchangeConfig.builder()
                    .id(sequenceAllocator.next(SequenceAllocator.EXCHANGES))
                    .exchangeId(entry.exchangeId())
                    .userId(CatalogDefaults.DEFAULT_OWNER)
                    .name(entry.name())
                    .type(entry.type())
                    .build();
            try {
                mongoTemplate.insert(StoreDocuments.toDocument(exchange, "", "", "", AppConstants.now()),
                        StoreDocuments.EXCHANGES);
                inserted++;
            } catch (DuplicateKeyException e) {
                log.debug("預設交易所 {} 已由其他程序建立", entry.exchangeId());
            }
        }
        return inserted;
    }

    /**
     * $setOnInsert 只在文件不存在時寫入，已存在的設定值不會被覆蓋
     */
    private int seedSystemSettings() {
        int inserted = 0;
        LocalDateTime now = AppConstants.now();
        for (Map.Entry<String, String> entry : CatalogDefaults.SYSTEM_SETTINGS.entrySet()) {
            UpdateResult result = mongoTemplate.upsert(
                    Query.query(Criteria.where("key").is(entry.getKey())),
                    new Update().setOnInsert("value", entry.getValue())
                            .setOnInsert("updated_at", StoreDocuments.toDate(now)),
                    StoreDocuments.SYSTEM_CONFIG);
            if (result != null && result.getUpsertedId() != null) {
                inserted++;
            }
        }
        return inserted;
    }
}
