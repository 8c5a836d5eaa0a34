package com.tradingstore.store.relational;

import com.tradingstore.shared.config.AppConstants;
import com.tradingstore.shared.exception.StoreErrors;
import com.tradingstore.store.CatalogDefaults;
import com.tradingstore.store.seed.DefaultDataSeeder;
import com.tradingstore.store.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
public class JdbcDefaultDataSeeder implements DefaultDataSeeder {

    private final JdbcTemplate jdbcTemplate;
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
            if (exists("SELECT COUNT(*) FROM ai_models WHERE model_id = ? AND user_id = ?",
                    entry.modelId(), CatalogDefaults.DEFAULT_OWNER)) {
                continue;
            }
            LocalDateTime now = AppConstants.now();
            try {
                jdbcTemplate.update(RelationalSchema.INSERT_AI_MODEL,
                        sequenceAllocator.next(SequenceAllocator.AI_MODELS),
                        entry.modelId(), CatalogDefaults.DEFAULT_OWNER, "", entry.name(), entry.provider(),
                        false, "", "", "", now, now);
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
            if (exists("SELECT COUNT(*) FROM exchanges WHERE exchange_id = ? AND user_id = ?",
                    entry.exchangeId(), CatalogDefaults.DEFAULT_OWNER)) {
                continue;
            }
            LocalDateTime now = AppConstants.now();
            try {
                jdbcTemplate.update(RelationalSchema.INSERT_EXCHANGE,
                        sequenceAllocator.next(SequenceAllocator.EXCHANGES),
                        entry.exchangeId(), CatalogDefaults.DEFAULT_OWNER, "", entry.name(), entry.type(),
                        false, "", "", false, "", "", "", "", now, now);
                inserted++;
            } catch (DuplicateKeyException e) {
                log.debug("預設交易所 {} 已由其他程序建立", entry.exchangeId());
            }
        }
        return inserted;
    }

    private int seedSystemSettings() {
        int inserted = 0;
        for (Map.Entry<String, String> entry : CatalogDefaults.SYSTEM_SETTINGS.entrySet()) {
            if (exists("SELECT COUNT(*) FROM system_config WHERE config_key = ?", entry.getKey())) {
                continue;
            }
            try {
                jdbcTemplate.update("INSERT INTO system_config (config_key, config_value, updated_at) VALUES (?, ?, ?)",
                        entry.getKey(), entry.getValue(), AppConstants.now());
                inserted++;
            } catch (DuplicateKeyException e) {
                log.debug("系統設定 {} 已存在", entry.getKey());
            }
        }
        return inserted;
    }

    private boolean exists(String sql, Object... args) {
        Long n = jdbcTemplate.queryForObject(sql, Long.class, args);
        return n != null && n > 0;
    }
}
