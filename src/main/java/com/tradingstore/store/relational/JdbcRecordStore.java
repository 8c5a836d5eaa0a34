package com.tradingstore.store.relational;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingstore.shared.config.AppConstants;
import com.tradingstore.shared.exception.BetaCodeUnavailableException;
import com.tradingstore.shared.exception.ConnectionException;
import com.tradingstore.shared.exception.DuplicateException;
import com.tradingstore.shared.exception.NotFoundException;
import com.tradingstore.shared.exception.StoreErrors;
import com.tradingstore.shared.exception.StoreException;
import com.tradingstore.store.CatalogDefaults;
import com.tradingstore.store.RecordStore;
import com.tradingstore.store.SecretFieldCodec;
import com.tradingstore.store.TraderDefaults;
import com.tradingstore.store.TradingSymbols;
import com.tradingstore.store.dto.AiModelUpdate;
import com.tradingstore.store.dto.BetaCodeStats;
import com.tradingstore.store.dto.ExchangeUpdate;
import com.tradingstore.store.dto.TraderFullConfig;
import com.tradingstore.store.entity.AIModelConfig;
import com.tradingstore.store.entity.BetaCode;
import com.tradingstore.store.entity.ExchangeConfig;
import com.tradingstore.store.entity.TraderRecord;
import com.tradingstore.store.entity.User;
import com.tradingstore.store.entity.UserSignalSource;
import com.tradingstore.store.sequence.SequenceAllocator;
import com.tradingstore.vault.CredentialVault;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 關聯式後端（H2 + JdbcTemplate）的 {@link RecordStore}
 */
@Slf4j
public class JdbcRecordStore implements RecordStore {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final SequenceAllocator sequenceAllocator;
    private final ObjectMapper objectMapper;
    private final SecretFieldCodec secrets = new SecretFieldCodec();

    public JdbcRecordStore(JdbcTemplate jdbcTemplate, SequenceAllocator sequenceAllocator, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.sequenceAllocator = sequenceAllocator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void setCredentialVault(CredentialVault vault) {
        secrets.setVault(vault);
        log.info("🔐 已注入 vault，機密欄位加密: {}", secrets.hasVault());
    }

    @Override
    public void ping() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            throw new ConnectionException("無法連線到關聯式存儲: " + e.getMessage(), e);
        }
    }

    @Override
    public void ensureAdminUser() {
        if (getUserById(User.ADMIN_ID).isPresent()) {
            return;
        }
        try {
            createUser(User.builder()
                    .id(User.ADMIN_ID)
                    .email(User.ADMIN_EMAIL)
                    .otpVerified(true)
                    .build());
            log.info("✅ 已建立保留的 admin 用戶");
        } catch (DuplicateException e) {
            log.debug("admin 用戶已由其他程序建立");
        }
    }

    // ==================== users ====================

    @Override
    public void createUser(User user) {
        run("建立用戶", () -> {
            LocalDateTime now = AppConstants.now();
            jdbcTemplate.update("INSERT INTO users (id, email, password_hash, otp_secret, otp_verified, "
                            + "created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                    user.getId(), user.getEmail(), nullToEmpty(user.getPasswordHash()),
                    nullToEmpty(user.getOtpSecret()), user.isOtpVerified(), now, now);
        });
    }

    @Override
    public Optional<User> getUserByEmail(String email) {
        return execute("查詢用戶", () -> jdbcTemplate.query("SELECT * FROM users WHERE email = ?",
                JdbcRowMappers.USER, email).stream().findFirst());
    }

    @Override
    public Optional<User> getUserById(String userId) {
        return execute("查詢用戶", () -> jdbcTemplate.query("SELECT * FROM users WHERE id = ?",
                JdbcRowMappers.USER, userId).stream().findFirst());
    }

    @Override
    public List<String> listUserIds() {
        return execute("列出用戶", () -> jdbcTemplate.queryForList("SELECT id FROM users ORDER BY id", String.class));
    }

    @Override
    public void setUserOtpVerified(String userId, boolean verified) {
        int updated = execute("更新 OTP 狀態", () -> jdbcTemplate.update(
                "UPDATE users SET otp_verified = ?, updated_at = ? WHERE id = ?",
                verified, AppConstants.now(), userId));
        requireFound(updated, "用戶不存在: " + userId);
    }

    @Override
    public void updateUserPassword(String userId, String passwordHash) {
        int updated = execute("更新密碼", () -> jdbcTemplate.update(
                "UPDATE users SET password_hash = ?, updated_at = ? WHERE id = ?",
                passwordHash, AppConstants.now(), userId));
        requireFound(updated, "用戶不存在: " + userId);
    }

    // ==================== ai_models ====================

    @Override
    public List<AIModelConfig> listAiModels(String userId) {
        List<AIModelConfig> models = execute("列出 AI 模型", () -> jdbcTemplate.query(
                "SELECT * FROM ai_models WHERE user_id = ? ORDER BY id", JdbcRowMappers.AI_MODEL, userId));
        models.forEach(this::openSecrets);
        return models;
    }

    /**
     * 依序嘗試：modelId 精確匹配 → 舊版 provider 匹配 → 建立新記錄
     */
    @Override
    public void upsertAiModel(String userId, String modelKey, AiModelUpdate update) {
        run("更新 AI 模型", () -> {
            Optional<AIModelConfig> existing = findAiModel("user_id = ? AND model_id = ?", userId, modelKey);
            if (existing.isEmpty()) {
                existing = findAiModel("user_id = ? AND provider = ?", userId, modelKey);
                existing.ifPresent(m -> log.warn("⚠️ 使用舊版 provider 匹配更新模型: {} -> {}",
                        modelKey, m.getModelId()));
            }
            if (existing.isPresent()) {
                updateAiModelRow(existing.get().getId(), update);
                return;
            }

            String provider = CatalogDefaults.inferProvider(modelKey);
            String name = jdbcTemplate.queryForList(
                            "SELECT name FROM ai_models WHERE provider = ? AND name <> '' ORDER BY id",
                            String.class, provider).stream()
                    .findFirst()
                    .orElse(CatalogDefaults.fallbackModelName(provider));
            String newModelId = CatalogDefaults.newModelId(userId, modelKey, provider);
            try {
                insertAiModel(AIModelConfig.builder()
                        .modelId(newModelId)
                        .userId(userId)
                        .name(name)
                        .provider(provider)
                        .enabled(update.isEnabled())
                        .apiKey(update.getApiKey())
                        .customApiUrl(update.getCustomApiUrl())
                        .customModelName(update.getCustomModelName())
                        .build());
                log.info("✓ 建立新的 AI 模型配置: modelId={}, provider={}, name={}", newModelId, provider, name);
            } catch (DuplicateKeyException e) {
                // 並發建立，改為更新對方剛插入的記錄
                AIModelConfig concurrent = findAiModel("user_id = ? AND model_id = ?", userId, newModelId)
                        .orElseThrow(() -> e);
                updateAiModelRow(concurrent.getId(), update);
            }
        });
    }

    @Override
    public AIModelConfig createAiModel(AIModelConfig model) {
        return execute("建立 AI 模型", () -> {
            if (findAiModel("user_id = ? AND model_id = ?", model.getUserId(), model.getModelId()).isPresent()) {
                throw new DuplicateException("AI 模型已存在: " + model.getModelId() + " (user=" + model.getUserId() + ")");
            }
            return insertAiModel(model);
        });
    }

    private Optional<AIModelConfig> findAiModel(String where, Object... args) {
        return jdbcTemplate.query("SELECT * FROM ai_models WHERE " + where + " ORDER BY id",
                JdbcRowMappers.AI_MODEL, args).stream().findFirst();
    }

    private void updateAiModelRow(int id, AiModelUpdate update) {
        StringBuilder sql = new StringBuilder(
                "UPDATE ai_models SET enabled = ?, custom_api_url = ?, custom_model_name = ?, updated_at = ?");
        List<Object> args = new ArrayList<>();
        args.add(update.isEnabled());
        args.add(nullToEmpty(update.getCustomApiUrl()));
        args.add(nullToEmpty(update.getCustomModelName()));
        args.add(AppConstants.now());
        if (SecretFieldCodec.shouldWrite(update.getApiKey())) {
            sql.append(", api_key = ?");
            args.add(secrets.seal(update.getApiKey()));
        }
        sql.append(" WHERE id = ?");
        args.add(id);
        jdbcTemplate.update(sql.toString(), args.toArray());
    }

    private AIModelConfig insertAiModel(AIModelConfig model) {
        int id = sequenceAllocator.next(SequenceAllocator.AI_MODELS);
        LocalDateTime now = AppConstants.now();
        jdbcTemplate.update(RelationalSchema.INSERT_AI_MODEL,
                id, model.getModelId(), model.getUserId(), nullToEmpty(model.getDisplayName()),
                nullToEmpty(model.getName()), nullToEmpty(model.getProvider()), model.isEnabled(),
                secrets.seal(model.getApiKey()), nullToEmpty(model.getCustomApiUrl()),
                nullToEmpty(model.getCustomModelName()), now, now);
        model.setId(id);
        model.setCreatedAt(now);
        model.setUpdatedAt(now);
        return model;
    }

    // ==================== exchanges ====================

    @Override
    public List<ExchangeConfig> listExchanges(String userId) {
        List<ExchangeConfig> exchanges = execute("列出交易所", () -> jdbcTemplate.query(
                "SELECT * FROM exchanges WHERE user_id = ? ORDER BY id", JdbcRowMappers.EXCHANGE, userId));
        exchanges.forEach(this::openSecrets);
        return exchanges;
    }

    /**
     * 先更新 (exchangeKey, userId)；沒有匹配時依類型 ID 建立新記錄
     */
    @Override
    public void upsertExchange(String userId, String exchangeKey, ExchangeUpdate update) {
        run("更新交易所", () -> {
            log.info("🔧 更新交易所: userId={}, exchange={}, enabled={}", userId, exchangeKey, update.isEnabled());
            if (updateExchangeRow(userId, exchangeKey, update) > 0) {
                return;
            }

            CatalogDefaults.ExchangeEntry entry = CatalogDefaults.exchangeFor(exchangeKey);
            try {
                insertExchange(ExchangeConfig.builder()
                        .exchangeId(exchangeKey)
                        .userId(userId)
                        .name(entry.name())
                        .type(entry.type())
                        .enabled(update.isEnabled())
                        .apiKey(update.getApiKey())
                        .secretKey(update.getSecretKey())
                        .testnet(update.isTestnet())
                        .hyperliquidWalletAddr(update.getHyperliquidWalletAddr())
                        .asterUser(update.getAsterUser())
                        .asterSigner(update.getAsterSigner())
                        .asterPrivateKey(update.getAsterPrivateKey())
                        .build());
                log.info("✓ 建立新的交易所配置: {} ({})", exchangeKey, entry.type());
            } catch (DuplicateKeyException e) {
                // 並發建立，改為更新對方剛插入的記錄
                updateExchangeRow(userId, exchangeKey, update);
            }
        });
    }

    @Override
    public ExchangeConfig createExchange(ExchangeConfig exchange) {
        return execute("建立交易所", () -> {
            Long n = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM exchanges WHERE exchange_id = ? AND user_id = ?",
                    Long.class, exchange.getExchangeId(), exchange.getUserId());
            if (n != null && n > 0) {
                throw new DuplicateException("交易所已存在: " + exchange.getExchangeId()
                        + " (user=" + exchange.getUserId() + ")");
            }
            return insertExchange(exchange);
        });
    }

    private int updateExchangeRow(String userId, String exchangeKey, ExchangeUpdate update) {
        StringBuilder sql = new StringBuilder("UPDATE exchanges SET enabled = ?, testnet = ?, "
                + "hyperliquid_wallet_addr = ?, aster_user = ?, aster_signer = ?, updated_at = ?");
        List<Object> args = new ArrayList<>();
        args.add(update.isEnabled());
        args.add(update.isTestnet());
        args.add(nullToEmpty(update.getHyperliquidWalletAddr()));
        args.add(nullToEmpty(update.getAsterUser()));
        args.add(nullToEmpty(update.getAsterSigner()));
        args.add(AppConstants.now());
        if (SecretFieldCodec.shouldWrite(update.getApiKey())) {
            sql.append(", api_key = ?");
            args.add(secrets.seal(update.getApiKey()));
        }
        if (SecretFieldCodec.shouldWrite(update.getSecretKey())) {
            sql.append(", secret_key = ?");
            args.add(secrets.seal(update.getSecretKey()));
        }
        if (SecretFieldCodec.shouldWrite(update.getAsterPrivateKey())) {
            sql.append(", aster_private_key = ?");
            args.add(secrets.seal(update.getAsterPrivateKey()));
        }
        sql.append(" WHERE exchange_id = ? AND user_id = ?");
        args.add(exchangeKey);
        args.add(userId);
        return jdbcTemplate.update(sql.toString(), args.toArray());
    }

    private ExchangeConfig insertExchange(ExchangeConfig exchange) {
        int id = sequenceAllocator.next(SequenceAllocator.EXCHANGES);
        LocalDateTime now = AppConstants.now();
        jdbcTemplate.update(RelationalSchema.INSERT_EXCHANGE,
                id, exchange.getExchangeId(), exchange.getUserId(), nullToEmpty(exchange.getDisplayName()),
                nullToEmpty(exchange.getName()), nullToEmpty(exchange.getType()), exchange.isEnabled(),
                secrets.seal(exchange.getApiKey()), secrets.seal(exchange.getSecretKey()), exchange.isTestnet(),
                nullToEmpty(exchange.getHyperliquidWalletAddr()), nullToEmpty(exchange.getAsterUser()),
                nullToEmpty(exchange.getAsterSigner()), secrets.seal(exchange.getAsterPrivateKey()), now, now);
        exchange.setId(id);
        exchange.setCreatedAt(now);
        exchange.setUpdatedAt(now);
        return exchange;
    }

    // ==================== traders ====================

    @Override
    public void createTrader(TraderRecord trader) {
        run("建立交易員", () -> {
            requireExists("SELECT COUNT(*) FROM ai_models WHERE id = ?", trader.getAiModelId(),
                    "AI 模型不存在: " + trader.getAiModelId());
            requireExists("SELECT COUNT(*) FROM exchanges WHERE id = ?", trader.getExchangeId(),
                    "交易所不存在: " + trader.getExchangeId());

            LocalDateTime now = AppConstants.now();
            jdbcTemplate.update(RelationalSchema.INSERT_TRADER,
                    trader.getId(), trader.getUserId(), trader.getName(),
                    trader.getAiModelId(), trader.getExchangeId(),
                    trader.getInitialBalance(), trader.getScanIntervalMinutes(), trader.isRunning(),
                    trader.getBtcEthLeverage(), trader.getAltcoinLeverage(),
                    nullToEmpty(trader.getTradingSymbols()), trader.isUseCoinPool(), trader.isUseOiTop(),
                    nullToEmpty(trader.getCustomPrompt()), trader.isOverrideBasePrompt(),
                    nullToEmpty(trader.getSystemPromptTemplate()), trader.isCrossMargin(),
                    trader.getTakerFeeRate(), trader.getMakerFeeRate(), nullToEmpty(trader.getOrderStrategy()),
                    trader.getLimitPriceOffset(), trader.getLimitTimeoutSeconds(),
                    nullToEmpty(trader.getTimeframes()), now, now);
            trader.setCreatedAt(now);
            trader.setUpdatedAt(now);
        });
    }

    @Override
    public List<TraderRecord> listTraders(String userId) {
        List<TraderRecord> traders = execute("列出交易員", () -> jdbcTemplate.query(
                "SELECT * FROM traders WHERE user_id = ? ORDER BY created_at DESC, id",
                JdbcRowMappers.TRADER, userId));
        traders.forEach(TraderDefaults::apply);
        return traders;
    }

    @Override
    public void setTraderRunning(String userId, String traderId, boolean running) {
        int updated = execute("更新交易員狀態", () -> jdbcTemplate.update(
                "UPDATE traders SET is_running = ?, updated_at = ? WHERE id = ? AND user_id = ?",
                running, AppConstants.now(), traderId, userId));
        requireFound(updated, "交易員不存在: " + traderId);
    }

    @Override
    public void updateTrader(TraderRecord trader) {
        int updated = execute("更新交易員", () -> jdbcTemplate.update("""
                        UPDATE traders SET name = ?, ai_model_id = ?, exchange_id = ?, scan_interval_minutes = ?,
                            btc_eth_leverage = ?, altcoin_leverage = ?, trading_symbols = ?,
                            use_coin_pool = ?, use_oi_top = ?, custom_prompt = ?, override_base_prompt = ?,
                            system_prompt_template = ?, is_cross_margin = ?, taker_fee_rate = ?,
                            maker_fee_rate = ?, order_strategy = ?, limit_price_offset = ?,
                            limit_timeout_seconds = ?, timeframes = ?, updated_at = ?
                        WHERE id = ? AND user_id = ?""",
                trader.getName(), trader.getAiModelId(), trader.getExchangeId(), trader.getScanIntervalMinutes(),
                trader.getBtcEthLeverage(), trader.getAltcoinLeverage(), nullToEmpty(trader.getTradingSymbols()),
                trader.isUseCoinPool(), trader.isUseOiTop(), nullToEmpty(trader.getCustomPrompt()),
                trader.isOverrideBasePrompt(), nullToEmpty(trader.getSystemPromptTemplate()),
                trader.isCrossMargin(), trader.getTakerFeeRate(), trader.getMakerFeeRate(),
                nullToEmpty(trader.getOrderStrategy()), trader.getLimitPriceOffset(),
                trader.getLimitTimeoutSeconds(), nullToEmpty(trader.getTimeframes()), AppConstants.now(),
                trader.getId(), trader.getUserId()));
        requireFound(updated, "交易員不存在: " + trader.getId());
    }

    @Override
    public void setTraderCustomPrompt(String userId, String traderId, String customPrompt, boolean overrideBase) {
        int updated = execute("更新自訂 prompt", () -> jdbcTemplate.update(
                "UPDATE traders SET custom_prompt = ?, override_base_prompt = ?, updated_at = ? "
                        + "WHERE id = ? AND user_id = ?",
                nullToEmpty(customPrompt), overrideBase, AppConstants.now(), traderId, userId));
        requireFound(updated, "交易員不存在: " + traderId);
    }

    @Override
    public void setTraderInitialBalance(String userId, String traderId, double initialBalance) {
        int updated = execute("更新初始餘額", () -> jdbcTemplate.update(
                "UPDATE traders SET initial_balance = ?, updated_at = ? WHERE id = ? AND user_id = ?",
                initialBalance, AppConstants.now(), traderId, userId));
        requireFound(updated, "交易員不存在: " + traderId);
        log.info("交易員 {} 初始餘額已手動同步為 {}", traderId, initialBalance);
    }

    @Override
    public void deleteTrader(String userId, String traderId) {
        int deleted = execute("刪除交易員", () -> jdbcTemplate.update(
                "DELETE FROM traders WHERE id = ? AND user_id = ?", traderId, userId));
        requireFound(deleted, "交易員不存在: " + traderId);
    }

    @Override
    public TraderFullConfig getTraderFullConfig(String userId, String traderId) {
        return execute("讀取交易員完整配置", () -> {
            TraderRecord trader = jdbcTemplate.query("SELECT * FROM traders WHERE id = ? AND user_id = ?",
                            JdbcRowMappers.TRADER, traderId, userId).stream()
                    .findFirst()
                    .map(TraderDefaults::apply)
                    .orElseThrow(() -> new NotFoundException("交易員不存在: " + traderId));
            AIModelConfig aiModel = jdbcTemplate.query("SELECT * FROM ai_models WHERE id = ?",
                            JdbcRowMappers.AI_MODEL, trader.getAiModelId()).stream()
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("AI 模型不存在: " + trader.getAiModelId()));
            ExchangeConfig exchange = jdbcTemplate.query("SELECT * FROM exchanges WHERE id = ?",
                            JdbcRowMappers.EXCHANGE, trader.getExchangeId()).stream()
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("交易所不存在: " + trader.getExchangeId()));
            openSecrets(aiModel);
            openSecrets(exchange);
            return new TraderFullConfig(trader, aiModel, exchange);
        });
    }

    // ==================== system_config ====================

    @Override
    public Optional<String> getSystemConfig(String key) {
        return execute("讀取系統設定", () -> jdbcTemplate.queryForList(
                "SELECT config_value FROM system_config WHERE config_key = ?", String.class, key)
                .stream().findFirst());
    }

    @Override
    public void setSystemConfig(String key, String value) {
        run("寫入系統設定", () -> jdbcTemplate.update(
                "MERGE INTO system_config (config_key, config_value, updated_at) KEY (config_key) VALUES (?, ?, ?)",
                key, nullToEmpty(value), AppConstants.now()));
    }

    // ==================== user_signal_sources ====================

    @Override
    public void createOrUpdateSignalSource(String userId, String coinPoolUrl, String oiTopUrl) {
        run("寫入信號源", () -> {
            LocalDateTime now = AppConstants.now();
            int updated = jdbcTemplate.update(
                    "UPDATE user_signal_sources SET coin_pool_url = ?, oi_top_url = ?, updated_at = ? WHERE user_id = ?",
                    nullToEmpty(coinPoolUrl), nullToEmpty(oiTopUrl), now, userId);
            if (updated > 0) {
                return;
            }
            try {
                jdbcTemplate.update("INSERT INTO user_signal_sources (user_id, coin_pool_url, oi_top_url, "
                                + "created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
                        userId, nullToEmpty(coinPoolUrl), nullToEmpty(oiTopUrl), now, now);
            } catch (DuplicateKeyException e) {
                jdbcTemplate.update(
                        "UPDATE user_signal_sources SET coin_pool_url = ?, oi_top_url = ?, updated_at = ? WHERE user_id = ?",
                        nullToEmpty(coinPoolUrl), nullToEmpty(oiTopUrl), now, userId);
            }
        });
    }

    @Override
    public Optional<UserSignalSource> getSignalSource(String userId) {
        return execute("讀取信號源", () -> jdbcTemplate.query(
                "SELECT * FROM user_signal_sources WHERE user_id = ?", JdbcRowMappers.SIGNAL_SOURCE, userId)
                .stream().findFirst());
    }

    // ==================== 聚合查詢 ====================

    @Override
    public List<String> listCustomCoins() {
        return execute("讀取自訂幣種", () -> {
            List<String> fields = jdbcTemplate.queryForList(
                    "SELECT trading_symbols FROM traders WHERE trading_symbols <> ''", String.class);
            String defaultCoins = fields.isEmpty() ? getSystemConfig("default_coins").orElse("") : "";
            return TradingSymbols.mergeCoins(fields, defaultCoins);
        });
    }

    @Override
    public List<String> listActiveTimeframes() {
        return execute("讀取時間線", () -> {
            List<String> fields = jdbcTemplate.queryForList(
                    "SELECT timeframes FROM traders WHERE is_running = TRUE", String.class);
            List<String> timeframes = TradingSymbols.mergeTimeframes(fields);
            log.info("📊 運行中交易員的時間線: {}", timeframes);
            return timeframes;
        });
    }

    // ==================== beta_codes ====================

    @Override
    public int loadBetaCodes(List<String> lines) {
        return execute("載入內測碼", () -> {
            int total = 0;
            int inserted = 0;
            for (String line : lines) {
                String code = line.trim();
                if (code.isEmpty() || code.startsWith("#")) {
                    continue;
                }
                total++;
                try {
                    jdbcTemplate.update("INSERT INTO beta_codes (code, used, used_by, created_at) VALUES (?, FALSE, '', ?)",
                            code, AppConstants.now());
                    inserted++;
                } catch (DuplicateKeyException e) {
                    log.debug("內測碼已存在: {}", code);
                }
            }
            log.info("✅ 內測碼載入完成: 共 {} 個，新增 {} 個", total, inserted);
            return inserted;
        });
    }

    @Override
    public boolean validateBetaCode(String code) {
        return findBetaCode(code).map(b -> !b.isUsed()).orElse(false);
    }

    @Override
    public void claimBetaCode(String code, String userEmail) {
        int updated = execute("領取內測碼", () -> jdbcTemplate.update(
                "UPDATE beta_codes SET used = TRUE, used_by = ?, used_at = ? WHERE code = ? AND used = FALSE",
                userEmail, AppConstants.now(), code));
        if (updated == 0) {
            throw new BetaCodeUnavailableException(code);
        }
        log.info("內測碼 {} 已由 {} 領取", code, userEmail);
    }

    @Override
    public Optional<BetaCode> findBetaCode(String code) {
        return execute("查詢內測碼", () -> jdbcTemplate.query(
                "SELECT * FROM beta_codes WHERE code = ?", JdbcRowMappers.BETA_CODE, code).stream().findFirst());
    }

    @Override
    public BetaCodeStats betaCodeStats() {
        return execute("統計內測碼", () -> {
            Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM beta_codes", Long.class);
            Long used = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM beta_codes WHERE used = TRUE", Long.class);
            return new BetaCodeStats(total != null ? total : 0, used != null ? used : 0);
        });
    }

    // ==================== decision_logs ====================

    @Override
    public void saveDecisionLog(String userId, String traderId, Map<String, Object> record) {
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StoreException("決策記錄序列化失敗: " + e.getOriginalMessage(), e);
        }
        run("寫入決策記錄", () -> jdbcTemplate.update(
                "INSERT INTO decision_logs (user_id, trader_id, record_json, created_at) VALUES (?, ?, ?, ?)",
                userId, traderId, json, AppConstants.now()));
    }

    @Override
    public List<Map<String, Object>> getDecisionLogs(String userId, String traderId, int limit) {
        List<String> rows = execute("讀取決策記錄", () -> jdbcTemplate.queryForList(
                "SELECT record_json FROM decision_logs WHERE user_id = ? AND trader_id = ? "
                        + "ORDER BY created_at DESC, id DESC LIMIT ?",
                String.class, userId, traderId, limit));
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (String json : rows) {
            try {
                records.add(objectMapper.readValue(json, RECORD_TYPE));
            } catch (JsonProcessingException e) {
                log.warn("⚠️ 略過無法解析的決策記錄: {}", e.getOriginalMessage());
            }
        }
        Collections.reverse(records);
        return records;
    }

    // ==================== lifecycle ====================

    @Override
    public void close() {
        DataSource dataSource = jdbcTemplate.getDataSource();
        if (dataSource instanceof Closeable) {
            try {
                ((Closeable) dataSource).close();
                log.info("關聯式存儲連線池已關閉");
            } catch (IOException e) {
                log.warn("關閉連線池失敗: {}", e.getMessage());
            }
        }
    }

    // ==================== helpers ====================

    private void openSecrets(AIModelConfig model) {
        model.setApiKey(secrets.open(model.getApiKey()));
    }

    private void openSecrets(ExchangeConfig exchange) {
        exchange.setApiKey(secrets.open(exchange.getApiKey()));
        exchange.setSecretKey(secrets.open(exchange.getSecretKey()));
        exchange.setAsterPrivateKey(secrets.open(exchange.getAsterPrivateKey()));
    }

    private void requireExists(String sql, Object arg, String message) {
        Long n = jdbcTemplate.queryForObject(sql, Long.class, arg);
        if (n == null || n == 0) {
            throw new NotFoundException(message);
        }
    }

    private static void requireFound(int affected, String message) {
        if (affected == 0) {
            throw new NotFoundException(message);
        }
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw StoreErrors.translate(operation, e);
        }
    }

    private void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
