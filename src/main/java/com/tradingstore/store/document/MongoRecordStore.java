package com.tradingstore.store.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
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
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 文件式後端（MongoDB + MongoTemplate）的 {@link RecordStore}
 *
 * 單筆操作都是單一文件的原子更新；所有查詢帶 maxTimeMS。
 */
@Slf4j
public class MongoRecordStore implements RecordStore {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final MongoTemplate mongoTemplate;
    private final MongoClient mongoClient;
    private final SequenceAllocator sequenceAllocator;
    private final ObjectMapper objectMapper;
    private final long timeoutMs;
    private final SecretFieldCodec secrets = new SecretFieldCodec();

    public MongoRecordStore(MongoTemplate mongoTemplate, MongoClient mongoClient, SequenceAllocator sequenceAllocator,
                            ObjectMapper objectMapper, Duration operationTimeout) {
        this.mongoTemplate = mongoTemplate;
        this.mongoClient = mongoClient;
        this.sequenceAllocator = sequenceAllocator;
        this.objectMapper = objectMapper;
        this.timeoutMs = operationTimeout.toMillis();
    }

    @Override
    public void setCredentialVault(CredentialVault vault) {
        secrets.setVault(vault);
        log.info("🔐 已注入 vault，機密欄位加密: {}", secrets.hasVault());
    }

    @Override
    public void ping() {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
        } catch (DataAccessException e) {
            throw new ConnectionException("無法連線到 MongoDB: " + e.getMessage(), e);
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
            boolean exists = mongoTemplate.exists(query(new Criteria().orOperator(
                    Criteria.where("id").is(user.getId()),
                    Criteria.where("email").is(user.getEmail()))), StoreDocuments.USERS);
            if (exists) {
                throw new DuplicateException("用戶已存在: " + user.getId() + " / " + user.getEmail());
            }
            mongoTemplate.insert(StoreDocuments.toDocument(user, AppConstants.now()), StoreDocuments.USERS);
        });
    }

    @Override
    public Optional<User> getUserByEmail(String email) {
        return findOne("查詢用戶", Criteria.where("email").is(email), StoreDocuments.USERS)
                .map(StoreDocuments::toUser);
    }

    @Override
    public Optional<User> getUserById(String userId) {
        return findOne("查詢用戶", Criteria.where("id").is(userId), StoreDocuments.USERS)
                .map(StoreDocuments::toUser);
    }

    @Override
    public List<String> listUserIds() {
        return execute("列出用戶", () -> mongoTemplate.find(query(new Criteria()).with(Sort.by("id")),
                        Document.class, StoreDocuments.USERS).stream()
                .map(doc -> doc.getString("id"))
                .toList());
    }

    @Override
    public void setUserOtpVerified(String userId, boolean verified) {
        UpdateResult result = execute("更新 OTP 狀態", () -> mongoTemplate.updateFirst(
                query(Criteria.where("id").is(userId)),
                touch(new Update().set("otp_verified", verified)),
                StoreDocuments.USERS));
        requireMatched(result, "用戶不存在: " + userId);
    }

    @Override
    public void updateUserPassword(String userId, String passwordHash) {
        UpdateResult result = execute("更新密碼", () -> mongoTemplate.updateFirst(
                query(Criteria.where("id").is(userId)),
                touch(new Update().set("password_hash", passwordHash)),
                StoreDocuments.USERS));
        requireMatched(result, "用戶不存在: " + userId);
    }

    // ==================== ai_models ====================

    @Override
    public List<AIModelConfig> listAiModels(String userId) {
        return execute("列出 AI 模型", () -> mongoTemplate.find(
                        query(Criteria.where("user_id").is(userId)).with(Sort.by("id")),
                        Document.class, StoreDocuments.AI_MODELS).stream()
                .map(StoreDocuments::toAiModel)
                .map(this::openSecrets)
                .toList());
    }

    /**
     * 依序嘗試：modelId 精確匹配 → 舊版 provider 匹配 → 建立新記錄
     */
    @Override
    public void upsertAiModel(String userId, String modelKey, AiModelUpdate update) {
        run("更新 AI 模型", () -> {
            Optional<Document> existing = findFirst(
                    Criteria.where("user_id").is(userId).and("model_id").is(modelKey), StoreDocuments.AI_MODELS);
            if (existing.isEmpty()) {
                existing = findFirst(
                        Criteria.where("user_id").is(userId).and("provider").is(modelKey), StoreDocuments.AI_MODELS);
                existing.ifPresent(doc -> log.warn("⚠️ 使用舊版 provider 匹配更新模型: {} -> {}",
                        modelKey, doc.getString("model_id")));
            }
            if (existing.isPresent()) {
                Update changes = touch(new Update()
                        .set("enabled", update.isEnabled())
                        .set("custom_api_url", StoreDocuments.nullToEmpty(update.getCustomApiUrl()))
                        .set("custom_model_name", StoreDocuments.nullToEmpty(update.getCustomModelName())));
                if (SecretFieldCodec.shouldWrite(update.getApiKey())) {
                    changes.set("api_key", secrets.seal(update.getApiKey()));
                }
                mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(existing.get().get("_id"))),
                        changes, StoreDocuments.AI_MODELS);
                return;
            }

            String provider = CatalogDefaults.inferProvider(modelKey);
            String name = findFirst(Criteria.where("provider").is(provider).and("name").ne(""),
                    StoreDocuments.AI_MODELS)
                    .map(doc -> doc.getString("name"))
                    .orElse(CatalogDefaults.fallbackModelName(provider));
            String newModelId = CatalogDefaults.newModelId(userId, modelKey, provider);
            log.info("✓ 建立新的 AI 模型配置: modelId={}, provider={}, name={}", newModelId, provider, name);

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
        });
    }

    @Override
    public AIModelConfig createAiModel(AIModelConfig model) {
        return execute("建立 AI 模型", () -> {
            if (mongoTemplate.exists(query(Criteria.where("model_id").is(model.getModelId())
                    .and("user_id").is(model.getUserId())), StoreDocuments.AI_MODELS)) {
                throw new DuplicateException("AI 模型已存在: " + model.getModelId() + " (user=" + model.getUserId() + ")");
            }
            return insertAiModel(model);
        });
    }

    private AIModelConfig insertAiModel(AIModelConfig model) {
        LocalDateTime now = AppConstants.now();
        model.setId(sequenceAllocator.next(SequenceAllocator.AI_MODELS));
        mongoTemplate.insert(StoreDocuments.toDocument(model, secrets.seal(model.getApiKey()), now),
                StoreDocuments.AI_MODELS);
        model.setCreatedAt(now);
        model.setUpdatedAt(now);
        return model;
    }

    // ==================== exchanges ====================

    @Override
    public List<ExchangeConfig> listExchanges(String userId) {
        return execute("列出交易所", () -> mongoTemplate.find(
                        query(Criteria.where("user_id").is(userId)).with(Sort.by("id")),
                        Document.class, StoreDocuments.EXCHANGES).stream()
                .map(StoreDocuments::toExchange)
                .map(this::openSecrets)
                .toList());
    }

    /**
     * 先更新 (exchangeKey, userId)；沒有匹配時依類型 ID 建立新記錄
     */
    @Override
    public void upsertExchange(String userId, String exchangeKey, ExchangeUpdate update) {
        run("更新交易所", () -> {
            log.info("🔧 更新交易所: userId={}, exchange={}, enabled={}", userId, exchangeKey, update.isEnabled());
            if (updateExchange(userId, exchangeKey, update) > 0) {
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
                // 並發建立，改為更新對方剛插入的文件
                updateExchange(userId, exchangeKey, update);
            }
        });
    }

    @Override
    public ExchangeConfig createExchange(ExchangeConfig exchange) {
        return execute("建立交易所", () -> {
            if (mongoTemplate.exists(query(Criteria.where("exchange_id").is(exchange.getExchangeId())
                    .and("user_id").is(exchange.getUserId())), StoreDocuments.EXCHANGES)) {
                throw new DuplicateException("交易所已存在: " + exchange.getExchangeId()
                        + " (user=" + exchange.getUserId() + ")");
            }
            return insertExchange(exchange);
        });
    }

    private long updateExchange(String userId, String exchangeKey, ExchangeUpdate update) {
        Update changes = touch(new Update()
                .set("enabled", update.isEnabled())
                .set("testnet", update.isTestnet())
                .set("hyperliquid_wallet_addr", StoreDocuments.nullToEmpty(update.getHyperliquidWalletAddr()))
                .set("aster_user", StoreDocuments.nullToEmpty(update.getAsterUser()))
                .set("aster_signer", StoreDocuments.nullToEmpty(update.getAsterSigner())));
        if (SecretFieldCodec.shouldWrite(update.getApiKey())) {
            changes.set("api_key", secrets.seal(update.getApiKey()));
        }
        if (SecretFieldCodec.shouldWrite(update.getSecretKey())) {
            changes.set("secret_key", secrets.seal(update.getSecretKey()));
        }
        if (SecretFieldCodec.shouldWrite(update.getAsterPrivateKey())) {
            changes.set("aster_private_key", secrets.seal(update.getAsterPrivateKey()));
        }
        UpdateResult result = mongoTemplate.updateFirst(
                query(Criteria.where("exchange_id").is(exchangeKey).and("user_id").is(userId)),
                changes, StoreDocuments.EXCHANGES);
        return result != null ? result.getMatchedCount() : 0;
    }

    private ExchangeConfig insertExchange(ExchangeConfig exchange) {
        LocalDateTime now = AppConstants.now();
        exchange.setId(sequenceAllocator.next(SequenceAllocator.EXCHANGES));
        mongoTemplate.insert(StoreDocuments.toDocument(exchange,
                        secrets.seal(exchange.getApiKey()),
                        secrets.seal(exchange.getSecretKey()),
                        secrets.seal(exchange.getAsterPrivateKey()), now),
                StoreDocuments.EXCHANGES);
        exchange.setCreatedAt(now);
        exchange.setUpdatedAt(now);
        return exchange;
    }

    // ==================== traders ====================

    @Override
    public void createTrader(TraderRecord trader) {
        run("建立交易員", () -> {
            if (!mongoTemplate.exists(query(Criteria.where("id").is(trader.getAiModelId())), StoreDocuments.AI_MODELS)) {
                throw new NotFoundException("AI 模型不存在: " + trader.getAiModelId());
            }
            if (!mongoTemplate.exists(query(Criteria.where("id").is(trader.getExchangeId())), StoreDocuments.EXCHANGES)) {
                throw new NotFoundException("交易所不存在: " + trader.getExchangeId());
            }
            if (mongoTemplate.exists(query(Criteria.where("id").is(trader.getId())), StoreDocuments.TRADERS)) {
                throw new DuplicateException("交易員已存在: " + trader.getId());
            }
            LocalDateTime now = AppConstants.now();
            mongoTemplate.insert(StoreDocuments.toDocument(trader, now), StoreDocuments.TRADERS);
            trader.setCreatedAt(now);
            trader.setUpdatedAt(now);
        });
    }

    @Override
    public List<TraderRecord> listTraders(String userId) {
        return execute("列出交易員", () -> mongoTemplate.find(
                        query(Criteria.where("user_id").is(userId)).with(Sort.by(Sort.Direction.DESC, "created_at")),
                        Document.class, StoreDocuments.TRADERS).stream()
                .map(StoreDocuments::toTrader)
                .map(TraderDefaults::apply)
                .toList());
    }

    @Override
    public void setTraderRunning(String userId, String traderId, boolean running) {
        updateTraderFields("更新交易員狀態", userId, traderId, new Update().set("is_running", running));
    }

    @Override
    public void updateTrader(TraderRecord trader) {
        updateTraderFields("更新交易員", trader.getUserId(), trader.getId(), new Update()
                .set("name", trader.getName())
                .set("ai_model_id", trader.getAiModelId())
                .set("exchange_id", trader.getExchangeId())
                .set("scan_interval_minutes", trader.getScanIntervalMinutes())
                .set("btc_eth_leverage", trader.getBtcEthLeverage())
                .set("altcoin_leverage", trader.getAltcoinLeverage())
                .set("trading_symbols", StoreDocuments.nullToEmpty(trader.getTradingSymbols()))
                .set("use_coin_pool", trader.isUseCoinPool())
                .set("use_oi_top", trader.isUseOiTop())
                .set("custom_prompt", StoreDocuments.nullToEmpty(trader.getCustomPrompt()))
                .set("override_base_prompt", trader.isOverrideBasePrompt())
                .set("system_prompt_template", StoreDocuments.nullToEmpty(trader.getSystemPromptTemplate()))
                .set("is_cross_margin", trader.isCrossMargin())
                .set("taker_fee_rate", trader.getTakerFeeRate())
                .set("maker_fee_rate", trader.getMakerFeeRate())
                .set("order_strategy", StoreDocuments.nullToEmpty(trader.getOrderStrategy()))
                .set("limit_price_offset", trader.getLimitPriceOffset())
                .set("limit_timeout_seconds", trader.getLimitTimeoutSeconds())
                .set("timeframes", StoreDocuments.nullToEmpty(trader.getTimeframes())));
    }

    @Override
    public void setTraderCustomPrompt(String userId, String traderId, String customPrompt, boolean overrideBase) {
        updateTraderFields("更新自訂 prompt", userId, traderId, new Update()
                .set("custom_prompt", StoreDocuments.nullToEmpty(customPrompt))
                .set("override_base_prompt", overrideBase));
    }

    @Override
    public void setTraderInitialBalance(String userId, String traderId, double initialBalance) {
        updateTraderFields("更新初始餘額", userId, traderId, new Update().set("initial_balance", initialBalance));
        log.info("交易員 {} 初始餘額已手動同步為 {}", traderId, initialBalance);
    }

    @Override
    public void deleteTrader(String userId, String traderId) {
        DeleteResult result = execute("刪除交易員", () -> mongoTemplate.remove(
                query(Criteria.where("id").is(traderId).and("user_id").is(userId)), StoreDocuments.TRADERS));
        if (result == null || result.getDeletedCount() == 0) {
            throw new NotFoundException("交易員不存在: " + traderId);
        }
    }

    @Override
    public TraderFullConfig getTraderFullConfig(String userId, String traderId) {
        TraderRecord trader = findOne("讀取交易員", Criteria.where("id").is(traderId).and("user_id").is(userId),
                StoreDocuments.TRADERS)
                .map(StoreDocuments::toTrader)
                .map(TraderDefaults::apply)
                .orElseThrow(() -> new NotFoundException("交易員不存在: " + traderId));
        AIModelConfig aiModel = findOne("讀取 AI 模型", Criteria.where("id").is(trader.getAiModelId()),
                StoreDocuments.AI_MODELS)
                .map(StoreDocuments::toAiModel)
                .map(this::openSecrets)
                .orElseThrow(() -> new NotFoundException("AI 模型不存在: " + trader.getAiModelId()));
        ExchangeConfig exchange = findOne("讀取交易所", Criteria.where("id").is(trader.getExchangeId()),
                StoreDocuments.EXCHANGES)
                .map(StoreDocuments::toExchange)
                .map(this::openSecrets)
                .orElseThrow(() -> new NotFoundException("交易所不存在: " + trader.getExchangeId()));
        return new TraderFullConfig(trader, aiModel, exchange);
    }

    private void updateTraderFields(String operation, String userId, String traderId, Update changes) {
        UpdateResult result = execute(operation, () -> mongoTemplate.updateFirst(
                query(Criteria.where("id").is(traderId).and("user_id").is(userId)),
                touch(changes), StoreDocuments.TRADERS));
        requireMatched(result, "交易員不存在: " + traderId);
    }

    // ==================== system_config ====================

    @Override
    public Optional<String> getSystemConfig(String key) {
        return findOne("讀取系統設定", Criteria.where("key").is(key), StoreDocuments.SYSTEM_CONFIG)
                .map(doc -> StoreDocuments.string(doc, "value"));
    }

    @Override
    public void setSystemConfig(String key, String value) {
        run("寫入系統設定", () -> mongoTemplate.upsert(
                query(Criteria.where("key").is(key)),
                touch(new Update().set("value", StoreDocuments.nullToEmpty(value))),
                StoreDocuments.SYSTEM_CONFIG));
    }

    // ==================== user_signal_sources ====================

    @Override
    public void createOrUpdateSignalSource(String userId, String coinPoolUrl, String oiTopUrl) {
        run("寫入信號源", () -> mongoTemplate.upsert(
                query(Criteria.where("user_id").is(userId)),
                touch(new Update()
                        .set("coin_pool_url", StoreDocuments.nullToEmpty(coinPoolUrl))
                        .set("oi_top_url", StoreDocuments.nullToEmpty(oiTopUrl))
                        .setOnInsert("created_at", StoreDocuments.toDate(AppConstants.now()))),
                StoreDocuments.USER_SIGNAL_SOURCES));
    }

    @Override
    public Optional<UserSignalSource> getSignalSource(String userId) {
        return findOne("讀取信號源", Criteria.where("user_id").is(userId), StoreDocuments.USER_SIGNAL_SOURCES)
                .map(StoreDocuments::toSignalSource);
    }

    // ==================== 聚合查詢 ====================

    @Override
    public List<String> listCustomCoins() {
        return execute("讀取自訂幣種", () -> {
            Query query = query(Criteria.where("trading_symbols").nin("", null));
            query.fields().include("trading_symbols");
            List<String> fields = mongoTemplate.find(query, Document.class, StoreDocuments.TRADERS).stream()
                    .map(doc -> StoreDocuments.string(doc, "trading_symbols"))
                    .toList();
            String defaultCoins = fields.isEmpty() ? getSystemConfig("default_coins").orElse("") : "";
            return TradingSymbols.mergeCoins(fields, defaultCoins);
        });
    }

    @Override
    public List<String> listActiveTimeframes() {
        return execute("讀取時間線", () -> {
            Query query = query(Criteria.where("is_running").is(true));
            query.fields().include("timeframes");
            List<String> fields = mongoTemplate.find(query, Document.class, StoreDocuments.TRADERS).stream()
                    .map(doc -> StoreDocuments.string(doc, "timeframes"))
                    .toList();
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
            LocalDateTime now = AppConstants.now();
            for (String line : lines) {
                String code = line.trim();
                if (code.isEmpty() || code.startsWith("#")) {
                    continue;
                }
                total++;
                UpdateResult result = mongoTemplate.upsert(
                        Query.query(Criteria.where("code").is(code)),
                        new Update().setOnInsert("used", false)
                                .setOnInsert("used_by", "")
                                .setOnInsert("created_at", StoreDocuments.toDate(now)),
                        StoreDocuments.BETA_CODES);
                if (result != null && result.getUpsertedId() != null) {
                    inserted++;
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
        UpdateResult result = execute("領取內測碼", () -> mongoTemplate.updateFirst(
                Query.query(Criteria.where("code").is(code).and("used").is(false)),
                new Update().set("used", true)
                        .set("used_by", userEmail)
                        .set("used_at", StoreDocuments.toDate(AppConstants.now())),
                StoreDocuments.BETA_CODES));
        if (result == null || result.getMatchedCount() == 0) {
            throw new BetaCodeUnavailableException(code);
        }
        log.info("內測碼 {} 已由 {} 領取", code, userEmail);
    }

    @Override
    public Optional<BetaCode> findBetaCode(String code) {
        return findOne("查詢內測碼", Criteria.where("code").is(code), StoreDocuments.BETA_CODES)
                .map(StoreDocuments::toBetaCode);
    }

    @Override
    public BetaCodeStats betaCodeStats() {
        return execute("統計內測碼", () -> new BetaCodeStats(
                mongoTemplate.count(query(new Criteria()), StoreDocuments.BETA_CODES),
                mongoTemplate.count(query(Criteria.where("used").is(true)), StoreDocuments.BETA_CODES)));
    }

    // ==================== decision_logs ====================

    /**
     * 記錄存成內嵌子文件 record；舊版本寫入的 record_json 字串仍可讀取
     */
    @Override
    public void saveDecisionLog(String userId, String traderId, Map<String, Object> record) {
        Map<String, Object> normalized;
        try {
            normalized = objectMapper.convertValue(record, RECORD_TYPE);
        } catch (IllegalArgumentException e) {
            throw new StoreException("決策記錄序列化失敗: " + e.getMessage(), e);
        }
        Document doc = new Document("user_id", userId)
                .append("trader_id", traderId)
                .append("record", new Document(normalized))
                .append("created_at", StoreDocuments.toDate(AppConstants.now()));
        run("寫入決策記錄", () -> mongoTemplate.insert(doc, StoreDocuments.DECISION_LOGS));
    }

    @Override
    public List<Map<String, Object>> getDecisionLogs(String userId, String traderId, int limit) {
        List<Document> docs = execute("讀取決策記錄", () -> mongoTemplate.find(
                query(Criteria.where("user_id").is(userId).and("trader_id").is(traderId))
                        .with(Sort.by(Sort.Direction.DESC, "created_at", "_id"))
                        .limit(limit),
                Document.class, StoreDocuments.DECISION_LOGS));
        List<Map<String, Object>> records = new ArrayList<>(docs.size());
        for (Document doc : docs) {
            readDecisionRecord(doc).ifPresent(records::add);
        }
        Collections.reverse(records);
        return records;
    }

    private Optional<Map<String, Object>> readDecisionRecord(Document doc) {
        Object embedded = doc.get("record");
        if (embedded instanceof Document) {
            return Optional.of(new LinkedHashMap<>((Document) embedded));
        }
        String json = StoreDocuments.string(doc, "record_json");
        if (json.isEmpty()) {
            log.warn("⚠️ 略過沒有內容的決策記錄: _id={}", doc.get("_id"));
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, RECORD_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("⚠️ 略過無法解析的決策記錄: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    // ==================== lifecycle ====================

    @Override
    public void close() {
        if (mongoClient != null) {
            mongoClient.close();
            log.info("MongoDB 連線已關閉");
        }
    }

    // ==================== helpers ====================

    private Query query(Criteria criteria) {
        return Query.query(criteria).maxTimeMsec(timeoutMs);
    }

    private static Update touch(Update update) {
        return update.set("updated_at", StoreDocuments.toDate(AppConstants.now()));
    }

    private Optional<Document> findFirst(Criteria criteria, String collection) {
        return Optional.ofNullable(mongoTemplate.findOne(query(criteria).with(Sort.by("id")), Document.class, collection));
    }

    private Optional<Document> findOne(String operation, Criteria criteria, String collection) {
        return execute(operation, () -> Optional.ofNullable(
                mongoTemplate.findOne(query(criteria), Document.class, collection)));
    }

    private AIModelConfig openSecrets(AIModelConfig model) {
        model.setApiKey(secrets.open(model.getApiKey()));
        return model;
    }

    private ExchangeConfig openSecrets(ExchangeConfig exchange) {
        exchange.setApiKey(secrets.open(exchange.getApiKey()));
        exchange.setSecretKey(secrets.open(exchange.getSecretKey()));
        exchange.setAsterPrivateKey(secrets.open(exchange.getAsterPrivateKey()));
        return exchange;
    }

    private static void requireMatched(UpdateResult result, String message) {
        if (result == null || result.getMatchedCount() == 0) {
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
}
