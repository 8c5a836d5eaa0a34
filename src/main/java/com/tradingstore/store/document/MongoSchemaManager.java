package com.tradingstore.store.document;

import com.mongodb.client.result.UpdateResult;
import com.tradingstore.shared.config.AppConstants;
import com.tradingstore.shared.exception.IntegrityException;
import com.tradingstore.shared.exception.SchemaException;
import com.tradingstore.store.schema.KeyMapping;
import com.tradingstore.store.schema.LegacyTraderRef;
import com.tradingstore.store.schema.SchemaGeneration;
import com.tradingstore.store.schema.SchemaManager;
import com.tradingstore.store.sequence.SequenceAllocator;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MongoDB 上的 schema 遷移
 *
 * 每份文件的轉換是單一 updateFirst（以 _id 定位），中途崩潰後重跑只會處理仍是舊格式的文件。
 * 舊格式判斷：ai_models / exchanges 缺少 model_id / exchange_id，traders 的外鍵為字串。
 */
@Slf4j
public class MongoSchemaManager implements SchemaManager {

    /** BSON string 型別編號 */
    private static final int BSON_STRING = 2;

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    /** 遷移後完整性檢查要求的欄位（model_id / exchange_id 由舊格式檢查涵蓋） */
    static final Map<String, List<String>> REQUIRED_FIELDS = new LinkedHashMap<>();

    static {
        REQUIRED_FIELDS.put(StoreDocuments.AI_MODELS, List.of("id", "user_id", "name", "provider", "enabled"));
        REQUIRED_FIELDS.put(StoreDocuments.EXCHANGES, List.of("id", "user_id", "name", "type", "enabled"));
        REQUIRED_FIELDS.put(StoreDocuments.TRADERS, List.of("id", "user_id", "ai_model_id", "exchange_id", "is_running"));
    }

    private final MongoTemplate mongoTemplate;
    private final SequenceAllocator sequenceAllocator;
    private final String backupDir;

    private volatile int generation = SchemaGeneration.UNKNOWN;

    public MongoSchemaManager(MongoTemplate mongoTemplate, SequenceAllocator sequenceAllocator, String backupDir) {
        this.mongoTemplate = mongoTemplate;
        this.sequenceAllocator = sequenceAllocator;
        this.backupDir = backupDir;
    }

    @Override
    public void ensureSchema() {
        try {
            applyAdditiveFields();

            int stored = readMarker();
            if (stored == SchemaGeneration.CURRENT) {
                generation = stored;
                log.debug("schema 已是世代 {}，略過遷移偵測", stored);
                return;
            }

            List<String> pending = detectPendingSteps();
            if (!pending.isEmpty()) {
                log.info("🔄 偵測到待執行的 schema 遷移: {}", pending);
                backup(pending.get(0));
                for (String step : pending) {
                    runStep(step);
                }
            }
            validate();
            ensureIndexes();

            writeMarker(SchemaGeneration.CURRENT);
            generation = SchemaGeneration.CURRENT;
            log.info("✅ schema 就緒，世代 {}", SchemaGeneration.CURRENT);
        } catch (DataAccessException e) {
            throw new SchemaException("schema 遷移失敗: " + e.getMessage(), e);
        }
    }

    @Override
    public int currentGeneration() {
        return generation;
    }

    // ==================== 附加欄位 ====================

    /**
     * 文件沒有固定結構，只為查詢會用到的欄位補上空值
     */
    private void applyAdditiveFields() {
        fillMissing(StoreDocuments.USERS, "otp_secret", "");
        fillMissing(StoreDocuments.USERS, "otp_verified", false);
        fillMissing(StoreDocuments.AI_MODELS, "display_name", "");
        fillMissing(StoreDocuments.EXCHANGES, "display_name", "");
        fillMissing(StoreDocuments.TRADERS, "trading_symbols", "");
        fillMissing(StoreDocuments.TRADERS, "timeframes", "");
    }

    private void fillMissing(String collection, String field, Object value) {
        UpdateResult result = mongoTemplate.updateMulti(
                Query.query(Criteria.where(field).exists(false)),
                new Update().set(field, value),
                collection);
        if (result != null && result.getModifiedCount() > 0) {
            log.info("{}.{}: 補上 {} 筆缺少的欄位", collection, field, result.getModifiedCount());
        }
    }

    // ==================== 世代標記 ====================

    private int readMarker() {
        Document marker = mongoTemplate.findOne(
                Query.query(Criteria.where("_id").is(SchemaGeneration.MARKER_NAME)),
                Document.class, StoreDocuments.SCHEMA_META);
        if (marker == null || !(marker.get("generation") instanceof Number)) {
            return SchemaGeneration.UNKNOWN;
        }
        return ((Number) marker.get("generation")).intValue();
    }

    private void writeMarker(int value) {
        mongoTemplate.upsert(
                Query.query(Criteria.where("_id").is(SchemaGeneration.MARKER_NAME)),
                new Update().set("generation", value)
                        .set("updated_at", StoreDocuments.toDate(AppConstants.now())),
                StoreDocuments.SCHEMA_META);
    }

    // ==================== 偵測 ====================

    private List<String> detectPendingSteps() {
        List<String> pending = new ArrayList<>();
        if (mongoTemplate.exists(legacyAiModels(), StoreDocuments.AI_MODELS)) {
            pending.add(SchemaGeneration.STEP_REKEY_AI_MODELS);
        }
        if (mongoTemplate.exists(legacyExchanges(), StoreDocuments.EXCHANGES)) {
            pending.add(SchemaGeneration.STEP_REKEY_EXCHANGES);
        }
        if (mongoTemplate.exists(legacyTraders(), StoreDocuments.TRADERS)) {
            pending.add(SchemaGeneration.STEP_REMAP_TRADER_REFS);
        }
        return pending;
    }

    private static Query legacyAiModels() {
        return Query.query(Criteria.where("model_id").exists(false));
    }

    private static Query legacyExchanges() {
        return Query.query(Criteria.where("exchange_id").exists(false));
    }

    private static Query legacyTraders() {
        return Query.query(new Criteria().orOperator(
                Criteria.where("ai_model_id").type(BSON_STRING),
                Criteria.where("exchange_id").type(BSON_STRING)));
    }

    private void runStep(String step) {
        switch (step) {
            case SchemaGeneration.STEP_REKEY_AI_MODELS -> rekey(StoreDocuments.AI_MODELS, "model_id",
                    SequenceAllocator.AI_MODELS, legacyAiModels());
            case SchemaGeneration.STEP_REKEY_EXCHANGES -> rekey(StoreDocuments.EXCHANGES, "exchange_id",
                    SequenceAllocator.EXCHANGES, legacyExchanges());
            case SchemaGeneration.STEP_REMAP_TRADER_REFS -> remapTraderRefs();
            default -> throw new SchemaException("未知的遷移步驟: " + step);
        }
    }

    // ==================== 破壞性步驟 ====================

    /**
     * 舊文件的字串 id 搬到 keyField，id 改為序號；(keyField, user_id) 已有新格式文件時刪除舊文件
     */
    private void rekey(String collection, String keyField, String family, Query legacyQuery) {
        List<Document> legacy = mongoTemplate.find(legacyQuery.with(Sort.by("created_at")), Document.class, collection);
        int migrated = 0;
        int dropped = 0;
        for (Document doc : legacy) {
            Object objectId = doc.get("_id");
            String legacyKey = String.valueOf(doc.get("id"));
            String userId = doc.getString("user_id");

            boolean alreadyMigrated = mongoTemplate.exists(Query.query(
                    Criteria.where(keyField).is(legacyKey).and("user_id").is(userId)), collection);
            if (alreadyMigrated) {
                mongoTemplate.remove(Query.query(Criteria.where("_id").is(objectId)), collection);
                dropped++;
                continue;
            }

            int newId = sequenceAllocator.next(family);
            mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(objectId)),
                    new Update().set(keyField, legacyKey).set("id", newId),
                    collection);
            migrated++;
        }
        log.info("✅ {} 重新編號完成: 遷移 {} 筆，移除重複 {} 筆", collection, migrated, dropped);
    }

    private void remapTraderRefs() {
        KeyMapping aiModels = KeyMapping.global();
        for (Document doc : mongoTemplate.findAll(Document.class, StoreDocuments.AI_MODELS)) {
            aiModels.put(doc.getString("user_id"), doc.getString("model_id"), StoreDocuments.integer(doc, "id"));
        }
        KeyMapping exchanges = KeyMapping.perUser();
        for (Document doc : mongoTemplate.findAll(Document.class, StoreDocuments.EXCHANGES)) {
            exchanges.put(doc.getString("user_id"), doc.getString("exchange_id"), StoreDocuments.integer(doc, "id"));
        }

        List<Document> traders = mongoTemplate.find(legacyTraders(), Document.class, StoreDocuments.TRADERS);
        int unmapped = 0;
        for (Document doc : traders) {
            LegacyTraderRef ref = new LegacyTraderRef(doc.getString("id"), doc.getString("user_id"),
                    String.valueOf(doc.get("ai_model_id")), String.valueOf(doc.get("exchange_id")));
            int aiModelId = resolve(doc.get("ai_model_id"), aiModels, ref.userId(), ref.aiModelRef());
            int exchangeId = resolve(doc.get("exchange_id"), exchanges, ref.userId(), ref.exchangeRef());
            if (aiModelId == KeyMapping.UNMAPPED || exchangeId == KeyMapping.UNMAPPED) {
                unmapped++;
                log.warn("⚠️ 交易員 {} 的外鍵無法對照: ai_model={} -> {}, exchange={} -> {}",
                        ref.traderId(), ref.aiModelRef(), aiModelId, ref.exchangeRef(), exchangeId);
            }
            mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(doc.get("_id"))),
                    new Update().set("ai_model_id", aiModelId).set("exchange_id", exchangeId),
                    StoreDocuments.TRADERS);
        }
        log.info("✅ traders 外鍵對照完成: {} 筆，無法對照 {} 筆", traders.size(), unmapped);
    }

    private static int resolve(Object current, KeyMapping mapping, String userId, String legacyKey) {
        if (current instanceof Number) {
            return ((Number) current).intValue();
        }
        return mapping.resolve(userId, legacyKey);
    }

    // ==================== 驗證 ====================

    private void validate() {
        long legacyModels = mongoTemplate.count(legacyAiModels(), StoreDocuments.AI_MODELS);
        long legacyExchanges = mongoTemplate.count(legacyExchanges(), StoreDocuments.EXCHANGES);
        long legacyTraders = mongoTemplate.count(legacyTraders(), StoreDocuments.TRADERS);
        if (legacyModels > 0 || legacyExchanges > 0 || legacyTraders > 0) {
            throw new IntegrityException(String.format(
                    "完整性檢查失敗: 仍有舊格式文件 ai_models=%d、exchanges=%d、traders=%d",
                    legacyModels, legacyExchanges, legacyTraders));
        }

        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : REQUIRED_FIELDS.entrySet()) {
            for (String field : entry.getValue()) {
                long count = mongoTemplate.count(Query.query(Criteria.where(field).exists(false)), entry.getKey());
                if (count > 0) {
                    missing.add(entry.getKey() + "." + field + "=" + count);
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new IntegrityException("完整性檢查失敗: 文件缺少必要欄位 " + missing);
        }

        List<Long> modelIds = numericIds(StoreDocuments.AI_MODELS);
        List<Long> exchangeIds = numericIds(StoreDocuments.EXCHANGES);
        long orphanModels = mongoTemplate.count(
                Query.query(Criteria.where("ai_model_id").nin(modelIds)), StoreDocuments.TRADERS);
        long orphanExchanges = mongoTemplate.count(
                Query.query(Criteria.where("exchange_id").nin(exchangeIds)), StoreDocuments.TRADERS);
        if (orphanModels > 0 || orphanExchanges > 0) {
            throw new IntegrityException(String.format(
                    "完整性檢查失敗: %d 個交易員引用不存在的 AI 模型，%d 個交易員引用不存在的交易所",
                    orphanModels, orphanExchanges));
        }

        long traders = mongoTemplate.count(new Query(), StoreDocuments.TRADERS);
        long aiModels = mongoTemplate.count(new Query(), StoreDocuments.AI_MODELS);
        long exchanges = mongoTemplate.count(new Query(), StoreDocuments.EXCHANGES);
        if (traders > 0 && (aiModels == 0 || exchanges == 0)) {
            throw new IntegrityException(String.format(
                    "完整性檢查失敗: 有 %d 個交易員，但 ai_models=%d、exchanges=%d",
                    traders, aiModels, exchanges));
        }
        log.info("✅ 完整性檢查通過: traders={}, ai_models={}, exchanges={}", traders, aiModels, exchanges);
    }

    /**
     * id 可能是 Int32 或 Int64，統一轉為 long；$nin 以數值比較，不受 BSON 型別影響
     */
    private List<Long> numericIds(String collection) {
        Query query = new Query();
        query.fields().include("id");
        List<Long> ids = new ArrayList<>();
        for (Document doc : mongoTemplate.find(query, Document.class, collection)) {
            Object id = doc.get("id");
            if (id instanceof Number) {
                ids.add(((Number) id).longValue());
            }
        }
        return ids;
    }

    private void ensureIndexes() {
        mongoTemplate.indexOps(StoreDocuments.USERS).ensureIndex(new Index().on("id", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(StoreDocuments.USERS).ensureIndex(new Index().on("email", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(StoreDocuments.AI_MODELS).ensureIndex(new Index().on("id", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(StoreDocuments.AI_MODELS).ensureIndex(new Index()
                .on("model_id", Sort.Direction.ASC).on("user_id", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(StoreDocuments.EXCHANGES).ensureIndex(new Index().on("id", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(StoreDocuments.EXCHANGES).ensureIndex(new Index()
                .on("exchange_id", Sort.Direction.ASC).on("user_id", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(StoreDocuments.TRADERS).ensureIndex(new Index().on("id", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(StoreDocuments.TRADERS).ensureIndex(new Index().on("user_id", Sort.Direction.ASC));
        mongoTemplate.indexOps(StoreDocuments.USER_SIGNAL_SOURCES)
                .ensureIndex(new Index().on("user_id", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(StoreDocuments.SYSTEM_CONFIG).ensureIndex(new Index().on("key", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(StoreDocuments.BETA_CODES).ensureIndex(new Index().on("code", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(StoreDocuments.DECISION_LOGS).ensureIndex(new Index()
                .on("user_id", Sort.Direction.ASC).on("trader_id", Sort.Direction.ASC)
                .on("created_at", Sort.Direction.DESC));
        log.info("MongoDB 索引已就緒");
    }

    // ==================== 備份 ====================

    /**
     * 每個集合匯出一個 JSON lines 檔；失敗只記錄警告，不中斷遷移
     */
    Optional<Path> backup(String reason) {
        try {
            String stamp = LocalDateTime.now(AppConstants.ZONE_ID).format(BACKUP_STAMP);
            Path dir = Paths.get(backupDir, "config_store_" + reason + "_" + stamp).toAbsolutePath();
            Files.createDirectories(dir);
            for (String collection : mongoTemplate.getCollectionNames()) {
                try (BufferedWriter writer = Files.newBufferedWriter(dir.resolve(collection + ".jsonl"),
                        StandardCharsets.UTF_8)) {
                    for (Document doc : mongoTemplate.findAll(Document.class, collection)) {
                        writer.write(doc.toJson());
                        writer.newLine();
                    }
                }
            }
            log.info("💾 遷移前備份完成: {}", dir);
            return Optional.of(dir);
        } catch (IOException | DataAccessException e) {
            log.warn("⚠️ 遷移前備份失敗，繼續遷移（無法回滾）: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
