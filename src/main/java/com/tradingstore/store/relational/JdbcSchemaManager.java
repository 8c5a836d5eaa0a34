package com.tradingstore.store.relational;

import com.tradingstore.shared.config.AppConstants;
import com.tradingstore.shared.exception.IntegrityException;
import com.tradingstore.shared.exception.SchemaException;
import com.tradingstore.store.schema.KeyMapping;
import com.tradingstore.store.schema.LegacyAiModelRow;
import com.tradingstore.store.schema.LegacyExchangeRow;
import com.tradingstore.store.schema.LegacyTraderRef;
import com.tradingstore.store.schema.SchemaGeneration;
import com.tradingstore.store.schema.SchemaManager;
import com.tradingstore.store.sequence.SequenceAllocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Types;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * H2 上的 schema 遷移
 *
 * 破壞性步驟都以結構偵測決定是否執行，可在中途崩潰後重跑：
 * <ul>
 *   <li>rekey_ai_models / rekey_exchanges：舊表改名為 *_legacy，建新表，逐筆以序號重新編號後刪除舊表</li>
 *   <li>remap_trader_refs：建 traders_v2，外鍵由舊字串鍵對照為新 id，再取代 traders</li>
 * </ul>
 */
@Slf4j
public class JdbcSchemaManager implements SchemaManager {

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final JdbcTemplate jdbcTemplate;
    private final SequenceAllocator sequenceAllocator;
    private final String backupDir;

    private volatile int generation = SchemaGeneration.UNKNOWN;

    public JdbcSchemaManager(JdbcTemplate jdbcTemplate, SequenceAllocator sequenceAllocator, String backupDir) {
        this.jdbcTemplate = jdbcTemplate;
        this.sequenceAllocator = sequenceAllocator;
        this.backupDir = backupDir;
    }

    @Override
    public void ensureSchema() {
        try {
            recoverInterruptedTraderSwap();
            createMissingTables();
            applyAdditiveColumns();

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
            // 未寫入標記代表上次遷移未通過檢查，每次都要重新驗證
            validate();

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

    // ==================== 建表 / 附加欄位 ====================

    private void createMissingTables() {
        for (String ddl : RelationalSchema.createStatements()) {
            jdbcTemplate.execute(ddl);
        }
    }

    private void applyAdditiveColumns() {
        for (String ddl : RelationalSchema.ADDITIVE_COLUMNS) {
            jdbcTemplate.execute(ddl);
        }
    }

    // ==================== 世代標記 ====================

    private int readMarker() {
        List<Integer> rows = jdbcTemplate.query("SELECT generation FROM schema_meta WHERE name = ?",
                (rs, i) -> rs.getInt(1), SchemaGeneration.MARKER_NAME);
        return rows.isEmpty() ? SchemaGeneration.UNKNOWN : rows.get(0);
    }

    private void writeMarker(int value) {
        jdbcTemplate.update("MERGE INTO schema_meta (name, generation, updated_at) KEY (name) VALUES (?, ?, ?)",
                SchemaGeneration.MARKER_NAME, value, AppConstants.now());
    }

    // ==================== 偵測 ====================

    private List<String> detectPendingSteps() {
        List<String> pending = new ArrayList<>();
        if (!columns("AI_MODELS").containsKey("MODEL_ID") || tableExists("AI_MODELS_LEGACY")) {
            pending.add(SchemaGeneration.STEP_REKEY_AI_MODELS);
        }
        if (!columns("EXCHANGES").containsKey("EXCHANGE_ID") || tableExists("EXCHANGES_LEGACY")) {
            pending.add(SchemaGeneration.STEP_REKEY_EXCHANGES);
        }
        Map<String, Integer> traderColumns = columns("TRADERS");
        if (!isInteger(traderColumns.get("AI_MODEL_ID")) || !isInteger(traderColumns.get("EXCHANGE_ID"))) {
            pending.add(SchemaGeneration.STEP_REMAP_TRADER_REFS);
        }
        return pending;
    }

    private void runStep(String step) {
        switch (step) {
            case SchemaGeneration.STEP_REKEY_AI_MODELS -> rekeyAiModels();
            case SchemaGeneration.STEP_REKEY_EXCHANGES -> rekeyExchanges();
            case SchemaGeneration.STEP_REMAP_TRADER_REFS -> remapTraderRefs();
            default -> throw new SchemaException("未知的遷移步驟: " + step);
        }
    }

    // ==================== 破壞性步驟 ====================

    private void rekeyAiModels() {
        if (!tableExists("AI_MODELS_LEGACY")) {
            jdbcTemplate.execute("ALTER TABLE ai_models RENAME TO ai_models_legacy");
        }
        jdbcTemplate.execute(RelationalSchema.AI_MODELS);
        addLegacyColumns("ai_models_legacy", "custom_api_url", "custom_model_name");

        List<LegacyAiModelRow> rows = jdbcTemplate.query("SELECT * FROM ai_models_legacy ORDER BY created_at",
                JdbcRowMappers.LEGACY_AI_MODEL);
        int migrated = 0;
        for (LegacyAiModelRow row : rows) {
            if (exists("SELECT COUNT(*) FROM ai_models WHERE model_id = ? AND user_id = ?",
                    row.legacyId(), row.userId())) {
                continue;
            }
            LocalDateTime now = AppConstants.now();
            jdbcTemplate.update(RelationalSchema.INSERT_AI_MODEL,
                    sequenceAllocator.next(SequenceAllocator.AI_MODELS),
                    row.legacyId(), row.userId(), "", nullToEmpty(row.name()), nullToEmpty(row.provider()),
                    row.enabled(), nullToEmpty(row.apiKey()), nullToEmpty(row.customApiUrl()),
                    nullToEmpty(row.customModelName()),
                    orNow(row.createdAt(), now), orNow(row.updatedAt(), now));
            migrated++;
        }
        jdbcTemplate.execute("DROP TABLE ai_models_legacy");
        log.info("✅ ai_models 重新編號完成: 舊記錄 {} 筆，本次遷移 {} 筆", rows.size(), migrated);
    }

    private void rekeyExchanges() {
        if (!tableExists("EXCHANGES_LEGACY")) {
            jdbcTemplate.execute("ALTER TABLE exchanges RENAME TO exchanges_legacy");
        }
        jdbcTemplate.execute(RelationalSchema.EXCHANGES);
        addLegacyColumns("exchanges_legacy",
                "hyperliquid_wallet_addr", "aster_user", "aster_signer", "aster_private_key");

        List<LegacyExchangeRow> rows = jdbcTemplate.query("SELECT * FROM exchanges_legacy ORDER BY created_at",
                JdbcRowMappers.LEGACY_EXCHANGE);
        int migrated = 0;
        for (LegacyExchangeRow row : rows) {
            if (exists("SELECT COUNT(*) FROM exchanges WHERE exchange_id = ? AND user_id = ?",
                    row.legacyId(), row.userId())) {
                continue;
            }
            LocalDateTime now = AppConstants.now();
            jdbcTemplate.update(RelationalSchema.INSERT_EXCHANGE,
                    sequenceAllocator.next(SequenceAllocator.EXCHANGES),
                    row.legacyId(), row.userId(), "", nullToEmpty(row.name()), nullToEmpty(row.type()),
                    row.enabled(), nullToEmpty(row.apiKey()), nullToEmpty(row.secretKey()), row.testnet(),
                    nullToEmpty(row.hyperliquidWalletAddr()), nullToEmpty(row.asterUser()),
                    nullToEmpty(row.asterSigner()), nullToEmpty(row.asterPrivateKey()),
                    orNow(row.createdAt(), now), orNow(row.updatedAt(), now));
            migrated++;
        }
        jdbcTemplate.execute("DROP TABLE exchanges_legacy");
        log.info("✅ exchanges 重新編號完成: 舊記錄 {} 筆，本次遷移 {} 筆", rows.size(), migrated);
    }

    private void remapTraderRefs() {
        Map<String, Integer> traderColumns = columns("TRADERS");
        boolean aiModelIsInteger = isInteger(traderColumns.get("AI_MODEL_ID"));
        boolean exchangeIsInteger = isInteger(traderColumns.get("EXCHANGE_ID"));

        KeyMapping aiModels = KeyMapping.global();
        jdbcTemplate.query("SELECT id, model_id, user_id FROM ai_models", rs -> {
            aiModels.put(rs.getString("user_id"), rs.getString("model_id"), rs.getInt("id"));
        });
        KeyMapping exchanges = KeyMapping.perUser();
        jdbcTemplate.query("SELECT id, exchange_id, user_id FROM exchanges", rs -> {
            exchanges.put(rs.getString("user_id"), rs.getString("exchange_id"), rs.getInt("id"));
        });

        jdbcTemplate.execute("DROP TABLE IF EXISTS traders_v2");
        jdbcTemplate.execute(RelationalSchema.traders("traders_v2"));
        jdbcTemplate.update("INSERT INTO traders_v2 (" + RelationalSchema.TRADER_DATA_COLUMNS
                + ", ai_model_id, exchange_id) SELECT " + RelationalSchema.TRADER_DATA_COLUMNS
                + ", 0, 0 FROM traders");

        List<LegacyTraderRef> refs = jdbcTemplate.query(
                "SELECT id, user_id, ai_model_id, exchange_id FROM traders",
                (rs, i) -> new LegacyTraderRef(rs.getString("id"), rs.getString("user_id"),
                        rs.getString("ai_model_id"), rs.getString("exchange_id")));
        int unmapped = 0;
        for (LegacyTraderRef ref : refs) {
            int aiModelId = aiModelIsInteger
                    ? parseOrUnmapped(ref.aiModelRef())
                    : aiModels.resolve(ref.userId(), ref.aiModelRef());
            int exchangeId = exchangeIsInteger
                    ? parseOrUnmapped(ref.exchangeRef())
                    : exchanges.resolve(ref.userId(), ref.exchangeRef());
            if (aiModelId == KeyMapping.UNMAPPED || exchangeId == KeyMapping.UNMAPPED) {
                unmapped++;
                log.warn("⚠️ 交易員 {} 的外鍵無法對照: ai_model={} -> {}, exchange={} -> {}",
                        ref.traderId(), ref.aiModelRef(), aiModelId, ref.exchangeRef(), exchangeId);
            }
            jdbcTemplate.update("UPDATE traders_v2 SET ai_model_id = ?, exchange_id = ? WHERE id = ?",
                    aiModelId, exchangeId, ref.traderId());
        }

        jdbcTemplate.execute("DROP TABLE traders");
        jdbcTemplate.execute("ALTER TABLE traders_v2 RENAME TO traders");
        log.info("✅ traders 外鍵對照完成: {} 筆，無法對照 {} 筆", refs.size(), unmapped);
    }

    /**
     * 暫存的舊表可能早於附加欄位，讀取前補齊
     */
    private void addLegacyColumns(String table, String... columns) {
        for (String column : columns) {
            jdbcTemplate.execute("ALTER TABLE " + table + " ADD COLUMN IF NOT EXISTS " + column
                    + " VARCHAR(4096) DEFAULT '' NOT NULL");
        }
    }

    /**
     * traders 取代到一半崩潰時的復原：舊表已刪則改名 traders_v2，否則丟棄 traders_v2 重做
     */
    private void recoverInterruptedTraderSwap() {
        if (!tableExists("TRADERS_V2")) {
            return;
        }
        if (tableExists("TRADERS")) {
            log.warn("⚠️ 發現未完成的 traders_v2，丟棄後重新執行外鍵對照");
            jdbcTemplate.execute("DROP TABLE traders_v2");
        } else {
            log.warn("⚠️ 發現未完成的 traders 取代，完成改名");
            jdbcTemplate.execute("ALTER TABLE traders_v2 RENAME TO traders");
        }
    }

    // ==================== 驗證 ====================

    private void validate() {
        for (Map.Entry<String, List<String>> entry : RelationalSchema.REQUIRED_COLUMNS.entrySet()) {
            Map<String, Integer> actual = columns(entry.getKey());
            List<String> missing = entry.getValue().stream().filter(c -> !actual.containsKey(c)).toList();
            if (!missing.isEmpty()) {
                throw new IntegrityException("完整性檢查失敗: " + entry.getKey() + " 缺少欄位 " + missing);
            }
        }

        long orphanModels = count("SELECT COUNT(*) FROM traders t LEFT JOIN ai_models a ON a.id = t.ai_model_id "
                + "WHERE a.id IS NULL");
        long orphanExchanges = count("SELECT COUNT(*) FROM traders t LEFT JOIN exchanges e ON e.id = t.exchange_id "
                + "WHERE e.id IS NULL");
        if (orphanModels > 0 || orphanExchanges > 0) {
            throw new IntegrityException(String.format(
                    "完整性檢查失敗: %d 個交易員引用不存在的 AI 模型，%d 個交易員引用不存在的交易所",
                    orphanModels, orphanExchanges));
        }

        long traders = count("SELECT COUNT(*) FROM traders");
        long aiModels = count("SELECT COUNT(*) FROM ai_models");
        long exchanges = count("SELECT COUNT(*) FROM exchanges");
        if (traders > 0 && (aiModels == 0 || exchanges == 0)) {
            throw new IntegrityException(String.format(
                    "完整性檢查失敗: 有 %d 個交易員，但 ai_models=%d、exchanges=%d",
                    traders, aiModels, exchanges));
        }
        log.info("✅ 完整性檢查通過: traders={}, ai_models={}, exchanges={}", traders, aiModels, exchanges);
    }

    // ==================== 備份 ====================

    /**
     * 以 H2 SCRIPT 匯出整個資料庫；失敗只記錄警告，不中斷遷移
     */
    Optional<Path> backup(String reason) {
        try {
            Path dir = Paths.get(backupDir);
            Files.createDirectories(dir);
            String stamp = LocalDateTime.now(AppConstants.ZONE_ID).format(BACKUP_STAMP);
            Path file = dir.resolve("config_store_" + reason + "_" + stamp + ".sql").toAbsolutePath();
            jdbcTemplate.execute("SCRIPT TO '" + file.toString().replace("'", "''") + "'");
            log.info("💾 遷移前備份完成: {}", file);
            return Optional.of(file);
        } catch (IOException | DataAccessException e) {
            log.warn("⚠️ 遷移前備份失敗，繼續遷移（無法回滾）: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ==================== helpers ====================

    private Map<String, Integer> columns(String table) {
        Map<String, Integer> result = jdbcTemplate.execute((ConnectionCallback<Map<String, Integer>>) con -> {
            Map<String, Integer> cols = new LinkedHashMap<>();
            try (ResultSet rs = con.getMetaData().getColumns(con.getCatalog(), schemaOf(con),
                    table.toUpperCase(Locale.ROOT), null)) {
                while (rs.next()) {
                    cols.put(rs.getString("COLUMN_NAME").toUpperCase(Locale.ROOT), rs.getInt("DATA_TYPE"));
                }
            }
            return cols;
        });
        return result != null ? result : Map.of();
    }

    private boolean tableExists(String table) {
        return !columns(table).isEmpty();
    }

    private static String schemaOf(Connection con) throws java.sql.SQLException {
        String schema = con.getSchema();
        return schema != null ? schema : "PUBLIC";
    }

    private static boolean isInteger(Integer sqlType) {
        return sqlType != null
                && (sqlType == Types.INTEGER || sqlType == Types.BIGINT || sqlType == Types.SMALLINT);
    }

    private boolean exists(String sql, Object... args) {
        Long n = jdbcTemplate.queryForObject(sql, Long.class, args);
        return n != null && n > 0;
    }

    private long count(String sql) {
        Long n = jdbcTemplate.queryForObject(sql, Long.class);
        return n != null ? n : 0;
    }

    private static int parseOrUnmapped(String value) {
        try {
            return value == null ? KeyMapping.UNMAPPED : Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return KeyMapping.UNMAPPED;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static LocalDateTime orNow(LocalDateTime value, LocalDateTime now) {
        return value != null ? value : now;
    }
}
