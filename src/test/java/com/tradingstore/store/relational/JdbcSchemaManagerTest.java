package com.tradingstore.store.relational;

import com.tradingstore.shared.exception.IntegrityException;
import com.tradingstore.store.schema.SchemaGeneration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class JdbcSchemaManagerTest {

    @TempDir
    Path tempDir;

    private JdbcTemplate jdbcTemplate;
    private Path backupDir;

    @BeforeEach
    void setUp() {
        jdbcTemplate = H2TestDatabase.create();
        backupDir = tempDir.resolve("backups");
    }

    private JdbcSchemaManager newManager(Path dir) {
        return new JdbcSchemaManager(jdbcTemplate, H2TestDatabase.allocator(jdbcTemplate), dir.toString());
    }

    /** 世代 1 的表結構：字串主鍵、字串外鍵 */
    private void createLegacySchema() {
        jdbcTemplate.execute("""
                CREATE TABLE ai_models (
                    id VARCHAR(128) PRIMARY KEY,
                    user_id VARCHAR(64) NOT NULL,
                    name VARCHAR(255) NOT NULL,
                    provider VARCHAR(64) NOT NULL,
                    enabled BOOLEAN DEFAULT FALSE,
                    api_key VARCHAR(4096) DEFAULT '',
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                    updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                )""");
        jdbcTemplate.execute("""
                CREATE TABLE exchanges (
                    id VARCHAR(128) NOT NULL,
                    user_id VARCHAR(64) NOT NULL,
                    name VARCHAR(255) NOT NULL,
                    type VARCHAR(32) NOT NULL,
                    enabled BOOLEAN DEFAULT FALSE,
                    api_key VARCHAR(4096) DEFAULT '',
                    secret_key VARCHAR(4096) DEFAULT '',
                    testnet BOOLEAN DEFAULT FALSE,
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                    updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                    PRIMARY KEY (id, user_id)
                )""");
        jdbcTemplate.execute("""
                CREATE TABLE traders (
                    id VARCHAR(128) PRIMARY KEY,
                    user_id VARCHAR(64) NOT NULL,
                    name VARCHAR(255) NOT NULL,
                    ai_model_id VARCHAR(128) NOT NULL,
                    exchange_id VARCHAR(128) NOT NULL,
                    initial_balance DOUBLE PRECISION DEFAULT 0,
                    scan_interval_minutes INT DEFAULT 3,
                    is_running BOOLEAN DEFAULT FALSE,
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                    updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                )""");

        jdbcTemplate.update("INSERT INTO ai_models (id, user_id, name, provider) VALUES ('deepseek', 'default', 'DeepSeek', 'deepseek')");
        jdbcTemplate.update("INSERT INTO ai_models (id, user_id, name, provider, enabled, api_key) "
                + "VALUES ('alice_deepseek', 'alice', 'DeepSeek', 'deepseek', TRUE, 'sk-alice')");
        jdbcTemplate.update("INSERT INTO exchanges (id, user_id, name, type) VALUES ('binance', 'default', 'Binance Futures', 'binance')");
        jdbcTemplate.update("INSERT INTO exchanges (id, user_id, name, type, enabled, api_key, secret_key) "
                + "VALUES ('binance', 'alice', 'Binance Futures', 'cex', TRUE, 'ak-alice', 'sk-alice')");
        jdbcTemplate.update("INSERT INTO traders (id, user_id, name, ai_model_id, exchange_id, initial_balance) "
                + "VALUES ('t1', 'alice', 'Alpha', 'alice_deepseek', 'binance', 1000)");
        jdbcTemplate.update("INSERT INTO traders (id, user_id, name, ai_model_id, exchange_id) "
                + "VALUES ('t2', 'alice', 'Beta', 'deepseek', 'binance')");
    }

    private int modelId(String modelKey, String userId) {
        return jdbcTemplate.queryForObject("SELECT id FROM ai_models WHERE model_id = ? AND user_id = ?",
                Integer.class, modelKey, userId);
    }

    private int exchangeId(String exchangeKey, String userId) {
        return jdbcTemplate.queryForObject("SELECT id FROM exchanges WHERE exchange_id = ? AND user_id = ?",
                Integer.class, exchangeKey, userId);
    }

    private List<Integer> marker() {
        return jdbcTemplate.queryForList("SELECT generation FROM schema_meta WHERE name = ?",
                Integer.class, SchemaGeneration.MARKER_NAME);
    }

    private long backupCount() throws Exception {
        if (!Files.exists(backupDir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(backupDir)) {
            return files.count();
        }
    }

    @Nested
    @DisplayName("全新存儲")
    class FreshStore {

        @Test
        @DisplayName("建立所有表並寫入世代標記，不做備份")
        void freshStore_createsTablesAndMarker() throws Exception {
            JdbcSchemaManager manager = newManager(backupDir);

            manager.ensureSchema();

            assertThat(manager.currentGeneration()).isEqualTo(SchemaGeneration.CURRENT);
            assertThat(marker()).containsExactly(SchemaGeneration.CURRENT);
            assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM traders", Long.class)).isZero();
            assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM decision_logs", Long.class)).isZero();
            assertThat(backupCount()).isZero();
        }

        @Test
        @DisplayName("連續呼叫兩次 → 第二次走快速路徑，結果相同")
        void secondCall_isNoOp() throws Exception {
            newManager(backupDir).ensureSchema();
            JdbcSchemaManager second = newManager(backupDir);

            second.ensureSchema();

            assertThat(second.currentGeneration()).isEqualTo(SchemaGeneration.CURRENT);
            assertThat(marker()).containsExactly(SchemaGeneration.CURRENT);
            assertThat(backupCount()).isZero();
        }
    }

    @Nested
    @DisplayName("世代 1 → 2 遷移")
    class LegacyMigration {

        @Test
        @DisplayName("ai_models / exchanges 重新編號，舊鍵保留為 model_id / exchange_id")
        void rekeysCatalogTables() {
            createLegacySchema();

            newManager(backupDir).ensureSchema();

            assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ai_models", Long.class)).isEqualTo(2);
            assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM exchanges", Long.class)).isEqualTo(2);
            assertThat(jdbcTemplate.queryForObject(
                    "SELECT api_key FROM ai_models WHERE model_id = 'alice_deepseek'", String.class))
                    .isEqualTo("sk-alice");
            assertThat(jdbcTemplate.queryForObject(
                    "SELECT secret_key FROM exchanges WHERE exchange_id = 'binance' AND user_id = 'alice'", String.class))
                    .isEqualTo("sk-alice");
            assertThat(jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME LIKE '%_LEGACY'", Long.class))
                    .isZero();
        }

        @Test
        @DisplayName("traders 外鍵改為新 id；用戶自己的記錄優先，找不到時退回預設記錄")
        void remapsTraderReferences() {
            createLegacySchema();

            newManager(backupDir).ensureSchema();

            assertThat(jdbcTemplate.queryForObject("SELECT ai_model_id FROM traders WHERE id = 't1'", Integer.class))
                    .isEqualTo(modelId("alice_deepseek", "alice"));
            assertThat(jdbcTemplate.queryForObject("SELECT exchange_id FROM traders WHERE id = 't1'", Integer.class))
                    .isEqualTo(exchangeId("binance", "alice"));
            assertThat(jdbcTemplate.queryForObject("SELECT ai_model_id FROM traders WHERE id = 't2'", Integer.class))
                    .isEqualTo(modelId("deepseek", "default"));
            assertThat(jdbcTemplate.queryForObject("SELECT initial_balance FROM traders WHERE id = 't1'", Double.class))
                    .isEqualTo(1000.0);
        }

        @Test
        @DisplayName("破壞性步驟前產生備份檔，完成後寫入標記")
        void writesBackupAndMarker() throws Exception {
            createLegacySchema();

            newManager(backupDir).ensureSchema();

            assertThat(backupCount()).isEqualTo(1);
            assertThat(marker()).containsExactly(SchemaGeneration.CURRENT);
        }

        @Test
        @DisplayName("遷移後再開啟一次 → 不再重新編號")
        void migratedStore_notMigratedAgain() {
            createLegacySchema();
            newManager(backupDir).ensureSchema();
            int before = modelId("alice_deepseek", "alice");

            newManager(backupDir).ensureSchema();

            assertThat(modelId("alice_deepseek", "alice")).isEqualTo(before);
            assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ai_models", Long.class)).isEqualTo(2);
        }

        @Test
        @DisplayName("改名後崩潰（只剩 ai_models_legacy）→ 重跑時完成遷移")
        void resumesAfterCrashDuringRekey() {
            createLegacySchema();
            jdbcTemplate.execute("ALTER TABLE ai_models RENAME TO ai_models_legacy");

            newManager(backupDir).ensureSchema();

            assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ai_models", Long.class)).isEqualTo(2);
            assertThat(jdbcTemplate.queryForObject("SELECT ai_model_id FROM traders WHERE id = 't1'", Integer.class))
                    .isEqualTo(modelId("alice_deepseek", "alice"));
            assertThat(marker()).containsExactly(SchemaGeneration.CURRENT);
        }

        @Test
        @DisplayName("備份失敗 → 記錄警告，遷移照常完成")
        void backupFailure_isNonFatal() throws Exception {
            createLegacySchema();
            Path notADirectory = Files.createFile(tempDir.resolve("occupied"));

            JdbcSchemaManager manager = newManager(notADirectory.resolve("backups"));
            manager.ensureSchema();

            assertThat(manager.currentGeneration()).isEqualTo(SchemaGeneration.CURRENT);
            assertThat(jdbcTemplate.queryForObject("SELECT ai_model_id FROM traders WHERE id = 't1'", Integer.class))
                    .isEqualTo(modelId("alice_deepseek", "alice"));
        }
    }

    @Nested
    @DisplayName("完整性檢查")
    class Validation {

        @Test
        @DisplayName("交易員引用不存在的模型 → IntegrityException，不寫入標記")
        void orphanReference_failsWithoutMarker() {
            createLegacySchema();
            jdbcTemplate.update("INSERT INTO traders (id, user_id, name, ai_model_id, exchange_id) "
                    + "VALUES ('t3', 'alice', 'Ghost', 'ghost_model', 'binance')");
            JdbcSchemaManager manager = newManager(backupDir);

            assertThatThrownBy(manager::ensureSchema)
                    .isInstanceOf(IntegrityException.class)
                    .hasMessageContaining("1 個交易員引用不存在的 AI 模型");
            assertThat(marker()).isEmpty();
            assertThat(manager.currentGeneration()).isEqualTo(SchemaGeneration.UNKNOWN);
        }

        @Test
        @DisplayName("上次檢查失敗 → 下次開啟仍然失敗，直到資料修正")
        void failedValidation_repeatsUntilFixed() {
            createLegacySchema();
            jdbcTemplate.update("INSERT INTO traders (id, user_id, name, ai_model_id, exchange_id) "
                    + "VALUES ('t3', 'alice', 'Ghost', 'ghost_model', 'binance')");
            assertThatThrownBy(() -> newManager(backupDir).ensureSchema()).isInstanceOf(IntegrityException.class);

            assertThatThrownBy(() -> newManager(backupDir).ensureSchema()).isInstanceOf(IntegrityException.class);

            jdbcTemplate.update("DELETE FROM traders WHERE id = 't3'");
            JdbcSchemaManager manager = newManager(backupDir);
            manager.ensureSchema();
            assertThat(manager.currentGeneration()).isEqualTo(SchemaGeneration.CURRENT);
        }
    }
}
