package com.tradingstore.store.relational;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingstore.shared.exception.BetaCodeUnavailableException;
import com.tradingstore.shared.exception.DuplicateException;
import com.tradingstore.shared.exception.NotFoundException;
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
import com.tradingstore.vault.CredentialVault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JdbcRecordStoreTest {

    private static final String MASTER_KEY = "01234567890123456789012345678901";

    @TempDir
    Path tempDir;

    private JdbcTemplate jdbcTemplate;
    private JdbcRecordStore store;

    @BeforeEach
    void setUp() {
        jdbcTemplate = H2TestDatabase.create();
        JdbcSequenceAllocator allocator = H2TestDatabase.allocator(jdbcTemplate);
        new JdbcSchemaManager(jdbcTemplate, allocator, tempDir.toString()).ensureSchema();
        new JdbcDefaultDataSeeder(jdbcTemplate, allocator).seedDefaults();
        store = new JdbcRecordStore(jdbcTemplate, allocator, new ObjectMapper());
        store.setCredentialVault(new CredentialVault(MASTER_KEY));
    }

    private AIModelConfig aliceModel() {
        return store.listAiModels("alice").stream()
                .filter(m -> m.getModelId().equals("alice_deepseek"))
                .findFirst()
                .orElseThrow();
    }

    private ExchangeConfig aliceBinance() {
        return store.listExchanges("alice").stream()
                .filter(e -> e.getExchangeId().equals("binance"))
                .findFirst()
                .orElseThrow();
    }

    private TraderRecord newTrader(String id, int aiModelId, int exchangeId) {
        return TraderRecord.builder()
                .id(id)
                .userId("alice")
                .name("Trader " + id)
                .aiModelId(aiModelId)
                .exchangeId(exchangeId)
                .initialBalance(1000)
                .scanIntervalMinutes(3)
                .crossMargin(true)
                .build();
    }

    /** 建立 alice 的模型與交易所，回傳 [aiModelId, exchangeId] */
    private int[] prepareAliceCatalog() {
        store.upsertAiModel("alice", "deepseek", AiModelUpdate.builder().enabled(true).apiKey("sk-model").build());
        store.upsertExchange("alice", "binance", ExchangeUpdate.builder()
                .enabled(true).apiKey("ak-binance").secretKey("sk-binance").build());
        return new int[]{aliceModel().getId(), aliceBinance().getId()};
    }

    @Nested
    @DisplayName("AI 模型 upsert")
    class AiModels {

        @Test
        @DisplayName("用戶第一次更新內建 provider → 建立 userId_provider，名稱沿用既有記錄")
        void firstUpdate_createsUserScopedModel() {
            store.upsertAiModel("alice", "deepseek", AiModelUpdate.builder().enabled(true).apiKey("sk-1").build());

            AIModelConfig model = aliceModel();
            assertThat(model.getProvider()).isEqualTo("deepseek");
            assertThat(model.getName()).isEqualTo("DeepSeek");
            assertThat(model.isEnabled()).isTrue();
            assertThat(model.getApiKey()).isEqualTo("sk-1");
        }

        @Test
        @DisplayName("第二次更新 → 更新同一筆，不新增")
        void secondUpdate_updatesSameRow() {
            store.upsertAiModel("alice", "deepseek", AiModelUpdate.builder().enabled(true).apiKey("sk-1").build());
            int id = aliceModel().getId();

            store.upsertAiModel("alice", "alice_deepseek", AiModelUpdate.builder()
                    .enabled(false).apiKey("sk-2").customModelName("deepseek-reasoner").build());

            assertThat(store.listAiModels("alice")).hasSize(1);
            AIModelConfig model = aliceModel();
            assertThat(model.getId()).isEqualTo(id);
            assertThat(model.isEnabled()).isFalse();
            assertThat(model.getApiKey()).isEqualTo("sk-2");
            assertThat(model.getCustomModelName()).isEqualTo("deepseek-reasoner");
        }

        @Test
        @DisplayName("以舊版 provider 名稱更新 → 命中既有記錄")
        void legacyProviderKey_matchesExisting() {
            store.upsertAiModel("alice", "deepseek", AiModelUpdate.builder().apiKey("sk-1").build());

            store.upsertAiModel("alice", "deepseek", AiModelUpdate.builder().enabled(true).build());

            assertThat(store.listAiModels("alice")).hasSize(1);
            assertThat(aliceModel().isEnabled()).isTrue();
        }

        @Test
        @DisplayName("更新時 apiKey 為空字串 → 保留原本的金鑰")
        void emptySecret_keepsExisting() {
            store.upsertAiModel("alice", "deepseek", AiModelUpdate.builder().apiKey("sk-keep").build());

            store.upsertAiModel("alice", "alice_deepseek", AiModelUpdate.builder()
                    .enabled(true).apiKey("").customApiUrl("https://proxy.local").build());

            AIModelConfig model = aliceModel();
            assertThat(model.getApiKey()).isEqualTo("sk-keep");
            assertThat(model.getCustomApiUrl()).isEqualTo("https://proxy.local");
        }

        @Test
        @DisplayName("未知的 provider → 名稱使用退回值")
        void unknownProvider_fallbackName() {
            store.upsertAiModel("alice", "alice_kimi", AiModelUpdate.builder().build());

            AIModelConfig model = store.listAiModels("alice").get(0);
            assertThat(model.getModelId()).isEqualTo("alice_kimi");
            assertThat(model.getProvider()).isEqualTo("kimi");
            assertThat(model.getName()).isEqualTo("kimi AI");
        }

        @Test
        @DisplayName("要建立的 modelId 已被同時插入 → 改為更新該筆，不拋例外")
        void concurrentInsert_fallsBackToUpdate() {
            AIModelConfig inserted = store.createAiModel(AIModelConfig.builder()
                    .modelId("alice_kimi").userId("alice").name("Kimi").provider("moonshot").build());

            store.upsertAiModel("alice", "kimi", AiModelUpdate.builder().enabled(true).apiKey("sk-kimi").build());

            assertThat(store.listAiModels("alice")).hasSize(1);
            AIModelConfig model = store.listAiModels("alice").get(0);
            assertThat(model.getId()).isEqualTo(inserted.getId());
            assertThat(model.getProvider()).isEqualTo("moonshot");
            assertThat(model.isEnabled()).isTrue();
            assertThat(model.getApiKey()).isEqualTo("sk-kimi");
        }

        @Test
        @DisplayName("重複建立 (modelId, userId) → DuplicateException")
        void createDuplicate_throws() {
            AIModelConfig model = AIModelConfig.builder()
                    .modelId("custom").userId("alice").name("Custom").provider("custom").build();
            store.createAiModel(model);

            assertThatThrownBy(() -> store.createAiModel(AIModelConfig.builder()
                    .modelId("custom").userId("alice").name("Custom").provider("custom").build()))
                    .isInstanceOf(DuplicateException.class);
            assertThat(model.getId()).isPositive();
        }
    }

    @Nested
    @DisplayName("交易所 upsert")
    class Exchanges {

        @Test
        @DisplayName("第一次更新 → 依類型建立，binance 為 cex")
        void firstUpdate_createsFromType() {
            store.upsertExchange("alice", "binance", ExchangeUpdate.builder()
                    .enabled(true).apiKey("ak").secretKey("sk").testnet(true).build());

            ExchangeConfig exchange = aliceBinance();
            assertThat(exchange.getName()).isEqualTo("Binance Futures");
            assertThat(exchange.getType()).isEqualTo("cex");
            assertThat(exchange.isTestnet()).isTrue();
            assertThat(exchange.getApiKey()).isEqualTo("ak");
            assertThat(exchange.getSecretKey()).isEqualTo("sk");
        }

        @Test
        @DisplayName("只帶 apiKey → secretKey 與 asterPrivateKey 保持不變")
        void selectiveSecrets_onlyProvidedFieldsChange() {
            store.upsertExchange("alice", "aster", ExchangeUpdate.builder()
                    .apiKey("ak-1").secretKey("sk-1").asterPrivateKey("pk-1").asterUser("0xuser").build());

            store.upsertExchange("alice", "aster", ExchangeUpdate.builder()
                    .enabled(true).apiKey("ak-2").asterUser("0xuser").build());

            ExchangeConfig exchange = store.listExchanges("alice").get(0);
            assertThat(store.listExchanges("alice")).hasSize(1);
            assertThat(exchange.getType()).isEqualTo("dex");
            assertThat(exchange.getApiKey()).isEqualTo("ak-2");
            assertThat(exchange.getSecretKey()).isEqualTo("sk-1");
            assertThat(exchange.getAsterPrivateKey()).isEqualTo("pk-1");
            assertThat(exchange.isEnabled()).isTrue();
        }

        @Test
        @DisplayName("機密欄位落盤時為信封格式，讀取時為明文")
        void secretsEncryptedAtRest() {
            store.upsertExchange("alice", "binance", ExchangeUpdate.builder()
                    .apiKey("ak-plain").secretKey("sk-plain").build());

            Map<String, Object> row = jdbcTemplate.queryForMap(
                    "SELECT api_key, secret_key FROM exchanges WHERE exchange_id = 'binance' AND user_id = 'alice'");
            assertThat((String) row.get("API_KEY")).startsWith(CredentialVault.STORAGE_PREFIX).doesNotContain("ak-plain");
            assertThat((String) row.get("SECRET_KEY")).startsWith(CredentialVault.STORAGE_PREFIX);
            assertThat(aliceBinance().getSecretKey()).isEqualTo("sk-plain");
        }

        @Test
        @DisplayName("舊版明文存放的金鑰 → 讀取時原樣返回")
        void legacyPlaintext_readAsIs() {
            store.upsertExchange("alice", "binance", ExchangeUpdate.builder().build());
            jdbcTemplate.update("UPDATE exchanges SET api_key = 'legacy-plain' WHERE user_id = 'alice'");

            assertThat(aliceBinance().getApiKey()).isEqualTo("legacy-plain");
        }

        @Test
        @DisplayName("重複建立 (exchangeId, userId) → DuplicateException")
        void createDuplicate_throws() {
            assertThatThrownBy(() -> store.createExchange(ExchangeConfig.builder()
                    .exchangeId("binance").userId("default").name("Binance").type("cex").build()))
                    .isInstanceOf(DuplicateException.class);
        }
    }

    @Nested
    @DisplayName("交易員")
    class Traders {

        @Test
        @DisplayName("建立後讀取 → 後加欄位套用預設值")
        void listTraders_appliesDefaults() {
            int[] refs = prepareAliceCatalog();
            store.createTrader(newTrader("t1", refs[0], refs[1]));

            TraderRecord trader = store.listTraders("alice").get(0);
            assertThat(trader.getBtcEthLeverage()).isEqualTo(TraderDefaults.LEVERAGE);
            assertThat(trader.getOrderStrategy()).isEqualTo(TraderDefaults.ORDER_STRATEGY);
            assertThat(trader.getTimeframes()).isEqualTo(TraderDefaults.TIMEFRAMES);
            assertThat(trader.getTakerFeeRate()).isEqualTo(TraderDefaults.TAKER_FEE_RATE);
            assertThat(trader.isCrossMargin()).isTrue();
            assertThat(trader.getInitialBalance()).isEqualTo(1000.0);
        }

        @Test
        @DisplayName("引用不存在的模型 → NotFoundException")
        void missingReference_throws() {
            int[] refs = prepareAliceCatalog();

            assertThatThrownBy(() -> store.createTrader(newTrader("t1", 999, refs[1])))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("完整配置 → 模型與交易所的金鑰已解密")
        void fullConfig_decryptsSecrets() {
            int[] refs = prepareAliceCatalog();
            store.createTrader(newTrader("t1", refs[0], refs[1]));

            TraderFullConfig config = store.getTraderFullConfig("alice", "t1");

            assertThat(config.trader().getId()).isEqualTo("t1");
            assertThat(config.aiModel().getApiKey()).isEqualTo("sk-model");
            assertThat(config.exchange().getApiKey()).isEqualTo("ak-binance");
            assertThat(config.exchange().getSecretKey()).isEqualTo("sk-binance");
        }

        @Test
        @DisplayName("別的用戶讀取 → NotFoundException")
        void fullConfig_otherUser_throws() {
            int[] refs = prepareAliceCatalog();
            store.createTrader(newTrader("t1", refs[0], refs[1]));

            assertThatThrownBy(() -> store.getTraderFullConfig("bob", "t1"))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("修改不存在的交易員 → NotFoundException")
        void mutateMissing_throws() {
            assertThatThrownBy(() -> store.setTraderRunning("alice", "ghost", true))
                    .isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> store.deleteTrader("alice", "ghost"))
                    .isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> store.setTraderInitialBalance("alice", "ghost", 10))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("updateTrader 寫入信號源開關與自訂 prompt，不改初始餘額")
        void updateTrader_writesFields() {
            int[] refs = prepareAliceCatalog();
            TraderRecord trader = newTrader("t1", refs[0], refs[1]);
            store.createTrader(trader);

            trader.setUseCoinPool(true);
            trader.setUseOiTop(true);
            trader.setTimeframes("1h,4h");
            trader.setInitialBalance(5);
            store.updateTrader(trader);
            store.setTraderCustomPrompt("alice", "t1", "be careful", true);

            TraderRecord loaded = store.listTraders("alice").get(0);
            assertThat(loaded.isUseCoinPool()).isTrue();
            assertThat(loaded.isUseOiTop()).isTrue();
            assertThat(loaded.getTimeframes()).isEqualTo("1h,4h");
            assertThat(loaded.getCustomPrompt()).isEqualTo("be careful");
            assertThat(loaded.isOverrideBasePrompt()).isTrue();
            assertThat(loaded.getInitialBalance()).isEqualTo(1000.0);
        }

        @Test
        @DisplayName("刪除後列表為空")
        void delete_removesTrader() {
            int[] refs = prepareAliceCatalog();
            store.createTrader(newTrader("t1", refs[0], refs[1]));

            store.deleteTrader("alice", "t1");

            assertThat(store.listTraders("alice")).isEmpty();
        }
    }

    @Nested
    @DisplayName("聚合查詢")
    class Aggregates {

        @Test
        @DisplayName("沒有交易員設定幣種 → 使用 default_coins")
        void noTraderSymbols_usesDefaultCoins() {
            assertThat(store.listCustomCoins()).startsWith("BTCUSDT", "ETHUSDT").hasSize(8);
        }

        @Test
        @DisplayName("交易員幣種 → 正規化為大寫 USDT 並去重")
        void traderSymbols_normalizedAndMerged() {
            int[] refs = prepareAliceCatalog();
            TraderRecord t1 = newTrader("t1", refs[0], refs[1]);
            t1.setTradingSymbols("btc, ETHUSDT");
            TraderRecord t2 = newTrader("t2", refs[0], refs[1]);
            t2.setTradingSymbols("[\"ethusdt\",\"SOL\"]");
            store.createTrader(t1);
            store.createTrader(t2);

            assertThat(store.listCustomCoins()).containsExactlyInAnyOrder("BTCUSDT", "ETHUSDT", "SOLUSDT");
        }

        @Test
        @DisplayName("時間線只取運行中的交易員；沒有時回傳預設值")
        void activeTimeframes_onlyRunning() {
            int[] refs = prepareAliceCatalog();
            assertThat(store.listActiveTimeframes()).isEqualTo(TradingSymbols.DEFAULT_TIMEFRAMES);

            TraderRecord running = newTrader("t1", refs[0], refs[1]);
            running.setRunning(true);
            running.setTimeframes("1m,4h");
            TraderRecord stopped = newTrader("t2", refs[0], refs[1]);
            stopped.setTimeframes("1d");
            store.createTrader(running);
            store.createTrader(stopped);

            assertThat(store.listActiveTimeframes()).containsExactly("1m", "4h");
        }
    }

    @Nested
    @DisplayName("內測碼")
    class BetaCodes {

        @Test
        @DisplayName("載入時略過空行、註解與已存在的碼")
        void load_skipsBlankCommentsAndDuplicates() {
            int first = store.loadBetaCodes(List.of("# header", "", "ABC123", "  DEF456  "));
            int second = store.loadBetaCodes(List.of("ABC123", "GHI789"));

            assertThat(first).isEqualTo(2);
            assertThat(second).isEqualTo(1);
            assertThat(store.betaCodeStats()).isEqualTo(new BetaCodeStats(3, 0));
        }

        @Test
        @DisplayName("領取一次成功，第二次拋出 BetaCodeUnavailableException")
        void claim_onlyOnce() {
            store.loadBetaCodes(List.of("ABC123"));

            store.claimBetaCode("ABC123", "alice@example.com");

            assertThatThrownBy(() -> store.claimBetaCode("ABC123", "bob@example.com"))
                    .isInstanceOf(BetaCodeUnavailableException.class);
            BetaCode code = store.findBetaCode("ABC123").orElseThrow();
            assertThat(code.isUsed()).isTrue();
            assertThat(code.getUsedBy()).isEqualTo("alice@example.com");
            assertThat(code.getUsedAt()).isNotNull();
            assertThat(store.validateBetaCode("ABC123")).isFalse();
            assertThat(store.betaCodeStats().remaining()).isZero();
        }

        @Test
        @DisplayName("領取不存在的碼 → BetaCodeUnavailableException")
        void claimUnknown_throws() {
            assertThatThrownBy(() -> store.claimBetaCode("NOPE", "alice@example.com"))
                    .isInstanceOf(BetaCodeUnavailableException.class);
            assertThat(store.validateBetaCode("NOPE")).isFalse();
        }

        @Test
        @DisplayName("已領取的碼重新載入 → 不重置使用狀態")
        void reload_keepsUsedState() {
            store.loadBetaCodes(List.of("ABC123"));
            store.claimBetaCode("ABC123", "alice@example.com");

            store.loadBetaCodes(List.of("ABC123"));

            assertThat(store.findBetaCode("ABC123").orElseThrow().getUsedBy()).isEqualTo("alice@example.com");
        }
    }

    @Nested
    @DisplayName("用戶、系統設定、信號源與決策記錄")
    class Misc {

        @Test
        @DisplayName("ensureAdminUser 重複呼叫 → 只有一個 admin")
        void ensureAdmin_idempotent() {
            store.ensureAdminUser();
            store.ensureAdminUser();

            assertThat(store.listUserIds()).containsExactly(User.ADMIN_ID);
            assertThat(store.getUserByEmail(User.ADMIN_EMAIL)).isPresent();
        }

        @Test
        @DisplayName("重複 email → DuplicateException")
        void duplicateEmail_throws() {
            store.createUser(User.builder().id("u1").email("a@example.com").build());

            assertThatThrownBy(() -> store.createUser(User.builder().id("u2").email("a@example.com").build()))
                    .isInstanceOf(DuplicateException.class);
        }

        @Test
        @DisplayName("OTP 與密碼更新")
        void userUpdates() {
            store.createUser(User.builder().id("u1").email("a@example.com").build());

            store.setUserOtpVerified("u1", true);
            store.updateUserPassword("u1", "hash-2");

            User user = store.getUserById("u1").orElseThrow();
            assertThat(user.isOtpVerified()).isTrue();
            assertThat(user.getPasswordHash()).isEqualTo("hash-2");
            assertThatThrownBy(() -> store.setUserOtpVerified("ghost", true)).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("系統設定讀寫；不存在的 key 回傳 empty")
        void systemConfig_readWrite() {
            store.setSystemConfig("beta_mode", "true");
            store.setSystemConfig("custom_key", "v1");

            assertThat(store.getSystemConfig("beta_mode")).contains("true");
            assertThat(store.getSystemConfig("custom_key")).contains("v1");
            assertThat(store.getSystemConfig("missing")).isEmpty();
        }

        @Test
        @DisplayName("信號源：第一次建立，第二次更新")
        void signalSource_upsert() {
            store.createOrUpdateSignalSource("alice", "https://pool/1", "https://oi/1");
            store.createOrUpdateSignalSource("alice", "https://pool/2", "");

            UserSignalSource source = store.getSignalSource("alice").orElseThrow();
            assertThat(source.getCoinPoolUrl()).isEqualTo("https://pool/2");
            assertThat(source.getOiTopUrl()).isEmpty();
            assertThat(store.getSignalSource("bob")).isEmpty();
        }

        @Test
        @DisplayName("決策記錄：取最新 N 筆，依時間舊到新返回")
        void decisionLogs_latestInOrder() {
            for (int i = 1; i <= 5; i++) {
                store.saveDecisionLog("alice", "t1", Map.of("cycle", i, "action", "hold"));
            }
            store.saveDecisionLog("alice", "t2", Map.of("cycle", 99));

            List<Map<String, Object>> logs = store.getDecisionLogs("alice", "t1", 3);

            assertThat(logs).extracting(m -> m.get("cycle")).containsExactly(3, 4, 5);
        }

        @Test
        @DisplayName("ping 正常時不拋例外")
        void ping_ok() {
            assertThatCode(store::ping).doesNotThrowAnyException();
        }
    }
}
