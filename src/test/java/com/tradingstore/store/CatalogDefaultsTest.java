package com.tradingstore.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CatalogDefaultsTest {

    @Nested
    @DisplayName("provider 推斷")
    class InferProvider {

        @Test
        @DisplayName("內建 provider 直接使用")
        void builtin() {
            assertThat(CatalogDefaults.inferProvider("deepseek")).isEqualTo("deepseek");
            assertThat(CatalogDefaults.inferProvider("qwen")).isEqualTo("qwen");
        }

        @Test
        @DisplayName("userId_provider → 取最後一段")
        void userScopedKey() {
            assertThat(CatalogDefaults.inferProvider("alice_deepseek")).isEqualTo("deepseek");
            assertThat(CatalogDefaults.inferProvider("team_a_kimi")).isEqualTo("kimi");
        }

        @Test
        @DisplayName("沒有底線 → 原樣返回")
        void plainKey() {
            assertThat(CatalogDefaults.inferProvider("openai")).isEqualTo("openai");
        }
    }

    @Test
    @DisplayName("新 modelId：key 即 provider 時加上用戶前綴")
    void newModelId() {
        assertThat(CatalogDefaults.newModelId("alice", "deepseek", "deepseek")).isEqualTo("alice_deepseek");
        assertThat(CatalogDefaults.newModelId("alice", "alice_kimi", "kimi")).isEqualTo("alice_kimi");
    }

    @Test
    @DisplayName("交易所類型：binance 為 cex，hyperliquid / aster 為 dex，其他預設 cex")
    void exchangeFor() {
        assertThat(CatalogDefaults.exchangeFor("binance").type()).isEqualTo("cex");
        assertThat(CatalogDefaults.exchangeFor("hyperliquid").type()).isEqualTo("dex");
        assertThat(CatalogDefaults.exchangeFor("aster").name()).isEqualTo("Aster DEX");
        assertThat(CatalogDefaults.exchangeFor("okx").name()).isEqualTo("okx Exchange");
        assertThat(CatalogDefaults.exchangeFor("okx").type()).isEqualTo("cex");
    }

    @Test
    @DisplayName("系統設定預設值")
    void systemSettings() {
        assertThat(CatalogDefaults.SYSTEM_SETTINGS)
                .hasSize(11)
                .containsEntry("beta_mode", "false")
                .containsEntry("api_server_port", "8080")
                .containsKey("default_coins");
        assertThat(CatalogDefaults.fallbackModelName("qwen")).isEqualTo("Qwen AI");
    }
}
