package com.tradingstore.vault;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

class CredentialVaultTest {

    private static final String TEST_MASTER_KEY = "01234567890123456789012345678901"; // exactly 32 chars

    private CredentialVault vault;

    @BeforeEach
    void setUp() {
        vault = new CredentialVault(TEST_MASTER_KEY);
    }

    @Nested
    @DisplayName("加密解密 Roundtrip")
    class Roundtrip {

        @Test
        @DisplayName("一般文字 → encrypt → decrypt = 原始明文")
        void normalText_roundtrip() {
            String stored = vault.encryptForStorage("sk-live-abc123");

            assertThat(stored).startsWith(CredentialVault.STORAGE_PREFIX);
            assertThat(vault.decryptFromStorage(stored)).isEqualTo("sk-live-abc123");
        }

        @Test
        @DisplayName("特殊字元（中文、emoji）→ encrypt → decrypt = 原始明文")
        void specialChars_roundtrip() {
            String plaintext = "密鑰測試！@#$%^&*()🚀";

            assertThat(vault.decryptFromStorage(vault.encryptForStorage(plaintext))).isEqualTo(plaintext);
        }

        @Test
        @DisplayName("長字串 → encrypt → decrypt = 原始明文")
        void longString_roundtrip() {
            String plaintext = "a".repeat(4000);

            assertThat(vault.decryptFromStorage(vault.encryptForStorage(plaintext))).isEqualTo(plaintext);
        }
    }

    @Nested
    @DisplayName("隨機 data key / IV")
    class Randomness {

        @Test
        @DisplayName("同一明文加密兩次 → 密文不同，解密後相同")
        void samePlaintext_differentCiphertext() {
            String first = vault.encryptForStorage("same-api-key");
            String second = vault.encryptForStorage("same-api-key");

            assertThat(first).isNotEqualTo(second);
            assertThat(vault.decryptFromStorage(first)).isEqualTo("same-api-key");
            assertThat(vault.decryptFromStorage(second)).isEqualTo("same-api-key");
        }
    }

    @Nested
    @DisplayName("舊版明文與損毀值")
    class LegacyAndCorrupt {

        @Test
        @DisplayName("沒有前綴的舊版明文 → 原樣返回")
        void legacyPlaintext_passesThrough() {
            assertThat(vault.decryptFromStorage("plain-legacy-key")).isEqualTo("plain-legacy-key");
            assertThat(vault.isEncryptedStorageValue("plain-legacy-key")).isFalse();
        }

        @Test
        @DisplayName("篡改密文 byte → 不拋例外，返回原始存儲值")
        void tamperedCiphertext_returnsStoredValue() {
            String stored = vault.encryptForStorage("secret-key");
            String[] parts = stored.substring(CredentialVault.STORAGE_PREFIX.length()).split(":");
            byte[] ciphertext = Base64.getDecoder().decode(parts[1]);
            ciphertext[ciphertext.length - 1] ^= 0xFF;
            String tampered = CredentialVault.STORAGE_PREFIX + parts[0] + ":"
                    + Base64.getEncoder().encodeToString(ciphertext);

            assertThat(vault.decryptFromStorage(tampered)).isEqualTo(tampered);
        }

        @Test
        @DisplayName("不同主金鑰 → 解密失敗，返回原始存儲值")
        void wrongMasterKey_returnsStoredValue() {
            String stored = vault.encryptForStorage("secret-key");
            CredentialVault other = new CredentialVault("abcdefghijabcdefghijabcdefghijab");

            assertThat(other.decryptFromStorage(stored)).isEqualTo(stored);
        }

        @Test
        @DisplayName("只有前綴或缺一段 → 不視為信封格式")
        void malformedEnvelope_notRecognized() {
            assertThat(vault.isEncryptedStorageValue(CredentialVault.STORAGE_PREFIX)).isFalse();
            assertThat(vault.isEncryptedStorageValue(CredentialVault.STORAGE_PREFIX + "abc")).isFalse();
            assertThat(vault.isEncryptedStorageValue(CredentialVault.STORAGE_PREFIX + "abc:")).isFalse();
            assertThat(vault.isEncryptedStorageValue(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("未啟用")
    class Disabled {

        @Test
        @DisplayName("主金鑰為空 → 加解密皆為恆等")
        void blankKey_identity() {
            CredentialVault disabled = new CredentialVault("");

            assertThat(disabled.isEnabled()).isFalse();
            assertThat(disabled.encryptForStorage("k")).isEqualTo("k");
            assertThat(disabled.decryptFromStorage("k")).isEqualTo("k");
        }

        @Test
        @DisplayName("主金鑰不足 32 bytes → 停用")
        void shortKey_disabled() {
            assertThat(new CredentialVault("too-short").isEnabled()).isFalse();
        }

        @Test
        @DisplayName("null 明文 → 返回 null")
        void nullPlaintext_returnsNull() {
            assertThat(vault.encryptForStorage(null)).isNull();
        }
    }
}
