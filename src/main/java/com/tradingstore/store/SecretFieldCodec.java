package com.tradingstore.store;

import com.tradingstore.shared.exception.CryptoException;
import com.tradingstore.vault.CredentialVault;
import lombok.extern.slf4j.Slf4j;

/**
 * 機密欄位的寫入加密 / 讀取解密
 *
 * vault 未注入或加密失敗時降級為明文，讀寫路徑不會因加密子系統而中斷。
 */
@Slf4j
public class SecretFieldCodec {

    private volatile CredentialVault vault;

    public void setVault(CredentialVault vault) {
        this.vault = vault;
    }

    public boolean hasVault() {
        return vault != null && vault.isEnabled();
    }

    public String seal(String plaintext) {
        CredentialVault current = vault;
        if (current == null || plaintext == null || plaintext.isEmpty()) {
            return plaintext == null ? "" : plaintext;
        }
        try {
            return current.encryptForStorage(plaintext);
        } catch (CryptoException e) {
            log.warn("⚠️ 加密失敗，降級為明文存放: {}", e.getMessage());
            return plaintext;
        }
    }

    public String open(String stored) {
        CredentialVault current = vault;
        if (current == null || stored == null || stored.isEmpty()) {
            return stored == null ? "" : stored;
        }
        if (!current.isEncryptedStorageValue(stored)) {
            return stored;
        }
        return current.decryptFromStorage(stored);
    }

    /**
     * 空字串代表「保持不變」
     */
    public static boolean shouldWrite(String secret) {
        return secret != null && !secret.isEmpty();
    }
}
