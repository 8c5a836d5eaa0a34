package com.tradingstore.vault;

import com.tradingstore.shared.config.StoreProperties;
import com.tradingstore.shared.exception.CryptoException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * 機密欄位信封加密（AES-256-GCM）
 *
 * 每個值使用隨機產生的 data key 加密，data key 再以主金鑰包裝。
 * 儲存格式: ENC:v1:Base64(wrapIv + wrappedKey):Base64(iv + ciphertext + authTag)
 *
 * 未設定主金鑰時加解密皆為恆等函數（明文存放），平台仍可運作。
 * 沒有 ENC:v1: 前綴的值視為舊版明文，解密時原樣返回，
 * 因此可以在既有部署上直接啟用加密，不需要重新加密所有資料。
 */
@Slf4j
@Component
public class CredentialVault {

    public static final String STORAGE_PREFIX = "ENC:v1:";

    private static final int KEY_LENGTH = 32;        // AES-256
    private static final int GCM_IV_LENGTH = 12;     // 96 bits
    private static final int GCM_TAG_LENGTH = 128;   // 128 bits
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private static final SecureRandom RANDOM = new SecureRandom();

    /** 初始化後唯讀，null 表示未啟用 */
    private final SecretKeySpec masterKey;

    @Autowired
    public CredentialVault(StoreProperties properties) {
        this(properties.getVault().getMasterKey());
    }

    public CredentialVault(String masterKey) {
        this.masterKey = buildMasterKey(masterKey);
        if (this.masterKey == null) {
            log.warn("⚠️ 未設定有效的 vault 主金鑰，機密欄位將以明文存放");
        }
    }

    public boolean isEnabled() {
        return masterKey != null;
    }

    /**
     * 加密用於存儲的值
     *
     * @param plaintext 明文
     * @return 信封格式密文；未啟用時原樣返回
     * @throws CryptoException 加密失敗
     */
    public String encryptForStorage(String plaintext) {
        if (masterKey == null || plaintext == null) {
            return plaintext;
        }
        try {
            byte[] dataKey = new byte[KEY_LENGTH];
            RANDOM.nextBytes(dataKey);

            byte[] wrapped = seal(masterKey, dataKey);
            byte[] ciphertext = seal(new SecretKeySpec(dataKey, "AES"),
                    plaintext.getBytes(StandardCharsets.UTF_8));
            Arrays.fill(dataKey, (byte) 0);

            Base64.Encoder encoder = Base64.getEncoder();
            return STORAGE_PREFIX + encoder.encodeToString(wrapped)
                    + ":" + encoder.encodeToString(ciphertext);
        } catch (Exception e) {
            throw new CryptoException("加密失敗", e);
        }
    }

    /**
     * 解密存儲的值
     *
     * 舊版明文原樣返回；密文損毀或金鑰錯誤時記錄警告並返回原值，不拋例外。
     */
    public String decryptFromStorage(String value) {
        if (masterKey == null || !isEncryptedStorageValue(value)) {
            return value;
        }
        try {
            String[] parts = value.substring(STORAGE_PREFIX.length()).split(":", -1);
            Base64.Decoder decoder = Base64.getDecoder();

            byte[] dataKey = open(masterKey, decoder.decode(parts[0]));
            byte[] plaintext = open(new SecretKeySpec(dataKey, "AES"), decoder.decode(parts[1]));
            Arrays.fill(dataKey, (byte) 0);

            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.warn("⚠️ 解密失敗，返回原始存儲值: {}", e.getMessage());
            return value;
        }
    }

    /**
     * 是否為信封格式（前綴 + 兩段 Base64）
     */
    public boolean isEncryptedStorageValue(String value) {
        if (value == null || !value.startsWith(STORAGE_PREFIX)) {
            return false;
        }
        String[] parts = value.substring(STORAGE_PREFIX.length()).split(":", -1);
        return parts.length == 2 && !parts[0].isEmpty() && !parts[1].isEmpty();
    }

    // ==================== private helpers ====================

    private static SecretKeySpec buildMasterKey(String masterKey) {
        if (masterKey == null || masterKey.isBlank()) {
            return null;
        }
        byte[] bytes = masterKey.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < KEY_LENGTH) {
            log.warn("⚠️ vault 主金鑰長度不足 {} bytes（實際 {}），停用加密", KEY_LENGTH, bytes.length);
            return null;
        }
        return new SecretKeySpec(bytes, 0, KEY_LENGTH, "AES");
    }

    private static byte[] seal(SecretKeySpec key, byte[] plaintext) throws Exception {
        byte[] iv = new byte[GCM_IV_LENGTH];
        RANDOM.nextBytes(iv);

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        byte[] ciphertext = cipher.doFinal(plaintext);

        ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
        buffer.put(iv);
        buffer.put(ciphertext);
        return buffer.array();
    }

    private static byte[] open(SecretKeySpec key, byte[] sealed) throws Exception {
        ByteBuffer buffer = ByteBuffer.wrap(sealed);
        byte[] iv = new byte[GCM_IV_LENGTH];
        buffer.get(iv);
        byte[] ciphertext = new byte[buffer.remaining()];
        buffer.get(ciphertext);

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        return cipher.doFinal(ciphertext);
    }
}
