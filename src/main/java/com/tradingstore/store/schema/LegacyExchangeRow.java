package com.tradingstore.store.schema;

import java.time.LocalDateTime;

/**
 * 世代 1 的 exchanges 記錄，主鍵為 (id, user_id)
 */
public record LegacyExchangeRow(
        String legacyId,
        String userId,
        String name,
        String type,
        boolean enabled,
        String apiKey,
        String secretKey,
        boolean testnet,
        String hyperliquidWalletAddr,
        String asterUser,
        String asterSigner,
        String asterPrivateKey,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {
}
