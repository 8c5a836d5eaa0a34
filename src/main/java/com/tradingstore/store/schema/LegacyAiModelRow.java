package com.tradingstore.store.schema;

import java.time.LocalDateTime;

/**
 * 世代 1 的 ai_models 記錄，id 為字串自然鍵
 */
public record LegacyAiModelRow(
        String legacyId,
        String userId,
        String name,
        String provider,
        boolean enabled,
        String apiKey,
        String customApiUrl,
        String customModelName,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {
}
