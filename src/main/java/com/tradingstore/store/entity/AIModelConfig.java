package com.tradingstore.store.entity;

import lombok.*;

import java.time.LocalDateTime;

/**
 * AI 模型配置
 *
 * (modelId, userId) 在同一用戶下唯一。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AIModelConfig {

    /** 序號分配器發出的主鍵 */
    private int id;

    /** 模型類型 ID，例如 "deepseek" 或 "alice_deepseek" */
    private String modelId;

    private String userId;

    @Builder.Default
    private String displayName = "";

    private String name;

    private String provider;

    private boolean enabled;

    /** 讀取時已解密；寫入時由存儲層加密 */
    @ToString.Exclude
    @Builder.Default
    private String apiKey = "";

    @Builder.Default
    private String customApiUrl = "";

    @Builder.Default
    private String customModelName = "";

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
