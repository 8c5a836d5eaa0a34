package com.tradingstore.store.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * AI 模型更新請求
 *
 * apiKey 為空字串時代表「保持不變」而不是清除。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiModelUpdate {

    private boolean enabled;

    @ToString.Exclude
    @Builder.Default
    private String apiKey = "";

    @Builder.Default
    private String customApiUrl = "";

    @Builder.Default
    private String customModelName = "";
}
