package com.tradingstore.store.entity;

import lombok.*;

import java.time.LocalDateTime;

/**
 * 交易員配置
 *
 * 晚於初版加入的欄位（槓桿、手續費、下單策略、限價逾時、時間線）
 * 在讀取時套用預設值，見 {@link com.tradingstore.store.TraderDefaults}。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraderRecord {

    private String id;

    private String userId;

    private String name;

    /** 外鍵：ai_models.id */
    private int aiModelId;

    /** 外鍵：exchanges.id */
    private int exchangeId;

    private double initialBalance;

    private int scanIntervalMinutes;

    private boolean running;

    /** BTC/ETH 槓桿倍數 */
    private int btcEthLeverage;

    /** 山寨幣槓桿倍數 */
    private int altcoinLeverage;

    /** 交易幣種，逗號分隔 */
    @Builder.Default
    private String tradingSymbols = "";

    /** 是否使用 COIN POOL 信號源 */
    private boolean useCoinPool;

    /** 是否使用 OI TOP 信號源 */
    private boolean useOiTop;

    @Builder.Default
    private String customPrompt = "";

    /** 是否以自訂 prompt 覆蓋基礎 prompt */
    private boolean overrideBasePrompt;

    @Builder.Default
    private String systemPromptTemplate = "";

    /** true=全倉，false=逐倉 */
    private boolean crossMargin;

    private double takerFeeRate;

    private double makerFeeRate;

    /** market_only / conservative_hybrid / limit_only */
    @Builder.Default
    private String orderStrategy = "";

    /** 限價單價格偏移百分比（-0.03 代表 -0.03%） */
    private double limitPriceOffset;

    /** 限價單逾時轉市價的秒數 */
    private int limitTimeoutSeconds;

    /** 時間線，逗號分隔，例如 "1m,4h,1d" */
    @Builder.Default
    private String timeframes = "";

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
