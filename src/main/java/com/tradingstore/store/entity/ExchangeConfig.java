package com.tradingstore.store.entity;

import lombok.*;

import java.time.LocalDateTime;

/**
 * 交易所配置
 *
 * (exchangeId, userId) 在同一用戶下唯一。
 * apiKey / secretKey / asterPrivateKey 為機密欄位。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExchangeConfig {

    private int id;

    /** 交易所類型 ID，例如 "binance" */
    private String exchangeId;

    private String userId;

    @Builder.Default
    private String displayName = "";

    private String name;

    /** cex / dex */
    private String type;

    private boolean enabled;

    /** Binance: API Key；Hyperliquid: agent 私鑰 */
    @ToString.Exclude
    @Builder.Default
    private String apiKey = "";

    /** Binance: Secret Key；Hyperliquid 不使用 */
    @ToString.Exclude
    @Builder.Default
    private String secretKey = "";

    private boolean testnet;

    /** Hyperliquid 主錢包地址 */
    @Builder.Default
    private String hyperliquidWalletAddr = "";

    @Builder.Default
    private String asterUser = "";

    @Builder.Default
    private String asterSigner = "";

    @ToString.Exclude
    @Builder.Default
    private String asterPrivateKey = "";

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
