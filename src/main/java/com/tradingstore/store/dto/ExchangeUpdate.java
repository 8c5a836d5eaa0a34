package com.tradingstore.store.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 交易所更新請求
 *
 * 機密欄位（apiKey / secretKey / asterPrivateKey）為空字串時保持不變，
 * 防止未帶機密的客戶端把已存的金鑰清掉。
 */
// TODO: 加入明確的 clearSecrets 旗標，讓客戶端能區分「清除」與「不變」
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExchangeUpdate {

    private boolean enabled;

    @ToString.Exclude
    @Builder.Default
    private String apiKey = "";

    @ToString.Exclude
    @Builder.Default
    private String secretKey = "";

    private boolean testnet;

    @Builder.Default
    private String hyperliquidWalletAddr = "";

    @Builder.Default
    private String asterUser = "";

    @Builder.Default
    private String asterSigner = "";

    @ToString.Exclude
    @Builder.Default
    private String asterPrivateKey = "";
}
