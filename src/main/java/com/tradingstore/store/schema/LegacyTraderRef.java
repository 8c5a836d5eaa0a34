package com.tradingstore.store.schema;

/**
 * 世代 1 交易員的外鍵（舊字串鍵）
 */
public record LegacyTraderRef(String traderId, String userId, String aiModelRef, String exchangeRef) {
}
