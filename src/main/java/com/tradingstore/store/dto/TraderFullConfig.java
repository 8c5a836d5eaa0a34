package com.tradingstore.store.dto;

import com.tradingstore.store.entity.AIModelConfig;
import com.tradingstore.store.entity.ExchangeConfig;
import com.tradingstore.store.entity.TraderRecord;

/**
 * 交易員完整配置（含已解密的 AI 模型與交易所）
 */
public record TraderFullConfig(TraderRecord trader, AIModelConfig aiModel, ExchangeConfig exchange) {
}
