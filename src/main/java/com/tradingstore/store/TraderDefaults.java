package com.tradingstore.store;

import com.tradingstore.store.entity.TraderRecord;

/**
 * 交易員後加欄位的讀取期預設值
 *
 * 不依賴後端的欄位預設值，兩種後端讀出的結果一致。
 */
public final class TraderDefaults {

    public static final int LEVERAGE = 5;
    public static final String SYSTEM_PROMPT_TEMPLATE = "default";
    public static final double TAKER_FEE_RATE = 0.0004;
    public static final double MAKER_FEE_RATE = 0.0002;
    public static final String ORDER_STRATEGY = "conservative_hybrid";
    public static final double LIMIT_PRICE_OFFSET = -0.03;
    public static final int LIMIT_TIMEOUT_SECONDS = 60;
    public static final String TIMEFRAMES = "4h";

    private TraderDefaults() {
    }

    public static TraderRecord apply(TraderRecord trader) {
        if (trader.getBtcEthLeverage() == 0) {
            trader.setBtcEthLeverage(LEVERAGE);
        }
        if (trader.getAltcoinLeverage() == 0) {
            trader.setAltcoinLeverage(LEVERAGE);
        }
        if (isBlank(trader.getSystemPromptTemplate())) {
            trader.setSystemPromptTemplate(SYSTEM_PROMPT_TEMPLATE);
        }
        if (trader.getTakerFeeRate() == 0) {
            trader.setTakerFeeRate(TAKER_FEE_RATE);
        }
        if (trader.getMakerFeeRate() == 0) {
            trader.setMakerFeeRate(MAKER_FEE_RATE);
        }
        if (isBlank(trader.getOrderStrategy())) {
            trader.setOrderStrategy(ORDER_STRATEGY);
        }
        if (trader.getLimitPriceOffset() == 0) {
            trader.setLimitPriceOffset(LIMIT_PRICE_OFFSET);
        }
        if (trader.getLimitTimeoutSeconds() == 0) {
            trader.setLimitTimeoutSeconds(LIMIT_TIMEOUT_SECONDS);
        }
        if (isBlank(trader.getTimeframes())) {
            trader.setTimeframes(TIMEFRAMES);
        }
        if (trader.getTradingSymbols() == null) {
            trader.setTradingSymbols("");
        }
        if (trader.getCustomPrompt() == null) {
            trader.setCustomPrompt("");
        }
        return trader;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
