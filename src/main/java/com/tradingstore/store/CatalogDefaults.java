package com.tradingstore.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 預設目錄資料與 upsert 建立時的推斷規則
 */
public final class CatalogDefaults {

    /** 預設目錄的擁有者 */
    public static final String DEFAULT_OWNER = "default";

    public record ModelEntry(String modelId, String name, String provider) {
    }

    public record ExchangeEntry(String exchangeId, String name, String type) {
    }

    public static final List<ModelEntry> AI_MODELS = List.of(
            new ModelEntry("deepseek", "DeepSeek", "deepseek"),
            new ModelEntry("qwen", "Qwen", "qwen")
    );

    public static final List<ExchangeEntry> EXCHANGES = List.of(
            new ExchangeEntry("binance", "Binance Futures", "binance"),
            new ExchangeEntry("hyperliquid", "Hyperliquid", "hyperliquid"),
            new ExchangeEntry("aster", "Aster DEX", "aster")
    );

    public static final Map<String, String> SYSTEM_SETTINGS;

    static {
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put("beta_mode", "false");
        settings.put("api_server_port", "8080");
        settings.put("use_default_coins", "true");
        settings.put("default_coins",
                "[\"BTCUSDT\",\"ETHUSDT\",\"SOLUSDT\",\"BNBUSDT\",\"XRPUSDT\",\"DOGEUSDT\",\"ADAUSDT\",\"HYPEUSDT\"]");
        settings.put("max_daily_loss", "10.0");
        settings.put("max_drawdown", "20.0");
        settings.put("stop_trading_minutes", "60");
        settings.put("btc_eth_leverage", "5");
        settings.put("altcoin_leverage", "5");
        settings.put("jwt_secret", "");
        settings.put("registration_enabled", "true");
        SYSTEM_SETTINGS = Collections.unmodifiableMap(settings);
    }

    private CatalogDefaults() {
    }

    /**
     * 用戶第一次更新某交易所時，依類型 ID 決定名稱與類別
     */
    public static ExchangeEntry exchangeFor(String exchangeKey) {
        return switch (exchangeKey) {
            case "binance" -> new ExchangeEntry(exchangeKey, "Binance Futures", "cex");
            case "hyperliquid" -> new ExchangeEntry(exchangeKey, "Hyperliquid", "dex");
            case "aster" -> new ExchangeEntry(exchangeKey, "Aster DEX", "dex");
            default -> new ExchangeEntry(exchangeKey, exchangeKey + " Exchange", "cex");
        };
    }

    /**
     * 從模型 key 推斷 provider：內建 provider 直接使用，否則取 "_" 分隔的最後一段
     */
    public static String inferProvider(String modelKey) {
        if ("deepseek".equals(modelKey) || "qwen".equals(modelKey)) {
            return modelKey;
        }
        String[] parts = modelKey.split("_");
        return parts.length >= 2 ? parts[parts.length - 1] : modelKey;
    }

    public static String fallbackModelName(String provider) {
        return switch (provider) {
            case "deepseek" -> "DeepSeek AI";
            case "qwen" -> "Qwen AI";
            default -> provider + " AI";
        };
    }

    /**
     * key 本身就是 provider 時，新記錄以 userId_provider 為 modelId
     */
    public static String newModelId(String userId, String modelKey, String provider) {
        return modelKey.equals(provider) ? userId + "_" + provider : modelKey;
    }
}
