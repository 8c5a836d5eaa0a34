package com.tradingstore.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 幣種與時間線的聚合規則，兩種後端共用
 */
@Slf4j
public final class TradingSymbols {

    public static final List<String> FALLBACK_COINS = List.of("BTCUSDT", "ETHUSDT", "SOLUSDT", "BNBUSDT");
    public static final List<String> DEFAULT_TIMEFRAMES = List.of("15m", "1h", "4h");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TradingSymbols() {
    }

    /**
     * 統一為大寫並補上 USDT 後綴
     */
    public static String normalize(String symbol) {
        String s = symbol.trim().toUpperCase(Locale.ROOT);
        return s.endsWith("USDT") ? s : s + "USDT";
    }

    /**
     * 解析幣種欄位：JSON 陣列或逗號分隔
     */
    public static List<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String value = raw.trim();
        if (value.startsWith("[")) {
            return parseJson(value);
        }
        List<String> result = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                result.add(part.trim());
            }
        }
        return result;
    }

    /**
     * 合併所有交易員的幣種；都沒設定時使用 default_coins（JSON），再不行用內建清單
     */
    public static List<String> mergeCoins(Collection<String> traderSymbolFields, String defaultCoinsJson) {
        Set<String> merged = new LinkedHashSet<>();
        for (String field : traderSymbolFields) {
            for (String symbol : parse(field)) {
                if (!symbol.isBlank()) {
                    merged.add(normalize(symbol));
                }
            }
        }
        if (!merged.isEmpty()) {
            return List.copyOf(merged);
        }

        if (defaultCoinsJson == null || defaultCoinsJson.isBlank()) {
            return FALLBACK_COINS;
        }
        try {
            List<String> defaults = MAPPER.readValue(defaultCoinsJson, new TypeReference<>() {});
            return defaults.isEmpty() ? FALLBACK_COINS : defaults;
        } catch (JsonProcessingException e) {
            log.warn("⚠️ 解析 default_coins 失敗: {}，使用內建預設值", e.getOriginalMessage());
            return FALLBACK_COINS;
        }
    }

    /**
     * 合併時間線，保留首次出現順序；空集合時回傳預設值
     */
    public static List<String> mergeTimeframes(Collection<String> timeframeFields) {
        Set<String> merged = new LinkedHashSet<>();
        for (String field : timeframeFields) {
            if (field == null) {
                continue;
            }
            for (String tf : field.split(",")) {
                if (!tf.isBlank()) {
                    merged.add(tf.trim());
                }
            }
        }
        return merged.isEmpty() ? DEFAULT_TIMEFRAMES : List.copyOf(merged);
    }

    private static List<String> parseJson(String json) {
        try {
            return MAPPER.readValue(json, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("幣種 JSON 解析失敗: {}", json);
            return List.of();
        }
    }
}
