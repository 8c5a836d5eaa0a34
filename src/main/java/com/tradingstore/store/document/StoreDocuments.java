package com.tradingstore.store.document;

import com.tradingstore.shared.config.AppConstants;
import com.tradingstore.store.entity.AIModelConfig;
import com.tradingstore.store.entity.BetaCode;
import com.tradingstore.store.entity.ExchangeConfig;
import com.tradingstore.store.entity.TraderRecord;
import com.tradingstore.store.entity.User;
import com.tradingstore.store.entity.UserSignalSource;
import org.bson.Document;

import java.time.LocalDateTime;
import java.util.Date;

/**
 * 實體與 BSON {@link Document} 之間的轉換
 *
 * 欄位名稱採 snake_case；業務主鍵存在 id 欄位，_id 由 MongoDB 自行產生。
 * 讀出的機密欄位為存儲值（未解密）。
 */
final class StoreDocuments {

    static final String USERS = "users";
    static final String AI_MODELS = "ai_models";
    static final String EXCHANGES = "exchanges";
    static final String TRADERS = "traders";
    static final String USER_SIGNAL_SOURCES = "user_signal_sources";
    static final String SYSTEM_CONFIG = "system_config";
    static final String BETA_CODES = "beta_codes";
    static final String COUNTERS = "counters";
    static final String SCHEMA_META = "schema_meta";
    static final String DECISION_LOGS = "decision_logs";

    private StoreDocuments() {
    }

    // ==================== users ====================

    static Document toDocument(User user, LocalDateTime now) {
        return new Document("id", user.getId())
                .append("email", user.getEmail())
                .append("password_hash", nullToEmpty(user.getPasswordHash()))
                .append("otp_secret", nullToEmpty(user.getOtpSecret()))
                .append("otp_verified", user.isOtpVerified())
                .append("created_at", toDate(now))
                .append("updated_at", toDate(now));
    }

    static User toUser(Document doc) {
        return User.builder()
                .id(doc.getString("id"))
                .email(doc.getString("email"))
                .passwordHash(string(doc, "password_hash"))
                .otpSecret(string(doc, "otp_secret"))
                .otpVerified(bool(doc, "otp_verified"))
                .createdAt(dateTime(doc, "created_at"))
                .updatedAt(dateTime(doc, "updated_at"))
                .build();
    }

    // ==================== ai_models ====================

    /**
     * @param sealedApiKey 已加密的 apiKey
     */
    static Document toDocument(AIModelConfig model, String sealedApiKey, LocalDateTime now) {
        return new Document("id", model.getId())
                .append("model_id", model.getModelId())
                .append("user_id", model.getUserId())
                .append("display_name", nullToEmpty(model.getDisplayName()))
                .append("name", nullToEmpty(model.getName()))
                .append("provider", nullToEmpty(model.getProvider()))
                .append("enabled", model.isEnabled())
                .append("api_key", sealedApiKey)
                .append("custom_api_url", nullToEmpty(model.getCustomApiUrl()))
                .append("custom_model_name", nullToEmpty(model.getCustomModelName()))
                .append("created_at", toDate(now))
                .append("updated_at", toDate(now));
    }

    static AIModelConfig toAiModel(Document doc) {
        return AIModelConfig.builder()
                .id(integer(doc, "id"))
                .modelId(doc.getString("model_id"))
                .userId(doc.getString("user_id"))
                .displayName(string(doc, "display_name"))
                .name(string(doc, "name"))
                .provider(string(doc, "provider"))
                .enabled(bool(doc, "enabled"))
                .apiKey(string(doc, "api_key"))
                .customApiUrl(string(doc, "custom_api_url"))
                .customModelName(string(doc, "custom_model_name"))
                .createdAt(dateTime(doc, "created_at"))
                .updatedAt(dateTime(doc, "updated_at"))
                .build();
    }

    // ==================== exchanges ====================

    static Document toDocument(ExchangeConfig exchange, String sealedApiKey, String sealedSecretKey,
                               String sealedAsterPrivateKey, LocalDateTime now) {
        return new Document("id", exchange.getId())
                .append("exchange_id", exchange.getExchangeId())
                .append("user_id", exchange.getUserId())
                .append("display_name", nullToEmpty(exchange.getDisplayName()))
                .append("name", nullToEmpty(exchange.getName()))
                .append("type", nullToEmpty(exchange.getType()))
                .append("enabled", exchange.isEnabled())
                .append("api_key", sealedApiKey)
                .append("secret_key", sealedSecretKey)
                .append("testnet", exchange.isTestnet())
                .append("hyperliquid_wallet_addr", nullToEmpty(exchange.getHyperliquidWalletAddr()))
                .append("aster_user", nullToEmpty(exchange.getAsterUser()))
                .append("aster_signer", nullToEmpty(exchange.getAsterSigner()))
                .append("aster_private_key", sealedAsterPrivateKey)
                .append("created_at", toDate(now))
                .append("updated_at", toDate(now));
    }

    static ExchangeConfig toExchange(Document doc) {
        return ExchangeConfig.builder()
                .id(integer(doc, "id"))
                .exchangeId(doc.getString("exchange_id"))
                .userId(doc.getString("user_id"))
                .displayName(string(doc, "display_name"))
                .name(string(doc, "name"))
                .type(string(doc, "type"))
                .enabled(bool(doc, "enabled"))
                .apiKey(string(doc, "api_key"))
                .secretKey(string(doc, "secret_key"))
                .testnet(bool(doc, "testnet"))
                .hyperliquidWalletAddr(string(doc, "hyperliquid_wallet_addr"))
                .asterUser(string(doc, "aster_user"))
                .asterSigner(string(doc, "aster_signer"))
                .asterPrivateKey(string(doc, "aster_private_key"))
                .createdAt(dateTime(doc, "created_at"))
                .updatedAt(dateTime(doc, "updated_at"))
                .build();
    }

    // ==================== traders ====================

    static Document toDocument(TraderRecord trader, LocalDateTime now) {
        return new Document("id", trader.getId())
                .append("user_id", trader.getUserId())
                .append("name", trader.getName())
                .append("ai_model_id", trader.getAiModelId())
                .append("exchange_id", trader.getExchangeId())
                .append("initial_balance", trader.getInitialBalance())
                .append("scan_interval_minutes", trader.getScanIntervalMinutes())
                .append("is_running", trader.isRunning())
                .append("btc_eth_leverage", trader.getBtcEthLeverage())
                .append("altcoin_leverage", trader.getAltcoinLeverage())
                .append("trading_symbols", nullToEmpty(trader.getTradingSymbols()))
                .append("use_coin_pool", trader.isUseCoinPool())
                .append("use_oi_top", trader.isUseOiTop())
                .append("custom_prompt", nullToEmpty(trader.getCustomPrompt()))
                .append("override_base_prompt", trader.isOverrideBasePrompt())
                .append("system_prompt_template", nullToEmpty(trader.getSystemPromptTemplate()))
                .append("is_cross_margin", trader.isCrossMargin())
                .append("taker_fee_rate", trader.getTakerFeeRate())
                .append("maker_fee_rate", trader.getMakerFeeRate())
                .append("order_strategy", nullToEmpty(trader.getOrderStrategy()))
                .append("limit_price_offset", trader.getLimitPriceOffset())
                .append("limit_timeout_seconds", trader.getLimitTimeoutSeconds())
                .append("timeframes", nullToEmpty(trader.getTimeframes()))
                .append("created_at", toDate(now))
                .append("updated_at", toDate(now));
    }

    /**
     * 後加的欄位在舊文件中可能不存在，缺少時得到 0 / false / ""，再由 TraderDefaults 補值
     */
    static TraderRecord toTrader(Document doc) {
        return TraderRecord.builder()
                .id(doc.getString("id"))
                .userId(doc.getString("user_id"))
                .name(string(doc, "name"))
                .aiModelId(integer(doc, "ai_model_id"))
                .exchangeId(integer(doc, "exchange_id"))
                .initialBalance(decimal(doc, "initial_balance"))
                .scanIntervalMinutes(integer(doc, "scan_interval_minutes"))
                .running(bool(doc, "is_running"))
                .btcEthLeverage(integer(doc, "btc_eth_leverage"))
                .altcoinLeverage(integer(doc, "altcoin_leverage"))
                .tradingSymbols(string(doc, "trading_symbols"))
                .useCoinPool(bool(doc, "use_coin_pool"))
                .useOiTop(bool(doc, "use_oi_top"))
                .customPrompt(string(doc, "custom_prompt"))
                .overrideBasePrompt(bool(doc, "override_base_prompt"))
                .systemPromptTemplate(string(doc, "system_prompt_template"))
                .crossMargin(doc.containsKey("is_cross_margin") ? bool(doc, "is_cross_margin") : true)
                .takerFeeRate(decimal(doc, "taker_fee_rate"))
                .makerFeeRate(decimal(doc, "maker_fee_rate"))
                .orderStrategy(string(doc, "order_strategy"))
                .limitPriceOffset(decimal(doc, "limit_price_offset"))
                .limitTimeoutSeconds(integer(doc, "limit_timeout_seconds"))
                .timeframes(string(doc, "timeframes"))
                .createdAt(dateTime(doc, "created_at"))
                .updatedAt(dateTime(doc, "updated_at"))
                .build();
    }

    // ==================== 其他 ====================

    static UserSignalSource toSignalSource(Document doc) {
        return UserSignalSource.builder()
                .userId(doc.getString("user_id"))
                .coinPoolUrl(string(doc, "coin_pool_url"))
                .oiTopUrl(string(doc, "oi_top_url"))
                .createdAt(dateTime(doc, "created_at"))
                .updatedAt(dateTime(doc, "updated_at"))
                .build();
    }

    static BetaCode toBetaCode(Document doc) {
        return BetaCode.builder()
                .code(doc.getString("code"))
                .used(bool(doc, "used"))
                .usedBy(string(doc, "used_by"))
                .usedAt(dateTime(doc, "used_at"))
                .createdAt(dateTime(doc, "created_at"))
                .build();
    }

    // ==================== 型別轉換 ====================

    static Date toDate(LocalDateTime value) {
        return value == null ? null : Date.from(value.atZone(AppConstants.ZONE_ID).toInstant());
    }

    static LocalDateTime dateTime(Document doc, String field) {
        Object value = doc.get(field);
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(((Date) value).toInstant(), AppConstants.ZONE_ID);
        }
        return null;
    }

    static String string(Document doc, String field) {
        Object value = doc.get(field);
        return value == null ? "" : value.toString();
    }

    static int integer(Document doc, String field) {
        Object value = doc.get(field);
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }

    static double decimal(Document doc, String field) {
        Object value = doc.get(field);
        return value instanceof Number ? ((Number) value).doubleValue() : 0;
    }

    static boolean bool(Document doc, String field) {
        Object value = doc.get(field);
        return value instanceof Boolean && (Boolean) value;
    }

    static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
