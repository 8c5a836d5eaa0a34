package com.tradingstore.store.relational;

import com.tradingstore.store.entity.AIModelConfig;
import com.tradingstore.store.entity.BetaCode;
import com.tradingstore.store.entity.ExchangeConfig;
import com.tradingstore.store.entity.TraderRecord;
import com.tradingstore.store.entity.User;
import com.tradingstore.store.entity.UserSignalSource;
import com.tradingstore.store.schema.LegacyAiModelRow;
import com.tradingstore.store.schema.LegacyExchangeRow;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;

/**
 * 關聯式後端的 RowMapper，回傳的機密欄位仍為存儲值（未解密）
 */
final class JdbcRowMappers {

    static final RowMapper<User> USER = (rs, i) -> User.builder()
            .id(rs.getString("id"))
            .email(rs.getString("email"))
            .passwordHash(rs.getString("password_hash"))
            .otpSecret(rs.getString("otp_secret"))
            .otpVerified(rs.getBoolean("otp_verified"))
            .createdAt(timestamp(rs, "created_at"))
            .updatedAt(timestamp(rs, "updated_at"))
            .build();

    static final RowMapper<AIModelConfig> AI_MODEL = (rs, i) -> AIModelConfig.builder()
            .id(rs.getInt("id"))
            .modelId(rs.getString("model_id"))
            .userId(rs.getString("user_id"))
            .displayName(rs.getString("display_name"))
            .name(rs.getString("name"))
            .provider(rs.getString("provider"))
            .enabled(rs.getBoolean("enabled"))
            .apiKey(rs.getString("api_key"))
            .customApiUrl(rs.getString("custom_api_url"))
            .customModelName(rs.getString("custom_model_name"))
            .createdAt(timestamp(rs, "created_at"))
            .updatedAt(timestamp(rs, "updated_at"))
            .build();

    static final RowMapper<ExchangeConfig> EXCHANGE = (rs, i) -> ExchangeConfig.builder()
            .id(rs.getInt("id"))
            .exchangeId(rs.getString("exchange_id"))
            .userId(rs.getString("user_id"))
            .displayName(rs.getString("display_name"))
            .name(rs.getString("name"))
            .type(rs.getString("type"))
            .enabled(rs.getBoolean("enabled"))
            .apiKey(rs.getString("api_key"))
            .secretKey(rs.getString("secret_key"))
            .testnet(rs.getBoolean("testnet"))
            .hyperliquidWalletAddr(rs.getString("hyperliquid_wallet_addr"))
            .asterUser(rs.getString("aster_user"))
            .asterSigner(rs.getString("aster_signer"))
            .asterPrivateKey(rs.getString("aster_private_key"))
            .createdAt(timestamp(rs, "created_at"))
            .updatedAt(timestamp(rs, "updated_at"))
            .build();

    static final RowMapper<TraderRecord> TRADER = (rs, i) -> TraderRecord.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .name(rs.getString("name"))
            .aiModelId(rs.getInt("ai_model_id"))
            .exchangeId(rs.getInt("exchange_id"))
            .initialBalance(rs.getDouble("initial_balance"))
            .scanIntervalMinutes(rs.getInt("scan_interval_minutes"))
            .running(rs.getBoolean("is_running"))
            .btcEthLeverage(rs.getInt("btc_eth_leverage"))
            .altcoinLeverage(rs.getInt("altcoin_leverage"))
            .tradingSymbols(rs.getString("trading_symbols"))
            .useCoinPool(rs.getBoolean("use_coin_pool"))
            .useOiTop(rs.getBoolean("use_oi_top"))
            .customPrompt(rs.getString("custom_prompt"))
            .overrideBasePrompt(rs.getBoolean("override_base_prompt"))
            .systemPromptTemplate(rs.getString("system_prompt_template"))
            .crossMargin(rs.getBoolean("is_cross_margin"))
            .takerFeeRate(rs.getDouble("taker_fee_rate"))
            .makerFeeRate(rs.getDouble("maker_fee_rate"))
            .orderStrategy(rs.getString("order_strategy"))
            .limitPriceOffset(rs.getDouble("limit_price_offset"))
            .limitTimeoutSeconds(rs.getInt("limit_timeout_seconds"))
            .timeframes(rs.getString("timeframes"))
            .createdAt(timestamp(rs, "created_at"))
            .updatedAt(timestamp(rs, "updated_at"))
            .build();

    static final RowMapper<UserSignalSource> SIGNAL_SOURCE = (rs, i) -> UserSignalSource.builder()
            .userId(rs.getString("user_id"))
            .coinPoolUrl(rs.getString("coin_pool_url"))
            .oiTopUrl(rs.getString("oi_top_url"))
            .createdAt(timestamp(rs, "created_at"))
            .updatedAt(timestamp(rs, "updated_at"))
            .build();

    static final RowMapper<BetaCode> BETA_CODE = (rs, i) -> BetaCode.builder()
            .code(rs.getString("code"))
            .used(rs.getBoolean("used"))
            .usedBy(rs.getString("used_by"))
            .usedAt(timestamp(rs, "used_at"))
            .createdAt(timestamp(rs, "created_at"))
            .build();

    /** 世代 1 的 ai_models，id 欄位為字串 */
    static final RowMapper<LegacyAiModelRow> LEGACY_AI_MODEL = (rs, i) -> new LegacyAiModelRow(
            rs.getString("id"),
            rs.getString("user_id"),
            rs.getString("name"),
            rs.getString("provider"),
            rs.getBoolean("enabled"),
            rs.getString("api_key"),
            rs.getString("custom_api_url"),
            rs.getString("custom_model_name"),
            timestamp(rs, "created_at"),
            timestamp(rs, "updated_at"));

    static final RowMapper<LegacyExchangeRow> LEGACY_EXCHANGE = (rs, i) -> new LegacyExchangeRow(
            rs.getString("id"),
            rs.getString("user_id"),
            rs.getString("name"),
            rs.getString("type"),
            rs.getBoolean("enabled"),
            rs.getString("api_key"),
            rs.getString("secret_key"),
            rs.getBoolean("testnet"),
            rs.getString("hyperliquid_wallet_addr"),
            rs.getString("aster_user"),
            rs.getString("aster_signer"),
            rs.getString("aster_private_key"),
            timestamp(rs, "created_at"),
            timestamp(rs, "updated_at"));

    private JdbcRowMappers() {
    }

    private static LocalDateTime timestamp(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, LocalDateTime.class);
    }
}
