package com.tradingstore.store.relational;

import java.util.List;
import java.util.Map;

/**
 * 關聯式後端（H2）的表結構，對應 schema 世代 2
 *
 * system_config 使用 config_key / config_value 欄位，因為 KEY、VALUE 是 H2 保留字。
 */
final class RelationalSchema {

    static final String USERS = """
            CREATE TABLE IF NOT EXISTS users (
                id VARCHAR(64) PRIMARY KEY,
                email VARCHAR(255) NOT NULL UNIQUE,
                password_hash VARCHAR(255) DEFAULT '' NOT NULL,
                otp_secret VARCHAR(255) DEFAULT '' NOT NULL,
                otp_verified BOOLEAN DEFAULT FALSE NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL
            )""";

    static final String AI_MODELS = """
            CREATE TABLE IF NOT EXISTS ai_models (
                id INT PRIMARY KEY,
                model_id VARCHAR(128) NOT NULL,
                user_id VARCHAR(64) NOT NULL,
                display_name VARCHAR(255) DEFAULT '' NOT NULL,
                name VARCHAR(255) DEFAULT '' NOT NULL,
                provider VARCHAR(64) DEFAULT '' NOT NULL,
                enabled BOOLEAN DEFAULT FALSE NOT NULL,
                api_key VARCHAR(4096) DEFAULT '' NOT NULL,
                custom_api_url VARCHAR(1024) DEFAULT '' NOT NULL,
                custom_model_name VARCHAR(255) DEFAULT '' NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL,
                UNIQUE (model_id, user_id)
            )""";

    static final String EXCHANGES = """
            CREATE TABLE IF NOT EXISTS exchanges (
                id INT PRIMARY KEY,
                exchange_id VARCHAR(128) NOT NULL,
                user_id VARCHAR(64) NOT NULL,
                display_name VARCHAR(255) DEFAULT '' NOT NULL,
                name VARCHAR(255) DEFAULT '' NOT NULL,
                type VARCHAR(32) DEFAULT '' NOT NULL,
                enabled BOOLEAN DEFAULT FALSE NOT NULL,
                api_key VARCHAR(4096) DEFAULT '' NOT NULL,
                secret_key VARCHAR(4096) DEFAULT '' NOT NULL,
                testnet BOOLEAN DEFAULT FALSE NOT NULL,
                hyperliquid_wallet_addr VARCHAR(255) DEFAULT '' NOT NULL,
                aster_user VARCHAR(255) DEFAULT '' NOT NULL,
                aster_signer VARCHAR(255) DEFAULT '' NOT NULL,
                aster_private_key VARCHAR(4096) DEFAULT '' NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL,
                UNIQUE (exchange_id, user_id)
            )""";

    static final String USER_SIGNAL_SOURCES = """
            CREATE TABLE IF NOT EXISTS user_signal_sources (
                user_id VARCHAR(64) PRIMARY KEY,
                coin_pool_url VARCHAR(1024) DEFAULT '' NOT NULL,
                oi_top_url VARCHAR(1024) DEFAULT '' NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL
            )""";

    static final String SYSTEM_CONFIG = """
            CREATE TABLE IF NOT EXISTS system_config (
                config_key VARCHAR(128) PRIMARY KEY,
                config_value VARCHAR(4096) DEFAULT '' NOT NULL,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL
            )""";

    static final String BETA_CODES = """
            CREATE TABLE IF NOT EXISTS beta_codes (
                code VARCHAR(128) PRIMARY KEY,
                used BOOLEAN DEFAULT FALSE NOT NULL,
                used_by VARCHAR(255) DEFAULT '' NOT NULL,
                used_at TIMESTAMP,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL
            )""";

    static final String COUNTERS = """
            CREATE TABLE IF NOT EXISTS counters (
                name VARCHAR(64) PRIMARY KEY,
                seq INT DEFAULT 0 NOT NULL
            )""";

    static final String SCHEMA_META = """
            CREATE TABLE IF NOT EXISTS schema_meta (
                name VARCHAR(64) PRIMARY KEY,
                generation INT NOT NULL,
                updated_at TIMESTAMP
            )""";

    static final String DECISION_LOGS = """
            CREATE TABLE IF NOT EXISTS decision_logs (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                user_id VARCHAR(64) NOT NULL,
                trader_id VARCHAR(128) NOT NULL,
                record_json CLOB NOT NULL,
                created_at TIMESTAMP NOT NULL
            )""";

    static final String DECISION_LOGS_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_decision_logs_trader ON decision_logs (user_id, trader_id, created_at)";

    /** traders 除兩個外鍵以外的欄位，遷移複製時使用 */
    static final String TRADER_DATA_COLUMNS = "id, user_id, name, initial_balance, scan_interval_minutes, "
            + "is_running, btc_eth_leverage, altcoin_leverage, trading_symbols, use_coin_pool, use_oi_top, "
            + "custom_prompt, override_base_prompt, system_prompt_template, is_cross_margin, "
            + "taker_fee_rate, maker_fee_rate, order_strategy, limit_price_offset, limit_timeout_seconds, "
            + "timeframes, created_at, updated_at";

    static final String INSERT_AI_MODEL = "INSERT INTO ai_models (id, model_id, user_id, display_name, name, "
            + "provider, enabled, api_key, custom_api_url, custom_model_name, created_at, updated_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    static final String INSERT_EXCHANGE = "INSERT INTO exchanges (id, exchange_id, user_id, display_name, name, "
            + "type, enabled, api_key, secret_key, testnet, hyperliquid_wallet_addr, aster_user, aster_signer, "
            + "aster_private_key, created_at, updated_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    static final String INSERT_TRADER = "INSERT INTO traders (id, user_id, name, ai_model_id, exchange_id, "
            + "initial_balance, scan_interval_minutes, is_running, btc_eth_leverage, altcoin_leverage, "
            + "trading_symbols, use_coin_pool, use_oi_top, custom_prompt, override_base_prompt, "
            + "system_prompt_template, is_cross_margin, taker_fee_rate, maker_fee_rate, order_strategy, "
            + "limit_price_offset, limit_timeout_seconds, timeframes, created_at, updated_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    /**
     * 後加欄位：無破壞性，每次啟動都套用，已存在時略過
     */
    static final List<String> ADDITIVE_COLUMNS = List.of(
            "ALTER TABLE users ADD COLUMN IF NOT EXISTS otp_secret VARCHAR(255) DEFAULT '' NOT NULL",
            "ALTER TABLE users ADD COLUMN IF NOT EXISTS otp_verified BOOLEAN DEFAULT FALSE NOT NULL",
            "ALTER TABLE ai_models ADD COLUMN IF NOT EXISTS display_name VARCHAR(255) DEFAULT '' NOT NULL",
            "ALTER TABLE ai_models ADD COLUMN IF NOT EXISTS custom_api_url VARCHAR(1024) DEFAULT '' NOT NULL",
            "ALTER TABLE ai_models ADD COLUMN IF NOT EXISTS custom_model_name VARCHAR(255) DEFAULT '' NOT NULL",
            "ALTER TABLE exchanges ADD COLUMN IF NOT EXISTS display_name VARCHAR(255) DEFAULT '' NOT NULL",
            "ALTER TABLE exchanges ADD COLUMN IF NOT EXISTS hyperliquid_wallet_addr VARCHAR(255) DEFAULT '' NOT NULL",
            "ALTER TABLE exchanges ADD COLUMN IF NOT EXISTS aster_user VARCHAR(255) DEFAULT '' NOT NULL",
            "ALTER TABLE exchanges ADD COLUMN IF NOT EXISTS aster_signer VARCHAR(255) DEFAULT '' NOT NULL",
            "ALTER TABLE exchanges ADD COLUMN IF NOT EXISTS aster_private_key VARCHAR(4096) DEFAULT '' NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS btc_eth_leverage INT DEFAULT 0 NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS altcoin_leverage INT DEFAULT 0 NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS trading_symbols VARCHAR(4096) DEFAULT '' NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS use_coin_pool BOOLEAN DEFAULT FALSE NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS use_oi_top BOOLEAN DEFAULT FALSE NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS custom_prompt CLOB DEFAULT '' NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS override_base_prompt BOOLEAN DEFAULT FALSE NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS system_prompt_template VARCHAR(128) DEFAULT '' NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS is_cross_margin BOOLEAN DEFAULT TRUE NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS taker_fee_rate DOUBLE PRECISION DEFAULT 0 NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS maker_fee_rate DOUBLE PRECISION DEFAULT 0 NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS order_strategy VARCHAR(32) DEFAULT '' NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS limit_price_offset DOUBLE PRECISION DEFAULT 0 NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS limit_timeout_seconds INT DEFAULT 0 NOT NULL",
            "ALTER TABLE traders ADD COLUMN IF NOT EXISTS timeframes VARCHAR(255) DEFAULT '' NOT NULL"
    );

    /** 遷移後完整性檢查要求的欄位 */
    static final Map<String, List<String>> REQUIRED_COLUMNS = Map.of(
            "AI_MODELS", List.of("ID", "MODEL_ID", "USER_ID", "NAME", "PROVIDER", "ENABLED", "API_KEY"),
            "EXCHANGES", List.of("ID", "EXCHANGE_ID", "USER_ID", "NAME", "TYPE", "ENABLED", "API_KEY", "SECRET_KEY"),
            "TRADERS", List.of("ID", "USER_ID", "AI_MODEL_ID", "EXCHANGE_ID", "IS_RUNNING")
    );

    private RelationalSchema() {
    }

    static String traders(String table) {
        return "CREATE TABLE IF NOT EXISTS " + table + """
                 (
                    id VARCHAR(128) PRIMARY KEY,
                    user_id VARCHAR(64) NOT NULL,
                    name VARCHAR(255) NOT NULL,
                    ai_model_id INT NOT NULL,
                    exchange_id INT NOT NULL,
                    initial_balance DOUBLE PRECISION DEFAULT 0 NOT NULL,
                    scan_interval_minutes INT DEFAULT 3 NOT NULL,
                    is_running BOOLEAN DEFAULT FALSE NOT NULL,
                    btc_eth_leverage INT DEFAULT 0 NOT NULL,
                    altcoin_leverage INT DEFAULT 0 NOT NULL,
                    trading_symbols VARCHAR(4096) DEFAULT '' NOT NULL,
                    use_coin_pool BOOLEAN DEFAULT FALSE NOT NULL,
                    use_oi_top BOOLEAN DEFAULT FALSE NOT NULL,
                    custom_prompt CLOB DEFAULT '' NOT NULL,
                    override_base_prompt BOOLEAN DEFAULT FALSE NOT NULL,
                    system_prompt_template VARCHAR(128) DEFAULT '' NOT NULL,
                    is_cross_margin BOOLEAN DEFAULT TRUE NOT NULL,
                    taker_fee_rate DOUBLE PRECISION DEFAULT 0 NOT NULL,
                    maker_fee_rate DOUBLE PRECISION DEFAULT 0 NOT NULL,
                    order_strategy VARCHAR(32) DEFAULT '' NOT NULL,
                    limit_price_offset DOUBLE PRECISION DEFAULT 0 NOT NULL,
                    limit_timeout_seconds INT DEFAULT 0 NOT NULL,
                    timeframes VARCHAR(255) DEFAULT '' NOT NULL,
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL,
                    updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL
                )""";
    }

    static List<String> createStatements() {
        return List.of(USERS, AI_MODELS, EXCHANGES, traders("traders"), USER_SIGNAL_SOURCES,
                SYSTEM_CONFIG, BETA_CODES, COUNTERS, SCHEMA_META, DECISION_LOGS, DECISION_LOGS_INDEX);
    }
}
