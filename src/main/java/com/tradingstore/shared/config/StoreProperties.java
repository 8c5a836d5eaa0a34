package com.tradingstore.shared.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 配置存儲設定，對應 application.yml 中的 trading-store 區塊
 */
@Getter
@ConfigurationProperties(prefix = "trading-store")
public class StoreProperties {

    /** 後端實作，啟動時決定，執行期間不變 */
    private final Backend backend;

    /** 每次後端呼叫的逾時 */
    private final Duration operationTimeout;

    /** 破壞性遷移前的備份目錄 */
    private final String backupDir;

    /** 內測碼清單檔，空字串表示不載入 */
    private final String betaCodesFile;

    private final Vault vault;
    private final Mongo mongo;

    public StoreProperties(
            @DefaultValue("relational") Backend backend,
            @DefaultValue("5s") Duration operationTimeout,
            @DefaultValue("./data/backups") String backupDir,
            @DefaultValue("") String betaCodesFile,
            @DefaultValue Vault vault,
            @DefaultValue Mongo mongo
    ) {
        this.backend = backend;
        this.operationTimeout = operationTimeout;
        this.backupDir = backupDir;
        this.betaCodesFile = betaCodesFile != null ? betaCodesFile : "";
        this.vault = vault;
        this.mongo = mongo;
    }

    public enum Backend {
        RELATIONAL, DOCUMENT
    }

    @Getter
    public static class Vault {

        /** 主金鑰（至少 32 bytes），空字串時機密欄位以明文存放 */
        private final String masterKey;

        public Vault(@DefaultValue("") String masterKey) {
            this.masterKey = masterKey != null ? masterKey : "";
        }
    }

    @Getter
    public static class Mongo {

        private final String uri;

        /** URI 未指定資料庫名稱時使用 */
        private final String database;

        public Mongo(@DefaultValue("mongodb://localhost:27017") String uri,
                     @DefaultValue("nofx") String database) {
            this.uri = uri;
            this.database = database;
        }
    }
}
