package com.tradingstore;

import com.tradingstore.shared.config.StoreProperties;
import com.tradingstore.shared.exception.StoreException;
import com.tradingstore.store.RecordStore;
import com.tradingstore.store.schema.SchemaManager;
import com.tradingstore.store.seed.DefaultDataSeeder;
import com.tradingstore.vault.CredentialVault;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 啟動時開啟配置存儲
 *
 * 順序固定：連線檢查 → schema 遷移 → 預設資料 → admin 用戶 → 注入 vault → 載入內測碼。
 * 任何一步失敗都會讓應用啟動失敗，不會帶著半遷移的存儲對外服務。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreBootstrap {

    private final RecordStore recordStore;
    private final SchemaManager schemaManager;
    private final DefaultDataSeeder seeder;
    private final CredentialVault vault;
    private final StoreProperties properties;

    @PostConstruct
    public void open() {
        log.info("開啟配置存儲，後端: {}", properties.getBackend());

        recordStore.ping();
        schemaManager.ensureSchema();
        seeder.seedDefaults();
        recordStore.ensureAdminUser();

        if (vault.isEnabled()) {
            recordStore.setCredentialVault(vault);
        } else {
            log.warn("⚠️ vault 未啟用，AI 模型與交易所的機密欄位將以明文存放");
        }

        String betaCodesFile = properties.getBetaCodesFile();
        if (betaCodesFile != null && !betaCodesFile.isBlank()) {
            loadBetaCodes(Paths.get(betaCodesFile));
        }

        log.info("✅ 配置存儲就緒，schema 世代 {}", schemaManager.currentGeneration());
    }

    private void loadBetaCodes(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("讀取內測碼檔案失敗: " + file + " (" + e.getMessage() + ")", e);
        }
        int inserted = recordStore.loadBetaCodes(lines);
        log.info("內測碼檔案 {} 載入完成，新增 {} 個", file, inserted);
    }
}
