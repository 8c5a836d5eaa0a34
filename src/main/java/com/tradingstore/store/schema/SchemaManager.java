package com.tradingstore.store.schema;

/**
 * Schema 遷移管理
 *
 * 流程：讀取已存的世代標記 → 建立缺少的族群 → 附加欄位 →
 * 破壞性步驟（先備份，逐步偵測後轉換）→ 完整性驗證 → 寫入標記。
 * 只在啟動時呼叫一次，期間不得有其他記錄操作。
 */
public interface SchemaManager {

    /**
     * @throws com.tradingstore.shared.exception.SchemaException    遷移步驟失敗
     * @throws com.tradingstore.shared.exception.IntegrityException 遷移後完整性檢查失敗
     */
    void ensureSchema();

    /**
     * 目前的 schema 世代（ensureSchema 之後有效，快取於記憶體）
     */
    int currentGeneration();
}
