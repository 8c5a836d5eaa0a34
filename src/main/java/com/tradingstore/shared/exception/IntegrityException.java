package com.tradingstore.shared.exception;

/**
 * 遷移後完整性檢查失敗：孤兒引用、缺少必要欄位或筆數不合理（致命）
 */
public class IntegrityException extends StoreException {

    public IntegrityException(String message) {
        super(message);
    }
}
