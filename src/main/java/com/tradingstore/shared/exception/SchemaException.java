package com.tradingstore.shared.exception;

/**
 * 遷移步驟執行失敗（致命，中止啟動）
 */
public class SchemaException extends StoreException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
