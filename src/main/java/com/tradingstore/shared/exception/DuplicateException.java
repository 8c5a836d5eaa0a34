package com.tradingstore.shared.exception;

/**
 * 唯一鍵衝突（用戶發起的建立操作）
 */
public class DuplicateException extends StoreException {

    public DuplicateException(String message) {
        super(message);
    }

    public DuplicateException(String message, Throwable cause) {
        super(message, cause);
    }
}
