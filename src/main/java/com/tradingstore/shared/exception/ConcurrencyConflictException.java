package com.tradingstore.shared.exception;

/**
 * 序號分配等原子操作競爭失敗，呼叫端可重試整個邏輯操作（不會部分套用）
 */
public class ConcurrencyConflictException extends StoreException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
