package com.tradingstore.shared.exception;

/**
 * 後端逾時或暫時性失敗，呼叫端可重試
 */
public class TransientStoreException extends StoreException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
