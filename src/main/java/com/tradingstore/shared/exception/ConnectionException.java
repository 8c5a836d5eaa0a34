package com.tradingstore.shared.exception;

/**
 * 啟動時無法連線到後端（致命，中止啟動）
 */
public class ConnectionException extends StoreException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
