package com.tradingstore.shared.exception;

/**
 * 配置存儲層例外的共同父類
 *
 * 所有例外皆為 unchecked，呼叫端依型別決定重試、回報或忽略。
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
