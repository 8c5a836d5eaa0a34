package com.tradingstore.shared.exception;

/**
 * 加解密失敗。存儲層一律降級處理，不會讓讀寫路徑中斷。
 */
public class CryptoException extends StoreException {

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
