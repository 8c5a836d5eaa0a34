package com.tradingstore.shared.exception;

/**
 * 內測碼不存在或已被使用
 */
public class BetaCodeUnavailableException extends StoreException {

    public BetaCodeUnavailableException(String code) {
        super("內測碼無效或已被使用: " + code);
    }
}
